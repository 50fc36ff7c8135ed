package com.ryuqq.provisioning.adapter.runner;

import com.ryuqq.provisioning.application.activity.ActivityContext;
import com.ryuqq.provisioning.application.activity.compensation.CompensationResult;
import com.ryuqq.provisioning.application.event.EventAppender;
import com.ryuqq.provisioning.application.orchestrator.BootstrapOrchestrator;
import com.ryuqq.provisioning.application.orchestrator.BootstrapStatus;
import com.ryuqq.provisioning.application.runtime.Runtime;
import com.ryuqq.provisioning.application.saga.BootstrapStepExecutor;
import com.ryuqq.provisioning.application.saga.StageRetryPolicies;
import com.ryuqq.provisioning.application.saga.StageRetryPolicy;
import com.ryuqq.provisioning.application.saga.StepResult;
import com.ryuqq.provisioning.core.event.BootstrapEventType;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.exception.ConcurrencyConflictException;
import com.ryuqq.provisioning.core.exception.SagaNotFoundException;
import com.ryuqq.provisioning.core.model.BootstrapId;
import com.ryuqq.provisioning.core.model.BootstrapRequest;
import com.ryuqq.provisioning.core.outcome.Fail;
import com.ryuqq.provisioning.core.outcome.Outcome;
import com.ryuqq.provisioning.core.outcome.Retry;
import com.ryuqq.provisioning.core.saga.BootstrapSagaState;
import com.ryuqq.provisioning.core.saga.SagaFailure;
import com.ryuqq.provisioning.core.spi.EventStore;
import com.ryuqq.provisioning.core.spi.SagaStateStore;
import com.ryuqq.provisioning.core.statemachine.BootstrapStage;
import com.ryuqq.provisioning.core.statemachine.SagaStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 영속 saga 상태 기반의 Bootstrap runner.
 *
 * <p>saga 진행 상황은 모두 {@link SagaStateStore}에 있고, runner 인스턴스는 메모리에 진행 상태를 들고 있지 않습니다.
 * 프로세스가 재시작되거나 여러 인스턴스가 같은 저장소를 공유해도 lease 만료 후 어느 인스턴스든 saga를 이어서 진행합니다.</p>
 *
 * <p><strong>pump() 처리 흐름:</strong></p>
 * <pre>
 * claimDue(now, lease, batchSize) → [saga1, saga2, ...]
 *   ↓
 * For each saga (worker pool):
 *   - FAILED            → 보상 실행 → COMPENSATED / CANCELLED
 *   - cancel_requested  → FAILED 저장 → 보상 실행 → CANCELLED
 *   - 그 외             → 대기 step 실행 → Outcome 처리
 *       Ok    → 다음 단계 저장 (ACTIVATED면 bootstrap.completed append)
 *       Retry → next_attempt_at = now + max(provider 대기 시간, backoff) 저장, 예산 소진 시 Fail과 동일
 *       Fail  → FAILED 저장 → bootstrap.failed append → 보상 실행 → COMPENSATED
 * </pre>
 *
 * <p>DNS 전파 대기 같은 긴 대기는 next_attempt_at으로 저장될 뿐 worker 스레드를 잡고 있지 않습니다.</p>
 *
 * <p>시간 예산은 step의 첫 시도를 시작한 시각부터 계산합니다. ConfigureDNS와 VerifyDNS는 하나의 DNS 예산을 나눠 쓰므로
 * ConfigureDNS가 끝나도 시작 시각을 VerifyDNS로 넘깁니다.</p>
 *
 * <p><strong>크래시 복구:</strong> 단계 실행 중 크래시가 나면 lease가 만료된 뒤 다른 pump가 같은 단계를 다시 실행합니다.
 * activity가 멱등이므로 중복 이벤트는 생기지 않습니다. 보상 도중의 크래시도 FAILED 상태에서 보상을 다시 실행하는 것으로 복구됩니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class BootstrapSagaRunner implements BootstrapOrchestrator, Runtime {

    private static final Logger log = LoggerFactory.getLogger(BootstrapSagaRunner.class);

    private static final String SOURCE = "BootstrapOrchestrator";
    private static final int MAX_CANCEL_ATTEMPTS = 3;

    private final SagaStateStore sagaStore;
    private final EventStore eventStore;
    private final EventAppender appender;
    private final BootstrapStepExecutor executor;
    private final StageRetryPolicies policies;
    private final SagaRunnerConfig config;
    private final BackoffCalculator backoffCalculator;
    private final Clock clock;
    private final ExecutorService workerPool;

    /**
     * 생성자 (설정의 jitter로 BackoffCalculator 생성).
     *
     * @param sagaStore saga 상태 저장소
     * @param eventStore 이벤트 로그 (bootstrap 스트림 중복 확인용)
     * @param appender 이벤트 발행 경로
     * @param executor step 실행기
     * @param policies step별 재시도 정책
     * @param config runner 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BootstrapSagaRunner(SagaStateStore sagaStore, EventStore eventStore, EventAppender appender,
                               BootstrapStepExecutor executor, StageRetryPolicies policies,
                               SagaRunnerConfig config, Clock clock) {
        this(sagaStore, eventStore, appender, executor, policies, config, clock,
            new BackoffCalculator(config == null ? 0.0 : config.jitterFactor()));
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @param sagaStore saga 상태 저장소
     * @param eventStore 이벤트 로그
     * @param appender 이벤트 발행 경로
     * @param executor step 실행기
     * @param policies step별 재시도 정책
     * @param config runner 설정
     * @param clock 시계
     * @param backoffCalculator 백오프 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BootstrapSagaRunner(SagaStateStore sagaStore, EventStore eventStore, EventAppender appender,
                               BootstrapStepExecutor executor, StageRetryPolicies policies,
                               SagaRunnerConfig config, Clock clock, BackoffCalculator backoffCalculator) {
        if (sagaStore == null) {
            throw new IllegalArgumentException("sagaStore cannot be null");
        }
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        if (appender == null) {
            throw new IllegalArgumentException("appender cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (policies == null) {
            throw new IllegalArgumentException("policies cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.sagaStore = sagaStore;
        this.eventStore = eventStore;
        this.appender = appender;
        this.executor = executor;
        this.policies = policies;
        this.config = config;
        this.clock = clock;
        this.backoffCalculator = backoffCalculator;
        this.workerPool = Executors.newFixedThreadPool(config.concurrency());
    }

    @Override
    public BootstrapId start(BootstrapRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        Instant now = clock.instant();
        BootstrapId bootstrapId = BootstrapId.newId();
        UUID orgId = UUID.randomUUID();

        // 1. saga 상태 저장 (즉시 실행 가능)
        sagaStore.create(BootstrapSagaState.start(bootstrapId, orgId, request, now));

        // 2. 감사 이벤트
        EventData data = EventData.builder()
            .put("org_id", orgId)
            .put("organization_name", request.organization().name())
            .put("subdomain", request.subdomain())
            .put("user_count", request.users().size())
            .build();
        appender.append(bootstrapId.getValue(), BootstrapEventType.INITIATED, data,
            new ActivityContext(bootstrapId, request.initiatedBy(), SOURCE, 1).metadata("Bootstrap initiated"));

        log.info("Bootstrap {} started for organization '{}' (org {})",
            bootstrapId, request.organization().name(), orgId);
        return bootstrapId;
    }

    @Override
    public BootstrapStatus getStatus(BootstrapId bootstrapId) {
        return sagaStore.find(bootstrapId)
            .map(BootstrapStatus::from)
            .orElseThrow(() -> new SagaNotFoundException(bootstrapId));
    }

    @Override
    public boolean cancel(BootstrapId bootstrapId, String reason) {
        String cancelReason = reason == null || reason.isBlank() ? "Cancelled by request" : reason;
        for (int i = 0; i < MAX_CANCEL_ATTEMPTS; i++) {
            BootstrapSagaState state = sagaStore.find(bootstrapId)
                .orElseThrow(() -> new SagaNotFoundException(bootstrapId));
            if (state.isTerminal() || state.currentStage() == BootstrapStage.FAILED) {
                return false;
            }
            if (state.cancelRequested()) {
                return true;
            }
            try {
                sagaStore.update(state.requestCancel(cancelReason, clock.instant()));
                log.info("Cancellation requested for bootstrap {}: {}", bootstrapId, cancelReason);
                return true;
            } catch (ConcurrencyConflictException e) {
                log.debug("Concurrent update while cancelling bootstrap {}, retrying", bootstrapId);
            }
        }
        throw new ConcurrencyConflictException(
            "Could not record cancellation for bootstrap " + bootstrapId + " after " + MAX_CANCEL_ATTEMPTS + " attempts");
    }

    @Override
    public void pump() {
        // 1. 실행할 saga claim
        Instant now = clock.instant();
        List<BootstrapSagaState> claimed =
            sagaStore.claimDue(now, Duration.ofMillis(config.leaseMs()), config.batchSize());
        if (claimed.isEmpty()) {
            return;
        }

        // 2. worker pool에서 한 단계씩 진행하고 배치 완료까지 대기
        List<Callable<Void>> tasks = new ArrayList<>(claimed.size());
        for (BootstrapSagaState state : claimed) {
            tasks.add(() -> {
                advanceSafely(state);
                return null;
            });
        }
        try {
            workerPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while advancing {} claimed saga(s); leases will expire", claimed.size());
        }
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerPool.shutdown();
        if (!workerPool.awaitTermination(60, TimeUnit.SECONDS)) {
            workerPool.shutdownNow();
        }
    }

    /**
     * saga 하나 진행. 예외가 나면 lease를 남겨 두고, 만료 후 다시 claim되게 합니다.
     */
    private void advanceSafely(BootstrapSagaState state) {
        MDC.put("bootstrapId", state.bootstrapId().toString());
        MDC.put("correlationId", state.bootstrapId().toString());
        try {
            advance(state);
        } catch (RuntimeException e) {
            log.error("Failed to advance bootstrap {} at stage {}; will resume after lease expiry",
                state.bootstrapId(), state.currentStage(), e);
        } finally {
            MDC.remove("bootstrapId");
            MDC.remove("correlationId");
        }
    }

    private void advance(BootstrapSagaState state) {
        if (state.currentStage() == BootstrapStage.FAILED) {
            compensate(state);
            return;
        }
        if (state.cancelRequested()) {
            SagaStep step = state.currentStage().pendingStep();
            SagaFailure failure = new SagaFailure(step.displayName(),
                "Bootstrap cancelled: " + state.cancelReason(), !state.completedStages().isEmpty());
            compensate(persist(state.fail(failure, clock.instant())));
            return;
        }
        runStep(state);
    }

    private void runStep(BootstrapSagaState state) {
        SagaStep step = state.currentStage().pendingStep();
        Instant budgetStart = state.stageStartedAt() != null ? state.stageStartedAt() : clock.instant();
        StepResult result = executor.execute(state);
        Outcome outcome = result.outcome();
        Instant now = clock.instant();

        if (outcome instanceof Retry retry) {
            handleRetry(result.state(), step, retry, budgetStart, now);
        } else if (outcome instanceof Fail fail) {
            failAndCompensate(result.state(), step, fail.message(), now);
        } else {
            BootstrapSagaState next = result.state().advanceTo(step.completesStage(), now);
            if (policies.carriesBudgetForward(step)) {
                next = next.toBuilder().stageStartedAt(budgetStart).build();
            }
            if (next.currentStage() == BootstrapStage.ACTIVATED) {
                appendOnce(next, BootstrapEventType.COMPLETED, EventData.builder()
                    .put("org_id", next.orgId())
                    .put("domain", next.dnsRecord() != null ? next.dnsRecord().fqdn() : null)
                    .put("invitations_sent", next.invitationsSent())
                    .build(), "Bootstrap completed");
            }
            persist(next);
            log.info("Bootstrap {} advanced to {}", state.bootstrapId(), next.currentStage());
        }
    }

    private void handleRetry(BootstrapSagaState state, SagaStep step, Retry retry, Instant stageStartedAt,
                             Instant now) {
        StageRetryPolicy policy = policies.forStep(step);

        if (!policy.allowsRetry(retry.attemptCount(), stageStartedAt, now)) {
            executor.onRetriesExhausted(state, step, retry.reason());
            failAndCompensate(state, step, retry.reason() + " (retries exhausted after "
                + retry.attemptCount() + " attempt(s))", now);
            return;
        }

        long delayMs = Math.max(retry.nextRetryAfterMillis(), backoffCalculator.calculate(policy, retry.attemptCount()));
        persist(state.scheduleRetry(retry.attemptCount(), stageStartedAt, now.plusMillis(delayMs), now));
        log.info("{} will be retried in {}ms (attempt {}): {}",
            step.displayName(), delayMs, retry.attemptCount(), retry.reason());
    }

    private void failAndCompensate(BootstrapSagaState state, SagaStep step, String message, Instant now) {
        SagaFailure failure = new SagaFailure(step.displayName(), message, !state.completedStages().isEmpty());
        log.warn("Bootstrap {} failed at {}: {}", state.bootstrapId(), step.displayName(), message);
        compensate(persist(state.fail(failure, now)));
    }

    /**
     * FAILED 상태의 saga 보상.
     *
     * <p>bootstrap.failed는 보상 전에 append되어, 보상 도중 크래시가 나도 의도가 감사 기록에 남습니다.</p>
     */
    private void compensate(BootstrapSagaState state) {
        boolean cancelled = state.cancelRequested();
        SagaFailure failure = state.failure();

        // 1. 실패 기록
        appendOnce(state, BootstrapEventType.FAILED, EventData.builder()
            .put("stage", failure.stage())
            .put("error", failure.message())
            .put("partial_cleanup_required", failure.cleanupRequired())
            .build(), "Bootstrap failed");

        // 2. 완료 단계 역순 보상
        List<String> warnings = new ArrayList<>();
        for (CompensationResult result : executor.compensate(state, cancelled)) {
            warnings.addAll(result.warnings());
        }

        // 3. 취소 기록
        if (cancelled) {
            appendOnce(state, BootstrapEventType.CANCELLED, EventData.builder()
                .put("reason", state.cancelReason())
                .put("cancelled_at", clock.instant())
                .build(), "Bootstrap cancelled");
        }

        // 4. 종료 상태 저장
        BootstrapStage terminal = cancelled ? BootstrapStage.CANCELLED : BootstrapStage.COMPENSATED;
        persist(state.finishCompensation(terminal, warnings, clock.instant()));
        log.info("Bootstrap {} finished as {} with {} compensation warning(s)",
            state.bootstrapId(), terminal, warnings.size());
    }

    /**
     * bootstrap 스트림에 같은 타입의 이벤트가 없을 때만 append (단계 재실행 시 중복 방지).
     */
    private void appendOnce(BootstrapSagaState state, BootstrapEventType type, EventData data, String reason) {
        UUID streamId = state.bootstrapId().getValue();
        boolean exists = eventStore.readStream(streamId, type.streamType()).stream()
            .anyMatch(event -> event.is(type));
        if (exists) {
            log.debug("{} already recorded for bootstrap {}", type.wireName(), state.bootstrapId());
            return;
        }
        appender.append(streamId, type, data,
            new ActivityContext(state.bootstrapId(), state.request().initiatedBy(), SOURCE, 1).metadata(reason));
    }

    /**
     * 상태 저장. 진행 중 들어온 취소 요청과 충돌하면 취소 요청을 합쳐 한 번 더 저장합니다.
     *
     * @throws ConcurrencyConflictException 취소 외의 이유로 충돌한 경우 (lease를 잃음)
     */
    private BootstrapSagaState persist(BootstrapSagaState state) {
        try {
            return sagaStore.update(state);
        } catch (ConcurrencyConflictException e) {
            BootstrapSagaState latest = sagaStore.find(state.bootstrapId())
                .orElseThrow(() -> new SagaNotFoundException(state.bootstrapId()));
            if (!latest.cancelRequested() || state.cancelRequested()) {
                throw e;
            }
            log.info("Merging concurrent cancellation into bootstrap {}", state.bootstrapId());
            BootstrapSagaState merged = state.toBuilder()
                .cancelRequested(true)
                .cancelReason(latest.cancelReason())
                .nextAttemptAt(state.isTerminal() ? state.nextAttemptAt() : latest.nextAttemptAt())
                .version(latest.version())
                .build();
            return sagaStore.update(merged);
        }
    }
}
