package com.ryuqq.provisioning.application.saga;

import com.ryuqq.provisioning.application.activity.ActivityContext;
import com.ryuqq.provisioning.application.activity.SendInvitationEmailsActivity;
import com.ryuqq.provisioning.application.activity.compensation.Compensation;
import com.ryuqq.provisioning.application.activity.compensation.CompensationContext;
import com.ryuqq.provisioning.application.activity.compensation.CompensationResult;
import com.ryuqq.provisioning.core.exception.ConcurrencyConflictException;
import com.ryuqq.provisioning.core.exception.PermanentValidationException;
import com.ryuqq.provisioning.core.exception.TransientProviderException;
import com.ryuqq.provisioning.core.model.BootstrapRequest;
import com.ryuqq.provisioning.core.outcome.Fail;
import com.ryuqq.provisioning.core.outcome.Ok;
import com.ryuqq.provisioning.core.outcome.Retry;
import com.ryuqq.provisioning.core.saga.BootstrapSagaState;
import com.ryuqq.provisioning.core.saga.DnsRecordRef;
import com.ryuqq.provisioning.core.saga.IssuedInvitation;
import com.ryuqq.provisioning.core.statemachine.SagaStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * saga 상태의 대기 step을 실행하고 결과를 {@link com.ryuqq.provisioning.core.outcome.Outcome}으로 판정합니다.
 *
 * <p><strong>예외 → Outcome 매핑:</strong></p>
 * <ul>
 *   <li>PermanentValidationException → Fail</li>
 *   <li>TransientProviderException (QuorumNotReached 포함) → Retry (provider의 retry-after 유지)</li>
 *   <li>ConcurrencyConflictException → Retry</li>
 *   <li>그 외 RuntimeException → Retry (정책 소진 시 saga가 Fail로 처리)</li>
 * </ul>
 *
 * <p>단계 전이, 재시도 예약, 상태 저장은 하지 않습니다. 그것은 runner의 일입니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class BootstrapStepExecutor {

    private static final Logger log = LoggerFactory.getLogger(BootstrapStepExecutor.class);

    private final BootstrapActivities activities;

    public BootstrapStepExecutor(BootstrapActivities activities) {
        if (activities == null) {
            throw new IllegalArgumentException("activities cannot be null");
        }
        this.activities = activities;
    }

    /**
     * 대기 step 한 번 실행.
     *
     * @param state 현재 saga 상태 (정상 경로, 비종료)
     * @return 판정과 갱신된 상태
     * @throws IllegalStateException 실행할 step이 없는 단계인 경우
     */
    public StepResult execute(BootstrapSagaState state) {
        SagaStep step = state.currentStage().pendingStep();
        int attempt = state.attempt() + 1;
        ActivityContext context = ActivityContext.forStep(state.bootstrapId(), state.request().initiatedBy(), step, attempt);

        log.info("Executing {} (attempt {})", step.displayName(), attempt);
        try {
            BootstrapSagaState updated = switch (step) {
                case CREATE_ORGANIZATION -> createOrganization(state, context);
                case CONFIGURE_DNS -> configureDns(state, context);
                case VERIFY_DNS -> verifyDns(state, attempt, context);
                case GENERATE_INVITATIONS -> generateInvitations(state, context);
                case SEND_INVITATION_EMAILS -> sendInvitationEmails(state, context);
                case ACTIVATE_ORGANIZATION -> activateOrganization(state, context);
            };
            return new StepResult(Ok.of(step), updated);

        } catch (PermanentValidationException e) {
            log.warn("{} failed permanently: {}", step.displayName(), e.getMessage());
            return new StepResult(Fail.from(step, e), state);

        } catch (TransientProviderException e) {
            log.info("{} will be retried: {}", step.displayName(), e.getMessage());
            return new StepResult(new Retry(step, describe(e), attempt, e.getRetryAfterMillis()), state);

        } catch (ConcurrencyConflictException e) {
            log.info("{} will be retried: {}", step.displayName(), e.getMessage());
            return new StepResult(new Retry(step, describe(e), attempt, 0L), state);

        } catch (RuntimeException e) {
            log.warn("{} raised an unexpected error (attempt {})", step.displayName(), attempt, e);
            return new StepResult(new Retry(step, describe(e), attempt, 0L), state);
        }
    }

    /**
     * 재시도 예산 소진 시 호출. VerifyDNS는 검증 실패 이벤트를 남깁니다.
     *
     * @param state saga 상태
     * @param step 소진된 step
     * @param reason 마지막 실패 사유
     */
    public void onRetriesExhausted(BootstrapSagaState state, SagaStep step, String reason) {
        if (step != SagaStep.VERIFY_DNS || state.dnsRecord() == null) {
            return;
        }
        int attempts = state.attempt() + 1;
        try {
            activities.verifyDns().recordFailure(state.orgId(), state.dnsRecord().fqdn(), reason, attempts,
                ActivityContext.forStep(state.bootstrapId(), state.request().initiatedBy(), step, attempts));
        } catch (RuntimeException e) {
            log.warn("Failed to record DNS verification failure for {}", state.dnsRecord().fqdn(), e);
        }
    }

    /**
     * 완료 단계의 보상을 역순으로 실행. 보상 하나의 실패는 나머지를 막지 않습니다.
     *
     * @param state FAILED 상태의 saga
     * @param cancelled 취소에 의한 보상인지 여부
     * @return 보상별 결과 (실행 순서)
     */
    public List<CompensationResult> compensate(BootstrapSagaState state, boolean cancelled) {
        String reason = cancelled ? state.cancelReason()
            : state.failure() != null ? state.failure().message() : null;
        CompensationContext context = new CompensationContext(state.bootstrapId(), state.orgId(),
            state.request().initiatedBy(), state.dnsRecord(), state.invitations(), reason, cancelled);

        List<Compensation> plan = activities.compensationPlan().planFor(state.completedStages());
        log.info("Running {} compensation(s) for completed stages {}", plan.size(), state.completedStages());

        List<CompensationResult> results = new ArrayList<>(plan.size());
        for (Compensation compensation : plan) {
            CompensationResult result;
            try {
                result = compensation.compensate(context);
            } catch (RuntimeException e) {
                log.error("Compensation {} threw unexpectedly", compensation.name(), e);
                result = CompensationResult.failed(compensation.name(), compensation.name() + " failed: " + describe(e));
            }
            if (result.hasWarnings()) {
                log.warn("Compensation {} completed with warnings: {}", compensation.name(), result.warnings());
            } else {
                log.info("Compensation {} completed: {}", compensation.name(), result.actions());
            }
            results.add(result);
        }
        return results;
    }

    private BootstrapSagaState createOrganization(BootstrapSagaState state, ActivityContext context) {
        activities.createOrganization().execute(state.orgId(), state.request(), context);
        return state;
    }

    private BootstrapSagaState configureDns(BootstrapSagaState state, ActivityContext context) {
        BootstrapRequest request = state.request();
        if (!request.hasSubdomain()) {
            log.info("No subdomain requested, skipping DNS configuration");
            return state;
        }
        DnsRecordRef record = activities.configureDns().execute(state.orgId(), request.subdomain(), context);
        return state.toBuilder().dnsRecord(record).build();
    }

    private BootstrapSagaState verifyDns(BootstrapSagaState state, int attempt, ActivityContext context) {
        if (state.dnsRecord() == null) {
            log.info("No DNS record configured, skipping DNS verification");
            return state;
        }
        activities.verifyDns().execute(state.orgId(), state.dnsRecord().fqdn(), attempt, context);
        return state;
    }

    private BootstrapSagaState generateInvitations(BootstrapSagaState state, ActivityContext context) {
        List<IssuedInvitation> invitations =
            activities.generateInvitations().execute(state.orgId(), state.request().users(), context);
        return state.toBuilder().invitations(invitations).build();
    }

    private BootstrapSagaState sendInvitationEmails(BootstrapSagaState state, ActivityContext context) {
        SendInvitationEmailsActivity.Result result = activities.sendInvitationEmails().execute(
            state.orgId(), state.request().organization().name(), state.invitations(), context);

        List<String> warnings = new ArrayList<>(state.warnings());
        for (SendInvitationEmailsActivity.Failure failure : result.failures()) {
            warnings.add("Failed to send invitation email to " + failure.email() + ": " + failure.reason());
        }
        return state.toBuilder()
            .invitationsSent(result.sentCount())
            .warnings(warnings)
            .build();
    }

    private BootstrapSagaState activateOrganization(BootstrapSagaState state, ActivityContext context) {
        activities.activateOrganization().execute(state.orgId(), context);
        return state;
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getClass().getSimpleName() + ": " + e.getMessage() : e.getClass().getSimpleName();
    }
}
