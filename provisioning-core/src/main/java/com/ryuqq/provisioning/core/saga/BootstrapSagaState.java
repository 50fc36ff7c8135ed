package com.ryuqq.provisioning.core.saga;

import com.ryuqq.provisioning.core.model.BootstrapId;
import com.ryuqq.provisioning.core.model.BootstrapRequest;
import com.ryuqq.provisioning.core.statemachine.BootstrapStage;
import com.ryuqq.provisioning.core.statemachine.StageTransition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Bootstrap saga의 영속 상태.
 *
 * <p>orchestrator만 이 상태를 변경하며, projection과 무관하게 saga 진행을 추적합니다.
 * 프로세스가 재시작되어도 이 레코드만으로 saga를 이어서 실행할 수 있어야 합니다.</p>
 *
 * <p><strong>실행 제어 필드:</strong></p>
 * <ul>
 *   <li>attempt: 현재 대기 중인 step의 누적 시도 횟수</li>
 *   <li>stageStartedAt: 시간 예산의 시작 시각 (현재 step의 첫 시도, VerifyDNS는 ConfigureDNS의 첫 시도)</li>
 *   <li>nextAttemptAt: 이 시각 이후에 runner가 claim할 수 있음 (backoff 대기)</li>
 *   <li>leaseUntil: claim한 runner의 lease 만료 시각 (크래시 시 만료 후 다른 runner가 재개)</li>
 *   <li>version: 낙관적 동시성 제어용 버전 (저장소가 저장 시 증가)</li>
 * </ul>
 *
 * <p><strong>Activity 결과 필드:</strong> dnsRecord, invitations, invitationsSent, warnings.
 * 보상과 최종 결과 계산에 사용됩니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record BootstrapSagaState(
    BootstrapId bootstrapId,
    UUID orgId,
    BootstrapRequest request,
    BootstrapStage currentStage,
    List<BootstrapStage> completedStages,
    SagaFailure failure,
    int attempt,
    Instant stageStartedAt,
    Instant nextAttemptAt,
    Instant leaseUntil,
    boolean cancelRequested,
    String cancelReason,
    DnsRecordRef dnsRecord,
    List<IssuedInvitation> invitations,
    int invitationsSent,
    List<String> warnings,
    Instant createdAt,
    Instant updatedAt,
    long version
) {

    public BootstrapSagaState {
        if (bootstrapId == null) {
            throw new IllegalArgumentException("bootstrapId cannot be null");
        }
        if (orgId == null) {
            throw new IllegalArgumentException("orgId cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (currentStage == null) {
            throw new IllegalArgumentException("currentStage cannot be null");
        }
        if (nextAttemptAt == null) {
            throw new IllegalArgumentException("nextAttemptAt cannot be null");
        }
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative (current: " + attempt + ")");
        }
        completedStages = completedStages == null ? List.of() : List.copyOf(completedStages);
        invitations = invitations == null ? List.of() : List.copyOf(invitations);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * 새 saga 상태 생성 (CREATED, 즉시 실행 가능).
     *
     * <p>orgId는 saga 시작 시 미리 배정되어 CreateOrganization의 멱등성 키가 됩니다.</p>
     *
     * @param bootstrapId saga id
     * @param orgId 미리 배정한 조직 id
     * @param request 시작 요청
     * @param now 현재 시각
     * @return 새 상태 (version 0)
     */
    public static BootstrapSagaState start(BootstrapId bootstrapId, UUID orgId, BootstrapRequest request, Instant now) {
        return new BootstrapSagaState(bootstrapId, orgId, request, BootstrapStage.CREATED, List.of(), null,
            0, null, now, null, false, null, null, List.of(), 0, List.of(), now, now, 0L);
    }

    public boolean isTerminal() {
        return currentStage.isTerminal();
    }

    public boolean hasCompleted(BootstrapStage stage) {
        return completedStages.contains(stage);
    }

    /**
     * 다음 정상 경로 단계로 전이.
     *
     * <p>완료 단계 목록에 추가하고 재시도 관련 필드와 lease를 초기화합니다.</p>
     *
     * @param next 다음 단계
     * @param now 현재 시각
     * @return 전이된 상태
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public BootstrapSagaState advanceTo(BootstrapStage next, Instant now) {
        StageTransition.validate(currentStage, next);
        if (!next.isHappyPath()) {
            throw new IllegalStateException("advanceTo only supports happy-path stages: " + next);
        }
        List<BootstrapStage> completed = new ArrayList<>(completedStages);
        completed.add(next);
        return toBuilder()
            .currentStage(next)
            .completedStages(completed)
            .attempt(0)
            .stageStartedAt(null)
            .nextAttemptAt(now)
            .leaseUntil(null)
            .updatedAt(now)
            .build();
    }

    /**
     * 재시도 예약 (lease 해제).
     *
     * @param attempt 누적 시도 횟수
     * @param stageStartedAt 현재 step 첫 시도 시각
     * @param nextAttemptAt 다음 시도 가능 시각
     * @param now 현재 시각
     * @return 갱신된 상태
     */
    public BootstrapSagaState scheduleRetry(int attempt, Instant stageStartedAt, Instant nextAttemptAt, Instant now) {
        return toBuilder()
            .attempt(attempt)
            .stageStartedAt(stageStartedAt)
            .nextAttemptAt(nextAttemptAt)
            .leaseUntil(null)
            .updatedAt(now)
            .build();
    }

    /**
     * FAILED로 전이하고 실패를 기록.
     *
     * @param failure 실패 기록
     * @param now 현재 시각
     * @return FAILED 상태
     */
    public BootstrapSagaState fail(SagaFailure failure, Instant now) {
        StageTransition.validate(currentStage, BootstrapStage.FAILED);
        return toBuilder()
            .currentStage(BootstrapStage.FAILED)
            .failure(failure)
            .nextAttemptAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * 보상 완료 후 종료 상태로 전이 (lease 해제).
     *
     * @param terminal COMPENSATED 또는 CANCELLED
     * @param compensationWarnings 보상 경고
     * @param now 현재 시각
     * @return 종료 상태
     */
    public BootstrapSagaState finishCompensation(BootstrapStage terminal, List<String> compensationWarnings, Instant now) {
        StageTransition.validate(currentStage, terminal);
        List<String> merged = new ArrayList<>(warnings);
        merged.addAll(compensationWarnings);
        return toBuilder()
            .currentStage(terminal)
            .warnings(merged)
            .leaseUntil(null)
            .updatedAt(now)
            .build();
    }

    public BootstrapSagaState requestCancel(String reason, Instant now) {
        return toBuilder()
            .cancelRequested(true)
            .cancelReason(reason)
            .nextAttemptAt(now)
            .updatedAt(now)
            .build();
    }

    public BootstrapSagaState withLease(Instant leaseUntil) {
        return toBuilder().leaseUntil(leaseUntil).build();
    }

    public BootstrapSagaState withVersion(long version) {
        return toBuilder().version(version).build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * 상태 변경용 빌더.
     */
    public static final class Builder {

        private final BootstrapId bootstrapId;
        private final UUID orgId;
        private final BootstrapRequest request;
        private final Instant createdAt;
        private BootstrapStage currentStage;
        private List<BootstrapStage> completedStages;
        private SagaFailure failure;
        private int attempt;
        private Instant stageStartedAt;
        private Instant nextAttemptAt;
        private Instant leaseUntil;
        private boolean cancelRequested;
        private String cancelReason;
        private DnsRecordRef dnsRecord;
        private List<IssuedInvitation> invitations;
        private int invitationsSent;
        private List<String> warnings;
        private Instant updatedAt;
        private long version;

        private Builder(BootstrapSagaState state) {
            this.bootstrapId = state.bootstrapId;
            this.orgId = state.orgId;
            this.request = state.request;
            this.createdAt = state.createdAt;
            this.currentStage = state.currentStage;
            this.completedStages = state.completedStages;
            this.failure = state.failure;
            this.attempt = state.attempt;
            this.stageStartedAt = state.stageStartedAt;
            this.nextAttemptAt = state.nextAttemptAt;
            this.leaseUntil = state.leaseUntil;
            this.cancelRequested = state.cancelRequested;
            this.cancelReason = state.cancelReason;
            this.dnsRecord = state.dnsRecord;
            this.invitations = state.invitations;
            this.invitationsSent = state.invitationsSent;
            this.warnings = state.warnings;
            this.updatedAt = state.updatedAt;
            this.version = state.version;
        }

        public Builder currentStage(BootstrapStage currentStage) {
            this.currentStage = currentStage;
            return this;
        }

        public Builder completedStages(List<BootstrapStage> completedStages) {
            this.completedStages = completedStages;
            return this;
        }

        public Builder failure(SagaFailure failure) {
            this.failure = failure;
            return this;
        }

        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }

        public Builder stageStartedAt(Instant stageStartedAt) {
            this.stageStartedAt = stageStartedAt;
            return this;
        }

        public Builder nextAttemptAt(Instant nextAttemptAt) {
            this.nextAttemptAt = nextAttemptAt;
            return this;
        }

        public Builder leaseUntil(Instant leaseUntil) {
            this.leaseUntil = leaseUntil;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Builder cancelReason(String cancelReason) {
            this.cancelReason = cancelReason;
            return this;
        }

        public Builder dnsRecord(DnsRecordRef dnsRecord) {
            this.dnsRecord = dnsRecord;
            return this;
        }

        public Builder invitations(List<IssuedInvitation> invitations) {
            this.invitations = invitations;
            return this;
        }

        public Builder invitationsSent(int invitationsSent) {
            this.invitationsSent = invitationsSent;
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings = warnings;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public BootstrapSagaState build() {
            return new BootstrapSagaState(bootstrapId, orgId, request, currentStage, completedStages, failure,
                attempt, stageStartedAt, nextAttemptAt, leaseUntil, cancelRequested, cancelReason, dnsRecord,
                invitations, invitationsSent, warnings, createdAt, updatedAt, version);
        }
    }
}
