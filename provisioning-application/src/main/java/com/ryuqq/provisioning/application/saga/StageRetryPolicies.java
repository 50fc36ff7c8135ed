package com.ryuqq.provisioning.application.saga;

import com.ryuqq.provisioning.core.statemachine.SagaStep;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * step별 재시도 정책 모음.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>CreateOrganization, GenerateInvitations, ActivateOrganization: 3회 (1초 ~ 30초)</li>
 *   <li>ConfigureDNS, VerifyDNS: 두 단계 합쳐 30분 예산 (10초 ~ 5분)</li>
 *   <li>SendInvitationEmails: 재시도 없음 (수신자별 실패는 경고)</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class StageRetryPolicies {

    public static final Duration DEFAULT_DNS_BUDGET = Duration.ofMinutes(30);

    private final Map<SagaStep, StageRetryPolicy> policies;

    private StageRetryPolicies(Map<SagaStep, StageRetryPolicy> policies) {
        for (SagaStep step : SagaStep.values()) {
            if (!policies.containsKey(step)) {
                throw new IllegalArgumentException("Missing retry policy for step " + step);
            }
        }
        this.policies = new EnumMap<>(policies);
    }

    public static StageRetryPolicies defaults() {
        return withDnsBudget(DEFAULT_DNS_BUDGET);
    }

    /**
     * 기본 정책에 DNS 시간 예산만 바꾼 정책 모음.
     *
     * @param dnsBudget DNS 단계 시간 예산
     * @return 정책 모음
     */
    public static StageRetryPolicies withDnsBudget(Duration dnsBudget) {
        Map<SagaStep, StageRetryPolicy> policies = new EnumMap<>(SagaStep.class);
        StageRetryPolicy fixed = StageRetryPolicy.fixedAttempts(3, 1_000L, 30_000L);
        StageRetryPolicy dns = StageRetryPolicy.durationBudget(dnsBudget, 10_000L, 300_000L);
        policies.put(SagaStep.CREATE_ORGANIZATION, fixed);
        policies.put(SagaStep.CONFIGURE_DNS, dns);
        policies.put(SagaStep.VERIFY_DNS, dns);
        policies.put(SagaStep.GENERATE_INVITATIONS, fixed);
        policies.put(SagaStep.SEND_INVITATION_EMAILS, StageRetryPolicy.noRetry());
        policies.put(SagaStep.ACTIVATE_ORGANIZATION, fixed);
        return new StageRetryPolicies(policies);
    }

    public StageRetryPolicy forStep(SagaStep step) {
        return policies.get(step);
    }

    /**
     * 완료된 step의 예산 시작 시각을 다음 step이 이어받는지 여부.
     *
     * <p>ConfigureDNS와 VerifyDNS는 하나의 DNS 예산을 공유합니다. 레코드 생성에 쓴 시간만큼 전파 확인 시간이 줄어듭니다.</p>
     *
     * @param completed 방금 완료된 step
     * @return 다음 step이 같은 예산을 이어서 쓰면 true
     */
    public boolean carriesBudgetForward(SagaStep completed) {
        return completed == SagaStep.CONFIGURE_DNS;
    }

    public StageRetryPolicies with(SagaStep step, StageRetryPolicy policy) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        Map<SagaStep, StageRetryPolicy> copy = new EnumMap<>(policies);
        copy.put(step, policy);
        return new StageRetryPolicies(copy);
    }
}
