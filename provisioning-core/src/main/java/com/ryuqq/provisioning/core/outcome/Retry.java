package com.ryuqq.provisioning.core.outcome;

import com.ryuqq.provisioning.core.statemachine.SagaStep;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>DNS provider API 타임아웃</li>
 *   <li>DNS 전파 quorum 미달</li>
 *   <li>이벤트 append 동시성 충돌</li>
 * </ul>
 *
 * <p>다음 시도 시각은 runner가 단계별 backoff로 계산합니다. provider가 대기 시간을 알려 준 경우
 * (rate limit의 Retry-After 등) nextRetryAfterMillis에 담기며, runner는 backoff와 둘 중 긴 쪽을 씁니다.</p>
 *
 * @param step 실패한 step
 * @param reason 재시도 사유
 * @param attemptCount 현재까지 시도 횟수 (1 이상)
 * @param nextRetryAfterMillis provider가 요청한 최소 대기 시간 (밀리초, 없으면 0)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record Retry(
    SagaStep step,
    String reason,
    int attemptCount,
    long nextRetryAfterMillis
) implements Outcome {

    public Retry {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + attemptCount + ")");
        }
        if (nextRetryAfterMillis < 0) {
            throw new IllegalArgumentException("nextRetryAfterMillis must be non-negative (current: " + nextRetryAfterMillis + ")");
        }
    }
}
