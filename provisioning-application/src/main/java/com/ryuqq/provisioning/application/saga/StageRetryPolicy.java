package com.ryuqq.provisioning.application.saga;

import java.time.Duration;
import java.time.Instant;

/**
 * saga step 하나의 재시도 정책.
 *
 * <p><strong>종류:</strong></p>
 * <ul>
 *   <li>FIXED_ATTEMPTS: 최대 시도 횟수까지 재시도</li>
 *   <li>DURATION_BUDGET: step 첫 시도로부터 시간 예산 내에서 계속 재시도 (DNS 전파 대기)</li>
 *   <li>NO_RETRY: 재시도 없음</li>
 * </ul>
 *
 * <p>재시도 간격은 exponential backoff: {@code min(baseDelayMs * 2^(attempt-1), maxDelayMs)}에 jitter.</p>
 *
 * @param kind 정책 종류
 * @param maxAttempts 최대 시도 횟수 (FIXED_ATTEMPTS)
 * @param budget 시간 예산 (DURATION_BUDGET)
 * @param baseDelayMs backoff 기본 지연
 * @param maxDelayMs backoff 최대 지연
 * @author Provisioning Team
 * @since 1.0.0
 */
public record StageRetryPolicy(
    Kind kind,
    int maxAttempts,
    Duration budget,
    long baseDelayMs,
    long maxDelayMs
) {

    public enum Kind {
        FIXED_ATTEMPTS,
        DURATION_BUDGET,
        NO_RETRY
    }

    public StageRetryPolicy {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind == Kind.FIXED_ATTEMPTS && maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (kind == Kind.DURATION_BUDGET && (budget == null || budget.isNegative() || budget.isZero())) {
            throw new IllegalArgumentException("budget must be positive (current: " + budget + ")");
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be non-negative (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs (current: " + maxDelayMs + ")");
        }
    }

    public static StageRetryPolicy fixedAttempts(int maxAttempts, long baseDelayMs, long maxDelayMs) {
        return new StageRetryPolicy(Kind.FIXED_ATTEMPTS, maxAttempts, null, baseDelayMs, maxDelayMs);
    }

    public static StageRetryPolicy durationBudget(Duration budget, long baseDelayMs, long maxDelayMs) {
        return new StageRetryPolicy(Kind.DURATION_BUDGET, 0, budget, baseDelayMs, maxDelayMs);
    }

    public static StageRetryPolicy noRetry() {
        return new StageRetryPolicy(Kind.NO_RETRY, 1, null, 0L, 0L);
    }

    /**
     * 방금 실패한 시도 이후 재시도 가능 여부.
     *
     * @param attemptsMade 지금까지 시도 횟수 (방금 실패 포함)
     * @param stageStartedAt step 첫 시도 시각
     * @param now 현재 시각
     * @return 재시도 가능하면 true
     */
    public boolean allowsRetry(int attemptsMade, Instant stageStartedAt, Instant now) {
        return switch (kind) {
            case FIXED_ATTEMPTS -> attemptsMade < maxAttempts;
            case DURATION_BUDGET -> Duration.between(stageStartedAt, now).compareTo(budget) < 0;
            case NO_RETRY -> false;
        };
    }

    public StageRetryPolicy withMaxAttempts(int maxAttempts) {
        return new StageRetryPolicy(kind, maxAttempts, budget, baseDelayMs, maxDelayMs);
    }

    public StageRetryPolicy withBudget(Duration budget) {
        return new StageRetryPolicy(kind, maxAttempts, budget, baseDelayMs, maxDelayMs);
    }

    public StageRetryPolicy withDelays(long baseDelayMs, long maxDelayMs) {
        return new StageRetryPolicy(kind, maxAttempts, budget, baseDelayMs, maxDelayMs);
    }
}
