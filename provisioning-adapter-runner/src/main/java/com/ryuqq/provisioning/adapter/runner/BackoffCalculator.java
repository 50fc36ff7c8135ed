package com.ryuqq.provisioning.adapter.runner;

import com.ryuqq.provisioning.application.saga.StageRetryPolicy;

import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>기본/최대 지연은 단계별 {@link StageRetryPolicy}에서 가져오고, jitter 비율만 runner가 정합니다.
 * 여러 saga가 같은 DNS 전파를 기다릴 때 재시도 시각이 한꺼번에 몰리지 않도록 jitter를 더합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attemptCount-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (DNS 단계: baseDelay=10s, maxDelay=5m):</strong></p>
 * <ul>
 *   <li>attemptCount=1: 10s + jitter</li>
 *   <li>attemptCount=2: 20s + jitter</li>
 *   <li>attemptCount=5: 160s + jitter</li>
 *   <li>attemptCount=6 이후: 300s (maxDelay)</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final int MAX_SHIFT = 30;

    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성 (jitterFactor=0.1).
     */
    public BackoffCalculator() {
        this(0.1);
    }

    public BackoffCalculator(double jitterFactor) {
        this(jitterFactor, Math::random);
    }

    /**
     * 난수 공급원을 주입해 생성 (테스트에서 jitter 고정용).
     *
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @param random [0, 1) 난수 공급원
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(double jitterFactor, DoubleSupplier random) {
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param policy 단계 재시도 정책
     * @param attemptCount 지금까지의 시도 횟수 (1부터 시작)
     * @return 다음 시도까지 대기 시간 (밀리초)
     * @throws IllegalArgumentException policy가 null이거나 attemptCount가 양수가 아닌 경우
     */
    public long calculate(StageRetryPolicy policy, int attemptCount) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }
        if (policy.baseDelayMs() == 0) {
            return 0L;
        }

        // 1. 지수적 백오프 (shift 상한으로 overflow 방지)
        int shift = Math.min(attemptCount - 1, MAX_SHIFT);
        long exponential = Math.min(policy.baseDelayMs() * (1L << shift), policy.maxDelayMs());

        // 2. Jitter 추가
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());

        // 3. 최대값 제한
        return Math.min(exponential + jitter, policy.maxDelayMs());
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
