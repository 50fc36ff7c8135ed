package com.ryuqq.provisioning.adapter.runner;

/**
 * BootstrapSagaRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchSize: pump 한 번에 claim할 saga 수 (기본 10)</li>
 *   <li>concurrency: saga를 진행하는 worker 스레드 수 (기본 4)</li>
 *   <li>leaseMs: claim한 saga의 lease 길이 (기본 60000ms). 한 단계 실행 시간보다 길어야 합니다.</li>
 *   <li>jitterFactor: 재시도 backoff jitter 비율 (기본 0.1)</li>
 * </ul>
 *
 * <p>lease가 만료되면 다른 runner가 같은 saga를 다시 claim합니다. 크래시 복구는 이 만료에 의존하므로
 * leaseMs를 너무 길게 잡으면 복구가 늦어지고, 너무 짧게 잡으면 느린 단계가 중복 실행됩니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 * @param batchSize 배치 크기 (1 이상)
 * @param concurrency worker 스레드 수 (1 이상)
 * @param leaseMs lease 길이 (밀리초, 양수)
 * @param jitterFactor jitter 비율 (0.0 ~ 1.0)
 */
public record SagaRunnerConfig(int batchSize, int concurrency, long leaseMs, double jitterFactor) {

    /**
     * 기본값: batchSize=10, concurrency=4, leaseMs=60000, jitterFactor=0.1
     */
    public SagaRunnerConfig() {
        this(10, 4, 60_000L, 0.1);
    }

    public SagaRunnerConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        if (leaseMs <= 0) {
            throw new IllegalArgumentException("leaseMs must be positive (current: " + leaseMs + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
    }

    public SagaRunnerConfig withBatchSize(int batchSize) {
        return new SagaRunnerConfig(batchSize, concurrency, leaseMs, jitterFactor);
    }

    public SagaRunnerConfig withConcurrency(int concurrency) {
        return new SagaRunnerConfig(batchSize, concurrency, leaseMs, jitterFactor);
    }

    public SagaRunnerConfig withLeaseMs(long leaseMs) {
        return new SagaRunnerConfig(batchSize, concurrency, leaseMs, jitterFactor);
    }

    public SagaRunnerConfig withJitterFactor(double jitterFactor) {
        return new SagaRunnerConfig(batchSize, concurrency, leaseMs, jitterFactor);
    }
}
