package com.ryuqq.provisioning.adapter.runner;

/**
 * ProjectionCatchUpDispatcher 설정 (불변 record).
 *
 * @author Provisioning Team
 * @since 1.0.0
 * @param batchSize 한 번에 스캔할 미처리 이벤트 수 (1 이상, 기본 100)
 * @param maxRetries 이 횟수만큼 실패한 이벤트는 자동 재시도하지 않음 (1 이상, 기본 5)
 */
public record CatchUpConfig(int batchSize, int maxRetries) {

    public CatchUpConfig() {
        this(100, 5);
    }

    public CatchUpConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive (current: " + maxRetries + ")");
        }
    }

    public CatchUpConfig withBatchSize(int batchSize) {
        return new CatchUpConfig(batchSize, maxRetries);
    }

    public CatchUpConfig withMaxRetries(int maxRetries) {
        return new CatchUpConfig(batchSize, maxRetries);
    }
}
