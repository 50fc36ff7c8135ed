package com.ryuqq.provisioning.core.event;

import java.time.Instant;

/**
 * 이벤트의 projection 처리 상태.
 *
 * <p>processed_at / processing_error / retry_count 세 컬럼을 하나의 닫힌 타입으로 표현합니다.</p>
 * <ul>
 *   <li>{@link Pending}: 아직 처리되지 않음</li>
 *   <li>{@link Processed}: 처리 완료 (오류 없음)</li>
 *   <li>{@link Failed}: handler 실패, processed_at은 비어 있고 재시도 대상</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public sealed interface ProcessingState
    permits ProcessingState.Pending, ProcessingState.Processed, ProcessingState.Failed {

    Pending PENDING = new Pending();

    /**
     * 처리 완료 여부.
     *
     * @return Processed인 경우 true
     */
    default boolean isProcessed() {
        return this instanceof Processed;
    }

    /**
     * 누적 실패 횟수.
     *
     * @return retry_count (Failed가 아니면 0)
     */
    default int retryCount() {
        return 0;
    }

    record Pending() implements ProcessingState {
    }

    record Processed(Instant processedAt) implements ProcessingState {

        public Processed {
            if (processedAt == null) {
                throw new IllegalArgumentException("processedAt cannot be null");
            }
        }
    }

    record Failed(String error, int retryCount) implements ProcessingState {

        public Failed {
            if (error == null || error.isBlank()) {
                throw new IllegalArgumentException("error cannot be null or blank");
            }
            if (retryCount < 1) {
                throw new IllegalArgumentException("retryCount must be positive (current: " + retryCount + ")");
            }
        }
    }
}
