package com.ryuqq.provisioning.core.projection;

import java.time.Instant;
import java.util.UUID;

/**
 * bootstrap 스트림의 감사용 projection.
 *
 * <p>saga 제어에는 사용하지 않습니다. saga 진행 상태의 원본은 saga 상태 저장소입니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record BootstrapView(
    UUID bootstrapId,
    UUID orgId,
    Status status,
    String failedStage,
    String error,
    boolean partialCleanupRequired,
    Instant initiatedAt,
    Instant finishedAt
) {

    public enum Status {
        INITIATED,
        COMPLETED,
        FAILED,
        CANCELLED
    }

    public BootstrapView {
        if (bootstrapId == null) {
            throw new IllegalArgumentException("bootstrapId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    public BootstrapView withStatus(Status next, Instant at) {
        return new BootstrapView(bootstrapId, orgId, next, failedStage, error, partialCleanupRequired,
            initiatedAt, at);
    }

    public BootstrapView withFailure(String stage, String failure, boolean cleanupRequired, Instant at) {
        return new BootstrapView(bootstrapId, orgId, Status.FAILED, stage, failure, cleanupRequired,
            initiatedAt, at);
    }
}
