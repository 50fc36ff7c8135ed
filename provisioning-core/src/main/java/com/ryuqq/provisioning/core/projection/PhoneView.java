package com.ryuqq.provisioning.core.projection;

import java.time.Instant;
import java.util.UUID;

/**
 * 전화번호 projection. 삭제는 soft delete.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record PhoneView(
    UUID phoneId,
    UUID orgId,
    String label,
    String number,
    String type,
    Instant createdAt,
    Instant deletedAt
) {

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public PhoneView deleted(Instant at) {
        return new PhoneView(phoneId, orgId, label, number, type, createdAt, at);
    }
}
