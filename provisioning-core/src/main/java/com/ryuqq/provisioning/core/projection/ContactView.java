package com.ryuqq.provisioning.core.projection;

import java.time.Instant;
import java.util.UUID;

/**
 * 연락처 projection. 삭제는 soft delete (deletedAt 기록).
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record ContactView(
    UUID contactId,
    UUID orgId,
    String label,
    String firstName,
    String lastName,
    String email,
    String title,
    Instant createdAt,
    Instant deletedAt
) {

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public ContactView deleted(Instant at) {
        return new ContactView(contactId, orgId, label, firstName, lastName, email, title, createdAt, at);
    }
}
