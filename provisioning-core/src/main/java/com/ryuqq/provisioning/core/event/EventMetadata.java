package com.ryuqq.provisioning.core.event;

/**
 * 이벤트 metadata (event_metadata).
 *
 * @param userId 행위자 user id
 * @param reason 이벤트 사유 (사람이 읽는 설명)
 * @param correlationId 상관 id (bootstrap saga id)
 * @param causationId 원인 id (선택, null 가능)
 * @param source 이벤트를 만든 activity 이름 (선택, null 가능)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record EventMetadata(
    String userId,
    String reason,
    String correlationId,
    String causationId,
    String source
) {

    public EventMetadata {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be null or blank");
        }
    }

    public EventMetadata withReason(String reason) {
        return new EventMetadata(userId, reason, correlationId, causationId, source);
    }
}
