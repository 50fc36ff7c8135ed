package com.ryuqq.provisioning.core.event;

import java.util.UUID;

/**
 * append 요청.
 *
 * <p>streamVersion은 호출자가 {@code currentVersion + 1}로 계산한 다음 버전입니다.</p>
 *
 * @param streamId 스트림 id
 * @param streamType 스트림 유형
 * @param streamVersion 다음 버전 (1 이상)
 * @param eventType 이벤트 타입 이름
 * @param data event_data
 * @param metadata event_metadata
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record NewEvent(
    UUID streamId,
    StreamType streamType,
    long streamVersion,
    String eventType,
    EventData data,
    EventMetadata metadata
) {

    public NewEvent {
        if (streamId == null) {
            throw new IllegalArgumentException("streamId cannot be null");
        }
        if (streamType == null) {
            throw new IllegalArgumentException("streamType cannot be null");
        }
        if (streamVersion < 1) {
            throw new IllegalArgumentException("streamVersion must be positive (current: " + streamVersion + ")");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType cannot be null or blank");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
    }

    /**
     * 타입 안전한 이벤트 타입으로 append 요청 생성.
     *
     * @param streamId 스트림 id
     * @param streamVersion 다음 버전
     * @param type 이벤트 타입 (스트림 유형 포함)
     * @param data event_data
     * @param metadata event_metadata
     * @return NewEvent 인스턴스
     */
    public static NewEvent of(UUID streamId, long streamVersion, DomainEventType type,
                              EventData data, EventMetadata metadata) {
        return new NewEvent(streamId, type.streamType(), streamVersion, type.wireName(), data, metadata);
    }
}
