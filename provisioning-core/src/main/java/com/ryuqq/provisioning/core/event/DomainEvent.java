package com.ryuqq.provisioning.core.event;

import java.time.Instant;
import java.util.UUID;

/**
 * 불변 도메인 이벤트 (이벤트 로그의 한 행).
 *
 * <p>processingState를 제외한 모든 필드는 append 이후 변하지 않습니다.</p>
 *
 * @param id 이벤트 id
 * @param sequence 전역 append 순서 (엄격 증가)
 * @param streamId 스트림 id
 * @param streamType 스트림 유형
 * @param streamVersion 스트림 내 버전 (1부터, 빈틈 없음)
 * @param eventType 이벤트 타입 이름
 * @param data event_data
 * @param metadata event_metadata
 * @param createdAt append 시각
 * @param processingState projection 처리 상태
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record DomainEvent(
    UUID id,
    long sequence,
    UUID streamId,
    StreamType streamType,
    long streamVersion,
    String eventType,
    EventData data,
    EventMetadata metadata,
    Instant createdAt,
    ProcessingState processingState
) {

    public DomainEvent {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (streamId == null) {
            throw new IllegalArgumentException("streamId cannot be null");
        }
        if (streamType == null) {
            throw new IllegalArgumentException("streamType cannot be null");
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
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (processingState == null) {
            processingState = ProcessingState.PENDING;
        }
    }

    public DomainEvent withProcessingState(ProcessingState state) {
        return new DomainEvent(id, sequence, streamId, streamType, streamVersion, eventType,
            data, metadata, createdAt, state);
    }

    /**
     * 이벤트 타입 비교.
     *
     * @param type 비교할 이벤트 타입
     * @return 스트림 유형과 이름이 모두 같으면 true
     */
    public boolean is(DomainEventType type) {
        return streamType == type.streamType() && eventType.equals(type.wireName());
    }
}
