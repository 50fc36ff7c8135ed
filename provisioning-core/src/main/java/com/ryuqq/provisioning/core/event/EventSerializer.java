package com.ryuqq.provisioning.core.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.util.UUID;

/**
 * 이벤트 로그 행의 JSON 직렬화/역직렬화.
 *
 * <p>wire 형식은 snake_case입니다:</p>
 * <pre>
 * {
 *   "id": "...", "sequence": 12,
 *   "stream_id": "...", "stream_type": "organization", "stream_version": 3,
 *   "event_type": "organization.subdomain.verified",
 *   "event_data": { ... },
 *   "event_metadata": { "user_id": "...", "reason": "...", "correlation_id": "...", "causation_id": "...", "source": "..." },
 *   "created_at": "2026-01-01T00:00:00Z",
 *   "processed_at": null, "processing_error": null, "retry_count": 0
 * }
 * </pre>
 *
 * <p>시각은 {@link JavaTimeModule}로 ISO-8601 문자열로 기록합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private EventSerializer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * 이벤트를 JSON 문자열로 직렬화.
     *
     * @param event 도메인 이벤트
     * @return JSON 문자열
     * @throws EventSerializationException 직렬화 실패 시
     */
    public static String serialize(DomainEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        try {
            return MAPPER.writeValueAsString(toWire(event));
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event: " + event.id(), e);
        }
    }

    /**
     * JSON 문자열을 이벤트로 역직렬화.
     *
     * @param json JSON 문자열
     * @return 도메인 이벤트
     * @throws EventSerializationException JSON이 잘못되었거나 stream_type을 알 수 없는 경우
     */
    public static DomainEvent deserialize(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("json cannot be null or blank");
        }
        WireEvent wire;
        try {
            wire = MAPPER.readValue(json, WireEvent.class);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize event", e);
        }
        return fromWire(wire);
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static WireEvent toWire(DomainEvent event) {
        EventMetadata metadata = event.metadata();
        Instant processedAt = null;
        String processingError = null;
        ProcessingState state = event.processingState();
        if (state instanceof ProcessingState.Processed processed) {
            processedAt = processed.processedAt();
        } else if (state instanceof ProcessingState.Failed failed) {
            processingError = failed.error();
        }
        return new WireEvent(
            event.id(),
            event.sequence(),
            event.streamId(),
            event.streamType().wireName(),
            event.streamVersion(),
            event.eventType(),
            event.data().toObjectNode(),
            new WireMetadata(metadata.userId(), metadata.reason(), metadata.correlationId(),
                metadata.causationId(), metadata.source()),
            event.createdAt(),
            processedAt,
            processingError,
            state.retryCount()
        );
    }

    private static DomainEvent fromWire(WireEvent wire) {
        StreamType streamType = StreamType.fromWireName(wire.streamType())
            .orElseThrow(() -> new EventSerializationException(
                "Unknown stream_type: " + wire.streamType(), null));
        if (wire.metadata() == null) {
            throw new EventSerializationException("event_metadata is missing for event " + wire.id(), null);
        }

        ProcessingState state;
        if (wire.processedAt() != null) {
            state = new ProcessingState.Processed(wire.processedAt());
        } else if (wire.processingError() != null) {
            state = new ProcessingState.Failed(wire.processingError(), Math.max(1, wire.retryCount()));
        } else {
            state = ProcessingState.PENDING;
        }

        WireMetadata m = wire.metadata();
        return new DomainEvent(
            wire.id(),
            wire.sequence(),
            wire.streamId(),
            streamType,
            wire.streamVersion(),
            wire.eventType(),
            wire.eventData() == null ? EventData.empty() : EventData.of(wire.eventData()),
            new EventMetadata(m.userId(), m.reason(), m.correlationId(), m.causationId(), m.source()),
            wire.createdAt(),
            state
        );
    }

    record WireEvent(
        @JsonProperty("id") UUID id,
        @JsonProperty("sequence") long sequence,
        @JsonProperty("stream_id") UUID streamId,
        @JsonProperty("stream_type") String streamType,
        @JsonProperty("stream_version") long streamVersion,
        @JsonProperty("event_type") String eventType,
        @JsonProperty("event_data") ObjectNode eventData,
        @JsonProperty("event_metadata") WireMetadata metadata,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("processed_at") Instant processedAt,
        @JsonProperty("processing_error") String processingError,
        @JsonProperty("retry_count") int retryCount
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record WireMetadata(
        @JsonProperty("user_id") String userId,
        @JsonProperty("reason") String reason,
        @JsonProperty("correlation_id") String correlationId,
        @JsonProperty("causation_id") String causationId,
        @JsonProperty("source") String source
    ) {
    }

    /**
     * Exception thrown when event serialization/deserialization fails.
     */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
