package com.ryuqq.provisioning.core.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 이벤트 payload (event_data).
 *
 * <p>Jackson {@link ObjectNode}를 감싸는 불변 값 객체입니다. 생성 시와 조회 시 모두
 * deep copy를 수행하므로 append 이후 payload가 변경되지 않습니다.</p>
 *
 * <p><strong>필수 필드 조회:</strong> {@link #text(String)}, {@link #uuid(String)} 등은 필드가 없으면
 * {@link IllegalStateException}을 던집니다. handler에서 발생하면 router가 이벤트를
 * Failed로 기록합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class EventData {

    private static final EventData EMPTY = new EventData(JsonNodeFactory.instance.objectNode());

    private final ObjectNode node;

    private EventData(ObjectNode node) {
        this.node = node;
    }

    public static EventData empty() {
        return EMPTY;
    }

    /**
     * ObjectNode로부터 EventData 생성 (deep copy).
     *
     * @param node JSON 객체
     * @return EventData 인스턴스
     * @throws IllegalArgumentException node가 null인 경우
     */
    public static EventData of(ObjectNode node) {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        return new EventData(node.deepCopy());
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean has(String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull();
    }

    public String text(String field) {
        return optionalText(field)
            .orElseThrow(() -> missing(field));
    }

    public Optional<String> optionalText(String field) {
        return has(field) ? Optional.of(node.get(field).asText()) : Optional.empty();
    }

    public UUID uuid(String field) {
        return UUID.fromString(text(field));
    }

    public Optional<UUID> optionalUuid(String field) {
        return optionalText(field).map(UUID::fromString);
    }

    public int intValue(String field) {
        if (!has(field)) {
            throw missing(field);
        }
        return node.get(field).asInt();
    }

    public boolean bool(String field) {
        if (!has(field)) {
            throw missing(field);
        }
        return node.get(field).asBoolean();
    }

    public Instant instant(String field) {
        return Instant.parse(text(field));
    }

    public Optional<Instant> optionalInstant(String field) {
        return optionalText(field).map(Instant::parse);
    }

    /**
     * 문자열 배열 필드 조회.
     *
     * @param field 필드 이름
     * @return 문자열 목록 (필드가 없으면 빈 목록)
     */
    public List<String> textList(String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(value.size());
        value.forEach(item -> values.add(item.asText()));
        return Collections.unmodifiableList(values);
    }

    /**
     * JSON 객체 사본 조회.
     *
     * @return deep copy된 ObjectNode
     */
    public ObjectNode toObjectNode() {
        return node.deepCopy();
    }

    private static IllegalStateException missing(String field) {
        return new IllegalStateException("event_data is missing required field: " + field);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return node.equals(((EventData) o).node);
    }

    @Override
    public int hashCode() {
        return node.hashCode();
    }

    @Override
    public String toString() {
        return node.toString();
    }

    /**
     * EventData 빌더. null 값은 JSON null로 기록됩니다.
     */
    public static final class Builder {

        private final ObjectNode node = JsonNodeFactory.instance.objectNode();

        private Builder() {
        }

        public Builder put(String field, String value) {
            node.put(field, value);
            return this;
        }

        public Builder put(String field, UUID value) {
            node.put(field, value == null ? null : value.toString());
            return this;
        }

        public Builder put(String field, int value) {
            node.put(field, value);
            return this;
        }

        public Builder put(String field, long value) {
            node.put(field, value);
            return this;
        }

        public Builder put(String field, boolean value) {
            node.put(field, value);
            return this;
        }

        public Builder put(String field, Instant value) {
            node.put(field, value == null ? null : value.toString());
            return this;
        }

        public Builder putList(String field, List<String> values) {
            ArrayNode array = node.putArray(field);
            if (values != null) {
                values.forEach(array::add);
            }
            return this;
        }

        public EventData build() {
            return new EventData(node.deepCopy());
        }
    }
}
