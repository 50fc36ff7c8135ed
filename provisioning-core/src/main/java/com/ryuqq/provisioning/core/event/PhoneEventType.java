package com.ryuqq.provisioning.core.event;

import java.util.Optional;

/**
 * phone 스트림 이벤트.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum PhoneEventType implements DomainEventType {

    CREATED("phone.created"),
    DELETED("phone.deleted");

    private final String wireName;

    PhoneEventType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    @Override
    public StreamType streamType() {
        return StreamType.PHONE;
    }

    public static Optional<PhoneEventType> fromWireName(String wireName) {
        for (PhoneEventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
