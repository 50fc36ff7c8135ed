package com.ryuqq.provisioning.core.event;

import java.util.Optional;

/**
 * contact 스트림 이벤트.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum ContactEventType implements DomainEventType {

    CREATED("contact.created"),
    DELETED("contact.deleted");

    private final String wireName;

    ContactEventType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    @Override
    public StreamType streamType() {
        return StreamType.CONTACT;
    }

    public static Optional<ContactEventType> fromWireName(String wireName) {
        for (ContactEventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
