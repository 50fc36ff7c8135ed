package com.ryuqq.provisioning.core.event;

import java.util.Optional;

/**
 * address 스트림 이벤트.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum AddressEventType implements DomainEventType {

    CREATED("address.created"),
    DELETED("address.deleted");

    private final String wireName;

    AddressEventType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    @Override
    public StreamType streamType() {
        return StreamType.ADDRESS;
    }

    public static Optional<AddressEventType> fromWireName(String wireName) {
        for (AddressEventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
