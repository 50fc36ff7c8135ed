package com.ryuqq.provisioning.core.event;

import java.util.Optional;

/**
 * bootstrap 스트림 이벤트 (saga 감사 기록).
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum BootstrapEventType implements DomainEventType {

    INITIATED("bootstrap.initiated"),
    COMPLETED("bootstrap.completed"),
    FAILED("bootstrap.failed"),
    CANCELLED("bootstrap.cancelled");

    private final String wireName;

    BootstrapEventType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    @Override
    public StreamType streamType() {
        return StreamType.BOOTSTRAP;
    }

    public static Optional<BootstrapEventType> fromWireName(String wireName) {
        for (BootstrapEventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
