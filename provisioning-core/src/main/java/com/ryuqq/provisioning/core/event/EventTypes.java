package com.ryuqq.provisioning.core.event;

import java.util.Optional;

/**
 * (stream_type, event_type) 쌍을 닫힌 이벤트 카탈로그에 대해 해석합니다.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class EventTypes {

    private EventTypes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 스트림 유형이 소유한 이벤트 타입 조회.
     *
     * @param streamType 스트림 유형
     * @param eventType 이벤트 타입 이름
     * @return 카탈로그에 있으면 해당 타입, 없으면 empty
     */
    public static Optional<DomainEventType> resolve(StreamType streamType, String eventType) {
        if (streamType == null || eventType == null) {
            return Optional.empty();
        }
        Optional<? extends DomainEventType> resolved = switch (streamType) {
            case ORGANIZATION -> OrganizationEventType.fromWireName(eventType);
            case INVITATION -> InvitationEventType.fromWireName(eventType);
            case CONTACT -> ContactEventType.fromWireName(eventType);
            case ADDRESS -> AddressEventType.fromWireName(eventType);
            case PHONE -> PhoneEventType.fromWireName(eventType);
            case JUNCTION -> JunctionEventType.fromWireName(eventType);
            case BOOTSTRAP -> BootstrapEventType.fromWireName(eventType);
        };
        return resolved.map(DomainEventType.class::cast);
    }

    /**
     * 이벤트 타입이 스트림 유형의 카탈로그에 속하는지 확인.
     *
     * @param streamType 스트림 유형
     * @param eventType 이벤트 타입 이름
     * @return 속하면 true
     */
    public static boolean isClaimed(StreamType streamType, String eventType) {
        return resolve(streamType, eventType).isPresent();
    }
}
