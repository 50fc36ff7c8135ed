package com.ryuqq.provisioning.core.event;

import java.util.Optional;

/**
 * junction 스트림 이벤트 (조직과 연락처 정보 사이의 연결).
 *
 * <p>이름 규칙 {@code *.linked} / {@code *.unlinked}를 따르며, router는 stream_type보다
 * 이 규칙을 먼저 확인하여 junction handler로 보냅니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum JunctionEventType implements DomainEventType {

    ORGANIZATION_CONTACT_LINKED("organization.contact.linked"),
    ORGANIZATION_CONTACT_UNLINKED("organization.contact.unlinked"),
    ORGANIZATION_ADDRESS_LINKED("organization.address.linked"),
    ORGANIZATION_ADDRESS_UNLINKED("organization.address.unlinked"),
    ORGANIZATION_PHONE_LINKED("organization.phone.linked"),
    ORGANIZATION_PHONE_UNLINKED("organization.phone.unlinked");

    private static final String LINKED_SUFFIX = ".linked";
    private static final String UNLINKED_SUFFIX = ".unlinked";

    private final String wireName;

    JunctionEventType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    @Override
    public StreamType streamType() {
        return StreamType.JUNCTION;
    }

    /**
     * 연결 해제 이벤트인지 확인.
     *
     * @return {@code *.unlinked}인 경우 true
     */
    public boolean isUnlink() {
        return wireName.endsWith(UNLINKED_SUFFIX);
    }

    /**
     * 이벤트 타입 이름이 junction 이름 규칙을 따르는지 확인.
     *
     * @param eventType 이벤트 타입 이름
     * @return {@code *.linked} 또는 {@code *.unlinked}인 경우 true
     */
    public static boolean matchesNamingConvention(String eventType) {
        return eventType != null
            && (eventType.endsWith(LINKED_SUFFIX) || eventType.endsWith(UNLINKED_SUFFIX));
    }

    public static Optional<JunctionEventType> fromWireName(String wireName) {
        for (JunctionEventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
