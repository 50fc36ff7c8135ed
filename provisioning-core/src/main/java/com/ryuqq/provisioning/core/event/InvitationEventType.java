package com.ryuqq.provisioning.core.event;

import java.util.Optional;

/**
 * invitation 스트림 이벤트. {@code user.invited}가 초대 projection의 생성 이벤트입니다.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum InvitationEventType implements DomainEventType {

    USER_INVITED("user.invited"),
    EMAIL_SENT("invitation.email.sent"),
    REVOKED("invitation.revoked"),
    ACCEPTED("invitation.accepted"),
    EXPIRED("invitation.expired");

    private final String wireName;

    InvitationEventType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    @Override
    public StreamType streamType() {
        return StreamType.INVITATION;
    }

    public static Optional<InvitationEventType> fromWireName(String wireName) {
        for (InvitationEventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
