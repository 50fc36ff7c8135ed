package com.ryuqq.provisioning.core.event;

import java.util.Optional;

/**
 * organization 스트림 이벤트.
 *
 * <p><strong>subdomain 상태 변화:</strong></p>
 * <ul>
 *   <li>{@link #CREATED}: 하위 도메인 요청 시 PENDING</li>
 *   <li>{@link #SUBDOMAIN_DNS_CREATED}: VERIFYING</li>
 *   <li>{@link #SUBDOMAIN_VERIFIED}: VERIFIED</li>
 *   <li>{@link #SUBDOMAIN_VERIFICATION_FAILED}: FAILED</li>
 *   <li>{@link #DNS_REMOVED}: REMOVED (보상)</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum OrganizationEventType implements DomainEventType {

    CREATED("organization.created"),
    SUBDOMAIN_DNS_CREATED("organization.subdomain.dns_created"),
    SUBDOMAIN_VERIFIED("organization.subdomain.verified"),
    SUBDOMAIN_VERIFICATION_FAILED("organization.subdomain.verification_failed"),
    DNS_REMOVED("organization.dns.removed"),
    ACTIVATED("organization.activated"),
    DEACTIVATED("organization.deactivated");

    private final String wireName;

    OrganizationEventType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    @Override
    public StreamType streamType() {
        return StreamType.ORGANIZATION;
    }

    public static Optional<OrganizationEventType> fromWireName(String wireName) {
        for (OrganizationEventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
