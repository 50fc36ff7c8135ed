package com.ryuqq.provisioning.core.dns;

/**
 * DNS provider의 zone.
 *
 * @param id provider zone id
 * @param name zone 이름 (예: "firstovertheline.com")
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record DnsZone(String id, String name) {

    public DnsZone {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }
}
