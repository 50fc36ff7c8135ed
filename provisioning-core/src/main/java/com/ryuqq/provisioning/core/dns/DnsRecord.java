package com.ryuqq.provisioning.core.dns;

/**
 * DNS provider에 존재하는 레코드.
 *
 * @param id provider record id
 * @param zoneId zone id
 * @param type 레코드 타입
 * @param name FQDN
 * @param content 레코드 값
 * @param ttl TTL (초)
 * @param proxied 프록시 여부
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record DnsRecord(
    String id,
    String zoneId,
    String type,
    String name,
    String content,
    int ttl,
    boolean proxied
) {

    public DnsRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (zoneId == null || zoneId.isBlank()) {
            throw new IllegalArgumentException("zoneId cannot be null or blank");
        }
    }
}
