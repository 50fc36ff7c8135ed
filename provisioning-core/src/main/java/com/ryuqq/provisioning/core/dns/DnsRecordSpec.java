package com.ryuqq.provisioning.core.dns;

/**
 * 생성할 DNS 레코드 명세.
 *
 * @param type 레코드 타입 (예: "CNAME")
 * @param name FQDN
 * @param content 레코드 값 (CNAME 대상 등)
 * @param ttl TTL (초, 1 이상)
 * @param proxied provider 프록시 사용 여부
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record DnsRecordSpec(String type, String name, String content, int ttl, boolean proxied) {

    public DnsRecordSpec {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content cannot be null or blank");
        }
        if (ttl < 1) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
    }

    public static DnsRecordSpec cname(String name, String target, int ttl) {
        return new DnsRecordSpec("CNAME", name, target, ttl, false);
    }
}
