package com.ryuqq.provisioning.core.dns;

/**
 * 레코드 조회 필터. null 필드는 조건에서 제외됩니다.
 *
 * @param name FQDN
 * @param type 레코드 타입
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record DnsRecordFilter(String name, String type) {

    public boolean matches(DnsRecord record) {
        return (name == null || name.equalsIgnoreCase(record.name()))
            && (type == null || type.equalsIgnoreCase(record.type()));
    }
}
