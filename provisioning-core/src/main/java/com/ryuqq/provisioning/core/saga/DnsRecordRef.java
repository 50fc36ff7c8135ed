package com.ryuqq.provisioning.core.saga;

/**
 * ConfigureDNS 결과로 saga에 기록되는 DNS 레코드 참조.
 *
 * @param recordId provider record id
 * @param zoneId provider zone id
 * @param fqdn 하위 도메인 FQDN
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record DnsRecordRef(String recordId, String zoneId, String fqdn) {

    public DnsRecordRef {
        if (recordId == null || recordId.isBlank()) {
            throw new IllegalArgumentException("recordId cannot be null or blank");
        }
        if (zoneId == null || zoneId.isBlank()) {
            throw new IllegalArgumentException("zoneId cannot be null or blank");
        }
        if (fqdn == null || fqdn.isBlank()) {
            throw new IllegalArgumentException("fqdn cannot be null or blank");
        }
    }
}
