package com.ryuqq.provisioning.core.projection;

import java.time.Instant;
import java.util.UUID;

/**
 * 조직 projection (organization 스트림의 read model).
 *
 * <p>version은 마지막으로 반영한 organization 스트림 이벤트의 stream_version입니다.
 * handler는 이 값 이하의 이벤트를 다시 받으면 무시합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record OrganizationView(
    UUID orgId,
    String name,
    String slug,
    String type,
    String path,
    UUID bootstrapId,
    String subdomain,
    SubdomainStatus subdomainStatus,
    String fqdn,
    String dnsRecordId,
    String dnsZoneId,
    String verificationMethod,
    int verificationAttempts,
    Instant verifiedAt,
    String verificationFailureReason,
    boolean active,
    Instant activatedAt,
    Instant deactivatedAt,
    String deactivationReason,
    Instant createdAt,
    long version
) {

    public OrganizationView {
        if (orgId == null) {
            throw new IllegalArgumentException("orgId cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (subdomainStatus == null) {
            throw new IllegalArgumentException("subdomainStatus cannot be null");
        }
    }

    /**
     * organization.created 반영.
     */
    public static OrganizationView created(UUID orgId, String name, String slug, String type, String path,
                                           UUID bootstrapId, String subdomain, Instant createdAt, long version) {
        SubdomainStatus status = subdomain == null ? SubdomainStatus.NOT_REQUESTED : SubdomainStatus.PENDING;
        return new OrganizationView(orgId, name, slug, type, path, bootstrapId, subdomain, status,
            null, null, null, null, 0, null, null, false, null, null, null, createdAt, version);
    }

    public OrganizationView withDnsCreated(String fqdn, String recordId, String zoneId, long version) {
        return new OrganizationView(orgId, name, slug, type, path, bootstrapId, subdomain,
            SubdomainStatus.VERIFYING, fqdn, recordId, zoneId, verificationMethod, verificationAttempts,
            verifiedAt, verificationFailureReason, active, activatedAt, deactivatedAt, deactivationReason,
            createdAt, version);
    }

    public OrganizationView withVerified(String method, int attempts, Instant at, long version) {
        return new OrganizationView(orgId, name, slug, type, path, bootstrapId, subdomain,
            SubdomainStatus.VERIFIED, fqdn, dnsRecordId, dnsZoneId, method, attempts,
            at, null, active, activatedAt, deactivatedAt, deactivationReason, createdAt, version);
    }

    public OrganizationView withVerificationFailed(String reason, int attempts, long version) {
        return new OrganizationView(orgId, name, slug, type, path, bootstrapId, subdomain,
            SubdomainStatus.FAILED, fqdn, dnsRecordId, dnsZoneId, verificationMethod, attempts,
            verifiedAt, reason, active, activatedAt, deactivatedAt, deactivationReason, createdAt, version);
    }

    public OrganizationView withDnsRemoved(long version) {
        return new OrganizationView(orgId, name, slug, type, path, bootstrapId, subdomain,
            SubdomainStatus.REMOVED, fqdn, null, dnsZoneId, verificationMethod, verificationAttempts,
            verifiedAt, verificationFailureReason, active, activatedAt, deactivatedAt, deactivationReason,
            createdAt, version);
    }

    public OrganizationView withActivated(Instant at, long version) {
        return new OrganizationView(orgId, name, slug, type, path, bootstrapId, subdomain,
            subdomainStatus, fqdn, dnsRecordId, dnsZoneId, verificationMethod, verificationAttempts,
            verifiedAt, verificationFailureReason, true, at, null, null, createdAt, version);
    }

    public OrganizationView withDeactivated(Instant at, String reason, long version) {
        return new OrganizationView(orgId, name, slug, type, path, bootstrapId, subdomain,
            subdomainStatus, fqdn, dnsRecordId, dnsZoneId, verificationMethod, verificationAttempts,
            verifiedAt, verificationFailureReason, false, activatedAt, at, reason, createdAt, version);
    }
}
