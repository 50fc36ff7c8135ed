package com.ryuqq.provisioning.core.projection;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * 초대 projection (invitation 스트림의 read model).
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record InvitationView(
    UUID invitationId,
    UUID orgId,
    String email,
    String firstName,
    String lastName,
    List<String> roles,
    String token,
    Instant expiresAt,
    InvitationStatus status,
    Instant emailSentAt,
    Instant acceptedAt,
    Instant revokedAt,
    String revokeReason,
    Instant createdAt,
    long version
) {

    public InvitationView {
        if (invitationId == null) {
            throw new IllegalArgumentException("invitationId cannot be null");
        }
        if (orgId == null) {
            throw new IllegalArgumentException("orgId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public boolean isPending() {
        return status == InvitationStatus.PENDING;
    }

    public InvitationView withEmailSent(Instant at, long version) {
        return new InvitationView(invitationId, orgId, email, firstName, lastName, roles, token, expiresAt,
            status, at, acceptedAt, revokedAt, revokeReason, createdAt, version);
    }

    public InvitationView withStatus(InvitationStatus next, Instant at, String reason, long version) {
        Instant accepted = next == InvitationStatus.ACCEPTED ? at : acceptedAt;
        Instant revoked = next == InvitationStatus.REVOKED ? at : revokedAt;
        String revokedWhy = next == InvitationStatus.REVOKED ? reason : revokeReason;
        return new InvitationView(invitationId, orgId, email, firstName, lastName, roles, token, expiresAt,
            next, emailSentAt, accepted, revoked, revokedWhy, createdAt, version);
    }
}
