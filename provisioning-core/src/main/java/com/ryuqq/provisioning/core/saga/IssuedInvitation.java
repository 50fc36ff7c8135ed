package com.ryuqq.provisioning.core.saga;

import java.time.Instant;
import java.util.UUID;

/**
 * GenerateInvitations 결과로 saga에 기록되는 초대.
 *
 * @param invitationId 초대 id
 * @param email 수신자 이메일
 * @param token 초대 토큰 (1회용 비밀값)
 * @param expiresAt 만료 시각
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record IssuedInvitation(UUID invitationId, String email, String token, Instant expiresAt) {

    public IssuedInvitation {
        if (invitationId == null) {
            throw new IllegalArgumentException("invitationId cannot be null");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email cannot be null or blank");
        }
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token cannot be null or blank");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("expiresAt cannot be null");
        }
    }

    @Override
    public String toString() {
        return "IssuedInvitation{" + invitationId + ", " + email + ", expiresAt=" + expiresAt + '}';
    }
}
