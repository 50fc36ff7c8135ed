package com.ryuqq.provisioning.core.model;

import java.util.List;
import java.util.Locale;

/**
 * 초대 대상 사용자.
 *
 * <p>email은 소문자로 정규화됩니다. (org_id, email) 쌍이 초대의 멱등성 키이므로
 * 대소문자 차이로 중복 초대가 생기지 않아야 합니다.</p>
 *
 * @param email 이메일 (정규화됨)
 * @param firstName 이름
 * @param lastName 성
 * @param roles 부여할 역할 목록 (1개 이상)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record InvitationRecipient(
    String email,
    String firstName,
    String lastName,
    List<String> roles
) {

    public InvitationRecipient {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email cannot be null or blank");
        }
        if (!email.contains("@")) {
            throw new IllegalArgumentException("email must contain '@' (current: " + email + ")");
        }
        if (roles == null || roles.isEmpty()) {
            throw new IllegalArgumentException("roles cannot be null or empty");
        }
        email = email.trim().toLowerCase(Locale.ROOT);
        roles = List.copyOf(roles);
    }

    /**
     * 단일 역할 초대 대상 생성.
     *
     * @param email 이메일
     * @param role 역할
     * @return InvitationRecipient 인스턴스
     */
    public static InvitationRecipient of(String email, String role) {
        return new InvitationRecipient(email, null, null, List.of(role));
    }
}
