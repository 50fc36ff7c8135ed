package com.ryuqq.provisioning.application.activity;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * 초대 토큰 생성기 (32바이트 난수, base64url, padding 없음).
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class InvitationTokenGenerator {

    private static final int TOKEN_BYTES = 32;

    private final SecureRandom random;

    public InvitationTokenGenerator() {
        this(new SecureRandom());
    }

    public InvitationTokenGenerator(SecureRandom random) {
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.random = random;
    }

    public String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
