package com.ryuqq.provisioning.core.model;

/**
 * 조직 연락처 입력값.
 *
 * @param label 연락처 구분 (예: "billing", "provider_admin")
 * @param firstName 이름
 * @param lastName 성
 * @param email 이메일
 * @param title 직함 (선택, null 가능)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record ContactInfo(
    String label,
    String firstName,
    String lastName,
    String email,
    String title
) {

    public ContactInfo {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label cannot be null or blank");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email cannot be null or blank");
        }
        // firstName, lastName, title은 null 허용
    }
}
