package com.ryuqq.provisioning.core.model;

/**
 * 조직 전화번호 입력값.
 *
 * @param label 전화 구분 (예: "main", "fax")
 * @param number 전화번호
 * @param type 회선 종류 (예: "office", "mobile")
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record PhoneInfo(String label, String number, String type) {

    public PhoneInfo {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label cannot be null or blank");
        }
        if (number == null || number.isBlank()) {
            throw new IllegalArgumentException("number cannot be null or blank");
        }
    }
}
