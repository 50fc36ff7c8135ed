package com.ryuqq.provisioning.core.model;

/**
 * 조직 주소 입력값.
 *
 * @param label 주소 구분 (예: "physical", "billing")
 * @param street1 주소 1
 * @param street2 주소 2 (선택)
 * @param city 도시
 * @param state 주(州)
 * @param zipCode 우편번호
 * @param country 국가 코드
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record AddressInfo(
    String label,
    String street1,
    String street2,
    String city,
    String state,
    String zipCode,
    String country
) {

    public AddressInfo {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label cannot be null or blank");
        }
        if (street1 == null || street1.isBlank()) {
            throw new IllegalArgumentException("street1 cannot be null or blank");
        }
        if (city == null || city.isBlank()) {
            throw new IllegalArgumentException("city cannot be null or blank");
        }
    }
}
