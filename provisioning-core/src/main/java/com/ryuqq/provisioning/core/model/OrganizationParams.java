package com.ryuqq.provisioning.core.model;

import java.util.List;
import java.util.Locale;

/**
 * 생성할 조직의 입력값.
 *
 * <p>contacts, addresses, phones는 조직 생성 단계에서 함께 생성되며
 * junction 이벤트로 조직에 연결됩니다.</p>
 *
 * @param name 조직 이름
 * @param type 조직 유형 (예: "provider", "provider_partner")
 * @param contacts 연락처 목록 (빈 목록 허용)
 * @param addresses 주소 목록 (빈 목록 허용)
 * @param phones 전화번호 목록 (빈 목록 허용)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record OrganizationParams(
    String name,
    String type,
    List<ContactInfo> contacts,
    List<AddressInfo> addresses,
    List<PhoneInfo> phones
) {

    public OrganizationParams {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        contacts = contacts == null ? List.of() : List.copyOf(contacts);
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
        phones = phones == null ? List.of() : List.copyOf(phones);
    }

    /**
     * 연락처 정보 없이 provider 조직 입력값 생성.
     *
     * @param name 조직 이름
     * @return OrganizationParams 인스턴스
     */
    public static OrganizationParams named(String name) {
        return new OrganizationParams(name, "provider", List.of(), List.of(), List.of());
    }

    /**
     * 이름으로부터 slug 생성 (소문자, 영숫자와 하이픈만).
     *
     * @return slug
     */
    public String slug() {
        String slug = name.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("(^-+)|(-+$)", "");
        return slug.isEmpty() ? "org" : slug;
    }
}
