package com.ryuqq.provisioning.core.model;

import java.util.List;

/**
 * Organization Bootstrap 시작 요청.
 *
 * <p>subdomain이 null이면 DNS 단계(설정, 검증)는 효과 없이 통과합니다.
 * (하위 도메인이 필요 없는 파트너 조직)</p>
 *
 * @param organization 조직 입력값
 * @param users 초대할 사용자 목록
 * @param subdomain 하위 도메인 라벨 (선택, null 가능)
 * @param initiatedBy 요청자 user id (이벤트 metadata의 user_id)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record BootstrapRequest(
    OrganizationParams organization,
    List<InvitationRecipient> users,
    String subdomain,
    String initiatedBy
) {

    public BootstrapRequest {
        if (organization == null) {
            throw new IllegalArgumentException("organization cannot be null");
        }
        if (initiatedBy == null || initiatedBy.isBlank()) {
            throw new IllegalArgumentException("initiatedBy cannot be null or blank");
        }
        users = users == null ? List.of() : List.copyOf(users);
        if (subdomain != null && subdomain.isBlank()) {
            subdomain = null;
        }
    }

    /**
     * 하위 도메인 요청 여부.
     *
     * @return subdomain이 지정된 경우 true
     */
    public boolean hasSubdomain() {
        return subdomain != null;
    }
}
