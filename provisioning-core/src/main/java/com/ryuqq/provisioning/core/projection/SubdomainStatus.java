package com.ryuqq.provisioning.core.projection;

/**
 * 조직 하위 도메인 상태.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum SubdomainStatus {

    /** 하위 도메인 요청 없음. */
    NOT_REQUESTED,
    PENDING,
    VERIFYING,
    VERIFIED,
    FAILED,
    /** 보상으로 DNS 레코드 삭제됨. */
    REMOVED
}
