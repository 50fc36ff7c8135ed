package com.ryuqq.provisioning.core.projection;

/**
 * 조직에 연결되는 연락처 정보 종류.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum LinkKind {
    CONTACT,
    ADDRESS,
    PHONE
}
