package com.ryuqq.provisioning.core.projection;

/**
 * 초대 상태.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum InvitationStatus {
    PENDING,
    ACCEPTED,
    EXPIRED,
    REVOKED
}
