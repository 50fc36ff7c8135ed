package com.ryuqq.provisioning.application.activity.compensation;

import com.ryuqq.provisioning.application.activity.ActivityContext;
import com.ryuqq.provisioning.core.model.BootstrapId;
import com.ryuqq.provisioning.core.saga.DnsRecordRef;
import com.ryuqq.provisioning.core.saga.IssuedInvitation;

import java.util.List;
import java.util.UUID;

/**
 * 보상 실행 컨텍스트.
 *
 * @param bootstrapId saga id
 * @param orgId 조직 id
 * @param userId 요청자
 * @param dnsRecord 생성된 DNS 레코드 (없으면 null)
 * @param invitations saga에 기록된 발급 초대
 * @param reason 보상 사유 (실패 메시지 또는 취소 사유)
 * @param cancelled 취소에 의한 보상인지 여부
 * @author Provisioning Team
 * @since 1.0.0
 */
public record CompensationContext(
    BootstrapId bootstrapId,
    UUID orgId,
    String userId,
    DnsRecordRef dnsRecord,
    List<IssuedInvitation> invitations,
    String reason,
    boolean cancelled
) {

    public CompensationContext {
        if (bootstrapId == null) {
            throw new IllegalArgumentException("bootstrapId cannot be null");
        }
        if (orgId == null) {
            throw new IllegalArgumentException("orgId cannot be null");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        invitations = invitations == null ? List.of() : List.copyOf(invitations);
        if (reason == null || reason.isBlank()) {
            reason = cancelled ? "Bootstrap cancelled" : "Bootstrap failed";
        }
    }

    public ActivityContext activityContext(String compensation) {
        return ActivityContext.forCompensation(bootstrapId, userId, compensation);
    }
}
