package com.ryuqq.provisioning.application.saga;

import com.ryuqq.provisioning.application.activity.compensation.Compensation;
import com.ryuqq.provisioning.core.statemachine.BootstrapStage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 완료 단계별 보상 매핑.
 *
 * <ul>
 *   <li>ORG_CREATED: 전화번호, 주소, 연락처 삭제 후 조직 비활성화</li>
 *   <li>DNS_CONFIGURED: DNS 레코드 삭제</li>
 *   <li>INVITATIONS_GENERATED: 초대 철회</li>
 *   <li>DNS_VERIFIED, EMAILS_SENT: 없음</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class CompensationPlan {

    private final List<Compensation> organizationCompensations;
    private final Compensation removeDns;
    private final Compensation revokeInvitations;

    /**
     * @param organizationCompensations ORG_CREATED 보상 (실행 순서대로)
     * @param removeDns DNS_CONFIGURED 보상
     * @param revokeInvitations INVITATIONS_GENERATED 보상
     */
    public CompensationPlan(List<Compensation> organizationCompensations, Compensation removeDns,
                            Compensation revokeInvitations) {
        if (organizationCompensations == null) {
            throw new IllegalArgumentException("organizationCompensations cannot be null");
        }
        if (removeDns == null) {
            throw new IllegalArgumentException("removeDns cannot be null");
        }
        if (revokeInvitations == null) {
            throw new IllegalArgumentException("revokeInvitations cannot be null");
        }
        this.organizationCompensations = List.copyOf(organizationCompensations);
        this.removeDns = removeDns;
        this.revokeInvitations = revokeInvitations;
    }

    public List<Compensation> forStage(BootstrapStage stage) {
        return switch (stage) {
            case ORG_CREATED -> organizationCompensations;
            case DNS_CONFIGURED -> List.of(removeDns);
            case INVITATIONS_GENERATED -> List.of(revokeInvitations);
            case CREATED, DNS_VERIFIED, EMAILS_SENT, ACTIVATED, FAILED, COMPENSATED, CANCELLED -> List.of();
        };
    }

    /**
     * 완료 단계의 보상을 완료 역순으로 나열.
     *
     * @param completedStages 완료 순서대로의 단계 목록
     * @return 실행할 보상 목록
     */
    public List<Compensation> planFor(List<BootstrapStage> completedStages) {
        List<BootstrapStage> reversed = new ArrayList<>(completedStages);
        Collections.reverse(reversed);
        List<Compensation> plan = new ArrayList<>();
        for (BootstrapStage stage : reversed) {
            plan.addAll(forStage(stage));
        }
        return plan;
    }
}
