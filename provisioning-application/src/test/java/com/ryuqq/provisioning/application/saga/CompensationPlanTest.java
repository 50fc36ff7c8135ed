package com.ryuqq.provisioning.application.saga;

import com.ryuqq.provisioning.application.activity.compensation.Compensation;
import com.ryuqq.provisioning.application.activity.compensation.CompensationContext;
import com.ryuqq.provisioning.application.activity.compensation.CompensationResult;
import com.ryuqq.provisioning.core.statemachine.BootstrapStage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CompensationPlan 테스트.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class CompensationPlanTest {

    private final CompensationPlan plan = new CompensationPlan(
        List.of(named("DeletePhones"), named("DeleteAddresses"), named("DeleteContacts"),
            named("DeactivateOrganization")),
        named("RemoveDNS"),
        named("RevokeInvitations"));

    @Test
    void planFor_완료_역순으로_보상() {
        List<Compensation> compensations = plan.planFor(List.of(
            BootstrapStage.ORG_CREATED, BootstrapStage.DNS_CONFIGURED, BootstrapStage.DNS_VERIFIED,
            BootstrapStage.INVITATIONS_GENERATED, BootstrapStage.EMAILS_SENT));

        assertThat(compensations).extracting(Compensation::name).containsExactly(
            "RevokeInvitations", "RemoveDNS",
            "DeletePhones", "DeleteAddresses", "DeleteContacts", "DeactivateOrganization");
    }

    @Test
    void planFor_DNS_설정_직후_실패() {
        List<Compensation> compensations =
            plan.planFor(List.of(BootstrapStage.ORG_CREATED, BootstrapStage.DNS_CONFIGURED));

        assertThat(compensations).extracting(Compensation::name)
            .startsWith("RemoveDNS")
            .endsWith("DeactivateOrganization");
    }

    @Test
    void planFor_완료_단계가_없으면_빈_계획() {
        assertThat(plan.planFor(List.of())).isEmpty();
    }

    @Test
    void forStage_보상이_없는_단계() {
        assertThat(plan.forStage(BootstrapStage.DNS_VERIFIED)).isEmpty();
        assertThat(plan.forStage(BootstrapStage.EMAILS_SENT)).isEmpty();
        assertThat(plan.forStage(BootstrapStage.ACTIVATED)).isEmpty();
    }

    private static Compensation named(String name) {
        return new Compensation() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public CompensationResult compensate(CompensationContext context) {
                return new CompensationResult(name, List.of(), List.of());
            }
        };
    }
}
