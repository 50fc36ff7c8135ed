package com.ryuqq.provisioning.testkit.contract;

import com.ryuqq.provisioning.application.orchestrator.BootstrapStatus;
import com.ryuqq.provisioning.core.event.BootstrapEventType;
import com.ryuqq.provisioning.core.event.InvitationEventType;
import com.ryuqq.provisioning.core.event.OrganizationEventType;
import com.ryuqq.provisioning.core.model.BootstrapId;
import com.ryuqq.provisioning.core.projection.InvitationView;
import com.ryuqq.provisioning.core.saga.BootstrapSagaState;
import com.ryuqq.provisioning.core.statemachine.BootstrapStage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for activity idempotency.
 *
 * <p>Every step is replayed from a rewound checkpoint. Each activity must notice its own
 * earlier effect in the event log and skip it.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class IdempotencyContractTest extends AbstractProvisioningContractTest {

    @Test
    void testReplay_FromFirstStep_RepeatsNoSideEffect() {
        // Given: a finished bootstrap
        propagate("replay", 2);
        BootstrapId id = runner.start(request("Replay", "replay", "a@replay.test", "b@replay.test"));
        BootstrapStatus first = pumpUntilTerminal(id);
        assertStage(first, BootstrapStage.ACTIVATED);
        UUID orgId = first.result().orgId();
        int eventsBefore = allEvents().size();

        // When: the checkpoint is rewound to the very beginning and the saga runs again
        rewindTo(id, BootstrapStage.CREATED, List.of());
        BootstrapStatus second = pumpUntilTerminal(id);

        // Then
        assertStage(second, BootstrapStage.ACTIVATED);
        assertEquals(1, count(orgId, OrganizationEventType.CREATED));
        assertEquals(1, count(orgId, OrganizationEventType.SUBDOMAIN_DNS_CREATED));
        assertEquals(1, count(orgId, OrganizationEventType.SUBDOMAIN_VERIFIED));
        assertEquals(1, count(orgId, OrganizationEventType.ACTIVATED));
        assertEquals(1, count(id.getValue(), BootstrapEventType.COMPLETED));
        assertEquals(1, dnsProvider.createCallCount());
        assertEquals(2, emailSender.outbox().size());
        assertEquals(eventsBefore, allEvents().size(), "Replay should append no new event");
    }

    @Test
    void testReplay_GenerateInvitations_ReusesLiveInvitation() {
        // Given
        propagate("reuse", 2);
        BootstrapId id = runner.start(request("Reuse", "reuse", "owner@reuse.test"));
        BootstrapSagaState generated = pumpUntilStage(id, BootstrapStage.INVITATIONS_GENERATED);
        UUID invitationId = generated.invitations().get(0).invitationId();

        // When
        rewindTo(id, BootstrapStage.DNS_VERIFIED, List.of(
            BootstrapStage.ORG_CREATED, BootstrapStage.DNS_CONFIGURED, BootstrapStage.DNS_VERIFIED));
        pumpUntilStage(id, BootstrapStage.INVITATIONS_GENERATED);

        // Then
        List<InvitationView> invitations = projectionStore.findInvitations(generated.orgId());
        assertEquals(1, invitations.size());
        assertEquals(invitationId, saga(id).invitations().get(0).invitationId());
        assertEquals(1, count(invitationId, InvitationEventType.USER_INVITED));
    }

    @Test
    void testReplay_SendInvitationEmails_DoesNotResend() {
        // Given
        propagate("resend", 2);
        BootstrapId id = runner.start(request("Resend", "resend", "owner@resend.test"));
        pumpUntilStage(id, BootstrapStage.EMAILS_SENT);
        assertEquals(1, emailSender.outbox().size());

        // When
        rewindTo(id, BootstrapStage.INVITATIONS_GENERATED, List.of(BootstrapStage.ORG_CREATED,
            BootstrapStage.DNS_CONFIGURED, BootstrapStage.DNS_VERIFIED, BootstrapStage.INVITATIONS_GENERATED));
        pumpUntilStage(id, BootstrapStage.EMAILS_SENT);

        // Then
        assertEquals(1, emailSender.outbox().size());
        UUID invitationId = saga(id).invitations().get(0).invitationId();
        assertEquals(1, count(invitationId, InvitationEventType.EMAIL_SENT));
    }

    private void rewindTo(BootstrapId id, BootstrapStage stage, List<BootstrapStage> completed) {
        BootstrapSagaState state = saga(id);
        sagaStore.update(state.toBuilder()
            .currentStage(stage)
            .completedStages(completed)
            .attempt(0)
            .stageStartedAt(clock.instant())
            .nextAttemptAt(clock.instant())
            .leaseUntil(null)
            .build());
    }
}
