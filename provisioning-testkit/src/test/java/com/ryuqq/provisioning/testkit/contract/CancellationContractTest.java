package com.ryuqq.provisioning.testkit.contract;

import com.ryuqq.provisioning.application.orchestrator.BootstrapStatus;
import com.ryuqq.provisioning.core.event.BootstrapEventType;
import com.ryuqq.provisioning.core.event.OrganizationEventType;
import com.ryuqq.provisioning.core.event.StreamType;
import com.ryuqq.provisioning.core.model.BootstrapId;
import com.ryuqq.provisioning.core.projection.BootstrapView;
import com.ryuqq.provisioning.core.projection.InvitationStatus;
import com.ryuqq.provisioning.core.projection.InvitationView;
import com.ryuqq.provisioning.core.statemachine.BootstrapStage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for cancellation requests.
 *
 * <p>A cancel request is picked up at the next step boundary. Every completed step is then
 * compensated and the saga ends as CANCELLED.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class CancellationContractTest extends AbstractProvisioningContractTest {

    @Test
    void testCancel_AfterInvitationsGenerated_CompensatesEverything() {
        // Given
        propagate("cancel", 2);
        BootstrapId id = runner.start(request("Cancel Me", "cancel", "a@cancel.test", "b@cancel.test"));
        UUID orgId = pumpUntilStage(id, BootstrapStage.INVITATIONS_GENERATED).orgId();

        // When
        assertTrue(runner.cancel(id, "Customer withdrew"));
        BootstrapStatus status = pumpUntilTerminal(id);

        // Then: saga
        assertStage(status, BootstrapStage.CANCELLED);
        assertTrue(status.cancelRequested());
        assertTrue(status.failure().message().contains("Customer withdrew"));

        // Then: compensations
        List<InvitationView> invitations = projectionStore.findInvitations(orgId);
        assertEquals(2, invitations.size());
        assertTrue(invitations.stream().allMatch(invitation -> invitation.status() == InvitationStatus.REVOKED));
        assertTrue(dnsProvider.records().isEmpty());
        assertFalse(projectionStore.findOrganization(orgId).orElseThrow().active());
        assertEquals(1, count(orgId, OrganizationEventType.DEACTIVATED));
        assertTrue(emailSender.outbox().isEmpty(), "No invitation email should be sent after cancel");

        // Then: audit trail
        assertEquals(List.of("bootstrap.initiated", "bootstrap.failed", "bootstrap.cancelled"),
            eventTypes(id.getValue(), StreamType.BOOTSTRAP));
        assertAppendedBefore(
            single(orgId, OrganizationEventType.DEACTIVATED),
            single(id.getValue(), BootstrapEventType.CANCELLED));
        assertEquals(BootstrapView.Status.CANCELLED,
            projectionStore.findBootstrap(id.getValue()).orElseThrow().status());
    }

    @Test
    void testCancel_BeforeFirstStep_CreatesNothing() {
        // Given
        BootstrapId id = runner.start(request("Never", "never", "owner@never.test"));

        // When
        assertTrue(runner.cancel(id, null));
        BootstrapStatus status = pumpUntilTerminal(id);

        // Then
        assertStage(status, BootstrapStage.CANCELLED);
        assertFalse(status.failure().cleanupRequired());
        assertEquals(0, count(saga(id).orgId(), OrganizationEventType.CREATED));
        assertEquals(0, dnsProvider.createCallCount());
        assertTrue(single(id.getValue(), BootstrapEventType.CANCELLED).data().text("reason")
            .contains("Cancelled by request"));
    }

    @Test
    void testCancel_AfterActivation_IsRejected() {
        // Given
        propagate("done", 2);
        BootstrapId id = runner.start(request("Done", "done", "owner@done.test"));
        pumpUntilTerminal(id);

        // When
        boolean cancelled = runner.cancel(id, "Too late");

        // Then
        assertFalse(cancelled);
        assertEquals(BootstrapStage.ACTIVATED, runner.getStatus(id).stage());
        assertEquals(0, count(id.getValue(), BootstrapEventType.CANCELLED));
    }

    @Test
    void testCancel_Twice_SecondRequestIsAccepted() {
        // Given
        BootstrapId id = runner.start(request("Twice", null, "owner@twice.test"));

        // When
        boolean first = runner.cancel(id, "first");
        boolean second = runner.cancel(id, "second");
        BootstrapStatus status = pumpUntilTerminal(id);

        // Then
        assertTrue(first);
        assertTrue(second);
        assertStage(status, BootstrapStage.CANCELLED);
        assertEquals(1, count(id.getValue(), BootstrapEventType.CANCELLED));
    }
}
