package com.ryuqq.provisioning.testkit.contract;

import com.ryuqq.provisioning.application.event.DispatchMode;
import com.ryuqq.provisioning.application.orchestrator.BootstrapStatus;
import com.ryuqq.provisioning.core.event.AddressEventType;
import com.ryuqq.provisioning.core.event.ContactEventType;
import com.ryuqq.provisioning.core.event.InvitationEventType;
import com.ryuqq.provisioning.core.event.OrganizationEventType;
import com.ryuqq.provisioning.core.event.PhoneEventType;
import com.ryuqq.provisioning.core.model.BootstrapId;
import com.ryuqq.provisioning.core.projection.InvitationStatus;
import com.ryuqq.provisioning.core.projection.SubdomainStatus;
import com.ryuqq.provisioning.core.saga.BootstrapSagaState;
import com.ryuqq.provisioning.core.saga.IssuedInvitation;
import com.ryuqq.provisioning.core.statemachine.BootstrapStage;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for asynchronous projection dispatch.
 *
 * <p>Appends leave events PENDING and the catch-up dispatcher projects them later. Steps and
 * compensations decide what is already done from the event log, so a saga can run, and be
 * rolled back, before any projection has caught up.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class AsyncDispatchContractTest extends AbstractProvisioningContractTest {

    @Override
    protected DispatchMode dispatchMode() {
        return DispatchMode.ASYNCHRONOUS;
    }

    @Test
    void testAsync_AppendLeavesEventPending() {
        // When
        runner.start(request("Pending", null, "owner@pending.test"));

        // Then
        assertEquals(1, eventStore.scanUnprocessed(10).size());
    }

    @Test
    void testAsync_CatchUpBetweenPumps_ActivatesOrganization() {
        // Given
        propagate("async", 2);
        BootstrapId id = runner.start(request("Async", "async", "owner@async.test"));

        // When
        for (int i = 0; i < MAX_PUMPS && !saga(id).isTerminal(); i++) {
            catchUp.pump();
            runner.pump();
            clock.advance(PUMP_INTERVAL);
        }
        catchUp.pump();

        // Then
        BootstrapStatus status = runner.getStatus(id);
        assertStage(status, BootstrapStage.ACTIVATED);
        assertAllProjected();
        assertEquals(SubdomainStatus.VERIFIED,
            projectionStore.findOrganization(status.result().orgId()).orElseThrow().subdomainStatus());
        assertTrue(projectionStore.findOrganization(status.result().orgId()).orElseThrow().active());
    }

    @Test
    void testAsync_CancelBeforeCatchUp_CompensatesFromEventLog() {
        // Given
        BootstrapId id = runner.start(requestWithContactInfo("Early Cancel", null, "owner@early.test"));
        UUID orgId = pumpUntilStage(id, BootstrapStage.ORG_CREATED).orgId();
        assertTrue(projectionStore.findOrganization(orgId).isEmpty());

        // When
        assertTrue(runner.cancel(id, "Customer withdrew"));
        BootstrapStatus status = pumpUntilTerminal(id);

        // Then: compensated from the log, projections still behind
        assertStage(status, BootstrapStage.CANCELLED);
        assertTrue(saga(id).warnings().isEmpty(), "Unexpected warnings: " + saga(id).warnings());
        assertEquals(1, count(orgId, OrganizationEventType.DEACTIVATED));
        assertEquals(1, allEvents().stream().filter(event -> event.is(ContactEventType.DELETED)).count());
        assertEquals(1, allEvents().stream().filter(event -> event.is(AddressEventType.DELETED)).count());
        assertEquals(1, allEvents().stream().filter(event -> event.is(PhoneEventType.DELETED)).count());

        // Then: projections converge once the dispatcher runs
        drainCatchUp();
        assertAllProjected();
        assertNotNull(projectionStore.findOrganization(orgId).orElseThrow().deactivatedAt());
    }

    @Test
    void testAsync_CancelAfterInvitationsBeforeCatchUp_RevokesEveryInvitation() {
        // Given
        propagate("late", 2);
        BootstrapId id = runner.start(request("Late Cancel", "late", "a@late.test", "b@late.test"));
        BootstrapSagaState generated = pumpUntilStage(id, BootstrapStage.INVITATIONS_GENERATED);
        assertEquals(2, generated.invitations().size());

        // When
        assertTrue(runner.cancel(id, "Customer withdrew"));
        BootstrapStatus status = pumpUntilTerminal(id);

        // Then
        assertStage(status, BootstrapStage.CANCELLED);
        for (IssuedInvitation invitation : generated.invitations()) {
            assertEquals(1, count(invitation.invitationId(), InvitationEventType.REVOKED));
        }
        assertEquals(1, count(generated.orgId(), OrganizationEventType.DNS_REMOVED));
        assertEquals(1, count(generated.orgId(), OrganizationEventType.DEACTIVATED));
        assertTrue(dnsProvider.records().isEmpty());
        assertTrue(emailSender.outbox().isEmpty());

        drainCatchUp();
        assertAllProjected();
        assertTrue(projectionStore.findInvitations(generated.orgId()).stream()
            .allMatch(invitation -> invitation.status() == InvitationStatus.REVOKED));
    }

    private void drainCatchUp() {
        int processed;
        do {
            processed = catchUp.pump();
        } while (processed > 0);
    }
}
