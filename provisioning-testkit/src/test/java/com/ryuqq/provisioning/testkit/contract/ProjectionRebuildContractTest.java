package com.ryuqq.provisioning.testkit.contract;

import com.ryuqq.provisioning.application.projection.ProjectionRebuilder;
import com.ryuqq.provisioning.core.model.BootstrapId;
import com.ryuqq.provisioning.core.projection.AddressView;
import com.ryuqq.provisioning.core.projection.BootstrapView;
import com.ryuqq.provisioning.core.projection.ContactView;
import com.ryuqq.provisioning.core.projection.InvitationView;
import com.ryuqq.provisioning.core.projection.OrganizationLinks;
import com.ryuqq.provisioning.core.projection.OrganizationView;
import com.ryuqq.provisioning.core.projection.PhoneView;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for rebuilding the read model from the event log.
 *
 * <p>Read views are a pure function of the log: clearing them and replaying every event
 * must yield exactly the same views.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class ProjectionRebuildContractTest extends AbstractProvisioningContractTest {

    @Test
    void testRebuild_ReproducesViews_ForActivatedAndCompensatedBootstraps() {
        // Given: one activated and one compensated bootstrap
        propagate("kept", 2);
        BootstrapId activated = runner.start(requestWithContactInfo("Kept", "kept", "a@kept.test", "b@kept.test"));
        BootstrapId compensated = runner.start(requestWithContactInfo("Dropped", "dropped", "c@dropped.test"));
        pumpUntilTerminal(activated);
        pumpUntilTerminal(compensated);

        Snapshot before1 = snapshot(activated);
        Snapshot before2 = snapshot(compensated);

        // When
        ProjectionRebuilder.RebuildReport report = rebuilder.rebuild();

        // Then
        assertEquals(0, report.failed());
        assertEquals(allEvents().size(), report.replayed());
        assertEquals(before1, snapshot(activated));
        assertEquals(before2, snapshot(compensated));
    }

    @Test
    void testRebuild_EmptyLog_ClearsViews() {
        // Given
        UUID orgId = UUID.randomUUID();

        // When
        ProjectionRebuilder.RebuildReport report = rebuilder.rebuild();

        // Then
        assertEquals(0, report.replayed());
        assertEquals(0L, report.lastSequence());
        assertTrue(projectionStore.findOrganization(orgId).isEmpty());
    }

    private Snapshot snapshot(BootstrapId id) {
        UUID orgId = saga(id).orgId();
        return new Snapshot(
            projectionStore.findOrganization(orgId).orElseThrow(),
            projectionStore.findInvitations(orgId),
            projectionStore.findContacts(orgId),
            projectionStore.findAddresses(orgId),
            projectionStore.findPhones(orgId),
            projectionStore.findLinks(orgId),
            projectionStore.findBootstrap(id.getValue()).orElseThrow());
    }

    private record Snapshot(
        OrganizationView organization,
        List<InvitationView> invitations,
        List<ContactView> contacts,
        List<AddressView> addresses,
        List<PhoneView> phones,
        OrganizationLinks links,
        BootstrapView bootstrap
    ) {
    }
}
