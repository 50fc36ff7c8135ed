package com.ryuqq.provisioning.application.activity.compensation;

import com.ryuqq.provisioning.application.activity.ActivityFixture;
import com.ryuqq.provisioning.application.activity.ConfigureDnsActivity;
import com.ryuqq.provisioning.application.activity.GenerateInvitationsActivity;
import com.ryuqq.provisioning.application.activity.InvitationTokenGenerator;
import com.ryuqq.provisioning.application.event.DispatchMode;
import com.ryuqq.provisioning.core.event.ContactEventType;
import com.ryuqq.provisioning.core.event.InvitationEventType;
import com.ryuqq.provisioning.core.event.JunctionEventType;
import com.ryuqq.provisioning.core.event.OrganizationEventType;
import com.ryuqq.provisioning.core.event.StreamType;
import com.ryuqq.provisioning.core.model.BootstrapRequest;
import com.ryuqq.provisioning.core.model.ContactInfo;
import com.ryuqq.provisioning.core.model.InvitationRecipient;
import com.ryuqq.provisioning.core.model.OrganizationParams;
import com.ryuqq.provisioning.core.projection.InvitationStatus;
import com.ryuqq.provisioning.core.projection.LinkKind;
import com.ryuqq.provisioning.core.projection.OrganizationView;
import com.ryuqq.provisioning.core.projection.SubdomainStatus;
import com.ryuqq.provisioning.core.saga.DnsRecordRef;
import com.ryuqq.provisioning.core.saga.IssuedInvitation;
import com.ryuqq.provisioning.core.statemachine.SagaStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 보상 activity 테스트.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class CompensationActivitiesTest {

    private ActivityFixture fixture;
    private UUID orgId;

    @BeforeEach
    void setUp() {
        fixture = new ActivityFixture();
        BootstrapRequest request = new BootstrapRequest(
            new OrganizationParams("Acme Health", "provider",
                List.of(new ContactInfo("billing", null, null, "billing@acme.com", null),
                    new ContactInfo("clinical", null, null, "clinical@acme.com", null)),
                List.of(), List.of()),
            List.of(), "acme", ActivityFixture.USER);
        orgId = fixture.createOrganization(request);
    }

    private CompensationContext context(DnsRecordRef record, boolean cancelled) {
        return new CompensationContext(fixture.bootstrapId, orgId, ActivityFixture.USER, record, List.of(), null, cancelled);
    }

    // ============================================================
    // DeactivateOrganization
    // ============================================================

    @Nested
    class Deactivate {

        private DeactivateOrganizationActivity activity;

        @BeforeEach
        void setUp() {
            activity = new DeactivateOrganizationActivity(fixture.history, fixture.appender, fixture.clock);
        }

        @Test
        void 실패로_인한_비활성화() {
            CompensationResult result = activity.compensate(context(null, false));

            assertThat(result.hasWarnings()).isFalse();
            OrganizationView view = fixture.projectionStore.findOrganization(orgId).orElseThrow();
            assertThat(view.deactivatedAt()).isEqualTo(ActivityFixture.NOW);
            assertThat(view.deactivationReason()).isEqualTo("Bootstrap failed");
            assertThat(fixture.eventStore.readStream(orgId, StreamType.ORGANIZATION))
                .filteredOn(event -> event.is(OrganizationEventType.DEACTIVATED))
                .singleElement()
                .satisfies(event -> assertThat(event.data().text("deactivation_type")).isEqualTo("bootstrap_failure"));
        }

        @Test
        void 취소로_인한_비활성화는_bootstrap_cancelled() {
            activity.compensate(context(null, true));

            assertThat(fixture.eventStore.readStream(orgId, StreamType.ORGANIZATION))
                .filteredOn(event -> event.is(OrganizationEventType.DEACTIVATED))
                .singleElement()
                .satisfies(event -> assertThat(event.data().text("deactivation_type")).isEqualTo("bootstrap_cancelled"));
        }

        @Test
        void 두번_실행해도_한번만_기록() {
            activity.compensate(context(null, false));
            activity.compensate(context(null, false));

            assertThat(fixture.count(orgId, StreamType.ORGANIZATION, OrganizationEventType.DEACTIVATED)).isEqualTo(1);
        }

        @Test
        void 조직이_없으면_경고만_남김() {
            CompensationContext unknown = new CompensationContext(fixture.bootstrapId, UUID.randomUUID(),
                ActivityFixture.USER, null, List.of(), "cleanup", false);

            CompensationResult result = activity.compensate(unknown);

            assertThat(result.hasWarnings()).isTrue();
            assertThat(result.compensation()).isEqualTo("DeactivateOrganization");
        }
    }

    // ============================================================
    // RemoveDNS
    // ============================================================

    @Nested
    class RemoveDns {

        private RemoveDnsActivity activity;

        @BeforeEach
        void setUp() {
            activity = new RemoveDnsActivity(fixture.dnsProvider, fixture.history, fixture.appender);
        }

        @Test
        void 레코드_삭제_및_dns_removed_기록() {
            // given
            DnsRecordRef record = new ConfigureDnsActivity(fixture.dnsProvider, fixture.history,
                fixture.appender, fixture.config).execute(orgId, "acme", fixture.context(SagaStep.CONFIGURE_DNS));

            // when
            CompensationResult result = activity.compensate(context(record, false));
            activity.compensate(context(record, false));

            // then
            assertThat(result.actions()).containsExactly("removed DNS record for acme.firstovertheline.com");
            assertThat(fixture.dnsProvider.records()).isEmpty();
            assertThat(fixture.projectionStore.findOrganization(orgId).orElseThrow().subdomainStatus())
                .isEqualTo(SubdomainStatus.REMOVED);
            assertThat(fixture.count(orgId, StreamType.ORGANIZATION, OrganizationEventType.DNS_REMOVED)).isEqualTo(1);
        }

        @Test
        void 레코드가_없으면_no_op() {
            CompensationResult result = activity.compensate(context(null, false));

            assertThat(result.actions()).isEmpty();
            assertThat(result.hasWarnings()).isFalse();
        }

        @Test
        void provider_실패는_경고로_남김() {
            DnsRecordRef record = new DnsRecordRef("rec-1", "zone-firstovertheline.com", "acme.firstovertheline.com");
            fixture.dnsProvider.failNextCalls(1);

            CompensationResult result = activity.compensate(context(record, false));

            assertThat(result.warnings()).singleElement()
                .satisfies(warning -> assertThat(warning).contains("acme.firstovertheline.com"));
            assertThat(fixture.count(orgId, StreamType.ORGANIZATION, OrganizationEventType.DNS_REMOVED)).isZero();
        }
    }

    // ============================================================
    // RevokeInvitations
    // ============================================================

    @Test
    void revokeInvitations_대기중_초대만_취소() {
        // given
        List<IssuedInvitation> issued = new GenerateInvitationsActivity(fixture.projectionStore, fixture.appender,
            new InvitationTokenGenerator(), fixture.config, fixture.clock)
            .execute(orgId, List.of(InvitationRecipient.of("a@acme.com", "admin"), InvitationRecipient.of("b@acme.com", "admin")),
                fixture.context(SagaStep.GENERATE_INVITATIONS));
        RevokeInvitationsActivity activity =
            new RevokeInvitationsActivity(fixture.history, fixture.projectionStore, fixture.appender, fixture.clock);

        // when
        CompensationResult result = activity.compensate(context(null, false));
        CompensationResult again = activity.compensate(context(null, false));

        // then
        assertThat(result.actions()).hasSize(2);
        assertThat(again.actions()).isEmpty();
        assertThat(fixture.projectionStore.findInvitation(issued.get(0).invitationId()).orElseThrow().status())
            .isEqualTo(InvitationStatus.REVOKED);
        assertThat(fixture.projectionStore.findLiveInvitation(orgId, "a@acme.com")).isEmpty();
    }

    // ============================================================
    // DeleteContactInfo
    // ============================================================

    @Test
    void deleteContacts_연결해제_후_삭제() {
        // given
        DeleteContactInfoActivity activity =
            new DeleteContactInfoActivity(LinkKind.CONTACT, fixture.history, fixture.appender, fixture.clock);

        // when
        CompensationResult result = activity.compensate(context(null, false));

        // then
        assertThat(activity.name()).isEqualTo("DeleteContacts");
        assertThat(result.actions()).hasSize(2);
        assertThat(fixture.projectionStore.findLinks(orgId).get(LinkKind.CONTACT)).isEmpty();
        assertThat(fixture.count(orgId, StreamType.JUNCTION, JunctionEventType.ORGANIZATION_CONTACT_UNLINKED))
            .isEqualTo(2);
        assertThat(fixture.projectionStore.findContacts(orgId)).allSatisfy(view -> assertThat(view.isDeleted()).isTrue());
        assertThat(fixture.eventStore.readAll(0, 100))
            .filteredOn(event -> event.is(ContactEventType.DELETED))
            .hasSize(2);
    }

    @Test
    void deleteContacts_두번째_실행은_no_op() {
        DeleteContactInfoActivity activity =
            new DeleteContactInfoActivity(LinkKind.CONTACT, fixture.history, fixture.appender, fixture.clock);
        activity.compensate(context(null, false));

        CompensationResult again = activity.compensate(context(null, false));

        assertThat(again.actions()).isEmpty();
        assertThat(again.hasWarnings()).isFalse();
    }

    // ============================================================
    // projection 미반영 상태
    // ============================================================

    @Nested
    class ProjectionBehind {

        private ActivityFixture async;
        private UUID asyncOrgId;

        @BeforeEach
        void setUp() {
            async = new ActivityFixture(DispatchMode.ASYNCHRONOUS);
            asyncOrgId = async.createOrganization(new BootstrapRequest(
                new OrganizationParams("Acme Health", "provider",
                    List.of(new ContactInfo("billing", null, null, "billing@acme.com", null)),
                    List.of(), List.of()),
                List.of(), "acme", ActivityFixture.USER));
        }

        private CompensationContext asyncContext(List<IssuedInvitation> invitations) {
            return new CompensationContext(async.bootstrapId, asyncOrgId, ActivityFixture.USER, null, invitations,
                "Bootstrap cancelled", true);
        }

        @Test
        void 조직_projection이_없어도_비활성화() {
            // given
            assertThat(async.projectionStore.findOrganization(asyncOrgId)).isEmpty();

            // when
            CompensationResult result = new DeactivateOrganizationActivity(async.history, async.appender, async.clock)
                .compensate(asyncContext(List.of()));

            // then
            assertThat(result.hasWarnings()).isFalse();
            assertThat(async.count(asyncOrgId, StreamType.ORGANIZATION, OrganizationEventType.DEACTIVATED)).isEqualTo(1);
        }

        @Test
        void saga에_기록된_초대는_projection_없이도_철회() {
            // given
            List<IssuedInvitation> issued = new GenerateInvitationsActivity(async.projectionStore, async.appender,
                new InvitationTokenGenerator(), async.config, async.clock)
                .execute(asyncOrgId, List.of(InvitationRecipient.of("a@acme.com", "admin"),
                    InvitationRecipient.of("b@acme.com", "admin")), async.context(SagaStep.GENERATE_INVITATIONS));
            RevokeInvitationsActivity activity =
                new RevokeInvitationsActivity(async.history, async.projectionStore, async.appender, async.clock);

            // when
            CompensationResult result = activity.compensate(asyncContext(issued));
            CompensationResult again = activity.compensate(asyncContext(issued));

            // then
            assertThat(result.actions()).hasSize(2);
            assertThat(again.actions()).isEmpty();
            for (IssuedInvitation invitation : issued) {
                assertThat(async.count(invitation.invitationId(), StreamType.INVITATION, InvitationEventType.REVOKED))
                    .isEqualTo(1);
            }
        }

        @Test
        void 연락처는_junction_스트림으로_찾아_삭제() {
            DeleteContactInfoActivity activity =
                new DeleteContactInfoActivity(LinkKind.CONTACT, async.history, async.appender, async.clock);

            CompensationResult result = activity.compensate(asyncContext(List.of()));
            CompensationResult again = activity.compensate(asyncContext(List.of()));

            assertThat(result.actions()).hasSize(1);
            assertThat(again.actions()).isEmpty();
            assertThat(async.count(asyncOrgId, StreamType.JUNCTION, JunctionEventType.ORGANIZATION_CONTACT_UNLINKED))
                .isEqualTo(1);
            assertThat(async.eventStore.readAll(0, 100))
                .filteredOn(event -> event.is(ContactEventType.DELETED))
                .hasSize(1);
        }
    }
}
