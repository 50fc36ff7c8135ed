package com.ryuqq.provisioning.application.projection;

import com.ryuqq.provisioning.application.activity.ActivityFixture;
import com.ryuqq.provisioning.application.activity.ConfigureDnsActivity;
import com.ryuqq.provisioning.application.activity.GenerateInvitationsActivity;
import com.ryuqq.provisioning.application.activity.InvitationTokenGenerator;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.EventMetadata;
import com.ryuqq.provisioning.core.event.NewEvent;
import com.ryuqq.provisioning.core.event.StreamType;
import com.ryuqq.provisioning.core.model.InvitationRecipient;
import com.ryuqq.provisioning.core.projection.InvitationView;
import com.ryuqq.provisioning.core.projection.OrganizationView;
import com.ryuqq.provisioning.core.statemachine.SagaStep;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ProjectionRebuilder 테스트.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class ProjectionRebuilderTest {

    private final ActivityFixture fixture = new ActivityFixture();

    @Test
    void rebuild_이벤트_재생으로_같은_projection_복원() {
        // given
        UUID orgId = fixture.createOrganization(fixture.request("Acme Health", "acme"));
        new ConfigureDnsActivity(fixture.dnsProvider, fixture.history, fixture.appender, fixture.config)
            .execute(orgId, "acme", fixture.context(SagaStep.CONFIGURE_DNS));
        new GenerateInvitationsActivity(fixture.projectionStore, fixture.appender, new InvitationTokenGenerator(),
            fixture.config, fixture.clock)
            .execute(orgId, List.of(InvitationRecipient.of("admin@acme.com", "provider_admin")),
                fixture.context(SagaStep.GENERATE_INVITATIONS));

        OrganizationView organization = fixture.projectionStore.findOrganization(orgId).orElseThrow();
        List<InvitationView> invitations = fixture.projectionStore.findInvitations(orgId);

        // when - 작은 page로 여러 번 나눠 읽기
        ProjectionRebuilder rebuilder =
            new ProjectionRebuilder(fixture.eventStore, fixture.projectionStore, fixture.router, 1);
        ProjectionRebuilder.RebuildReport report = rebuilder.rebuild();

        // then
        assertThat(report.replayed()).isEqualTo(fixture.eventStore.size());
        assertThat(report.failed()).isZero();
        assertThat(fixture.projectionStore.findOrganization(orgId)).contains(organization);
        assertThat(fixture.projectionStore.findInvitations(orgId)).isEqualTo(invitations);
    }

    @Test
    void rebuild_실패한_이벤트는_세고_계속_진행() {
        // given
        UUID orgId = fixture.createOrganization(fixture.request("Acme", null));
        fixture.eventStore.append(new NewEvent(UUID.randomUUID(), StreamType.ORGANIZATION, 1,
            "organization.renamed", EventData.empty(),
            new EventMetadata(ActivityFixture.USER, "test", "corr", null, "test")));

        // when
        ProjectionRebuilder.RebuildReport report =
            new ProjectionRebuilder(fixture.eventStore, fixture.projectionStore, fixture.router, 100).rebuild();

        // then
        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.replayed()).isEqualTo(fixture.eventStore.size() - 1);
        assertThat(report.lastSequence()).isEqualTo(fixture.eventStore.readAll(0, 100).get(report.replayed()).sequence());
        assertThat(fixture.projectionStore.findOrganization(orgId)).isPresent();
    }
}
