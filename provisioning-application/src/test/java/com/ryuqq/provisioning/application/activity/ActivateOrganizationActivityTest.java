package com.ryuqq.provisioning.application.activity;

import com.ryuqq.provisioning.application.event.DispatchMode;
import com.ryuqq.provisioning.core.event.OrganizationEventType;
import com.ryuqq.provisioning.core.event.StreamType;
import com.ryuqq.provisioning.core.projection.OrganizationView;
import com.ryuqq.provisioning.core.statemachine.SagaStep;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActivateOrganizationActivityTest {

    private final ActivityFixture fixture = new ActivityFixture();
    private final ActivateOrganizationActivity activity =
        new ActivateOrganizationActivity(fixture.history, fixture.appender, fixture.clock);

    @Test
    void execute_조직_활성화() {
        UUID orgId = fixture.createOrganization(fixture.request("Acme", null));

        boolean activated = activity.execute(orgId, fixture.context(SagaStep.ACTIVATE_ORGANIZATION));

        assertThat(activated).isTrue();
        OrganizationView view = fixture.projectionStore.findOrganization(orgId).orElseThrow();
        assertThat(view.active()).isTrue();
        assertThat(view.activatedAt()).isEqualTo(ActivityFixture.NOW);
    }

    @Test
    void execute_이미_활성이면_no_op() {
        UUID orgId = fixture.createOrganization(fixture.request("Acme", null));
        activity.execute(orgId, fixture.context(SagaStep.ACTIVATE_ORGANIZATION));

        boolean again = activity.execute(orgId, fixture.context(SagaStep.ACTIVATE_ORGANIZATION));

        assertThat(again).isFalse();
        assertThat(fixture.count(orgId, StreamType.ORGANIZATION, OrganizationEventType.ACTIVATED)).isEqualTo(1);
    }

    @Test
    void execute_조직_스트림이_없으면_예외() {
        UUID unknown = UUID.randomUUID();

        assertThatThrownBy(() -> activity.execute(unknown, fixture.context(SagaStep.ACTIVATE_ORGANIZATION)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining(unknown.toString());
    }

    @Test
    void execute_projection_반영_전에도_이벤트_로그로_판단() {
        ActivityFixture async = new ActivityFixture(DispatchMode.ASYNCHRONOUS);
        ActivateOrganizationActivity asyncActivity =
            new ActivateOrganizationActivity(async.history, async.appender, async.clock);
        UUID orgId = async.createOrganization(async.request("Acme", null));

        boolean first = asyncActivity.execute(orgId, async.context(SagaStep.ACTIVATE_ORGANIZATION));
        boolean second = asyncActivity.execute(orgId, async.context(SagaStep.ACTIVATE_ORGANIZATION));

        assertThat(async.projectionStore.findOrganization(orgId)).isEmpty();
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(async.count(orgId, StreamType.ORGANIZATION, OrganizationEventType.ACTIVATED)).isEqualTo(1);
    }
}
