package com.ryuqq.provisioning.application.activity;

import com.ryuqq.provisioning.core.event.ContactEventType;
import com.ryuqq.provisioning.core.event.JunctionEventType;
import com.ryuqq.provisioning.core.event.OrganizationEventType;
import com.ryuqq.provisioning.core.event.StreamType;
import com.ryuqq.provisioning.core.model.AddressInfo;
import com.ryuqq.provisioning.core.model.BootstrapRequest;
import com.ryuqq.provisioning.core.model.ContactInfo;
import com.ryuqq.provisioning.core.model.OrganizationParams;
import com.ryuqq.provisioning.core.model.PhoneInfo;
import com.ryuqq.provisioning.core.projection.LinkKind;
import com.ryuqq.provisioning.core.projection.OrganizationView;
import com.ryuqq.provisioning.core.statemachine.SagaStep;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CreateOrganizationActivity 테스트.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class CreateOrganizationActivityTest {

    private final ActivityFixture fixture = new ActivityFixture();
    private final CreateOrganizationActivity activity =
        new CreateOrganizationActivity(fixture.eventStore, fixture.appender);

    @Test
    void execute_조직과_연락처정보_생성() {
        // given
        UUID orgId = UUID.randomUUID();
        BootstrapRequest request = new BootstrapRequest(
            new OrganizationParams("Acme Health", "provider",
                List.of(new ContactInfo("billing", "Jane", null, "jane@acme.com", null)),
                List.of(new AddressInfo("hq", "1 Main St", null, "Springfield", null, null, "US")),
                List.of(new PhoneInfo("main", "+1-555-0100", "office"))),
            List.of(), "acme", ActivityFixture.USER);

        // when
        CreateOrganizationActivity.Result result =
            activity.execute(orgId, request, fixture.context(SagaStep.CREATE_ORGANIZATION));

        // then
        assertThat(result.created()).isTrue();
        assertThat(result.contacts()).isEqualTo(1);
        assertThat(result.addresses()).isEqualTo(1);
        assertThat(result.phones()).isEqualTo(1);

        OrganizationView view = fixture.projectionStore.findOrganization(orgId).orElseThrow();
        assertThat(view.slug()).isEqualTo("acme-health");
        assertThat(view.path()).isEqualTo("root.acme_health");
        assertThat(view.bootstrapId()).isEqualTo(fixture.bootstrapId.getValue());
        assertThat(fixture.projectionStore.findContacts(orgId)).hasSize(1);
        assertThat(fixture.projectionStore.findLinks(orgId).get(LinkKind.ADDRESS)).hasSize(1);
        assertThat(fixture.projectionStore.findLinks(orgId).get(LinkKind.PHONE)).hasSize(1);
    }

    @Test
    void execute_재실행시_이벤트를_중복_기록하지_않음() {
        // given
        UUID orgId = UUID.randomUUID();
        BootstrapRequest request = new BootstrapRequest(
            new OrganizationParams("Acme Health", "provider",
                List.of(new ContactInfo("billing", null, null, "jane@acme.com", null)), List.of(), List.of()),
            List.of(), null, ActivityFixture.USER);
        activity.execute(orgId, request, fixture.context(SagaStep.CREATE_ORGANIZATION));
        long before = fixture.eventStore.size();

        // when
        CreateOrganizationActivity.Result again =
            activity.execute(orgId, request, fixture.context(SagaStep.CREATE_ORGANIZATION));

        // then
        assertThat(again.created()).isFalse();
        assertThat(fixture.eventStore.size()).isEqualTo(before);
        assertThat(fixture.count(orgId, StreamType.ORGANIZATION, OrganizationEventType.CREATED)).isEqualTo(1);
        assertThat(fixture.count(orgId, StreamType.JUNCTION, JunctionEventType.ORGANIZATION_CONTACT_LINKED))
            .isEqualTo(1);
    }

    @Test
    void derivedId_같은_입력이면_같은_id() {
        UUID orgId = UUID.randomUUID();

        assertThat(CreateOrganizationActivity.derivedId(orgId, "contact", 0))
            .isEqualTo(CreateOrganizationActivity.derivedId(orgId, "contact", 0))
            .isNotEqualTo(CreateOrganizationActivity.derivedId(orgId, "contact", 1));
    }

    @Test
    void execute_contact_이벤트는_contact_스트림에_기록() {
        UUID orgId = UUID.randomUUID();
        BootstrapRequest request = new BootstrapRequest(
            new OrganizationParams("Acme", "provider",
                List.of(new ContactInfo("billing", null, null, "jane@acme.com", null)), List.of(), List.of()),
            List.of(), null, ActivityFixture.USER);

        activity.execute(orgId, request, fixture.context(SagaStep.CREATE_ORGANIZATION));

        UUID contactId = CreateOrganizationActivity.derivedId(orgId, "contact", 0);
        assertThat(fixture.count(contactId, StreamType.CONTACT, ContactEventType.CREATED)).isEqualTo(1);
    }
}
