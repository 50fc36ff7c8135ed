package com.ryuqq.provisioning.application.projection;

import com.ryuqq.provisioning.adapter.inmemory.event.InMemoryEventStore;
import com.ryuqq.provisioning.adapter.inmemory.projection.InMemoryProjectionStore;
import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.EventMetadata;
import com.ryuqq.provisioning.core.event.JunctionEventType;
import com.ryuqq.provisioning.core.event.NewEvent;
import com.ryuqq.provisioning.core.event.OrganizationEventType;
import com.ryuqq.provisioning.core.event.ProcessingState;
import com.ryuqq.provisioning.core.event.StreamType;
import com.ryuqq.provisioning.core.exception.UnhandledEventTypeException;
import com.ryuqq.provisioning.core.projection.LinkKind;
import com.ryuqq.provisioning.core.projection.OrganizationView;
import com.ryuqq.provisioning.core.projection.SubdomainStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ProjectionRouter 테스트.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class ProjectionRouterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final EventMetadata METADATA =
        new EventMetadata("admin@example.com", "test", "corr-1", null, "test");

    private InMemoryEventStore eventStore;
    private InMemoryProjectionStore projectionStore;
    private ProjectionRouter router;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        eventStore = new InMemoryEventStore(clock);
        projectionStore = new InMemoryProjectionStore(clock);
        router = new ProjectionRouter(eventStore, projectionStore, new RouterConfig(), clock);
    }

    // ============================================================
    // 성공 경로
    // ============================================================

    @Test
    void route_organizationCreated_projection_반영_및_processed_기록() {
        // given
        UUID orgId = UUID.randomUUID();
        DomainEvent event = eventStore.append(organizationCreated(orgId));

        // when
        ProcessingState state = router.route(event);

        // then
        assertThat(state.isProcessed()).isTrue();
        OrganizationView view = projectionStore.findOrganization(orgId).orElseThrow();
        assertThat(view.name()).isEqualTo("Acme Health");
        assertThat(view.subdomainStatus()).isEqualTo(SubdomainStatus.PENDING);
        assertThat(eventStore.findById(event.id()).orElseThrow().processingState().isProcessed()).isTrue();
    }

    @Test
    void route_이미_처리된_이벤트는_다시_적용하지_않음() {
        // given
        UUID orgId = UUID.randomUUID();
        DomainEvent event = eventStore.append(organizationCreated(orgId));
        router.route(event);
        projectionStore.clear();

        // when
        ProcessingState state = router.route(event);

        // then
        assertThat(state.isProcessed()).isTrue();
        assertThat(projectionStore.findOrganization(orgId)).isEmpty();
    }

    @Test
    void route_junction_이름규칙은_junction_핸들러로() {
        // given
        UUID orgId = UUID.randomUUID();
        UUID contactId = UUID.randomUUID();
        DomainEvent linked = eventStore.append(NewEvent.of(orgId, 1, JunctionEventType.ORGANIZATION_CONTACT_LINKED,
            EventData.builder().put("organization_id", orgId).put("contact_id", contactId).build(), METADATA));

        // when
        router.route(linked);

        // then
        assertThat(projectionStore.findLinks(orgId).get(LinkKind.CONTACT)).containsExactly(contactId);
    }

    // ============================================================
    // 실패 경로
    // ============================================================

    @Test
    void route_핸들러_실패는_기록만_하고_전파하지_않음() {
        // given - organization.created 없이 activated
        UUID orgId = UUID.randomUUID();
        DomainEvent activated = eventStore.append(new NewEvent(orgId, StreamType.ORGANIZATION, 1,
            OrganizationEventType.ACTIVATED.wireName(),
            EventData.builder().put("activated_at", NOW).build(), METADATA));

        // when
        ProcessingState state = router.route(activated);

        // then
        assertThat(state).isInstanceOf(ProcessingState.Failed.class);
        ProcessingState.Failed failed = (ProcessingState.Failed) state;
        assertThat(failed.retryCount()).isEqualTo(1);
        assertThat(failed.error())
            .contains("Organization projection missing")
            .contains(" | Detail: java.lang.IllegalStateException");
        assertThat(eventStore.scanUnprocessed(10)).extracting(DomainEvent::id).containsExactly(activated.id());
    }

    @Test
    void route_미등록_event_type은_기록후_예외_전파() {
        // given
        UUID orgId = UUID.randomUUID();
        DomainEvent unknown = eventStore.append(new NewEvent(orgId, StreamType.ORGANIZATION, 1,
            "organization.renamed", EventData.empty(), METADATA));

        // when & then
        assertThatThrownBy(() -> router.route(unknown))
            .isInstanceOf(UnhandledEventTypeException.class)
            .hasMessageContaining("organization.renamed");
        ProcessingState state = eventStore.findById(unknown.id()).orElseThrow().processingState();
        assertThat(state).isInstanceOf(ProcessingState.Failed.class);
    }

    @Test
    void dispatch_junction_stream에_이름규칙_외_이벤트는_미등록() {
        UUID orgId = UUID.randomUUID();
        DomainEvent odd = eventStore.append(new NewEvent(orgId, StreamType.JUNCTION, 1,
            "junction.rebuilt", EventData.empty(), METADATA));

        assertThatThrownBy(() -> router.dispatch(odd))
            .isInstanceOf(UnhandledEventTypeException.class);
    }

    @Test
    void handler_stream_version_이하_이벤트는_건너뜀() {
        // given
        UUID orgId = UUID.randomUUID();
        DomainEvent created = eventStore.append(organizationCreated(orgId));
        DomainEvent activated = eventStore.append(NewEvent.of(orgId, 2, OrganizationEventType.ACTIVATED,
            EventData.builder().put("activated_at", NOW).build(), METADATA));
        router.route(created);
        router.route(activated);

        // when - 재생
        router.dispatch(created);

        // then
        OrganizationView view = projectionStore.findOrganization(orgId).orElseThrow();
        assertThat(view.active()).isTrue();
        assertThat(view.version()).isEqualTo(2L);
    }

    private static NewEvent organizationCreated(UUID orgId) {
        EventData data = EventData.builder()
            .put("name", "Acme Health")
            .put("slug", "acme-health")
            .put("type", "provider")
            .put("path", "root.acme_health")
            .put("subdomain", "acme")
            .build();
        return NewEvent.of(orgId, 1, OrganizationEventType.CREATED, data, METADATA);
    }
}
