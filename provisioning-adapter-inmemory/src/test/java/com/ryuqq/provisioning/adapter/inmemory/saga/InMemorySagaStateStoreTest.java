package com.ryuqq.provisioning.adapter.inmemory.saga;

import com.ryuqq.provisioning.core.exception.ConcurrencyConflictException;
import com.ryuqq.provisioning.core.exception.SagaNotFoundException;
import com.ryuqq.provisioning.core.model.BootstrapId;
import com.ryuqq.provisioning.core.model.BootstrapRequest;
import com.ryuqq.provisioning.core.model.OrganizationParams;
import com.ryuqq.provisioning.core.saga.BootstrapSagaState;
import com.ryuqq.provisioning.core.statemachine.BootstrapStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySagaStateStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Duration LEASE = Duration.ofSeconds(60);

    private InMemorySagaStateStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySagaStateStore();
    }

    @Test
    void update_version_일치시_증가() {
        // given
        BootstrapSagaState created = store.create(newSaga(NOW));

        // when
        BootstrapSagaState updated = store.update(created.advanceTo(BootstrapStage.ORG_CREATED, NOW));

        // then
        assertThat(updated.version()).isEqualTo(created.version() + 1);
        assertThat(store.find(created.bootstrapId()).orElseThrow().currentStage()).isEqualTo(BootstrapStage.ORG_CREATED);
    }

    @Test
    void update_stale_version은_충돌() {
        // given
        BootstrapSagaState created = store.create(newSaga(NOW));
        store.update(created.advanceTo(BootstrapStage.ORG_CREATED, NOW));

        // when & then
        assertThatThrownBy(() -> store.update(created.requestCancel("late", NOW)))
            .isInstanceOf(ConcurrencyConflictException.class);
    }

    @Test
    void update_없는_saga() {
        assertThatThrownBy(() -> store.update(newSaga(NOW)))
            .isInstanceOf(SagaNotFoundException.class);
    }

    @Test
    void claimDue_lease_동안은_다시_claim되지_않음() {
        // given
        store.create(newSaga(NOW));

        // when
        List<BootstrapSagaState> first = store.claimDue(NOW, LEASE, 10);
        List<BootstrapSagaState> second = store.claimDue(NOW.plusSeconds(30), LEASE, 10);
        List<BootstrapSagaState> afterExpiry = store.claimDue(NOW.plusSeconds(61), LEASE, 10);

        // then
        assertThat(first).hasSize(1);
        assertThat(first.get(0).leaseUntil()).isEqualTo(NOW.plus(LEASE));
        assertThat(second).isEmpty();
        assertThat(afterExpiry).hasSize(1);
    }

    @Test
    void claimDue_미래_nextAttemptAt과_종료_saga는_제외() {
        // given
        store.create(newSaga(NOW.plusSeconds(120)));
        BootstrapSagaState due = store.create(newSaga(NOW));

        // when
        List<BootstrapSagaState> claimed = store.claimDue(NOW, LEASE, 10);

        // then
        assertThat(claimed).extracting(BootstrapSagaState::bootstrapId).containsExactly(due.bootstrapId());
    }

    @Test
    void claimDue_oldestFirst_respectsLimit() {
        BootstrapSagaState older = store.create(newSaga(NOW.minusSeconds(10)));
        store.create(newSaga(NOW));

        List<BootstrapSagaState> claimed = store.claimDue(NOW, LEASE, 1);

        assertThat(claimed).extracting(BootstrapSagaState::bootstrapId).containsExactly(older.bootstrapId());
    }

    private static BootstrapSagaState newSaga(Instant dueAt) {
        BootstrapRequest request = new BootstrapRequest(OrganizationParams.named("Acme"), List.of(), null, "admin");
        return BootstrapSagaState.start(BootstrapId.newId(), UUID.randomUUID(), request, dueAt);
    }
}
