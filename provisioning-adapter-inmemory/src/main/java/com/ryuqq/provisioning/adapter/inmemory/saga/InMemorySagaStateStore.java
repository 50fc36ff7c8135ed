package com.ryuqq.provisioning.adapter.inmemory.saga;

import com.ryuqq.provisioning.core.exception.ConcurrencyConflictException;
import com.ryuqq.provisioning.core.exception.SagaNotFoundException;
import com.ryuqq.provisioning.core.model.BootstrapId;
import com.ryuqq.provisioning.core.saga.BootstrapSagaState;
import com.ryuqq.provisioning.core.spi.SagaStateStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link SagaStateStore}.
 *
 * <p>Writes (create, update, claimDue) are serialized on the store monitor so that a version
 * check and the replacement happen atomically, the same guarantee a
 * {@code UPDATE ... WHERE version = ?} gives in a database. Reads are lock-free.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class InMemorySagaStateStore implements SagaStateStore {

    private final ConcurrentHashMap<BootstrapId, BootstrapSagaState> sagas = new ConcurrentHashMap<>();

    @Override
    public synchronized BootstrapSagaState create(BootstrapSagaState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (sagas.containsKey(state.bootstrapId())) {
            throw new ConcurrencyConflictException("Saga already exists: " + state.bootstrapId());
        }
        BootstrapSagaState stored = state.withVersion(0L);
        sagas.put(stored.bootstrapId(), stored);
        return stored;
    }

    @Override
    public Optional<BootstrapSagaState> find(BootstrapId bootstrapId) {
        if (bootstrapId == null) {
            throw new IllegalArgumentException("bootstrapId cannot be null");
        }
        return Optional.ofNullable(sagas.get(bootstrapId));
    }

    @Override
    public synchronized BootstrapSagaState update(BootstrapSagaState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        BootstrapSagaState current = sagas.get(state.bootstrapId());
        if (current == null) {
            throw new SagaNotFoundException(state.bootstrapId());
        }
        if (current.version() != state.version()) {
            throw new ConcurrencyConflictException("Saga " + state.bootstrapId() + " was modified concurrently"
                + " (stored version " + current.version() + ", given " + state.version() + ")");
        }
        BootstrapSagaState stored = state.withVersion(state.version() + 1);
        sagas.put(stored.bootstrapId(), stored);
        return stored;
    }

    @Override
    public synchronized List<BootstrapSagaState> claimDue(Instant now, Duration lease, int limit) {
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        if (lease == null || lease.isNegative() || lease.isZero()) {
            throw new IllegalArgumentException("lease must be positive, but was: " + lease);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }

        List<BootstrapSagaState> due = sagas.values().stream()
            .filter(state -> !state.isTerminal())
            .filter(state -> !state.nextAttemptAt().isAfter(now))
            .filter(state -> state.leaseUntil() == null || !state.leaseUntil().isAfter(now))
            .sorted(Comparator.comparing(BootstrapSagaState::nextAttemptAt))
            .limit(limit)
            .toList();

        List<BootstrapSagaState> claimed = new ArrayList<>(due.size());
        for (BootstrapSagaState state : due) {
            BootstrapSagaState leased = state.withLease(now.plus(lease)).withVersion(state.version() + 1);
            sagas.put(leased.bootstrapId(), leased);
            claimed.add(leased);
        }
        return claimed;
    }

    public int size() {
        return sagas.size();
    }
}
