package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.model.BootstrapId;
import com.ryuqq.provisioning.core.saga.BootstrapSagaState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable saga-state table SPI, keyed by bootstrap id.
 *
 * <p>The orchestrator persists every stage transition and retry schedule here, so a saga can be
 * resumed by any runner instance after a process restart.</p>
 *
 * <p><strong>Concurrency:</strong></p>
 * <ul>
 *   <li>Optimistic: {@link #update} succeeds only if the stored version equals the given state's
 *       version, and increments the version</li>
 *   <li>Leases: {@link #claimDue} hands each due saga to exactly one caller until its lease
 *       expires, which gives crash recovery without long-held locks</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface SagaStateStore {

    /**
     * Inserts a new saga.
     *
     * @param state the initial state
     * @return the stored state
     * @throws com.ryuqq.provisioning.core.exception.ConcurrencyConflictException if the id already exists
     */
    BootstrapSagaState create(BootstrapSagaState state);

    /**
     * Finds a saga by id.
     *
     * @param bootstrapId the saga id
     * @return the state, or empty if absent
     */
    Optional<BootstrapSagaState> find(BootstrapId bootstrapId);

    /**
     * Replaces a saga state if its version matches the stored one.
     *
     * @param state the new state carrying the version it was read at
     * @return the stored state with the incremented version
     * @throws com.ryuqq.provisioning.core.exception.ConcurrencyConflictException on version mismatch
     * @throws com.ryuqq.provisioning.core.exception.SagaNotFoundException if the saga does not exist
     */
    BootstrapSagaState update(BootstrapSagaState state);

    /**
     * Claims non-terminal sagas that are due and not leased by another runner.
     *
     * <p>A saga is due when {@code nextAttemptAt <= now} and its lease is empty or expired.
     * Claimed sagas get {@code leaseUntil = now + lease}, oldest {@code nextAttemptAt} first.</p>
     *
     * @param now the current time
     * @param lease lease duration
     * @param limit maximum number of sagas
     * @return claimed states (with their new versions)
     */
    List<BootstrapSagaState> claimDue(Instant now, Duration lease, int limit);
}
