package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.NewEvent;
import com.ryuqq.provisioning.core.event.ProcessingState;
import com.ryuqq.provisioning.core.event.StreamType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only domain event log SPI.
 *
 * <p>The event log is the single source of truth. Every projection is derived from it and
 * can be rebuilt by replaying it from sequence zero.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Append immutable events with per-stream optimistic concurrency</li>
 *   <li>Assign a strictly increasing global sequence and the created_at timestamp</li>
 *   <li>Track projection processing state (processed_at, processing_error, retry_count)</li>
 *   <li>Support router catch-up through an unprocessed-event scan</li>
 * </ul>
 *
 * <p><strong>Append Contract:</strong></p>
 * <pre>
 * long next = store.currentVersion(streamId, streamType) + 1;
 * store.append(new NewEvent(streamId, streamType, next, ...));
 * // version already taken → ConcurrencyConflictException, never an overwrite
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: concurrent appends to the same stream must not both succeed with one version</li>
 *   <li>No gaps: the first event of a stream has version 1, each following event version + 1</li>
 *   <li>Immutability: event_data and event_metadata never change after append</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface EventStore {

    /**
     * Appends an event to its stream.
     *
     * @param event the event to append, carrying the caller-computed next version
     * @return the stored event (its {@code id} is the EventId)
     * @throws com.ryuqq.provisioning.core.exception.ConcurrencyConflictException
     *         if the version already exists or is not {@code currentVersion + 1}
     * @throws IllegalArgumentException if event is null
     */
    DomainEvent append(NewEvent event);

    /**
     * Returns the latest version of a stream.
     *
     * @param streamId the stream id
     * @param streamType the stream type
     * @return the latest version, or 0 if the stream has no events
     */
    long currentVersion(UUID streamId, StreamType streamType);

    /**
     * Reads all events of one stream ordered by version.
     *
     * @param streamId the stream id
     * @param streamType the stream type
     * @return events in version order (empty if none)
     */
    List<DomainEvent> readStream(UUID streamId, StreamType streamType);

    /**
     * Reads events by global sequence.
     *
     * @param afterSequence exclusive lower bound (0 reads from the beginning)
     * @param limit maximum number of events
     * @return events in sequence order
     */
    List<DomainEvent> readAll(long afterSequence, int limit);

    /**
     * Finds an event by id.
     *
     * @param eventId the event id
     * @return the event, or empty if absent
     */
    Optional<DomainEvent> findById(UUID eventId);

    /**
     * Scans events whose projection has not been applied (Pending or Failed), oldest first.
     *
     * @param limit maximum number of events
     * @return unprocessed events in sequence order
     */
    default List<DomainEvent> scanUnprocessed(int limit) {
        return scanUnprocessed(0L, limit);
    }

    /**
     * Scans unprocessed events after a sequence cursor, oldest first.
     *
     * <p>Callers page past events they cannot apply yet (dead or queued behind a blocked stream)
     * by passing the last sequence they have seen.</p>
     *
     * @param afterSequence exclusive lower bound (0 scans from the beginning)
     * @param limit maximum number of events
     * @return unprocessed events in sequence order
     */
    List<DomainEvent> scanUnprocessed(long afterSequence, int limit);

    /**
     * Marks an event as processed and clears its processing error.
     *
     * @param eventId the event id
     * @param processedAt processing timestamp
     * @throws IllegalArgumentException if the event does not exist
     */
    void markProcessed(UUID eventId, Instant processedAt);

    /**
     * Records a projection failure: stores the error, increments retry_count, and leaves
     * processed_at empty so the event is retried.
     *
     * @param eventId the event id
     * @param error the error description
     * @return the new Failed state
     * @throws IllegalArgumentException if the event does not exist
     */
    ProcessingState.Failed markFailed(UUID eventId, String error);
}
