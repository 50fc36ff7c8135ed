package com.ryuqq.provisioning.adapter.inmemory.event;

import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.EventSerializer;
import com.ryuqq.provisioning.core.event.NewEvent;
import com.ryuqq.provisioning.core.event.ProcessingState;
import com.ryuqq.provisioning.core.event.StreamType;
import com.ryuqq.provisioning.core.exception.ConcurrencyConflictException;
import com.ryuqq.provisioning.core.spi.EventStore;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link EventStore} for tests and local runs.
 *
 * <p>Each row keeps the event in its JSON wire form (via {@link EventSerializer}), exactly
 * as a database row would hold event_data and event_metadata, plus a separately mutable
 * processing state. Reads deserialize the row, so callers never share mutable state with
 * the log.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>rows:</strong> ConcurrentSkipListMap&lt;Long, Row&gt; - events by global sequence (ordered scans)</li>
 *   <li><strong>sequenceById:</strong> ConcurrentHashMap&lt;UUID, Long&gt; - event id lookup</li>
 *   <li><strong>streamVersions:</strong> ConcurrentHashMap&lt;StreamKey, Long&gt; - latest version per stream</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong> appends are serialized on the store monitor, which makes the
 * version check and the insert atomic. Reads are lock-free.</p>
 *
 * <p><strong>Limitations:</strong> data is lost on process restart.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class InMemoryEventStore implements EventStore {

    private final ConcurrentSkipListMap<Long, Row> rows = new ConcurrentSkipListMap<>();
    private final ConcurrentHashMap<UUID, Long> sequenceById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<StreamKey, Long> streamVersions = new ConcurrentHashMap<>();
    private final Clock clock;
    private long lastSequence;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public synchronized DomainEvent append(NewEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }

        // 1. Optimistic concurrency check
        StreamKey key = new StreamKey(event.streamId(), event.streamType());
        long current = streamVersions.getOrDefault(key, 0L);
        if (event.streamVersion() != current + 1) {
            throw new ConcurrencyConflictException("Version conflict on " + event.streamType().wireName() + ":"
                + event.streamId() + " (expected " + (current + 1) + ", got " + event.streamVersion() + ")");
        }

        // 2. Assign id, sequence and created_at
        long sequence = ++lastSequence;
        DomainEvent stored = new DomainEvent(
            UUID.randomUUID(),
            sequence,
            event.streamId(),
            event.streamType(),
            event.streamVersion(),
            event.eventType(),
            event.data(),
            event.metadata(),
            clock.instant(),
            ProcessingState.PENDING);

        // 3. Persist the wire form
        rows.put(sequence, new Row(EventSerializer.serialize(stored), ProcessingState.PENDING));
        sequenceById.put(stored.id(), sequence);
        streamVersions.put(key, event.streamVersion());
        return stored;
    }

    @Override
    public long currentVersion(UUID streamId, StreamType streamType) {
        if (streamId == null) {
            throw new IllegalArgumentException("streamId cannot be null");
        }
        if (streamType == null) {
            throw new IllegalArgumentException("streamType cannot be null");
        }
        return streamVersions.getOrDefault(new StreamKey(streamId, streamType), 0L);
    }

    @Override
    public List<DomainEvent> readStream(UUID streamId, StreamType streamType) {
        if (streamId == null) {
            throw new IllegalArgumentException("streamId cannot be null");
        }
        if (streamType == null) {
            throw new IllegalArgumentException("streamType cannot be null");
        }
        return rows.values().stream()
            .map(Row::toEvent)
            .filter(e -> e.streamId().equals(streamId) && e.streamType() == streamType)
            .collect(Collectors.toList());
    }

    @Override
    public List<DomainEvent> readAll(long afterSequence, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }
        return rows.tailMap(afterSequence, false).values().stream()
            .limit(limit)
            .map(Row::toEvent)
            .collect(Collectors.toList());
    }

    @Override
    public Optional<DomainEvent> findById(UUID eventId) {
        if (eventId == null) {
            throw new IllegalArgumentException("eventId cannot be null");
        }
        Long sequence = sequenceById.get(eventId);
        if (sequence == null) {
            return Optional.empty();
        }
        return Optional.of(rows.get(sequence).toEvent());
    }

    @Override
    public List<DomainEvent> scanUnprocessed(long afterSequence, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }
        return rows.tailMap(afterSequence, false).values().stream()
            .filter(row -> !row.state.isProcessed())
            .limit(limit)
            .map(Row::toEvent)
            .collect(Collectors.toList());
    }

    @Override
    public void markProcessed(UUID eventId, Instant processedAt) {
        if (processedAt == null) {
            throw new IllegalArgumentException("processedAt cannot be null");
        }
        long sequence = requireSequence(eventId);
        rows.computeIfPresent(sequence, (seq, row) -> row.withState(new ProcessingState.Processed(processedAt)));
    }

    @Override
    public ProcessingState.Failed markFailed(UUID eventId, String error) {
        long sequence = requireSequence(eventId);
        Row updated = rows.computeIfPresent(sequence, (seq, row) ->
            row.withState(new ProcessingState.Failed(error, row.state.retryCount() + 1)));
        return (ProcessingState.Failed) Objects.requireNonNull(updated).state;
    }

    /**
     * Number of stored events.
     */
    public int size() {
        return rows.size();
    }

    private long requireSequence(UUID eventId) {
        if (eventId == null) {
            throw new IllegalArgumentException("eventId cannot be null");
        }
        Long sequence = sequenceById.get(eventId);
        if (sequence == null) {
            throw new IllegalArgumentException("Event not found: " + eventId);
        }
        return sequence;
    }

    private record StreamKey(UUID streamId, StreamType streamType) {
    }

    private static final class Row {
        private final String json;
        private final ProcessingState state;

        Row(String json, ProcessingState state) {
            this.json = json;
            this.state = state;
        }

        Row withState(ProcessingState next) {
            return new Row(json, next);
        }

        DomainEvent toEvent() {
            return EventSerializer.deserialize(json).withProcessingState(state);
        }
    }
}
