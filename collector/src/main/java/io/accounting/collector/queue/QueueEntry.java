package io.accounting.collector.queue;

import io.accounting.core.Record;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One pending delivery. CREATE entries carry the record, CLOSE entries the stop time. An
 * incomplete CREATE still waits for metrics and is sent with defaults once past its deadline or
 * its enrichment attempts.
 */
public final class QueueEntry {
    private final long seq;
    private final EntryKind kind;
    private final String recordId;
    private final Record record;
    private final Instant stopTime;
    private final int attempts;
    private final Instant dueAt;
    private final boolean incomplete;
    private final int enrichAttempts;
    private final Instant deadline;

    QueueEntry(long seq, EntryKind kind, String recordId, Record record, Instant stopTime,
               int attempts, Instant dueAt, boolean incomplete, int enrichAttempts, Instant deadline) {
        this.seq = seq;
        this.kind = Objects.requireNonNull(kind);
        this.recordId = Objects.requireNonNull(recordId);
        this.record = record;
        this.stopTime = stopTime;
        this.attempts = attempts;
        this.dueAt = Objects.requireNonNull(dueAt);
        this.incomplete = incomplete;
        this.enrichAttempts = enrichAttempts;
        this.deadline = deadline;
    }

    public static QueueEntry create(Record record, Instant dueAt) {
        return new QueueEntry(0, EntryKind.CREATE, record.recordId(), record, null, 0, dueAt, false, 0, null);
    }

    public static QueueEntry createIncomplete(Record record, Instant dueAt, Instant deadline) {
        return new QueueEntry(0, EntryKind.CREATE, record.recordId(), record, null, 0, dueAt, true, 0, deadline);
    }

    public static QueueEntry close(String recordId, Instant stopTime, Instant dueAt) {
        return new QueueEntry(0, EntryKind.CLOSE, recordId, null, Objects.requireNonNull(stopTime), 0, dueAt, false, 0, null);
    }

    /** Position in the queue, 0 before the entry is stored. */
    public long seq() { return seq; }
    public EntryKind kind() { return kind; }
    public String recordId() { return recordId; }
    public Optional<Record> record() { return Optional.ofNullable(record); }
    public Optional<Instant> stopTime() { return Optional.ofNullable(stopTime); }
    public int attempts() { return attempts; }
    public Instant dueAt() { return dueAt; }
    public boolean incomplete() { return incomplete; }
    public int enrichAttempts() { return enrichAttempts; }
    public Optional<Instant> deadline() { return Optional.ofNullable(deadline); }

    public boolean isDue(Instant now) { return !dueAt.isAfter(now); }

    @Override
    public String toString() {
        return "QueueEntry{" + seq + " " + kind + " " + recordId + ", attempts=" + attempts + ", due=" + dueAt
                + (incomplete ? ", incomplete, enrichAttempts=" + enrichAttempts : "") + "}";
    }
}
