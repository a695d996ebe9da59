package io.accounting.collector.runtime;

import com.codahale.metrics.MetricRegistry;
import io.accounting.collector.InMemoryStore;
import io.accounting.collector.MutableClock;
import io.accounting.collector.RecordingDeadLetters;
import io.accounting.collector.enrich.Backlog;
import io.accounting.collector.enrich.EnrichResult;
import io.accounting.collector.enrich.IncompleteDefaults;
import io.accounting.collector.mapping.ComponentRule;
import io.accounting.collector.mapping.RecordMapper;
import io.accounting.collector.queue.DurableQueue;
import io.accounting.collector.queue.QueueEntry;
import io.accounting.collector.retry.ExponentialBackoffRetryPolicy;
import io.accounting.core.Component;
import io.accounting.core.Record;
import io.accounting.error.UpstreamUnavailableException;
import io.accounting.error.ValidationException;
import io.accounting.metrics.Metrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class QueueSenderTest {
    static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");
    static final Instant T1 = T0.plusSeconds(3600);

    @TempDir Path dir;
    final MutableClock clock = new MutableClock(T0);
    final InMemoryStore store = new InMemoryStore();
    final RecordingDeadLetters deadLetters = new RecordingDeadLetters();
    final AtomicReference<EnrichResult> enrichAnswer = new AtomicReference<>(EnrichResult.incomplete(Map.of(), "not yet"));
    final AtomicInteger enrichCalls = new AtomicInteger();
    DurableQueue queue;
    QueueSender sender;

    @BeforeEach
    void setUp() {
        queue = new DurableQueue(dir);
        sender = sender(100);
    }

    private QueueSender sender(int batch) {
        Metrics metrics = new Metrics(new MetricRegistry());
        RecordMapper mapper = new RecordMapper("slurm", List.of(), Map.of(), ComponentRule.parseList("cpu=NCPUS, memory=@metrics"), Set.of());
        Backlog backlog = new Backlog((record, wanted) -> {
            enrichCalls.incrementAndGet();
            return enrichAnswer.get();
        }, mapper, new IncompleteDefaults(Map.of("memory", 1024L)), 2, Duration.ofMinutes(5), Duration.ofDays(1), clock, metrics);
        return new QueueSender(queue, store, backlog, new ExponentialBackoffRetryPolicy(3, 1000, 60_000), deadLetters, clock, batch, metrics);
    }

    @AfterEach
    void tearDown() { queue.close(); }

    private static Record record(String id, Instant stop) {
        return Record.builder(id, T0).stopTime(stop).component(Component.of("cpu", 8)).build();
    }

    private void enqueue(QueueEntry... entries) {
        queue.commit(List.of(entries), null, Set.of(), Set.of());
    }

    @Test
    void delivers_in_queue_order_and_empties_the_queue() {
        enqueue(QueueEntry.create(record("slurm-1", null), T0),
                QueueEntry.close("slurm-1", T1, T0),
                QueueEntry.create(record("slurm-2", T1), T0));

        assertEquals(3, sender.drainOnce());
        assertEquals(List.of("create slurm-1", "close slurm-1", "create slurm-2"), store.calls);
        assertEquals(T1, store.records.get("slurm-1").stopTime().orElseThrow());
        assertEquals(0, queue.size());
    }

    @Test
    void conflict_counts_as_delivered() {
        store.createOrOpen(record("slurm-1", T1));
        enqueue(QueueEntry.create(record("slurm-1", T1), T0));

        assertEquals(1, sender.drainOnce());
        assertEquals(0, queue.size());
        assertTrue(deadLetters.entries.isEmpty());
    }

    @Test
    void unavailable_store_reschedules_with_backoff_and_ends_the_pass() {
        store.failNext(new UpstreamUnavailableException("connection refused"));
        enqueue(QueueEntry.create(record("slurm-1", T1), T0), QueueEntry.create(record("slurm-2", T1), T0));

        assertEquals(0, sender.drainOnce());
        assertEquals(List.of("create slurm-1"), store.calls);
        QueueEntry first = queue.peek(1).get(0);
        assertEquals(1, first.attempts());
        assertEquals(T0.plusMillis(1000), first.dueAt());

        // the waiting entry does not block other records
        assertEquals(1, sender.drainOnce());
        assertTrue(store.records.containsKey("slurm-2"));

        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, sender.drainOnce());
        assertEquals(0, queue.size());
    }

    @Test
    void later_entries_of_a_waiting_record_wait_too() {
        store.failNext(new UpstreamUnavailableException("timeout"));
        enqueue(QueueEntry.create(record("slurm-1", null), T0), QueueEntry.close("slurm-1", T1, T0));

        sender.drainOnce();
        sender.drainOnce();
        assertEquals(List.of("create slurm-1"), store.calls);

        clock.advance(Duration.ofSeconds(2));
        assertEquals(2, sender.drainOnce());
        assertEquals(List.of("create slurm-1", "create slurm-1", "close slurm-1"), store.calls);
    }

    @Test
    void invalid_record_goes_to_dead_letters() {
        store.failNext(new ValidationException("stop_time before start_time"));
        enqueue(QueueEntry.create(record("slurm-1", T1), T0));

        assertEquals(0, sender.drainOnce());
        assertEquals(0, queue.size());
        assertEquals(1, deadLetters.entries.size());
        assertEquals("slurm-1", deadLetters.entries.get(0).recordId());
    }

    @Test
    void close_of_unknown_record_gives_up_after_max_attempts() {
        enqueue(QueueEntry.close("slurm-404", T1, T0));

        for (int i = 0; i < 3; i++) {
            sender.drainOnce();
            clock.advance(Duration.ofMinutes(1));
        }
        assertEquals(0, queue.size());
        assertEquals(1, deadLetters.entries.size());
        assertEquals(3, store.calls.size());
    }

    @Test
    void backlog_entry_is_sent_once_metrics_arrive() {
        enqueue(QueueEntry.createIncomplete(record("slurm-1", T1), T0, T0.plus(Duration.ofDays(1))));

        assertEquals(0, sender.drainOnce());
        assertEquals(1, queue.peek(1).get(0).enrichAttempts());
        assertTrue(store.records.isEmpty());

        enrichAnswer.set(EnrichResult.complete(Map.of("memory", 2048L)));
        clock.advance(Duration.ofMinutes(5));
        assertEquals(1, sender.drainOnce());
        assertTrue(store.records.get("slurm-1").components().contains(Component.of("memory", 2048)));
    }

    @Test
    void exhausted_backlog_entry_gets_defaults_and_is_never_enriched_again() {
        enqueue(QueueEntry.createIncomplete(record("slurm-1", T1), T0, T0.plus(Duration.ofDays(1))));

        sender.drainOnce();
        clock.advance(Duration.ofMinutes(5));
        sender.drainOnce();
        assertEquals(2, enrichCalls.get());
        assertTrue(store.records.isEmpty());

        store.failNext(new UpstreamUnavailableException("down"));
        clock.advance(Duration.ofMinutes(5));
        assertEquals(0, sender.drainOnce());
        assertEquals(3, enrichCalls.get());
        assertFalse(queue.peek(1).get(0).incomplete());

        clock.advance(Duration.ofMinutes(5));
        assertEquals(1, sender.drainOnce());
        assertEquals(3, enrichCalls.get());
        Record stored = store.records.get("slurm-1");
        assertEquals(List.of(Component.of("cpu", 8), Component.of("memory", 1024)), stored.components());
    }

    @Test
    void unavailable_metrics_do_not_count_but_the_deadline_still_applies() {
        enrichAnswer.set(EnrichResult.unavailable("prometheus down"));
        enqueue(QueueEntry.createIncomplete(record("slurm-1", T1), T0, T0.plus(Duration.ofHours(1))));

        sender.drainOnce();
        clock.advance(Duration.ofMinutes(5));
        sender.drainOnce();
        assertEquals(0, queue.peek(1).get(0).enrichAttempts());

        clock.advance(Duration.ofHours(1));
        assertEquals(1, sender.drainOnce());
        assertTrue(store.records.get("slurm-1").components().contains(Component.of("memory", 1024)));
    }

    @Test
    void parked_entries_do_not_crowd_due_ones_out_of_the_batch() {
        QueueSender small = sender(2);
        Instant deadline = T0.plus(Duration.ofDays(1));
        enqueue(QueueEntry.createIncomplete(record("slurm-1", T1), T0, deadline),
                QueueEntry.createIncomplete(record("slurm-2", T1), T0, deadline));
        assertEquals(0, small.drainOnce());

        enqueue(QueueEntry.create(record("slurm-3", T1), T0),
                QueueEntry.close("slurm-4", T1, T0));
        store.createOrOpen(record("slurm-4", null));
        store.calls.clear();

        assertEquals(2, small.drainOnce());
        assertEquals(List.of("create slurm-3", "close slurm-4"), store.calls);
        assertEquals(2, queue.size());
    }

    @Test
    void unavailable_metrics_are_asked_once_per_pass() {
        enrichAnswer.set(EnrichResult.unavailable("prometheus timed out"));
        Instant deadline = T0.plus(Duration.ofDays(1));
        for (int i = 1; i <= 5; i++) {
            enqueue(QueueEntry.createIncomplete(record("slurm-" + i, T1), T0, deadline));
        }
        enqueue(QueueEntry.create(record("slurm-6", T1), T0));

        assertEquals(1, sender.drainOnce());
        assertEquals(1, enrichCalls.get());
        assertEquals(List.of("create slurm-6"), store.calls);
        assertEquals(5, queue.size());
        for (QueueEntry e : queue.peek(5)) {
            assertEquals(0, e.enrichAttempts());
            assertEquals(T0.plus(Duration.ofMinutes(5)), e.dueAt());
        }

        clock.advance(Duration.ofMinutes(5));
        enrichAnswer.set(EnrichResult.complete(Map.of("memory", 512L)));
        assertEquals(5, sender.drainOnce());
        assertEquals(6, enrichCalls.get());
    }
}
