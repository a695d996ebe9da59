package io.accounting.collector.queue;

import io.accounting.collector.source.Cursor;
import io.accounting.core.Component;
import io.accounting.core.Record;
import io.accounting.error.PersistenceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DurableQueueTest {
    static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");

    @TempDir Path dir;

    private static Record record(String id, Instant stop) {
        return Record.builder(id, T0).stopTime(stop).component(Component.of("cpu", 8)).build();
    }

    @Test
    void entries_cursor_and_open_jobs_survive_reopen() {
        try (DurableQueue q = new DurableQueue(dir)) {
            assertTrue(q.cursor().isEmpty());
            q.commit(List.of(
                    QueueEntry.create(record("slurm-1", null), T0),
                    QueueEntry.close("slurm-1", T0.plusSeconds(60), T0),
                    QueueEntry.createIncomplete(record("slurm-2", T0.plusSeconds(30)), T0, T0.plusSeconds(86400))),
                    new Cursor(T0.plusSeconds(60), "2"), Set.of("slurm-3"), Set.of());
        }

        try (DurableQueue q = new DurableQueue(dir)) {
            assertEquals(new Cursor(T0.plusSeconds(60), "2"), q.cursor().orElseThrow());
            assertTrue(q.isOpen("slurm-3"));
            assertFalse(q.isOpen("slurm-1"));
            List<QueueEntry> entries = q.peek(10);
            assertEquals(3, entries.size());
            assertEquals(EntryKind.CREATE, entries.get(0).kind());
            assertEquals(record("slurm-1", null), entries.get(0).record().orElseThrow());
            assertEquals(EntryKind.CLOSE, entries.get(1).kind());
            assertEquals(T0.plusSeconds(60), entries.get(1).stopTime().orElseThrow());
            assertTrue(entries.get(2).incomplete());
            assertEquals(T0.plusSeconds(86400), entries.get(2).deadline().orElseThrow());
            assertTrue(entries.get(0).seq() < entries.get(1).seq());
            assertEquals(1, q.incompleteCount());
        }
    }

    @Test
    void closed_jobs_are_forgotten() {
        try (DurableQueue q = new DurableQueue(dir)) {
            q.commit(List.of(), new Cursor(T0, "1"), Set.of("slurm-1"), Set.of());
            q.commit(List.of(), new Cursor(T0.plusSeconds(5), "1"), Set.of(), Set.of("slurm-1"));
            assertFalse(q.isOpen("slurm-1"));
        }
    }

    @Test
    void failed_commit_leaves_nothing_behind() {
        try (DurableQueue q = new DurableQueue(dir)) {
            q.commit(List.of(), new Cursor(T0, "1"), Set.of(), Set.of());
            List<QueueEntry> entries = List.of(
                    QueueEntry.create(record("slurm-2", null), T0),
                    QueueEntry.close("x".repeat(2000), T0, T0));
            assertThrows(PersistenceException.class, () -> q.commit(entries, new Cursor(T0.plusSeconds(9), "2"), Set.of("slurm-2"), Set.of()));

            assertEquals(0, q.size());
            assertEquals(new Cursor(T0, "1"), q.cursor().orElseThrow());
            assertFalse(q.isOpen("slurm-2"));
        }
    }

    @Test
    void updates_attempts_and_completion() {
        try (DurableQueue q = new DurableQueue(dir)) {
            q.commit(List.of(QueueEntry.createIncomplete(record("slurm-1", T0.plusSeconds(10)), T0, T0.plusSeconds(100))),
                    null, Set.of(), Set.of());
            long seq = q.peek(1).get(0).seq();

            q.reschedule(seq, 2, T0.plusSeconds(4));
            q.deferEnrichment(seq, 1, T0.plusSeconds(300));
            QueueEntry e = q.peek(1).get(0);
            assertEquals(2, e.attempts());
            assertEquals(1, e.enrichAttempts());
            assertEquals(T0.plusSeconds(300), e.dueAt());
            assertFalse(e.isDue(T0.plusSeconds(299)));

            Record full = e.record().orElseThrow().toBuilder().component(Component.of("memory", 512)).build();
            q.complete(seq, full);
            e = q.peek(1).get(0);
            assertFalse(e.incomplete());
            assertEquals(full, e.record().orElseThrow());

            q.delete(seq);
            assertEquals(0, q.size());
        }
    }

    @Test
    void corrupt_state_is_a_persistence_error() throws Exception {
        Files.writeString(dir.resolve(DurableQueue.DB_NAME + ".mv.db"), "not a database ".repeat(1000), StandardCharsets.UTF_8);
        assertThrows(PersistenceException.class, () -> new DurableQueue(dir));
    }
}
