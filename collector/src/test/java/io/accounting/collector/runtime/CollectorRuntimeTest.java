package io.accounting.collector.runtime;

import io.accounting.collector.FakeJobSource;
import io.accounting.collector.InMemoryStore;
import io.accounting.collector.MutableClock;
import io.accounting.collector.queue.DurableQueue;
import io.accounting.error.PersistenceException;
import io.accounting.error.UpstreamUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static io.accounting.collector.FakeJobSource.job;
import static org.junit.jupiter.api.Assertions.*;

public class CollectorRuntimeTest {
    static final Instant T0 = Instant.parse("2024-03-01T08:00:00Z");

    @TempDir Path dir;
    final MutableClock clock = new MutableClock(T0);
    final FakeJobSource source = new FakeJobSource();
    final InMemoryStore store = new InMemoryStore();

    private CollectorRuntime runtime(DurableQueue queue) {
        return new CollectorRuntime(Pipelines.collector(source, queue, clock), Pipelines.sender(queue, store, clock),
                queue, Duration.ofMillis(20), Duration.ofMillis(20));
    }

    @Test
    void collects_and_sends_until_stopped() throws Exception {
        source.put(job("1", T0, T0.plusSeconds(60), 1));
        CollectorRuntime runtime = runtime(new DurableQueue(dir));
        runtime.start();
        try {
            long until = System.currentTimeMillis() + 10_000;
            while (!hasRecord("slurm-1") && System.currentTimeMillis() < until) Thread.sleep(10);
            assertTrue(hasRecord("slurm-1"));
        } finally {
            runtime.stop();
        }
        assertFalse(runtime.isRunning());
        assertTrue(runtime.failure().isEmpty());
        assertTimeoutPreemptively(Duration.ofSeconds(1), runtime::awaitStopped);
    }

    @Test
    void one_shot_runs_one_cycle_and_keeps_undelivered_entries() {
        source.put(job("1", T0, T0.plusSeconds(60), 1));
        source.put(job("2", T0, T0.plusSeconds(90), 1));
        store.failNext(new UpstreamUnavailableException("down"));

        assertTrue(runtime(new DurableQueue(dir)).runOnce());
        assertEquals(1, store.calls.size());

        try (DurableQueue reopened = new DurableQueue(dir)) {
            assertEquals(2, reopened.size());
        }
    }

    @Test
    void state_failure_stops_the_runtime() {
        source.failWith(new PersistenceException("disk gone"));
        CollectorRuntime runtime = runtime(new DurableQueue(dir));
        runtime.start();

        assertTimeoutPreemptively(Duration.ofSeconds(10), runtime::awaitStopped);
        assertEquals("disk gone", runtime.failure().orElseThrow().getMessage());
        assertFalse(runtime.isRunning());
    }

    private boolean hasRecord(String id) {
        synchronized (store) {
            return store.records.containsKey(id);
        }
    }
}
