package io.accounting.collector.runtime;

import io.accounting.collector.queue.DurableQueue;
import io.accounting.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives the collect and send steps on two independent single-thread schedulers with fixed
 * delay, so a run never overlaps itself and a slow store never delays collection.
 *
 * <p>A {@link PersistenceException} in either step stops the runtime; {@link #failure()} then
 * holds it. Other failures are logged and the step runs again on its next tick.
 */
public class CollectorRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CollectorRuntime.class);

    private final Collector collector;
    private final QueueSender sender;
    private final DurableQueue queue;
    private final Duration collectInterval;
    private final Duration sendInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<PersistenceException> failure = new AtomicReference<>();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile ScheduledExecutorService collectScheduler;
    private volatile ScheduledExecutorService sendScheduler;

    public CollectorRuntime(Collector collector, QueueSender sender, DurableQueue queue, Duration collectInterval, Duration sendInterval) {
        this.collector = collector;
        this.sender = sender;
        this.queue = queue;
        this.collectInterval = collectInterval;
        this.sendInterval = sendInterval;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) return;
        collectScheduler = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "collector-collect"));
        sendScheduler = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "collector-send"));
        collectScheduler.scheduleWithFixedDelay(() -> tick("collect", collector::collectOnce), 0, collectInterval.toMillis(), TimeUnit.MILLISECONDS);
        sendScheduler.scheduleWithFixedDelay(() -> tick("send", sender::drainOnce), 0, sendInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("collector running: collect every {}, send every {}", collectInterval, sendInterval);
    }

    /**
     * One collect cycle followed by one send cycle on the calling thread, then closes the queue.
     *
     * @return false when the collector state failed
     */
    public boolean runOnce() {
        try {
            int queued = collector.collectOnce();
            int sent = sender.drainOnce();
            log.info("one-shot run queued {} and delivered {}, {} entries left", queued, sent, queue.size());
            return true;
        } catch (PersistenceException e) {
            failure.set(e);
            log.error("collector state failed, giving up", e);
            return false;
        } finally {
            queue.close();
            stopped.countDown();
        }
    }

    public boolean isRunning() { return running.get(); }

    public Optional<PersistenceException> failure() { return Optional.ofNullable(failure.get()); }

    /** Blocks until {@link #stop()} completed or the runtime failed and shut down. */
    public void awaitStopped() throws InterruptedException {
        stopped.await();
    }

    /** Lets the running cycles finish, then closes the queue. */
    public void stop() {
        if (!running.compareAndSet(true, false)) return;
        shutdown(collectScheduler);
        shutdown(sendScheduler);
        queue.close();
        stopped.countDown();
        log.info("collector stopped");
    }

    @Override
    public void close() { stop(); }

    private void tick(String step, Runnable work) {
        if (!running.get()) return;
        try {
            work.run();
        } catch (PersistenceException e) {
            if (failure.compareAndSet(null, e)) {
                log.error("{} step hit a collector state failure, stopping", step, e);
                new Thread(this::stop, "collector-stop").start();
            }
        } catch (RuntimeException e) {
            log.error("{} step failed, retrying on the next tick", step, e);
        }
    }

    private static void shutdown(ScheduledExecutorService scheduler) {
        if (scheduler == null) return;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(1, TimeUnit.MINUTES)) {
                log.warn("scheduler did not finish within a minute, interrupting");
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
