package io.accounting.collector.runtime;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Timer;
import io.accounting.collector.enrich.Backlog;
import io.accounting.collector.error.DeadLetterSink;
import io.accounting.collector.queue.DurableQueue;
import io.accounting.collector.queue.QueueEntry;
import io.accounting.collector.retry.RetryPolicy;
import io.accounting.core.CreateOutcome;
import io.accounting.core.Record;
import io.accounting.core.RecordIngest;
import io.accounting.error.AccountingException;
import io.accounting.error.ConflictException;
import io.accounting.error.NotFoundException;
import io.accounting.error.PersistenceException;
import io.accounting.error.UpstreamUnavailableException;
import io.accounting.error.ValidationException;
import io.accounting.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Send step: delivers due queue entries in queue order and removes each once the store has it.
 *
 * <p>A conflict on create counts as delivered. An unavailable store reschedules the entry with
 * backoff and ends the pass. Entries the store rejects as invalid go to the dead-letter sink.
 * While an entry waits, later entries for the same record wait too. Only due entries are read,
 * so entries parked for later never crowd due ones out of a batch.
 */
public class QueueSender {
    private static final Logger log = LoggerFactory.getLogger(QueueSender.class);

    private final DurableQueue queue;
    private final RecordIngest store;
    private final Backlog backlog;
    private final RetryPolicy retry;
    private final DeadLetterSink deadLetters;
    private final Clock clock;
    private final int batchSize;
    private final Timer sendTimer;
    private final Counter delivered;
    private final Counter duplicates;
    private final Counter retried;
    private final Counter deadLettered;

    public QueueSender(DurableQueue queue, RecordIngest store, Backlog backlog, RetryPolicy retry,
                       DeadLetterSink deadLetters, Clock clock, int batchSize, Metrics metrics) {
        this.queue = queue;
        this.store = store;
        this.backlog = backlog;
        this.retry = retry;
        this.deadLetters = deadLetters;
        this.clock = clock;
        this.batchSize = Math.max(1, batchSize);
        this.sendTimer = metrics.timer("collector.send.time");
        this.delivered = metrics.counter("collector.send.delivered");
        this.duplicates = metrics.counter("collector.send.duplicates");
        this.retried = metrics.counter("collector.send.retried");
        this.deadLettered = metrics.counter("collector.send.dead_lettered");
    }

    /**
     * @return number of entries delivered in this pass
     */
    public int drainOnce() {
        int count = 0;
        try (Timer.Context ignored = sendTimer.time()) {
            List<QueueEntry> entries = queue.due(clock.instant(), batchSize);
            Backlog.Pass enrichment = backlog.pass();
            Set<String> held = new HashSet<>();
            for (QueueEntry entry : entries) {
                Instant now = clock.instant();
                if (held.contains(entry.recordId()) || !entry.isDue(now)) {
                    held.add(entry.recordId());
                    continue;
                }
                Outcome outcome = send(entry, enrichment);
                switch (outcome) {
                    case DELIVERED -> count++;
                    case HELD -> held.add(entry.recordId());
                    case STOP -> {
                        log.info("store unavailable, {} delivered before the pass ended", count);
                        return count;
                    }
                    case DROPPED -> { }
                }
            }
        }
        return count;
    }

    private enum Outcome { DELIVERED, HELD, STOP, DROPPED }

    private Outcome send(QueueEntry entry, Backlog.Pass enrichment) {
        Record record = null;
        if (entry.incomplete()) {
            Optional<Record> ready = enrichment.resolve(entry, queue);
            if (ready.isEmpty()) return Outcome.HELD;
            record = ready.get();
        }
        try {
            switch (entry.kind()) {
                case CREATE -> {
                    Record toSend = record != null ? record : entry.record()
                            .orElseThrow(() -> new PersistenceException("create entry " + entry.seq() + " has no record"));
                    if (store.createOrOpen(toSend) == CreateOutcome.ALREADY_EXISTS) duplicates.inc();
                }
                case CLOSE -> store.close(entry.recordId(), entry.stopTime()
                        .orElseThrow(() -> new PersistenceException("close entry " + entry.seq() + " has no stop time")));
            }
        } catch (ConflictException e) {
            duplicates.inc();
            log.debug("{} already in the store, counted as delivered", entry.recordId());
        } catch (UpstreamUnavailableException e) {
            reschedule(entry, e);
            return Outcome.STOP;
        } catch (NotFoundException e) {
            // create not delivered yet
            return retryOrDrop(entry, e) ? Outcome.HELD : Outcome.DROPPED;
        } catch (ValidationException e) {
            drop(entry, e);
            return Outcome.DROPPED;
        } catch (PersistenceException e) {
            throw e;
        } catch (AccountingException e) {
            return retryOrDrop(entry, e) ? Outcome.HELD : Outcome.DROPPED;
        }
        queue.delete(entry.seq());
        delivered.inc();
        return Outcome.DELIVERED;
    }

    private boolean retryOrDrop(QueueEntry entry, AccountingException e) {
        if (!retry.shouldRetry(entry.attempts() + 1, e)) {
            drop(entry, e);
            return false;
        }
        reschedule(entry, e);
        return true;
    }

    private void reschedule(QueueEntry entry, AccountingException e) {
        int attempts = entry.attempts() + 1;
        long delay = retry.backoffMillis(attempts);
        retried.inc();
        log.warn("delivery of {} {} failed (attempt {}), retrying in {} ms: {}",
                entry.kind(), entry.recordId(), attempts, delay, e.getMessage());
        queue.reschedule(entry.seq(), attempts, clock.instant().plusMillis(delay));
    }

    private void drop(QueueEntry entry, AccountingException e) {
        deadLetters.acceptFailure("send", entry, e);
        deadLettered.inc();
        queue.delete(entry.seq());
    }
}
