package io.accounting.collector.runtime;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Timer;
import io.accounting.collector.enrich.Backlog;
import io.accounting.collector.error.DeadLetterSink;
import io.accounting.collector.mapping.RecordMapper;
import io.accounting.collector.queue.DurableQueue;
import io.accounting.collector.queue.QueueEntry;
import io.accounting.collector.source.Cursor;
import io.accounting.collector.source.JobSource;
import io.accounting.collector.source.SourceJob;
import io.accounting.core.Record;
import io.accounting.error.UpstreamUnavailableException;
import io.accounting.error.ValidationException;
import io.accounting.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collect step: reads jobs changed since the cursor, turns each into a queue entry and commits
 * the entries together with the advanced cursor.
 *
 * <ul>
 *   <li>running job: CREATE of an open record, the job is remembered as open</li>
 *   <li>finished job remembered as open: CLOSE with its end time</li>
 *   <li>finished job never seen running: CREATE with stop time, in the backlog when metrics
 *       components are missing; left out when its state is not one records are kept for</li>
 * </ul>
 *
 * <p>A job that cannot be mapped goes to the dead-letter sink before the cursor moves past it.
 */
public class Collector {
    private static final Logger log = LoggerFactory.getLogger(Collector.class);

    private final JobSource source;
    private final RecordMapper mapper;
    private final DurableQueue queue;
    private final Backlog backlog;
    private final DeadLetterSink deadLetters;
    private final Cursor initialCursor;
    private final Clock clock;
    private final Timer collectTimer;
    private final Counter collected;
    private final Counter skipped;
    private final Counter filtered;
    private final Counter sourceFailures;

    public Collector(JobSource source, RecordMapper mapper, DurableQueue queue, Backlog backlog,
                     DeadLetterSink deadLetters, Instant earliest, Clock clock, Metrics metrics) {
        this.source = source;
        this.mapper = mapper;
        this.queue = queue;
        this.backlog = backlog;
        this.deadLetters = deadLetters;
        this.initialCursor = Cursor.startingAt(earliest);
        this.clock = clock;
        this.collectTimer = metrics.timer("collector.collect.time");
        this.collected = metrics.counter("collector.collect.jobs");
        this.skipped = metrics.counter("collector.collect.skipped");
        this.filtered = metrics.counter("collector.collect.filtered");
        this.sourceFailures = metrics.counter("collector.collect.source_failures");
    }

    /**
     * @return number of entries queued; 0 when the source was unavailable, in which case the
     *         cursor stays where it was
     */
    public int collectOnce() {
        try (Timer.Context ignored = collectTimer.time()) {
            Cursor cursor = queue.cursor().orElse(initialCursor);
            List<SourceJob> jobs;
            try {
                jobs = source.fetchAfter(cursor);
            } catch (UpstreamUnavailableException e) {
                sourceFailures.inc();
                log.warn("job source unavailable, cursor stays at {}: {}", cursor, e.getMessage());
                return 0;
            }
            if (jobs.isEmpty()) return 0;

            Instant now = clock.instant();
            List<QueueEntry> entries = new ArrayList<>();
            Set<String> opened = new LinkedHashSet<>();
            Set<String> closed = new LinkedHashSet<>();
            Cursor last = cursor;
            for (SourceJob job : jobs) {
                if (!cursor.isBefore(job)) continue;
                last = Cursor.of(job);
                String id = mapper.recordId(job.jobId());
                boolean wasOpen = opened.contains(id) || (!closed.contains(id) && queue.isOpen(id));
                if (job.isRunning() && wasOpen) continue;
                if (wasOpen) {
                    entries.add(QueueEntry.close(id, job.endTime().truncatedTo(ChronoUnit.MICROS), now));
                    opened.remove(id);
                    closed.add(id);
                    continue;
                }
                if (!job.isRunning() && !mapper.acceptsState(job.state())) {
                    filtered.inc();
                    log.debug("job {} finished as {}, no record kept", job.jobId(), job.state());
                    continue;
                }
                Record record;
                try {
                    record = mapper.map(job);
                } catch (ValidationException e) {
                    deadLetters.acceptJob("collect", job, e);
                    skipped.inc();
                    continue;
                }
                if (job.isRunning()) {
                    entries.add(QueueEntry.create(record, now));
                    opened.add(id);
                } else if (!backlog.missing(record).isEmpty()) {
                    entries.add(QueueEntry.createIncomplete(record, now, backlog.deadlineFrom(now)));
                } else {
                    entries.add(QueueEntry.create(record, now));
                }
            }
            queue.commit(entries, last, opened, closed);
            collected.inc(entries.size());
            log.info("collected {} entries from {} jobs, cursor now {}", entries.size(), jobs.size(), last);
            return entries.size();
        }
    }
}
