package io.accounting.collector.enrich;

import com.codahale.metrics.Counter;
import io.accounting.collector.mapping.ComponentRule;
import io.accounting.collector.mapping.RecordMapper;
import io.accounting.collector.queue.DurableQueue;
import io.accounting.collector.queue.QueueEntry;
import io.accounting.core.Component;
import io.accounting.core.Record;
import io.accounting.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finished records whose metrics components are not yet available. Each send pass tries to fill
 * them in; after {@code maxRetries} counted attempts or past the entry's deadline the record is
 * completed with {@link IncompleteDefaults} and sent as it is.
 */
public class Backlog {
    private static final Logger log = LoggerFactory.getLogger(Backlog.class);

    private final MetricsEnricher enricher;
    private final RecordMapper mapper;
    private final IncompleteDefaults defaults;
    private final int maxRetries;
    private final Duration retryInterval;
    private final Duration deadline;
    private final Clock clock;
    private final Counter enriched;
    private final Counter defaulted;

    public Backlog(MetricsEnricher enricher, RecordMapper mapper, IncompleteDefaults defaults,
                   int maxRetries, Duration retryInterval, Duration deadline, Clock clock, Metrics metrics) {
        this.enricher = enricher;
        this.mapper = mapper;
        this.defaults = defaults;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryInterval = retryInterval;
        this.deadline = deadline;
        this.clock = clock;
        this.enriched = metrics.counter("collector.backlog.enriched");
        this.defaulted = metrics.counter("collector.backlog.defaulted");
    }

    /** Names of metrics components the record still lacks. */
    public Set<String> missing(Record record) {
        Set<String> out = new LinkedHashSet<>();
        for (ComponentRule rule : mapper.metricComponents()) {
            if (!record.hasComponent(rule.name())) out.add(rule.name());
        }
        return out;
    }

    /** When an incomplete record of a job collected now stops waiting for metrics. */
    public Instant deadlineFrom(Instant now) {
        return now.plus(deadline);
    }

    /** Enrichment state of one send pass. */
    public Pass pass() {
        return new Pass();
    }

    /**
     * Completes incomplete entries during one send pass. Once the metrics system is found
     * unavailable it is not asked again in the same pass; the remaining entries are parked
     * without counting an attempt.
     */
    public final class Pass {
        private String unavailable;

        private Pass() {}

        public boolean metricsUnavailable() { return unavailable != null; }

        /**
         * Tries to complete an incomplete entry. Returns the record to send, already stored back
         * as complete, or empty when the entry was parked for another attempt.
         */
        public Optional<Record> resolve(QueueEntry entry, DurableQueue queue) {
            Record record = entry.record().orElseThrow(() -> new IllegalStateException("backlog entry without record: " + entry));
            Set<String> wanted = missing(record);
            Instant now = clock.instant();
            if (wanted.isEmpty()) return Optional.of(store(entry, queue, record));

            EnrichResult result;
            if (unavailable != null) {
                result = EnrichResult.unavailable(unavailable);
            } else {
                result = enricher.enrich(record, wanted);
                if (result.status() == EnrichResult.Status.UNAVAILABLE) {
                    unavailable = result.reason() == null ? "metrics system unavailable" : result.reason();
                    log.warn("metrics system unavailable, enrichment paused for this pass: {}", unavailable);
                }
            }
            Record withFound = withComponents(record, result.amounts());
            if (result.status() == EnrichResult.Status.COMPLETE) {
                enriched.inc();
                log.debug("{} enriched with {}", record.recordId(), result.amounts().keySet());
                return Optional.of(store(entry, queue, withFound));
            }

            int attempts = entry.enrichAttempts() + (result.status() == EnrichResult.Status.INCOMPLETE ? 1 : 0);
            boolean pastDeadline = entry.deadline().map(d -> !now.isBefore(d)).orElse(false);
            if (attempts > maxRetries || pastDeadline) {
                Map<String, Long> fill = new LinkedHashMap<>(result.amounts());
                for (String name : wanted) fill.putIfAbsent(name, defaults.amountFor(name));
                defaulted.inc();
                log.warn("{} sent incomplete after {} enrichment attempts{}: {}", record.recordId(), attempts,
                        pastDeadline ? " (deadline passed)" : "", result.reason());
                return Optional.of(store(entry, queue, withComponents(record, fill)));
            }
            log.debug("{} still incomplete (attempt {}): {}", record.recordId(), attempts, result.reason());
            queue.deferEnrichment(entry.seq(), attempts, now.plus(retryInterval));
            return Optional.empty();
        }
    }

    private static Record store(QueueEntry entry, DurableQueue queue, Record record) {
        queue.complete(entry.seq(), record);
        return record;
    }

    private Record withComponents(Record record, Map<String, Long> amounts) {
        if (amounts.isEmpty()) return record;
        List<Component> components = new ArrayList<>(record.components());
        amounts.forEach((name, amount) -> {
            if (!record.hasComponent(name)) components.add(new Component(name, amount, mapper.rule(name).metricsScores()));
        });
        return record.toBuilder().components(components).build();
    }
}
