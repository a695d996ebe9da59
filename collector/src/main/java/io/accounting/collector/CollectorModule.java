package io.accounting.collector;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.accounting.client.RecordStoreClient;
import io.accounting.collector.config.CollectorConfig;
import io.accounting.collector.enrich.Backlog;
import io.accounting.collector.enrich.IncompleteDefaults;
import io.accounting.collector.enrich.MetricsEnricher;
import io.accounting.collector.enrich.PrometheusMetricsEnricher;
import io.accounting.collector.error.DeadLetterSink;
import io.accounting.collector.error.FileDeadLetterSink;
import io.accounting.collector.mapping.RecordMapper;
import io.accounting.collector.queue.DurableQueue;
import io.accounting.collector.retry.ExponentialBackoffRetryPolicy;
import io.accounting.collector.retry.RetryPolicy;
import io.accounting.collector.runtime.Collector;
import io.accounting.collector.runtime.CollectorRuntime;
import io.accounting.collector.runtime.QueueSender;
import io.accounting.collector.source.JobSource;
import io.accounting.collector.source.slurm.SacctOutputParser;
import io.accounting.collector.source.slurm.SlurmJobSource;
import io.accounting.core.RecordIngest;
import io.accounting.metrics.Metrics;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashSet;

public class CollectorModule extends AbstractModule {
    private final CollectorConfig config;

    public CollectorModule(CollectorConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(CollectorConfig.class).toInstance(config);
        bind(Clock.class).toInstance(Clock.systemUTC());
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton DurableQueue queue(Metrics metrics) {
        DurableQueue queue = new DurableQueue(config.stateDir());
        metrics.gauge("collector.queue.size", queue::size);
        metrics.gauge("collector.backlog.size", queue::incompleteCount);
        return queue;
    }

    @Provides @Singleton RecordMapper mapper() {
        return new RecordMapper(config.recordPrefix(), config.sites(), config.metaFields(), config.components(),
                new LinkedHashSet<>(config.jobStates()));
    }

    @Provides @Singleton JobSource jobSource(RecordMapper mapper) {
        SacctOutputParser parser = new SacctOutputParser(mapper.jobFields(), config.timeZone());
        return new SlurmJobSource(config.sacctCommand(), parser, config.timeZone(), config.sacctTimeout());
    }

    @Provides @Singleton MetricsEnricher enricher(RecordMapper mapper) {
        if (config.metricsUrl() == null) return MetricsEnricher.none();
        return new PrometheusMetricsEnricher(config.metricsUrl(), config.metricsTimeout(), config.metricsQuery(), mapper::jobId);
    }

    @Provides @Singleton Backlog backlog(MetricsEnricher enricher, RecordMapper mapper, Clock clock, Metrics metrics) {
        return new Backlog(enricher, mapper, IncompleteDefaults.parse(config.incompleteDefaults()), config.backlogMaxRetries(),
                config.backlogInterval(), config.backlogDeadline(), clock, metrics);
    }

    @Provides @Singleton RecordIngest store() { return new RecordStoreClient(config.storeUrl(), config.storeTimeout()); }

    @Provides @Singleton RetryPolicy retryPolicy() {
        return new ExponentialBackoffRetryPolicy(config.retryMaxAttempts(), config.retryBaseMillis(), config.retryMaxMillis());
    }

    @Provides @Singleton DeadLetterSink deadLetters(Clock clock) throws IOException {
        return new FileDeadLetterSink(config.deadLetterFile(), clock);
    }

    @Provides @Singleton Collector collector(JobSource source, RecordMapper mapper, DurableQueue queue, Backlog backlog,
                                             DeadLetterSink deadLetters, Clock clock, Metrics metrics) {
        return new Collector(source, mapper, queue, backlog, deadLetters, config.earliest(), clock, metrics);
    }

    @Provides @Singleton QueueSender sender(DurableQueue queue, RecordIngest store, Backlog backlog, RetryPolicy retry,
                                           DeadLetterSink deadLetters, Clock clock, Metrics metrics) {
        return new QueueSender(queue, store, backlog, retry, deadLetters, clock, config.sendBatch(), metrics);
    }

    @Provides @Singleton CollectorRuntime runtime(Collector collector, QueueSender sender, DurableQueue queue) {
        return new CollectorRuntime(collector, sender, queue, config.collectInterval(), config.sendInterval());
    }
}
