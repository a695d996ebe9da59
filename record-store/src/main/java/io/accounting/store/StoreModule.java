package io.accounting.store;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.accounting.jdbc.Database;
import io.accounting.metrics.Metrics;
import io.accounting.store.config.StoreConfig;
import io.accounting.store.metrics.RecordCountGauges;
import io.accounting.store.query.RecordQueryEngine;
import io.accounting.store.server.RecordStoreServer;

import java.io.IOException;
import java.time.Clock;

public class StoreModule extends AbstractModule {
    static final String SCHEMA = "db/record-store.sql";

    private final StoreConfig config;

    public StoreModule(StoreConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(StoreConfig.class).toInstance(config);
        bind(Clock.class).toInstance(Clock.systemUTC());
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton Database database() {
        Database db = new Database(config.jdbcUrl(), config.jdbcUser(), config.jdbcPassword());
        db.migrate(SCHEMA);
        return db;
    }

    @Provides @Singleton JdbcRecordStore recordStore(Database db, Clock clock, Metrics metrics) {
        JdbcRecordStore store = new JdbcRecordStore(db, config.lenient(), clock, metrics);
        RecordCountGauges.register(metrics, store, config.metaCountKeys(), config.metricsFrequencySeconds());
        return store;
    }

    @Provides @Singleton RecordQueryEngine queryEngine(Database db, Metrics metrics) { return new RecordQueryEngine(db, metrics); }

    @Provides @Singleton RecordStoreServer server(JdbcRecordStore store, RecordQueryEngine engine, Metrics metrics) throws IOException {
        return new RecordStoreServer(config.port(), config.workers(), store, engine, metrics);
    }
}
