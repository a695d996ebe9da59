package io.accounting.store.metrics;

import com.codahale.metrics.CachedGauge;
import io.accounting.error.PersistenceException;
import io.accounting.metrics.Metrics;
import io.accounting.store.JdbcRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Database-backed gauges: total records and records per value of selected meta keys
 * (site, group, user). Values are recomputed at most once per refresh period.
 */
public final class RecordCountGauges {
    private static final Logger log = LoggerFactory.getLogger(RecordCountGauges.class);

    private RecordCountGauges() {}

    public static void register(Metrics metrics, JdbcRecordStore store, List<String> metaKeys, long refreshSeconds) {
        long period = Math.max(1, refreshSeconds);
        metrics.registry().register("store.records.total", new CachedGauge<Long>(period, TimeUnit.SECONDS) {
            @Override
            protected Long loadValue() {
                try {
                    return store.count();
                } catch (PersistenceException e) {
                    log.warn("record count unavailable: {}", e.getMessage());
                    return -1L;
                }
            }
        });
        for (String key : metaKeys) {
            metrics.registry().register("store.records.by_" + key, new CachedGauge<Map<String, Long>>(period, TimeUnit.SECONDS) {
                @Override
                protected Map<String, Long> loadValue() {
                    try {
                        return store.countByMetaValue(key);
                    } catch (PersistenceException e) {
                        log.warn("record count by {} unavailable: {}", key, e.getMessage());
                        return Map.of();
                    }
                }
            });
        }
    }
}
