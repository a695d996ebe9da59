package io.accounting.collector.enrich;

import io.accounting.core.Record;

import java.util.Map;
import java.util.Set;

public interface MetricsEnricher {
    EnrichResult enrich(Record record, Set<String> components);

    /** Enricher for deployments without a metrics system; nothing is ever found. */
    static MetricsEnricher none() {
        return (record, components) -> EnrichResult.incomplete(Map.of(), "no metrics system configured");
    }
}
