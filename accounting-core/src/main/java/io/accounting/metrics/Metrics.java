package io.accounting.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Snapshot;
import com.codahale.metrics.Timer;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.accounting.json.JsonSupport;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Process-wide metric registry created once at startup and shared by request handlers and
 * pipeline tasks.
 */
public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    @SuppressWarnings("unchecked")
    public <T> Gauge<T> gauge(String name, Supplier<T> value) {
        return registry.gauge(name, () -> (Gauge<T>) value::get);
    }

    /** JSON view of every metric; timer durations are in milliseconds. */
    public ObjectNode snapshot() {
        ObjectNode root = JsonSupport.MAPPER.createObjectNode();
        ObjectNode counters = root.putObject("counters");
        registry.getCounters().forEach((name, c) -> counters.put(name, c.getCount()));
        ObjectNode gauges = root.putObject("gauges");
        for (Map.Entry<String, Gauge> e : registry.getGauges().entrySet()) {
            Object v = e.getValue().getValue();
            if (v instanceof Number) gauges.put(e.getKey(), ((Number) v).doubleValue());
            else gauges.set(e.getKey(), JsonSupport.MAPPER.valueToTree(v));
        }
        ObjectNode meters = root.putObject("meters");
        registry.getMeters().forEach((name, m) -> meters.putObject(name)
                .put("count", m.getCount())
                .put("m1_rate", m.getOneMinuteRate()));
        ObjectNode timers = root.putObject("timers");
        registry.getTimers().forEach((name, t) -> {
            Snapshot s = t.getSnapshot();
            timers.putObject(name)
                    .put("count", t.getCount())
                    .put("mean_ms", s.getMean() / 1_000_000.0)
                    .put("p50_ms", s.getMedian() / 1_000_000.0)
                    .put("p99_ms", s.get99thPercentile() / 1_000_000.0);
        });
        return root;
    }
}
