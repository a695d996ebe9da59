package io.accounting.collector.config;

import io.accounting.collector.mapping.ComponentRule;
import io.accounting.collector.mapping.SiteRule;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Collector settings. Each value comes from a system property ({@code accounting.collector.*}),
 * then an environment variable ({@code ACCOUNTING_COLLECTOR_*}), then the default.
 *
 * @param metricsUrl Prometheus base URL, null when components are not enriched from metrics
 * @param sites site rules, see {@link SiteRule#parseList(String)}
 * @param metaFields meta key to sacct field, e.g. {@code user=User}
 * @param components component rules, see {@link ComponentRule#parseList(String)}
 * @param incompleteDefaults default amounts for components never delivered by metrics
 * @param jobStates states of finished jobs that become records, empty for all
 */
public record CollectorConfig(
        URI storeUrl,
        Duration storeTimeout,
        URI metricsUrl,
        Duration metricsTimeout,
        String metricsQuery,
        Duration collectInterval,
        Duration sendInterval,
        Duration backlogInterval,
        int backlogMaxRetries,
        Duration backlogDeadline,
        String recordPrefix,
        Path stateDir,
        Instant earliest,
        List<SiteRule> sites,
        Map<String, String> metaFields,
        List<ComponentRule> components,
        String incompleteDefaults,
        List<String> jobStates,
        List<String> sacctCommand,
        Duration sacctTimeout,
        ZoneId timeZone,
        long retryBaseMillis,
        long retryMaxMillis,
        int retryMaxAttempts,
        int sendBatch
) {
    public static CollectorConfig fromEnv() {
        URI store = URI.create(setting("store.url", "http://127.0.0.1:8000"));
        Duration storeTimeout = seconds("store.timeout", "10");
        String metrics = setting("metrics.url", "");
        Duration metricsTimeout = seconds("metrics.timeout", "60");
        String metricsQuery = setting("metrics.query", "");
        Duration collect = seconds("collect.interval", "60");
        Duration send = seconds("send.interval", "60");
        Duration backlogInterval = seconds("backlog.interval", "300");
        int backlogRetries = Integer.parseInt(setting("backlog.max-retries", "2"));
        Duration backlogDeadline = seconds("backlog.deadline", "86400");
        String prefix = setting("record.prefix", "slurm");
        Path stateDir = Path.of(setting("state.dir", "./collector-state"));
        Instant earliest = Instant.parse(setting("earliest", "1970-01-01T00:00:00Z"));
        List<SiteRule> sites = SiteRule.parseList(setting("sites", ""));
        Map<String, String> meta = pairs(setting("meta.fields", "user=User,group=Group"));
        List<ComponentRule> components = ComponentRule.parseList(setting("components", "cpu=NCPUS"));
        String defaults = setting("incomplete.defaults", "");
        List<String> states = list(setting("job.states", "completed"));
        List<String> sacct = Arrays.stream(setting("sacct.command", "sacct").trim().split("\\s+")).collect(Collectors.toList());
        Duration sacctTimeout = seconds("sacct.timeout", "60");
        String zone = setting("time-zone", "");
        ZoneId tz = zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        long retryBase = Long.parseLong(setting("retry.base-ms", "1000"));
        long retryMax = Long.parseLong(setting("retry.max-ms", "300000"));
        int retryAttempts = Integer.parseInt(setting("retry.max-attempts", "10"));
        int batch = Integer.parseInt(setting("send.batch", "500"));
        return new CollectorConfig(store, storeTimeout, metrics.isBlank() ? null : URI.create(metrics), metricsTimeout,
                metricsQuery, collect, send, backlogInterval, backlogRetries, backlogDeadline, prefix, stateDir, earliest,
                sites, meta, components, defaults, states, sacct, sacctTimeout, tz, retryBase, retryMax, retryAttempts, batch);
    }

    public Path deadLetterFile() { return stateDir.resolve("dead-letter.jsonl"); }

    public CollectorConfig withStoreUrl(URI url) {
        return new CollectorConfig(url, storeTimeout, metricsUrl, metricsTimeout, metricsQuery, collectInterval,
                sendInterval, backlogInterval, backlogMaxRetries, backlogDeadline, recordPrefix, stateDir, earliest, sites,
                metaFields, components, incompleteDefaults, jobStates, sacctCommand, sacctTimeout, timeZone, retryBaseMillis,
                retryMaxMillis, retryMaxAttempts, sendBatch);
    }

    public CollectorConfig withStateDir(Path dir) {
        return new CollectorConfig(storeUrl, storeTimeout, metricsUrl, metricsTimeout, metricsQuery, collectInterval,
                sendInterval, backlogInterval, backlogMaxRetries, backlogDeadline, recordPrefix, dir, earliest, sites,
                metaFields, components, incompleteDefaults, jobStates, sacctCommand, sacctTimeout, timeZone, retryBaseMillis,
                retryMaxMillis, retryMaxAttempts, sendBatch);
    }

    public CollectorConfig withIntervals(Duration collect, Duration send) {
        return new CollectorConfig(storeUrl, storeTimeout, metricsUrl, metricsTimeout, metricsQuery, collect,
                send, backlogInterval, backlogMaxRetries, backlogDeadline, recordPrefix, stateDir, earliest, sites,
                metaFields, components, incompleteDefaults, jobStates, sacctCommand, sacctTimeout, timeZone, retryBaseMillis,
                retryMaxMillis, retryMaxAttempts, sendBatch);
    }

    private static Duration seconds(String name, String def) {
        return Duration.ofSeconds(Long.parseLong(setting(name, def)));
    }

    static List<String> list(String text) {
        return Arrays.stream(text.split(",")).map(String::trim).filter(v -> !v.isEmpty()).collect(Collectors.toList());
    }

    static Map<String, String> pairs(String text) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String item : text.split(",")) {
            String spec = item.trim();
            if (spec.isEmpty()) continue;
            int eq = spec.indexOf('=');
            if (eq <= 0 || eq == spec.length() - 1) throw new IllegalArgumentException("expected key=value: " + spec);
            out.put(spec.substring(0, eq).trim(), spec.substring(eq + 1).trim());
        }
        return out;
    }

    private static String setting(String name, String def) {
        String env = "ACCOUNTING_COLLECTOR_" + name.toUpperCase().replace('.', '_').replace('-', '_');
        return System.getProperty("accounting.collector." + name, System.getenv().getOrDefault(env, def));
    }
}
