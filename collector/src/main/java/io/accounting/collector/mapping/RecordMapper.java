package io.accounting.collector.mapping;

import io.accounting.collector.source.SourceJob;
import io.accounting.core.Component;
import io.accounting.core.Meta;
import io.accounting.core.Record;
import io.accounting.error.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns batch-system jobs into records with the deterministic id {@code prefix-jobid}, so a job
 * collected twice always maps to the same record.
 */
public class RecordMapper {
    private final String prefix;
    private final List<SiteRule> sites;
    private final Map<String, String> metaFields;
    private final List<ComponentRule> components;
    private final Set<String> jobStates;

    /**
     * @param sites site rules, first match wins; no site meta when none matches
     * @param metaFields meta key to batch-system field
     * @param jobStates states (lower case) of finished jobs worth a record; empty for all
     */
    public RecordMapper(String prefix, List<SiteRule> sites, Map<String, String> metaFields,
                        List<ComponentRule> components, Set<String> jobStates) {
        this.prefix = prefix;
        this.sites = List.copyOf(sites);
        this.metaFields = new LinkedHashMap<>(metaFields);
        this.components = List.copyOf(components);
        this.jobStates = jobStates.stream().map(s -> s.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    }

    public String recordId(String jobId) {
        return prefix + "-" + jobId;
    }

    /** Job id a record id was built from, the inverse of {@link #recordId(String)}. */
    public String jobId(String recordId) {
        String p = prefix + "-";
        return recordId.startsWith(p) ? recordId.substring(p.length()) : recordId;
    }

    public List<ComponentRule> components() { return components; }

    /** Components the metrics system has to supply before a finished record is complete. */
    public List<ComponentRule> metricComponents() {
        return components.stream().filter(ComponentRule::fromMetrics).collect(Collectors.toList());
    }

    public ComponentRule rule(String name) {
        for (ComponentRule r : components) {
            if (r.name().equals(name)) return r;
        }
        throw new IllegalArgumentException("no component rule named " + name);
    }

    /** Batch-system fields the rules read, in first-use order. */
    public List<String> jobFields() {
        Set<String> fields = new LinkedHashSet<>(metaFields.values());
        for (SiteRule site : sites) {
            if (site.onlyIf() != null) fields.add(site.onlyIf().field());
        }
        for (ComponentRule rule : components) {
            if (!rule.fromMetrics()) fields.add(rule.field());
            if (rule.onlyIf() != null) fields.add(rule.onlyIf().field());
            for (ScoreRule score : rule.scores()) {
                if (score.onlyIf() != null) fields.add(score.onlyIf().field());
            }
        }
        return new ArrayList<>(fields);
    }

    /**
     * Whether a finished job in {@code state} gets a record. Slurm states may carry a suffix
     * ({@code CANCELLED by 1000}); only the first word counts.
     */
    public boolean acceptsState(String state) {
        if (jobStates.isEmpty()) return true;
        if (state == null || state.isBlank()) return false;
        String word = state.trim().split("\\s+")[0].toLowerCase(Locale.ROOT);
        return jobStates.contains(word);
    }

    /**
     * Maps the job with the components its own fields provide; components filled from metrics
     * are left out.
     */
    public Record map(SourceJob job) {
        Meta.Builder meta = Meta.builder();
        for (SiteRule site : sites) {
            if (site.matches(job)) {
                meta.put("site", site.name());
                break;
            }
        }
        metaFields.forEach((key, field) -> job.field(field).ifPresent(v -> meta.put(key, v)));

        List<Component> out = new ArrayList<>();
        for (ComponentRule rule : components) {
            if (rule.fromMetrics() || !rule.appliesTo(job)) continue;
            String raw = job.field(rule.field()).orElse("0");
            out.add(new Component(rule.name(), amount(job, rule, raw), rule.scoresFor(job)));
        }
        return Record.builder(recordId(job.jobId()), job.startTime())
                .stopTime(job.endTime())
                .meta(meta.build())
                .components(out)
                .build();
    }

    private static long amount(SourceJob job, ComponentRule rule, String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("job " + job.jobId() + " has non-numeric " + rule.field() + " for component " + rule.name() + ": " + raw);
        }
    }
}
