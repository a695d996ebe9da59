package io.accounting.collector.mapping;

import io.accounting.collector.source.SourceJob;
import io.accounting.core.Score;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * How one component of a record is filled: from a batch-system field, or, when {@code field} is
 * null, from the metrics system once the job has finished. With {@code onlyIf} set the component
 * is only put on jobs matching it.
 */
public record ComponentRule(String name, String field, List<ScoreRule> scores, JobCondition onlyIf) {
    public static final String FROM_METRICS = "@metrics";

    public ComponentRule {
        Objects.requireNonNull(name, "name");
        scores = scores == null ? List.of() : List.copyOf(scores);
        if (field == null && (onlyIf != null || scores.stream().anyMatch(s -> s.onlyIf() != null))) {
            throw new IllegalArgumentException("component " + name + " comes from metrics and cannot have conditions");
        }
    }

    public boolean fromMetrics() { return field == null; }

    public boolean appliesTo(SourceJob job) {
        return onlyIf == null || onlyIf.matches(job);
    }

    public List<Score> scoresFor(SourceJob job) {
        return scores.stream().filter(s -> s.appliesTo(job)).map(ScoreRule::score).collect(Collectors.toList());
    }

    /** Scores of a metrics component, which never depend on the job. */
    public List<Score> metricsScores() {
        return scores.stream().map(ScoreRule::score).collect(Collectors.toList());
    }

    /**
     * Parses {@code name=FIELD|score:value|score:value:FIELD~REGEX|if:FIELD~REGEX}, comma
     * separated. A field of {@value #FROM_METRICS} marks a component supplied by the metrics
     * system. Patterns here cannot contain {@code ,} or {@code |}.
     */
    public static List<ComponentRule> parseList(String text) {
        List<ComponentRule> rules = new ArrayList<>();
        if (text == null || text.isBlank()) return rules;
        for (String item : text.split(",")) {
            String spec = item.trim();
            if (spec.isEmpty()) continue;
            String[] parts = spec.split("\\|");
            int eq = parts[0].indexOf('=');
            if (eq <= 0 || eq == parts[0].length() - 1) {
                throw new IllegalArgumentException("component rule must look like name=FIELD: " + spec);
            }
            String name = parts[0].substring(0, eq).trim();
            String field = parts[0].substring(eq + 1).trim();
            List<ScoreRule> scores = new ArrayList<>();
            JobCondition onlyIf = null;
            for (int i = 1; i < parts.length; i++) {
                String part = parts[i].trim();
                if (part.startsWith("if:")) {
                    onlyIf = JobCondition.parse(part.substring(3).trim());
                    continue;
                }
                String[] kv = part.split(":", 3);
                if (kv.length < 2) throw new IllegalArgumentException("score must look like name:value: " + part);
                Score score = new Score(kv[0].trim(), Double.parseDouble(kv[1].trim()));
                scores.add(new ScoreRule(score, kv.length == 3 ? JobCondition.parse(kv[2].trim()) : null));
            }
            rules.add(new ComponentRule(name, FROM_METRICS.equals(field) ? null : field, scores, onlyIf));
        }
        return rules;
    }
}
