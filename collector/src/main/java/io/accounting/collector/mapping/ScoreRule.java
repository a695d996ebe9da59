package io.accounting.collector.mapping;

import io.accounting.collector.source.SourceJob;
import io.accounting.core.Score;

import java.util.Objects;

/** A score attached to a component, only for jobs matching {@code onlyIf} when it is set. */
public record ScoreRule(Score score, JobCondition onlyIf) {
    public ScoreRule {
        Objects.requireNonNull(score, "score");
    }

    public boolean appliesTo(SourceJob job) {
        return onlyIf == null || onlyIf.matches(job);
    }
}
