package io.accounting.collector.mapping;

import io.accounting.collector.source.SourceJob;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A site a job may be attributed to. Rules are tried in order and the first whose condition
 * holds wins; a rule without a condition matches every job.
 */
public record SiteRule(String name, JobCondition onlyIf) {
    public SiteRule {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("site rule without a name");
    }

    public boolean matches(SourceJob job) {
        return onlyIf == null || onlyIf.matches(job);
    }

    /**
     * Parses {@code NAME|FIELD~REGEX;NAME}, rules separated by {@code ;}. The text after the
     * first {@code |} is the condition, so the pattern may itself contain {@code |}.
     */
    public static List<SiteRule> parseList(String text) {
        List<SiteRule> rules = new ArrayList<>();
        if (text == null || text.isBlank()) return rules;
        for (String item : text.split(";")) {
            String rule = item.trim();
            if (rule.isEmpty()) continue;
            int bar = rule.indexOf('|');
            if (bar < 0) {
                rules.add(new SiteRule(rule, null));
            } else {
                rules.add(new SiteRule(rule.substring(0, bar).trim(), JobCondition.parse(rule.substring(bar + 1).trim())));
            }
        }
        return rules;
    }
}
