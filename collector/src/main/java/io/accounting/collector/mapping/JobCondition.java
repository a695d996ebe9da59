package io.accounting.collector.mapping;

import io.accounting.collector.source.SourceJob;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A regular expression that a field of the job has to match somewhere, written
 * {@code FIELD~REGEX}. A job without the field never matches.
 */
public final class JobCondition {
    private final String field;
    private final Pattern pattern;

    public JobCondition(String field, Pattern pattern) {
        this.field = Objects.requireNonNull(field, "field");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    public static JobCondition parse(String text) {
        int tilde = text.indexOf('~');
        if (tilde <= 0 || tilde == text.length() - 1) {
            throw new IllegalArgumentException("condition must look like FIELD~REGEX: " + text);
        }
        String field = text.substring(0, tilde).trim();
        try {
            return new JobCondition(field, Pattern.compile(text.substring(tilde + 1)));
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("invalid pattern for " + field + ": " + e.getMessage(), e);
        }
    }

    public String field() { return field; }

    public Pattern pattern() { return pattern; }

    public boolean matches(SourceJob job) {
        return job.field(field).map(v -> pattern.matcher(v).find()).orElse(false);
    }

    @Override
    public String toString() { return field + "~" + pattern.pattern(); }
}
