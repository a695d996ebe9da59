package io.accounting.collector.source;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Bookmark of the last collected job: its modification time, with the job id breaking ties
 * between jobs modified in the same instant.
 */
public record Cursor(Instant modifiedAt, String jobId) implements Comparable<Cursor> {
    private static final Comparator<Cursor> ORDER = Comparator.comparing(Cursor::modifiedAt).thenComparing(Cursor::jobId);

    public Cursor {
        Objects.requireNonNull(modifiedAt, "modifiedAt");
        jobId = jobId == null ? "" : jobId;
    }

    /** Cursor before every job modified at or after {@code earliest}. */
    public static Cursor startingAt(Instant earliest) {
        return new Cursor(earliest, "");
    }

    public static Cursor of(SourceJob job) {
        return new Cursor(job.modifiedAt(), job.jobId());
    }

    public boolean isBefore(SourceJob job) {
        return compareTo(of(job)) < 0;
    }

    @Override
    public int compareTo(Cursor o) {
        return ORDER.compare(this, o);
    }
}
