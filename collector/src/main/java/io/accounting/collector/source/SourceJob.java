package io.accounting.collector.source;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * A job as reported by the batch system. {@code fields} carries the raw accounting columns the
 * record mapper may pick meta values and component amounts from.
 *
 * @param endTime null while the job is running
 */
public record SourceJob(String jobId, Instant startTime, Instant endTime, String state, Map<String, String> fields) {
    public SourceJob {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public boolean isRunning() { return endTime == null; }

    /** Last change of the job: its end once finished, its start before. */
    public Instant modifiedAt() { return endTime != null ? endTime : startTime; }

    public Optional<String> field(String name) {
        String v = fields.get(name);
        return v == null || v.isBlank() ? Optional.empty() : Optional.of(v);
    }
}
