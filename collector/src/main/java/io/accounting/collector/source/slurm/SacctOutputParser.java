package io.accounting.collector.source.slurm;

import io.accounting.collector.source.SourceJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads {@code sacct --parsable2 --noheader} output. Columns follow {@link #fields()}; job steps
 * ({@code 42.batch}, {@code 42.0}) and jobs that have not started are skipped, an {@code Unknown}
 * end marks a running job.
 */
public class SacctOutputParser {
    private static final Logger log = LoggerFactory.getLogger(SacctOutputParser.class);

    public static final String JOB_ID = "JobID";
    public static final String STATE = "State";
    public static final String START = "Start";
    public static final String END = "End";

    private static final List<String> REQUIRED = List.of(JOB_ID, STATE, START, END);
    private static final Set<String> NO_TIME = Set.of("Unknown", "None", "");

    private final List<String> fields;
    private final ZoneId zone;

    public SacctOutputParser(List<String> extraFields, ZoneId zone) {
        Set<String> all = new LinkedHashSet<>(REQUIRED);
        all.addAll(extraFields);
        this.fields = List.copyOf(all);
        this.zone = zone;
    }

    /** Column list for {@code --format}. */
    public List<String> fields() { return fields; }

    public List<SourceJob> parse(String output) {
        List<SourceJob> jobs = new ArrayList<>();
        int lineNo = 0;
        for (String line : output.split("\\R")) {
            lineNo++;
            if (line.isBlank()) continue;
            String[] cols = line.split("\\|", -1);
            if (cols.length != fields.size()) {
                log.warn("sacct line {} has {} columns, expected {}: {}", lineNo, cols.length, fields.size(), line);
                continue;
            }
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < cols.length; i++) values.put(fields.get(i), cols[i].trim());

            String jobId = values.get(JOB_ID);
            if (jobId.isEmpty() || jobId.contains(".")) continue;
            try {
                Instant start = time(values.get(START));
                if (start == null) continue;
                jobs.add(new SourceJob(jobId, start, time(values.get(END)), values.get(STATE), values));
            } catch (DateTimeParseException e) {
                log.warn("sacct line {} has an unreadable timestamp: {}", lineNo, line);
            }
        }
        return jobs;
    }

    private Instant time(String text) {
        if (text == null || NO_TIME.contains(text)) return null;
        return LocalDateTime.parse(text).atZone(zone).toInstant();
    }
}
