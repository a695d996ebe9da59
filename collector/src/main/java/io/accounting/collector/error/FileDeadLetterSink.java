package io.accounting.collector.error;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.accounting.collector.queue.QueueEntry;
import io.accounting.collector.source.SourceJob;
import io.accounting.core.Timestamps;
import io.accounting.error.AccountingException;
import io.accounting.error.PersistenceException;
import io.accounting.json.JsonSupport;
import io.accounting.json.RecordJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;

/**
 * Appends one JSON line per rejected entry or unmappable job. The entry leaves the queue, and the
 * collect cursor moves past the job, only after its line is written, so a failed write is a
 * persistence failure.
 */
public class FileDeadLetterSink implements DeadLetterSink {
    private static final Logger log = LoggerFactory.getLogger(FileDeadLetterSink.class);

    private final Path file;
    private final Clock clock;

    public FileDeadLetterSink(Path file, Clock clock) throws IOException {
        this.file = file;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    public Path file() { return file; }

    @Override
    public synchronized void acceptFailure(String stage, QueueEntry entry, Exception e) {
        ObjectNode line = JsonSupport.MAPPER.createObjectNode()
                .put("ts", Timestamps.format(clock.instant()))
                .put("stage", stage)
                .put("seq", entry.seq())
                .put("kind", entry.kind().name())
                .put("record_id", entry.recordId())
                .put("attempts", entry.attempts())
                .put("error", errorName(e))
                .put("message", e.getMessage());
        entry.record().ifPresent(r -> line.set("record", RecordJson.toJson(r)));
        entry.stopTime().ifPresent(t -> line.put("stop_time", Timestamps.format(t)));
        append(line, entry.recordId());
        log.warn("{} entry {} for {} dead-lettered: {}", stage, entry.seq(), entry.recordId(), e.getMessage());
    }

    @Override
    public synchronized void acceptJob(String stage, SourceJob job, Exception e) {
        ObjectNode line = JsonSupport.MAPPER.createObjectNode()
                .put("ts", Timestamps.format(clock.instant()))
                .put("stage", stage)
                .put("job_id", job.jobId())
                .put("state", job.state())
                .put("start_time", Timestamps.format(job.startTime()))
                .put("error", errorName(e))
                .put("message", e.getMessage());
        if (job.endTime() != null) line.put("end_time", Timestamps.format(job.endTime()));
        ObjectNode fields = line.putObject("fields");
        job.fields().forEach(fields::put);
        append(line, "job " + job.jobId());
        log.warn("{} job {} dead-lettered: {}", stage, job.jobId(), e.getMessage());
    }

    private void append(ObjectNode line, String what) {
        try {
            Files.writeString(file, line + System.lineSeparator(), StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException io) {
            throw new PersistenceException("cannot write dead letter for " + what + " to " + file, io);
        }
    }

    private static String errorName(Exception e) {
        return e instanceof AccountingException ? ((AccountingException) e).kind().name() : e.getClass().getSimpleName();
    }
}
