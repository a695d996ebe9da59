package io.accounting.collector.source.slurm;

import io.accounting.collector.source.Cursor;
import io.accounting.collector.source.JobSource;
import io.accounting.collector.source.SourceJob;
import io.accounting.error.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Asks Slurm's accounting database through {@code sacct}. The command runs with a timeout; a
 * failing or hanging call is reported as an unavailable upstream and retried on the next tick.
 */
public class SlurmJobSource implements JobSource {
    private static final Logger log = LoggerFactory.getLogger(SlurmJobSource.class);
    private static final DateTimeFormatter SACCT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final List<String> command;
    private final SacctOutputParser parser;
    private final ZoneId zone;
    private final Duration timeout;

    /**
     * @param command the sacct executable, optionally with leading arguments
     */
    public SlurmJobSource(List<String> command, SacctOutputParser parser, ZoneId zone, Duration timeout) {
        this.command = List.copyOf(command);
        this.parser = parser;
        this.zone = zone;
        this.timeout = timeout;
    }

    @Override
    public List<SourceJob> fetchAfter(Cursor cursor) {
        String output = run(arguments(cursor));
        return parser.parse(output).stream()
                .filter(cursor::isBefore)
                .sorted(Comparator.comparing(Cursor::of))
                .collect(Collectors.toList());
    }

    List<String> arguments(Cursor cursor) {
        // sacct only has second resolution and -S is inclusive
        LocalDateTime since = LocalDateTime.ofInstant(cursor.modifiedAt().truncatedTo(ChronoUnit.SECONDS), zone);
        List<String> args = new ArrayList<>(command);
        args.add("--allusers");
        args.add("--parsable2");
        args.add("--noheader");
        args.add("--format=" + String.join(",", parser.fields()));
        args.add("--starttime=" + SACCT_TIME.format(since));
        args.add("--endtime=now");
        return args;
    }

    private String run(List<String> args) {
        Process process;
        try {
            process = new ProcessBuilder(args).redirectErrorStream(false).start();
        } catch (IOException e) {
            throw new UpstreamUnavailableException("cannot start " + args.get(0) + ": " + e.getMessage(), e);
        }
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new UpstreamUnavailableException("sacct did not finish within " + timeout);
            }
            if (process.exitValue() != 0) {
                throw new UpstreamUnavailableException("sacct exited with " + process.exitValue() + ": " + stderr.get().trim());
            }
            String out = stdout.get();
            log.debug("sacct returned {} bytes", out.length());
            return out;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("interrupted while waiting for sacct", e);
        } catch (ExecutionException e) {
            throw new UpstreamUnavailableException("cannot read sacct output", e.getCause());
        }
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
