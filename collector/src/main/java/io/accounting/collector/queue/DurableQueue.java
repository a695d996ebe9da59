package io.accounting.collector.queue;

import io.accounting.collector.source.Cursor;
import io.accounting.core.Record;
import io.accounting.error.PersistenceException;
import io.accounting.error.ValidationException;
import io.accounting.jdbc.Database;
import io.accounting.json.RecordJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Collector state on local disk: the FIFO send queue, the collect cursor and the set of jobs
 * created open. Backed by an embedded H2 file database under the state directory, written
 * through on every commit.
 *
 * <p>Every failure to read or write this state is a {@link PersistenceException}.
 */
public class DurableQueue implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DurableQueue.class);

    static final String SCHEMA = "db/collector-queue.sql";
    static final String DB_NAME = "collector";

    private static final String COLUMNS =
            "seq, kind, record_id, record_json, stop_time, attempts, due_at, incomplete, enrich_attempts, deadline";

    private final Path stateDir;
    private final Database db;
    private final Connection keepOpen;

    public DurableQueue(Path stateDir) {
        this.stateDir = stateDir.toAbsolutePath();
        try {
            Files.createDirectories(this.stateDir);
        } catch (IOException e) {
            throw new PersistenceException("cannot create state directory " + this.stateDir, e);
        }
        this.db = new Database("jdbc:h2:file:" + this.stateDir.resolve(DB_NAME) + ";WRITE_DELAY=0", null, null);
        try {
            this.keepOpen = db.connect();
        } catch (SQLException e) {
            throw new PersistenceException("cannot open collector state in " + this.stateDir, e);
        }
        try {
            db.migrate(SCHEMA);
        } catch (PersistenceException e) {
            Database.closeAll(keepOpen);
            throw e;
        }
        log.info("collector state opened at {} with {} queued entries", this.stateDir, size());
    }

    public Path stateDir() { return stateDir; }

    public Optional<Cursor> cursor() {
        try (Connection c = db.connect();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT modified_at, job_id FROM collect_cursor WHERE id = 1")) {
            if (!rs.next()) return Optional.empty();
            return Optional.of(new Cursor(Database.instant(rs.getObject(1, OffsetDateTime.class)), rs.getString(2)));
        } catch (SQLException e) {
            throw new PersistenceException("cannot read collect cursor", e);
        }
    }

    public boolean isOpen(String recordId) {
        try (Connection c = db.connect();
             PreparedStatement ps = c.prepareStatement("SELECT 1 FROM open_job WHERE record_id = ?")) {
            ps.setString(1, recordId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new PersistenceException("cannot read open jobs", e);
        }
    }

    /**
     * Appends {@code entries}, records opened and closed jobs and moves the cursor, all in one
     * transaction: after a crash either all of it is on disk or none.
     */
    public void commit(List<QueueEntry> entries, Cursor cursor, Collection<String> opened, Collection<String> closed) {
        try {
            db.inTransaction(c -> {
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO send_queue (kind, record_id, record_json, stop_time, attempts, due_at, incomplete, enrich_attempts, deadline) "
                                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                    for (QueueEntry e : entries) {
                        ps.setString(1, e.kind().name());
                        ps.setString(2, e.recordId());
                        if (e.record().isPresent()) ps.setString(3, RecordJson.toJsonString(e.record().get()));
                        else ps.setNull(3, Types.CLOB);
                        ps.setObject(4, Database.utc(e.stopTime().orElse(null)));
                        ps.setInt(5, e.attempts());
                        ps.setObject(6, Database.utc(e.dueAt()));
                        ps.setBoolean(7, e.incomplete());
                        ps.setInt(8, e.enrichAttempts());
                        ps.setObject(9, Database.utc(e.deadline().orElse(null)));
                        ps.addBatch();
                    }
                    if (!entries.isEmpty()) ps.executeBatch();
                }
                try (PreparedStatement ps = c.prepareStatement("MERGE INTO open_job (record_id) KEY (record_id) VALUES (?)")) {
                    for (String id : opened) {
                        ps.setString(1, id);
                        ps.addBatch();
                    }
                    if (!opened.isEmpty()) ps.executeBatch();
                }
                try (PreparedStatement ps = c.prepareStatement("DELETE FROM open_job WHERE record_id = ?")) {
                    for (String id : closed) {
                        ps.setString(1, id);
                        ps.addBatch();
                    }
                    if (!closed.isEmpty()) ps.executeBatch();
                }
                if (cursor != null) {
                    try (PreparedStatement ps = c.prepareStatement(
                            "MERGE INTO collect_cursor (id, modified_at, job_id) KEY (id) VALUES (1, ?, ?)")) {
                        ps.setObject(1, Database.utc(cursor.modifiedAt()));
                        ps.setString(2, cursor.jobId());
                        ps.executeUpdate();
                    }
                }
                return entries.size();
            });
        } catch (SQLException e) {
            throw new PersistenceException("cannot append " + entries.size() + " entries to the send queue", e);
        }
    }

    /** Oldest entries first, due or not. */
    public List<QueueEntry> peek(int max) {
        List<QueueEntry> out = new ArrayList<>();
        try (Connection c = db.connect();
             PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM send_queue ORDER BY seq FETCH FIRST ? ROWS ONLY")) {
            ps.setInt(1, max);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("cannot read the send queue", e);
        }
    }

    /**
     * Oldest entries that may be attempted at {@code now}: due, and not queued behind an entry of
     * the same record that is still waiting.
     */
    public List<QueueEntry> due(Instant now, int max) {
        List<QueueEntry> out = new ArrayList<>();
        try (Connection c = db.connect();
             PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM send_queue q WHERE q.due_at <= ? "
                     + "AND NOT EXISTS (SELECT 1 FROM send_queue w WHERE w.record_id = q.record_id AND w.seq < q.seq AND w.due_at > ?) "
                     + "ORDER BY q.seq FETCH FIRST ? ROWS ONLY")) {
            ps.setObject(1, Database.utc(now));
            ps.setObject(2, Database.utc(now));
            ps.setInt(3, max);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("cannot read due entries of the send queue", e);
        }
    }

    public long size() {
        try (Connection c = db.connect();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM send_queue")) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new PersistenceException("cannot count the send queue", e);
        }
    }

    public long incompleteCount() {
        try (Connection c = db.connect();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM send_queue WHERE incomplete")) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new PersistenceException("cannot count the backlog", e);
        }
    }

    public void delete(long seq) {
        update("DELETE FROM send_queue WHERE seq = ?", ps -> ps.setLong(1, seq), seq);
    }

    /** Keeps the entry for a later attempt. */
    public void reschedule(long seq, int attempts, Instant dueAt) {
        update("UPDATE send_queue SET attempts = ?, due_at = ? WHERE seq = ?", ps -> {
            ps.setInt(1, attempts);
            ps.setObject(2, Database.utc(dueAt));
            ps.setLong(3, seq);
        }, seq);
    }

    /** Counts a failed enrichment of an incomplete entry and parks it until {@code dueAt}. */
    public void deferEnrichment(long seq, int enrichAttempts, Instant dueAt) {
        update("UPDATE send_queue SET enrich_attempts = ?, due_at = ? WHERE seq = ?", ps -> {
            ps.setInt(1, enrichAttempts);
            ps.setObject(2, Database.utc(dueAt));
            ps.setLong(3, seq);
        }, seq);
    }

    /** Stores the final form of a backlog entry; it is never enriched again. */
    public void complete(long seq, Record record) {
        update("UPDATE send_queue SET record_json = ?, incomplete = FALSE WHERE seq = ?", ps -> {
            ps.setString(1, RecordJson.toJsonString(record));
            ps.setLong(2, seq);
        }, seq);
    }

    @Override
    public void close() {
        Database.closeAll(keepOpen);
        log.info("collector state at {} closed", stateDir);
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private void update(String sql, Binder binder, long seq) {
        try (Connection c = db.connect(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("cannot update send queue entry " + seq, e);
        }
    }

    private static QueueEntry map(ResultSet rs) throws SQLException {
        long seq = rs.getLong("seq");
        String json = rs.getString("record_json");
        Record record;
        try {
            record = json == null ? null : RecordJson.fromJson(json);
        } catch (ValidationException e) {
            throw new PersistenceException("send queue entry " + seq + " holds an unreadable record", e);
        }
        EntryKind kind;
        try {
            kind = EntryKind.valueOf(rs.getString("kind"));
        } catch (IllegalArgumentException e) {
            throw new PersistenceException("send queue entry " + seq + " has unknown kind " + rs.getString("kind"), e);
        }
        return new QueueEntry(
                seq,
                kind,
                rs.getString("record_id"),
                record,
                Database.instant(rs.getObject("stop_time", OffsetDateTime.class)),
                rs.getInt("attempts"),
                Database.instant(rs.getObject("due_at", OffsetDateTime.class)),
                rs.getBoolean("incomplete"),
                rs.getInt("enrich_attempts"),
                Database.instant(rs.getObject("deadline", OffsetDateTime.class)));
    }
}
