package io.accounting.store;

import com.codahale.metrics.Counter;
import io.accounting.core.BulkOutcome;
import io.accounting.core.CloseOutcome;
import io.accounting.core.Component;
import io.accounting.core.CreateOutcome;
import io.accounting.core.Record;
import io.accounting.core.RecordIngest;
import io.accounting.error.AccountingException;
import io.accounting.error.ConflictException;
import io.accounting.error.ErrorKind;
import io.accounting.error.NotFoundException;
import io.accounting.error.PersistenceException;
import io.accounting.error.ValidationException;
import io.accounting.jdbc.Database;
import io.accounting.json.RecordJson;
import io.accounting.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Record store over JDBC. Each operation runs in its own transaction and duplicate detection
 * relies on the unique constraint on {@code record_id}, so concurrent creates of the same id
 * resolve to exactly one creation.
 */
public class JdbcRecordStore implements RecordIngest {
    private static final Logger log = LoggerFactory.getLogger(JdbcRecordStore.class);

    public static final String LENIENT_WARNING = "Record already exists, but the error was ignored because the store runs in lenient mode.";

    private static final int MAX_INSERT_ATTEMPTS = 3;

    private final Database db;
    private final boolean lenient;
    private final Clock clock;
    private final Counter created;
    private final Counter duplicates;
    private final Counter closed;

    public JdbcRecordStore(Database db, boolean lenient, Clock clock, Metrics metrics) {
        this.db = Objects.requireNonNull(db);
        this.lenient = lenient;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.created = metrics.counter("store.records.created");
        this.duplicates = metrics.counter("store.records.duplicates");
        this.closed = metrics.counter("store.records.closed");
    }

    public boolean isLenient() { return lenient; }

    @Override
    public CreateOutcome createOrOpen(Record record) {
        if (insert(record)) return CreateOutcome.CREATED;
        if (lenient) {
            log.warn("record {} already exists, ignored in lenient mode", record.recordId());
            return CreateOutcome.ALREADY_EXISTS;
        }
        throw new ConflictException("record " + record.recordId() + " already exists");
    }

    @Override
    public CloseOutcome close(String recordId, Instant stopTime) {
        Objects.requireNonNull(stopTime, "stopTime");
        Instant stop = stopTime.truncatedTo(ChronoUnit.MICROS);
        try {
            CloseOutcome outcome = db.inTransaction(c -> {
                Instant start;
                Instant current;
                try (PreparedStatement ps = c.prepareStatement(
                        "SELECT start_time, stop_time FROM accounting_record WHERE record_id = ? FOR UPDATE")) {
                    ps.setString(1, recordId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) throw new NotFoundException("record " + recordId + " does not exist");
                        start = Database.instant(rs.getObject(1, OffsetDateTime.class));
                        current = Database.instant(rs.getObject(2, OffsetDateTime.class));
                    }
                }
                if (stop.isBefore(start)) {
                    throw new ValidationException("record " + recordId + " cannot stop at " + stop + " before its start " + start);
                }
                if (stop.equals(current)) return CloseOutcome.UNCHANGED;
                if (current != null) {
                    log.info("record {} stop time replaced: {} -> {}", recordId, current, stop);
                }
                try (PreparedStatement ps = c.prepareStatement(
                        "UPDATE accounting_record SET stop_time = ?, runtime = ?, updated_at = ? WHERE record_id = ?")) {
                    ps.setObject(1, Database.utc(stop));
                    ps.setLong(2, Record.runtimeSeconds(start, stop));
                    ps.setObject(3, Database.utc(now()));
                    ps.setString(4, recordId);
                    ps.executeUpdate();
                }
                return CloseOutcome.CLOSED;
            });
            if (outcome == CloseOutcome.CLOSED) closed.inc();
            return outcome;
        } catch (SQLException e) {
            throw new PersistenceException("could not close record " + recordId, e);
        }
    }

    @Override
    public Record get(String recordId) {
        try (Connection c = db.connect();
             PreparedStatement ps = c.prepareStatement("SELECT " + RecordRows.COLUMNS + " FROM accounting_record r WHERE r.record_id = ?")) {
            ps.setString(1, recordId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) throw new NotFoundException("record " + recordId + " does not exist");
                return RecordRows.map(rs);
            }
        } catch (SQLException e) {
            throw new PersistenceException("could not read record " + recordId, e);
        }
    }

    /**
     * Creates every element independently. Duplicates are reported as already existing in both
     * strict and lenient mode; a failure of one element never undoes another.
     */
    @Override
    public List<BulkOutcome> bulkCreate(List<Record> records) {
        List<BulkOutcome> out = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            Record r = records.get(i);
            try {
                if (insert(r)) {
                    out.add(BulkOutcome.created(i, r.recordId()));
                } else if (lenient) {
                    out.add(BulkOutcome.alreadyExists(i, r.recordId()));
                } else {
                    out.add(BulkOutcome.rejected(i, r.recordId(), ErrorKind.CONFLICT, "record " + r.recordId() + " already exists"));
                }
            } catch (AccountingException e) {
                log.error("bulk element {} ({}) rejected: {}", i, r.recordId(), e.getMessage());
                out.add(BulkOutcome.rejected(i, r.recordId(), e.kind(), e.getMessage()));
            }
        }
        return out;
    }

    public long count() {
        try (Connection c = db.connect();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM accounting_record")) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new PersistenceException("could not count records", e);
        }
    }

    /** Number of records per value of a meta key, e.g. records per site. */
    public Map<String, Long> countByMetaValue(String key) {
        String sql = "SELECT meta_value, COUNT(DISTINCT record_pk) FROM record_meta WHERE meta_key = ? GROUP BY meta_value ORDER BY meta_value";
        Map<String, Long> counts = new LinkedHashMap<>();
        try (Connection c = db.connect(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) counts.put(rs.getString(1), rs.getLong(2));
            }
            return counts;
        } catch (SQLException e) {
            throw new PersistenceException("could not count records by " + key, e);
        }
    }

    /**
     * @return false when a record with the same id already exists
     */
    private boolean insert(Record r) {
        for (int attempt = 1; ; attempt++) {
            try {
                db.inTransaction(c -> {
                    long pk = insertRow(c, r);
                    insertMeta(c, pk, r);
                    insertComponents(c, pk, r.components());
                    return pk;
                });
                created.inc();
                return true;
            } catch (SQLException e) {
                if (Database.isUniqueViolation(e)) {
                    duplicates.inc();
                    return false;
                }
                if (attempt < MAX_INSERT_ATTEMPTS && Database.isTransient(e)) {
                    log.debug("retrying insert of {} after transient failure: {}", r.recordId(), e.getMessage());
                    continue;
                }
                throw new PersistenceException("could not store record " + r.recordId(), e);
            }
        }
    }

    private long insertRow(Connection c, Record r) throws SQLException {
        String sql = "INSERT INTO accounting_record (record_id, start_time, stop_time, runtime, meta_json, components_json, updated_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, r.recordId());
            ps.setObject(2, Database.utc(r.startTime()));
            ps.setObject(3, Database.utc(r.stopTime().orElse(null)));
            if (r.runtime().isPresent()) ps.setLong(4, r.runtime().get());
            else ps.setNull(4, Types.BIGINT);
            ps.setString(5, RecordJson.metaToJson(r.meta()).toString());
            ps.setString(6, RecordJson.componentsToJson(r.components()).toString());
            ps.setObject(7, Database.utc(now()));
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new SQLException("no key generated for record " + r.recordId());
                return keys.getLong(1);
            }
        }
    }

    private void insertMeta(Connection c, long pk, Record r) throws SQLException {
        if (r.meta().isEmpty()) return;
        String sql = "INSERT INTO record_meta (record_pk, meta_key, meta_value, key_position, value_position) VALUES (?, ?, ?, ?, ?)";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            int keyPos = 0;
            for (Map.Entry<String, List<String>> e : r.meta().asMap().entrySet()) {
                int valuePos = 0;
                for (String v : e.getValue()) {
                    ps.setLong(1, pk);
                    ps.setString(2, e.getKey());
                    ps.setString(3, v);
                    ps.setInt(4, keyPos);
                    ps.setInt(5, valuePos++);
                    ps.addBatch();
                }
                keyPos++;
            }
            ps.executeBatch();
        }
    }

    private void insertComponents(Connection c, long pk, List<Component> components) throws SQLException {
        if (components.isEmpty()) return;
        String sql = "INSERT INTO record_component (record_pk, component_name, amount, component_position) VALUES (?, ?, ?, ?)";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            int pos = 0;
            for (Component comp : components) {
                ps.setLong(1, pk);
                ps.setString(2, comp.name());
                ps.setLong(3, comp.amount());
                ps.setInt(4, pos++);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
