package io.accounting.jdbc;

import io.accounting.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Set;

/**
 * JDBC connection source plus the schema bootstrap and transaction helper used by the record
 * store and the collector's local queue.
 */
public class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    /** SQLState reported for unique constraint violations. */
    public static final String UNIQUE_VIOLATION = "23505";

    // H2: concurrent update, lock timeout
    private static final Set<String> TRANSIENT_STATES = Set.of("90131", "HYT00");

    private final String jdbcUrl;
    private final String user;
    private final String password;

    public Database(String jdbcUrl, String user, String password) {
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
    }

    public String url() { return jdbcUrl; }

    public Connection connect() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection c) throws SQLException;
    }

    /**
     * Runs {@code work} in one transaction; any failure rolls it back and is rethrown.
     */
    public <T> T inTransaction(SqlWork<T> work) throws SQLException {
        try (Connection c = connect()) {
            c.setAutoCommit(false);
            try {
                T result = work.run(c);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            }
        }
    }

    /**
     * Executes a classpath SQL script of {@code ;}-terminated statements. Statements must be
     * idempotent ({@code IF NOT EXISTS}) since this runs at every start.
     */
    public void migrate(String resource) {
        String script;
        try (InputStream in = Database.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new PersistenceException("schema script not found on classpath: " + resource);
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PersistenceException("cannot read schema script " + resource, e);
        }
        try (Connection c = connect(); Statement st = c.createStatement()) {
            for (String sql : script.split(";")) {
                if (!sql.isBlank()) st.execute(sql.trim());
            }
        } catch (SQLException e) {
            throw new PersistenceException("cannot apply schema " + resource + " to " + jdbcUrl, e);
        }
        log.info("schema {} applied to {}", resource, jdbcUrl);
    }

    public static boolean isUniqueViolation(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            if (UNIQUE_VIOLATION.equals(cur.getSQLState())) return true;
        }
        return false;
    }

    /**
     * Serialization failures and lock conflicts between concurrent writers; the transaction can
     * be retried as a whole.
     */
    public static boolean isTransient(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            String state = cur.getSQLState();
            if (state != null && (state.startsWith("40") || TRANSIENT_STATES.contains(state))) return true;
        }
        return false;
    }

    public static OffsetDateTime utc(Instant t) {
        return t == null ? null : t.atOffset(ZoneOffset.UTC);
    }

    public static Instant instant(OffsetDateTime t) {
        return t == null ? null : t.toInstant();
    }

    /** Closes JDBC resources in order, logging rather than masking the caller's outcome. */
    public static void closeAll(AutoCloseable... resources) {
        for (AutoCloseable r : resources) {
            if (r == null) continue;
            try {
                r.close();
            } catch (Exception e) {
                log.warn("failed to close {}: {}", r.getClass().getSimpleName(), e.toString());
            }
        }
    }
}
