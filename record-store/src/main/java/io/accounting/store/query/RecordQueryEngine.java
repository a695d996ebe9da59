package io.accounting.store.query;

import com.codahale.metrics.Timer;
import io.accounting.core.Record;
import io.accounting.error.PersistenceException;
import io.accounting.jdbc.Database;
import io.accounting.metrics.Metrics;
import io.accounting.query.RecordQuery;
import io.accounting.query.RecordQueryParser;
import io.accounting.store.RecordRows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Executes record queries. Results are read row by row from an open cursor, so callers must
 * close the returned stream (try-with-resources) to release the connection.
 */
public class RecordQueryEngine {
    private static final Logger log = LoggerFactory.getLogger(RecordQueryEngine.class);
    private static final int FETCH_SIZE = 256;

    private final Database db;
    private final Timer queryTimer;

    public RecordQueryEngine(Database db, Metrics metrics) {
        this.db = db;
        this.queryTimer = metrics.timer("store.query.time");
    }

    /** Parses and runs a raw {@code GET /records} query string. */
    public Stream<Record> stream(String rawQuery) {
        return stream(RecordQueryParser.parse(rawQuery));
    }

    public Stream<Record> stream(RecordQuery query) {
        SqlQuery sql = SqlQuery.of(query);
        log.debug("query {} -> {} with {} parameters", query, sql.sql(), sql.params().size());
        Connection c = null;
        PreparedStatement ps = null;
        ResultSet rs;
        try (Timer.Context ignored = queryTimer.time()) {
            c = db.connect();
            ps = c.prepareStatement(sql.sql());
            sql.bind(ps);
            ps.setFetchSize(query.limit().isPresent() ? Math.min(FETCH_SIZE, query.limit().getAsInt()) : FETCH_SIZE);
            rs = ps.executeQuery();
        } catch (SQLException e) {
            Database.closeAll(ps, c);
            throw new PersistenceException("query failed: " + query, e);
        }
        Connection conn = c;
        PreparedStatement stmt = ps;
        ResultSet rows = rs;
        return StreamSupport.stream(new RowSpliterator(rows), false)
                .onClose(() -> Database.closeAll(rows, stmt, conn));
    }

    private static final class RowSpliterator extends Spliterators.AbstractSpliterator<Record> {
        private final ResultSet rs;

        RowSpliterator(ResultSet rs) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.rs = rs;
        }

        @Override
        public boolean tryAdvance(Consumer<? super Record> action) {
            try {
                if (!rs.next()) return false;
                action.accept(RecordRows.map(rs));
                return true;
            } catch (SQLException e) {
                throw new PersistenceException("failed reading query results", e);
            }
        }
    }
}
