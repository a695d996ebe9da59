package io.accounting.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.accounting.core.Record;
import io.accounting.error.PersistenceException;
import io.accounting.jdbc.Database;
import io.accounting.json.JsonSupport;
import io.accounting.json.RecordJson;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;

/**
 * Maps {@code accounting_record} rows back to records.
 */
public final class RecordRows {
    public static final String COLUMNS = "r.record_id, r.start_time, r.stop_time, r.meta_json, r.components_json, r.updated_at";

    private RecordRows() {}

    public static Record map(ResultSet rs) throws SQLException {
        String id = rs.getString("record_id");
        try {
            return Record.builder(id, Database.instant(rs.getObject("start_time", OffsetDateTime.class)))
                    .stopTime(Database.instant(rs.getObject("stop_time", OffsetDateTime.class)))
                    .meta(RecordJson.metaFromJson(JsonSupport.MAPPER.readTree(rs.getString("meta_json"))))
                    .components(RecordJson.componentsFromJson(JsonSupport.MAPPER.readTree(rs.getString("components_json"))))
                    .updatedAt(Database.instant(rs.getObject("updated_at", OffsetDateTime.class)))
                    .build();
        } catch (JsonProcessingException e) {
            throw new PersistenceException("stored record " + id + " has unreadable meta or components", e);
        }
    }
}
