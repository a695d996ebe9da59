package io.accounting.json;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.accounting.core.Component;
import io.accounting.core.Meta;
import io.accounting.core.Record;
import io.accounting.core.Score;
import io.accounting.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RecordJsonTest {
    @Test
    void writes_derived_runtime_and_utc_timestamps() {
        Record r = Record.builder("slurm-42", Instant.parse("2024-01-01T10:00:00Z"))
                .stopTime(Instant.parse("2024-01-01T11:00:00Z"))
                .meta(Meta.builder().put("site", "KIT").build())
                .component(Component.of("cpu", 8, new Score("hepspec", 10.0)))
                .build();
        ObjectNode json = RecordJson.toJson(r);

        assertEquals("slurm-42", json.get("record_id").asText());
        assertEquals(3600, json.get("runtime").asLong());
        assertEquals("2024-01-01T10:00:00Z", json.get("start_time").asText());
        assertEquals("KIT", json.get("meta").get("site").get(0).asText());
        assertEquals(10.0, json.get("components").get(0).get("scores").get(0).get("value").asDouble());
        assertTrue(json.get("updated_at").isNull());
        assertEquals(r, RecordJson.fromJson(json.toString()));
    }

    @Test
    void reads_offsets_and_ignores_client_runtime() {
        Record r = RecordJson.fromJson("{\"record_id\":\"a\",\"start_time\":\"2024-01-01T12:00:00+02:00\","
                + "\"stop_time\":\"2024-01-01T10:00:30Z\",\"runtime\":99999,"
                + "\"meta\":{\"site\":[\"B\",\"A\"]},\"components\":[{\"name\":\"cpu\",\"amount\":4}]}");
        assertEquals(Instant.parse("2024-01-01T10:00:00Z"), r.startTime());
        assertEquals(30L, r.runtime().orElseThrow());
        assertEquals(List.of("B", "A"), r.meta().get("site"));
        assertTrue(r.components().get(0).scores().isEmpty());
    }

    @Test
    void malformed_input_is_a_validation_error() {
        assertThrows(ValidationException.class, () -> RecordJson.fromJson("{not json"));
        assertThrows(ValidationException.class, () -> RecordJson.fromJson("[]"));
        assertThrows(ValidationException.class, () -> RecordJson.fromJson("{\"record_id\":\"a\",\"start_time\":\"yesterday\"}"));
        assertThrows(ValidationException.class, () -> RecordJson.fromJson("{\"record_id\":\"a\",\"start_time\":\"2024-01-01T00:00:00Z\",\"meta\":{\"site\":\"A\"}}"));
        assertThrows(ValidationException.class, () -> RecordJson.fromJson("{\"record_id\":\"a\",\"start_time\":\"2024-01-01T00:00:00Z\",\"components\":[{\"name\":\"cpu\",\"amount\":1.5}]}"));
    }
}
