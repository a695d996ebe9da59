package io.accounting.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.accounting.core.Component;
import io.accounting.core.Meta;
import io.accounting.core.Record;
import io.accounting.core.Score;
import io.accounting.core.Timestamps;
import io.accounting.error.ValidationException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Wire format of a record:
 * <pre>
 * {"record_id": "...", "meta": {"site": ["A"]},
 *  "components": [{"name": "cpu", "amount": 8, "scores": [{"name": "hepspec", "value": 10.0}]}],
 *  "start_time": "...", "stop_time": "...", "runtime": 3600, "updated_at": "..."}
 * </pre>
 * {@code runtime} is written for readers but ignored when reading.
 */
public final class RecordJson {
    private RecordJson() {}

    public static ObjectNode toJson(Record r) {
        ObjectNode node = JsonSupport.MAPPER.createObjectNode();
        node.put("record_id", r.recordId());
        node.set("meta", metaToJson(r.meta()));
        node.set("components", componentsToJson(r.components()));
        node.put("start_time", Timestamps.format(r.startTime()));
        putTime(node, "stop_time", r.stopTime().orElse(null));
        if (r.runtime().isPresent()) node.put("runtime", r.runtime().get());
        else node.putNull("runtime");
        putTime(node, "updated_at", r.updatedAt().orElse(null));
        return node;
    }

    public static String toJsonString(Record r) {
        return toJson(r).toString();
    }

    public static Record fromJson(String json) {
        JsonNode node;
        try {
            node = JsonSupport.MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException("malformed record JSON: " + e.getOriginalMessage());
        }
        return fromJson(node);
    }

    public static Record fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ValidationException("record must be a JSON object");
        }
        Record.Builder b = new Record.Builder()
                .recordId(text(node, "record_id"))
                .startTime(time(node, "start_time"))
                .stopTime(time(node, "stop_time"))
                .updatedAt(time(node, "updated_at"));
        JsonNode meta = node.get("meta");
        if (meta != null && !meta.isNull()) b.meta(metaFromJson(meta));
        JsonNode components = node.get("components");
        if (components != null && !components.isNull()) b.components(componentsFromJson(components));
        return b.build();
    }

    public static ObjectNode metaToJson(Meta meta) {
        ObjectNode node = JsonSupport.MAPPER.createObjectNode();
        for (Map.Entry<String, List<String>> e : meta.asMap().entrySet()) {
            ArrayNode values = node.putArray(e.getKey());
            e.getValue().forEach(values::add);
        }
        return node;
    }

    public static ArrayNode componentsToJson(List<Component> components) {
        ArrayNode arr = JsonSupport.MAPPER.createArrayNode();
        for (Component c : components) {
            ObjectNode cn = arr.addObject();
            cn.put("name", c.name());
            cn.put("amount", c.amount());
            ArrayNode scores = cn.putArray("scores");
            for (Score s : c.scores()) {
                scores.addObject().put("name", s.name()).put("value", s.value());
            }
        }
        return arr;
    }

    public static List<Component> componentsFromJson(JsonNode node) {
        if (!node.isArray()) throw new ValidationException("components must be an array");
        List<Component> out = new ArrayList<>();
        for (JsonNode c : node) out.add(component(c));
        return out;
    }

    /** Reads the stop time of a close request; the record body must carry one. */
    public static Instant requiredStopTime(JsonNode node) {
        Instant stop = node == null ? null : time(node, "stop_time");
        if (stop == null) throw new ValidationException("close requires stop_time");
        return stop;
    }

    public static Meta metaFromJson(JsonNode node) {
        if (!node.isObject()) throw new ValidationException("meta must be an object of string arrays");
        Meta.Builder b = Meta.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            if (!f.getValue().isArray()) {
                throw new ValidationException("meta " + f.getKey() + " must be an array of strings");
            }
            List<String> values = new ArrayList<>();
            for (JsonNode v : f.getValue()) {
                if (!v.isTextual()) throw new ValidationException("meta " + f.getKey() + " holds a non-string value");
                values.add(v.asText());
            }
            b.put(f.getKey(), values);
        }
        return b.build();
    }

    private static Component component(JsonNode node) {
        if (!node.isObject()) throw new ValidationException("component must be an object");
        JsonNode amount = node.get("amount");
        if (amount == null || !amount.isIntegralNumber() || !amount.canConvertToLong()) {
            throw new ValidationException("component amount must be a 64-bit integer");
        }
        List<Score> scores = new ArrayList<>();
        JsonNode sn = node.get("scores");
        if (sn != null && !sn.isNull()) {
            if (!sn.isArray()) throw new ValidationException("scores must be an array");
            for (JsonNode s : sn) {
                JsonNode value = s.get("value");
                if (value == null || !value.isNumber()) throw new ValidationException("score value must be a number");
                scores.add(new Score(text(s, "name"), value.asDouble()));
            }
        }
        return new Component(text(node, "name"), amount.asLong(), scores);
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.isTextual()) throw new ValidationException(field + " must be a string");
        return v.asText();
    }

    private static Instant time(JsonNode node, String field) {
        String v = text(node, field);
        if (v == null) return null;
        try {
            return Timestamps.parse(v);
        } catch (DateTimeParseException e) {
            throw new ValidationException(field + " is not an RFC 3339 timestamp: " + v);
        }
    }

    private static void putTime(ObjectNode node, String field, Instant t) {
        if (t == null) node.putNull(field);
        else node.put(field, Timestamps.format(t));
    }
}
