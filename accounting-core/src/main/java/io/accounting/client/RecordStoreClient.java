package io.accounting.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.accounting.core.BulkOutcome;
import io.accounting.core.CloseOutcome;
import io.accounting.core.CreateOutcome;
import io.accounting.core.Record;
import io.accounting.core.RecordIngest;
import io.accounting.core.Timestamps;
import io.accounting.error.AccountingException;
import io.accounting.error.ErrorKind;
import io.accounting.error.UpstreamUnavailableException;
import io.accounting.json.JsonSupport;
import io.accounting.json.RecordJson;
import io.accounting.query.RecordQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP client for the record store API.
 *
 * <p>Store-side failures come back as the matching typed exception. Connection errors, timeouts
 * and server errors become {@link UpstreamUnavailableException}; a request that timed out may
 * still have been applied, which the store's idempotency absorbs on the retry.
 */
public class RecordStoreClient implements RecordIngest {
    private static final Logger log = LoggerFactory.getLogger(RecordStoreClient.class);

    private final HttpClient client;
    private final URI base;
    private final Duration timeout;

    public RecordStoreClient(URI base, Duration timeout) {
        this.timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
        this.client = HttpClient.newBuilder().connectTimeout(this.timeout).build();
        String s = base.toString();
        this.base = URI.create(s.endsWith("/") ? s.substring(0, s.length() - 1) : s);
    }

    @Override
    public CreateOutcome createOrOpen(Record record) {
        JsonNode body = send(request("/record")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(RecordJson.toJsonString(record))));
        CreateOutcome outcome = CreateOutcome.valueOf(body.path("outcome").asText("CREATED"));
        if (outcome == CreateOutcome.ALREADY_EXISTS) {
            log.debug("store reported {} as already existing: {}", record.recordId(), body.path("warning").asText());
        }
        return outcome;
    }

    @Override
    public CloseOutcome close(String recordId, Instant stopTime) {
        ObjectNode req = JsonSupport.MAPPER.createObjectNode()
                .put("record_id", recordId)
                .put("stop_time", Timestamps.format(stopTime));
        JsonNode body = send(request("/record")
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(req.toString())));
        return CloseOutcome.valueOf(body.path("outcome").asText("CLOSED"));
    }

    @Override
    public Record get(String recordId) {
        String path = "/record/" + URLEncoder.encode(recordId, StandardCharsets.UTF_8).replace("+", "%20");
        return RecordJson.fromJson(send(request(path).GET()));
    }

    @Override
    public List<BulkOutcome> bulkCreate(List<Record> records) {
        ArrayNode arr = JsonSupport.MAPPER.createArrayNode();
        records.forEach(r -> arr.add(RecordJson.toJson(r)));
        JsonNode body = send(request("/records")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(arr.toString())));
        List<BulkOutcome> out = new ArrayList<>();
        for (JsonNode n : body) {
            String kind = n.path("error").asText(null);
            out.add(new BulkOutcome(
                    n.path("index").asInt(),
                    n.path("record_id").asText(null),
                    BulkOutcome.Status.valueOf(n.path("status").asText()),
                    kind == null ? null : ErrorKind.valueOf(kind),
                    n.path("message").asText(null)));
        }
        return out;
    }

    public List<Record> query(RecordQuery query) {
        String qs = query.toQueryString();
        JsonNode body = send(request(qs.isEmpty() ? "/records" : "/records?" + qs).GET());
        List<Record> out = new ArrayList<>();
        for (JsonNode n : body) out.add(RecordJson.fromJson(n));
        return out;
    }

    public boolean isHealthy() {
        try {
            HttpResponse<String> resp = client.send(request("/health_check").GET().build(), HttpResponse.BodyHandlers.ofString());
            return resp.statusCode() == 200;
        } catch (IOException e) {
            log.debug("health check against {} failed: {}", base, e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create(base + path)).timeout(timeout);
    }

    private JsonNode send(HttpRequest.Builder builder) {
        HttpRequest req = builder.build();
        HttpResponse<String> resp;
        try {
            resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UpstreamUnavailableException(req.method() + " " + req.uri() + " failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("interrupted while calling " + req.uri(), e);
        }
        JsonNode body = parse(resp);
        int status = resp.statusCode();
        if (status >= 200 && status < 300) return body;
        if (status >= 500) {
            throw new UpstreamUnavailableException("store answered " + status + " for " + req.method() + " " + req.uri());
        }
        ErrorKind kind;
        try {
            kind = ErrorKind.valueOf(body.path("error").asText(""));
        } catch (IllegalArgumentException e) {
            throw new UpstreamUnavailableException("unexpected " + status + " from " + req.uri() + ": " + resp.body());
        }
        throw AccountingException.of(kind, body.path("message").asText("store answered " + status));
    }

    private static JsonNode parse(HttpResponse<String> resp) {
        String text = resp.body();
        if (text == null || text.isBlank()) return JsonSupport.MAPPER.createObjectNode();
        try {
            return JsonSupport.MAPPER.readTree(text);
        } catch (IOException e) {
            if (resp.statusCode() >= 500) return JsonSupport.MAPPER.createObjectNode();
            throw new UpstreamUnavailableException("store sent unreadable JSON (" + resp.statusCode() + ")", e);
        }
    }
}
