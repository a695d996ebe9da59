package io.accounting.store.server;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.accounting.core.BulkOutcome;
import io.accounting.core.CloseOutcome;
import io.accounting.core.CreateOutcome;
import io.accounting.core.Record;
import io.accounting.error.AccountingException;
import io.accounting.error.ErrorKind;
import io.accounting.error.NotFoundException;
import io.accounting.error.ValidationException;
import io.accounting.json.JsonSupport;
import io.accounting.json.RecordJson;
import io.accounting.metrics.Metrics;
import io.accounting.query.RecordQuery;
import io.accounting.query.RecordQueryParser;
import io.accounting.store.JdbcRecordStore;
import io.accounting.store.query.RecordQueryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * HTTP ingestion and query API of the record store.
 *
 * <pre>
 * POST /record         create (or open) one record
 * PUT  /record         close a record; body carries record_id and stop_time
 * GET  /record/{id}    fetch one record
 * POST /records        bulk create with per-element outcome
 * GET  /records?...    filtered, sorted, limited query streamed as a JSON array
 * GET  /health_check   liveness
 * GET  /metrics        metric snapshot
 * </pre>
 *
 * Errors are answered as {@code {"error": KIND, "message": ...}} with the kind's status code.
 */
public class RecordStoreServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RecordStoreServer.class);

    private final HttpServer server;
    private final ExecutorService executor;
    private final JdbcRecordStore store;
    private final RecordQueryEngine engine;
    private final Metrics metrics;
    private final Meter errors;

    public RecordStoreServer(int port, int workers, JdbcRecordStore store, RecordQueryEngine engine, Metrics metrics) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.store = store;
        this.engine = engine;
        this.metrics = metrics;
        this.errors = metrics.meter("store.http.errors");
        AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, workers), r -> {
            Thread t = new Thread(r, "record-store-http-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.createContext("/", new Route("not_found", this::notFound));
        server.createContext("/record", new Route("record", this::record));
        server.createContext("/records", new Route("records", this::records));
        server.createContext("/health_check", new Route("health", this::health));
        server.createContext("/metrics", new Route("metrics", this::metricsSnapshot));
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        log.info("record store listening on port {} (lenient={})", port(), store.isLenient());
    }

    public int port() { return server.getAddress().getPort(); }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
    }

    @FunctionalInterface
    private interface Action {
        void handle(HttpExchange exchange) throws IOException;
    }

    /** Times each call and turns typed failures into error responses. */
    private class Route implements HttpHandler {
        private final String name;
        private final Action action;
        private final Timer timer;

        Route(String name, Action action) {
            this.name = name;
            this.action = action;
            this.timer = metrics.timer("store.http." + name);
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try (Timer.Context ignored = timer.time()) {
                action.handle(exchange);
            } catch (AccountingException e) {
                errors.mark();
                if (e.kind().httpStatus() >= 500) {
                    log.error("{} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                } else {
                    log.debug("{} {} -> {}: {}", exchange.getRequestMethod(), exchange.getRequestURI(), e.kind(), e.getMessage());
                }
                error(exchange, e.kind().httpStatus(), e.kind().name(), e.getMessage());
            } catch (RuntimeException e) {
                errors.mark();
                log.error("{} {} failed in route {}", exchange.getRequestMethod(), exchange.getRequestURI(), name, e);
                error(exchange, 500, ErrorKind.PERSISTENCE.name(), e.toString());
            } finally {
                exchange.close();
            }
        }
    }

    private void record(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();
        if (path.equals("/record") || path.equals("/record/")) {
            if ("POST".equalsIgnoreCase(method)) {
                Record record = RecordJson.fromJson(readJson(exchange));
                CreateOutcome outcome = store.createOrOpen(record);
                ObjectNode body = JsonSupport.MAPPER.createObjectNode().put("outcome", outcome.name());
                if (outcome == CreateOutcome.ALREADY_EXISTS) body.put("warning", JdbcRecordStore.LENIENT_WARNING);
                json(exchange, 200, body);
            } else if ("PUT".equalsIgnoreCase(method)) {
                JsonNode body = readJson(exchange);
                JsonNode id = body.get("record_id");
                if (id == null || !id.isTextual()) throw new ValidationException("close requires record_id");
                CloseOutcome outcome = store.close(id.asText(), RecordJson.requiredStopTime(body));
                json(exchange, 200, JsonSupport.MAPPER.createObjectNode().put("outcome", outcome.name()));
            } else {
                methodNotAllowed(exchange);
            }
            return;
        }
        if (!path.startsWith("/record/")) {
            notFound(exchange);
            return;
        }
        if (!"GET".equalsIgnoreCase(method)) {
            methodNotAllowed(exchange);
            return;
        }
        String id = path.substring("/record/".length());
        json(exchange, 200, RecordJson.toJson(store.get(id)));
    }

    private void records(HttpExchange exchange) throws IOException {
        if (!exchange.getRequestURI().getPath().equals("/records")) {
            notFound(exchange);
            return;
        }
        String method = exchange.getRequestMethod();
        if ("POST".equalsIgnoreCase(method)) {
            bulk(exchange);
        } else if ("GET".equalsIgnoreCase(method)) {
            query(exchange);
        } else {
            methodNotAllowed(exchange);
        }
    }

    private void bulk(HttpExchange exchange) throws IOException {
        JsonNode body = readJson(exchange);
        if (!body.isArray()) throw new ValidationException("bulk create expects a JSON array of records");

        // elements that fail validation are rejected here; the rest go to the store
        List<BulkOutcome> outcomes = new ArrayList<>();
        List<Record> valid = new ArrayList<>();
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < body.size(); i++) {
            JsonNode n = body.get(i);
            try {
                valid.add(RecordJson.fromJson(n));
                positions.add(i);
                outcomes.add(null);
            } catch (ValidationException e) {
                JsonNode id = n.get("record_id");
                outcomes.add(BulkOutcome.rejected(i, id != null && id.isTextual() ? id.asText() : null, e.kind(), e.getMessage()));
            }
        }
        List<BulkOutcome> stored = store.bulkCreate(valid);
        for (int j = 0; j < stored.size(); j++) {
            BulkOutcome o = stored.get(j);
            int index = positions.get(j);
            outcomes.set(index, new BulkOutcome(index, o.recordId(), o.status(), o.errorKind(), o.message()));
        }

        ArrayNode arr = JsonSupport.MAPPER.createArrayNode();
        for (BulkOutcome o : outcomes) {
            ObjectNode n = arr.addObject().put("index", o.index()).put("status", o.status().name());
            if (o.recordId() != null) n.put("record_id", o.recordId());
            if (o.errorKind() != null) n.put("error", o.errorKind().name());
            if (o.message() != null) n.put("message", o.message());
        }
        json(exchange, 200, arr);
    }

    private void query(HttpExchange exchange) throws IOException {
        RecordQuery query = RecordQueryParser.parse(exchange.getRequestURI().getRawQuery());
        streamArray(exchange, engine.stream(query), query);
    }

    /** Writes {@code results} as a JSON array and closes it, also when the response cannot be started. */
    static void streamArray(HttpExchange exchange, Stream<Record> results, RecordQuery query) throws IOException {
        try (results) {
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, 0);
            try (OutputStream os = exchange.getResponseBody();
                 JsonGenerator gen = JsonSupport.MAPPER.getFactory().createGenerator(os)) {
                gen.writeStartArray();
                Iterator<Record> it = results.iterator();
                while (it.hasNext()) gen.writeTree(RecordJson.toJson(it.next()));
                gen.writeEndArray();
            } catch (AccountingException e) {
                // the status line is already out; the client sees a truncated array
                log.error("query {} aborted while streaming", query, e);
            }
        }
    }

    private void health(HttpExchange exchange) throws IOException {
        byte[] ok = "OK".getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(200, ok.length);
        try (OutputStream os = exchange.getResponseBody()) { os.write(ok); }
    }

    private void metricsSnapshot(HttpExchange exchange) throws IOException {
        json(exchange, 200, metrics.snapshot());
    }

    private void notFound(HttpExchange exchange) throws IOException {
        throw new NotFoundException("The requested resource was not found: " + exchange.getRequestURI().getPath());
    }

    private static void methodNotAllowed(HttpExchange exchange) throws IOException {
        error(exchange, 405, "METHOD_NOT_ALLOWED", exchange.getRequestMethod() + " is not supported on " + exchange.getRequestURI().getPath());
    }

    private static JsonNode readJson(HttpExchange exchange) throws IOException {
        byte[] body = exchange.getRequestBody().readAllBytes();
        try {
            return JsonSupport.MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ValidationException("request body is not valid JSON: " + e.getOriginalMessage());
        }
    }

    private static void json(HttpExchange exchange, int status, JsonNode body) throws IOException {
        byte[] bytes = JsonSupport.MAPPER.writeValueAsBytes(body);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) { os.write(bytes); }
    }

    private static void error(HttpExchange exchange, int status, String kind, String message) throws IOException {
        ObjectNode body = JsonSupport.MAPPER.createObjectNode().put("error", kind).put("message", message);
        json(exchange, status, body);
    }
}
