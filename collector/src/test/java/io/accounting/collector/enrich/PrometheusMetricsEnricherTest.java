package io.accounting.collector.enrich;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.accounting.core.Record;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class PrometheusMetricsEnricherTest {
    static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");
    static final Record CLOSED = Record.builder("slurm-42", T0).stopTime(T0.plusSeconds(3600)).build();

    HttpServer server;
    final AtomicReference<String> lastQuery = new AtomicReference<>();
    final AtomicInteger status = new AtomicInteger(200);

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/api/v1/query", this::answer);
        server.start();
    }

    @AfterEach
    void stopServer() { server.stop(0); }

    private void answer(HttpExchange exchange) throws IOException {
        String query = exchange.getRequestURI().getQuery();
        lastQuery.set(query);
        String result = query.contains("memory")
                ? "[{\"metric\":{},\"value\":[1704106800,\"2048.4\"]}]"
                : "[]";
        byte[] body = ("{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":" + result + "}}")
                .getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status.get(), body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private PrometheusMetricsEnricher enricher() {
        return new PrometheusMetricsEnricher(URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/"),
                Duration.ofSeconds(2), null, id -> id.substring("slurm-".length()));
    }

    @Test
    void complete_when_every_component_has_a_sample() {
        EnrichResult r = enricher().enrich(CLOSED, Set.of("memory"));
        assertEquals(EnrichResult.Status.COMPLETE, r.status());
        assertEquals(Map.of("memory", 2048L), r.amounts());
        assertTrue(lastQuery.get().contains("job_id=\"42\""), lastQuery.get());
        assertTrue(lastQuery.get().contains("[3600s]"), lastQuery.get());
        assertTrue(lastQuery.get().endsWith("time=" + T0.plusSeconds(3600).getEpochSecond()), lastQuery.get());
    }

    @Test
    void incomplete_keeps_what_was_found() {
        EnrichResult r = enricher().enrich(CLOSED, new LinkedHashSet<>(List.of("memory", "gpu")));
        assertEquals(EnrichResult.Status.INCOMPLETE, r.status());
        assertEquals(Map.of("memory", 2048L), r.amounts());
    }

    @Test
    void server_errors_and_unreachable_prometheus_are_unavailable() {
        status.set(503);
        assertEquals(EnrichResult.Status.UNAVAILABLE, enricher().enrich(CLOSED, Set.of("memory")).status());

        PrometheusMetricsEnricher e = enricher();
        server.stop(0);
        assertEquals(EnrichResult.Status.UNAVAILABLE, e.enrich(CLOSED, Set.of("memory")).status());
    }

    @Test
    void open_records_are_not_queried() {
        EnrichResult r = enricher().enrich(Record.builder("slurm-1", T0).build(), Set.of("memory"));
        assertEquals(EnrichResult.Status.INCOMPLETE, r.status());
        assertNull(lastQuery.get());
    }
}
