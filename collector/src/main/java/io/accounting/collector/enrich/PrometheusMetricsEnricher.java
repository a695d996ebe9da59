package io.accounting.collector.enrich;

import com.fasterxml.jackson.databind.JsonNode;
import io.accounting.core.Record;
import io.accounting.json.JsonSupport;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Looks up component amounts with Prometheus instant queries evaluated at the record's stop time.
 * The query template may use {@code {component}}, {@code {job_id}}, {@code {record_id}} and
 * {@code {runtime}} (seconds); the first sample of the result vector is the amount.
 */
public class PrometheusMetricsEnricher implements MetricsEnricher {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsEnricher.class);

    public static final String DEFAULT_QUERY = "max_over_time({component}{job_id=\"{job_id}\"}[{runtime}s])";

    private final HttpClient client;
    private final URI base;
    private final Duration timeout;
    private final String queryTemplate;
    private final Function<String, String> jobIdOf;

    public PrometheusMetricsEnricher(URI base, Duration timeout, String queryTemplate, Function<String, String> jobIdOf) {
        this.timeout = timeout;
        this.client = HttpClient.newBuilder().connectTimeout(timeout).build();
        String s = base.toString();
        this.base = URI.create(s.endsWith("/") ? s.substring(0, s.length() - 1) : s);
        this.queryTemplate = queryTemplate == null || queryTemplate.isBlank() ? DEFAULT_QUERY : queryTemplate;
        this.jobIdOf = jobIdOf;
    }

    @Override
    public EnrichResult enrich(Record record, Set<String> components) {
        if (record.isOpen()) return EnrichResult.incomplete(Map.of(), "record " + record.recordId() + " is still open");
        Map<String, Long> found = new LinkedHashMap<>();
        for (String component : components) {
            String query = render(record, component);
            JsonNode body;
            try {
                body = query(query, record.stopTime().get().getEpochSecond());
            } catch (IOException e) {
                log.debug("prometheus query for {} of {} failed: {}", component, record.recordId(), e.toString());
                return EnrichResult.unavailable(e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return EnrichResult.unavailable("interrupted");
            }
            if (!"success".equals(body.path("status").asText())) {
                return EnrichResult.unavailable("prometheus answered " + body.path("error").asText(body.toString()));
            }
            JsonNode result = body.path("data").path("result");
            if (!result.isArray() || result.isEmpty()) continue;
            JsonNode value = result.get(0).path("value").path(1);
            try {
                double amount = Double.parseDouble(value.asText());
                if (Double.isFinite(amount) && amount >= 0) found.put(component, Math.round(amount));
            } catch (NumberFormatException e) {
                log.warn("prometheus returned a non-numeric {} for {}: {}", component, record.recordId(), value);
            }
        }
        if (found.keySet().containsAll(components)) return EnrichResult.complete(found);
        return EnrichResult.incomplete(found, "no samples for " + missing(components, found));
    }

    String render(Record record, String component) {
        return queryTemplate
                .replace("{component}", component)
                .replace("{job_id}", jobIdOf.apply(record.recordId()))
                .replace("{record_id}", record.recordId())
                .replace("{runtime}", String.valueOf(Math.max(1, record.runtime().orElse(1L))));
    }

    private JsonNode query(String query, long time) throws IOException, InterruptedException {
        URI uri = URI.create(base + "/api/v1/query?query=" + URLEncoder.encode(query, StandardCharsets.UTF_8) + "&time=" + time);
        HttpRequest req = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 500) throw new IOException("prometheus answered " + resp.statusCode());
        return JsonSupport.MAPPER.readTree(resp.body());
    }

    private static List<String> missing(Set<String> wanted, Map<String, Long> found) {
        return wanted.stream().filter(c -> !found.containsKey(c)).sorted().collect(Collectors.toList());
    }
}
