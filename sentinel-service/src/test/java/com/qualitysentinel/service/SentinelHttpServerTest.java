package com.qualitysentinel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.qualitysentinel.core.RegressionEngine;
import com.qualitysentinel.core.config.DetectionConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SentinelHttpServerTest {

    private final JsonCodec codec = new JsonCodec();
    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    private RegressionEngine engine;
    private SentinelHttpServer server;

    @BeforeEach
    void setUp() {
        engine = new RegressionEngine(DetectionConfig.defaults());
        server = new SentinelHttpServer(engine, codec);
        server.start("127.0.0.1", 0, 2);
    }

    @AfterEach
    void tearDown() {
        server.stop();
        engine.close();
    }

    @Test
    @DisplayName("Health and readiness should answer UP")
    void shouldServeHealth() throws Exception {
        HttpResponse<String> health = get("/health");
        HttpResponse<String> readiness = get("/readiness");

        assertThat(health.statusCode()).isEqualTo(200);
        assertThat(health.body()).isEqualTo("{\"status\":\"UP\"}");
        assertThat(readiness.statusCode()).isEqualTo(200);
        assertThat(server.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Registered metric should accept samples and surface threshold events")
    void shouldIngestAndQuery() throws Exception {
        HttpResponse<String> registered = post("/metrics",
                "{\"componentId\":\"checkout\",\"metricName\":\"latency_ms\","
                        + "\"category\":\"performance\",\"upperThreshold\":200.0}");
        assertThat(registered.statusCode()).isEqualTo(201);
        assertThat(json(registered).get("componentId").asText()).isEqualTo("checkout");

        HttpResponse<String> sample = post("/samples",
                "{\"componentId\":\"checkout\",\"metricName\":\"latency_ms\",\"value\":350.0}");
        assertThat(sample.statusCode()).isEqualTo(202);

        JsonNode events = json(get("/events?component=checkout"));
        assertThat(events.isArray()).isTrue();
        assertThat(events).hasSize(1);
        assertThat(events.get(0).get("detectionMethod").asText()).isEqualTo("THRESHOLD");
        assertThat(events.get(0).get("currentValue").asDouble()).isEqualTo(350.0);

        JsonNode status = json(get("/status"));
        assertThat(status.get("registeredMetrics").asInt()).isEqualTo(1);
        assertThat(status.get("eventCount").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Unregistered metric samples should answer 404")
    void shouldRejectUnknownMetric() throws Exception {
        HttpResponse<String> response = post("/samples",
                "{\"componentId\":\"ghost\",\"metricName\":\"latency_ms\",\"value\":1.0}");

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(json(response).get("error").asText()).contains("ghost.latency_ms");
    }

    @Test
    @DisplayName("Invalid input should answer 400")
    void shouldRejectBadInput() throws Exception {
        assertThat(post("/metrics", "{\"componentId\":\"checkout\",\"metricName\":\"latency_ms\","
                + "\"category\":\"speed\"}").statusCode()).isEqualTo(400);
        assertThat(post("/metrics", "{not json").statusCode()).isEqualTo(400);
        assertThat(post("/samples", "{\"componentId\":\"checkout\",\"metricName\":\"latency_ms\"}")
                .statusCode()).isEqualTo(400);
        assertThat(get("/events?severity=urgent").statusCode()).isEqualTo(400);
        assertThat(get("/events?since=yesterday").statusCode()).isEqualTo(400);
        assertThat(get("/baselines?component=checkout").statusCode()).isEqualTo(400);
    }

    @Test
    @DisplayName("Wrong method should answer 405")
    void shouldRejectWrongMethod() throws Exception {
        assertThat(get("/metrics").statusCode()).isEqualTo(405);
        assertThat(post("/status", "{}").statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("Manual baseline should be served after registration")
    void shouldServeBaseline() throws Exception {
        post("/metrics", "{\"componentId\":\"model\",\"metricName\":\"accuracy\","
                + "\"category\":\"accuracy\",\"baselineValue\":0.95}");

        HttpResponse<String> found = get("/baselines?component=model&metric=accuracy");
        HttpResponse<String> missing = get("/baselines?component=model&metric=recall");

        assertThat(found.statusCode()).isEqualTo(200);
        assertThat(json(found).get("value").asDouble()).isEqualTo(0.95);
        assertThat(json(found).get("method").asText()).isEqualTo("MANUAL");
        assertThat(missing.statusCode()).isEqualTo(404);
    }

    @Test
    @DisplayName("Report should be generated and fetched by id")
    void shouldGenerateAndFetchReport() throws Exception {
        post("/metrics", "{\"componentId\":\"search\",\"metricName\":\"error_rate\","
                + "\"category\":\"reliability\",\"upperThreshold\":0.05}");
        post("/samples", "{\"componentId\":\"search\",\"metricName\":\"error_rate\",\"value\":0.3}");

        Instant start = Instant.now().minus(Duration.ofHours(1));
        Instant end = Instant.now().plus(Duration.ofMinutes(1));
        HttpResponse<String> created = post("/reports?start=" + start + "&end=" + end, "");
        assertThat(created.statusCode()).isEqualTo(201);
        String reportId = json(created).get("reportId").asText();

        HttpResponse<String> fetched = get("/reports/" + reportId);
        assertThat(fetched.statusCode()).isEqualTo(200);
        JsonNode report = json(fetched);
        assertThat(report.get("totalRegressions").asInt()).isEqualTo(1);
        assertThat(report.get("affectedComponents").get(0).asText()).isEqualTo("search");

        assertThat(get("/reports/unknown").statusCode()).isEqualTo(404);
        assertThat(post("/reports?start=" + end + "&end=" + start, "").statusCode()).isEqualTo(400);
    }

    @Test
    @DisplayName("Default report period should be used without parameters")
    void shouldGenerateDefaultReport() throws Exception {
        HttpResponse<String> created = post("/reports", "");

        assertThat(created.statusCode()).isEqualTo(201);
        assertThat(engine.getReport(json(created).get("reportId").asText())).isPresent();
    }

    @Test
    @DisplayName("Out-of-range port should be rejected")
    void shouldRejectInvalidPort() {
        SentinelHttpServer other = new SentinelHttpServer(engine, codec);

        assertThatThrownBy(() -> other.start("127.0.0.1", -1, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getPort() + path);
    }

    private JsonNode json(HttpResponse<String> response) throws IOException {
        return codec.mapper().readTree(response.body());
    }
}
