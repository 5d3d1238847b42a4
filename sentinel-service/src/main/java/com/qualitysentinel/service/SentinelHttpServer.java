package com.qualitysentinel.service;

import com.qualitysentinel.core.RegressionEngine;
import com.qualitysentinel.core.model.MetricKey;
import com.qualitysentinel.core.model.Severity;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP front end of a {@link RegressionEngine}, built on the JDK
 * {@link HttpServer}.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}, {@code GET /readiness}: {@code {"status":"UP"}}</li>
 * <li>{@code GET /status}: engine status</li>
 * <li>{@code POST /metrics}: register a metric, {@code 201} with its key</li>
 * <li>{@code POST /samples}: record a sample, {@code 202}, or {@code 404} if
 * the metric is not registered</li>
 * <li>{@code GET /events?component=&severity=&since=}: stored regressions,
 * newest first</li>
 * <li>{@code GET /baselines?component=&metric=}: current baseline</li>
 * <li>{@code POST /reports?start=&end=}: generate a report, {@code 201} with
 * its id; without parameters the default period ending now is used</li>
 * <li>{@code GET /reports/{id}}: a stored report</li>
 * </ul>
 *
 * <p>
 * Invalid input answers {@code 400} with {@code {"error": "..."}}; any other
 * failure is logged and answers {@code 500}.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelHttpServer {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelHttpServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final String REPORTS_PATH = "/reports";

    private final RegressionEngine engine;
    private final JsonCodec codec;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private HttpServer server;
    private ExecutorService executor;

    public SentinelHttpServer(RegressionEngine engine, JsonCodec codec) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    /**
     * Bind and start serving.
     *
     * @param bindAddress interface to bind, e.g. {@code 0.0.0.0}
     * @param port        TCP port in [0, 65535]; 0 picks an ephemeral port
     * @param threads     number of request worker threads
     * @throws IllegalArgumentException if the port is out of range
     * @throws UncheckedIOException     if the socket cannot be bound
     */
    public synchronized void start(String bindAddress, int port, int threads) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("HTTP port must be in range [0, 65535], got: " + port);
        }
        if (running.get()) {
            return;
        }
        try {
            server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        } catch (IOException e) {
            LOG.error("Failed to start HTTP server on {}:{}: {}", bindAddress, port, e.getMessage(), e);
            throw new UncheckedIOException("Cannot bind " + bindAddress + ":" + port, e);
        }
        server.createContext("/health", SentinelHttpServer::handleHealthCheck);
        server.createContext("/readiness", SentinelHttpServer::handleHealthCheck);
        server.createContext("/status", exchange -> dispatch(exchange, "GET", this::status));
        server.createContext("/metrics", exchange -> dispatch(exchange, "POST", this::registerMetric));
        server.createContext("/samples", exchange -> dispatch(exchange, "POST", this::recordSample));
        server.createContext("/events", exchange -> dispatch(exchange, "GET", this::listEvents));
        server.createContext("/baselines", exchange -> dispatch(exchange, "GET", this::currentBaseline));
        server.createContext(REPORTS_PATH, this::handleReports);

        AtomicInteger threadIndex = new AtomicInteger();
        executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "sentinel-http-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        running.set(true);
        LOG.info("HTTP server started on {}:{}", bindAddress, getPort());
    }

    /**
     * Stop accepting requests and release the worker threads.
     */
    public synchronized void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdown();
            LOG.info("HTTP server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /** @return the bound port; meaningful only while running */
    public int getPort() {
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Endpoints
    // ---------------------------------------------------------------

    private Response status(HttpExchange exchange) {
        return Response.ok(engine.status());
    }

    private Response registerMetric(HttpExchange exchange) {
        MetricRegistrationRequest request = codec.read(exchange.getRequestBody(), MetricRegistrationRequest.class);
        MetricKey key = engine.registerMetric(
                request.getComponentId(),
                request.getMetricName(),
                request.parsedCategory(),
                request.getBaselineValue(),
                request.thresholds());
        return new Response(201, key);
    }

    private Response recordSample(HttpExchange exchange) {
        SampleRequest request = codec.read(exchange.getRequestBody(), SampleRequest.class);
        if (request.getValue() == null) {
            throw new IllegalArgumentException("value is required");
        }
        boolean accepted = engine.recordSample(
                request.getComponentId(), request.getMetricName(), request.getValue(), request.getMetadata());
        if (!accepted) {
            return Response.error(404, "Sample rejected: metric " + request.getComponentId() + "."
                    + request.getMetricName() + " is not registered or the value is not finite");
        }
        return new Response(202, Map.of("accepted", true));
    }

    private Response listEvents(HttpExchange exchange) {
        Map<String, String> query = queryParameters(exchange);
        String severity = query.get("severity");
        String since = query.get("since");
        return Response.ok(engine.listEvents(
                query.get("component"),
                severity != null ? Severity.parse(severity) : null,
                since != null ? parseInstant("since", since) : null));
    }

    private Response currentBaseline(HttpExchange exchange) {
        Map<String, String> query = queryParameters(exchange);
        String component = requireParameter(query, "component");
        String metric = requireParameter(query, "metric");
        return engine.currentBaseline(component, metric)
                .map(Response::ok)
                .orElseGet(() -> Response.error(404, "No baseline for " + component + "." + metric));
    }

    private void handleReports(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        if (path.equals(REPORTS_PATH) || path.equals(REPORTS_PATH + "/")) {
            dispatch(exchange, "POST", this::generateReport);
        } else {
            dispatch(exchange, "GET", this::getReport);
        }
    }

    private Response generateReport(HttpExchange exchange) {
        Map<String, String> query = queryParameters(exchange);
        String start = query.get("start");
        String end = query.get("end");
        if (start == null && end == null) {
            return new Response(201, Map.of("reportId", engine.generateReport()));
        }
        return engine.generateReport(
                        parseInstant("start", requireParameter(query, "start")),
                        parseInstant("end", requireParameter(query, "end")))
                .map(id -> new Response(201, Map.of("reportId", id)))
                .orElseGet(() -> Response.error(400, "start must not be after end"));
    }

    private Response getReport(HttpExchange exchange) {
        String id = exchange.getRequestURI().getPath().substring(REPORTS_PATH.length() + 1);
        return engine.getReport(id)
                .map(Response::ok)
                .orElseGet(() -> Response.error(404, "Report not found: " + id));
    }

    // ---------------------------------------------------------------
    // Plumbing
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface Endpoint {
        Response handle(HttpExchange exchange) throws IOException;
    }

    private static final class Response {
        private final int status;
        private final Object body;

        private Response(int status, Object body) {
            this.status = status;
            this.body = body;
        }

        static Response ok(Object body) {
            return new Response(200, body);
        }

        static Response error(int status, String message) {
            return new Response(status, Map.of("error", message));
        }
    }

    private void dispatch(HttpExchange exchange, String method, Endpoint endpoint) throws IOException {
        Response response;
        if (!method.equals(exchange.getRequestMethod())) {
            response = Response.error(405, "Method " + exchange.getRequestMethod() + " not allowed");
        } else {
            try {
                response = endpoint.handle(exchange);
            } catch (IllegalArgumentException e) {
                response = Response.error(400, e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("Request {} {} failed: {}", exchange.getRequestMethod(), exchange.getRequestURI(),
                        e.getMessage(), e);
                response = Response.error(500, "Internal server error");
            }
        }
        send(exchange, response.status, codec.write(response.body));
    }

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        send(exchange, 200, HEALTH_RESPONSE);
    }

    private static void send(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private static Map<String, String> queryParameters(HttpExchange exchange) {
        Map<String, String> parameters = new HashMap<>();
        String raw = exchange.getRequestURI().getRawQuery();
        if (raw == null || raw.isEmpty()) {
            return parameters;
        }
        for (String pair : raw.split("&")) {
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            if (!name.isEmpty() && !value.isEmpty()) {
                parameters.put(URLDecoder.decode(name, StandardCharsets.UTF_8),
                        URLDecoder.decode(value, StandardCharsets.UTF_8));
            }
        }
        return parameters;
    }

    private static String requireParameter(Map<String, String> query, String name) {
        String value = query.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Query parameter '" + name + "' is required");
        }
        return value;
    }

    private static Instant parseInstant(String name, String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "Query parameter '" + name + "' must be an ISO-8601 instant, got: " + value, e);
        }
    }
}
