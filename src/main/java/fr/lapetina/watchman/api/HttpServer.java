package fr.lapetina.watchman.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.watchman.api.dto.StatusResponse;
import fr.lapetina.watchman.api.dto.TargetRequest;
import fr.lapetina.watchman.api.dto.TargetResponse;
import fr.lapetina.watchman.domain.exception.TargetNotFoundException;
import fr.lapetina.watchman.domain.model.DeploymentTarget;
import fr.lapetina.watchman.domain.model.StatusEntry;
import fr.lapetina.watchman.infrastructure.config.ConfigLoader;
import fr.lapetina.watchman.infrastructure.config.WatchmanConfig;
import fr.lapetina.watchman.infrastructure.health.StatusStore;
import fr.lapetina.watchman.infrastructure.health.StatusStore.StatusTable;
import fr.lapetina.watchman.infrastructure.health.TargetRegistry;
import fr.lapetina.watchman.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /status - All status entries of the latest reconciled round
 * - GET /status/{name} - Status of one registered target
 * - GET /targets - Registered targets
 * - POST /targets - Register or replace a target
 * - DELETE /targets/{name} - Deregister a target
 * - GET / - Project listing of endpoints and their health
 * - GET /healthcheck - Liveness of Watchman itself
 * - GET /metrics - Prometheus metrics endpoint
 * - POST /admin/reload - Reload configuration
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final TargetRegistry targetRegistry;
    private final StatusStore statusStore;
    private final MetricsRegistry metricsRegistry;
    private final ConfigLoader configLoader;
    private final WatchmanConfig.ProjectConfig project;

    public HttpServer(
            WatchmanConfig.ServerConfig serverConfig,
            WatchmanConfig.ProjectConfig project,
            TargetRegistry targetRegistry,
            StatusStore statusStore,
            MetricsRegistry metricsRegistry,
            ConfigLoader configLoader
    ) throws IOException {
        this.project = project;
        this.targetRegistry = targetRegistry;
        this.statusStore = statusStore;
        this.metricsRegistry = metricsRegistry;
        this.configLoader = configLoader;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(serverConfig.getHost(), serverConfig.getPort()),
                serverConfig.getBacklog()
        );

        AtomicInteger threadCounter = new AtomicInteger(0);
        this.executor = Executors.newFixedThreadPool(serverConfig.getThreads(), r -> {
            Thread t = new Thread(r, "http-handler-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/status", new StatusHandler());
        server.createContext("/targets", new TargetsHandler());
        server.createContext("/healthcheck", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());
        server.createContext("/", new ProjectHandler());

        log.info("HTTP server configured on {}:{}", serverConfig.getHost(), getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    /**
     * Base handler: request id in MDC and exception to status code mapping.
     */
    private abstract class JsonHandler implements HttpHandler {

        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            String requestId = Optional.ofNullable(exchange.getRequestHeaders().getFirst("X-Request-ID"))
                    .orElseGet(() -> UUID.randomUUID().toString());
            MDC.put("requestId", requestId);
            try {
                route(exchange, exchange.getRequestMethod().toUpperCase(Locale.ROOT),
                        exchange.getRequestURI().getPath());
            } catch (TargetNotFoundException e) {
                sendError(exchange, 404, e.getMessage());
            } catch (JsonProcessingException e) {
                log.debug("Malformed request body: {}", e.getOriginalMessage());
                sendError(exchange, 400, "Malformed JSON body: " + e.getOriginalMessage());
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
            } catch (Exception e) {
                log.error("Error handling request: method={}, path={}",
                        exchange.getRequestMethod(), exchange.getRequestURI(), e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                exchange.close();
                MDC.clear();
            }
        }

        abstract void route(HttpExchange exchange, String method, String path) throws IOException;
    }

    // ==================== STATUS HANDLER ====================

    private class StatusHandler extends JsonHandler {
        @Override
        void route(HttpExchange exchange, String method, String path) throws IOException {
            if (!"GET".equals(method)) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String name = trailingName(path, "/status");
            if (name == null) {
                List<StatusResponse> entries = statusStore.list().stream()
                        .map(StatusResponse::from)
                        .toList();
                sendJson(exchange, 200, entries);
            } else {
                sendJson(exchange, 200, StatusResponse.from(statusOf(name)));
            }
        }

        private StatusEntry statusOf(String name) {
            if (!targetRegistry.contains(name)) {
                throw new TargetNotFoundException(name);
            }
            return statusStore.get(name).orElseThrow(() ->
                    new TargetNotFoundException(name, "No status yet for target: " + name));
        }
    }

    // ==================== TARGETS HANDLER ====================

    private class TargetsHandler extends JsonHandler {
        @Override
        void route(HttpExchange exchange, String method, String path) throws IOException {
            String name = trailingName(path, "/targets");

            if (name == null && "GET".equals(method)) {
                List<TargetResponse> targets = targetRegistry.snapshot().values().stream()
                        .map(TargetResponse::from)
                        .toList();
                sendJson(exchange, 200, targets);
            } else if (name == null && "POST".equals(method)) {
                handleRegister(exchange);
            } else if (name != null && "DELETE".equals(method)) {
                boolean removed = targetRegistry.deregister(name);
                sendJson(exchange, 200, Map.of("name", name, "removed", removed));
            } else if (name != null && "GET".equals(method)) {
                DeploymentTarget target = targetRegistry.get(name)
                        .orElseThrow(() -> new TargetNotFoundException(name));
                sendJson(exchange, 200, TargetResponse.from(target));
            } else {
                sendError(exchange, 405, "Method Not Allowed");
            }
        }

        private void handleRegister(HttpExchange exchange) throws IOException {
            TargetRequest request;
            try (InputStream is = exchange.getRequestBody()) {
                request = objectMapper.readValue(is, TargetRequest.class);
            }
            if (request == null) {
                throw new IllegalArgumentException("Request body is required");
            }

            DeploymentTarget accepted = targetRegistry.register(request.toDeploymentTarget());
            sendJson(exchange, 200, TargetResponse.from(accepted));
        }
    }

    // ==================== PROJECT HANDLER ====================

    private class ProjectHandler extends JsonHandler {
        @Override
        void route(HttpExchange exchange, String method, String path) throws IOException {
            if (!"/".equals(path)) {
                sendError(exchange, 404, "Not Found");
                return;
            }
            if (!"GET".equals(method)) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            StatusTable table = statusStore.current();
            List<Map<String, Object>> endpoints = new ArrayList<>();
            for (DeploymentTarget target : targetRegistry.snapshot().values()) {
                StatusEntry entry = table.entries().get(target.getName());
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("target-name", target.getName());
                info.put("endpoint", target.getEndpoint().toString());
                info.put("healthy", entry != null && entry.isHealthy());
                info.put("metadata", entry != null && entry.reportedMetadata() != null
                        ? entry.reportedMetadata()
                        : Map.of());
                endpoints.add(info);
            }

            Map<String, Object> listing = new LinkedHashMap<>();
            listing.put("project-name", project.getName());
            listing.put("project-version", project.getVersion());
            listing.put("round", table.round());
            listing.put("endpoints", endpoints);
            sendJson(exchange, 200, listing);
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler extends JsonHandler {
        @Override
        void route(HttpExchange exchange, String method, String path) throws IOException {
            if (!"GET".equals(method)) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            StatusTable table = statusStore.current();
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "ok");
            health.put("project", project.getName());
            health.put("version", project.getVersion());
            health.put("targets", targetRegistry.size());
            health.put("round", table.round());
            health.put("reconciledAt", table.reconciledAt());
            sendJson(exchange, 200, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler extends JsonHandler {
        @Override
        void route(HttpExchange exchange, String method, String path) throws IOException {
            if (!"GET".equals(method)) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler extends JsonHandler {
        @Override
        void route(HttpExchange exchange, String method, String path) throws IOException {
            if (path.equals("/admin/reload") && "POST".equals(method)) {
                // load() leaves the current configuration in place when the new one is invalid
                WatchmanConfig config = configLoader.load();
                sendJson(exchange, 200, Map.of(
                        "message", "Configuration reloaded",
                        "targets", config.getTargets().size()
                ));
            } else {
                sendError(exchange, 404, "Not Found");
            }
        }
    }

    // ==================== HELPER METHODS ====================

    /**
     * Returns the single path segment after {@code prefix}, or null for the collection itself.
     */
    private static String trailingName(String path, String prefix) {
        String rest = path.substring(prefix.length());
        if (rest.isEmpty() || rest.equals("/")) {
            return null;
        }
        if (!rest.startsWith("/")) {
            throw new TargetNotFoundException(rest, "Not Found: " + path);
        }
        String name = rest.substring(1);
        if (name.endsWith("/")) {
            name = name.substring(0, name.length() - 1);
        }
        if (name.isEmpty() || name.contains("/")) {
            throw new TargetNotFoundException(name, "Not Found: " + path);
        }
        return name;
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "Unknown error");
        sendJson(exchange, statusCode, error);
    }
}
