package fr.lapetina.watchman.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.watchman.domain.model.DeploymentTarget;
import fr.lapetina.watchman.domain.model.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * HTTP probe for deployed model servers.
 *
 * A probe is one or two calls:
 * 1. GET {endpoint}/healthcheck - must answer 2xx and, if it returns a JSON
 *    object with a "status" field, that status must be ok/healthy/up.
 * 2. GET {endpoint}/metadata - only when the target declares expected metadata;
 *    every expected dotted path must resolve to the expected value.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O.
 */
public class HttpProbeClient implements ProbeClient, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpProbeClient.class);

    private static final Set<String> OK_STATUSES = Set.of("ok", "healthy", "up");
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public HttpProbeClient(Duration connectTimeout, Clock clock) {
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public HttpProbeClient(Duration connectTimeout) {
        this(connectTimeout, Clock.systemUTC());
    }

    @Override
    public CompletableFuture<ProbeResult> probe(DeploymentTarget target, Duration timeout) {
        long startNanos = System.nanoTime();

        log.debug("Probe started: target={}, endpoint={}, timeoutMs={}",
                target.getName(), target.getEndpoint(), timeout.toMillis());

        CompletableFuture<ProbeResult> probe;
        try {
            probe = httpClient.sendAsync(get(target.resolve("healthcheck"), timeout),
                            HttpResponse.BodyHandlers.ofString())
                    .thenCompose(response -> onHealthcheck(target, response, timeout, startNanos));
        } catch (Exception e) {
            // Invalid URI or request rejected before any I/O
            return CompletableFuture.completedFuture(ProbeResult.unreachable(
                    target.getName(), clock.instant(), "Invalid request: " + e.getMessage(), elapsed(startNanos)));
        }

        return probe
                .exceptionally(ex -> classifyFailure(target, ex, startNanos))
                .completeOnTimeout(null, timeout.toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(result -> {
                    ProbeResult outcome = result != null
                            ? result
                            : ProbeResult.timeout(target.getName(), clock.instant(),
                                    "No answer within " + timeout.toMillis() + "ms");
                    logOutcome(target, outcome);
                    return outcome;
                });
    }

    private CompletableFuture<ProbeResult> onHealthcheck(
            DeploymentTarget target,
            HttpResponse<String> response,
            Duration timeout,
            long startNanos
    ) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            return CompletableFuture.completedFuture(ProbeResult.unhealthy(
                    target.getName(), clock.instant(), "Healthcheck returned HTTP " + status,
                    null, elapsed(startNanos)));
        }

        String reportedStatus = reportedStatus(response.body());
        if (reportedStatus != null && !OK_STATUSES.contains(reportedStatus.toLowerCase())) {
            return CompletableFuture.completedFuture(ProbeResult.unhealthy(
                    target.getName(), clock.instant(), "Reported status: " + reportedStatus,
                    null, elapsed(startNanos)));
        }

        if (target.getExpectedMetadata().isEmpty()) {
            return CompletableFuture.completedFuture(
                    ProbeResult.healthy(target.getName(), clock.instant(), null, elapsed(startNanos)));
        }

        // Both requests share one budget so nothing outlives the probe timeout
        Duration remaining = remainingBudget(timeout, startNanos);
        if (remaining.isZero()) {
            return CompletableFuture.completedFuture(ProbeResult.timeout(target.getName(), clock.instant(),
                    "No answer within " + timeout.toMillis() + "ms"));
        }
        return httpClient.sendAsync(get(target.resolve("metadata"), remaining), HttpResponse.BodyHandlers.ofString())
                .thenApply(metadataResponse -> onMetadata(target, metadataResponse, startNanos));
    }

    private ProbeResult onMetadata(DeploymentTarget target, HttpResponse<String> response, long startNanos) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            return ProbeResult.unhealthy(target.getName(), clock.instant(),
                    "Metadata returned HTTP " + status, null, elapsed(startNanos));
        }

        Map<String, Object> document;
        try {
            document = objectMapper.readValue(response.body(), JSON_OBJECT);
        } catch (JsonProcessingException e) {
            return ProbeResult.unhealthy(target.getName(), clock.instant(),
                    "Malformed metadata: " + e.getOriginalMessage(), null, elapsed(startNanos));
        }
        if (document == null) {
            return ProbeResult.unhealthy(target.getName(), clock.instant(),
                    "Empty metadata document", null, elapsed(startNanos));
        }

        List<String> mismatches = new ArrayList<>();
        for (Map.Entry<String, String> expected : target.getExpectedMetadata().entrySet()) {
            Object actual = MetadataPaths.lookup(document, expected.getKey());
            String actualText = actual == null ? null : String.valueOf(actual);
            if (!Objects.equals(expected.getValue(), actualText)) {
                mismatches.add(expected.getKey() + " expected '" + expected.getValue()
                        + "' but was '" + actualText + "'");
            }
        }

        if (!mismatches.isEmpty()) {
            return ProbeResult.unhealthy(target.getName(), clock.instant(),
                    "Metadata mismatch: " + String.join("; ", mismatches), document, elapsed(startNanos));
        }
        return ProbeResult.healthy(target.getName(), clock.instant(), document, elapsed(startNanos));
    }

    /**
     * Extracts a "status" field from a JSON object body, or null if there is none.
     * Non-JSON bodies (plain "OK" etc.) carry no status.
     */
    private String reportedStatus(String body) {
        if (body == null || body.isBlank() || !body.trim().startsWith("{")) {
            return null;
        }
        try {
            Map<String, Object> json = objectMapper.readValue(body, JSON_OBJECT);
            Object status = json == null ? null : json.get("status");
            return status == null ? null : String.valueOf(status);
        } catch (JsonProcessingException e) {
            log.debug("Healthcheck body is not JSON, ignoring: {}", e.getOriginalMessage());
            return null;
        }
    }

    private ProbeResult classifyFailure(DeploymentTarget target, Throwable ex, long startNanos) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        String message = cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? ": " + cause.getMessage() : "");

        if (cause instanceof HttpTimeoutException || cause instanceof java.util.concurrent.TimeoutException) {
            return ProbeResult.timeout(target.getName(), clock.instant(), message);
        }
        if (cause instanceof ConnectException
                || cause instanceof UnknownHostException
                || cause instanceof IOException
                || cause instanceof IllegalArgumentException) {
            return ProbeResult.unreachable(target.getName(), clock.instant(), message, elapsed(startNanos));
        }

        log.error("Probe failed unexpectedly: target={}, errorType={}, error={}",
                target.getName(), cause.getClass().getSimpleName(), cause.getMessage(), cause);
        return ProbeResult.unreachable(target.getName(), clock.instant(), message, elapsed(startNanos));
    }

    private void logOutcome(DeploymentTarget target, ProbeResult result) {
        long latencyMs = result.latency() != null ? result.latency().toMillis() : -1;
        if (result.isHealthy()) {
            log.debug("Probe passed: target={}, latencyMs={}", target.getName(), latencyMs);
        } else {
            log.warn("Probe failed: target={}, outcome={}, reason={}, latencyMs={}",
                    target.getName(), result.outcome(), result.reason(), latencyMs);
        }
    }

    private static HttpRequest get(URI uri, Duration timeout) {
        return HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
    }

    /**
     * Time left of {@code timeout} for a probe started at {@code startNanos}, never negative.
     */
    static Duration remainingBudget(Duration timeout, long startNanos) {
        Duration remaining = timeout.minus(elapsed(startNanos));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit closing in Java 17
    }
}
