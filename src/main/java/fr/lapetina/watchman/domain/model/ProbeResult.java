package fr.lapetina.watchman.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable outcome of one health check against one target.
 *
 * @param targetName name of the probed target
 * @param timestamp  when the outcome was determined
 * @param outcome    classification of the check
 * @param reason     human readable cause for non-healthy outcomes, null otherwise
 * @param payload    metadata document reported by the endpoint, null if none was read
 * @param latency    time spent on the check, null for synthesized results
 */
public record ProbeResult(
        String targetName,
        Instant timestamp,
        ProbeOutcome outcome,
        String reason,
        Map<String, Object> payload,
        Duration latency
) {
    public ProbeResult {
        Objects.requireNonNull(targetName, "targetName is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(outcome, "outcome is required");
        payload = MetadataDocuments.immutableCopy(payload);
    }

    public static ProbeResult healthy(String targetName, Instant timestamp,
                                      Map<String, Object> payload, Duration latency) {
        return new ProbeResult(targetName, timestamp, ProbeOutcome.HEALTHY, null, payload, latency);
    }

    public static ProbeResult unhealthy(String targetName, Instant timestamp, String reason,
                                        Map<String, Object> payload, Duration latency) {
        return new ProbeResult(targetName, timestamp, ProbeOutcome.UNHEALTHY, reason, payload, latency);
    }

    public static ProbeResult unreachable(String targetName, Instant timestamp, String reason, Duration latency) {
        return new ProbeResult(targetName, timestamp, ProbeOutcome.UNREACHABLE, reason, null, latency);
    }

    public static ProbeResult timeout(String targetName, Instant timestamp, String reason) {
        return new ProbeResult(targetName, timestamp, ProbeOutcome.TIMEOUT, reason, null, null);
    }

    public boolean isHealthy() {
        return outcome == ProbeOutcome.HEALTHY;
    }
}
