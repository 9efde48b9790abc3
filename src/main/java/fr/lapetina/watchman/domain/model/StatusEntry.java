package fr.lapetina.watchman.domain.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Authoritative per-target state, as produced by one reconciliation round.
 *
 * Entries are never mutated: each round builds new instances and the whole
 * table is swapped in at once.
 *
 * @param name                target name
 * @param health              current classification
 * @param consecutiveFailures failed probes since the last healthy one
 * @param lastSuccess         timestamp of the last healthy probe, null if never healthy
 * @param lastTransition      when {@code health} last changed (or the entry was created)
 * @param lastProbedAt        timestamp of the probe result this entry reflects
 * @param lastOutcome         outcome of that probe
 * @param lastReason          reason attached to that probe, null when healthy
 * @param reportedMetadata    most recent metadata document the endpoint reported, null if none yet
 * @param round               sequence number of the round that produced the entry
 * @param target              registration the entry tracks; a different deployment under the
 *                            same name starts a fresh entry
 */
public record StatusEntry(
        String name,
        TargetHealth health,
        int consecutiveFailures,
        Instant lastSuccess,
        Instant lastTransition,
        Instant lastProbedAt,
        ProbeOutcome lastOutcome,
        String lastReason,
        Map<String, Object> reportedMetadata,
        long round,
        DeploymentTarget target
) {
    public StatusEntry {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(health, "health is required");
        Objects.requireNonNull(lastTransition, "lastTransition is required");
        Objects.requireNonNull(target, "target is required");
        reportedMetadata = MetadataDocuments.immutableCopy(reportedMetadata);
    }

    public boolean isHealthy() {
        return health == TargetHealth.HEALTHY;
    }
}
