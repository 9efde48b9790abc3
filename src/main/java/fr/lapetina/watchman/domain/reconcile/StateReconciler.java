package fr.lapetina.watchman.domain.reconcile;

import fr.lapetina.watchman.domain.model.DeploymentTarget;
import fr.lapetina.watchman.domain.model.ProbeResult;
import fr.lapetina.watchman.domain.model.StatusEntry;
import fr.lapetina.watchman.domain.model.TargetHealth;
import fr.lapetina.watchman.infrastructure.health.StatusStore;
import fr.lapetina.watchman.infrastructure.health.StatusStore.StatusTable;
import fr.lapetina.watchman.infrastructure.health.TargetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges one round of probe results with the prior status table and the
 * current registry into the next authoritative table.
 *
 * Rules:
 * - Healthy probe: HEALTHY, failure count reset to 0.
 * - Any other outcome: failure count incremented; health flips to UNHEALTHY
 *   once the count reaches the threshold, and stays as it was before that.
 * - Registered target missing from the round: counted as UNREACHABLE.
 * - Entry whose target is no longer registered: pruned.
 * - Name re-registered with another endpoint or expected metadata: the old
 *   entry is dropped and the target starts again from the baseline.
 * - Round not newer than the last applied one: discarded, store untouched.
 *
 * This is the only writer of the {@link StatusStore}.
 */
public final class StateReconciler {

    private static final Logger log = LoggerFactory.getLogger(StateReconciler.class);

    private final TargetRegistry registry;
    private final StatusStore store;
    private final int failureThreshold;
    private final Clock clock;

    // Guarded by this
    private long lastAppliedRound;

    public StateReconciler(TargetRegistry registry, StatusStore store, int failureThreshold, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1: " + failureThreshold);
        }
        this.registry = registry;
        this.store = store;
        this.failureThreshold = failureThreshold;
        this.clock = clock;
    }

    public StateReconciler(TargetRegistry registry, StatusStore store, int failureThreshold) {
        this(registry, store, failureThreshold, Clock.systemUTC());
    }

    /**
     * Applies a round and swaps the resulting table into the store.
     */
    public synchronized ReconcileResult apply(Round round) {
        if (round.sequence() <= lastAppliedRound) {
            log.warn("Stale round discarded: round={}, lastApplied={}", round.sequence(), lastAppliedRound);
            return ReconcileResult.discarded(round.sequence());
        }

        Map<String, DeploymentTarget> registered = registry.snapshot();
        StatusTable prior = store.current();
        Map<String, ProbeResult> results = round.resultsByTarget();

        Map<String, StatusEntry> next = new LinkedHashMap<>();
        List<ReconcileResult.Transition> transitions = new ArrayList<>();
        int healthy = 0;

        for (Map.Entry<String, DeploymentTarget> registration : registered.entrySet()) {
            String name = registration.getKey();
            DeploymentTarget target = registration.getValue();
            ProbeResult result = results.get(name);
            if (result == null) {
                log.debug("No probe result for registered target, counting as unreachable: name={}, round={}",
                        name, round.sequence());
                result = ProbeResult.unreachable(name, round.closedAt(),
                        "Not probed in round " + round.sequence(), null);
            }

            StatusEntry previous = prior.entries().get(name);
            if (previous != null && !target.isSameDeployment(previous.target())) {
                log.info("Target re-registered with a new deployment, status reset: name={}, previousEndpoint={}, " +
                        "endpoint={}", name, previous.target().getEndpoint(), target.getEndpoint());
                previous = null;
            }
            StatusEntry entry = classify(previous, target, result, round.sequence());
            next.put(name, entry);

            if (entry.isHealthy()) {
                healthy++;
            }
            if (previous != null && previous.health() != entry.health()) {
                transitions.add(new ReconcileResult.Transition(name, previous.health(), entry.health()));
                log.info("Target health changed: name={}, previousHealth={}, newHealth={}, " +
                                "consecutiveFailures={}, outcome={}, reason={}",
                        name, previous.health(), entry.health(), entry.consecutiveFailures(),
                        result.outcome(), result.reason());
            }
        }

        List<String> pruned = new ArrayList<>();
        for (String name : prior.entries().keySet()) {
            if (!registered.containsKey(name)) {
                pruned.add(name);
            }
        }
        if (!pruned.isEmpty()) {
            log.info("Pruned status for deregistered targets: round={}, names={}", round.sequence(), pruned);
        }

        store.replace(new StatusTable(round.sequence(), clock.instant(), next));
        lastAppliedRound = round.sequence();

        log.debug("Round applied: round={}, entries={}, healthy={}, transitions={}, pruned={}",
                round.sequence(), next.size(), healthy, transitions.size(), pruned.size());

        return new ReconcileResult(round.sequence(), true, next.size(), healthy, pruned, transitions);
    }

    private StatusEntry classify(StatusEntry previous, DeploymentTarget target, ProbeResult result, long round) {
        Instant at = result.timestamp();

        // Unseen targets start from an optimistic HEALTHY baseline
        TargetHealth priorHealth = previous != null ? previous.health() : TargetHealth.HEALTHY;
        int priorFailures = previous != null ? previous.consecutiveFailures() : 0;
        Instant priorSuccess = previous != null ? previous.lastSuccess() : null;
        Instant priorTransition = previous != null ? previous.lastTransition() : at;
        Instant priorProbe = previous != null ? previous.lastProbedAt() : null;

        int failures;
        TargetHealth health;
        Instant lastSuccess;
        if (result.isHealthy()) {
            failures = 0;
            health = TargetHealth.HEALTHY;
            lastSuccess = latest(priorSuccess, at);
        } else {
            failures = priorFailures + 1;
            health = failures >= failureThreshold ? TargetHealth.UNHEALTHY : priorHealth;
            lastSuccess = priorSuccess;
        }

        Instant lastTransition = health != priorHealth ? at : priorTransition;
        Map<String, Object> metadata = result.payload() != null
                ? result.payload()
                : (previous != null ? previous.reportedMetadata() : null);

        return new StatusEntry(
                result.targetName(),
                health,
                failures,
                lastSuccess,
                lastTransition,
                latest(priorProbe, at),
                result.outcome(),
                result.reason(),
                metadata,
                round,
                target
        );
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public synchronized long getLastAppliedRound() {
        return lastAppliedRound;
    }
}
