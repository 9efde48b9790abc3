package fr.lapetina.watchman.domain.reconcile;

import fr.lapetina.watchman.domain.model.ProbeResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One closed poll round: every probe result collected before the round deadline,
 * including synthesized timeouts for probes that did not finish.
 *
 * @param sequence   monotonic round number, starting at 1
 * @param startedAt  when the poller took the registry snapshot
 * @param closedAt   when the round was closed and handed off
 * @param results    one result per snapshotted target, in snapshot order
 * @param stragglers number of probes abandoned at the deadline
 */
public record Round(
        long sequence,
        Instant startedAt,
        Instant closedAt,
        List<ProbeResult> results,
        int stragglers
) {
    public Round {
        if (sequence < 1) {
            throw new IllegalArgumentException("Round sequence must be >= 1: " + sequence);
        }
        Objects.requireNonNull(startedAt, "startedAt is required");
        Objects.requireNonNull(closedAt, "closedAt is required");
        results = List.copyOf(results);
    }

    public static Round of(long sequence, Instant at, List<ProbeResult> results) {
        return new Round(sequence, at, at, results, 0);
    }

    /**
     * Results keyed by target name. If a target appears twice, the last result wins.
     */
    public Map<String, ProbeResult> resultsByTarget() {
        Map<String, ProbeResult> byTarget = new LinkedHashMap<>();
        for (ProbeResult result : results) {
            byTarget.put(result.targetName(), result);
        }
        return Collections.unmodifiableMap(byTarget);
    }

    public Duration duration() {
        return Duration.between(startedAt, closedAt);
    }
}
