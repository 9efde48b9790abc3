package fr.lapetina.watchman.domain.reconcile;

import fr.lapetina.watchman.domain.model.TargetHealth;

import java.util.List;

/**
 * Summary of one {@link StateReconciler#apply(Round)} call.
 *
 * @param round       sequence of the round that was offered
 * @param applied     false if the round was discarded as stale
 * @param entries     number of entries in the resulting table
 * @param healthy     number of HEALTHY entries in the resulting table
 * @param pruned      names dropped because they are no longer registered
 * @param transitions health changes caused by this round
 */
public record ReconcileResult(
        long round,
        boolean applied,
        int entries,
        int healthy,
        List<String> pruned,
        List<Transition> transitions
) {
    public ReconcileResult {
        pruned = List.copyOf(pruned);
        transitions = List.copyOf(transitions);
    }

    static ReconcileResult discarded(long round) {
        return new ReconcileResult(round, false, 0, 0, List.of(), List.of());
    }

    public int unhealthy() {
        return entries - healthy;
    }

    /**
     * A change of health classification for one target.
     */
    public record Transition(String name, TargetHealth from, TargetHealth to) {
    }
}
