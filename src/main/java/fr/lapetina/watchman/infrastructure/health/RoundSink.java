package fr.lapetina.watchman.infrastructure.health;

import fr.lapetina.watchman.domain.reconcile.Round;

/**
 * Receives each closed round exactly once, in round order.
 */
@FunctionalInterface
public interface RoundSink {

    void accept(Round round);
}
