package fr.lapetina.watchman.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.watchman.domain.event.RoundEvent;
import fr.lapetina.watchman.domain.reconcile.ReconcileResult;
import fr.lapetina.watchman.domain.reconcile.StateReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage handler: applies the round to the status table.
 *
 * Runs on a single consumer thread, so rounds are reconciled one at a time
 * in publish order.
 */
public final class ReconcileHandler implements EventHandler<RoundEvent> {

    private static final Logger log = LoggerFactory.getLogger(ReconcileHandler.class);

    private final StateReconciler reconciler;

    public ReconcileHandler(StateReconciler reconciler) {
        this.reconciler = reconciler;
    }

    @Override
    public void onEvent(RoundEvent event, long sequence, boolean endOfBatch) {
        if (event.getRound() == null) {
            return;
        }
        try {
            ReconcileResult result = reconciler.apply(event.getRound());
            event.setResult(result);
        } catch (RuntimeException e) {
            log.error("Reconciliation failed: round={}", event.getRound().sequence(), e);
            event.setFailure(e);
        }
    }
}
