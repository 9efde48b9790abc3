package fr.lapetina.watchman.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.watchman.domain.event.RoundEvent;
import fr.lapetina.watchman.domain.reconcile.ReconcileResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Final stage handler: completes the publisher's future and recycles the slot.
 */
public final class CompletionHandler implements EventHandler<RoundEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(RoundEvent event, long sequence, boolean endOfBatch) {
        try {
            if (event.getRound() == null) {
                return;
            }
            logSummary(event);

            CompletableFuture<ReconcileResult> completion = event.getCompletion();
            if (completion != null && !completion.isDone()) {
                if (event.getFailure() != null) {
                    completion.completeExceptionally(event.getFailure());
                } else {
                    completion.complete(event.getResult());
                }
            }
        } finally {
            // Clear event for reuse
            event.clear();
        }
    }

    private void logSummary(RoundEvent event) {
        long round = event.getRound().sequence();
        long pipelineMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - event.getPublishedAtNanos());
        ReconcileResult result = event.getResult();

        if (event.getFailure() != null) {
            log.warn("Round failed: round={}, pipelineMs={}, error={}",
                    round, pipelineMs, event.getFailure().getMessage());
        } else if (result != null && result.applied()) {
            log.debug("Round completed: round={}, entries={}, healthy={}, unhealthy={}, " +
                            "transitions={}, pruned={}, pipelineMs={}",
                    round, result.entries(), result.healthy(), result.unhealthy(),
                    result.transitions().size(), result.pruned().size(), pipelineMs);
        } else {
            log.debug("Round discarded: round={}, pipelineMs={}", round, pipelineMs);
        }
    }
}
