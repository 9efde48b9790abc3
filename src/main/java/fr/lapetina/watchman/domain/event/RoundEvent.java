package fr.lapetina.watchman.domain.event;

import fr.lapetina.watchman.domain.reconcile.ReconcileResult;
import fr.lapetina.watchman.domain.reconcile.Round;

import java.util.concurrent.CompletableFuture;

/**
 * Mutable ring-buffer slot carrying one round through the reconciliation pipeline.
 *
 * Slots are pre-allocated by the Disruptor and reused; {@link #clear()} is
 * called by the last handler once the round is done.
 */
public final class RoundEvent {

    private Round round;
    private CompletableFuture<ReconcileResult> completion;
    private ReconcileResult result;
    private Throwable failure;
    private long publishedAtNanos;

    public void initialize(Round round, CompletableFuture<ReconcileResult> completion) {
        this.round = round;
        this.completion = completion;
        this.result = null;
        this.failure = null;
        this.publishedAtNanos = System.nanoTime();
    }

    public void clear() {
        this.round = null;
        this.completion = null;
        this.result = null;
        this.failure = null;
        this.publishedAtNanos = 0;
    }

    public Round getRound() {
        return round;
    }

    public CompletableFuture<ReconcileResult> getCompletion() {
        return completion;
    }

    public ReconcileResult getResult() {
        return result;
    }

    public void setResult(ReconcileResult result) {
        this.result = result;
    }

    public Throwable getFailure() {
        return failure;
    }

    public void setFailure(Throwable failure) {
        this.failure = failure;
    }

    public long getPublishedAtNanos() {
        return publishedAtNanos;
    }

    @Override
    public String toString() {
        return "RoundEvent{" +
                "round=" + (round != null ? round.sequence() : null) +
                ", applied=" + (result != null ? result.applied() : null) +
                ", failure=" + (failure != null ? failure.getClass().getSimpleName() : null) +
                '}';
    }
}
