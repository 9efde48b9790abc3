package fr.lapetina.watchman.disruptor.exception;

/**
 * Exception thrown when a round cannot be handed to the reconciliation pipeline.
 *
 * This occurs when:
 * - Ring buffer is full because reconciliation has fallen behind
 * - Pipeline is not running
 */
public final class BackpressureException extends RuntimeException {

    private final BackpressureReason reason;

    public BackpressureException(BackpressureReason reason) {
        super("Backpressure: " + reason.getMessage());
        this.reason = reason;
    }

    public BackpressureException(BackpressureReason reason, String details) {
        super("Backpressure: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public enum BackpressureReason {
        RING_BUFFER_FULL("Ring buffer is full"),
        PIPELINE_STOPPED("Reconciliation pipeline is not running");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
