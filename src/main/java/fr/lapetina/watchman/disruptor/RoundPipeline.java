package fr.lapetina.watchman.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.watchman.disruptor.exception.BackpressureException;
import fr.lapetina.watchman.disruptor.handlers.CompletionHandler;
import fr.lapetina.watchman.disruptor.handlers.MetricsHandler;
import fr.lapetina.watchman.disruptor.handlers.ReconcileHandler;
import fr.lapetina.watchman.domain.event.RoundEvent;
import fr.lapetina.watchman.domain.event.RoundEventFactory;
import fr.lapetina.watchman.domain.reconcile.ReconcileResult;
import fr.lapetina.watchman.domain.reconcile.Round;
import fr.lapetina.watchman.domain.reconcile.StateReconciler;
import fr.lapetina.watchman.infrastructure.config.WatchmanConfig;
import fr.lapetina.watchman.infrastructure.health.RoundSink;
import fr.lapetina.watchman.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Disruptor pipeline carrying closed rounds from the poller to the reconciler.
 *
 * Handler chain: Reconcile -> Metrics -> Completion. Each stage has a single
 * consumer thread, so rounds are applied strictly in publish order and the
 * reconciler stays the only writer of the status table. The poller is not
 * blocked by reconciliation: publishing only claims a slot.
 *
 * PRODUCER TYPE CHOICE: SINGLE
 *
 * Only the poller thread publishes.
 *
 * WAIT STRATEGY CHOICE: Configurable (default BlockingWaitStrategy)
 *
 * Rounds arrive every few seconds at most, so a parked consumer costs nothing
 * in latency that matters.
 */
public final class RoundPipeline implements RoundSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RoundPipeline.class);

    private final Disruptor<RoundEvent> disruptor;
    private final RingBuffer<RoundEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final MetricsRegistry metricsRegistry;

    private RoundPipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;

        ThreadFactory threadFactory = new PipelineThreadFactory("round-pipeline");
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new RoundEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.SINGLE,
                waitStrategy
        );

        disruptor
                .handleEventsWith(new ReconcileHandler(builder.reconciler))
                .then(new MetricsHandler(builder.metricsRegistry))
                .then(new CompletionHandler());

        disruptor.setDefaultExceptionHandler(new PipelineExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("RoundPipeline created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("RoundPipeline started");
        }
    }

    /**
     * Publishes a closed round for reconciliation.
     *
     * @return future completing with the reconciliation summary
     * @throws BackpressureException if the ring buffer is full or the pipeline is stopped
     */
    public CompletableFuture<ReconcileResult> submit(Round round) {
        if (!running.get()) {
            throw new BackpressureException(BackpressureException.BackpressureReason.PIPELINE_STOPPED,
                    "round " + round.sequence());
        }

        CompletableFuture<ReconcileResult> completion = new CompletableFuture<>();

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            metricsRegistry.incrementDroppedRounds();
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "round " + round.sequence() + ", remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        try {
            RoundEvent event = ringBuffer.get(sequence);
            event.initialize(round, completion);
        } finally {
            ringBuffer.publish(sequence);
        }

        log.debug("Round published: round={}, sequence={}", round.sequence(), sequence);
        return completion;
    }

    @Override
    public void accept(Round round) {
        submit(round);
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Drains published rounds, then stops the consumer threads.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down RoundPipeline...");
            try {
                disruptor.shutdown(10, TimeUnit.SECONDS);
                log.info("RoundPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("RoundPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for Disruptor consumer threads.
     */
    private static class PipelineThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        PipelineThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Exception handler for Disruptor.
     */
    private static class PipelineExceptionHandler
            implements com.lmax.disruptor.ExceptionHandler<RoundEvent> {

        private static final Logger log = LoggerFactory.getLogger(PipelineExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, RoundEvent event) {
            log.error("Exception in round handler: sequence={}, event={}", sequence, event, ex);

            if (event.getCompletion() != null && !event.getCompletion().isDone()) {
                event.getCompletion().completeExceptionally(ex);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for RoundPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 64;
        private String waitStrategy = "blocking";
        private StateReconciler reconciler;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder reconciler(StateReconciler reconciler) {
            this.reconciler = reconciler;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(WatchmanConfig config) {
            ringBufferSize(config.getPipeline().getRingBufferSize());
            this.waitStrategy = config.getPipeline().getWaitStrategy();
            return this;
        }

        public RoundPipeline build() {
            if (reconciler == null) {
                throw new IllegalStateException("StateReconciler is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new RoundPipeline(this);
        }
    }
}
