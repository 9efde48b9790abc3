package fr.lapetina.watchman.disruptor;

import fr.lapetina.watchman.disruptor.exception.BackpressureException;
import fr.lapetina.watchman.domain.model.DeploymentTarget;
import fr.lapetina.watchman.domain.model.ProbeResult;
import fr.lapetina.watchman.domain.model.TargetHealth;
import fr.lapetina.watchman.domain.reconcile.ReconcileResult;
import fr.lapetina.watchman.domain.reconcile.Round;
import fr.lapetina.watchman.domain.reconcile.StateReconciler;
import fr.lapetina.watchman.infrastructure.health.StatusStore;
import fr.lapetina.watchman.infrastructure.health.TargetRegistry;
import fr.lapetina.watchman.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class RoundPipelineTest {

    private TargetRegistry registry;
    private StatusStore store;
    private StateReconciler reconciler;
    private MetricsRegistry metrics;
    private RoundPipeline pipeline;

    @BeforeEach
    void setUp() {
        registry = new TargetRegistry();
        registry.register(DeploymentTarget.builder().name("a").endpoint("http://a.test").build());
        store = new StatusStore();
        reconciler = new StateReconciler(registry, store, 2);
        metrics = new MetricsRegistry("pipeline_test");
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
        metrics.close();
    }

    private RoundPipeline pipeline(int ringBufferSize) {
        pipeline = RoundPipeline.builder()
                .ringBufferSize(ringBufferSize)
                .waitStrategy("blocking")
                .reconciler(reconciler)
                .metricsRegistry(metrics)
                .build();
        return pipeline;
    }

    private static Round round(long sequence, boolean healthy) {
        Instant at = Instant.parse("2024-01-01T00:00:00Z").plusSeconds(sequence);
        ProbeResult result = healthy
                ? ProbeResult.healthy("a", at, null, Duration.ofMillis(3))
                : ProbeResult.unreachable("a", at, "Connection refused", Duration.ofMillis(3));
        return Round.of(sequence, at, List.of(result));
    }

    @Test
    @DisplayName("should reconcile a submitted round and complete its future")
    void shouldReconcileRound() throws Exception {
        pipeline(8).start();

        ReconcileResult result = pipeline.submit(round(1, true)).get(5, TimeUnit.SECONDS);

        assertThat(result.applied()).isTrue();
        assertThat(result.round()).isEqualTo(1);
        assertThat(store.get("a").orElseThrow().health()).isEqualTo(TargetHealth.HEALTHY);
        assertThat(store.current().round()).isEqualTo(1);
    }

    @Test
    @DisplayName("should apply rounds in submission order")
    void shouldApplyInOrder() throws Exception {
        pipeline(8).start();

        List<CompletableFuture<ReconcileResult>> futures = new ArrayList<>();
        for (long sequence = 1; sequence <= 20; sequence++) {
            futures.add(pipeline.submit(round(sequence, sequence % 3 != 0)));
            // Wait for a free slot instead of tripping backpressure
            while (pipeline.getRemainingCapacity() == 0) {
                Thread.sleep(1);
            }
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        assertThat(futures).allSatisfy(f -> assertThat(f.join().applied()).isTrue());
        assertThat(reconciler.getLastAppliedRound()).isEqualTo(20);
        assertThat(store.current().round()).isEqualTo(20);
    }

    @Test
    @DisplayName("should report a delayed older round as discarded")
    void shouldDiscardDelayedRound() throws Exception {
        pipeline(8).start();

        pipeline.submit(round(5, true)).get(5, TimeUnit.SECONDS);
        ReconcileResult stale = pipeline.submit(round(4, false)).get(5, TimeUnit.SECONDS);

        assertThat(stale.applied()).isFalse();
        assertThat(store.current().round()).isEqualTo(5);
        assertThat(store.get("a").orElseThrow().consecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("should refuse rounds before start")
    void shouldRefuseBeforeStart() {
        pipeline(8);

        assertThatThrownBy(() -> pipeline.submit(round(1, true)))
                .isInstanceOf(BackpressureException.class)
                .extracting(e -> ((BackpressureException) e).getReason())
                .isEqualTo(BackpressureException.BackpressureReason.PIPELINE_STOPPED);
    }

    @Test
    @DisplayName("should reject rounds when reconciliation falls behind")
    void shouldRejectWhenFull() throws Exception {
        pipeline(2).start();
        List<CompletableFuture<ReconcileResult>> accepted = new ArrayList<>();
        BackpressureException rejected = null;

        // Holding the reconciler's monitor stalls the consumer
        synchronized (reconciler) {
            for (long sequence = 1; sequence <= 10 && rejected == null; sequence++) {
                long next = sequence;
                rejected = catchThrowableOfType(() -> accepted.add(pipeline.submit(round(next, true))),
                        BackpressureException.class);
            }
        }

        assertThat(rejected).isNotNull();
        assertThat(rejected.getReason()).isEqualTo(BackpressureException.BackpressureReason.RING_BUFFER_FULL);
        assertThat(accepted).isNotEmpty();

        CompletableFuture.allOf(accepted.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
        assertThat(metrics.getRegistry().get("pipeline_test_rounds_dropped_total").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should record probe and round metrics")
    void shouldRecordMetrics() throws Exception {
        pipeline(8).start();

        pipeline.submit(round(1, false)).get(5, TimeUnit.SECONDS);
        pipeline.submit(round(2, false)).get(5, TimeUnit.SECONDS);

        assertThat(metrics.getRegistry().get("pipeline_test_probes_total")
                .tag("outcome", "UNREACHABLE").counter().count()).isEqualTo(2.0);
        assertThat(metrics.getRegistry().get("pipeline_test_targets_unhealthy").gauge().value()).isEqualTo(1.0);
        assertThat(metrics.scrape()).contains("pipeline_test_round_duration");
    }

    @Test
    @DisplayName("should reject a ring buffer size that is not a power of two")
    void shouldRejectInvalidRingBufferSize() {
        assertThatThrownBy(() -> RoundPipeline.builder().ringBufferSize(6))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
