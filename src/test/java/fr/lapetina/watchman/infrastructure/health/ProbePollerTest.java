package fr.lapetina.watchman.infrastructure.health;

import fr.lapetina.watchman.domain.model.DeploymentTarget;
import fr.lapetina.watchman.domain.model.ProbeOutcome;
import fr.lapetina.watchman.domain.model.ProbeResult;
import fr.lapetina.watchman.domain.reconcile.Round;
import fr.lapetina.watchman.infrastructure.http.ProbeClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProbePollerTest {

    private TargetRegistry registry;
    private ProbePoller poller;

    @BeforeEach
    void setUp() {
        registry = new TargetRegistry();
    }

    @AfterEach
    void tearDown() {
        if (poller != null) {
            poller.close();
        }
    }

    private void register(String... names) {
        for (String name : names) {
            registry.register(DeploymentTarget.builder().name(name).endpoint("http://" + name + ".test").build());
        }
    }

    private ProbePoller poller(ProbeClient client, long timeoutMs, long deadlineMs, int maxInFlight) {
        poller = new ProbePoller(registry, client, round -> { },
                Duration.ofMillis(deadlineMs * 4),
                Duration.ofMillis(timeoutMs),
                Duration.ofMillis(deadlineMs),
                maxInFlight,
                Clock.systemUTC());
        return poller;
    }

    /**
     * Probe client driven by a function of (target, timeout).
     */
    private static ProbeClient stub(BiFunction<DeploymentTarget, Duration, CompletableFuture<ProbeResult>> behavior) {
        return behavior::apply;
    }

    private static CompletableFuture<ProbeResult> healthyNow(DeploymentTarget target) {
        return CompletableFuture.completedFuture(
                ProbeResult.healthy(target.getName(), Clock.systemUTC().instant(), null, Duration.ZERO));
    }

    private static Map<String, ProbeResult> byTarget(Round round) {
        return round.resultsByTarget();
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("should reject a probe timeout longer than the round deadline")
        void shouldRejectTimeoutAboveDeadline() {
            assertThatThrownBy(() -> new ProbePoller(registry, stub((t, d) -> healthyNow(t)), round -> { },
                    Duration.ofSeconds(10), Duration.ofSeconds(3), Duration.ofSeconds(2), 1, Clock.systemUTC()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("round deadline");
        }

        @Test
        @DisplayName("should reject a round deadline not shorter than the interval")
        void shouldRejectDeadlineAtInterval() {
            assertThatThrownBy(() -> new ProbePoller(registry, stub((t, d) -> healthyNow(t)), round -> { },
                    Duration.ofSeconds(10), Duration.ofSeconds(1), Duration.ofSeconds(10), 1, Clock.systemUTC()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("poll interval");
        }

        @Test
        @DisplayName("should reject a non-positive concurrency bound")
        void shouldRejectZeroInFlight() {
            assertThatThrownBy(() -> new ProbePoller(registry, stub((t, d) -> healthyNow(t)), round -> { },
                    Duration.ofSeconds(10), Duration.ofSeconds(1), Duration.ofSeconds(2), 0, Clock.systemUTC()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("pollOnce")
    class PollOnce {

        @Test
        @DisplayName("should probe every registered target once")
        void shouldProbeEveryTarget() {
            register("a", "b", "c");
            AtomicInteger calls = new AtomicInteger();
            poller(stub((t, d) -> {
                calls.incrementAndGet();
                return healthyNow(t);
            }), 100, 500, 4);

            Round round = poller.pollOnce();

            assertThat(calls.get()).isEqualTo(3);
            assertThat(round.results()).extracting(ProbeResult::targetName).containsExactly("a", "b", "c");
            assertThat(round.results()).allMatch(ProbeResult::isHealthy);
            assertThat(round.stragglers()).isZero();
        }

        @Test
        @DisplayName("should number rounds monotonically")
        void shouldNumberRounds() {
            register("a");
            poller(stub((t, d) -> healthyNow(t)), 100, 500, 1);

            assertThat(poller.pollOnce().sequence()).isEqualTo(1);
            assertThat(poller.pollOnce().sequence()).isEqualTo(2);
            assertThat(poller.getLastRoundSequence()).isEqualTo(2);
        }

        @Test
        @DisplayName("should close an empty round when nothing is registered")
        void shouldHandleEmptyRegistry() {
            poller(stub((t, d) -> healthyNow(t)), 100, 500, 1);

            Round round = poller.pollOnce();

            assertThat(round.results()).isEmpty();
        }

        @Test
        @DisplayName("should never exceed the in-flight bound")
        void shouldBoundConcurrency() {
            register("a", "b", "c", "d", "e", "f");
            AtomicInteger current = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            Executor later = CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS);

            poller(stub((t, d) -> {
                peak.accumulateAndGet(current.incrementAndGet(), Math::max);
                return CompletableFuture.supplyAsync(() -> {
                    current.decrementAndGet();
                    return ProbeResult.healthy(t.getName(), Clock.systemUTC().instant(), null, Duration.ofMillis(50));
                }, later);
            }), 500, 2000, 2);

            Round round = poller.pollOnce();

            assertThat(peak.get()).isLessThanOrEqualTo(2);
            assertThat(round.results()).hasSize(6).allMatch(ProbeResult::isHealthy);
            assertThat(poller.getInFlightProbes()).isZero();
        }

        @Test
        @DisplayName("should synthesize a timeout for a probe that never answers")
        void shouldTimeOutSlowProbe() {
            register("fast", "slow");
            poller(stub((t, d) -> t.getName().equals("slow") ? new CompletableFuture<>() : healthyNow(t)),
                    100, 1000, 2);

            Round round = poller.pollOnce();

            ProbeResult slow = byTarget(round).get("slow");
            assertThat(slow.outcome()).isEqualTo(ProbeOutcome.TIMEOUT);
            assertThat(slow.reason()).isEqualTo("No answer within 100ms");
            assertThat(byTarget(round).get("fast").isHealthy()).isTrue();
            assertThat(round.stragglers()).isZero();
        }

        @Test
        @DisplayName("should abandon probes still running at the round deadline")
        void shouldAbandonStragglers() {
            register("first", "second");
            poller(stub((t, d) -> new CompletableFuture<>()), 250, 300, 1);

            long started = System.nanoTime();
            Round round = poller.pollOnce();
            long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertThat(round.results()).hasSize(2)
                    .allMatch(r -> r.outcome() == ProbeOutcome.TIMEOUT);
            assertThat(round.stragglers()).isEqualTo(1);
            assertThat(byTarget(round).get("second").reason()).contains("Abandoned at round deadline");
            assertThat(tookMs).isLessThan(2000);
        }

        @Test
        @DisplayName("should isolate a failing probe from the rest of the round")
        void shouldIsolateFailures() {
            register("throws", "fails", "ok");
            poller(stub((t, d) -> {
                switch (t.getName()) {
                    case "throws":
                        throw new IllegalStateException("boom");
                    case "fails":
                        return CompletableFuture.failedFuture(new RuntimeException("kaput"));
                    default:
                        return healthyNow(t);
                }
            }), 100, 500, 1);

            Round round = poller.pollOnce();
            Map<String, ProbeResult> results = byTarget(round);

            assertThat(results.get("throws").outcome()).isEqualTo(ProbeOutcome.UNREACHABLE);
            assertThat(results.get("throws").reason()).contains("boom");
            assertThat(results.get("fails").outcome()).isEqualTo(ProbeOutcome.UNREACHABLE);
            assertThat(results.get("fails").reason()).contains("kaput");
            assertThat(results.get("ok").isHealthy()).isTrue();
            assertThat(poller.getInFlightProbes()).isZero();
        }

        @Test
        @DisplayName("should pass the configured timeout to the probe client")
        void shouldPassTimeout() {
            register("a");
            BlockingQueue<Duration> seen = new LinkedBlockingQueue<>();
            poller(stub((t, d) -> {
                seen.add(d);
                return healthyNow(t);
            }), 123, 500, 1);

            poller.pollOnce();

            assertThat(seen).containsExactly(Duration.ofMillis(123));
        }
    }

    @Test
    @DisplayName("should hand each round to the sink when started")
    void shouldHandRoundsToSink() throws Exception {
        register("a");
        BlockingQueue<Round> rounds = new LinkedBlockingQueue<>();
        poller = new ProbePoller(registry, stub((t, d) -> healthyNow(t)), rounds::add,
                Duration.ofMillis(100), Duration.ofMillis(20), Duration.ofMillis(50), 1, Clock.systemUTC());

        poller.start();

        Round first = rounds.poll(5, TimeUnit.SECONDS);
        Round second = rounds.poll(5, TimeUnit.SECONDS);
        assertThat(first).isNotNull();
        assertThat(second).isNotNull();
        assertThat(second.sequence()).isGreaterThan(first.sequence());
        assertThat(poller.isRunning()).isTrue();

        poller.close();
        assertThat(poller.isRunning()).isFalse();
    }

    @Test
    @DisplayName("should keep polling after the sink throws")
    void shouldSurviveSinkFailure() throws Exception {
        register("a");
        BlockingQueue<Long> sequences = new LinkedBlockingQueue<>();
        poller = new ProbePoller(registry, stub((t, d) -> healthyNow(t)), round -> {
            sequences.add(round.sequence());
            throw new IllegalStateException("sink down");
        }, Duration.ofMillis(100), Duration.ofMillis(20), Duration.ofMillis(50), 1, Clock.systemUTC());

        poller.start();

        assertThat(sequences.poll(5, TimeUnit.SECONDS)).isEqualTo(1L);
        assertThat(sequences.poll(5, TimeUnit.SECONDS)).isEqualTo(2L);
    }
}
