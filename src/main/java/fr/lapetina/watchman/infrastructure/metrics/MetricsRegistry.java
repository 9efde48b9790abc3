package fr.lapetina.watchman.infrastructure.metrics;

import fr.lapetina.watchman.domain.model.ProbeOutcome;
import fr.lapetina.watchman.domain.model.TargetHealth;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Probe counters and latency per outcome
 * - Round duration, applied/discarded rounds and stragglers
 * - Health transition counters
 * - Fleet gauges (registered, healthy, unhealthy)
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<ProbeOutcome, Counter> probeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ProbeOutcome, Timer> probeTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> roundCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<TargetHealth, Counter> transitionCounters = new ConcurrentHashMap<>();

    private final Timer roundDuration;
    private final Counter stragglers;
    private final Counter droppedRounds;

    // Fleet gauges, updated after each applied round
    private final AtomicInteger healthyTargets = new AtomicInteger(0);
    private final AtomicInteger unhealthyTargets = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_targets_healthy", healthyTargets, AtomicInteger::get)
                .description("Targets classified HEALTHY in the latest applied round")
                .register(registry);

        Gauge.builder(prefix + "_targets_unhealthy", unhealthyTargets, AtomicInteger::get)
                .description("Targets classified UNHEALTHY in the latest applied round")
                .register(registry);

        this.roundDuration = Timer.builder(prefix + "_round_duration")
                .description("Time from registry snapshot to round close")
                .publishPercentileHistogram()
                .register(registry);

        this.stragglers = Counter.builder(prefix + "_probe_stragglers_total")
                .description("Probes abandoned at the round deadline")
                .register(registry);

        this.droppedRounds = Counter.builder(prefix + "_rounds_dropped_total")
                .description("Rounds that could not be handed off for reconciliation")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("watchman");
    }

    /**
     * Counts one probe and records its latency when known.
     */
    public void recordProbe(ProbeOutcome outcome, Duration latency) {
        probeCounters.computeIfAbsent(outcome, o ->
                Counter.builder(prefix + "_probes_total")
                        .description("Total number of probes")
                        .tag("outcome", o.name())
                        .register(registry)
        ).increment();

        if (latency != null) {
            probeTimers.computeIfAbsent(outcome, o ->
                    Timer.builder(prefix + "_probe_latency")
                            .description("Probe latency")
                            .tag("outcome", o.name())
                            .publishPercentiles(0.5, 0.9, 0.99)
                            .register(registry)
            ).record(latency);
        }
    }

    /**
     * Records a closed round.
     */
    public void recordRound(Duration duration, int roundStragglers, boolean applied) {
        roundDuration.record(duration);
        if (roundStragglers > 0) {
            stragglers.increment(roundStragglers);
        }
        String result = applied ? "applied" : "discarded";
        roundCounters.computeIfAbsent(result, r ->
                Counter.builder(prefix + "_rounds_total")
                        .description("Total number of reconciled rounds")
                        .tag("result", r)
                        .register(registry)
        ).increment();
    }

    public void incrementDroppedRounds() {
        droppedRounds.increment();
    }

    /**
     * Counts a health transition, tagged with the new classification.
     */
    public void recordTransition(TargetHealth to) {
        transitionCounters.computeIfAbsent(to, h ->
                Counter.builder(prefix + "_health_transitions_total")
                        .description("Total number of health classification changes")
                        .tag("to", h.name())
                        .register(registry)
        ).increment();
    }

    public void setFleetHealth(int healthy, int unhealthy) {
        healthyTargets.set(healthy);
        unhealthyTargets.set(unhealthy);
    }

    /**
     * Registers a gauge backed by a live value (e.g. registry size).
     */
    public void registerGauge(String name, String description, Supplier<Number> value) {
        Gauge.builder(prefix + "_" + name, value)
                .description(description)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
