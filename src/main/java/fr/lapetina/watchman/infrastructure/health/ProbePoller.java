package fr.lapetina.watchman.infrastructure.health;

import fr.lapetina.watchman.disruptor.exception.BackpressureException;
import fr.lapetina.watchman.domain.model.DeploymentTarget;
import fr.lapetina.watchman.domain.model.ProbeResult;
import fr.lapetina.watchman.domain.reconcile.Round;
import fr.lapetina.watchman.infrastructure.http.ProbeClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic poll loop: one round per tick.
 *
 * Each round snapshots the registry, probes every target with at most
 * {@code maxInFlight} probes running at once, and closes at the round
 * deadline whether or not every probe has answered. Probes still running at
 * that point are abandoned and recorded as TIMEOUT; their late answers are
 * dropped. The closed round is handed to the {@link RoundSink} exactly once.
 */
public final class ProbePoller implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProbePoller.class);

    private final TargetRegistry registry;
    private final ProbeClient probeClient;
    private final RoundSink sink;
    private final Duration interval;
    private final Duration probeTimeout;
    private final Duration roundDeadline;
    private final int maxInFlight;
    private final Semaphore inFlight;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong roundSequence = new AtomicLong(0);

    public ProbePoller(
            TargetRegistry registry,
            ProbeClient probeClient,
            RoundSink sink,
            Duration interval,
            Duration probeTimeout,
            Duration roundDeadline,
            int maxInFlight,
            Clock clock
    ) {
        if (probeTimeout.isZero() || probeTimeout.isNegative()) {
            throw new IllegalArgumentException("Probe timeout must be positive: " + probeTimeout);
        }
        if (probeTimeout.compareTo(roundDeadline) > 0) {
            throw new IllegalArgumentException("Probe timeout " + probeTimeout
                    + " must not exceed round deadline " + roundDeadline);
        }
        if (roundDeadline.compareTo(interval) >= 0) {
            throw new IllegalArgumentException("Round deadline " + roundDeadline
                    + " must be shorter than poll interval " + interval);
        }
        if (maxInFlight < 1) {
            throw new IllegalArgumentException("maxInFlight must be >= 1: " + maxInFlight);
        }
        this.registry = registry;
        this.probeClient = probeClient;
        this.sink = sink;
        this.interval = interval;
        this.probeTimeout = probeTimeout;
        this.roundDeadline = roundDeadline;
        this.maxInFlight = maxInFlight;
        this.inFlight = new Semaphore(maxInFlight);
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "probe-poller");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic polling. The first round runs immediately.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleAtFixedRate(
                    this::tick,
                    0,
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Probe poller started: interval={}, probeTimeout={}, roundDeadline={}, maxInFlight={}",
                    interval, probeTimeout, roundDeadline, maxInFlight);
        }
    }

    private void tick() {
        if (!running.get()) {
            return;
        }
        try {
            Round round = pollOnce();
            sink.accept(round);
        } catch (BackpressureException e) {
            log.warn("Round dropped: {}", e.getMessage());
        } catch (Exception e) {
            // Never let one bad round cancel the schedule
            log.error("Poll round failed", e);
        }
    }

    /**
     * Runs one complete round and returns it without handing it off.
     */
    public Round pollOnce() {
        long sequence = roundSequence.incrementAndGet();
        Instant startedAt = clock.instant();
        long deadlineNanos = System.nanoTime() + roundDeadline.toNanos();

        Collection<DeploymentTarget> targets = registry.snapshot().values();
        log.debug("Round started: round={}, targetCount={}", sequence, targets.size());

        Map<String, CompletableFuture<ProbeResult>> pending = new LinkedHashMap<>();
        for (DeploymentTarget target : targets) {
            pending.put(target.getName(), dispatch(target, deadlineNanos));
        }

        awaitRound(sequence, pending.values(), deadlineNanos);

        List<ProbeResult> results = new ArrayList<>(pending.size());
        int stragglers = 0;
        for (Map.Entry<String, CompletableFuture<ProbeResult>> entry : pending.entrySet()) {
            CompletableFuture<ProbeResult> future = entry.getValue();
            if (future.isDone() && !future.isCompletedExceptionally()) {
                results.add(future.join());
            } else {
                stragglers++;
                results.add(ProbeResult.timeout(entry.getKey(), clock.instant(),
                        "Abandoned at round deadline of round " + sequence));
            }
        }

        Round round = new Round(sequence, startedAt, clock.instant(), results, stragglers);
        long failed = results.stream().filter(r -> !r.isHealthy()).count();
        if (stragglers > 0 || failed > 0) {
            log.info("Round closed: round={}, targets={}, failed={}, stragglers={}, durationMs={}",
                    sequence, results.size(), failed, stragglers, round.duration().toMillis());
        } else {
            log.debug("Round closed: round={}, targets={}, durationMs={}",
                    sequence, results.size(), round.duration().toMillis());
        }
        return round;
    }

    /**
     * Waits for a free probe slot (until the round deadline at most) and starts the probe.
     * The slot is released when the probe completes or times out, whichever comes first.
     */
    private CompletableFuture<ProbeResult> dispatch(DeploymentTarget target, long deadlineNanos) {
        String name = target.getName();
        try {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0 || !inFlight.tryAcquire(remaining, TimeUnit.NANOSECONDS)) {
                log.debug("No probe slot before round deadline: target={}", name);
                return CompletableFuture.completedFuture(ProbeResult.timeout(name, clock.instant(),
                        "No probe slot free before round deadline"));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.completedFuture(ProbeResult.timeout(name, clock.instant(),
                    "Interrupted while waiting for a probe slot"));
        }

        CompletableFuture<ProbeResult> probe;
        try {
            probe = probeClient.probe(target, probeTimeout);
        } catch (Exception e) {
            inFlight.release();
            log.error("Probe client threw instead of returning a result: target={}", name, e);
            return CompletableFuture.completedFuture(ProbeResult.unreachable(name, clock.instant(),
                    "Probe error: " + e.getMessage(), null));
        }

        // The HTTP client bounds all of a probe's requests by the same timeout,
        // so releasing the permit here does not leave requests running
        return probe
                .orTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, ex) -> {
                    inFlight.release();
                    if (ex == null && result != null) {
                        return result;
                    }
                    return failureResult(name, ex);
                });
    }

    private ProbeResult failureResult(String name, Throwable ex) {
        Throwable cause = ex != null && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException) {
            return ProbeResult.timeout(name, clock.instant(), "No answer within " + probeTimeout.toMillis() + "ms");
        }
        String message = cause == null ? "Probe returned no result" : cause.getMessage();
        return ProbeResult.unreachable(name, clock.instant(), "Probe error: " + message, null);
    }

    private void awaitRound(long sequence, Collection<CompletableFuture<ProbeResult>> futures, long deadlineNanos) {
        if (futures.isEmpty()) {
            return;
        }
        long remaining = deadlineNanos - System.nanoTime();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.warn("Round deadline reached with probes outstanding: round={}, deadline={}", sequence, roundDeadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for round: round={}", sequence);
        } catch (ExecutionException e) {
            log.error("Unexpected probe failure in round: round={}", sequence, e);
        }
    }

    /**
     * Number of probe slots currently held.
     */
    public int getInFlightProbes() {
        return maxInFlight - inFlight.availablePermits();
    }

    public long getLastRoundSequence() {
        return roundSequence.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Probe poller stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
