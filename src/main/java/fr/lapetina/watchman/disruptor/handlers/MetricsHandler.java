package fr.lapetina.watchman.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.watchman.domain.event.RoundEvent;
import fr.lapetina.watchman.domain.model.ProbeResult;
import fr.lapetina.watchman.domain.reconcile.ReconcileResult;
import fr.lapetina.watchman.domain.reconcile.Round;
import fr.lapetina.watchman.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records probe, round and fleet metrics for each reconciled round.
 */
public final class MetricsHandler implements EventHandler<RoundEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(RoundEvent event, long sequence, boolean endOfBatch) {
        Round round = event.getRound();
        if (round == null) {
            return;
        }

        try {
            for (ProbeResult result : round.results()) {
                metricsRegistry.recordProbe(result.outcome(), result.latency());
            }

            ReconcileResult result = event.getResult();
            boolean applied = result != null && result.applied();
            metricsRegistry.recordRound(round.duration(), round.stragglers(), applied);

            if (applied) {
                metricsRegistry.setFleetHealth(result.healthy(), result.unhealthy());
                for (ReconcileResult.Transition transition : result.transitions()) {
                    metricsRegistry.recordTransition(transition.to());
                }
            }
        } catch (Exception e) {
            // Metrics must never fail the round
            log.warn("Failed to record round metrics: round={}", round.sequence(), e);
        }
    }
}
