package fr.lapetina.watchman.infrastructure.http;

import fr.lapetina.watchman.domain.model.DeploymentTarget;
import fr.lapetina.watchman.domain.model.ProbeResult;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Performs a single health check against one deployed instance.
 */
public interface ProbeClient {

    /**
     * Probes a target.
     *
     * The returned future never completes exceptionally: every failure mode is
     * reported as a {@link ProbeResult} outcome. It completes no later than
     * {@code timeout} after the call, with a TIMEOUT result if necessary.
     *
     * @param target  target to check
     * @param timeout upper bound for the whole check
     * @return future completing with the probe outcome
     */
    CompletableFuture<ProbeResult> probe(DeploymentTarget target, Duration timeout);
}
