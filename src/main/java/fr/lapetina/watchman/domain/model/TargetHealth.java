package fr.lapetina.watchman.domain.model;

/**
 * Health classification of a deployment target.
 *
 * HEALTHY: Serving the expected model, or failing for fewer rounds than the threshold
 * UNHEALTHY: Failed at least the configured number of consecutive probes
 */
public enum TargetHealth {
    HEALTHY,
    UNHEALTHY
}
