package fr.lapetina.watchman.domain.model;

/**
 * Closed set of probe outcomes.
 * The reconciler classifies on this value alone and never looks at raw responses.
 */
public enum ProbeOutcome {
    /** Endpoint answered, reported itself healthy and serves the expected model */
    HEALTHY,

    /** Endpoint answered but is degraded, malformed, or serving the wrong model */
    UNHEALTHY,

    /** Endpoint could not be reached (connection refused, DNS failure, I/O error) */
    UNREACHABLE,

    /** No answer within the probe timeout or the round deadline */
    TIMEOUT
}
