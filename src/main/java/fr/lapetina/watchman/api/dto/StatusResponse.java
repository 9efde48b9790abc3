package fr.lapetina.watchman.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.watchman.domain.model.StatusEntry;

import java.time.Instant;

/**
 * API view of a {@link StatusEntry}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusResponse(
        String name,
        String health,
        @JsonProperty("consecutive-failures") int consecutiveFailures,
        @JsonProperty("last-success") Instant lastSuccess,
        @JsonProperty("last-transition") Instant lastTransition,
        @JsonProperty("last-probed") Instant lastProbed,
        @JsonProperty("last-outcome") String lastOutcome,
        @JsonProperty("last-reason") String lastReason,
        long round
) {
    public static StatusResponse from(StatusEntry entry) {
        return new StatusResponse(
                entry.name(),
                entry.health().name(),
                entry.consecutiveFailures(),
                entry.lastSuccess(),
                entry.lastTransition(),
                entry.lastProbedAt(),
                entry.lastOutcome() != null ? entry.lastOutcome().name() : null,
                entry.lastReason(),
                entry.round()
        );
    }
}
