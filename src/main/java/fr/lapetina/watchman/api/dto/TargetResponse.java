package fr.lapetina.watchman.api.dto;

import fr.lapetina.watchman.domain.model.DeploymentTarget;

import java.util.Map;

/**
 * A registered target as returned by the API.
 */
public record TargetResponse(
        String name,
        String endpoint,
        Map<String, String> metadata,
        String source
) {
    public static TargetResponse from(DeploymentTarget target) {
        return new TargetResponse(
                target.getName(),
                target.getEndpoint().toString(),
                target.getExpectedMetadata(),
                target.getSource().name()
        );
    }
}
