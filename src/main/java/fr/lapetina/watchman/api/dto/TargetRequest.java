package fr.lapetina.watchman.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import fr.lapetina.watchman.domain.model.DeploymentTarget;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of {@code POST /targets}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TargetRequest {

    private String name;
    private String endpoint;

    @JsonAlias({"expected-metadata", "expectedMetadata"})
    private Map<String, String> metadata = new LinkedHashMap<>();

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

    public Map<String, String> getMetadata() { return metadata; }
    public void setMetadata(Map<String, String> metadata) { this.metadata = metadata; }

    /**
     * Converts to a domain target registered through the API.
     *
     * @throws IllegalArgumentException if name or endpoint is missing or invalid
     */
    public DeploymentTarget toDeploymentTarget() {
        return DeploymentTarget.builder()
                .name(name)
                .endpoint(endpoint)
                .expectedMetadata(metadata)
                .source(DeploymentTarget.Source.API)
                .build();
    }
}
