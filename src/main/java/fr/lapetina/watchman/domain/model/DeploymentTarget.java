package fr.lapetina.watchman.domain.model;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A model deployment Watchman is responsible for monitoring.
 *
 * Immutable: a registration change always produces a new instance that
 * replaces the previous one in the registry.
 */
public final class DeploymentTarget {

    /**
     * Where the registration came from. Config reloads only touch CONFIG targets.
     */
    public enum Source {
        CONFIG,
        API
    }

    private final String name;
    private final URI endpoint;
    private final Map<String, String> expectedMetadata;
    private final Source source;

    private DeploymentTarget(Builder builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("Target name is required");
        }
        if (builder.name.contains("/")) {
            throw new IllegalArgumentException("Target name must not contain '/': " + builder.name);
        }
        this.name = builder.name;
        this.endpoint = validateEndpoint(builder.endpoint);
        this.expectedMetadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.expectedMetadata));
        this.source = Objects.requireNonNull(builder.source, "Source is required");
    }

    private static URI validateEndpoint(URI endpoint) {
        if (endpoint == null) {
            throw new IllegalArgumentException("Target endpoint is required");
        }
        String scheme = endpoint.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Target endpoint must be an http(s) URL: " + endpoint);
        }
        if (endpoint.getHost() == null) {
            throw new IllegalArgumentException("Target endpoint has no host: " + endpoint);
        }
        return endpoint;
    }

    public String getName() {
        return name;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    /**
     * Metadata the serving instance must report, keyed by dotted path into its
     * metadata document (e.g. {@code metadata.user-defined.machine-name}).
     */
    public Map<String, String> getExpectedMetadata() {
        return expectedMetadata;
    }

    public Source getSource() {
        return source;
    }

    /**
     * Resolves a path below the endpoint, tolerating a trailing slash on the base URL.
     */
    public URI resolve(String path) {
        String base = endpoint.toString().replaceAll("/+$", "");
        return URI.create(base + "/" + path);
    }

    /**
     * True when {@code other} points at the same deployment: same endpoint and same
     * expected metadata. The registration source is ignored.
     */
    public boolean isSameDeployment(DeploymentTarget other) {
        return other != null
                && endpoint.equals(other.endpoint)
                && expectedMetadata.equals(other.expectedMetadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeploymentTarget that = (DeploymentTarget) o;
        return name.equals(that.name)
                && endpoint.equals(that.endpoint)
                && expectedMetadata.equals(that.expectedMetadata)
                && source == that.source;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, endpoint, expectedMetadata, source);
    }

    @Override
    public String toString() {
        return "DeploymentTarget{" +
                "name='" + name + '\'' +
                ", endpoint=" + endpoint +
                ", source=" + source +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private URI endpoint;
        private final Map<String, String> expectedMetadata = new LinkedHashMap<>();
        private Source source = Source.API;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder endpoint(String url) {
            if (url == null) {
                this.endpoint = null;
                return this;
            }
            try {
                this.endpoint = URI.create(url.trim());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid target endpoint: " + url, e);
            }
            return this;
        }

        public Builder endpoint(URI url) {
            this.endpoint = url;
            return this;
        }

        public Builder expect(String path, String value) {
            this.expectedMetadata.put(path, value);
            return this;
        }

        public Builder expectedMetadata(Map<String, String> metadata) {
            if (metadata != null) {
                this.expectedMetadata.putAll(metadata);
            }
            return this;
        }

        public Builder source(Source source) {
            this.source = source;
            return this;
        }

        public DeploymentTarget build() {
            return new DeploymentTarget(this);
        }
    }
}
