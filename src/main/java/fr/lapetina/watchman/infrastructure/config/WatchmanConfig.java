package fr.lapetina.watchman.infrastructure.config;

import fr.lapetina.watchman.domain.model.DeploymentTarget;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for Watchman.
 * Designed to be populated from YAML.
 */
public class WatchmanConfig {

    private ServerConfig server = new ServerConfig();
    private ProjectConfig project = new ProjectConfig();
    private List<TargetConfig> targets = new ArrayList<>();
    private PollingConfig polling = new PollingConfig();
    private PipelineConfig pipeline = new PipelineConfig();
    private HttpConfig http = new HttpConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public ProjectConfig getProject() { return project; }
    public void setProject(ProjectConfig project) { this.project = project; }

    public List<TargetConfig> getTargets() { return targets; }
    public void setTargets(List<TargetConfig> targets) { this.targets = targets; }

    public PollingConfig getPolling() { return polling; }
    public void setPolling(PollingConfig polling) { this.polling = polling; }

    public PipelineConfig getPipeline() { return pipeline; }
    public void setPipeline(PipelineConfig pipeline) { this.pipeline = pipeline; }

    public HttpConfig getHttp() { return http; }
    public void setHttp(HttpConfig http) { this.http = http; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 5555;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int threads = 8;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * Project this Watchman instance reports on.
     */
    public static class ProjectConfig {
        private String name = "default";
        private String version = "0";

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }
    }

    /**
     * Statically configured deployment target.
     */
    public static class TargetConfig {
        private String name;
        private String endpoint;
        private Map<String, String> metadata = new LinkedHashMap<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public Map<String, String> getMetadata() { return metadata; }
        public void setMetadata(Map<String, String> metadata) { this.metadata = metadata; }

        /**
         * Builds the registry entry for this target.
         *
         * @throws IllegalArgumentException if the name or endpoint is unusable
         */
        public DeploymentTarget toTarget() {
            return DeploymentTarget.builder()
                    .name(name)
                    .endpoint(endpoint)
                    .expectedMetadata(metadata)
                    .source(DeploymentTarget.Source.CONFIG)
                    .build();
        }
    }

    /**
     * Poll loop and debounce configuration.
     */
    public static class PollingConfig {
        private long intervalMs = 30000;
        private long probeTimeoutMs = 5000;
        private long roundDeadlineMs = 20000;
        private int maxInFlightProbes = 16;
        private int failureThreshold = 3;

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getProbeTimeoutMs() { return probeTimeoutMs; }
        public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }

        public long getRoundDeadlineMs() { return roundDeadlineMs; }
        public void setRoundDeadlineMs(long roundDeadlineMs) { this.roundDeadlineMs = roundDeadlineMs; }

        public int getMaxInFlightProbes() { return maxInFlightProbes; }
        public void setMaxInFlightProbes(int maxInFlightProbes) { this.maxInFlightProbes = maxInFlightProbes; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
    }

    /**
     * LMAX Disruptor configuration for the round pipeline.
     */
    public static class PipelineConfig {
        private int ringBufferSize = 64;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Outbound HTTP client configuration.
     */
    public static class HttpConfig {
        private long connectTimeoutMs = 2000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "watchman";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
