package fr.lapetina.watchman;

import fr.lapetina.watchman.disruptor.RoundPipeline;
import fr.lapetina.watchman.domain.model.DeploymentTarget;
import fr.lapetina.watchman.domain.reconcile.StateReconciler;
import fr.lapetina.watchman.infrastructure.config.ConfigLoader;
import fr.lapetina.watchman.infrastructure.config.WatchmanConfig;
import fr.lapetina.watchman.infrastructure.health.ProbePoller;
import fr.lapetina.watchman.infrastructure.health.StatusStore;
import fr.lapetina.watchman.infrastructure.health.TargetRegistry;
import fr.lapetina.watchman.infrastructure.http.HttpProbeClient;
import fr.lapetina.watchman.infrastructure.http.ProbeClient;
import fr.lapetina.watchman.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Factory for creating a fully-wired Watchman instance from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (WatchmanFactory factory = WatchmanFactory.create("watchman.yaml").start()) {
 *     StatusStore status = factory.getStatusStore();
 *     // read status...
 * }
 * }</pre>
 */
public class WatchmanFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WatchmanFactory.class);

    private final ConfigLoader configLoader;
    private final WatchmanConfig config;
    private final TargetRegistry targetRegistry;
    private final StatusStore statusStore;
    private final MetricsRegistry metricsRegistry;
    private final StateReconciler reconciler;
    private final RoundPipeline pipeline;
    private final ProbeClient probeClient;
    private final ProbePoller poller;

    protected WatchmanFactory(ConfigLoader configLoader, ProbeClient probeClientOverride, Clock clock) {
        this.configLoader = configLoader;
        this.config = configLoader.load();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        this.targetRegistry = new TargetRegistry();
        targetRegistry.replaceAll(DeploymentTarget.Source.CONFIG, toTargets(config));

        this.statusStore = new StatusStore();
        this.reconciler = new StateReconciler(
                targetRegistry,
                statusStore,
                config.getPolling().getFailureThreshold(),
                clock
        );

        this.pipeline = RoundPipeline.builder()
                .fromConfig(config)
                .reconciler(reconciler)
                .metricsRegistry(metricsRegistry)
                .build();

        // Allow override for testing
        this.probeClient = probeClientOverride != null
                ? probeClientOverride
                : new HttpProbeClient(Duration.ofMillis(config.getHttp().getConnectTimeoutMs()), clock);

        WatchmanConfig.PollingConfig polling = config.getPolling();
        this.poller = new ProbePoller(
                targetRegistry,
                probeClient,
                pipeline,
                Duration.ofMillis(polling.getIntervalMs()),
                Duration.ofMillis(polling.getProbeTimeoutMs()),
                Duration.ofMillis(polling.getRoundDeadlineMs()),
                polling.getMaxInFlightProbes(),
                clock
        );

        configLoader.addListener(this::onConfigChanged);

        metricsRegistry.registerGauge("targets_registered", "Targets currently registered",
                targetRegistry::size);
        metricsRegistry.registerGauge("probes_in_flight", "Probes currently in flight",
                poller::getInFlightProbes);
        metricsRegistry.registerGauge("pipeline_remaining_capacity", "Free slots in the round ring buffer",
                pipeline::getRemainingCapacity);

        log.info("WatchmanFactory initialized for project {} with {} targets",
                config.getProject().getName(), targetRegistry.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static WatchmanFactory create(String configPath) {
        return new WatchmanFactory(new ConfigLoader(configPath), null, Clock.systemUTC());
    }

    /**
     * Creates a factory from the default configuration (watchman.yaml).
     */
    public static WatchmanFactory create() {
        return create("watchman.yaml");
    }

    /**
     * Starts the pipeline, the poller and the config file watcher.
     */
    public WatchmanFactory start() {
        pipeline.start();
        poller.start();
        configLoader.startWatching();
        log.info("Watchman started");
        return this;
    }

    public TargetRegistry getTargetRegistry() {
        return targetRegistry;
    }

    public StatusStore getStatusStore() {
        return statusStore;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public StateReconciler getReconciler() {
        return reconciler;
    }

    public RoundPipeline getPipeline() {
        return pipeline;
    }

    public ProbePoller getPoller() {
        return poller;
    }

    public WatchmanConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private static List<DeploymentTarget> toTargets(WatchmanConfig config) {
        List<DeploymentTarget> targets = new ArrayList<>();
        for (WatchmanConfig.TargetConfig targetConfig : config.getTargets()) {
            targets.add(targetConfig.toTarget());
        }
        return targets;
    }

    private void onConfigChanged(WatchmanConfig oldConfig, WatchmanConfig newConfig) {
        log.info("Configuration changed, applying target updates...");

        // API registrations survive a reload
        targetRegistry.replaceAll(DeploymentTarget.Source.CONFIG, toTargets(newConfig));

        if (oldConfig != null && !samePolling(oldConfig.getPolling(), newConfig.getPolling())) {
            log.warn("Polling settings changed; they take effect on restart");
        }

        log.info("Configuration updates applied: {} targets registered", targetRegistry.size());
    }

    private static boolean samePolling(WatchmanConfig.PollingConfig a, WatchmanConfig.PollingConfig b) {
        return a.getIntervalMs() == b.getIntervalMs()
                && a.getProbeTimeoutMs() == b.getProbeTimeoutMs()
                && a.getRoundDeadlineMs() == b.getRoundDeadlineMs()
                && a.getMaxInFlightProbes() == b.getMaxInFlightProbes()
                && a.getFailureThreshold() == b.getFailureThreshold();
    }

    @Override
    public void close() {
        log.info("Shutting down WatchmanFactory...");

        try {
            poller.close();
        } catch (Exception e) {
            log.warn("Error closing poller", e);
        }

        try {
            pipeline.close();
        } catch (Exception e) {
            log.warn("Error closing pipeline", e);
        }

        if (probeClient instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error closing probe client", e);
            }
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("WatchmanFactory shut down");
    }
}
