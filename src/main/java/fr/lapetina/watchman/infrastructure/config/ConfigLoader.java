package fr.lapetina.watchman.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Configuration loader with hot-reload support.
 *
 * Supports:
 * - Loading from classpath or file system
 * - Process-start overrides through {@code watchman.*} system properties
 * - Validation of poll timing
 * - File watching for automatic reload
 * - Listener notification on changes
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String OVERRIDE_PREFIX = "watchman.";

    private final AtomicReference<WatchmanConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Properties overrides;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath, Properties overrides) {
        this.configPath = Paths.get(configPath);
        this.overrides = overrides;
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(WatchmanConfig.class, loaderOptions));
    }

    public ConfigLoader(String configPath) {
        this(configPath, System.getProperties());
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public WatchmanConfig load() {
        WatchmanConfig config = prepare(loadFromPath());
        WatchmanConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private WatchmanConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private WatchmanConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private WatchmanConfig parse(InputStream is, String origin) {
        try {
            WatchmanConfig config = yaml.load(is);
            // An empty document means "all defaults"
            return config != null ? config : new WatchmanConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + origin + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public WatchmanConfig loadFromStream(InputStream inputStream) {
        WatchmanConfig config = prepare(parse(inputStream, "stream"));
        WatchmanConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private WatchmanConfig prepare(WatchmanConfig config) {
        applyOverrides(config, overrides);
        validate(config);
        return config;
    }

    /**
     * Applies {@code watchman.server.port} and {@code watchman.polling.*} overrides.
     */
    static void applyOverrides(WatchmanConfig config, Properties properties) {
        if (properties == null) {
            return;
        }
        WatchmanConfig.PollingConfig polling = config.getPolling();
        override(properties, "server.port", v -> config.getServer().setPort(Integer.parseInt(v)));
        override(properties, "polling.intervalMs", v -> polling.setIntervalMs(Long.parseLong(v)));
        override(properties, "polling.probeTimeoutMs", v -> polling.setProbeTimeoutMs(Long.parseLong(v)));
        override(properties, "polling.roundDeadlineMs", v -> polling.setRoundDeadlineMs(Long.parseLong(v)));
        override(properties, "polling.maxInFlightProbes", v -> polling.setMaxInFlightProbes(Integer.parseInt(v)));
        override(properties, "polling.failureThreshold", v -> polling.setFailureThreshold(Integer.parseInt(v)));
    }

    private static void override(Properties properties, String key, Consumer<String> setter) {
        String value = properties.getProperty(OVERRIDE_PREFIX + key);
        if (value == null || value.isBlank()) {
            return;
        }
        try {
            setter.accept(value.trim());
            log.info("Configuration override applied: {}={}", OVERRIDE_PREFIX + key, value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid value for " + OVERRIDE_PREFIX + key + ": " + value, e);
        }
    }

    /**
     * Checks the poll timing invariants (0 < probe timeout <= round deadline < interval)
     * and that every configured target can be registered.
     */
    static void validate(WatchmanConfig config) {
        WatchmanConfig.PollingConfig polling = config.getPolling();
        if (polling.getProbeTimeoutMs() <= 0) {
            throw new ConfigurationException("polling.probeTimeoutMs must be positive");
        }
        if (polling.getProbeTimeoutMs() > polling.getRoundDeadlineMs()) {
            throw new ConfigurationException("polling.probeTimeoutMs (" + polling.getProbeTimeoutMs()
                    + ") must not exceed polling.roundDeadlineMs (" + polling.getRoundDeadlineMs() + ")");
        }
        if (polling.getRoundDeadlineMs() >= polling.getIntervalMs()) {
            throw new ConfigurationException("polling.roundDeadlineMs (" + polling.getRoundDeadlineMs()
                    + ") must be shorter than polling.intervalMs (" + polling.getIntervalMs() + ")");
        }
        if (polling.getMaxInFlightProbes() < 1) {
            throw new ConfigurationException("polling.maxInFlightProbes must be >= 1");
        }
        if (polling.getFailureThreshold() < 1) {
            throw new ConfigurationException("polling.failureThreshold must be >= 1");
        }
        int ringBufferSize = config.getPipeline().getRingBufferSize();
        if (ringBufferSize < 1 || Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("pipeline.ringBufferSize must be a power of 2: " + ringBufferSize);
        }
        Set<String> names = new HashSet<>();
        for (WatchmanConfig.TargetConfig target : config.getTargets()) {
            if (target.getName() == null || target.getName().isBlank() || target.getEndpoint() == null) {
                throw new ConfigurationException("Every configured target needs a name and an endpoint");
            }
            try {
                target.toTarget();
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid target " + target.getName() + ": " + e.getMessage(), e);
            }
            if (!names.add(target.getName())) {
                throw new ConfigurationException("Duplicate target name: " + target.getName());
            }
        }
    }

    /**
     * Returns the current configuration.
     */
    public WatchmanConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent == null) {
                parent = Paths.get(".");
            }
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed.equals(configPath.getFileName())) {
                    // Debounce - check if file actually changed
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload. Keeps the current configuration if the new one is invalid.
     */
    public WatchmanConfig reload() {
        try {
            return load();
        } catch (Exception e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    /**
     * Adds a listener for configuration changes.
     */
    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    private void notifyListeners(WatchmanConfig oldConfig, WatchmanConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
