package fr.lapetina.watchman.infrastructure.config;

import fr.lapetina.watchman.domain.model.DeploymentTarget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static ByteArrayInputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static ConfigLoader loader(Properties overrides) {
        return new ConfigLoader("unused.yaml", overrides);
    }

    @Nested
    @DisplayName("loading")
    class Loading {

        @Test
        @DisplayName("should load the test configuration from the classpath")
        void shouldLoadFromClasspath() {
            WatchmanConfig config = new ConfigLoader("test-config.yaml", new Properties()).load();

            assertThat(config.getProject().getName()).isEqualTo("test-project");
            assertThat(config.getProject().getVersion()).isEqualTo("7");
            assertThat(config.getServer().getPort()).isZero();
            assertThat(config.getTargets()).extracting(WatchmanConfig.TargetConfig::getName)
                    .containsExactly("machine-a", "machine-b");
            assertThat(config.getTargets().get(0).getMetadata())
                    .containsEntry("metadata.user-defined.machine-name", "machine-a");
            assertThat(config.getPolling().getFailureThreshold()).isEqualTo(3);
        }

        @Test
        @DisplayName("should use defaults for an empty document")
        void shouldUseDefaultsForEmptyDocument() {
            WatchmanConfig config = loader(new Properties()).loadFromStream(yaml(""));

            WatchmanConfig.PollingConfig polling = config.getPolling();
            assertThat(polling.getIntervalMs()).isEqualTo(30000);
            assertThat(polling.getProbeTimeoutMs()).isEqualTo(5000);
            assertThat(polling.getRoundDeadlineMs()).isEqualTo(20000);
            assertThat(polling.getMaxInFlightProbes()).isEqualTo(16);
            assertThat(polling.getFailureThreshold()).isEqualTo(3);
            assertThat(config.getServer().getPort()).isEqualTo(5555);
            assertThat(config.getTargets()).isEmpty();
        }

        @Test
        @DisplayName("should keep defaults for sections that are not set")
        void shouldMergeWithDefaults() {
            WatchmanConfig config = loader(new Properties()).loadFromStream(yaml(
                    "polling:\n" +
                    "  failureThreshold: 5\n"));

            assertThat(config.getPolling().getFailureThreshold()).isEqualTo(5);
            assertThat(config.getPolling().getIntervalMs()).isEqualTo(30000);
            assertThat(config.getPipeline().getRingBufferSize()).isEqualTo(64);
        }

        @Test
        @DisplayName("should fail when the file does not exist anywhere")
        void shouldFailOnMissingFile() {
            assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml", new Properties()).load())
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("should fail on unknown properties")
        void shouldFailOnInvalidYaml() {
            assertThatThrownBy(() -> loader(new Properties()).loadFromStream(yaml("polling:\n  nope: 1\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Invalid configuration");
        }
    }

    @Nested
    @DisplayName("overrides")
    class Overrides {

        @Test
        @DisplayName("should apply polling and port overrides from properties")
        void shouldApplyOverrides() {
            Properties properties = new Properties();
            properties.setProperty("watchman.server.port", "8181");
            properties.setProperty("watchman.polling.intervalMs", "60000");
            properties.setProperty("watchman.polling.probeTimeoutMs", "1000");
            properties.setProperty("watchman.polling.roundDeadlineMs", "4000");
            properties.setProperty("watchman.polling.maxInFlightProbes", "2");
            properties.setProperty("watchman.polling.failureThreshold", " 7 ");

            WatchmanConfig config = loader(properties).loadFromStream(yaml(""));

            assertThat(config.getServer().getPort()).isEqualTo(8181);
            assertThat(config.getPolling().getIntervalMs()).isEqualTo(60000);
            assertThat(config.getPolling().getProbeTimeoutMs()).isEqualTo(1000);
            assertThat(config.getPolling().getRoundDeadlineMs()).isEqualTo(4000);
            assertThat(config.getPolling().getMaxInFlightProbes()).isEqualTo(2);
            assertThat(config.getPolling().getFailureThreshold()).isEqualTo(7);
        }

        @Test
        @DisplayName("should ignore properties outside the watchman prefix")
        void shouldIgnoreUnrelatedProperties() {
            WatchmanConfig config = new WatchmanConfig();
            Properties properties = new Properties();
            properties.setProperty("polling.intervalMs", "1");

            ConfigLoader.applyOverrides(config, properties);

            assertThat(config.getPolling().getIntervalMs()).isEqualTo(30000);
        }

        @Test
        @DisplayName("should reject a non-numeric override")
        void shouldRejectNonNumericOverride() {
            Properties properties = new Properties();
            properties.setProperty("watchman.polling.failureThreshold", "three");

            assertThatThrownBy(() -> loader(properties).loadFromStream(yaml("")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("watchman.polling.failureThreshold");
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("should reject a probe timeout longer than the round deadline")
        void shouldRejectTimeoutAboveDeadline() {
            WatchmanConfig config = new WatchmanConfig();
            config.getPolling().setProbeTimeoutMs(25000);

            assertThatThrownBy(() -> ConfigLoader.validate(config))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("probeTimeoutMs");
        }

        @Test
        @DisplayName("should reject a round deadline not shorter than the interval")
        void shouldRejectDeadlineAboveInterval() {
            WatchmanConfig config = new WatchmanConfig();
            config.getPolling().setRoundDeadlineMs(30000);

            assertThatThrownBy(() -> ConfigLoader.validate(config))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("roundDeadlineMs");
        }

        @Test
        @DisplayName("should reject a threshold below one")
        void shouldRejectThresholdBelowOne() {
            WatchmanConfig config = new WatchmanConfig();
            config.getPolling().setFailureThreshold(0);

            assertThatThrownBy(() -> ConfigLoader.validate(config))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }

        @Test
        @DisplayName("should reject a ring buffer size that is not a power of two")
        void shouldRejectRingBufferSize() {
            WatchmanConfig config = new WatchmanConfig();
            config.getPipeline().setRingBufferSize(100);

            assertThatThrownBy(() -> ConfigLoader.validate(config))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("power of 2");
        }

        @Test
        @DisplayName("should reject a target without endpoint")
        void shouldRejectTargetWithoutEndpoint() {
            WatchmanConfig config = new WatchmanConfig();
            WatchmanConfig.TargetConfig target = new WatchmanConfig.TargetConfig();
            target.setName("a");
            config.getTargets().add(target);

            assertThatThrownBy(() -> ConfigLoader.validate(config))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("target validation")
    class TargetValidation {

        private WatchmanConfig withTarget(String name, String endpoint) {
            WatchmanConfig config = new WatchmanConfig();
            WatchmanConfig.TargetConfig target = new WatchmanConfig.TargetConfig();
            target.setName(name);
            target.setEndpoint(endpoint);
            config.getTargets().add(target);
            return config;
        }

        @Test
        @DisplayName("should reject an endpoint that is not http(s)")
        void shouldRejectNonHttpEndpoint() {
            assertThatThrownBy(() -> ConfigLoader.validate(withTarget("b", "ftp://b.test")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Invalid target b");
        }

        @Test
        @DisplayName("should reject a name that cannot be used in a path")
        void shouldRejectSlashInName() {
            assertThatThrownBy(() -> ConfigLoader.validate(withTarget("a/b", "http://a.test")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("'/'");
        }

        @Test
        @DisplayName("should reject the same name configured twice")
        void shouldRejectDuplicateNames() {
            WatchmanConfig config = withTarget("a", "http://one.test");
            WatchmanConfig.TargetConfig again = new WatchmanConfig.TargetConfig();
            again.setName("a");
            again.setEndpoint("http://two.test");
            config.getTargets().add(again);

            assertThatThrownBy(() -> ConfigLoader.validate(config))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Duplicate target name: a");
        }

        @Test
        @DisplayName("should build config targets with the CONFIG source")
        void shouldBuildConfigTargets() {
            WatchmanConfig.TargetConfig target = withTarget("a", "http://a.test").getTargets().get(0);

            assertThat(target.toTarget().getSource()).isEqualTo(DeploymentTarget.Source.CONFIG);
            assertThat(target.toTarget().getEndpoint().toString()).isEqualTo("http://a.test");
        }
    }

    @Nested
    @DisplayName("reload")
    class Reload {

        @TempDir
        Path dir;

        @Test
        @DisplayName("should notify listeners with old and new configuration")
        void shouldNotifyListeners() throws Exception {
            Path file = dir.resolve("watchman.yaml");
            Files.writeString(file, "project:\n  name: first\n");
            ConfigLoader loader = new ConfigLoader(file.toString(), new Properties());
            List<String> changes = new ArrayList<>();
            loader.addListener((oldConfig, newConfig) -> changes.add(
                    (oldConfig == null ? "none" : oldConfig.getProject().getName())
                            + "->" + newConfig.getProject().getName()));

            loader.load();
            Files.writeString(file, "project:\n  name: second\n");
            loader.reload();

            assertThat(changes).containsExactly("none->first", "first->second");
            assertThat(loader.getCurrentConfig().getProject().getName()).isEqualTo("second");
            loader.close();
        }

        @Test
        @DisplayName("should leave configuration and listeners untouched when a target becomes invalid")
        void shouldNotNotifyOnInvalidTarget() throws Exception {
            Path file = dir.resolve("watchman.yaml");
            Files.writeString(file, "targets:\n  - name: a\n    endpoint: http://a.test\n");
            ConfigLoader loader = new ConfigLoader(file.toString(), new Properties());
            WatchmanConfig first = loader.load();
            List<String> notified = new ArrayList<>();
            loader.addListener((oldConfig, newConfig) -> notified.add(newConfig.getTargets().get(0).getName()));

            Files.writeString(file, "targets:\n  - name: b\n    endpoint: ftp://b.test\n");

            assertThatThrownBy(loader::load)
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Invalid target b");
            assertThat(loader.getCurrentConfig()).isSameAs(first);
            assertThat(notified).isEmpty();
            loader.close();
        }

        @Test
        @DisplayName("should keep the current configuration when the new file is invalid")
        void shouldKeepCurrentOnInvalidReload() throws Exception {
            Path file = dir.resolve("watchman.yaml");
            Files.writeString(file, "project:\n  name: first\n");
            ConfigLoader loader = new ConfigLoader(file.toString(), new Properties());
            WatchmanConfig first = loader.load();

            Files.writeString(file, "polling:\n  failureThreshold: 0\n");
            WatchmanConfig afterReload = loader.reload();

            assertThat(afterReload).isSameAs(first);
            assertThat(loader.getCurrentConfig().getProject().getName()).isEqualTo("first");
            loader.close();
        }
    }
}
