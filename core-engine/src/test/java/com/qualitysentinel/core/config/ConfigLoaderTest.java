package com.qualitysentinel.core.config;

import com.qualitysentinel.core.model.DetectionMethodType;
import com.qualitysentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should load bundled default config from classpath")
    void shouldLoadDefaultResource() {
        DetectionConfig config = ConfigLoader.read(ConfigSource.classpath(ConfigLoader.DEFAULT_RESOURCE));

        assertThat(config.detectionInterval()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.detectionWindow()).isEqualTo(Duration.ofMinutes(30));
        assertThat(config.getMaxSamplesPerComponent()).isEqualTo(1000);
        assertThat(config.getMethods().enabledMethods()).containsExactly(DetectionMethodType.values());
        assertThat(config.getMethods().getAnomaly().getAnomalyThreshold()).isEqualTo(2.5);
        assertThat(config.getMethods().getChangePoint().getChangeThreshold()).isEqualTo(0.20);
        assertThat(config.getAlerting().alertSeverities()).containsExactlyInAnyOrder(Severity.MAJOR, Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should overlay YAML values on defaults")
    void shouldOverlayOnDefaults() {
        DetectionConfig config = ConfigLoader.read(ConfigSource.classpath("test-config.yml"));

        assertThat(config.getDetectionIntervalSeconds()).isEqualTo(60);
        assertThat(config.getMinSamplesPerMetric()).isEqualTo(5);
        assertThat(config.getSeverity().getMajor()).isEqualTo(20.0);
        assertThat(config.getMethods().isEnabled(DetectionMethodType.TREND)).isFalse();
        assertThat(config.getMethods().isEnabled(DetectionMethodType.ANOMALY)).isTrue();
        assertThat(config.getMethods().getAnomaly().getAnomalyThreshold()).isEqualTo(3.0);
        // untouched keys keep their defaults
        assertThat(config.getMethods().getAnomaly().getRecentCount()).isEqualTo(3);
        assertThat(config.getErrorBackoffSeconds()).isEqualTo(5);
        assertThat(config.getBaseline().isAutoUpdate()).isFalse();
        assertThat(config.getAlerting().alertSeverities()).containsExactly(Severity.CRITICAL);
        assertThat(config.getAlerting().cooldown()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    @DisplayName("Should report every invalid value in one exception")
    void shouldAggregateValidationErrors() {
        assertThatThrownBy(() -> ConfigLoader.read(ConfigSource.classpath("invalid-config.yml")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("detectionIntervalSeconds")
                .hasMessageContaining("maxSamplesPerComponent")
                .hasMessageContaining("severity")
                .hasMessageContaining("urgent");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> ConfigLoader.read(ConfigSource.classpath("duplicate-keys.yml")))
                .isInstanceOf(YAMLException.class);
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        DetectionConfig config = ConfigLoader.read(ConfigSource.classpath("empty.yml"));

        assertThat(config.getDetectionIntervalSeconds()).isEqualTo(300);
        assertThat(config.getSeverity().getCritical()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ConfigLoader.read(ConfigSource.classpath("does-not-exist.yml")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sentinel.yml");
        Files.writeString(file, "detectionIntervalSeconds: 42\nbaseline:\n  minSamples: 20\n");

        DetectionConfig config = ConfigLoader.load(file.toString());

        assertThat(config.getDetectionIntervalSeconds()).isEqualTo(42);
        assertThat(config.getBaseline().getMinSamples()).isEqualTo(20);
    }

    @Test
    @DisplayName("Should throw when file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        String missing = dir.resolve("missing.yml").toString();

        assertThatThrownBy(() -> ConfigLoader.load(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Config file not found");
    }

    @Test
    @DisplayName("Explicit path should win over the environment")
    void shouldPreferExplicitPath(@TempDir Path dir) throws IOException {
        Path explicit = Files.writeString(dir.resolve("explicit.yml"), "detectionIntervalSeconds: 10\n");
        Path fromEnv = Files.writeString(dir.resolve("env.yml"), "detectionIntervalSeconds: 20\n");

        ConfigSource source = ConfigLoader.resolve(explicit.toString(), fromEnv.toString());

        assertThat(source.describe()).contains("explicit.yml");
        assertThat(ConfigLoader.read(source).getDetectionIntervalSeconds()).isEqualTo(10);
    }

    @Test
    @DisplayName("Environment path should be used when it exists")
    void shouldUseEnvironmentPath(@TempDir Path dir) throws IOException {
        Path fromEnv = Files.writeString(dir.resolve("env.yml"), "detectionIntervalSeconds: 20\n");

        ConfigSource source = ConfigLoader.resolve(null, fromEnv.toString());

        assertThat(ConfigLoader.read(source).getDetectionIntervalSeconds()).isEqualTo(20);
    }

    @Test
    @DisplayName("Missing environment file should fall back to the bundled resource")
    void shouldFallBackToBundledResource(@TempDir Path dir) {
        ConfigSource source = ConfigLoader.resolve(" ", dir.resolve("absent.yml").toString());

        assertThat(source.describe()).isEqualTo("classpath resource " + ConfigLoader.DEFAULT_RESOURCE);
        assertThat(ConfigLoader.read(source).getDetectionIntervalSeconds()).isEqualTo(300);
    }
}
