package com.qualitysentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds a validated {@link DetectionConfig} from YAML.
 *
 * <p>
 * The document only has to name the values it changes: SnakeYAML binds onto
 * a bean whose fields already hold the defaults, and an empty document yields
 * {@link DetectionConfig#defaults()}. Duplicate keys are rejected and
 * {@link DetectionConfig#validate()} runs on every result, so an invalid
 * configuration fails at startup with all its errors listed.
 * </p>
 *
 * <h3>Source resolution</h3>
 * <ol>
 * <li>An explicit path, when given; a missing file is an error.</li>
 * <li>The file named by {@value #ENV_CONFIG_PATH}, when it exists.</li>
 * <li>The bundled {@value #DEFAULT_RESOURCE} classpath resource.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable naming a config file. */
    public static final String ENV_CONFIG_PATH = "QUALITY_SENTINEL_CONFIG";

    /** Classpath resource used when no file is configured. */
    public static final String DEFAULT_RESOURCE = "quality-sentinel.yml";

    private ConfigLoader() {
    }

    /** Resolve without an explicit path. */
    public static DetectionConfig load() {
        return load(null);
    }

    /**
     * Resolve the source and read it.
     *
     * @param explicitPath config file chosen by the caller, or {@code null} /
     *                     blank to fall through to the environment
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the chosen file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static DetectionConfig load(String explicitPath) {
        return read(resolve(explicitPath, System.getenv(ENV_CONFIG_PATH)));
    }

    static ConfigSource resolve(String explicitPath, String envPath) {
        if (explicitPath != null && !explicitPath.isBlank()) {
            return ConfigSource.file(Path.of(explicitPath));
        }
        if (envPath != null && !envPath.isBlank()) {
            if (Files.exists(Path.of(envPath))) {
                return ConfigSource.file(Path.of(envPath));
            }
            LOG.warn("{}={} does not exist, using {}", ENV_CONFIG_PATH, envPath, DEFAULT_RESOURCE);
        }
        return ConfigSource.classpath(DEFAULT_RESOURCE);
    }

    /**
     * Read one source.
     *
     * @throws IllegalArgumentException if the source does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static DetectionConfig read(ConfigSource source) {
        LOG.info("Loading detection config from {}", source.describe());
        DetectionConfig config;
        try (InputStream is = source.open()) {
            config = yaml().load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config from " + source.describe(), e);
        }

        if (config == null) {
            LOG.warn("Detection config in {} is empty, using defaults", source.describe());
            config = DetectionConfig.defaults();
        }
        config.validate();

        LOG.info("Detection config: interval={}s window={}s capacity={} methods={} alerting={}",
                config.getDetectionIntervalSeconds(),
                config.getDetectionWindowSeconds(),
                config.getMaxSamplesPerComponent(),
                config.getMethods().enabledMethods(),
                config.getAlerting().alertSeverities());
        return config;
    }

    private static Yaml yaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new Constructor(DetectionConfig.class, options));
    }
}
