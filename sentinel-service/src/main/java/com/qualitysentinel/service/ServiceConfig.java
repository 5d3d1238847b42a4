package com.qualitysentinel.service;

import java.util.Objects;

/**
 * Typed, immutable configuration of the Quality Sentinel service process.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service can be configured from a container spec or a shell without
 * touching the detection YAML.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic and test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    public static final String ENV_CONFIG_PATH = "QUALITY_SENTINEL_CONFIG";
    public static final String ENV_HTTP_PORT = "HTTP_PORT";
    public static final String ENV_BIND_ADDRESS = "HTTP_BIND_ADDRESS";
    public static final String ENV_HTTP_THREADS = "HTTP_THREADS";

    private final String configPath;
    private final String bindAddress;
    private final int httpPort;
    private final int httpThreads;

    private ServiceConfig(Builder b) {
        this.configPath = b.configPath;
        this.bindAddress = b.bindAddress;
        this.httpPort = b.httpPort;
        this.httpThreads = b.httpThreads;
    }

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .configPath(env(ENV_CONFIG_PATH, ""))
                    .bindAddress(env(ENV_BIND_ADDRESS, "0.0.0.0"))
                    .httpPort(Integer.parseInt(env(ENV_HTTP_PORT, "8080")))
                    .httpThreads(Integer.parseInt(env(ENV_HTTP_THREADS, "4")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /** @return path of the detection YAML, or empty to use the bundled defaults */
    public String getConfigPath() {
        return configPath;
    }

    public boolean hasConfigPath() {
        return !configPath.isBlank();
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public int getHttpThreads() {
        return httpThreads;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * {@link #build()} checks that the port is in [0, 65535] (0 binds an
     * ephemeral port), that at least one HTTP worker is configured and that
     * the bind address is not blank.
     * </p>
     */
    public static class Builder {
        private String configPath = "";
        private String bindAddress = "0.0.0.0";
        private int httpPort = 8080;
        private int httpThreads = 4;

        public Builder configPath(String v) {
            this.configPath = v;
            return this;
        }

        public Builder bindAddress(String v) {
            this.bindAddress = v;
            return this;
        }

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder httpThreads(int v) {
            this.httpThreads = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(configPath, "configPath required");
            if (bindAddress == null || bindAddress.isBlank()) {
                throw new IllegalArgumentException("bindAddress must not be null or blank");
            }
            if (httpPort < 0 || httpPort > 65_535) {
                throw new IllegalArgumentException("httpPort must be in [0, 65535], got: " + httpPort);
            }
            if (httpThreads < 1) {
                throw new IllegalArgumentException("httpThreads must be >= 1, got: " + httpThreads);
            }
            return new ServiceConfig(this);
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "configPath='" + configPath + '\'' +
                ", bindAddress='" + bindAddress + '\'' +
                ", httpPort=" + httpPort +
                ", httpThreads=" + httpThreads +
                '}';
    }
}
