package com.qualitysentinel.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a {@link DetectionConfig} document is read from: a file or a
 * classpath resource.
 *
 * @since 1.0.0
 */
public final class ConfigSource {

    @FunctionalInterface
    private interface Opener {
        InputStream open() throws IOException;
    }

    private final String description;
    private final Opener opener;

    private ConfigSource(String description, Opener opener) {
        this.description = description;
        this.opener = opener;
    }

    public static ConfigSource file(Path path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        return new ConfigSource("file " + path, () -> {
            try {
                return Files.newInputStream(path);
            } catch (NoSuchFileException e) {
                throw new IllegalArgumentException("Config file not found: " + path, e);
            }
        });
    }

    public static ConfigSource classpath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        return new ConfigSource("classpath resource " + resource, () -> {
            InputStream is = ConfigSource.class.getClassLoader().getResourceAsStream(resource);
            if (is == null) {
                throw new IllegalArgumentException("Classpath resource not found: " + resource);
            }
            return is;
        });
    }

    /**
     * @throws IllegalArgumentException if the file or resource does not exist
     * @throws IOException              if it cannot be opened
     */
    InputStream open() throws IOException {
        return opener.open();
    }

    public String describe() {
        return description;
    }

    @Override
    public String toString() {
        return description;
    }
}
