package com.tracegraph.core.renderer;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Where and how one run's documents are rendered.
 *
 * @param outputDirectory target output directory path
 * @param settings renderer-specific settings, e.g. {@code console.colors}
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        if (settings == null) {
            settings = Map.of();
        }
    }

    /**
     * Normalized absolute output directory.
     *
     * @return output directory
     */
    public Path outputPath() {
        return Path.of(outputDirectory).toAbsolutePath().normalize();
    }

    /**
     * Resolves a document path against the output directory.
     *
     * <p>Model and archive names flow into document paths, so a path that would land outside
     * the output directory is rejected.
     *
     * @param relativePath document path relative to the output directory
     * @return absolute target path
     * @throws IllegalArgumentException if the path escapes the output directory
     */
    public Path resolve(String relativePath) {
        Path root = outputPath();
        Path target = root.resolve(relativePath).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalArgumentException("Document path escapes output directory: " + relativePath);
        }
        return target;
    }

    /**
     * Reads a boolean setting.
     *
     * @param key setting key
     * @param defaultValue value when the setting is absent
     * @return setting value
     */
    public boolean flag(String key, boolean defaultValue) {
        String value = settings.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}
