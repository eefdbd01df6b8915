package com.tracegraph.core.scanner;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Context provided to scanners during execution.
 *
 * @param rootPath scanned root directory
 * @param sourcePaths directories to search for inputs
 * @param configuration scanner-specific configuration
 * @param settings global settings from tracegraph.yaml
 */
public record ScanContext(
    Path rootPath,
    List<Path> sourcePaths,
    Map<String, Object> configuration,
    Map<String, String> settings
) {
    /** Setting holding the code-generation cache directory. */
    public static final String SETTING_CODEGEN_CACHE = "codegen.cacheDirectory";

    /** Setting holding comma-separated source extensions of generated code. */
    public static final String SETTING_CODEGEN_EXTENSIONS = "codegen.sourceExtensions";

    /**
     * Compact constructor with validation.
     */
    public ScanContext {
        Objects.requireNonNull(rootPath, "rootPath must not be null");
        if (sourcePaths == null || sourcePaths.isEmpty()) {
            sourcePaths = List.of(rootPath);
        }
        if (configuration == null) {
            configuration = Map.of();
        }
        if (settings == null) {
            settings = Map.of();
        }
    }

    /**
     * Creates a context for a root directory with no configuration.
     *
     * @param rootPath root directory
     * @return context
     */
    public static ScanContext of(Path rootPath) {
        return new ScanContext(rootPath, List.of(rootPath), Map.of(), Map.of());
    }

    /**
     * Returns a copy carrying another scanner configuration block.
     *
     * @param scannerConfiguration configuration of the scanner about to run
     * @return new context
     */
    public ScanContext withConfiguration(Map<String, Object> scannerConfiguration) {
        return new ScanContext(rootPath, sourcePaths, scannerConfiguration, settings);
    }

    /**
     * Finds regular files matching the given glob pattern.
     *
     * <p>The pattern is matched against the path relative to {@link #rootPath()}.
     *
     * @param pattern glob pattern
     * @return stream of matching file paths
     */
    public Stream<Path> findFiles(String pattern) {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);

        return sourcePaths.stream()
            .flatMap(sourcePath -> {
                try (Stream<Path> walk = Files.walk(sourcePath)) {
                    return walk
                        .filter(Files::isRegularFile)
                        .filter(path -> matcher.matches(rootPath.relativize(path)))
                        .toList()
                        .stream();
                } catch (IOException e) {
                    throw new UncheckedIOException("Cannot walk " + sourcePath, e);
                }
            });
    }

    /**
     * Gets a configuration value for the current scanner.
     *
     * @param key configuration key
     * @param <T> expected type
     * @return configuration value or null if not found
     */
    @SuppressWarnings("unchecked")
    public <T> T getConfig(String key) {
        return (T) configuration.get(key);
    }

    /**
     * Gets a global setting value.
     *
     * @param key setting key
     * @return setting value or null if not found
     */
    public String getSetting(String key) {
        return settings.get(key);
    }
}
