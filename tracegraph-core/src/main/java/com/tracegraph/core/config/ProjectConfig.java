package com.tracegraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Root configuration for TraceGraph runs.
 *
 * <p>Loaded from {@code tracegraph.yaml} in the scanned root. Every section is optional;
 * absent sections fall back to the values of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "Brake Controller"
 *   version: "2.1.0"
 *
 * scanners:
 *   enabled:
 *     - cameo-requirements
 *     - simulink-blocks
 *
 * hierarchy:
 *   enabled: true
 *
 * versioning:
 *   enabled: true
 *   storeDirectory: ".tracegraph/versions"
 *
 * codegen:
 *   sourceExtensions: [".c", ".h"]
 *
 * output:
 *   directory: "./tracegraph-output"
 * }</pre>
 *
 * @param project project metadata
 * @param scanners scanner selection and scanner-specific settings
 * @param hierarchy hierarchy inference settings
 * @param versioning version tracking settings
 * @param codegen code-generation archive settings
 * @param batch batch execution settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("scanners") ScannerConfig scanners,
    @JsonProperty("hierarchy") HierarchyConfig hierarchy,
    @JsonProperty("versioning") VersioningConfig versioning,
    @JsonProperty("codegen") CodegenConfig codegen,
    @JsonProperty("batch") BatchConfig batch,
    @JsonProperty("output") OutputConfig output
) {
    /** Default configuration file name. */
    public static final String FILE_NAME = "tracegraph.yaml";

    /**
     * Compact constructor filling absent sections with defaults.
     */
    public ProjectConfig {
        if (project == null) {
            project = new ProjectInfo("project", "1.0.0", null);
        }
        if (scanners == null) {
            scanners = new ScannerConfig(List.of(), Map.of());
        }
        if (hierarchy == null) {
            hierarchy = new HierarchyConfig(true);
        }
        if (versioning == null) {
            versioning = new VersioningConfig(true, VersioningConfig.DEFAULT_STORE_DIRECTORY, true);
        }
        if (codegen == null) {
            codegen = new CodegenConfig(null, List.of(".c"));
        }
        if (batch == null) {
            batch = new BatchConfig(0);
        }
        if (output == null) {
            output = new OutputConfig(OutputConfig.DEFAULT_DIRECTORY);
        }
    }

    /**
     * Creates a default configuration: all scanners, hierarchy and versioning enabled.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null, null, null, null);
    }

    /**
     * Returns a copy with another output directory.
     *
     * @param directory output directory
     * @return new configuration
     */
    public ProjectConfig withOutputDirectory(String directory) {
        return new ProjectConfig(project, scanners, hierarchy, versioning, codegen, batch, new OutputConfig(directory));
    }

    /**
     * Returns a copy with hierarchy inference switched on or off.
     *
     * @param enabled whether hierarchy inference runs
     * @return new configuration
     */
    public ProjectConfig withHierarchy(boolean enabled) {
        return new ProjectConfig(project, scanners, new HierarchyConfig(enabled), versioning, codegen, batch, output);
    }

    /**
     * Returns a copy with version tracking switched on or off.
     *
     * @param enabled whether version tracking runs
     * @return new configuration
     */
    public ProjectConfig withVersioning(boolean enabled) {
        return new ProjectConfig(project, scanners, hierarchy,
            new VersioningConfig(enabled, versioning.storeDirectory(), versioning.history()), codegen, batch, output);
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param version project version
     * @param description optional project description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("description") String description
    ) {}

    /**
     * Scanner configuration.
     *
     * @param enabled enabled scanner ids; empty enables every registered scanner
     * @param config scanner-specific configuration keyed by scanner id
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScannerConfig(
        @JsonProperty("enabled") List<String> enabled,
        @JsonProperty("config") Map<String, Object> config
    ) {
        public ScannerConfig {
            enabled = enabled == null ? List.of() : List.copyOf(enabled);
            config = config == null ? Map.of() : config;
        }

        /**
         * Checks if a scanner is enabled.
         *
         * @param scannerId scanner ID to check
         * @return true if no explicit list is given or the list contains the id
         */
        public boolean isEnabled(String scannerId) {
            return enabled.isEmpty() || enabled.contains(scannerId);
        }

        /**
         * Returns the configuration block of one scanner.
         *
         * @param scannerId scanner id
         * @return configuration map, empty when absent
         */
        @SuppressWarnings("unchecked")
        public Map<String, Object> configFor(String scannerId) {
            Object value = config.get(scannerId);
            return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
        }
    }

    /**
     * Hierarchy inference configuration.
     *
     * @param enabled whether dotted ids are linked to their parents
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HierarchyConfig(
        @JsonProperty("enabled") Boolean enabled
    ) {
        public boolean enabledOrDefault() {
            return enabled == null || enabled;
        }
    }

    /**
     * Version tracking configuration.
     *
     * @param enabled whether versions are tracked
     * @param storeDirectory directory of the version stores, relative to the scanned root
     * @param history whether emitted records are appended to the history log
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VersioningConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("storeDirectory") String storeDirectory,
        @JsonProperty("history") Boolean history
    ) {
        /** Default store directory. */
        public static final String DEFAULT_STORE_DIRECTORY = ".tracegraph/versions";

        public VersioningConfig {
            if (storeDirectory == null || storeDirectory.isBlank()) {
                storeDirectory = DEFAULT_STORE_DIRECTORY;
            }
        }

        public boolean enabledOrDefault() {
            return enabled == null || enabled;
        }

        public boolean historyOrDefault() {
            return history == null || history;
        }
    }

    /**
     * Code-generation archive configuration.
     *
     * @param cacheDirectory directory for extracted archives; null extracts next to each archive
     * @param sourceExtensions extensions of recovered source files
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CodegenConfig(
        @JsonProperty("cacheDirectory") String cacheDirectory,
        @JsonProperty("sourceExtensions") List<String> sourceExtensions
    ) {
        public CodegenConfig {
            sourceExtensions = sourceExtensions == null || sourceExtensions.isEmpty()
                ? List.of(".c")
                : List.copyOf(sourceExtensions);
        }
    }

    /**
     * Batch execution configuration.
     *
     * @param parallelism worker threads; 0 or less uses the number of available processors
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BatchConfig(
        @JsonProperty("parallelism") Integer parallelism
    ) {
        /**
         * Resolves the effective number of worker threads.
         *
         * @return worker count, at least 1
         */
        public int effectiveParallelism() {
            if (parallelism == null || parallelism <= 0) {
                return Math.max(1, Runtime.getRuntime().availableProcessors());
            }
            return parallelism;
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory
    ) {
        /** Default output directory. */
        public static final String DEFAULT_DIRECTORY = "./tracegraph-output";

        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_DIRECTORY;
            }
        }
    }
}
