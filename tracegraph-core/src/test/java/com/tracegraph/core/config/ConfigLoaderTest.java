package com.tracegraph.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("tracegraph.yaml");
        Files.writeString(configFile, """
            project:
              name: "Cruise"
              version: "2.1.0"
              description: "Cruise control traceability"

            scanners:
              enabled:
                - cameo-requirements
                - simulink-blocks
              config:
                simulink-blocks:
                  strict: true

            hierarchy:
              enabled: false

            versioning:
              enabled: true
              storeDirectory: "versions"
              history: false

            codegen:
              cacheDirectory: ".cache/codegen"
              sourceExtensions: [".c", ".h"]

            batch:
              parallelism: 3

            output:
              directory: "./out"
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("Cruise");
        assertThat(config.project().version()).isEqualTo("2.1.0");
        assertThat(config.scanners().enabled()).containsExactly("cameo-requirements", "simulink-blocks");
        assertThat(config.scanners().isEnabled("simulink-codegen")).isFalse();
        assertThat(config.scanners().configFor("simulink-blocks")).isEqualTo(Map.of("strict", true));
        assertThat(config.scanners().configFor("cameo-requirements")).isEmpty();
        assertThat(config.hierarchy().enabledOrDefault()).isFalse();
        assertThat(config.versioning().storeDirectory()).isEqualTo("versions");
        assertThat(config.versioning().historyOrDefault()).isFalse();
        assertThat(config.codegen().cacheDirectory()).isEqualTo(".cache/codegen");
        assertThat(config.codegen().sourceExtensions()).containsExactly(".c", ".h");
        assertThat(config.batch().effectiveParallelism()).isEqualTo(3);
        assertThat(config.output().directory()).isEqualTo("./out");
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("tracegraph.yaml");
        Files.writeString(configFile, """
            project:
              name: "Minimal"
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("Minimal");
        assertThat(config.project().description()).isNull();
        assertThat(config.scanners().enabled()).isEmpty();
        assertThat(config.scanners().isEnabled("anything")).isTrue();
        assertThat(config.hierarchy().enabledOrDefault()).isTrue();
        assertThat(config.versioning().enabledOrDefault()).isTrue();
        assertThat(config.versioning().storeDirectory()).isEqualTo(ProjectConfig.VersioningConfig.DEFAULT_STORE_DIRECTORY);
        assertThat(config.codegen().sourceExtensions()).containsExactly(".c");
        assertThat(config.batch().effectiveParallelism()).isPositive();
        assertThat(config.output().directory()).isEqualTo(ProjectConfig.OutputConfig.DEFAULT_DIRECTORY);
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("tracegraph.yaml");
        Files.writeString(configFile, "project: [unclosed\n  name: :");

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("project");
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("tracegraph.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_ignoresUnknownKeys() throws IOException {
        Path configFile = tempDir.resolve("tracegraph.yaml");
        Files.writeString(configFile, """
            project:
              name: "Extra"
              owner: "someone"
            dashboards:
              - grafana
            """);

        assertThat(ConfigLoader.load(configFile).project().name()).isEqualTo("Extra");
    }

    @Test
    void loadFromRoot_withoutFile_returnsDefaults() {
        assertThat(ConfigLoader.loadFromRoot(tempDir)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void overrides_replaceOnlyTheirSection() {
        ProjectConfig config = ProjectConfig.defaults()
            .withOutputDirectory("build/trace")
            .withHierarchy(false)
            .withVersioning(false);

        assertThat(config.output().directory()).isEqualTo("build/trace");
        assertThat(config.hierarchy().enabledOrDefault()).isFalse();
        assertThat(config.versioning().enabledOrDefault()).isFalse();
        assertThat(config.versioning().storeDirectory()).isEqualTo(ProjectConfig.VersioningConfig.DEFAULT_STORE_DIRECTORY);
    }
}
