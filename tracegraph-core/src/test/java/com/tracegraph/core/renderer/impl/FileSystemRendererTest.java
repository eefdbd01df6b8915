package com.tracegraph.core.renderer.impl;

import com.tracegraph.core.renderer.GeneratedFile;
import com.tracegraph.core.renderer.GeneratedOutput;
import com.tracegraph.core.renderer.RenderContext;
import com.tracegraph.core.renderer.RenderReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withNestedPaths_createsDirectories() throws IOException {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            GeneratedFile.json("requirements/cruise_connectivity.json", "{\"nodes\":{}}"),
            GeneratedFile.json("simulink/Plant/block_connectivity.json", "{}")));
        RenderContext context = new RenderContext(tempDir.resolve("out").toString(), Map.of());

        // When
        RenderReport report = renderer.render(output, context);

        // Then
        assertThat(report.isComplete()).isTrue();
        assertThat(report.written()).containsExactly(
            "requirements/cruise_connectivity.json", "simulink/Plant/block_connectivity.json");
        assertThat(Files.readString(tempDir.resolve("out/requirements/cruise_connectivity.json")))
            .isEqualTo("{\"nodes\":{}}");
    }

    @Test
    void render_withUnwritableFile_recordsFailureAndContinues() throws IOException {
        // Given: A directory occupies the path of the first file
        Path outputDir = tempDir.resolve("out");
        Files.createDirectories(outputDir.resolve("blocked.json"));
        GeneratedOutput output = new GeneratedOutput(List.of(
            GeneratedFile.json("blocked.json", "{}"),
            GeneratedFile.json("fine.json", "{}")));

        // When
        RenderReport report = renderer.render(output, new RenderContext(outputDir.toString(), Map.of()));

        // Then
        assertThat(report.isComplete()).isFalse();
        assertThat(report.failures()).containsOnlyKeys("blocked.json");
        assertThat(report.written()).containsExactly("fine.json");
    }

    @Test
    void render_whenOutputDirectoryCannotBeCreated_throws() throws IOException {
        Path file = tempDir.resolve("occupied");
        Files.writeString(file, "x");

        assertThatThrownBy(() -> renderer.render(new GeneratedOutput(List.of()), new RenderContext(file.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to create output directory");
    }

    @Test
    void render_withPathEscapingOutput_rejectsOnlyThatFile() {
        Path outputDir = tempDir.resolve("out");
        GeneratedOutput output = new GeneratedOutput(List.of(
            GeneratedFile.json("simulink/../../escaped.json", "{}"),
            GeneratedFile.json("batch_summary.json", "{}")));

        RenderReport report = renderer.render(output, new RenderContext(outputDir.toString(), Map.of()));

        assertThat(report.failures()).containsOnlyKeys("simulink/../../escaped.json");
        assertThat(report.written()).containsExactly("batch_summary.json");
        assertThat(tempDir.resolve("escaped.json")).doesNotExist();
    }
}
