package com.tracegraph.core.renderer.impl;

import com.tracegraph.core.renderer.GeneratedFile;
import com.tracegraph.core.renderer.GeneratedOutput;
import com.tracegraph.core.renderer.OutputRenderer;
import com.tracegraph.core.renderer.RenderContext;
import com.tracegraph.core.renderer.RenderReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renderer that writes generated documents to the filesystem.
 *
 * <p>Creates directory structure automatically and preserves relative paths.
 * Existing files are overwritten. A document that cannot be written is logged and reported;
 * the remaining documents are still written.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext("./tracegraph-output", Map.of());
 *
 * GeneratedOutput output = new GeneratedOutput(List.of(
 *     GeneratedFile.json("requirements/spec_connectivity.json", "{ \"nodes\": {} }")
 * ));
 *
 * new FileSystemRenderer().render(output, context);
 * // Creates: ./tracegraph-output/requirements/spec_connectivity.json
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public RenderReport render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputPath();
        logger.info("Rendering {} files to filesystem at: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        List<String> written = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (GeneratedFile file : output.files()) {
            try {
                writeFile(context.resolve(file.relativePath()), file);
                written.add(file.relativePath());
            } catch (IOException | IllegalArgumentException e) {
                logger.error("Failed to write file: {}: {}", file.relativePath(), e.getMessage());
                failures.put(file.relativePath(), e.getMessage());
            }
        }

        logger.info("Rendered {} of {} files to filesystem", written.size(), output.files().size());
        return new RenderReport(written, failures);
    }

    private void writeFile(Path targetPath, GeneratedFile file) throws IOException {
        logger.debug("Writing file: {}", targetPath);

        Path parentDir = targetPath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
        logger.debug("Wrote file: {} ({} bytes)", file.relativePath(), file.content().length());
    }
}
