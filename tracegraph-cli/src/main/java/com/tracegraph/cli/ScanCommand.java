package com.tracegraph.cli;

import com.tracegraph.core.config.ConfigLoader;
import com.tracegraph.core.config.ProjectConfig;
import com.tracegraph.core.model.BatchSummary;
import com.tracegraph.core.model.FileOutcome;
import com.tracegraph.core.model.GapSeverity;
import com.tracegraph.core.model.TrackingResult;
import com.tracegraph.core.pipeline.PipelineResult;
import com.tracegraph.core.pipeline.ScannerRegistry;
import com.tracegraph.core.pipeline.TraceabilityPipeline;
import com.tracegraph.core.renderer.OutputRenderer;
import com.tracegraph.core.scanner.Scanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to run the full traceability pipeline over a directory.
 *
 * <p>Orchestrates:
 * <ol>
 *   <li>Load configuration and discover scanners via SPI</li>
 *   <li>Run enabled scanners over every discovered archive and model</li>
 *   <li>Merge, link and validate the requirement graph</li>
 *   <li>Track versions and connection fingerprints</li>
 *   <li>Render all documents to the output directory</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Scan current directory
 * tracegraph scan
 *
 * # Scan a directory, writing elsewhere, without touching version stores
 * tracegraph scan ./models -o ./out --no-versioning
 * }</pre>
 */
@Command(
    name = "scan",
    description = "Extract requirements, blocks and code mappings and track their versions",
    mixinStandardHelpOptions = true
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    @Parameters(
        index = "0",
        description = "Directory holding archives and models (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: tracegraph.yaml)"
    )
    private Path configPath = Path.of(ProjectConfig.FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"-r", "--renderer"},
        description = "Renderer id: filesystem or console (default: filesystem)",
        defaultValue = "filesystem"
    )
    private String rendererId;

    @Option(names = {"--no-hierarchy"}, description = "Do not link dotted requirement ids")
    private boolean noHierarchy;

    @Option(names = {"--no-versioning"}, description = "Do not read or write version stores")
    private boolean noVersioning;

    @Option(names = {"--dry-run"}, description = "Run scanners but don't write output documents")
    private boolean dryRun;

    @Override
    public Integer call() {
        try {
            log.info("Starting scan of: {}", projectPath.toAbsolutePath());
            System.out.println("Scanning: " + projectPath.toAbsolutePath());
            System.out.println();

            ProjectConfig config = loadConfiguration();
            List<Scanner> scanners = ScannerRegistry.enabled(ScannerRegistry.discover(), config.scanners());
            System.out.println("✓ Enabled " + scanners.size() + " scanners");

            OutputRenderer renderer = dryRun ? null : findRenderer(rendererId);
            TraceabilityPipeline pipeline = new TraceabilityPipeline(config, scanners, renderer, Clock.systemUTC());
            PipelineResult result = pipeline.run(projectPath);

            printSummary(result);
            if (result.render() != null) {
                System.out.println("✓ Rendered " + result.render().written().size() + " documents to: "
                    + pipeline.outputDirectory(projectPath));
                result.render().failures().forEach((file, error) ->
                    System.err.println("✗ Failed to write " + file + ": " + error));
            } else {
                System.out.println("Dry-run mode: skipped writing " + result.output().files().size() + " documents");
            }

            System.out.println();
            System.out.println("✓ Scan complete");
            return 0;
        } catch (Exception e) {
            log.error("Scan failed", e);
            System.err.println("✗ Scan failed: " + e.getMessage());
            return 1;
        }
    }

    private ProjectConfig loadConfiguration() {
        Path absoluteConfigPath = configPath.isAbsolute() ? configPath : projectPath.resolve(configPath);
        log.debug("Loading configuration from: {}", absoluteConfigPath);

        ProjectConfig config = ConfigLoader.load(absoluteConfigPath);
        if (outputDir != null) {
            config = config.withOutputDirectory(outputDir.toAbsolutePath().toString());
        }
        if (noHierarchy) {
            config = config.withHierarchy(false);
        }
        if (noVersioning) {
            config = config.withVersioning(false);
        }
        return config;
    }

    static OutputRenderer findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
        }
        throw new IllegalArgumentException("Unknown renderer: " + id);
    }

    private void printSummary(PipelineResult result) {
        BatchSummary summary = result.summary();
        System.out.println();
        System.out.println("Batch Summary:");
        System.out.println("  Inputs:         " + summary.totalFiles());
        System.out.println("  Successful:     " + summary.successful());
        System.out.println("  Failed:         " + summary.failed());
        System.out.println("  Entities:       " + summary.totalEntities());
        System.out.println("  Requirements:   " + result.requirements().size());
        System.out.println("  Hierarchy:      " + result.hierarchyEdges() + " links added");
        System.out.println("  Collisions:     " + summary.collisions().size());
        System.out.println("  Issues:         " + result.validation().count(GapSeverity.ERROR) + " errors, "
            + result.validation().count(GapSeverity.WARNING) + " warnings");

        TrackingResult requirements = result.requirementTracking();
        if (requirements != null) {
            System.out.println("  Req. versions:  " + requirements.newCount() + " new, "
                + requirements.changedCount() + " changed, " + requirements.unchanged() + " unchanged");
        }
        for (Map.Entry<String, TrackingResult> entry : result.blockTracking().entrySet()) {
            TrackingResult tracking = entry.getValue();
            System.out.println("  " + entry.getKey() + ": " + tracking.newCount() + " new, "
                + tracking.changedCount() + " changed, " + tracking.unchanged() + " unchanged blocks");
        }
        System.out.println();

        for (FileOutcome outcome : summary.files()) {
            if (!outcome.succeeded()) {
                System.err.println("✗ " + outcome.filename() + ": " + outcome.error());
            }
        }
    }
}
