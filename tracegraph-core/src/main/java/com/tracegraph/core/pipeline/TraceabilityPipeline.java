package com.tracegraph.core.pipeline;

import com.tracegraph.core.config.ProjectConfig;
import com.tracegraph.core.graph.GraphMerger;
import com.tracegraph.core.graph.GraphValidator;
import com.tracegraph.core.graph.HierarchyInferencer;
import com.tracegraph.core.io.CodeMappingCodec;
import com.tracegraph.core.io.GraphDocumentCodec;
import com.tracegraph.core.io.JsonDocuments;
import com.tracegraph.core.model.ArtifactType;
import com.tracegraph.core.model.BatchSummary;
import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.ConnectionSnapshot;
import com.tracegraph.core.model.FileOutcome;
import com.tracegraph.core.model.QualityGap;
import com.tracegraph.core.model.Tool;
import com.tracegraph.core.model.TrackingResult;
import com.tracegraph.core.model.ValidationReport;
import com.tracegraph.core.renderer.GeneratedFile;
import com.tracegraph.core.renderer.GeneratedOutput;
import com.tracegraph.core.renderer.OutputRenderer;
import com.tracegraph.core.renderer.RenderContext;
import com.tracegraph.core.renderer.RenderReport;
import com.tracegraph.core.scanner.ScanContext;
import com.tracegraph.core.scanner.ScanResult;
import com.tracegraph.core.scanner.Scanner;
import com.tracegraph.core.util.FileUtils;
import com.tracegraph.core.versioning.ConnectionFingerprint;
import com.tracegraph.core.versioning.VersionTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * End-to-end run over one root directory.
 *
 * <p>Steps:
 * <ol>
 *   <li>Run every enabled scanner over its inputs on the {@link BatchProcessor}</li>
 *   <li>Merge the requirement graphs of all archives (last write wins)</li>
 *   <li>Link dotted requirement ids to their parents, when enabled</li>
 *   <li>Validate the merged requirement graph</li>
 *   <li>Track versions of requirements and blocks and fingerprint each model's connections,
 *       when enabled</li>
 *   <li>Render all documents</li>
 * </ol>
 * Version stores are written before rendering, so a rendering failure never loses version
 * records.
 *
 * @since 1.0.0
 */
public class TraceabilityPipeline {

    private static final Logger log = LoggerFactory.getLogger(TraceabilityPipeline.class);

    /** Source label of the merged requirement graph. */
    public static final String MERGED_SOURCE = "all_requirements";

    private static final String VERSION_STORE_SOURCE = "version store";

    private final ProjectConfig config;
    private final List<Scanner> scanners;
    private final OutputRenderer renderer;
    private final VersionTracker tracker;
    private final ConnectionFingerprint fingerprint;
    private final HierarchyInferencer hierarchy = new HierarchyInferencer();
    private final GraphValidator validator = new GraphValidator();

    /**
     * Creates a pipeline.
     *
     * @param config project configuration
     * @param scanners enabled scanners in run order
     * @param renderer renderer for the emitted documents, or null to skip rendering
     * @param clock clock for version timestamps
     */
    public TraceabilityPipeline(ProjectConfig config, List<Scanner> scanners, OutputRenderer renderer, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.scanners = List.copyOf(scanners);
        this.renderer = renderer;
        this.tracker = new VersionTracker(clock);
        this.fingerprint = new ConnectionFingerprint(clock);
    }

    /**
     * Runs the pipeline.
     *
     * @param root root directory holding the inputs
     * @return run result
     */
    public PipelineResult run(Path root) {
        Path rootPath = root.toAbsolutePath().normalize();
        log.info("Starting traceability run over {}", rootPath);

        ScanContext context = new ScanContext(rootPath, List.of(rootPath), Map.of(), settings());
        List<ScanResult> results = new BatchProcessor(config.batch().effectiveParallelism())
            .run(scanners, context, config.scanners());

        List<GeneratedFile> files = new ArrayList<>();
        List<FileOutcome> outcomes = new ArrayList<>();
        List<QualityGap> gaps = new ArrayList<>();
        List<CanonicalGraph> requirementGraphs = new ArrayList<>();
        Map<String, CanonicalGraph> blockGraphs = new LinkedHashMap<>();

        for (ScanResult result : results) {
            outcomes.add(collect(result, files, gaps, requirementGraphs, blockGraphs));
        }

        CanonicalGraph requirements = GraphMerger.merge(MERGED_SOURCE, requirementGraphs);
        int hierarchyEdges = 0;
        if (config.hierarchy().enabledOrDefault()) {
            HierarchyInferencer.Result inferred = hierarchy.infer(requirements);
            requirements = inferred.graph();
            hierarchyEdges = inferred.edgesAdded();
        }
        files.add(GeneratedFile.json(OutputLayout.ALL_REQUIREMENTS, GraphDocumentCodec.write(requirements)));

        ValidationReport validation = validator.validate(requirements);
        gaps.addAll(validator.toQualityGaps(validation));

        TrackingResult requirementTracking = null;
        Map<String, TrackingResult> blockTracking = new LinkedHashMap<>();
        Map<String, ConnectionSnapshot> connections = new LinkedHashMap<>();
        boolean versioning = config.versioning().enabledOrDefault();
        Path storeDirectory = rootPath.resolve(config.versioning().storeDirectory()).normalize();

        if (versioning && !requirementGraphs.isEmpty()) {
            requirementTracking = track(requirements, storeDirectory.resolve(OutputLayout.REQUIREMENT_STORE),
                ArtifactType.REQUIREMENT, Tool.CAMEO, gaps);
        }
        for (Map.Entry<String, CanonicalGraph> entry : blockGraphs.entrySet()) {
            String model = entry.getKey();
            CanonicalGraph graph = entry.getValue();
            if (versioning) {
                TrackingResult tracking = track(graph, storeDirectory.resolve(OutputLayout.blockStore(model)),
                    ArtifactType.MODEL, Tool.SIMULINK, gaps);
                if (tracking != null) {
                    blockTracking.put(model, tracking);
                }
            }
            ConnectionSnapshot snapshot = fingerprintConnections(storeDirectory, model, graph, versioning, gaps);
            connections.put(model, snapshot);
            files.add(GeneratedFile.json(OutputLayout.connectionVersion(model), JsonDocuments.write(snapshot)));
        }

        BatchSummary summary = BatchSummary.of(outcomes, requirements.collisions(), gaps);
        files.add(GeneratedFile.json(OutputLayout.VALIDATION_REPORT, JsonDocuments.write(validation)));
        files.add(GeneratedFile.json(OutputLayout.BATCH_SUMMARY, JsonDocuments.write(summary)));

        GeneratedOutput output = new GeneratedOutput(files);
        RenderReport render = render(output, rootPath);

        log.info("Run complete: {} inputs ({} failed), {} requirements, {} block models",
            summary.totalFiles(), summary.failed(), requirements.size(), blockGraphs.size());
        return new PipelineResult(results, requirements, hierarchyEdges, validation, summary,
            requirementTracking, blockTracking, connections, output, render);
    }

    /**
     * Resolves the output directory of a run.
     *
     * @param root scanned root
     * @return absolute output directory
     */
    public Path outputDirectory(Path root) {
        return root.toAbsolutePath().normalize().resolve(config.output().directory()).normalize();
    }

    private FileOutcome collect(ScanResult result, List<GeneratedFile> files, List<QualityGap> gaps,
                                List<CanonicalGraph> requirementGraphs, Map<String, CanonicalGraph> blockGraphs) {
        Path fileName = result.input().getFileName();
        String filename = fileName != null ? fileName.toString() : result.input().toString();
        result.warnings().forEach(warning -> gaps.add(QualityGap.warning(filename, warning)));

        if (!result.success()) {
            String error = result.firstError() != null ? result.firstError() : "Unknown error";
            gaps.add(QualityGap.error(filename, error));
            return new FileOutcome(filename, result.scannerId(), FileOutcome.FAILED, 0, null, error);
        }

        String outputFile = null;
        if (result.codeMappings() != null) {
            outputFile = OutputLayout.codeMappings(FileUtils.getStem(result.input()));
            files.add(GeneratedFile.json(outputFile, CodeMappingCodec.write(result.codeMappings())));
        } else if (result.diagram() != null && result.graph() != null) {
            String model = uniqueModelKey(result.diagram().modelName(), blockGraphs.keySet());
            if (!model.equals(result.diagram().modelName())) {
                log.warn("Model name {} of {} is already taken, tracking it as {}",
                    result.diagram().modelName(), result.input(), model);
                gaps.add(QualityGap.warning(filename, "Model name " + result.diagram().modelName()
                    + " is shared with another input, outputs and versions are kept under " + model));
            }
            outputFile = OutputLayout.blockGraph(model);
            blockGraphs.put(model, result.graph());
            files.add(GeneratedFile.json(outputFile, GraphDocumentCodec.write(result.graph())));
        } else if (result.graph() != null) {
            outputFile = OutputLayout.requirementGraph(FileUtils.getStem(result.input()));
            requirementGraphs.add(result.graph());
            files.add(GeneratedFile.json(outputFile, GraphDocumentCodec.write(result.graph())));
        }

        return new FileOutcome(filename, result.scannerId(), FileOutcome.SUCCESS, result.entityCount(), outputFile, null);
    }

    /**
     * Model names key output folders and version stores, so a repeated name gets a numeric
     * suffix instead of replacing the earlier model.
     */
    static String uniqueModelKey(String modelName, Set<String> taken) {
        if (!taken.contains(modelName)) {
            return modelName;
        }
        int suffix = 2;
        while (taken.contains(modelName + "_" + suffix)) {
            suffix++;
        }
        return modelName + "_" + suffix;
    }

    private TrackingResult track(CanonicalGraph graph, Path storeFile, ArtifactType type, Tool tool, List<QualityGap> gaps) {
        try {
            TrackingResult tracking = tracker.trackAndPersist(graph, storeFile, type, tool,
                config.versioning().historyOrDefault());
            if (tracking.degradedStore()) {
                gaps.add(QualityGap.warning(VERSION_STORE_SOURCE,
                    "Unreadable store " + storeFile.getFileName() + ", all artifacts treated as new"));
            }
            return tracking;
        } catch (IOException e) {
            log.error("Failed to persist version store {}: {}", storeFile, e.getMessage(), e);
            gaps.add(QualityGap.error(VERSION_STORE_SOURCE, "Failed to persist " + storeFile.getFileName() + ": " + e.getMessage()));
            return null;
        }
    }

    private ConnectionSnapshot fingerprintConnections(Path storeDirectory, String model, CanonicalGraph graph,
                                                      boolean persist, List<QualityGap> gaps) {
        if (!persist) {
            return fingerprint.fingerprint(model, graph);
        }
        try {
            return fingerprint.update(storeDirectory, model, graph);
        } catch (IOException e) {
            log.error("Failed to persist connection snapshot of {}: {}", model, e.getMessage(), e);
            gaps.add(QualityGap.error(VERSION_STORE_SOURCE, "Failed to persist connections of " + model + ": " + e.getMessage()));
            return fingerprint.fingerprint(model, graph);
        }
    }

    private RenderReport render(GeneratedOutput output, Path rootPath) {
        if (renderer == null) {
            log.debug("No renderer configured, skipping {} documents", output.files().size());
            return null;
        }
        RenderContext renderContext = new RenderContext(outputDirectory(rootPath).toString(), Map.of());
        try {
            return renderer.render(output, renderContext);
        } catch (IllegalStateException e) {
            log.error("Rendering with {} failed: {}", renderer.getId(), e.getMessage(), e);
            Map<String, String> failures = new LinkedHashMap<>();
            output.files().forEach(file -> failures.put(file.relativePath(), e.getMessage()));
            return new RenderReport(List.of(), failures);
        }
    }

    private Map<String, String> settings() {
        Map<String, String> settings = new HashMap<>();
        ProjectConfig.CodegenConfig codegen = config.codegen();
        if (codegen.cacheDirectory() != null && !codegen.cacheDirectory().isBlank()) {
            settings.put(ScanContext.SETTING_CODEGEN_CACHE, codegen.cacheDirectory());
        }
        settings.put(ScanContext.SETTING_CODEGEN_EXTENSIONS, String.join(",", codegen.sourceExtensions()));
        return settings;
    }
}
