package com.tracegraph.core.scanner.impl.cameo;

import com.tracegraph.core.archive.RequirementsArchiveReader;
import com.tracegraph.core.graph.CanonicalGraphBuilder;
import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.scanner.ScanContext;
import com.tracegraph.core.scanner.ScanResult;
import com.tracegraph.core.scanner.ScanStatistics;
import com.tracegraph.core.scanner.base.AbstractXmlScanner;
import com.tracegraph.core.scanner.impl.cameo.util.RelationshipResolver;
import com.tracegraph.core.scanner.impl.cameo.util.RequirementExtractor;
import com.tracegraph.core.scanner.impl.cameo.util.XmiElementCollector;
import com.tracegraph.core.scanner.impl.cameo.util.XmiIndex;
import com.tracegraph.core.util.FileUtils;
import org.w3c.dom.Document;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Scanner for SysML requirements in Cameo/MagicDraw model archives ({@code .mdzip}).
 *
 * <p><b>Pipeline</b></p>
 * <ol>
 *   <li>Read the {@code com.nomagic.magicdraw.uml_model.model} entry of the archive</li>
 *   <li>Index stereotype applications and identified elements ({@link XmiElementCollector})</li>
 *   <li>Extract requirements with valid names ({@link RequirementExtractor})</li>
 *   <li>Attach derive/refine/satisfy/verify/trace relationships ({@link RelationshipResolver})</li>
 *   <li>Adapt to canonical nodes keyed by business id ({@link CanonicalGraphBuilder})</li>
 * </ol>
 *
 * <p>A missing entry or corrupt archive and malformed XMI fail the input, not the batch.
 * Requirements rejected by the name filter and unresolved references are counted in
 * {@link ScanStatistics}.
 *
 * @see RequirementsArchiveReader
 * @since 1.0.0
 */
public class CameoRequirementsScanner extends AbstractXmlScanner {

    private static final String SCANNER_ID = "cameo-requirements";
    private static final String SCANNER_DISPLAY_NAME = "Cameo Requirements Scanner";
    private static final int SCANNER_PRIORITY = 10;

    private final RequirementsArchiveReader archiveReader = new RequirementsArchiveReader();
    private final XmiElementCollector collector = new XmiElementCollector();
    private final RequirementExtractor extractor = new RequirementExtractor();
    private final RelationshipResolver resolver = new RelationshipResolver();

    @Override
    public String getId() {
        return SCANNER_ID;
    }

    @Override
    public String getDisplayName() {
        return SCANNER_DISPLAY_NAME;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of("*.mdzip", "**/*.mdzip");
    }

    @Override
    public int getPriority() {
        return SCANNER_PRIORITY;
    }

    @Override
    public ScanResult scan(Path input, ScanContext context) {
        log.info("Analyzing requirements archive: {}", input.getFileName());
        try {
            byte[] payload = archiveReader.readPayload(input);
            Document document = parseXml(payload, input.getFileName() + "!" + RequirementsArchiveReader.PAYLOAD_ENTRY);
            return analyze(input, document);
        } catch (IOException e) {
            return failedResult(input, e);
        }
    }

    private ScanResult analyze(Path input, Document document) {
        ScanStatistics.Builder stats = new ScanStatistics.Builder();

        XmiIndex index = collector.collect(document);
        stats.elementsVisited(index.elementsVisited());
        log.debug("Collected {} stereotype applications and {} identified elements",
            index.stereotypes().size(), index.elements().size());

        RequirementExtractor.Extraction extraction = extractor.extract(index, FileUtils.getStem(input));
        for (String rejected : extraction.rejected()) {
            stats.addSkip("invalid name", "Requirement '" + rejected + "' skipped");
        }

        RelationshipResolver.Resolution resolution = resolver.resolve(index, extraction.requirements());
        stats.entitiesExtracted(resolution.requirements().size());
        stats.edgesCollected(resolution.edges());
        stats.addResolutionMisses(resolution.misses());

        CanonicalGraph graph = CanonicalGraphBuilder.fromRequirements(
            input.getFileName().toString(), resolution.requirements().values());

        List<String> warnings = new ArrayList<>();
        if (graph.size() == 0) {
            warnings.add("No requirements with a Requirement stereotype found in " + input.getFileName());
            log.warn("No requirements found in {}; it may contain design elements only", input.getFileName());
        }
        if (!graph.collisions().isEmpty()) {
            warnings.add(graph.collisions().size() + " requirements share a business id in " + input.getFileName());
        }

        ScanStatistics statistics = stats.build();
        log.info("Extracted {} requirements from {} ({})", graph.size(), input.getFileName(), statistics.getSummary());
        return graphResult(input, graph, null, warnings, statistics);
    }
}
