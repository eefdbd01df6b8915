package com.tracegraph.core.scanner.impl.simulink;

import com.tracegraph.core.archive.BlockDiagramSource;
import com.tracegraph.core.graph.CanonicalGraphBuilder;
import com.tracegraph.core.model.BlockDiagram;
import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.scanner.ScanContext;
import com.tracegraph.core.scanner.ScanResult;
import com.tracegraph.core.scanner.ScanStatistics;
import com.tracegraph.core.scanner.base.AbstractXmlScanner;
import com.tracegraph.core.scanner.impl.simulink.util.BlockDiagramParser;
import org.w3c.dom.Document;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Scanner for Simulink block diagrams.
 *
 * <p>Handles unpacked model trees (a directory holding {@code blockdiagram.xml} and
 * {@code systems/*.xml}) and packaged {@code .slx} containers. Each model becomes a canonical
 * graph of blocks connected by signal lines; the parsed {@link BlockDiagram} is returned as well
 * so that its connection set can be fingerprinted.
 *
 * @see BlockDiagramParser
 * @since 1.0.0
 */
public class SimulinkBlockScanner extends AbstractXmlScanner {

    private static final String SCANNER_ID = "simulink-blocks";
    private static final String SCANNER_DISPLAY_NAME = "Simulink Block Diagram Scanner";
    private static final int SCANNER_PRIORITY = 20;

    private final BlockDiagramParser parser = new BlockDiagramParser();

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
        return Set.of(
            BlockDiagramSource.ROOT_DESCRIPTOR,
            "**/" + BlockDiagramSource.ROOT_DESCRIPTOR,
            "*.slx",
            "**/*.slx");
    }

    @Override
    public int getPriority() {
        return SCANNER_PRIORITY;
    }

    /**
     * Model trees are reported as their directory, containers as the file itself.
     */
    @Override
    public List<Path> discoverInputs(ScanContext context) {
        List<Path> trees = findInputs(context, BlockDiagramSource.ROOT_DESCRIPTOR, "**/" + BlockDiagramSource.ROOT_DESCRIPTOR)
            .stream()
            .map(Path::getParent)
            .toList();
        List<Path> containers = findInputs(context, "*.slx", "**/*.slx");
        return Stream.concat(trees.stream(), containers.stream())
            .distinct()
            .sorted()
            .toList();
    }

    @Override
    public ScanResult scan(Path input, ScanContext context) {
        try {
            BlockDiagramSource source = BlockDiagramSource.open(input);
            log.info("Loading Simulink model {} from {}", source.modelName(), input);

            Document root = source.rootDescriptor() != null
                ? parseXml(source.rootDescriptor(), BlockDiagramSource.ROOT_DESCRIPTOR)
                : null;
            Map<String, Document> systems = new LinkedHashMap<>();
            for (Map.Entry<String, byte[]> entry : source.systemDescriptors().entrySet()) {
                systems.put(entry.getKey(), parseXml(entry.getValue(), BlockDiagramSource.SYSTEMS_DIR + "/" + entry.getKey() + ".xml"));
            }

            ScanStatistics.Builder stats = new ScanStatistics.Builder();
            BlockDiagram diagram = parser.parse(source.modelName(), root, systems, stats);
            CanonicalGraph graph = CanonicalGraphBuilder.fromBlockDiagram(diagram);
            int unresolved = CanonicalGraphBuilder.countUnresolvedConnections(diagram);
            stats.entitiesExtracted(graph.size());
            stats.addResolutionMisses(unresolved);

            List<String> warnings = new ArrayList<>();
            if (root == null) {
                warnings.add("Model " + source.modelName() + " has no " + BlockDiagramSource.ROOT_DESCRIPTOR);
            }
            if (systems.isEmpty()) {
                warnings.add("Model " + source.modelName() + " has no system descriptors");
            }
            if (unresolved > 0) {
                log.debug("{} connections of {} reference unknown blocks", unresolved, source.modelName());
            }

            ScanStatistics statistics = stats.build();
            log.info("Parsed {} blocks and {} connections from {} ({})",
                diagram.blocks().size(), diagram.connections().size(), source.modelName(), statistics.getSummary());
            return graphResult(input, graph, diagram, warnings, statistics);
        } catch (IOException e) {
            return failedResult(input, e);
        }
    }
}
