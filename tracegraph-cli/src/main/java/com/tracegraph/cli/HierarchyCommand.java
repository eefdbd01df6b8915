package com.tracegraph.cli;

import com.tracegraph.core.graph.HierarchyInferencer;
import com.tracegraph.core.io.GraphDocumentCodec;
import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.CanonicalNode;
import com.tracegraph.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to link dotted requirement ids of a graph document to their parents.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Writes requirements_with_hierarchy.json next to the input
 * tracegraph hierarchy requirements.json
 * }</pre>
 */
@Command(
    name = "hierarchy",
    description = "Add parent/child links for dotted requirement ids",
    mixinStandardHelpOptions = true
)
public class HierarchyCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HierarchyCommand.class);

    static final String SUFFIX = "_with_hierarchy.json";

    @Parameters(index = "0", description = "Canonical graph document")
    private Path input;

    @Option(names = {"-o", "--output"}, description = "Output file (default: <input>" + SUFFIX + ")")
    private Path output;

    @Override
    public Integer call() {
        try {
            CanonicalGraph graph = GraphDocumentCodec.read(input);
            HierarchyInferencer.Result result = new HierarchyInferencer().infer(graph);

            Path target = output != null ? output : input.resolveSibling(FileUtils.getStem(input) + SUFFIX);
            Files.writeString(target, GraphDocumentCodec.write(result.graph()), StandardCharsets.UTF_8);

            long roots = result.graph().nodes().values().stream().filter(n -> n.incoming().isEmpty()).count();
            long withRelationships = result.graph().nodes().values().stream().filter(CanonicalNode::hasRelationships).count();
            System.out.println("✓ Added " + result.edgesAdded() + " hierarchical relationships");
            System.out.println("✓ Saved to: " + target);
            System.out.println("  Requirements:      " + result.graph().size());
            System.out.println("  With relationships: " + withRelationships);
            System.out.println("  Roots (no parent):  " + roots);
            return 0;
        } catch (Exception e) {
            log.error("Hierarchy inference failed", e);
            System.err.println("✗ Hierarchy inference failed: " + e.getMessage());
            return 1;
        }
    }
}
