package com.tracegraph.core.graph;

import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.CanonicalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Links dotted requirement ids to their parents.
 *
 * <p>For every node id containing a dot, the parent id is the text before the last dot
 * ({@code TWCAT150.3.1} is the parent of {@code TWCAT150.3.1.2}). When the parent is a node
 * of the graph, the parent is added to the child's incoming list and the child to the
 * parent's outgoing list. Both additions are skipped when already present, so running the
 * inferencer twice adds nothing the second time.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * HierarchyInferencer.Result result = new HierarchyInferencer().infer(graph);
 * log.info("Added {} hierarchical relationships", result.edgesAdded());
 * }</pre>
 *
 * @since 1.0.0
 */
public class HierarchyInferencer {

    private static final Logger log = LoggerFactory.getLogger(HierarchyInferencer.class);

    /**
     * Outcome of an inference run.
     *
     * @param graph graph with hierarchy edges
     * @param edgesAdded number of child-to-parent links added
     */
    public record Result(CanonicalGraph graph, int edgesAdded) {}

    /**
     * Adds hierarchy edges.
     *
     * @param graph input graph, left unchanged
     * @return new graph and the number of links added
     */
    public Result infer(CanonicalGraph graph) {
        Map<String, List<String>> incoming = new LinkedHashMap<>();
        Map<String, List<String>> outgoing = new LinkedHashMap<>();
        graph.nodes().forEach((id, node) -> {
            incoming.put(id, new ArrayList<>(node.incoming()));
            outgoing.put(id, new ArrayList<>(node.outgoing()));
        });

        int added = 0;
        for (String id : graph.nodes().keySet()) {
            String parent = parentOf(id);
            if (parent == null || !graph.nodes().containsKey(parent)) {
                continue;
            }
            List<String> childIncoming = incoming.get(id);
            if (!childIncoming.contains(parent)) {
                childIncoming.add(parent);
                added++;
                log.debug("{} derives from {}", id, parent);
            }
            List<String> parentOutgoing = outgoing.get(parent);
            if (!parentOutgoing.contains(id)) {
                parentOutgoing.add(id);
            }
        }

        Map<String, CanonicalNode> nodes = new LinkedHashMap<>();
        graph.nodes().forEach((id, node) -> nodes.put(id, node.withEdges(incoming.get(id), outgoing.get(id))));
        log.info("Added {} hierarchical relationships to {}", added, graph.source());
        return new Result(new CanonicalGraph(graph.source(), nodes, graph.collisions()), added);
    }

    /**
     * Returns the parent id of a dotted id.
     *
     * @param id node id
     * @return text before the last dot, or null when the id has no dot
     */
    public static String parentOf(String id) {
        int dot = id.lastIndexOf('.');
        return dot < 0 ? null : id.substring(0, dot);
    }
}
