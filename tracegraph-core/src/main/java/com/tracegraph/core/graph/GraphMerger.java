package com.tracegraph.core.graph;

import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.CanonicalNode;
import com.tracegraph.core.model.NodeCollision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges per-input graphs into one graph.
 *
 * <p>Nodes keep the position of their first occurrence. When an id occurs again with different
 * content the later node replaces the earlier one and a {@link NodeCollision} is recorded.
 * Identical repeats are not collisions. Collisions already recorded on the input graphs are
 * carried over.
 *
 * @since 1.0.0
 */
public final class GraphMerger {

    private static final Logger log = LoggerFactory.getLogger(GraphMerger.class);

    private GraphMerger() {
    }

    /**
     * Merges graphs in the given order.
     *
     * @param source label of the merged graph
     * @param graphs graphs to merge
     * @return merged graph
     */
    public static CanonicalGraph merge(String source, List<CanonicalGraph> graphs) {
        Map<String, CanonicalNode> nodes = new LinkedHashMap<>();
        List<NodeCollision> collisions = new ArrayList<>();
        for (CanonicalGraph graph : graphs) {
            collisions.addAll(graph.collisions());
            for (CanonicalNode node : graph.nodes().values()) {
                CanonicalNode previous = nodes.put(node.id(), node);
                if (previous != null && previous.equals(node)) {
                    log.debug("Node id {} from {} repeats identical content", node.id(), graph.source());
                } else if (previous != null) {
                    log.warn("Node id {} from {} replaces the one from {}", node.id(), graph.source(), previous.sourceFile());
                    collisions.add(new NodeCollision(node.id(), previous.sourceFile(), node.sourceFile()));
                }
            }
        }
        return new CanonicalGraph(source, nodes, collisions);
    }
}
