package com.tracegraph.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered set of canonical nodes keyed by id.
 *
 * @param source label of the input that produced the graph (file name, model name, "merged")
 * @param nodes nodes by id in insertion order
 * @param collisions ids that were written more than once while building the graph
 *
 * @since 1.0.0
 */
public record CanonicalGraph(
    String source,
    Map<String, CanonicalNode> nodes,
    List<NodeCollision> collisions
) {
    /**
     * Compact constructor with validation.
     */
    public CanonicalGraph {
        Objects.requireNonNull(source, "source must not be null");
        nodes = nodes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        collisions = collisions == null ? List.of() : List.copyOf(collisions);
    }

    /**
     * Creates an empty graph.
     *
     * @param source source label
     * @return empty graph
     */
    public static CanonicalGraph empty(String source) {
        return new CanonicalGraph(source, Map.of(), List.of());
    }

    /**
     * Number of nodes.
     *
     * @return node count
     */
    public int size() {
        return nodes.size();
    }

    /**
     * Looks up a node.
     *
     * @param id node id
     * @return node or null
     */
    public CanonicalNode node(String id) {
        return nodes.get(id);
    }
}
