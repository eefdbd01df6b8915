package com.tracegraph.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Unified node shape emitted for requirements and blocks alike.
 *
 * <p>{@code incoming} and {@code outgoing} hold ids of other nodes of the same graph.
 * For requirements the lists are de-duplicated; for blocks they are literal
 * per-connection lists and may repeat an id.
 *
 * @param id node id (requirement business id or block sid)
 * @param name display name
 * @param nodeType node type ("Requirement_Functional", "Gain", ...)
 * @param text requirement text, null for blocks
 * @param xmiId internal model id, null for blocks
 * @param incoming ids of nodes with an edge into this node
 * @param outgoing ids of nodes this node has an edge to
 * @param properties additional properties
 * @param sourceFile originating source
 *
 * @since 1.0.0
 */
public record CanonicalNode(
    String id,
    String name,
    String nodeType,
    String text,
    String xmiId,
    List<String> incoming,
    List<String> outgoing,
    Map<String, Object> properties,
    String sourceFile
) {
    /**
     * Compact constructor with validation.
     */
    public CanonicalNode {
        Objects.requireNonNull(id, "id must not be null");
        if (name == null) {
            name = "";
        }
        if (nodeType == null) {
            nodeType = "";
        }
        incoming = incoming == null ? List.of() : List.copyOf(incoming);
        outgoing = outgoing == null ? List.of() : List.copyOf(outgoing);
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        if (sourceFile == null) {
            sourceFile = "";
        }
    }

    /**
     * Returns a copy with new edge lists.
     *
     * @param newIncoming incoming ids
     * @param newOutgoing outgoing ids
     * @return new node
     */
    public CanonicalNode withEdges(List<String> newIncoming, List<String> newOutgoing) {
        return new CanonicalNode(id, name, nodeType, text, xmiId, newIncoming, newOutgoing, properties, sourceFile);
    }

    /**
     * Returns true if this node has at least one incoming or outgoing edge.
     *
     * @return true when connected
     */
    public boolean hasRelationships() {
        return !incoming.isEmpty() || !outgoing.isEmpty();
    }
}
