package com.tracegraph.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything parsed from one block-diagram model.
 *
 * @param modelName model name
 * @param modelProperties model-level properties from the root descriptor
 * @param blocks blocks in descriptor order
 * @param connections connections in descriptor order
 */
public record BlockDiagram(
    String modelName,
    Map<String, String> modelProperties,
    List<Block> blocks,
    List<Connection> connections
) {
    /**
     * Compact constructor with validation.
     */
    public BlockDiagram {
        Objects.requireNonNull(modelName, "modelName must not be null");
        modelProperties = modelProperties == null ? Map.of() : Map.copyOf(modelProperties);
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        connections = connections == null ? List.of() : List.copyOf(connections);
    }
}
