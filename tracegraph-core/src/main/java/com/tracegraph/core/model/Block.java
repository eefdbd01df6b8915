package com.tracegraph.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A block of a block-diagram model.
 *
 * @param sid block id, unique per model
 * @param name block name
 * @param blockType block type (Gain, Sum, SubSystem, ...)
 * @param position diagram rectangle
 * @param properties remaining descriptor properties
 * @param parentSystem base name of the containing descriptor (e.g. "system_root")
 * @param inputPorts number of input ports
 * @param outputPorts number of output ports
 */
public record Block(
    String sid,
    String name,
    String blockType,
    Position position,
    Map<String, String> properties,
    String parentSystem,
    int inputPorts,
    int outputPorts
) {
    /**
     * Compact constructor with validation.
     */
    public Block {
        Objects.requireNonNull(sid, "sid must not be null");
        if (name == null) {
            name = "";
        }
        if (blockType == null) {
            blockType = "";
        }
        if (position == null) {
            position = Position.DEFAULT;
        }
        properties = properties == null ? Map.of() : Map.copyOf(properties);
        if (parentSystem == null) {
            parentSystem = "";
        }
    }
}
