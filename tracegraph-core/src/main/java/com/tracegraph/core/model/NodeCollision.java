package com.tracegraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A node id written twice while building or merging graphs. The later write wins.
 *
 * @param nodeId colliding id
 * @param replacedSource source of the node that was overwritten
 * @param winningSource source of the node that was kept
 */
public record NodeCollision(
    @JsonProperty("node_id") String nodeId,
    @JsonProperty("replaced_source") String replacedSource,
    @JsonProperty("winning_source") String winningSource
) {
    /**
     * Compact constructor with validation.
     */
    public NodeCollision {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
    }
}
