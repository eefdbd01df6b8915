package com.tracegraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Fingerprint of the connection set of one block model.
 *
 * @param modelName model name
 * @param versionId SHA-256 over the sorted pairs
 * @param connectionCount number of connections
 * @param timestamp ISO-8601 instant of the snapshot
 * @param connections sorted "source->destination" pairs
 */
public record ConnectionSnapshot(
    @JsonProperty("model_name") String modelName,
    @JsonProperty("version_id") String versionId,
    @JsonProperty("connection_count") int connectionCount,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("connections") List<String> connections
) {
    /**
     * Compact constructor with validation.
     */
    public ConnectionSnapshot {
        Objects.requireNonNull(modelName, "modelName must not be null");
        Objects.requireNonNull(versionId, "versionId must not be null");
        connections = connections == null ? List.of() : List.copyOf(connections);
    }
}
