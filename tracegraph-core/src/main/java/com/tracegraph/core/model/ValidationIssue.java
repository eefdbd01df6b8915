package com.tracegraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One finding of the graph validator.
 *
 * @param nodeId affected node, or null for graph-level findings
 * @param severity severity
 * @param message description
 */
public record ValidationIssue(
    @JsonProperty("node_id") String nodeId,
    @JsonProperty("severity") GapSeverity severity,
    @JsonProperty("message") String message
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationIssue {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
