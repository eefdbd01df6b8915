package com.tracegraph.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity level for quality gaps and validation issues.
 *
 * @since 1.0.0
 */
public enum GapSeverity {
    /**
     * Informational, no action required.
     */
    INFO,

    /**
     * Potential issue that should be reviewed.
     */
    WARNING,

    /**
     * Significant issue that affects extraction quality.
     */
    ERROR;

    /**
     * Lower-case JSON value.
     *
     * @return e.g. "warning"
     */
    @JsonValue
    public String jsonValue() {
        return name().toLowerCase();
    }
}
