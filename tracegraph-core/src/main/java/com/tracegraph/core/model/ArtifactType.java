package com.tracegraph.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of versioned artifact.
 */
public enum ArtifactType {
    REQUIREMENT("requirement"),
    MODEL("model");

    private final String value;

    ArtifactType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses a stored value.
     *
     * @param value stored value, case-insensitive
     * @return artifact type
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static ArtifactType fromValue(String value) {
        for (ArtifactType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown artifact type: " + value);
    }
}
