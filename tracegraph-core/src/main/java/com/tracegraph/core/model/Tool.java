package com.tracegraph.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Authoring tool an artifact originates from.
 */
public enum Tool {
    CAMEO("cameo"),
    SIMULINK("simulink");

    private final String value;

    Tool(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static Tool fromValue(String value) {
        for (Tool tool : values()) {
            if (tool.value.equalsIgnoreCase(value)) {
                return tool;
            }
        }
        throw new IllegalArgumentException("Unknown tool: " + value);
    }
}
