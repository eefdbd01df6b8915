package com.tracegraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of generated code referencing a block.
 *
 * @param line 1-based line number
 * @param code line text
 */
public record CodeReference(
    @JsonProperty("line") int line,
    @JsonProperty("code") String code
) {}
