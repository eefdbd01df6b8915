package com.tracegraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Quality report over one canonical graph.
 *
 * <p>Statistics keys: {@code total}, {@code with_text}, {@code with_relationships},
 * {@code by_type} and {@code by_source}.
 *
 * @param sourceFile graph that was validated
 * @param statistics aggregate counts
 * @param issues findings in node order
 */
public record ValidationReport(
    @JsonProperty("source_file") String sourceFile,
    @JsonProperty("statistics") Map<String, Object> statistics,
    @JsonProperty("issues") List<ValidationIssue> issues
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationReport {
        Objects.requireNonNull(sourceFile, "sourceFile must not be null");
        statistics = statistics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * Counts issues of one severity.
     *
     * @param severity severity to count
     * @return number of issues
     */
    public long count(GapSeverity severity) {
        return issues.stream().filter(issue -> issue.severity() == severity).count();
    }

    /**
     * Returns true if any issue has ERROR severity.
     *
     * @return true when errors were found
     */
    @JsonIgnore
    public boolean hasErrors() {
        return count(GapSeverity.ERROR) > 0;
    }
}
