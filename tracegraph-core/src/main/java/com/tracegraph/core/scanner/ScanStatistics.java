package com.tracegraph.core.scanner;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics collected while scanning one input.
 *
 * <p>Provides transparency into what was skipped and what could not be resolved.
 * Resolution misses (references to elements that are not part of the extracted set)
 * are expected in real models and never fail a scan.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ScanStatistics.Builder stats = new ScanStatistics.Builder();
 * stats.elementsVisited(812);
 * stats.entitiesExtracted(37);
 * stats.addSkip("invalid name", "Requirement '42' skipped");
 * stats.addResolutionMisses(3);
 * ScanStatistics result = stats.build();
 * }</pre>
 *
 * @param elementsVisited model elements or lines visited
 * @param entitiesExtracted requirements, blocks or mappings extracted
 * @param entitiesSkipped candidates rejected (invalid name, missing id, unparseable endpoint)
 * @param edgesCollected relationships or connections kept
 * @param resolutionMisses references dropped because their target was not extracted
 * @param skipReasons skip reasons with their occurrence counts
 * @param topIssues most significant skip details (max 10)
 *
 * @since 1.0.0
 */
public record ScanStatistics(
    int elementsVisited,
    int entitiesExtracted,
    int entitiesSkipped,
    int edgesCollected,
    int resolutionMisses,
    Map<String, Integer> skipReasons,
    List<String> topIssues
) {
    /** Maximum number of retained issue details. */
    public static final int MAX_TOP_ISSUES = 10;

    /**
     * Compact constructor with validation and defaults.
     */
    public ScanStatistics {
        if (elementsVisited < 0) {
            elementsVisited = 0;
        }
        if (entitiesExtracted < 0) {
            entitiesExtracted = 0;
        }
        if (entitiesSkipped < 0) {
            entitiesSkipped = 0;
        }
        if (edgesCollected < 0) {
            edgesCollected = 0;
        }
        if (resolutionMisses < 0) {
            resolutionMisses = 0;
        }
        if (skipReasons == null) {
            skipReasons = Map.of();
        }
        if (topIssues == null) {
            topIssues = List.of();
        }
    }

    /**
     * Creates an empty statistics instance.
     *
     * @return empty statistics
     */
    public static ScanStatistics empty() {
        return new ScanStatistics(0, 0, 0, 0, 0, Map.of(), List.of());
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(
            "Visited: %d, Extracted: %d, Skipped: %d, Edges: %d, Unresolved: %d",
            elementsVisited,
            entitiesExtracted,
            entitiesSkipped,
            edgesCollected,
            resolutionMisses
        );
    }

    /**
     * Builder for constructing ScanStatistics incrementally.
     */
    public static class Builder {
        private int elementsVisited = 0;
        private int entitiesExtracted = 0;
        private int entitiesSkipped = 0;
        private int edgesCollected = 0;
        private int resolutionMisses = 0;
        private final Map<String, Integer> skipReasons = new HashMap<>();
        private final List<String> topIssues = new ArrayList<>();

        public Builder elementsVisited(int count) {
            this.elementsVisited = count;
            return this;
        }

        public Builder incrementElementsVisited() {
            this.elementsVisited++;
            return this;
        }

        public Builder entitiesExtracted(int count) {
            this.entitiesExtracted = count;
            return this;
        }

        public Builder incrementEdgesCollected() {
            this.edgesCollected++;
            return this;
        }

        public Builder edgesCollected(int count) {
            this.edgesCollected = count;
            return this;
        }

        public Builder addResolutionMisses(int count) {
            this.resolutionMisses += count;
            return this;
        }

        public Builder addSkip(String reason, String detail) {
            this.entitiesSkipped++;
            skipReasons.merge(reason, 1, Integer::sum);
            if (topIssues.size() < MAX_TOP_ISSUES) {
                topIssues.add(detail);
            }
            return this;
        }

        public ScanStatistics build() {
            return new ScanStatistics(
                elementsVisited,
                entitiesExtracted,
                entitiesSkipped,
                edgesCollected,
                resolutionMisses,
                Map.copyOf(skipReasons),
                List.copyOf(topIssues)
            );
        }
    }
}
