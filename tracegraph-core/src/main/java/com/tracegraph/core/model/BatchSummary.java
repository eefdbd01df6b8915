package com.tracegraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Aggregate outcome of one batch run.
 *
 * @param totalFiles number of inputs processed
 * @param successful inputs processed without error
 * @param failed inputs that failed
 * @param totalEntities nodes and mappings extracted across all inputs
 * @param files per-input outcomes in discovery order
 * @param collisions node ids written more than once while merging
 * @param issues quality gaps found during the run
 */
public record BatchSummary(
    @JsonProperty("total_files") int totalFiles,
    @JsonProperty("successful") int successful,
    @JsonProperty("failed") int failed,
    @JsonProperty("total_entities") int totalEntities,
    @JsonProperty("files") List<FileOutcome> files,
    @JsonProperty("collisions") List<NodeCollision> collisions,
    @JsonProperty("issues") List<QualityGap> issues
) {
    /**
     * Compact constructor with defaults.
     */
    public BatchSummary {
        files = files == null ? List.of() : List.copyOf(files);
        collisions = collisions == null ? List.of() : List.copyOf(collisions);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * Builds a summary from per-file outcomes.
     *
     * @param files outcomes
     * @param collisions merge collisions
     * @param issues quality gaps
     * @return summary
     */
    public static BatchSummary of(List<FileOutcome> files, List<NodeCollision> collisions, List<QualityGap> issues) {
        int ok = (int) files.stream().filter(FileOutcome::succeeded).count();
        int entities = files.stream().mapToInt(FileOutcome::entities).sum();
        return new BatchSummary(files.size(), ok, files.size() - ok, entities, files, collisions, issues);
    }
}
