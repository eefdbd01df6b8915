package com.tracegraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One immutable version record of an artifact.
 *
 * <p>{@code versionId} is the SHA-256 hex digest of {@code snapshot}, the sorted-key JSON
 * serialization of the artifact's canonical node body. Records form a lineage through
 * {@code parentVersionId}; the first record of an artifact has no parent.
 *
 * @param artifactId node id of the artifact
 * @param versionId content hash
 * @param artifactType artifact kind
 * @param tool originating tool
 * @param timestamp ISO-8601 instant the record was created
 * @param parentVersionId previous current version, or null
 * @param snapshot canonical serialization that was hashed
 *
 * @since 1.0.0
 */
public record ArtifactVersion(
    @JsonProperty("artifact_id") String artifactId,
    @JsonProperty("version_id") String versionId,
    @JsonProperty("artifact_type") ArtifactType artifactType,
    @JsonProperty("tool") Tool tool,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("parent_version_id") String parentVersionId,
    @JsonProperty("snapshot") String snapshot
) {
    /**
     * Compact constructor with validation.
     */
    public ArtifactVersion {
        Objects.requireNonNull(artifactId, "artifactId must not be null");
        Objects.requireNonNull(versionId, "versionId must not be null");
        Objects.requireNonNull(artifactType, "artifactType must not be null");
        Objects.requireNonNull(tool, "tool must not be null");
    }

    /**
     * Returns true if this is the first record of its artifact.
     *
     * @return true when there is no parent
     */
    @JsonIgnore
    public boolean isInitial() {
        return parentVersionId == null;
    }
}
