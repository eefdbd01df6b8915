package com.tracegraph.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of tracking one graph against a version store.
 *
 * @param emitted new version records, in node order
 * @param current current version per artifact after tracking, including carried-forward artifacts
 * @param unchanged number of artifacts whose hash matched the current version
 * @param degradedStore true if the prior store could not be read and was treated as empty
 */
public record TrackingResult(
    List<ArtifactVersion> emitted,
    Map<String, ArtifactVersion> current,
    int unchanged,
    boolean degradedStore
) {
    /**
     * Compact constructor with validation.
     */
    public TrackingResult {
        emitted = emitted == null ? List.of() : List.copyOf(emitted);
        Objects.requireNonNull(current, "current must not be null");
        current = Collections.unmodifiableMap(new LinkedHashMap<>(current));
    }

    /**
     * Number of records for artifacts seen for the first time.
     *
     * @return count of initial records
     */
    public long newCount() {
        return emitted.stream().filter(ArtifactVersion::isInitial).count();
    }

    /**
     * Number of records for artifacts whose content changed.
     *
     * @return count of child records
     */
    public long changedCount() {
        return emitted.size() - newCount();
    }
}
