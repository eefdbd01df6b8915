package com.tracegraph.core.versioning;

import com.tracegraph.core.model.ArtifactType;
import com.tracegraph.core.model.ArtifactVersion;
import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.CanonicalNode;
import com.tracegraph.core.model.Tool;
import com.tracegraph.core.model.TrackingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Detects content changes of graph nodes across runs and emits version records.
 *
 * <p>For every node of a graph the tracker hashes the canonical snapshot and compares it with
 * the current version in the store:
 * <ul>
 *   <li>no current version: a new record without parent</li>
 *   <li>different hash: a new record whose parent is the current version</li>
 *   <li>equal hash: nothing is emitted</li>
 * </ul>
 * Artifacts in the store that are absent from the graph keep their current version.
 *
 * <p>A reverted artifact gets a fresh record parented on the version it reverts from, even
 * though its version id equals an older ancestor.
 *
 * @since 1.0.0
 */
public class VersionTracker {

    private static final Logger log = LoggerFactory.getLogger(VersionTracker.class);

    private final Clock clock;

    public VersionTracker() {
        this(Clock.systemUTC());
    }

    public VersionTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Tracks a graph against an in-memory store.
     *
     * @param graph graph to track
     * @param store prior versions
     * @param artifactType type recorded on new versions
     * @param tool tool recorded on new versions
     * @return emitted records and the updated current versions
     */
    public TrackingResult track(CanonicalGraph graph, VersionStore store, ArtifactType artifactType, Tool tool) {
        String timestamp = Instant.now(clock).toString();
        Map<String, ArtifactVersion> current = new LinkedHashMap<>(store.versions());
        List<ArtifactVersion> emitted = new ArrayList<>();
        int unchanged = 0;

        for (CanonicalNode node : graph.nodes().values()) {
            String snapshot = Snapshots.snapshotOf(node);
            String versionId = Snapshots.versionIdOf(snapshot);
            ArtifactVersion prior = current.get(node.id());

            if (prior != null && prior.versionId().equals(versionId)) {
                unchanged++;
                continue;
            }

            String parent = prior == null ? null : prior.versionId();
            ArtifactVersion record = new ArtifactVersion(
                node.id(), versionId, artifactType, tool, timestamp, parent, snapshot);
            emitted.add(record);
            current.put(node.id(), record);
            log.debug("{} {} -> {}", prior == null ? "New artifact" : "Changed artifact", node.id(), versionId);
        }

        TrackingResult result = new TrackingResult(emitted, current, unchanged, store.isDegraded());
        log.info("Tracked {} artifacts from {}: {} new, {} changed, {} unchanged",
            graph.size(), graph.source(), result.newCount(), result.changedCount(), unchanged);
        return result;
    }

    /**
     * Tracks a graph against a store file, then rewrites the store and appends the emitted
     * records to its history log.
     *
     * @param graph graph to track
     * @param storeFile version store file
     * @param artifactType type recorded on new versions
     * @param tool tool recorded on new versions
     * @param history whether to append to the history log
     * @return tracking result
     * @throws IOException if the store or the history log cannot be written
     */
    public TrackingResult trackAndPersist(CanonicalGraph graph, Path storeFile, ArtifactType artifactType,
                                          Tool tool, boolean history) throws IOException {
        VersionStore store = VersionStore.load(storeFile);
        TrackingResult result = track(graph, store, artifactType, tool);
        if (!result.emitted().isEmpty() || store.isDegraded() || store.size() != result.current().size()) {
            VersionStore.of(result.current()).save(storeFile);
        }
        if (history) {
            HistoryLog.forStore(storeFile).append(result.emitted());
        }
        return result;
    }
}
