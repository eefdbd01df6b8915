package com.tracegraph.core.versioning;

import com.tracegraph.core.model.ArtifactType;
import com.tracegraph.core.model.ArtifactVersion;
import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.CanonicalNode;
import com.tracegraph.core.model.Tool;
import com.tracegraph.core.model.TrackingResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link VersionTracker}.
 */
class VersionTrackerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:15:30Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final VersionTracker tracker = new VersionTracker(CLOCK);

    private static CanonicalNode requirement(String id, String text) {
        return new CanonicalNode(id, "Name " + id, "Requirement_General", text, "_" + id,
            List.of(), List.of(), Map.of("priority", "high"), "cruise");
    }

    private static CanonicalGraph graph(CanonicalNode... nodes) {
        Map<String, CanonicalNode> byId = new LinkedHashMap<>();
        for (CanonicalNode node : nodes) {
            byId.put(node.id(), node);
        }
        return new CanonicalGraph("cruise.mdzip", byId, List.of());
    }

    @Test
    void track_withEmptyStore_emitsInitialVersions() {
        // When: Two requirements are tracked for the first time
        TrackingResult result = tracker.track(graph(requirement("R1", "a"), requirement("R2", "b")),
            VersionStore.empty(), ArtifactType.REQUIREMENT, Tool.CAMEO);

        // Then: Both get a parentless record
        assertThat(result.emitted()).hasSize(2);
        assertThat(result.newCount()).isEqualTo(2);
        ArtifactVersion first = result.emitted().get(0);
        assertThat(first.artifactId()).isEqualTo("R1");
        assertThat(first.parentVersionId()).isNull();
        assertThat(first.artifactType()).isEqualTo(ArtifactType.REQUIREMENT);
        assertThat(first.tool()).isEqualTo(Tool.CAMEO);
        assertThat(first.timestamp()).isEqualTo("2024-03-01T10:15:30Z");
        assertThat(first.versionId()).isEqualTo(Snapshots.versionIdOf(first.snapshot()));
        assertThat(result.current()).containsOnlyKeys("R1", "R2");
    }

    @Test
    void track_withOneChangedNode_emitsExactlyOneChildVersion() {
        // Given: A store holding R1 and R2
        TrackingResult initial = tracker.track(graph(requirement("R1", "a"), requirement("R2", "b")),
            VersionStore.empty(), ArtifactType.REQUIREMENT, Tool.CAMEO);
        VersionStore store = VersionStore.of(initial.current());

        // When: Only R2 changes its text
        TrackingResult result = tracker.track(graph(requirement("R1", "a"), requirement("R2", "b2")),
            store, ArtifactType.REQUIREMENT, Tool.CAMEO);

        // Then: One record parented on the prior R2 version
        assertThat(result.emitted()).hasSize(1);
        ArtifactVersion changed = result.emitted().get(0);
        assertThat(changed.artifactId()).isEqualTo("R2");
        assertThat(changed.parentVersionId()).isEqualTo(store.get("R2").versionId());
        assertThat(changed.versionId()).isNotEqualTo(store.get("R2").versionId());
        assertThat(result.unchanged()).isEqualTo(1);
        assertThat(result.changedCount()).isEqualTo(1);
        assertThat(result.current().get("R2")).isEqualTo(changed);
    }

    @Test
    void track_resubmittingSameGraph_emitsNothing() {
        CanonicalGraph graph = graph(requirement("R1", "a"));
        TrackingResult initial = tracker.track(graph, VersionStore.empty(), ArtifactType.REQUIREMENT, Tool.CAMEO);

        TrackingResult again = tracker.track(graph, VersionStore.of(initial.current()), ArtifactType.REQUIREMENT, Tool.CAMEO);

        assertThat(again.emitted()).isEmpty();
        assertThat(again.unchanged()).isEqualTo(1);
    }

    @Test
    void track_revertedNode_getsFreshRecordParentedOnCurrentVersion() {
        TrackingResult v1 = tracker.track(graph(requirement("R1", "a")), VersionStore.empty(),
            ArtifactType.REQUIREMENT, Tool.CAMEO);
        TrackingResult v2 = tracker.track(graph(requirement("R1", "b")), VersionStore.of(v1.current()),
            ArtifactType.REQUIREMENT, Tool.CAMEO);

        TrackingResult v3 = tracker.track(graph(requirement("R1", "a")), VersionStore.of(v2.current()),
            ArtifactType.REQUIREMENT, Tool.CAMEO);

        ArtifactVersion reverted = v3.emitted().get(0);
        assertThat(reverted.versionId()).isEqualTo(v1.emitted().get(0).versionId());
        assertThat(reverted.parentVersionId()).isEqualTo(v2.emitted().get(0).versionId());
    }

    @Test
    void track_keepsArtifactsAbsentFromGraph() {
        TrackingResult initial = tracker.track(graph(requirement("R1", "a"), requirement("R2", "b")),
            VersionStore.empty(), ArtifactType.REQUIREMENT, Tool.CAMEO);

        TrackingResult result = tracker.track(graph(requirement("R1", "a")), VersionStore.of(initial.current()),
            ArtifactType.REQUIREMENT, Tool.CAMEO);

        assertThat(result.current()).containsOnlyKeys("R1", "R2");
    }

    @Test
    void trackAndPersist_secondRunEmitsNothingAndAppendsHistoryOnce() throws Exception {
        // Given: A store file that does not exist yet
        Path storeFile = tempDir.resolve("versions/cameo_versions.json");
        CanonicalGraph graph = graph(requirement("R1", "a"), requirement("R2", "b"));

        // When: The same graph is tracked twice
        TrackingResult first = tracker.trackAndPersist(graph, storeFile, ArtifactType.REQUIREMENT, Tool.CAMEO, true);
        TrackingResult second = tracker.trackAndPersist(graph, storeFile, ArtifactType.REQUIREMENT, Tool.CAMEO, true);

        // Then: Only the first run writes records
        assertThat(first.emitted()).hasSize(2);
        assertThat(second.emitted()).isEmpty();
        assertThat(VersionStore.load(storeFile).size()).isEqualTo(2);
        assertThat(HistoryLog.forStore(storeFile).readAll()).hasSize(2);
    }

    @Test
    void trackAndPersist_withCorruptStore_flagsDegradedAndRewrites() throws Exception {
        Path storeFile = tempDir.resolve("cameo_versions.json");
        Files.writeString(storeFile, "{ this is not json");

        TrackingResult result = tracker.trackAndPersist(graph(requirement("R1", "a")), storeFile,
            ArtifactType.REQUIREMENT, Tool.CAMEO, false);

        assertThat(result.degradedStore()).isTrue();
        assertThat(result.newCount()).isEqualTo(1);
        VersionStore reloaded = VersionStore.load(storeFile);
        assertThat(reloaded.isDegraded()).isFalse();
        assertThat(reloaded.get("R1")).isEqualTo(result.current().get("R1"));
        assertThat(HistoryLog.forStore(storeFile).file()).doesNotExist();
    }
}
