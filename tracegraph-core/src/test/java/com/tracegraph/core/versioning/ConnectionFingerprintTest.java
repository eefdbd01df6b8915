package com.tracegraph.core.versioning;

import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.CanonicalNode;
import com.tracegraph.core.model.ConnectionSnapshot;
import com.tracegraph.core.util.Hashing;
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
 * Tests for {@link ConnectionFingerprint}.
 */
class ConnectionFingerprintTest {

    @TempDir
    Path tempDir;

    private final ConnectionFingerprint fingerprint =
        new ConnectionFingerprint(Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC));

    private static CanonicalGraph blocks(Map<String, List<String>> outgoing) {
        Map<String, CanonicalNode> nodes = new LinkedHashMap<>();
        outgoing.forEach((id, targets) -> nodes.put(id,
            new CanonicalNode(id, "B" + id, "Gain", null, null, List.of(), targets, Map.of(), "Plant")));
        return new CanonicalGraph("Plant", nodes, List.of());
    }

    @Test
    void connectionPairs_areSortedAndKeepDuplicates() {
        Map<String, List<String>> outgoing = new LinkedHashMap<>();
        outgoing.put("2", List.of("3"));
        outgoing.put("1", List.of("3", "2", "3"));

        assertThat(ConnectionFingerprint.connectionPairs(blocks(outgoing)))
            .containsExactly("1->2", "1->3", "1->3", "2->3");
    }

    @Test
    void fingerprint_hashesNewlineJoinedPairs() {
        ConnectionSnapshot snapshot = fingerprint.fingerprint("Plant", blocks(Map.of("1", List.of("2"), "2", List.of("3"))));

        assertThat(snapshot.versionId()).isEqualTo(Hashing.sha256Hex("1->2\n2->3"));
        assertThat(snapshot.connectionCount()).isEqualTo(2);
        assertThat(snapshot.timestamp()).isEqualTo("2024-03-01T00:00:00Z");
    }

    @Test
    void update_rewritesOnlyWhenConnectionsChange() throws Exception {
        // Given: A first snapshot of the model
        CanonicalGraph graph = blocks(Map.of("1", List.of("2")));
        ConnectionSnapshot first = fingerprint.update(tempDir, "Plant", graph);
        Path file = ConnectionFingerprint.snapshotFile(tempDir, "Plant");
        assertThat(file).isEqualTo(tempDir.resolve("simulink/Plant_connections.json"));

        // When: The same connections are seen with a later clock, then a changed set
        ConnectionFingerprint later = new ConnectionFingerprint(Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));
        ConnectionSnapshot same = later.update(tempDir, "Plant", graph);
        ConnectionSnapshot changed = later.update(tempDir, "Plant", blocks(Map.of("1", List.of("2", "2"))));

        // Then: The unchanged run returns the stored snapshot
        assertThat(same).isEqualTo(first);
        assertThat(changed.versionId()).isNotEqualTo(first.versionId());
        assertThat(Files.readString(file)).contains(changed.versionId());
    }

    @Test
    void update_withCorruptSnapshot_recordsNewOne() throws Exception {
        Path file = ConnectionFingerprint.snapshotFile(tempDir, "Plant");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "garbage");

        ConnectionSnapshot snapshot = fingerprint.update(tempDir, "Plant", blocks(Map.of("1", List.of("2"))));

        assertThat(snapshot.connectionCount()).isEqualTo(1);
        assertThat(Files.readString(file)).contains(snapshot.versionId());
    }
}
