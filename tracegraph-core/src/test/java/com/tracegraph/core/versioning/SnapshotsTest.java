package com.tracegraph.core.versioning;

import com.tracegraph.core.model.CanonicalNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Snapshots}.
 */
class SnapshotsTest {

    @Test
    void snapshotOf_sortsKeysAndOmitsId() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("zeta", "1");
        properties.put("alpha", "2");
        CanonicalNode node = new CanonicalNode("R1", "Speed", "Requirement_General", "Hold.", "_1",
            List.of(), List.of("R2"), properties, "cruise");

        String snapshot = Snapshots.snapshotOf(node);

        assertThat(snapshot).isEqualTo("{\"incoming\":[],\"name\":\"Speed\",\"node_type\":\"Requirement_General\","
            + "\"outgoing\":[\"R2\"],\"properties\":{\"alpha\":\"2\",\"zeta\":\"1\"},\"source_file\":\"cruise\","
            + "\"text\":\"Hold.\",\"xmi_id\":\"_1\"}");
    }

    @Test
    void snapshotOf_isIndependentOfPropertyInsertionOrder() {
        Map<String, Object> forward = new LinkedHashMap<>();
        forward.put("a", "1");
        forward.put("b", "2");
        Map<String, Object> backward = new LinkedHashMap<>();
        backward.put("b", "2");
        backward.put("a", "1");

        CanonicalNode one = new CanonicalNode("X", "n", "t", null, null, List.of(), List.of(), forward, "s");
        CanonicalNode two = new CanonicalNode("X", "n", "t", null, null, List.of(), List.of(), backward, "s");

        assertThat(Snapshots.versionIdOf(Snapshots.snapshotOf(one)))
            .isEqualTo(Snapshots.versionIdOf(Snapshots.snapshotOf(two)));
    }

    @Test
    void versionIdOf_isSha256Hex() {
        assertThat(Snapshots.versionIdOf(""))
            .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }
}
