package com.tracegraph.core.graph;

import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.CanonicalNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link HierarchyInferencer}.
 */
class HierarchyInferencerTest {

    private final HierarchyInferencer inferencer = new HierarchyInferencer();

    private static CanonicalNode node(String id, List<String> incoming, List<String> outgoing) {
        return new CanonicalNode(id, "Name " + id, "Requirement_General", "text", "_" + id,
            incoming, outgoing, Map.of(), "model");
    }

    private static CanonicalGraph graph(CanonicalNode... nodes) {
        Map<String, CanonicalNode> byId = new LinkedHashMap<>();
        for (CanonicalNode node : nodes) {
            byId.put(node.id(), node);
        }
        return new CanonicalGraph("merged", byId, List.of());
    }

    @Test
    void infer_linksEachDottedIdToItsParent() {
        // Given: A, A.1 and A.1.2
        CanonicalGraph input = graph(
            node("A", List.of(), List.of()),
            node("A.1", List.of(), List.of()),
            node("A.1.2", List.of(), List.of()));

        // When: Hierarchy is inferred
        HierarchyInferencer.Result result = inferencer.infer(input);

        // Then: Two links, each mirrored on the parent
        assertThat(result.edgesAdded()).isEqualTo(2);
        CanonicalGraph graph = result.graph();
        assertThat(graph.node("A").incoming()).isEmpty();
        assertThat(graph.node("A").outgoing()).containsExactly("A.1");
        assertThat(graph.node("A.1").incoming()).containsExactly("A");
        assertThat(graph.node("A.1").outgoing()).containsExactly("A.1.2");
        assertThat(graph.node("A.1.2").incoming()).containsExactly("A.1");
    }

    @Test
    void infer_runTwice_addsNothingTheSecondTime() {
        CanonicalGraph input = graph(
            node("A", List.of(), List.of()),
            node("A.1", List.of(), List.of()),
            node("A.1.2", List.of(), List.of()));

        HierarchyInferencer.Result first = inferencer.infer(input);
        HierarchyInferencer.Result second = inferencer.infer(first.graph());

        assertThat(second.edgesAdded()).isZero();
        assertThat(second.graph().nodes()).isEqualTo(first.graph().nodes());
    }

    @Test
    void infer_keepsExistingEdgesAndSkipsMissingParents() {
        CanonicalGraph input = graph(
            node("REQ", List.of(), List.of("X")),
            node("REQ.1", List.of("REQ"), List.of()),
            node("X.9", List.of(), List.of()));

        HierarchyInferencer.Result result = inferencer.infer(input);

        assertThat(result.edgesAdded()).isZero();
        assertThat(result.graph().node("REQ").outgoing()).containsExactly("X", "REQ.1");
        assertThat(result.graph().node("REQ.1").incoming()).containsExactly("REQ");
        assertThat(result.graph().node("X.9").incoming()).isEmpty();
    }

    @Test
    void infer_leavesInputUnchanged() {
        CanonicalGraph input = graph(node("A", List.of(), List.of()), node("A.1", List.of(), List.of()));

        inferencer.infer(input);

        assertThat(input.node("A.1").incoming()).isEmpty();
    }

    @Test
    void parentOf_returnsTextBeforeLastDot() {
        assertThat(HierarchyInferencer.parentOf("TWCAT150.3.1.2")).isEqualTo("TWCAT150.3.1");
        assertThat(HierarchyInferencer.parentOf("TWCAT150")).isNull();
    }
}
