package com.tracegraph.core.scanner.impl.simulink;

import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.CanonicalNode;
import com.tracegraph.core.scanner.Fixtures;
import com.tracegraph.core.scanner.ScanResult;
import com.tracegraph.core.scanner.ScannerTestBase;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link SimulinkBlockScanner}.
 */
class SimulinkBlockScannerTest extends ScannerTestBase {

    private final SimulinkBlockScanner scanner = new SimulinkBlockScanner();

    @Test
    void scan_withModelTree_buildsBlockGraph() throws Exception {
        // Given: An unpacked model "Plant"
        Path tree = createModelTree("Plant", Fixtures.BLOCK_DIAGRAM, Map.of("system_root", Fixtures.SYSTEM_ROOT));

        // When: The tree is scanned
        ScanResult result = scanner.scan(tree, context);

        // Then: Blocks become nodes named after the model directory
        assertThat(result.success()).isTrue();
        CanonicalGraph graph = result.graph();
        assertThat(graph.source()).isEqualTo("Plant");
        assertThat(graph.nodes()).containsOnlyKeys("10", "20", "30");

        CanonicalNode gain = graph.node("10");
        assertThat(gain.nodeType()).isEqualTo("Gain");
        assertThat(gain.outgoing()).containsExactly("20", "30");
        assertThat(gain.incoming()).isEmpty();
        assertThat(gain.properties())
            .containsEntry("Gain", "2.5")
            .containsEntry("parent_system", "system_root")
            .containsEntry("model_name", "Plant")
            .containsEntry("position", List.of(100, 50, 130, 80));
        assertThat(graph.node("20").incoming()).containsExactly("10");

        assertThat(result.diagram().connections()).hasSize(2);
        assertThat(result.statistics().entitiesExtracted()).isEqualTo(3);
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void scan_withSlxContainer_readsPackagedDescriptors() throws Exception {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("[Content_Types].xml", "<Types/>");
        entries.put("simulink/blockdiagram.xml", Fixtures.BLOCK_DIAGRAM);
        entries.put("simulink/systems/system_root.xml", Fixtures.SYSTEM_ROOT);
        Path container = createZip("models/Plant.slx", entries);

        ScanResult result = scanner.scan(container, context);

        assertThat(result.success()).isTrue();
        assertThat(result.graph().source()).isEqualTo("Plant");
        assertThat(result.graph().size()).isEqualTo(3);
        assertThat(result.diagram().modelProperties()).containsEntry("SolverType", "Fixed-step");
    }

    @Test
    void scan_withoutSystems_warns() throws Exception {
        Path tree = createModelTree("Empty", Fixtures.BLOCK_DIAGRAM, Map.of());

        ScanResult result = scanner.scan(tree, context);

        assertThat(result.success()).isTrue();
        assertThat(result.graph().size()).isZero();
        assertThat(result.warnings()).hasSize(1);
        assertThat(result.warnings().get(0)).contains("no system descriptors");
    }

    @Test
    void scan_withMalformedSystem_fails() throws Exception {
        Path tree = createModelTree("Broken", Fixtures.BLOCK_DIAGRAM, Map.of("system_root", "<System><Block"));

        ScanResult result = scanner.scan(tree, context);

        assertThat(result.success()).isFalse();
        assertThat(result.firstError()).contains("malformed XML");
    }

    @Test
    void scan_withCorruptContainer_fails() throws Exception {
        Path container = createFile("Bad.slx", "not a zip");

        ScanResult result = scanner.scan(container, context);

        assertThat(result.success()).isFalse();
        assertThat(result.firstError()).contains("Bad.slx");
    }

    @Test
    void discoverInputs_findsTreesAndContainers() throws Exception {
        Path tree = createModelTree("Plant", Fixtures.BLOCK_DIAGRAM, Map.of("system_root", Fixtures.SYSTEM_ROOT));
        Path container = createZip("nested/Ctrl.slx", Map.of("simulink/blockdiagram.xml", Fixtures.BLOCK_DIAGRAM));
        createFile("notes.txt", "ignore me");

        List<Path> inputs = scanner.discoverInputs(context);

        assertThat(inputs).containsExactlyInAnyOrder(tree, container);
        assertThat(scanner.appliesTo(context)).isTrue();
    }

    @Test
    void appliesTo_withoutModels_returnsFalse() throws Exception {
        createFile("readme.md", "# nothing");

        assertThat(scanner.appliesTo(context)).isFalse();
    }
}
