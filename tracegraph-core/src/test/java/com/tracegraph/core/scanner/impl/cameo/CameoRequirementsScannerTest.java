package com.tracegraph.core.scanner.impl.cameo;

import com.tracegraph.core.model.CanonicalNode;
import com.tracegraph.core.model.Requirement;
import com.tracegraph.core.scanner.Fixtures;
import com.tracegraph.core.scanner.ScanResult;
import com.tracegraph.core.scanner.ScannerTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link CameoRequirementsScanner}.
 */
class CameoRequirementsScannerTest extends ScannerTestBase {

    private CameoRequirementsScanner scanner;

    @BeforeEach
    void setUpScanner() {
        scanner = new CameoRequirementsScanner();
    }

    @Test
    void scan_withRequirementsArchive_buildsGraphKeyedByBusinessId() throws IOException {
        // Given: Archive with two valid requirements and one rejected name
        Path archive = createMdzip("models/cruise.mdzip", Fixtures.REQUIREMENTS_XMI);

        // When: Scanner is executed
        ScanResult result = scanner.scan(archive, context);

        // Then: Requirements are keyed by their business id
        assertThat(result.success()).isTrue();
        assertThat(result.graph().nodes()).containsOnlyKeys("REQ-1", "REQ-1.1");
        assertThat(result.graph().source()).isEqualTo("cruise.mdzip");

        CanonicalNode parent = result.graph().node("REQ-1");
        assertThat(parent.name()).isEqualTo("Vehicle Speed Control");
        assertThat(parent.nodeType()).isEqualTo("Requirement_General");
        assertThat(parent.text()).isEqualTo("Maintain speed within 1 km/h.");
        assertThat(parent.xmiId()).isEqualTo("_c1");
        assertThat(parent.sourceFile()).isEqualTo("cruise");
    }

    @Test
    void scan_withDeriveAndRefine_projectsReferencesToBusinessIds() throws IOException {
        // Given: REQ-1.1 derives from and refines REQ-1
        Path archive = createMdzip("cruise.mdzip", Fixtures.REQUIREMENTS_XMI);

        // When: Scanner is executed
        ScanResult result = scanner.scan(archive, context);

        // Then: Derivation is incoming, refinement outgoing, unknown supplier dropped
        CanonicalNode child = result.graph().node("REQ-1.1");
        assertThat(child.incoming()).containsExactly("REQ-1");
        assertThat(child.outgoing()).containsExactly("REQ-1");
        assertThat(child.text()).isEqualTo(Requirement.NO_TEXT);
        assertThat(result.graph().node("REQ-1").hasRelationships()).isFalse();

        assertThat(result.statistics().edgesCollected()).isEqualTo(2);
        assertThat(result.statistics().resolutionMisses()).isEqualTo(1);
    }

    @Test
    void scan_withInvalidName_countsSkip() throws IOException {
        Path archive = createMdzip("cruise.mdzip", Fixtures.REQUIREMENTS_XMI);

        ScanResult result = scanner.scan(archive, context);

        assertThat(result.statistics().entitiesSkipped()).isEqualTo(1);
        assertThat(result.statistics().skipReasons()).containsEntry("invalid name", 1);
        assertThat(result.graph().nodes()).doesNotContainKey("REQ-9");
    }

    @Test
    void scan_withMissingPayloadEntry_failsInput() throws IOException {
        // Given: Zip without the model entry
        Path archive = createZip("broken.mdzip", Map.of("other.txt", "x"));

        // When: Scanner is executed
        ScanResult result = scanner.scan(archive, context);

        // Then: Input fails with a reason, no exception escapes
        assertThat(result.success()).isFalse();
        assertThat(result.firstError()).contains("broken.mdzip");
        assertThat(result.graph()).isNull();
    }

    @Test
    void scan_withMalformedXmi_failsInput() throws IOException {
        Path archive = createMdzip("bad.mdzip", "<xmi:XMI><unclosed>");

        ScanResult result = scanner.scan(archive, context);

        assertThat(result.success()).isFalse();
        assertThat(result.firstError()).contains("malformed XML");
    }

    @Test
    void scan_withCorruptArchive_failsInput() throws IOException {
        Path archive = createFile("corrupt.mdzip", "this is not a zip file");

        ScanResult result = scanner.scan(archive, context);

        assertThat(result.success()).isFalse();
    }

    @Test
    void scan_withoutRequirements_succeedsWithWarning() throws IOException {
        Path archive = createMdzip("design.mdzip", """
            <?xml version="1.0" encoding="UTF-8"?>
            <xmi:XMI xmlns:xmi="http://www.omg.org/spec/XMI/20131001" xmlns:uml="http://www.omg.org/spec/UML/20131001">
              <uml:Model xmi:type="uml:Model" xmi:id="m" name="Design">
                <packagedElement xmi:type="uml:Class" xmi:id="_x" name="Controller"/>
              </uml:Model>
            </xmi:XMI>
            """);

        ScanResult result = scanner.scan(archive, context);

        assertThat(result.success()).isTrue();
        assertThat(result.graph().size()).isZero();
        assertThat(result.warnings()).hasSize(1);
    }

    @Test
    void discoverInputs_findsArchivesAtAnyDepth() throws IOException {
        createMdzip("top.mdzip", Fixtures.REQUIREMENTS_XMI);
        createMdzip("nested/deeper/inner.mdzip", Fixtures.REQUIREMENTS_XMI);
        createFile("notes.txt", "ignored");

        assertThat(scanner.discoverInputs(context))
            .extracting(p -> p.getFileName().toString())
            .containsExactlyInAnyOrder("top.mdzip", "inner.mdzip");
        assertThat(scanner.appliesTo(context)).isTrue();
    }
}
