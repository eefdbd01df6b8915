package com.tracegraph.core.scanner.impl.cameo.util;

import com.tracegraph.core.model.RawElement;
import com.tracegraph.core.model.RelationshipKind;
import com.tracegraph.core.model.Requirement;
import com.tracegraph.core.model.StereotypeApplication;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RelationshipResolver}.
 */
class RelationshipResolverTest {

    private final RelationshipResolver resolver = new RelationshipResolver();

    private static Requirement requirement(String xmiId, String reqId) {
        return new Requirement(reqId, xmiId, "Requirement " + reqId, Requirement.NO_TEXT, "General",
            Map.of(), List.of(), List.of(), List.of(), List.of(), List.of(), "model");
    }

    private static RawElement relationship(String id, String type, String name, String client, String supplier) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("xmi:id", id);
        if (name != null) {
            attributes.put("name", name);
        }
        if (client != null) {
            attributes.put("client", client);
        }
        if (supplier != null) {
            attributes.put("supplier", supplier);
        }
        return new RawElement(id, type, "packagedElement", attributes, null, null);
    }

    private static Map<String, Requirement> requirements() {
        Map<String, Requirement> requirements = new LinkedHashMap<>();
        requirements.put("_a", requirement("_a", "REQ-A"));
        requirements.put("_b", requirement("_b", "REQ-B"));
        requirements.put("_c", requirement("_c", "REQ-C"));
        return requirements;
    }

    @Test
    void resolve_withSatisfyStereotype_attachesSatisfiesEdge() {
        // Given: A Realization stereotyped Satisfy from _a to _b
        XmiIndex index = new XmiIndex(
            Map.of("_r", new StereotypeApplication("Satisfy", null, null, null)),
            Map.of("_r", relationship("_r", "uml:Realization", null, "_a", "_b")),
            1);

        // When: Relationships are resolved
        RelationshipResolver.Resolution resolution = resolver.resolve(index, requirements());

        // Then: _a satisfies _b and nothing else changes
        assertThat(resolution.requirements().get("_a").satisfies()).containsExactly("_b");
        assertThat(resolution.requirements().get("_b").satisfies()).isEmpty();
        assertThat(resolution.edges()).isEqualTo(1);
        assertThat(resolution.misses()).isZero();
    }

    @Test
    void resolve_withUnstereotypedDependency_defaultsToTrace() {
        XmiIndex index = new XmiIndex(
            Map.of(),
            Map.of("_r", relationship("_r", "uml:Dependency", "link", "_a", "_c")),
            1);

        RelationshipResolver.Resolution resolution = resolver.resolve(index, requirements());

        assertThat(resolution.requirements().get("_a").tracesTo()).containsExactly("_c");
    }

    @Test
    void resolve_withNonRequirementClient_addsNoEdge() {
        XmiIndex index = new XmiIndex(
            Map.of(),
            Map.of("_r", relationship("_r", "uml:Dependency", null, "_block", "_a")),
            1);

        RelationshipResolver.Resolution resolution = resolver.resolve(index, requirements());

        assertThat(resolution.edges()).isZero();
        assertThat(resolution.misses()).isZero();
        assertThat(resolution.requirements().values())
            .allSatisfy(requirement -> assertThat(requirement.tracesTo()).isEmpty());
    }

    @Test
    void resolve_dropsUnknownSuppliersAndDeduplicates() {
        // Given: Two verify relationships naming _b twice and one unknown supplier
        Map<String, RawElement> elements = new LinkedHashMap<>();
        elements.put("_r1", relationship("_r1", "uml:Abstraction", "verify link", "_a", "_b _ghost"));
        elements.put("_r2", relationship("_r2", "uml:Abstraction", "verify again", "_a", "_b"));
        XmiIndex index = new XmiIndex(Map.of(), elements, 2);

        // When: Relationships are resolved
        RelationshipResolver.Resolution resolution = resolver.resolve(index, requirements());

        // Then: One verify edge survives and the unknown reference is counted
        assertThat(resolution.requirements().get("_a").verifies()).containsExactly("_b");
        assertThat(resolution.edges()).isEqualTo(1);
        assertThat(resolution.misses()).isEqualTo(1);
    }

    @Test
    void resolve_ignoresElementsWithoutBothEnds() {
        XmiIndex index = new XmiIndex(
            Map.of(),
            Map.of("_r", relationship("_r", "uml:Dependency", null, "_a", null)),
            1);

        RelationshipResolver.Resolution resolution = resolver.resolve(index, requirements());

        assertThat(resolution.edges()).isZero();
    }

    @Test
    void classify_prefersStereotypeOverName() {
        RawElement element = relationship("_r", "uml:Abstraction", "refines", "_a", "_b");

        assertThat(RelationshipResolver.classify(element, new StereotypeApplication("DeriveReqt", null, null, null)))
            .isEqualTo(RelationshipKind.DERIVES);
        assertThat(RelationshipResolver.classify(element, null)).isEqualTo(RelationshipKind.REFINES);
        assertThat(RelationshipResolver.classify(relationship("_r", "uml:Dependency", "uses", "_a", "_b"), null))
            .isEqualTo(RelationshipKind.TRACES);
    }
}
