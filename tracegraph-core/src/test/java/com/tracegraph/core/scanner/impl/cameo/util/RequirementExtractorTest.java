package com.tracegraph.core.scanner.impl.cameo.util;

import com.tracegraph.core.model.RawElement;
import com.tracegraph.core.model.Requirement;
import com.tracegraph.core.model.StereotypeApplication;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RequirementExtractor}.
 */
class RequirementExtractorTest {

    private final RequirementExtractor extractor = new RequirementExtractor();

    private static RawElement element(String id, String name, Map<String, String> extra) {
        return element(id, name, extra, null);
    }

    private static RawElement element(String id, String name, Map<String, String> extra, String commentBody) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("xmi:id", id);
        attributes.put("xmi:type", "uml:Class");
        if (name != null) {
            attributes.put("name", name);
        }
        attributes.putAll(extra);
        return new RawElement(id, "uml:Class", "packagedElement", attributes, attributes.get("source"), commentBody);
    }

    private static StereotypeApplication requirement(String id, String text) {
        return new StereotypeApplication(StereotypeApplication.REQUIREMENT, id, text, null);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "ab", " x ", "123", "12 34", "Unnamed Requirement"})
    void isValidName_rejectsArtefactNames(String name) {
        assertThat(RequirementExtractor.isValidName(name)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Brake", "R-12", "REQ", "1a2", "Speed Limit"})
    void isValidName_acceptsRealNames(String name) {
        assertThat(RequirementExtractor.isValidName(name)).isTrue();
    }

    @Test
    void isValidName_rejectsNull() {
        assertThat(RequirementExtractor.isValidName(null)).isFalse();
    }

    @Test
    void extract_onlyRequirementStereotypesWithKnownElements() {
        // Given: one requirement, one derive stereotype, one dangling requirement
        Map<String, StereotypeApplication> stereotypes = new LinkedHashMap<>();
        stereotypes.put("_a", requirement("REQ-1", "Text"));
        stereotypes.put("_d", new StereotypeApplication("Derive", null, null, null));
        stereotypes.put("_gone", requirement("REQ-2", null));
        Map<String, RawElement> elements = new LinkedHashMap<>();
        elements.put("_a", element("_a", "Brake Pressure", Map.of()));
        elements.put("_d", element("_d", "link", Map.of()));
        XmiIndex index = new XmiIndex(stereotypes, elements, 10);

        // When: Extraction runs
        RequirementExtractor.Extraction extraction = extractor.extract(index, "brakes");

        // Then: Only the matched requirement is produced
        assertThat(extraction.requirements()).containsOnlyKeys("_a");
        Requirement requirement = extraction.requirements().get("_a");
        assertThat(requirement.reqId()).isEqualTo("REQ-1");
        assertThat(requirement.sourceFile()).isEqualTo("brakes");
        assertThat(requirement.derivesFrom()).isEmpty();
        assertThat(extraction.rejected()).isEmpty();
    }

    @Test
    void resolveText_fallsBackThroughAttributesAndComment() {
        StereotypeApplication bare = requirement(null, null);

        assertThat(RequirementExtractor.resolveText(element("_a", "Brake", Map.of("body", "from body")), bare))
            .isEqualTo("from body");
        assertThat(RequirementExtractor.resolveText(element("_a", "Brake", Map.of(), "from comment"), bare))
            .isEqualTo("from comment");
        assertThat(RequirementExtractor.resolveText(element("_a", "Brake", Map.of("text", ""), "from comment"), bare))
            .isEqualTo("from comment");
        assertThat(RequirementExtractor.resolveText(element("_a", "Brake", Map.of("text", "", "body", "from body")), bare))
            .isEqualTo("from body");
        assertThat(RequirementExtractor.resolveText(element("_a", "Brake", Map.of("specification", "")), bare))
            .isEqualTo(Requirement.NO_TEXT);
        assertThat(RequirementExtractor.resolveText(element("_a", "Brake", Map.of()), bare))
            .isEqualTo(Requirement.NO_TEXT);
        assertThat(RequirementExtractor.resolveText(element("_a", "Brake", Map.of("text", "attr")), requirement(null, "stereo")))
            .isEqualTo("stereo");
    }

    @Test
    void resolveId_fallsBackToNameThenInternalIdSuffix() {
        StereotypeApplication bare = requirement(null, null);

        assertThat(RequirementExtractor.resolveId(element("_a", "Brake", Map.of("identifier", "SYS-4")), bare))
            .isEqualTo("SYS-4");
        assertThat(RequirementExtractor.resolveId(element("_a", "REQ Brake", Map.of()), bare))
            .isEqualTo("REQ Brake");
        assertThat(RequirementExtractor.resolveId(element("_0123456789abc", "Brake", Map.of()), bare))
            .isEqualTo("REQ-56789abc");
        assertThat(RequirementExtractor.resolveId(element("_short", "Brake", Map.of()), bare))
            .isEqualTo("REQ-_short");
    }

    @Test
    void resolveType_usesAttributeThenNameKeywords() {
        assertThat(RequirementExtractor.resolveType(element("_a", "Anything", Map.of("requirementType", "Safety"))))
            .isEqualTo("Safety");
        assertThat(RequirementExtractor.resolveType(element("_a", "Functional Braking", Map.of()))).isEqualTo("Functional");
        assertThat(RequirementExtractor.resolveType(element("_a", "Non-functional Latency", Map.of()))).isEqualTo("Functional");
        assertThat(RequirementExtractor.resolveType(element("_a", "Performance Budget", Map.of()))).isEqualTo("Performance");
        assertThat(RequirementExtractor.resolveType(element("_a", "CAN Interface", Map.of()))).isEqualTo("Interface");
        assertThat(RequirementExtractor.resolveType(element("_a", "Brake", Map.of()))).isEqualTo(RequirementExtractor.GENERAL_TYPE);
    }

    @Test
    void propertiesOf_keepsPlainAttributesOnly() {
        RawElement element = element("_a", "Brake", Map.of("priority", "high", "xmlns:uml", "urn:uml"));

        assertThat(RequirementExtractor.propertiesOf(element)).containsOnly(Map.entry("priority", "high"));
    }

    @Test
    void extract_recordsRejectedNames() {
        XmiIndex index = new XmiIndex(
            Map.of("_a", requirement("REQ-1", null)),
            Map.of("_a", element("_a", "42", Map.of())),
            2);

        RequirementExtractor.Extraction extraction = extractor.extract(index, "m");

        assertThat(extraction.requirements()).isEmpty();
        assertThat(extraction.rejected()).isEqualTo(List.of("42"));
    }
}
