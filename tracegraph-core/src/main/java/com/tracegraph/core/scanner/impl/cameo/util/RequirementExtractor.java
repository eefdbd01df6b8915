package com.tracegraph.core.scanner.impl.cameo.util;

import com.tracegraph.core.model.RawElement;
import com.tracegraph.core.model.Requirement;
import com.tracegraph.core.model.StereotypeApplication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns stereotyped model elements into {@link Requirement} records.
 *
 * <p>An element becomes a requirement when it is present in both indices, its stereotype
 * is Requirement, and its name passes {@link #isValidName(String)}. Relationship lists are
 * left empty; {@link RelationshipResolver} fills them.
 *
 * <p>Field resolution order:
 * <ul>
 *   <li>text: stereotype text, then the {@code text}, {@code body}, {@code specification},
 *       {@code Text} attributes, then the first nested comment, then "No text specified"</li>
 *   <li>id: stereotype id, then the {@code id}, {@code Id}, {@code identifier}, {@code ID}
 *       attributes, then the name when it contains "REQ" or "R-", then "REQ-" followed by the
 *       last eight characters of the internal id</li>
 *   <li>type: {@code type} or {@code requirementType} attribute, then name keywords, then "General"</li>
 *   <li>source file: element source, then stereotype source, then the archive stem</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class RequirementExtractor {

    private static final Logger log = LoggerFactory.getLogger(RequirementExtractor.class);

    /** Type used when no type can be determined. */
    public static final String GENERAL_TYPE = "General";

    private static final String UNNAMED = "Unnamed Requirement";
    private static final Set<String> LONE_PUNCTUATION = Set.of("+", "-", "*", "/", "=", ".", ",");
    private static final List<String> TEXT_ATTRIBUTES = List.of("text", "body", "specification", "Text");
    private static final List<String> ID_ATTRIBUTES = List.of("id", "Id", "identifier", "ID");
    private static final List<String> TYPE_ATTRIBUTES = List.of("type", "requirementType");

    /**
     * Outcome of an extraction.
     *
     * @param requirements requirements keyed by internal id, in stereotype order
     * @param rejected names of stereotyped elements rejected by the name filter
     */
    public record Extraction(Map<String, Requirement> requirements, List<String> rejected) {
        public Extraction {
            requirements = Collections.unmodifiableMap(new LinkedHashMap<>(requirements));
            rejected = List.copyOf(rejected);
        }
    }

    /**
     * Extracts requirements from a collected index.
     *
     * @param index parse-scoped indices
     * @param archiveStem file stem of the archive, the last source-file fallback
     * @return extracted requirements and rejected names
     */
    public Extraction extract(XmiIndex index, String archiveStem) {
        Map<String, Requirement> requirements = new LinkedHashMap<>();
        List<String> rejected = new ArrayList<>();

        index.stereotypes().forEach((baseId, application) -> {
            if (!application.isRequirement()) {
                return;
            }
            RawElement element = index.element(baseId);
            if (element == null) {
                log.debug("Requirement stereotype targets unknown element {}", baseId);
                return;
            }
            if (!isValidName(element.name())) {
                log.debug("Skipping requirement {} with name '{}'", baseId, element.name());
                rejected.add(element.name());
                return;
            }
            Requirement requirement = toRequirement(element, application, archiveStem);
            requirements.put(requirement.xmiId(), requirement);
        });

        return new Extraction(requirements, rejected);
    }

    /**
     * Checks whether a name looks like a real requirement rather than a diagram artefact.
     *
     * <p>Rejects empty names, "Unnamed Requirement", names of at most two characters after
     * trimming, digit-only names (inner spaces ignored) and lone punctuation characters.
     *
     * @param name element name
     * @return true if the name is acceptable
     */
    public static boolean isValidName(String name) {
        if (name == null || name.isEmpty() || UNNAMED.equals(name)) {
            return false;
        }
        String trimmed = name.trim();
        if (trimmed.length() <= 2) {
            return false;
        }
        if (LONE_PUNCTUATION.contains(trimmed)) {
            return false;
        }
        return !trimmed.replace(" ", "").chars().allMatch(Character::isDigit);
    }

    Requirement toRequirement(RawElement element, StereotypeApplication application, String archiveStem) {
        String name = element.name();
        return new Requirement(
            resolveId(element, application),
            element.id(),
            name,
            resolveText(element, application),
            resolveType(element),
            propertiesOf(element),
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            resolveSource(element, application, archiveStem)
        );
    }

    static String resolveText(RawElement element, StereotypeApplication application) {
        if (notEmpty(application.stereotypeText())) {
            return application.stereotypeText();
        }
        for (String attribute : TEXT_ATTRIBUTES) {
            String value = element.attribute(attribute);
            if (notEmpty(value)) {
                return value;
            }
        }
        if (notEmpty(element.commentBody())) {
            return element.commentBody();
        }
        return Requirement.NO_TEXT;
    }

    static String resolveId(RawElement element, StereotypeApplication application) {
        if (notEmpty(application.stereotypeId())) {
            return application.stereotypeId();
        }
        for (String attribute : ID_ATTRIBUTES) {
            String value = element.attribute(attribute);
            if (notEmpty(value)) {
                return value;
            }
        }
        String upper = element.name().toUpperCase();
        if (upper.contains("REQ") || upper.contains("R-")) {
            return element.name();
        }
        String id = element.id();
        return "REQ-" + (id.length() > 8 ? id.substring(id.length() - 8) : id);
    }

    static String resolveType(RawElement element) {
        for (String attribute : TYPE_ATTRIBUTES) {
            String value = element.attribute(attribute);
            if (notEmpty(value)) {
                return value;
            }
        }
        String lower = element.name().toLowerCase();
        // "non-functional" contains "functional" and therefore classifies as Functional
        if (lower.contains("functional")) {
            return "Functional";
        } else if (lower.contains("performance") || lower.contains("non-functional")) {
            return "Performance";
        } else if (lower.contains("interface")) {
            return "Interface";
        } else if (lower.contains("design")) {
            return "Design";
        } else if (lower.contains("test")) {
            return "Test";
        } else if (lower.contains("system")) {
            return "System";
        } else if (lower.contains("user")) {
            return "User";
        }
        return GENERAL_TYPE;
    }

    static Map<String, String> propertiesOf(RawElement element) {
        Map<String, String> properties = new LinkedHashMap<>();
        element.attributes().forEach((key, value) -> {
            if (!key.contains(":") && !key.startsWith("xmlns") && !"name".equals(key)) {
                properties.put(key, value);
            }
        });
        return properties;
    }

    static String resolveSource(RawElement element, StereotypeApplication application, String archiveStem) {
        if (notEmpty(element.source())) {
            return element.source();
        }
        if (notEmpty(application.source())) {
            return application.source();
        }
        return archiveStem;
    }

    private static boolean notEmpty(String value) {
        return value != null && !value.isEmpty();
    }
}
