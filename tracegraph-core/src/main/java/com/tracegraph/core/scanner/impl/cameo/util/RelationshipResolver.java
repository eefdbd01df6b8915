package com.tracegraph.core.scanner.impl.cameo.util;

import com.tracegraph.core.model.RawElement;
import com.tracegraph.core.model.RelationshipKind;
import com.tracegraph.core.model.Requirement;
import com.tracegraph.core.model.StereotypeApplication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Attaches traceability relationships to extracted requirements.
 *
 * <p>Resolution runs in two phases over the parse-scoped indices:
 * <ol>
 *   <li>Collect: every element whose declared type contains Dependency, Abstraction,
 *       Realization or Trace and that has both {@code client} and {@code supplier} contributes
 *       each supplier to the raw list of each client requirement. The kind comes from the
 *       stereotype applied to the relationship element, then from its name, then defaults to
 *       {@link RelationshipKind#TRACES}.</li>
 *   <li>Resolve: raw references that are not requirement ids of this parse are dropped and
 *       counted as resolution misses; the rest are de-duplicated in first-seen order.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class RelationshipResolver {

    private static final Logger log = LoggerFactory.getLogger(RelationshipResolver.class);

    private static final List<String> RELATIONSHIP_TYPES =
        List.of("Dependency", "Abstraction", "Realization", "Trace");

    /**
     * Outcome of a resolution.
     *
     * @param requirements requirements with relationship lists filled, keyed by internal id
     * @param edges number of relationship entries kept
     * @param misses number of references dropped
     */
    public record Resolution(Map<String, Requirement> requirements, int edges, int misses) {
        public Resolution {
            requirements = Collections.unmodifiableMap(new LinkedHashMap<>(requirements));
        }
    }

    /**
     * Resolves relationships.
     *
     * @param index parse-scoped indices
     * @param requirements extracted requirements keyed by internal id
     * @return requirements with relationships, plus edge and miss counts
     */
    public Resolution resolve(XmiIndex index, Map<String, Requirement> requirements) {
        Map<String, Map<RelationshipKind, List<String>>> raw = collect(index, requirements);

        Map<String, Requirement> resolved = new LinkedHashMap<>();
        int edges = 0;
        int misses = 0;
        for (Requirement requirement : requirements.values()) {
            Map<RelationshipKind, List<String>> candidates = raw.get(requirement.xmiId());
            if (candidates == null) {
                resolved.put(requirement.xmiId(), requirement);
                continue;
            }
            Map<RelationshipKind, List<String>> kept = new EnumMap<>(RelationshipKind.class);
            for (Map.Entry<RelationshipKind, List<String>> entry : candidates.entrySet()) {
                Set<String> targets = new LinkedHashSet<>();
                for (String target : entry.getValue()) {
                    if (requirements.containsKey(target)) {
                        targets.add(target);
                    } else {
                        misses++;
                        log.debug("Unresolved {} reference {} -> {}", entry.getKey().keyword(), requirement.reqId(), target);
                    }
                }
                edges += targets.size();
                kept.put(entry.getKey(), new ArrayList<>(targets));
            }
            resolved.put(requirement.xmiId(), requirement.withRelationships(kept));
        }
        return new Resolution(resolved, edges, misses);
    }

    private Map<String, Map<RelationshipKind, List<String>>> collect(XmiIndex index, Map<String, Requirement> requirements) {
        Map<String, Map<RelationshipKind, List<String>>> raw = new LinkedHashMap<>();
        for (RawElement element : index.elements().values()) {
            if (!isRelationship(element.declaredType())) {
                continue;
            }
            String client = element.attribute("client");
            String supplier = element.attribute("supplier");
            if (isBlank(client) || isBlank(supplier)) {
                continue;
            }
            List<String> suppliers = List.of(supplier.trim().split("\\s+"));
            RelationshipKind kind = null;
            for (String clientId : client.trim().split("\\s+")) {
                if (!requirements.containsKey(clientId)) {
                    continue;
                }
                if (kind == null) {
                    kind = classify(element, index.stereotypeOf(element.id()));
                }
                raw.computeIfAbsent(clientId, key -> new EnumMap<>(RelationshipKind.class))
                    .computeIfAbsent(kind, key -> new ArrayList<>())
                    .addAll(suppliers);
            }
        }
        return raw;
    }

    /**
     * Classifies a relationship element.
     *
     * @param element relationship element
     * @param stereotype stereotype applied to it, or null
     * @return relationship kind
     */
    static RelationshipKind classify(RawElement element, StereotypeApplication stereotype) {
        if (stereotype != null) {
            RelationshipKind fromStereotype = RelationshipKind.fromLabel(stereotype.stereotype());
            if (fromStereotype != null) {
                return fromStereotype;
            }
        }
        RelationshipKind fromName = RelationshipKind.fromLabel(element.name());
        return fromName != null ? fromName : RelationshipKind.TRACES;
    }

    private static boolean isRelationship(String declaredType) {
        for (String type : RELATIONSHIP_TYPES) {
            if (declaredType.contains(type)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
