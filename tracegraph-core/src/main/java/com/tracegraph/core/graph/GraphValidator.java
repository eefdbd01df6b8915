package com.tracegraph.core.graph;

import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.CanonicalNode;
import com.tracegraph.core.model.GapSeverity;
import com.tracegraph.core.model.QualityGap;
import com.tracegraph.core.model.Requirement;
import com.tracegraph.core.model.ValidationIssue;
import com.tracegraph.core.model.ValidationReport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reports data-quality findings for a canonical graph.
 *
 * <p>Findings never block export:
 * <ul>
 *   <li>WARNING for nodes without text (missing, empty, or the "No text specified" placeholder)</li>
 *   <li>ERROR for nodes without a name</li>
 *   <li>INFO for nodes without any relationship</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class GraphValidator {

    /**
     * Validates a graph.
     *
     * @param graph graph to validate
     * @return report with statistics and issues
     */
    public ValidationReport validate(CanonicalGraph graph) {
        int withText = 0;
        int withRelationships = 0;
        Map<String, Integer> byType = new TreeMap<>();
        Map<String, Integer> bySource = new TreeMap<>();
        List<ValidationIssue> issues = new ArrayList<>();

        for (CanonicalNode node : graph.nodes().values()) {
            if (hasText(node)) {
                withText++;
            } else {
                issues.add(new ValidationIssue(node.id(), GapSeverity.WARNING, "Missing requirement text"));
            }
            if (node.hasRelationships()) {
                withRelationships++;
            } else {
                issues.add(new ValidationIssue(node.id(), GapSeverity.INFO, "No relationships"));
            }
            byType.merge(node.nodeType().isEmpty() ? "Unknown" : node.nodeType(), 1, Integer::sum);
            bySource.merge(node.sourceFile().isEmpty() ? "Unknown" : node.sourceFile(), 1, Integer::sum);
            if (node.name().isEmpty()) {
                issues.add(new ValidationIssue(node.id(), GapSeverity.ERROR, "Missing requirement name"));
            }
        }

        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("total", graph.size());
        statistics.put("with_text", withText);
        statistics.put("with_relationships", withRelationships);
        statistics.put("by_type", byType);
        statistics.put("by_source", bySource);
        return new ValidationReport(graph.source(), statistics, issues);
    }

    /**
     * Summarises a report as batch quality gaps: one gap per severity that has findings,
     * INFO findings excluded.
     *
     * @param report validation report
     * @return quality gaps
     */
    public List<QualityGap> toQualityGaps(ValidationReport report) {
        List<QualityGap> gaps = new ArrayList<>();
        long errors = report.count(GapSeverity.ERROR);
        long warnings = report.count(GapSeverity.WARNING);
        if (errors > 0) {
            gaps.add(QualityGap.error(report.sourceFile(), errors + " requirements without name"));
        }
        if (warnings > 0) {
            gaps.add(QualityGap.warning(report.sourceFile(), warnings + " requirements without text"));
        }
        return gaps;
    }

    private static boolean hasText(CanonicalNode node) {
        return node.text() != null && !node.text().isEmpty() && !Requirement.NO_TEXT.equals(node.text());
    }
}
