package com.tracegraph.core.pipeline;

import com.tracegraph.core.model.BatchSummary;
import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.ConnectionSnapshot;
import com.tracegraph.core.model.TrackingResult;
import com.tracegraph.core.model.ValidationReport;
import com.tracegraph.core.renderer.GeneratedOutput;
import com.tracegraph.core.renderer.RenderReport;
import com.tracegraph.core.scanner.ScanResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything one pipeline run produced.
 *
 * @param scanResults per-input scan results in discovery order
 * @param requirements merged requirement graph, hierarchy applied when enabled
 * @param hierarchyEdges edges added by hierarchy inference
 * @param validation validation report of the merged requirement graph
 * @param summary batch summary
 * @param requirementTracking tracking of the merged requirement graph, null when versioning is off
 * @param blockTracking tracking per block model, empty when versioning is off
 * @param connections connection fingerprint per block model
 * @param output documents handed to the renderer
 * @param render render outcome, null when nothing was rendered
 */
public record PipelineResult(
    List<ScanResult> scanResults,
    CanonicalGraph requirements,
    int hierarchyEdges,
    ValidationReport validation,
    BatchSummary summary,
    TrackingResult requirementTracking,
    Map<String, TrackingResult> blockTracking,
    Map<String, ConnectionSnapshot> connections,
    GeneratedOutput output,
    RenderReport render
) {
    /**
     * Compact constructor with validation.
     */
    public PipelineResult {
        scanResults = scanResults == null ? List.of() : List.copyOf(scanResults);
        Objects.requireNonNull(requirements, "requirements must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        blockTracking = blockTracking == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(blockTracking));
        connections = connections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(connections));
    }

    /**
     * Total version records emitted across all stores.
     *
     * @return emitted record count
     */
    public int versionsEmitted() {
        int total = requirementTracking == null ? 0 : requirementTracking.emitted().size();
        for (TrackingResult tracking : blockTracking.values()) {
            total += tracking.emitted().size();
        }
        return total;
    }
}
