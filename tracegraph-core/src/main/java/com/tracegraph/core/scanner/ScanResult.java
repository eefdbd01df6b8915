package com.tracegraph.core.scanner;

import com.tracegraph.core.model.BlockDiagram;
import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.CodeMappingReport;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Result returned by a scanner for one input.
 *
 * <p>Requirement and block scanners fill {@code graph}; the block scanner also fills
 * {@code diagram} so that connection fingerprints can be computed. The code-generation
 * scanner fills {@code codeMappings}.
 *
 * @param scannerId ID of the scanner that produced this result
 * @param input scanned input
 * @param success whether the input was processed
 * @param graph extracted canonical graph, null when the scanner produces none
 * @param diagram parsed block diagram, null for other formats
 * @param codeMappings recovered code mappings, null for other formats
 * @param warnings non-fatal issues
 * @param errors reasons the input could not be processed
 * @param statistics extraction statistics
 */
public record ScanResult(
    String scannerId,
    Path input,
    boolean success,
    CanonicalGraph graph,
    BlockDiagram diagram,
    CodeMappingReport codeMappings,
    List<String> warnings,
    List<String> errors,
    ScanStatistics statistics
) {
    /**
     * Compact constructor with validation.
     */
    public ScanResult {
        Objects.requireNonNull(scannerId, "scannerId must not be null");
        Objects.requireNonNull(input, "input must not be null");
        if (warnings == null) {
            warnings = List.of();
        }
        if (errors == null) {
            errors = List.of();
        }
        if (statistics == null) {
            statistics = ScanStatistics.empty();
        }
    }

    /**
     * Creates a failed scan result.
     *
     * @param scannerId scanner ID
     * @param input scanned input
     * @param errors error messages
     * @return failed result
     */
    public static ScanResult failed(String scannerId, Path input, List<String> errors) {
        return new ScanResult(scannerId, input, false, null, null, null, List.of(), errors, ScanStatistics.empty());
    }

    /**
     * Number of extracted entities: graph nodes or code mappings.
     *
     * @return entity count
     */
    public int entityCount() {
        if (graph != null) {
            return graph.size();
        }
        if (codeMappings != null) {
            return codeMappings.mappings().size();
        }
        return 0;
    }

    /**
     * Returns the first error, or null for successful results.
     *
     * @return error message
     */
    public String firstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }
}
