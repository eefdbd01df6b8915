package com.tracegraph.core.scanner.base;

import com.tracegraph.core.model.BlockDiagram;
import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.CodeMappingReport;
import com.tracegraph.core.scanner.ScanContext;
import com.tracegraph.core.scanner.ScanResult;
import com.tracegraph.core.scanner.ScanStatistics;
import com.tracegraph.core.scanner.Scanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Abstract base class for scanner implementations providing common functionality.
 *
 * <p>This class reduces code duplication across scanner implementations by providing:
 * <ul>
 *   <li>Logger initialization (one logger per scanner class)</li>
 *   <li>Input discovery over the scanner's glob patterns ({@link #findInputs(ScanContext, String...)})</li>
 *   <li>appliesTo() based on discovery</li>
 *   <li>ScanResult creation helpers ({@link #failedResult(Path, Exception)}, {@link #graphResult})</li>
 * </ul>
 *
 * <p><b>Usage Example</b></p>
 * <p>Concrete scanners typically:</p>
 * <ol>
 *   <li>Override getId() to return a unique scanner identifier</li>
 *   <li>Return their glob patterns from getSupportedFilePatterns()</li>
 *   <li>In scan(), read and parse the input, catching archive and parse errors into failedResult()</li>
 * </ol>
 *
 * @see Scanner
 * @see ScanContext
 * @see ScanResult
 * @since 1.0.0
 */
public abstract class AbstractScanner implements Scanner {

    /**
     * Logger instance for this scanner.
     * Automatically initialized with the concrete scanner class name.
     */
    protected final Logger log;

    /**
     * Constructor that initializes the logger for the concrete scanner class.
     */
    protected AbstractScanner() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    // ==================== Input Discovery ====================

    /**
     * Discovers inputs using {@link #getSupportedFilePatterns()}.
     *
     * @param context scan context
     * @return sorted, de-duplicated inputs
     */
    @Override
    public List<Path> discoverInputs(ScanContext context) {
        return findInputs(context, getSupportedFilePatterns().toArray(String[]::new));
    }

    /**
     * Finds regular files matching any of the given glob patterns.
     *
     * @param context scan context
     * @param patterns glob patterns, relative to the root
     * @return sorted, de-duplicated files
     */
    protected List<Path> findInputs(ScanContext context, String... patterns) {
        return Stream.of(patterns)
            .flatMap(context::findFiles)
            .map(Path::normalize)
            .distinct()
            .sorted()
            .toList();
    }

    /**
     * Returns true when {@link #discoverInputs(ScanContext)} finds at least one input.
     *
     * @param context scan context
     * @return true if there is anything to scan
     */
    @Override
    public boolean appliesTo(ScanContext context) {
        try {
            return !discoverInputs(context).isEmpty();
        } catch (UncheckedIOException e) {
            log.warn("Cannot search {} for {} inputs: {}", context.rootPath(), getId(), e.getMessage());
            return false;
        }
    }

    // ==================== ScanResult Creation Helpers ====================

    /**
     * Creates a failed ScanResult from an exception, logging it at ERROR.
     *
     * @param input input that failed
     * @param cause failure
     * @return failed ScanResult with this scanner's ID
     */
    protected ScanResult failedResult(Path input, Exception cause) {
        log.error("Failed to scan {}: {}", input, cause.getMessage());
        log.debug("Failure detail for {}", input, cause);
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return ScanResult.failed(getId(), input, List.of(reason));
    }

    /**
     * Creates a successful ScanResult carrying a graph.
     *
     * @param input scanned input
     * @param graph extracted graph
     * @param diagram parsed diagram, or null
     * @param warnings warnings (can be empty)
     * @param statistics statistics
     * @return successful ScanResult
     */
    protected ScanResult graphResult(Path input, CanonicalGraph graph, BlockDiagram diagram,
                                     List<String> warnings, ScanStatistics statistics) {
        return new ScanResult(getId(), input, true, graph, diagram, null, warnings, List.of(), statistics);
    }

    /**
     * Creates a successful ScanResult carrying code mappings.
     *
     * @param input scanned input
     * @param report code mapping report
     * @param warnings warnings (can be empty)
     * @param statistics statistics
     * @return successful ScanResult
     */
    protected ScanResult mappingResult(Path input, CodeMappingReport report,
                                       List<String> warnings, ScanStatistics statistics) {
        return new ScanResult(getId(), input, true, null, null, report, warnings, List.of(), statistics);
    }
}
