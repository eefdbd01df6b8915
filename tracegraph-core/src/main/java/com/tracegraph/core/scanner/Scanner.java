package com.tracegraph.core.scanner;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Interface for scanners that extract a canonical graph from one engineering-model format.
 *
 * <p>Scanners are discovered via Java Service Provider Interface (SPI). Each scanner
 * discovers its inputs under the scanned root and turns one input (an archive, a model
 * tree or a container) into one {@link ScanResult}. Inputs are independent of each other,
 * so a batch may scan them concurrently; a scanner must not keep per-input state in fields.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.tracegraph.core.scanner.Scanner}
 *
 * @see ScanContext
 * @see ScanResult
 */
public interface Scanner {

    /**
     * Returns unique identifier for this scanner.
     *
     * <p>Used for referencing scanner results and configuration. Should be kebab-case
     * (e.g., "cameo-requirements", "simulink-blocks").
     *
     * @return unique scanner identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this scanner.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns glob patterns for inputs this scanner handles.
     *
     * @return glob patterns
     */
    Set<String> getSupportedFilePatterns();

    /**
     * Returns execution priority for this scanner. Lower values are listed and run first.
     *
     * @return priority value
     */
    int getPriority();

    /**
     * Checks if this scanner has anything to do under the given context.
     *
     * @param context scan context
     * @return true if at least one input exists
     */
    boolean appliesTo(ScanContext context);

    /**
     * Discovers the inputs this scanner handles, in a stable order.
     *
     * @param context scan context
     * @return inputs, possibly empty
     */
    List<Path> discoverInputs(ScanContext context);

    /**
     * Scans one input.
     *
     * <p>Archive and parse failures are reported as a failed result, never thrown.
     *
     * @param input input discovered by {@link #discoverInputs(ScanContext)}
     * @param context scan context
     * @return scan result
     */
    ScanResult scan(Path input, ScanContext context);
}
