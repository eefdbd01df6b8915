package com.tracegraph.core.pipeline;

import com.tracegraph.core.config.ProjectConfig;
import com.tracegraph.core.scanner.Scanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Discovers scanners through {@link ServiceLoader} and selects the enabled ones.
 */
public final class ScannerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScannerRegistry.class);

    private ScannerRegistry() {
    }

    /**
     * Loads all registered scanners, ordered by priority.
     *
     * @return scanners, lowest priority value first
     */
    public static List<Scanner> discover() {
        ServiceLoader<Scanner> loader = ServiceLoader.load(Scanner.class);
        List<Scanner> scanners = new ArrayList<>();
        loader.forEach(scanners::add);
        scanners.sort(Comparator.comparingInt(Scanner::getPriority).thenComparing(Scanner::getId));

        log.debug("Discovered {} scanners", scanners.size());
        if (log.isDebugEnabled()) {
            scanners.forEach(s -> log.debug("  - {} ({})", s.getId(), s.getDisplayName()));
        }
        return scanners;
    }

    /**
     * Filters scanners by the enabled list of the configuration. Unknown ids in the
     * configuration are logged.
     *
     * @param scanners discovered scanners
     * @param config scanner configuration
     * @return enabled scanners in their original order
     */
    public static List<Scanner> enabled(List<Scanner> scanners, ProjectConfig.ScannerConfig config) {
        if (config.enabled() != null && !config.enabled().isEmpty()) {
            Set<String> available = scanners.stream().map(Scanner::getId).collect(Collectors.toSet());
            List<String> unknown = config.enabled().stream().filter(id -> !available.contains(id)).toList();
            if (!unknown.isEmpty()) {
                log.warn("Unknown scanner IDs in configuration: {} (available: {})", unknown, available);
            }
        }
        List<Scanner> enabled = scanners.stream().filter(s -> config.isEnabled(s.getId())).toList();
        log.debug("{} of {} scanners enabled", enabled.size(), scanners.size());
        return enabled;
    }
}
