package com.tracegraph.cli;

import com.tracegraph.core.pipeline.ScannerRegistry;
import com.tracegraph.core.renderer.OutputRenderer;
import com.tracegraph.core.scanner.Scanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available scanners or renderers.
 *
 * <p>Discovers plugins via Java Service Provider Interface (SPI) and displays
 * their capabilities.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * tracegraph list scanners
 * tracegraph list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available scanners or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: scanners or renderers",
        defaultValue = "scanners"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "scanners", "scanner" -> listScanners();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: scanners or renderers", type);
                yield 1;
            }
        };
    }

    private int listScanners() {
        System.out.println("Available Scanners:");
        System.out.println();

        List<Scanner> scanners = ScannerRegistry.discover();
        for (Scanner scanner : scanners) {
            System.out.printf("  • %s (ID: %s)%n", scanner.getDisplayName(), scanner.getId());
            System.out.printf("    Patterns: %s%n", scanner.getSupportedFilePatterns());
            System.out.printf("    Priority: %d%n", scanner.getPriority());
            System.out.println();
        }
        if (scanners.isEmpty()) {
            System.out.println("  No scanners found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            System.out.printf("  • %s%n", renderer.getId());
        }
        if (!found) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }
}
