package com.tracegraph;

import ch.qos.logback.classic.Level;
import com.tracegraph.cli.HierarchyCommand;
import com.tracegraph.cli.HistoryCommand;
import com.tracegraph.cli.ListCommand;
import com.tracegraph.cli.ScanCommand;
import com.tracegraph.cli.TrackCommand;
import com.tracegraph.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Main CLI entry point for TraceGraph.
 *
 * <p>TraceGraph extracts requirements from Cameo archives and blocks, connections and
 * generated-code references from Simulink models into one canonical graph, and tracks content
 * versions of every artifact across runs.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code scan} - Run the full pipeline over a directory</li>
 *   <li>{@code hierarchy} - Link dotted requirement ids in a graph document</li>
 *   <li>{@code validate} - Report quality issues of a graph document</li>
 *   <li>{@code track} - Track versions of a graph document against a store</li>
 *   <li>{@code history} - Print the version lineage of one artifact</li>
 *   <li>{@code list} - List available scanners or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Process every archive and model under ./models
 * tracegraph scan ./models
 *
 * # Lineage of one requirement
 * tracegraph history REQ-1.2 --store .tracegraph/versions/cameo_versions.json
 * }</pre>
 */
@Command(
    name = "tracegraph",
    mixinStandardHelpOptions = true,
    version = "TraceGraph 1.0.0-SNAPSHOT",
    description = "Requirements and block-diagram traceability extraction with content-addressed versioning",
    subcommands = {
        ScanCommand.class,
        HierarchyCommand.class,
        ValidateCommand.class,
        TrackCommand.class,
        HistoryCommand.class,
        ListCommand.class
    }
)
public class TraceGraphCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("TraceGraph - Requirements and Model Traceability");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'tracegraph --help' to see available commands");
        System.out.println("Use 'tracegraph <command> --help' for command-specific help");
    }

    /**
     * Sets the root Logback level from the global options, then runs the selected command.
     *
     * @param parseResult parsed command line
     * @return exit code
     */
    int executionStrategy(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Builds the command line with the logging strategy installed.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        TraceGraphCLI cli = new TraceGraphCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
