package com.tracegraph.cli;

import com.tracegraph.core.graph.GraphValidator;
import com.tracegraph.core.io.GraphDocumentCodec;
import com.tracegraph.core.io.JsonDocuments;
import com.tracegraph.core.model.GapSeverity;
import com.tracegraph.core.model.ValidationIssue;
import com.tracegraph.core.model.ValidationReport;
import com.tracegraph.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to report quality issues of a canonical graph document.
 *
 * <p>Issues never fail the command; only an unreadable document does.
 */
@Command(
    name = "validate",
    description = "Validate a requirement graph document",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    private static final int MAX_LISTED = 10;

    @Parameters(index = "0", description = "Canonical graph document")
    private Path input;

    @Option(names = {"--export-report"}, description = "Write <input>_validation_report.json next to the input")
    private boolean exportReport;

    @Override
    public Integer call() {
        try {
            GraphValidator validator = new GraphValidator();
            ValidationReport report = validator.validate(GraphDocumentCodec.read(input));

            System.out.println("Validation of " + input.getFileName() + ":");
            for (Map.Entry<String, Object> stat : report.statistics().entrySet()) {
                System.out.println("  " + stat.getKey() + ": " + stat.getValue());
            }
            printIssues("ERRORS", report, GapSeverity.ERROR);
            printIssues("WARNINGS", report, GapSeverity.WARNING);

            if (exportReport) {
                Path target = input.resolveSibling(FileUtils.getStem(input) + "_validation_report.json");
                Files.writeString(target, JsonDocuments.write(report), StandardCharsets.UTF_8);
                System.out.println("✓ Validation report saved to: " + target);
            }
            return 0;
        } catch (Exception e) {
            log.error("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }

    private void printIssues(String title, ValidationReport report, GapSeverity severity) {
        List<ValidationIssue> issues = report.issues().stream().filter(i -> i.severity() == severity).toList();
        if (issues.isEmpty()) {
            return;
        }
        System.out.println();
        System.out.println(title + " (" + issues.size() + "):");
        issues.stream().limit(MAX_LISTED).forEach(i -> System.out.println("  " + i.nodeId() + ": " + i.message()));
        if (issues.size() > MAX_LISTED) {
            System.out.println("  ... and " + (issues.size() - MAX_LISTED) + " more");
        }
    }
}
