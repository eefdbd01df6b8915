package com.tracegraph.cli;

import com.tracegraph.core.model.ArtifactVersion;
import com.tracegraph.core.versioning.HistoryLog;
import com.tracegraph.core.versioning.VersionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to print the version lineage of one artifact, newest first.
 */
@Command(
    name = "history",
    description = "Print the version lineage of an artifact",
    mixinStandardHelpOptions = true
)
public class HistoryCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HistoryCommand.class);

    @Parameters(index = "0", description = "Artifact id")
    private String artifactId;

    @Option(names = {"-s", "--store"}, required = true, description = "Version store file")
    private Path store;

    @Option(names = {"--snapshots"}, description = "Print the snapshot of every version")
    private boolean snapshots;

    @Override
    public Integer call() {
        try {
            ArtifactVersion current = VersionStore.load(store).get(artifactId);
            List<ArtifactVersion> lineage = HistoryLog.forStore(store)
                .lineage(artifactId, current != null ? current.versionId() : null);

            if (lineage.isEmpty() && current != null) {
                lineage = List.of(current);
            }
            if (lineage.isEmpty()) {
                System.err.println("✗ No versions recorded for " + artifactId);
                return 1;
            }

            System.out.println("History of " + artifactId + " (" + lineage.size() + " versions):");
            for (ArtifactVersion version : lineage) {
                System.out.println("  " + version.timestamp() + "  " + TrackCommand.abbreviate(version.versionId())
                    + (version.isInitial() ? "  (initial)" : "  <- " + TrackCommand.abbreviate(version.parentVersionId())));
                if (snapshots) {
                    System.out.println("      " + version.snapshot());
                }
            }
            return 0;
        } catch (Exception e) {
            log.error("History lookup failed", e);
            System.err.println("✗ History lookup failed: " + e.getMessage());
            return 1;
        }
    }
}
