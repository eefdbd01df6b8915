package com.tracegraph.cli;

import com.tracegraph.core.io.GraphDocumentCodec;
import com.tracegraph.core.model.ArtifactType;
import com.tracegraph.core.model.ArtifactVersion;
import com.tracegraph.core.model.CanonicalGraph;
import com.tracegraph.core.model.Tool;
import com.tracegraph.core.model.TrackingResult;
import com.tracegraph.core.versioning.VersionTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;

/**
 * Command to track the versions of one graph document against a version store.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * tracegraph track out/all_requirements.json --store .tracegraph/versions/cameo_versions.json
 * tracegraph track out/simulink/Plant/block_connectivity.json --type model \
 *     --store .tracegraph/versions/simulink/Plant_versions.json
 * }</pre>
 */
@Command(
    name = "track",
    description = "Record content versions of every node of a graph document",
    mixinStandardHelpOptions = true
)
public class TrackCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TrackCommand.class);

    @Parameters(index = "0", description = "Canonical graph document")
    private Path input;

    @Option(names = {"-s", "--store"}, required = true, description = "Version store file")
    private Path store;

    @Option(names = {"-t", "--type"}, description = "Artifact type: requirement or model (default: requirement)",
        defaultValue = "requirement")
    private String type;

    @Option(names = {"--no-history"}, description = "Do not append to the history log")
    private boolean noHistory;

    @Override
    public Integer call() {
        try {
            ArtifactType artifactType = ArtifactType.fromValue(type);
            Tool tool = artifactType == ArtifactType.REQUIREMENT ? Tool.CAMEO : Tool.SIMULINK;
            CanonicalGraph graph = GraphDocumentCodec.read(input);

            TrackingResult result = new VersionTracker(Clock.systemUTC())
                .trackAndPersist(graph, store, artifactType, tool, !noHistory);

            if (result.degradedStore()) {
                System.err.println("⚠ Store " + store + " was unreadable; all artifacts were treated as new");
            }
            for (ArtifactVersion version : result.emitted()) {
                System.out.println((version.isInitial() ? "  + " : "  ~ ") + version.artifactId()
                    + " " + abbreviate(version.versionId()));
            }
            System.out.println("✓ " + result.current().size() + " artifacts tracked ("
                + result.newCount() + " new, " + result.changedCount() + " changed, "
                + result.unchanged() + " unchanged)");
            return 0;
        } catch (Exception e) {
            log.error("Tracking failed", e);
            System.err.println("✗ Tracking failed: " + e.getMessage());
            return 1;
        }
    }

    static String abbreviate(String versionId) {
        return versionId.length() > 12 ? versionId.substring(0, 12) : versionId;
    }
}
