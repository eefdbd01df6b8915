package com.tracegraph.core.archive;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when a container cannot be opened, is corrupt, or lacks its expected payload.
 *
 * @since 1.0.0
 */
public class ArchiveException extends IOException {

    private final Path archive;

    public ArchiveException(Path archive, String message) {
        super(archive + ": " + message);
        this.archive = archive;
    }

    public ArchiveException(Path archive, String message, Throwable cause) {
        super(archive + ": " + message, cause);
        this.archive = archive;
    }

    /**
     * The container that could not be read.
     *
     * @return archive path
     */
    public Path getArchive() {
        return archive;
    }
}
