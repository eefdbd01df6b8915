package com.tracegraph.core.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Reads the XMI payload out of a requirements-model archive ({@code .mdzip}).
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * byte[] xmi = new RequirementsArchiveReader().readPayload(Path.of("system.mdzip"));
 * }</pre>
 *
 * @since 1.0.0
 */
public class RequirementsArchiveReader {

    /** Name of the archive entry holding the model. */
    public static final String PAYLOAD_ENTRY = "com.nomagic.magicdraw.uml_model.model";

    private static final Logger log = LoggerFactory.getLogger(RequirementsArchiveReader.class);

    /**
     * Reads the model payload.
     *
     * @param archive archive path
     * @return raw payload bytes
     * @throws ArchiveException if the archive is missing, corrupt, or lacks the payload entry
     */
    public byte[] readPayload(Path archive) throws ArchiveException {
        if (!Files.isRegularFile(archive)) {
            throw new ArchiveException(archive, "archive not found");
        }
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            ZipEntry entry = zip.getEntry(PAYLOAD_ENTRY);
            if (entry == null) {
                throw new ArchiveException(archive, "missing entry " + PAYLOAD_ENTRY);
            }
            try (InputStream in = zip.getInputStream(entry)) {
                byte[] payload = in.readAllBytes();
                log.debug("Read {} bytes of model payload from {}", payload.length, archive.getFileName());
                return payload;
            }
        } catch (ZipException e) {
            throw new ArchiveException(archive, "corrupt archive", e);
        } catch (ArchiveException e) {
            throw e;
        } catch (IOException e) {
            throw new ArchiveException(archive, "cannot read archive", e);
        }
    }
}
