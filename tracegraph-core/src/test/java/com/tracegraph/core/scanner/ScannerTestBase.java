package com.tracegraph.core.scanner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Base class for scanner functional tests.
 *
 * <p>Provides common test infrastructure including:
 * <ul>
 *   <li>Temporary directory creation for test inputs</li>
 *   <li>Helper methods for creating files, zip archives and model trees</li>
 *   <li>ScanContext creation with sensible defaults</li>
 * </ul>
 *
 * @since 1.0.0
 */
public abstract class ScannerTestBase {

    /** Requirements archive payload entry. */
    protected static final String MDZIP_PAYLOAD = "com.nomagic.magicdraw.uml_model.model";

    @TempDir
    protected Path tempDir;

    protected ScanContext context;

    @BeforeEach
    void setUp() {
        context = ScanContext.of(tempDir);
    }

    /**
     * Creates a file in the temp directory with the given content.
     *
     * @param relativePath path relative to tempDir
     * @param content file content
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
        return filePath;
    }

    /**
     * Creates a zip archive in the temp directory.
     *
     * @param relativePath archive path relative to tempDir
     * @param entries entry name to content, written in iteration order
     * @return the created archive
     * @throws IOException if the archive cannot be written
     */
    protected Path createZip(String relativePath, Map<String, String> entries) throws IOException {
        Path archive = tempDir.resolve(relativePath);
        Files.createDirectories(archive.getParent());
        try (OutputStream out = Files.newOutputStream(archive);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return archive;
    }

    /**
     * Creates a requirements archive holding the given XMI payload.
     *
     * @param relativePath archive path relative to tempDir
     * @param xmi XMI payload
     * @return the created archive
     * @throws IOException if the archive cannot be written
     */
    protected Path createMdzip(String relativePath, String xmi) throws IOException {
        return createZip(relativePath, Map.of(MDZIP_PAYLOAD, xmi));
    }

    /**
     * Creates an unpacked block-diagram model tree {@code <model>/simulink/...}.
     *
     * @param modelName model directory name
     * @param rootDescriptor content of blockdiagram.xml
     * @param systems system descriptor base name to content
     * @return the {@code simulink} directory
     * @throws IOException if a file cannot be written
     */
    protected Path createModelTree(String modelName, String rootDescriptor, Map<String, String> systems) throws IOException {
        String base = modelName + "/simulink/";
        createFile(base + "blockdiagram.xml", rootDescriptor);
        for (Map.Entry<String, String> system : systems.entrySet()) {
            createFile(base + "systems/" + system.getKey() + ".xml", system.getValue());
        }
        return tempDir.resolve(modelName).resolve("simulink");
    }
}
