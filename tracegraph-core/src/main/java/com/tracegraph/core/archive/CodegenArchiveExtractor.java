package com.tracegraph.core.archive;

import com.tracegraph.core.util.FileUtils;
import com.tracegraph.core.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * Extracts a code-generation archive ({@code .slxc}) into a persistent cache directory.
 *
 * <p>The cache directory is {@code <stem>_extracted} next to the archive. Under a configured
 * cache root, archives from different folders share one parent, so the name also carries a
 * short hash of the archive's absolute path: {@code <stem>_<hash>_extracted}. Extraction is idempotent: a cache directory that already holds
 * source files is reused as is, an existing directory without source files is deleted and
 * extracted again.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * CodegenArchiveExtractor extractor = new CodegenArchiveExtractor(null, List.of(".c"));
 * Path dir = extractor.extract(Path.of("Controller.slxc"));
 * List<Path> sources = extractor.findSourceFiles(dir);
 * }</pre>
 *
 * @since 1.0.0
 */
public class CodegenArchiveExtractor {

    private static final Logger log = LoggerFactory.getLogger(CodegenArchiveExtractor.class);

    /** Default extensions of recovered source files. */
    public static final List<String> DEFAULT_SOURCE_EXTENSIONS = List.of(".c");

    private final Path cacheRoot;
    private final List<String> sourceExtensions;

    /**
     * Creates an extractor.
     *
     * @param cacheRoot directory holding extraction directories, or null to extract next to the archive
     * @param sourceExtensions extensions of source files to recover, null or empty for {@code .c}
     */
    public CodegenArchiveExtractor(Path cacheRoot, List<String> sourceExtensions) {
        this.cacheRoot = cacheRoot;
        this.sourceExtensions = sourceExtensions == null || sourceExtensions.isEmpty()
            ? DEFAULT_SOURCE_EXTENSIONS
            : List.copyOf(sourceExtensions);
    }

    private static final int PATH_KEY_LENGTH = 12;

    /**
     * Returns the extraction directory for an archive.
     *
     * @param archive archive path
     * @return cache directory, distinct for every archive path
     */
    public Path extractionDirectory(Path archive) {
        Path absolute = archive.toAbsolutePath().normalize();
        String stem = FileUtils.getStem(absolute);
        if (cacheRoot != null) {
            String pathKey = Hashing.sha256Hex(FileUtils.toPortableString(absolute)).substring(0, PATH_KEY_LENGTH);
            return cacheRoot.resolve(stem + "_" + pathKey + "_extracted");
        }
        return absolute.getParent().resolve(stem + "_extracted");
    }

    /**
     * Extracts the archive unless a usable cached extraction exists.
     *
     * @param archive archive path
     * @return extraction directory
     * @throws ArchiveException if the archive is missing, corrupt, or contains entries escaping the directory
     */
    public Path extract(Path archive) throws ArchiveException {
        Objects.requireNonNull(archive, "archive must not be null");
        if (!Files.isRegularFile(archive)) {
            throw new ArchiveException(archive, "archive not found");
        }

        Path target = extractionDirectory(archive);
        try {
            if (Files.isDirectory(target)) {
                if (!findSourceFiles(target).isEmpty()) {
                    log.debug("Reusing extracted directory {}", target);
                    return target;
                }
                log.debug("Extracted directory {} has no source files, extracting again", target);
                FileUtils.deleteRecursively(target);
            }
            Files.createDirectories(target);
        } catch (IOException e) {
            throw new ArchiveException(archive, "cannot prepare extraction directory", e);
        }

        try {
            unzip(archive, target);
        } catch (IOException e) {
            discardPartialExtraction(target, e);
            if (e instanceof ArchiveException archiveException) {
                throw archiveException;
            }
            if (e instanceof ZipException) {
                throw new ArchiveException(archive, "corrupt archive", e);
            }
            throw new ArchiveException(archive, "cannot extract archive", e);
        }
        log.info("Extracted {} to {}", archive.getFileName(), target);
        return target;
    }

    /**
     * Lists recovered source files under an extraction directory.
     *
     * @param extractionDirectory extraction directory
     * @return sorted source files
     * @throws IOException if the directory cannot be walked
     */
    public List<Path> findSourceFiles(Path extractionDirectory) throws IOException {
        return FileUtils.findFilesWithExtensions(extractionDirectory, sourceExtensions);
    }

    private void unzip(Path archive, Path target) throws IOException {
        Path normalizedTarget = target.toAbsolutePath().normalize();
        int entries = 0;
        try (InputStream raw = Files.newInputStream(archive);
             ZipInputStream zip = new ZipInputStream(raw)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                entries++;
                Path destination = normalizedTarget.resolve(entry.getName()).normalize();
                if (!destination.startsWith(normalizedTarget)) {
                    throw new ArchiveException(archive, "entry escapes extraction directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(destination);
                } else {
                    Files.createDirectories(destination.getParent());
                    Files.copy(zip, destination, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
        if (entries == 0) {
            // ZipInputStream yields nothing for non-zip content instead of failing
            throw new ArchiveException(archive, "corrupt archive or no entries");
        }
    }

    private void discardPartialExtraction(Path target, IOException cause) {
        try {
            FileUtils.deleteRecursively(target);
        } catch (IOException cleanup) {
            cause.addSuppressed(cleanup);
            log.warn("Could not remove partial extraction {}: {}", target, cleanup.getMessage());
        }
    }
}
