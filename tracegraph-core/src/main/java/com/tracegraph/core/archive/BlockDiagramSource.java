package com.tracegraph.core.archive;

import com.tracegraph.core.util.FileUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Descriptor files of one block-diagram model, read either from an unpacked model tree
 * ({@code blockdiagram.xml} + {@code systems/*.xml}) or from a packaged {@code .slx} container.
 *
 * <p>System descriptors are keyed by their base name ({@code system_root}) and kept in name order.
 *
 * @param modelName model name
 * @param location directory or container the descriptors were read from
 * @param rootDescriptor root descriptor content, or null when absent
 * @param systemDescriptors subsystem descriptors by base name
 *
 * @since 1.0.0
 */
public record BlockDiagramSource(
    String modelName,
    Path location,
    byte[] rootDescriptor,
    Map<String, byte[]> systemDescriptors
) {
    /** Root descriptor file name. */
    public static final String ROOT_DESCRIPTOR = "blockdiagram.xml";

    /** Directory holding subsystem descriptors. */
    public static final String SYSTEMS_DIR = "systems";

    private static final String SLX_PREFIX = "simulink/";

    /**
     * Compact constructor with defaults.
     */
    public BlockDiagramSource {
        systemDescriptors = systemDescriptors == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(systemDescriptors));
    }

    /**
     * Opens a model tree directory or an {@code .slx} container.
     *
     * @param location directory or container
     * @return descriptors
     * @throws ArchiveException if the location cannot be read
     */
    public static BlockDiagramSource open(Path location) throws ArchiveException {
        if (Files.isDirectory(location)) {
            return fromTree(location);
        }
        if (Files.isRegularFile(location)) {
            return fromContainer(location);
        }
        throw new ArchiveException(location, "model not found");
    }

    /**
     * Derives the model name of a tree directory: its own name, or its parent's name
     * when the directory is the {@code simulink} folder of an unpacked container.
     *
     * @param directory model tree directory
     * @return model name
     */
    public static String modelNameOf(Path directory) {
        Path normalized = directory.toAbsolutePath().normalize();
        Path name = normalized.getFileName();
        if (name == null) {
            return directory.toString();
        }
        Path parent = normalized.getParent();
        if (name.toString().equalsIgnoreCase("simulink") && parent != null && parent.getFileName() != null) {
            return parent.getFileName().toString();
        }
        return name.toString();
    }

    private static BlockDiagramSource fromTree(Path directory) throws ArchiveException {
        try {
            Path rootFile = directory.resolve(ROOT_DESCRIPTOR);
            byte[] root = Files.isRegularFile(rootFile) ? Files.readAllBytes(rootFile) : null;

            Map<String, byte[]> systems = new LinkedHashMap<>();
            Path systemsDir = directory.resolve(SYSTEMS_DIR);
            if (Files.isDirectory(systemsDir)) {
                List<Path> files;
                try (Stream<Path> listing = Files.list(systemsDir)) {
                    files = listing
                        .filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().endsWith(".xml"))
                        .sorted()
                        .toList();
                }
                for (Path file : files) {
                    systems.put(FileUtils.getStem(file), Files.readAllBytes(file));
                }
            }
            return new BlockDiagramSource(modelNameOf(directory), directory, root, systems);
        } catch (IOException e) {
            throw new ArchiveException(directory, "cannot read model tree", e);
        }
    }

    private static BlockDiagramSource fromContainer(Path container) throws ArchiveException {
        try (ZipFile zip = new ZipFile(container.toFile())) {
            byte[] root = null;
            Map<String, byte[]> systems = new TreeMap<>();
            List<ZipEntry> entries = new ArrayList<>();
            Enumeration<? extends ZipEntry> e = zip.entries();
            while (e.hasMoreElements()) {
                entries.add(e.nextElement());
            }
            for (ZipEntry entry : entries) {
                String name = entry.getName();
                if (entry.isDirectory() || !name.startsWith(SLX_PREFIX)) {
                    continue;
                }
                String relative = name.substring(SLX_PREFIX.length());
                if (relative.equals(ROOT_DESCRIPTOR)) {
                    root = readEntry(zip, entry);
                } else if (relative.startsWith(SYSTEMS_DIR + "/") && relative.endsWith(".xml")
                    && relative.indexOf('/', SYSTEMS_DIR.length() + 1) < 0) {
                    String base = relative.substring(SYSTEMS_DIR.length() + 1, relative.length() - ".xml".length());
                    systems.put(base, readEntry(zip, entry));
                }
            }
            return new BlockDiagramSource(FileUtils.getStem(container), container, root, systems);
        } catch (ZipException ex) {
            throw new ArchiveException(container, "corrupt container", ex);
        } catch (IOException ex) {
            throw new ArchiveException(container, "cannot read container", ex);
        }
    }

    private static byte[] readEntry(ZipFile zip, ZipEntry entry) throws IOException {
        try (InputStream in = zip.getInputStream(entry)) {
            return in.readAllBytes();
        }
    }
}
