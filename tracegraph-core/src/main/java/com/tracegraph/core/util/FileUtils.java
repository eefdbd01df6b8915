package com.tracegraph.core.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern starting from a root directory.
     *
     * <p>The pattern is matched against the path relative to {@code rootPath}, so
     * {@code **}{@code /*.c} does not match files directly under the root.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern
     * @return sorted list of matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(rootPath.relativize(path)))
                .sorted()
                .toList();
        }
    }

    /**
     * Finds regular files whose name ends with one of the given extensions.
     *
     * @param rootPath root directory
     * @param extensions extensions including the dot, e.g. ".c"
     * @return sorted list of matching paths, empty if the root does not exist
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFilesWithExtensions(Path rootPath, List<String> extensions) throws IOException {
        if (!Files.isDirectory(rootPath)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> hasExtension(path, extensions))
                .sorted()
                .toList();
        }
    }

    /**
     * Checks whether a file name ends with one of the given extensions (case-insensitive).
     *
     * @param path file path
     * @param extensions extensions including the dot
     * @return true on match
     */
    public static boolean hasExtension(Path path, List<String> extensions) {
        String fileName = path.getFileName().toString().toLowerCase();
        return extensions.stream().anyMatch(ext -> fileName.endsWith(ext.toLowerCase()));
    }

    /**
     * Gets the file name without its last extension.
     *
     * @param path file path
     * @return stem, e.g. "model" for "model.mdzip"
     */
    public static String getStem(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Converts a path to a forward-slash string, independent of the platform separator.
     *
     * @param path relative path
     * @return portable string
     */
    public static String toPortableString(Path path) {
        return path.toString().replace('\\', '/');
    }

    /**
     * Recursively deletes a directory tree. Does nothing if the path does not exist.
     *
     * @param root directory to delete
     * @throws IOException if a file cannot be deleted
     */
    public static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
