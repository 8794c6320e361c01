package com.sourcelint.core.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Utility class for source file discovery.
 */
public final class FileUtils {

    /**
     * Glob matching the source files the rules apply to.
     */
    public static final String SOURCE_GLOB = "**.swift";

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern starting from a root directory.
     *
     * <p>Patterns are matched against the path relative to {@code rootPath}. A root
     * that is itself a regular file is returned as-is when its name matches.
     *
     * @param rootPath root directory (or single file) to search from
     * @param globPattern glob pattern
     * @return matching paths, sorted
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        if (Files.isRegularFile(rootPath)) {
            return matcher.matches(rootPath.getFileName()) ? List.of(rootPath) : List.of();
        }

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> {
                    Path relativePath = rootPath.relativize(path);
                    return matcher.matches(relativePath);
                })
                .sorted()
                .toList();
        }
    }

    /**
     * Finds source files under several roots, skipping excluded paths.
     *
     * <p>A file is excluded when it lies under (or is) one of the excluded paths.
     * Files reachable from several roots are returned once.
     *
     * @param includedRoots directories or files to lint
     * @param excludedPaths directories or files to skip
     * @return source files in discovery order
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findSourceFiles(List<Path> includedRoots, List<Path> excludedPaths) throws IOException {
        List<Path> excluded = excludedPaths.stream()
            .map(path -> path.toAbsolutePath().normalize())
            .toList();

        // Keyed on the normalized path; the first spelling seen is kept
        Map<Path, Path> found = new LinkedHashMap<>();
        for (Path root : includedRoots) {
            if (!Files.exists(root)) {
                throw new IOException("Path does not exist: " + root);
            }
            for (Path file : findFiles(root, SOURCE_GLOB)) {
                Path normalized = file.toAbsolutePath().normalize();
                if (excluded.stream().noneMatch(normalized::startsWith)) {
                    found.putIfAbsent(normalized, file);
                }
            }
        }
        return new ArrayList<>(found.values());
    }
}
