package github.sarthakdev143.reel_export.service.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Cleanup helpers for job workspaces. Failures are logged and never abort the caller.
 */
public final class WorkspaceFiles {

    private static final Logger logger = LoggerFactory.getLogger(WorkspaceFiles.class);

    private WorkspaceFiles() {
    }

    public static boolean deleteIfExists(Path path) {
        if (path == null) {
            return false;
        }
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete {}", path, e);
            return false;
        }
    }

    /**
     * @return the number of regular files removed
     */
    public static int deleteRecursively(Path directory) {
        if (directory == null || Files.notExists(directory)) {
            return 0;
        }

        List<Path> paths;
        try (Stream<Path> pathStream = Files.walk(directory)) {
            paths = pathStream.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            logger.warn("Could not list {} for cleanup", directory, e);
            return 0;
        }

        int deletedFiles = 0;
        for (Path path : paths) {
            boolean regularFile = Files.isRegularFile(path);
            if (deleteIfExists(path) && regularFile) {
                deletedFiles++;
            }
        }
        return deletedFiles;
    }

    /**
     * Removes everything below {@code directory} but keeps the directory itself.
     *
     * @return the number of top-level entries removed
     */
    public static int clearDirectory(Path directory) {
        int removedEntries = 0;
        for (Path child : listEntries(directory)) {
            if (Files.isDirectory(child)) {
                deleteRecursively(child);
                if (Files.notExists(child)) {
                    removedEntries++;
                }
            } else if (deleteIfExists(child)) {
                removedEntries++;
            }
        }
        return removedEntries;
    }

    /**
     * Counts the files and job directories directly below {@code directory}.
     */
    public static int countEntries(Path directory) {
        return listEntries(directory).size();
    }

    private static List<Path> listEntries(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> childStream = Files.list(directory)) {
            return childStream.collect(Collectors.toList());
        } catch (IOException e) {
            logger.warn("Could not list {}", directory, e);
            return List.of();
        }
    }

    /**
     * Reduces a user-supplied name to {@code [A-Za-z0-9._-]}, falling back to {@code defaultName}.
     */
    public static String sanitizeFilename(String input, String defaultName) {
        if (input == null) {
            return defaultName;
        }
        String sanitized = input.trim().replaceAll("[^A-Za-z0-9._-]", "_");
        while (sanitized.startsWith(".")) {
            sanitized = sanitized.substring(1);
        }
        return sanitized.isBlank() ? defaultName : sanitized;
    }
}
