package org.codeaudit.runner;

import org.codeaudit.sections.PatternRegistry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Utility for collecting Elixir source files from paths.
 */
public final class FileCollector {

    private FileCollector() {}

    /**
     * Collect source files from a list of paths (files or directories).
     * Directories are scanned recursively; files excluded by the context are skipped.
     *
     * @param paths        List of paths to collect from
     * @param context      Context providing exclusion globs
     * @param errorHandler Handler for errors during collection
     * @return Sorted list of source file paths
     */
    public static List<Path> collectSourceFiles(List<Path> paths, AuditContext context, Consumer<String> errorHandler) {
        var files = new ArrayList<Path>();

        for (var path : paths) {
            if (!Files.exists(path)) {
                errorHandler.accept("Path does not exist: " + path);
            } else if (Files.isDirectory(path)) {
                collectFromDirectory(path, files, errorHandler);
            } else if (isSourceFile(path)) {
                files.add(path);
            }
        }

        return files.stream()
                    .filter(context::shouldScan)
                    .distinct()
                    .sorted()
                    .toList();
    }

    private static void collectFromDirectory(Path directory, List<Path> files, Consumer<String> errorHandler) {
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.filter(Files::isRegularFile)
                .filter(FileCollector::isSourceFile)
                .forEach(files::add);
        } catch (IOException | UncheckedIOException e) {
            errorHandler.accept("Error scanning " + directory + ": " + e.getMessage());
        }
    }

    private static boolean isSourceFile(Path path) {
        return PatternRegistry.isSourceFile(path.getFileName()
                                                .toString());
    }
}
