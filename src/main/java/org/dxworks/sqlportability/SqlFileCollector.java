package org.dxworks.sqlportability;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Enumerates the SQL model files under a set of roots.
 */
public final class SqlFileCollector {

    private static final String SQL_EXTENSION = ".sql";

    private SqlFileCollector() {
        // utility class
    }

    public static List<Path> collect(List<Path> roots) {
        List<Path> files = new ArrayList<>();
        for (Path root : roots) {
            files.addAll(collect(root));
        }
        return files;
    }

    /**
     * @return every {@code *.sql} regular file under {@code root}, sorted; nothing for a missing root
     */
    public static List<Path> collect(Path root) {
        if (root == null || !Files.exists(root)) {
            return List.of();
        }
        if (Files.isRegularFile(root)) {
            return isSqlFile(root) ? List.of(root) : List.of();
        }

        try (Stream<Path> stream = Files.walk(root)) {
            return stream.filter(Files::isRegularFile)
                    .filter(SqlFileCollector::isSqlFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            System.err.println("[SqlFileCollector] Failed to list " + root + ": " + e.getMessage());
            return List.of();
        }
    }

    static boolean isSqlFile(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(SQL_EXTENSION);
    }
}
