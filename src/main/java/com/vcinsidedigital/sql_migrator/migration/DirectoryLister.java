package com.vcinsidedigital.sql_migrator.migration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the entry names of a directory.
 */
@FunctionalInterface
public interface DirectoryLister {

    List<String> list(Path directory) throws IOException;

    /**
     * Regular files directly inside the directory; subdirectories are skipped.
     */
    static DirectoryLister filesystem() {
        return directory -> {
            try (Stream<Path> entries = Files.list(directory)) {
                return entries
                        .filter(Files::isRegularFile)
                        .map(p -> p.getFileName().toString())
                        .collect(Collectors.toList());
            }
        };
    }
}
