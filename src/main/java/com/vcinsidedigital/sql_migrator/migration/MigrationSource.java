package com.vcinsidedigital.sql_migrator.migration;

import com.vcinsidedigital.sql_migrator.exception.MigrationReadException;
import com.vcinsidedigital.sql_migrator.exception.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Discovers migration files in a directory and reads their bodies.
 */
public class MigrationSource {
    private static final Logger logger = LoggerFactory.getLogger(MigrationSource.class);

    /**
     * Orders strings by the unsigned bytes of their UTF-8 encoding.
     */
    public static final Comparator<String> BYTEWISE_ORDER = (a, b) -> Arrays.compareUnsigned(
            a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));

    private final DirectoryLister lister;
    private final String extension;

    public MigrationSource(String extension) {
        this(DirectoryLister.filesystem(), extension);
    }

    public MigrationSource(DirectoryLister lister, String extension) {
        this.lister = Objects.requireNonNull(lister, "lister");
        this.extension = Objects.requireNonNull(extension, "extension");
    }

    /**
     * Keeps the names ending in {@code extension} and sorts them byte-wise ascending.
     */
    public static List<String> selectCandidates(Collection<String> names, String extension) {
        return names.stream()
                .filter(name -> name.endsWith(extension))
                .sorted(BYTEWISE_ORDER)
                .collect(Collectors.toList());
    }

    /**
     * @return candidate migrations in execution order; empty if the directory has none
     * @throws SourceUnavailableException if the directory cannot be listed
     */
    public List<MigrationFile> listCandidates(Path directory) throws SourceUnavailableException {
        List<String> names;
        try {
            names = lister.list(directory);
        } catch (IOException | UncheckedIOException | SecurityException e) {
            throw new SourceUnavailableException(directory, e);
        }

        List<MigrationFile> candidates = selectCandidates(names, extension).stream()
                .map(name -> new MigrationFile(name, directory.resolve(name)))
                .collect(Collectors.toList());
        logger.debug("Found {} migration file(s) in {}", candidates.size(), directory);
        return candidates;
    }

    /**
     * Reads the body of one migration as UTF-8 text.
     */
    public String readBody(MigrationFile file) throws MigrationReadException {
        try {
            return Files.readString(file.getPath(), StandardCharsets.UTF_8);
        } catch (IOException | UncheckedIOException | SecurityException e) {
            throw new MigrationReadException(file.getFilename(), e);
        }
    }

    public String getExtension() {
        return extension;
    }
}
