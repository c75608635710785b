package com.vcinsidedigital.sql_migrator.migration;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A candidate migration on disk. Identity is the filename; the body is read at apply time.
 */
public final class MigrationFile {
    private final String filename;
    private final Path path;

    public MigrationFile(String filename, Path path) {
        this.filename = Objects.requireNonNull(filename, "filename");
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath();
    }

    public String getFilename() {
        return filename;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MigrationFile)) return false;
        return filename.equals(((MigrationFile) o).filename);
    }

    @Override
    public int hashCode() {
        return filename.hashCode();
    }

    @Override
    public String toString() {
        return filename;
    }
}
