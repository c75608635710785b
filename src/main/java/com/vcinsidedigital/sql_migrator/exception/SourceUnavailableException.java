package com.vcinsidedigital.sql_migrator.exception;

import java.nio.file.Path;

/**
 * The migrations directory is missing or cannot be listed.
 */
public class SourceUnavailableException extends MigrationException {
    private final Path directory;

    public SourceUnavailableException(Path directory, Throwable cause) {
        super("Cannot read migrations directory " + directory + ": " + describe(cause), null, cause);
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
