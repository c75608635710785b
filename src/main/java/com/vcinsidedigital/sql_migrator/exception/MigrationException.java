package com.vcinsidedigital.sql_migrator.exception;

/**
 * Base type for every failure that aborts a migration run.
 * <p>
 * Subclasses that concern one migration file expose its name through {@link #getFilename()};
 * for the others it is {@code null}.
 */
public abstract class MigrationException extends Exception {
    private final String filename;

    protected MigrationException(String message, String filename, Throwable cause) {
        super(message, cause);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
