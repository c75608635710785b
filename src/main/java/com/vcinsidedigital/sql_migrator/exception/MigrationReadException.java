package com.vcinsidedigital.sql_migrator.exception;

/**
 * A migration file vanished or became unreadable between discovery and application.
 */
public class MigrationReadException extends MigrationException {

    public MigrationReadException(String filename, Throwable cause) {
        super("Failed to read " + filename + ": " + cause.getMessage(), filename, cause);
    }
}
