package com.vcinsidedigital.sql_migrator.exception;

/**
 * Executing a migration body, or recording it in the tracking table, failed.
 * The migration's transaction has been rolled back when this is thrown out of a run.
 */
public class MigrationApplyException extends MigrationException {

    public MigrationApplyException(String filename, Throwable cause) {
        this("Failed to apply " + filename + ": " + cause.getMessage(), filename, cause);
    }

    protected MigrationApplyException(String message, String filename, Throwable cause) {
        super(message, filename, cause);
    }
}
