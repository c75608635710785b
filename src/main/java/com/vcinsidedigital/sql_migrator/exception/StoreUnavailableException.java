package com.vcinsidedigital.sql_migrator.exception;

/**
 * The tracking table could not be created or read.
 */
public class StoreUnavailableException extends MigrationException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
