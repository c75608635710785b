package com.vcinsidedigital.sql_migrator.exception;

/**
 * The tracking table already holds a record for the migration being applied,
 * usually because another runner got there first.
 */
public class DuplicateRecordException extends MigrationApplyException {

    public DuplicateRecordException(String filename, Throwable cause) {
        super("Migration " + filename + " is already recorded as applied", filename, cause);
    }
}
