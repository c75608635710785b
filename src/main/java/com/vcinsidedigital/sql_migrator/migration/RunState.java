package com.vcinsidedigital.sql_migrator.migration;

/**
 * Lifecycle of a single {@link MigrationRunner#run()}.
 */
public enum RunState {
    IDLE,
    SCHEMA_READY,
    SCANNING,
    APPLYING,
    COMMITTED,
    ROLLED_BACK,
    DONE,
    FAILED
}
