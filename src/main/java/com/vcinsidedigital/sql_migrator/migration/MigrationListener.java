package com.vcinsidedigital.sql_migrator.migration;

import com.vcinsidedigital.sql_migrator.exception.MigrationException;

import java.time.Duration;

/**
 * Receives progress of a migration run. All callbacks default to no-ops.
 */
public interface MigrationListener {

    MigrationListener NONE = new MigrationListener() {};

    default void onSchemaReady(String tableName) {}

    default void onScanned(int totalCandidates, int alreadyApplied, int pending) {}

    default void onSkipped(MigrationFile file) {}

    default void onApplying(MigrationFile file) {}

    default void onApplied(MigrationFile file, Duration elapsed) {}

    /**
     * Called once when the run aborts. {@code file} is null when the failure happened
     * before any migration was attempted.
     */
    default void onFailed(MigrationFile file, MigrationException error) {}

    default void onCompleted(MigrationSummary summary) {}
}
