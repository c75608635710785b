package com.vcinsidedigital.sql_migrator.migration;

import java.time.Instant;

/**
 * One row of the tracking table.
 */
public final class MigrationRecord {
    private final String filename;
    private final Instant appliedAt;

    public MigrationRecord(String filename, Instant appliedAt) {
        this.filename = filename;
        this.appliedAt = appliedAt;
    }

    public String getFilename() {
        return filename;
    }

    public Instant getAppliedAt() {
        return appliedAt;
    }

    @Override
    public String toString() {
        return filename + " @ " + appliedAt;
    }
}
