package com.vcinsidedigital.sql_migrator.migration;

import java.util.List;

/**
 * Read-only snapshot of applied records and pending files.
 */
public final class MigrationStatus {
    private final List<MigrationRecord> applied;
    private final List<MigrationFile> pending;

    public MigrationStatus(List<MigrationRecord> applied, List<MigrationFile> pending) {
        this.applied = List.copyOf(applied);
        this.pending = List.copyOf(pending);
    }

    public List<MigrationRecord> getApplied() {
        return applied;
    }

    public List<MigrationFile> getPending() {
        return pending;
    }

    public boolean isUpToDate() {
        return pending.isEmpty();
    }
}
