package com.vcinsidedigital.sql_migrator.migration;

import java.util.List;

/**
 * Outcome of a successful run.
 */
public final class MigrationSummary {
    private final int totalCandidates;
    private final int alreadyApplied;
    private final List<String> appliedFilenames;

    public MigrationSummary(int totalCandidates, int alreadyApplied, List<String> appliedFilenames) {
        this.totalCandidates = totalCandidates;
        this.alreadyApplied = alreadyApplied;
        this.appliedFilenames = List.copyOf(appliedFilenames);
    }

    public int getTotalCandidates() {
        return totalCandidates;
    }

    public int getAlreadyApplied() {
        return alreadyApplied;
    }

    public int getNewlyApplied() {
        return appliedFilenames.size();
    }

    /**
     * Filenames applied by this run, in application order.
     */
    public List<String> getAppliedFilenames() {
        return appliedFilenames;
    }

    public boolean isUpToDate() {
        return appliedFilenames.isEmpty();
    }

    @Override
    public String toString() {
        return "MigrationSummary{total=" + totalCandidates
                + ", alreadyApplied=" + alreadyApplied
                + ", newlyApplied=" + getNewlyApplied() + "}";
    }
}
