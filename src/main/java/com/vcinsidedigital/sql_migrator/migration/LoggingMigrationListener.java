package com.vcinsidedigital.sql_migrator.migration;

import com.vcinsidedigital.sql_migrator.exception.MigrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Reports a run through SLF4J in console-friendly form.
 */
public class LoggingMigrationListener implements MigrationListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingMigrationListener.class);
    private static final String RULE = "================================";

    @Override
    public void onSchemaReady(String tableName) {
        logger.info("✓ Migrations tracking table '{}' ready", tableName);
    }

    @Override
    public void onScanned(int totalCandidates, int alreadyApplied, int pending) {
        logger.debug("{} candidate(s), {} already applied, {} pending", totalCandidates, alreadyApplied, pending);
    }

    @Override
    public void onSkipped(MigrationFile file) {
        logger.info("⊘ {} (already applied)", file.getFilename());
    }

    @Override
    public void onApplying(MigrationFile file) {
        logger.info("→ Applying {}...", file.getFilename());
    }

    @Override
    public void onApplied(MigrationFile file, Duration elapsed) {
        logger.info("✓ {} applied successfully ({} ms)", file.getFilename(), elapsed.toMillis());
    }

    @Override
    public void onFailed(MigrationFile file, MigrationException error) {
        if (file != null) {
            logger.error("✗ {} failed, transaction rolled back: {}", file.getFilename(), error.getMessage());
        } else {
            logger.error("✗ Migration run aborted: {}", error.getMessage());
        }
    }

    @Override
    public void onCompleted(MigrationSummary summary) {
        logger.info(RULE);
        logger.info("Migration Summary:");
        logger.info("  Total migrations: {}", summary.getTotalCandidates());
        logger.info("  Already applied: {}", summary.getAlreadyApplied());
        logger.info("  Newly applied: {}", summary.getNewlyApplied());
        logger.info(RULE);
        if (summary.isUpToDate()) {
            logger.info("✓ Database is up to date - no new migrations to apply");
        } else {
            logger.info("✓ Database migration completed successfully");
        }
    }
}
