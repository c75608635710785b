package com.vcinsidedigital.sql_migrator.migration;

import com.vcinsidedigital.sql_migrator.exception.DuplicateRecordException;
import com.vcinsidedigital.sql_migrator.exception.MigrationApplyException;
import com.vcinsidedigital.sql_migrator.exception.MigrationException;
import com.vcinsidedigital.sql_migrator.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies pending migrations from a directory, one transaction per migration.
 * <p>
 * Migrations run strictly in ascending filename order. The first failure rolls back that
 * migration and aborts the run; migrations committed before it stay applied. The connection
 * belongs to the caller and is never closed here. Instances are not thread-safe, and only one
 * runner may work against a database at a time since no lock is taken.
 */
public class MigrationRunner {
    private static final Logger logger = LoggerFactory.getLogger(MigrationRunner.class);

    private final Connection connection;
    private final MigrationStore store;
    private final MigrationSource source;
    private final Path directory;
    private final MigrationListener listener;

    private RunState state = RunState.IDLE;

    public MigrationRunner(Connection connection, MigrationStore store, MigrationSource source, Path directory) {
        this(connection, store, source, directory, MigrationListener.NONE);
    }

    public MigrationRunner(Connection connection, MigrationStore store, MigrationSource source,
                           Path directory, MigrationListener listener) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.store = Objects.requireNonNull(store, "store");
        this.source = Objects.requireNonNull(source, "source");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Applies every pending migration.
     *
     * @return counts of candidates, skipped and newly applied migrations
     * @throws MigrationException on the first failure; nothing after it is attempted
     * @throws RuntimeException when the listener throws; the run stops in {@link RunState#FAILED}
     */
    public MigrationSummary run() throws MigrationException {
        state = RunState.IDLE;
        MigrationFile current = null;
        try {
            prepareSchema();
            state = RunState.SCHEMA_READY;
            listener.onSchemaReady(store.getTableName());

            Set<String> applied = store.listApplied();
            List<MigrationFile> candidates = source.listCandidates(directory);
            state = RunState.SCANNING;

            List<MigrationFile> pending = new ArrayList<>();
            int alreadyApplied = 0;
            for (MigrationFile candidate : candidates) {
                if (applied.contains(candidate.getFilename())) {
                    alreadyApplied++;
                    listener.onSkipped(candidate);
                } else {
                    pending.add(candidate);
                }
            }
            listener.onScanned(candidates.size(), alreadyApplied, pending.size());

            List<String> appliedNow = new ArrayList<>();
            for (MigrationFile file : pending) {
                current = file;
                apply(file);
                appliedNow.add(file.getFilename());
            }

            MigrationSummary summary = new MigrationSummary(candidates.size(), alreadyApplied, appliedNow);
            state = RunState.DONE;
            listener.onCompleted(summary);
            return summary;
        } catch (MigrationException e) {
            state = RunState.FAILED;
            listener.onFailed(current, e);
            throw e;
        } catch (RuntimeException e) {
            // thrown by a listener; whatever was committed before it stays applied
            state = RunState.FAILED;
            logger.error("Migration run aborted{}", current != null ? " at " + current.getFilename() : "", e);
            throw e;
        }
    }

    /**
     * Reports applied records and pending files without applying anything.
     * Creates the tracking table if needed.
     */
    public MigrationStatus status() throws MigrationException {
        prepareSchema();
        List<MigrationRecord> records = store.listRecords();
        Set<String> applied = records.stream()
                .map(MigrationRecord::getFilename)
                .collect(Collectors.toSet());
        List<MigrationFile> pending = source.listCandidates(directory).stream()
                .filter(file -> !applied.contains(file.getFilename()))
                .collect(Collectors.toList());
        return new MigrationStatus(records, pending);
    }

    public RunState getState() {
        return state;
    }

    private void apply(MigrationFile file) throws MigrationException {
        state = RunState.APPLYING;
        listener.onApplying(file);

        String body = source.readBody(file);
        long started = System.nanoTime();

        boolean autoCommit;
        try {
            autoCommit = beginTransaction();
        } catch (SQLException e) {
            throw new MigrationApplyException(file.getFilename(), e);
        }

        try {
            MigrationContext context = new MigrationContext(connection, file.getFilename(), store.getDbType());
            int statements = context.executeScript(body);
            store.recordApplied(file.getFilename());
            connection.commit();
            state = RunState.COMMITTED;
            logger.debug("{}: {} statement(s) committed", file.getFilename(), statements);
        } catch (DuplicateRecordException e) {
            rollback(e);
            throw e;
        } catch (SQLException | RuntimeException e) {
            MigrationApplyException failure = new MigrationApplyException(file.getFilename(), e);
            rollback(failure);
            throw failure;
        } finally {
            restoreAutoCommit(autoCommit);
        }

        listener.onApplied(file, Duration.ofNanos(System.nanoTime() - started));
    }

    private void prepareSchema() throws StoreUnavailableException {
        boolean autoCommit;
        try {
            autoCommit = beginTransaction();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Cannot begin transaction: " + e.getMessage(), e);
        }

        try {
            store.ensureSchema();
            connection.commit();
        } catch (StoreUnavailableException e) {
            rollback(e);
            throw e;
        } catch (SQLException e) {
            StoreUnavailableException failure = new StoreUnavailableException(
                    "Cannot commit tracking table creation: " + e.getMessage(), e);
            rollback(failure);
            throw failure;
        } finally {
            restoreAutoCommit(autoCommit);
        }
    }

    /**
     * @return the auto-commit mode to restore afterwards
     */
    private boolean beginTransaction() throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        return autoCommit;
    }

    private void rollback(MigrationException failure) {
        try {
            connection.rollback();
            if (state == RunState.APPLYING) {
                state = RunState.ROLLED_BACK;
            }
        } catch (SQLException e) {
            logger.error("Rollback failed", e);
            failure.addSuppressed(e);
        }
    }

    private void restoreAutoCommit(boolean autoCommit) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            logger.warn("Could not restore auto-commit mode: {}", e.getMessage());
        }
    }
}
