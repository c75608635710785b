package com.vcinsidedigital.sql_migrator;

import com.vcinsidedigital.sql_migrator.config.ConnectionFactory;
import com.vcinsidedigital.sql_migrator.config.DatabaseConfig;
import com.vcinsidedigital.sql_migrator.config.MigrationSettings;
import com.vcinsidedigital.sql_migrator.exception.MigrationException;
import com.vcinsidedigital.sql_migrator.exception.StoreUnavailableException;
import com.vcinsidedigital.sql_migrator.migration.LoggingMigrationListener;
import com.vcinsidedigital.sql_migrator.migration.MigrationListener;
import com.vcinsidedigital.sql_migrator.migration.MigrationRunner;
import com.vcinsidedigital.sql_migrator.migration.MigrationSource;
import com.vcinsidedigital.sql_migrator.migration.MigrationStatus;
import com.vcinsidedigital.sql_migrator.migration.MigrationStore;
import com.vcinsidedigital.sql_migrator.migration.MigrationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Entry point that owns the database connection for one operation.
 * <p>
 * Each call opens a connection, builds a {@link MigrationRunner} around it and closes the
 * connection again, whatever the outcome.
 */
public class SqlMigrator {
    private static final Logger logger = LoggerFactory.getLogger(SqlMigrator.class);

    private final ConnectionFactory connectionFactory;
    private final MigrationSettings settings;
    private MigrationListener listener = new LoggingMigrationListener();

    public SqlMigrator(DatabaseConfig config, MigrationSettings settings) {
        this(new ConnectionFactory(config), settings);
    }

    public SqlMigrator(ConnectionFactory connectionFactory, MigrationSettings settings) {
        this.connectionFactory = connectionFactory;
        this.settings = settings;
    }

    public SqlMigrator setListener(MigrationListener listener) {
        this.listener = listener;
        return this;
    }

    /**
     * Applies all pending migrations.
     */
    public MigrationSummary migrate() throws MigrationException {
        logger.info("Migrating {} from {}", connectionFactory.getConfig().describe(), settings.getDirectory());
        try (Connection conn = openConnection()) {
            return createRunner(conn).run();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to close connection: " + e.getMessage(), e);
        }
    }

    /**
     * Lists applied and pending migrations without changing anything but the tracking table's existence.
     */
    public MigrationStatus status() throws MigrationException {
        try (Connection conn = openConnection()) {
            return createRunner(conn).status();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to close connection: " + e.getMessage(), e);
        }
    }

    private MigrationRunner createRunner(Connection conn) {
        MigrationStore store = new MigrationStore(conn, settings.getTableName(),
                connectionFactory.getConfig().getType());
        MigrationSource source = new MigrationSource(settings.getExtension());
        return new MigrationRunner(conn, store, source, settings.getDirectory(), listener);
    }

    private Connection openConnection() throws StoreUnavailableException {
        try {
            return connectionFactory.openConnection();
        } catch (SQLException e) {
            throw new StoreUnavailableException(
                    "Cannot connect to " + connectionFactory.getConfig().describe() + ": " + e.getMessage(), e);
        }
    }
}
