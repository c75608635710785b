package com.vcinsidedigital.sql_migrator.migration;

import com.vcinsidedigital.sql_migrator.config.DatabaseConfig.DatabaseType;
import com.vcinsidedigital.sql_migrator.config.MigrationSettings;
import com.vcinsidedigital.sql_migrator.exception.DuplicateRecordException;
import com.vcinsidedigital.sql_migrator.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Tracking table of applied migrations, kept inside the database being migrated.
 * <p>
 * The store never manages transactions itself: every call runs on the connection it was given,
 * so {@link #recordApplied(String)} joins whatever transaction the caller has open.
 * Records are append-only.
 */
public class MigrationStore {
    private static final Logger logger = LoggerFactory.getLogger(MigrationStore.class);

    // SQLITE_CONSTRAINT primary result code
    private static final int SQLITE_CONSTRAINT = 19;
    private static final int MYSQL_DUPLICATE_ENTRY = 1062;
    private static final int SQLSERVER_UNIQUE_INDEX = 2601;
    private static final int SQLSERVER_UNIQUE_CONSTRAINT = 2627;

    private final Connection connection;
    private final String tableName;
    private final DatabaseType dbType;
    private final Clock clock;

    public MigrationStore(Connection connection, String tableName, DatabaseType dbType) {
        this(connection, tableName, dbType, Clock.systemUTC());
    }

    public MigrationStore(Connection connection, String tableName, DatabaseType dbType, Clock clock) {
        if (!MigrationSettings.isValidTableName(tableName)) {
            throw new IllegalArgumentException("Invalid tracking table name: " + tableName);
        }
        this.connection = Objects.requireNonNull(connection, "connection");
        this.tableName = tableName;
        this.dbType = Objects.requireNonNull(dbType, "dbType");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates a store whose dialect is detected from the connection's metadata.
     *
     * @throws StoreUnavailableException if the metadata cannot be read
     * @throws IllegalArgumentException if the database product is not supported
     */
    public static MigrationStore forConnection(Connection connection, String tableName)
            throws StoreUnavailableException {
        try {
            String product = connection.getMetaData().getDatabaseProductName();
            return new MigrationStore(connection, tableName, DatabaseType.fromProductName(product));
        } catch (SQLException e) {
            throw new StoreUnavailableException("Cannot determine database type: " + e.getMessage(), e);
        }
    }

    /**
     * Creates the tracking table if it does not exist yet.
     */
    public void ensureSchema() throws StoreUnavailableException {
        String sql = createTableSql();
        logger.debug("SQL: {}", sql);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        } catch (SQLException e) {
            throw new StoreUnavailableException(
                    "Cannot create tracking table '" + tableName + "': " + e.getMessage(), e);
        }
    }

    /**
     * @return filenames currently recorded as applied, in no particular order
     */
    public Set<String> listApplied() throws StoreUnavailableException {
        Set<String> filenames = new HashSet<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT filename FROM " + tableName)) {
            while (rs.next()) {
                filenames.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException(
                    "Cannot read tracking table '" + tableName + "': " + e.getMessage(), e);
        }
        return filenames;
    }

    /**
     * @return every record, oldest first
     */
    public List<MigrationRecord> listRecords() throws StoreUnavailableException {
        List<MigrationRecord> records = new ArrayList<>();
        String sql = "SELECT filename, applied_at FROM " + tableName + " ORDER BY applied_at, id";
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                Timestamp appliedAt = rs.getTimestamp(2);
                records.add(new MigrationRecord(rs.getString(1),
                        appliedAt != null ? appliedAt.toInstant() : null));
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException(
                    "Cannot read tracking table '" + tableName + "': " + e.getMessage(), e);
        }
        return records;
    }

    /**
     * Inserts a record for {@code filename} stamped with the store clock's current instant.
     *
     * @throws DuplicateRecordException if the filename is already recorded
     * @throws SQLException for any other database failure
     */
    public Instant recordApplied(String filename) throws DuplicateRecordException, SQLException {
        Instant now = clock.instant();
        String sql = "INSERT INTO " + tableName + " (filename, applied_at) VALUES (?, ?)";
        try (PreparedStatement pstmt = connection.prepareStatement(sql)) {
            pstmt.setString(1, filename);
            pstmt.setTimestamp(2, Timestamp.from(now));
            pstmt.executeUpdate();
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                throw new DuplicateRecordException(filename, e);
            }
            throw e;
        }
        return now;
    }

    public String getTableName() {
        return tableName;
    }

    public DatabaseType getDbType() {
        return dbType;
    }

    String createTableSql() {
        return switch (dbType) {
            case SQLITE -> "CREATE TABLE IF NOT EXISTS " + tableName + " (\n" +
                    "    id INTEGER PRIMARY KEY AUTOINCREMENT,\n" +
                    "    filename TEXT NOT NULL UNIQUE,\n" +
                    "    applied_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP\n" +
                    ")";
            case POSTGRESQL -> "CREATE TABLE IF NOT EXISTS " + tableName + " (\n" +
                    "    id SERIAL PRIMARY KEY,\n" +
                    "    filename VARCHAR(255) NOT NULL UNIQUE,\n" +
                    "    applied_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP\n" +
                    ")";
            case MYSQL -> "CREATE TABLE IF NOT EXISTS " + tableName + " (\n" +
                    "    id INT AUTO_INCREMENT PRIMARY KEY,\n" +
                    "    filename VARCHAR(255) NOT NULL UNIQUE,\n" +
                    "    applied_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP\n" +
                    ")";
            case SQLSERVER -> "IF OBJECT_ID(N'" + tableName + "', N'U') IS NULL\n" +
                    "CREATE TABLE " + tableName + " (\n" +
                    "    id INT IDENTITY(1,1) PRIMARY KEY,\n" +
                    "    filename NVARCHAR(255) NOT NULL UNIQUE,\n" +
                    "    applied_at DATETIME2 NOT NULL DEFAULT SYSUTCDATETIME()\n" +
                    ")";
        };
    }

    static boolean isUniqueViolation(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            if (current instanceof SQLIntegrityConstraintViolationException) {
                return true;
            }
            String state = current.getSQLState();
            if (state != null && state.startsWith("23")) {
                return true;
            }
            int code = current.getErrorCode();
            if (code == SQLITE_CONSTRAINT || code == MYSQL_DUPLICATE_ENTRY
                    || code == SQLSERVER_UNIQUE_INDEX || code == SQLSERVER_UNIQUE_CONSTRAINT) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && message.toUpperCase(Locale.ROOT).contains("UNIQUE CONSTRAINT")) {
                return true;
            }
        }
        return false;
    }
}
