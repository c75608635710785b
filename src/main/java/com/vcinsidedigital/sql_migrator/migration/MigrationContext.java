package com.vcinsidedigital.sql_migrator.migration;

import com.vcinsidedigital.sql_migrator.config.DatabaseConfig.DatabaseType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Executes the statements of one migration inside its open transaction.
 */
public class MigrationContext {
    private static final Logger logger = LoggerFactory.getLogger(MigrationContext.class);

    private final Connection connection;
    private final String filename;
    private final DatabaseType dbType;

    public MigrationContext(Connection connection, String filename, DatabaseType dbType) {
        this.connection = connection;
        this.filename = filename;
        this.dbType = dbType;
    }

    public void execute(String sql) throws SQLException {
        logger.debug("[{}] SQL: {}", filename, sql);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        }
    }

    /**
     * Splits {@code body} with {@link SqlScriptParser} and executes the statements in order.
     * MySQL scripts are split with backslash escapes in string literals.
     *
     * @return number of statements executed
     */
    public int executeScript(String body) throws SQLException {
        List<String> statements = SqlScriptParser.split(body, dbType == DatabaseType.MYSQL);
        for (String sql : statements) {
            execute(sql);
        }
        return statements.size();
    }

    public Connection getConnection() {
        return connection;
    }

    public DatabaseType getDbType() {
        return dbType;
    }

    public String getFilename() {
        return filename;
    }
}
