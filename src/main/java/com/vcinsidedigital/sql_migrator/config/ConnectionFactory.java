package com.vcinsidedigital.sql_migrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens JDBC connections for a {@link DatabaseConfig}.
 * <p>
 * Every call returns a new connection owned by the caller, who must close it.
 */
public class ConnectionFactory {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionFactory.class);

    private final DatabaseConfig config;
    private boolean driverLoaded = false;

    public ConnectionFactory(DatabaseConfig config) {
        this.config = config;
    }

    public Connection openConnection() throws SQLException {
        loadDriver();

        String url = config.getJdbcUrl();
        Connection conn;
        if (config.getUsername() != null) {
            conn = DriverManager.getConnection(url, config.getUsername(), config.getPassword());
        } else {
            conn = DriverManager.getConnection(url);
        }

        logger.debug("Opened connection to {}", config.describe());
        return conn;
    }

    public DatabaseConfig getConfig() {
        return config;
    }

    private void loadDriver() throws SQLException {
        if (driverLoaded) {
            return;
        }
        try {
            Class.forName(config.getDriverClassName());
            driverLoaded = true;
        } catch (ClassNotFoundException e) {
            throw new SQLException("JDBC driver not found on classpath: " + config.getDriverClassName(), e);
        }
    }
}
