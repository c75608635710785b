package com.vcinsidedigital.sql_migrator.config;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

public class DatabaseConfig {
    private static final Pattern PASSWORD_PROPERTY = Pattern.compile("(?i);\\s*password\\s*=[^;]*");

    private DatabaseType type;
    private String host;
    private int port;
    private String database;
    private String username;
    private String password;
    private String filePath; // SQLite only
    private String instance; // SQL Server named instances
    private String rawUrl;

    private DatabaseConfig() {}

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a configuration from environment variables.
     * <p>
     * {@code DATABASE_URL} wins when present, then {@code SQLITE_PATH}; otherwise a PostgreSQL
     * connection is described by {@code POSTGRES_HOST}, {@code POSTGRES_PORT}, {@code POSTGRES_DB},
     * {@code POSTGRES_USER} and {@code POSTGRES_PASSWORD}.
     *
     * @param env variables to read, usually {@link System#getenv()}
     * @return the configuration
     */
    public static DatabaseConfig fromEnvironment(Map<String, String> env) {
        Builder builder = builder();
        String url = env.get("DATABASE_URL");
        String sqlitePath = env.get("SQLITE_PATH");

        if (url != null && !url.isBlank()) {
            builder.url(url);
        } else if (sqlitePath != null && !sqlitePath.isBlank()) {
            return builder.sqlite(sqlitePath).build();
        } else {
            String port = env.getOrDefault("POSTGRES_PORT", "5432");
            try {
                builder.postgresql(
                        env.getOrDefault("POSTGRES_HOST", "localhost"),
                        Integer.parseInt(port.trim()),
                        env.getOrDefault("POSTGRES_DB", "postgres"));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("POSTGRES_PORT is not a number: " + port, e);
            }
            builder.credentials(env.getOrDefault("POSTGRES_USER", "postgres"), env.get("POSTGRES_PASSWORD"));
            return builder.build();
        }

        String user = env.get("DATABASE_USER");
        if (user != null) {
            builder.credentials(user, env.get("DATABASE_PASSWORD"));
        }
        return builder.build();
    }

    public String getJdbcUrl() {
        if (rawUrl != null) {
            return rawUrl;
        }
        return switch (type) {
            case MYSQL -> String.format("jdbc:mysql://%s:%d/%s?useSSL=false&serverTimezone=UTC",
                    host, port, database);
            case SQLITE -> String.format("jdbc:sqlite:%s", filePath);
            case POSTGRESQL -> String.format("jdbc:postgresql://%s:%d/%s",
                    host, port, database);
            case SQLSERVER -> {
                StringBuilder url = new StringBuilder("jdbc:sqlserver://");
                url.append(host);
                if (instance != null && !instance.isEmpty()) {
                    url.append("\\").append(instance);
                }
                url.append(":").append(port);
                url.append(";databaseName=").append(database);
                url.append(";encrypt=false;trustServerCertificate=true");
                yield url.toString();
            }
        };
    }

    public String getDriverClassName() {
        return type.getDriverClassName();
    }

    /**
     * Renders the connection target without credentials, for log output.
     * Drops the query string, any {@code user:password@} part and SQL Server {@code ;password=} properties.
     */
    public String describe() {
        if (type == DatabaseType.SQLITE && filePath != null) {
            return "sqlite:" + filePath;
        }
        String url = getJdbcUrl();
        int query = url.indexOf('?');
        if (query >= 0) {
            url = url.substring(0, query);
        }
        int authority = url.indexOf("//");
        if (authority >= 0) {
            int start = authority + 2;
            int end = start;
            while (end < url.length() && url.charAt(end) != '/' && url.charAt(end) != ';') {
                end++;
            }
            int at = url.lastIndexOf('@', end - 1);
            if (at >= start) {
                url = url.substring(0, start) + url.substring(at + 1);
            }
        }
        return PASSWORD_PROPERTY.matcher(url).replaceAll("");
    }

    public DatabaseType getType() { return type; }
    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getDatabase() { return database; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public String getFilePath() { return filePath; }
    public String getInstance() { return instance; }

    public static class Builder {
        private final DatabaseConfig config = new DatabaseConfig();

        public Builder mysql(String host, int port, String database) {
            return server(DatabaseType.MYSQL, host, port, database);
        }

        public Builder sqlite(String filePath) {
            config.type = DatabaseType.SQLITE;
            config.filePath = filePath;
            return this;
        }

        public Builder postgresql(String host, int port, String database) {
            return server(DatabaseType.POSTGRESQL, host, port, database);
        }

        public Builder sqlserver(String host, int port, String database) {
            return server(DatabaseType.SQLSERVER, host, port, database);
        }

        /**
         * SQL Server on its default port (1433).
         */
        public Builder sqlserver(String host, String database) {
            return sqlserver(host, 1433, database);
        }

        /**
         * Named SQL Server instance, e.g. SQLEXPRESS.
         */
        public Builder instance(String instance) {
            config.instance = instance;
            return this;
        }

        /**
         * Uses a complete JDBC URL as is; the database type is taken from its subprotocol.
         */
        public Builder url(String jdbcUrl) {
            config.type = DatabaseType.fromJdbcUrl(jdbcUrl);
            config.rawUrl = jdbcUrl;
            return this;
        }

        public Builder credentials(String username, String password) {
            config.username = username;
            config.password = password;
            return this;
        }

        public DatabaseConfig build() {
            if (config.type == null) {
                throw new IllegalStateException("Database type not specified");
            }
            return config;
        }

        private Builder server(DatabaseType type, String host, int port, String database) {
            config.type = type;
            config.host = host;
            config.port = port;
            config.database = database;
            return this;
        }
    }

    public enum DatabaseType {
        MYSQL("com.mysql.cj.jdbc.Driver", "jdbc:mysql:", "mysql"),
        SQLITE("org.sqlite.JDBC", "jdbc:sqlite:", "sqlite"),
        POSTGRESQL("org.postgresql.Driver", "jdbc:postgresql:", "postgresql"),
        SQLSERVER("com.microsoft.sqlserver.jdbc.SQLServerDriver", "jdbc:sqlserver:", "microsoft sql server");

        private final String driverClassName;
        private final String urlPrefix;
        private final String productName;

        DatabaseType(String driverClassName, String urlPrefix, String productName) {
            this.driverClassName = driverClassName;
            this.urlPrefix = urlPrefix;
            this.productName = productName;
        }

        public String getDriverClassName() {
            return driverClassName;
        }

        public static DatabaseType fromJdbcUrl(String jdbcUrl) {
            if (jdbcUrl != null) {
                String lower = jdbcUrl.toLowerCase(Locale.ROOT);
                for (DatabaseType type : values()) {
                    if (lower.startsWith(type.urlPrefix)) {
                        return type;
                    }
                }
            }
            throw new IllegalArgumentException("Unsupported JDBC URL: " + jdbcUrl);
        }

        /**
         * Maps {@link java.sql.DatabaseMetaData#getDatabaseProductName()} to a type.
         * MariaDB is treated as MySQL.
         */
        public static DatabaseType fromProductName(String productName) {
            if (productName != null) {
                String lower = productName.toLowerCase(Locale.ROOT);
                if (lower.contains("mariadb")) {
                    return MYSQL;
                }
                for (DatabaseType type : values()) {
                    if (lower.contains(type.productName)) {
                        return type;
                    }
                }
            }
            throw new IllegalArgumentException("Unsupported database product: " + productName);
        }
    }
}
