package com.vcinsidedigital.sql_migrator.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vcinsidedigital.sql_migrator.config.DatabaseConfig.DatabaseType;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DatabaseConfig")
class DatabaseConfigTest {

    @Nested
    @DisplayName("builder")
    class Building {

        @Test
        @DisplayName("builds JDBC URLs per database type")
        void jdbcUrls() {
            assertThat(DatabaseConfig.builder().sqlite("app.db").build().getJdbcUrl())
                    .isEqualTo("jdbc:sqlite:app.db");
            assertThat(DatabaseConfig.builder().postgresql("db", 5432, "jobs").build().getJdbcUrl())
                    .isEqualTo("jdbc:postgresql://db:5432/jobs");
            assertThat(DatabaseConfig.builder().mysql("db", 3306, "jobs").build().getJdbcUrl())
                    .startsWith("jdbc:mysql://db:3306/jobs?");
            assertThat(DatabaseConfig.builder().sqlserver("db", "jobs").instance("SQLEXPRESS").build().getJdbcUrl())
                    .startsWith("jdbc:sqlserver://db\\SQLEXPRESS:1433;databaseName=jobs");
        }

        @Test
        @DisplayName("raw URL keeps its text and infers the type")
        void rawUrl() {
            DatabaseConfig config = DatabaseConfig.builder().url("jdbc:postgresql://h:6543/x?ssl=true").build();

            assertThat(config.getType()).isEqualTo(DatabaseType.POSTGRESQL);
            assertThat(config.getJdbcUrl()).isEqualTo("jdbc:postgresql://h:6543/x?ssl=true");
            assertThat(config.describe()).isEqualTo("jdbc:postgresql://h:6543/x");
        }

        @Test
        @DisplayName("describe hides credentials carried inside the URL")
        void describeHidesCredentials() {
            assertThat(DatabaseConfig.builder().url("jdbc:mysql://app:s3cret@db:3306/jobs?useSSL=false").build()
                    .describe()).isEqualTo("jdbc:mysql://db:3306/jobs");
            assertThat(DatabaseConfig.builder()
                    .url("jdbc:sqlserver://db:1433;databaseName=jobs;user=sa;Password=s3cret;encrypt=false").build()
                    .describe()).isEqualTo("jdbc:sqlserver://db:1433;databaseName=jobs;user=sa;encrypt=false");
            assertThat(DatabaseConfig.builder().url("jdbc:postgresql://db/jobs?user=app&password=s3cret").build()
                    .describe()).isEqualTo("jdbc:postgresql://db/jobs");
        }

        @Test
        @DisplayName("missing type fails")
        void missingType() {
            assertThatThrownBy(() -> DatabaseConfig.builder().credentials("u", "p").build())
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("unsupported URL fails")
        void unsupportedUrl() {
            assertThatThrownBy(() -> DatabaseConfig.builder().url("jdbc:oracle:thin:@h:1521:x"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("fromEnvironment")
    class FromEnvironment {

        @Test
        @DisplayName("defaults to a local PostgreSQL")
        void postgresDefaults() {
            DatabaseConfig config = DatabaseConfig.fromEnvironment(Map.of());

            assertThat(config.getType()).isEqualTo(DatabaseType.POSTGRESQL);
            assertThat(config.getJdbcUrl()).isEqualTo("jdbc:postgresql://localhost:5432/postgres");
            assertThat(config.getUsername()).isEqualTo("postgres");
            assertThat(config.getPassword()).isNull();
        }

        @Test
        @DisplayName("reads POSTGRES_* variables")
        void postgresVariables() {
            DatabaseConfig config = DatabaseConfig.fromEnvironment(Map.of(
                    "POSTGRES_HOST", "db.internal",
                    "POSTGRES_PORT", "6432",
                    "POSTGRES_DB", "jobseeker",
                    "POSTGRES_USER", "jobseeker",
                    "POSTGRES_PASSWORD", "secret"));

            assertThat(config.getJdbcUrl()).isEqualTo("jdbc:postgresql://db.internal:6432/jobseeker");
            assertThat(config.getUsername()).isEqualTo("jobseeker");
            assertThat(config.getPassword()).isEqualTo("secret");
        }

        @Test
        @DisplayName("DATABASE_URL takes precedence over SQLITE_PATH")
        void databaseUrlFirst() {
            DatabaseConfig config = DatabaseConfig.fromEnvironment(Map.of(
                    "DATABASE_URL", "jdbc:mysql://db:3306/app",
                    "SQLITE_PATH", "ignored.db",
                    "DATABASE_USER", "root"));

            assertThat(config.getType()).isEqualTo(DatabaseType.MYSQL);
            assertThat(config.getUsername()).isEqualTo("root");
        }

        @Test
        @DisplayName("SQLITE_PATH selects SQLite")
        void sqlitePath() {
            DatabaseConfig config = DatabaseConfig.fromEnvironment(Map.of("SQLITE_PATH", "job-seeker.db"));

            assertThat(config.getType()).isEqualTo(DatabaseType.SQLITE);
            assertThat(config.describe()).isEqualTo("sqlite:job-seeker.db");
        }

        @Test
        @DisplayName("non-numeric port fails")
        void badPort() {
            assertThatThrownBy(() -> DatabaseConfig.fromEnvironment(Map.of("POSTGRES_PORT", "five")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("POSTGRES_PORT");
        }
    }

    @Test
    @DisplayName("product names map to database types")
    void productNames() {
        assertThat(DatabaseType.fromProductName("SQLite")).isEqualTo(DatabaseType.SQLITE);
        assertThat(DatabaseType.fromProductName("PostgreSQL")).isEqualTo(DatabaseType.POSTGRESQL);
        assertThat(DatabaseType.fromProductName("MariaDB")).isEqualTo(DatabaseType.MYSQL);
        assertThat(DatabaseType.fromProductName("Microsoft SQL Server")).isEqualTo(DatabaseType.SQLSERVER);
        assertThatThrownBy(() -> DatabaseType.fromProductName("H2")).isInstanceOf(IllegalArgumentException.class);
    }
}
