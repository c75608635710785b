package com.vcinsidedigital.sql_migrator.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Where migrations come from and where their application is recorded.
 */
public class MigrationSettings {
    public static final String DEFAULT_DIRECTORY = "migrations";
    public static final String DEFAULT_TABLE = "migrations";
    public static final String DEFAULT_EXTENSION = ".sql";

    // The table name is interpolated into DDL, so only plain identifiers are accepted
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

    private Path directory = Path.of(DEFAULT_DIRECTORY);
    private String tableName = DEFAULT_TABLE;
    private String extension = DEFAULT_EXTENSION;

    private MigrationSettings() {}

    public static Builder builder() {
        return new Builder();
    }

    public static MigrationSettings defaults() {
        return builder().build();
    }

    /**
     * Reads {@code MIGRATIONS_DIR}, {@code MIGRATIONS_TABLE} and {@code MIGRATIONS_EXTENSION},
     * falling back to the defaults for anything unset.
     */
    public static MigrationSettings fromEnvironment(Map<String, String> env) {
        return builder().applyEnvironment(env).build();
    }

    public static boolean isValidTableName(String tableName) {
        return tableName != null && TABLE_NAME.matcher(tableName).matches();
    }

    public Path getDirectory() { return directory; }
    public String getTableName() { return tableName; }
    public String getExtension() { return extension; }

    public static class Builder {
        private final MigrationSettings settings = new MigrationSettings();

        public Builder directory(Path directory) {
            settings.directory = directory;
            return this;
        }

        public Builder directory(String directory) {
            return directory(Path.of(directory));
        }

        public Builder tableName(String tableName) {
            settings.tableName = tableName;
            return this;
        }

        public Builder extension(String extension) {
            settings.extension = extension;
            return this;
        }

        public Builder applyEnvironment(Map<String, String> env) {
            String dir = env.get("MIGRATIONS_DIR");
            if (dir != null && !dir.isBlank()) {
                directory(dir);
            }
            String table = env.get("MIGRATIONS_TABLE");
            if (table != null && !table.isBlank()) {
                tableName(table);
            }
            String ext = env.get("MIGRATIONS_EXTENSION");
            if (ext != null && !ext.isBlank()) {
                extension(ext);
            }
            return this;
        }

        public MigrationSettings build() {
            if (settings.directory == null) {
                throw new IllegalStateException("Migrations directory not specified");
            }
            if (!isValidTableName(settings.tableName)) {
                throw new IllegalArgumentException("Invalid tracking table name: " + settings.tableName);
            }
            if (settings.extension == null || settings.extension.isEmpty()) {
                throw new IllegalArgumentException("Migration file extension must not be empty");
            }
            return settings;
        }
    }
}
