package com.vcinsidedigital.sql_migrator.cli;

import com.vcinsidedigital.sql_migrator.SqlMigrator;
import com.vcinsidedigital.sql_migrator.config.DatabaseConfig;
import com.vcinsidedigital.sql_migrator.config.MigrationSettings;
import com.vcinsidedigital.sql_migrator.exception.MigrationException;
import com.vcinsidedigital.sql_migrator.migration.MigrationFile;
import com.vcinsidedigital.sql_migrator.migration.MigrationRecord;
import com.vcinsidedigital.sql_migrator.migration.MigrationStatus;
import com.vcinsidedigital.sql_migrator.migration.MigrationSummary;

import java.io.PrintStream;
import java.util.HashMap;
import java.util.Map;

/**
 * Command line wrapper.
 *
 * <pre>
 * sql-migrator [migrate|status] [--dir DIR] [--table NAME] [--extension EXT]
 *              [--url JDBC_URL | --sqlite FILE] [--user USER] [--password PASSWORD]
 * </pre>
 *
 * Options not given on the command line are taken from the environment
 * (see {@link DatabaseConfig#fromEnvironment} and {@link MigrationSettings#fromEnvironment}).
 * Exit codes: 0 on success, 1 when the run fails, 2 on bad usage.
 */
public class MigrateCommand {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private static final String USAGE =
            "Usage: sql-migrator [migrate|status] [--dir DIR] [--table NAME] [--extension EXT]\n" +
            "                    [--url JDBC_URL | --sqlite FILE] [--user USER] [--password PASSWORD]";

    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;

    public MigrateCommand(Map<String, String> env, PrintStream out, PrintStream err) {
        this.env = env;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new MigrateCommand(System.getenv(), System.out, System.err).execute(args);
        System.exit(code);
    }

    public int execute(String[] args) {
        String command = "migrate";
        Map<String, String> options = new HashMap<>();

        try {
            int i = 0;
            if (args.length > 0 && !args[0].startsWith("--")) {
                command = args[0];
                i = 1;
            }
            for (; i < args.length; i++) {
                String arg = args[i];
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    out.println(USAGE);
                    return EXIT_OK;
                }
                if (!arg.startsWith("--") || i + 1 >= args.length) {
                    throw new IllegalArgumentException("Unexpected argument: " + arg);
                }
                options.put(arg.substring(2), args[++i]);
            }
            if (!"migrate".equals(command) && !"status".equals(command)) {
                throw new IllegalArgumentException("Unknown command: " + command);
            }

            // database options are consumed first so settings() can reject whatever is left
            DatabaseConfig config = databaseConfig(options);
            SqlMigrator migrator = new SqlMigrator(config, settings(options));
            if ("status".equals(command)) {
                printStatus(migrator.status());
            } else {
                MigrationSummary summary = migrator.migrate();
                out.printf("total=%d alreadyApplied=%d newlyApplied=%d%n",
                        summary.getTotalCandidates(), summary.getAlreadyApplied(), summary.getNewlyApplied());
            }
            return EXIT_OK;
        } catch (IllegalArgumentException | IllegalStateException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        } catch (MigrationException e) {
            err.println("✗ Migration failed: " + e.getMessage());
            if (e.getFilename() != null) {
                err.println("  File: " + e.getFilename());
            }
            if (e.getCause() != null) {
                err.println("  Cause: " + e.getCause());
            }
            return EXIT_FAILED;
        }
    }

    private DatabaseConfig databaseConfig(Map<String, String> options) {
        Map<String, String> merged = new HashMap<>(env);
        if (options.containsKey("url")) {
            merged.put("DATABASE_URL", options.remove("url"));
        }
        if (options.containsKey("sqlite")) {
            merged.remove("DATABASE_URL");
            merged.put("SQLITE_PATH", options.remove("sqlite"));
        }
        if (options.containsKey("user")) {
            String user = options.remove("user");
            merged.put("DATABASE_USER", user);
            merged.put("POSTGRES_USER", user);
        }
        if (options.containsKey("password")) {
            String password = options.remove("password");
            merged.put("DATABASE_PASSWORD", password);
            merged.put("POSTGRES_PASSWORD", password);
        }
        return DatabaseConfig.fromEnvironment(merged);
    }

    private MigrationSettings settings(Map<String, String> options) {
        MigrationSettings.Builder builder = MigrationSettings.builder().applyEnvironment(env);
        String dir = options.remove("dir");
        if (dir != null) {
            builder.directory(dir);
        }
        String table = options.remove("table");
        if (table != null) {
            builder.tableName(table);
        }
        String extension = options.remove("extension");
        if (extension != null) {
            builder.extension(extension);
        }
        if (!options.isEmpty()) {
            throw new IllegalArgumentException("Unknown option: --" + options.keySet().iterator().next());
        }
        return builder.build();
    }

    private void printStatus(MigrationStatus status) {
        for (MigrationRecord record : status.getApplied()) {
            out.println("applied  " + record.getFilename() + "  " + record.getAppliedAt());
        }
        for (MigrationFile file : status.getPending()) {
            out.println("pending  " + file.getFilename());
        }
        out.printf("%d applied, %d pending%n", status.getApplied().size(), status.getPending().size());
    }
}
