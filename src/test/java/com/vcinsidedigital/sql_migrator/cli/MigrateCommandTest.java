package com.vcinsidedigital.sql_migrator.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("MigrateCommand")
class MigrateCommandTest {

    @TempDir
    Path tempDir;

    private Path migrationsDir;
    private Path database;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws Exception {
        migrationsDir = Files.createDirectory(tempDir.resolve("migrations"));
        database = tempDir.resolve("job-seeker.db");
        Files.writeString(migrationsDir.resolve("0001_create_table.sql"), "CREATE TABLE t (id INT);");
        Files.writeString(migrationsDir.resolve("0002_add_column.sql"), "ALTER TABLE t ADD COLUMN name TEXT;");
    }

    @Test
    @DisplayName("migrate exits 0 and prints the summary")
    void migrateSucceeds() {
        int code = execute("migrate", "--sqlite", database.toString(), "--dir", migrationsDir.toString());

        assertThat(code).isEqualTo(MigrateCommand.EXIT_OK);
        assertThat(stdout()).contains("total=2 alreadyApplied=0 newlyApplied=2");

        out.reset();
        assertThat(execute("--sqlite", database.toString(), "--dir", migrationsDir.toString()))
                .isEqualTo(MigrateCommand.EXIT_OK);
        assertThat(stdout()).contains("total=2 alreadyApplied=2 newlyApplied=0");
    }

    @Test
    @DisplayName("settings can come from the environment")
    void usesEnvironment() {
        Map<String, String> env = Map.of(
                "SQLITE_PATH", database.toString(),
                "MIGRATIONS_DIR", migrationsDir.toString(),
                "MIGRATIONS_TABLE", "schema_history");

        int code = new MigrateCommand(env, printer(out), printer(err)).execute(new String[0]);

        assertThat(code).isEqualTo(MigrateCommand.EXIT_OK);
        assertThat(stdout()).contains("newlyApplied=2");
    }

    @Test
    @DisplayName("failed migration exits 1 and names the file on stderr")
    void migrateFails() throws Exception {
        Files.writeString(migrationsDir.resolve("0003_broken.sql"), "ALTER TABLE nope ADD COLUMN x INT;");

        int code = execute("migrate", "--sqlite", database.toString(), "--dir", migrationsDir.toString());

        assertThat(code).isEqualTo(MigrateCommand.EXIT_FAILED);
        assertThat(stderr()).contains("0003_broken.sql").contains("Cause:");
    }

    @Test
    @DisplayName("missing directory exits 1")
    void missingDirectory() {
        int code = execute("--sqlite", database.toString(), "--dir", tempDir.resolve("nowhere").toString());

        assertThat(code).isEqualTo(MigrateCommand.EXIT_FAILED);
        assertThat(stderr()).contains("nowhere");
    }

    @Test
    @DisplayName("status lists applied and pending files")
    void status() {
        execute("--sqlite", database.toString(), "--dir", migrationsDir.toString());
        out.reset();

        int code = execute("status", "--sqlite", database.toString(), "--dir", migrationsDir.toString());

        assertThat(code).isEqualTo(MigrateCommand.EXIT_OK);
        assertThat(stdout())
                .contains("applied  0001_create_table.sql")
                .contains("applied  0002_add_column.sql")
                .contains("2 applied, 0 pending");
    }

    @Test
    @DisplayName("usage errors exit 2")
    void usageErrors() {
        assertThat(execute("rollback")).isEqualTo(MigrateCommand.EXIT_USAGE);
        assertThat(execute("--sqlite", database.toString(), "--verbose", "yes")).isEqualTo(MigrateCommand.EXIT_USAGE);
        assertThat(execute("--dir")).isEqualTo(MigrateCommand.EXIT_USAGE);
        assertThat(execute("--sqlite", database.toString(), "--table", "bad-name")).isEqualTo(MigrateCommand.EXIT_USAGE);
        assertThat(stderr()).contains("Usage:");
    }

    private int execute(String... args) {
        return new MigrateCommand(Map.of(), printer(out), printer(err)).execute(args);
    }

    private static PrintStream printer(ByteArrayOutputStream buffer) {
        return new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
