package org.sqlvault.console;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlvault.BaseTest;
import org.sqlvault.backup.BackupConfig;
import org.sqlvault.backup.BackupEngine;
import org.sqlvault.backup.BackupMetadata;
import org.sqlvault.backup.BackupType;
import org.sqlvault.schedule.BackupScheduler;
import org.sqlvault.schedule.ScheduleConfig;
import org.sqlvault.schedule.SchedulerStatus;

import javax.sql.DataSource;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class BackupConsoleTest extends BaseTest {

    @TempDir
    Path directory;

    private DataSource dataSource;
    private BackupEngine engine;
    private ObjectMapper objectMapper;
    private BackupConsole console;
    private String output;

    @BeforeEach
    public void setUp() throws Exception {
        dataSource = createDataSource(directory.resolve("app.db"));
        execute(dataSource,
                "CREATE TABLE venues (id INTEGER PRIMARY KEY, name TEXT)",
                "INSERT INTO venues (name) VALUES ('Corner Bar'), ('Harbour View')");
        objectMapper = createObjectMapper();
        engine = new BackupEngine(
                new BackupConfig(directory.resolve("backups"), 30, 30, true, false, Set.of()),
                dataSource, objectMapper, Clock.systemUTC());
        BackupScheduler scheduler = mock(BackupScheduler.class);
        when(scheduler.getStatus()).thenReturn(new SchedulerStatus(false, new ScheduleConfig(), List.of(), null));
        console = new BackupConsole(engine, scheduler, objectMapper);
    }

    private int run(String input, String... args) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        int code = console.execute(List.of(args), new BufferedReader(new StringReader(input)), out);
        output = buffer.toString(StandardCharsets.UTF_8);
        return code;
    }

    private BackupMetadata createBackup() {
        return engine.createBackup(BackupType.FULL, "Before test").metadata();
    }

    @Test
    public void testCreateAndList() throws Exception {
        assertEquals(0, run("", "list"));
        assertTrue(output.contains("No backups found"));

        assertEquals(0, run("", "create", "--type", "schema", "--description", "Schema only"));
        assertTrue(output.contains("Backup created"));
        assertTrue(output.contains("schema_"));

        assertEquals(0, run("", "list"));
        assertTrue(output.contains("Backups (showing 1 of 1)"));
        assertTrue(output.contains("Schema only"));

        assertEquals(0, run("", "list", "--format", "json"));
        JsonNode backups = objectMapper.readTree(output);
        assertEquals(1, backups.size());
        assertEquals("schema", backups.get(0).get("type").asText());
    }

    @Test
    public void testRestoreConfirmation() throws Exception {
        BackupMetadata metadata = createBackup();
        execute(dataSource, "DELETE FROM venues");

        assertEquals(1, run("no\n", "restore", metadata.getId()));
        assertTrue(output.contains("Restore cancelled"));
        assertEquals(0, count(dataSource, "venues"));

        assertEquals(0, run("RESTORE\n", "restore", metadata.getId()));
        assertTrue(output.contains("Database restored"));
        assertEquals(2, count(dataSource, "venues"));

        execute(dataSource, "DELETE FROM venues");
        assertEquals(0, run("", "restore", metadata.getId(), "--force"));
        assertEquals(2, count(dataSource, "venues"));
    }

    @Test
    public void testUnknownBackup() {
        createBackup();

        assertEquals(1, run("", "restore", "missing"));
        assertTrue(output.contains("Backup not found: missing"));
        assertTrue(output.contains("Available backups:"));

        assertEquals(1, run("", "verify"));
        assertTrue(output.contains("Backup id is required"));
    }

    @Test
    public void testVerifyAndDelete() {
        BackupMetadata metadata = createBackup();

        assertEquals(0, run("", "verify", metadata.getId()));
        assertTrue(output.contains("Backup is valid"));

        assertEquals(1, run("keep\n", "delete", metadata.getId()));
        assertTrue(output.contains("Delete cancelled"));
        assertEquals(1, engine.listBackups().size());

        assertEquals(0, run("DELETE\n", "delete", metadata.getId()));
        assertTrue(engine.listBackups().isEmpty());
    }

    @Test
    public void testCleanupAndStatus() {
        createBackup();

        assertEquals(0, run("", "cleanup", "--dry-run"));
        assertTrue(output.contains("No backups to clean up"));

        assertEquals(0, run("", "cleanup"));
        assertTrue(output.contains("No backups to clean up"));
        assertEquals(1, engine.listBackups().size());

        assertEquals(0, run("", "status"));
        assertTrue(output.contains("Backups"));
        assertTrue(output.contains("stopped"));
    }

    @Test
    public void testInvalidCommands() {
        assertEquals(1, run("", "archive"));
        assertTrue(output.contains("Commands:"));

        assertEquals(1, run("", "create", "--type", "weekly"));
        assertTrue(output.contains("Error: Unknown backup type: weekly"));

        assertEquals(1, run("", "create", "--type", "incremental"));
        assertFalse(output.contains("Backup created"));

        assertEquals(1, run("", "list", "--limit"));
        assertTrue(output.contains("Missing value for option --limit"));
    }

}
