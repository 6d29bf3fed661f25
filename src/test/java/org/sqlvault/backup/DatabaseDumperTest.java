package org.sqlvault.backup;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlvault.BaseTest;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DatabaseDumperTest extends BaseTest {

    private static final Instant CREATED = Instant.parse("2026-10-18T03:00:00Z");

    @TempDir
    Path directory;

    private DataSource dataSource;

    @BeforeEach
    public void setUp() throws Exception {
        dataSource = createDataSource(directory.resolve("dump.db"));
        execute(dataSource,
                "CREATE TABLE venues (id INTEGER PRIMARY KEY, name TEXT NOT NULL)",
                "CREATE TABLE error_logs (id INTEGER PRIMARY KEY, message TEXT)",
                "CREATE INDEX idx_venues_name ON venues(name)",
                "CREATE INDEX idx_error_logs_message ON error_logs(message)",
                "INSERT INTO error_logs (message) VALUES ('boom')");
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement("INSERT INTO venues (name) VALUES (?)")) {
            for (int i = 0; i < 250; i++) {
                statement.setString(1, "Venue " + i);
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private DatabaseDumper.Dump dump(BackupType type) throws Exception {
        try (Connection connection = dataSource.getConnection()) {
            return new DatabaseDumper(Set.of("error_logs")).dump(connection, type, CREATED);
        }
    }

    private static long occurrences(String text, String fragment) {
        return text.lines().filter(line -> line.startsWith(fragment)).count();
    }

    @Test
    public void testFullDump() throws Exception {
        DatabaseDumper.Dump dump = dump(BackupType.FULL);
        String script = dump.script();

        assertEquals(List.of("venues"), dump.tables());
        assertEquals(250, dump.recordCount());

        List<String> lines = script.lines().toList();
        assertEquals("-- SQLVault Database Backup", lines.get(0));
        assertEquals("-- Type: full", lines.get(1));
        assertEquals("-- Created: 2026-10-18T03:00:00Z", lines.get(2));
        assertEquals("-- Tables: 1", lines.get(3));
        assertEquals("-- Records: 250", lines.get(4));
        assertTrue(lines.contains("PRAGMA foreign_keys=OFF;"));
        assertTrue(lines.contains("BEGIN TRANSACTION;"));
        assertEquals("PRAGMA foreign_keys=ON;", lines.get(lines.size() - 1));
        assertEquals("COMMIT;", lines.get(lines.size() - 2));

        assertTrue(lines.contains("DROP TABLE IF EXISTS \"venues\";"));
        assertTrue(lines.contains("CREATE TABLE venues (id INTEGER PRIMARY KEY, name TEXT NOT NULL);"));
        assertTrue(lines.contains("-- Data for table: venues"));
        assertEquals(3, occurrences(script, "INSERT INTO \"venues\" (\"id\", \"name\") VALUES"));
        assertTrue(script.contains("(1, 'Venue 0')"));
        assertTrue(script.contains("(250, 'Venue 249')"));
    }

    @Test
    public void testExcludedTable() throws Exception {
        String script = dump(BackupType.FULL).script();

        assertFalse(script.contains("error_logs"));
        assertTrue(script.contains("CREATE INDEX idx_venues_name ON venues(name);"));
    }

    @Test
    public void testSchemaDump() throws Exception {
        DatabaseDumper.Dump dump = dump(BackupType.SCHEMA);

        assertEquals(0, dump.recordCount());
        assertFalse(dump.script().contains("INSERT INTO"));
        assertFalse(dump.script().contains("-- Data for table"));
        assertTrue(dump.script().contains("CREATE TABLE venues"));
        assertTrue(dump.script().contains("-- Indexes"));
    }

    @Test
    public void testEmptyTable() throws Exception {
        execute(dataSource, "DELETE FROM venues");

        DatabaseDumper.Dump dump = dump(BackupType.FULL);

        assertEquals(0, dump.recordCount());
        assertEquals(List.of("venues"), dump.tables());
        assertFalse(dump.script().contains("INSERT INTO"));
    }

}
