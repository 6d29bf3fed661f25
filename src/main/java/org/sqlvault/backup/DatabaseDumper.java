/*
 * Copyright 2026
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.sqlvault.backup;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Serializes the schema and optionally the rows of a SQLite database into a replayable SQL script.
 */
public class DatabaseDumper {

    public static final int BATCH_SIZE = 100;

    private static final String TABLE_QUERY = "SELECT name, sql FROM sqlite_master "
            + "WHERE type = 'table' AND name NOT LIKE 'sqlite_%' ORDER BY name";

    private static final String INDEX_QUERY = "SELECT name, tbl_name, sql FROM sqlite_master "
            + "WHERE type = 'index' AND name NOT LIKE 'sqlite_%' AND sql IS NOT NULL ORDER BY name";

    private final Set<String> excludeTables;

    public DatabaseDumper(Set<String> excludeTables) {
        this.excludeTables = excludeTables;
    }

    public record Dump(String script, List<String> tables, long recordCount) {
    }

    public Dump dump(Connection connection, BackupType type, Instant createdAt) throws SQLException {
        List<String> statements = new ArrayList<>();
        List<String> tables = new ArrayList<>();
        long recordCount = 0;

        try (PreparedStatement statement = connection.prepareStatement(TABLE_QUERY);
             ResultSet resultSet = statement.executeQuery()) {
            List<String[]> definitions = new ArrayList<>();
            while (resultSet.next()) {
                definitions.add(new String[] {resultSet.getString("name"), resultSet.getString("sql")});
            }
            for (String[] definition : definitions) {
                String name = definition[0];
                String sql = definition[1];
                if (excludeTables.contains(name) || sql == null) {
                    continue;
                }
                tables.add(name);
                statements.add("-- Table: " + name);
                statements.add("DROP TABLE IF EXISTS " + SqlLiteral.quoteIdentifier(name) + ";");
                statements.add(sql + ";");
                statements.add("");
                if (type != BackupType.SCHEMA) {
                    recordCount += dumpRows(connection, name, statements);
                }
            }
        }

        List<String> indexes = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(INDEX_QUERY);
             ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                if (tables.contains(resultSet.getString("tbl_name"))) {
                    indexes.add(resultSet.getString("sql") + ";");
                }
            }
        }
        if (!indexes.isEmpty()) {
            statements.add("-- Indexes");
            statements.addAll(indexes);
            statements.add("");
        }

        List<String> lines = new ArrayList<>();
        lines.add("-- SQLVault Database Backup");
        lines.add("-- Type: " + type.getId());
        lines.add("-- Created: " + createdAt);
        lines.add("-- Tables: " + tables.size());
        lines.add("-- Records: " + recordCount);
        lines.add("-- Generated by SQLVault Backup System");
        lines.add("");
        lines.add("PRAGMA foreign_keys=OFF;");
        lines.add("BEGIN TRANSACTION;");
        lines.add("");
        lines.addAll(statements);
        lines.add("");
        lines.add("COMMIT;");
        lines.add("PRAGMA foreign_keys=ON;");

        return new Dump(String.join("\n", lines), List.copyOf(tables), recordCount);
    }

    private long dumpRows(Connection connection, String table, List<String> statements) throws SQLException {
        long count = 0;
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT * FROM " + SqlLiteral.quoteIdentifier(table));
             ResultSet resultSet = statement.executeQuery()) {
            ResultSetMetaData metaData = resultSet.getMetaData();
            int columnCount = metaData.getColumnCount();
            StringJoiner columns = new StringJoiner(", ");
            for (int i = 1; i <= columnCount; i++) {
                columns.add(SqlLiteral.quoteIdentifier(metaData.getColumnName(i)));
            }
            String prefix = "INSERT INTO " + SqlLiteral.quoteIdentifier(table) + " (" + columns + ") VALUES";

            List<String> batch = new ArrayList<>(BATCH_SIZE);
            while (resultSet.next()) {
                StringJoiner values = new StringJoiner(", ", "(", ")");
                for (int i = 1; i <= columnCount; i++) {
                    values.add(SqlLiteral.render(resultSet.getObject(i)));
                }
                if (count == 0) {
                    statements.add("-- Data for table: " + table);
                }
                batch.add(values.toString());
                count++;
                if (batch.size() == BATCH_SIZE) {
                    flushBatch(prefix, batch, statements);
                }
            }
            if (!batch.isEmpty()) {
                flushBatch(prefix, batch, statements);
            }
        }
        if (count > 0) {
            statements.add("");
        }
        return count;
    }

    private void flushBatch(String prefix, List<String> batch, List<String> statements) {
        statements.add(prefix);
        statements.add("  " + String.join(",\n  ", batch) + ";");
        batch.clear();
    }

}
