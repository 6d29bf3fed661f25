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
package org.sqlvault.console;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlvault.backup.BackupEngine;
import org.sqlvault.backup.BackupException;
import org.sqlvault.backup.BackupMetadata;
import org.sqlvault.backup.BackupResult;
import org.sqlvault.backup.BackupSummary;
import org.sqlvault.backup.BackupType;
import org.sqlvault.backup.CleanupCandidate;
import org.sqlvault.backup.CleanupResult;
import org.sqlvault.backup.RestoreResult;
import org.sqlvault.helper.FormatUtil;
import org.sqlvault.schedule.BackupScheduler;
import org.sqlvault.schedule.SchedulerStatus;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Operator commands over the backup engine.
 */
public class BackupConsole {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackupConsole.class);

    private static final Set<String> FLAGS = Set.of("force", "dry-run");

    private final BackupEngine backupEngine;
    private final BackupScheduler scheduler;
    private final ObjectMapper objectMapper;

    @Inject
    public BackupConsole(BackupEngine backupEngine, BackupScheduler scheduler, ObjectMapper objectMapper) {
        this.backupEngine = backupEngine;
        this.scheduler = scheduler;
        this.objectMapper = objectMapper;
    }

    public int execute(List<String> args, BufferedReader input, PrintStream out) {
        if (args.isEmpty()) {
            printUsage(out);
            return 1;
        }
        Map<String, String> options = new HashMap<>();
        List<String> arguments = new ArrayList<>();
        for (int i = 1; i < args.size(); i++) {
            String arg = args.get(i);
            if (arg.startsWith("--")) {
                String name = arg.substring(2);
                if (FLAGS.contains(name)) {
                    options.put(name, "true");
                } else if (i + 1 < args.size()) {
                    options.put(name, args.get(++i));
                } else {
                    out.println("Missing value for option " + arg);
                    return 1;
                }
            } else {
                arguments.add(arg);
            }
        }

        try {
            return switch (args.get(0)) {
                case "create" -> create(options, out);
                case "list" -> list(options, out);
                case "restore" -> restore(arguments, options, input, out);
                case "delete" -> delete(arguments, options, input, out);
                case "cleanup" -> cleanup(options, out);
                case "status" -> status(out);
                case "verify" -> verify(arguments, out);
                default -> {
                    printUsage(out);
                    yield 1;
                }
            };
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.warn("Command {} failed", args.get(0), e);
            out.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private int create(Map<String, String> options, PrintStream out) {
        BackupType type = BackupType.fromId(options.getOrDefault("type", "full"));
        if (type == BackupType.INCREMENTAL) {
            out.println("Backup type must be full or schema");
            return 1;
        }
        String description = options.get("description");
        BackupResult result = backupEngine.createBackup(type, description);
        if (!result.success()) {
            out.println("Backup failed: " + result.error());
            return 1;
        }
        BackupMetadata metadata = result.metadata();
        out.println("Backup created");
        printRow(out, "Backup ID", metadata.getId());
        printRow(out, "Filename", metadata.getFilename());
        printRow(out, "Created", metadata.getCreatedAt());
        printRow(out, "Size", FormatUtil.formatSize(metadata.getSize()));
        printRow(out, "Tables", String.valueOf(metadata.getTables().size()));
        printRow(out, "Records", String.valueOf(metadata.getRecordCount()));
        printRow(out, "Compressed", metadata.isCompressed() ? "yes" : "no");
        printRow(out, "Duration", result.duration() + "ms");
        if (description != null) {
            printRow(out, "Description", description);
        }
        return 0;
    }

    private int list(Map<String, String> options, PrintStream out) throws IOException {
        int limit = Integer.parseInt(options.getOrDefault("limit", "10"));
        List<BackupMetadata> backups = backupEngine.listBackups();
        if (backups.isEmpty()) {
            out.println("No backups found");
            return 0;
        }
        List<BackupMetadata> shown = backups.subList(0, Math.min(limit, backups.size()));
        if ("json".equals(options.get("format"))) {
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(shown));
            return 0;
        }
        out.printf("Backups (showing %d of %d)%n", shown.size(), backups.size());
        out.printf("%-28s %-7s %-25s %10s %7s %9s  %s%n",
                "ID", "TYPE", "CREATED", "SIZE", "TABLES", "RECORDS", "DESCRIPTION");
        long totalSize = 0;
        for (BackupMetadata backup : backups) {
            totalSize += backup.getSize();
        }
        for (BackupMetadata backup : shown) {
            String description = backup.getDescription() != null ? backup.getDescription() : "-";
            if (description.length() > 20) {
                description = description.substring(0, 20);
            }
            out.printf("%-28s %-7s %-25s %10s %7d %9d  %s%n",
                    backup.getId(),
                    backup.getType() != null ? backup.getType().getId() : "-",
                    backup.getCreatedAt(),
                    FormatUtil.formatSize(backup.getSize()),
                    backup.getTables().size(),
                    backup.getRecordCount(),
                    description);
        }
        out.println("Total size: " + FormatUtil.formatSize(totalSize));
        return 0;
    }

    private int restore(
            List<String> arguments, Map<String, String> options, BufferedReader input, PrintStream out)
            throws IOException {
        Optional<BackupMetadata> backup = resolve(arguments, out);
        if (backup.isEmpty()) {
            return 1;
        }
        BackupMetadata metadata = backup.get();
        if (!options.containsKey("force")) {
            printBackup(out, metadata);
            out.println("Warning: this operation replaces the current database content.");
            if (!confirm(input, out, "RESTORE")) {
                out.println("Restore cancelled");
                return 1;
            }
        }
        RestoreResult result = backupEngine.restoreFromBackup(metadata.getId());
        if (!result.success()) {
            out.println("Restore failed: " + result.error());
            return 1;
        }
        out.println("Database restored");
        printRow(out, "Tables", String.valueOf(result.restoredTables().size()));
        printRow(out, "Records", String.valueOf(result.restoredRecords()));
        printRow(out, "Duration", result.duration() + "ms");
        for (String table : result.restoredTables()) {
            out.println("  * " + table);
        }
        return 0;
    }

    private int delete(
            List<String> arguments, Map<String, String> options, BufferedReader input, PrintStream out)
            throws IOException {
        Optional<BackupMetadata> backup = resolve(arguments, out);
        if (backup.isEmpty()) {
            return 1;
        }
        BackupMetadata metadata = backup.get();
        if (!options.containsKey("force")) {
            printBackup(out, metadata);
            if (!confirm(input, out, "DELETE")) {
                out.println("Delete cancelled");
                return 1;
            }
        }
        if (!backupEngine.deleteBackup(metadata.getId())) {
            out.println("Backup not found: " + metadata.getId());
            return 1;
        }
        out.println("Backup deleted: " + metadata.getFilename());
        return 0;
    }

    private int cleanup(Map<String, String> options, PrintStream out) {
        if (options.containsKey("dry-run")) {
            List<CleanupCandidate> candidates = backupEngine.planCleanup();
            if (candidates.isEmpty()) {
                out.println("No backups to clean up");
                return 0;
            }
            out.printf("%d backups would be deleted%n", candidates.size());
            long totalSize = 0;
            for (CleanupCandidate candidate : candidates) {
                BackupMetadata metadata = candidate.metadata();
                totalSize += metadata.getSize();
                out.printf("%-32s %-25s %10s  %s%n",
                        metadata.getFilename(),
                        metadata.getCreatedAt(),
                        FormatUtil.formatSize(metadata.getSize()),
                        candidate.reason() == CleanupCandidate.Reason.AGED ? "expired" : "over limit");
            }
            out.println("Space to be freed: " + FormatUtil.formatSize(totalSize));
            return 0;
        }
        CleanupResult result = backupEngine.cleanupOldBackups();
        if (result.deletedCount() == 0) {
            out.println("No backups to clean up");
        } else {
            out.println("Deleted backups: " + result.deletedCount());
            out.println("Freed space: " + FormatUtil.formatSize(result.freedSpace()));
        }
        if (result.orphansRemoved() > 0) {
            out.println("Orphaned files removed: " + result.orphansRemoved());
        }
        return 0;
    }

    private int status(PrintStream out) {
        BackupSummary summary = backupEngine.getSummary();
        printRow(out, "Backups", String.valueOf(summary.count()));
        printRow(out, "Total size", FormatUtil.formatSize(summary.totalSize()));
        printRow(out, "Newest", summary.newest() != null ? summary.newest() : "none");
        printRow(out, "Oldest", summary.oldest() != null ? summary.oldest() : "none");
        printRow(out, "Average size", FormatUtil.formatSize(summary.averageSize()));
        summary.countByType().forEach((type, count) -> printRow(out, "  " + type.getId(), String.valueOf(count)));
        printRow(out, "Directory", backupEngine.getConfig().backupDir().toString());

        SchedulerStatus schedulerStatus = scheduler.getStatus();
        printRow(out, "Scheduler", schedulerStatus.running() ? "running" : "stopped");
        if (schedulerStatus.config().getType() != null) {
            printRow(out, "Schedule", schedulerStatus.config().getType().getId());
        }
        if (schedulerStatus.nextBackup() != null) {
            printRow(out, "Next backup", schedulerStatus.nextBackup());
        }
        return 0;
    }

    private int verify(List<String> arguments, PrintStream out) {
        Optional<BackupMetadata> backup = resolve(arguments, out);
        if (backup.isEmpty()) {
            return 1;
        }
        try {
            backupEngine.verifyBackup(backup.get().getId());
            out.println("Backup is valid: " + backup.get().getFilename());
            return 0;
        } catch (BackupException e) {
            out.println("Backup is unusable (" + e.getReason() + "): " + e.getMessage());
            return 1;
        }
    }

    private Optional<BackupMetadata> resolve(List<String> arguments, PrintStream out) {
        if (arguments.isEmpty()) {
            out.println("Backup id is required");
            return Optional.empty();
        }
        String query = arguments.get(0);
        Optional<BackupMetadata> backup = backupEngine.findBackup(query);
        if (backup.isEmpty()) {
            out.println("Backup not found: " + query);
            List<BackupMetadata> available = backupEngine.listBackups();
            if (!available.isEmpty()) {
                out.println("Available backups:");
                available.stream().limit(5).forEach(item -> out.println("  " + item.getId()));
            }
        }
        return backup;
    }

    private boolean confirm(BufferedReader input, PrintStream out, String word) throws IOException {
        out.print("Type " + word + " to continue: ");
        out.flush();
        String line = input.readLine();
        return line != null && word.equals(line.trim());
    }

    private void printBackup(PrintStream out, BackupMetadata metadata) {
        printRow(out, "Backup ID", metadata.getId());
        printRow(out, "Filename", metadata.getFilename());
        printRow(out, "Created", metadata.getCreatedAt());
        printRow(out, "Type", metadata.getType() != null ? metadata.getType().getId() : "-");
        printRow(out, "Size", FormatUtil.formatSize(metadata.getSize()));
        printRow(out, "Tables", String.valueOf(metadata.getTables().size()));
        printRow(out, "Records", String.valueOf(metadata.getRecordCount()));
    }

    private void printRow(PrintStream out, String name, String value) {
        out.printf("%-14s %s%n", name, value);
    }

    private void printUsage(PrintStream out) {
        out.println("Commands:");
        out.println("  create [--type full|schema] [--description text]");
        out.println("  list [--limit n] [--format table|json]");
        out.println("  restore <id> [--force]");
        out.println("  delete <id> [--force]");
        out.println("  cleanup [--dry-run]");
        out.println("  status");
        out.println("  verify <id>");
    }

}
