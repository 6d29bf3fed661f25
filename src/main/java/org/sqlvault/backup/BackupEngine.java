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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlvault.helper.Checksum;
import org.sqlvault.helper.FormatUtil;
import org.sqlvault.helper.GzipUtil;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

@Singleton
public class BackupEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackupEngine.class);

    public static final String METADATA_SUFFIX = ".meta.json";
    public static final String SQL_SUFFIX = ".sql";
    public static final String GZIP_SUFFIX = ".sql.gz";
    private static final String TEMP_SUFFIX = ".tmp";

    private static final Comparator<BackupMetadata> CREATION_ORDER = Comparator
            .comparing(BackupEngine::parseCreatedAt)
            .thenComparing(BackupMetadata::getId);

    private final BackupConfig config;
    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final DatabaseDumper dumper;

    private final ReentrantLock operationLock = new ReentrantLock();
    private long lastTimestamp;

    @Inject
    public BackupEngine(BackupConfig config, DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this.config = config;
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.dumper = new DatabaseDumper(config.excludeTables());
        if (config.encryption()) {
            LOGGER.warn("Backup encryption is not supported, artifacts are stored unencrypted");
        }
    }

    public BackupConfig getConfig() {
        return config;
    }

    public BackupResult createBackup(BackupType type, String description) {
        long started = System.nanoTime();
        if (type == null) {
            return BackupResult.failure(FailureReason.UNSUPPORTED, "Backup type is required", elapsed(started));
        }
        if (type == BackupType.INCREMENTAL) {
            return BackupResult.failure(
                    FailureReason.UNSUPPORTED, "Incremental backups are not supported", elapsed(started));
        }
        operationLock.lock();
        try {
            Path backupDir = config.backupDir();
            Files.createDirectories(backupDir);

            Instant createdAt = clock.instant();
            String id = type.getId() + "_" + nextTimestamp(createdAt);

            DatabaseDumper.Dump dump;
            try (Connection connection = dataSource.getConnection()) {
                dump = dumper.dump(connection, type, createdAt);
            }

            byte[] data = dump.script().getBytes(StandardCharsets.UTF_8);
            if (config.compression()) {
                data = GzipUtil.compress(data);
            }
            String checksum = Checksum.sha256(data);

            String filename = id + (config.compression() ? GZIP_SUFFIX : SQL_SUFFIX);
            writeFile(backupDir.resolve(filename), data);

            BackupMetadata metadata = new BackupMetadata();
            metadata.setId(id);
            metadata.setType(type);
            metadata.setFilename(filename);
            metadata.setCreatedAt(createdAt.toString());
            metadata.setSize(data.length);
            metadata.setChecksum(checksum);
            metadata.setDescription(description);
            metadata.setTables(dump.tables());
            metadata.setRecordCount(type == BackupType.SCHEMA ? 0 : dump.recordCount());
            metadata.setCompressed(config.compression());
            writeFile(backupDir.resolve(id + METADATA_SUFFIX),
                    objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(metadata));

            long duration = elapsed(started);
            LOGGER.info("Backup {} created: {} ({}, {} tables, {} records, {} ms)",
                    type.getId(), filename, FormatUtil.formatSize(data.length),
                    dump.tables().size(), metadata.getRecordCount(), duration);
            return BackupResult.success(metadata, duration);
        } catch (Exception e) {
            LOGGER.warn("Backup {} failed", type.getId(), e);
            return BackupResult.failure(reasonOf(e), e.getMessage(), elapsed(started));
        } finally {
            operationLock.unlock();
        }
    }

    public List<BackupMetadata> listBackups() {
        Path backupDir = config.backupDir();
        List<BackupMetadata> backups = new ArrayList<>();
        if (!Files.isDirectory(backupDir)) {
            return backups;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(backupDir, "*" + METADATA_SUFFIX)) {
            for (Path path : stream) {
                try {
                    BackupMetadata metadata = objectMapper.readValue(path.toFile(), BackupMetadata.class);
                    if (metadata.getId() == null || metadata.getFilename() == null) {
                        throw new IOException("Missing id or filename");
                    }
                    parseCreatedAt(metadata);
                    backups.add(metadata);
                } catch (IOException | DateTimeParseException e) {
                    LOGGER.warn("Failed to read backup metadata {}", path.getFileName(), e);
                }
            }
        } catch (IOException e) {
            LOGGER.warn("Failed to list backup directory {}", backupDir, e);
        }
        backups.sort(CREATION_ORDER.reversed());
        return backups;
    }

    public Optional<BackupMetadata> findBackup(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        List<BackupMetadata> backups = listBackups();
        for (BackupMetadata backup : backups) {
            if (backup.getId().equals(query)) {
                return Optional.of(backup);
            }
        }
        return backups.stream()
                .filter(backup -> backup.getId().contains(query) || backup.getFilename().contains(query))
                .findFirst();
    }

    public RestoreResult restoreFromBackup(String id) {
        long started = System.nanoTime();
        operationLock.lock();
        try {
            BackupMetadata metadata = requireBackup(id);
            String script = readVerifiedScript(metadata);
            executeScript(script);

            long duration = elapsed(started);
            LOGGER.info("Database restored from backup {} ({} tables, {} records, {} ms)",
                    metadata.getFilename(), metadata.getTables().size(), metadata.getRecordCount(), duration);
            return RestoreResult.success(metadata.getTables(), metadata.getRecordCount(), duration);
        } catch (Exception e) {
            LOGGER.warn("Restore from backup {} failed", id, e);
            return RestoreResult.failure(reasonOf(e), e.getMessage(), elapsed(started));
        } finally {
            operationLock.unlock();
        }
    }

    public void verifyBackup(String id) throws BackupException {
        readVerifiedScript(requireBackup(id));
    }

    public List<CleanupCandidate> planCleanup() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(config.retentionDays()));
        List<CleanupCandidate> candidates = new ArrayList<>();
        List<BackupMetadata> remaining = new ArrayList<>();
        for (BackupMetadata backup : listBackups()) {
            if (parseCreatedAt(backup).isBefore(cutoff)) {
                candidates.add(new CleanupCandidate(backup, CleanupCandidate.Reason.AGED));
            } else {
                remaining.add(backup);
            }
        }
        if (remaining.size() > config.maxBackups()) {
            remaining.sort(CREATION_ORDER);
            for (BackupMetadata backup : remaining.subList(0, remaining.size() - config.maxBackups())) {
                candidates.add(new CleanupCandidate(backup, CleanupCandidate.Reason.EXCESS));
            }
        }
        return candidates;
    }

    public CleanupResult cleanupOldBackups() {
        operationLock.lock();
        try {
            int deletedCount = 0;
            long freedSpace = 0;
            for (CleanupCandidate candidate : planCleanup()) {
                BackupMetadata backup = candidate.metadata();
                try {
                    freedSpace += deletePair(backup);
                    deletedCount++;
                    LOGGER.info("Deleted {} backup {}",
                            candidate.reason() == CleanupCandidate.Reason.AGED ? "old" : "excess",
                            backup.getFilename());
                } catch (IOException e) {
                    LOGGER.warn("Failed to delete backup {}", backup.getFilename(), e);
                }
            }
            int orphans = removeOrphans();
            if (deletedCount > 0 || orphans > 0) {
                LOGGER.info("Cleanup completed: {} backups deleted, {} orphaned files removed, {} freed",
                        deletedCount, orphans, FormatUtil.formatSize(freedSpace));
            }
            return new CleanupResult(deletedCount, freedSpace, orphans);
        } finally {
            operationLock.unlock();
        }
    }

    public boolean deleteBackup(String id) throws IOException {
        operationLock.lock();
        try {
            Optional<BackupMetadata> backup = listBackups().stream()
                    .filter(item -> item.getId().equals(id))
                    .findFirst();
            if (backup.isEmpty()) {
                return false;
            }
            deletePair(backup.get());
            LOGGER.info("Deleted backup {}", backup.get().getFilename());
            return true;
        } finally {
            operationLock.unlock();
        }
    }

    public BackupSummary getSummary() {
        List<BackupMetadata> backups = listBackups();
        long totalSize = 0;
        Map<BackupType, Integer> countByType = new EnumMap<>(BackupType.class);
        for (BackupMetadata backup : backups) {
            totalSize += backup.getSize();
            if (backup.getType() != null) {
                countByType.merge(backup.getType(), 1, Integer::sum);
            }
        }
        return new BackupSummary(
                backups.size(),
                totalSize,
                backups.isEmpty() ? null : backups.get(0).getCreatedAt(),
                backups.isEmpty() ? null : backups.get(backups.size() - 1).getCreatedAt(),
                backups.isEmpty() ? 0 : Math.round((double) totalSize / backups.size()),
                countByType);
    }

    private BackupMetadata requireBackup(String id) throws BackupException {
        return listBackups().stream()
                .filter(backup -> backup.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> new BackupException(FailureReason.NOT_FOUND, "Backup not found: " + id));
    }

    private String readVerifiedScript(BackupMetadata metadata) throws BackupException {
        Path artifact = config.backupDir().resolve(metadata.getFilename()).normalize();
        if (!artifact.startsWith(config.backupDir())) {
            throw new BackupException(FailureReason.INTEGRITY, "Invalid backup filename: " + metadata.getFilename());
        }
        byte[] data;
        try {
            data = Files.readAllBytes(artifact);
        } catch (NoSuchFileException e) {
            throw new BackupException(
                    FailureReason.IO, "Backup file is missing, backup is unusable: " + metadata.getFilename(), e);
        } catch (IOException e) {
            throw new BackupException(FailureReason.IO, "Failed to read backup file: " + metadata.getFilename(), e);
        }

        if (!Checksum.matches(metadata.getChecksum(), data)) {
            throw new BackupException(
                    FailureReason.INTEGRITY, "Backup file checksum mismatch - file may be corrupted");
        }
        if (metadata.isCompressed()) {
            try {
                data = GzipUtil.decompress(data);
            } catch (IOException e) {
                throw new BackupException(
                        FailureReason.INTEGRITY, "Backup file cannot be decompressed - file may be corrupted", e);
            }
        }
        return new String(data, StandardCharsets.UTF_8);
    }

    private void executeScript(String script) throws BackupException {
        List<String> statements = SqlScript.statements(script);
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            try (Statement statement = connection.createStatement()) {
                statement.execute("PRAGMA foreign_keys=OFF");
            }
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                for (String sql : statements) {
                    statement.execute(sql);
                }
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
                try (Statement statement = connection.createStatement()) {
                    statement.execute("PRAGMA foreign_keys=ON");
                }
            }
        } catch (SQLException e) {
            throw new BackupException(FailureReason.EXECUTION, "Restore script failed: " + e.getMessage(), e);
        }
    }

    private long deletePair(BackupMetadata backup) throws IOException {
        Path backupDir = config.backupDir();
        long freed = 0;
        Path artifact = backupDir.resolve(backup.getFilename()).normalize();
        if (artifact.startsWith(backupDir) && Files.deleteIfExists(artifact)) {
            freed = backup.getSize();
        }
        Files.deleteIfExists(backupDir.resolve(backup.getId() + METADATA_SUFFIX));
        return freed;
    }

    private int removeOrphans() {
        Path backupDir = config.backupDir();
        if (!Files.isDirectory(backupDir)) {
            return 0;
        }
        Set<String> known = new HashSet<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(backupDir, "*" + METADATA_SUFFIX)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                known.add(name.substring(0, name.length() - METADATA_SUFFIX.length()));
            }
        } catch (IOException e) {
            LOGGER.warn("Failed to scan backup directory {}", backupDir, e);
            return 0;
        }

        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(backupDir)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                boolean orphan;
                if (name.endsWith(TEMP_SUFFIX)) {
                    orphan = true;
                } else if (name.endsWith(GZIP_SUFFIX)) {
                    orphan = !known.contains(name.substring(0, name.length() - GZIP_SUFFIX.length()));
                } else if (name.endsWith(SQL_SUFFIX)) {
                    orphan = !known.contains(name.substring(0, name.length() - SQL_SUFFIX.length()));
                } else {
                    orphan = false;
                }
                if (orphan && Files.isRegularFile(path)) {
                    try {
                        Files.delete(path);
                        removed++;
                        LOGGER.info("Removed orphaned backup file {}", name);
                    } catch (IOException e) {
                        LOGGER.warn("Failed to remove orphaned backup file {}", name, e);
                    }
                }
            }
        } catch (IOException e) {
            LOGGER.warn("Failed to scan backup directory {}", backupDir, e);
        }
        return removed;
    }

    private void writeFile(Path target, byte[] data) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        Files.write(temp, data);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    private long nextTimestamp(Instant createdAt) {
        lastTimestamp = Math.max(createdAt.toEpochMilli(), lastTimestamp + 1);
        return lastTimestamp;
    }

    private static Instant parseCreatedAt(BackupMetadata metadata) {
        if (metadata.getCreatedAt() == null) {
            throw new DateTimeParseException("Missing creation time", "", 0);
        }
        return Instant.parse(metadata.getCreatedAt());
    }

    private static FailureReason reasonOf(Exception e) {
        if (e instanceof BackupException backupException) {
            return backupException.getReason();
        } else if (e instanceof SQLException) {
            return FailureReason.EXECUTION;
        }
        return FailureReason.IO;
    }

    private static long elapsed(long started) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    }

}
