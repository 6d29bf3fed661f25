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

import org.sqlvault.config.Config;
import org.sqlvault.config.Keys;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Settings of a {@link BackupEngine}, fixed for the lifetime of the engine.
 */
public record BackupConfig(
        Path backupDir,
        int maxBackups,
        int retentionDays,
        boolean compression,
        boolean encryption,
        Set<String> excludeTables) {

    public BackupConfig {
        backupDir = backupDir.toAbsolutePath().normalize();
        excludeTables = Set.copyOf(excludeTables);
    }

    public static BackupConfig fromConfig(Config config) {
        Set<String> excluded = Arrays.stream(config.getString(Keys.BACKUP_EXCLUDE_TABLES, "").split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toSet());
        return new BackupConfig(
                Path.of(config.getString(Keys.BACKUP_PATH)),
                config.getInteger(Keys.BACKUP_MAX_COUNT),
                config.getInteger(Keys.BACKUP_RETENTION_DAYS),
                config.getBoolean(Keys.BACKUP_COMPRESSION),
                config.getBoolean(Keys.BACKUP_ENCRYPTION),
                excluded);
    }

}
