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
package org.sqlvault.config;

public final class Keys {

    private Keys() {
    }

    /**
     * Deployment environment name. Automatic backups are only started in the "production" environment.
     */
    public static final ConfigKey<String> ENVIRONMENT = new StringConfigKey(
            "environment",
            "development");

    /**
     * JDBC connection URL of the database to back up.
     */
    public static final ConfigKey<String> DATABASE_URL = new StringConfigKey(
            "database.url",
            "jdbc:sqlite:./data/sqlvault.db");

    /**
     * Database user, if the driver requires one.
     */
    public static final ConfigKey<String> DATABASE_USER = new StringConfigKey(
            "database.user");

    /**
     * Database password, if the driver requires one.
     */
    public static final ConfigKey<String> DATABASE_PASSWORD = new StringConfigKey(
            "database.password");

    /**
     * Directory holding backup artifacts and their metadata files.
     */
    public static final ConfigKey<String> BACKUP_PATH = new StringConfigKey(
            "backup.path",
            "./backups");

    /**
     * Maximum number of backups kept by the cleanup.
     */
    public static final ConfigKey<Integer> BACKUP_MAX_COUNT = new IntegerConfigKey(
            "backup.maxCount",
            30);

    /**
     * Backups older than this number of days are deleted by the cleanup.
     */
    public static final ConfigKey<Integer> BACKUP_RETENTION_DAYS = new IntegerConfigKey(
            "backup.retentionDays",
            30);

    /**
     * Compress backup artifacts with gzip.
     */
    public static final ConfigKey<Boolean> BACKUP_COMPRESSION = new BooleanConfigKey(
            "backup.compression",
            true);

    /**
     * Reserved. Encryption of artifacts is not implemented.
     */
    public static final ConfigKey<Boolean> BACKUP_ENCRYPTION = new BooleanConfigKey(
            "backup.encryption",
            false);

    /**
     * Comma separated list of tables that are never included in a dump.
     */
    public static final ConfigKey<String> BACKUP_EXCLUDE_TABLES = new StringConfigKey(
            "backup.excludeTables",
            "error_logs");

    /**
     * Interval between scheduled backups in hours.
     */
    public static final ConfigKey<Long> BACKUP_INTERVAL = new LongConfigKey(
            "backup.interval",
            24L);

    /**
     * Scheduler trigger type: interval, cron or manual.
     */
    public static final ConfigKey<String> SCHEDULER_TYPE = new StringConfigKey(
            "scheduler.type",
            "interval");

    /**
     * Five field cron expression used by the cron trigger type.
     */
    public static final ConfigKey<String> SCHEDULER_CRON = new StringConfigKey(
            "scheduler.cron");

    /**
     * Type of scheduled backups: full or schema.
     */
    public static final ConfigKey<String> SCHEDULER_BACKUP_TYPE = new StringConfigKey(
            "scheduler.backupType",
            "full");

    /**
     * Description attached to scheduled backups.
     */
    public static final ConfigKey<String> SCHEDULER_DESCRIPTION = new StringConfigKey(
            "scheduler.description",
            "Automatic scheduled backup");

    /**
     * Delay in seconds before the first backup of an interval schedule.
     */
    public static final ConfigKey<Long> SCHEDULER_INITIAL_DELAY = new LongConfigKey(
            "scheduler.initialDelay",
            60L);

    /**
     * Period in seconds of the cron expression check.
     */
    public static final ConfigKey<Long> SCHEDULER_CRON_PERIOD = new LongConfigKey(
            "scheduler.cronPeriod",
            60L);

}
