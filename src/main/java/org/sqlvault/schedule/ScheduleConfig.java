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
package org.sqlvault.schedule;

import jakarta.annotation.Nullable;
import org.sqlvault.backup.BackupType;
import org.sqlvault.config.Config;
import org.sqlvault.config.Keys;

import java.util.concurrent.TimeUnit;

/**
 * Schedule settings. Used both as the full scheduler configuration and as a partial update, where
 * {@code null} fields keep their current value.
 */
public class ScheduleConfig {

    private ScheduleType type;
    private Long interval;
    private String cronExpression;
    private Boolean enabled;
    private BackupType backupType;
    private String description;

    public ScheduleConfig() {
    }

    public ScheduleConfig(ScheduleConfig other) {
        this.type = other.type;
        this.interval = other.interval;
        this.cronExpression = other.cronExpression;
        this.enabled = other.enabled;
        this.backupType = other.backupType;
        this.description = other.description;
    }

    public static ScheduleConfig fromConfig(Config config) {
        ScheduleConfig scheduleConfig = new ScheduleConfig();
        scheduleConfig.setType(ScheduleType.fromId(config.getString(Keys.SCHEDULER_TYPE)));
        scheduleConfig.setInterval(TimeUnit.HOURS.toMillis(config.getLong(Keys.BACKUP_INTERVAL)));
        scheduleConfig.setCronExpression(config.getString(Keys.SCHEDULER_CRON));
        scheduleConfig.setEnabled(true);
        scheduleConfig.setBackupType(BackupType.fromId(config.getString(Keys.SCHEDULER_BACKUP_TYPE)));
        scheduleConfig.setDescription(config.getString(Keys.SCHEDULER_DESCRIPTION));
        return scheduleConfig;
    }

    public ScheduleConfig merge(ScheduleConfig changes) {
        ScheduleConfig merged = new ScheduleConfig(this);
        if (changes.type != null) {
            merged.type = changes.type;
        }
        if (changes.interval != null) {
            merged.interval = changes.interval;
        }
        if (changes.cronExpression != null) {
            merged.cronExpression = changes.cronExpression;
        }
        if (changes.enabled != null) {
            merged.enabled = changes.enabled;
        }
        if (changes.backupType != null) {
            merged.backupType = changes.backupType;
        }
        if (changes.description != null) {
            merged.description = changes.description;
        }
        return merged;
    }

    @Nullable
    public ScheduleType getType() {
        return type;
    }

    public void setType(ScheduleType type) {
        this.type = type;
    }

    @Nullable
    public Long getInterval() {
        return interval;
    }

    public void setInterval(Long interval) {
        this.interval = interval;
    }

    @Nullable
    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    @Nullable
    public Boolean getEnabled() {
        return enabled;
    }

    public void setEnabled(Boolean enabled) {
        this.enabled = enabled;
    }

    @Nullable
    public BackupType getBackupType() {
        return backupType;
    }

    public void setBackupType(BackupType backupType) {
        this.backupType = backupType;
    }

    @Nullable
    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

}
