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

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlvault.backup.BackupEngine;
import org.sqlvault.backup.BackupResult;
import org.sqlvault.backup.BackupType;
import org.sqlvault.backup.CleanupResult;
import org.sqlvault.backup.FailureReason;
import org.sqlvault.config.Config;
import org.sqlvault.config.Keys;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs backups on a fixed interval or a cron expression.
 * <p>
 * Cron expressions are evaluated by polling the wall clock (every minute by default) rather than by computing exact
 * fire times, so a backup starts within one polling period of the matching minute.
 */
@Singleton
public class BackupScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackupScheduler.class);

    public static final String TIMER_INTERVAL = "interval";
    public static final String TIMER_BOOTSTRAP = "bootstrap";
    public static final String TIMER_CRON = "cron";

    private final BackupEngine backupEngine;
    private final ScheduledExecutorService executor;
    private final Clock clock;
    private final long initialDelay;
    private final long cronPeriod;

    private final Map<String, ScheduledFuture<?>> timers = new LinkedHashMap<>();
    private ScheduleConfig config;
    private CronExpression cronExpression;
    private boolean running;
    private LocalDateTime lastCronRun;

    @Inject
    public BackupScheduler(
            Config config, BackupEngine backupEngine, ScheduledExecutorService executor, Clock clock) {
        this(ScheduleConfig.fromConfig(config), backupEngine, executor, clock,
                TimeUnit.SECONDS.toMillis(config.getLong(Keys.SCHEDULER_INITIAL_DELAY)),
                TimeUnit.SECONDS.toMillis(config.getLong(Keys.SCHEDULER_CRON_PERIOD)));
    }

    public BackupScheduler(
            ScheduleConfig config, BackupEngine backupEngine, ScheduledExecutorService executor, Clock clock,
            long initialDelay, long cronPeriod) {
        this.config = new ScheduleConfig(config);
        this.backupEngine = backupEngine;
        this.executor = executor;
        this.clock = clock;
        this.initialDelay = initialDelay;
        this.cronPeriod = cronPeriod;
    }

    public synchronized void start() {
        if (running) {
            LOGGER.info("Backup scheduler is already running");
            return;
        }
        if (!Boolean.TRUE.equals(config.getEnabled())) {
            LOGGER.info("Backup scheduler is disabled");
            return;
        }

        running = true;
        ScheduleType type = config.getType() != null ? config.getType() : ScheduleType.INTERVAL;
        switch (type) {
            case INTERVAL -> startInterval();
            case CRON -> startCron();
            default -> LOGGER.info("Manual schedule, backups only run on request");
        }
        LOGGER.info("Backup scheduler started ({})", type.getId());
    }

    public synchronized void stop() {
        if (!running) {
            LOGGER.info("Backup scheduler is not running");
            return;
        }
        running = false;
        for (Map.Entry<String, ScheduledFuture<?>> entry : timers.entrySet()) {
            entry.getValue().cancel(false);
            LOGGER.info("Stopped timer {}", entry.getKey());
        }
        timers.clear();
        cronExpression = null;
        LOGGER.info("Backup scheduler stopped");
    }

    public synchronized void updateConfig(ScheduleConfig changes) {
        boolean wasRunning = running;
        if (wasRunning) {
            stop();
        }
        config = config.merge(changes);
        if (wasRunning && Boolean.TRUE.equals(config.getEnabled())) {
            start();
        }
        LOGGER.info("Backup scheduler configuration updated");
    }

    public synchronized ScheduleConfig getConfig() {
        return new ScheduleConfig(config);
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public synchronized SchedulerStatus getStatus() {
        String nextBackup = null;
        ScheduledFuture<?> interval = timers.get(TIMER_INTERVAL);
        if (running && interval != null) {
            long delay = Math.max(0, interval.getDelay(TimeUnit.MILLISECONDS));
            nextBackup = clock.instant().plusMillis(delay).toString();
        }
        return new SchedulerStatus(running, new ScheduleConfig(config), new ArrayList<>(timers.keySet()), nextBackup);
    }

    public BackupResult executeManualBackup(BackupType type, String description) {
        BackupType backupType = type != null ? type : BackupType.FULL;
        String text = description != null && !description.isBlank() ? description : "Manual backup";
        LOGGER.info("Executing manual {} backup", backupType.getId());
        try {
            BackupResult result = backupEngine.createBackup(backupType, text);
            if (result.success()) {
                LOGGER.info("Manual backup completed: {}", result.metadata().getFilename());
            } else {
                LOGGER.warn("Manual backup failed: {}", result.error());
            }
            return result;
        } catch (RuntimeException e) {
            LOGGER.warn("Manual backup error", e);
            return BackupResult.failure(FailureReason.IO, e.getMessage(), 0);
        }
    }

    void executeBackup() {
        ScheduleConfig current = getConfig();
        BackupType backupType = current.getBackupType() != null ? current.getBackupType() : BackupType.FULL;
        try {
            LOGGER.info("Executing scheduled {} backup", backupType.getId());
            BackupResult result = backupEngine.createBackup(backupType, current.getDescription());
            if (result.success()) {
                LOGGER.info("Scheduled backup completed: {}", result.metadata().getFilename());
                CleanupResult cleanup = backupEngine.cleanupOldBackups();
                if (cleanup.deletedCount() > 0) {
                    LOGGER.info("Cleanup: {} old backups removed", cleanup.deletedCount());
                }
            } else {
                LOGGER.warn("Scheduled backup failed: {}", result.error());
            }
        } catch (RuntimeException e) {
            LOGGER.warn("Scheduled backup error", e);
        }
    }

    void checkCron() {
        CronExpression expression;
        synchronized (this) {
            expression = cronExpression;
        }
        if (expression == null) {
            return;
        }
        LocalDateTime minute = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
        if (!expression.matches(minute)) {
            return;
        }
        synchronized (this) {
            if (minute.equals(lastCronRun)) {
                return;
            }
            lastCronRun = minute;
        }
        executeBackup();
    }

    private void startInterval() {
        Long interval = config.getInterval();
        if (interval == null || interval <= 0) {
            LOGGER.warn("Backup interval is not configured, no backups will be scheduled");
            return;
        }
        timers.put(TIMER_INTERVAL, executor.scheduleAtFixedRate(
                this::executeBackup, interval, interval, TimeUnit.MILLISECONDS));
        timers.put(TIMER_BOOTSTRAP, executor.schedule(() -> {
            synchronized (this) {
                timers.remove(TIMER_BOOTSTRAP);
            }
            executeBackup();
        }, initialDelay, TimeUnit.MILLISECONDS));
        LOGGER.info("Scheduled backup every {} ms, first backup in {} ms", interval, initialDelay);
    }

    private void startCron() {
        CronExpression expression = CronExpression.parse(config.getCronExpression());
        if (config.getCronExpression() == null) {
            LOGGER.warn("Cron expression is not configured, no backups will be scheduled");
            return;
        }
        if (!expression.isValid()) {
            LOGGER.warn("Cron expression '{}' is invalid and will never match: {}",
                    expression, expression.getError());
        }
        cronExpression = expression;
        lastCronRun = null;
        timers.put(TIMER_CRON, executor.scheduleAtFixedRate(
                this::checkCron, cronPeriod, cronPeriod, TimeUnit.MILLISECONDS));
        LOGGER.info("Scheduled backup with cron expression {}", expression);
    }

}
