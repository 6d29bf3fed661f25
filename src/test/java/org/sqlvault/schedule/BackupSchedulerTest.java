package org.sqlvault.schedule;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.sqlvault.backup.BackupEngine;
import org.sqlvault.backup.BackupMetadata;
import org.sqlvault.backup.BackupResult;
import org.sqlvault.backup.BackupType;
import org.sqlvault.backup.CleanupResult;
import org.sqlvault.backup.FailureReason;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockingDetails;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class BackupSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-10-18T03:00:30Z");
    private static final long HOUR = 3_600_000;

    private BackupEngine engine;
    private ScheduledExecutorService executor;

    @BeforeEach
    public void setUp() {
        engine = mock(BackupEngine.class);
        BackupMetadata metadata = new BackupMetadata();
        metadata.setId("full_1");
        metadata.setFilename("full_1.sql.gz");
        when(engine.createBackup(any(), any())).thenReturn(BackupResult.success(metadata, 5));
        when(engine.cleanupOldBackups()).thenReturn(new CleanupResult(1, 100, 0));
        executor = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    private static ScheduleConfig interval(long interval) {
        ScheduleConfig config = new ScheduleConfig();
        config.setType(ScheduleType.INTERVAL);
        config.setInterval(interval);
        config.setEnabled(true);
        config.setBackupType(BackupType.FULL);
        config.setDescription("Scheduled");
        return config;
    }

    private static ScheduleConfig cron(String expression) {
        ScheduleConfig config = interval(HOUR);
        config.setType(ScheduleType.CRON);
        config.setCronExpression(expression);
        return config;
    }

    private BackupScheduler createScheduler(ScheduleConfig config, Instant now, long initialDelay) {
        return new BackupScheduler(
                config, engine, executor, Clock.fixed(now, ZoneOffset.UTC), initialDelay, HOUR);
    }

    private long backupCount() {
        return mockingDetails(engine).getInvocations().stream()
                .filter(invocation -> invocation.getMethod().getName().equals("createBackup"))
                .count();
    }

    @Test
    public void testIntervalSchedule() throws Exception {
        BackupScheduler scheduler = createScheduler(interval(500), NOW, 50);

        scheduler.start();

        verify(engine, after(250).times(1)).createBackup(BackupType.FULL, "Scheduled");
        verify(engine, timeout(2000).atLeast(3)).createBackup(BackupType.FULL, "Scheduled");
        verify(engine, timeout(1000).atLeast(3)).cleanupOldBackups();
        assertEquals(List.of(BackupScheduler.TIMER_INTERVAL), scheduler.getStatus().activeTimers());

        scheduler.stop();
        Thread.sleep(100);
        long count = backupCount();
        Thread.sleep(1000);
        assertEquals(count, backupCount());
    }

    @Test
    public void testStatus() {
        BackupScheduler scheduler = createScheduler(interval(HOUR), NOW, HOUR);

        scheduler.start();
        SchedulerStatus status = scheduler.getStatus();

        assertTrue(status.running());
        assertEquals(List.of(BackupScheduler.TIMER_INTERVAL, BackupScheduler.TIMER_BOOTSTRAP), status.activeTimers());
        assertEquals(ScheduleType.INTERVAL, status.config().getType());
        Instant next = Instant.parse(status.nextBackup());
        assertTrue(!next.isAfter(NOW.plusMillis(HOUR)) && next.isAfter(NOW.plusMillis(HOUR - 5000)));

        scheduler.stop();
        status = scheduler.getStatus();

        assertFalse(status.running());
        assertTrue(status.activeTimers().isEmpty());
        assertNull(status.nextBackup());
        verify(engine, never()).createBackup(any(), any());
    }

    @Test
    public void testStartConditions() {
        ScheduleConfig disabled = interval(HOUR);
        disabled.setEnabled(false);
        BackupScheduler scheduler = createScheduler(disabled, NOW, HOUR);
        scheduler.start();
        assertFalse(scheduler.isRunning());
        assertTrue(scheduler.getStatus().activeTimers().isEmpty());

        scheduler = createScheduler(interval(HOUR), NOW, HOUR);
        scheduler.start();
        scheduler.start();
        assertEquals(2, scheduler.getStatus().activeTimers().size());

        ScheduleConfig unconfigured = interval(HOUR);
        unconfigured.setInterval(null);
        scheduler = createScheduler(unconfigured, NOW, HOUR);
        scheduler.start();
        assertTrue(scheduler.isRunning());
        assertTrue(scheduler.getStatus().activeTimers().isEmpty());

        ScheduleConfig manual = interval(HOUR);
        manual.setType(ScheduleType.MANUAL);
        scheduler = createScheduler(manual, NOW, HOUR);
        scheduler.start();
        assertTrue(scheduler.isRunning());
        assertTrue(scheduler.getStatus().activeTimers().isEmpty());
        assertNull(scheduler.getStatus().nextBackup());
    }

    @Test
    public void testCronMatch() {
        BackupScheduler scheduler = createScheduler(cron("0 3 * * *"), NOW, HOUR);
        scheduler.start();

        assertEquals(List.of(BackupScheduler.TIMER_CRON), scheduler.getStatus().activeTimers());

        scheduler.checkCron();
        scheduler.checkCron();

        verify(engine, times(1)).createBackup(BackupType.FULL, "Scheduled");
        verify(engine, times(1)).cleanupOldBackups();
    }

    @Test
    public void testCronMismatch() {
        BackupScheduler scheduler = createScheduler(cron("0 3 * * *"), NOW.plusSeconds(3600), HOUR);
        scheduler.start();

        scheduler.checkCron();

        verify(engine, never()).createBackup(any(), any());
    }

    @Test
    public void testCronInvalidOrMissing() {
        BackupScheduler scheduler = createScheduler(cron("every night"), NOW, HOUR);
        scheduler.start();
        assertTrue(scheduler.isRunning());
        assertEquals(List.of(BackupScheduler.TIMER_CRON), scheduler.getStatus().activeTimers());
        scheduler.checkCron();

        scheduler = createScheduler(cron(null), NOW, HOUR);
        scheduler.start();
        assertTrue(scheduler.getStatus().activeTimers().isEmpty());
        scheduler.checkCron();

        verify(engine, never()).createBackup(any(), any());
    }

    @Test
    public void testCronStopped() {
        BackupScheduler scheduler = createScheduler(cron("0 3 * * *"), NOW, HOUR);
        scheduler.start();
        scheduler.stop();

        scheduler.checkCron();

        verify(engine, never()).createBackup(any(), any());
    }

    @Test
    public void testUpdateConfig() {
        BackupScheduler scheduler = createScheduler(interval(HOUR), NOW, HOUR);
        scheduler.start();

        ScheduleConfig changes = new ScheduleConfig();
        changes.setType(ScheduleType.CRON);
        changes.setCronExpression("0 3 * * *");
        scheduler.updateConfig(changes);

        assertTrue(scheduler.isRunning());
        assertEquals(List.of(BackupScheduler.TIMER_CRON), scheduler.getStatus().activeTimers());
        assertEquals(ScheduleType.CRON, scheduler.getConfig().getType());
        assertEquals(HOUR, scheduler.getConfig().getInterval());

        changes = new ScheduleConfig();
        changes.setEnabled(false);
        scheduler.updateConfig(changes);

        assertFalse(scheduler.isRunning());
        assertTrue(scheduler.getStatus().activeTimers().isEmpty());
    }

    @Test
    public void testUpdateConfigWhenStopped() {
        BackupScheduler scheduler = createScheduler(interval(HOUR), NOW, HOUR);

        ScheduleConfig changes = new ScheduleConfig();
        changes.setDescription("Nightly");
        scheduler.updateConfig(changes);

        assertFalse(scheduler.isRunning());
        assertEquals("Nightly", scheduler.getConfig().getDescription());
    }

    @Test
    public void testFailedBackupSkipsCleanup() {
        when(engine.createBackup(any(), any())).thenReturn(BackupResult.failure(FailureReason.IO, "disk full", 1));
        BackupScheduler scheduler = createScheduler(interval(HOUR), NOW, HOUR);

        scheduler.executeBackup();

        verify(engine).createBackup(BackupType.FULL, "Scheduled");
        verify(engine, never()).cleanupOldBackups();
    }

    @Test
    public void testBackupErrorIsContained() {
        when(engine.createBackup(any(), any())).thenThrow(new IllegalStateException("disk full"));
        BackupScheduler scheduler = createScheduler(interval(HOUR), NOW, HOUR);

        assertDoesNotThrow(scheduler::executeBackup);
        verify(engine, never()).cleanupOldBackups();

        BackupResult result = scheduler.executeManualBackup(BackupType.FULL, null);
        assertFalse(result.success());
        assertEquals(FailureReason.IO, result.reason());
        assertEquals("disk full", result.error());
    }

    @Test
    public void testManualBackup() {
        BackupScheduler scheduler = createScheduler(interval(HOUR), NOW, HOUR);

        BackupResult result = scheduler.executeManualBackup(null, null);
        scheduler.executeManualBackup(BackupType.SCHEMA, "Before upgrade");

        assertTrue(result.success());
        verify(engine).createBackup(BackupType.FULL, "Manual backup");
        verify(engine).createBackup(BackupType.SCHEMA, "Before upgrade");
        verify(engine, never()).cleanupOldBackups();
    }

}
