package org.sqlvault.schedule;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.sqlvault.backup.BackupEngine;
import org.sqlvault.config.Config;
import org.sqlvault.config.Keys;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class SchedulerBootstrapTest {

    private BackupEngine engine;
    private ScheduledExecutorService executor;

    @BeforeEach
    public void setUp() {
        engine = mock(BackupEngine.class);
        executor = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    private Config createConfig(String environment) {
        Config config = new Config();
        config.setString(Keys.ENVIRONMENT, environment);
        config.setString(Keys.SCHEDULER_INITIAL_DELAY, "3600");
        return config;
    }

    @Test
    public void testProduction() {
        Config config = createConfig("production");
        BackupScheduler scheduler = new BackupScheduler(config, engine, executor, Clock.systemUTC());
        SchedulerBootstrap bootstrap = new SchedulerBootstrap(config, scheduler);

        bootstrap.initialize();

        assertTrue(scheduler.isRunning());
        assertEquals("Automatic production backup", scheduler.getConfig().getDescription());
        assertEquals(24 * 3_600_000L, scheduler.getConfig().getInterval());

        bootstrap.shutdown();

        assertFalse(scheduler.isRunning());
        verify(engine, never()).createBackup(any(), any());
    }

    @Test
    public void testConfiguredDescription() {
        Config config = createConfig("production");
        config.setString(Keys.SCHEDULER_DESCRIPTION, "Hourly snapshot");
        BackupScheduler scheduler = new BackupScheduler(config, engine, executor, Clock.systemUTC());

        new SchedulerBootstrap(config, scheduler).initialize();

        assertEquals("Hourly snapshot", scheduler.getConfig().getDescription());
    }

    @Test
    public void testDevelopment() {
        Config config = createConfig("development");
        BackupScheduler scheduler = new BackupScheduler(config, engine, executor, Clock.systemUTC());
        SchedulerBootstrap bootstrap = new SchedulerBootstrap(config, scheduler);

        bootstrap.initialize();

        assertFalse(scheduler.isRunning());
        bootstrap.shutdown();
        assertFalse(scheduler.isRunning());
    }

}
