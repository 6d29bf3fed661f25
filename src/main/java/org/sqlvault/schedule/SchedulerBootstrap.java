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
import org.sqlvault.config.Config;
import org.sqlvault.config.Keys;

/**
 * Application wiring of the default {@link BackupScheduler}. {@link #initialize()} is called once at startup and
 * {@link #shutdown()} from the shutdown hook.
 */
@Singleton
public class SchedulerBootstrap {

    private static final Logger LOGGER = LoggerFactory.getLogger(SchedulerBootstrap.class);

    public static final String PRODUCTION = "production";

    private final Config config;
    private final BackupScheduler scheduler;

    @Inject
    public SchedulerBootstrap(Config config, BackupScheduler scheduler) {
        this.config = config;
        this.scheduler = scheduler;
    }

    public void initialize() {
        String environment = config.getString(Keys.ENVIRONMENT);
        if (!PRODUCTION.equalsIgnoreCase(environment)) {
            LOGGER.info("Automatic backup disabled in {} environment", environment);
            return;
        }
        ScheduleConfig changes = new ScheduleConfig();
        changes.setEnabled(true);
        if (!config.hasKey(Keys.SCHEDULER_DESCRIPTION)) {
            changes.setDescription("Automatic production backup");
        }
        scheduler.updateConfig(changes);
        scheduler.start();
    }

    public void shutdown() {
        if (scheduler.isRunning()) {
            scheduler.stop();
        }
    }

}
