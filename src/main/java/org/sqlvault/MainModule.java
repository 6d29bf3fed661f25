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
package org.sqlvault;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.inject.Singleton;
import org.sqlvault.backup.BackupConfig;
import org.sqlvault.config.Config;
import org.sqlvault.config.Keys;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

public class MainModule extends AbstractModule {

    private final Config config;

    public MainModule(Config config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(Config.class).toInstance(config);
    }

    @Singleton
    @Provides
    public static BackupConfig provideBackupConfig(Config config) {
        return BackupConfig.fromConfig(config);
    }

    @Singleton
    @Provides
    public static ObjectMapper provideObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return objectMapper;
    }

    @Singleton
    @Provides
    public static DataSource provideDataSource(Config config) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(config.getString(Keys.DATABASE_URL));
        if (config.hasKey(Keys.DATABASE_USER)) {
            hikariConfig.setUsername(config.getString(Keys.DATABASE_USER));
            hikariConfig.setPassword(config.getString(Keys.DATABASE_PASSWORD, ""));
        }
        hikariConfig.setMaximumPoolSize(2);
        hikariConfig.setPoolName("sqlvault");
        return new HikariDataSource(hikariConfig);
    }

    @Singleton
    @Provides
    public static ScheduledExecutorService provideScheduledExecutorService() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "backup-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Singleton
    @Provides
    public static Clock provideClock() {
        return Clock.systemDefaultZone();
    }

}
