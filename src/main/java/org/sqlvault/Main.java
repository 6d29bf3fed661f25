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

import com.google.inject.Guice;
import com.google.inject.Injector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlvault.config.Config;
import org.sqlvault.console.BackupConsole;
import org.sqlvault.schedule.SchedulerBootstrap;

import javax.sql.DataSource;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public final class Main {

    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: sqlvault <config.xml> [command [options]]");
            System.exit(1);
        }
        Injector injector = Guice.createInjector(new MainModule(new Config(args[0])));
        if (args.length > 1) {
            List<String> command = Arrays.asList(args).subList(1, args.length);
            BufferedReader input = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            int code = injector.getInstance(BackupConsole.class).execute(command, input, System.out);
            close(injector);
            System.exit(code);
        }
        run(injector);
    }

    private static void run(Injector injector) throws InterruptedException {
        SchedulerBootstrap bootstrap = injector.getInstance(SchedulerBootstrap.class);
        bootstrap.initialize();

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down backup service...");
            bootstrap.shutdown();
            close(injector);
            shutdown.countDown();
        }));
        shutdown.await();
    }

    private static void close(Injector injector) {
        ScheduledExecutorService executor = injector.getInstance(ScheduledExecutorService.class);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOGGER.warn("Backup still running after shutdown timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        DataSource dataSource = injector.getInstance(DataSource.class);
        if (dataSource instanceof Closeable closeable) {
            try {
                closeable.close();
            } catch (IOException e) {
                LOGGER.warn("Failed to close data source", e);
            }
        }
    }

}
