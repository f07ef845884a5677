/*
 * Copyright 2025, AutoMQ HK Limited.
 *
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.automq.otel.utils;

import org.slf4j.Logger;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

public class Threads {

    /**
     * Create a new ThreadFactory.
     *
     * @param pattern The pattern to use. If this contains %d, it will be replaced with a thread number.
     * @param daemon  True if we want daemon threads.
     * @return The new ThreadFactory.
     */
    public static ThreadFactory createThreadFactory(final String pattern, final boolean daemon) {
        AtomicLong threadEpoch = new AtomicLong(0);
        return r -> {
            String threadName = pattern.contains("%d") ? String.format(pattern, threadEpoch.incrementAndGet()) : pattern;
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(daemon);
            return thread;
        };
    }

    public static ScheduledExecutorService newSingleThreadScheduledExecutor(String name, boolean daemon,
        Logger logger) {
        return newSingleThreadScheduledExecutor(createThreadFactory(name, daemon), logger);
    }

    /**
     * Creates a single thread scheduler whose tasks never die from an uncaught exception: the exception is logged
     * and periodic tasks keep their schedule. Delayed tasks are dropped on shutdown.
     */
    public static ScheduledExecutorService newSingleThreadScheduledExecutor(ThreadFactory threadFactory,
        Logger logger) {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, threadFactory) {
            @Override
            public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
                return super.schedule(wrapRunnable(command, logger), delay, unit);
            }

            @Override
            public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period,
                TimeUnit unit) {
                return super.scheduleAtFixedRate(wrapRunnable(command, logger), initialDelay, period, unit);
            }

            @Override
            public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay, long delay,
                TimeUnit unit) {
                return super.scheduleWithFixedDelay(wrapRunnable(command, logger), initialDelay, delay, unit);
            }
        };
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        return executor;
    }

    static Runnable wrapRunnable(Runnable runnable, Logger logger) {
        return () -> {
            try {
                runnable.run();
            } catch (Throwable throwable) {
                logger.error("[FATAL] Uncaught exception in executor thread {}", Thread.currentThread().getName(), throwable);
            }
        };
    }

    /**
     * Stops an executor without waiting for running tasks: queued tasks are dropped and running ones interrupted.
     * Waits up to {@code timeout} for the threads to exit.
     */
    public static void shutdownNow(ExecutorService executorService, long timeout, TimeUnit timeUnit, Logger logger) {
        if (null == executorService) {
            return;
        }
        executorService.shutdownNow();
        try {
            if (!executorService.awaitTermination(timeout, timeUnit)) {
                logger.warn("Executor {} did not terminate in {} {}", executorService, timeout, timeUnit);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
