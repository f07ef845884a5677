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

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThreadsTest {
    private static final Logger LOGGER = LoggerFactory.getLogger(ThreadsTest.class);

    @Test
    void threadFactoryNamesAndDaemon() {
        ThreadFactory factory = Threads.createThreadFactory("worker-%d", true);

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertEquals("worker-1", first.getName());
        assertEquals("worker-2", second.getName());
        assertTrue(first.isDaemon());
    }

    @Test
    void periodicTaskSurvivesExceptions() {
        ScheduledExecutorService executor = Threads.newSingleThreadScheduledExecutor("threads-test", true, LOGGER);
        AtomicInteger runs = new AtomicInteger();
        try {
            executor.scheduleAtFixedRate(() -> {
                runs.incrementAndGet();
                throw new IllegalStateException("tick failed");
            }, 0, 10, TimeUnit.MILLISECONDS);

            await().atMost(Duration.ofSeconds(5)).until(() -> runs.get() >= 3);
        } finally {
            Threads.shutdownNow(executor, 5, TimeUnit.SECONDS, LOGGER);
        }
        assertTrue(executor.isTerminated());
    }
}
