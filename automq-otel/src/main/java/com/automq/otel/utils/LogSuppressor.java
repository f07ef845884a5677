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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Rate limits a repeating WARN line, e.g. the failure of every export tick to an unreachable collector. At most one
 * line is written per interval, prefixed with the number of lines dropped since the previous one.
 */
public class LogSuppressor {
    private final Logger logger;
    private final long intervalMs;
    private final AtomicLong nextLogTimeMs = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public LogSuppressor(Logger logger, long intervalMs) {
        this.logger = logger;
        this.intervalMs = intervalMs;
    }

    public void warn(String format, Object... args) {
        long dropped = acquire(System.currentTimeMillis());
        if (dropped >= 0) {
            logger.warn("[SUPPRESSED_TIME=" + dropped + "] " + format, args);
        }
    }

    /**
     * @return the number of suppressed lines to report when the caller may log now, -1 otherwise
     */
    long acquire(long nowMs) {
        long next = nextLogTimeMs.get();
        if (nowMs < next || !nextLogTimeMs.compareAndSet(next, nowMs + intervalMs)) {
            suppressed.incrementAndGet();
            return -1;
        }
        return suppressed.getAndSet(0);
    }
}
