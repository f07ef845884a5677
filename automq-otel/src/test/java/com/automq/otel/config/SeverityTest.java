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

package com.automq.otel.config;

import org.apache.log4j.Level;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SeverityTest {

    @Test
    void ordering() {
        assertTrue(Severity.ERROR.isAtLeast(Severity.WARN));
        assertTrue(Severity.WARN.isAtLeast(Severity.WARN));
        assertFalse(Severity.DEBUG.isAtLeast(Severity.INFO));
    }

    @Test
    void fromOtelRoundsDown() {
        assertEquals(Severity.INFO, Severity.fromOtel(io.opentelemetry.api.logs.Severity.INFO3));
        assertEquals(Severity.ERROR, Severity.fromOtel(io.opentelemetry.api.logs.Severity.FATAL));
        assertEquals(Severity.TRACE, Severity.fromOtel(io.opentelemetry.api.logs.Severity.TRACE2));
        assertNull(Severity.fromOtel(io.opentelemetry.api.logs.Severity.UNDEFINED_SEVERITY_NUMBER));
    }

    @Test
    void log4jLevels() {
        assertEquals(Severity.ERROR, Severity.fromLevel(Level.FATAL));
        assertEquals(Severity.WARN, Severity.fromLevel(Level.WARN));
        assertEquals(Severity.TRACE, Severity.fromLevel(Level.TRACE));
        assertEquals(Level.DEBUG, Severity.DEBUG.toLevel());
    }

    @Test
    void syslogLevels() {
        assertEquals(3, Severity.ERROR.syslogLevel());
        assertEquals(4, Severity.WARN.syslogLevel());
        assertEquals(6, Severity.INFO.syslogLevel());
        assertEquals(7, Severity.DEBUG.syslogLevel());
        assertEquals(7, Severity.TRACE.syslogLevel());
    }
}
