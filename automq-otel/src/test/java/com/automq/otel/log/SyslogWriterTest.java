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

package com.automq.otel.log;

import com.automq.otel.config.Severity;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyslogWriterTest {
    private static final Instant TIMESTAMP = Instant.parse("2024-05-01T10:15:30.123456Z");

    @Test
    void formatsSyslogLine() {
        SyslogWriter writer = new SyslogWriter("my-service", "host-1", new PrintStream(new ByteArrayOutputStream()));

        assertEquals("<6>2024-05-01T10:15:30.123Z my-service [host-1 tid=\"42\" module=\"com.foo.Bar\"] - hello",
            writer.format(Severity.INFO, TIMESTAMP, 42, "com.foo.Bar", "hello"));
    }

    @Test
    void priorityFollowsSeverity() {
        SyslogWriter writer = new SyslogWriter("s", "h", new PrintStream(new ByteArrayOutputStream()));

        assertTrue(writer.format(Severity.ERROR, TIMESTAMP, 1, "m", "x").startsWith("<3>"));
        assertTrue(writer.format(Severity.WARN, TIMESTAMP, 1, "m", "x").startsWith("<4>"));
        assertTrue(writer.format(Severity.DEBUG, TIMESTAMP, 1, "m", "x").startsWith("<7>"));
        assertTrue(writer.format(Severity.TRACE, TIMESTAMP, 1, "m", "x").startsWith("<7>"));
    }

    @Test
    void writesStackTraceAfterMessage() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        SyslogWriter writer = new SyslogWriter("s", "h", new PrintStream(out, true, StandardCharsets.UTF_8));

        writer.write(Severity.ERROR, TIMESTAMP, 7, "m", "boom",
            new String[] {"java.lang.IllegalStateException: boom", "\tat Foo.bar(Foo.java:1)"});

        String[] lines = out.toString(StandardCharsets.UTF_8).split(System.lineSeparator());
        assertEquals(3, lines.length);
        assertEquals("<3>2024-05-01T10:15:30.123Z s [h tid=\"7\" module=\"m\"] - boom", lines[0]);
        assertEquals("java.lang.IllegalStateException: boom", lines[1]);
        assertEquals("\tat Foo.bar(Foo.java:1)", lines[2]);
    }
}
