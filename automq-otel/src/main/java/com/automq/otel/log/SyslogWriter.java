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

import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Writes log records to a stream, one syslog style line per record:
 * {@code <PRI>2024-05-01T10:15:30.123Z service [host tid="42" module="com.foo.Bar"] - message}.
 */
public class SyslogWriter {
    private static final DateTimeFormatter TIMESTAMP_FORMATTER =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final String serviceName;
    private final String hostName;
    private final PrintStream out;

    public SyslogWriter(String serviceName, String hostName) {
        this(serviceName, hostName, System.err);
    }

    public SyslogWriter(String serviceName, String hostName, PrintStream out) {
        this.serviceName = serviceName;
        this.hostName = hostName;
        this.out = out;
    }

    /**
     * Writes the record right away, the stream is flushed after every record.
     */
    public void write(Severity severity, Instant timestamp, long threadId, String module, String message,
        String[] stackTrace) {
        StringBuilder sb = new StringBuilder(128);
        sb.append(format(severity, timestamp, threadId, module, message));
        if (stackTrace != null) {
            for (String line : stackTrace) {
                sb.append(System.lineSeparator()).append(line);
            }
        }
        out.println(sb);
        out.flush();
    }

    String format(Severity severity, Instant timestamp, long threadId, String module, String message) {
        return "<" + severity.syslogLevel() + ">" + TIMESTAMP_FORMATTER.format(timestamp) + " " + serviceName
            + " [" + hostName + " tid=\"" + threadId + "\" module=\"" + module + "\"] - " + message;
    }
}
