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

import java.util.Locale;

/**
 * Log severity, ordered from the least to the most severe.
 */
public enum Severity {
    TRACE(io.opentelemetry.api.logs.Severity.TRACE, 7),
    DEBUG(io.opentelemetry.api.logs.Severity.DEBUG, 7),
    INFO(io.opentelemetry.api.logs.Severity.INFO, 6),
    WARN(io.opentelemetry.api.logs.Severity.WARN, 4),
    ERROR(io.opentelemetry.api.logs.Severity.ERROR, 3);

    private final io.opentelemetry.api.logs.Severity otelSeverity;
    private final int syslogLevel;

    Severity(io.opentelemetry.api.logs.Severity otelSeverity, int syslogLevel) {
        this.otelSeverity = otelSeverity;
        this.syslogLevel = syslogLevel;
    }

    public io.opentelemetry.api.logs.Severity toOtel() {
        return otelSeverity;
    }

    public int syslogLevel() {
        return syslogLevel;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Maps an OpenTelemetry severity number back to this scale. Numbers between two levels round down,
     * FATAL and above map to ERROR. Returns null for an undefined severity.
     */
    public static Severity fromOtel(io.opentelemetry.api.logs.Severity severity) {
        if (severity == null || severity.getSeverityNumber() <= 0) {
            return null;
        }
        int number = severity.getSeverityNumber();
        Severity result = TRACE;
        for (Severity candidate : values()) {
            if (number >= candidate.otelSeverity.getSeverityNumber()) {
                result = candidate;
            }
        }
        return result;
    }

    public static Severity fromLevel(Level level) {
        if (level.isGreaterOrEqual(Level.ERROR)) {
            return ERROR;
        } else if (level.isGreaterOrEqual(Level.WARN)) {
            return WARN;
        } else if (level.isGreaterOrEqual(Level.INFO)) {
            return INFO;
        } else if (level.isGreaterOrEqual(Level.DEBUG)) {
            return DEBUG;
        }
        return TRACE;
    }

    public Level toLevel() {
        switch (this) {
            case ERROR:
                return Level.ERROR;
            case WARN:
                return Level.WARN;
            case INFO:
                return Level.INFO;
            case DEBUG:
                return Level.DEBUG;
            default:
                return Level.TRACE;
        }
    }

    public static Severity fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Severity must not be null");
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: " + value, e);
        }
    }
}
