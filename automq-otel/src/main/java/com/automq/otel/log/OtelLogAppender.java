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

import com.automq.otel.config.RegexFilter;
import com.automq.otel.config.Severity;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.LogManager;
import org.apache.log4j.spi.LoggingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.logs.LogRecordBuilder;
import io.opentelemetry.api.logs.LoggerProvider;

/**
 * Bridges log4j events into OpenTelemetry log records, and mirrors them to stderr when enabled.
 *
 * <p>Events are first checked against the disallow filters, then written to stderr, then emitted to the logger
 * provider under a logger named after the event's logger, so the log pipelines can filter on it. Levels are applied
 * upstream by {@link LevelFilter#apply()}, every event reaching the appender is bridged.
 */
public class OtelLogAppender extends AppenderSkeleton {
    private static final Logger LOGGER = LoggerFactory.getLogger(OtelLogAppender.class);
    public static final String APPENDER_NAME = "OTEL";

    static final AttributeKey<String> EXCEPTION_STACKTRACE = AttributeKey.stringKey("exception.stacktrace");
    static final AttributeKey<String> THREAD_NAME = AttributeKey.stringKey("thread.name");

    // events logged while an event is being bridged, e.g. by the SDK itself, are not bridged again
    private static final ThreadLocal<Boolean> BRIDGING = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final LoggerProvider loggerProvider;
    private final SyslogWriter syslogWriter;
    private final List<Pair<Pattern, Pattern>> disallowFilters;

    /**
     * @param syslogWriter null to disable the stderr mirror
     */
    public OtelLogAppender(LoggerProvider loggerProvider, SyslogWriter syslogWriter, List<RegexFilter> regexFilters) {
        this.loggerProvider = loggerProvider;
        this.syslogWriter = syslogWriter;
        this.disallowFilters = compile(regexFilters);
        setName(APPENDER_NAME);
    }

    private static List<Pair<Pattern, Pattern>> compile(List<RegexFilter> regexFilters) {
        if (regexFilters == null || regexFilters.isEmpty()) {
            return Collections.emptyList();
        }
        List<Pair<Pattern, Pattern>> filters = new ArrayList<>(regexFilters.size());
        for (RegexFilter filter : regexFilters) {
            try {
                filters.add(Pair.of(Pattern.compile(filter.moduleRegex()), Pattern.compile(filter.logTextRegex())));
            } catch (PatternSyntaxException | NullPointerException e) {
                LOGGER.warn("Ignoring invalid log filter {}", filter, e);
            }
        }
        return filters;
    }

    /**
     * Attaches the appender to the root logger.
     *
     * @return false if an appender of this kind is already attached, in which case nothing changes
     */
    public boolean attachToRoot() {
        synchronized (OtelLogAppender.class) {
            if (LogManager.getRootLogger().getAppender(APPENDER_NAME) != null) {
                return false;
            }
            LogManager.getRootLogger().addAppender(this);
            return true;
        }
    }

    public void detachFromRoot() {
        synchronized (OtelLogAppender.class) {
            LogManager.getRootLogger().removeAppender(this);
        }
        close();
    }

    @Override
    protected void append(LoggingEvent event) {
        if (BRIDGING.get()) {
            return;
        }
        BRIDGING.set(Boolean.TRUE);
        try {
            bridge(event);
        } catch (RuntimeException e) {
            errorHandler.error("Failed to bridge log event", e, 0);
        } finally {
            BRIDGING.set(Boolean.FALSE);
        }
    }

    private void bridge(LoggingEvent event) {
        String module = event.getLoggerName();
        String message = event.getRenderedMessage();
        if (message == null) {
            message = "";
        }
        if (isDisallowed(module, message)) {
            return;
        }
        Severity severity = Severity.fromLevel(event.getLevel());
        Instant timestamp = Instant.ofEpochMilli(event.getTimeStamp());
        String[] stackTrace = event.getThrowableStrRep();

        if (syslogWriter != null) {
            syslogWriter.write(severity, timestamp, Thread.currentThread().getId(), module, message, stackTrace);
        }

        LogRecordBuilder builder = loggerProvider.get(module)
            .logRecordBuilder()
            .setTimestamp(timestamp)
            .setSeverity(severity.toOtel())
            .setSeverityText(severity.name())
            .setBody(message)
            .setAttribute(THREAD_NAME, event.getThreadName());
        if (stackTrace != null) {
            builder.setAttribute(EXCEPTION_STACKTRACE, StringUtils.join(stackTrace, System.lineSeparator()));
        }
        builder.emit();
    }

    boolean isDisallowed(String module, String message) {
        for (Pair<Pattern, Pattern> filter : disallowFilters) {
            if (filter.getLeft().matcher(module).find() && filter.getRight().matcher(message).find()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public boolean requiresLayout() {
        return false;
    }
}
