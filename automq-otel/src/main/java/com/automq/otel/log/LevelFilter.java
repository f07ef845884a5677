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

import com.automq.otel.OtelSetupException;
import com.automq.otel.config.Severity;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Level;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The process-wide log level filter, parsed from an expression such as {@code "info,io.grpc=off,com.foo.bar=debug"}.
 *
 * <p>The expression is a comma separated list of directives. A directive is either a bare level, which sets the
 * default, {@code module=level}, which overrides the level for a logger and its descendants, or a bare module name,
 * which enables everything for that module. Levels are {@code off, error, warn, info, debug, trace}. When several
 * module directives match a logger, the longest one wins.
 */
public final class LevelFilter {
    // null means off
    private final Severity defaultSeverity;
    private final Map<String, Severity> moduleSeverities;
    private final Map<String, Level> previousLevels = new LinkedHashMap<>();

    private LevelFilter(Severity defaultSeverity, Map<String, Severity> moduleSeverities) {
        this.defaultSeverity = defaultSeverity;
        this.moduleSeverities = Collections.unmodifiableMap(moduleSeverities);
    }

    public static LevelFilter parse(String expression) throws OtelSetupException {
        if (StringUtils.isBlank(expression)) {
            throw new OtelSetupException("Log level expression must not be empty");
        }
        Severity defaultSeverity = null;
        boolean hasDefault = false;
        Map<String, Severity> modules = new LinkedHashMap<>();
        for (String rawDirective : expression.split(",")) {
            String directive = rawDirective.trim();
            if (directive.isEmpty()) {
                continue;
            }
            int idx = directive.indexOf('=');
            if (idx < 0) {
                if (isLevel(directive)) {
                    defaultSeverity = parseLevel(directive, expression);
                    hasDefault = true;
                } else {
                    checkModule(directive, expression);
                    modules.put(directive, Severity.TRACE);
                }
                continue;
            }
            String module = directive.substring(0, idx).trim();
            String level = directive.substring(idx + 1).trim();
            checkModule(module, expression);
            if (level.contains("=")) {
                throw new OtelSetupException("Malformed log level directive '" + directive + "' in '" + expression + "'");
            }
            modules.put(module, parseLevel(level, expression));
        }
        // loggers not named by a module directive are off, unless the expression names nothing at all
        if (!hasDefault && modules.isEmpty()) {
            defaultSeverity = Severity.ERROR;
        }
        return new LevelFilter(defaultSeverity, modules);
    }

    /**
     * @return true if records of the given severity from the given logger pass the filter
     */
    public boolean enabled(String module, Severity severity) {
        Severity threshold = thresholdFor(module);
        return threshold != null && severity.isAtLeast(threshold);
    }

    /**
     * @return the minimum severity for the logger, null when the logger is turned off
     */
    public Severity thresholdFor(String module) {
        String bestMatch = null;
        for (String candidate : moduleSeverities.keySet()) {
            if (matches(candidate, module) && (bestMatch == null || candidate.length() > bestMatch.length())) {
                bestMatch = candidate;
            }
        }
        return bestMatch == null ? defaultSeverity : moduleSeverities.get(bestMatch);
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    public Map<String, Severity> moduleSeverities() {
        return moduleSeverities;
    }

    /**
     * Applies the filter to the log4j logger hierarchy so that filtered records are never created. The previous
     * levels are remembered and put back by {@link #restore()}.
     */
    public synchronized void apply() {
        Logger root = LogManager.getRootLogger();
        previousLevels.putIfAbsent("", root.getLevel());
        root.setLevel(toLevel(defaultSeverity));
        moduleSeverities.forEach((module, severity) -> {
            Logger logger = LogManager.getLogger(module);
            previousLevels.putIfAbsent(module, logger.getLevel());
            logger.setLevel(toLevel(severity));
        });
    }

    public synchronized void restore() {
        previousLevels.forEach((module, level) -> {
            Logger logger = module.isEmpty() ? LogManager.getRootLogger() : LogManager.getLogger(module);
            // the root logger always needs a level
            if (level != null || !module.isEmpty()) {
                logger.setLevel(level);
            }
        });
        previousLevels.clear();
    }

    private static Level toLevel(Severity severity) {
        return severity == null ? Level.OFF : severity.toLevel();
    }

    private static boolean matches(String module, String loggerName) {
        return loggerName.equals(module) || loggerName.startsWith(module + ".");
    }

    private static boolean isLevel(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "off":
            case "error":
            case "warn":
            case "info":
            case "debug":
            case "trace":
                return true;
            default:
                return false;
        }
    }

    private static Severity parseLevel(String value, String expression) throws OtelSetupException {
        if (!isLevel(value)) {
            throw new OtelSetupException("Unknown log level '" + value + "' in '" + expression + "'");
        }
        return "off".equalsIgnoreCase(value) ? null : Severity.fromString(value);
    }

    private static void checkModule(String module, String expression) throws OtelSetupException {
        if (module.isEmpty() || module.chars().anyMatch(Character::isWhitespace)) {
            throw new OtelSetupException("Malformed module '" + module + "' in log level expression '" + expression + "'");
        }
    }

    @Override
    public String toString() {
        return "LevelFilter{default=" + (defaultSeverity == null ? "OFF" : defaultSeverity) + ", modules=" + moduleSeverities + '}';
    }
}
