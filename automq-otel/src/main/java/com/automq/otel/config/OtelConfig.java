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

import com.automq.otel.OtelConstants;
import com.automq.otel.OtelSetupException;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Observability configuration. Instances are immutable; use {@link #builder()} to create one.
 */
public final class OtelConfig {
    private final String serviceName;
    private final String enterpriseNumber;
    private final boolean emitMetricsToStdout;
    private final boolean emitLogsToStderr;
    private final List<MetricsExportTarget> metricsExportTargets;
    private final List<LogsExportTarget> logExportTargets;
    private final String level;
    private final Map<String, String> resourceAttributes;
    private final PrometheusConfig prometheusConfig;
    private final List<RegexFilter> regexFilters;
    private final boolean registerGlobal;

    private OtelConfig(Builder builder) {
        this.serviceName = builder.serviceName;
        this.enterpriseNumber = builder.enterpriseNumber;
        this.emitMetricsToStdout = builder.emitMetricsToStdout;
        this.emitLogsToStderr = builder.emitLogsToStderr;
        this.metricsExportTargets = Collections.unmodifiableList(new ArrayList<>(builder.metricsExportTargets));
        this.logExportTargets = Collections.unmodifiableList(new ArrayList<>(builder.logExportTargets));
        this.level = builder.level;
        this.resourceAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.resourceAttributes));
        this.prometheusConfig = builder.prometheusConfig;
        this.regexFilters = Collections.unmodifiableList(new ArrayList<>(builder.regexFilters));
        this.registerGlobal = builder.registerGlobal;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Name of the component, for example "App".
     */
    public String serviceName() {
        return serviceName;
    }

    /**
     * Optional enterprise number, null when not set.
     */
    public String enterpriseNumber() {
        return enterpriseNumber;
    }

    public boolean emitMetricsToStdout() {
        return emitMetricsToStdout;
    }

    public boolean emitLogsToStderr() {
        return emitLogsToStderr;
    }

    public List<MetricsExportTarget> metricsExportTargets() {
        return metricsExportTargets;
    }

    public List<LogsExportTarget> logExportTargets() {
        return logExportTargets;
    }

    /**
     * Log level, specified as logging directives and controllable on a per-module basis, e.g. "info,io.grpc=off".
     */
    public String level() {
        return level;
    }

    public Map<String, String> resourceAttributes() {
        return resourceAttributes;
    }

    /**
     * Optional Prometheus configuration, null when the scrape endpoint is disabled.
     */
    public PrometheusConfig prometheusConfig() {
        return prometheusConfig;
    }

    public List<RegexFilter> regexFilters() {
        return regexFilters;
    }

    public boolean registerGlobal() {
        return registerGlobal;
    }

    /**
     * Checks the parts of the configuration that would prevent the orchestrator from starting.
     */
    public void validate() throws OtelSetupException {
        if (StringUtils.isBlank(serviceName)) {
            throw new OtelSetupException("Service name must not be empty");
        }
        for (MetricsExportTarget target : metricsExportTargets) {
            validateSchedule("metrics", target.url(), target.intervalSecs(), target.timeoutSecs());
        }
        for (LogsExportTarget target : logExportTargets) {
            validateSchedule("logs", target.url(), target.intervalSecs(), target.timeoutSecs());
        }
    }

    private static void validateSchedule(String kind, String url, long intervalSecs, long timeoutSecs)
        throws OtelSetupException {
        if (intervalSecs <= 0) {
            throw new OtelSetupException(String.format("Export interval of %s target %s must be positive, got %d",
                kind, url, intervalSecs));
        }
        if (timeoutSecs <= 0) {
            throw new OtelSetupException(String.format("Export timeout of %s target %s must be positive, got %d",
                kind, url, timeoutSecs));
        }
    }

    @Override
    public String toString() {
        return "OtelConfig{" +
            "serviceName='" + serviceName + '\'' +
            ", enterpriseNumber=" + enterpriseNumber +
            ", emitMetricsToStdout=" + emitMetricsToStdout +
            ", emitLogsToStderr=" + emitLogsToStderr +
            ", metricsExportTargets=" + metricsExportTargets +
            ", logExportTargets=" + logExportTargets +
            ", level='" + level + '\'' +
            ", resourceAttributes=" + resourceAttributes +
            ", prometheusConfig=" + prometheusConfig +
            ", regexFilters=" + regexFilters +
            '}';
    }

    public static class Builder {
        private String serviceName = OtelConstants.DEFAULT_SERVICE_NAME;
        private String enterpriseNumber;
        private boolean emitMetricsToStdout = false;
        private boolean emitLogsToStderr = true;
        private final List<MetricsExportTarget> metricsExportTargets = new ArrayList<>();
        private final List<LogsExportTarget> logExportTargets = new ArrayList<>();
        private String level = OtelConstants.DEFAULT_LEVEL;
        private final Map<String, String> resourceAttributes = new LinkedHashMap<>();
        private PrometheusConfig prometheusConfig;
        private final List<RegexFilter> regexFilters = new ArrayList<>();
        private boolean registerGlobal = true;

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder enterpriseNumber(String enterpriseNumber) {
            this.enterpriseNumber = enterpriseNumber;
            return this;
        }

        public Builder emitMetricsToStdout(boolean emitMetricsToStdout) {
            this.emitMetricsToStdout = emitMetricsToStdout;
            return this;
        }

        public Builder emitLogsToStderr(boolean emitLogsToStderr) {
            this.emitLogsToStderr = emitLogsToStderr;
            return this;
        }

        public Builder addMetricsExportTarget(MetricsExportTarget target) {
            this.metricsExportTargets.add(Objects.requireNonNull(target, "target"));
            return this;
        }

        public Builder metricsExportTargets(List<MetricsExportTarget> targets) {
            this.metricsExportTargets.clear();
            targets.forEach(this::addMetricsExportTarget);
            return this;
        }

        public Builder addLogExportTarget(LogsExportTarget target) {
            this.logExportTargets.add(Objects.requireNonNull(target, "target"));
            return this;
        }

        public Builder logExportTargets(List<LogsExportTarget> targets) {
            this.logExportTargets.clear();
            targets.forEach(this::addLogExportTarget);
            return this;
        }

        public Builder level(String level) {
            this.level = level;
            return this;
        }

        /**
         * Adds a resource attribute. A later value for the same key replaces the earlier one.
         */
        public Builder resourceAttribute(String key, String value) {
            if (StringUtils.isBlank(key)) {
                throw new IllegalArgumentException("Resource attribute key must not be blank");
            }
            this.resourceAttributes.put(key, Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder resourceAttributes(Map<String, String> attributes) {
            this.resourceAttributes.clear();
            attributes.forEach(this::resourceAttribute);
            return this;
        }

        public Builder prometheusConfig(PrometheusConfig prometheusConfig) {
            this.prometheusConfig = prometheusConfig;
            return this;
        }

        public Builder addRegexFilter(RegexFilter filter) {
            this.regexFilters.add(Objects.requireNonNull(filter, "filter"));
            return this;
        }

        public Builder registerGlobal(boolean registerGlobal) {
            this.registerGlobal = registerGlobal;
            return this;
        }

        public OtelConfig build() {
            return new OtelConfig(this);
        }
    }
}
