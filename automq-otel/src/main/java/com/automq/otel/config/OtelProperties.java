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

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Reads an {@link OtelConfig} from flat properties, see {@link OtelConstants} for the keys.
 */
public class OtelProperties {
    private static final Logger LOGGER = LoggerFactory.getLogger(OtelProperties.class);

    private final Properties props;

    public OtelProperties(Properties props) {
        this.props = props != null ? props : new Properties();
    }

    public String getServiceName() {
        return props.getProperty(OtelConstants.SERVICE_NAME_CONFIG, OtelConstants.DEFAULT_SERVICE_NAME);
    }

    public String getEnterpriseNumber() {
        String value = props.getProperty(OtelConstants.ENTERPRISE_NUMBER_CONFIG);
        return StringUtils.isBlank(value) ? null : value.trim();
    }

    public String getLevel() {
        return props.getProperty(OtelConstants.LEVEL_CONFIG, OtelConstants.DEFAULT_LEVEL);
    }

    public boolean isEmitMetricsToStdout() {
        return Boolean.parseBoolean(props.getProperty(OtelConstants.EMIT_METRICS_TO_STDOUT_CONFIG, "false"));
    }

    public boolean isEmitLogsToStderr() {
        return Boolean.parseBoolean(props.getProperty(OtelConstants.EMIT_LOGS_TO_STDERR_CONFIG, "true"));
    }

    public PrometheusConfig getPrometheusConfig() {
        String port = props.getProperty(OtelConstants.PROMETHEUS_PORT_CONFIG);
        if (StringUtils.isBlank(port)) {
            return null;
        }
        try {
            return new PrometheusConfig(Integer.parseInt(port.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid Prometheus port: " + port, e);
        }
    }

    public List<Pair<String, String>> getResourceAttributes() {
        String attributes = props.getProperty(OtelConstants.RESOURCE_ATTRIBUTES_CONFIG);
        if (StringUtils.isBlank(attributes)) {
            return Collections.emptyList();
        }
        List<Pair<String, String>> result = new ArrayList<>();
        for (String attribute : attributes.split(",")) {
            String[] kv = attribute.split("=", 2);
            if (kv.length != 2 || StringUtils.isBlank(kv[0])) {
                LOGGER.warn("Ignoring malformed resource attribute: {}", attribute);
                continue;
            }
            result.add(Pair.of(kv[0].trim(), kv[1].trim()));
        }
        return result;
    }

    public List<MetricsExportTarget> getMetricsExportTargets() {
        List<MetricsExportTarget> targets = new ArrayList<>();
        for (String uri : splitUris(props.getProperty(OtelConstants.METRICS_EXPORT_TARGETS_CONFIG))) {
            targets.add(MetricsExportTarget.parse(uri));
        }
        return targets;
    }

    public List<LogsExportTarget> getLogExportTargets() {
        List<LogsExportTarget> targets = new ArrayList<>();
        for (String uri : splitUris(props.getProperty(OtelConstants.LOGS_EXPORT_TARGETS_CONFIG))) {
            targets.add(LogsExportTarget.parse(uri));
        }
        return targets;
    }

    public OtelConfig toConfig() {
        OtelConfig.Builder builder = OtelConfig.builder()
            .serviceName(getServiceName())
            .enterpriseNumber(getEnterpriseNumber())
            .level(getLevel())
            .emitMetricsToStdout(isEmitMetricsToStdout())
            .emitLogsToStderr(isEmitLogsToStderr())
            .prometheusConfig(getPrometheusConfig())
            .metricsExportTargets(getMetricsExportTargets())
            .logExportTargets(getLogExportTargets());
        for (Pair<String, String> attribute : getResourceAttributes()) {
            builder.resourceAttribute(attribute.getKey(), attribute.getValue());
        }
        return builder.build();
    }

    private static List<String> splitUris(String uris) {
        if (StringUtils.isBlank(uris)) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (String uri : uris.split(",")) {
            if (StringUtils.isNotBlank(uri)) {
                result.add(uri.trim());
            }
        }
        return result;
    }
}
