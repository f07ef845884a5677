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
import com.automq.otel.utils.URIUtils;

import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Map;

/**
 * A logs export target.
 *
 * <p>The URI form accepted by {@link #parse(String)} is
 * {@code http://host:4317?interval.secs=10&timeout.secs=5&export.severity=error[&ca.cert.path=/path/ca.pem]}.
 *
 * @param url            address of the OTLP compatible collector
 * @param intervalSecs   how often buffered records are flushed
 * @param timeoutSecs    how long a single push may take before it is abandoned
 * @param exportSeverity minimum severity exported to this target, null to export everything the level filter lets through
 * @param caCertPath     optional PEM file with the certificates trusted for TLS endpoints
 */
public record LogsExportTarget(String url, long intervalSecs, long timeoutSecs, Severity exportSeverity,
                               String caCertPath) {

    public LogsExportTarget {
        if (StringUtils.isBlank(url)) {
            throw new IllegalArgumentException("Logs export target url is required");
        }
    }

    public LogsExportTarget(String url, long intervalSecs, long timeoutSecs, Severity exportSeverity) {
        this(url, intervalSecs, timeoutSecs, exportSeverity, null);
    }

    public LogsExportTarget(String url, long intervalSecs, long timeoutSecs) {
        this(url, intervalSecs, timeoutSecs, null, null);
    }

    public static LogsExportTarget parse(String uriStr) {
        try {
            URI uri = new URI(uriStr.trim());
            if (StringUtils.isBlank(uri.getScheme()) || StringUtils.isBlank(uri.getAuthority())) {
                throw new IllegalArgumentException("Invalid logs export target URI: " + uriStr);
            }
            Map<String, List<String>> queries = URIUtils.parseQuery(uri);
            String severity = URIUtils.param(queries, OtelConstants.TARGET_EXPORT_SEVERITY_PARAM);
            return new LogsExportTarget(
                URIUtils.endpoint(uri),
                URIUtils.longParam(queries, OtelConstants.TARGET_INTERVAL_SECS_PARAM, OtelConstants.DEFAULT_TARGET_INTERVAL_SECS),
                URIUtils.longParam(queries, OtelConstants.TARGET_TIMEOUT_SECS_PARAM, OtelConstants.DEFAULT_TARGET_TIMEOUT_SECS),
                StringUtils.isBlank(severity) ? null : Severity.fromString(severity),
                URIUtils.param(queries, OtelConstants.TARGET_CA_CERT_PATH_PARAM));
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid logs export target URI: " + uriStr, e);
        }
    }
}
