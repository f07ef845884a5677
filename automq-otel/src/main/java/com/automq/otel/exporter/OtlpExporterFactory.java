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

package com.automq.otel.exporter;

import com.automq.otel.OtelSetupException;
import com.automq.otel.config.LogsExportTarget;
import com.automq.otel.config.MetricsExportTarget;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;

import io.opentelemetry.exporter.otlp.logs.OtlpGrpcLogRecordExporter;
import io.opentelemetry.exporter.otlp.logs.OtlpGrpcLogRecordExporterBuilder;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporterBuilder;
import io.opentelemetry.sdk.logs.export.LogRecordExporter;
import io.opentelemetry.sdk.metrics.export.MetricExporter;

/**
 * Builds the OTLP/gRPC exporters for export targets. {@code grpc://} and {@code grpcs://} are accepted as aliases of
 * {@code http://} and {@code https://}.
 */
public class OtlpExporterFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(OtlpExporterFactory.class);

    public MetricExporter metricExporter(MetricsExportTarget target) throws OtelSetupException {
        String endpoint = normalizeEndpoint(target.url());
        OtlpGrpcMetricExporterBuilder builder = OtlpGrpcMetricExporter.builder()
            .setEndpoint(endpoint)
            .setTimeout(Duration.ofSeconds(target.timeoutSecs()));
        if (StringUtils.isNotBlank(target.caCertPath())) {
            builder.setTrustedCertificates(readCertificates(target.caCertPath()));
        }
        try {
            MetricExporter exporter = builder.build();
            LOGGER.info("OTLP metrics exporter initialized with endpoint: {}, intervalSecs: {}, timeoutSecs: {}, temporality: {}",
                endpoint, target.intervalSecs(), target.timeoutSecs(), target.temporality());
            return exporter;
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new OtelSetupException("Unable to build metrics exporter for " + target.url(), e);
        }
    }

    public LogRecordExporter logExporter(LogsExportTarget target) throws OtelSetupException {
        String endpoint = normalizeEndpoint(target.url());
        OtlpGrpcLogRecordExporterBuilder builder = OtlpGrpcLogRecordExporter.builder()
            .setEndpoint(endpoint)
            .setTimeout(Duration.ofSeconds(target.timeoutSecs()));
        if (StringUtils.isNotBlank(target.caCertPath())) {
            builder.setTrustedCertificates(readCertificates(target.caCertPath()));
        }
        try {
            LogRecordExporter exporter = builder.build();
            LOGGER.info("OTLP logs exporter initialized with endpoint: {}, intervalSecs: {}, timeoutSecs: {}, exportSeverity: {}",
                endpoint, target.intervalSecs(), target.timeoutSecs(), target.exportSeverity());
            return exporter;
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new OtelSetupException("Unable to build logs exporter for " + target.url(), e);
        }
    }

    static String normalizeEndpoint(String url) throws OtelSetupException {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new OtelSetupException("Invalid export target url " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        switch (scheme) {
            case "http":
            case "https":
                return url;
            case "grpc":
                return "http" + url.substring(scheme.length());
            case "grpcs":
                return "https" + url.substring(scheme.length());
            default:
                throw new OtelSetupException("Unsupported scheme '" + uri.getScheme() + "' of export target " + url);
        }
    }

    private static byte[] readCertificates(String caCertPath) throws OtelSetupException {
        try {
            return Files.readAllBytes(Paths.get(caCertPath));
        } catch (IOException e) {
            throw new OtelSetupException("Unable to read CA certificates from " + caCertPath, e);
        }
    }
}
