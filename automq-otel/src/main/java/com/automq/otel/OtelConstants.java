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

package com.automq.otel;

/**
 * Constants for the telemetry orchestrator, including configuration keys, resource attribute keys and default values.
 */
public class OtelConstants {

    //################################################################
    // Service and Resource Attributes
    //################################################################
    public static final String SERVICE_NAME_KEY = "service.name";
    public static final String ENTERPRISE_NUMBER_KEY = "enterprise.number";
    public static final String DEFAULT_SERVICE_NAME = "App";
    public static final String DEFAULT_LEVEL = "info";

    //################################################################
    // Configuration Keys
    //################################################################
    public static final String SERVICE_NAME_CONFIG = "otel.service.name";
    public static final String ENTERPRISE_NUMBER_CONFIG = "otel.enterprise.number";
    public static final String LEVEL_CONFIG = "otel.level";
    public static final String EMIT_METRICS_TO_STDOUT_CONFIG = "otel.emit.metrics.to.stdout";
    public static final String EMIT_LOGS_TO_STDERR_CONFIG = "otel.emit.logs.to.stderr";
    /**
     * The resource attributes attached to every metric and log. The format is key1=value1,key2=value2.
     */
    public static final String RESOURCE_ATTRIBUTES_CONFIG = "otel.resource.attributes";
    public static final String PROMETHEUS_PORT_CONFIG = "otel.prometheus.port";
    /**
     * Comma separated metrics export target URIs, e.g.
     * http://localhost:4317?interval.secs=10&amp;timeout.secs=5&amp;temporality=delta
     */
    public static final String METRICS_EXPORT_TARGETS_CONFIG = "otel.metrics.export.targets";
    /**
     * Comma separated logs export target URIs, e.g.
     * http://localhost:4317?interval.secs=10&amp;timeout.secs=5&amp;export.severity=error
     */
    public static final String LOGS_EXPORT_TARGETS_CONFIG = "otel.logs.export.targets";

    //################################################################
    // Export Target Query Parameters
    //################################################################
    public static final String TARGET_INTERVAL_SECS_PARAM = "interval.secs";
    public static final String TARGET_TIMEOUT_SECS_PARAM = "timeout.secs";
    public static final String TARGET_TEMPORALITY_PARAM = "temporality";
    public static final String TARGET_EXPORT_SEVERITY_PARAM = "export.severity";
    public static final String TARGET_CA_CERT_PATH_PARAM = "ca.cert.path";
    public static final long DEFAULT_TARGET_INTERVAL_SECS = 60;
    public static final long DEFAULT_TARGET_TIMEOUT_SECS = 30;

    //################################################################
    // Prometheus
    //################################################################
    public static final int DEFAULT_PROMETHEUS_PORT = 9600;
    public static final String PROMETHEUS_PATH = "/metrics";

    //################################################################
    // Pipelines
    //################################################################
    /**
     * Cadence of the stdout metrics mirror when no metrics export target is configured.
     */
    public static final long DEFAULT_STDOUT_INTERVAL_SECS = 60;
    public static final int DEFAULT_LOG_MAX_QUEUE_SIZE = 2048;
    public static final int DEFAULT_LOG_MAX_EXPORT_BATCH_SIZE = 512;
    public static final long EXPORT_FAILURE_LOG_INTERVAL_MS = 30_000;
}
