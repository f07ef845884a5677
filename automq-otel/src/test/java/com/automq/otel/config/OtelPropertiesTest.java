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

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OtelPropertiesTest {

    @Test
    void emptyPropertiesUseDefaults() {
        OtelConfig config = new OtelProperties(new Properties()).toConfig();

        assertEquals("App", config.serviceName());
        assertNull(config.enterpriseNumber());
        assertEquals("info", config.level());
        assertFalse(config.emitMetricsToStdout());
        assertTrue(config.emitLogsToStderr());
        assertNull(config.prometheusConfig());
        assertTrue(config.metricsExportTargets().isEmpty());
        assertTrue(config.logExportTargets().isEmpty());
        assertTrue(config.resourceAttributes().isEmpty());
    }

    @Test
    void readsEveryKey() {
        Properties props = new Properties();
        props.setProperty("otel.service.name", "broker");
        props.setProperty("otel.enterprise.number", " 42 ");
        props.setProperty("otel.level", "warn,com.automq=debug");
        props.setProperty("otel.emit.metrics.to.stdout", "true");
        props.setProperty("otel.emit.logs.to.stderr", "false");
        props.setProperty("otel.prometheus.port", "9700");
        props.setProperty("otel.resource.attributes", "region=us-east,zone = a ,broken");
        props.setProperty("otel.metrics.export.targets",
            "http://collector:4317?interval.secs=10&timeout.secs=5&temporality=delta, grpcs://secure:4317?ca.cert.path=/tmp/ca.pem");
        props.setProperty("otel.logs.export.targets", "http://collector:4317?interval.secs=2&export.severity=error");

        OtelConfig config = new OtelProperties(props).toConfig();

        assertEquals("broker", config.serviceName());
        assertEquals("42", config.enterpriseNumber());
        assertEquals("warn,com.automq=debug", config.level());
        assertTrue(config.emitMetricsToStdout());
        assertFalse(config.emitLogsToStderr());
        assertEquals(9700, config.prometheusConfig().port());
        assertEquals(Map.of("region", "us-east", "zone", "a"), config.resourceAttributes());

        assertEquals(2, config.metricsExportTargets().size());
        MetricsExportTarget delta = config.metricsExportTargets().get(0);
        assertEquals("http://collector:4317", delta.url());
        assertEquals(10, delta.intervalSecs());
        assertEquals(5, delta.timeoutSecs());
        assertEquals(Temporality.DELTA, delta.temporality());
        MetricsExportTarget secure = config.metricsExportTargets().get(1);
        assertEquals("grpcs://secure:4317", secure.url());
        assertEquals(60, secure.intervalSecs());
        assertEquals(30, secure.timeoutSecs());
        assertEquals(Temporality.CUMULATIVE, secure.temporality());
        assertEquals("/tmp/ca.pem", secure.caCertPath());

        LogsExportTarget logs = config.logExportTargets().get(0);
        assertEquals(2, logs.intervalSecs());
        assertEquals(Severity.ERROR, logs.exportSeverity());
    }

    @Test
    void malformedValuesAreRejected() {
        Properties badPort = new Properties();
        badPort.setProperty("otel.prometheus.port", "http");
        assertThrows(IllegalArgumentException.class, () -> new OtelProperties(badPort).toConfig());

        Properties badInterval = new Properties();
        badInterval.setProperty("otel.metrics.export.targets", "http://collector:4317?interval.secs=often");
        assertThrows(IllegalArgumentException.class, () -> new OtelProperties(badInterval).toConfig());

        Properties badSeverity = new Properties();
        badSeverity.setProperty("otel.logs.export.targets", "http://collector:4317?export.severity=loud");
        assertThrows(IllegalArgumentException.class, () -> new OtelProperties(badSeverity).toConfig());

        Properties noHost = new Properties();
        noHost.setProperty("otel.logs.export.targets", "collector");
        assertThrows(IllegalArgumentException.class, () -> new OtelProperties(noHost).toConfig());
    }
}
