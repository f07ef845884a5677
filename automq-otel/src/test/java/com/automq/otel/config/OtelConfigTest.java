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

import com.automq.otel.OtelSetupException;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OtelConfigTest {

    @Test
    void builderKeepsTargetOrderAndLastAttributeValue() {
        OtelConfig config = OtelConfig.builder()
            .addMetricsExportTarget(new MetricsExportTarget("http://a:4317", 10, 5))
            .addMetricsExportTarget(new MetricsExportTarget("http://b:4317", 20, 5, Temporality.DELTA))
            .resourceAttribute("k", "v1")
            .resourceAttribute("k", "v2")
            .build();

        assertEquals(List.of("http://a:4317", "http://b:4317"),
            List.of(config.metricsExportTargets().get(0).url(), config.metricsExportTargets().get(1).url()));
        assertEquals(Temporality.CUMULATIVE, config.metricsExportTargets().get(0).temporality());
        assertEquals("v2", config.resourceAttributes().get("k"));
        assertDoesNotThrow(config::validate);
    }

    @Test
    void validateRejectsUnusableConfig() {
        assertThrows(OtelSetupException.class, () -> OtelConfig.builder().serviceName(" ").build().validate());
        assertThrows(OtelSetupException.class, () -> OtelConfig.builder()
            .addMetricsExportTarget(new MetricsExportTarget("http://a:4317", 0, 5))
            .build()
            .validate());
        assertThrows(OtelSetupException.class, () -> OtelConfig.builder()
            .addLogExportTarget(new LogsExportTarget("http://a:4317", 10, -1))
            .build()
            .validate());
    }

    @Test
    void builderMisuseIsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> new MetricsExportTarget("", 10, 5));
        assertThrows(IllegalArgumentException.class, () -> new PrometheusConfig(70000));
        assertThrows(IllegalArgumentException.class, () -> OtelConfig.builder().resourceAttribute(" ", "v"));
        assertThrows(IllegalArgumentException.class, () -> Temporality.fromString("sometimes"));
    }

    @Test
    void defaults() {
        assertEquals(9600, new PrometheusConfig().port());
        assertEquals(RegexFilter.FilterAction.DISALLOW, new RegexFilter("a", "b").action());
        assertNull(new LogsExportTarget("http://a:4317", 1, 1).exportSeverity());
    }
}
