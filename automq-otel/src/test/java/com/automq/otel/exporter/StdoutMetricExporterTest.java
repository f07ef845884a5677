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

import com.automq.otel.metrics.InstrumentRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.resources.Resource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StdoutMetricExporterTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void writesCounterAsJson() throws Exception {
        InstrumentRegistry registry = new InstrumentRegistry(
            Resource.create(Attributes.of(AttributeKey.stringKey("service.name"), "stdout-test")));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StdoutMetricExporter exporter = new StdoutMetricExporter(new PrintStream(out, true, StandardCharsets.UTF_8));
        try {
            registry.getMeter("scope").counterBuilder("requests").setUnit("1").build()
                .add(4, Attributes.of(AttributeKey.stringKey("method"), "GET"));

            assertTrue(exporter.export(registry.snapshot()).isSuccess());

            JsonNode json = mapper.readTree(out.toString(StandardCharsets.UTF_8));
            assertEquals("stdout-test", json.get("resource").get("service.name").asText());
            assertEquals("scope", json.get("scope").asText());
            assertEquals("requests", json.get("name").asText());
            assertEquals("LONG_SUM", json.get("type").asText());
            assertEquals("CUMULATIVE", json.get("temporality").asText());
            assertTrue(json.get("monotonic").asBoolean());
            JsonNode point = json.get("dataPoints").get(0);
            assertEquals(4, point.get("value").asLong());
            assertEquals("GET", point.get("attributes").get("method").asText());
        } finally {
            registry.release();
        }
    }

    @Test
    void writesHistogramBuckets() throws Exception {
        InstrumentRegistry registry = new InstrumentRegistry(Resource.empty());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StdoutMetricExporter exporter = new StdoutMetricExporter(new PrintStream(out, true, StandardCharsets.UTF_8));
        try {
            registry.getMeter("scope").histogramBuilder("latency")
                .setExplicitBucketBoundariesAdvice(List.of(10.0))
                .build()
                .record(4);

            exporter.export(registry.snapshot());

            JsonNode point = mapper.readTree(out.toString(StandardCharsets.UTF_8)).get("dataPoints").get(0);
            assertEquals(1, point.get("count").asLong());
            assertEquals(4.0, point.get("sum").asDouble());
            assertEquals(10.0, point.get("bounds").get(0).asDouble());
            assertEquals(1, point.get("bucketCounts").get(0).asLong());
            assertEquals(0, point.get("bucketCounts").get(1).asLong());
        } finally {
            registry.release();
        }
    }

    @Test
    void exportAfterShutdownFails() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StdoutMetricExporter exporter = new StdoutMetricExporter(new PrintStream(out, true, StandardCharsets.UTF_8));

        exporter.shutdown();

        assertFalse(exporter.export(List.of()).isSuccess());
        assertEquals(0, out.size());
    }
}
