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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.InstrumentType;
import io.opentelemetry.sdk.metrics.data.AggregationTemporality;
import io.opentelemetry.sdk.metrics.data.DoublePointData;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.PointData;
import io.opentelemetry.sdk.metrics.data.SummaryPointData;
import io.opentelemetry.sdk.metrics.data.ValueAtQuantile;
import io.opentelemetry.sdk.metrics.export.MetricExporter;

/**
 * Writes every exported instrument to a stream as a pretty printed JSON document, one object per instrument.
 */
public class StdoutMetricExporter implements MetricExporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(StdoutMetricExporter.class);

    private final ObjectWriter writer = new ObjectMapper().writerWithDefaultPrettyPrinter();
    private final PrintStream out;
    private volatile boolean shutdown;

    public StdoutMetricExporter() {
        this(System.out);
    }

    public StdoutMetricExporter(PrintStream out) {
        this.out = out;
    }

    @Override
    public CompletableResultCode export(Collection<MetricData> metrics) {
        if (shutdown) {
            return CompletableResultCode.ofFailure();
        }
        try {
            StringBuilder sb = new StringBuilder();
            for (MetricData metric : metrics) {
                sb.append(writer.writeValueAsString(toJson(metric))).append(System.lineSeparator());
            }
            out.print(sb);
            out.flush();
            return CompletableResultCode.ofSuccess();
        } catch (JsonProcessingException e) {
            LOGGER.error("Writing metrics to stdout failed", e);
            return CompletableResultCode.ofFailure();
        }
    }

    static Map<String, Object> toJson(MetricData metric) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("resource", attributes(metric.getResource().getAttributes()));
        json.put("scope", metric.getInstrumentationScopeInfo().getName());
        json.put("name", metric.getName());
        json.put("description", metric.getDescription());
        json.put("unit", metric.getUnit());
        json.put("type", metric.getType().name());
        List<Map<String, Object>> points = new ArrayList<>();
        switch (metric.getType()) {
            case LONG_SUM:
                json.put("temporality", metric.getLongSumData().getAggregationTemporality().name());
                json.put("monotonic", metric.getLongSumData().isMonotonic());
                metric.getLongSumData().getPoints().forEach(p -> points.add(longPoint(p)));
                break;
            case DOUBLE_SUM:
                json.put("temporality", metric.getDoubleSumData().getAggregationTemporality().name());
                json.put("monotonic", metric.getDoubleSumData().isMonotonic());
                metric.getDoubleSumData().getPoints().forEach(p -> points.add(doublePoint(p)));
                break;
            case LONG_GAUGE:
                metric.getLongGaugeData().getPoints().forEach(p -> points.add(longPoint(p)));
                break;
            case DOUBLE_GAUGE:
                metric.getDoubleGaugeData().getPoints().forEach(p -> points.add(doublePoint(p)));
                break;
            case HISTOGRAM:
                json.put("temporality", metric.getHistogramData().getAggregationTemporality().name());
                metric.getHistogramData().getPoints().forEach(p -> points.add(histogramPoint(p)));
                break;
            case SUMMARY:
                metric.getSummaryData().getPoints().forEach(p -> points.add(summaryPoint(p)));
                break;
            default:
                json.put("unsupported", true);
                break;
        }
        json.put("dataPoints", points);
        return json;
    }

    private static Map<String, Object> longPoint(LongPointData point) {
        Map<String, Object> json = point(point);
        json.put("value", point.getValue());
        return json;
    }

    private static Map<String, Object> doublePoint(DoublePointData point) {
        Map<String, Object> json = point(point);
        json.put("value", point.getValue());
        return json;
    }

    private static Map<String, Object> histogramPoint(HistogramPointData point) {
        Map<String, Object> json = point(point);
        json.put("count", point.getCount());
        json.put("sum", point.getSum());
        if (point.hasMin()) {
            json.put("min", point.getMin());
        }
        if (point.hasMax()) {
            json.put("max", point.getMax());
        }
        json.put("bounds", point.getBoundaries());
        json.put("bucketCounts", point.getCounts());
        return json;
    }

    private static Map<String, Object> summaryPoint(SummaryPointData point) {
        Map<String, Object> json = point(point);
        json.put("count", point.getCount());
        json.put("sum", point.getSum());
        Map<String, Object> quantiles = new LinkedHashMap<>();
        for (ValueAtQuantile value : point.getValues()) {
            quantiles.put(String.valueOf(value.getQuantile()), value.getValue());
        }
        json.put("quantiles", quantiles);
        return json;
    }

    private static Map<String, Object> point(PointData point) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("attributes", attributes(point.getAttributes()));
        json.put("startTimeUnixNano", point.getStartEpochNanos());
        json.put("timeUnixNano", point.getEpochNanos());
        return json;
    }

    private static Map<String, Object> attributes(Attributes attributes) {
        Map<String, Object> json = new LinkedHashMap<>();
        attributes.forEach((key, value) -> json.put(key.getKey(), value));
        return json;
    }

    @Override
    public AggregationTemporality getAggregationTemporality(InstrumentType instrumentType) {
        return AggregationTemporality.CUMULATIVE;
    }

    @Override
    public CompletableResultCode flush() {
        out.flush();
        return CompletableResultCode.ofSuccess();
    }

    @Override
    public CompletableResultCode shutdown() {
        shutdown = true;
        return CompletableResultCode.ofSuccess();
    }
}
