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

package com.automq.otel.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.AggregationTemporality;
import io.opentelemetry.sdk.metrics.data.DoublePointData;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.SumData;
import io.opentelemetry.sdk.metrics.internal.data.ImmutableDoublePointData;
import io.opentelemetry.sdk.metrics.internal.data.ImmutableHistogramData;
import io.opentelemetry.sdk.metrics.internal.data.ImmutableHistogramPointData;
import io.opentelemetry.sdk.metrics.internal.data.ImmutableLongPointData;
import io.opentelemetry.sdk.metrics.internal.data.ImmutableMetricData;
import io.opentelemetry.sdk.metrics.internal.data.ImmutableSumData;

/**
 * Reports for every sum and histogram stream only what changed since the previous collection of the same target.
 *
 * <p>The baseline moves forward on every collection, whether or not the export that follows succeeds, so a failed
 * export leaves a gap in the delta series. A monotonic stream whose value went down is treated as restarted and its
 * current value is reported as is. A stream missing from a collection is forgotten, when it comes back its current
 * value is reported as is. Gauges and summaries are passed through unchanged.
 */
public class DeltaTemporalityPolicy implements TemporalityPolicy {
    private static final Logger LOGGER = LoggerFactory.getLogger(DeltaTemporalityPolicy.class);

    private final DeltaStateCache cache = new DeltaStateCache();

    @Override
    public AggregationTemporality temporality() {
        return AggregationTemporality.DELTA;
    }

    @Override
    public Collection<MetricData> apply(Collection<MetricData> snapshot) {
        List<MetricData> result = new ArrayList<>(snapshot.size());
        for (MetricData metric : snapshot) {
            switch (metric.getType()) {
                case LONG_SUM:
                    result.add(deltaLongSum(metric));
                    break;
                case DOUBLE_SUM:
                    result.add(deltaDoubleSum(metric));
                    break;
                case HISTOGRAM:
                    result.add(deltaHistogram(metric));
                    break;
                default:
                    result.add(metric);
                    break;
            }
        }
        int evicted = cache.evictUntouched();
        if (evicted > 0) {
            LOGGER.debug("Forgot {} streams missing from the latest collection", evicted);
        }
        return result;
    }

    int trackedStreams() {
        return cache.size();
    }

    private MetricData deltaLongSum(MetricData metric) {
        SumData<LongPointData> data = metric.getLongSumData();
        if (data.getAggregationTemporality() == AggregationTemporality.DELTA) {
            return metric;
        }
        List<LongPointData> points = new ArrayList<>(data.getPoints().size());
        for (LongPointData point : data.getPoints()) {
            LongPointData previous = cache.swap(streamKey(metric, point.getAttributes()), point);
            long value = point.getValue();
            long start = point.getStartEpochNanos();
            if (previous != null) {
                long delta = value - previous.getValue();
                if (delta >= 0 || !data.isMonotonic()) {
                    value = delta;
                    start = previous.getEpochNanos();
                } else {
                    LOGGER.debug("Counter {} went from {} to {}, treat it as a reset", metric.getName(), previous.getValue(), value);
                }
            }
            points.add(ImmutableLongPointData.create(start, point.getEpochNanos(), point.getAttributes(), value));
        }
        return ImmutableMetricData.createLongSum(
            metric.getResource(),
            metric.getInstrumentationScopeInfo(),
            metric.getName(),
            metric.getDescription(),
            metric.getUnit(),
            ImmutableSumData.create(data.isMonotonic(), AggregationTemporality.DELTA, points));
    }

    private MetricData deltaDoubleSum(MetricData metric) {
        SumData<DoublePointData> data = metric.getDoubleSumData();
        if (data.getAggregationTemporality() == AggregationTemporality.DELTA) {
            return metric;
        }
        List<DoublePointData> points = new ArrayList<>(data.getPoints().size());
        for (DoublePointData point : data.getPoints()) {
            DoublePointData previous = cache.swap(streamKey(metric, point.getAttributes()), point);
            double value = point.getValue();
            long start = point.getStartEpochNanos();
            if (previous != null) {
                double delta = value - previous.getValue();
                if (delta >= 0 || !data.isMonotonic()) {
                    value = delta;
                    start = previous.getEpochNanos();
                } else {
                    LOGGER.debug("Counter {} went from {} to {}, treat it as a reset", metric.getName(), previous.getValue(), value);
                }
            }
            points.add(ImmutableDoublePointData.create(start, point.getEpochNanos(), point.getAttributes(), value));
        }
        return ImmutableMetricData.createDoubleSum(
            metric.getResource(),
            metric.getInstrumentationScopeInfo(),
            metric.getName(),
            metric.getDescription(),
            metric.getUnit(),
            ImmutableSumData.create(data.isMonotonic(), AggregationTemporality.DELTA, points));
    }

    private MetricData deltaHistogram(MetricData metric) {
        if (metric.getHistogramData().getAggregationTemporality() == AggregationTemporality.DELTA) {
            return metric;
        }
        Collection<HistogramPointData> cumulative = metric.getHistogramData().getPoints();
        List<HistogramPointData> points = new ArrayList<>(cumulative.size());
        for (HistogramPointData point : cumulative) {
            HistogramPointData previous = cache.swap(streamKey(metric, point.getAttributes()), point);
            if (previous == null || isReset(previous, point)) {
                points.add(point);
                continue;
            }
            List<Long> counts = new ArrayList<>(point.getCounts().size());
            for (int i = 0; i < point.getCounts().size(); i++) {
                counts.add(point.getCounts().get(i) - previous.getCounts().get(i));
            }
            // min and max of the interval are unknown
            points.add(ImmutableHistogramPointData.create(
                previous.getEpochNanos(),
                point.getEpochNanos(),
                point.getAttributes(),
                point.getSum() - previous.getSum(),
                false,
                0,
                false,
                0,
                point.getBoundaries(),
                counts));
        }
        return ImmutableMetricData.createDoubleHistogram(
            metric.getResource(),
            metric.getInstrumentationScopeInfo(),
            metric.getName(),
            metric.getDescription(),
            metric.getUnit(),
            ImmutableHistogramData.create(AggregationTemporality.DELTA, points));
    }

    private static boolean isReset(HistogramPointData previous, HistogramPointData current) {
        if (current.getCount() < previous.getCount() || !current.getBoundaries().equals(previous.getBoundaries())) {
            return true;
        }
        for (int i = 0; i < current.getCounts().size(); i++) {
            if (current.getCounts().get(i) < previous.getCounts().get(i)) {
                return true;
            }
        }
        return false;
    }

    private static DeltaStateCache.StreamKey streamKey(MetricData metric, Attributes attributes) {
        return DeltaStateCache.key(metric.getInstrumentationScopeInfo(), metric.getName(), attributes);
    }
}
