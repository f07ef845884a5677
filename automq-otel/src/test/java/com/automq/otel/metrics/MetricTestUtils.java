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

import java.util.Collection;
import java.util.List;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.common.InstrumentationScopeInfo;
import io.opentelemetry.sdk.metrics.data.AggregationTemporality;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.internal.data.ImmutableLongPointData;
import io.opentelemetry.sdk.metrics.internal.data.ImmutableMetricData;
import io.opentelemetry.sdk.metrics.internal.data.ImmutableSumData;
import io.opentelemetry.sdk.resources.Resource;

final class MetricTestUtils {

    private MetricTestUtils() {
    }

    static MetricData find(Collection<MetricData> metrics, String name) {
        return metrics.stream()
            .filter(m -> m.getName().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("metric " + name + " not found in " + metrics));
    }

    static long longSum(Collection<MetricData> metrics, String name) {
        return find(metrics, name).getLongSumData().getPoints().stream().mapToLong(p -> p.getValue()).sum();
    }

    static double doubleSum(Collection<MetricData> metrics, String name) {
        return find(metrics, name).getDoubleSumData().getPoints().stream().mapToDouble(p -> p.getValue()).sum();
    }

    static MetricData cumulativeCounter(String name, long epochNanos, long value) {
        return ImmutableMetricData.createLongSum(
            Resource.empty(),
            InstrumentationScopeInfo.create("test"),
            name,
            "",
            "1",
            ImmutableSumData.create(true, AggregationTemporality.CUMULATIVE,
                List.of(ImmutableLongPointData.create(0, epochNanos, Attributes.empty(), value))));
    }
}
