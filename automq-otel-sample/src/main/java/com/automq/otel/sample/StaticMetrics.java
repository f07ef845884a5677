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

package com.automq.otel.sample;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.DoubleUpDownCounter;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.ObservableLongGauge;

/**
 * The instruments recorded by the sample application.
 */
public class StaticMetrics {
    private static final Logger LOGGER = LoggerFactory.getLogger(StaticMetrics.class);
    public static final String METER_NAME = "sample.app";

    private final LongCounter requests;
    private final LongHistogram requestSizes;
    private final DoubleHistogram requestSizesF64;
    private final LongCounter connectionErrors;
    private final DoubleUpDownCounter updownCounter;
    private final AtomicLong lastIteration = new AtomicLong();
    private final ObservableLongGauge observableGauge;

    public StaticMetrics(Meter meter) {
        LOGGER.info("initializing static metrics");
        this.requests = meter.counterBuilder("requests").build();
        this.requestSizes = meter.histogramBuilder("requestsizes").ofLongs().build();
        this.requestSizesF64 = meter.histogramBuilder("requestsizes.f64").build();
        this.connectionErrors = meter.counterBuilder("connectionerrors").build();
        this.updownCounter = meter.upDownCounterBuilder("updown_counter").ofDoubles().build();
        this.observableGauge = meter.gaugeBuilder("observable_gauge")
            .ofLongs()
            .buildWithCallback(measurement -> measurement.record(lastIteration.get()));
    }

    public void recordIteration(long iteration, double value, boolean up) {
        requests.add(1);
        requestSizes.record(25);
        requestSizesF64.record(value);
        connectionErrors.add(1);
        updownCounter.add(up ? value : -value);
        lastIteration.set(iteration);
    }

    public void close() {
        observableGauge.close();
    }
}
