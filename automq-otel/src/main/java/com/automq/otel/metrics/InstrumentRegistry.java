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

import java.io.Closeable;
import java.util.Collection;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.resources.Resource;

/**
 * The process-wide instrument registry shared by every metric pipeline and the scrape endpoint.
 *
 * <p>Instruments are created through {@link #getMeter(String)} and recorded concurrently by application code.
 * {@link #snapshot()} returns a point-in-time cumulative view of all of them. The handle is reference counted: the
 * creator holds the first reference, every component that keeps the registry beyond its own call should
 * {@link #retain()} it and {@link #release()} it when done. The meter provider is shut down with the last reference.
 */
public class InstrumentRegistry implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(InstrumentRegistry.class);
    private static final long SHUTDOWN_TIMEOUT_SECS = 10;

    private final Resource resource;
    private final RegistrySnapshotReader reader;
    private final SdkMeterProvider meterProvider;
    private final AtomicInteger refCount = new AtomicInteger(1);

    public InstrumentRegistry(Resource resource) {
        this.resource = resource;
        this.reader = new RegistrySnapshotReader();
        this.meterProvider = SdkMeterProvider.builder()
            .setResource(resource)
            .registerMetricReader(reader)
            .build();
    }

    public Meter getMeter(String scope) {
        return meterProvider.get(scope);
    }

    public SdkMeterProvider meterProvider() {
        return meterProvider;
    }

    public Resource resource() {
        return resource;
    }

    /**
     * @return the cumulative state of every instrument, empty once the registry is released
     */
    public Collection<MetricData> snapshot() {
        return reader.snapshot();
    }

    public InstrumentRegistry retain() {
        for (; ; ) {
            int count = refCount.get();
            if (count <= 0) {
                throw new IllegalStateException("Instrument registry already released");
            }
            if (refCount.compareAndSet(count, count + 1)) {
                return this;
            }
        }
    }

    public void release() {
        int count = refCount.decrementAndGet();
        if (count == 0) {
            CompletableResultCode result = meterProvider.shutdown().join(SHUTDOWN_TIMEOUT_SECS, TimeUnit.SECONDS);
            if (!result.isSuccess()) {
                LOGGER.warn("Meter provider did not shut down cleanly");
            }
        } else if (count < 0) {
            refCount.incrementAndGet();
            throw new IllegalStateException("Instrument registry released more times than retained");
        }
    }

    public int refCount() {
        return refCount.get();
    }

    @Override
    public void close() {
        release();
    }
}
