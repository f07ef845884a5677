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

import com.automq.otel.OtelConstants;
import com.automq.otel.utils.LogSuppressor;
import com.automq.otel.utils.Threads;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.export.MetricExporter;

/**
 * Periodically exports the registry to one target.
 *
 * <p>Every interval the pipeline takes a snapshot of the registry, applies the target's temporality policy and hands
 * the batch to the exporter, waiting at most the target's timeout. A tick that fails or times out is logged and
 * counted, the next tick runs on schedule. Ticks of one pipeline never overlap and each pipeline runs on its own
 * thread, so a slow target never delays another one.
 */
public class MetricPipeline implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetricPipeline.class);

    private final String name;
    private final InstrumentRegistry registry;
    private final TemporalityPolicy policy;
    private final MetricExporter exporter;
    private final Duration interval;
    private final Duration timeout;
    private final ScheduledExecutorService scheduler;
    private final LogSuppressor failureLogger;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong exportSuccessCount = new AtomicLong();
    private final AtomicLong exportFailureCount = new AtomicLong();

    public MetricPipeline(String name, InstrumentRegistry registry, TemporalityPolicy policy, MetricExporter exporter,
        long intervalSecs, long timeoutSecs) {
        this(name, registry, policy, exporter, Duration.ofSeconds(intervalSecs), Duration.ofSeconds(timeoutSecs));
    }

    MetricPipeline(String name, InstrumentRegistry registry, TemporalityPolicy policy, MetricExporter exporter,
        Duration interval, Duration timeout) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Export interval must be positive, got " + interval);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Export timeout must be positive, got " + timeout);
        }
        if (timeout.compareTo(interval) > 0) {
            LOGGER.warn("Export timeout {} of metric pipeline {} is longer than its interval {}", timeout, name, interval);
        }
        this.name = name;
        this.registry = registry.retain();
        this.policy = policy;
        this.exporter = exporter;
        this.interval = interval;
        this.timeout = timeout;
        this.scheduler = Threads.newSingleThreadScheduledExecutor("otel-metrics-" + name, true, LOGGER);
        this.failureLogger = new LogSuppressor(LOGGER, OtelConstants.EXPORT_FAILURE_LOG_INTERVAL_MS);
    }

    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Metric pipeline " + name + " is closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        long intervalMs = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::exportOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        LOGGER.info("Metric pipeline {} started, interval: {}, timeout: {}, temporality: {}", name, interval, timeout,
            policy.temporality());
    }

    /**
     * Runs one collection and export on the calling thread.
     *
     * @return true if the batch was exported within the timeout
     */
    boolean exportOnce() {
        Collection<MetricData> batch;
        try {
            batch = policy.apply(registry.snapshot());
        } catch (Exception e) {
            exportFailureCount.incrementAndGet();
            failureLogger.warn("Failed to collect metrics for pipeline {}", name, e);
            return false;
        }
        if (batch.isEmpty()) {
            return true;
        }
        CompletableResultCode result;
        try {
            result = exporter.export(batch);
        } catch (Exception e) {
            exportFailureCount.incrementAndGet();
            failureLogger.warn("Failed to export {} metrics for pipeline {}", batch.size(), name, e);
            return false;
        }
        result.join(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!result.isDone()) {
            exportFailureCount.incrementAndGet();
            failureLogger.warn("Export of {} metrics for pipeline {} timed out after {}", batch.size(), name, timeout);
            return false;
        }
        if (!result.isSuccess()) {
            exportFailureCount.incrementAndGet();
            failureLogger.warn("Export of {} metrics for pipeline {} failed", batch.size(), name);
            return false;
        }
        exportSuccessCount.incrementAndGet();
        return true;
    }

    /**
     * Exports the current state right away on the pipeline thread and waits for it, at most the export timeout.
     */
    public boolean flush() {
        if (closed.get()) {
            return false;
        }
        Future<Boolean> future;
        try {
            future = scheduler.submit(this::exportOnce);
        } catch (RejectedExecutionException e) {
            return false;
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warn("Flush of metric pipeline {} did not complete", name, e);
            return false;
        }
    }

    public String name() {
        return name;
    }

    public long exportSuccessCount() {
        return exportSuccessCount.get();
    }

    public long exportFailureCount() {
        return exportFailureCount.get();
    }

    /**
     * Stops the schedule, abandoning any in-flight export.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Threads.shutdownNow(scheduler, 5, TimeUnit.SECONDS, LOGGER);
        exporter.shutdown();
        registry.release();
        LOGGER.info("Metric pipeline {} closed, exported: {}, failed: {}", name, exportSuccessCount.get(), exportFailureCount.get());
    }

    @Override
    public String toString() {
        return "MetricPipeline{name='" + name + "', interval=" + interval + ", timeout=" + timeout + '}';
    }
}
