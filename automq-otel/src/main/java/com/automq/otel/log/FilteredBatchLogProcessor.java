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

package com.automq.otel.log;

import com.automq.otel.LogRecordFilter;
import com.automq.otel.OtelConstants;
import com.automq.otel.config.Severity;
import com.automq.otel.utils.LogSuppressor;
import com.automq.otel.utils.Threads;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.logs.LogRecordProcessor;
import io.opentelemetry.sdk.logs.ReadWriteLogRecord;
import io.opentelemetry.sdk.logs.data.LogRecordData;
import io.opentelemetry.sdk.logs.export.LogRecordExporter;

/**
 * Buffers the emitted log records accepted by the target's filter and exports them periodically.
 *
 * <p>Rejected records never enter the buffer. The buffer is bounded; when it is full the oldest record is dropped to
 * make room. Every interval the buffer is drained and exported in batches, each batch bounded by the export timeout. A
 * batch that fails or times out is dropped, records are never exported twice. Records without a severity are never
 * exported.
 *
 * <p>{@link #shutdown()} abandons whatever is still buffered, call {@link #forceFlush()} first to export it.
 */
public class FilteredBatchLogProcessor implements LogRecordProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(FilteredBatchLogProcessor.class);

    private final String name;
    private final LogRecordExporter exporter;
    private final LogRecordFilter filter;
    private final Duration interval;
    private final Duration timeout;
    private final int maxQueueSize;
    private final int maxExportBatchSize;
    private final Deque<LogRecordData> queue = new ArrayDeque<>();
    private final ScheduledExecutorService scheduler;
    private final LogSuppressor failureLogger;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong droppedCount = new AtomicLong();
    private final AtomicLong filteredCount = new AtomicLong();
    private final AtomicLong exportedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    public FilteredBatchLogProcessor(String name, LogRecordExporter exporter, LogRecordFilter filter,
        long intervalSecs, long timeoutSecs) {
        this(name, exporter, filter, Duration.ofSeconds(intervalSecs), Duration.ofSeconds(timeoutSecs),
            OtelConstants.DEFAULT_LOG_MAX_QUEUE_SIZE, OtelConstants.DEFAULT_LOG_MAX_EXPORT_BATCH_SIZE);
    }

    FilteredBatchLogProcessor(String name, LogRecordExporter exporter, LogRecordFilter filter, Duration interval,
        Duration timeout, int maxQueueSize, int maxExportBatchSize) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Export interval must be positive, got " + interval);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Export timeout must be positive, got " + timeout);
        }
        if (maxQueueSize <= 0 || maxExportBatchSize <= 0) {
            throw new IllegalArgumentException("Queue size and batch size must be positive");
        }
        if (timeout.compareTo(interval) > 0) {
            LOGGER.warn("Export timeout {} of log pipeline {} is longer than its interval {}", timeout, name, interval);
        }
        this.name = name;
        this.exporter = exporter;
        this.filter = filter;
        this.interval = interval;
        this.timeout = timeout;
        this.maxQueueSize = maxQueueSize;
        this.maxExportBatchSize = Math.min(maxExportBatchSize, maxQueueSize);
        this.scheduler = Threads.newSingleThreadScheduledExecutor("otel-logs-" + name, true, LOGGER);
        this.failureLogger = new LogSuppressor(LOGGER, OtelConstants.EXPORT_FAILURE_LOG_INTERVAL_MS);
    }

    public void start() {
        if (closed.get() || !started.compareAndSet(false, true)) {
            return;
        }
        long intervalMs = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::exportBuffered, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void onEmit(Context context, ReadWriteLogRecord logRecord) {
        if (closed.get()) {
            return;
        }
        LogRecordData data = logRecord.toLogRecordData();
        if (!accept(data)) {
            filteredCount.incrementAndGet();
            return;
        }
        synchronized (queue) {
            if (queue.size() >= maxQueueSize) {
                queue.pollFirst();
                droppedCount.incrementAndGet();
            }
            queue.addLast(data);
        }
    }

    /**
     * Drains the buffer and exports it.
     *
     * @return true if every batch was exported
     */
    boolean exportBuffered() {
        List<LogRecordData> drained;
        synchronized (queue) {
            if (queue.isEmpty()) {
                return true;
            }
            drained = new ArrayList<>(queue);
            queue.clear();
        }
        boolean success = true;
        for (int from = 0; from < drained.size(); from += maxExportBatchSize) {
            List<LogRecordData> batch = drained.subList(from, Math.min(from + maxExportBatchSize, drained.size()));
            success &= exportBatch(batch);
        }
        return success;
    }

    private boolean accept(LogRecordData record) {
        Severity severity = Severity.fromOtel(record.getSeverity());
        if (severity == null) {
            return false;
        }
        return filter.test(record.getInstrumentationScopeInfo().getName(), severity);
    }

    private boolean exportBatch(List<LogRecordData> batch) {
        try {
            CompletableResultCode result = exporter.export(new ArrayList<>(batch));
            result.join(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!result.isDone()) {
                failedCount.addAndGet(batch.size());
                failureLogger.warn("Export of {} log records for pipeline {} timed out after {}", batch.size(), name, timeout);
                return false;
            }
            if (!result.isSuccess()) {
                failedCount.addAndGet(batch.size());
                failureLogger.warn("Export of {} log records for pipeline {} failed", batch.size(), name);
                return false;
            }
            exportedCount.addAndGet(batch.size());
            return true;
        } catch (Exception e) {
            failedCount.addAndGet(batch.size());
            failureLogger.warn("Export of {} log records for pipeline {} failed", batch.size(), name, e);
            return false;
        }
    }

    @Override
    public CompletableResultCode forceFlush() {
        if (closed.get()) {
            return CompletableResultCode.ofSuccess();
        }
        Future<Boolean> future;
        try {
            future = scheduler.submit(this::exportBuffered);
        } catch (RejectedExecutionException e) {
            return CompletableResultCode.ofFailure();
        }
        try {
            // each batch may take up to the timeout
            long batches = Math.max(1, (maxQueueSize + maxExportBatchSize - 1) / maxExportBatchSize);
            return Boolean.TRUE.equals(future.get(timeout.toMillis() * batches, TimeUnit.MILLISECONDS))
                ? CompletableResultCode.ofSuccess() : CompletableResultCode.ofFailure();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableResultCode.ofFailure();
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warn("Flush of log pipeline {} did not complete", name, e);
            return CompletableResultCode.ofFailure();
        }
    }

    @Override
    public CompletableResultCode shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return CompletableResultCode.ofSuccess();
        }
        Threads.shutdownNow(scheduler, 5, TimeUnit.SECONDS, LOGGER);
        int abandoned;
        synchronized (queue) {
            abandoned = queue.size();
            queue.clear();
        }
        LOGGER.info("Log pipeline {} closed, exported: {}, failed: {}, dropped: {}, abandoned: {}", name,
            exportedCount.get(), failedCount.get(), droppedCount.get(), abandoned);
        return exporter.shutdown();
    }

    public String name() {
        return name;
    }

    public int queueSize() {
        synchronized (queue) {
            return queue.size();
        }
    }

    /**
     * @return records dropped because the buffer was full
     */
    public long droppedCount() {
        return droppedCount.get();
    }

    public long filteredCount() {
        return filteredCount.get();
    }

    public long exportedCount() {
        return exportedCount.get();
    }

    public long failedCount() {
        return failedCount.get();
    }

    @Override
    public String toString() {
        return "FilteredBatchLogProcessor{name='" + name + "', interval=" + interval + ", timeout=" + timeout
            + ", maxQueueSize=" + maxQueueSize + ", maxExportBatchSize=" + maxExportBatchSize + '}';
    }
}
