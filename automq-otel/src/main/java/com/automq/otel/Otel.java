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

package com.automq.otel;

import com.automq.otel.config.LogsExportTarget;
import com.automq.otel.config.MetricsExportTarget;
import com.automq.otel.config.OtelConfig;
import com.automq.otel.config.PrometheusConfig;
import com.automq.otel.exporter.OtlpExporterFactory;
import com.automq.otel.exporter.StdoutMetricExporter;
import com.automq.otel.log.FilteredBatchLogProcessor;
import com.automq.otel.log.LevelFilter;
import com.automq.otel.log.OtelLogAppender;
import com.automq.otel.log.SyslogWriter;
import com.automq.otel.metrics.CumulativeTemporalityPolicy;
import com.automq.otel.metrics.InstrumentRegistry;
import com.automq.otel.metrics.MetricPipeline;
import com.automq.otel.prometheus.ScrapeServer;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

import java.io.Closeable;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.OpenTelemetrySdkBuilder;
import io.opentelemetry.sdk.logs.SdkLoggerProvider;
import io.opentelemetry.sdk.logs.SdkLoggerProviderBuilder;
import io.opentelemetry.sdk.logs.export.LogRecordExporter;
import io.opentelemetry.sdk.metrics.export.MetricExporter;
import io.opentelemetry.sdk.resources.Resource;

/**
 * Owns every telemetry pipeline of the process.
 *
 * <p>{@link #create(OtelConfig)} performs the one-time setup and fails fast on a configuration that cannot work.
 * {@link #start()} then starts one metric pipeline per metrics target, one log pipeline per logs target, the stdout
 * mirror and the Prometheus endpoint, each running independently. {@link #run()} does the same and blocks until
 * {@link #cancel()} is called or the calling thread is interrupted.
 *
 * <pre>{@code
 * Otel otel = Otel.create(OtelConfig.builder().serviceName("my-app").prometheusConfig(new PrometheusConfig()).build());
 * LongCounter requests = otel.getMeter("my-app").counterBuilder("requests").build();
 * otel.start();
 * ...
 * otel.shutdown();
 * }</pre>
 */
public class Otel implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(Otel.class);
    private static final long FLUSH_TIMEOUT_SECS = 30;

    private final OtelConfig config;
    private final InstrumentRegistry registry;
    private final LevelFilter levelFilter;
    private final List<MetricPipeline> metricPipelines;
    private final MetricPipeline stdoutPipeline;
    private final SdkLoggerProvider loggerProvider;
    private final List<FilteredBatchLogProcessor> logProcessors;
    private final OtelLogAppender logAppender;
    private final ScrapeServer scrapeServer;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private Otel(OtelConfig config, InstrumentRegistry registry, LevelFilter levelFilter,
        List<MetricPipeline> metricPipelines, MetricPipeline stdoutPipeline, SdkLoggerProvider loggerProvider,
        List<FilteredBatchLogProcessor> logProcessors, OtelLogAppender logAppender, ScrapeServer scrapeServer) {
        this.config = config;
        this.registry = registry;
        this.levelFilter = levelFilter;
        this.metricPipelines = Collections.unmodifiableList(metricPipelines);
        this.stdoutPipeline = stdoutPipeline;
        this.loggerProvider = loggerProvider;
        this.logProcessors = Collections.unmodifiableList(logProcessors);
        this.logAppender = logAppender;
        this.scrapeServer = scrapeServer;
    }

    public static Otel create(OtelConfig config) throws OtelSetupException {
        return create(config, new OtlpExporterFactory());
    }

    static Otel create(OtelConfig config, OtlpExporterFactory exporterFactory) throws OtelSetupException {
        config.validate();
        LevelFilter levelFilter = LevelFilter.parse(config.level());
        Resource resource = buildResource(config);

        InstrumentRegistry registry = new InstrumentRegistry(resource);
        ScrapeServer scrapeServer = null;
        List<MetricPipeline> metricPipelines = new ArrayList<>();
        MetricPipeline stdoutPipeline = null;
        SdkLoggerProvider loggerProvider = null;
        List<FilteredBatchLogProcessor> logProcessors = new ArrayList<>();
        OtelLogAppender logAppender = null;
        try {
            PrometheusConfig prometheusConfig = config.prometheusConfig();
            if (prometheusConfig != null) {
                scrapeServer = new ScrapeServer(prometheusConfig.port(), registry);
            }

            for (MetricsExportTarget target : config.metricsExportTargets()) {
                MetricExporter exporter;
                try {
                    exporter = exporterFactory.metricExporter(target);
                } catch (OtelSetupException e) {
                    LOGGER.error("Unable to export metrics to {}, skipping the target", target.url(), e);
                    continue;
                }
                metricPipelines.add(new MetricPipeline(pipelineName(target.url(), metricPipelines.size()), registry,
                    TargetTranslator.temporalityPolicy(target), exporter, target.intervalSecs(), target.timeoutSecs()));
            }

            if (config.emitMetricsToStdout()) {
                long intervalSecs = config.metricsExportTargets().stream()
                    .mapToLong(MetricsExportTarget::intervalSecs)
                    .min()
                    .orElse(OtelConstants.DEFAULT_STDOUT_INTERVAL_SECS);
                stdoutPipeline = new MetricPipeline("stdout", registry, CumulativeTemporalityPolicy.INSTANCE,
                    new StdoutMetricExporter(), intervalSecs, intervalSecs);
            }

            if (config.emitLogsToStderr() || !config.logExportTargets().isEmpty()) {
                SdkLoggerProviderBuilder builder = SdkLoggerProvider.builder().setResource(resource);
                for (LogsExportTarget target : config.logExportTargets()) {
                    LogRecordExporter exporter;
                    try {
                        exporter = exporterFactory.logExporter(target);
                    } catch (OtelSetupException e) {
                        LOGGER.error("Unable to export logs to {}, skipping the target", target.url(), e);
                        continue;
                    }
                    FilteredBatchLogProcessor processor = new FilteredBatchLogProcessor(
                        pipelineName(target.url(), logProcessors.size()), exporter,
                        TargetTranslator.logRecordFilter(target, levelFilter), target.intervalSecs(), target.timeoutSecs());
                    logProcessors.add(processor);
                    builder.addLogRecordProcessor(processor);
                }
                loggerProvider = builder.build();

                SyslogWriter syslogWriter = config.emitLogsToStderr()
                    ? new SyslogWriter(config.serviceName(), hostName()) : null;
                OtelLogAppender appender = new OtelLogAppender(loggerProvider, syslogWriter, config.regexFilters());
                if (appender.attachToRoot()) {
                    logAppender = appender;
                    levelFilter.apply();
                } else {
                    LOGGER.warn("Unable to initialize the log bridge as another one is already installed, logs of this instance are not exported");
                    appender.close();
                    loggerProvider.shutdown().join(FLUSH_TIMEOUT_SECS, TimeUnit.SECONDS);
                    loggerProvider = null;
                    logProcessors.clear();
                }
            }
        } catch (OtelSetupException | RuntimeException e) {
            metricPipelines.forEach(MetricPipeline::close);
            if (stdoutPipeline != null) {
                stdoutPipeline.close();
            }
            if (scrapeServer != null) {
                scrapeServer.close();
            }
            if (loggerProvider != null) {
                loggerProvider.shutdown();
            }
            registry.release();
            throw e;
        }

        if (!SLF4JBridgeHandler.isInstalled()) {
            SLF4JBridgeHandler.removeHandlersForRootLogger();
            SLF4JBridgeHandler.install();
        }
        if (config.registerGlobal()) {
            registerGlobal(registry, loggerProvider);
        }
        LOGGER.info("Telemetry initialized: {}", config);
        return new Otel(config, registry, levelFilter, metricPipelines, stdoutPipeline, loggerProvider, logProcessors,
            logAppender, scrapeServer);
    }

    static Resource buildResource(OtelConfig config) {
        AttributesBuilder attributes = Attributes.builder();
        config.resourceAttributes().forEach((key, value) -> attributes.put(key, value));
        attributes.put(OtelConstants.SERVICE_NAME_KEY, config.serviceName());
        if (StringUtils.isNotBlank(config.enterpriseNumber())) {
            attributes.put(OtelConstants.ENTERPRISE_NUMBER_KEY, config.enterpriseNumber());
        }
        return Resource.create(attributes.build());
    }

    private static void registerGlobal(InstrumentRegistry registry, SdkLoggerProvider loggerProvider) {
        OpenTelemetrySdkBuilder builder = OpenTelemetrySdk.builder().setMeterProvider(registry.meterProvider());
        if (loggerProvider != null) {
            builder.setLoggerProvider(loggerProvider);
        }
        try {
            GlobalOpenTelemetry.set(builder.build());
        } catch (IllegalStateException e) {
            LOGGER.warn("GlobalOpenTelemetry is already set, keeping the existing instance");
        }
    }

    private static String pipelineName(String url, int index) {
        return index + "-" + url.replaceAll("[^a-zA-Z0-9.:_-]", "_");
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String hostName = System.getenv("HOSTNAME");
            return StringUtils.isBlank(hostName) ? "localhost" : hostName;
        }
    }

    /**
     * Starts every pipeline and the Prometheus endpoint. Calling it more than once has no effect.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Telemetry is already cancelled");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        metricPipelines.forEach(MetricPipeline::start);
        if (stdoutPipeline != null) {
            stdoutPipeline.start();
        }
        logProcessors.forEach(FilteredBatchLogProcessor::start);
        if (scrapeServer != null) {
            scrapeServer.start();
        }
        LOGGER.info("Telemetry started with {} metric pipeline(s), {} log pipeline(s), stdout: {}, prometheus port: {}",
            metricPipelines.size(), logProcessors.size(), stdoutPipeline != null, scrapePort());
    }

    /**
     * Starts and blocks until {@link #cancel()} is called. An interrupt of the calling thread cancels as well.
     */
    public void run() {
        start();
        try {
            cancelled.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
        }
    }

    /**
     * Stops everything right away: pending exports are abandoned, the Prometheus port is released, the log bridge
     * is detached and the log levels are restored.
     */
    public void cancel() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (scrapeServer != null) {
            scrapeServer.close();
        }
        metricPipelines.forEach(MetricPipeline::close);
        if (stdoutPipeline != null) {
            stdoutPipeline.close();
        }
        if (logAppender != null) {
            logAppender.detachFromRoot();
            levelFilter.restore();
        }
        if (loggerProvider != null) {
            loggerProvider.shutdown().join(FLUSH_TIMEOUT_SECS, TimeUnit.SECONDS);
        }
        registry.release();
        cancelled.countDown();
        LOGGER.info("Telemetry cancelled");
    }

    /**
     * Exports pending metrics and logs, then cancels.
     */
    public void shutdown() {
        if (closed.get()) {
            return;
        }
        for (MetricPipeline pipeline : metricPipelines) {
            if (!pipeline.flush()) {
                LOGGER.warn("Encountered error while flushing metric pipeline {}", pipeline.name());
            }
        }
        if (stdoutPipeline != null) {
            stdoutPipeline.flush();
        }
        if (loggerProvider != null && !loggerProvider.forceFlush().join(FLUSH_TIMEOUT_SECS, TimeUnit.SECONDS).isSuccess()) {
            LOGGER.warn("Encountered error while flushing log pipelines");
        }
        cancel();
    }

    @Override
    public void close() {
        cancel();
    }

    public Meter getMeter(String scope) {
        return registry.getMeter(scope);
    }

    public InstrumentRegistry registry() {
        return registry;
    }

    public OtelConfig config() {
        return config;
    }

    public LevelFilter levelFilter() {
        return levelFilter;
    }

    public List<MetricPipeline> metricPipelines() {
        return metricPipelines;
    }

    public List<FilteredBatchLogProcessor> logProcessors() {
        return logProcessors;
    }

    public boolean isLogBridgeInstalled() {
        return logAppender != null;
    }

    /**
     * @return the bound Prometheus port, -1 when the endpoint is disabled
     */
    public int scrapePort() {
        return scrapeServer == null ? -1 : scrapeServer.port();
    }

    public boolean isCancelled() {
        return closed.get();
    }
}
