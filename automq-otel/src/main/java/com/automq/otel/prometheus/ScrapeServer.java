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

package com.automq.otel.prometheus;

import com.automq.otel.OtelConstants;
import com.automq.otel.OtelSetupException;
import com.automq.otel.metrics.InstrumentRegistry;
import com.automq.otel.utils.Threads;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import io.opentelemetry.sdk.metrics.data.MetricData;

/**
 * Serves the registry in the Prometheus text format on {@code GET /metrics}.
 *
 * <p>The port is bound when the server is created, requests are served once it is started.
 */
public class ScrapeServer implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScrapeServer.class);
    private static final int HANDLER_THREADS = 2;

    private final InstrumentRegistry registry;
    private final HttpServer server;
    private final ExecutorService executor;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ScrapeServer(int port, InstrumentRegistry registry) throws OtelSetupException {
        try {
            this.server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (BindException e) {
            throw new OtelSetupException("Prometheus port " + port + " is already in use", e);
        } catch (IOException e) {
            throw new OtelSetupException("Unable to bind Prometheus endpoint to port " + port, e);
        }
        this.registry = registry.retain();
        this.executor = Executors.newFixedThreadPool(HANDLER_THREADS, Threads.createThreadFactory("otel-prometheus-%d", true));
        server.setExecutor(executor);
        server.createContext(OtelConstants.PROMETHEUS_PATH, this::handleMetricsPath);
    }

    public void start() {
        if (closed.get() || !started.compareAndSet(false, true)) {
            return;
        }
        server.start();
        LOGGER.info("Prometheus endpoint started on port {}, path {}", port(), OtelConstants.PROMETHEUS_PATH);
    }

    public int port() {
        return server.getAddress().getPort();
    }

    private void handleMetricsPath(HttpExchange exchange) throws IOException {
        try {
            if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                byte[] body = ExpositionTranslator.translate(snapshot(), registry.resource())
                    .getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", PromConsts.CONTENT_TYPE);
                exchange.sendResponseHeaders(200, body.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(body);
                }
            } else {
                exchange.getResponseHeaders().set("Allow", "GET");
                exchange.sendResponseHeaders(405, -1);
            }
        } catch (RuntimeException e) {
            LOGGER.warn("Unexpected error while handling metrics request", e);
            if (exchange.getResponseCode() == -1) {
                exchange.sendResponseHeaders(500, -1);
            }
        } finally {
            exchange.close();
        }
    }

    // an unreadable registry still yields a valid document holding target_info alone
    private Collection<MetricData> snapshot() {
        try {
            return registry.snapshot();
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to read the metrics registry, serving target_info only", e);
            return Collections.emptyList();
        }
    }

    /**
     * Stops serving right away and releases the port.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        server.stop(0);
        Threads.shutdownNow(executor, 5, TimeUnit.SECONDS, LOGGER);
        registry.release();
        LOGGER.info("Prometheus endpoint stopped");
    }
}
