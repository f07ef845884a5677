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

import com.automq.otel.OtelSetupException;
import com.automq.otel.metrics.InstrumentRegistry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.sdk.resources.Resource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ScrapeServerTest {
    private static final Pattern COUNTER_LINE = Pattern.compile("^scrapes_total\\{[^}]*} (\\d+)$", Pattern.MULTILINE);

    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    private InstrumentRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InstrumentRegistry(Resource.create(Attributes.of(AttributeKey.stringKey("service.name"), "scrape-test")));
    }

    @AfterEach
    void tearDown() {
        registry.release();
    }

    private HttpResponse<String> get(int port) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/metrics"))
            .timeout(Duration.ofSeconds(10))
            .GET()
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void servesExposition() throws Exception {
        registry.getMeter("scope").counterBuilder("scrapes").build().add(3);
        try (ScrapeServer server = new ScrapeServer(0, registry)) {
            server.start();
            assertTrue(server.port() > 0);

            HttpResponse<String> response = get(server.port());

            assertEquals(200, response.statusCode());
            assertEquals(PromConsts.CONTENT_TYPE, response.headers().firstValue("Content-Type").orElse(null));
            assertTrue(response.body().startsWith("# HELP target_info Target metadata\n"), response.body());
            assertTrue(response.body().contains(
                "scrapes_total{service_name=\"scrape-test\",otel_scope_name=\"scope\"} 3\n"), response.body());
        }
    }

    @Test
    void unreadableRegistryServesTargetInfoOnly() throws Exception {
        InstrumentRegistry failing = mock(InstrumentRegistry.class);
        when(failing.retain()).thenReturn(failing);
        when(failing.resource()).thenReturn(registry.resource());
        when(failing.snapshot()).thenThrow(new IllegalStateException("reader is shut down"));
        try (ScrapeServer server = new ScrapeServer(0, failing)) {
            server.start();

            HttpResponse<String> response = get(server.port());

            assertEquals(200, response.statusCode());
            assertEquals("# HELP target_info Target metadata\n"
                + "# TYPE target_info gauge\n"
                + "target_info{service_name=\"scrape-test\"} 1\n", response.body());
        }
    }

    @Test
    void otherMethodsAreRejected() throws Exception {
        try (ScrapeServer server = new ScrapeServer(0, registry)) {
            server.start();
            HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + "/metrics"))
                .POST(HttpRequest.BodyPublishers.ofString("x"))
                .build();

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

            assertEquals(405, response.statusCode());
            assertEquals("GET", response.headers().firstValue("Allow").orElse(null));
        }
    }

    @Test
    void busyPortIsSetupError() throws Exception {
        try (ServerSocket socket = new ServerSocket(0)) {
            OtelSetupException e = assertThrows(OtelSetupException.class,
                () -> new ScrapeServer(socket.getLocalPort(), registry));
            assertTrue(e.getMessage().contains(String.valueOf(socket.getLocalPort())), e.getMessage());
        }
        assertEquals(1, registry.refCount());
    }

    @Test
    void portIsReleasedOnClose() throws Exception {
        int port;
        try (ScrapeServer server = new ScrapeServer(0, registry)) {
            server.start();
            port = server.port();
            assertEquals(2, registry.refCount());
        }
        assertEquals(1, registry.refCount());

        try (ScrapeServer server = new ScrapeServer(port, registry)) {
            server.start();
            assertEquals(200, get(port).statusCode());
        }
    }

    @Test
    @Timeout(60)
    void concurrentScrapesSeeConsistentCounters() throws Exception {
        LongCounter counter = registry.getMeter("scope").counterBuilder("scrapes").build();
        counter.add(1);
        AtomicBoolean running = new AtomicBoolean(true);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try (ScrapeServer server = new ScrapeServer(0, registry)) {
            server.start();
            Future<?> writer = executor.submit(() -> {
                while (running.get()) {
                    counter.add(1);
                }
            });
            List<Future<List<Long>>> scrapers = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                scrapers.add(executor.submit(() -> {
                    List<Long> values = new ArrayList<>();
                    for (int j = 0; j < 20; j++) {
                        String body = get(server.port()).body();
                        assertTrue(body.startsWith("# HELP target_info"), body);
                        Matcher matcher = COUNTER_LINE.matcher(body);
                        assertTrue(matcher.find(), body);
                        values.add(Long.parseLong(matcher.group(1)));
                    }
                    return values;
                }));
            }
            for (Future<List<Long>> scraper : scrapers) {
                List<Long> values = scraper.get(30, TimeUnit.SECONDS);
                for (int i = 1; i < values.size(); i++) {
                    assertTrue(values.get(i) >= values.get(i - 1), values.toString());
                }
            }
            running.set(false);
            writer.get(10, TimeUnit.SECONDS);
        } finally {
            running.set(false);
            executor.shutdownNow();
        }
    }
}
