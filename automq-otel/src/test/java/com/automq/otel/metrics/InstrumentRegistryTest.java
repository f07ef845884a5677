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

import org.junit.jupiter.api.Test;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.sdk.resources.Resource;

import static com.automq.otel.metrics.MetricTestUtils.find;
import static com.automq.otel.metrics.MetricTestUtils.longSum;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InstrumentRegistryTest {

    @Test
    void snapshotIsCumulativeAndCarriesResource() {
        Resource resource = Resource.create(Attributes.of(AttributeKey.stringKey("service.name"), "svc"));
        InstrumentRegistry registry = new InstrumentRegistry(resource);
        try {
            LongCounter counter = registry.getMeter("scope").counterBuilder("hits").build();
            counter.add(2);
            assertEquals(2, longSum(registry.snapshot(), "hits"));
            counter.add(3);
            assertEquals(5, longSum(registry.snapshot(), "hits"));
            assertEquals(resource, find(registry.snapshot(), "hits").getResource());
            assertSame(resource, registry.resource());
        } finally {
            registry.release();
        }
    }

    @Test
    void lastReleaseShutsDownProvider() {
        InstrumentRegistry registry = new InstrumentRegistry(Resource.empty());
        LongCounter counter = registry.getMeter("scope").counterBuilder("hits").build();
        counter.add(1);

        registry.retain();
        assertEquals(2, registry.refCount());
        registry.release();
        assertEquals(1, longSum(registry.snapshot(), "hits"));

        registry.release();
        assertEquals(0, registry.refCount());
        assertTrue(registry.snapshot().isEmpty());
        assertThrows(IllegalStateException.class, registry::retain);
        assertThrows(IllegalStateException.class, registry::release);
    }
}
