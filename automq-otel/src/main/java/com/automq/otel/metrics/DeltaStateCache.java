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

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.common.InstrumentationScopeInfo;
import io.opentelemetry.sdk.metrics.data.PointData;

/**
 * The last cumulative point seen for every stream of one export target. Not thread safe, owned by a single pipeline.
 */
class DeltaStateCache {
    private final Map<StreamKey, PointData> previous = new HashMap<>();
    private final Set<StreamKey> touched = new HashSet<>();

    /**
     * Records {@code current} as the new baseline of the stream and returns the previous one, or null if the stream is
     * new.
     */
    @SuppressWarnings("unchecked")
    <T extends PointData> T swap(StreamKey key, T current) {
        touched.add(key);
        return (T) previous.put(key, current);
    }

    /**
     * Forgets the streams not swapped since the previous call.
     *
     * @return the number of streams forgotten
     */
    int evictUntouched() {
        int before = previous.size();
        previous.keySet().retainAll(touched);
        touched.clear();
        return before - previous.size();
    }

    int size() {
        return previous.size();
    }

    static StreamKey key(InstrumentationScopeInfo scope, String metricName, Attributes attributes) {
        return new StreamKey(scope.getName(), metricName, attributes);
    }

    static final class StreamKey {
        private final String scope;
        private final String metricName;
        private final Attributes attributes;

        StreamKey(String scope, String metricName, Attributes attributes) {
            this.scope = scope;
            this.metricName = metricName;
            this.attributes = attributes;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            StreamKey that = (StreamKey) o;
            return scope.equals(that.scope) && metricName.equals(that.metricName) && attributes.equals(that.attributes);
        }

        @Override
        public int hashCode() {
            return Objects.hash(scope, metricName, attributes);
        }

        @Override
        public String toString() {
            return scope + "/" + metricName + attributes;
        }
    }
}
