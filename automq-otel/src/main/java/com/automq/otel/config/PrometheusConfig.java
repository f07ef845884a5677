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

package com.automq.otel.config;

import com.automq.otel.OtelConstants;

/**
 * Prometheus configuration. When present, an HTTP endpoint serving the metrics in the Prometheus text format is
 * started on {@code port}.
 */
public record PrometheusConfig(int port) {

    public PrometheusConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Illegal Prometheus port " + port);
        }
    }

    public PrometheusConfig() {
        this(OtelConstants.DEFAULT_PROMETHEUS_PORT);
    }
}
