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

import java.util.Locale;

/**
 * Aggregation temporality requested by a metrics export target.
 */
public enum Temporality {
    /**
     * Every export reports the running total since the process started.
     */
    CUMULATIVE,
    /**
     * Every export reports the increment since the previous export to the same target.
     */
    DELTA;

    public static Temporality fromString(String value) {
        if (value == null || value.isBlank()) {
            return CUMULATIVE;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "cumulative":
                return CUMULATIVE;
            case "delta":
                return DELTA;
            default:
                throw new IllegalArgumentException("Unknown temporality: " + value);
        }
    }
}
