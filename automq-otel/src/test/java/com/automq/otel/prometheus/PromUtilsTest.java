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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PromUtilsTest {

    @Test
    void mapMetricName() {
        assertEquals("http_requests_milliseconds", PromUtils.mapMetricName("http.requests", "ms", false, false));
        assertEquals("requests_total", PromUtils.mapMetricName("requests", "", true, false));
        assertEquals("requests_total", PromUtils.mapMetricName("requests_total", "", true, false));
        assertEquals("sent_bytes_total", PromUtils.mapMetricName("sent", "By", true, false));
        assertEquals("cpu_utilization_ratio", PromUtils.mapMetricName("cpu.utilization", "1", false, true));
        assertEquals("queue_depth", PromUtils.mapMetricName("queue-depth", "{requests}", false, true));
        assertEquals("_1xx_responses", PromUtils.mapMetricName("1xx responses", null, false, false));
    }

    @Test
    void sanitizeLabel() {
        assertEquals("service_name", PromUtils.sanitizeLabel("service.name"));
        assertEquals("_0day", PromUtils.sanitizeLabel("0day"));
        assertEquals("a_b_c", PromUtils.sanitizeLabel("a:b-c"));
    }

    @Test
    void escapeLabelValue() {
        assertEquals("say \\\"hi\\\"\\nC:\\\\tmp", PromUtils.escapeLabelValue("say \"hi\"\nC:\\tmp"));
        assertEquals("plain", PromUtils.escapeLabelValue("plain"));
    }

    @Test
    void formatValue() {
        assertEquals("5", PromUtils.formatValue(5.0));
        assertEquals("-3", PromUtils.formatValue(-3.0));
        assertEquals("2.5", PromUtils.formatValue(2.5));
        assertEquals("NaN", PromUtils.formatValue(Double.NaN));
        assertEquals("+Inf", PromUtils.formatValue(Double.POSITIVE_INFINITY));
        assertEquals("-Inf", PromUtils.formatValue(Double.NEGATIVE_INFINITY));
    }
}
