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
import com.automq.otel.config.Severity;
import com.automq.otel.config.Temporality;
import com.automq.otel.log.LevelFilter;
import com.automq.otel.metrics.CumulativeTemporalityPolicy;
import com.automq.otel.metrics.DeltaTemporalityPolicy;
import com.automq.otel.metrics.TemporalityPolicy;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TargetTranslatorTest {

    @Test
    void temporalityDefaultsToCumulative() {
        TemporalityPolicy policy = TargetTranslator.temporalityPolicy(new MetricsExportTarget("http://a:4317", 10, 5));
        assertInstanceOf(CumulativeTemporalityPolicy.class, policy);
    }

    @Test
    void everyDeltaTargetGetsItsOwnState() {
        MetricsExportTarget target = new MetricsExportTarget("http://a:4317", 10, 5, Temporality.DELTA);
        TemporalityPolicy first = TargetTranslator.temporalityPolicy(target);
        TemporalityPolicy second = TargetTranslator.temporalityPolicy(target);

        assertInstanceOf(DeltaTemporalityPolicy.class, first);
        assertNotSame(first, second);
    }

    @Test
    void withoutExportSeverityOnlyTheGlobalFilterApplies() throws OtelSetupException {
        LevelFilter levelFilter = LevelFilter.parse("info,noisy=error");
        LogRecordFilter filter = TargetTranslator.logRecordFilter(new LogsExportTarget("http://a:4317", 1, 1), levelFilter);

        assertTrue(filter.test("app", Severity.INFO));
        assertFalse(filter.test("app", Severity.DEBUG));
        assertFalse(filter.test("noisy.Client", Severity.WARN));
    }

    @Test
    void errorTargetNeverReceivesWarnOrLower() throws OtelSetupException {
        LogsExportTarget target = new LogsExportTarget("http://a:4317", 1, 1, Severity.ERROR);
        Random random = new Random(7);
        for (String expression : new String[] {"trace", "info", "error", "off", "trace,app=off"}) {
            LevelFilter levelFilter = LevelFilter.parse(expression);
            LogRecordFilter filter = TargetTranslator.logRecordFilter(target, levelFilter);
            for (int i = 0; i < 1000; i++) {
                Severity severity = Severity.values()[random.nextInt(Severity.values().length)];
                String module = random.nextBoolean() ? "app" : "lib";
                boolean accepted = filter.test(module, severity);
                if (severity != Severity.ERROR) {
                    assertFalse(accepted, expression + " " + module + " " + severity);
                } else {
                    assertTrue(accepted == levelFilter.enabled(module, severity), expression + " " + module);
                }
            }
        }
    }
}
