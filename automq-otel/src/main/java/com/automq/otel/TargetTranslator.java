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
import com.automq.otel.log.LevelFilter;
import com.automq.otel.metrics.CumulativeTemporalityPolicy;
import com.automq.otel.metrics.DeltaTemporalityPolicy;
import com.automq.otel.metrics.TemporalityPolicy;

/**
 * Maps export targets to the policies their pipelines apply.
 */
public final class TargetTranslator {

    private TargetTranslator() {
    }

    /**
     * Every call for a delta target returns a new policy, so delta baselines are never shared between targets.
     */
    public static TemporalityPolicy temporalityPolicy(MetricsExportTarget target) {
        switch (target.temporality()) {
            case DELTA:
                return new DeltaTemporalityPolicy();
            case CUMULATIVE:
            default:
                return CumulativeTemporalityPolicy.INSTANCE;
        }
    }

    /**
     * Combines the target's minimum severity, if any, with the global level filter.
     */
    public static LogRecordFilter logRecordFilter(LogsExportTarget target, LevelFilter levelFilter) {
        Severity exportSeverity = target.exportSeverity();
        if (exportSeverity == null) {
            return levelFilter::enabled;
        }
        return (module, severity) -> severity.isAtLeast(exportSeverity) && levelFilter.enabled(module, severity);
    }
}
