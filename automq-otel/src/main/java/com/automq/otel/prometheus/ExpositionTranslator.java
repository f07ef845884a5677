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

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.DoublePointData;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.metrics.data.SummaryPointData;
import io.opentelemetry.sdk.metrics.data.ValueAtQuantile;
import io.opentelemetry.sdk.resources.Resource;

/**
 * Renders a cumulative snapshot of the registry in the Prometheus text exposition format, version 0.0.4.
 *
 * <p>The document starts with a {@code target_info} sample carrying the resource attributes, followed by the metric
 * families sorted by name. Every sample is labelled with the resource attributes, the instrumentation scope and the
 * point's own attributes. A family that cannot be rendered is left out of the document.
 *
 * <p>Attribute keys whose sanitized names collide are merged into one label, their values joined with {@code ;} in key
 * order. A point attribute never overrides a resource or scope label and never takes a name the format reserves
 * ({@code le}, {@code quantile}); it is renamed with the {@code exported_} prefix instead.
 */
public final class ExpositionTranslator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExpositionTranslator.class);
    private static final Set<String> RESERVED_LABELS = Set.of(PromConsts.LABEL_NAME_LE, PromConsts.LABEL_NAME_QUANTILE,
        PromConsts.SCOPE_NAME_LABEL);

    private ExpositionTranslator() {
    }

    public static String translate(Collection<MetricData> metrics, Resource resource) {
        Map<String, String> resourceLabels = withAttributes(Map.of(), resource.getAttributes());
        StringBuilder sb = new StringBuilder(4096);
        writeTargetInfo(sb, resourceLabels);

        Map<String, List<MetricData>> families = new TreeMap<>();
        for (MetricData metric : metrics) {
            families.computeIfAbsent(PromUtils.normalizeMetricName(metric), k -> new ArrayList<>()).add(metric);
        }
        for (Map.Entry<String, List<MetricData>> family : families.entrySet()) {
            StringBuilder familyText = new StringBuilder(256);
            try {
                writeFamily(familyText, family.getKey(), family.getValue(), resourceLabels);
                sb.append(familyText);
            } catch (RuntimeException e) {
                LOGGER.warn("Skipping metric family {} which failed to render", family.getKey(), e);
            }
        }
        return sb.toString();
    }

    private static void writeTargetInfo(StringBuilder sb, Map<String, String> resourceLabels) {
        sb.append("# HELP ").append(PromConsts.TARGET_INFO).append(' ').append(PromConsts.TARGET_INFO_HELP).append('\n');
        sb.append("# TYPE ").append(PromConsts.TARGET_INFO).append(' ').append(PromConsts.TYPE_GAUGE).append('\n');
        writeSample(sb, PromConsts.TARGET_INFO, resourceLabels, null, null, "1");
    }

    private static void writeFamily(StringBuilder sb, String name, List<MetricData> metrics,
        Map<String, String> resourceLabels) {
        MetricData first = metrics.get(0);
        String type = prometheusType(first);
        if (type == null) {
            LOGGER.debug("Metric {} of type {} is not exposed", first.getName(), first.getType());
            return;
        }
        if (StringUtils.isNotBlank(first.getDescription())) {
            sb.append("# HELP ").append(name).append(' ').append(PromUtils.escapeHelp(first.getDescription())).append('\n');
        }
        sb.append("# TYPE ").append(name).append(' ').append(type).append('\n');
        for (MetricData metric : metrics) {
            if (!type.equals(prometheusType(metric))) {
                LOGGER.warn("Metric {} of scope {} conflicts with the type {} of family {}, skipping it", metric.getName(),
                    metric.getInstrumentationScopeInfo().getName(), type, name);
                continue;
            }
            Map<String, String> baseLabels = new LinkedHashMap<>(resourceLabels);
            baseLabels.put(PromConsts.SCOPE_NAME_LABEL, metric.getInstrumentationScopeInfo().getName());
            writePoints(sb, name, metric, baseLabels);
        }
    }

    private static String prometheusType(MetricData metric) {
        switch (metric.getType()) {
            case LONG_SUM:
            case DOUBLE_SUM:
                return PromUtils.isCounter(metric) ? PromConsts.TYPE_COUNTER : PromConsts.TYPE_GAUGE;
            case LONG_GAUGE:
            case DOUBLE_GAUGE:
                return PromConsts.TYPE_GAUGE;
            case HISTOGRAM:
                return PromConsts.TYPE_HISTOGRAM;
            case SUMMARY:
                return PromConsts.TYPE_SUMMARY;
            default:
                return null;
        }
    }

    private static void writePoints(StringBuilder sb, String name, MetricData metric, Map<String, String> baseLabels) {
        MetricDataType type = metric.getType();
        switch (type) {
            case LONG_SUM:
                for (LongPointData point : metric.getLongSumData().getPoints()) {
                    writeSample(sb, name, withAttributes(baseLabels, point.getAttributes()), null, null, Long.toString(point.getValue()));
                }
                break;
            case LONG_GAUGE:
                for (LongPointData point : metric.getLongGaugeData().getPoints()) {
                    writeSample(sb, name, withAttributes(baseLabels, point.getAttributes()), null, null, Long.toString(point.getValue()));
                }
                break;
            case DOUBLE_SUM:
                for (DoublePointData point : metric.getDoubleSumData().getPoints()) {
                    writeSample(sb, name, withAttributes(baseLabels, point.getAttributes()), null, null, PromUtils.formatValue(point.getValue()));
                }
                break;
            case DOUBLE_GAUGE:
                for (DoublePointData point : metric.getDoubleGaugeData().getPoints()) {
                    writeSample(sb, name, withAttributes(baseLabels, point.getAttributes()), null, null, PromUtils.formatValue(point.getValue()));
                }
                break;
            case HISTOGRAM:
                for (HistogramPointData point : metric.getHistogramData().getPoints()) {
                    writeHistogram(sb, name, withAttributes(baseLabels, point.getAttributes()), point);
                }
                break;
            case SUMMARY:
                for (SummaryPointData point : metric.getSummaryData().getPoints()) {
                    writeSummary(sb, name, withAttributes(baseLabels, point.getAttributes()), point);
                }
                break;
            default:
                break;
        }
    }

    private static void writeHistogram(StringBuilder sb, String name, Map<String, String> labels, HistogramPointData point) {
        List<Double> boundaries = point.getBoundaries();
        List<Long> counts = point.getCounts();
        if (counts.size() != boundaries.size() + 1) {
            throw new IllegalStateException("Histogram " + name + " has " + boundaries.size() + " boundaries but "
                + counts.size() + " bucket counts");
        }
        String bucketName = name + PromConsts.METRIC_NAME_SUFFIX_BUCKET;
        long cumulative = 0;
        for (int i = 0; i < boundaries.size(); i++) {
            cumulative += counts.get(i);
            writeSample(sb, bucketName, labels, PromConsts.LABEL_NAME_LE, PromUtils.formatValue(boundaries.get(i)),
                Long.toString(cumulative));
        }
        writeSample(sb, bucketName, labels, PromConsts.LABEL_NAME_LE, PromConsts.LABEL_VALUE_INF,
            Long.toString(point.getCount()));
        writeSample(sb, name + PromConsts.METRIC_NAME_SUFFIX_SUM, labels, null, null, PromUtils.formatValue(point.getSum()));
        writeSample(sb, name + PromConsts.METRIC_NAME_SUFFIX_COUNT, labels, null, null, Long.toString(point.getCount()));
    }

    private static void writeSummary(StringBuilder sb, String name, Map<String, String> labels, SummaryPointData point) {
        for (ValueAtQuantile quantile : point.getValues()) {
            writeSample(sb, name, labels, PromConsts.LABEL_NAME_QUANTILE, PromUtils.formatValue(quantile.getQuantile()),
                PromUtils.formatValue(quantile.getValue()));
        }
        writeSample(sb, name + PromConsts.METRIC_NAME_SUFFIX_SUM, labels, null, null, PromUtils.formatValue(point.getSum()));
        writeSample(sb, name + PromConsts.METRIC_NAME_SUFFIX_COUNT, labels, null, null, Long.toString(point.getCount()));
    }

    private static void writeSample(StringBuilder sb, String name, Map<String, String> labels, String extraLabel,
        String extraValue, String value) {
        sb.append(name);
        if (!labels.isEmpty() || extraLabel != null) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, String> label : labels.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                sb.append(label.getKey()).append("=\"").append(PromUtils.escapeLabelValue(label.getValue())).append('"');
            }
            if (extraLabel != null) {
                if (!first) {
                    sb.append(',');
                }
                sb.append(extraLabel).append("=\"").append(extraValue).append('"');
            }
            sb.append('}');
        }
        sb.append(' ').append(value).append('\n');
    }

    private static Map<String, String> withAttributes(Map<String, String> baseLabels, Attributes attributes) {
        if (attributes.isEmpty()) {
            return baseLabels;
        }
        Map<String, String> labels = new LinkedHashMap<>(baseLabels);
        sanitize(attributes).forEach((key, value) -> labels.put(freeLabelName(labels, key), value));
        return labels;
    }

    private static String freeLabelName(Map<String, String> labels, String name) {
        String free = name;
        while (RESERVED_LABELS.contains(free) || labels.containsKey(free)) {
            free = PromConsts.EXPORTED_LABEL_PREFIX + free;
        }
        return free;
    }

    // attributes iterate in key order, which keeps merged values stable
    private static Map<String, String> sanitize(Attributes attributes) {
        Map<String, String> labels = new LinkedHashMap<>();
        attributes.forEach((key, value) -> labels.merge(PromUtils.sanitizeLabel(key.getKey()), String.valueOf(value),
            (existing, added) -> existing + ";" + added));
        return labels;
    }
}
