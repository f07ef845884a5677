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

import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;

/**
 * Naming and formatting rules of the Prometheus text format.
 */
public class PromUtils {
    private static final String RATIO_SUFFIX = "_ratio";

    /**
     * Maps an instrument name to a Prometheus metric name: invalid characters become '_', the unit is appended and
     * counters end with {@code _total}.
     */
    public static String normalizeMetricName(MetricData metricData) {
        return mapMetricName(metricData.getName(), metricData.getUnit(), isCounter(metricData), isGauge(metricData));
    }

    static String mapMetricName(String name, String unit, boolean isCounter, boolean isGauge) {
        name = sanitizeMetricName(name);

        String prometheusUnit = getPrometheusUnit(unit);
        if (StringUtils.isNotBlank(prometheusUnit) && !name.contains(prometheusUnit)) {
            name = name + "_" + prometheusUnit;
        }

        // the unit goes before the _total suffix
        if (isCounter && name.endsWith(PromConsts.METRIC_NAME_SUFFIX_TOTAL)) {
            name = name.substring(0, name.length() - PromConsts.METRIC_NAME_SUFFIX_TOTAL.length());
        }
        if (isCounter) {
            name = name + PromConsts.METRIC_NAME_SUFFIX_TOTAL;
        }

        if ("1".equals(unit) && isGauge && !name.contains("ratio")) {
            name = name + RATIO_SUFFIX;
        }
        return name;
    }

    static String getPrometheusUnit(String unit) {
        if (StringUtils.isBlank(unit) || unit.contains("{")) {
            return "";
        }
        switch (unit) {
            case "d":
                return "days";
            case "h":
                return "hours";
            case "min":
                return "minutes";
            case "s":
                return "seconds";
            case "ms":
                return "milliseconds";
            case "us":
                return "microseconds";
            case "ns":
                return "nanoseconds";
            case "By":
                return "bytes";
            case "KiBy":
                return "kibibytes";
            case "MiBy":
                return "mebibytes";
            case "GiBy":
                return "gibibytes";
            case "KBy":
                return "kilobytes";
            case "MBy":
                return "megabytes";
            case "GBy":
                return "gigabytes";
            case "Cel":
                return "celsius";
            case "Hz":
                return "hertz";
            case "%":
                return "percent";
            case "1/s":
                return "per_second";
            case "By/s":
                return "bytes_per_second";
            case "1":
                return "";
            default:
                return sanitizeLabel(unit);
        }
    }

    public static boolean isCounter(MetricData metricData) {
        if (metricData.getType() == MetricDataType.DOUBLE_SUM) {
            return metricData.getDoubleSumData().isMonotonic();
        }
        if (metricData.getType() == MetricDataType.LONG_SUM) {
            return metricData.getLongSumData().isMonotonic();
        }
        return false;
    }

    private static boolean isGauge(MetricData metricData) {
        return metricData.getType() == MetricDataType.LONG_GAUGE || metricData.getType() == MetricDataType.DOUBLE_GAUGE;
    }

    public static String sanitizeMetricName(String name) {
        String sanitized = name.replaceAll("[^a-zA-Z0-9_:]", "_");
        if (!sanitized.isEmpty() && Character.isDigit(sanitized.charAt(0))) {
            sanitized = "_" + sanitized;
        }
        return sanitized;
    }

    public static String sanitizeLabel(String labelKey) {
        String sanitized = labelKey.replaceAll("[^a-zA-Z0-9_]", "_");
        if (!sanitized.isEmpty() && Character.isDigit(sanitized.charAt(0))) {
            sanitized = "_" + sanitized;
        }
        return sanitized;
    }

    public static String escapeLabelValue(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String escapeHelp(String help) {
        return help.replace("\\", "\\\\").replace("\n", "\\n");
    }

    /**
     * Integral values are written without a fraction, e.g. {@code 5} rather than {@code 5.0}.
     */
    public static String formatValue(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "+Inf" : "-Inf";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
