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

public class PromConsts {
    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";
    public static final String TARGET_INFO = "target_info";
    public static final String TARGET_INFO_HELP = "Target metadata";
    public static final String SCOPE_NAME_LABEL = "otel_scope_name";
    public static final String EXPORTED_LABEL_PREFIX = "exported_";
    public static final String METRIC_NAME_SUFFIX_TOTAL = "_total";
    public static final String METRIC_NAME_SUFFIX_SUM = "_sum";
    public static final String METRIC_NAME_SUFFIX_COUNT = "_count";
    public static final String METRIC_NAME_SUFFIX_BUCKET = "_bucket";
    public static final String LABEL_NAME_LE = "le";
    public static final String LABEL_NAME_QUANTILE = "quantile";
    public static final String LABEL_VALUE_INF = "+Inf";
    public static final String TYPE_COUNTER = "counter";
    public static final String TYPE_GAUGE = "gauge";
    public static final String TYPE_HISTOGRAM = "histogram";
    public static final String TYPE_SUMMARY = "summary";
}
