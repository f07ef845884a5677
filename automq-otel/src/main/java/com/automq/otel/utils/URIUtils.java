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

package com.automq.otel.utils;

import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for export target URIs of the form {@code scheme://host:port/path?key=value&...}.
 */
public final class URIUtils {

    private URIUtils() {
    }

    /**
     * Decodes the query string. A key given without a value maps to an empty string.
     */
    public static Map<String, List<String>> parseQuery(URI uri) {
        return parseQuery(uri.getRawQuery());
    }

    public static Map<String, List<String>> parseQuery(String rawQuery) {
        if (StringUtils.isBlank(rawQuery)) {
            return Collections.emptyMap();
        }
        Map<String, List<String>> params = new LinkedHashMap<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int idx = pair.indexOf('=');
            String key = decode(idx < 0 ? pair : pair.substring(0, idx));
            String value = idx < 0 ? "" : decode(pair.substring(idx + 1));
            params.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }
        return params;
    }

    /**
     * @return the value of {@code key}, null when absent or blank
     * @throws IllegalArgumentException if the key is given more than once
     */
    public static String param(Map<String, List<String>> params, String key) {
        List<String> values = params.get(key);
        if (values == null) {
            return null;
        }
        if (values.size() != 1) {
            throw new IllegalArgumentException("Parameter " + key + " is given " + values.size() + " times: " + values);
        }
        return StringUtils.isBlank(values.get(0)) ? null : values.get(0).trim();
    }

    public static long longParam(Map<String, List<String>> params, String key, long defaultValue) {
        String value = param(params, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + key + " must be a number, got " + value, e);
        }
    }

    /**
     * @return the URI without its query string and fragment
     */
    public static String endpoint(URI uri) {
        String path = uri.getRawPath();
        return uri.getScheme() + "://" + uri.getRawAuthority() + (path == null ? "" : path);
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
