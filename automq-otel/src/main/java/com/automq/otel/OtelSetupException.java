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

/**
 * Thrown when the telemetry orchestrator cannot be set up, e.g. because of an invalid configuration or a scrape port
 * that is already bound. Nothing has been started when this is thrown.
 */
public class OtelSetupException extends Exception {

    public OtelSetupException(String message) {
        super(message);
    }

    public OtelSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
