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

package com.automq.otel.sample;

import com.automq.otel.Otel;
import com.automq.otel.OtelSetupException;
import com.automq.otel.config.LogsExportTarget;
import com.automq.otel.config.MetricsExportTarget;
import com.automq.otel.config.OtelConfig;
import com.automq.otel.config.OtelProperties;
import com.automq.otel.config.Severity;
import com.automq.otel.config.Temporality;

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.helper.HelpScreenException;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

/**
 * Drives the telemetry library: records a few instruments in a loop, logs, then shuts down.
 */
public class SampleApp {
    private static final Logger LOGGER = LoggerFactory.getLogger(SampleApp.class);

    public static void main(String[] args) throws IOException, OtelSetupException {
        Namespace ns = null;
        ArgumentParser parser = Config.parser();
        try {
            ns = parser.parseArgs(args);
        } catch (HelpScreenException e) {
            System.exit(0);
        } catch (ArgumentParserException e) {
            parser.handleError(e);
            System.exit(1);
        }
        Config config = new Config(ns);

        Otel otel = Otel.create(buildOtelConfig(config));
        otel.start();
        try {
            run(otel, config.numIterations);
        } finally {
            otel.shutdown();
        }
    }

    static OtelConfig buildOtelConfig(Config config) throws IOException {
        if (config.configFile != null) {
            Properties props = new Properties();
            try (InputStream in = Files.newInputStream(Paths.get(config.configFile))) {
                props.load(in);
            }
            return new OtelProperties(props).toConfig();
        }
        OtelConfig.Builder builder = OtelConfig.builder()
            .serviceName("sample-app")
            .emitMetricsToStdout(true)
            .level("info,io.grpc=off,okhttp3=off")
            .resourceAttribute("resource_key1", "1");
        if (config.otelRepoUrl != null) {
            builder.addMetricsExportTarget(new MetricsExportTarget(config.otelRepoUrl, 1, 5, Temporality.CUMULATIVE))
                .addLogExportTarget(new LogsExportTarget(config.otelRepoUrl, 1, 5, Severity.ERROR));
        }
        return builder.build();
    }

    static void run(Otel otel, long numIterations) {
        StaticMetrics metrics = new StaticMetrics(otel.getMeter(StaticMetrics.METER_NAME));
        LOGGER.error("Test error log. Only this log will be exported to the target");
        try {
            for (long iteration = 1; iteration < numIterations; iteration++) {
                double value = ThreadLocalRandom.current().nextDouble() * 1_000_000.0;
                metrics.recordIteration(iteration, value, ThreadLocalRandom.current().nextBoolean());
                LOGGER.info("iteration: {}", iteration);
                LockSupport.parkNanos(TimeUnit.MICROSECONDS.toNanos(100));
            }
        } finally {
            metrics.close();
        }
    }

    static class Config {
        final long numIterations;
        final String otelRepoUrl;
        final String configFile;

        Config(Namespace ns) {
            this.numIterations = ns.getLong("numIterations");
            this.otelRepoUrl = ns.getString("otelRepoUrl");
            this.configFile = ns.getString("config");
        }

        static ArgumentParser parser() {
            ArgumentParser parser = ArgumentParsers
                .newFor("SampleApp")
                .build()
                .defaultHelp(true)
                .description("Records sample metrics and logs through the telemetry library");
            parser.addArgument("-n", "--num-iterations")
                .dest("numIterations")
                .type(Long.class)
                .setDefault(1000L)
                .help("Number of iterations");
            parser.addArgument("-o", "--otel-repo-url")
                .dest("otelRepoUrl")
                .help("OTLP compatible collector receiving the metrics and the error logs, e.g. http://localhost:4317");
            parser.addArgument("-c", "--config")
                .dest("config")
                .help("Properties file with otel.* settings, replaces the built-in configuration");
            return parser;
        }
    }
}
