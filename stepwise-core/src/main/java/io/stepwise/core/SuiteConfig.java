/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.stepwise.core;

import io.stepwise.common.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Suite settings loaded from a JSON file. Hooks are code-only and never part of the file.
 * <pre>
 * {
 *   "features": ["src/test/features/cart.feature"],
 *   "tags": ["@smoke"],
 *   "ignoreTags": ["@slow"],
 *   "threads": 4,
 *   "logLevel": "debug",
 *   "scenarioTimeoutMillis": 30000,
 *   "values": { "baseUrl": "http://localhost:8080" }
 * }
 * </pre>
 */
public class SuiteConfig {

    private List<String> features = new ArrayList<>();
    private List<String> tags = new ArrayList<>();
    private List<String> ignoreTags = new ArrayList<>();
    private int threads = 1;
    private String logLevel;
    private Long scenarioTimeoutMillis;
    private Map<String, Object> values = new LinkedHashMap<>();

    public static SuiteConfig load(Path configPath) {
        String content;
        try {
            content = Files.readString(configPath);
        } catch (IOException e) {
            throw new IllegalArgumentException("failed to read config from: " + configPath, e);
        }
        return parse(content);
    }

    public static SuiteConfig parse(String json) {
        Json j = Json.of(json);
        if (j.isArray()) {
            throw new IllegalArgumentException("invalid config: expected JSON object");
        }
        SuiteConfig config = new SuiteConfig();
        j.<List<String>>getOptional("features").ifPresent(list -> config.features = new ArrayList<>(list));
        j.<List<String>>getOptional("tags").ifPresent(list -> config.tags = new ArrayList<>(list));
        j.<List<String>>getOptional("ignoreTags").ifPresent(list -> config.ignoreTags = new ArrayList<>(list));
        j.<Number>getOptional("threads").ifPresent(n -> config.threads = n.intValue());
        j.<String>getOptional("logLevel").ifPresent(s -> config.logLevel = s);
        j.<Number>getOptional("scenarioTimeoutMillis").ifPresent(n -> config.scenarioTimeoutMillis = n.longValue());
        j.<Map<String, Object>>getOptional("values").ifPresent(map -> config.values = new LinkedHashMap<>(map));
        return config;
    }

    /**
     * Values set in code after this call override the file.
     */
    public SuiteOptions.Builder applyTo(SuiteOptions.Builder builder) {
        builder.features(features.toArray(new String[0]));
        builder.tags(tags.toArray(new String[0]));
        builder.ignoreTags(ignoreTags.toArray(new String[0]));
        builder.parallel(threads);
        if (logLevel != null) {
            builder.logLevel(logLevel);
        }
        if (scenarioTimeoutMillis != null) {
            builder.scenarioTimeout(Duration.ofMillis(scenarioTimeoutMillis));
        }
        builder.values(values);
        return builder;
    }

    public List<String> getFeatures() {
        return features;
    }

    public List<String> getTags() {
        return tags;
    }

    public List<String> getIgnoreTags() {
        return ignoreTags;
    }

    public int getThreads() {
        return threads;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public Long getScenarioTimeoutMillis() {
        return scenarioTimeoutMillis;
    }

    public Map<String, Object> getValues() {
        return values;
    }

}
