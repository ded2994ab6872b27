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

import io.stepwise.log.LogContext;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of how a suite runs: tag filters, ordered lifecycle hooks,
 * parallelism, feature paths and the values every scenario context starts with.
 * <pre>
 * SuiteOptions options = SuiteOptions.builder()
 *     .tags("@smoke")
 *     .ignoreTags("@slow")
 *     .beforeScenario(ctx -&gt; ctx.set("started", true))
 *     .parallel(4)
 *     .build();
 * </pre>
 */
public class SuiteOptions {

    private final Set<String> tags;
    private final Set<String> ignoreTags;
    private final List<Hook> beforeScenario;
    private final List<Hook> afterScenario;
    private final List<Hook> beforeStep;
    private final List<Hook> afterStep;
    private final List<ResultListener> resultListeners;
    private final List<Path> features;
    private final Map<String, Object> values;
    private final int threads;
    private final Duration scenarioTimeout;
    private final String logLevel;

    private SuiteOptions(Builder b) {
        tags = Collections.unmodifiableSet(new LinkedHashSet<>(b.tags));
        ignoreTags = Collections.unmodifiableSet(new LinkedHashSet<>(b.ignoreTags));
        beforeScenario = List.copyOf(b.beforeScenario);
        afterScenario = List.copyOf(b.afterScenario);
        beforeStep = List.copyOf(b.beforeStep);
        afterStep = List.copyOf(b.afterStep);
        resultListeners = List.copyOf(b.resultListeners);
        features = List.copyOf(b.features);
        values = Collections.unmodifiableMap(new LinkedHashMap<>(b.values));
        threads = b.threads;
        scenarioTimeout = b.scenarioTimeout;
        logLevel = b.logLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SuiteOptions defaults() {
        return new Builder().build();
    }

    public Set<String> getTags() {
        return tags;
    }

    public Set<String> getIgnoreTags() {
        return ignoreTags;
    }

    public List<Hook> getBeforeScenario() {
        return beforeScenario;
    }

    public List<Hook> getAfterScenario() {
        return afterScenario;
    }

    public List<Hook> getBeforeStep() {
        return beforeStep;
    }

    public List<Hook> getAfterStep() {
        return afterStep;
    }

    public List<ResultListener> getResultListeners() {
        return resultListeners;
    }

    public List<Path> getFeatures() {
        return features;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public int getThreads() {
        return threads;
    }

    public boolean isParallel() {
        return threads > 1;
    }

    /**
     * @return the per-scenario deadline offset, null when scenarios have no deadline
     */
    public Duration getScenarioTimeout() {
        return scenarioTimeout;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public static class Builder {

        private static final Logger logger = LogContext.RUNTIME_LOGGER;

        private final Set<String> tags = new LinkedHashSet<>();
        private final Set<String> ignoreTags = new LinkedHashSet<>();
        private final List<Hook> beforeScenario = new ArrayList<>();
        private final List<Hook> afterScenario = new ArrayList<>();
        private final List<Hook> beforeStep = new ArrayList<>();
        private final List<Hook> afterStep = new ArrayList<>();
        private final List<ResultListener> resultListeners = new ArrayList<>();
        private final List<Path> features = new ArrayList<>();
        private final Map<String, Object> values = new LinkedHashMap<>();
        private int threads = 1;
        private Duration scenarioTimeout;
        private String logLevel;

        Builder() {
        }

        /**
         * Only scenarios carrying at least one of these tags run. Tags must start with '@'.
         */
        public Builder tags(String... tags) {
            addTags(this.tags, tags);
            return this;
        }

        /**
         * Scenarios carrying any of these tags never run, this wins over {@link #tags(String...)}.
         */
        public Builder ignoreTags(String... tags) {
            addTags(this.ignoreTags, tags);
            return this;
        }

        private static void addTags(Set<String> target, String... tags) {
            for (String tag : tags) {
                if (tag == null || !tag.startsWith("@")) {
                    logger.warn("ignoring tag without '@' prefix: {}", tag);
                    continue;
                }
                target.add(tag);
            }
        }

        public Builder beforeScenario(Hook hook) {
            beforeScenario.add(hook);
            return this;
        }

        public Builder afterScenario(Hook hook) {
            afterScenario.add(hook);
            return this;
        }

        public Builder beforeStep(Hook hook) {
            beforeStep.add(hook);
            return this;
        }

        public Builder afterStep(Hook hook) {
            afterStep.add(hook);
            return this;
        }

        public Builder resultListener(ResultListener listener) {
            resultListeners.add(listener);
            return this;
        }

        public Builder features(String... paths) {
            for (String path : paths) {
                features.add(Path.of(path));
            }
            return this;
        }

        public Builder features(Path... paths) {
            Collections.addAll(features, paths);
            return this;
        }

        /**
         * Seeds every scenario context. Each scenario gets a shallow copy, so the value
         * itself is shared and should be immutable.
         */
        public Builder value(String key, Object value) {
            values.put(key, value);
            return this;
        }

        public Builder values(Map<String, Object> map) {
            values.putAll(map);
            return this;
        }

        public Builder parallel(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("thread count must be at least 1: " + threads);
            }
            this.threads = threads;
            return this;
        }

        public Builder scenarioTimeout(Duration timeout) {
            this.scenarioTimeout = timeout;
            return this;
        }

        public Builder logLevel(String logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public SuiteOptions build() {
            return new SuiteOptions(this);
        }

    }

}
