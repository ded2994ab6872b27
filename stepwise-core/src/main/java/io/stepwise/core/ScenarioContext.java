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

import io.stepwise.gherkin.Scenario;
import io.stepwise.gherkin.Step;
import io.stepwise.gherkin.Table;
import io.stepwise.log.LogContext;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state shared by the steps and hooks of one scenario. Every scenario
 * gets a fresh instance seeded with a copy of the suite's initial values, so
 * keys set or replaced here never leak between scenarios, even when they run
 * in parallel.
 * <p>
 * The copy is shallow: an initial value is the same object in every scenario.
 * Seed only immutable values, and set a fresh collection in the context when a
 * scenario needs one to mutate.
 */
public class ScenarioContext {

    private static final LogContext.LogWriter LOG = LogContext.with(LogContext.SCENARIO_LOGGER);

    private final Scenario scenario;
    private final Map<String, Object> values;
    private final Instant deadline;

    private Step step;

    public ScenarioContext(Scenario scenario, Map<String, Object> initialValues, Instant deadline) {
        this.scenario = scenario;
        this.values = new LinkedHashMap<>(initialValues == null ? Collections.emptyMap() : initialValues);
        this.deadline = deadline;
    }

    public ScenarioContext set(String key, Object value) {
        values.put(key, value);
        return this;
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        return (T) values.get(key);
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String key, T defaultValue) {
        return (T) values.getOrDefault(key, defaultValue);
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Object remove(String key) {
        return values.remove(key);
    }

    public Map<String, Object> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public Scenario getScenario() {
        return scenario;
    }

    /**
     * @return the step being executed, null outside of a step
     */
    public Step getStep() {
        return step;
    }

    void setStep(Step step) {
        this.step = step;
    }

    public String getDocString() {
        return step == null ? null : step.getDocString();
    }

    public Table getTable() {
        return step == null ? null : step.getTable();
    }

    /**
     * The engine never interrupts a step, long running steps are expected to
     * check {@link #isExpired()} themselves.
     */
    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    public boolean isExpired() {
        return deadline != null && Instant.now().isAfter(deadline);
    }

    /**
     * Writes to the current step's log and to the "stepwise.scenario" category.
     */
    public void log(String format, Object... args) {
        LOG.info(format, args);
    }

}
