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
import io.stepwise.gherkin.Tag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ScenarioResult {

    private final Scenario scenario;
    private final boolean skipped;
    private final List<StepResult> stepResults = new ArrayList<>();
    private final List<Throwable> hookErrors = new ArrayList<>();
    private long startTime;
    private long endTime;
    private String threadName;

    public ScenarioResult(Scenario scenario) {
        this(scenario, false);
    }

    private ScenarioResult(Scenario scenario, boolean skipped) {
        this.scenario = scenario;
        this.skipped = skipped;
    }

    /**
     * A scenario excluded by tags: every literal step recorded as skipped, nothing executed.
     */
    public static ScenarioResult skipped(Scenario scenario) {
        ScenarioResult sr = new ScenarioResult(scenario, true);
        long now = System.currentTimeMillis();
        sr.startTime = now;
        sr.endTime = now;
        for (Step step : scenario.getStepsIncludingBackground()) {
            sr.stepResults.add(StepResult.skipped(step, now));
        }
        return sr;
    }

    void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    void setThreadName(String threadName) {
        this.threadName = threadName;
    }

    void addStepResult(StepResult sr) {
        stepResults.add(sr);
    }

    void addHookError(Throwable error) {
        hookErrors.add(error);
    }

    public Scenario getScenario() {
        return scenario;
    }

    public List<StepResult> getStepResults() {
        return Collections.unmodifiableList(stepResults);
    }

    public List<Throwable> getHookErrors() {
        return Collections.unmodifiableList(hookErrors);
    }

    public Throwable getHookError() {
        return hookErrors.isEmpty() ? null : hookErrors.get(0);
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public String getThreadName() {
        return threadName;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public boolean isFailed() {
        return !hookErrors.isEmpty() || stepResults.stream().anyMatch(StepResult::isFailed);
    }

    public boolean isPassed() {
        return !skipped && !isFailed();
    }

    public StepResult.Status getStatus() {
        if (skipped) {
            return StepResult.Status.SKIPPED;
        }
        return isFailed() ? StepResult.Status.FAILED : StepResult.Status.PASSED;
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

    /**
     * The first step error, else the first hook error.
     */
    public Throwable getError() {
        return stepResults.stream()
                .filter(StepResult::isFailed)
                .findFirst()
                .map(StepResult::getError)
                .orElse(getHookError());
    }

    public String getFailureMessage() {
        Throwable error = getError();
        return error == null ? null : error.getMessage();
    }

    public int getPassedCount() {
        return (int) stepResults.stream().filter(StepResult::isPassed).count();
    }

    public int getFailedCount() {
        return (int) stepResults.stream().filter(StepResult::isFailed).count();
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", scenario.getName());
        map.put("line", scenario.getLine());
        map.put("refId", scenario.getRefId());
        if (scenario.getRuleName() != null) {
            map.put("rule", scenario.getRuleName());
        }
        List<String> tags = new ArrayList<>();
        for (Tag tag : scenario.getTagsEffective()) {
            tags.add(tag.getName());
        }
        map.put("tags", tags);
        map.put("status", getStatus().name().toLowerCase());
        map.put("durationMillis", getDurationMillis());
        if (isFailed()) {
            map.put("error", String.valueOf(getFailureMessage()));
        }
        if (!hookErrors.isEmpty()) {
            List<String> errors = new ArrayList<>(hookErrors.size());
            for (Throwable t : hookErrors) {
                errors.add(String.valueOf(t.getMessage()));
            }
            map.put("hookErrors", errors);
        }
        map.put("executorName", threadName);
        map.put("startTime", startTime);
        map.put("endTime", endTime);
        List<Map<String, Object>> steps = new ArrayList<>(stepResults.size());
        for (StepResult sr : stepResults) {
            steps.add(sr.toJson());
        }
        map.put("stepResults", steps);
        return map;
    }

    @Override
    public String toString() {
        return getStatus() + " " + scenario;
    }

}
