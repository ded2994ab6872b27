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

import io.stepwise.gherkin.Feature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class FeatureResult {

    private final Feature feature;
    private final List<ScenarioResult> scenarioResults = new ArrayList<>();
    private long startTime;
    private long endTime;

    public FeatureResult(Feature feature) {
        this.feature = feature;
    }

    public Feature getFeature() {
        return feature;
    }

    void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    synchronized void addScenarioResult(ScenarioResult sr) {
        scenarioResults.add(sr);
    }

    /**
     * @return results in document order
     */
    public List<ScenarioResult> getScenarioResults() {
        return Collections.unmodifiableList(scenarioResults);
    }

    public int getScenarioCount() {
        return scenarioResults.size();
    }

    public int getPassedCount() {
        return (int) scenarioResults.stream().filter(ScenarioResult::isPassed).count();
    }

    public int getFailedCount() {
        return (int) scenarioResults.stream().filter(ScenarioResult::isFailed).count();
    }

    public int getSkippedCount() {
        return (int) scenarioResults.stream().filter(ScenarioResult::isSkipped).count();
    }

    public boolean isFailed() {
        return getFailedCount() > 0;
    }

    public boolean isPassed() {
        return !isFailed();
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", feature.getName());
        map.put("uri", feature.getUri());
        map.put("passedCount", getPassedCount());
        map.put("failedCount", getFailedCount());
        map.put("skippedCount", getSkippedCount());
        map.put("durationMillis", getDurationMillis());
        List<Map<String, Object>> list = new ArrayList<>(scenarioResults.size());
        for (ScenarioResult sr : scenarioResults) {
            list.add(sr.toJson());
        }
        map.put("scenarioResults", list);
        return map;
    }

    @Override
    public String toString() {
        return feature.getUri() + " passed: " + getPassedCount() + " failed: " + getFailedCount()
                + " skipped: " + getSkippedCount();
    }

}
