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
import io.stepwise.log.LogContext;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SuiteResult {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final List<FeatureResult> featureResults = new ArrayList<>();
    private long startTime;
    private long endTime;

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

    synchronized void addFeatureResult(FeatureResult fr) {
        featureResults.add(fr);
    }

    public List<FeatureResult> getFeatureResults() {
        return Collections.unmodifiableList(featureResults);
    }

    public int getFeatureCount() {
        return featureResults.size();
    }

    public int getScenarioCount() {
        return featureResults.stream().mapToInt(FeatureResult::getScenarioCount).sum();
    }

    public int getScenarioPassedCount() {
        return featureResults.stream().mapToInt(FeatureResult::getPassedCount).sum();
    }

    public int getScenarioFailedCount() {
        return featureResults.stream().mapToInt(FeatureResult::getFailedCount).sum();
    }

    public int getScenarioSkippedCount() {
        return featureResults.stream().mapToInt(FeatureResult::getSkippedCount).sum();
    }

    public boolean isFailed() {
        return getScenarioFailedCount() > 0;
    }

    public boolean isPassed() {
        return !isFailed();
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

    public List<String> getErrors() {
        List<String> errors = new ArrayList<>();
        for (FeatureResult fr : featureResults) {
            for (ScenarioResult sr : fr.getScenarioResults()) {
                if (sr.isFailed()) {
                    errors.add(sr.getScenario().getDebugInfo() + " " + sr.getFailureMessage());
                }
            }
        }
        return errors;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("featureCount", getFeatureCount());
        map.put("scenarioCount", getScenarioCount());
        map.put("passedCount", getScenarioPassedCount());
        map.put("failedCount", getScenarioFailedCount());
        map.put("skippedCount", getScenarioSkippedCount());
        map.put("startTime", startTime);
        map.put("endTime", endTime);
        map.put("durationMillis", getDurationMillis());
        List<Map<String, Object>> list = new ArrayList<>(featureResults.size());
        for (FeatureResult fr : featureResults) {
            list.add(fr.toJson());
        }
        map.put("featureResults", list);
        return map;
    }

    public String toJsonString() {
        return Json.toJson(toJson());
    }

    /**
     * One line at the runtime logger, failed scenarios listed below it.
     */
    public void logSummary(int threadCount) {
        logger.info(String.format("features: %d | scenarios: %d | passed: %d | failed: %d | skipped: %d | threads: %d | elapsed: %.2fs",
                getFeatureCount(), getScenarioCount(), getScenarioPassedCount(), getScenarioFailedCount(),
                getScenarioSkippedCount(), threadCount, getDurationMillis() / 1000.0));
        for (String error : getErrors()) {
            logger.info("failed: {}", error);
        }
    }

}
