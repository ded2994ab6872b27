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

import io.stepwise.gherkin.Step;

import java.util.LinkedHashMap;
import java.util.Map;

public class StepResult {

    public enum Status {
        PASSED, FAILED, SKIPPED
    }

    private final Step step;
    private final Status status;
    private final long startTime;
    private final long durationNanos;
    private final Throwable error;
    private String log;

    private StepResult(Step step, Status status, long startTime, long durationNanos, Throwable error) {
        this.step = step;
        this.status = status;
        this.startTime = startTime;
        this.durationNanos = durationNanos;
        this.error = error;
    }

    public static StepResult passed(Step step, long startTime, long durationNanos) {
        return new StepResult(step, Status.PASSED, startTime, durationNanos, null);
    }

    public static StepResult failed(Step step, long startTime, long durationNanos, Throwable error) {
        return new StepResult(step, Status.FAILED, startTime, durationNanos, error);
    }

    public static StepResult skipped(Step step, long startTime) {
        return new StepResult(step, Status.SKIPPED, startTime, 0, null);
    }

    public Step getStep() {
        return step;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return epoch millis
     */
    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return startTime + durationNanos / 1_000_000;
    }

    public long getDurationNanos() {
        return durationNanos;
    }

    public double getDurationMillis() {
        return durationNanos / 1_000_000.0;
    }

    public Throwable getError() {
        return error;
    }

    public String getErrorMessage() {
        return error == null ? null : error.getMessage();
    }

    public String getLog() {
        return log;
    }

    void setLog(String log) {
        this.log = log;
    }

    public boolean isPassed() {
        return status == Status.PASSED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("step", step.toJson());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", status.name().toLowerCase());
        result.put("startTime", startTime);
        result.put("endTime", getEndTime());
        result.put("nanos", durationNanos);
        if (error != null) {
            result.put("errorMessage", String.valueOf(error.getMessage()));
            result.put("errorType", error.getClass().getName());
        }
        map.put("result", result);
        if (log != null && !log.isEmpty()) {
            map.put("stepLog", log);
        }
        return map;
    }

    @Override
    public String toString() {
        return status + " " + step;
    }

}
