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
import io.stepwise.gherkin.Scenario;
import io.stepwise.log.LogContext;
import io.stepwise.step.StepwiseException;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs the scenarios of one feature, either one after the other or submitted
 * to the suite's worker pool. Results are kept in document order.
 */
public class FeatureRuntime implements Callable<FeatureResult> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Suite suite;
    private final Feature feature;
    private final FeatureResult result;

    public FeatureRuntime(Suite suite, Feature feature) {
        this.suite = suite;
        this.feature = feature;
        this.result = new FeatureResult(feature);
    }

    @Override
    public FeatureResult call() {
        start();
        for (Scenario scenario : feature.getScenarios()) {
            result.addScenarioResult(toRuntimeOrSkip(scenario));
        }
        return end();
    }

    /**
     * Submits every selected scenario, excluded ones complete immediately as skipped.
     */
    List<Future<ScenarioResult>> submit(ExecutorService executor) {
        start();
        List<Future<ScenarioResult>> futures = new ArrayList<>(feature.getScenarios().size());
        for (Scenario scenario : feature.getScenarios()) {
            if (isSelected(scenario)) {
                futures.add(executor.submit(newRuntime(scenario)));
            } else {
                futures.add(CompletableFuture.completedFuture(skip(scenario)));
            }
        }
        return futures;
    }

    FeatureResult collect(List<Future<ScenarioResult>> futures) {
        for (Future<ScenarioResult> future : futures) {
            try {
                result.addScenarioResult(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StepwiseException("interrupted while waiting for scenarios of: " + feature, e);
            } catch (ExecutionException e) {
                throw new StepwiseException("scenario execution failed in: " + feature, e.getCause());
            }
        }
        return end();
    }

    private ScenarioResult toRuntimeOrSkip(Scenario scenario) {
        return isSelected(scenario) ? newRuntime(scenario).call() : skip(scenario);
    }

    private boolean isSelected(Scenario scenario) {
        return suite.getTagSelector().evaluate(scenario.getTagsEffective());
    }

    private ScenarioRuntime newRuntime(Scenario scenario) {
        return new ScenarioRuntime(scenario, suite.getMatcher(), suite.getOptions());
    }

    private ScenarioResult skip(Scenario scenario) {
        logger.debug("skipping scenario by tags: {}", scenario);
        return ScenarioResult.skipped(scenario);
    }

    private void start() {
        result.setStartTime(System.currentTimeMillis());
        for (ResultListener listener : suite.getOptions().getResultListeners()) {
            listener.onFeatureStart(feature);
        }
    }

    private FeatureResult end() {
        result.setEndTime(System.currentTimeMillis());
        logger.info("{}", result);
        for (ResultListener listener : suite.getOptions().getResultListeners()) {
            listener.onFeatureEnd(result);
        }
        return result;
    }

    public Feature getFeature() {
        return feature;
    }

    public FeatureResult getResult() {
        return result;
    }

}
