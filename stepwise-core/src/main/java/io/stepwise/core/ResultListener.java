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

/**
 * Receives results as they stream in. Purely observational, a listener cannot
 * change the outcome of a run. In parallel mode the scenario callbacks arrive
 * on worker threads, so implementations must be thread-safe.
 */
public interface ResultListener {

    default void onSuiteStart(Suite suite) {
    }

    default void onSuiteEnd(SuiteResult result) {
    }

    default void onFeatureStart(Feature feature) {
    }

    default void onFeatureEnd(FeatureResult result) {
    }

    /**
     * Not called for scenarios excluded by tags.
     */
    default void onScenarioStart(Scenario scenario) {
    }

    default void onScenarioEnd(ScenarioResult result) {
    }

}
