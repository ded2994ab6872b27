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
import io.stepwise.log.LogContext;
import io.stepwise.step.StepDefinition;
import io.stepwise.step.StepFaultException;
import io.stepwise.step.StepMatcher;
import io.stepwise.step.StepResolutionException;
import io.stepwise.step.StepwiseException;
import org.slf4j.Logger;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Executes one scenario in its own context: before-scenario hooks, background
 * steps, then the scenario steps or the expanded outline steps, stopping at
 * the first step that does not pass. After-scenario hooks run exactly once
 * whatever happened.
 */
public class ScenarioRuntime implements Callable<ScenarioResult> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public enum State {
        PENDING, RUNNING, PASSED, FAILED
    }

    private final Scenario scenario;
    private final StepMatcher matcher;
    private final SuiteOptions options;
    private final ScenarioContext context;
    private final StepExecutor executor;
    private final ScenarioResult result;

    private volatile State state = State.PENDING;

    public ScenarioRuntime(Scenario scenario, StepMatcher matcher, SuiteOptions options) {
        this.scenario = scenario;
        this.matcher = matcher;
        this.options = options;
        Instant deadline = options.getScenarioTimeout() == null ? null : Instant.now().plus(options.getScenarioTimeout());
        this.context = new ScenarioContext(scenario, options.getValues(), deadline);
        this.executor = new StepExecutor(this);
        this.result = new ScenarioResult(scenario);
    }

    @Override
    public ScenarioResult call() {
        state = State.RUNNING;
        result.setStartTime(System.currentTimeMillis());
        result.setThreadName(Thread.currentThread().getName());
        LogContext.set(new LogContext());
        for (ResultListener listener : options.getResultListeners()) {
            fireListener(() -> listener.onScenarioStart(scenario));
        }
        logger.debug("scenario start: {}", scenario);
        try {
            if (runHooks(options.getBeforeScenario(), "beforeScenario", true)) {
                runSteps();
            }
        } finally {
            runHooks(options.getAfterScenario(), "afterScenario", false);
            result.setEndTime(System.currentTimeMillis());
            state = result.isFailed() ? State.FAILED : State.PASSED;
            LogContext.clear();
            logger.debug("scenario end: {} {}", state, scenario);
        }
        for (ResultListener listener : options.getResultListeners()) {
            fireListener(() -> listener.onScenarioEnd(result));
        }
        return result;
    }

    private void runSteps() {
        for (Step step : scenario.getBackgroundSteps()) {
            if (!run(step, null)) {
                return;
            }
        }
        if (!scenario.isOutline()) {
            for (Step step : scenario.getSteps()) {
                if (!run(step, null)) {
                    return;
                }
            }
            return;
        }
        List<ResolvedStep> expanded;
        try {
            expanded = OutlineExpander.expand(scenario.getSteps(), scenario.getExamples(), matcher).steps();
        } catch (StepResolutionException e) {
            Step failed = e.getStep();
            logger.error("{}:{} {}", scenario.getFeatureUri(), failed.getLine(), e.getMessage());
            result.addStepResult(StepResult.failed(failed, System.currentTimeMillis(), 0, e));
            return;
        }
        for (ResolvedStep rs : expanded) {
            if (!run(rs.step(), rs.definition())) {
                return;
            }
        }
    }

    private boolean run(Step step, StepDefinition definition) {
        StepResult sr = executor.execute(step, definition);
        result.addStepResult(sr);
        return sr.isPassed();
    }

    /**
     * @param stopOnFailure stop at the first failing hook instead of running them all
     * @return true if every hook that ran succeeded
     */
    private boolean runHooks(List<Hook> hooks, String phase, boolean stopOnFailure) {
        boolean ok = true;
        for (Hook hook : hooks) {
            try {
                hook.run(context);
            } catch (Throwable t) {
                Throwable error = toHookFailure(phase, t);
                logger.error("{} {} hook failed: {}", scenario.getDebugInfo(), phase, error.getMessage());
                result.addHookError(error);
                ok = false;
                if (stopOnFailure) {
                    break;
                }
            }
        }
        return ok;
    }

    private Throwable toHookFailure(String phase, Throwable t) {
        if (t instanceof Exception || t instanceof AssertionError) {
            return t;
        }
        String where = phase + " hook of " + scenario.getDebugInfo();
        if (t instanceof Error e) {
            return new StepFaultException(where, e);
        }
        return new StepwiseException(where + " threw " + t, t);
    }

    private static void fireListener(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.warn("result listener failed: {}", e.getMessage());
        }
    }

    public Scenario getScenario() {
        return scenario;
    }

    public ScenarioContext getContext() {
        return context;
    }

    public SuiteOptions getOptions() {
        return options;
    }

    public StepMatcher getMatcher() {
        return matcher;
    }

    public ScenarioResult getResult() {
        return result;
    }

    public State getState() {
        return state;
    }

}
