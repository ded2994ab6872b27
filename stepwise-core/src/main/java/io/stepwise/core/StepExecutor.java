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
import io.stepwise.log.LogContext;
import io.stepwise.step.ArgumentCoercer;
import io.stepwise.step.StepDefinition;
import io.stepwise.step.StepFaultException;
import io.stepwise.step.StepwiseException;
import org.slf4j.Logger;

/**
 * Runs a single step: before-step hooks, resolution, coercion, invocation and
 * after-step hooks. Nothing thrown by user code escapes, every outcome becomes
 * a {@link StepResult}.
 */
public class StepExecutor {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final ScenarioRuntime runtime;

    public StepExecutor(ScenarioRuntime runtime) {
        this.runtime = runtime;
    }

    /**
     * @param definition the already resolved definition, or null to resolve against the registry
     */
    public StepResult execute(Step step, StepDefinition definition) {
        ScenarioContext context = runtime.getContext();
        SuiteOptions options = runtime.getOptions();
        long startTime = System.currentTimeMillis();
        long start = System.nanoTime();
        context.setStep(step);
        Throwable error = null;
        try {
            for (Hook hook : options.getBeforeStep()) {
                hook.run(context);
            }
            StepDefinition def = definition == null ? runtime.getMatcher().resolve(step) : definition;
            Object[] args = ArgumentCoercer.coerce(def.capture(step.getText()), def.getArgTypes());
            def.getFunction().invoke(context, args);
        } catch (Throwable t) {
            error = toFailure(step, t);
        } finally {
            for (Hook hook : options.getAfterStep()) {
                try {
                    hook.run(context);
                } catch (Throwable t) {
                    Throwable hookError = toFailure(step, t);
                    if (error == null) {
                        error = hookError;
                    } else {
                        error.addSuppressed(hookError);
                    }
                }
            }
            context.setStep(null);
        }
        long duration = System.nanoTime() - start;
        StepResult result;
        if (error == null) {
            result = StepResult.passed(step, startTime, duration);
        } else {
            logger.error("{}:{} {} failed: {}", runtime.getScenario().getFeatureUri(), step.getLine(),
                    step.getPrefixedText(), error.getMessage());
            result = StepResult.failed(step, startTime, duration, error);
        }
        result.setLog(LogContext.get().collect());
        return result;
    }

    static Throwable toFailure(Step step, Throwable t) {
        if (t instanceof Exception || t instanceof AssertionError) {
            return t;
        }
        String where = "step '" + step.getText() + "' at line " + step.getLine();
        if (t instanceof Error e) {
            return new StepFaultException(where, e);
        }
        return new StepwiseException(where + " threw " + t, t);
    }

}
