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
import io.stepwise.gherkin.FeatureParser;
import io.stepwise.log.LogContext;
import io.stepwise.step.StepMatcher;
import io.stepwise.step.StepRegistry;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of a run.
 * <pre>
 * StepRegistry steps = new StepRegistry()
 *     .step("I have {int} cucumbers", ArgType.INT, (ctx, n) -&gt; ctx.set("cukes", n));
 * SuiteResult result = Suite.of(steps, SuiteOptions.builder().ignoreTags("@wip").build())
 *     .run(FeatureParser.parse(Path.of("cukes.feature")));
 * </pre>
 * Running freezes the registry, registering steps afterwards fails.
 */
public class Suite {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final StepRegistry registry;
    private final SuiteOptions options;
    private final TagSelector tagSelector;

    private StepMatcher matcher;
    private SuiteResult result;

    private Suite(StepRegistry registry, SuiteOptions options) {
        this.registry = registry;
        this.options = options;
        this.tagSelector = new TagSelector(options.getTags(), options.getIgnoreTags());
    }

    public static Suite of(StepRegistry registry) {
        return new Suite(registry, SuiteOptions.defaults());
    }

    public static Suite of(StepRegistry registry, SuiteOptions options) {
        return new Suite(registry, options);
    }

    /**
     * Runs the features listed in the options, parsed from disk.
     */
    public SuiteResult run() {
        List<Feature> features = new ArrayList<>(options.getFeatures().size());
        for (Path path : options.getFeatures()) {
            features.add(FeatureParser.parse(path));
        }
        return run(features);
    }

    public SuiteResult run(Feature... features) {
        return run(Arrays.asList(features));
    }

    public SuiteResult run(List<Feature> features) {
        registry.freeze();
        matcher = registry.matcher();
        if (options.getLogLevel() != null) {
            LogContext.setRuntimeLogLevel(options.getLogLevel());
        }
        result = new SuiteResult();
        result.setStartTime(System.currentTimeMillis());
        for (ResultListener listener : options.getResultListeners()) {
            listener.onSuiteStart(this);
        }
        List<Feature> selected = new ArrayList<>(features.size());
        for (Feature feature : features) {
            if (tagSelector.isFeatureExcluded(feature)) {
                logger.debug("skipping feature by tags: {}", feature);
            } else {
                selected.add(feature);
            }
        }
        try {
            if (options.isParallel()) {
                runParallel(selected);
            } else {
                runSequential(selected);
            }
        } finally {
            result.setEndTime(System.currentTimeMillis());
            for (ResultListener listener : options.getResultListeners()) {
                listener.onSuiteEnd(result);
            }
            result.logSummary(options.getThreads());
        }
        return result;
    }

    private void runSequential(List<Feature> features) {
        for (Feature feature : features) {
            FeatureRuntime fr = new FeatureRuntime(this, feature);
            result.addFeatureResult(fr.call());
        }
    }

    private void runParallel(List<Feature> features) {
        ExecutorService executor = Executors.newFixedThreadPool(options.getThreads(), new WorkerThreadFactory());
        try {
            List<FeatureRuntime> runtimes = new ArrayList<>(features.size());
            List<List<Future<ScenarioResult>>> pending = new ArrayList<>(features.size());
            for (Feature feature : features) {
                FeatureRuntime fr = new FeatureRuntime(this, feature);
                runtimes.add(fr);
                pending.add(fr.submit(executor));
            }
            for (int i = 0; i < runtimes.size(); i++) {
                result.addFeatureResult(runtimes.get(i).collect(pending.get(i)));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "stepwise-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }

    }

    public StepRegistry getRegistry() {
        return registry;
    }

    public SuiteOptions getOptions() {
        return options;
    }

    public TagSelector getTagSelector() {
        return tagSelector;
    }

    /**
     * @return the matcher over the frozen registry, null before the run starts
     */
    public StepMatcher getMatcher() {
        return matcher;
    }

    public SuiteResult getResult() {
        return result;
    }

}
