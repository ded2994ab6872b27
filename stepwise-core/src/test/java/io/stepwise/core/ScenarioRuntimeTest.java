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

import io.stepwise.gherkin.Table;
import io.stepwise.step.ArgType;
import io.stepwise.step.StepArgumentException;
import io.stepwise.step.StepFaultException;
import io.stepwise.step.StepRegistry;
import io.stepwise.step.StepResolutionException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static io.stepwise.core.StepResult.Status.*;
import static io.stepwise.core.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class ScenarioRuntimeTest {

    private final List<String> calls = new ArrayList<>();

    private StepRegistry registry() {
        return new StepRegistry()
                .step("^pass$", ctx -> calls.add("pass"))
                .step("^fail$", ctx -> {
                    calls.add("fail");
                    throw new AssertionError("boom");
                })
                .step("^explode$", ctx -> {
                    calls.add("explode");
                    throw new StackOverflowError("deep");
                })
                .step("^record (\\w+)$", ArgType.STRING, (ctx, s) -> calls.add(s));
    }

    @Test
    void testHaltsAtFirstFailure() {
        ScenarioResult sr = run(registry(), """
                * pass
                * pass
                * fail
                * pass
                """);
        assertStatuses(sr, PASSED, PASSED, FAILED);
        assertFailedWith(sr, "boom");
        assertInstanceOf(AssertionError.class, sr.getError());
        assertEquals(List.of("pass", "pass", "fail"), calls);
    }

    @Test
    void testAllPassed() {
        ScenarioResult sr = run(registry(), """
                * pass
                * record done
                """);
        assertPassed(sr);
        assertStatuses(sr, PASSED, PASSED);
        assertEquals(StepResult.Status.PASSED, sr.getStatus());
        assertNotNull(sr.getThreadName());
        assertTrue(sr.getEndTime() >= sr.getStartTime());
    }

    @Test
    void testErrorIsWrappedAsFault() {
        ScenarioResult sr = run(registry(), """
                * explode
                * pass
                """);
        assertStatuses(sr, FAILED);
        StepFaultException fault = assertInstanceOf(StepFaultException.class, sr.getError());
        assertInstanceOf(StackOverflowError.class, fault.getCause());
        assertTrue(fault.getMessage().contains("explode"));
    }

    @Test
    void testAfterScenarioRunsOnceWhateverHappens() {
        AtomicInteger after = new AtomicInteger();
        SuiteOptions options = SuiteOptions.builder()
                .afterScenario(ctx -> after.incrementAndGet())
                .build();
        SuiteResult result = runSuite(registry(), options, """
                Feature:
                Scenario: passes
                  * pass
                Scenario: fails
                  * fail
                Scenario: faults
                  * explode
                Scenario: undefined
                  * nobody knows this step
                """);
        assertEquals(4, after.get());
        List<ScenarioResult> results = result.getFeatureResults().get(0).getScenarioResults();
        assertEquals(4, results.size());
        assertTrue(results.get(0).isPassed());
        assertTrue(results.get(1).isFailed());
        assertTrue(results.get(2).isFailed());
        assertInstanceOf(StepResolutionException.class, results.get(3).getError());
    }

    @Test
    void testHooksInOrder() {
        SuiteOptions options = SuiteOptions.builder()
                .beforeScenario(ctx -> calls.add("beforeScenario1"))
                .beforeScenario(ctx -> calls.add("beforeScenario2"))
                .beforeStep(ctx -> calls.add("beforeStep " + ctx.getStep().getText()))
                .afterStep(ctx -> calls.add("afterStep " + ctx.getStep().getText()))
                .afterScenario(ctx -> calls.add("afterScenario"))
                .build();
        ScenarioResult sr = runFeature(registry(), options, """
                Feature:
                Scenario:
                  * pass
                  * fail
                """);
        assertTrue(sr.isFailed());
        assertEquals(List.of(
                "beforeScenario1", "beforeScenario2",
                "beforeStep pass", "pass", "afterStep pass",
                "beforeStep fail", "fail", "afterStep fail",
                "afterScenario"), calls);
    }

    @Test
    void testBeforeScenarioFailureSkipsSteps() {
        AtomicInteger after = new AtomicInteger();
        SuiteOptions options = SuiteOptions.builder()
                .beforeScenario(ctx -> {
                    throw new IllegalStateException("not ready");
                })
                .beforeScenario(ctx -> calls.add("second hook"))
                .afterScenario(ctx -> after.incrementAndGet())
                .build();
        ScenarioResult sr = runFeature(registry(), options, """
                Feature:
                Scenario:
                  * pass
                """);
        assertTrue(sr.isFailed());
        assertTrue(sr.getStepResults().isEmpty());
        assertEquals(1, sr.getHookErrors().size());
        assertEquals("not ready", sr.getHookError().getMessage());
        assertEquals("not ready", sr.getFailureMessage());
        assertTrue(calls.isEmpty());
        assertEquals(1, after.get());
    }

    @Test
    void testStepHookFailuresFailTheStep() {
        SuiteOptions before = SuiteOptions.builder()
                .beforeStep(ctx -> {
                    throw new IllegalStateException("before step");
                })
                .build();
        ScenarioResult sr = runFeature(registry(), before, "Feature:\nScenario:\n* pass\n* pass");
        assertStatuses(sr, FAILED);
        assertFailedWith(sr, "before step");
        assertTrue(calls.isEmpty());
        SuiteOptions after = SuiteOptions.builder()
                .afterStep(ctx -> {
                    throw new IllegalStateException("after step");
                })
                .build();
        sr = runFeature(registry(), after, "Feature:\nScenario:\n* pass\n* pass");
        assertStatuses(sr, FAILED);
        assertFailedWith(sr, "after step");
        assertEquals(List.of("pass"), calls);
    }

    @Test
    void testAfterScenarioFailureIsRecorded() {
        SuiteOptions options = SuiteOptions.builder()
                .afterScenario(ctx -> {
                    throw new IllegalStateException("cleanup failed");
                })
                .afterScenario(ctx -> calls.add("second cleanup"))
                .build();
        ScenarioResult sr = runFeature(registry(), options, "Feature:\nScenario:\n* pass");
        assertStatuses(sr, PASSED);
        assertTrue(sr.isFailed());
        assertEquals("cleanup failed", sr.getFailureMessage());
        assertEquals(List.of("pass", "second cleanup"), calls);
    }

    @Test
    void testArityMismatchFailsStep() {
        StepRegistry registry = new StepRegistry()
                .step("^add (\\d+) and (\\d+)$", List.of(ArgType.INT), (ctx, args) -> calls.add("called"));
        ScenarioResult sr = run(registry, "* add 1 and 2");
        assertInstanceOf(StepArgumentException.class, sr.getError());
        assertTrue(calls.isEmpty());
    }

    @Test
    void testBackgroundThenRuleBackground() {
        ScenarioResult sr = runFeature(registry(), SuiteOptions.defaults(), """
                Feature:
                  Background:
                    * record feature
                  Rule: ordering
                    Background:
                      * record rule
                    Scenario:
                      * record scenario
                """);
        assertPassed(sr);
        assertEquals("ordering", sr.getScenario().getRuleName());
        assertEquals(List.of("feature", "rule", "scenario"), calls);
    }

    @Test
    void testFailingBackgroundStopsScenario() {
        ScenarioResult sr = runFeature(registry(), SuiteOptions.defaults(), """
                Feature:
                  Background:
                    * fail
                  Scenario:
                    * pass
                """);
        assertStatuses(sr, FAILED);
        assertEquals(List.of("fail"), calls);
    }

    @Test
    void testOutlineRunsExpandedSteps() {
        List<Integer> eaten = new ArrayList<>();
        StepRegistry registry = new StepRegistry()
                .step("I eat {int} apples", ArgType.INT, (ctx, n) -> eaten.add(n))
                .step("I am {word}", ArgType.STRING, (ctx, s) -> ctx.set("mood", s));
        ScenarioResult sr = runFeature(registry, SuiteOptions.defaults(), """
                Feature:
                  Scenario Outline:
                    * I eat <count> apples
                    * I am <mood>
                    Examples:
                      | count | mood  |
                      | 3     | full  |
                      | 5     | sick  |
                """);
        assertPassed(sr);
        assertStatuses(sr, PASSED, PASSED, PASSED, PASSED);
        assertEquals(List.of(3, 5), eaten);
        assertEquals("I am sick", sr.getStepResults().get(3).getStep().getText());
    }

    @Test
    void testOutlineWithUndefinedStepFailsBeforeRunning() {
        StepRegistry registry = new StepRegistry()
                .step("I eat {int} apples", ArgType.INT, (ctx, n) -> calls.add("eat"));
        ScenarioResult sr = runFeature(registry, SuiteOptions.defaults(), """
                Feature:
                  Scenario Outline:
                    * I eat <count> apples
                    * I juggle <count> pears
                    Examples:
                      | count |
                      | 1     |
                """);
        assertStatuses(sr, FAILED);
        assertInstanceOf(StepResolutionException.class, sr.getError());
        assertEquals("I juggle 1 pears", sr.getStepResults().get(0).getStep().getText());
        assertTrue(calls.isEmpty());
    }

    @Test
    void testOutlineStepThatIsOnlyAPlaceholder() {
        List<Integer> eaten = new ArrayList<>();
        StepRegistry registry = new StepRegistry()
                .step("I eat {int} apples", ArgType.INT, (ctx, n) -> eaten.add(n));
        ScenarioResult sr = runFeature(registry, SuiteOptions.defaults(), """
                Feature:
                  Scenario Outline:
                    * <action>
                    Examples:
                      | action         |
                      | I eat 3 apples |
                      | I eat 4 apples |
                """);
        assertPassed(sr);
        assertEquals(List.of(3, 4), eaten);
    }

    @Test
    void testContextDoesNotWriteBackToSuiteValues() {
        StepRegistry registry = new StepRegistry()
                .step("I replace base", ctx -> ctx.set("base", "changed"));
        SuiteOptions options = SuiteOptions.builder().value("base", "seed").build();
        assertPassed(runFeature(registry, options, """
                Feature:
                  Scenario:
                    * I replace base
                """));
        assertEquals("seed", options.getValues().get("base"));
    }

    @Test
    void testDocStringAndTable() {
        List<Object> seen = new ArrayList<>();
        StepRegistry registry = new StepRegistry()
                .step("a document", ctx -> seen.add(ctx.getDocString()))
                .step("a table", ctx -> {
                    Table table = ctx.getTable();
                    seen.add(table.getRowsAsMaps());
                });
        ScenarioResult sr = run(registry, """
                * a document
                  ```
                  hello world
                  ```
                * a table
                  | name | qty |
                  | pear | 2   |
                """);
        assertPassed(sr);
        assertEquals("hello world", seen.get(0));
        assertEquals(List.of(Map.of("name", "pear", "qty", "2")), seen.get(1));
    }

    @Test
    void testContextIsolationAndInitialValues() {
        StepRegistry registry = new StepRegistry()
                .step("I remember {word}", ArgType.STRING, (ctx, s) -> {
                    assertFalse(ctx.has("memory"));
                    assertEquals("seed", ctx.get("base"));
                    ctx.set("memory", s);
                });
        SuiteOptions options = SuiteOptions.builder().value("base", "seed").build();
        SuiteResult result = runSuite(registry, options, """
                Feature:
                  Scenario: one
                    * I remember apples
                  Scenario: two
                    * I remember pears
                """);
        assertTrue(result.isPassed());
        assertEquals(2, result.getScenarioPassedCount());
    }

    @Test
    void testDeadline() {
        StepRegistry registry = new StepRegistry()
                .step("no deadline", ctx -> assertTrue(ctx.getDeadline().isEmpty()));
        assertPassed(run(registry, "* no deadline"));
        SuiteOptions options = SuiteOptions.builder().scenarioTimeout(Duration.ofMinutes(5)).build();
        StepRegistry other = new StepRegistry()
                .step("a deadline", ctx -> {
                    assertTrue(ctx.getDeadline().isPresent());
                    assertFalse(ctx.isExpired());
                });
        assertPassed(runFeature(other, options, "Feature:\nScenario:\n* a deadline"));
    }

    @Test
    void testStepLogIsCaptured() {
        StepRegistry registry = new StepRegistry()
                .step("I log {word}", ArgType.STRING, (ctx, s) -> ctx.log("hello {}", s))
                .step("silence", ctx -> {
                });
        ScenarioResult sr = run(registry, """
                * I log world
                * silence
                """);
        assertPassed(sr);
        assertEquals("hello world\n", sr.getStepResults().get(0).getLog());
        assertEquals("", sr.getStepResults().get(1).getLog());
    }

    @Test
    void testStateAfterCall() {
        ScenarioRuntime runtime = new ScenarioRuntime(
                feature("Feature:\nScenario:\n* fail").getScenarios().get(0),
                registry().matcher(), SuiteOptions.defaults());
        assertEquals(ScenarioRuntime.State.PENDING, runtime.getState());
        ScenarioResult sr = runtime.call();
        assertSame(sr, runtime.getResult());
        assertEquals(ScenarioRuntime.State.FAILED, runtime.getState());
    }

}
