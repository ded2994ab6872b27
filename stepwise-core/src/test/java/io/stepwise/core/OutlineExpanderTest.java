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
import io.stepwise.step.ArgType;
import io.stepwise.step.StepDefinition;
import io.stepwise.step.StepRegistry;
import io.stepwise.step.StepResolutionException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class OutlineExpanderTest {

    private static StepRegistry registry() {
        return new StepRegistry()
                .step("I eat {int} apples", ArgType.INT, (ctx, n) -> {
                })
                .step("I have (.*) left", ArgType.STRING, (ctx, s) -> {
                })
                .step("the price is {float}", ArgType.DOUBLE, (ctx, d) -> {
                });
    }

    private static Scenario outline(String gherkin) {
        return TestUtils.feature(gherkin).getScenarios().get(0);
    }

    @Test
    void testSingleRow() {
        Scenario scenario = outline("""
                Feature:
                Scenario Outline:
                  * I eat <count> apples
                  Examples:
                    | count |
                    | 3     |
                """);
        StepRegistry registry = registry();
        OutlineExpander.Expansion expansion = OutlineExpander.expand(scenario.getSteps(), scenario.getExamples(), registry.matcher());
        assertEquals(1, expansion.steps().size());
        ResolvedStep rs = expansion.steps().get(0);
        assertEquals("I eat 3 apples", rs.step().getText());
        assertEquals(Map.of("count", "3"), rs.exampleData());
        assertSame(registry.getDefinitions().get(0).getFunction(), rs.definition().getFunction());
        StepDefinition synthesized = expansion.overlay().get(0);
        assertEquals(Pattern.quote("I eat ") + "(-?\\d+)" + Pattern.quote(" apples"), synthesized.getPattern().pattern());
        assertEquals(List.of(ArgType.INT), synthesized.getArgTypes());
        assertSame(rs.definition().getFunction(), synthesized.getFunction());
    }

    @Test
    void testRowMajorOrder() {
        Scenario scenario = outline("""
                Feature:
                Scenario Outline:
                  * I eat <count> apples
                  * I have <rest> left
                  Examples:
                    | count | rest  |
                    | 1     | four  |
                    | 2     | three |
                  Examples:
                    | count | rest |
                    | 5     | none |
                """);
        OutlineExpander.Expansion expansion = OutlineExpander.expand(scenario.getSteps(), scenario.getExamples(), registry().matcher());
        List<String> texts = new ArrayList<>();
        for (ResolvedStep rs : expansion.steps()) {
            texts.add(rs.tableIndex() + "." + rs.rowIndex() + " " + rs.step().getText());
        }
        assertEquals(List.of(
                "0.0 I eat 1 apples",
                "0.0 I have four left",
                "0.1 I eat 2 apples",
                "0.1 I have three left",
                "1.0 I eat 5 apples",
                "1.0 I have none left"), texts);
        assertEquals(6, expansion.overlay().size());
    }

    @Test
    void testFragmentChoice() {
        assertEquals(OutlineExpander.INT_FRAGMENT, OutlineExpander.fragmentFor("42"));
        assertEquals(OutlineExpander.INT_FRAGMENT, OutlineExpander.fragmentFor("-7"));
        assertEquals(OutlineExpander.DECIMAL_FRAGMENT, OutlineExpander.fragmentFor("2.5"));
        assertEquals(OutlineExpander.DECIMAL_FRAGMENT, OutlineExpander.fragmentFor(".5"));
        assertEquals(OutlineExpander.ANY_FRAGMENT, OutlineExpander.fragmentFor("four"));
        assertEquals(OutlineExpander.ANY_FRAGMENT, OutlineExpander.fragmentFor(""));
    }

    @Test
    void testSynthesizedPatternQuotesLiterals() {
        String regex = OutlineExpander.synthesize("cost (<price>) is <unknown>", Map.of("price", "2.5"));
        assertEquals(Pattern.quote("cost (") + OutlineExpander.DECIMAL_FRAGMENT + Pattern.quote(") is <unknown>"), regex);
        assertTrue(Pattern.compile(regex).matcher("cost (2.5) is <unknown>").matches());
    }

    @Test
    void testDocStringAndTableSubstituted() {
        Scenario scenario = outline("""
                Feature:
                Scenario Outline:
                  * I have <name> left
                    ```
                    dear <name>
                    ```
                  * the price is <price>
                    | item   | price   |
                    | <name> | <price> |
                  Examples:
                    | name | price |
                    | bob  | 9.99  |
                """);
        OutlineExpander.Expansion expansion = OutlineExpander.expand(scenario.getSteps(), scenario.getExamples(), registry().matcher());
        assertEquals("dear bob", expansion.steps().get(0).step().getDocString());
        assertEquals(List.of("bob", "9.99"), expansion.steps().get(1).step().getTable().getRows().get(1));
        assertEquals("the price is 9.99", expansion.steps().get(1).step().getText());
    }

    @Test
    void testUnresolvedStepFailsAtExpansion() {
        Scenario scenario = outline("""
                Feature:
                Scenario Outline:
                  * I eat <count> apples
                  * I juggle <count> pears
                  Examples:
                    | count |
                    | 3     |
                """);
        StepResolutionException e = assertThrows(StepResolutionException.class,
                () -> OutlineExpander.expand(scenario.getSteps(), scenario.getExamples(), registry().matcher()));
        assertEquals("I juggle 3 pears", e.getStep().getText());
    }

    @Test
    void testPlaceholderOnlyStepKeepsResolvedDefinition() {
        Scenario scenario = outline("""
                Feature:
                Scenario Outline:
                  * <action>
                  Examples:
                    | action         |
                    | I eat 3 apples |
                """);
        StepRegistry registry = registry();
        OutlineExpander.Expansion expansion = OutlineExpander.expand(scenario.getSteps(), scenario.getExamples(), registry.matcher());
        ResolvedStep rs = expansion.steps().get(0);
        assertSame(registry.getDefinitions().get(0), rs.definition());
        assertEquals(List.of("3"), rs.definition().capture(rs.step().getText()));
    }

    @Test
    void testOverlayNeedsMatchingGroupCount() {
        Scenario scenario = outline("""
                Feature:
                Scenario Outline:
                  * I eat <first><second> apples
                  Examples:
                    | first | second |
                    | 1     | 2      |
                """);
        OutlineExpander.Expansion expansion = OutlineExpander.expand(scenario.getSteps(), scenario.getExamples(), registry().matcher());
        assertEquals("I eat 12 apples", expansion.steps().get(0).step().getText());
        assertTrue(expansion.overlay().isEmpty());
    }

}
