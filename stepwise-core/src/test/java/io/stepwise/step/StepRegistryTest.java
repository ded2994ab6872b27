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
package io.stepwise.step;

import io.stepwise.core.ScenarioContext;
import io.stepwise.core.ScenarioResult;
import io.stepwise.core.TestUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class StepRegistryTest {

    @Test
    void testTemplateStepResolvesTypedArgument() {
        AtomicReference<Integer> captured = new AtomicReference<>();
        StepRegistry registry = new StepRegistry()
                .step("I have {int} cucumbers", ArgType.INT, (ctx, n) -> captured.set(n));
        ScenarioResult sr = TestUtils.run(registry, "* I have 42 cucumbers");
        TestUtils.assertPassed(sr);
        assertEquals(42, captured.get());
    }

    @Test
    void testOneDefinitionPerVariant() {
        StepRegistry registry = new StepRegistry()
                .step("I say {text}", ArgType.STRING, (ctx, s) -> {
                })
                .step("I count {int}", ArgType.INT, (ctx, n) -> {
                });
        List<StepDefinition> defs = registry.getDefinitions();
        assertEquals(3, defs.size());
        assertEquals("I say {text}", defs.get(0).getSource());
        assertEquals("I say {text}", defs.get(1).getSource());
        assertEquals("I count {int}", defs.get(2).getSource());
    }

    @Test
    void testTwoAndThreeArguments() {
        List<Object> seen = new ArrayList<>();
        StepRegistry registry = new StepRegistry()
                .step("{word} weighs {float} kg", ArgType.STRING, ArgType.DOUBLE, (ctx, w, kg) -> {
                    seen.add(w);
                    seen.add(kg);
                })
                .step(Pattern.compile("^move (\\d+) from (\\w+) to (\\w+)$"), List.of(ArgType.LONG, ArgType.STRING, ArgType.STRING),
                        (ctx, args) -> seen.addAll(List.of(args)));
        ScenarioResult sr = TestUtils.run(registry, """
                * box weighs 2.5 kg
                * move 3 from left to right
                """);
        TestUtils.assertPassed(sr);
        assertEquals(List.of("box", 2.5, 3L, "left", "right"), seen);
    }

    @Test
    void testPatternThatDoesNotCompile() {
        StepRegistry registry = new StepRegistry();
        StepConfigException e = assertThrows(StepConfigException.class,
                () -> registry.step("I have {unknown} things", ctx -> {
                }));
        assertTrue(e.getMessage().contains("I have {unknown} things"));
        assertTrue(registry.getDefinitions().isEmpty());
    }

    @Test
    void testFrozenRegistry() {
        StepRegistry registry = new StepRegistry().step("a", ctx -> {
        });
        registry.freeze();
        assertTrue(registry.isFrozen());
        assertTrue(registry.getTemplates().isFrozen());
        assertThrows(IllegalStateException.class, () -> registry.step("b", ctx -> {
        }));
        assertThrows(IllegalStateException.class, () -> registry.parameterTemplate("{x}", "(x)"));
        assertThrows(IllegalStateException.class, () -> registry.register(new CartSteps()));
        assertEquals(1, registry.getDefinitions().size());
    }

    @Test
    void testCustomTemplate() {
        AtomicReference<String> color = new AtomicReference<>();
        StepRegistry registry = new StepRegistry()
                .parameterTemplate("{color}", "(red|green|blue)")
                .step("paint it {color}", ArgType.STRING, (ctx, c) -> color.set(c));
        TestUtils.assertPassed(TestUtils.run(registry, "* paint it green"));
        assertEquals("green", color.get());
    }

    static class CartSteps {

        @StepDef("I add {int} items")
        public void add(ScenarioContext ctx, int count) {
            ctx.set("items", ctx.get("items", 0) + count);
        }

        @StepDef({"the cart holds {int} items", "the cart has {int} items"})
        public void check(ScenarioContext ctx, Integer expected) {
            assertEquals(expected, ctx.<Integer>get("items"));
        }

        @StepDef("the label is {text}")
        void label(ScenarioContext ctx, String label, Object ignored) {
            // one group captured, two arguments declared
        }

    }

    static class AnnotatedSteps {

        final List<String> calls = new ArrayList<>();

        @StepDef("I add {int} items")
        void add(ScenarioContext ctx, int count) {
            calls.add("add " + count);
        }

        @StepDef({"the cart holds {int} items", "the cart has {int} items"})
        void check(ScenarioContext ctx, Integer expected) {
            calls.add("check " + expected);
        }

        @StepDef("the note reads (.*)")
        void note(ScenarioContext ctx, byte[] raw) {
            calls.add("note " + new String(raw));
        }

        @StepDef("it blows up")
        void boom(ScenarioContext ctx) throws Exception {
            throw new Exception("blown");
        }

    }

    @Test
    void testAnnotatedMethods() {
        AnnotatedSteps steps = new AnnotatedSteps();
        StepRegistry registry = new StepRegistry().register(steps);
        assertEquals(5, registry.getDefinitions().size());
        ScenarioResult sr = TestUtils.run(registry, """
                * I add 2 items
                * the cart has 2 items
                * the cart holds 2 items
                * the note reads hello
                """);
        TestUtils.assertPassed(sr);
        assertEquals(List.of("add 2", "check 2", "check 2", "note hello"), steps.calls);
    }

    @Test
    void testAnnotatedExceptionFailsStep() {
        StepRegistry registry = new StepRegistry().register(new AnnotatedSteps());
        ScenarioResult sr = TestUtils.run(registry, "* it blows up");
        TestUtils.assertFailedWith(sr, "blown");
        assertEquals(Exception.class, sr.getError().getClass());
    }

    @Test
    void testAnnotatedArity() {
        StepRegistry registry = new StepRegistry().register(new CartSteps());
        ScenarioResult sr = TestUtils.run(registry, "* the label is 'sale'");
        assertTrue(sr.isFailed());
        assertInstanceOf(StepArgumentException.class, sr.getError());
    }

    static class MissingContext {

        @StepDef("no context {int}")
        void bad(int n) {
        }

    }

    static class UnsupportedType {

        @StepDef("a map {word}")
        void bad(ScenarioContext ctx, Map<String, Object> map) {
        }

    }

    @Test
    void testAnnotatedValidation() {
        StepConfigException e = assertThrows(StepConfigException.class, () -> new StepRegistry().register(new MissingContext()));
        assertTrue(e.getMessage().contains("no context {int}"));
        assertTrue(e.getMessage().contains("ScenarioContext"));
        e = assertThrows(StepConfigException.class, () -> new StepRegistry().register(new UnsupportedType()));
        assertTrue(e.getMessage().contains("a map {word}"));
        assertThrows(StepConfigException.class, () -> new StepRegistry().register(null));
    }

}
