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

import io.stepwise.gherkin.ExamplesTable;
import io.stepwise.gherkin.Step;
import io.stepwise.step.StepDefinition;
import io.stepwise.step.StepMatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns outline steps and their example tables into concrete resolved steps,
 * ordered table, then row, then step.
 * <p>
 * For every generated step a pattern is synthesized from the outline text:
 * literal text is quoted and each placeholder becomes a fragment chosen from
 * the cell value. The synthesized pattern is bound to the callable of the
 * definition the substituted text resolves to, and kept in a scenario-local
 * overlay that sits after the registry's definitions. An overlay entry is only
 * kept when its group count fits the callable's arguments. Nothing is added to
 * the registry itself.
 * <p>
 * Each resolved step runs with the definition its own substituted text
 * resolved to, never with an overlay pattern, whose groups may capture
 * differently.
 */
public class OutlineExpander {

    static final String INT_FRAGMENT = "(-?\\d+)";
    static final String DECIMAL_FRAGMENT = "([+-]?(?:\\d*\\.)?\\d+)";
    static final String ANY_FRAGMENT = "(.*)";

    private static final Pattern PLACEHOLDER = Pattern.compile("<([^<>]+)>");
    private static final Pattern INT_LITERAL = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL_LITERAL = Pattern.compile("[+-]?(\\d*\\.)?\\d+");

    private OutlineExpander() {
        // only static methods
    }

    public record Expansion(List<ResolvedStep> steps, List<StepDefinition> overlay) {

    }

    /**
     * @throws io.stepwise.step.StepResolutionException for the first generated step no definition matches
     */
    public static Expansion expand(List<Step> steps, List<ExamplesTable> examples, StepMatcher matcher) {
        List<ResolvedStep> resolved = new ArrayList<>();
        List<StepDefinition> overlay = new ArrayList<>();
        for (int t = 0; t < examples.size(); t++) {
            ExamplesTable table = examples.get(t);
            for (int r = 0; r < table.getRowCount(); r++) {
                Map<String, String> data = table.getExampleData(r);
                for (Step outlineStep : steps) {
                    Step concrete = substitute(outlineStep, data);
                    StepDefinition def = matcher.resolve(concrete);
                    Pattern synthesized = Pattern.compile(synthesize(outlineStep.getText(), data));
                    if (synthesized.matcher("").groupCount() == def.getArgTypes().size()) {
                        overlay.add(def.withPattern(synthesized, outlineStep.getText()));
                    }
                    resolved.add(new ResolvedStep(concrete, def, t, r, data));
                }
            }
        }
        return new Expansion(resolved, overlay);
    }

    static Step substitute(Step step, Map<String, String> data) {
        Step result = step;
        for (Map.Entry<String, String> entry : data.entrySet()) {
            result = result.replace("<" + entry.getKey() + ">", entry.getValue());
        }
        return result;
    }

    /**
     * Quoted literal segments with one capturing fragment per known placeholder.
     * A placeholder missing from the row stays literal text.
     */
    static String synthesize(String outlineText, Map<String, String> data) {
        StringBuilder sb = new StringBuilder();
        Matcher m = PLACEHOLDER.matcher(outlineText);
        int last = 0;
        while (m.find()) {
            String value = data.get(m.group(1));
            if (value == null) {
                continue;
            }
            appendQuoted(sb, outlineText.substring(last, m.start()));
            sb.append(fragmentFor(value));
            last = m.end();
        }
        appendQuoted(sb, outlineText.substring(last));
        return sb.toString();
    }

    static String fragmentFor(String value) {
        if (INT_LITERAL.matcher(value).matches()) {
            return INT_FRAGMENT;
        }
        if (DECIMAL_LITERAL.matcher(value).matches()) {
            return DECIMAL_FRAGMENT;
        }
        return ANY_FRAGMENT;
    }

    private static void appendQuoted(StringBuilder sb, String literal) {
        if (!literal.isEmpty()) {
            sb.append(Pattern.quote(literal));
        }
    }

}
