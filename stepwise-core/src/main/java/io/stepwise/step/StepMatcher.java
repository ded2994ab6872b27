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

import io.stepwise.gherkin.Step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Finds the definition for a step text. Patterns are searched, not anchored.
 * The definition with the most non-overlapping matches wins and on a tie the
 * first registered one is kept.
 */
public class StepMatcher {

    private final List<StepDefinition> definitions;

    public StepMatcher(List<StepDefinition> definitions) {
        this.definitions = Collections.unmodifiableList(new ArrayList<>(definitions));
    }

    public Optional<StepDefinition> find(String text) {
        StepDefinition best = null;
        int found = 0;
        for (StepDefinition def : definitions) {
            int count = def.countMatches(text);
            if (count > found) {
                found = count;
                best = def;
            }
        }
        return Optional.ofNullable(best);
    }

    public StepDefinition resolve(Step step) {
        return find(step.getText()).orElseThrow(() -> new StepResolutionException(step));
    }

    public StepDefinition resolve(String text) {
        return find(text).orElseThrow(() -> new StepResolutionException(text));
    }

    /**
     * @return a matcher over these definitions followed by the overlay
     */
    public StepMatcher withOverlay(List<StepDefinition> overlay) {
        if (overlay.isEmpty()) {
            return this;
        }
        List<StepDefinition> list = new ArrayList<>(definitions.size() + overlay.size());
        list.addAll(definitions);
        list.addAll(overlay);
        return new StepMatcher(list);
    }

    public List<StepDefinition> getDefinitions() {
        return definitions;
    }

}
