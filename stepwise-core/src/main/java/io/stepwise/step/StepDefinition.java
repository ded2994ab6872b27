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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A compiled pattern bound to a callable and the kinds of its arguments.
 */
public final class StepDefinition {

    private final Pattern pattern;
    private final StepFunction function;
    private final List<ArgType<?>> argTypes;
    private final String source;

    public StepDefinition(Pattern pattern, StepFunction function, List<ArgType<?>> argTypes, String source) {
        this.pattern = pattern;
        this.function = function;
        this.argTypes = List.copyOf(argTypes);
        this.source = source;
    }

    /**
     * Same callable and argument kinds, different pattern.
     */
    public StepDefinition withPattern(Pattern other, String source) {
        return new StepDefinition(other, function, argTypes, source);
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }

    /**
     * @return the number of non-overlapping matches of the pattern in the text,
     * an empty match right after the previous match is not counted
     */
    public int countMatches(String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        int previousEnd = -1;
        while (matcher.find()) {
            boolean abutting = matcher.start() == matcher.end() && matcher.start() == previousEnd;
            previousEnd = matcher.end();
            if (!abutting) {
                count++;
            }
        }
        return count;
    }

    /**
     * Groups of the first match, an unmatched group is null.
     */
    public List<String> capture(String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            throw new StepResolutionException(text);
        }
        List<String> groups = new ArrayList<>(matcher.groupCount());
        for (int i = 1; i <= matcher.groupCount(); i++) {
            groups.add(matcher.group(i));
        }
        return groups;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public StepFunction getFunction() {
        return function;
    }

    public List<ArgType<?>> getArgTypes() {
        return argTypes;
    }

    /**
     * @return what was registered, the pattern text before template expansion or the method name
     */
    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return pattern.pattern();
    }

}
