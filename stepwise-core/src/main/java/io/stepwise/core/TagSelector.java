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
import io.stepwise.gherkin.Tag;

import java.util.Collection;
import java.util.Set;

/**
 * Tag based inclusion and exclusion. Tags are compared by exact text. An
 * excluded tag always wins, a non-empty include set requires at least one hit.
 */
public class TagSelector {

    private final Set<String> include;
    private final Set<String> exclude;

    public TagSelector(Set<String> include, Set<String> exclude) {
        this.include = Set.copyOf(include);
        this.exclude = Set.copyOf(exclude);
    }

    public boolean isFeatureExcluded(Feature feature) {
        return anyIn(feature.getTags(), exclude);
    }

    public boolean evaluate(Collection<Tag> tags) {
        if (anyIn(tags, exclude)) {
            return false;
        }
        return include.isEmpty() || anyIn(tags, include);
    }

    private static boolean anyIn(Collection<Tag> tags, Set<String> names) {
        if (names.isEmpty()) {
            return false;
        }
        for (Tag tag : tags) {
            if (names.contains(tag.getName())) {
                return true;
            }
        }
        return false;
    }

}
