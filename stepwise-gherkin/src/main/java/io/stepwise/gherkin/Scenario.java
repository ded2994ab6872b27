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
package io.stepwise.gherkin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A scenario or a scenario outline. Scenarios nested under a {@code Rule:} keep
 * the rule name and inherit the rule tags, background steps hold the feature
 * background followed by the rule background.
 */
public class Scenario {

    private final String featureUri;
    private final int index;
    private final int line;
    private final String keyword;
    private final String name;
    private final String description;
    private final List<Tag> tags;
    private final List<Tag> inheritedTags;
    private final List<Step> backgroundSteps;
    private final List<Step> steps;
    private final List<ExamplesTable> examples;
    private final String ruleName;

    private Scenario(Builder builder) {
        featureUri = builder.featureUri;
        index = builder.index;
        line = builder.line;
        keyword = builder.keyword;
        name = builder.name == null ? "" : builder.name;
        description = builder.description;
        tags = List.copyOf(builder.tags);
        inheritedTags = List.copyOf(builder.inheritedTags);
        backgroundSteps = List.copyOf(builder.backgroundSteps);
        steps = List.copyOf(builder.steps);
        examples = List.copyOf(builder.examples);
        ruleName = builder.ruleName;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isOutline() {
        return !examples.isEmpty();
    }

    /**
     * Feature tags, then rule tags, then the scenario's own tags, duplicates removed.
     */
    public Set<Tag> getTagsEffective() {
        Set<Tag> set = new LinkedHashSet<>(inheritedTags);
        set.addAll(tags);
        return Collections.unmodifiableSet(set);
    }

    public List<Step> getStepsIncludingBackground() {
        List<Step> temp = new ArrayList<>(backgroundSteps.size() + steps.size());
        temp.addAll(backgroundSteps);
        temp.addAll(steps);
        return temp;
    }

    public String getRefId() {
        return "[" + (index + 1) + ":" + line + "]";
    }

    public String getDebugInfo() {
        return featureUri + ":" + line;
    }

    public String getFeatureUri() {
        return featureUri;
    }

    public int getIndex() {
        return index;
    }

    public int getLine() {
        return line;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<Tag> getTags() {
        return tags;
    }

    public List<Tag> getInheritedTags() {
        return inheritedTags;
    }

    public List<Step> getBackgroundSteps() {
        return backgroundSteps;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public List<ExamplesTable> getExamples() {
        return examples;
    }

    public String getRuleName() {
        return ruleName;
    }

    @Override
    public String toString() {
        return getDebugInfo() + " " + name;
    }

    public static class Builder {

        private String featureUri = "";
        private int index;
        private int line;
        private String keyword = "Scenario";
        private String name;
        private String description;
        private final List<Tag> tags = new ArrayList<>();
        private final List<Tag> inheritedTags = new ArrayList<>();
        private final List<Step> backgroundSteps = new ArrayList<>();
        private final List<Step> steps = new ArrayList<>();
        private final List<ExamplesTable> examples = new ArrayList<>();
        private String ruleName;

        public Builder featureUri(String featureUri) {
            this.featureUri = featureUri;
            return this;
        }

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder line(int line) {
            this.line = line;
            return this;
        }

        public Builder keyword(String keyword) {
            this.keyword = keyword;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder tags(List<Tag> tags) {
            this.tags.addAll(tags);
            return this;
        }

        public Builder inheritedTags(List<Tag> tags) {
            this.inheritedTags.addAll(tags);
            return this;
        }

        public Builder backgroundSteps(List<Step> steps) {
            this.backgroundSteps.addAll(steps);
            return this;
        }

        public Builder step(Step step) {
            this.steps.add(step);
            return this;
        }

        public Builder steps(List<Step> steps) {
            this.steps.addAll(steps);
            return this;
        }

        public Builder examples(ExamplesTable table) {
            this.examples.add(table);
            return this;
        }

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Scenario build() {
            return new Scenario(this);
        }

    }

}
