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

import java.util.List;

public class Feature {

    private final String uri;
    private final int line;
    private final String name;
    private final String description;
    private final List<Tag> tags;
    private final Background background;
    private final List<Scenario> scenarios;

    public Feature(String uri, int line, String name, String description, List<Tag> tags,
                   Background background, List<Scenario> scenarios) {
        this.uri = uri;
        this.line = line;
        this.name = name == null ? "" : name;
        this.description = description;
        this.tags = List.copyOf(tags);
        this.background = background;
        this.scenarios = List.copyOf(scenarios);
    }

    public boolean isBackgroundPresent() {
        return background != null && !background.getSteps().isEmpty();
    }

    public String getUri() {
        return uri;
    }

    public int getLine() {
        return line;
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

    public Background getBackground() {
        return background;
    }

    public List<Scenario> getScenarios() {
        return scenarios;
    }

    public String getNameForReport() {
        return name.isEmpty() ? uri : name;
    }

    @Override
    public String toString() {
        return uri;
    }

}
