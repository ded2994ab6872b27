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

import io.stepwise.log.LogContext;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Placeholder tokens such as {@code {int}} mapped to the regex fragments they
 * expand to. Each fragment yields its own pattern variant. When a pattern holds
 * several distinct tokens the variants are the cross product, tokens taken in
 * registration order.
 */
public class ParameterTemplates {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public static final String INT = "{int}";
    public static final String FLOAT = "{float}";
    public static final String WORD = "{word}";
    public static final String TEXT = "{text}";

    private final Map<String, List<String>> templates = new LinkedHashMap<>();
    private volatile boolean frozen;

    public ParameterTemplates() {
        register(INT, "(-?\\d+)");
        register(FLOAT, "([-+]?\\d*\\.?\\d+)");
        register(WORD, "([\\d\\w]+)");
        register(TEXT, "\"([\\d\\w\\-\\s]+)\"", "'([\\d\\w\\-\\s]+)'");
    }

    /**
     * Adds fragments for a token. Fragments for an existing token are appended.
     *
     * @throws StepConfigException if a fragment is not a valid regex
     * @throws IllegalStateException once frozen
     */
    public ParameterTemplates register(String token, String... fragments) {
        if (frozen) {
            throw new IllegalStateException("parameter templates are frozen, cannot register: " + token);
        }
        if (token == null || token.isEmpty()) {
            throw new StepConfigException("parameter template token must not be empty");
        }
        if (fragments == null || fragments.length == 0) {
            throw new StepConfigException("no fragments given for parameter template: " + token);
        }
        for (String fragment : fragments) {
            try {
                Pattern.compile(fragment);
            } catch (PatternSyntaxException e) {
                throw new StepConfigException("invalid regex fragment for " + token + ": " + e.getMessage(), e);
            }
        }
        List<String> list = templates.computeIfAbsent(token, k -> new ArrayList<>());
        Collections.addAll(list, fragments);
        logger.trace("parameter template {} -> {}", token, list);
        return this;
    }

    public List<String> expand(String pattern) {
        List<String> variants = List.of(pattern);
        for (Map.Entry<String, List<String>> entry : templates.entrySet()) {
            String token = entry.getKey();
            if (!pattern.contains(token)) {
                continue;
            }
            List<String> next = new ArrayList<>(variants.size() * entry.getValue().size());
            for (String variant : variants) {
                for (String fragment : entry.getValue()) {
                    next.add(variant.replace(token, fragment));
                }
            }
            variants = next;
        }
        return variants;
    }

    public List<String> getFragments(String token) {
        List<String> list = templates.get(token);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

}
