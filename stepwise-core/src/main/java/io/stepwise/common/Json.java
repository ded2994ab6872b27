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
package io.stepwise.common;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thin wrapper over a json-path document, used for configuration files and
 * for rendering result maps.
 */
public class Json {

    private final DocumentContext doc;
    private final boolean array;
    private final String prefix;

    private Json(DocumentContext doc) {
        this.doc = doc;
        array = doc.json() instanceof List;
        prefix = array ? "$" : "$.";
    }

    public static Json of(Object any) {
        if (any == null) {
            throw new IllegalArgumentException("input must not be null");
        }
        if (any instanceof String s) {
            if (s.isBlank()) {
                throw new IllegalArgumentException("input string must not be empty or blank");
            }
            return new Json(JsonPath.parse(parseLenient(s)));
        } else if (any instanceof List || any instanceof Map) {
            return new Json(JsonPath.parse(any));
        } else {
            return new Json(JsonPath.parse(JSONValue.toJSONString(any)));
        }
    }

    public static Object parseLenient(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("invalid json: input is null or blank");
        }
        Object result;
        try {
            result = JSONValue.parseKeepingOrder(json);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("invalid json: " + e.getMessage(), e);
        }
        if (!(result instanceof Map || result instanceof List)) {
            throw new IllegalArgumentException("invalid json: not a JSON object or array");
        }
        return result;
    }

    /**
     * @return compact JSON text for maps, lists and scalars
     */
    public static String toJson(Object value) {
        return JSONValue.toJSONString(value, JSONStyle.NO_COMPRESS);
    }

    private String prefix(String path) {
        return path.charAt(0) == '$' ? path : prefix + path;
    }

    public <T> T get(String path) {
        return doc.read(prefix(path));
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String path, T defaultValue) {
        return (T) getOptional(path).orElse(defaultValue);
    }

    public <T> Optional<T> getOptional(String path) {
        try {
            return Optional.ofNullable(get(path));
        } catch (PathNotFoundException e) {
            return Optional.empty();
        }
    }

    public boolean pathExists(String path) {
        return getOptional(path).isPresent();
    }

    public boolean isArray() {
        return array;
    }

    public Map<String, Object> asMap() {
        return doc.read("$");
    }

    @Override
    public String toString() {
        return doc.jsonString();
    }

}
