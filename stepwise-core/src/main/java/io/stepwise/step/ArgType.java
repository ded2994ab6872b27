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

import java.nio.charset.StandardCharsets;
import java.util.function.Function;

/**
 * A parameter kind a captured group can be converted into. The set is closed,
 * any declared type outside it falls back to {@link #BYTES}.
 */
public final class ArgType<T> {

    public enum Kind {
        STRING, INT, LONG, FLOAT, DOUBLE, BYTES
    }

    public static final ArgType<String> STRING = new ArgType<>(Kind.STRING, String.class, s -> s);
    public static final ArgType<Integer> INT = new ArgType<>(Kind.INT, Integer.class, Integer::valueOf);
    public static final ArgType<Long> LONG = new ArgType<>(Kind.LONG, Long.class, Long::valueOf);
    public static final ArgType<Float> FLOAT = new ArgType<>(Kind.FLOAT, Float.class, Float::valueOf);
    public static final ArgType<Double> DOUBLE = new ArgType<>(Kind.DOUBLE, Double.class, Double::valueOf);
    public static final ArgType<byte[]> BYTES = new ArgType<>(Kind.BYTES, byte[].class, s -> s.getBytes(StandardCharsets.UTF_8));

    private final Kind kind;
    private final Class<T> type;
    private final Function<String, T> converter;

    private ArgType(Kind kind, Class<T> type, Function<String, T> converter) {
        this.kind = kind;
        this.type = type;
        this.converter = converter;
    }

    public static ArgType<?> forClass(Class<?> clazz) {
        if (clazz == String.class) {
            return STRING;
        } else if (clazz == int.class || clazz == Integer.class) {
            return INT;
        } else if (clazz == long.class || clazz == Long.class) {
            return LONG;
        } else if (clazz == float.class || clazz == Float.class) {
            return FLOAT;
        } else if (clazz == double.class || clazz == Double.class) {
            return DOUBLE;
        }
        return BYTES;
    }

    public boolean isNumeric() {
        return kind != Kind.STRING && kind != Kind.BYTES;
    }

    /**
     * @throws NumberFormatException if a numeric kind cannot parse the text
     */
    public T convert(String raw) {
        return converter.apply(isNumeric() ? raw.trim() : raw);
    }

    public Kind getKind() {
        return kind;
    }

    public Class<T> getType() {
        return type;
    }

    @Override
    public String toString() {
        return kind.name();
    }

}
