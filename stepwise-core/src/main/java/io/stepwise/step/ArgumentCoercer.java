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

import java.util.List;

public class ArgumentCoercer {

    private ArgumentCoercer() {
        // only static methods
    }

    /**
     * Converts captured groups into the declared argument kinds. The callable
     * also takes the context, so its declared arity is one more than the number
     * of argument kinds.
     *
     * @throws StepArgumentException on an arity mismatch or a value the kind cannot parse
     */
    public static Object[] coerce(List<String> groups, List<ArgType<?>> argTypes) {
        int declaredArity = argTypes.size() + 1;
        if (groups.size() + 1 != declaredArity) {
            throw new StepArgumentException("step function takes " + declaredArity
                    + " parameter(s) including the context, but the pattern captured " + groups.size() + " group(s)");
        }
        Object[] args = new Object[groups.size()];
        for (int i = 0; i < args.length; i++) {
            ArgType<?> type = argTypes.get(i);
            String value = groups.get(i);
            if (value == null) {
                if (type.isNumeric()) {
                    throw new StepArgumentException("argument " + (i + 1) + " is unmatched, cannot convert to " + type);
                }
                continue;
            }
            try {
                args[i] = type.convert(value);
            } catch (NumberFormatException e) {
                throw new StepArgumentException("argument " + (i + 1) + " value '" + value + "' is not a valid " + type, e);
            }
        }
        return args;
    }

}
