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

import io.stepwise.core.ScenarioContext;
import io.stepwise.log.LogContext;
import org.slf4j.Logger;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Holds every registered step definition in registration order.
 * <p>
 * Registration is a build phase: once {@link #freeze()} is called, which
 * {@link io.stepwise.core.Suite#run()} does, the registry and its templates
 * are read-only and further registration fails.
 * <pre>
 * StepRegistry steps = new StepRegistry()
 *     .step("I have {int} cucumbers", ArgType.INT, (ctx, n) -&gt; ctx.set("count", n))
 *     .step("I eat {int}", ArgType.INT, (ctx, n) -&gt; ...);
 * </pre>
 */
public class StepRegistry {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final ParameterTemplates templates;
    private final List<StepDefinition> definitions = new ArrayList<>();
    private volatile boolean frozen;

    public StepRegistry() {
        this(new ParameterTemplates());
    }

    public StepRegistry(ParameterTemplates templates) {
        this.templates = templates;
    }

    public StepRegistry parameterTemplate(String token, String... fragments) {
        checkNotFrozen(token);
        templates.register(token, fragments);
        return this;
    }

    public StepRegistry step(String pattern, StepFunction0 fn) {
        return step(pattern, List.of(), (ctx, args) -> fn.apply(ctx));
    }

    @SuppressWarnings("unchecked")
    public <A> StepRegistry step(String pattern, ArgType<A> a, StepFunction1<A> fn) {
        return step(pattern, List.<ArgType<?>>of(a), (ctx, args) -> fn.apply(ctx, (A) args[0]));
    }

    @SuppressWarnings("unchecked")
    public <A, B> StepRegistry step(String pattern, ArgType<A> a, ArgType<B> b, StepFunction2<A, B> fn) {
        return step(pattern, List.<ArgType<?>>of(a, b), (ctx, args) -> fn.apply(ctx, (A) args[0], (B) args[1]));
    }

    @SuppressWarnings("unchecked")
    public <A, B, C> StepRegistry step(String pattern, ArgType<A> a, ArgType<B> b, ArgType<C> c, StepFunction3<A, B, C> fn) {
        return step(pattern, List.<ArgType<?>>of(a, b, c), (ctx, args) -> fn.apply(ctx, (A) args[0], (B) args[1], (C) args[2]));
    }

    /**
     * Expands parameter templates and registers one definition per variant.
     *
     * @throws StepConfigException if a variant does not compile
     */
    public StepRegistry step(String pattern, List<ArgType<?>> argTypes, StepFunction fn) {
        checkNotFrozen(pattern);
        if (pattern == null || fn == null) {
            throw new StepConfigException("pattern and step function are required: " + pattern);
        }
        List<StepDefinition> compiled = new ArrayList<>();
        for (String variant : templates.expand(pattern)) {
            Pattern regex;
            try {
                regex = Pattern.compile(variant);
            } catch (PatternSyntaxException e) {
                throw new StepConfigException("step pattern '" + pattern + "' does not compile: " + e.getDescription(), e);
            }
            compiled.add(new StepDefinition(regex, fn, argTypes, pattern));
        }
        add(compiled);
        return this;
    }

    public StepRegistry step(Pattern pattern, StepFunction0 fn) {
        return step(pattern, List.of(), (ctx, args) -> fn.apply(ctx));
    }

    @SuppressWarnings("unchecked")
    public <A> StepRegistry step(Pattern pattern, ArgType<A> a, StepFunction1<A> fn) {
        return step(pattern, List.<ArgType<?>>of(a), (ctx, args) -> fn.apply(ctx, (A) args[0]));
    }

    @SuppressWarnings("unchecked")
    public <A, B> StepRegistry step(Pattern pattern, ArgType<A> a, ArgType<B> b, StepFunction2<A, B> fn) {
        return step(pattern, List.<ArgType<?>>of(a, b), (ctx, args) -> fn.apply(ctx, (A) args[0], (B) args[1]));
    }

    /**
     * Registers a precompiled pattern as-is, templates are not applied.
     */
    public StepRegistry step(Pattern pattern, List<ArgType<?>> argTypes, StepFunction fn) {
        String source = pattern == null ? null : pattern.pattern();
        checkNotFrozen(source);
        if (pattern == null || fn == null) {
            throw new StepConfigException("pattern and step function are required: " + source);
        }
        add(List.of(new StepDefinition(pattern, fn, argTypes, source)));
        return this;
    }

    /**
     * Registers every method annotated with {@link StepDef}, methods taken in name order.
     * The first parameter must be the scenario context, the others are coerced
     * with {@link ArgType#forClass(Class)}.
     *
     * @throws StepConfigException naming the pattern and the reason when a method is not usable
     */
    public StepRegistry register(Object steps) {
        if (steps == null) {
            throw new StepConfigException("step object must not be null");
        }
        Class<?> clazz = steps.getClass();
        List<Method> methods = new ArrayList<>();
        for (Method method : clazz.getDeclaredMethods()) {
            if (method.isAnnotationPresent(StepDef.class)) {
                methods.add(method);
            }
        }
        methods.sort(Comparator.comparing(Method::getName));
        if (methods.isEmpty()) {
            logger.warn("no @StepDef methods found on: {}", clazz.getName());
        }
        for (Method method : methods) {
            for (String pattern : method.getAnnotation(StepDef.class).value()) {
                List<ArgType<?>> argTypes = toArgTypes(pattern, method);
                step(pattern, argTypes, toFunction(pattern, steps, method));
            }
        }
        return this;
    }

    private static List<ArgType<?>> toArgTypes(String pattern, Method method) {
        Class<?>[] params = method.getParameterTypes();
        if (params.length == 0 || params[0] != ScenarioContext.class) {
            throw new StepConfigException("step '" + pattern + "': method " + method.getName()
                    + " must take " + ScenarioContext.class.getSimpleName() + " as its first parameter");
        }
        if (method.getReturnType() != void.class) {
            logger.debug("step '{}': return value of {} is ignored", pattern, method.getName());
        }
        List<ArgType<?>> argTypes = new ArrayList<>(params.length - 1);
        for (Class<?> param : Arrays.asList(params).subList(1, params.length)) {
            ArgType<?> type = ArgType.forClass(param);
            if (type == ArgType.BYTES && !param.isAssignableFrom(byte[].class)) {
                throw new StepConfigException("step '" + pattern + "': parameter type " + param.getName()
                        + " of method " + method.getName() + " cannot take a converted argument");
            }
            argTypes.add(type);
        }
        return argTypes;
    }

    private static StepFunction toFunction(String pattern, Object target, Method method) {
        try {
            method.setAccessible(true);
        } catch (RuntimeException e) {
            throw new StepConfigException("step '" + pattern + "': method " + method.getName() + " is not accessible", e);
        }
        Object instance = Modifier.isStatic(method.getModifiers()) ? null : target;
        return (ctx, args) -> {
            Object[] full = new Object[args.length + 1];
            full[0] = ctx;
            System.arraycopy(args, 0, full, 1, args.length);
            try {
                method.invoke(instance, full);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception ex) {
                    throw ex;
                }
                if (cause instanceof Error err) {
                    throw err;
                }
                throw e;
            }
        };
    }

    private synchronized void add(List<StepDefinition> compiled) {
        definitions.addAll(compiled);
        if (logger.isTraceEnabled()) {
            for (StepDefinition def : compiled) {
                logger.trace("registered step: {}", def);
            }
        }
    }

    private void checkNotFrozen(String what) {
        if (frozen) {
            throw new IllegalStateException("step registry is frozen, cannot register: " + what);
        }
    }

    public void freeze() {
        if (!frozen) {
            frozen = true;
            templates.freeze();
            logger.debug("step registry frozen with {} definition(s)", definitions.size());
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    public ParameterTemplates getTemplates() {
        return templates;
    }

    public List<StepDefinition> getDefinitions() {
        return Collections.unmodifiableList(definitions);
    }

    public StepMatcher matcher() {
        return new StepMatcher(definitions);
    }

}
