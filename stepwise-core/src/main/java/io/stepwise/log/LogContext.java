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
package io.stepwise.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-local log collector for scenario execution. Lines a step writes
 * through its context are buffered here, collected into the step result
 * when the step ends, and cascaded to the "stepwise.scenario" category.
 */
public class LogContext {

    private static final ThreadLocal<LogContext> CURRENT = new ThreadLocal<>();

    /** Suite, feature and scenario lifecycle, failures */
    public static final Logger RUNTIME_LOGGER = LoggerFactory.getLogger("stepwise.runtime");

    /** Lines written by step code */
    public static final Logger SCENARIO_LOGGER = LoggerFactory.getLogger("stepwise.scenario");

    private static final String ROOT_CATEGORY = "stepwise";

    private static volatile LogLevel threshold = LogLevel.INFO;

    private final StringBuilder buffer = new StringBuilder();

    public static LogContext get() {
        LogContext ctx = CURRENT.get();
        if (ctx == null) {
            ctx = new LogContext();
            CURRENT.set(ctx);
        }
        return ctx;
    }

    public static void set(LogContext ctx) {
        CURRENT.set(ctx);
    }

    public static void clear() {
        CURRENT.remove();
    }

    public static LogWriter with(Logger logger) {
        return new LogWriter(logger);
    }

    /**
     * Minimum level captured into step logs. Does not affect SLF4J output.
     */
    public static void setLogLevel(LogLevel level) {
        threshold = level;
    }

    public static LogLevel getLogLevel() {
        return threshold;
    }

    /**
     * Sets the Logback level of the "stepwise" logger and so every category below it.
     * Reflection keeps Logback a runtime-only dependency.
     *
     * @return false if the level is empty or Logback is not the SLF4J backend
     */
    public static boolean setRuntimeLogLevel(String level) {
        if (level == null || level.isEmpty()) {
            return false;
        }
        try {
            Object factory = LoggerFactory.getILoggerFactory();
            if (!factory.getClass().getName().equals("ch.qos.logback.classic.LoggerContext")) {
                RUNTIME_LOGGER.debug("runtime log level not supported, backend is {}", factory.getClass().getName());
                return false;
            }
            Object logger = factory.getClass()
                    .getMethod("getLogger", String.class)
                    .invoke(factory, ROOT_CATEGORY);
            Class<?> levelClass = Class.forName("ch.qos.logback.classic.Level");
            Object levelValue = levelClass
                    .getMethod("toLevel", String.class)
                    .invoke(null, level.toUpperCase());
            logger.getClass()
                    .getMethod("setLevel", levelClass)
                    .invoke(logger, levelValue);
            RUNTIME_LOGGER.debug("runtime log level set to: {}", level);
            return true;
        } catch (ReflectiveOperationException e) {
            RUNTIME_LOGGER.warn("failed to set runtime log level: {}", e.getMessage());
            return false;
        }
    }

    public void log(LogLevel level, String message) {
        if (level.isEnabled(threshold)) {
            buffer.append(message).append('\n');
        }
    }

    public void log(LogLevel level, String format, Object... args) {
        if (level.isEnabled(threshold)) {
            buffer.append(format(format, args)).append('\n');
        }
    }

    public void log(String format, Object... args) {
        log(LogLevel.INFO, format, args);
    }

    /**
     * @return the buffered text, the buffer is cleared
     */
    public String collect() {
        String result = buffer.toString();
        buffer.setLength(0);
        return result;
    }

    public String peek() {
        return buffer.toString();
    }

    static String format(String format, Object... args) {
        if (args == null || args.length == 0) {
            return format;
        }
        StringBuilder sb = new StringBuilder();
        int argIndex = 0;
        int i = 0;
        while (i < format.length()) {
            if (i < format.length() - 1 && format.charAt(i) == '{' && format.charAt(i + 1) == '}') {
                sb.append(argIndex < args.length ? args[argIndex++] : "{}");
                i += 2;
            } else {
                sb.append(format.charAt(i));
                i++;
            }
        }
        return sb.toString();
    }

    /**
     * Writes to the current thread's buffer and to the wrapped SLF4J logger.
     */
    public static class LogWriter {

        private final Logger logger;

        LogWriter(Logger logger) {
            this.logger = logger;
        }

        public void log(LogLevel level, String format, Object... args) {
            String message = format(format, args);
            get().log(level, message);
            switch (level) {
                case TRACE -> logger.trace(message);
                case DEBUG -> logger.debug(message);
                case INFO -> logger.info(message);
                case WARN -> logger.warn(message);
                case ERROR -> logger.error(message);
            }
        }

        public void debug(String format, Object... args) {
            log(LogLevel.DEBUG, format, args);
        }

        public void info(String format, Object... args) {
            log(LogLevel.INFO, format, args);
        }

        public void warn(String format, Object... args) {
            log(LogLevel.WARN, format, args);
        }

        public void error(String format, Object... args) {
            log(LogLevel.ERROR, format, args);
        }

    }

}
