/*
 * Copyright 2021 DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.datastax.faultline.util;

import java.util.Optional;
import java.util.function.BooleanSupplier;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs a message on entry to and exit from a block of work (a submit, a revert, a reconciliation pass)
 *  and indents everything logged through this class on the same thread until the block ends.
 *  Nested blocks accumulate indentation, so a submit that retries an apply reads as a tree in the log. */
public class ScopedLogger
{
    private final Logger logger;
    private static final ThreadLocal<Integer> indent = ThreadLocal.withInitial(() -> 0);
    private static final int INDENT_INCREMENT = 2;

    private interface LogMethod
    {
        void log(String msg, Object... args);
    }

    private ScopedLogger(Logger logger)
    {
        this.logger = logger;
    }

    public static ScopedLogger getLogger(Class<?> clazz)
    {
        return new ScopedLogger(LoggerFactory.getLogger(clazz));
    }

    public static ScopedLogger getLogger(String name)
    {
        return new ScopedLogger(LoggerFactory.getLogger(name));
    }

    @VisibleForTesting
    static ScopedLogger getLogger(Logger logger)
    {
        return new ScopedLogger(logger);
    }

    public Logger delegate()
    {
        return logger;
    }

    private static String indent()
    {
        return Strings.repeat(" ", indent.get());
    }

    private class Scoped implements AutoCloseable
    {
        private final LogMethod logMethod;
        private final BooleanSupplier logEnabled;
        private final String msg;
        private final Object[] args;
        private Optional<Object> result = Optional.empty();
        private boolean expectResult = false;

        private Scoped(LogMethod logMethod, BooleanSupplier logEnabled, String msg, Object[] args)
        {
            this.logMethod = logMethod;
            this.logEnabled = logEnabled;
            this.msg = msg;
            this.args = args;
            if (logEnabled.getAsBoolean())
            {
                logMethod.log(indent() + msg + "...", args);
                indent.set(indent.get() + INDENT_INCREMENT);
            }
        }

        @Override
        public void close()
        {
            if (logEnabled.getAsBoolean())
            {
                indent.set(Math.max(0, indent.get() - INDENT_INCREMENT));
                final var doneMsg = indent() + msg + "...done" + (result.isEmpty() ? " (exception thrown)" : "");
                final var resultMsg = result
                    .filter(ignored -> expectResult)
                    .map(r -> " -> [" + r + "]")
                    .orElse("");
                logMethod.log(doneMsg + resultMsg, args);
            }
        }
    }

    public interface ThrowingSupplier<T, E extends Throwable>
    {
        T get() throws E;
    }

    public interface ThrowingRunnable<E extends Throwable>
    {
        void run() throws E;
    }

    public static class ScopedInvocation
    {
        private final Scoped scoped;

        private ScopedInvocation(Scoped scoped)
        {
            this.scoped = scoped;
        }

        public <E extends Throwable> void run(ThrowingRunnable<E> runnable) throws E
        {
            try (var scoped_ = scoped)
            {
                runnable.run();
                scoped.result = Optional.of(true);
            }
        }

        public <T, E extends Throwable> T get(ThrowingSupplier<T, E> supplier) throws E
        {
            try (var scoped_ = scoped)
            {
                scoped.expectResult = true;
                final T result = supplier.get();
                scoped.result = Optional.of(result == null ? "<null>" : result);
                return result;
            }
        }
    }

    public ScopedInvocation withScopedInfo(String msg, Object... args)
    {
        return new ScopedInvocation(new Scoped(logger::info, logger::isInfoEnabled, msg, args));
    }

    public ScopedInvocation withScopedDebug(String msg, Object... args)
    {
        return new ScopedInvocation(new Scoped(logger::debug, logger::isDebugEnabled, msg, args));
    }

    public void trace(String msg, Object... args)
    {
        if (logger.isTraceEnabled())
        {
            logger.trace(indent() + msg, args);
        }
    }

    public void debug(String msg, Object... args)
    {
        if (logger.isDebugEnabled())
        {
            logger.debug(indent() + msg, args);
        }
    }

    public void info(String msg, Object... args)
    {
        if (logger.isInfoEnabled())
        {
            logger.info(indent() + msg, args);
        }
    }

    public void warn(String msg, Object... args)
    {
        if (logger.isWarnEnabled())
        {
            logger.warn(indent() + msg, args);
        }
    }

    public void error(String msg, Object... args)
    {
        if (logger.isErrorEnabled())
        {
            logger.error(indent() + msg, args);
        }
    }
}
