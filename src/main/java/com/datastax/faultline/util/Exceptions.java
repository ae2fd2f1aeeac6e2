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

import java.io.IOException;
import java.io.UncheckedIOException;

public class Exceptions
{
    private Exceptions()
    {
    }

    public interface IOExceptionThrowingSupplier<T>
    {
        T get() throws IOException;
    }

    /** Return the result of checked.get(), wrapping any IOException thrown with an UncheckedIOException */
    public static <T> T getUncheckedIO(IOExceptionThrowingSupplier<T> checked)
    {
        try
        {
            return checked.get();
        }
        catch (IOException e)
        {
            throw new UncheckedIOException(e);
        }
    }

    public interface IOExceptionThrowingRunnable
    {
        void run() throws IOException;
    }

    /** Run checked.run(), wrapping any IOException thrown with an UncheckedIOException */
    public static void runUncheckedIO(IOExceptionThrowingRunnable checked)
    {
        try
        {
            checked.run();
        }
        catch (IOException e)
        {
            throw new UncheckedIOException(e);
        }
    }

    /** The innermost message in a cause chain, which for wrapped transport errors is usually the useful one */
    public static String rootMessage(Throwable throwable)
    {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current)
        {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }
}
