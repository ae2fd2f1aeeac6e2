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
package com.datastax.faultline.engine;

import java.util.function.Predicate;
import java.util.function.Supplier;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Uninterruptibles;

import com.datastax.faultline.exceptions.FaultEngineException;
import com.datastax.faultline.util.Duration;
import com.datastax.faultline.util.ScopedLogger;

/** Bounded exponential backoff for backend calls: attempt, and while the failure is retryable and
 *  attempts remain, wait <code>initialBackoff * multiplier^(attempt - 1)</code> (capped at
 *  <code>maxBackoff</code>) and try again. */
public class RetryPolicy
{
    private static final ScopedLogger logger = ScopedLogger.getLogger(RetryPolicy.class);

    public interface Sleeper
    {
        void sleep(java.time.Duration duration);
    }

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double multiplier;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier,
        Sleeper sleeper)
    {
        Preconditions.checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1");
        Preconditions.checkArgument(multiplier >= 1.0, "multiplier must be at least 1");
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.multiplier = multiplier;
        this.sleeper = sleeper;
    }

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier)
    {
        this(maxAttempts, initialBackoff, maxBackoff, multiplier, Uninterruptibles::sleepUninterruptibly);
    }

    public static RetryPolicy noRetries()
    {
        return new RetryPolicy(1, Duration.seconds(0), Duration.seconds(0), 1.0);
    }

    public int getMaxAttempts()
    {
        return maxAttempts;
    }

    /** How long to wait after failed attempt number <code>attempt</code> (counting from 1) */
    java.time.Duration backoff(int attempt)
    {
        final double nanos = initialBackoff.toNanos() * Math.pow(multiplier, attempt - 1);
        return java.time.Duration.ofNanos((long) Math.min(nanos, maxBackoff.toNanos()));
    }

    public <T> T call(String description, Supplier<T> operation, Predicate<FaultEngineException> retryable)
    {
        for (int attempt = 1; ; attempt++)
        {
            try
            {
                return operation.get();
            }
            catch (FaultEngineException e)
            {
                if (attempt >= maxAttempts || !retryable.test(e))
                {
                    throw e;
                }
                final var backoff = backoff(attempt);
                logger.warn("{} failed (attempt {} of {}), retrying in {}ms: {}", description, attempt,
                    maxAttempts, backoff.toMillis(), e.getMessage());
                sleeper.sleep(backoff);
            }
        }
    }
}
