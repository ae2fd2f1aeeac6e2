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
package com.datastax.faultline.lifecycle;

import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;

import com.datastax.faultline.util.ScopedLogger;

/** Serializes the conflict check and activation of faults whose scopes (the namespaces they touch)
 *  overlap.  Submissions with disjoint scopes never wait for each other. */
public class ScopeReservationLocks
{
    private static final ScopedLogger logger = ScopedLogger.getLogger(ScopeReservationLocks.class);

    private final Set<String> reservedScopes = new HashSet<>();

    public class Reservation implements AutoCloseable
    {
        private final Set<String> scope;
        private final long acquiredAtNanos = System.nanoTime();
        private Duration releasedAfter;

        private Reservation(Set<String> scope)
        {
            this.scope = scope;
        }

        /** Release the reservation and return how long it was held (for diagnostics); idempotent */
        public synchronized Duration release()
        {
            if (releasedAfter == null)
            {
                releaseScope(scope);
                releasedAfter = Duration.ofNanos(System.nanoTime() - acquiredAtNanos);
            }
            return releasedAfter;
        }

        @Override
        public void close()
        {
            final var held = release();
            logger.debug("Released {} after {}ms", scope, held.toMillis());
        }
    }

    /** Wait up to <code>timeout</code> for every namespace in <code>scope</code> to be free, then
     *  reserve them all at once.  Empty if they did not all become free in time. */
    public synchronized Optional<Reservation> acquire(Set<String> scope,
        com.datastax.faultline.util.Duration timeout)
    {
        final Set<String> required = Set.copyOf(scope);
        return logger.withScopedDebug("acquire({})  reserved: {}", required, reservedScopes).get(() -> {
            final long deadline = System.nanoTime() + timeout.toNanos();
            while (!Collections.disjoint(reservedScopes, required))
            {
                final long remaining = deadline - System.nanoTime();
                if (remaining <= 0)
                {
                    return Optional.empty();
                }
                try
                {
                    TimeUnit.NANOSECONDS.timedWait(this, remaining);
                }
                catch (InterruptedException e)
                {
                    Thread.currentThread().interrupt();
                    return Optional.empty();
                }
            }
            reservedScopes.addAll(required);
            return Optional.of(new Reservation(required));
        });
    }

    public synchronized boolean isReserved(String namespace)
    {
        return reservedScopes.contains(namespace);
    }

    private synchronized void releaseScope(Set<String> scope)
    {
        Preconditions.checkArgument(reservedScopes.containsAll(scope));
        reservedScopes.removeAll(scope);
        Verify.verify(reservedScopes.stream().noneMatch(scope::contains));
        notifyAll();
    }
}
