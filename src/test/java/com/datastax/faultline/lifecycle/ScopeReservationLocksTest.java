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

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.datastax.faultline.util.Duration;

import static org.assertj.core.api.Assertions.assertThat;

public class ScopeReservationLocksTest
{
    private final ScopeReservationLocks locks = new ScopeReservationLocks();

    @Test
    public void disjoint_scopes_are_reserved_independently()
    {
        final var shop = locks.acquire(Set.of("shop"), Duration.milliseconds(10));
        final var billing = locks.acquire(Set.of("billing"), Duration.milliseconds(10));

        assertThat(shop).isPresent();
        assertThat(billing).isPresent();
        assertThat(locks.isReserved("shop")).isTrue();
        assertThat(locks.isReserved("billing")).isTrue();
    }

    @Test
    public void overlapping_scopes_wait_and_give_up_after_the_timeout()
    {
        final var held = locks.acquire(Set.of("shop", "billing"), Duration.milliseconds(10)).orElseThrow();

        assertThat(locks.acquire(Set.of("billing", "audit"), Duration.milliseconds(50))).isEmpty();
        assertThat(locks.isReserved("audit")).isFalse();

        held.close();
        assertThat(locks.acquire(Set.of("billing", "audit"), Duration.milliseconds(10))).isPresent();
    }

    @Test
    public void a_waiter_proceeds_as_soon_as_the_scope_is_released() throws Exception
    {
        final var held = locks.acquire(Set.of("shop"), Duration.milliseconds(10)).orElseThrow();

        final var waiter = CompletableFuture.supplyAsync(() -> locks.acquire(Set.of("shop"), Duration.seconds(30)));
        Thread.sleep(50);
        assertThat(waiter).isNotDone();

        held.release();

        assertThat(waiter.get(10, TimeUnit.SECONDS)).isPresent();
    }

    @Test
    public void releasing_twice_is_harmless()
    {
        final var held = locks.acquire(Set.of("shop"), Duration.milliseconds(10)).orElseThrow();
        final var other = locks.acquire(Set.of("billing"), Duration.milliseconds(10)).orElseThrow();

        held.release();
        held.close();

        assertThat(locks.isReserved("shop")).isFalse();
        assertThat(locks.isReserved("billing")).isTrue();
        other.close();
    }
}
