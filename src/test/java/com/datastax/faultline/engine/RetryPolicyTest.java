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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.datastax.faultline.exceptions.ApplyException;
import com.datastax.faultline.exceptions.FaultEngineException;
import com.datastax.faultline.util.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RetryPolicyTest
{
    private final List<java.time.Duration> sleeps = new ArrayList<>();

    private RetryPolicy policy(int maxAttempts)
    {
        return new RetryPolicy(maxAttempts, Duration.milliseconds(100), Duration.milliseconds(350), 2.0,
            sleeps::add);
    }

    @Test
    public void backoff_grows_by_the_multiplier_up_to_the_cap()
    {
        final var policy = policy(5);

        assertThat(policy.backoff(1)).isEqualTo(java.time.Duration.ofMillis(100));
        assertThat(policy.backoff(2)).isEqualTo(java.time.Duration.ofMillis(200));
        assertThat(policy.backoff(3)).isEqualTo(java.time.Duration.ofMillis(350));
        assertThat(policy.backoff(10)).isEqualTo(java.time.Duration.ofMillis(350));
    }

    @Test
    public void retryable_failures_are_retried_until_success()
    {
        final var attempts = new AtomicInteger();

        final var result = policy(5).call("apply", () -> {
            if (attempts.incrementAndGet() < 3)
            {
                throw ApplyException.transientFailure("connection refused");
            }
            return "applied";
        }, FaultEngineException::isRetryable);

        assertThat(result).isEqualTo("applied");
        assertThat(attempts).hasValue(3);
        assertThat(sleeps).containsExactly(java.time.Duration.ofMillis(100), java.time.Duration.ofMillis(200));
    }

    @Test
    public void the_last_failure_is_thrown_once_attempts_run_out()
    {
        final var attempts = new AtomicInteger();

        assertThatThrownBy(() -> policy(3).call("apply", () -> {
            throw ApplyException.transientFailure("attempt " + attempts.incrementAndGet());
        }, FaultEngineException::isRetryable))
            .isInstanceOf(ApplyException.class)
            .hasMessageContaining("attempt 3");

        assertThat(sleeps).hasSize(2);
    }

    @Test
    public void non_retryable_failures_are_thrown_immediately()
    {
        final var attempts = new AtomicInteger();

        assertThatThrownBy(() -> policy(5).call("apply", () -> {
            attempts.incrementAndGet();
            throw ApplyException.rejected("admission webhook denied");
        }, FaultEngineException::isRetryable))
            .isInstanceOf(ApplyException.class);

        assertThat(attempts).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    public void other_exceptions_are_never_retried()
    {
        final var attempts = new AtomicInteger();

        assertThatThrownBy(() -> policy(5).call("apply", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("bug");
        }, e -> true))
            .isInstanceOf(IllegalStateException.class);

        assertThat(attempts).hasValue(1);
    }

    @Test
    public void invalid_settings_are_refused()
    {
        assertThatThrownBy(() -> policy(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.seconds(1), Duration.seconds(1), 0.5))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
