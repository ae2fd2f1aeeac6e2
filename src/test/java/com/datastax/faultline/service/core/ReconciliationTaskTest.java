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
package com.datastax.faultline.service.core;

import io.netty.util.HashedWheelTimer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.datastax.faultline.engine.OrchestrationEngine;
import com.datastax.faultline.engine.ReconciliationReport;
import com.datastax.faultline.util.Duration;
import com.datastax.faultline.util.NamedThreadFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ReconciliationTaskTest
{
    private final HashedWheelTimer timer = new HashedWheelTimer(new NamedThreadFactory("TestTimer"));
    private final OrchestrationEngine engine = mock(OrchestrationEngine.class);

    @AfterEach
    public void stopTimer()
    {
        timer.stop();
    }

    private ReconciliationTask task(boolean startPaused)
    {
        return new ReconciliationTask(startPaused, timer, Duration.milliseconds(10), Duration.milliseconds(10),
            engine);
    }

    @Test
    public void run_now_reconciles_once()
    {
        when(engine.reconcile()).thenReturn(new ReconciliationReport());

        task(true).runNow();

        verify(engine, times(1)).reconcile();
    }

    @Test
    public void a_failed_run_does_not_stop_later_runs()
    {
        when(engine.reconcile())
            .thenThrow(new IllegalStateException("store unavailable"))
            .thenReturn(new ReconciliationReport());
        final var task = task(true);

        task.runNow();
        task.runNow();

        verify(engine, times(2)).reconcile();
    }

    @Test
    public void a_started_task_runs_repeatedly_until_stopped()
    {
        when(engine.reconcile()).thenReturn(new ReconciliationReport());
        final var task = task(false);

        task.start();
        assertThat(task.isPaused()).isFalse();
        verify(engine, timeout(5000).atLeast(2)).reconcile();

        task.stop();
        assertThat(task.isPaused()).isTrue();
    }

    @Test
    public void a_task_that_starts_paused_waits_to_be_run()
    {
        final var task = task(true);

        task.start();

        assertThat(task.isPaused()).isTrue();
        verify(engine, never()).reconcile();
    }
}
