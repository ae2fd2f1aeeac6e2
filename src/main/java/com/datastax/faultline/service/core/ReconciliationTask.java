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

import com.datastax.faultline.engine.OrchestrationEngine;
import com.datastax.faultline.util.Duration;
import com.datastax.faultline.util.ScopedLogger;

/** Runs {@link OrchestrationEngine#reconcile} on a fixed interval */
public class ReconciliationTask extends PeriodicTask
{
    private static final ScopedLogger logger = ScopedLogger.getLogger(ReconciliationTask.class);

    private final OrchestrationEngine engine;

    public ReconciliationTask(boolean startPaused, HashedWheelTimer timer, Duration delay, Duration repeat,
        OrchestrationEngine engine)
    {
        super(startPaused, timer, delay, repeat);
        this.engine = engine;
    }

    @Override
    protected ScopedLogger logger()
    {
        return logger;
    }

    @Override
    protected void runTask()
    {
        final var report = engine.reconcile();
        if (!report.getFailures().isEmpty() || !report.getSkippedBusy().isEmpty())
        {
            logger.warn("Reconciliation: {}", report);
        }
        else
        {
            logger.debug("Reconciliation: {}", report);
        }
    }
}
