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

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import io.dropwizard.lifecycle.Managed;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;

import com.datastax.faultline.util.Duration;
import com.datastax.faultline.util.LockHolder;
import com.datastax.faultline.util.ScopedLogger;

/** Periodic task that can be paused and run on demand.
 *
 *  <p>Scheduled runs and {@link #runNow} take the same lock, so the task never runs concurrently with
 *  itself.  The timer thread blocks while a run is in progress, and runs that fall due meanwhile queue
 *  up behind it instead of being skipped. */
public abstract class PeriodicTask implements Managed
{
    private final boolean startPaused;
    private final HashedWheelTimer timer;
    private final Duration delay;
    private final Duration repeat;
    private final ReentrantLock runningTaskLock = new ReentrantLock();

    private volatile Timeout timeout;

    protected PeriodicTask(boolean startPaused, HashedWheelTimer timer, Duration delay, Duration repeat)
    {
        this.startPaused = startPaused;
        this.timer = timer;
        this.delay = delay;
        this.repeat = repeat;
    }

    protected abstract ScopedLogger logger();

    protected abstract void runTask();

    public synchronized void pause()
    {
        if (timeout != null)
        {
            logger().info("Pausing");
            timeout.cancel();
            timeout = null;
        }
    }

    public boolean isPaused()
    {
        return timeout == null;
    }

    private synchronized void scheduleFirstRun()
    {
        timeout = timer.newTimeout(this::runTaskAndReschedule, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void runTaskAndReschedule(Timeout timeout)
    {
        runNow();
        reschedule();
    }

    private synchronized void reschedule()
    {
        if (isPaused())
        {
            return;
        }

        timeout = timer.newTimeout(this::runTaskAndReschedule, repeat.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void run()
    {
        if (isPaused())
        {
            logger().info("Running every {}", repeat.toAbbrevString());
            scheduleFirstRun();
        }
    }

    /** Run the task on the calling thread, waiting for any run already in progress.  A failed run is
     *  logged and does not stop the schedule. */
    public void runNow()
    {
        try (var lockHolder = LockHolder.acquire(runningTaskLock))
        {
            runTask();
        }
        catch (RuntimeException e)
        {
            logger().error("Periodic run failed", e);
        }
    }

    @Override
    public void start()
    {
        if (!startPaused)
        {
            run();
        }
    }

    @Override
    public void stop()
    {
        pause();
    }
}
