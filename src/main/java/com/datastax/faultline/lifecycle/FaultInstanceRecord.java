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

import java.util.concurrent.locks.ReentrantLock;

/** The manager's bookkeeping for one instance: the current snapshot, the lock that makes one thread at a
 *  time its owner, and whether a revert is waiting for an in-flight apply to finish. */
class FaultInstanceRecord
{
    final ReentrantLock ownership = new ReentrantLock();
    private FaultInstance snapshot;
    private boolean revertQueued = false;

    FaultInstanceRecord(FaultInstance snapshot)
    {
        this.snapshot = snapshot;
    }

    synchronized FaultInstance snapshot()
    {
        return snapshot;
    }

    synchronized void publish(FaultInstance next)
    {
        snapshot = next;
    }

    /** Queue a revert if the instance is still PENDING.  Checked and set atomically with respect to
     *  {@link #publish}, so a revert is either queued before the owner leaves PENDING or sees the new state. */
    synchronized boolean queueRevertIfPending()
    {
        if (snapshot.getState() == FaultState.PENDING)
        {
            revertQueued = true;
            return true;
        }
        return false;
    }

    synchronized boolean takeQueuedRevert()
    {
        final var queued = revertQueued;
        revertQueued = false;
        return queued;
    }
}
