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
import java.util.function.UnaryOperator;

import com.datastax.faultline.backends.Artifact;
import com.datastax.faultline.backends.BackendHandle;
import com.datastax.faultline.exceptions.StorageException;
import com.datastax.faultline.requests.FaultRequest;
import com.datastax.faultline.util.Duration;
import com.datastax.faultline.util.LockHolder;

/** Exclusive ownership of one instance, for the length of a try-with-resources block.  Every
 *  transition goes through here: it is persisted, then published to readers. */
public class OwnedInstance implements AutoCloseable
{
    private final FaultLifecycleManager manager;
    private final FaultInstanceRecord record;
    private final LockHolder<ReentrantLock> ownership;
    private boolean released = false;

    OwnedInstance(FaultLifecycleManager manager, FaultInstanceRecord record, LockHolder<ReentrantLock> ownership)
    {
        this.manager = manager;
        this.record = record;
        this.ownership = ownership;
    }

    public FaultInstance get()
    {
        return record.snapshot();
    }

    private FaultInstance update(UnaryOperator<FaultInstance> transition)
    {
        if (released)
        {
            throw new IllegalStateException("Ownership of " + record.snapshot() + " has been released");
        }
        final var previous = record.snapshot();
        final var next = transition.apply(previous);
        manager.persist(next);
        record.publish(next);
        manager.logTransition(previous, next);
        return next;
    }

    /** Like {@link #update}, but a transition the store refuses is still published, so readers never see a
     *  state the owner has already left */
    private FaultInstance updateEvenIfUnsaved(UnaryOperator<FaultInstance> transition)
    {
        try
        {
            return update(transition);
        }
        catch (StorageException e)
        {
            final var previous = record.snapshot();
            final var next = transition.apply(previous);
            record.publish(next);
            manager.logTransition(previous, next);
            manager.logUnsaved(next, e);
            return next;
        }
    }

    public FaultInstance recordArtifact(Artifact artifact)
    {
        return update(instance -> instance.withArtifact(artifact));
    }

    public FaultInstance activate(BackendHandle handle)
    {
        return update(instance -> instance.activated(handle, manager.now()));
    }

    public FaultInstance reject(String reason)
    {
        return update(instance -> instance.rejected(reason, manager.now()));
    }

    /** Settle a submit that could not finish; see {@link #updateEvenIfUnsaved} */
    public FaultInstance rejectEvenIfUnsaved(String reason)
    {
        return updateEvenIfUnsaved(instance -> instance.rejected(reason, manager.now()));
    }

    public FaultInstance failPartialEvenIfUnsaved(BackendHandle handle, String reason)
    {
        return updateEvenIfUnsaved(instance -> instance.failedPartial(handle, reason, manager.now()));
    }

    public FaultInstance beginRevert()
    {
        return update(FaultInstance::reverting);
    }

    public FaultInstance completeRevert()
    {
        return update(instance -> instance.reverted(manager.now()));
    }

    public FaultInstance failPartial(BackendHandle handle, String reason)
    {
        return update(instance -> instance.failedPartial(handle, reason, manager.now()));
    }

    /** Make an ACTIVE instance expire <code>ttl</code> from now */
    public FaultInstance renew(Duration ttl)
    {
        return update(instance -> {
            final FaultRequest renewedRequest = instance.getRequest().withTtl(ttl);
            return instance.renewed(renewedRequest, manager.now().plus(ttl.toJdkDuration()));
        });
    }

    public FaultInstance markBackendUnknown()
    {
        if (get().getBackendUnknownSince().isPresent())
        {
            return get();
        }
        return update(instance -> instance.backendUnknown(manager.now()));
    }

    public FaultInstance markBackendKnown()
    {
        if (get().getBackendUnknownSince().isEmpty())
        {
            return get();
        }
        return update(FaultInstance::backendKnown);
    }

    /** Take a revert that was requested while this instance was PENDING; only the owner may take it */
    public boolean takeQueuedRevert()
    {
        return record.takeQueuedRevert();
    }

    @Override
    public void close()
    {
        if (!released)
        {
            released = true;
            ownership.close();
        }
    }
}
