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

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

import com.datastax.faultline.exceptions.ConflictException;
import com.datastax.faultline.exceptions.NotFoundException;
import com.datastax.faultline.exceptions.StorageException;
import com.datastax.faultline.requests.FaultRequest;
import com.datastax.faultline.util.Duration;
import com.datastax.faultline.util.LockHolder;
import com.datastax.faultline.util.ScopedLogger;

/** The authoritative record of fault instances.
 *
 *  <p>Snapshots can be read at any time without blocking.  Changing an instance requires owning it
 *  ({@link #own}, {@link #tryOwn}), and only one thread owns an instance at a time, so transitions of a
 *  single instance are strictly ordered.  Activation additionally requires a scope reservation
 *  ({@link #reserveScope}) under which {@link #checkConflicts} is decisive. */
public class FaultLifecycleManager
{
    private static final ScopedLogger logger = ScopedLogger.getLogger(FaultLifecycleManager.class);

    private final ConcurrentMap<UUID, FaultInstanceRecord> records = new ConcurrentHashMap<>();
    private final ScopeReservationLocks scopeLocks = new ScopeReservationLocks();
    private final FaultInstanceStore store;
    private final Clock clock;

    public FaultLifecycleManager(FaultInstanceStore store, Clock clock)
    {
        this.store = store;
        this.clock = clock;
    }

    Instant now()
    {
        return clock.instant();
    }

    void persist(FaultInstance instance)
    {
        try
        {
            store.save(instance);
        }
        catch (RuntimeException e)
        {
            throw new StorageException("save " + instance, e);
        }
    }

    void logUnsaved(FaultInstance instance, StorageException e)
    {
        logger.error("{} is only held in memory; the store still has an earlier state: {}", instance,
            e.getMessage());
    }

    void logTransition(FaultInstance previous, FaultInstance next)
    {
        if (previous.getState() == next.getState())
        {
            logger.debug("{} updated", next);
        }
        else if (next.getState() == FaultState.FAILED_PARTIAL)
        {
            logger.error("{} {} -> {}: {}; backend may still hold {}", next.getInstanceId(), previous.getState(),
                next.getState(), next.getFailureReason().orElse("no reason given"),
                next.getBackendHandle().map(Object::toString).orElse("nothing"));
        }
        else
        {
            logger.info("{} {} -> {}{}", next.getInstanceId(), previous.getState(), next.getState(),
                next.getFailureReason().filter(ignored -> next.getState() == FaultState.REJECTED)
                    .map(reason -> ": " + reason).orElse(""));
        }
    }

    /** Load every stored instance; unfinished ones will be resolved by reconciliation.  Returns how many
     *  were loaded. */
    public int recover()
    {
        return logger.withScopedInfo("Recovering fault instances").get(() -> {
            final var loaded = store.loadAll();
            loaded.forEach(instance -> records.putIfAbsent(instance.getInstanceId(),
                new FaultInstanceRecord(instance)));
            loaded.stream()
                .filter(instance -> !instance.getState().isFinished())
                .forEach(instance -> logger.info("Recovered {}", instance));
            return loaded.size();
        });
    }

    /** Create a PENDING instance for a normalized, validated request; the caller owns it */
    public OwnedInstance create(FaultRequest request, boolean composable)
    {
        final var instance = FaultInstance.pending(UUID.randomUUID(), request, composable, now());
        final var record = new FaultInstanceRecord(instance);
        final var ownership = LockHolder.acquire(record.ownership);
        try
        {
            persist(instance);
            if (records.putIfAbsent(instance.getInstanceId(), record) != null)
            {
                throw new IllegalStateException("Duplicate instance id " + instance.getInstanceId());
            }
        }
        catch (RuntimeException e)
        {
            ownership.close();
            throw e;
        }
        logger.info("{} created PENDING", instance);
        return new OwnedInstance(this, record, ownership);
    }

    private FaultInstanceRecord record(UUID instanceId)
    {
        final var record = records.get(instanceId);
        if (record == null)
        {
            throw new NotFoundException("Fault instance", String.valueOf(instanceId));
        }
        return record;
    }

    /** Become the owner of an instance, waiting as long as it takes */
    public OwnedInstance own(UUID instanceId)
    {
        final var record = record(instanceId);
        return new OwnedInstance(this, record, LockHolder.acquire(record.ownership));
    }

    /** Become the owner of an instance if that is possible within <code>wait</code> */
    public Optional<OwnedInstance> tryOwn(UUID instanceId, Duration wait)
    {
        final var record = record(instanceId);
        return LockHolder.tryAcquire(record.ownership, wait)
            .map(ownership -> new OwnedInstance(this, record, ownership));
    }

    public FaultInstance get(UUID instanceId)
    {
        return record(instanceId).snapshot();
    }

    public Optional<FaultInstance> find(UUID instanceId)
    {
        return Optional.ofNullable(records.get(instanceId)).map(FaultInstanceRecord::snapshot);
    }

    /** Snapshots of every instance, oldest first */
    public List<FaultInstance> list()
    {
        return records.values().stream()
            .map(FaultInstanceRecord::snapshot)
            .sorted(Comparator.comparing(FaultInstance::getCreatedAt)
                .thenComparing(FaultInstance::getInstanceId))
            .collect(Collectors.toList());
    }

    /** If the instance is PENDING, queue a revert for its owner to run when apply finishes */
    public boolean queueRevertIfPending(UUID instanceId)
    {
        return record(instanceId).queueRevertIfPending();
    }

    public ScopeReservationLocks.Reservation reserveScope(Set<String> scope, Duration timeout)
    {
        return scopeLocks.acquire(scope, timeout).orElseThrow(() -> new ConflictException(
            String.format("Timed out after %s waiting for other faults in %s to settle",
                timeout.toAbbrevString(), scope),
            List.of()));
    }

    /** Fail if <code>candidate</code> may not become ACTIVE alongside the instances already live.
     *  Only decisive while the candidate's scope is reserved. */
    public void checkConflicts(FaultInstance candidate)
    {
        final var request = candidate.getRequest();
        final var selector = request.getSpec().getSelector();

        final var conflicting = records.values().stream()
            .map(FaultInstanceRecord::snapshot)
            .filter(other -> !other.getInstanceId().equals(candidate.getInstanceId()))
            .filter(other -> sameBackendResource(request, other) ||
                (other.getState().isLive() &&
                    !candidate.isComposable() && !other.isComposable() &&
                    selector.overlaps(other.getRequest().getSpec().getSelector())))
            .collect(Collectors.toList());

        if (!conflicting.isEmpty())
        {
            throw new ConflictException(String.format("%s/%s conflicts with live faults %s",
                request.namespace(), request.name(), conflicting),
                conflicting.stream().map(FaultInstance::getInstanceId).collect(Collectors.toList()));
        }
    }

    /** Two instances with the same namespace and name would own the same backend resource */
    private static boolean sameBackendResource(FaultRequest request, FaultInstance other)
    {
        return other.getState().holdsBackendHandle() &&
            other.getRequest().getMetadata().getName().equals(request.getMetadata().getName()) &&
            other.getRequest().getMetadata().getNamespace().equals(request.getMetadata().getNamespace());
    }

    /** Forget REVERTED and REJECTED instances that finished more than <code>retention</code> ago */
    public int evictFinished(Duration retention)
    {
        final var cutoff = now().minus(retention.toJdkDuration());
        final var evicted = records.values().stream()
            .map(FaultInstanceRecord::snapshot)
            .filter(instance -> instance.getState().isFinished())
            .filter(instance -> instance.getFinishedAt().map(finished -> finished.isBefore(cutoff)).orElse(false))
            .map(FaultInstance::getInstanceId)
            .collect(Collectors.toList());

        evicted.forEach(instanceId -> {
            store.delete(instanceId);
            records.remove(instanceId);
        });
        if (!evicted.isEmpty())
        {
            logger.info("Evicted {} finished instances", evicted.size());
        }
        return evicted.size();
    }
}
