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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** What one reconciliation pass did */
public class ReconciliationReport
{
    private final List<UUID> confirmed = new ArrayList<>();
    private final List<UUID> expired = new ArrayList<>();
    private final List<UUID> completed = new ArrayList<>();
    private final List<UUID> drifted = new ArrayList<>();
    private final List<UUID> unreachable = new ArrayList<>();
    private final List<UUID> revertsRetried = new ArrayList<>();
    private final List<UUID> interruptedResolved = new ArrayList<>();
    private final List<UUID> skippedBusy = new ArrayList<>();
    private final Map<UUID, String> failures = new LinkedHashMap<>();
    private int evicted = 0;

    void confirmed(UUID id)
    {
        confirmed.add(id);
    }

    void expired(UUID id)
    {
        expired.add(id);
    }

    void completed(UUID id)
    {
        completed.add(id);
    }

    void drifted(UUID id)
    {
        drifted.add(id);
    }

    void unreachable(UUID id)
    {
        unreachable.add(id);
    }

    void revertRetried(UUID id)
    {
        revertsRetried.add(id);
    }

    void interruptedResolved(UUID id)
    {
        interruptedResolved.add(id);
    }

    void skippedBusy(UUID id)
    {
        skippedBusy.add(id);
    }

    void failed(UUID id, String reason)
    {
        failures.put(id, reason);
    }

    void evicted(int count)
    {
        evicted = count;
    }

    /** ACTIVE instances whose backend confirmed they are still running */
    public List<UUID> getConfirmed()
    {
        return Collections.unmodifiableList(confirmed);
    }

    /** Instances reverted because their TTL passed */
    public List<UUID> getExpired()
    {
        return Collections.unmodifiableList(expired);
    }

    /** Instances the backend had finished on its own, now cleaned up */
    public List<UUID> getCompleted()
    {
        return Collections.unmodifiableList(completed);
    }

    /** ACTIVE instances the backend no longer knew about */
    public List<UUID> getDrifted()
    {
        return Collections.unmodifiableList(drifted);
    }

    /** ACTIVE instances given up on after the backend stayed unreachable past the grace period */
    public List<UUID> getUnreachable()
    {
        return Collections.unmodifiableList(unreachable);
    }

    public List<UUID> getRevertsRetried()
    {
        return Collections.unmodifiableList(revertsRetried);
    }

    /** PENDING instances left behind by an interrupted submit */
    public List<UUID> getInterruptedResolved()
    {
        return Collections.unmodifiableList(interruptedResolved);
    }

    public List<UUID> getSkippedBusy()
    {
        return Collections.unmodifiableList(skippedBusy);
    }

    public Map<UUID, String> getFailures()
    {
        return Collections.unmodifiableMap(failures);
    }

    public int getEvicted()
    {
        return evicted;
    }

    @Override
    public String toString()
    {
        return String.format("confirmed=%d expired=%d completed=%d drifted=%d unreachable=%d revertsRetried=%d " +
            "interrupted=%d busy=%d failures=%d evicted=%d", confirmed.size(), expired.size(), completed.size(),
            drifted.size(), unreachable.size(), revertsRetried.size(), interruptedResolved.size(),
            skippedBusy.size(), failures.size(), evicted);
    }
}
