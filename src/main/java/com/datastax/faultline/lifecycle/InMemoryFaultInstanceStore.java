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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/** Keeps nothing across restarts */
public class InMemoryFaultInstanceStore implements FaultInstanceStore
{
    private final Map<UUID, FaultInstance> instances = new ConcurrentHashMap<>();

    @Override
    public void save(FaultInstance instance)
    {
        instances.put(instance.getInstanceId(), instance);
    }

    @Override
    public void delete(UUID instanceId)
    {
        instances.remove(instanceId);
    }

    @Override
    public List<FaultInstance> loadAll()
    {
        return new ArrayList<>(instances.values());
    }
}
