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

import java.util.List;
import java.util.UUID;

/** Durable home of instance snapshots, so faults left in place survive a restart of the engine */
public interface FaultInstanceStore
{
    void save(FaultInstance instance);

    void delete(UUID instanceId);

    List<FaultInstance> loadAll();
}
