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
package com.datastax.faultline.exceptions;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/** A fault could not become active because live faults already target the same things */
public class ConflictException extends FaultEngineException
{
    private final List<UUID> conflictingInstanceIds;

    public ConflictException(String message, List<UUID> conflictingInstanceIds)
    {
        super(Kind.CONFLICT, message);
        this.conflictingInstanceIds = List.copyOf(conflictingInstanceIds);
    }

    public List<UUID> getConflictingInstanceIds()
    {
        return conflictingInstanceIds;
    }

    @Override
    public boolean isRetryable()
    {
        return true;
    }

    @Override
    public List<String> getDetails()
    {
        return conflictingInstanceIds.stream().map(UUID::toString).collect(Collectors.toList());
    }
}
