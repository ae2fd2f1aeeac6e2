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

import java.util.Optional;

import com.datastax.faultline.backends.BackendHandle;
import com.datastax.faultline.util.Duration;

/** A backend call did not answer in time; what it did in the meantime is unknown */
public class BackendTimeoutException extends FaultEngineException
{
    private final String operation;
    private final Optional<BackendHandle> partialHandle;

    public BackendTimeoutException(String operation, Duration timeout, Optional<BackendHandle> partialHandle)
    {
        super(Kind.TIMEOUT, String.format("Backend %s did not complete within %s", operation,
            timeout.toAbbrevString()));
        this.operation = operation;
        this.partialHandle = partialHandle;
    }

    public String getOperation()
    {
        return operation;
    }

    public Optional<BackendHandle> getPartialHandle()
    {
        return partialHandle;
    }
}
