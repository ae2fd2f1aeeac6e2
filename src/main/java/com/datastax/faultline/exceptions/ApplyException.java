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

/** Applying an artifact failed.  {@link #transientFailure} errors may succeed if repeated;
 *  {@link #rejected} errors will not.  If the backend may have kept some state despite the failure,
 *  {@link #getPartialHandle} identifies it so it can be cleaned up. */
public class ApplyException extends FaultEngineException
{
    private final Optional<BackendHandle> partialHandle;

    private ApplyException(Kind kind, String message, Optional<BackendHandle> partialHandle, Throwable cause)
    {
        super(kind, message, cause);
        this.partialHandle = partialHandle;
    }

    public static ApplyException transientFailure(String message)
    {
        return new ApplyException(Kind.APPLY_TRANSIENT, message, Optional.empty(), null);
    }

    public static ApplyException transientFailure(String message, Throwable cause)
    {
        return new ApplyException(Kind.APPLY_TRANSIENT, message, Optional.empty(), cause);
    }

    public static ApplyException rejected(String message)
    {
        return new ApplyException(Kind.APPLY_REJECTED, message, Optional.empty(), null);
    }

    public static ApplyException rejected(String message, Throwable cause)
    {
        return new ApplyException(Kind.APPLY_REJECTED, message, Optional.empty(), cause);
    }

    public ApplyException withPartialHandle(BackendHandle handle)
    {
        final var copy = new ApplyException(getKind(), getMessage(), Optional.of(handle), getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public Optional<BackendHandle> getPartialHandle()
    {
        return partialHandle;
    }

    public boolean isTransient()
    {
        return getKind() == Kind.APPLY_TRANSIENT;
    }

    @Override
    public boolean isRetryable()
    {
        return isTransient();
    }
}
