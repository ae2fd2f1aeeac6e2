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

public class RevertException extends FaultEngineException
{
    private final boolean transientFailure;

    public RevertException(String message, boolean transientFailure)
    {
        super(Kind.REVERT, message);
        this.transientFailure = transientFailure;
    }

    public RevertException(String message, boolean transientFailure, Throwable cause)
    {
        super(Kind.REVERT, message, cause);
        this.transientFailure = transientFailure;
    }

    @Override
    public boolean isRetryable()
    {
        return transientFailure;
    }
}
