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

/** Root of every error the engine surfaces to callers.  Each error has a {@link Kind} so that callers
 *  (and the REST layer) can react to the category without matching on classes, and says whether
 *  repeating the same operation could succeed. */
public abstract class FaultEngineException extends RuntimeException
{
    public enum Kind
    {
        NOT_FOUND,
        INVALID_TEMPLATE,
        VALIDATION,
        CONFLICT,
        RENDER,
        APPLY_TRANSIENT,
        APPLY_REJECTED,
        REVERT,
        TIMEOUT,
        UNSUPPORTED,
        STORAGE
    }

    private final Kind kind;

    protected FaultEngineException(Kind kind, String message)
    {
        super(message);
        this.kind = kind;
    }

    protected FaultEngineException(Kind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind()
    {
        return kind;
    }

    public boolean isRetryable()
    {
        return false;
    }

    /** Individual problems behind this error; empty when the message says it all */
    public List<String> getDetails()
    {
        return List.of();
    }

    static String describe(String summary, List<String> problems)
    {
        return summary + ":\n  " + String.join("\n  ", problems);
    }
}
