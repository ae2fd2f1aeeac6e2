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
package com.datastax.faultline.backends;

import com.datastax.faultline.exceptions.UnsupportedBackendException;
import com.datastax.faultline.requests.ValidatedRequest;
import com.datastax.faultline.templates.BackendKind;

/** Stands in for a backend kind that templates may name but that has no implementation.  It refuses to
 *  apply and never claims to have reverted anything. */
public class UnsupportedBackendAdapter implements BackendAdapter
{
    private final BackendKind kind;

    public UnsupportedBackendAdapter(BackendKind kind)
    {
        this.kind = kind;
    }

    @Override
    public BackendKind kind()
    {
        return kind;
    }

    @Override
    public Artifact render(ValidatedRequest request)
    {
        throw unsupported("render");
    }

    @Override
    public BackendHandle apply(Artifact artifact)
    {
        throw unsupported("apply");
    }

    @Override
    public RevertOutcome revert(BackendHandle handle)
    {
        return RevertOutcome.UNSUPPORTED;
    }

    @Override
    public BackendStatus status(BackendHandle handle)
    {
        return BackendStatus.UNKNOWN;
    }

    private UnsupportedBackendException unsupported(String operation)
    {
        return new UnsupportedBackendException(
            String.format("Backend '%s' is not implemented; cannot %s", kind, operation));
    }
}
