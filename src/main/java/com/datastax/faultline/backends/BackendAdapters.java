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

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

import com.datastax.faultline.exceptions.UnsupportedBackendException;
import com.datastax.faultline.templates.BackendKind;

/** One adapter per backend kind; kinds without an adapter are unsupported */
public class BackendAdapters
{
    private final Map<BackendKind, BackendAdapter> adapters = new EnumMap<>(BackendKind.class);

    public BackendAdapters(Collection<? extends BackendAdapter> adapters)
    {
        adapters.forEach(adapter -> {
            if (this.adapters.put(adapter.kind(), adapter) != null)
            {
                throw new IllegalArgumentException("More than one adapter for backend " + adapter.kind());
            }
        });
    }

    public BackendAdapter get(BackendKind kind)
    {
        final var adapter = adapters.get(kind);
        if (adapter == null)
        {
            throw new UnsupportedBackendException("No adapter for backend " + kind);
        }
        return adapter;
    }
}
