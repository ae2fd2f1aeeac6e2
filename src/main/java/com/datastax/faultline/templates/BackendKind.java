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
package com.datastax.faultline.templates;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** The backend families a template can target */
public enum BackendKind
{
    /** Declarative manifests applied to a Kubernetes cluster running Chaos Mesh */
    CHAOS_MESH("chaos-mesh"),
    /** Direct agent on the target host; declared so templates can name it, but not implemented */
    CHAOSD("chaosd"),
    /** Delegated to a named {@link com.datastax.faultline.backends.custom.CustomFaultExecutor} */
    CUSTOM("custom");

    private final String id;

    BackendKind(String id)
    {
        this.id = id;
    }

    @JsonValue
    public String id()
    {
        return id;
    }

    public static Optional<BackendKind> fromId(String id)
    {
        return Arrays.stream(values())
            .filter(kind -> kind.id.equalsIgnoreCase(id))
            .findFirst();
    }

    @JsonCreator
    public static BackendKind fromJson(String id)
    {
        return fromId(id).orElseThrow(() -> new IllegalArgumentException("Unknown backend '" + id + "'"));
    }

    @Override
    public String toString()
    {
        return id;
    }
}
