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

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import com.datastax.faultline.templates.BackendKind;

/** Identifies the state a backend holds for an applied fault.  The token is opaque to everything but
 *  the adapter that issued it; attributes carry whatever else that adapter needs to revert or query
 *  it later, possibly after a restart. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class BackendHandle
{
    private final BackendKind kind;
    private final String token;
    private final Map<String, String> attributes;

    @JsonCreator
    public BackendHandle(
        @JsonProperty("kind") BackendKind kind,
        @JsonProperty("token") String token,
        @JsonProperty("attributes") Map<String, String> attributes)
    {
        this.kind = Objects.requireNonNull(kind);
        this.token = Objects.requireNonNull(token);
        this.attributes = attributes == null ? Map.of() : Map.copyOf(new TreeMap<>(attributes));
    }

    public BackendHandle(BackendKind kind, String token)
    {
        this(kind, token, Map.of());
    }

    @JsonProperty
    public BackendKind getKind()
    {
        return kind;
    }

    @JsonProperty
    public String getToken()
    {
        return token;
    }

    @JsonProperty
    public Map<String, String> getAttributes()
    {
        return attributes;
    }

    public Optional<String> attribute(String name)
    {
        return Optional.ofNullable(attributes.get(name));
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (o == null || getClass() != o.getClass())
        {
            return false;
        }
        BackendHandle that = (BackendHandle) o;
        return kind == that.kind && token.equals(that.token) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(kind, token, attributes);
    }

    @Override
    public String toString()
    {
        return kind + ":" + token;
    }
}
