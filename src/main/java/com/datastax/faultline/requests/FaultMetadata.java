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
package com.datastax.faultline.requests;

import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import com.datastax.faultline.util.Duration;

/** Identity and lifetime of a requested fault: the name and namespace the backend resource will get,
 *  and how long it should stay injected before the reconciler reverts it. */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public class FaultMetadata
{
    private final Optional<String> name;
    private final Optional<String> namespace;
    private final Optional<Duration> ttl;

    @JsonCreator
    public FaultMetadata(
        @JsonProperty("name") Optional<String> name,
        @JsonProperty("namespace") Optional<String> namespace,
        @JsonProperty("ttl") Optional<Duration> ttl)
    {
        this.name = name == null ? Optional.empty() : name;
        this.namespace = namespace == null ? Optional.empty() : namespace;
        this.ttl = ttl == null ? Optional.empty() : ttl;
    }

    public static FaultMetadata of(String name, String namespace, Duration ttl)
    {
        return new FaultMetadata(Optional.ofNullable(name), Optional.ofNullable(namespace), Optional.ofNullable(ttl));
    }

    public static FaultMetadata empty()
    {
        return new FaultMetadata(Optional.empty(), Optional.empty(), Optional.empty());
    }

    @JsonProperty
    public Optional<String> getName()
    {
        return name;
    }

    @JsonProperty
    public Optional<String> getNamespace()
    {
        return namespace;
    }

    @JsonProperty
    public Optional<Duration> getTtl()
    {
        return ttl;
    }

    public FaultMetadata withDefaults(String defaultName, String defaultNamespace)
    {
        return new FaultMetadata(
            name.or(() -> Optional.ofNullable(defaultName)),
            namespace.or(() -> Optional.ofNullable(defaultNamespace)),
            ttl);
    }

    public FaultMetadata withTtl(Duration newTtl)
    {
        return new FaultMetadata(name, namespace, Optional.of(newTtl));
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
        FaultMetadata that = (FaultMetadata) o;
        return name.equals(that.name) && namespace.equals(that.namespace) && ttl.equals(that.ttl);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(name, namespace, ttl);
    }

    @Override
    public String toString()
    {
        return namespace.orElse("?") + "/" + name.orElse("?") +
            ttl.map(t -> " ttl=" + t.toAbbrevString()).orElse("");
    }
}
