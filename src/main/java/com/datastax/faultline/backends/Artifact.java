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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import com.datastax.faultline.templates.BackendKind;

/** The output of rendering, ready to apply.  Where the adapter can tell before applying which backend
 *  state the artifact will create, {@link #getExpectedHandle} names it; that is what gets cleaned up
 *  when an apply fails ambiguously or the process dies mid-apply. */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public class Artifact
{
    private final BackendKind kind;
    private final String content;
    private final Optional<BackendHandle> expectedHandle;
    private final Map<String, String> attributes;

    @JsonCreator
    public Artifact(
        @JsonProperty("kind") BackendKind kind,
        @JsonProperty("content") String content,
        @JsonProperty("expectedHandle") Optional<BackendHandle> expectedHandle,
        @JsonProperty("attributes") Map<String, String> attributes)
    {
        this.kind = Objects.requireNonNull(kind);
        this.content = Objects.requireNonNull(content);
        this.expectedHandle = expectedHandle == null ? Optional.empty() : expectedHandle;
        this.attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public Artifact(BackendKind kind, String content, Optional<BackendHandle> expectedHandle)
    {
        this(kind, content, expectedHandle, Map.of());
    }

    @JsonProperty
    public BackendKind getKind()
    {
        return kind;
    }

    @JsonProperty
    public String getContent()
    {
        return content;
    }

    @JsonProperty
    public Optional<BackendHandle> getExpectedHandle()
    {
        return expectedHandle;
    }

    /** Facts the adapter carries from rendering to applying */
    @JsonProperty
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
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
        Artifact artifact = (Artifact) o;
        return kind == artifact.kind && content.equals(artifact.content) &&
            expectedHandle.equals(artifact.expectedHandle) && attributes.equals(artifact.attributes);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(kind, content, expectedHandle, attributes);
    }
}
