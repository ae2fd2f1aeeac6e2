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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import com.datastax.faultline.util.Duration;

/** A caller's request to inject a fault from a template.  Requests are immutable; {@link #normalize}
 *  returns a copy with the server-side defaults filled in. */
public class FaultRequest
{
    private final String templateId;
    private final FaultMetadata metadata;
    private final FaultSpec spec;

    @JsonCreator
    public FaultRequest(
        @JsonProperty("templateID") String templateId,
        @JsonProperty("metadata") FaultMetadata metadata,
        @JsonProperty("spec") FaultSpec spec)
    {
        this.templateId = templateId;
        this.metadata = metadata == null ? FaultMetadata.empty() : metadata;
        this.spec = spec == null ? new FaultSpec(null) : spec;
    }

    @JsonProperty("templateID")
    public String getTemplateId()
    {
        return templateId;
    }

    @JsonProperty
    public FaultMetadata getMetadata()
    {
        return metadata;
    }

    @JsonProperty
    public FaultSpec getSpec()
    {
        return spec;
    }

    public static String defaultName(String templateId)
    {
        return templateId.replace('/', '-').toLowerCase() + "-instance";
    }

    /** Fill in the name (derived from the template id) and namespace when the caller left them out,
     *  and make a selector that names no namespace select the request's namespace */
    public FaultRequest normalize(String defaultNamespace)
    {
        final var normalizedMetadata = metadata.withDefaults(
            templateId == null ? null : defaultName(templateId), defaultNamespace);
        final var namespace = normalizedMetadata.getNamespace().orElseThrow();
        final var normalizedSpec = spec.selector()
            .map(selector -> spec.withSelector(selector.resolve(namespace)))
            .orElse(spec);
        return new FaultRequest(templateId, normalizedMetadata, normalizedSpec);
    }

    public FaultRequest withTtl(Duration ttl)
    {
        return new FaultRequest(templateId, metadata.withTtl(ttl), spec);
    }

    /** Name and namespace of a normalized request */
    public String name()
    {
        return metadata.getName().orElseThrow(() -> new IllegalStateException("request is not normalized"));
    }

    public String namespace()
    {
        return metadata.getNamespace()
            .orElseThrow(() -> new IllegalStateException("request is not normalized"));
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
        FaultRequest that = (FaultRequest) o;
        return Objects.equals(templateId, that.templateId) && metadata.equals(that.metadata) &&
            spec.equals(that.spec);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(templateId, metadata, spec);
    }

    @Override
    public String toString()
    {
        return "FaultRequest{" + templateId + " " + metadata + " " + spec + "}";
    }
}
