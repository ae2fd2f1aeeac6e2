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
package com.datastax.faultline.rendering;

import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;

import com.datastax.faultline.exceptions.RenderException;
import com.datastax.faultline.requests.ValidatedRequest;
import com.datastax.faultline.templates.TemplateRegistry;
import com.datastax.faultline.util.JacksonUtils;

/** The values a rendering definition can refer to:
 *
 * <pre>
 *   metadata.name, metadata.namespace
 *   metadata.hasTtl, metadata.ttl        (ttl as e.g. "60s")
 *   spec.selector                        (inline JSON, which is also YAML flow style)
 *   spec.&lt;parameter&gt;                     (inline JSON literals, strings quoted; absent optionals are empty)
 * </pre>
 */
public final class RenderScope
{
    private RenderScope()
    {
    }

    public static Map<String, Object> of(ValidatedRequest validated)
    {
        final var request = validated.request();

        final Map<String, Object> metadata = new HashMap<>();
        metadata.put("name", request.name());
        metadata.put("namespace", request.namespace());
        metadata.put("hasTtl", request.getMetadata().getTtl().isPresent());
        metadata.put("ttl", request.getMetadata().getTtl().map(ttl -> ttl.toAbbrevString()).orElse(""));

        final Map<String, Object> spec = new HashMap<>();
        validated.template().getParameters().forEach(parameter -> spec.put(parameter.getName(), null));
        validated.parameters().forEach((name, value) -> spec.put(name, inline(value)));
        spec.put(TemplateRegistry.SELECTOR_PARAMETER,
            request.getSpec().selector().map(selector -> inline(selector.toMap())).orElse("{}"));

        final Map<String, Object> scope = new HashMap<>();
        scope.put("metadata", metadata);
        scope.put("spec", spec);
        return scope;
    }

    /** Every value is written as a JSON literal, so a string can never end its own scalar and add keys */
    private static Object inline(Object value)
    {
        if (value == null)
        {
            return null;
        }
        try
        {
            return JacksonUtils.getObjectMapper().writeValueAsString(value);
        }
        catch (JsonProcessingException e)
        {
            throw new RenderException("Could not serialize value " + value, e);
        }
    }
}
