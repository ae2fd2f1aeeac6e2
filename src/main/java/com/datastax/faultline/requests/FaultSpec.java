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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** What to inject, as it appears on the wire: a <code>selector</code> plus the template's parameters
 *  as sibling keys, e.g. <code>{"selector": {...}, "load": 80, "workers": 2}</code>. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FaultSpec
{
    private final TargetSelector selector;
    private final Map<String, Object> parameters = new LinkedHashMap<>();

    @JsonCreator
    public FaultSpec(@JsonProperty("selector") TargetSelector selector)
    {
        this.selector = selector;
    }

    public FaultSpec(TargetSelector selector, Map<String, Object> parameters)
    {
        this.selector = selector;
        this.parameters.putAll(parameters);
    }

    @JsonProperty
    public TargetSelector getSelector()
    {
        return selector;
    }

    public Optional<TargetSelector> selector()
    {
        return Optional.ofNullable(selector);
    }

    @JsonAnyGetter
    public Map<String, Object> getParameters()
    {
        return Collections.unmodifiableMap(parameters);
    }

    @JsonAnySetter
    private void setParameter(String name, Object value)
    {
        parameters.put(name, value);
    }

    public FaultSpec withSelector(TargetSelector newSelector)
    {
        return new FaultSpec(newSelector, parameters);
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
        FaultSpec that = (FaultSpec) o;
        return Objects.equals(selector, that.selector) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(selector, parameters);
    }

    @Override
    public String toString()
    {
        return "FaultSpec{selector=" + selector + ", parameters=" + parameters + "}";
    }
}
