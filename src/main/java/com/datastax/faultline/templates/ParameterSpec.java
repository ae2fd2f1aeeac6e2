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

import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_ABSENT)
public class ParameterSpec
{
    private final String name;
    private final ParameterType type;
    private final boolean required;
    private final Optional<Object> defaultValue;
    private final Optional<String> description;

    public ParameterSpec(String name, ParameterType type, boolean required, Optional<Object> defaultValue,
        Optional<String> description)
    {
        this.name = Objects.requireNonNull(name);
        this.type = Objects.requireNonNull(type);
        this.required = required;
        this.defaultValue = defaultValue;
        this.description = description;
    }

    public static ParameterSpec required(String name, ParameterType type)
    {
        return new ParameterSpec(name, type, true, Optional.empty(), Optional.empty());
    }

    public static ParameterSpec optional(String name, ParameterType type, Object defaultValue)
    {
        return new ParameterSpec(name, type, false, Optional.ofNullable(defaultValue), Optional.empty());
    }

    public String getName()
    {
        return name;
    }

    public ParameterType getType()
    {
        return type;
    }

    public boolean isRequired()
    {
        return required;
    }

    public Optional<Object> getDefaultValue()
    {
        return defaultValue;
    }

    public Optional<String> getDescription()
    {
        return description;
    }

    @Override
    public String toString()
    {
        return name + ":" + type + (required ? "" : "?");
    }
}
