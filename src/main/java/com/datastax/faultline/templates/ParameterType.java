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
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

import com.datastax.faultline.util.Duration;

/** The value types a template parameter may declare, and the JSON/YAML values each one accepts */
public enum ParameterType
{
    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    /** A string such as <code>30s</code> or <code>5m</code> */
    DURATION("duration"),
    LIST("list"),
    MAP("map");

    private final String id;

    ParameterType(String id)
    {
        this.id = id;
    }

    @JsonValue
    public String id()
    {
        return id;
    }

    public static Optional<ParameterType> fromId(String id)
    {
        return Arrays.stream(values())
            .filter(type -> type.id.equalsIgnoreCase(id))
            .findFirst();
    }

    public boolean accepts(Object value)
    {
        if (value == null)
        {
            return false;
        }
        switch (this)
        {
            case STRING:
                return value instanceof String;
            case INTEGER:
                return value instanceof Integer || value instanceof Long ||
                    value instanceof java.math.BigInteger ||
                    value instanceof Short || value instanceof Byte;
            case NUMBER:
                return value instanceof Number;
            case BOOLEAN:
                return value instanceof Boolean;
            case DURATION:
                return value instanceof String && Duration.isValid((String) value);
            case LIST:
                return value instanceof List;
            case MAP:
                return value instanceof Map;
            default:
                throw new AssertionError(this);
        }
    }

    @Override
    public String toString()
    {
        return id;
    }
}
