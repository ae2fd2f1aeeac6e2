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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.datastax.faultline.util.JacksonUtils;

/** A {@link TemplateSource} held entirely in memory: an index written as YAML plus named definitions */
public class InMemoryTemplateSource implements TemplateSource
{
    private final String indexYaml;
    private final Map<String, String> definitions = new HashMap<>();

    public InMemoryTemplateSource(String indexYaml)
    {
        this.indexYaml = indexYaml;
    }

    public InMemoryTemplateSource withDefinition(String path, String definition)
    {
        definitions.put(path, definition);
        return this;
    }

    @Override
    public String describe()
    {
        return "in-memory";
    }

    @Override
    public TemplateIndex readIndex()
    {
        try
        {
            final var index = JacksonUtils.getYamlObjectMapper().readValue(indexYaml, TemplateIndex.class);
            return index != null ? index : new TemplateIndex();
        }
        catch (IOException e)
        {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public Optional<String> readDefinition(String path)
    {
        return Optional.ofNullable(definitions.get(path));
    }
}
