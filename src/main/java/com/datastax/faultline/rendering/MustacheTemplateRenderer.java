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

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheException;
import com.github.mustachejava.reflect.Guard;
import com.github.mustachejava.reflect.MissingWrapper;
import com.github.mustachejava.reflect.ReflectionObjectHandler;

import com.datastax.faultline.exceptions.RenderException;

/** Renders mustache definitions without HTML escaping, failing if any tag has no value */
public class MustacheTemplateRenderer implements TemplateRenderer
{
    private static class UnescapedMustacheFactory extends DefaultMustacheFactory
    {
        /** Manifests are YAML, not HTML */
        @Override
        public void encode(String value, Writer writer)
        {
            try
            {
                writer.write(value);
            }
            catch (IOException e)
            {
                throw new MustacheException("Failed to write value: " + value, e);
            }
        }
    }

    @Override
    public String render(String name, String definition, Map<String, Object> scope)
    {
        // Compiled mustaches are cached per factory and the missing-tag handler is per render,
        // so each render gets its own factory.
        final var mustacheFactory = new UnescapedMustacheFactory();
        final Set<String> missingTags = new TreeSet<>();

        mustacheFactory.setObjectHandler(new ReflectionObjectHandler() {
            @Override
            protected MissingWrapper createMissingWrapper(String tag, List<Guard> guards)
            {
                missingTags.add(tag);
                return super.createMissingWrapper(tag, guards);
            }
        });

        final StringWriter writer = new StringWriter(definition.length() * 2);
        try
        {
            final Mustache mustache = mustacheFactory.compile(new StringReader(definition), name);
            mustache.execute(writer, scope);
        }
        catch (MustacheException e)
        {
            throw new RenderException(String.format("Could not render '%s': %s", name, e.getMessage()), e);
        }

        if (!missingTags.isEmpty())
        {
            throw new RenderException(String.format("Could not render '%s'; no values were given for: %s",
                name, String.join(", ", missingTags)));
        }

        return writer.toString();
    }
}
