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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import com.datastax.faultline.exceptions.InvalidTemplateException;
import com.datastax.faultline.util.Exceptions;
import com.datastax.faultline.util.JacksonUtils;

/** Reads templates from a directory laid out as:
 *
 * <pre>
 *   templates/
 *     index.yaml
 *     stress/cpu-throttle.yaml.mustache
 *     network/delay.yaml.mustache
 * </pre>
 *
 * Definition paths in the index are resolved against the directory and may not escape it. */
public class FileTemplateSource implements TemplateSource
{
    private final Path templatesDir;
    private final String indexFile;

    public FileTemplateSource(Path templatesDir, String indexFile)
    {
        this.templatesDir = templatesDir.toAbsolutePath().normalize();
        this.indexFile = indexFile;
    }

    public FileTemplateSource(Path templatesDir)
    {
        this(templatesDir, "index.yaml");
    }

    @Override
    public String describe()
    {
        return templatesDir.resolve(indexFile).toString();
    }

    @Override
    public TemplateIndex readIndex()
    {
        final var indexPath = templatesDir.resolve(indexFile);
        if (!Files.isRegularFile(indexPath))
        {
            throw new InvalidTemplateException("index file " + indexPath + " does not exist", null);
        }
        try
        {
            final var index = JacksonUtils.getYamlObjectMapper().readValue(indexPath.toFile(), TemplateIndex.class);
            return index != null ? index : new TemplateIndex();
        }
        catch (IOException e)
        {
            throw new InvalidTemplateException("could not parse " + indexPath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> readDefinition(String path)
    {
        final var resolved = templatesDir.resolve(path).normalize();
        if (!resolved.startsWith(templatesDir) || !Files.isRegularFile(resolved))
        {
            return Optional.empty();
        }
        return Optional.of(Exceptions.getUncheckedIO(() -> Files.readString(resolved, StandardCharsets.UTF_8)));
    }
}
