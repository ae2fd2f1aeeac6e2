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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableMap;

import com.datastax.faultline.exceptions.InvalidTemplateException;
import com.datastax.faultline.exceptions.NotFoundException;
import com.datastax.faultline.util.ScopedLogger;

/** Holds the current set of templates, keyed by template id.
 *
 *  <p>Readers always see one complete, validated set: {@link #reload} builds and validates a new
 *  mapping off to the side and then swaps a single reference.  A reload that fails validation
 *  leaves the previous mapping in place. */
public class TemplateRegistry
{
    private static final ScopedLogger logger = ScopedLogger.getLogger(TemplateRegistry.class);

    /** Names used in the rendering scope; they cannot be redeclared as parameters */
    public static final String SELECTOR_PARAMETER = "selector";

    private static final Pattern PARAMETER_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern TEMPLATE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._/-]*");

    private final AtomicReference<ImmutableMap<String, FaultTemplate>> templates =
        new AtomicReference<>(ImmutableMap.of());
    private volatile TemplateSource source;

    public TemplateRegistry(TemplateSource source)
    {
        this.source = source;
    }

    /** Create a registry and load it from <code>source</code>, failing if the source is invalid */
    public static TemplateRegistry loadFrom(TemplateSource source)
    {
        final var registry = new TemplateRegistry(source);
        registry.reload();
        return registry;
    }

    /** Read and validate every template in <code>source</code> without touching any registry */
    public static ImmutableMap<String, FaultTemplate> load(TemplateSource source)
    {
        return logger.withScopedInfo("Loading templates from {}", source.describe()).get(() -> {
            final var index = source.readIndex();
            final List<String> problems = new ArrayList<>();
            final Map<String, FaultTemplate> loaded = new LinkedHashMap<>();
            final var seenIds = new HashSet<String>();

            for (int i = 0; i < index.templates.size(); i++)
            {
                final var entry = index.templates.get(i);
                if (entry == null)
                {
                    problems.add(String.format("templates[%d]: empty entry", i));
                    continue;
                }
                final var where = entry.templateId != null ?
                    String.format("template '%s'", entry.templateId) :
                    String.format("templates[%d]", i);

                final var entryProblems = new ArrayList<String>();
                if (entry.templateId == null || entry.templateId.isBlank())
                {
                    entryProblems.add("templateID is missing");
                }
                else if (!TEMPLATE_ID.matcher(entry.templateId).matches())
                {
                    entryProblems.add("templateID must be alphanumeric with '.', '_', '-' or '/' separators");
                }
                else if (!seenIds.add(entry.templateId))
                {
                    entryProblems.add("templateID is a duplicate");
                }

                final var backend = validateBackend(entry, entryProblems);
                final var definition = validateDefinition(source, entry, entryProblems);
                final var parameters = validateParameters(entry.parameters, entryProblems);

                if (entryProblems.isEmpty())
                {
                    loaded.put(entry.templateId, new FaultTemplate(entry.templateId, backend.get(), parameters,
                        entry.path, definition.get(), entry.composable,
                        Optional.ofNullable(entry.description), Optional.ofNullable(entry.executor)));
                }
                else
                {
                    entryProblems.forEach(problem -> problems.add(where + ": " + problem));
                }
            }

            if (!problems.isEmpty())
            {
                throw new InvalidTemplateException(problems);
            }
            return ImmutableMap.copyOf(loaded);
        });
    }

    private static Optional<BackendKind> validateBackend(TemplateIndex.Entry entry, List<String> problems)
    {
        if (entry.backend == null)
        {
            problems.add("backend is missing");
            return Optional.empty();
        }
        final var backend = BackendKind.fromId(entry.backend);
        if (backend.isEmpty())
        {
            problems.add(String.format("unknown backend '%s'", entry.backend));
        }
        else if (backend.get() == BackendKind.CUSTOM && (entry.executor == null || entry.executor.isBlank()))
        {
            problems.add("custom templates must name an executor");
        }
        return backend;
    }

    private static Optional<String> validateDefinition(TemplateSource source, TemplateIndex.Entry entry,
        List<String> problems)
    {
        if (entry.path == null || entry.path.isBlank())
        {
            problems.add("path is missing");
            return Optional.empty();
        }
        final var definition = source.readDefinition(entry.path);
        if (definition.isEmpty())
        {
            problems.add(String.format("rendering definition '%s' not found", entry.path));
        }
        return definition;
    }

    private static List<ParameterSpec> validateParameters(List<TemplateIndex.Parameter> declared,
        List<String> problems)
    {
        final List<ParameterSpec> parameters = new ArrayList<>();
        final var names = new HashSet<String>();
        if (declared == null)
        {
            return parameters;
        }
        for (var parameter : declared)
        {
            if (parameter == null || parameter.name == null)
            {
                problems.add("parameter without a name");
                continue;
            }
            final var name = parameter.name;
            if (!PARAMETER_NAME.matcher(name).matches())
            {
                problems.add(String.format("parameter '%s' is not a valid identifier", name));
            }
            if (name.equals(SELECTOR_PARAMETER))
            {
                problems.add(String.format("parameter name '%s' is reserved", name));
            }
            if (!names.add(name))
            {
                problems.add(String.format("parameter '%s' is declared twice", name));
            }
            final var type = parameter.type == null ?
                Optional.of(ParameterType.STRING) :
                ParameterType.fromId(parameter.type);
            if (type.isEmpty())
            {
                problems.add(String.format("parameter '%s' has unknown type '%s'", name, parameter.type));
                continue;
            }
            if (parameter.defaultValue != null && !type.get().accepts(parameter.defaultValue))
            {
                problems.add(String.format("default for parameter '%s' is not a %s", name, type.get()));
            }
            if (parameter.required && parameter.defaultValue != null)
            {
                problems.add(String.format("required parameter '%s' cannot have a default", name));
            }
            parameters.add(new ParameterSpec(name, type.get(), parameter.required,
                Optional.ofNullable(parameter.defaultValue), Optional.ofNullable(parameter.description)));
        }
        return parameters;
    }

    public ImmutableMap<String, FaultTemplate> reload()
    {
        return reload(source);
    }

    /** Load from <code>newSource</code> and, if it is valid, make it the current source and mapping */
    public synchronized ImmutableMap<String, FaultTemplate> reload(TemplateSource newSource)
    {
        final var loaded = load(newSource);
        source = newSource;
        templates.set(loaded);
        logger.info("Template registry now holds {} templates: {}", loaded.size(), loaded.keySet());
        return loaded;
    }

    public FaultTemplate get(String templateId)
    {
        return find(templateId).orElseThrow(() -> new NotFoundException("Template", templateId));
    }

    public Optional<FaultTemplate> find(String templateId)
    {
        return Optional.ofNullable(templateId).map(id -> templates.get().get(id));
    }

    /** A consistent snapshot of every template */
    public ImmutableMap<String, FaultTemplate> templates()
    {
        return templates.get();
    }
}
