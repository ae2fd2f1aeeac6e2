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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A loaded, validated template.  Instances are immutable and owned by the {@link TemplateRegistry};
 *  a reload replaces them wholesale rather than mutating them. */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public class FaultTemplate
{
    private final String templateId;
    private final BackendKind backend;
    private final List<ParameterSpec> parameters;
    private final String renderPath;
    private final String definition;
    private final boolean composable;
    private final Optional<String> description;
    private final Optional<String> executor;

    public FaultTemplate(String templateId, BackendKind backend, List<ParameterSpec> parameters,
        String renderPath, String definition, boolean composable, Optional<String> description,
        Optional<String> executor)
    {
        this.templateId = Objects.requireNonNull(templateId);
        this.backend = Objects.requireNonNull(backend);
        this.parameters = List.copyOf(parameters);
        this.renderPath = Objects.requireNonNull(renderPath);
        this.definition = Objects.requireNonNull(definition);
        this.composable = composable;
        this.description = description;
        this.executor = executor;
    }

    @JsonProperty("templateID")
    public String getTemplateId()
    {
        return templateId;
    }

    public BackendKind getBackend()
    {
        return backend;
    }

    public List<ParameterSpec> getParameters()
    {
        return parameters;
    }

    @JsonIgnore
    public Optional<ParameterSpec> getParameter(String name)
    {
        return parameters.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    @JsonProperty("path")
    public String getRenderPath()
    {
        return renderPath;
    }

    /** The rendering definition read from the template source when this template was loaded */
    @JsonIgnore
    public String getDefinition()
    {
        return definition;
    }

    /** Composable templates may target selectors that overlap other live faults */
    public boolean isComposable()
    {
        return composable;
    }

    public Optional<String> getDescription()
    {
        return description;
    }

    /** Name of the custom executor; only present for {@link BackendKind#CUSTOM} templates */
    public Optional<String> getExecutor()
    {
        return executor;
    }

    @Override
    public String toString()
    {
        return "FaultTemplate{" + templateId + " (" + backend + ")}";
    }
}
