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
package com.datastax.faultline.service;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;

import io.dropwizard.servlets.tasks.Task;

import com.datastax.faultline.engine.OrchestrationEngine;
import com.datastax.faultline.exceptions.InvalidTemplateException;

/** Admin task: <code>POST /tasks/reload-templates</code> */
class ReloadTemplatesTask extends Task
{
    private final OrchestrationEngine engine;

    ReloadTemplatesTask(OrchestrationEngine engine)
    {
        super("reload-templates");
        this.engine = engine;
    }

    @Override
    public void execute(Map<String, List<String>> parameters, PrintWriter output)
    {
        try
        {
            final var templates = engine.reloadTemplates();
            output.printf("Loaded %d templates: %s%n", templates.size(), String.join(", ", templates.keySet()));
        }
        catch (InvalidTemplateException e)
        {
            output.println("Templates were not reloaded; the previous templates remain in use.");
            e.getProblems().forEach(problem -> output.println("  " + problem));
        }
    }
}
