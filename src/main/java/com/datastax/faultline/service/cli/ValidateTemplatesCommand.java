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
package com.datastax.faultline.service.cli;

import java.io.PrintStream;

import com.google.common.annotations.VisibleForTesting;
import io.dropwizard.cli.ConfiguredCommand;
import io.dropwizard.setup.Bootstrap;
import net.sourceforge.argparse4j.inf.Namespace;

import com.datastax.faultline.exceptions.InvalidTemplateException;
import com.datastax.faultline.service.FaultlineConfiguration;
import com.datastax.faultline.templates.FileTemplateSource;
import com.datastax.faultline.templates.TemplateRegistry;

/** Loads the configured templates exactly as the server would, reports every problem found, and exits */
public class ValidateTemplatesCommand extends ConfiguredCommand<FaultlineConfiguration>
{
    private final PrintStream out;
    private final PrintStream err;

    public ValidateTemplatesCommand()
    {
        this(System.out, System.err);
    }

    @VisibleForTesting
    ValidateTemplatesCommand(PrintStream out, PrintStream err)
    {
        super("validate-templates", "Validate the configured fault templates and exit");
        this.out = out;
        this.err = err;
    }

    @Override
    protected void run(Bootstrap<FaultlineConfiguration> bootstrap, Namespace namespace,
        FaultlineConfiguration configuration)
    {
        final var source = new FileTemplateSource(configuration.getTemplatesDir(), configuration.getTemplateIndex());
        try
        {
            final var templates = TemplateRegistry.load(source);
            out.printf("%s: %d valid templates%n", source.describe(), templates.size());
            templates.keySet().forEach(templateId -> out.println("  " + templateId));
        }
        catch (InvalidTemplateException e)
        {
            err.printf("%s: %d problems%n", source.describe(), e.getProblems().size());
            e.getProblems().forEach(problem -> err.println("  " + problem));
            throw e;
        }
    }
}
