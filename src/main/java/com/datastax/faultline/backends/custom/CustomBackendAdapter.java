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
package com.datastax.faultline.backends.custom;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

import com.datastax.faultline.backends.Artifact;
import com.datastax.faultline.backends.BackendAdapter;
import com.datastax.faultline.backends.BackendHandle;
import com.datastax.faultline.backends.BackendStatus;
import com.datastax.faultline.backends.RevertOutcome;
import com.datastax.faultline.exceptions.ApplyException;
import com.datastax.faultline.exceptions.FaultEngineException;
import com.datastax.faultline.exceptions.RevertException;
import com.datastax.faultline.exceptions.UnsupportedBackendException;
import com.datastax.faultline.rendering.RenderScope;
import com.datastax.faultline.rendering.TemplateRenderer;
import com.datastax.faultline.requests.ValidatedRequest;
import com.datastax.faultline.templates.BackendKind;
import com.datastax.faultline.util.Exceptions;
import com.datastax.faultline.util.ScopedLogger;

/** Hands rendered definitions to the {@link CustomFaultExecutor} a template names */
public class CustomBackendAdapter implements BackendAdapter
{
    private static final ScopedLogger logger = ScopedLogger.getLogger(CustomBackendAdapter.class);

    static final String EXECUTOR = "executor";

    private final TemplateRenderer renderer;
    private final Map<String, CustomFaultExecutor> executors;

    public CustomBackendAdapter(TemplateRenderer renderer, Collection<CustomFaultExecutor> executors)
    {
        this.renderer = renderer;
        this.executors = executors.stream().collect(Collectors.toMap(
            executor -> executor.name().toLowerCase(Locale.ROOT),
            Function.identity(),
            (a, b) -> {
                throw new IllegalArgumentException("Two custom executors are named " + a.name());
            },
            TreeMap::new));
        logger.info("Custom fault executors: {}", this.executors.keySet());
    }

    /** Use every executor registered with {@link ServiceLoader} */
    public static CustomBackendAdapter withDiscoveredExecutors(TemplateRenderer renderer)
    {
        return new CustomBackendAdapter(renderer,
            StreamSupport.stream(ServiceLoader.load(CustomFaultExecutor.class).spliterator(), false)
                .collect(Collectors.toList()));
    }

    @Override
    public BackendKind kind()
    {
        return BackendKind.CUSTOM;
    }

    private Optional<CustomFaultExecutor> executor(String name)
    {
        return Optional.ofNullable(executors.get(name.toLowerCase(Locale.ROOT)));
    }

    private CustomFaultExecutor requireExecutor(Optional<String> name)
    {
        final var executorName = name.orElseThrow(() -> new UnsupportedBackendException(
            "Custom fault does not name an executor"));
        return executor(executorName).orElseThrow(() -> new UnsupportedBackendException(
            String.format("No custom executor named '%s' is registered", executorName)));
    }

    @Override
    public Artifact render(ValidatedRequest request)
    {
        final var template = request.template();
        final var executorName = template.getExecutor().orElseThrow(() -> new UnsupportedBackendException(
            String.format("Template '%s' does not name a custom executor", template.getTemplateId())));
        final var content = renderer.render(template.getRenderPath(), template.getDefinition(),
            RenderScope.of(request));
        return new Artifact(BackendKind.CUSTOM, content, Optional.empty(), Map.of(EXECUTOR, executorName));
    }

    @Override
    public BackendHandle apply(Artifact artifact)
    {
        final var executor = requireExecutor(artifact.attribute(EXECUTOR));
        return logger.withScopedInfo("Injecting with custom executor {}", executor.name()).get(() -> {
            final String token;
            try
            {
                token = executor.inject(artifact.getContent());
            }
            catch (FaultEngineException e)
            {
                throw e;
            }
            catch (RuntimeException e)
            {
                throw ApplyException.rejected(String.format("Custom executor '%s' failed: %s", executor.name(),
                    Exceptions.rootMessage(e)), e);
            }
            if (token == null || token.isBlank())
            {
                throw ApplyException.rejected(String.format("Custom executor '%s' returned no token",
                    executor.name()));
            }
            return new BackendHandle(BackendKind.CUSTOM, token, Map.of(EXECUTOR, executor.name()));
        });
    }

    @Override
    public RevertOutcome revert(BackendHandle handle)
    {
        final var executor = executor(handle.attribute(EXECUTOR).orElse(""));
        if (executor.isEmpty())
        {
            logger.warn("Cannot revert {}: custom executor '{}' is not registered", handle,
                handle.attribute(EXECUTOR).orElse("<none>"));
            return RevertOutcome.UNSUPPORTED;
        }
        return logger.withScopedInfo("Removing {} with custom executor {}", handle, executor.get().name())
            .get(() -> {
                try
                {
                    return executor.get().remove(handle.getToken()) ?
                        RevertOutcome.REVERTED :
                        RevertOutcome.ALREADY_GONE;
                }
                catch (FaultEngineException e)
                {
                    throw e;
                }
                catch (RuntimeException e)
                {
                    throw new RevertException(String.format("Custom executor '%s' failed: %s",
                        executor.get().name(), Exceptions.rootMessage(e)), false, e);
                }
            });
    }

    @Override
    public BackendStatus status(BackendHandle handle)
    {
        final var executor = executor(handle.attribute(EXECUTOR).orElse(""));
        if (executor.isEmpty())
        {
            return BackendStatus.UNKNOWN;
        }
        try
        {
            final var status = executor.get().status(handle.getToken());
            return status != null ? status : BackendStatus.UNKNOWN;
        }
        catch (RuntimeException e)
        {
            logger.warn("Custom executor '{}' could not report status of {}: {}", executor.get().name(), handle,
                Exceptions.rootMessage(e));
            return BackendStatus.UNKNOWN;
        }
    }
}
