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
package com.datastax.faultline.backends.chaos_mesh;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;

import com.datastax.faultline.backends.Artifact;
import com.datastax.faultline.backends.BackendAdapter;
import com.datastax.faultline.backends.BackendHandle;
import com.datastax.faultline.backends.BackendStatus;
import com.datastax.faultline.backends.RevertOutcome;
import com.datastax.faultline.backends.kubernetes.KubeCommandResult;
import com.datastax.faultline.backends.kubernetes.KubeControl;
import com.datastax.faultline.exceptions.ApplyException;
import com.datastax.faultline.exceptions.BackendTimeoutException;
import com.datastax.faultline.exceptions.RenderException;
import com.datastax.faultline.exceptions.RevertException;
import com.datastax.faultline.rendering.RenderScope;
import com.datastax.faultline.rendering.TemplateRenderer;
import com.datastax.faultline.requests.TargetSelector;
import com.datastax.faultline.requests.ValidatedRequest;
import com.datastax.faultline.templates.BackendKind;
import com.datastax.faultline.util.Duration;
import com.datastax.faultline.util.Exceptions;
import com.datastax.faultline.util.JacksonUtils;
import com.datastax.faultline.util.ScopedLogger;

/** Injects faults by applying Chaos Mesh custom resources with kubectl, and reverts them by deleting the
 *  resource (Chaos Mesh's finalizers restore the target when the resource goes away).
 *
 *  <p>The handle of an applied manifest is known before applying it: it is the manifest's
 *  <code>apiVersion</code>, <code>kind</code>, <code>metadata.namespace</code> and <code>metadata.name</code>. */
public class ChaosMeshBackendAdapter implements BackendAdapter
{
    private static final ScopedLogger logger = ScopedLogger.getLogger(ChaosMeshBackendAdapter.class);

    static final String API_VERSION = "apiVersion";
    static final String KIND = "kind";
    static final String NAME = "name";
    static final String NAMESPACE = "namespace";

    /** kubectl failures matching these are the cluster being unreachable or overloaded, not a verdict */
    private static final List<Pattern> TRANSIENT_ERRORS = List.of(
        Pattern.compile("connection refused", Pattern.CASE_INSENSITIVE),
        Pattern.compile("unable to connect to the server", Pattern.CASE_INSENSITIVE),
        Pattern.compile("i/o timeout", Pattern.CASE_INSENSITIVE),
        Pattern.compile("TLS handshake timeout", Pattern.CASE_INSENSITIVE),
        Pattern.compile("ServiceUnavailable|service unavailable", Pattern.CASE_INSENSITIVE),
        Pattern.compile("TooManyRequests|too many requests", Pattern.CASE_INSENSITIVE),
        Pattern.compile("etcdserver: request timed out", Pattern.CASE_INSENSITIVE),
        Pattern.compile("the object has been modified", Pattern.CASE_INSENSITIVE));

    private final TemplateRenderer renderer;
    private final KubeControl kubeControl;
    private final Duration commandTimeout;

    public ChaosMeshBackendAdapter(TemplateRenderer renderer, KubeControl kubeControl, Duration commandTimeout)
    {
        this.renderer = renderer;
        this.kubeControl = kubeControl;
        this.commandTimeout = commandTimeout;
    }

    @Override
    public BackendKind kind()
    {
        return BackendKind.CHAOS_MESH;
    }

    @Override
    public Artifact render(ValidatedRequest request)
    {
        final var template = request.template();
        final var content = renderer.render(template.getRenderPath(), template.getDefinition(),
            RenderScope.of(request));

        final JsonNode manifest;
        try
        {
            manifest = JacksonUtils.getYamlObjectMapper().reader()
                .with(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                .readTree(content);
        }
        catch (IOException e)
        {
            throw new RenderException(String.format("'%s' did not render to valid YAML: %s",
                template.getRenderPath(), e.getMessage()), e);
        }

        final List<String> missing = new ArrayList<>();
        final var apiVersion = requiredText(manifest, "/apiVersion", missing);
        final var kind = requiredText(manifest, "/kind", missing);
        final var name = requiredText(manifest, "/metadata/name", missing);
        if (!missing.isEmpty())
        {
            throw new RenderException(String.format("Manifest rendered from '%s' is missing %s",
                template.getRenderPath(), String.join(", ", missing)));
        }
        final var namespace = request.request().namespace();
        checkMatchesRequest(template.getRenderPath(), manifest, request);

        return new Artifact(BackendKind.CHAOS_MESH, content,
            Optional.of(handleFor(apiVersion, kind, namespace, name)));
    }

    /** The manifest must act on what the request names, since conflicts and reservations are decided from
     *  the request */
    private static void checkMatchesRequest(String renderPath, JsonNode manifest, ValidatedRequest validated)
    {
        final var request = validated.request();
        final List<String> mismatches = new ArrayList<>();

        final var name = manifest.at("/metadata/name").textValue();
        if (!request.name().equals(name))
        {
            mismatches.add(String.format("metadata.name is '%s', not '%s'", name, request.name()));
        }

        final var namespace = manifest.at("/metadata/namespace");
        if (!namespace.isMissingNode() && !request.namespace().equals(namespace.textValue()))
        {
            mismatches.add(String.format("metadata.namespace is '%s', not '%s'",
                namespace.asText(), request.namespace()));
        }

        final var selector = manifest.at("/spec/selector");
        final JsonNode expectedSelector = JacksonUtils.getObjectMapper().valueToTree(
            request.getSpec().selector().map(TargetSelector::toMap).orElse(Map.of()));
        if (!selector.isMissingNode() && !selector.equals(expectedSelector))
        {
            mismatches.add(String.format("spec.selector is %s, not %s", selector, expectedSelector));
        }

        if (!mismatches.isEmpty())
        {
            throw new RenderException(String.format("Manifest rendered from '%s' does not match the request: %s",
                renderPath, String.join("; ", mismatches)));
        }
    }

    private static String requiredText(JsonNode manifest, String pointer, List<String> missing)
    {
        final var value = manifest == null ? null : manifest.at(pointer).textValue();
        if (value == null || value.isBlank())
        {
            missing.add(pointer.substring(1).replace('/', '.'));
        }
        return value;
    }

    static BackendHandle handleFor(String apiVersion, String kind, String namespace, String name)
    {
        return new BackendHandle(BackendKind.CHAOS_MESH,
            String.format("%s/%s/%s", namespace, resourceType(apiVersion, kind), name),
            Map.of(API_VERSION, apiVersion, KIND, kind, NAMESPACE, namespace, NAME, name));
    }

    /** <code>kind.group</code>, which kubectl resolves unambiguously even when several groups define the kind */
    private static String resourceType(String apiVersion, String kind)
    {
        final var slash = apiVersion.indexOf('/');
        final var lowerKind = kind.toLowerCase();
        return slash < 0 ? lowerKind : lowerKind + "." + apiVersion.substring(0, slash);
    }

    private static String resource(BackendHandle handle)
    {
        return resourceType(attribute(handle, API_VERSION), attribute(handle, KIND)) + "/" +
            attribute(handle, NAME);
    }

    private static Optional<String> namespace(BackendHandle handle)
    {
        return handle.attribute(NAMESPACE);
    }

    private static String attribute(BackendHandle handle, String name)
    {
        return handle.attribute(name).orElseThrow(() -> new IllegalArgumentException(
            String.format("Handle %s has no '%s' attribute", handle, name)));
    }

    static boolean isTransient(String stderr)
    {
        return TRANSIENT_ERRORS.stream().anyMatch(pattern -> pattern.matcher(stderr).find());
    }

    private static String describeFailure(KubeCommandResult result)
    {
        final var stderr = result.stderr().strip();
        return String.format("'%s' exited with %d%s", result.command(), result.exitCode(),
            stderr.isEmpty() ? "" : ": " + stderr);
    }

    @Override
    public BackendHandle apply(Artifact artifact)
    {
        final var handle = artifact.getExpectedHandle().orElseThrow(() -> ApplyException.rejected(
            "Chaos Mesh artifact does not identify the resource it creates"));

        return logger.withScopedInfo("Applying {}", handle).get(() -> {
            final KubeCommandResult result;
            try
            {
                result = kubeControl.execute(namespace(handle), List.of("apply", "-f", "-"),
                    Optional.of(artifact.getContent()), commandTimeout);
            }
            catch (UncheckedIOException e)
            {
                throw ApplyException.rejected("Could not run kubectl: " + Exceptions.rootMessage(e), e);
            }

            if (result.timedOut())
            {
                throw new BackendTimeoutException("apply of " + handle, commandTimeout, Optional.of(handle));
            }
            if (!result.succeeded())
            {
                final var message = describeFailure(result);
                throw isTransient(result.stderr()) ?
                    ApplyException.transientFailure(message) :
                    ApplyException.rejected(message);
            }
            return handle;
        });
    }

    @Override
    public RevertOutcome revert(BackendHandle handle)
    {
        return logger.withScopedInfo("Reverting {}", handle).get(() -> {
            final KubeCommandResult result;
            try
            {
                result = kubeControl.execute(namespace(handle),
                    List.of("delete", resource(handle), "--ignore-not-found"), Optional.empty(), commandTimeout);
            }
            catch (UncheckedIOException e)
            {
                throw new RevertException("Could not run kubectl: " + Exceptions.rootMessage(e), false, e);
            }

            if (result.timedOut())
            {
                throw new BackendTimeoutException("revert of " + handle, commandTimeout, Optional.of(handle));
            }
            if (!result.succeeded())
            {
                throw new RevertException(describeFailure(result), isTransient(result.stderr()));
            }
            // --ignore-not-found prints nothing when there was nothing to delete
            return result.stdout().isBlank() ? RevertOutcome.ALREADY_GONE : RevertOutcome.REVERTED;
        });
    }

    @Override
    public BackendStatus status(BackendHandle handle)
    {
        final KubeCommandResult result;
        try
        {
            result = kubeControl.execute(namespace(handle),
                List.of("get", resource(handle), "-o", "json", "--ignore-not-found"), Optional.empty(),
                commandTimeout);
        }
        catch (UncheckedIOException e)
        {
            logger.warn("Could not run kubectl to get status of {}: {}", handle, Exceptions.rootMessage(e));
            return BackendStatus.UNKNOWN;
        }

        if (!result.succeeded())
        {
            logger.warn("Could not get status of {}: {}", handle,
                result.timedOut() ? "timed out" : describeFailure(result));
            return BackendStatus.UNKNOWN;
        }
        if (result.stdout().isBlank())
        {
            return BackendStatus.GONE;
        }

        try
        {
            final var resource = JacksonUtils.getObjectMapper().readTree(result.stdout());
            final var desiredPhase = resource.at("/status/experiment/desiredPhase").asText("");
            return desiredPhase.equals("Stop") ? BackendStatus.COMPLETED : BackendStatus.RUNNING;
        }
        catch (IOException e)
        {
            logger.warn("Could not parse status of {}: {}", handle, e.getMessage());
            return BackendStatus.UNKNOWN;
        }
    }
}
