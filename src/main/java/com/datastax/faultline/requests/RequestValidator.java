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
package com.datastax.faultline.requests;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.datastax.faultline.exceptions.ValidationException;
import com.datastax.faultline.templates.FaultTemplate;
import com.datastax.faultline.util.Duration;

/** Checks a normalized {@link FaultRequest} against a template's parameter schema and the selector
 *  rules.  Every violation is collected before failing, so callers can fix a request in one go.
 *  Has no side effects. */
public class RequestValidator
{
    static final int MAX_SUBDOMAIN_LENGTH = 253;
    static final int MAX_LABEL_LENGTH = 63;

    private static final Pattern DNS_1123_LABEL = Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?");
    private static final Pattern DNS_1123_SUBDOMAIN =
        Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?(\\.[a-z0-9]([-a-z0-9]*[a-z0-9])?)*");
    private static final Pattern LABEL_NAME = Pattern.compile("([A-Za-z0-9][-A-Za-z0-9_.]*)?[A-Za-z0-9]");
    private static final Pattern LABEL_VALUE = Pattern.compile("(([A-Za-z0-9][-A-Za-z0-9_.]*)?[A-Za-z0-9])?");

    private final Duration maxTtl;

    public RequestValidator(Duration maxTtl)
    {
        this.maxTtl = maxTtl;
    }

    public Duration getMaxTtl()
    {
        return maxTtl;
    }

    public ValidatedRequest validate(FaultRequest request, FaultTemplate template)
    {
        final List<String> violations = new ArrayList<>();

        if (!template.getTemplateId().equals(request.getTemplateId()))
        {
            violations.add(String.format("templateID '%s' does not match template '%s'",
                request.getTemplateId(), template.getTemplateId()));
        }

        validateMetadata(request.getMetadata(), violations);
        final var parameters = validateParameters(request.getSpec().getParameters(), template, violations);
        validateSelector(request.getSpec(), violations);

        if (!violations.isEmpty())
        {
            throw new ValidationException(violations);
        }
        return ValidatedRequest.of(request, template, parameters);
    }

    private void validateMetadata(FaultMetadata metadata, List<String> violations)
    {
        metadata.getName().ifPresentOrElse(
            name -> {
                if (!isDnsSubdomain(name))
                {
                    violations.add(String.format("metadata.name '%s' must be a lower case RFC 1123 subdomain",
                        name));
                }
            },
            () -> violations.add("metadata.name is missing"));

        metadata.getNamespace().ifPresentOrElse(
            namespace -> {
                if (!isDnsLabel(namespace))
                {
                    violations.add(String.format("metadata.namespace '%s' must be a lower case RFC 1123 label",
                        namespace));
                }
            },
            () -> violations.add("metadata.namespace is missing"));

        validateTtl(metadata.getTtl().orElse(null), "metadata.ttl", violations);
    }

    /** Check a TTL on its own, as when renewing a fault */
    public void validateTtl(Duration ttl)
    {
        final List<String> violations = new ArrayList<>();
        validateTtl(ttl, "ttl", violations);
        if (!violations.isEmpty())
        {
            throw new ValidationException(violations);
        }
    }

    private void validateTtl(Duration ttl, String field, List<String> violations)
    {
        if (ttl == null)
        {
            return;
        }
        if (ttl.isZero())
        {
            violations.add(field + " must be positive");
        }
        else if (ttl.compareTo(maxTtl) > 0)
        {
            violations.add(String.format("%s %s exceeds the maximum of %s", field, ttl.toAbbrevString(),
                maxTtl.toAbbrevString()));
        }
    }

    private Map<String, Object> validateParameters(Map<String, Object> given, FaultTemplate template,
        List<String> violations)
    {
        final Map<String, Object> effective = new LinkedHashMap<>();

        for (var spec : template.getParameters())
        {
            final var name = spec.getName();
            if (given.containsKey(name))
            {
                final var value = given.get(name);
                if (!spec.getType().accepts(value))
                {
                    violations.add(String.format("spec.%s must be a %s, got %s", name, spec.getType(),
                        value == null ? "null" : "'" + value + "'"));
                }
                else
                {
                    effective.put(name, value);
                }
            }
            else if (spec.isRequired())
            {
                violations.add(String.format("spec.%s is required", name));
            }
            else
            {
                spec.getDefaultValue().ifPresent(value -> effective.put(name, value));
            }
        }

        given.keySet().stream()
            .filter(name -> template.getParameter(name).isEmpty())
            .sorted()
            .forEach(name -> violations.add(String.format("spec.%s is not a parameter of template '%s'",
                name, template.getTemplateId())));

        return Collections.unmodifiableMap(effective);
    }

    private void validateSelector(FaultSpec spec, List<String> violations)
    {
        final var selector = spec.getSelector();
        if (selector == null || selector.isEmpty())
        {
            violations.add("spec.selector must select at least one target");
            return;
        }

        selector.getPods().forEach((namespace, podNames) -> {
            if (!isDnsLabel(namespace))
            {
                violations.add(String.format("spec.selector.pods namespace '%s' is not a valid namespace",
                    namespace));
            }
            if (podNames.isEmpty())
            {
                violations.add(String.format("spec.selector.pods['%s'] must name at least one pod", namespace));
            }
            podNames.stream()
                .filter(pod -> pod == null || !isDnsSubdomain(pod))
                .forEach(pod -> violations.add(String.format("spec.selector.pods['%s'] '%s' is not a valid pod name",
                    namespace, pod)));
        });

        selector.getNamespaces().stream()
            .filter(namespace -> namespace == null || !isDnsLabel(namespace))
            .forEach(namespace -> violations.add(
                String.format("spec.selector.namespaces '%s' is not a valid namespace", namespace)));

        selector.getLabelSelectors().forEach((key, value) -> {
            if (!isLabelKey(key))
            {
                violations.add(String.format("spec.selector.labelSelectors key '%s' is not a valid label key", key));
            }
            if (value == null || value.length() > MAX_LABEL_LENGTH || !LABEL_VALUE.matcher(value).matches())
            {
                violations.add(String.format("spec.selector.labelSelectors['%s'] '%s' is not a valid label value",
                    key, value));
            }
        });
    }

    static boolean isDnsLabel(String value)
    {
        return value != null && value.length() <= MAX_LABEL_LENGTH && DNS_1123_LABEL.matcher(value).matches();
    }

    static boolean isDnsSubdomain(String value)
    {
        return value != null && value.length() <= MAX_SUBDOMAIN_LENGTH &&
            DNS_1123_SUBDOMAIN.matcher(value).matches();
    }

    static boolean isLabelKey(String key)
    {
        final var slash = key.indexOf('/');
        final var prefix = slash >= 0 ? key.substring(0, slash) : null;
        final var name = slash >= 0 ? key.substring(slash + 1) : key;
        return (prefix == null || isDnsSubdomain(prefix)) &&
            name.length() <= MAX_LABEL_LENGTH && LABEL_NAME.matcher(name).matches();
    }
}
