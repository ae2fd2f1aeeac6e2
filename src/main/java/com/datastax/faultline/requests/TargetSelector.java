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
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Which workloads a fault targets, using Chaos Mesh's selector vocabulary:
 *
 * <ul>
 *   <li><code>pods</code>: explicit pod names, keyed by namespace;
 *   <li><code>namespaces</code>: every pod in these namespaces, narrowed by...
 *   <li><code>labelSelectors</code>: labels a pod must carry (all of them).
 * </ul>
 *
 * A namespace listed in <code>namespaces</code> is selected broadly (by labels) even if it also has
 * explicit pods.  {@link #resolve} turns a labels-only selector into one that names its namespace. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class TargetSelector
{
    private final Map<String, List<String>> pods;
    private final List<String> namespaces;
    private final Map<String, String> labelSelectors;

    @JsonCreator
    public TargetSelector(
        @JsonProperty("pods") Map<String, List<String>> pods,
        @JsonProperty("namespaces") List<String> namespaces,
        @JsonProperty("labelSelectors") Map<String, String> labelSelectors)
    {
        final var sortedPods = new TreeMap<String, List<String>>();
        if (pods != null)
        {
            pods.forEach((namespace, names) -> sortedPods.put(namespace,
                names == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(names))));
        }
        this.pods = Collections.unmodifiableMap(sortedPods);
        this.namespaces = namespaces == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(namespaces));
        this.labelSelectors = labelSelectors == null ? Map.of() :
            Collections.unmodifiableMap(new TreeMap<>(labelSelectors));
    }

    public static TargetSelector pods(String namespace, String... podNames)
    {
        return new TargetSelector(Map.of(namespace, List.of(podNames)), null, null);
    }

    public static TargetSelector namespace(String namespace, Map<String, String> labels)
    {
        return new TargetSelector(null, List.of(namespace), labels);
    }

    public static TargetSelector labels(Map<String, String> labels)
    {
        return new TargetSelector(null, null, labels);
    }

    @JsonProperty
    public Map<String, List<String>> getPods()
    {
        return pods;
    }

    @JsonProperty
    public List<String> getNamespaces()
    {
        return namespaces;
    }

    @JsonProperty
    public Map<String, String> getLabelSelectors()
    {
        return labelSelectors;
    }

    @JsonIgnore
    public boolean isEmpty()
    {
        return pods.values().stream().allMatch(List::isEmpty) && namespaces.isEmpty() && labelSelectors.isEmpty();
    }

    /** If nothing names a namespace, select <code>defaultNamespace</code> broadly */
    public TargetSelector resolve(String defaultNamespace)
    {
        if (pods.isEmpty() && namespaces.isEmpty())
        {
            return new TargetSelector(pods, List.of(defaultNamespace), labelSelectors);
        }
        return this;
    }

    /** The namespaces this selector touches; these are the units of scope reservation */
    @JsonIgnore
    public Set<String> scope()
    {
        final var scope = new TreeSet<>(pods.keySet());
        scope.addAll(namespaces);
        return scope;
    }

    /** True if some pod could be selected by both selectors.  Pods named explicitly in both overlap when
     *  the names intersect; a broad selection overlaps anything in the same namespace unless both sides
     *  select by labels that contradict each other.  We cannot see pod labels, so an explicit pod list
     *  against a broad selection is assumed to overlap. */
    public boolean overlaps(TargetSelector other)
    {
        for (var namespace : scope())
        {
            if (!other.scope().contains(namespace))
            {
                continue;
            }
            final boolean thisBroad = namespaces.contains(namespace);
            final boolean otherBroad = other.namespaces.contains(namespace);

            if (!thisBroad && !otherBroad)
            {
                if (!Collections.disjoint(pods.get(namespace), other.pods.get(namespace)))
                {
                    return true;
                }
            }
            else if (thisBroad && otherBroad)
            {
                if (!labelsContradict(labelSelectors, other.labelSelectors))
                {
                    return true;
                }
            }
            else
            {
                return true;
            }
        }
        return false;
    }

    private static boolean labelsContradict(Map<String, String> a, Map<String, String> b)
    {
        return a.entrySet().stream()
            .anyMatch(entry -> b.containsKey(entry.getKey()) && !b.get(entry.getKey()).equals(entry.getValue()));
    }

    /** Plain maps and lists, for rendering */
    public Map<String, Object> toMap()
    {
        final var map = new LinkedHashMap<String, Object>();
        if (!pods.isEmpty())
        {
            map.put("pods", pods);
        }
        if (!namespaces.isEmpty())
        {
            map.put("namespaces", namespaces);
        }
        if (!labelSelectors.isEmpty())
        {
            map.put("labelSelectors", labelSelectors);
        }
        return map;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (o == null || getClass() != o.getClass())
        {
            return false;
        }
        TargetSelector that = (TargetSelector) o;
        return pods.equals(that.pods) && namespaces.equals(that.namespaces) &&
            labelSelectors.equals(that.labelSelectors);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(pods, namespaces, labelSelectors);
    }

    @Override
    public String toString()
    {
        return "TargetSelector" + toMap();
    }
}
