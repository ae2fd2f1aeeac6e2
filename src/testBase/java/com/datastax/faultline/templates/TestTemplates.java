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

/** Templates shared by tests: a Chaos Mesh stress template, a composable network template, a chaosd
 *  template and a custom one */
public final class TestTemplates
{
    public static final String CPU_THROTTLE = "stress/cpu-throttle";
    public static final String NETWORK_DELAY = "network/delay";
    public static final String HOST_CPU_BURN = "host/cpu-burn";
    public static final String CUSTOM_PARTITION = "custom/partition";

    public static final String INDEX = String.join("\n",
        "templates:",
        "  - templateID: " + CPU_THROTTLE,
        "    backend: chaos-mesh",
        "    path: stress/cpu-throttle.yaml.mustache",
        "    parameters:",
        "      - {name: load, type: integer, required: true}",
        "      - {name: workers, type: integer, default: 1}",
        "  - templateID: " + NETWORK_DELAY,
        "    backend: chaos-mesh",
        "    path: network/delay.yaml.mustache",
        "    composable: true",
        "    parameters:",
        "      - {name: latency, type: string, required: true}",
        "  - templateID: " + HOST_CPU_BURN,
        "    backend: chaosd",
        "    path: host/cpu-burn.json.mustache",
        "    parameters:",
        "      - {name: load, type: integer, required: true}",
        "  - templateID: " + CUSTOM_PARTITION,
        "    backend: custom",
        "    executor: recording",
        "    path: custom/partition.mustache",
        "    parameters:",
        "      - {name: peers, type: list, default: []}",
        "");

    public static final String CPU_THROTTLE_DEFINITION = String.join("\n",
        "apiVersion: chaos-mesh.org/v1alpha1",
        "kind: StressChaos",
        "metadata:",
        "  name: {{metadata.name}}",
        "  namespace: {{metadata.namespace}}",
        "spec:",
        "  mode: all",
        "  selector: {{spec.selector}}",
        "  stressors:",
        "    cpu:",
        "      workers: {{spec.workers}}",
        "      load: {{spec.load}}",
        "{{#metadata.hasTtl}}",
        "  duration: {{metadata.ttl}}",
        "{{/metadata.hasTtl}}",
        "");

    public static final String NETWORK_DELAY_DEFINITION = String.join("\n",
        "apiVersion: chaos-mesh.org/v1alpha1",
        "kind: NetworkChaos",
        "metadata:",
        "  name: {{metadata.name}}",
        "  namespace: {{metadata.namespace}}",
        "spec:",
        "  action: delay",
        "  mode: all",
        "  selector: {{spec.selector}}",
        "  delay:",
        "    latency: {{spec.latency}}",
        "");

    private TestTemplates()
    {
    }

    public static InMemoryTemplateSource source()
    {
        return new InMemoryTemplateSource(INDEX)
            .withDefinition("stress/cpu-throttle.yaml.mustache", CPU_THROTTLE_DEFINITION)
            .withDefinition("network/delay.yaml.mustache", NETWORK_DELAY_DEFINITION)
            .withDefinition("host/cpu-burn.json.mustache", "{\"load\": {{spec.load}}}")
            .withDefinition("custom/partition.mustache", "partition {{metadata.name}} from {{spec.peers}}");
    }

    public static TemplateRegistry registry()
    {
        return TemplateRegistry.loadFrom(source());
    }
}
