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

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.datastax.faultline.exceptions.InvalidTemplateException;
import com.datastax.faultline.exceptions.NotFoundException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TemplateRegistryTest
{
    private static InMemoryTemplateSource sourceWithIds(String... templateIds)
    {
        final var index = new StringBuilder("templates:\n");
        for (var templateId : templateIds)
        {
            index.append("  - templateID: ").append(templateId).append('\n')
                .append("    backend: chaos-mesh\n")
                .append("    path: fault.mustache\n");
        }
        return new InMemoryTemplateSource(index.toString()).withDefinition("fault.mustache", "kind: X");
    }

    @Test
    public void loads_every_template_with_its_parameters()
    {
        final var registry = TestTemplates.registry();

        assertThat(registry.templates()).containsOnlyKeys(
            TestTemplates.CPU_THROTTLE, TestTemplates.NETWORK_DELAY,
            TestTemplates.HOST_CPU_BURN, TestTemplates.CUSTOM_PARTITION);

        final var cpuThrottle = registry.get(TestTemplates.CPU_THROTTLE);
        assertThat(cpuThrottle.getBackend()).isEqualTo(BackendKind.CHAOS_MESH);
        assertThat(cpuThrottle.isComposable()).isFalse();
        assertThat(cpuThrottle.getParameter("load")).hasValueSatisfying(load -> {
            assertThat(load.getType()).isEqualTo(ParameterType.INTEGER);
            assertThat(load.isRequired()).isTrue();
        });
        assertThat(cpuThrottle.getParameter("workers")).hasValueSatisfying(workers ->
            assertThat(workers.getDefaultValue()).contains(1));

        assertThat(registry.get(TestTemplates.NETWORK_DELAY).isComposable()).isTrue();
        assertThat(registry.get(TestTemplates.CUSTOM_PARTITION).getExecutor()).contains("recording");
    }

    @Test
    public void unknown_templates_are_not_found()
    {
        final var registry = TestTemplates.registry();

        assertThat(registry.find("no/such-template")).isEmpty();
        assertThatThrownBy(() -> registry.get("no/such-template"))
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining("no/such-template");
    }

    @Test
    public void every_problem_in_the_index_is_reported_at_once()
    {
        final var source = new InMemoryTemplateSource(String.join("\n",
            "templates:",
            "  - templateID: a",
            "    backend: chaos-mesh",
            "    path: a.mustache",
            "  - templateID: a",
            "    backend: chaos-mesh",
            "    path: a.mustache",
            "  - templateID: b",
            "    backend: litmus",
            "    path: a.mustache",
            "  - templateID: c",
            "    backend: chaos-mesh",
            "    path: missing.mustache",
            "  - templateID: d",
            "    backend: custom",
            "    path: a.mustache",
            "  - backend: chaos-mesh",
            "    path: a.mustache",
            "  - templateID: e",
            "    backend: chaos-mesh",
            "    path: a.mustache",
            "    parameters:",
            "      - {name: selector, type: string}",
            "      - {name: x, type: complex}",
            "      - {name: y, type: integer, default: lots}",
            "      - {name: z, type: integer, required: true, default: 3}",
            "      - {name: z, type: integer}",
            ""))
            .withDefinition("a.mustache", "kind: A");

        assertThatThrownBy(() -> TemplateRegistry.load(source))
            .isInstanceOfSatisfying(InvalidTemplateException.class, e -> assertThat(e.getProblems())
                .anySatisfy(problem -> assertThat(problem).contains("'a'").contains("duplicate"))
                .anySatisfy(problem -> assertThat(problem).contains("unknown backend 'litmus'"))
                .anySatisfy(problem -> assertThat(problem).contains("'missing.mustache' not found"))
                .anySatisfy(problem -> assertThat(problem).contains("'d'").contains("executor"))
                .anySatisfy(problem -> assertThat(problem).contains("templates[5]").contains("templateID is missing"))
                .anySatisfy(problem -> assertThat(problem).contains("'selector' is reserved"))
                .anySatisfy(problem -> assertThat(problem).contains("unknown type 'complex'"))
                .anySatisfy(problem -> assertThat(problem).contains("default for parameter 'y'"))
                .anySatisfy(problem -> assertThat(problem).contains("required parameter 'z'"))
                .anySatisfy(problem -> assertThat(problem).contains("'z' is declared twice")));
    }

    @Test
    public void a_failed_reload_leaves_the_previous_templates_in_place()
    {
        final var registry = TemplateRegistry.loadFrom(sourceWithIds("a", "b"));

        final var broken = new InMemoryTemplateSource("templates:\n  - templateID: c\n    backend: nope\n");
        assertThatThrownBy(() -> registry.reload(broken)).isInstanceOf(InvalidTemplateException.class);

        assertThat(registry.templates()).containsOnlyKeys("a", "b");
    }

    @Test
    public void readers_never_see_a_partially_reloaded_registry() throws Exception
    {
        final var first = sourceWithIds("a1", "a2");
        final var second = sourceWithIds("b1", "b2", "b3");
        final var registry = TemplateRegistry.loadFrom(first);

        final var done = new AtomicBoolean(false);
        final var inconsistent = new ConcurrentLinkedQueue<Set<String>>();
        final var reader = CompletableFuture.runAsync(() -> {
            while (!done.get())
            {
                final var ids = registry.templates().keySet();
                if (!ids.equals(Set.of("a1", "a2")) && !ids.equals(Set.of("b1", "b2", "b3")))
                {
                    inconsistent.add(Set.copyOf(ids));
                }
            }
        });

        for (int i = 0; i < 200; i++)
        {
            registry.reload(i % 2 == 0 ? second : first);
        }
        done.set(true);
        reader.get();

        assertThat(inconsistent).isEmpty();
    }

    @Test
    public void file_source_reads_the_index_and_definitions_from_a_directory(@TempDir Path dir) throws Exception
    {
        Files.createDirectories(dir.resolve("stress"));
        Files.writeString(dir.resolve("index.yaml"), TestTemplates.INDEX);
        Files.writeString(dir.resolve("stress/cpu-throttle.yaml.mustache"), TestTemplates.CPU_THROTTLE_DEFINITION);

        final var source = new FileTemplateSource(dir);

        assertThat(source.readIndex().templates).hasSize(4);
        assertThat(source.readDefinition("stress/cpu-throttle.yaml.mustache"))
            .contains(TestTemplates.CPU_THROTTLE_DEFINITION);
        assertThat(source.readDefinition("network/delay.yaml.mustache")).isEmpty();
    }

    @Test
    public void file_source_does_not_read_outside_its_directory(@TempDir Path dir) throws Exception
    {
        final var templatesDir = Files.createDirectories(dir.resolve("templates"));
        Files.writeString(dir.resolve("secret.txt"), "secret");

        assertThat(new FileTemplateSource(templatesDir).readDefinition("../secret.txt")).isEmpty();
    }

    @Test
    public void file_source_without_an_index_is_invalid(@TempDir Path dir)
    {
        assertThatThrownBy(() -> TemplateRegistry.load(new FileTemplateSource(dir)))
            .isInstanceOf(InvalidTemplateException.class)
            .hasMessageContaining("index.yaml");
    }

    @Test
    public void shipped_templates_are_valid()
    {
        final var templates = TemplateRegistry.load(new FileTemplateSource(Paths.get("templates")));

        assertThat(templates).containsKeys("stress/cpu-throttle", "network/delay", "pod/kill");
    }
}
