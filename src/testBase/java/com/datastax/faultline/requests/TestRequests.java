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

import java.util.Map;

import com.datastax.faultline.templates.TemplateRegistry;
import com.datastax.faultline.templates.TestTemplates;
import com.datastax.faultline.util.Duration;

/** Builders for requests against {@link TestTemplates} */
public final class TestRequests
{
    public static final String NAMESPACE = "shop";

    private static final TemplateRegistry registry = TestTemplates.registry();
    private static final RequestValidator validator = new RequestValidator(Duration.hours(24));

    private TestRequests()
    {
    }

    public static FaultRequest cpuThrottle(String name, Duration ttl, TargetSelector selector, int load)
    {
        return new FaultRequest(TestTemplates.CPU_THROTTLE, FaultMetadata.of(name, NAMESPACE, ttl),
            new FaultSpec(selector, Map.of("load", load)));
    }

    public static FaultRequest cpuThrottle(String name, Duration ttl)
    {
        return cpuThrottle(name, ttl, TargetSelector.pods(NAMESPACE, "web-0"), 80);
    }

    public static FaultRequest networkDelay(String name, TargetSelector selector)
    {
        return new FaultRequest(TestTemplates.NETWORK_DELAY, FaultMetadata.of(name, NAMESPACE, null),
            new FaultSpec(selector, Map.of("latency", "100ms")));
    }

    public static FaultRequest hostCpuBurn(String name)
    {
        return new FaultRequest(TestTemplates.HOST_CPU_BURN, FaultMetadata.of(name, NAMESPACE, null),
            new FaultSpec(TargetSelector.pods(NAMESPACE, "web-0"), Map.of("load", 50)));
    }

    public static FaultRequest customPartition(String name)
    {
        return new FaultRequest(TestTemplates.CUSTOM_PARTITION, FaultMetadata.of(name, NAMESPACE, null),
            new FaultSpec(TargetSelector.pods(NAMESPACE, "db-0"), Map.of()));
    }

    public static ValidatedRequest validated(FaultRequest request)
    {
        final var normalized = request.normalize("chaos-testing");
        return validator.validate(normalized, registry.get(normalized.getTemplateId()));
    }
}
