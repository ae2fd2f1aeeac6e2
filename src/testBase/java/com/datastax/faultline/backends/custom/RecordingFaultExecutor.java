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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.auto.service.AutoService;

import com.datastax.faultline.backends.BackendStatus;

/** Keeps injected faults in a static map so tests can see what the service-loaded instance did */
@AutoService(CustomFaultExecutor.class)
public class RecordingFaultExecutor implements CustomFaultExecutor
{
    public static final String NAME = "recording";

    private static final Map<String, String> injected = new ConcurrentHashMap<>();
    private static final List<String> removed = new ArrayList<>();
    private static final AtomicInteger nextToken = new AtomicInteger();

    public static synchronized void reset()
    {
        injected.clear();
        removed.clear();
    }

    public static Map<String, String> getInjected()
    {
        return Map.copyOf(injected);
    }

    public static synchronized List<String> getRemoved()
    {
        return List.copyOf(removed);
    }

    @Override
    public String name()
    {
        return NAME;
    }

    @Override
    public String inject(String renderedDefinition)
    {
        if (renderedDefinition.contains("explode"))
        {
            throw new IllegalStateException("asked to explode");
        }
        final var token = "recorded-" + nextToken.incrementAndGet();
        injected.put(token, renderedDefinition);
        return token;
    }

    @Override
    public boolean remove(String token)
    {
        synchronized (RecordingFaultExecutor.class)
        {
            removed.add(token);
        }
        return injected.remove(token) != null;
    }

    @Override
    public BackendStatus status(String token)
    {
        return injected.containsKey(token) ? BackendStatus.RUNNING : BackendStatus.GONE;
    }
}
