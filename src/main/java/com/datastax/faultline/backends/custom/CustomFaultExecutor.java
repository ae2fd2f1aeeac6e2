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

import com.datastax.faultline.backends.BackendStatus;

/** A user-supplied way of injecting faults, for templates whose backend is <code>custom</code>.
 *
 *  <p>Implementations are found with {@link java.util.ServiceLoader}; annotate them with
 *  <code>@AutoService(CustomFaultExecutor.class)</code> and they will be picked up. The template's
 *  <code>executor</code> field selects one by {@link #name}, case-insensitively.
 *
 *  <p>Executors may throw {@link com.datastax.faultline.exceptions.ApplyException} or
 *  {@link com.datastax.faultline.exceptions.RevertException} to say whether a failure is worth retrying;
 *  anything else they throw is treated as a permanent failure. */
public interface CustomFaultExecutor
{
    String name();

    /** Inject the fault described by the rendered definition
     *  @return a token that identifies the injected fault to {@link #remove} and {@link #status} */
    String inject(String renderedDefinition);

    /** Remove the fault; returns false if there was nothing to remove */
    boolean remove(String token);

    BackendStatus status(String token);
}
