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
package com.datastax.faultline.util;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Creates daemon threads named <code>prefix-N</code> so they can be picked out of thread dumps and logs */
public class NamedThreadFactory implements ThreadFactory
{
    private final String prefix;
    private final AtomicInteger threadNumber = new AtomicInteger(1);

    public NamedThreadFactory(String prefix)
    {
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable runnable)
    {
        final var thread = new Thread(runnable, prefix + "-" + threadNumber.getAndIncrement());
        thread.setDaemon(true);
        return thread;
    }
}
