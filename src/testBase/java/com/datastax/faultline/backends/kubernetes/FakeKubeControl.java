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
package com.datastax.faultline.backends.kubernetes;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import com.datastax.faultline.util.Duration;

/** Records every kubectl invocation and answers with queued results; unscripted commands succeed silently */
public class FakeKubeControl implements KubeControl
{
    public static class Invocation
    {
        public final Optional<String> namespace;
        public final List<String> args;
        public final Optional<String> stdin;

        Invocation(Optional<String> namespace, List<String> args, Optional<String> stdin)
        {
            this.namespace = namespace;
            this.args = List.copyOf(args);
            this.stdin = stdin;
        }

        public String commandLine()
        {
            return String.join(" ", args);
        }

        @Override
        public String toString()
        {
            return namespace.map(ns -> "-n " + ns + " ").orElse("") + commandLine();
        }
    }

    private final List<Invocation> invocations = new ArrayList<>();
    private final Deque<KubeCommandResult> results = new ArrayDeque<>();

    public synchronized FakeKubeControl thenSucceed(String stdout)
    {
        results.add(KubeCommandResult.completed("kubectl", 0, stdout, ""));
        return this;
    }

    public synchronized FakeKubeControl thenFail(int exitCode, String stderr)
    {
        results.add(KubeCommandResult.completed("kubectl", exitCode, "", stderr));
        return this;
    }

    public synchronized FakeKubeControl thenTimeOut()
    {
        results.add(KubeCommandResult.timedOut("kubectl"));
        return this;
    }

    public synchronized List<Invocation> getInvocations()
    {
        return List.copyOf(invocations);
    }

    public synchronized Invocation lastInvocation()
    {
        return invocations.get(invocations.size() - 1);
    }

    @Override
    public synchronized KubeCommandResult execute(Optional<String> namespace, List<String> args,
        Optional<String> stdin, Duration timeout)
    {
        invocations.add(new Invocation(namespace, args, stdin));
        final var result = results.poll();
        return result != null ? result : KubeCommandResult.completed("kubectl", 0, "", "");
    }
}
