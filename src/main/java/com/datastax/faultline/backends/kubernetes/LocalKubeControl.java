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

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

import com.google.common.base.Joiner;

import com.datastax.faultline.util.Duration;
import com.datastax.faultline.util.Exceptions;
import com.datastax.faultline.util.ScopedLogger;

/** Runs the kubectl executable as a local process */
public class LocalKubeControl implements KubeControl
{
    private static final ScopedLogger logger = ScopedLogger.getLogger(LocalKubeControl.class);

    private final String executable;
    private final Optional<String> context;
    private final Optional<String> kubeconfig;
    private final ExecutorService ioExecutor;

    /** @param ioExecutor pumps each process's stdin, stdout and stderr; needs three free threads per
     *                    concurrent command, so a cached pool is the natural choice */
    public LocalKubeControl(String executable, Optional<String> context, Optional<String> kubeconfig,
        ExecutorService ioExecutor)
    {
        this.executable = executable;
        this.context = context;
        this.kubeconfig = kubeconfig;
        this.ioExecutor = ioExecutor;
    }

    List<String> commandLine(Optional<String> namespace, List<String> args)
    {
        final List<String> command = new ArrayList<>();
        command.add(executable);
        context.ifPresent(context_ -> command.add("--context=" + context_));
        kubeconfig.ifPresent(kubeconfig_ -> command.add("--kubeconfig=" + kubeconfig_));
        namespace.ifPresent(namespace_ -> command.add("--namespace=" + namespace_));
        command.addAll(args);
        return command;
    }

    @Override
    public KubeCommandResult execute(Optional<String> namespace, List<String> args, Optional<String> stdin,
        Duration timeout)
    {
        final var command = commandLine(namespace, args);
        final var commandString = Joiner.on(' ').join(command);

        return logger.withScopedDebug("Executing locally: {}", commandString).get(() -> {
            final Process process = Exceptions.getUncheckedIO(() -> new ProcessBuilder(command).start());

            final var stdinWritten = CompletableFuture.runAsync(() -> writeAndClose(process.getOutputStream(),
                stdin.orElse("")), ioExecutor)
                .whenComplete((ignored, e) -> {
                    if (e != null)
                    {
                        logger.debug("Could not write stdin of {}: {}", commandString, Exceptions.rootMessage(e));
                    }
                });
            final var stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()), ioExecutor);
            final var stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()), ioExecutor);

            if (!waitFor(process, timeout))
            {
                logger.warn("{} did not finish within {}; killing it", commandString, timeout.toAbbrevString());
                kill(process);
                stdinWritten.cancel(true);
                return KubeCommandResult.timedOut(commandString);
            }

            return KubeCommandResult.completed(commandString, process.exitValue(),
                join(stdout), join(stderr));
        });
    }

    private static boolean waitFor(Process process, Duration timeout)
    {
        try
        {
            return process.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void kill(Process process)
    {
        Stream.concat(process.descendants(), Stream.of(process.toHandle())).forEach(processHandle -> {
            logger.debug("Killing {} {}", processHandle.pid(), processHandle.info().command());
            processHandle.destroyForcibly();
        });
    }

    private static void writeAndClose(OutputStream outputStream, String content)
    {
        Exceptions.runUncheckedIO(() -> {
            try (outputStream)
            {
                outputStream.write(content.getBytes(StandardCharsets.UTF_8));
            }
        });
    }

    private static String readFully(InputStream inputStream)
    {
        return Exceptions.getUncheckedIO(() -> {
            try (inputStream)
            {
                return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        });
    }

    private static String join(CompletableFuture<String> output)
    {
        try
        {
            return output.get(5, TimeUnit.SECONDS);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            return "";
        }
        catch (ExecutionException | TimeoutException e)
        {
            logger.warn("Could not read process output: {}", Exceptions.rootMessage(e));
            return "";
        }
    }
}
