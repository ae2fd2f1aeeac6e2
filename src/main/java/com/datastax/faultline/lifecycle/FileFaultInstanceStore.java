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
package com.datastax.faultline.lifecycle;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import com.datastax.faultline.util.Exceptions;
import com.datastax.faultline.util.JacksonUtils;
import com.datastax.faultline.util.ScopedLogger;

/** Stores each instance as <code>&lt;instanceId&gt;.json</code> in a directory.  Files are replaced
 *  atomically, so a crash leaves either the previous or the new snapshot, never a torn one. */
public class FileFaultInstanceStore implements FaultInstanceStore
{
    private static final ScopedLogger logger = ScopedLogger.getLogger(FileFaultInstanceStore.class);
    private static final String SUFFIX = ".json";

    private final Path directory;

    public FileFaultInstanceStore(Path directory)
    {
        this.directory = directory;
        Exceptions.runUncheckedIO(() -> Files.createDirectories(directory));
    }

    private Path pathFor(UUID instanceId)
    {
        return directory.resolve(instanceId + SUFFIX);
    }

    @Override
    public void save(FaultInstance instance)
    {
        final var target = pathFor(instance.getInstanceId());
        Exceptions.runUncheckedIO(() -> {
            final var temp = Files.createTempFile(directory, instance.getInstanceId().toString(), ".tmp");
            try
            {
                JacksonUtils.getObjectMapper().writeValue(temp.toFile(), instance);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            }
            finally
            {
                Files.deleteIfExists(temp);
            }
        });
    }

    @Override
    public void delete(UUID instanceId)
    {
        Exceptions.runUncheckedIO(() -> Files.deleteIfExists(pathFor(instanceId)));
    }

    /** @throws UncheckedIOException if any stored instance cannot be read; starting up without it would
     *          lose track of a fault that may still be in place */
    @Override
    public List<FaultInstance> loadAll()
    {
        return logger.withScopedInfo("Loading fault instances from {}", directory).get(() -> {
            try (var files = Files.list(directory))
            {
                return files
                    .filter(path -> path.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .map(this::read)
                    .collect(Collectors.toList());
            }
            catch (IOException e)
            {
                throw new UncheckedIOException(e);
            }
        });
    }

    private FaultInstance read(Path path)
    {
        try
        {
            return JacksonUtils.getObjectMapper().readValue(path.toFile(), FaultInstance.class);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Could not read stored fault instance " + path, e);
        }
    }
}
