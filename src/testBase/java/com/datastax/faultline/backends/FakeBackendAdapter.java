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
package com.datastax.faultline.backends;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.util.concurrent.Uninterruptibles;

import com.datastax.faultline.requests.ValidatedRequest;
import com.datastax.faultline.templates.BackendKind;

/** In-memory backend whose failures, statuses and timing can be scripted by tests.
 *
 *  <p>Faults are keyed by <code>namespace/name</code>; an applied fault is RUNNING until it is reverted
 *  or a test changes its status. */
public class FakeBackendAdapter implements BackendAdapter
{
    private static class ScriptedFailure
    {
        final RuntimeException exception;
        final boolean leavesState;

        ScriptedFailure(RuntimeException exception, boolean leavesState)
        {
            this.exception = exception;
            this.leavesState = leavesState;
        }
    }

    private final BackendKind kind;
    private final Map<String, BackendStatus> faults = new ConcurrentHashMap<>();
    private final Queue<ScriptedFailure> applyFailures = new ConcurrentLinkedQueue<>();
    private final Queue<RuntimeException> revertFailures = new ConcurrentLinkedQueue<>();
    private final List<String> applied = Collections.synchronizedList(new ArrayList<>());
    private final List<String> reverted = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger applyAttempts = new AtomicInteger();
    private final AtomicInteger revertAttempts = new AtomicInteger();

    private volatile boolean revertSupported = true;
    private volatile boolean reachable = true;
    private volatile CountDownLatch applyStarted = new CountDownLatch(0);
    private volatile CountDownLatch releaseApply = new CountDownLatch(0);

    public FakeBackendAdapter(BackendKind kind)
    {
        this.kind = kind;
    }

    public FakeBackendAdapter()
    {
        this(BackendKind.CHAOS_MESH);
    }

    public static BackendHandle handleFor(BackendKind kind, String namespace, String name)
    {
        return new BackendHandle(kind, namespace + "/" + name, Map.of("namespace", namespace, "name", name));
    }

    public BackendHandle handleFor(String namespace, String name)
    {
        return handleFor(kind, namespace, name);
    }

    // Scripting

    public FakeBackendAdapter failNextApply(RuntimeException exception)
    {
        applyFailures.add(new ScriptedFailure(exception, false));
        return this;
    }

    /** The next apply creates the fault and then fails, as a backend that timed out after accepting it would */
    public FakeBackendAdapter failNextApplyLeavingFault(RuntimeException exception)
    {
        applyFailures.add(new ScriptedFailure(exception, true));
        return this;
    }

    public FakeBackendAdapter failNextRevert(RuntimeException exception)
    {
        revertFailures.add(exception);
        return this;
    }

    public void setRevertSupported(boolean revertSupported)
    {
        this.revertSupported = revertSupported;
    }

    public void setReachable(boolean reachable)
    {
        this.reachable = reachable;
    }

    public void setStatus(String namespace, String name, BackendStatus status)
    {
        faults.put(namespace + "/" + name, status);
    }

    /** Simulate something outside the engine removing the fault */
    public void removeOutOfBand(String namespace, String name)
    {
        faults.remove(namespace + "/" + name);
    }

    /** Make the next applies block until {@link #releaseApplies} is called; returns a latch that counts
     *  down when the first of them starts */
    public CountDownLatch holdApplies()
    {
        applyStarted = new CountDownLatch(1);
        releaseApply = new CountDownLatch(1);
        return applyStarted;
    }

    public void releaseApplies()
    {
        releaseApply.countDown();
    }

    // Inspection

    public boolean isLive(String namespace, String name)
    {
        return faults.containsKey(namespace + "/" + name);
    }

    public List<String> getApplied()
    {
        return List.copyOf(applied);
    }

    public List<String> getReverted()
    {
        return List.copyOf(reverted);
    }

    public int getApplyAttempts()
    {
        return applyAttempts.get();
    }

    public int getRevertAttempts()
    {
        return revertAttempts.get();
    }

    // BackendAdapter

    @Override
    public BackendKind kind()
    {
        return kind;
    }

    @Override
    public Artifact render(ValidatedRequest request)
    {
        final var namespace = request.request().namespace();
        final var name = request.request().name();
        return new Artifact(kind, request.template().getTemplateId() + " " + request.parameters(),
            Optional.of(handleFor(namespace, name)));
    }

    @Override
    public BackendHandle apply(Artifact artifact)
    {
        applyAttempts.incrementAndGet();
        applyStarted.countDown();
        Uninterruptibles.awaitUninterruptibly(releaseApply);

        final var handle = artifact.getExpectedHandle().orElseThrow();
        final var failure = applyFailures.poll();
        if (failure != null)
        {
            if (failure.leavesState)
            {
                faults.put(handle.getToken(), BackendStatus.RUNNING);
            }
            throw failure.exception;
        }

        faults.put(handle.getToken(), BackendStatus.RUNNING);
        applied.add(handle.getToken());
        return handle;
    }

    @Override
    public RevertOutcome revert(BackendHandle handle)
    {
        revertAttempts.incrementAndGet();
        final var failure = revertFailures.poll();
        if (failure != null)
        {
            throw failure;
        }
        if (!revertSupported)
        {
            return RevertOutcome.UNSUPPORTED;
        }
        reverted.add(handle.getToken());
        return faults.remove(handle.getToken()) != null ? RevertOutcome.REVERTED : RevertOutcome.ALREADY_GONE;
    }

    @Override
    public BackendStatus status(BackendHandle handle)
    {
        if (!reachable)
        {
            return BackendStatus.UNKNOWN;
        }
        return faults.getOrDefault(handle.getToken(), BackendStatus.GONE);
    }
}
