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
package com.datastax.faultline.engine;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

import com.google.common.collect.ImmutableMap;

import com.datastax.faultline.backends.Artifact;
import com.datastax.faultline.backends.BackendAdapter;
import com.datastax.faultline.backends.BackendAdapters;
import com.datastax.faultline.backends.BackendHandle;
import com.datastax.faultline.backends.RevertOutcome;
import com.datastax.faultline.exceptions.ApplyException;
import com.datastax.faultline.exceptions.BackendTimeoutException;
import com.datastax.faultline.exceptions.FaultEngineException;
import com.datastax.faultline.exceptions.ValidationException;
import com.datastax.faultline.lifecycle.FaultInstance;
import com.datastax.faultline.lifecycle.FaultLifecycleManager;
import com.datastax.faultline.lifecycle.FaultState;
import com.datastax.faultline.lifecycle.OwnedInstance;
import com.datastax.faultline.requests.FaultRequest;
import com.datastax.faultline.requests.RequestValidator;
import com.datastax.faultline.requests.ValidatedRequest;
import com.datastax.faultline.templates.FaultTemplate;
import com.datastax.faultline.templates.TemplateRegistry;
import com.datastax.faultline.util.Duration;
import com.datastax.faultline.util.Exceptions;
import com.datastax.faultline.util.ScopedLogger;

/** The single entry point for injecting, inspecting and reverting faults.
 *
 *  <p>A submit either leaves an ACTIVE instance behind or fails; it never returns with the instance
 *  still PENDING.  If apply fails after the backend may have kept some state, that state is reverted
 *  before the error is surfaced, and if that revert fails too the instance is FAILED_PARTIAL.
 *
 *  <p>Backend calls run on the calling thread while it owns the instance concerned, so callers only
 *  ever wait on backend calls for the instance they asked about (or, for submit, on activations
 *  whose scope overlaps theirs). */
public class OrchestrationEngine
{
    private static final ScopedLogger logger = ScopedLogger.getLogger(OrchestrationEngine.class);

    private final TemplateRegistry registry;
    private final RequestValidator validator;
    private final BackendAdapters adapters;
    private final FaultLifecycleManager lifecycle;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final String defaultNamespace;
    private final Duration scopeLockTimeout;
    private final Duration ownershipWait;
    private final Duration unknownGracePeriod;
    private final Duration finishedRetention;

    private OrchestrationEngine(Builder builder)
    {
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.validator = Objects.requireNonNull(builder.validator, "validator");
        this.adapters = Objects.requireNonNull(builder.adapters, "adapters");
        this.lifecycle = Objects.requireNonNull(builder.lifecycle, "lifecycle");
        this.retryPolicy = builder.retryPolicy;
        this.clock = builder.clock;
        this.defaultNamespace = builder.defaultNamespace;
        this.scopeLockTimeout = builder.scopeLockTimeout;
        this.ownershipWait = builder.ownershipWait;
        this.unknownGracePeriod = builder.unknownGracePeriod;
        this.finishedRetention = builder.finishedRetention;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static class Builder
    {
        private TemplateRegistry registry;
        private RequestValidator validator;
        private BackendAdapters adapters;
        private FaultLifecycleManager lifecycle;
        private RetryPolicy retryPolicy = RetryPolicy.noRetries();
        private Clock clock = Clock.systemUTC();
        private String defaultNamespace = "chaos-testing";
        private Duration scopeLockTimeout = Duration.seconds(30);
        private Duration ownershipWait = Duration.milliseconds(500);
        private Duration unknownGracePeriod = Duration.minutes(5);
        private Duration finishedRetention = Duration.hours(24);

        private Builder()
        {
        }

        public Builder withTemplateRegistry(TemplateRegistry registry)
        {
            this.registry = registry;
            return this;
        }

        public Builder withRequestValidator(RequestValidator validator)
        {
            this.validator = validator;
            return this;
        }

        public Builder withBackendAdapters(BackendAdapters adapters)
        {
            this.adapters = adapters;
            return this;
        }

        public Builder withLifecycleManager(FaultLifecycleManager lifecycle)
        {
            this.lifecycle = lifecycle;
            return this;
        }

        public Builder withRetryPolicy(RetryPolicy retryPolicy)
        {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder withClock(Clock clock)
        {
            this.clock = clock;
            return this;
        }

        public Builder withDefaultNamespace(String defaultNamespace)
        {
            this.defaultNamespace = defaultNamespace;
            return this;
        }

        public Builder withScopeLockTimeout(Duration scopeLockTimeout)
        {
            this.scopeLockTimeout = scopeLockTimeout;
            return this;
        }

        /** How long reconciliation waits for an instance someone else owns before skipping it */
        public Builder withOwnershipWait(Duration ownershipWait)
        {
            this.ownershipWait = ownershipWait;
            return this;
        }

        public Builder withUnknownGracePeriod(Duration unknownGracePeriod)
        {
            this.unknownGracePeriod = unknownGracePeriod;
            return this;
        }

        public Builder withFinishedRetention(Duration finishedRetention)
        {
            this.finishedRetention = finishedRetention;
            return this;
        }

        public OrchestrationEngine build()
        {
            return new OrchestrationEngine(this);
        }
    }

    // Submit

    public FaultInstance submit(FaultRequest rawRequest)
    {
        return logger.withScopedInfo("Submitting {}", rawRequest.getTemplateId()).get(() -> {
            final FaultTemplate template = registry.get(rawRequest.getTemplateId());
            final var request = rawRequest.normalize(defaultNamespace);
            final var validated = validator.validate(request, template);

            try (var owned = lifecycle.create(request, template.isComposable()))
            {
                applyAndActivate(owned, validated);

                if (owned.takeQueuedRevert())
                {
                    logger.info("Running revert of {} queued during apply", owned.get().getInstanceId());
                    try
                    {
                        revertOwned(owned);
                    }
                    catch (FaultEngineException e)
                    {
                        // The submit itself succeeded; the failed revert is recorded as FAILED_PARTIAL
                        logger.warn("Queued revert of {} failed: {}", owned.get().getInstanceId(), e.getMessage());
                    }
                }
                return owned.get();
            }
        });
    }

    /** Everything the reservation must cover: the namespaces the fault targets, and the one its backend
     *  resource lives in */
    private static Set<String> reservationScope(FaultRequest request)
    {
        final var scope = new TreeSet<>(request.getSpec().getSelector().scope());
        scope.add(request.namespace());
        return scope;
    }

    private void applyAndActivate(OwnedInstance owned, ValidatedRequest validated)
    {
        final var instanceId = owned.get().getInstanceId();
        boolean applyAttempted = false;
        Optional<BackendHandle> applied = Optional.empty();
        Optional<BackendAdapter> usedAdapter = Optional.empty();

        try (var reservation = lifecycle.reserveScope(reservationScope(validated.request()), scopeLockTimeout))
        {
            lifecycle.checkConflicts(owned.get());

            final var adapter = adapters.get(validated.template().getBackend());
            usedAdapter = Optional.of(adapter);
            final Artifact artifact = adapter.render(validated);
            owned.recordArtifact(artifact);

            applyAttempted = true;
            final BackendHandle handle = retryPolicy.call("apply of " + instanceId,
                () -> adapter.apply(artifact), FaultEngineException::isRetryable);
            applied = Optional.of(handle);
            owned.activate(handle);
        }
        catch (RuntimeException e)
        {
            // Once apply has returned, the fault is live whatever failed afterwards
            final var leftBehind = applied.isPresent() ? applied :
                applyAttempted ? partialHandle(e) : Optional.<BackendHandle>empty();
            try
            {
                settleFailedSubmit(owned, usedAdapter, leftBehind, e);
            }
            catch (RuntimeException settleFailure)
            {
                e.addSuppressed(settleFailure);
            }
            // A queued revert is satisfied by whatever the failure left
            owned.takeQueuedRevert();
            throw e;
        }
    }

    private static Optional<BackendHandle> partialHandle(RuntimeException e)
    {
        if (e instanceof ApplyException)
        {
            return ((ApplyException) e).getPartialHandle();
        }
        if (e instanceof BackendTimeoutException)
        {
            return ((BackendTimeoutException) e).getPartialHandle();
        }
        return Optional.empty();
    }

    private static String reason(RuntimeException e)
    {
        return e instanceof FaultEngineException ?
            ((FaultEngineException) e).getKind() + ": " + e.getMessage() :
            "internal error: " + Exceptions.rootMessage(e);
    }

    /** Leave the instance REJECTED if nothing can be left on the backend, FAILED_PARTIAL otherwise */
    private void settleFailedSubmit(OwnedInstance owned, Optional<BackendAdapter> adapter,
        Optional<BackendHandle> leftBehind, RuntimeException failure)
    {
        if (leftBehind.isEmpty())
        {
            owned.rejectEvenIfUnsaved(reason(failure));
            return;
        }

        final var handle = leftBehind.get();
        logger.warn("Submit of {} failed and may have left {} behind; cleaning up",
            owned.get().getInstanceId(), handle);
        try
        {
            final var outcome = retryPolicy.call("cleanup of " + handle,
                () -> adapter.orElseGet(() -> adapters.get(handle.getKind())).revert(handle),
                OrchestrationEngine::isRetryableRevertFailure);
            if (outcome == RevertOutcome.UNSUPPORTED)
            {
                owned.failPartialEvenIfUnsaved(handle, reason(failure) + "; backend cannot clean up");
            }
            else
            {
                owned.rejectEvenIfUnsaved(reason(failure) + "; cleaned up");
            }
        }
        catch (FaultEngineException cleanupFailure)
        {
            owned.failPartialEvenIfUnsaved(handle,
                reason(failure) + "; cleanup failed: " + cleanupFailure.getMessage());
        }
    }

    // Revert

    private static boolean isRetryableRevertFailure(FaultEngineException e)
    {
        // revert is idempotent, so a timed-out attempt is safe to repeat
        return e.isRetryable() || e instanceof BackendTimeoutException;
    }

    public RevertResult revert(UUID instanceId)
    {
        return logger.withScopedInfo("Reverting {}", instanceId).get(() -> {
            if (lifecycle.queueRevertIfPending(instanceId))
            {
                logger.info("{} is still being applied; revert queued", instanceId);
                return new RevertResult(RevertResult.Outcome.QUEUED, lifecycle.get(instanceId));
            }
            try (var owned = lifecycle.own(instanceId))
            {
                return revertOwned(owned);
            }
        });
    }

    private RevertResult revertOwned(OwnedInstance owned)
    {
        final var instance = owned.get();
        switch (instance.getState())
        {
            case REVERTED:
                return new RevertResult(RevertResult.Outcome.ALREADY_REVERTED, instance);
            case REJECTED:
                return new RevertResult(RevertResult.Outcome.NOT_APPLIED, instance);
            case ACTIVE:
            case FAILED_PARTIAL:
                owned.beginRevert();
                return executeRevert(owned);
            case REVERTING:
                return executeRevert(owned);
            default:
                throw new IllegalStateException("Cannot revert " + instance);
        }
    }

    /** Revert a REVERTING instance's handle; on failure the instance is left FAILED_PARTIAL */
    private RevertResult executeRevert(OwnedInstance owned)
    {
        final var handle = owned.get().getBackendHandle().orElseThrow();
        final RevertOutcome outcome;
        try
        {
            final var adapter = adapters.get(handle.getKind());
            outcome = retryPolicy.call("revert of " + handle, () -> adapter.revert(handle),
                OrchestrationEngine::isRetryableRevertFailure);
        }
        catch (FaultEngineException e)
        {
            owned.failPartial(handle, "revert failed: " + e.getMessage());
            throw e;
        }

        if (outcome == RevertOutcome.UNSUPPORTED)
        {
            owned.failPartial(handle, "backend " + handle.getKind() + " cannot revert");
            return new RevertResult(RevertResult.Outcome.UNSUPPORTED, owned.get());
        }
        return new RevertResult(RevertResult.Outcome.REVERTED, owned.completeRevert());
    }

    // Queries

    public FaultInstance status(UUID instanceId)
    {
        return lifecycle.get(instanceId);
    }

    public List<FaultInstance> list()
    {
        return lifecycle.list();
    }

    /** Make an ACTIVE instance expire <code>ttl</code> from now */
    public FaultInstance renew(UUID instanceId, Duration ttl)
    {
        validator.validateTtl(ttl);
        try (var owned = lifecycle.own(instanceId))
        {
            if (owned.get().getState() != FaultState.ACTIVE)
            {
                throw new ValidationException(List.of(String.format("instance %s is %s; only ACTIVE instances " +
                    "can be renewed", instanceId, owned.get().getState())));
            }
            return owned.renew(ttl);
        }
    }

    public ImmutableMap<String, FaultTemplate> reloadTemplates()
    {
        return registry.reload();
    }

    public ImmutableMap<String, FaultTemplate> templates()
    {
        return registry.templates();
    }

    public FaultTemplate template(String templateId)
    {
        return registry.get(templateId);
    }

    // Reconciliation

    /** Bring every unfinished instance in line with its TTL and with what its backend reports.  Instances
     *  that stay owned by someone else for longer than the ownership wait are skipped until next time. */
    public ReconciliationReport reconcile()
    {
        return logger.withScopedInfo("Reconciling").get(() -> {
            final var report = new ReconciliationReport();
            for (var instance : lifecycle.list())
            {
                final var state = instance.getState();
                if (state.isFinished() || state == FaultState.FAILED_PARTIAL)
                {
                    continue;
                }
                final var instanceId = instance.getInstanceId();
                final var owned = lifecycle.tryOwn(instanceId, ownershipWait);
                if (owned.isEmpty())
                {
                    report.skippedBusy(instanceId);
                    continue;
                }
                try (var ownedInstance = owned.get())
                {
                    reconcileOwned(ownedInstance, report);
                }
                catch (FaultEngineException e)
                {
                    logger.warn("Reconciling {} failed: {}", instanceId, e.getMessage());
                    report.failed(instanceId, e.getMessage());
                }
            }
            report.evicted(lifecycle.evictFinished(finishedRetention));
            return report;
        });
    }

    private void reconcileOwned(OwnedInstance owned, ReconciliationReport report)
    {
        final var instance = owned.get();
        final var instanceId = instance.getInstanceId();
        switch (instance.getState())
        {
            case PENDING:
                resolveInterruptedSubmit(owned);
                report.interruptedResolved(instanceId);
                if (owned.takeQueuedRevert() && owned.get().getState() == FaultState.FAILED_PARTIAL)
                {
                    revertOwned(owned);
                }
                break;
            case ACTIVE:
                reconcileActive(owned, report);
                break;
            case REVERTING:
                report.revertRetried(instanceId);
                executeRevert(owned);
                break;
            default:
                break;
        }
    }

    private void reconcileActive(OwnedInstance owned, ReconciliationReport report)
    {
        final var instance = owned.get();
        final var instanceId = instance.getInstanceId();
        final var now = clock.instant();

        if (instance.isExpired(now))
        {
            logger.info("{} expired at {}", instanceId, instance.getExpiresAt().orElseThrow());
            report.expired(instanceId);
            owned.beginRevert();
            executeRevert(owned);
            return;
        }

        final var handle = instance.getBackendHandle().orElseThrow();
        final var status = adapters.get(handle.getKind()).status(handle);
        switch (status)
        {
            case RUNNING:
                owned.markBackendKnown();
                report.confirmed(instanceId);
                break;
            case COMPLETED:
                logger.info("{} was completed by the backend; removing it", instanceId);
                report.completed(instanceId);
                owned.beginRevert();
                executeRevert(owned);
                break;
            case GONE:
                report.drifted(instanceId);
                owned.failPartial(handle, "backend no longer holds the fault");
                break;
            case UNKNOWN:
            {
                final var since = owned.markBackendUnknown().getBackendUnknownSince().orElseThrow();
                if (!now.isBefore(since.plus(unknownGracePeriod.toJdkDuration())))
                {
                    report.unreachable(instanceId);
                    owned.failPartial(handle, "backend status unknown since " + since);
                }
                break;
            }
            default:
                throw new AssertionError(status);
        }
    }

    /** A PENDING instance nobody owns was left by a submit that never finished (usually a restart).
     *  Whatever its artifact would have created is removed, and the submit is treated as failed. */
    private void resolveInterruptedSubmit(OwnedInstance owned)
    {
        final var instance = owned.get();
        final var expected = instance.getArtifact().flatMap(Artifact::getExpectedHandle);
        if (expected.isEmpty())
        {
            owned.reject("submit was interrupted before anything was applied");
            return;
        }

        final var handle = expected.get();
        try
        {
            final var outcome = retryPolicy.call("cleanup of " + handle,
                () -> adapters.get(handle.getKind()).revert(handle),
                OrchestrationEngine::isRetryableRevertFailure);
            if (outcome == RevertOutcome.UNSUPPORTED)
            {
                owned.failPartial(handle, "submit was interrupted and backend cannot clean up");
            }
            else
            {
                owned.reject("submit was interrupted; cleaned up");
            }
        }
        catch (FaultEngineException e)
        {
            owned.failPartial(handle, "submit was interrupted and cleanup failed: " + e.getMessage());
        }
    }
}
