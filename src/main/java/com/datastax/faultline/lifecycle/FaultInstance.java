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

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import com.datastax.faultline.backends.Artifact;
import com.datastax.faultline.backends.BackendHandle;
import com.datastax.faultline.requests.FaultRequest;

/** An immutable snapshot of one fault instance.  The {@link FaultLifecycleManager} replaces the snapshot
 *  on every transition, so a snapshot handed to a caller never changes underneath them. */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public class FaultInstance
{
    private final UUID instanceId;
    private final FaultRequest request;
    private final boolean composable;
    private final FaultState state;
    private final Instant createdAt;
    private final Optional<Instant> activatedAt;
    private final Optional<Instant> expiresAt;
    private final Optional<BackendHandle> backendHandle;
    private final Optional<Artifact> artifact;
    private final Optional<String> failureReason;
    private final Optional<Instant> backendUnknownSince;
    private final Optional<Instant> finishedAt;

    @JsonCreator
    FaultInstance(
        @JsonProperty("instanceId") UUID instanceId,
        @JsonProperty("request") FaultRequest request,
        @JsonProperty("composable") boolean composable,
        @JsonProperty("state") FaultState state,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("activatedAt") Optional<Instant> activatedAt,
        @JsonProperty("expiresAt") Optional<Instant> expiresAt,
        @JsonProperty("backendHandle") Optional<BackendHandle> backendHandle,
        @JsonProperty("artifact") Optional<Artifact> artifact,
        @JsonProperty("failureReason") Optional<String> failureReason,
        @JsonProperty("backendUnknownSince") Optional<Instant> backendUnknownSince,
        @JsonProperty("finishedAt") Optional<Instant> finishedAt)
    {
        this.instanceId = Objects.requireNonNull(instanceId);
        this.request = Objects.requireNonNull(request);
        this.composable = composable;
        this.state = Objects.requireNonNull(state);
        this.createdAt = Objects.requireNonNull(createdAt);
        this.activatedAt = orEmpty(activatedAt);
        this.expiresAt = orEmpty(expiresAt);
        this.backendHandle = orEmpty(backendHandle);
        this.artifact = orEmpty(artifact);
        this.failureReason = orEmpty(failureReason);
        this.backendUnknownSince = orEmpty(backendUnknownSince);
        this.finishedAt = orEmpty(finishedAt);

        Preconditions.checkArgument(state.holdsBackendHandle() == this.backendHandle.isPresent(),
            "instance %s in state %s %s a backend handle", instanceId, state,
            this.backendHandle.isPresent() ? "cannot have" : "must have");
    }

    private static <T> Optional<T> orEmpty(Optional<T> optional)
    {
        return optional == null ? Optional.empty() : optional;
    }

    static FaultInstance pending(UUID instanceId, FaultRequest request, boolean composable, Instant now)
    {
        return new FaultInstance(instanceId, request, composable, FaultState.PENDING, now,
            Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
            Optional.empty(), Optional.empty());
    }

    private class Copy
    {
        FaultState state = FaultInstance.this.state;
        Optional<Instant> activatedAt = FaultInstance.this.activatedAt;
        Optional<Instant> expiresAt = FaultInstance.this.expiresAt;
        Optional<BackendHandle> backendHandle = FaultInstance.this.backendHandle;
        Optional<Artifact> artifact = FaultInstance.this.artifact;
        Optional<String> failureReason = FaultInstance.this.failureReason;
        Optional<Instant> backendUnknownSince = FaultInstance.this.backendUnknownSince;
        Optional<Instant> finishedAt = FaultInstance.this.finishedAt;
        FaultRequest request = FaultInstance.this.request;

        Copy transitionTo(FaultState next)
        {
            Preconditions.checkState(FaultInstance.this.state.canTransitionTo(next),
                "instance %s cannot go from %s to %s", instanceId, FaultInstance.this.state, next);
            state = next;
            return this;
        }

        FaultInstance build()
        {
            return new FaultInstance(instanceId, request, composable, state, createdAt, activatedAt, expiresAt,
                backendHandle, artifact, failureReason, backendUnknownSince, finishedAt);
        }
    }

    FaultInstance withArtifact(Artifact newArtifact)
    {
        Preconditions.checkState(state == FaultState.PENDING, "artifact can only be recorded while PENDING");
        final var copy = new Copy();
        copy.artifact = Optional.of(newArtifact);
        return copy.build();
    }

    FaultInstance activated(BackendHandle handle, Instant now)
    {
        final var copy = new Copy().transitionTo(FaultState.ACTIVE);
        copy.backendHandle = Optional.of(handle);
        copy.activatedAt = Optional.of(now);
        copy.expiresAt = request.getMetadata().getTtl().map(ttl -> now.plus(ttl.toJdkDuration()));
        return copy.build();
    }

    FaultInstance rejected(String reason, Instant now)
    {
        final var copy = new Copy().transitionTo(FaultState.REJECTED);
        copy.failureReason = Optional.of(reason);
        copy.finishedAt = Optional.of(now);
        return copy.build();
    }

    FaultInstance reverting()
    {
        final var copy = new Copy().transitionTo(FaultState.REVERTING);
        copy.backendUnknownSince = Optional.empty();
        return copy.build();
    }

    FaultInstance reverted(Instant now)
    {
        final var copy = new Copy().transitionTo(FaultState.REVERTED);
        copy.backendHandle = Optional.empty();
        copy.backendUnknownSince = Optional.empty();
        copy.finishedAt = Optional.of(now);
        return copy.build();
    }

    FaultInstance failedPartial(BackendHandle handle, String reason, Instant now)
    {
        final var copy = new Copy().transitionTo(FaultState.FAILED_PARTIAL);
        copy.backendHandle = Optional.of(handle);
        copy.failureReason = Optional.of(reason);
        copy.finishedAt = Optional.of(now);
        return copy.build();
    }

    FaultInstance renewed(FaultRequest renewedRequest, Instant expiry)
    {
        Preconditions.checkState(state == FaultState.ACTIVE, "only ACTIVE instances can be renewed");
        final var copy = new Copy();
        copy.request = renewedRequest;
        copy.expiresAt = Optional.of(expiry);
        return copy.build();
    }

    FaultInstance backendUnknown(Instant since)
    {
        final var copy = new Copy();
        copy.backendUnknownSince = Optional.of(backendUnknownSince.orElse(since));
        return copy.build();
    }

    FaultInstance backendKnown()
    {
        final var copy = new Copy();
        copy.backendUnknownSince = Optional.empty();
        return copy.build();
    }

    @JsonProperty
    public UUID getInstanceId()
    {
        return instanceId;
    }

    @JsonProperty
    public FaultRequest getRequest()
    {
        return request;
    }

    @JsonIgnore
    public String getTemplateId()
    {
        return request.getTemplateId();
    }

    /** Whether the template was composable when this instance was created */
    @JsonProperty
    public boolean isComposable()
    {
        return composable;
    }

    @JsonProperty
    public FaultState getState()
    {
        return state;
    }

    @JsonProperty
    public Instant getCreatedAt()
    {
        return createdAt;
    }

    @JsonProperty
    public Optional<Instant> getActivatedAt()
    {
        return activatedAt;
    }

    @JsonProperty
    public Optional<Instant> getExpiresAt()
    {
        return expiresAt;
    }

    @JsonProperty
    public Optional<BackendHandle> getBackendHandle()
    {
        return backendHandle;
    }

    @JsonProperty
    public Optional<Artifact> getArtifact()
    {
        return artifact;
    }

    @JsonProperty
    public Optional<String> getFailureReason()
    {
        return failureReason;
    }

    /** When the backend first failed to report on this instance, if it is currently failing to */
    @JsonProperty
    public Optional<Instant> getBackendUnknownSince()
    {
        return backendUnknownSince;
    }

    @JsonProperty
    public Optional<Instant> getFinishedAt()
    {
        return finishedAt;
    }

    @JsonIgnore
    public boolean isExpired(Instant now)
    {
        return expiresAt.map(expiry -> !now.isBefore(expiry)).orElse(false);
    }

    @Override
    public String toString()
    {
        return String.format("FaultInstance{%s %s %s/%s %s}", instanceId, request.getTemplateId(),
            request.getMetadata().getNamespace().orElse("?"), request.getMetadata().getName().orElse("?"), state);
    }
}
