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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.datastax.faultline.MutableClock;
import com.datastax.faultline.backends.Artifact;
import com.datastax.faultline.backends.BackendAdapters;
import com.datastax.faultline.backends.BackendStatus;
import com.datastax.faultline.backends.FakeBackendAdapter;
import com.datastax.faultline.backends.UnsupportedBackendAdapter;
import com.datastax.faultline.exceptions.ApplyException;
import com.datastax.faultline.exceptions.BackendTimeoutException;
import com.datastax.faultline.exceptions.ConflictException;
import com.datastax.faultline.exceptions.NotFoundException;
import com.datastax.faultline.exceptions.RevertException;
import com.datastax.faultline.exceptions.StorageException;
import com.datastax.faultline.exceptions.UnsupportedBackendException;
import com.datastax.faultline.exceptions.ValidationException;
import com.datastax.faultline.lifecycle.FaultInstance;
import com.datastax.faultline.lifecycle.FaultLifecycleManager;
import com.datastax.faultline.lifecycle.FaultState;
import com.datastax.faultline.lifecycle.InMemoryFaultInstanceStore;
import com.datastax.faultline.requests.FaultMetadata;
import com.datastax.faultline.requests.FaultRequest;
import com.datastax.faultline.requests.FaultSpec;
import com.datastax.faultline.requests.RequestValidator;
import com.datastax.faultline.requests.TargetSelector;
import com.datastax.faultline.templates.BackendKind;
import com.datastax.faultline.templates.InMemoryTemplateSource;
import com.datastax.faultline.templates.TemplateRegistry;
import com.datastax.faultline.templates.TestTemplates;
import com.datastax.faultline.util.Duration;

import static com.datastax.faultline.requests.TestRequests.NAMESPACE;
import static com.datastax.faultline.requests.TestRequests.cpuThrottle;
import static com.datastax.faultline.requests.TestRequests.hostCpuBurn;
import static com.datastax.faultline.requests.TestRequests.networkDelay;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OrchestrationEngineTest
{
    private final MutableClock clock = new MutableClock();
    private final InMemoryFaultInstanceStore store = new InMemoryFaultInstanceStore();
    private final FakeBackendAdapter chaosMesh = new FakeBackendAdapter(BackendKind.CHAOS_MESH);
    private final List<java.time.Duration> sleeps = new ArrayList<>();

    private FaultLifecycleManager lifecycle;
    private OrchestrationEngine engine;

    @BeforeEach
    public void setUp()
    {
        lifecycle = new FaultLifecycleManager(store, clock);
        engine = engineFor(lifecycle);
    }

    private OrchestrationEngine engineFor(FaultLifecycleManager lifecycleManager)
    {
        return engineFor(lifecycleManager, TestTemplates.registry());
    }

    private OrchestrationEngine engineFor(FaultLifecycleManager lifecycleManager, TemplateRegistry registry)
    {
        return OrchestrationEngine.builder()
            .withTemplateRegistry(registry)
            .withRequestValidator(new RequestValidator(Duration.hours(24)))
            .withBackendAdapters(new BackendAdapters(List.of(chaosMesh,
                new UnsupportedBackendAdapter(BackendKind.CHAOSD))))
            .withLifecycleManager(lifecycleManager)
            .withRetryPolicy(new RetryPolicy(3, Duration.milliseconds(10), Duration.milliseconds(40), 2.0,
                sleeps::add))
            .withClock(clock)
            .withScopeLockTimeout(Duration.seconds(10))
            .withOwnershipWait(Duration.milliseconds(50))
            .withUnknownGracePeriod(Duration.minutes(1))
            .withFinishedRetention(Duration.hours(1))
            .build();
    }

    private static FaultRequest burn(Duration ttl)
    {
        return cpuThrottle("burn", ttl);
    }

    private static FaultRequest burnOn(String name, String pod)
    {
        return cpuThrottle(name, Duration.hours(1), TargetSelector.pods(NAMESPACE, pod), 50);
    }

    private FaultInstance onlyInstance()
    {
        assertThat(engine.list()).hasSize(1);
        return engine.list().get(0);
    }

    // Submit

    @Test
    public void a_fault_with_a_ttl_is_active_until_it_expires()
    {
        final var instance = engine.submit(burn(Duration.seconds(60)));

        assertThat(instance.getState()).isEqualTo(FaultState.ACTIVE);
        assertThat(instance.getExpiresAt()).contains(clock.instant().plusSeconds(60));
        assertThat(chaosMesh.isLive(NAMESPACE, "burn")).isTrue();

        clock.advance(Duration.seconds(30));
        assertThat(engine.reconcile().getConfirmed()).containsExactly(instance.getInstanceId());

        clock.advance(Duration.seconds(31));
        final var report = engine.reconcile();

        assertThat(report.getExpired()).containsExactly(instance.getInstanceId());
        assertThat(engine.status(instance.getInstanceId()).getState()).isEqualTo(FaultState.REVERTED);
        assertThat(chaosMesh.isLive(NAMESPACE, "burn")).isFalse();
    }

    @Test
    public void a_cpu_throttle_on_one_worker_is_reverted_by_the_first_reconcile_after_its_ttl()
    {
        final var registry = TemplateRegistry.loadFrom(new InMemoryTemplateSource(String.join("\n",
            "templates:",
            "  - templateID: cpu-throttle",
            "    backend: chaos-mesh",
            "    path: cpu-throttle.yaml.mustache",
            "    parameters:",
            "      - {name: load, type: integer, default: 50}",
            "      - {name: workers, type: integer, default: 1}",
            ""))
            .withDefinition("cpu-throttle.yaml.mustache", TestTemplates.CPU_THROTTLE_DEFINITION));
        engine = engineFor(lifecycle, registry);

        final var instance = engine.submit(new FaultRequest("cpu-throttle",
            FaultMetadata.of(null, null, Duration.seconds(60)),
            new FaultSpec(TargetSelector.pods("default", "worker-0"), Map.of())));

        assertThat(instance.getState()).isEqualTo(FaultState.ACTIVE);
        assertThat(instance.getBackendHandle()).isPresent();

        clock.advance(Duration.seconds(61));
        final var report = engine.reconcile();

        assertThat(report.getExpired()).containsExactly(instance.getInstanceId());
        assertThat(engine.status(instance.getInstanceId()).getState()).isEqualTo(FaultState.REVERTED);
    }

    @Test
    public void a_fault_without_a_ttl_stays_active()
    {
        final var instance = engine.submit(burn(null));

        clock.advance(Duration.days(7));
        engine.reconcile();

        assertThat(instance.getExpiresAt()).isEmpty();
        assertThat(engine.status(instance.getInstanceId()).getState()).isEqualTo(FaultState.ACTIVE);
    }

    @Test
    public void an_unknown_template_creates_no_instance()
    {
        final var request = new FaultRequest("nope/missing", FaultMetadata.of("x", NAMESPACE, null),
            new FaultSpec(TargetSelector.pods(NAMESPACE, "web-0"), Map.of()));

        assertThatThrownBy(() -> engine.submit(request)).isInstanceOf(NotFoundException.class);
        assertThat(engine.list()).isEmpty();
        assertThat(chaosMesh.getApplyAttempts()).isZero();
    }

    @Test
    public void an_invalid_request_creates_no_instance()
    {
        final var request = new FaultRequest(TestTemplates.CPU_THROTTLE, FaultMetadata.of("burn", NAMESPACE, null),
            new FaultSpec(TargetSelector.pods(NAMESPACE, "web-0"), Map.of("load", "lots")));

        assertThatThrownBy(() -> engine.submit(request)).isInstanceOf(ValidationException.class);
        assertThat(engine.list()).isEmpty();
    }

    @Test
    public void transient_apply_failures_are_retried()
    {
        chaosMesh.failNextApply(ApplyException.transientFailure("connection refused"));

        final var instance = engine.submit(burn(Duration.minutes(5)));

        assertThat(instance.getState()).isEqualTo(FaultState.ACTIVE);
        assertThat(chaosMesh.getApplyAttempts()).isEqualTo(2);
        assertThat(sleeps).containsExactly(java.time.Duration.ofMillis(10));
    }

    @Test
    public void a_rejected_apply_leaves_the_instance_rejected()
    {
        chaosMesh.failNextApply(ApplyException.rejected("admission webhook denied"));

        assertThatThrownBy(() -> engine.submit(burn(Duration.minutes(5))))
            .isInstanceOf(ApplyException.class);

        final var instance = onlyInstance();
        assertThat(instance.getState()).isEqualTo(FaultState.REJECTED);
        assertThat(instance.getFailureReason()).hasValueSatisfying(
            reason -> assertThat(reason).contains("admission webhook denied"));
        assertThat(instance.getBackendHandle()).isEmpty();
        assertThat(chaosMesh.getApplyAttempts()).isEqualTo(1);
    }

    @Test
    public void a_partial_apply_is_cleaned_up()
    {
        chaosMesh.failNextApplyLeavingFault(ApplyException.rejected("webhook timed out")
            .withPartialHandle(chaosMesh.handleFor(NAMESPACE, "burn")));

        assertThatThrownBy(() -> engine.submit(burn(Duration.minutes(5))))
            .isInstanceOf(ApplyException.class);

        assertThat(onlyInstance().getState()).isEqualTo(FaultState.REJECTED);
        assertThat(chaosMesh.isLive(NAMESPACE, "burn")).isFalse();
    }

    @Test
    public void a_partial_apply_whose_cleanup_fails_is_failed_partial()
    {
        chaosMesh.failNextApplyLeavingFault(ApplyException.rejected("webhook timed out")
            .withPartialHandle(chaosMesh.handleFor(NAMESPACE, "burn")));
        chaosMesh.failNextRevert(new RevertException("forbidden", false));

        assertThatThrownBy(() -> engine.submit(burn(Duration.minutes(5))))
            .isInstanceOf(ApplyException.class);

        final var instance = onlyInstance();
        assertThat(instance.getState()).isEqualTo(FaultState.FAILED_PARTIAL);
        assertThat(instance.getBackendHandle()).contains(chaosMesh.handleFor(NAMESPACE, "burn"));
        assertThat(chaosMesh.isLive(NAMESPACE, "burn")).isTrue();
    }

    @Test
    public void an_apply_timeout_is_not_retried_but_is_cleaned_up()
    {
        chaosMesh.failNextApplyLeavingFault(new BackendTimeoutException("apply", Duration.seconds(30),
            Optional.of(chaosMesh.handleFor(NAMESPACE, "burn"))));

        assertThatThrownBy(() -> engine.submit(burn(Duration.minutes(5))))
            .isInstanceOf(BackendTimeoutException.class);

        assertThat(chaosMesh.getApplyAttempts()).isEqualTo(1);
        assertThat(onlyInstance().getState()).isEqualTo(FaultState.REJECTED);
        assertThat(chaosMesh.isLive(NAMESPACE, "burn")).isFalse();
    }

    @Test
    public void an_unsupported_backend_rejects_the_submit()
    {
        assertThatThrownBy(() -> engine.submit(hostCpuBurn("burn")))
            .isInstanceOf(UnsupportedBackendException.class);

        assertThat(onlyInstance().getState()).isEqualTo(FaultState.REJECTED);
    }

    @Test
    public void overlapping_faults_conflict()
    {
        final var first = engine.submit(burnOn("first", "web-0"));

        assertThatThrownBy(() -> engine.submit(burnOn("second", "web-0")))
            .isInstanceOfSatisfying(ConflictException.class,
                e -> assertThat(e.getConflictingInstanceIds()).containsExactly(first.getInstanceId()));

        assertThat(engine.list()).extracting(FaultInstance::getState)
            .containsExactlyInAnyOrder(FaultState.ACTIVE, FaultState.REJECTED);
        assertThat(chaosMesh.getApplyAttempts()).isEqualTo(1);
    }

    @Test
    public void faults_on_different_pods_coexist()
    {
        engine.submit(burnOn("first", "web-0"));
        engine.submit(burnOn("second", "web-1"));

        assertThat(engine.list()).extracting(FaultInstance::getState)
            .containsExactly(FaultState.ACTIVE, FaultState.ACTIVE);
    }

    @Test
    public void composable_faults_coexist_on_the_same_targets()
    {
        final var everything = TargetSelector.namespace(NAMESPACE, Map.of());

        engine.submit(networkDelay("delay-a", everything));
        engine.submit(networkDelay("delay-b", everything));

        assertThat(engine.list()).extracting(FaultInstance::getState)
            .containsExactly(FaultState.ACTIVE, FaultState.ACTIVE);
    }

    @Test
    public void a_fault_can_be_resubmitted_after_it_is_reverted()
    {
        final var first = engine.submit(burn(Duration.minutes(5)));
        engine.revert(first.getInstanceId());

        final var second = engine.submit(burn(Duration.minutes(5)));

        assertThat(second.getState()).isEqualTo(FaultState.ACTIVE);
        assertThat(second.getInstanceId()).isNotEqualTo(first.getInstanceId());
    }

    @Test
    public void parallel_identical_submits_leave_exactly_one_fault() throws Exception
    {
        final var applyStarted = chaosMesh.holdApplies();
        final var firstSubmit = CompletableFuture.supplyAsync(() -> engine.submit(burn(Duration.minutes(5))));
        assertThat(applyStarted.await(10, TimeUnit.SECONDS)).isTrue();

        final var secondSubmit = CompletableFuture.supplyAsync(() -> engine.submit(burn(Duration.minutes(5))));
        Thread.sleep(50);
        assertThat(secondSubmit).isNotDone();

        chaosMesh.releaseApplies();

        assertThat(firstSubmit.get(10, TimeUnit.SECONDS).getState()).isEqualTo(FaultState.ACTIVE);
        assertThatThrownBy(() -> secondSubmit.get(10, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(ConflictException.class);
        assertThat(chaosMesh.getApplied()).containsExactly("shop/burn");
    }

    /** Accepts new instances but nothing after them */
    private static class StoreRefusingSettledStates extends InMemoryFaultInstanceStore
    {
        @Override
        public void save(FaultInstance instance)
        {
            if (instance.getState() != FaultState.PENDING)
            {
                throw new UncheckedIOException(new IOException("disk full"));
            }
            super.save(instance);
        }
    }

    @Test
    public void a_fault_applied_but_not_recorded_is_cleaned_up()
    {
        engine = engineFor(new FaultLifecycleManager(new StoreRefusingSettledStates(), clock));

        assertThatThrownBy(() -> engine.submit(burn(Duration.seconds(60))))
            .isInstanceOf(StorageException.class)
            .hasMessageContaining("disk full");

        final var instance = onlyInstance();
        assertThat(instance.getState()).isEqualTo(FaultState.REJECTED);
        assertThat(instance.getFailureReason()).hasValueSatisfying(
            reason -> assertThat(reason).contains("cleaned up"));
        assertThat(chaosMesh.getReverted()).hasSize(1);
        assertThat(chaosMesh.isLive(NAMESPACE, "burn")).isFalse();
    }

    @Test
    public void a_fault_applied_but_not_recorded_that_cannot_be_cleaned_up_is_failed_partial()
    {
        engine = engineFor(new FaultLifecycleManager(new StoreRefusingSettledStates(), clock));
        chaosMesh.failNextRevert(new RevertException("forbidden: User cannot delete", false));

        assertThatThrownBy(() -> engine.submit(burn(Duration.seconds(60))))
            .isInstanceOf(StorageException.class);

        final var instance = onlyInstance();
        assertThat(instance.getState()).isEqualTo(FaultState.FAILED_PARTIAL);
        assertThat(instance.getBackendHandle()).contains(chaosMesh.handleFor(NAMESPACE, "burn"));
        assertThat(chaosMesh.isLive(NAMESPACE, "burn")).isTrue();
    }

    // Revert

    @Test
    public void revert_removes_the_fault_and_is_idempotent()
    {
        final var instance = engine.submit(burn(Duration.minutes(5)));

        final var first = engine.revert(instance.getInstanceId());
        final var second = engine.revert(instance.getInstanceId());

        assertThat(first.getOutcome()).isEqualTo(RevertResult.Outcome.REVERTED);
        assertThat(first.getInstance().getState()).isEqualTo(FaultState.REVERTED);
        assertThat(first.getInstance().getBackendHandle()).isEmpty();
        assertThat(second.getOutcome()).isEqualTo(RevertResult.Outcome.ALREADY_REVERTED);
        assertThat(chaosMesh.getRevertAttempts()).isEqualTo(1);
    }

    @Test
    public void reverting_a_rejected_submit_reports_nothing_applied()
    {
        chaosMesh.failNextApply(ApplyException.rejected("denied"));
        assertThatThrownBy(() -> engine.submit(burn(Duration.minutes(5)))).isInstanceOf(ApplyException.class);

        final var result = engine.revert(onlyInstance().getInstanceId());

        assertThat(result.getOutcome()).isEqualTo(RevertResult.Outcome.NOT_APPLIED);
        assertThat(chaosMesh.getRevertAttempts()).isZero();
    }

    @Test
    public void reverting_an_unknown_instance_is_not_found()
    {
        assertThatThrownBy(() -> engine.revert(UUID.randomUUID()))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    public void transient_revert_failures_are_retried()
    {
        final var instance = engine.submit(burn(Duration.minutes(5)));
        chaosMesh.failNextRevert(new RevertException("etcd leader election", true));

        assertThat(engine.revert(instance.getInstanceId()).getOutcome())
            .isEqualTo(RevertResult.Outcome.REVERTED);
        assertThat(chaosMesh.getRevertAttempts()).isEqualTo(2);
    }

    @Test
    public void a_failed_revert_is_failed_partial_and_can_be_retried_by_hand()
    {
        final var instance = engine.submit(burn(Duration.minutes(5)));
        chaosMesh.failNextRevert(new RevertException("forbidden", false));

        assertThatThrownBy(() -> engine.revert(instance.getInstanceId())).isInstanceOf(RevertException.class);
        assertThat(engine.status(instance.getInstanceId()).getState()).isEqualTo(FaultState.FAILED_PARTIAL);

        engine.reconcile();
        assertThat(engine.status(instance.getInstanceId()).getState()).isEqualTo(FaultState.FAILED_PARTIAL);

        assertThat(engine.revert(instance.getInstanceId()).getOutcome())
            .isEqualTo(RevertResult.Outcome.REVERTED);
        assertThat(chaosMesh.isLive(NAMESPACE, "burn")).isFalse();
    }

    @Test
    public void a_backend_that_cannot_revert_leaves_the_fault_failed_partial()
    {
        final var instance = engine.submit(burn(Duration.minutes(5)));
        chaosMesh.setRevertSupported(false);

        final var result = engine.revert(instance.getInstanceId());

        assertThat(result.getOutcome()).isEqualTo(RevertResult.Outcome.UNSUPPORTED);
        assertThat(result.getInstance().getState()).isEqualTo(FaultState.FAILED_PARTIAL);
        assertThat(result.getInstance().getBackendHandle()).isPresent();
    }

    @Test
    public void a_revert_during_apply_is_queued_and_runs_once_apply_finishes() throws Exception
    {
        final var applyStarted = chaosMesh.holdApplies();
        final var submit = CompletableFuture.supplyAsync(() -> engine.submit(burn(Duration.minutes(5))));
        assertThat(applyStarted.await(10, TimeUnit.SECONDS)).isTrue();

        final var pending = onlyInstance();
        assertThat(pending.getState()).isEqualTo(FaultState.PENDING);
        final var result = engine.revert(pending.getInstanceId());
        assertThat(result.getOutcome()).isEqualTo(RevertResult.Outcome.QUEUED);

        chaosMesh.releaseApplies();

        assertThat(submit.get(10, TimeUnit.SECONDS).getState()).isEqualTo(FaultState.REVERTED);
        assertThat(chaosMesh.isLive(NAMESPACE, "burn")).isFalse();
    }

    @Test
    public void a_revert_queued_during_a_failing_apply_is_satisfied_by_the_failure() throws Exception
    {
        chaosMesh.failNextApply(ApplyException.rejected("denied"));
        final var applyStarted = chaosMesh.holdApplies();
        final var submit = CompletableFuture.supplyAsync(() -> engine.submit(burn(Duration.minutes(5))));
        assertThat(applyStarted.await(10, TimeUnit.SECONDS)).isTrue();

        engine.revert(onlyInstance().getInstanceId());
        chaosMesh.releaseApplies();

        assertThatThrownBy(() -> submit.get(10, TimeUnit.SECONDS)).hasCauseInstanceOf(ApplyException.class);
        assertThat(onlyInstance().getState()).isEqualTo(FaultState.REJECTED);
        assertThat(chaosMesh.getRevertAttempts()).isZero();
    }

    // Renew

    @Test
    public void renew_extends_an_active_fault()
    {
        final var instance = engine.submit(burn(Duration.seconds(60)));
        clock.advance(Duration.seconds(50));

        final var renewed = engine.renew(instance.getInstanceId(), Duration.minutes(10));
        clock.advance(Duration.seconds(61));
        engine.reconcile();

        assertThat(renewed.getExpiresAt()).contains(instance.getCreatedAt().plusSeconds(50 + 600));
        assertThat(engine.status(instance.getInstanceId()).getState()).isEqualTo(FaultState.ACTIVE);
    }

    @Test
    public void renew_refuses_inactive_faults_and_excessive_ttls()
    {
        final var instance = engine.submit(burn(Duration.seconds(60)));

        assertThatThrownBy(() -> engine.renew(instance.getInstanceId(), Duration.days(2)))
            .isInstanceOf(ValidationException.class);

        engine.revert(instance.getInstanceId());
        assertThatThrownBy(() -> engine.renew(instance.getInstanceId(), Duration.minutes(10)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("REVERTED");
    }

    // Reconcile

    @Test
    public void a_fault_completed_by_the_backend_is_cleaned_up()
    {
        final var instance = engine.submit(burn(Duration.hours(1)));
        chaosMesh.setStatus(NAMESPACE, "burn", BackendStatus.COMPLETED);

        final var report = engine.reconcile();

        assertThat(report.getCompleted()).containsExactly(instance.getInstanceId());
        assertThat(engine.status(instance.getInstanceId()).getState()).isEqualTo(FaultState.REVERTED);
    }

    @Test
    public void a_fault_removed_behind_our_back_is_reported_as_drift()
    {
        final var instance = engine.submit(burn(Duration.hours(1)));
        chaosMesh.removeOutOfBand(NAMESPACE, "burn");

        final var report = engine.reconcile();

        assertThat(report.getDrifted()).containsExactly(instance.getInstanceId());
        assertThat(engine.status(instance.getInstanceId()).getState()).isEqualTo(FaultState.FAILED_PARTIAL);

        assertThat(engine.revert(instance.getInstanceId()).getInstance().getState())
            .isEqualTo(FaultState.REVERTED);
    }

    @Test
    public void an_unreachable_backend_is_tolerated_for_the_grace_period()
    {
        final var instance = engine.submit(burn(Duration.hours(1)));
        chaosMesh.setReachable(false);

        engine.reconcile();
        clock.advance(Duration.seconds(59));
        final var early = engine.reconcile();

        assertThat(early.getUnreachable()).isEmpty();
        assertThat(engine.status(instance.getInstanceId()).getState()).isEqualTo(FaultState.ACTIVE);
        assertThat(engine.status(instance.getInstanceId()).getBackendUnknownSince()).isPresent();

        clock.advance(Duration.seconds(1));
        final var late = engine.reconcile();

        assertThat(late.getUnreachable()).containsExactly(instance.getInstanceId());
        assertThat(engine.status(instance.getInstanceId()).getState()).isEqualTo(FaultState.FAILED_PARTIAL);
    }

    @Test
    public void a_backend_that_comes_back_resets_the_grace_period()
    {
        final var instance = engine.submit(burn(Duration.hours(1)));
        chaosMesh.setReachable(false);
        engine.reconcile();

        clock.advance(Duration.seconds(50));
        chaosMesh.setReachable(true);
        engine.reconcile();

        chaosMesh.setReachable(false);
        clock.advance(Duration.seconds(50));
        engine.reconcile();

        assertThat(engine.status(instance.getInstanceId()).getState()).isEqualTo(FaultState.ACTIVE);
    }

    @Test
    public void an_instance_being_submitted_is_skipped() throws Exception
    {
        final var applyStarted = chaosMesh.holdApplies();
        final var submit = CompletableFuture.supplyAsync(() -> engine.submit(burn(Duration.minutes(5))));
        assertThat(applyStarted.await(10, TimeUnit.SECONDS)).isTrue();

        final var report = engine.reconcile();

        assertThat(report.getSkippedBusy()).containsExactly(onlyInstance().getInstanceId());
        chaosMesh.releaseApplies();
        assertThat(submit.get(10, TimeUnit.SECONDS).getState()).isEqualTo(FaultState.ACTIVE);
    }

    @Test
    public void an_interrupted_submit_is_cleaned_up_after_a_restart()
    {
        final var request = burn(Duration.minutes(5)).normalize("chaos-testing");
        final var handle = chaosMesh.handleFor(NAMESPACE, "burn");
        final UUID instanceId;
        try (var owned = lifecycle.create(request, false))
        {
            instanceId = owned.get().getInstanceId();
            owned.recordArtifact(new Artifact(BackendKind.CHAOS_MESH, "kind: StressChaos", Optional.of(handle)));
        }
        // the apply reached the backend before the process died
        chaosMesh.setStatus(NAMESPACE, "burn", BackendStatus.RUNNING);

        final var restarted = new FaultLifecycleManager(store, clock);
        restarted.recover();
        final var report = engineFor(restarted).reconcile();

        assertThat(report.getInterruptedResolved()).containsExactly(instanceId);
        assertThat(restarted.get(instanceId).getState()).isEqualTo(FaultState.REJECTED);
        assertThat(chaosMesh.isLive(NAMESPACE, "burn")).isFalse();
    }

    @Test
    public void an_interrupted_submit_that_cannot_be_cleaned_up_is_failed_partial()
    {
        final var request = burn(Duration.minutes(5)).normalize("chaos-testing");
        final var handle = chaosMesh.handleFor(NAMESPACE, "burn");
        final UUID instanceId;
        try (var owned = lifecycle.create(request, false))
        {
            instanceId = owned.get().getInstanceId();
            owned.recordArtifact(new Artifact(BackendKind.CHAOS_MESH, "kind: StressChaos", Optional.of(handle)));
        }
        chaosMesh.failNextRevert(new RevertException("forbidden", false));

        engine.reconcile();

        assertThat(engine.status(instanceId).getState()).isEqualTo(FaultState.FAILED_PARTIAL);
        assertThat(engine.status(instanceId).getBackendHandle()).contains(handle);
    }

    @Test
    public void an_interrupted_submit_that_never_rendered_is_rejected()
    {
        final UUID instanceId;
        try (var owned = lifecycle.create(burn(Duration.minutes(5)).normalize("chaos-testing"), false))
        {
            instanceId = owned.get().getInstanceId();
        }

        engine.reconcile();

        assertThat(engine.status(instanceId).getState()).isEqualTo(FaultState.REJECTED);
        assertThat(chaosMesh.getRevertAttempts()).isZero();
    }

    @Test
    public void finished_instances_are_evicted_after_the_retention()
    {
        final var instance = engine.submit(burn(Duration.minutes(5)));
        engine.revert(instance.getInstanceId());

        clock.advance(Duration.minutes(59));
        assertThat(engine.reconcile().getEvicted()).isZero();

        clock.advance(Duration.minutes(2));
        assertThat(engine.reconcile().getEvicted()).isEqualTo(1);

        assertThatThrownBy(() -> engine.status(instance.getInstanceId())).isInstanceOf(NotFoundException.class);
        assertThat(store.loadAll()).isEmpty();
    }
}
