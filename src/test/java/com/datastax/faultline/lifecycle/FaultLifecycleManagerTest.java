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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.datastax.faultline.MutableClock;
import com.datastax.faultline.backends.BackendHandle;
import com.datastax.faultline.exceptions.ConflictException;
import com.datastax.faultline.exceptions.NotFoundException;
import com.datastax.faultline.exceptions.StorageException;
import com.datastax.faultline.requests.FaultRequest;
import com.datastax.faultline.requests.TargetSelector;
import com.datastax.faultline.templates.BackendKind;
import com.datastax.faultline.util.Duration;

import static com.datastax.faultline.requests.TestRequests.NAMESPACE;
import static com.datastax.faultline.requests.TestRequests.cpuThrottle;
import static com.datastax.faultline.requests.TestRequests.networkDelay;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FaultLifecycleManagerTest
{
    private static final BackendHandle HANDLE = new BackendHandle(BackendKind.CHAOS_MESH, "shop/burn");

    private final MutableClock clock = new MutableClock();
    private final RecordingStore store = new RecordingStore();
    private final FaultLifecycleManager manager = new FaultLifecycleManager(store, clock);

    /** Remembers the state of every save, in order */
    private static class RecordingStore extends InMemoryFaultInstanceStore
    {
        final List<FaultState> saved = new ArrayList<>();
        RuntimeException failNextSave;

        @Override
        public synchronized void save(FaultInstance instance)
        {
            if (failNextSave != null)
            {
                final var failure = failNextSave;
                failNextSave = null;
                throw failure;
            }
            saved.add(instance.getState());
            super.save(instance);
        }
    }

    private static FaultRequest request(String name)
    {
        return cpuThrottle(name, Duration.seconds(60)).normalize("chaos-testing");
    }

    private FaultInstance active(FaultRequest request, boolean composable)
    {
        try (var owned = manager.create(request, composable))
        {
            return owned.activate(new BackendHandle(BackendKind.CHAOS_MESH, request.namespace() + "/" +
                request.name()));
        }
    }

    @Test
    public void every_transition_is_persisted_in_order()
    {
        try (var owned = manager.create(request("burn"), false))
        {
            owned.activate(HANDLE);
            owned.beginRevert();
            owned.completeRevert();
        }

        assertThat(store.saved).containsExactly(FaultState.PENDING, FaultState.ACTIVE, FaultState.REVERTING,
            FaultState.REVERTED);
    }

    @Test
    public void activation_sets_the_expiry_from_the_ttl()
    {
        final var instance = active(request("burn"), false);

        assertThat(instance.getActivatedAt()).contains(clock.instant());
        assertThat(instance.getExpiresAt()).contains(clock.instant().plusSeconds(60));
        assertThat(instance.isExpired(clock.instant().plusSeconds(59))).isFalse();
        assertThat(instance.isExpired(clock.instant().plusSeconds(60))).isTrue();
    }

    @Test
    public void a_failed_save_leaves_the_published_state_unchanged()
    {
        final UUID instanceId;
        try (var owned = manager.create(request("burn"), false))
        {
            instanceId = owned.get().getInstanceId();
            store.failNextSave = new IllegalStateException("disk full");
            assertThatThrownBy(() -> owned.activate(HANDLE))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("disk full")
                .hasCauseInstanceOf(IllegalStateException.class);
        }

        assertThat(manager.get(instanceId).getState()).isEqualTo(FaultState.PENDING);
    }

    @Test
    public void a_settling_transition_is_published_even_when_the_store_refuses_it()
    {
        final UUID instanceId;
        try (var owned = manager.create(request("burn"), false))
        {
            instanceId = owned.get().getInstanceId();
            store.failNextSave = new IllegalStateException("disk full");
            owned.failPartialEvenIfUnsaved(HANDLE, "apply succeeded but could not be recorded");
        }

        assertThat(manager.get(instanceId).getState()).isEqualTo(FaultState.FAILED_PARTIAL);
        assertThat(manager.get(instanceId).getBackendHandle()).contains(HANDLE);
        assertThat(store.saved).containsExactly(FaultState.PENDING);
    }

    @Test
    public void illegal_transitions_are_refused()
    {
        try (var owned = manager.create(request("burn"), false))
        {
            owned.activate(HANDLE);
            assertThatThrownBy(() -> owned.reject("too late")).isInstanceOf(IllegalStateException.class);
            assertThat(owned.get().getState()).isEqualTo(FaultState.ACTIVE);
        }
    }

    @Test
    public void ownership_cannot_be_used_after_release()
    {
        final var owned = manager.create(request("burn"), false);
        owned.close();
        owned.close();

        assertThatThrownBy(() -> owned.activate(HANDLE)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void only_one_owner_at_a_time() throws Exception
    {
        try (var owned = manager.create(request("burn"), false))
        {
            final var instanceId = owned.get().getInstanceId();
            final var contender = CompletableFuture.supplyAsync(
                () -> manager.tryOwn(instanceId, Duration.milliseconds(50)));

            assertThat(contender.get(10, TimeUnit.SECONDS)).isEmpty();
        }
    }

    @Test
    public void unknown_instances_are_not_found()
    {
        final var instanceId = UUID.randomUUID();

        assertThatThrownBy(() -> manager.get(instanceId)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> manager.own(instanceId)).isInstanceOf(NotFoundException.class);
        assertThat(manager.find(instanceId)).isEmpty();
    }

    @Test
    public void a_revert_can_only_be_queued_while_pending()
    {
        try (var owned = manager.create(request("burn"), false))
        {
            final var instanceId = owned.get().getInstanceId();

            assertThat(manager.queueRevertIfPending(instanceId)).isTrue();
            assertThat(owned.takeQueuedRevert()).isTrue();
            assertThat(owned.takeQueuedRevert()).isFalse();

            owned.activate(HANDLE);
            assertThat(manager.queueRevertIfPending(instanceId)).isFalse();
        }
    }

    @Test
    public void renew_moves_the_expiry_and_records_the_new_ttl()
    {
        final var instance = active(request("burn"), false);
        clock.advance(Duration.seconds(30));

        try (var owned = manager.own(instance.getInstanceId()))
        {
            final var renewed = owned.renew(Duration.minutes(5));

            assertThat(renewed.getExpiresAt()).contains(clock.instant().plusSeconds(300));
            assertThat(renewed.getRequest().getMetadata().getTtl()).contains(Duration.minutes(5));
        }
    }

    @Test
    public void backend_unknown_keeps_the_first_time_it_was_seen()
    {
        final var instance = active(request("burn"), false);
        final var firstSeen = clock.instant();

        try (var owned = manager.own(instance.getInstanceId()))
        {
            owned.markBackendUnknown();
            clock.advance(Duration.seconds(10));
            assertThat(owned.markBackendUnknown().getBackendUnknownSince()).contains(firstSeen);

            assertThat(owned.markBackendKnown().getBackendUnknownSince()).isEmpty();
        }
    }

    @Test
    public void overlapping_live_instances_conflict()
    {
        final var existing = active(request("burn"), false);

        try (var candidate = manager.create(request("burn-again"), false))
        {
            assertThatThrownBy(() -> manager.checkConflicts(candidate.get()))
                .isInstanceOfSatisfying(ConflictException.class,
                    e -> assertThat(e.getConflictingInstanceIds()).containsExactly(existing.getInstanceId()));
        }
    }

    @Test
    public void disjoint_selectors_do_not_conflict()
    {
        active(request("burn"), false);
        final var elsewhere = cpuThrottle("elsewhere", Duration.seconds(60),
            TargetSelector.pods(NAMESPACE, "web-1"), 50).normalize("chaos-testing");

        try (var candidate = manager.create(elsewhere, false))
        {
            manager.checkConflicts(candidate.get());
        }
    }

    @Test
    public void composable_faults_may_overlap()
    {
        final var everything = TargetSelector.namespace(NAMESPACE, Map.of());
        active(networkDelay("delay-a", everything).normalize("chaos-testing"), true);

        try (var candidate = manager.create(networkDelay("delay-b", everything).normalize("chaos-testing"), true))
        {
            manager.checkConflicts(candidate.get());
        }
    }

    @Test
    public void the_same_name_conflicts_even_when_composable()
    {
        final var everything = TargetSelector.namespace(NAMESPACE, Map.of());
        active(networkDelay("delay", everything).normalize("chaos-testing"), true);

        try (var candidate = manager.create(networkDelay("delay", everything).normalize("chaos-testing"), true))
        {
            assertThatThrownBy(() -> manager.checkConflicts(candidate.get()))
                .isInstanceOf(ConflictException.class);
        }
    }

    @Test
    public void a_partially_failed_instance_still_owns_its_name()
    {
        try (var owned = manager.create(request("burn"), false))
        {
            owned.failPartial(HANDLE, "cleanup failed");
        }

        try (var candidate = manager.create(request("burn"), false))
        {
            assertThatThrownBy(() -> manager.checkConflicts(candidate.get()))
                .isInstanceOf(ConflictException.class);
        }
    }

    @Test
    public void reverted_instances_do_not_conflict()
    {
        final var existing = active(request("burn"), false);
        try (var owned = manager.own(existing.getInstanceId()))
        {
            owned.beginRevert();
            owned.completeRevert();
        }

        try (var candidate = manager.create(request("burn"), false))
        {
            manager.checkConflicts(candidate.get());
        }
    }

    @Test
    public void reserving_a_busy_scope_times_out_as_a_conflict()
    {
        try (var ignored = manager.reserveScope(Set.of(NAMESPACE), Duration.seconds(1)))
        {
            final var waiter = CompletableFuture.supplyAsync(
                () -> manager.reserveScope(Set.of(NAMESPACE), Duration.milliseconds(50)));

            assertThatThrownBy(() -> waiter.get(10, TimeUnit.SECONDS))
                .hasCauseInstanceOf(ConflictException.class);
        }
    }

    @Test
    public void finished_instances_are_evicted_after_the_retention()
    {
        final UUID rejected;
        try (var owned = manager.create(request("burn"), false))
        {
            rejected = owned.get().getInstanceId();
            owned.reject("bad manifest");
        }
        final UUID partial;
        try (var owned = manager.create(request("stuck"), false))
        {
            partial = owned.get().getInstanceId();
            owned.failPartial(HANDLE, "cleanup failed");
        }

        clock.advance(Duration.minutes(30));
        assertThat(manager.evictFinished(Duration.hours(1))).isZero();

        clock.advance(Duration.minutes(31));
        assertThat(manager.evictFinished(Duration.hours(1))).isEqualTo(1);

        assertThat(manager.find(rejected)).isEmpty();
        assertThat(manager.find(partial)).isPresent();
        assertThat(store.loadAll()).extracting(FaultInstance::getInstanceId).containsExactly(partial);
    }

    @Test
    public void recover_restores_stored_instances()
    {
        final var existing = active(request("burn"), false);

        final var recovered = new FaultLifecycleManager(store, clock);
        assertThat(recovered.recover()).isEqualTo(1);

        assertThat(recovered.get(existing.getInstanceId()).getState()).isEqualTo(FaultState.ACTIVE);
        assertThat(recovered.get(existing.getInstanceId()).getBackendHandle()).contains(
            new BackendHandle(BackendKind.CHAOS_MESH, "shop/burn"));
    }

    @Test
    public void list_is_oldest_first()
    {
        final var first = active(request("first"), false);
        clock.advance(Duration.seconds(1));
        final var second = active(cpuThrottle("second", Duration.seconds(60),
            TargetSelector.pods(NAMESPACE, "web-2"), 10).normalize("chaos-testing"), false);

        assertThat(manager.list()).extracting(FaultInstance::getInstanceId)
            .containsExactly(first.getInstanceId(), second.getInstanceId());
    }
}
