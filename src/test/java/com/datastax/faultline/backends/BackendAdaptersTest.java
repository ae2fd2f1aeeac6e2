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

import java.util.List;

import org.junit.jupiter.api.Test;

import com.datastax.faultline.exceptions.UnsupportedBackendException;
import com.datastax.faultline.requests.TestRequests;
import com.datastax.faultline.templates.BackendKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BackendAdaptersTest
{
    @Test
    public void adapters_are_chosen_by_kind()
    {
        final var chaosMesh = new FakeBackendAdapter(BackendKind.CHAOS_MESH);
        final var adapters = new BackendAdapters(List.of(chaosMesh, new UnsupportedBackendAdapter(BackendKind.CHAOSD)));

        assertThat(adapters.get(BackendKind.CHAOS_MESH)).isSameAs(chaosMesh);
        assertThat(adapters.get(BackendKind.CHAOSD).kind()).isEqualTo(BackendKind.CHAOSD);
        assertThatThrownBy(() -> adapters.get(BackendKind.CUSTOM))
            .isInstanceOf(UnsupportedBackendException.class);
    }

    @Test
    public void unsupported_backends_refuse_to_apply_but_never_fail_a_revert()
    {
        final var unsupported = new UnsupportedBackendAdapter(BackendKind.CHAOSD);
        final var validated = TestRequests.validated(TestRequests.hostCpuBurn("burn"));
        final var handle = new BackendHandle(BackendKind.CHAOSD, "token");

        assertThatThrownBy(() -> unsupported.render(validated)).isInstanceOf(UnsupportedBackendException.class);
        assertThat(unsupported.revert(handle)).isEqualTo(RevertOutcome.UNSUPPORTED);
        assertThat(unsupported.status(handle)).isEqualTo(BackendStatus.UNKNOWN);
    }
}
