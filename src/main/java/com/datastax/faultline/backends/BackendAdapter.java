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

import com.datastax.faultline.requests.ValidatedRequest;
import com.datastax.faultline.templates.BackendKind;

/** Everything the engine needs from one backend family.  Rendering is pure and separate from applying,
 *  so a rendered artifact can be recorded (and inspected) before anything touches the backend.
 *
 *  <p>Implementations must only throw {@link com.datastax.faultline.exceptions.FaultEngineException}s:
 *  transport failures are classified into the engine's error kinds here, not by the caller. */
public interface BackendAdapter
{
    BackendKind kind();

    /** @throws com.datastax.faultline.exceptions.RenderException */
    Artifact render(ValidatedRequest request);

    /** @throws com.datastax.faultline.exceptions.ApplyException
     *  @throws com.datastax.faultline.exceptions.BackendTimeoutException
     *  @throws com.datastax.faultline.exceptions.UnsupportedBackendException */
    BackendHandle apply(Artifact artifact);

    /** Remove whatever state <code>handle</code> identifies.  Idempotent: reverting something that is
     *  already gone (or was never applied) reports {@link RevertOutcome#ALREADY_GONE}.
     *
     *  @throws com.datastax.faultline.exceptions.RevertException
     *  @throws com.datastax.faultline.exceptions.BackendTimeoutException */
    RevertOutcome revert(BackendHandle handle);

    /** Never throws: a backend that cannot be asked is {@link BackendStatus#UNKNOWN} */
    BackendStatus status(BackendHandle handle);
}
