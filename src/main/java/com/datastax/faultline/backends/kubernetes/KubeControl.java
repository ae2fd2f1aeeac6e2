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

import java.util.List;
import java.util.Optional;

import com.datastax.faultline.util.Duration;

/** Runs kubectl commands against the configured cluster */
public interface KubeControl
{
    /** Run <code>kubectl [--namespace=namespace] args...</code>, feeding <code>stdin</code> to it if present.
     *  Returns once the command exits or <code>timeout</code> expires, whichever comes first; a
     *  command that times out is killed.
     *
     *  @throws java.io.UncheckedIOException if kubectl could not be started at all */
    KubeCommandResult execute(Optional<String> namespace, List<String> args, Optional<String> stdin,
        Duration timeout);
}
