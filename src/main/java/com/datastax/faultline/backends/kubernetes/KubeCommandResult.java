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

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class KubeCommandResult
{
    public abstract String command();

    /** Meaningless if {@link #timedOut} */
    public abstract int exitCode();

    public abstract String stdout();

    public abstract String stderr();

    public abstract boolean timedOut();

    public static KubeCommandResult completed(String command, int exitCode, String stdout, String stderr)
    {
        return new AutoValue_KubeCommandResult(command, exitCode, stdout, stderr, false);
    }

    public static KubeCommandResult timedOut(String command)
    {
        return new AutoValue_KubeCommandResult(command, -1, "", "", true);
    }

    public boolean succeeded()
    {
        return !timedOut() && exitCode() == 0;
    }
}
