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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import com.datastax.faultline.lifecycle.FaultInstance;

/** What a revert did, and the instance as it stands afterwards */
public class RevertResult
{
    public enum Outcome
    {
        /** The fault was removed from the backend */
        REVERTED,
        /** An earlier revert already removed it; nothing was done */
        ALREADY_REVERTED,
        /** The fault never reached the backend */
        NOT_APPLIED,
        /** Apply is still in flight; the revert will run as soon as it finishes */
        QUEUED,
        /** The backend cannot revert; the instance is FAILED_PARTIAL */
        UNSUPPORTED
    }

    private final Outcome outcome;
    private final FaultInstance instance;

    @JsonCreator
    public RevertResult(@JsonProperty("outcome") Outcome outcome, @JsonProperty("instance") FaultInstance instance)
    {
        this.outcome = outcome;
        this.instance = instance;
    }

    @JsonProperty
    public Outcome getOutcome()
    {
        return outcome;
    }

    @JsonProperty
    public FaultInstance getInstance()
    {
        return instance;
    }

    @Override
    public String toString()
    {
        return outcome + " " + instance;
    }
}
