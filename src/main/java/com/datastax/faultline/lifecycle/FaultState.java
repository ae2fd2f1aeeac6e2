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

import java.util.EnumSet;
import java.util.Set;

/** The life of a fault instance.  Transitions:
 *
 * <pre>
 *   PENDING        -> ACTIVE          apply succeeded
 *   PENDING        -> REJECTED        apply refused, or failed and nothing was left behind
 *   PENDING        -> FAILED_PARTIAL  apply failed and what it left behind could not be removed
 *   ACTIVE         -> REVERTING       explicit revert, or expiry
 *   ACTIVE         -> FAILED_PARTIAL  backend lost the fault, or could not be reached for too long
 *   REVERTING      -> REVERTED        revert succeeded
 *   REVERTING      -> FAILED_PARTIAL  revert failed
 *   FAILED_PARTIAL -> REVERTING       explicit revert
 * </pre>
 */
public enum FaultState
{
    PENDING,
    ACTIVE,
    REVERTING,
    REVERTED,
    /** The backend may still hold state we could not remove or confirm; needs an explicit revert */
    FAILED_PARTIAL,
    REJECTED;

    private Set<FaultState> successors()
    {
        switch (this)
        {
            case PENDING:
                return EnumSet.of(ACTIVE, REJECTED, FAILED_PARTIAL);
            case ACTIVE:
                return EnumSet.of(REVERTING, FAILED_PARTIAL);
            case REVERTING:
                return EnumSet.of(REVERTED, FAILED_PARTIAL);
            case FAILED_PARTIAL:
                return EnumSet.of(REVERTING);
            default:
                return EnumSet.noneOf(FaultState.class);
        }
    }

    public boolean canTransitionTo(FaultState next)
    {
        return successors().contains(next);
    }

    /** States in which the instance holds a backend handle, and only those */
    public boolean holdsBackendHandle()
    {
        return this == ACTIVE || this == REVERTING || this == FAILED_PARTIAL;
    }

    /** States whose fault is (or is about to be) in effect on the backend, and so take part in conflicts */
    public boolean isLive()
    {
        return this == ACTIVE || this == REVERTING;
    }

    /** No further automatic transitions; {@link #FAILED_PARTIAL} can still be reverted by hand */
    public boolean isTerminal()
    {
        return this == REVERTED || this == REJECTED || this == FAILED_PARTIAL;
    }

    /** Finished for good: nothing is left on the backend and nothing more can happen */
    public boolean isFinished()
    {
        return this == REVERTED || this == REJECTED;
    }
}
