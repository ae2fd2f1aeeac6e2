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
package com.datastax.faultline.exceptions;

import java.util.List;

public class ValidationException extends FaultEngineException
{
    private final List<String> violations;

    public ValidationException(List<String> violations)
    {
        super(Kind.VALIDATION, describe("Invalid fault request", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations()
    {
        return violations;
    }

    @Override
    public List<String> getDetails()
    {
        return violations;
    }
}
