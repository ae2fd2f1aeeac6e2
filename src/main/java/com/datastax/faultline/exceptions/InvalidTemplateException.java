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

/** A template index that cannot be loaded; lists every problem found, not just the first */
public class InvalidTemplateException extends FaultEngineException
{
    private final List<String> problems;

    public InvalidTemplateException(List<String> problems)
    {
        super(Kind.INVALID_TEMPLATE, describe("Invalid template index", problems));
        this.problems = List.copyOf(problems);
    }

    public InvalidTemplateException(String problem, Throwable cause)
    {
        super(Kind.INVALID_TEMPLATE, "Invalid template index: " + problem, cause);
        this.problems = List.of(problem);
    }

    public List<String> getProblems()
    {
        return problems;
    }

    @Override
    public List<String> getDetails()
    {
        return problems;
    }
}
