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
package com.datastax.faultline.requests;

import java.util.Map;

import com.google.auto.value.AutoValue;

import com.datastax.faultline.templates.FaultTemplate;

/** A normalized request that passed validation against its template, together with the effective
 *  parameters: what the caller gave plus the template's declared defaults. */
@AutoValue
public abstract class ValidatedRequest
{
    public abstract FaultRequest request();

    public abstract FaultTemplate template();

    public abstract Map<String, Object> parameters();

    static ValidatedRequest of(FaultRequest request, FaultTemplate template, Map<String, Object> parameters)
    {
        return new AutoValue_ValidatedRequest(request, template, parameters);
    }
}
