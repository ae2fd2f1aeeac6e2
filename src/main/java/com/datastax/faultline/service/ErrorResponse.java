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
package com.datastax.faultline.service;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of every error response from the API */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse
{
    @JsonProperty
    private final int code;

    @JsonProperty
    private final String kind;

    @JsonProperty
    private final String message;

    @JsonProperty
    private final List<String> details;

    @JsonCreator
    public ErrorResponse(
        @JsonProperty("code") int code,
        @JsonProperty("kind") String kind,
        @JsonProperty("message") String message,
        @JsonProperty("details") List<String> details)
    {
        this.code = code;
        this.kind = kind;
        this.message = message;
        this.details = details == null ? List.of() : details;
    }

    public int getCode()
    {
        return code;
    }

    public String getKind()
    {
        return kind;
    }

    public String getMessage()
    {
        return message;
    }

    public List<String> getDetails()
    {
        return details;
    }
}
