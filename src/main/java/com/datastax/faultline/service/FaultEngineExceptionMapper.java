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

import javax.ws.rs.WebApplicationException;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import io.dropwizard.jersey.errors.LoggingExceptionMapper;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.LoggerFactory;

import com.datastax.faultline.exceptions.FaultEngineException;

/** Maps engine errors to statuses by their kind.  Anything else is a server error, reported with the
 *  stack frames from our own code so users can report it without grepping the server log.
 *
 *  <p>Register concrete subclasses only; Jersey cannot work out the exception type of a generic one. */
class FaultEngineExceptionMapper<T extends Throwable> extends LoggingExceptionMapper<T>
{
    static final int UNPROCESSABLE_ENTITY = 422;

    FaultEngineExceptionMapper()
    {
        super(LoggerFactory.getLogger(FaultEngineExceptionMapper.class));
    }

    static int statusFor(FaultEngineException.Kind kind)
    {
        switch (kind)
        {
            case NOT_FOUND:
                return Response.Status.NOT_FOUND.getStatusCode();
            case VALIDATION:
            case RENDER:
            case APPLY_REJECTED:
                return UNPROCESSABLE_ENTITY;
            case CONFLICT:
                return Response.Status.CONFLICT.getStatusCode();
            case APPLY_TRANSIENT:
                return Response.Status.SERVICE_UNAVAILABLE.getStatusCode();
            case TIMEOUT:
                return Response.Status.GATEWAY_TIMEOUT.getStatusCode();
            case REVERT:
                return Response.Status.BAD_GATEWAY.getStatusCode();
            case UNSUPPORTED:
                return Response.Status.NOT_IMPLEMENTED.getStatusCode();
            case INVALID_TEMPLATE:
            case STORAGE:
            default:
                return Response.Status.INTERNAL_SERVER_ERROR.getStatusCode();
        }
    }

    @Override
    public Response toResponse(T exception)
    {
        if (exception instanceof FaultEngineException)
        {
            final var engineException = (FaultEngineException) exception;
            final var status = statusFor(engineException.getKind());
            return Response.status(status)
                .type(MediaType.APPLICATION_JSON_TYPE)
                .entity(new ErrorResponse(status, engineException.getKind().name(),
                    engineException.getMessage(), engineException.getDetails()))
                .build();
        }

        if (exception instanceof WebApplicationException)
        {
            return super.toResponse(exception);
        }

        final long id = logException(exception);

        final List<String> ourFrames = Arrays.stream(ExceptionUtils.getStackFrames(exception))
            .filter(frame -> {
                final String trimmedFrame = frame.trim();
                return !trimmedFrame.startsWith("at") || trimmedFrame.contains("com.datastax.faultline");
            })
            .collect(Collectors.toList());

        final var status = Response.Status.INTERNAL_SERVER_ERROR.getStatusCode();
        return Response.status(status)
            .type(MediaType.APPLICATION_JSON_TYPE)
            .entity(new ErrorResponse(status, "INTERNAL",
                String.format("%s (logged with ID %016x)",
                    exception.getLocalizedMessage() != null ? exception.getLocalizedMessage() : "Server error", id),
                ourFrames))
            .build();
    }
}
