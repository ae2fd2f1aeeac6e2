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
package com.datastax.faultline.service.resources;

import javax.validation.constraints.NotNull;
import javax.ws.rs.Consumes;
import javax.ws.rs.DELETE;
import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.QueryParam;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.core.UriBuilder;

import java.util.List;
import java.util.UUID;

import com.codahale.metrics.annotation.Timed;

import com.datastax.faultline.engine.OrchestrationEngine;
import com.datastax.faultline.engine.ReconciliationReport;
import com.datastax.faultline.engine.RevertResult;
import com.datastax.faultline.exceptions.ValidationException;
import com.datastax.faultline.lifecycle.FaultInstance;
import com.datastax.faultline.requests.FaultRequest;
import com.datastax.faultline.util.Duration;

@Path("/faults")
@Produces(MediaType.APPLICATION_JSON)
public class FaultResource
{
    private final OrchestrationEngine engine;

    public FaultResource(OrchestrationEngine engine)
    {
        this.engine = engine;
    }

    @POST
    @Timed
    @Consumes(MediaType.APPLICATION_JSON)
    public Response submit(@NotNull FaultRequest request)
    {
        final FaultInstance instance = engine.submit(request);
        return Response
            .created(UriBuilder.fromResource(FaultResource.class)
                .path("{id}")
                .build(instance.getInstanceId()))
            .entity(instance)
            .build();
    }

    @GET
    @Timed
    public List<FaultInstance> list()
    {
        return engine.list();
    }

    @GET
    @Timed
    @Path("/{id}")
    public FaultInstance status(@PathParam("id") UUID instanceId)
    {
        return engine.status(instanceId);
    }

    @DELETE
    @Timed
    @Path("/{id}")
    public RevertResult revert(@PathParam("id") UUID instanceId)
    {
        return engine.revert(instanceId);
    }

    @POST
    @Timed
    @Path("/{id}/renew")
    public FaultInstance renew(@PathParam("id") UUID instanceId, @QueryParam("ttl") String ttl)
    {
        return engine.renew(instanceId, parseTtl(ttl));
    }

    @POST
    @Timed
    @Path("/reconcile")
    public ReconciliationReport reconcile()
    {
        return engine.reconcile();
    }

    private static Duration parseTtl(String ttl)
    {
        if (ttl == null || ttl.isBlank())
        {
            throw new ValidationException(List.of("ttl: a ttl query parameter is required"));
        }
        if (!Duration.isValid(ttl))
        {
            throw new ValidationException(List.of("ttl: '" + ttl + "' is not a duration"));
        }
        return Duration.fromString(ttl);
    }
}
