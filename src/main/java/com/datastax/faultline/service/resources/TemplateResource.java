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

import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;

import java.util.Collection;

import com.codahale.metrics.annotation.Timed;

import com.datastax.faultline.engine.OrchestrationEngine;
import com.datastax.faultline.templates.FaultTemplate;

/** Read-only view of the loaded templates, plus an atomic reload */
@Path("/templates")
@Produces(MediaType.APPLICATION_JSON)
public class TemplateResource
{
    private final OrchestrationEngine engine;

    public TemplateResource(OrchestrationEngine engine)
    {
        this.engine = engine;
    }

    @GET
    @Timed
    public Collection<FaultTemplate> list()
    {
        return engine.templates().values();
    }

    @GET
    @Timed
    @Path("/{templateId: .+}")
    public FaultTemplate get(@PathParam("templateId") String templateId)
    {
        return engine.template(templateId);
    }

    @POST
    @Timed
    @Path("/reload")
    public Collection<FaultTemplate> reload()
    {
        return engine.reloadTemplates().values();
    }
}
