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
package com.datastax.faultline.templates;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/** The raw shape of an <code>index.yaml</code> document.  Fields are deliberately loosely typed so that
 *  {@link TemplateRegistry} can report every problem at once instead of stopping at the first bad value. */
public class TemplateIndex
{
    @JsonProperty
    public List<Entry> templates = new ArrayList<>();

    public static class Entry
    {
        @JsonProperty("templateID")
        public String templateId;

        @JsonProperty
        public String backend;

        @JsonProperty
        public String path;

        @JsonProperty
        public boolean composable = false;

        @JsonProperty
        public String description;

        @JsonProperty
        public String executor;

        @JsonProperty
        public List<Parameter> parameters = new ArrayList<>();
    }

    public static class Parameter
    {
        @JsonProperty
        public String name;

        @JsonProperty
        public String type;

        @JsonProperty
        public boolean required = false;

        @JsonProperty("default")
        public Object defaultValue;

        @JsonProperty
        public String description;
    }
}
