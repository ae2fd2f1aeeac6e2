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
package com.datastax.faultline.rendering;

import java.util.Map;

/** Turns a rendering definition plus named values into text (usually a manifest) */
public interface TemplateRenderer
{
    /** @param name identifies the definition in error messages
     *  @throws com.datastax.faultline.exceptions.RenderException if the definition is malformed
     *          or refers to values that <code>scope</code> does not provide */
    String render(String name, String definition, Map<String, Object> scope);
}
