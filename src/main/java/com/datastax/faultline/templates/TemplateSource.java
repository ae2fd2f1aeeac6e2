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

import java.util.Optional;

/** Where templates come from: a versioned index plus the rendering definitions it refers to */
public interface TemplateSource
{
    /** Human-readable location, used in log and error messages */
    String describe();

    TemplateIndex readIndex();

    /** The rendering definition at <code>path</code>, relative to the source; empty if there is none */
    Optional<String> readDefinition(String path);
}
