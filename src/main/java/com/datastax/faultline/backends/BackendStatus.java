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
package com.datastax.faultline.backends;

/** What a backend reports about a previously applied fault */
public enum BackendStatus
{
    /** The fault is in place */
    RUNNING,
    /** The backend finished the fault on its own, but still holds its state */
    COMPLETED,
    /** The backend holds no state for the handle */
    GONE,
    /** The backend could not be asked; never to be read as success */
    UNKNOWN
}
