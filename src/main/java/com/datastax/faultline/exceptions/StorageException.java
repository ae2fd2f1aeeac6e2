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

import com.datastax.faultline.util.Exceptions;

/** The instance store refused to save or delete an instance */
public class StorageException extends FaultEngineException
{
    public StorageException(String operation, RuntimeException cause)
    {
        super(Kind.STORAGE, String.format("Could not %s: %s", operation, Exceptions.rootMessage(cause)), cause);
    }
}
