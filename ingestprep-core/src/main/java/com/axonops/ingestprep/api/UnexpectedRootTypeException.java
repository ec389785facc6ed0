/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.ingestprep.api;

/**
 * Thrown when the input is valid JSON but its top-level value is not an object.
 *
 * @since 1.0.0
 */
public final class UnexpectedRootTypeException extends IngestException {

    private final JsonValueType actualType;

    public UnexpectedRootTypeException(JsonValueType actualType) {
        super("ingestprep: expecting json dictionary; got " + actualType.jsonName());
        this.actualType = actualType;
    }

    /** @return the type of the top-level value that was found */
    public JsonValueType getActualType() {
        return actualType;
    }
}
