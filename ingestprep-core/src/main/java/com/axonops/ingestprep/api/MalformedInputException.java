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
 * Thrown when the input handed to {@link FieldExtractor} is not a single valid JSON value.
 *
 * <p>No fields are produced; the extractor is left with an empty field list and can be reused.
 *
 * @since 1.0.0
 */
public final class MalformedInputException extends IngestException {

    public MalformedInputException(String message) {
        super("ingestprep: cannot parse json: " + message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super("ingestprep: cannot parse json: " + message, cause);
    }
}
