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

import com.fasterxml.jackson.core.JsonToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The closed set of JSON value types the flattener understands.
 *
 * <p>Jackson's streaming parser also has structural tokens (field names, end markers) and an
 * embedded-object token that a text parser never produces where a value starts. Meeting one of
 * them means the tokenizer broke its own contract, which is logged and reported as an
 * {@link AssertionError} rather than an input error.
 *
 * @since 1.0.0
 */
public enum JsonValueType {
  NULL("null"),
  OBJECT("object"),
  ARRAY("array"),
  STRING("string"),
  NUMBER("number"),
  BOOLEAN("bool");

  private static final Logger logger = LoggerFactory.getLogger(JsonValueType.class);

  private final String jsonName;

  JsonValueType(String jsonName) {
    this.jsonName = jsonName;
  }

  /** Name used in error messages, e.g. {@code array}. */
  public String jsonName() {
    return jsonName;
  }

  /**
   * Maps the token that starts a value to its type.
   *
   * @param token current parser token, positioned at the start of a value
   * @return the value type
   * @throws AssertionError if the token cannot start a value
   */
  public static JsonValueType of(JsonToken token) {
    if (token == null) {
      logger.error("ingestprep: BUG: no JSON token where a value was expected");
      throw new AssertionError("BUG: no JSON token where a value was expected");
    }
    switch (token) {
      case VALUE_NULL:
        return NULL;
      case START_OBJECT:
        return OBJECT;
      case START_ARRAY:
        return ARRAY;
      case VALUE_STRING:
        return STRING;
      case VALUE_NUMBER_INT:
      case VALUE_NUMBER_FLOAT:
        return NUMBER;
      case VALUE_TRUE:
      case VALUE_FALSE:
        return BOOLEAN;
      default:
        logger.error("ingestprep: BUG: unexpected JSON token {} where a value was expected", token);
        throw new AssertionError("BUG: unexpected JSON token: " + token);
    }
  }
}
