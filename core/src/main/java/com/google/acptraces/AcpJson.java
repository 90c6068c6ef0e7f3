/*
 * Copyright 2026 Google LLC
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

package com.google.acptraces;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;

/** Shared Jackson configuration for reading ACP lines and writing structured span attributes. */
public final class AcpJson {

  private static final ObjectMapper objectMapper = createObjectMapper();

  private AcpJson() {}

  /** Creates the ObjectMapper. */
  private static ObjectMapper createObjectMapper() {
    return new ObjectMapper()
        // A line carries exactly one JSON value; anything after it makes the line malformed.
        .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
  }

  /**
   * Parses a single line as a JSON object.
   *
   * @return the object, or empty if the line is not valid JSON or is not an object
   */
  public static Optional<ObjectNode> readObject(String line) {
    if (line == null || line.isBlank()) {
      return Optional.empty();
    }
    try {
      JsonNode node = objectMapper.readTree(line);
      return node instanceof ObjectNode objectNode ? Optional.of(objectNode) : Optional.empty();
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
  }

  /** Serializes an object to a compact Json string. */
  public static String toJsonString(Object object) {
    try {
      return objectMapper.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(e);
    }
  }
}
