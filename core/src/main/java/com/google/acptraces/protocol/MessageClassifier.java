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

package com.google.acptraces.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.acptraces.AcpJson;
import java.util.Optional;

/**
 * Turns raw protocol lines into {@link AcpMessage}s. Stateless; lines that are not JSON objects or
 * carry neither a string {@code method} nor an {@code id} yield nothing.
 */
public final class MessageClassifier {

  private MessageClassifier() {}

  public static Optional<AcpMessage> classify(String line) {
    return AcpJson.readObject(line).flatMap(MessageClassifier::classify);
  }

  static Optional<AcpMessage> classify(ObjectNode object) {
    JsonNode method = object.get("method");
    JsonNode id = object.get("id");
    if (method != null && method.isTextual()) {
      JsonNode params = object.has("params") ? object.get("params") : NullNode.getInstance();
      if (id != null) {
        return Optional.of(new AcpMessage.Request(RequestId.of(id), method.asText(), params));
      }
      return Optional.of(new AcpMessage.Notification(method.asText(), params));
    }
    if (id != null) {
      return Optional.of(
          new AcpMessage.Response(
              RequestId.of(id),
              Optional.ofNullable(object.get("result")),
              Optional.ofNullable(object.get("error"))));
    }
    return Optional.empty();
  }
}
