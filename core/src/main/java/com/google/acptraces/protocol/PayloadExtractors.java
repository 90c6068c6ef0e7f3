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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads protocol-specific fields out of request params, notification params and response results.
 * Every accessor returns empty when a step of the path is missing or has the wrong JSON type.
 */
public final class PayloadExtractors {

  /** The error type reported when a JSON-RPC error object has no {@code code}. */
  public static final String OTHER_ERROR_TYPE = "_OTHER";

  private PayloadExtractors() {}

  public static Optional<String> sessionId(JsonNode params) {
    return text(params, "sessionId");
  }

  /** Joins the {@code text} blocks of a {@code session/prompt} request with newlines. */
  public static Optional<String> promptText(JsonNode params) {
    JsonNode prompt = params.path("prompt");
    if (!prompt.isArray()) {
      return Optional.empty();
    }
    List<String> texts = new ArrayList<>();
    for (JsonNode block : prompt) {
      if ("text".equals(block.path("type").textValue()) && block.path("text").isTextual()) {
        texts.add(block.get("text").asText());
      }
    }
    return texts.isEmpty() ? Optional.empty() : Optional.of(String.join("\n", texts));
  }

  public static Optional<String> updateType(JsonNode params) {
    return text(params, "update", "sessionUpdate");
  }

  public static Optional<String> chunkText(JsonNode params) {
    return text(params, "update", "content", "text");
  }

  public static Optional<String> toolCallId(JsonNode params) {
    return text(params, "update", "toolCallId");
  }

  public static Optional<String> toolCallTitle(JsonNode params) {
    return text(params, "update", "title");
  }

  public static Optional<String> toolCallKind(JsonNode params) {
    return text(params, "update", "kind");
  }

  public static Optional<String> toolCallStatus(JsonNode params) {
    return text(params, "update", "status");
  }

  public static Optional<JsonNode> toolCallRawInput(JsonNode params) {
    return node(params, "update", "rawInput");
  }

  public static Optional<JsonNode> toolCallRawOutput(JsonNode params) {
    return node(params, "update", "rawOutput");
  }

  public static Optional<PeerInfo> agentInfo(JsonNode result) {
    return peerInfo(result.path("agentInfo"));
  }

  public static Optional<PeerInfo> clientInfo(JsonNode params) {
    return peerInfo(params.path("clientInfo"));
  }

  public static Optional<Long> protocolVersion(JsonNode result) {
    JsonNode version = result.path("protocolVersion");
    return version.canConvertToExactIntegral() && version.canConvertToLong()
        ? Optional.of(version.longValue())
        : Optional.empty();
  }

  public static Optional<String> stopReason(JsonNode result) {
    return text(result, "stopReason");
  }

  /** The {@code code} of a JSON-RPC error object as text, or {@value #OTHER_ERROR_TYPE}. */
  public static String errorType(JsonNode error) {
    JsonNode code = error.path("code");
    if (code.isMissingNode() || code.isNull()) {
      return OTHER_ERROR_TYPE;
    }
    return code.isTextual() ? code.asText() : code.toString();
  }

  private static Optional<PeerInfo> peerInfo(JsonNode info) {
    if (!info.path("name").isTextual()) {
      return Optional.empty();
    }
    return Optional.of(new PeerInfo(info.get("name").asText(), text(info, "version")));
  }

  private static Optional<String> text(JsonNode root, String... path) {
    return node(root, path).filter(JsonNode::isTextual).map(JsonNode::asText);
  }

  private static Optional<JsonNode> node(JsonNode root, String... path) {
    JsonNode current = root;
    for (String field : path) {
      if (current == null || !current.isObject()) {
        return Optional.empty();
      }
      current = current.get(field);
    }
    return current == null || current.isNull() ? Optional.empty() : Optional.of(current);
  }
}
