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

import com.google.common.collect.ImmutableSet;

/** Maps ACP vocabulary onto the GenAI semantic-convention vocabulary. */
public final class GenAiMappings {

  /** Tool type for tool kinds that only read data. */
  public static final String TOOL_TYPE_DATASTORE = "datastore";

  /** Tool type for every other tool kind. */
  public static final String TOOL_TYPE_EXTENSION = "extension";

  /** Finish reason used for stop reasons this mapping does not know. */
  public static final String FALLBACK_FINISH_REASON = "other";

  private static final ImmutableSet<String> DATASTORE_KINDS =
      ImmutableSet.of("read", "search", "fetch");

  private static final ImmutableSet<String> TOOL_METHODS =
      ImmutableSet.of(
          "fs/read_text_file",
          "fs/write_text_file",
          "terminal/create",
          "terminal/write",
          "terminal/resize",
          "terminal/release");

  private GenAiMappings() {}

  /** Returns {@code gen_ai.tool.type} for an ACP tool-call {@code kind}. */
  public static String toolType(String kind) {
    return DATASTORE_KINDS.contains(kind) ? TOOL_TYPE_DATASTORE : TOOL_TYPE_EXTENSION;
  }

  /** Whether an agent-to-editor request method is a filesystem or terminal tool invocation. */
  public static boolean isToolMethod(String method) {
    return TOOL_METHODS.contains(method);
  }

  /** Returns the GenAI finish reason for an ACP {@code stopReason}. */
  public static String finishReason(String stopReason) {
    switch (stopReason) {
      case "end_turn":
        return "stop";
      case "max_tokens":
      case "max_turn_requests":
        return "length";
      case "refusal":
        return "content_filter";
      case "cancelled":
        return "cancelled";
      default:
        return FALLBACK_FINISH_REASON;
    }
  }
}
