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
import java.util.Optional;

/** A classified JSON-RPC message observed on one of the proxied pipes. */
public interface AcpMessage {

  /** A message carrying both {@code method} and {@code id}. */
  record Request(RequestId id, String method, JsonNode params) implements AcpMessage {}

  /** A message carrying {@code id} but no {@code method}. */
  record Response(RequestId id, Optional<JsonNode> result, Optional<JsonNode> error)
      implements AcpMessage {

    public boolean isError() {
      return error.isPresent();
    }
  }

  /** A message carrying {@code method} but no {@code id}. */
  record Notification(String method, JsonNode params) implements AcpMessage {}
}
