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

/**
 * JSON-RPC correlation token. Peers echo ids verbatim, so identity is the compact JSON text of the
 * id node: {@code 7} and {@code "7"} are distinct ids.
 *
 * @param canonical compact JSON form, used for equality and hashing
 * @param text human readable form (string ids without quotes), used in span attributes
 */
public record RequestId(String canonical, String text) {

  public static RequestId of(JsonNode id) {
    String canonical = id.toString();
    return new RequestId(canonical, id.isTextual() ? id.asText() : canonical);
  }

  @Override
  public String toString() {
    return canonical;
  }
}
