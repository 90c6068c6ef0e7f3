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

package com.google.acptraces.telemetry;

import com.google.acptraces.protocol.Direction;
import com.google.acptraces.protocol.RequestId;
import io.opentelemetry.api.trace.Span;
import javax.annotation.Nullable;

/**
 * A request that has been observed and is waiting for its response.
 *
 * @param span the open span, or null for {@code session/prompt} whose span lives on the session
 * @param method the request method, which selects how the response is handled
 * @param sessionId the session the request belongs to, if it named one
 * @param startNanos ticker reading when the request was observed
 */
record PendingRequest(
    @Nullable Span span, String method, @Nullable String sessionId, long startNanos) {

  /**
   * Identifies a pending request. Editor and agent number their requests independently, so the id
   * is scoped by the direction the request travelled.
   */
  record Key(Direction requester, RequestId id) {

    /** The key a response travelling in {@code responseDirection} answers. */
    static Key answeredBy(Direction responseDirection, RequestId id) {
      return new Key(responseDirection.opposite(), id);
    }
  }
}
