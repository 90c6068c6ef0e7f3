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

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Telemetry state of one ACP session. Created on the first prompt (or tool call) naming the
 * session and kept until shutdown, so it spans every prompt of the conversation.
 */
final class SessionState {

  private final String sessionId;

  @Nullable private Span promptSpan;
  @Nullable private SpanContext promptSpanContext;
  @Nullable private PendingRequest.Key promptOwner;
  private long promptStartNanos;
  @Nullable private Long firstChunkNanos;
  private final StringBuilder output = new StringBuilder();
  private final Map<String, Span> toolSpans = new LinkedHashMap<>();

  SessionState(String sessionId) {
    this.sessionId = sessionId;
  }

  String sessionId() {
    return sessionId;
  }

  /**
   * Makes {@code span} the active prompt of this session and resets streaming state.
   *
   * @return the prompt span that was still open, if any
   */
  @Nullable
  Span beginPrompt(Span span, PendingRequest.Key owner, long startNanos) {
    Span previous = promptSpan;
    promptSpan = span;
    promptSpanContext = span.getSpanContext();
    promptOwner = owner;
    promptStartNanos = startNanos;
    firstChunkNanos = null;
    output.setLength(0);
    return previous;
  }

  /**
   * Removes the active prompt span if it belongs to the request identified by {@code owner}.
   *
   * @return the span, or null if there is none or a newer prompt has taken the slot
   */
  @Nullable
  Span takePromptSpan(PendingRequest.Key owner) {
    if (promptSpan == null || !owner.equals(promptOwner)) {
      return null;
    }
    Span span = promptSpan;
    promptSpan = null;
    promptOwner = null;
    return span;
  }

  /** Removes the active prompt span regardless of which request owns it. */
  @Nullable
  Span takePromptSpan() {
    Span span = promptSpan;
    promptSpan = null;
    promptOwner = null;
    return span;
  }

  /** Context of the latest prompt span, kept after it ends so late tool calls still nest. */
  @Nullable
  SpanContext promptSpanContext() {
    return promptSpanContext;
  }

  long promptStartNanos() {
    return promptStartNanos;
  }

  @Nullable
  Long firstChunkNanos() {
    return firstChunkNanos;
  }

  void recordChunk(long nowNanos, @Nullable String text) {
    if (firstChunkNanos == null) {
      firstChunkNanos = nowNanos;
    }
    if (text != null) {
      output.append(text);
    }
  }

  String output() {
    return output.toString();
  }

  /**
   * Tracks an open tool span.
   *
   * @return the span previously tracked under the same tool-call id, if any
   */
  @Nullable
  Span putToolSpan(String toolCallId, Span span) {
    return toolSpans.put(toolCallId, span);
  }

  @Nullable
  Span removeToolSpan(String toolCallId) {
    return toolSpans.remove(toolCallId);
  }

  Map<String, Span> toolSpans() {
    return toolSpans;
  }
}
