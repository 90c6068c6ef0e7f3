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

import com.fasterxml.jackson.databind.JsonNode;
import com.google.acptraces.AcpJson;
import com.google.acptraces.protocol.PayloadExtractors;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Context;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Attribute vocabulary and span helpers for ACP telemetry. Attribute names follow the OTEL GenAI
 * semantic conventions where one exists, and the {@code acp.*} namespace otherwise.
 */
public final class Tracing {

  static final AttributeKey<String> GEN_AI_OPERATION_NAME =
      AttributeKey.stringKey("gen_ai.operation.name");
  static final AttributeKey<String> GEN_AI_CONVERSATION_ID =
      AttributeKey.stringKey("gen_ai.conversation.id");
  static final AttributeKey<String> GEN_AI_PROVIDER_NAME =
      AttributeKey.stringKey("gen_ai.provider.name");
  static final AttributeKey<String> GEN_AI_AGENT_NAME = AttributeKey.stringKey("gen_ai.agent.name");
  static final AttributeKey<String> GEN_AI_AGENT_ID = AttributeKey.stringKey("gen_ai.agent.id");
  static final AttributeKey<String> GEN_AI_TOOL_NAME = AttributeKey.stringKey("gen_ai.tool.name");
  static final AttributeKey<String> GEN_AI_TOOL_CALL_ID =
      AttributeKey.stringKey("gen_ai.tool.call.id");
  static final AttributeKey<String> GEN_AI_TOOL_TYPE = AttributeKey.stringKey("gen_ai.tool.type");
  static final AttributeKey<String> GEN_AI_TOOL_CALL_ARGUMENTS =
      AttributeKey.stringKey("gen_ai.tool.call.arguments");
  static final AttributeKey<String> GEN_AI_TOOL_CALL_RESULT =
      AttributeKey.stringKey("gen_ai.tool.call.result");
  static final AttributeKey<String> GEN_AI_INPUT_MESSAGES =
      AttributeKey.stringKey("gen_ai.input.messages");
  static final AttributeKey<String> GEN_AI_OUTPUT_MESSAGES =
      AttributeKey.stringKey("gen_ai.output.messages");
  static final AttributeKey<List<String>> GEN_AI_RESPONSE_FINISH_REASONS =
      AttributeKey.stringArrayKey("gen_ai.response.finish_reasons");

  static final AttributeKey<String> RPC_SYSTEM = AttributeKey.stringKey("rpc.system");
  static final AttributeKey<String> RPC_METHOD = AttributeKey.stringKey("rpc.method");
  static final AttributeKey<String> JSONRPC_REQUEST_ID =
      AttributeKey.stringKey("jsonrpc.request.id");
  static final AttributeKey<String> NETWORK_TRANSPORT = AttributeKey.stringKey("network.transport");
  static final AttributeKey<String> ERROR_TYPE = AttributeKey.stringKey("error.type");

  static final AttributeKey<String> ACP_METHOD_NAME = AttributeKey.stringKey("acp.method.name");
  static final AttributeKey<Long> ACP_PROTOCOL_VERSION =
      AttributeKey.longKey("acp.protocol.version");
  static final AttributeKey<String> ACP_AGENT_VERSION = AttributeKey.stringKey("acp.agent.version");
  static final AttributeKey<String> ACP_CLIENT_NAME = AttributeKey.stringKey("acp.client.name");
  static final AttributeKey<String> ACP_CLIENT_VERSION =
      AttributeKey.stringKey("acp.client.version");
  static final AttributeKey<String> ACP_STOP_REASON = AttributeKey.stringKey("acp.stop_reason");
  static final AttributeKey<Long> ACP_TIME_TO_FIRST_TOKEN_MS =
      AttributeKey.longKey("acp.time_to_first_token_ms");
  static final AttributeKey<String> ACP_TOOL_KIND = AttributeKey.stringKey("acp.tool.kind");

  static final String OPERATION_INVOKE_AGENT = "invoke_agent";
  static final String OPERATION_EXECUTE_TOOL = "execute_tool";
  static final String TRANSPORT_PIPE = "pipe";
  static final String RPC_SYSTEM_JSONRPC = "jsonrpc";

  private Tracing() {}

  /**
   * Returns a parent context built from a captured span context, so children can be started long
   * after the parent's owner has moved on. A null span context makes the child a trace root.
   */
  static Context parentContext(@Nullable SpanContext spanContext) {
    return spanContext == null ? Context.root() : Context.root().with(Span.wrap(spanContext));
  }

  /** Starts a span under the given captured parent, or as a trace root when there is none. */
  static Span startWithParent(SpanBuilder builder, @Nullable SpanContext parent) {
    if (parent == null) {
      return builder.setNoParent().startSpan();
    }
    return builder.setParent(parentContext(parent)).startSpan();
  }

  /** Marks a span failed from a JSON-RPC error object. */
  static void markError(Span span, JsonNode error) {
    span.setStatus(StatusCode.ERROR, error.toString());
    span.setAttribute(ERROR_TYPE, PayloadExtractors.errorType(error));
  }

  /** Marks a span failed with a fixed description and {@code error.type}. */
  static void markError(Span span, String description, String errorType) {
    span.setStatus(StatusCode.ERROR, description);
    span.setAttribute(ERROR_TYPE, errorType);
  }

  /** Builds the {@code gen_ai.input.messages} value for a user prompt. */
  static String inputMessages(String promptText) {
    return AcpJson.toJsonString(
        ImmutableList.of(ImmutableMap.of("role", "user", "parts", textParts(promptText))));
  }

  /**
   * Builds the {@code gen_ai.output.messages} value for streamed agent output.
   *
   * @param finishReason omitted from the message when null
   */
  static String outputMessages(String output, @Nullable String finishReason) {
    Map<String, Object> message = new LinkedHashMap<>();
    message.put("role", "assistant");
    message.put("parts", textParts(output));
    if (finishReason != null) {
      message.put("finish_reason", finishReason);
    }
    return AcpJson.toJsonString(ImmutableList.of(message));
  }

  private static ImmutableList<ImmutableMap<String, String>> textParts(String text) {
    return ImmutableList.of(ImmutableMap.of("type", "text", "content", text));
  }
}
