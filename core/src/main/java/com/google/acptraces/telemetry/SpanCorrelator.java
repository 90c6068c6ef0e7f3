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

import static com.google.acptraces.telemetry.Tracing.ACP_AGENT_VERSION;
import static com.google.acptraces.telemetry.Tracing.ACP_CLIENT_NAME;
import static com.google.acptraces.telemetry.Tracing.ACP_CLIENT_VERSION;
import static com.google.acptraces.telemetry.Tracing.ACP_METHOD_NAME;
import static com.google.acptraces.telemetry.Tracing.ACP_PROTOCOL_VERSION;
import static com.google.acptraces.telemetry.Tracing.ACP_STOP_REASON;
import static com.google.acptraces.telemetry.Tracing.ACP_TIME_TO_FIRST_TOKEN_MS;
import static com.google.acptraces.telemetry.Tracing.ACP_TOOL_KIND;
import static com.google.acptraces.telemetry.Tracing.GEN_AI_AGENT_ID;
import static com.google.acptraces.telemetry.Tracing.GEN_AI_AGENT_NAME;
import static com.google.acptraces.telemetry.Tracing.GEN_AI_CONVERSATION_ID;
import static com.google.acptraces.telemetry.Tracing.GEN_AI_INPUT_MESSAGES;
import static com.google.acptraces.telemetry.Tracing.GEN_AI_OPERATION_NAME;
import static com.google.acptraces.telemetry.Tracing.GEN_AI_OUTPUT_MESSAGES;
import static com.google.acptraces.telemetry.Tracing.GEN_AI_PROVIDER_NAME;
import static com.google.acptraces.telemetry.Tracing.GEN_AI_RESPONSE_FINISH_REASONS;
import static com.google.acptraces.telemetry.Tracing.GEN_AI_TOOL_CALL_ARGUMENTS;
import static com.google.acptraces.telemetry.Tracing.GEN_AI_TOOL_CALL_ID;
import static com.google.acptraces.telemetry.Tracing.GEN_AI_TOOL_CALL_RESULT;
import static com.google.acptraces.telemetry.Tracing.GEN_AI_TOOL_NAME;
import static com.google.acptraces.telemetry.Tracing.GEN_AI_TOOL_TYPE;
import static com.google.acptraces.telemetry.Tracing.JSONRPC_REQUEST_ID;
import static com.google.acptraces.telemetry.Tracing.NETWORK_TRANSPORT;
import static com.google.acptraces.telemetry.Tracing.OPERATION_EXECUTE_TOOL;
import static com.google.acptraces.telemetry.Tracing.OPERATION_INVOKE_AGENT;
import static com.google.acptraces.telemetry.Tracing.RPC_METHOD;
import static com.google.acptraces.telemetry.Tracing.RPC_SYSTEM;
import static com.google.acptraces.telemetry.Tracing.RPC_SYSTEM_JSONRPC;
import static com.google.acptraces.telemetry.Tracing.TRANSPORT_PIPE;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.acptraces.protocol.AcpMessage;
import com.google.acptraces.protocol.Direction;
import com.google.acptraces.protocol.GenAiMappings;
import com.google.acptraces.protocol.MessageClassifier;
import com.google.acptraces.protocol.PayloadExtractors;
import com.google.acptraces.protocol.PeerInfo;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds a trace of an ACP conversation from the lines flowing through the proxy.
 *
 * <p>Three lifetimes overlap here: request/response pairs (keyed by requester direction and id),
 * prompts streaming into a session (keyed by session id), and tool calls reported through {@code
 * session/update} notifications (keyed by tool-call id within a session). Every span this class
 * opens is ended exactly once, either when the protocol closes it or in {@link #shutdown()}.
 *
 * <p>Not thread-safe. All calls must come from the single task that drains the tap channel.
 */
public final class SpanCorrelator {

  private static final Logger logger = LoggerFactory.getLogger(SpanCorrelator.class);

  static final String METHOD_INITIALIZE = "initialize";
  static final String METHOD_SESSION_PROMPT = "session/prompt";
  static final String METHOD_SESSION_UPDATE = "session/update";

  static final String ROOT_SPAN_NAME = "acp_session";
  static final String UNKNOWN_SESSION = "unknown";
  static final String UNKNOWN_TOOL = "unknown tool";
  static final String DEFAULT_TOOL_KIND = "other";

  static final String UPDATE_MESSAGE_CHUNK = "agent_message_chunk";
  static final String UPDATE_TOOL_CALL = "tool_call";
  static final String UPDATE_TOOL_CALL_UPDATE = "tool_call_update";
  static final String STATUS_COMPLETED = "completed";
  static final String STATUS_FAILED = "failed";

  static final String SESSION_ENDED = "session ended unexpectedly";
  static final String PROCESS_EXITED = "process exited before response";
  static final String PROMPT_SUPERSEDED = "superseded by a newer prompt";
  static final String TOOL_CALL_ID_REUSED = "tool call id reused";
  static final String REQUEST_ID_REUSED = "request id reused";

  private final Tracer tracer;
  private final AcpTelemetry telemetry;
  private final boolean recordContent;
  private final Ticker ticker;

  private final Map<PendingRequest.Key, PendingRequest> pending = new LinkedHashMap<>();
  private final Map<String, SessionState> sessions = new LinkedHashMap<>();

  @Nullable private Span rootSpan;
  @Nullable private SpanContext rootSpanContext;
  @Nullable private PeerInfo agentInfo;
  @Nullable private PeerInfo clientInfo;
  @Nullable private Long protocolVersion;
  private boolean shutDown;

  /**
   * @param telemetry tracer and instruments to report through
   * @param recordContent whether prompt text, agent output and tool payloads may be copied into
   *     span attributes
   */
  public SpanCorrelator(AcpTelemetry telemetry, boolean recordContent) {
    this(telemetry, recordContent, Ticker.systemTicker());
  }

  @VisibleForTesting
  SpanCorrelator(AcpTelemetry telemetry, boolean recordContent, Ticker ticker) {
    this.telemetry = telemetry;
    this.tracer = telemetry.tracer();
    this.recordContent = recordContent;
    this.ticker = ticker;
  }

  /**
   * Feeds one tapped line into the state machine. Lines that are not JSON-RPC messages are
   * ignored; nothing here ever throws back into the caller.
   */
  public void process(Direction direction, String line) {
    if (shutDown) {
      logger.debug("Ignoring {} line received after shutdown", direction);
      return;
    }
    Optional<AcpMessage> message = MessageClassifier.classify(line);
    if (message.isEmpty()) {
      logger.trace("Dropping unclassified {} line", direction);
      return;
    }
    try {
      dispatch(direction, message.get());
    } catch (RuntimeException e) {
      logger.warn("Failed to correlate {} message: {}", direction, message.get(), e);
    }
  }

  private void dispatch(Direction direction, AcpMessage message) {
    if (message instanceof AcpMessage.Request request) {
      logger.debug("{} request {} id={}", direction, request.method(), request.id());
      handleRequest(direction, request);
    } else if (message instanceof AcpMessage.Response response) {
      logger.debug("{} response id={} error={}", direction, response.id(), response.isError());
      handleResponse(direction, response);
    } else if (message instanceof AcpMessage.Notification notification) {
      logger.debug("{} notification {}", direction, notification.method());
      handleNotification(notification);
    }
  }

  // Requests

  private void handleRequest(Direction direction, AcpMessage.Request request) {
    PendingRequest.Key key = new PendingRequest.Key(direction, request.id());
    String method = request.method();
    if (METHOD_INITIALIZE.equals(method)) {
      startInitialize(key, request);
    } else if (METHOD_SESSION_PROMPT.equals(method)) {
      startPrompt(key, request);
    } else if (GenAiMappings.isToolMethod(method)) {
      startToolMethod(key, request);
    } else {
      startGenericMethod(key, request);
    }
  }

  private void startInitialize(PendingRequest.Key key, AcpMessage.Request request) {
    PayloadExtractors.clientInfo(request.params()).ifPresent(info -> clientInfo = info);
    ensureRootSpan();
    Span span =
        startUnderRoot(
            tracer
                .spanBuilder(METHOD_INITIALIZE)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(RPC_SYSTEM, RPC_SYSTEM_JSONRPC)
                .setAttribute(RPC_METHOD, METHOD_INITIALIZE)
                .setAttribute(ACP_METHOD_NAME, METHOD_INITIALIZE)
                .setAttribute(NETWORK_TRANSPORT, TRANSPORT_PIPE));
    track(key, new PendingRequest(span, METHOD_INITIALIZE, null, ticker.read()));
  }

  private void startPrompt(PendingRequest.Key key, AcpMessage.Request request) {
    JsonNode params = request.params();
    String sessionId = PayloadExtractors.sessionId(params).orElse(UNKNOWN_SESSION);
    String spanName =
        agentInfo == null
            ? OPERATION_INVOKE_AGENT
            : OPERATION_INVOKE_AGENT + " " + agentInfo.name();

    SpanBuilder builder =
        tracer
            .spanBuilder(spanName)
            .setSpanKind(SpanKind.CLIENT)
            .setAttribute(GEN_AI_OPERATION_NAME, OPERATION_INVOKE_AGENT)
            .setAttribute(GEN_AI_CONVERSATION_ID, sessionId)
            .setAttribute(ACP_METHOD_NAME, METHOD_SESSION_PROMPT)
            .setAttribute(NETWORK_TRANSPORT, TRANSPORT_PIPE);
    if (agentInfo != null) {
      builder.setAttribute(GEN_AI_PROVIDER_NAME, "acp." + agentInfo.name());
      builder.setAttribute(GEN_AI_AGENT_NAME, agentInfo.name());
      builder.setAttribute(GEN_AI_AGENT_ID, agentInfo.name());
      agentInfo.version().ifPresent(v -> builder.setAttribute(ACP_AGENT_VERSION, v));
    }
    if (clientInfo != null) {
      builder.setAttribute(ACP_CLIENT_NAME, clientInfo.name());
      clientInfo.version().ifPresent(v -> builder.setAttribute(ACP_CLIENT_VERSION, v));
    }
    if (recordContent) {
      PayloadExtractors.promptText(params)
          .ifPresent(
              text -> builder.setAttribute(GEN_AI_INPUT_MESSAGES, Tracing.inputMessages(text)));
    }

    Span span = startUnderRoot(builder);
    long now = ticker.read();
    SessionState session = sessions.computeIfAbsent(sessionId, SessionState::new);
    Span superseded = session.beginPrompt(span, key, now);
    if (superseded != null) {
      logger.debug("Prompt {} replaces an open prompt on session {}", key.id(), sessionId);
      superseded.setStatus(StatusCode.ERROR, PROMPT_SUPERSEDED);
      superseded.end();
    }
    track(key, new PendingRequest(null, METHOD_SESSION_PROMPT, sessionId, now));
  }

  private void startToolMethod(PendingRequest.Key key, AcpMessage.Request request) {
    String method = request.method();
    String sessionId = PayloadExtractors.sessionId(request.params()).orElse(null);
    SpanBuilder builder =
        tracer
            .spanBuilder(OPERATION_EXECUTE_TOOL + " " + method)
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(GEN_AI_OPERATION_NAME, OPERATION_EXECUTE_TOOL)
            .setAttribute(GEN_AI_TOOL_NAME, method)
            .setAttribute(GEN_AI_TOOL_CALL_ID, request.id().text())
            .setAttribute(GEN_AI_TOOL_TYPE, "function")
            .setAttribute(ACP_METHOD_NAME, method)
            .setAttribute(NETWORK_TRANSPORT, TRANSPORT_PIPE);
    if (sessionId != null) {
      builder.setAttribute(GEN_AI_CONVERSATION_ID, sessionId);
    }
    if (recordContent) {
      builder.setAttribute(GEN_AI_TOOL_CALL_ARGUMENTS, request.params().toString());
    }
    Span span = Tracing.startWithParent(builder, sessionParent(sessionId));
    track(key, new PendingRequest(span, method, sessionId, ticker.read()));
  }

  private void startGenericMethod(PendingRequest.Key key, AcpMessage.Request request) {
    String method = request.method();
    Span span =
        startUnderRoot(
            tracer
                .spanBuilder(method)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(RPC_SYSTEM, RPC_SYSTEM_JSONRPC)
                .setAttribute(RPC_METHOD, method)
                .setAttribute(ACP_METHOD_NAME, method)
                .setAttribute(NETWORK_TRANSPORT, TRANSPORT_PIPE)
                .setAttribute(JSONRPC_REQUEST_ID, request.id().text()));
    String sessionId = PayloadExtractors.sessionId(request.params()).orElse(null);
    track(key, new PendingRequest(span, method, sessionId, ticker.read()));
  }

  private void track(PendingRequest.Key key, PendingRequest request) {
    PendingRequest previous = pending.put(key, request);
    if (previous != null && previous.span() != null) {
      logger.debug("Request id {} reused before its response arrived", key.id());
      previous.span().setStatus(StatusCode.ERROR, REQUEST_ID_REUSED);
      previous.span().end();
    }
  }

  // Responses

  private void handleResponse(Direction direction, AcpMessage.Response response) {
    PendingRequest.Key key = PendingRequest.Key.answeredBy(direction, response.id());
    PendingRequest request = pending.remove(key);
    if (request == null) {
      logger.debug("No pending request for response id={}", response.id());
      return;
    }
    String method = request.method();
    if (METHOD_INITIALIZE.equals(method)) {
      finishInitialize(request, response);
    } else if (METHOD_SESSION_PROMPT.equals(method)) {
      finishPrompt(key, request, response);
    } else if (GenAiMappings.isToolMethod(method)) {
      finishToolMethod(request, response);
    } else {
      finishGenericMethod(request, response);
    }
  }

  private void finishInitialize(PendingRequest request, AcpMessage.Response response) {
    Span span = request.span();
    if (span == null) {
      return;
    }
    response
        .result()
        .ifPresent(
            result -> {
              PayloadExtractors.agentInfo(result)
                  .ifPresent(
                      info -> {
                        agentInfo = info;
                        span.setAttribute(GEN_AI_AGENT_NAME, info.name());
                        span.setAttribute(GEN_AI_AGENT_ID, info.name());
                        info.version().ifPresent(v -> span.setAttribute(ACP_AGENT_VERSION, v));
                      });
              PayloadExtractors.protocolVersion(result)
                  .ifPresent(
                      version -> {
                        protocolVersion = version;
                        span.setAttribute(ACP_PROTOCOL_VERSION, version);
                      });
            });
    response.error().ifPresent(error -> Tracing.markError(span, error));
    if (agentInfo != null && rootSpan != null) {
      rootSpan.setAttribute(GEN_AI_AGENT_NAME, agentInfo.name());
    }
    span.end();
  }

  private void finishPrompt(
      PendingRequest.Key key, PendingRequest request, AcpMessage.Response response) {
    SessionState session = request.sessionId() == null ? null : sessions.get(request.sessionId());
    if (session == null) {
      return;
    }
    Span span = session.takePromptSpan(key);
    if (span == null) {
      logger.debug("Response to superseded prompt {} on session {}", key.id(), session.sessionId());
      return;
    }
    double durationSeconds = secondsSince(request.startNanos());

    Optional<String> stopReason = response.result().flatMap(PayloadExtractors::stopReason);
    String finishReason = stopReason.map(GenAiMappings::finishReason).orElse(null);
    if (finishReason != null) {
      span.setAttribute(ACP_STOP_REASON, stopReason.get());
      span.setAttribute(GEN_AI_RESPONSE_FINISH_REASONS, ImmutableList.of(finishReason));
    }
    String output = session.output();
    if (recordContent && !output.isEmpty()) {
      span.setAttribute(GEN_AI_OUTPUT_MESSAGES, Tracing.outputMessages(output, finishReason));
    }

    Long firstChunk = session.firstChunkNanos();
    if (firstChunk != null) {
      long ttftNanos = Math.max(0L, firstChunk - session.promptStartNanos());
      span.setAttribute(ACP_TIME_TO_FIRST_TOKEN_MS, TimeUnit.NANOSECONDS.toMillis(ttftNanos));
      telemetry.recordTimeToFirstToken(toSeconds(ttftNanos), OPERATION_INVOKE_AGENT);
    }

    response.error().ifPresent(error -> Tracing.markError(span, error));
    span.end();
    telemetry.recordOperationDuration(durationSeconds, OPERATION_INVOKE_AGENT);
  }

  private void finishToolMethod(PendingRequest request, AcpMessage.Response response) {
    Span span = request.span();
    if (span == null) {
      return;
    }
    if (recordContent) {
      response.result().ifPresent(r -> span.setAttribute(GEN_AI_TOOL_CALL_RESULT, r.toString()));
    }
    response.error().ifPresent(error -> Tracing.markError(span, error));
    span.end();
  }

  private void finishGenericMethod(PendingRequest request, AcpMessage.Response response) {
    Span span = request.span();
    if (span == null) {
      return;
    }
    response.error().ifPresent(error -> Tracing.markError(span, error));
    span.end();
  }

  // Notifications

  private void handleNotification(AcpMessage.Notification notification) {
    if (!METHOD_SESSION_UPDATE.equals(notification.method())) {
      return;
    }
    JsonNode params = notification.params();
    Optional<String> sessionId = PayloadExtractors.sessionId(params);
    Optional<String> updateType = PayloadExtractors.updateType(params);
    if (sessionId.isEmpty() || updateType.isEmpty()) {
      return;
    }
    switch (updateType.get()) {
      case UPDATE_MESSAGE_CHUNK:
        recordChunk(sessionId.get(), params);
        break;
      case UPDATE_TOOL_CALL:
        startToolCall(sessionId.get(), params);
        break;
      case UPDATE_TOOL_CALL_UPDATE:
        updateToolCall(sessionId.get(), params);
        break;
      default:
        logger.trace("Ignoring session update {}", updateType.get());
    }
  }

  private void recordChunk(String sessionId, JsonNode params) {
    SessionState session = sessions.get(sessionId);
    if (session == null) {
      return;
    }
    session.recordChunk(ticker.read(), PayloadExtractors.chunkText(params).orElse(null));
  }

  private void startToolCall(String sessionId, JsonNode params) {
    Optional<String> toolCallId = PayloadExtractors.toolCallId(params);
    if (toolCallId.isEmpty()) {
      return;
    }
    String title = PayloadExtractors.toolCallTitle(params).orElse(UNKNOWN_TOOL);
    String kind = PayloadExtractors.toolCallKind(params).orElse(DEFAULT_TOOL_KIND);

    SpanBuilder builder =
        tracer
            .spanBuilder(OPERATION_EXECUTE_TOOL + " " + title)
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(GEN_AI_OPERATION_NAME, OPERATION_EXECUTE_TOOL)
            .setAttribute(GEN_AI_TOOL_NAME, title)
            .setAttribute(GEN_AI_TOOL_CALL_ID, toolCallId.get())
            .setAttribute(GEN_AI_TOOL_TYPE, GenAiMappings.toolType(kind))
            .setAttribute(GEN_AI_CONVERSATION_ID, sessionId)
            .setAttribute(ACP_METHOD_NAME, METHOD_SESSION_UPDATE)
            .setAttribute(ACP_TOOL_KIND, kind)
            .setAttribute(NETWORK_TRANSPORT, TRANSPORT_PIPE);
    if (recordContent) {
      PayloadExtractors.toolCallRawInput(params)
          .ifPresent(raw -> builder.setAttribute(GEN_AI_TOOL_CALL_ARGUMENTS, raw.toString()));
    }
    Span span = Tracing.startWithParent(builder, sessionParent(sessionId));

    SessionState session = sessions.computeIfAbsent(sessionId, SessionState::new);
    Span replaced = session.putToolSpan(toolCallId.get(), span);
    if (replaced != null) {
      logger.debug("Tool call id {} reused on session {}", toolCallId.get(), sessionId);
      replaced.setStatus(StatusCode.ERROR, TOOL_CALL_ID_REUSED);
      replaced.end();
    }
  }

  private void updateToolCall(String sessionId, JsonNode params) {
    Optional<String> toolCallId = PayloadExtractors.toolCallId(params);
    if (toolCallId.isEmpty()) {
      return;
    }
    String status = PayloadExtractors.toolCallStatus(params).orElse("");
    if (!STATUS_COMPLETED.equals(status) && !STATUS_FAILED.equals(status)) {
      return;
    }
    SessionState session = sessions.get(sessionId);
    Span span = session == null ? null : session.removeToolSpan(toolCallId.get());
    if (span == null) {
      logger.debug("No open tool call {} on session {}", toolCallId.get(), sessionId);
      return;
    }
    if (STATUS_FAILED.equals(status)) {
      Tracing.markError(span, "tool call failed", "tool_error");
    }
    if (recordContent) {
      PayloadExtractors.toolCallRawOutput(params)
          .ifPresent(raw -> span.setAttribute(GEN_AI_TOOL_CALL_RESULT, raw.toString()));
    }
    span.end();
  }

  // Shutdown

  /**
   * Ends every span that is still open: prompt and tool spans of each session, then spans of
   * requests that never got a response, and finally the root session span, so the root is the
   * last span to end. Later calls, and later {@link #process} calls, have no effect.
   */
  public void shutdown() {
    if (shutDown) {
      return;
    }
    shutDown = true;
    int forced = 0;
    for (SessionState session : sessions.values()) {
      Span prompt = session.takePromptSpan();
      if (prompt != null) {
        endWithError(prompt, SESSION_ENDED);
        forced++;
      }
      for (Span tool : session.toolSpans().values()) {
        endWithError(tool, SESSION_ENDED);
        forced++;
      }
      session.toolSpans().clear();
    }
    sessions.clear();
    for (PendingRequest request : pending.values()) {
      if (request.span() != null) {
        endWithError(request.span(), PROCESS_EXITED);
        forced++;
      }
    }
    pending.clear();
    if (rootSpan != null) {
      rootSpan.end();
      rootSpan = null;
    }
    logger.info("Correlator shut down, force-closed {} open span(s)", forced);
  }

  // Global identity learned from initialize

  public Optional<PeerInfo> agentInfo() {
    return Optional.ofNullable(agentInfo);
  }

  public Optional<PeerInfo> clientInfo() {
    return Optional.ofNullable(clientInfo);
  }

  public Optional<Long> protocolVersion() {
    return Optional.ofNullable(protocolVersion);
  }

  @VisibleForTesting
  int pendingRequestCount() {
    return pending.size();
  }

  // Helpers

  private void ensureRootSpan() {
    if (rootSpan != null) {
      return;
    }
    rootSpan =
        tracer
            .spanBuilder(ROOT_SPAN_NAME)
            .setSpanKind(SpanKind.INTERNAL)
            .setNoParent()
            .setAttribute(ACP_METHOD_NAME, "session")
            .setAttribute(NETWORK_TRANSPORT, TRANSPORT_PIPE)
            .startSpan();
    rootSpanContext = rootSpan.getSpanContext();
  }

  private Span startUnderRoot(SpanBuilder builder) {
    return Tracing.startWithParent(builder, rootSpanContext);
  }

  /** Parent for spans belonging to a session: its latest prompt if any, else the root. */
  @Nullable
  private SpanContext sessionParent(@Nullable String sessionId) {
    SessionState session = sessionId == null ? null : sessions.get(sessionId);
    if (session != null && session.promptSpanContext() != null) {
      return session.promptSpanContext();
    }
    return rootSpanContext;
  }

  private static void endWithError(Span span, String description) {
    span.setStatus(StatusCode.ERROR, description);
    span.end();
  }

  private double secondsSince(long startNanos) {
    return toSeconds(Math.max(0L, ticker.read() - startNanos));
  }

  private static double toSeconds(long nanos) {
    return nanos / (double) TimeUnit.SECONDS.toNanos(1);
  }
}
