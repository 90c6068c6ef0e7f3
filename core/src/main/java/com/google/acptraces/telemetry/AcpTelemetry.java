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

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Tracer;

/**
 * The tracer and instruments the correlator reports through. Built once by the process owner from
 * an explicit {@link OpenTelemetry} instance and passed down; nothing here touches global state.
 */
public final class AcpTelemetry {

  /** Instrumentation scope of every span and instrument produced by the proxy. */
  public static final String INSTRUMENTATION_SCOPE = "acp-traces";

  static final String OPERATION_DURATION_METRIC = "gen_ai.client.operation.duration";
  static final String TIME_TO_FIRST_TOKEN_METRIC = "gen_ai.server.time_to_first_token";

  private final Tracer tracer;
  private final DoubleHistogram operationDuration;
  private final DoubleHistogram timeToFirstToken;

  private AcpTelemetry(Tracer tracer, Meter meter) {
    this.tracer = tracer;
    this.operationDuration =
        meter
            .histogramBuilder(OPERATION_DURATION_METRIC)
            .setUnit("s")
            .setDescription("GenAI operation duration")
            .build();
    this.timeToFirstToken =
        meter
            .histogramBuilder(TIME_TO_FIRST_TOKEN_METRIC)
            .setUnit("s")
            .setDescription("Time to generate first token")
            .build();
  }

  public static AcpTelemetry create(OpenTelemetry openTelemetry) {
    return new AcpTelemetry(
        openTelemetry.getTracer(INSTRUMENTATION_SCOPE),
        openTelemetry.getMeter(INSTRUMENTATION_SCOPE));
  }

  public Tracer tracer() {
    return tracer;
  }

  void recordOperationDuration(double seconds, String operationName) {
    operationDuration.record(
        seconds, Attributes.of(Tracing.GEN_AI_OPERATION_NAME, operationName));
  }

  void recordTimeToFirstToken(double seconds, String operationName) {
    timeToFirstToken.record(seconds, Attributes.of(Tracing.GEN_AI_OPERATION_NAME, operationName));
  }
}
