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

package com.google.acptraces.proxy;

import static com.google.common.truth.Truth.assertThat;

import com.google.acptraces.proxy.config.OtlpProtocol;
import com.google.acptraces.proxy.config.ProxyConfig;
import com.google.common.collect.ImmutableList;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricExporter;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.data.SpanData;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OtlpTelemetrySinkTest {

  @Test
  public void flush_exportsEndedSpansWithServiceName() {
    InMemorySpanExporter spanExporter = InMemorySpanExporter.create();
    InMemoryMetricExporter metricExporter = InMemoryMetricExporter.create();
    OtlpTelemetrySink sink = new OtlpTelemetrySink("kiro-agent", spanExporter, metricExporter);

    sink.openTelemetry().getTracer("test").spanBuilder("acp_session").startSpan().end();
    sink.openTelemetry()
        .getMeter("test")
        .histogramBuilder("gen_ai.client.operation.duration")
        .build()
        .record(1.5);
    sink.flush();

    List<SpanData> spans = spanExporter.getFinishedSpanItems();
    assertThat(spans).hasSize(1);
    assertThat(spans.get(0).getName()).isEqualTo("acp_session");
    assertThat(spans.get(0).getResource().getAttribute(OtlpTelemetrySink.SERVICE_NAME))
        .isEqualTo("kiro-agent");
    assertThat(metricExporter.getFinishedMetricItems()).isNotEmpty();
    sink.close();
  }

  @Test
  public void close_flushesAndIsIdempotent() {
    InMemorySpanExporter spanExporter = InMemorySpanExporter.create();
    OtlpTelemetrySink sink =
        new OtlpTelemetrySink("acp-agent", spanExporter, InMemoryMetricExporter.create());

    sink.openTelemetry().getTracer("test").spanBuilder("initialize").startSpan().end();
    sink.close();
    sink.close();

    assertThat(spanExporter.getFinishedSpanItems()).hasSize(1);
  }

  @Test
  public void signalEndpoint_appendsPathOnce() {
    assertThat(OtlpTelemetrySink.signalEndpoint("http://localhost:4318", "/v1/traces"))
        .isEqualTo("http://localhost:4318/v1/traces");
    assertThat(OtlpTelemetrySink.signalEndpoint("http://localhost:4318/", "/v1/metrics"))
        .isEqualTo("http://localhost:4318/v1/metrics");
    assertThat(OtlpTelemetrySink.signalEndpoint("http://otel/v1/traces", "/v1/traces"))
        .isEqualTo("http://otel/v1/traces");
  }

  @Test
  public void create_buildsSinkForEachProtocol() {
    for (OtlpProtocol protocol : OtlpProtocol.values()) {
      ProxyConfig config =
          ProxyConfig.builder().otlpProtocol(protocol).command(ImmutableList.of("agent")).build();

      OtlpTelemetrySink sink = OtlpTelemetrySink.create(config);

      assertThat(sink.openTelemetry()).isNotNull();
      sink.close();
    }
  }
}
