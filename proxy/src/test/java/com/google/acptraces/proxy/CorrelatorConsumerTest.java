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
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.acptraces.protocol.Direction;
import com.google.acptraces.telemetry.AcpTelemetry;
import com.google.acptraces.telemetry.SpanCorrelator;
import com.google.acptraces.telemetry.TelemetrySink;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.junit4.OpenTelemetryRule;
import io.opentelemetry.sdk.trace.data.SpanData;
import java.util.List;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class CorrelatorConsumerTest {
  @Rule public final OpenTelemetryRule openTelemetryRule = OpenTelemetryRule.create();
  @Rule public final MockitoRule mocks = MockitoJUnit.rule();

  @Mock private TelemetrySink mockSink;

  private TapChannel channel;
  private SpanCorrelator correlator;

  @Before
  public void setUp() {
    when(mockSink.openTelemetry()).thenReturn(openTelemetryRule.getOpenTelemetry());
    channel = new TapChannel();
    correlator =
        new SpanCorrelator(AcpTelemetry.create(mockSink.openTelemetry()), /* recordContent= */ false);
  }

  @Test
  public void run_processesLinesThenShutsDownAndFlushes() {
    channel.offer(
        Direction.EDITOR_TO_AGENT,
        "{\"jsonrpc\":\"2.0\",\"id\":0,\"method\":\"initialize\",\"params\":{}}");
    channel.offer(
        Direction.AGENT_TO_EDITOR,
        "{\"jsonrpc\":\"2.0\",\"id\":0,\"result\":{\"agentInfo\":{\"name\":\"kiro\"}}}");
    channel.offer(
        Direction.EDITOR_TO_AGENT,
        "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"session/prompt\","
            + "\"params\":{\"sessionId\":\"s1\",\"prompt\":[]}}");
    channel.close();

    new CorrelatorConsumer(channel, correlator, mockSink).run();

    List<SpanData> spans = openTelemetryRule.getSpans();
    assertThat(spans).hasSize(3);
    assertThat(spans.get(0).getName()).isEqualTo("initialize");
    assertThat(spans.get(1).getName()).isEqualTo("invoke_agent kiro");
    assertThat(spans.get(1).getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
    assertThat(spans.get(2).getName()).isEqualTo("acp_session");
    assertThat(correlator.agentInfo().get().name()).isEqualTo("kiro");
    verify(mockSink).flush();
  }

  @Test
  public void run_interrupted_stillShutsDownAndFlushes() throws Exception {
    Thread consumer = new Thread(new CorrelatorConsumer(channel, correlator, mockSink));

    consumer.start();
    consumer.interrupt();
    consumer.join(5000);

    assertThat(consumer.isAlive()).isFalse();
    verify(mockSink).flush();
    // The correlator is shut down, so nothing more is traced.
    correlator.process(
        Direction.EDITOR_TO_AGENT,
        "{\"jsonrpc\":\"2.0\",\"id\":0,\"method\":\"initialize\",\"params\":{}}");
    assertThat(openTelemetryRule.getSpans()).isEmpty();
  }
}
