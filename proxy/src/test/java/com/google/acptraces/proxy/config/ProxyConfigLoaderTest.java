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

package com.google.acptraces.proxy.config;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ProxyConfigLoaderTest {

  private static ProxyConfig load(Map<String, String> env, String... args) {
    return ProxyConfigLoader.load(CommandLine.parse(ImmutableList.copyOf(args)), env::get);
  }

  @Test
  public void load_defaults() {
    ProxyConfig config = load(ImmutableMap.of(), "agent", "--acp");

    assertThat(config.getOtlpProtocol()).isEqualTo(OtlpProtocol.GRPC);
    assertThat(config.getOtlpEndpoint()).isEqualTo("http://localhost:4317");
    assertThat(config.getServiceName()).isEqualTo("acp-agent");
    assertThat(config.isRecordContent()).isFalse();
    assertThat(config.getDrainTimeout()).isEqualTo(Duration.ofMillis(2000));
    assertThat(config.getCommand()).containsExactly("agent", "--acp").inOrder();
  }

  @Test
  public void load_httpProtocol_defaultsToHttpPort() {
    ProxyConfig config = load(ImmutableMap.of(), "--otlp-protocol", "http/protobuf", "agent");

    assertThat(config.getOtlpProtocol()).isEqualTo(OtlpProtocol.HTTP_PROTOBUF);
    assertThat(config.getOtlpEndpoint()).isEqualTo("http://localhost:4318");
  }

  @Test
  public void load_environmentFallbacks() {
    ProxyConfig config =
        load(
            ImmutableMap.of(
                "OTEL_EXPORTER_OTLP_ENDPOINT", "http://otel:4318",
                "OTEL_EXPORTER_OTLP_PROTOCOL", "http",
                "OTEL_SERVICE_NAME", "claude-agent",
                "ACP_TRACES_RECORD_CONTENT", "true",
                "ACP_TRACES_DRAIN_TIMEOUT_MS", "500"),
            "agent");

    assertThat(config.getOtlpEndpoint()).isEqualTo("http://otel:4318");
    assertThat(config.getOtlpProtocol()).isEqualTo(OtlpProtocol.HTTP_PROTOBUF);
    assertThat(config.getServiceName()).isEqualTo("claude-agent");
    assertThat(config.isRecordContent()).isTrue();
    assertThat(config.getDrainTimeout()).isEqualTo(Duration.ofMillis(500));
  }

  @Test
  public void load_commandLineOverridesEnvironment() {
    ProxyConfig config =
        load(
            ImmutableMap.of(
                "OTEL_EXPORTER_OTLP_ENDPOINT", "http://env:4317",
                "OTEL_EXPORTER_OTLP_PROTOCOL", "http",
                "OTEL_SERVICE_NAME", "from-env"),
            "--otlp-endpoint",
            "http://cli:4317",
            "--otlp-protocol",
            "grpc",
            "--service-name",
            "from-cli",
            "agent");

    assertThat(config.getOtlpEndpoint()).isEqualTo("http://cli:4317");
    assertThat(config.getOtlpProtocol()).isEqualTo(OtlpProtocol.GRPC);
    assertThat(config.getServiceName()).isEqualTo("from-cli");
  }

  @Test
  public void load_httpJson_mapsToProtobuf() {
    assertThat(load(ImmutableMap.of(), "--otlp-protocol", "http-json", "agent").getOtlpProtocol())
        .isEqualTo(OtlpProtocol.HTTP_PROTOBUF);
  }

  @Test
  public void load_unknownProtocolOnCommandLine_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> load(ImmutableMap.of(), "--otlp-protocol", "carrier-pigeon", "agent"));
  }

  @Test
  public void load_invalidEnvironmentValues_keepDefaults() {
    ProxyConfig config =
        load(
            ImmutableMap.of(
                "OTEL_EXPORTER_OTLP_PROTOCOL", "carrier-pigeon",
                "ACP_TRACES_DRAIN_TIMEOUT_MS", "soon",
                "ACP_TRACES_RECORD_CONTENT", "yes please"),
            "agent");

    assertThat(config.getOtlpProtocol()).isEqualTo(OtlpProtocol.GRPC);
    assertThat(config.getDrainTimeout()).isEqualTo(ProxyConfig.DEFAULT_DRAIN_TIMEOUT);
    assertThat(config.isRecordContent()).isFalse();
  }

  @Test
  public void load_negativeDrainTimeout_keepsDefault() {
    ProxyConfig config = load(ImmutableMap.of("ACP_TRACES_DRAIN_TIMEOUT_MS", "-5"), "agent");

    assertThat(config.getDrainTimeout()).isEqualTo(ProxyConfig.DEFAULT_DRAIN_TIMEOUT);
  }

  @Test
  public void builder_requiresCommand() {
    assertThrows(IllegalArgumentException.class, () -> ProxyConfig.builder().build());
  }
}
