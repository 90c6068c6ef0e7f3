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

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link ProxyConfig} from the command line, falling back to system properties and
 * environment variables for anything the command line leaves unset.
 */
public class ProxyConfigLoader {
  private static final Logger logger = LoggerFactory.getLogger(ProxyConfigLoader.class);

  // Variable names
  static final String ENDPOINT_ENV = "OTEL_EXPORTER_OTLP_ENDPOINT";
  static final String PROTOCOL_ENV = "OTEL_EXPORTER_OTLP_PROTOCOL";
  static final String SERVICE_NAME_ENV = "OTEL_SERVICE_NAME";
  static final String RECORD_CONTENT_ENV = "ACP_TRACES_RECORD_CONTENT";
  static final String DRAIN_TIMEOUT_ENV = "ACP_TRACES_DRAIN_TIMEOUT_MS";

  private ProxyConfigLoader() {}

  public static ProxyConfig load(CommandLine commandLine) {
    return load(commandLine, Settings::get);
  }

  /**
   * @param lookup resolves a variable name to its value, or null when unset
   * @throws IllegalArgumentException if the command line names an unknown OTLP protocol
   */
  @VisibleForTesting
  static ProxyConfig load(CommandLine commandLine, Function<String, String> lookup) {
    ProxyConfig.Builder builder = ProxyConfig.builder().command(commandLine.command());

    Optional<String> protocolName = commandLine.otlpProtocol();
    if (protocolName.isPresent()) {
      builder.otlpProtocol(
          parseProtocol(protocolName.get())
              .orElseThrow(
                  () ->
                      new IllegalArgumentException(
                          "Unknown OTLP protocol: " + protocolName.get())));
    } else {
      String envProtocol = lookup.apply(PROTOCOL_ENV);
      if (envProtocol != null) {
        Optional<OtlpProtocol> parsed = parseProtocol(envProtocol);
        if (parsed.isPresent()) {
          builder.otlpProtocol(parsed.get());
        } else {
          logger.warn("Invalid {} value: {}, using grpc", PROTOCOL_ENV, envProtocol);
        }
      }
    }

    String endpoint = commandLine.otlpEndpoint().orElseGet(() -> lookup.apply(ENDPOINT_ENV));
    if (endpoint != null) {
      builder.otlpEndpoint(endpoint);
    }

    String serviceName = commandLine.serviceName().orElseGet(() -> lookup.apply(SERVICE_NAME_ENV));
    if (serviceName != null) {
      builder.serviceName(serviceName);
    }

    if (commandLine.recordContent()) {
      builder.recordContent(true);
    } else {
      String recordContent = lookup.apply(RECORD_CONTENT_ENV);
      if (recordContent != null) {
        builder.recordContent(Boolean.parseBoolean(recordContent.trim()));
      }
    }

    String drainTimeoutStr = lookup.apply(DRAIN_TIMEOUT_ENV);
    if (drainTimeoutStr != null) {
      try {
        long drainTimeoutMs = Long.parseLong(drainTimeoutStr.trim());
        if (drainTimeoutMs >= 0) {
          builder.drainTimeout(Duration.ofMillis(drainTimeoutMs));
        } else {
          logger.warn("Negative drain timeout: {}, using default", drainTimeoutStr);
        }
      } catch (NumberFormatException e) {
        logger.warn("Invalid drain timeout value: {}, using default", drainTimeoutStr);
      }
    }

    ProxyConfig config = builder.build();
    logger.info("Loaded proxy config: {}", config);
    return config;
  }

  private static Optional<OtlpProtocol> parseProtocol(String name) {
    if (OtlpProtocol.isJsonAlias(name)) {
      logger.warn("OTLP over HTTP/JSON is not supported, exporting with http/protobuf instead");
    }
    return OtlpProtocol.parse(name);
  }
}
