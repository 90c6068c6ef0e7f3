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

import java.util.Locale;
import java.util.Optional;

/** Transport used to ship spans and metrics to the collector. */
public enum OtlpProtocol {
  GRPC("http://localhost:4317"),
  HTTP_PROTOBUF("http://localhost:4318");

  private final String defaultEndpoint;

  OtlpProtocol(String defaultEndpoint) {
    this.defaultEndpoint = defaultEndpoint;
  }

  public String defaultEndpoint() {
    return defaultEndpoint;
  }

  /**
   * Parses a protocol name as accepted on the command line and in {@code
   * OTEL_EXPORTER_OTLP_PROTOCOL}. JSON over HTTP is reported as {@link #HTTP_PROTOBUF}; callers
   * detect that case with {@link #isJsonAlias}.
   */
  public static Optional<OtlpProtocol> parse(String name) {
    switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "grpc":
        return Optional.of(GRPC);
      case "http":
      case "http/protobuf":
      case "http-json":
      case "http/json":
        return Optional.of(HTTP_PROTOBUF);
      default:
        return Optional.empty();
    }
  }

  public static boolean isJsonAlias(String name) {
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    return normalized.equals("http-json") || normalized.equals("http/json");
  }
}
