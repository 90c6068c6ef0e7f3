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

/**
 * Destination for finished spans and recorded metrics. Owns export configuration; the correlator
 * only sees the {@link OpenTelemetry} handle it exposes.
 */
public interface TelemetrySink extends AutoCloseable {

  /** The handle spans and instruments are created from. */
  OpenTelemetry openTelemetry();

  /** Blocks until everything recorded so far has been handed to the exporters. */
  void flush();

  /** Flushes and releases exporters. Calling it more than once has no further effect. */
  @Override
  void close();
}
