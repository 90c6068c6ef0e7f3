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

import com.google.acptraces.telemetry.SpanCorrelator;
import com.google.acptraces.telemetry.TelemetrySink;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains the tap channel into the correlator. When the channel ends, shuts the correlator down and
 * flushes the sink so the root session span reaches the exporters before the process exits.
 */
final class CorrelatorConsumer implements Runnable {
  private static final Logger logger = LoggerFactory.getLogger(CorrelatorConsumer.class);

  private final TapChannel channel;
  private final SpanCorrelator correlator;
  private final TelemetrySink sink;

  CorrelatorConsumer(TapChannel channel, SpanCorrelator correlator, TelemetrySink sink) {
    this.channel = channel;
    this.correlator = correlator;
    this.sink = sink;
  }

  @Override
  public void run() {
    long processed = 0;
    try {
      Optional<TappedLine> next;
      while ((next = channel.take()).isPresent()) {
        TappedLine tapped = next.get();
        correlator.process(tapped.direction(), tapped.line());
        processed++;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Correlator consumer interrupted after {} line(s)", processed);
    } finally {
      correlator.shutdown();
      sink.flush();
      logger.debug("Correlator consumer finished after {} line(s)", processed);
    }
  }
}
