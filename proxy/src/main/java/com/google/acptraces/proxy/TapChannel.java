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

import com.google.acptraces.protocol.Direction;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered hand-off of tapped lines from both forwarders to the single correlator consumer.
 *
 * <p>The queue is unbounded so that {@link #offer} never blocks a forwarder. After {@link #close()}
 * the consumer drains what was already queued and then sees the end of the channel; later offers
 * are dropped.
 */
public final class TapChannel {
  private static final Logger logger = LoggerFactory.getLogger(TapChannel.class);

  private static final TappedLine END_OF_CHANNEL = new TappedLine(Direction.EDITOR_TO_AGENT, "");

  private final BlockingQueue<TappedLine> queue = new LinkedBlockingQueue<>();
  private volatile boolean closed;

  /** Queues a line for the consumer. Never blocks and never throws. */
  public void offer(Direction direction, String line) {
    if (closed) {
      logger.trace("Dropping {} line offered after close", direction);
      return;
    }
    queue.offer(new TappedLine(direction, line));
  }

  /** Marks the end of the channel. Lines already queued are still delivered. */
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    queue.offer(END_OF_CHANNEL);
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Waits for the next line.
   *
   * @return the line, or empty once the channel is closed and everything before the close has been
   *     taken
   */
  public Optional<TappedLine> take() throws InterruptedException {
    TappedLine next = queue.take();
    if (next == END_OF_CHANNEL) {
      // Leave the marker for any later take.
      queue.offer(END_OF_CHANNEL);
      return Optional.empty();
    }
    return Optional.of(next);
  }
}
