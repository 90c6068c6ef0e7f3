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
import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards one byte stream to another line by line, handing a decoded copy of every line to a
 * {@link TapChannel}.
 *
 * <p>Bytes are forwarded exactly as read, terminators included, and each line is flushed as soon as
 * its newline arrives. A final line without a newline is forwarded and tapped at end of stream. The
 * copy is queued before the line is written, so a response can never be tapped ahead of the request
 * it answers.
 */
public final class StreamTap implements Callable<Long> {
  private static final Logger logger = LoggerFactory.getLogger(StreamTap.class);

  private final Direction direction;
  private final InputStream source;
  private final OutputStream destination;
  private final TapChannel channel;

  public StreamTap(
      Direction direction, InputStream source, OutputStream destination, TapChannel channel) {
    this.direction = direction;
    this.source = source;
    this.destination = destination;
    this.channel = channel;
  }

  /**
   * Runs until the source reaches end of stream.
   *
   * @return the number of lines forwarded
   * @throws IOException if reading the source or writing the destination fails
   */
  @Override
  public Long call() throws IOException {
    InputStream in = new BufferedInputStream(source);
    ByteArrayOutputStream line = new ByteArrayOutputStream();
    long lines = 0;
    int next;
    while ((next = in.read()) != -1) {
      line.write(next);
      if (next == '\n') {
        forward(line);
        lines++;
      }
    }
    if (line.size() > 0) {
      forward(line);
      lines++;
    }
    logger.debug("{} stream reached end after {} line(s)", direction, lines);
    return lines;
  }

  private void forward(ByteArrayOutputStream line) throws IOException {
    byte[] bytes = line.toByteArray();
    line.reset();
    channel.offer(direction, decode(bytes));
    destination.write(bytes);
    destination.flush();
  }

  /** Decodes a raw line as UTF-8 and strips its {@code \n} or {@code \r\n} terminator. */
  static String decode(byte[] bytes) {
    int length = bytes.length;
    if (length > 0 && bytes[length - 1] == '\n') {
      length--;
      if (length > 0 && bytes[length - 1] == '\r') {
        length--;
      }
    }
    return new String(bytes, 0, length, StandardCharsets.UTF_8);
  }
}
