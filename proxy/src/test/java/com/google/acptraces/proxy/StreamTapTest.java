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
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.acptraces.protocol.Direction;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StreamTapTest {

  private static List<String> drain(TapChannel channel) throws InterruptedException {
    channel.close();
    List<String> lines = new ArrayList<>();
    Optional<TappedLine> next;
    while ((next = channel.take()).isPresent()) {
      lines.add(next.get().line());
    }
    return lines;
  }

  @Test
  public void call_forwardsBytesExactlyAndTapsEachLine() throws Exception {
    byte[] input =
        "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\"}\r\nnot json\n\n{\"id\":1}\n"
            .getBytes(UTF_8);
    ByteArrayOutputStream output = new ByteArrayOutputStream();
    TapChannel channel = new TapChannel();

    long lines =
        new StreamTap(
                Direction.EDITOR_TO_AGENT, new ByteArrayInputStream(input), output, channel)
            .call();

    assertThat(lines).isEqualTo(4L);
    assertThat(output.toByteArray()).isEqualTo(input);
    assertThat(drain(channel))
        .containsExactly(
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\"}", "not json", "", "{\"id\":1}")
        .inOrder();
  }

  @Test
  public void call_finalLineWithoutNewline_isForwardedAndTapped() throws Exception {
    byte[] input = "first\nlast without newline".getBytes(UTF_8);
    ByteArrayOutputStream output = new ByteArrayOutputStream();
    TapChannel channel = new TapChannel();

    new StreamTap(Direction.AGENT_TO_EDITOR, new ByteArrayInputStream(input), output, channel)
        .call();

    assertThat(output.toByteArray()).isEqualTo(input);
    assertThat(drain(channel)).containsExactly("first", "last without newline").inOrder();
  }

  @Test
  public void call_invalidUtf8_passesThroughUntouched() throws Exception {
    byte[] input = {'a', (byte) 0xff, (byte) 0xfe, 'b', '\n'};
    ByteArrayOutputStream output = new ByteArrayOutputStream();
    TapChannel channel = new TapChannel();

    new StreamTap(Direction.AGENT_TO_EDITOR, new ByteArrayInputStream(input), output, channel)
        .call();

    assertThat(output.toByteArray()).isEqualTo(input);
    assertThat(drain(channel)).hasSize(1);
  }

  @Test
  public void call_emptyStream_forwardsNothing() throws Exception {
    ByteArrayOutputStream output = new ByteArrayOutputStream();
    TapChannel channel = new TapChannel();

    long lines =
        new StreamTap(
                Direction.EDITOR_TO_AGENT, new ByteArrayInputStream(new byte[0]), output, channel)
            .call();

    assertThat(lines).isEqualTo(0L);
    assertThat(output.size()).isEqualTo(0);
    assertThat(drain(channel)).isEmpty();
  }

  @Test
  public void call_tapsLineBeforeWritingIt() throws Exception {
    TapChannel channel = new TapChannel();
    List<Boolean> tappedBeforeWrite = new ArrayList<>();
    OutputStream destination =
        new OutputStream() {
          @Override
          public void write(int b) {
            throw new UnsupportedOperationException();
          }

          @Override
          public void write(byte[] b, int off, int len) throws IOException {
            try {
              tappedBeforeWrite.add(channel.take().isPresent());
            } catch (InterruptedException e) {
              throw new IOException(e);
            }
          }
        };

    new StreamTap(
            Direction.EDITOR_TO_AGENT,
            new ByteArrayInputStream("one\ntwo\n".getBytes(UTF_8)),
            destination,
            channel)
        .call();

    assertThat(tappedBeforeWrite).containsExactly(true, true);
  }

  @Test
  public void call_writeFailure_propagates() {
    OutputStream broken =
        new OutputStream() {
          @Override
          public void write(int b) throws IOException {
            throw new IOException("Broken pipe");
          }
        };

    IOException e =
        assertThrows(
            IOException.class,
            () ->
                new StreamTap(
                        Direction.AGENT_TO_EDITOR,
                        new ByteArrayInputStream("line\n".getBytes(UTF_8)),
                        broken,
                        new TapChannel())
                    .call());
    assertThat(e).hasMessageThat().isEqualTo("Broken pipe");
  }

  @Test
  public void decode_stripsLfAndCrLfOnly() {
    assertThat(StreamTap.decode("abc\n".getBytes(UTF_8))).isEqualTo("abc");
    assertThat(StreamTap.decode("abc\r\n".getBytes(UTF_8))).isEqualTo("abc");
    assertThat(StreamTap.decode("abc\r".getBytes(UTF_8))).isEqualTo("abc\r");
    assertThat(StreamTap.decode("héllo\n".getBytes(UTF_8))).isEqualTo("héllo");
    assertThat(StreamTap.decode("\n".getBytes(UTF_8))).isEmpty();
  }
}
