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

import com.google.acptraces.protocol.Direction;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TapChannelTest {

  @Test
  public void take_returnsLinesInOfferOrder() throws Exception {
    TapChannel channel = new TapChannel();

    channel.offer(Direction.EDITOR_TO_AGENT, "request");
    channel.offer(Direction.AGENT_TO_EDITOR, "response");

    assertThat(channel.take()).hasValue(new TappedLine(Direction.EDITOR_TO_AGENT, "request"));
    assertThat(channel.take()).hasValue(new TappedLine(Direction.AGENT_TO_EDITOR, "response"));
  }

  @Test
  public void close_deliversQueuedLinesThenEnds() throws Exception {
    TapChannel channel = new TapChannel();
    channel.offer(Direction.EDITOR_TO_AGENT, "before close");

    channel.close();

    assertThat(channel.isClosed()).isTrue();
    assertThat(channel.take()).hasValue(new TappedLine(Direction.EDITOR_TO_AGENT, "before close"));
    assertThat(channel.take()).isEmpty();
    assertThat(channel.take()).isEmpty();
  }

  @Test
  public void offer_afterClose_isDropped() throws Exception {
    TapChannel channel = new TapChannel();
    channel.close();
    channel.close();

    channel.offer(Direction.AGENT_TO_EDITOR, "late");

    assertThat(channel.take()).isEmpty();
  }

  @Test
  public void take_blocksUntilLineArrives() throws Exception {
    TapChannel channel = new TapChannel();
    Thread producer =
        new Thread(
            () -> {
              try {
                Thread.sleep(50);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              channel.offer(Direction.AGENT_TO_EDITOR, "eventually");
            });
    producer.start();

    assertThat(channel.take()).hasValue(new TappedLine(Direction.AGENT_TO_EDITOR, "eventually"));
    producer.join();
  }
}
