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

package com.google.acptraces.protocol;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class GenAiMappingsTest {

  @Test
  public void toolType_readOnlyKinds_areDatastore() {
    assertThat(GenAiMappings.toolType("read")).isEqualTo("datastore");
    assertThat(GenAiMappings.toolType("search")).isEqualTo("datastore");
    assertThat(GenAiMappings.toolType("fetch")).isEqualTo("datastore");
  }

  @Test
  public void toolType_everythingElse_isExtension() {
    for (String kind :
        new String[] {"edit", "delete", "move", "execute", "think", "other", "unknown", "", "READ"}) {
      assertThat(GenAiMappings.toolType(kind)).isEqualTo("extension");
    }
  }

  @Test
  public void isToolMethod_matchesExactMethodNames() {
    assertThat(GenAiMappings.isToolMethod("fs/read_text_file")).isTrue();
    assertThat(GenAiMappings.isToolMethod("fs/write_text_file")).isTrue();
    assertThat(GenAiMappings.isToolMethod("terminal/create")).isTrue();
    assertThat(GenAiMappings.isToolMethod("terminal/write")).isTrue();
    assertThat(GenAiMappings.isToolMethod("terminal/resize")).isTrue();
    assertThat(GenAiMappings.isToolMethod("terminal/release")).isTrue();

    assertThat(GenAiMappings.isToolMethod("session/prompt")).isFalse();
    assertThat(GenAiMappings.isToolMethod("terminal/output")).isFalse();
    assertThat(GenAiMappings.isToolMethod("fs/read_text_file ")).isFalse();
  }

  @Test
  public void finishReason_mapsKnownStopReasons() {
    assertThat(GenAiMappings.finishReason("end_turn")).isEqualTo("stop");
    assertThat(GenAiMappings.finishReason("max_tokens")).isEqualTo("length");
    assertThat(GenAiMappings.finishReason("max_turn_requests")).isEqualTo("length");
    assertThat(GenAiMappings.finishReason("refusal")).isEqualTo("content_filter");
    assertThat(GenAiMappings.finishReason("cancelled")).isEqualTo("cancelled");
  }

  @Test
  public void finishReason_unknownStopReason_usesFallback() {
    assertThat(GenAiMappings.finishReason("something_new"))
        .isEqualTo(GenAiMappings.FALLBACK_FINISH_REASON);
    assertThat(GenAiMappings.finishReason("")).isEqualTo(GenAiMappings.FALLBACK_FINISH_REASON);
  }
}
