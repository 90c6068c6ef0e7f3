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

/** Which way a tapped line travelled through the proxy. */
public enum Direction {
  EDITOR_TO_AGENT,
  AGENT_TO_EDITOR;

  /** The direction a reply to a message travelling this way takes. */
  public Direction opposite() {
    return this == EDITOR_TO_AGENT ? AGENT_TO_EDITOR : EDITOR_TO_AGENT;
  }
}
