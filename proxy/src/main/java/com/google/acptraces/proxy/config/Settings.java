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

import javax.annotation.Nullable;

/** Reads a setting from system properties first, then from the environment. */
public final class Settings {

  private Settings() {}

  /** Returns the value of {@code key}, or null when neither source defines a non-empty value. */
  @Nullable
  public static String get(String key) {
    String val = System.getProperty(key);
    if (val == null || val.isEmpty()) {
      val = System.getenv(key);
    }
    return val == null || val.isEmpty() ? null : val;
  }
}
