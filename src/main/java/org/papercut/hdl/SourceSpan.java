/*
 * Copyright 2025 The Papercut Authors
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

package org.papercut.hdl;

/**
 * A range of source text: {@code [start, end)} as String offsets, plus the (1-based) line and
 * column of its first character.
 */
public record SourceSpan(int start, int end, int line, int column) {

  /** True if this span and {@code other} share at least one character. */
  public boolean overlaps(SourceSpan other) {
    return start < other.end && other.start < end;
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
