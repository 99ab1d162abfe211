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

package org.papercut.mutate;

/** The kinds of syntax that papercut knows how to simplify. */
public enum Category {
  /**
   * A conditional expression {@code c ? a : b}; branch 0 keeps {@code a}, branch 1 keeps {@code b}.
   */
  TERNARY("ternary", 2),

  /**
   * A procedural {@code if} statement; branch 0 keeps the then-statement, branch 1 the
   * else-statement (or nothing).
   */
  CONDITIONAL("if", 2),

  /**
   * A non-default item of a case statement; branch 0 makes it always match, branch 1 deletes it.
   */
  CASE_ITEM("case", 2),

  /** A module-level vector declaration whose single packed range can lose its top bit. */
  BIT_SHRINK("shrink", 1);

  /** Used in the names of generated candidates. */
  public final String tag;

  public final int numBranches;

  Category(String tag, int numBranches) {
    this.tag = tag;
    this.numBranches = numBranches;
  }

  /** True if sites of this category can be toggled at runtime by select inputs. */
  public boolean isMuxable() {
    return this != BIT_SHRINK;
  }
}
