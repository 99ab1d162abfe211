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

import com.google.common.collect.ImmutableMap;
import org.antlr.v4.runtime.Vocabulary;

/**
 * A statics-only class providing convenient access to ANTLR token types (which are just ints).
 *
 * <p>ANTLR's Vocabulary class doesn't provide any direct way to get the token type for a literal
 * token such as {@code ';'}, so we build a map of them once and look up each one we're interested
 * in.
 */
public final class TokenType {

  // Statics only
  private TokenType() {}

  /**
   * A Map from token name to token type. Token names are either literals enclosed in single quotes
   * (e.g. "{@code '+'}") or symbolic names (e.g. "{@code NUMBER}").
   */
  static final ImmutableMap<String, Integer> MAP;

  static {
    // Token types are densely allocated starting from 1, so we stop at the first gap.
    Vocabulary vocab = VerilogLexer.VOCABULARY;
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    for (int i = 1; ; i++) {
      String s = vocab.getLiteralName(i);
      if (s == null) {
        s = vocab.getSymbolicName(i);
        if (s == null) {
          break;
        }
      }
      builder.put(s, i);
    }
    MAP = builder.buildOrThrow();
  }

  /**
   * Returns the token type for the given name. Throws an exception if there is no such token name.
   */
  public static int of(String name) {
    Integer result = MAP.get(name);
    if (result == null) {
      throw new IllegalArgumentException("No token named " + name);
    }
    return result;
  }

  public static final int SEMICOLON = of("';'");
  public static final int PLUS = of("'+'");
  public static final int MINUS = of("'-'");
  public static final int STAR = of("'*'");
  public static final int SLASH = of("'/'");
  public static final int PERCENT = of("'%'");
  public static final int POWER = of("'**'");
  public static final int SHIFT_LEFT = of("'<<'");
  public static final int SHIFT_RIGHT = of("'>>'");
  public static final int ARITHMETIC_SHIFT_LEFT = of("'<<<'");
  public static final int ARITHMETIC_SHIFT_RIGHT = of("'>>>'");
  public static final int LESS_THAN = of("'<'");
  public static final int LESS_THAN_OR_EQUALS = of("'<='");
  public static final int GREATER_THAN = of("'>'");
  public static final int GREATER_THAN_OR_EQUALS = of("'>='");
  public static final int EQUALS_EQUALS = of("'=='");
  public static final int NOT_EQUALS = of("'!='");
  public static final int LOGICAL_AND = of("'&&'");
  public static final int LOGICAL_OR = of("'||'");
  public static final int BANG = of("'!'");
}
