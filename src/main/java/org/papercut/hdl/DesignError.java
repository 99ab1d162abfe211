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

import com.google.errorprone.annotations.FormatMethod;
import org.antlr.v4.runtime.Token;

/** Problems found while reading or interpreting a design throw a DesignError. */
public class DesignError extends RuntimeException {
  public final String msg;
  public final int lineNum;
  public final int charPositionInLine;

  public DesignError(String msg, int lineNum, int charPositionInLine) {
    super(msg);
    this.msg = msg;
    this.lineNum = lineNum;
    this.charPositionInLine = charPositionInLine;
  }

  /** Returns a DesignError located at the given token. */
  public static DesignError at(Token token, String msg) {
    return new DesignError(msg, token.getLine(), token.getCharPositionInLine());
  }

  /** Returns a DesignError located at the given token. */
  @FormatMethod
  public static DesignError at(Token token, String fmt, Object... fmtArgs) {
    return at(token, String.format(fmt, fmtArgs));
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s:%s)", msg, lineNum, charPositionInLine);
  }
}
