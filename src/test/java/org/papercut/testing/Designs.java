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

package org.papercut.testing;

/** Sample designs shared by tests. */
public final class Designs {

  // Statics only
  private Designs() {}

  /**
   * A module with two sites of each category, plus constructs that are not sites: a conditional
   * in a parameter, a case item whose label is the case expression, a default item, a scalar, a
   * two-dimensional vector and an integer.
   */
  public static final String SAMPLE =
      String.join(
          "\n",
          "module sel #(parameter W = 4, parameter MODE = W > 2 ? 1 : 0) (",
          "  input logic [3:0] a,",
          "  input logic [3:0] b,",
          "  input logic [1:0] op,",
          "  input logic en,",
          "  output logic [3:0] y,",
          "  output logic [3:0] z",
          ");",
          "  logic [3:0] t;",
          "  logic [7:0] wide, wider;",
          "  logic flag;",
          "  logic [3:0][1:0] packed2;",
          "  integer count;",
          "  assign t = en ? a : b;",
          "  always_comb begin",
          "    if (en) z = a;",
          "    else z = b;",
          "    if (op == 2'b11) z = t;",
          "    case (op)",
          "      2'b00: y = a;",
          "      2'b01, 2'b10: y = en ? b : a;",
          "      op: y = t;",
          "      default: y = 4'b0;",
          "    endcase",
          "  end",
          "endmodule",
          "");
}
