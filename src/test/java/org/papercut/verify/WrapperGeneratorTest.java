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

package org.papercut.verify;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.papercut.hdl.Design;
import org.papercut.hdl.ModuleInterface;

@RunWith(JUnit4.class)
public class WrapperGeneratorTest {

  private static ModuleInterface interfaceOf(String source) {
    return ModuleInterface.of(Design.parse(source, "in.sv"));
  }

  @Test
  public void instantiatesBothAndComparesOutputs() {
    ModuleInterface base =
        interfaceOf(
            "module add #(parameter W = 4) (input logic [W-1:0] a, b, output logic [W-1:0] s);\n"
                + "  assign s = a + b;\n"
                + "endmodule\n");
    ModuleInterface candidate =
        interfaceOf(
            "module add_muxed #(parameter W = 4) (input logic pc_sel0, input logic [W-1:0] a, b,"
                + " output logic [W-1:0] s);\n"
                + "  assign s = pc_sel0 ? a : a + b;\n"
                + "endmodule\n");
    assertThat(WrapperGenerator.generate(base, candidate, "add_muxed_wrapper"))
        .isEqualTo(
            String.join(
                "\n",
                "module add_muxed_wrapper #(",
                "    parameter W = 4",
                ") (",
                "    input logic [W-1:0] a,",
                "    input logic [W-1:0] b,",
                "    input logic pc_sel0,",
                "    output logic [W-1:0] add_s,",
                "    output logic [W-1:0] add_muxed_s,",
                "    output logic equiv",
                ");",
                "",
                "add #(",
                "    .W(W)",
                ") add_inst (",
                "    .a(a),",
                "    .b(b),",
                "    .s(add_s)",
                ");",
                "",
                "add_muxed #(",
                "    .W(W)",
                ") add_muxed_inst (",
                "    .pc_sel0(pc_sel0),",
                "    .a(a),",
                "    .b(b),",
                "    .s(add_muxed_s)",
                ");",
                "",
                "assign equiv = (add_s == add_muxed_s);",
                "",
                "`ifdef FORMAL",
                "  always @(*) begin",
                "    assert(equiv);",
                "  end",
                "`endif",
                "",
                "endmodule",
                ""));
  }

  @Test
  public void everySharedOutputIsCompared() {
    ModuleInterface base =
        interfaceOf("module p (input logic i, output logic x, y, inout wire bus);\nendmodule\n");
    ModuleInterface candidate =
        interfaceOf("module q (input logic i, output logic x, y, inout wire bus);\nendmodule\n");
    String wrapper = WrapperGenerator.generate(base, candidate, "q_wrapper");
    assertThat(wrapper).startsWith("module q_wrapper (\n    input logic i,\n    inout ");
    assertThat(wrapper).contains("\nassign equiv = (p_x == q_x) & (p_y == q_y);\n");
  }

  @Test
  public void noSharedOutputs() {
    ModuleInterface base = interfaceOf("module p (input logic i, output logic x);\nendmodule\n");
    ModuleInterface candidate =
        interfaceOf("module q (input logic i, output logic w);\nendmodule\n");
    String wrapper = WrapperGenerator.generate(base, candidate, "q_wrapper");
    assertThat(wrapper).contains("    output logic p_x,\n    output logic q_w,\n");
    assertThat(wrapper).contains("\nassign equiv = 1'b1;\n");
  }
}
