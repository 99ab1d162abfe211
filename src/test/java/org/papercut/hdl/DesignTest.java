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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.papercut.hdl.VerilogParser.ModuleDeclarationContext;

@RunWith(JUnit4.class)
public class DesignTest {

  private static final String COUNTER =
      String.join(
          "\n",
          "// An up counter",
          "module counter #(parameter WIDTH = 4) (",
          "  input logic clk,",
          "  input logic rst,",
          "  output logic [WIDTH-1:0] count",
          ");",
          "  always_ff @(posedge clk) begin",
          "    if (rst) count <= '0;",
          "    else count <= count + 1;",
          "  end",
          "endmodule : counter",
          "");

  @Test
  public void renderingWithoutEditsReproducesTheSource() {
    Design design = Design.parse(COUNTER, "counter.sv");
    assertThat(new DesignRewriter(design).renderDocument()).isEqualTo(COUNTER);
  }

  @Test
  public void topModule() {
    Design design = Design.parse(COUNTER, "counter.sv");
    ModuleDeclarationContext module = design.topModule();
    assertThat(design.moduleName()).isEqualTo("counter");
    assertThat(design.textOf(module.endName)).isEqualTo("counter");
    assertThat(design.span(module).line()).isEqualTo(2);
    assertThat(design.span(module).column()).isEqualTo(1);
    assertThat(design.indentationOf(module.moduleItem(0))).isEqualTo("  ");
  }

  @Test
  public void topModuleIsTheOneNotInstantiated() {
    Design design =
        Design.parse(
            String.join(
                "\n",
                "module sub (input logic a, output logic y);",
                "  assign y = ~a;",
                "endmodule",
                "module top (input logic a, output logic y);",
                "  sub u (.a(a), .y(y));",
                "endmodule",
                ""),
            "top.sv");
    assertThat(design.modules()).hasSize(2);
    assertThat(design.moduleName()).isEqualTo("top");
    assertThat(design.renameModule("top_v2").text()).contains("module sub (");
  }

  @Test
  public void renameModuleRenamesEndLabel() {
    Design renamed = Design.parse(COUNTER, "counter.sv").renameModule("counter_v2");
    assertThat(renamed.moduleName()).isEqualTo("counter_v2");
    assertThat(renamed.text())
        .isEqualTo(
            COUNTER
                .replace("module counter #", "module counter_v2 #")
                .replace("endmodule : counter", "endmodule : counter_v2"));
  }

  @Test
  public void syntaxErrorReportsLocation() {
    DesignError e =
        assertThrows(
            DesignError.class,
            () -> Design.parse("module m;\n  assign = 1;\nendmodule\n", "bad.sv"));
    assertThat(e.lineNum).isEqualTo(2);
  }

  @Test
  public void missingModule() {
    Design design = Design.parse("// nothing here\n", "empty.sv");
    assertThrows(StructureNotFoundException.class, design::topModule);
  }

  @Test
  public void offsetsAccountForSurrogatePairs() {
    String text = "// 😀\nmodule smile; endmodule\n";
    Design design = Design.parse(text, "smile.sv");
    assertThat(design.textOf(design.topModule().name)).isEqualTo("smile");
  }
}
