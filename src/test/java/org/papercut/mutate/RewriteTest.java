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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.papercut.hdl.Design;
import org.papercut.hdl.DesignRewriter;
import org.papercut.testing.Designs;

@RunWith(JUnitParamsRunner.class)
public class RewriteTest {

  private static final String SCENARIO =
      "module m (input logic b, input logic [3:0] c, input logic [3:0] d, output logic [3:0] a);\n"
          + "  assign a = b ? c : d;\n"
          + "endmodule\n";

  private final Design sample = Design.parse(Designs.SAMPLE, "sel.sv");

  private Rewrite rewriteOf(Design design, Category category, int index) {
    return Rewrite.of(SiteLocator.locate(design, category).get(index));
  }

  @Test
  public void ternaryBranches() {
    Design design = Design.parse(SCENARIO, "m.sv");
    Rewrite rewrite = rewriteOf(design, Category.TERNARY, 0);
    assertThat(rewrite.apply(design, 0).text()).contains("  assign a = c;\n");
    assertThat(rewrite.apply(design, 1).text()).contains("  assign a = d;\n");
    // The base is unchanged
    assertThat(design.text()).isEqualTo(SCENARIO);
  }

  @Test
  @Parameters({
    "TERNARY, 0, 0",
    "TERNARY, 0, 1",
    "TERNARY, 1, 0",
    "TERNARY, 1, 1",
    "CONDITIONAL, 0, 0",
    "CONDITIONAL, 0, 1",
    "CONDITIONAL, 1, 0",
    "CONDITIONAL, 1, 1",
    "CASE_ITEM, 0, 0",
    "CASE_ITEM, 0, 1",
    "CASE_ITEM, 1, 0",
    "CASE_ITEM, 1, 1",
  })
  public void applyingRemovesTheSite(Category category, int index, int branch) {
    int before = SiteLocator.locate(sample, category).size();
    Design after = rewriteOf(sample, category, index).apply(sample, branch);
    assertThat(SiteLocator.locate(after, category)).hasSize(before - 1);
  }

  @Test
  public void conditionalBranches() {
    Rewrite withElse = rewriteOf(sample, Category.CONDITIONAL, 0);
    assertThat(withElse.apply(sample, 0).text())
        .contains("  always_comb begin\n    z = a;\n    if (op == 2'b11)");
    assertThat(withElse.apply(sample, 1).text())
        .contains("  always_comb begin\n    z = b;\n    if (op == 2'b11)");
    Rewrite withoutElse = rewriteOf(sample, Category.CONDITIONAL, 1);
    assertThat(withoutElse.apply(sample, 0).text()).contains("    z = t;\n    case (op)");
    assertThat(withoutElse.apply(sample, 1).text()).contains("    ;\n    case (op)");
  }

  @Test
  public void caseItemBranches() {
    Rewrite rewrite = rewriteOf(sample, Category.CASE_ITEM, 1);
    assertThat(rewrite.apply(sample, 0).text()).contains("      op, op: y = en ? b : a;\n");
    assertThat(rewrite.apply(sample, 1).text())
        .contains("      2'b00: y = a;\n      \n      op: y = t;\n");
  }

  @Test
  public void shrinkDecrementsTheLargerBound() {
    Rewrite rewrite = rewriteOf(sample, Category.BIT_SHRINK, 1);
    assertThat(rewrite.numSelections()).isEqualTo(1);
    assertThat(rewrite.apply(sample, 0).text()).contains("  logic [6:0] wide, wider;\n");
    assertThrows(IndexOutOfBoundsException.class, () -> rewrite.apply(sample, 1));

    Design ascending =
        Design.parse("module r (input logic i);\n  logic [0:7] q;\nendmodule\n", "r.sv");
    assertThat(rewriteOf(ascending, Category.BIT_SHRINK, 0).apply(ascending, 0).text())
        .contains("  logic [0:6] q;\n");
  }

  @Test
  public void muxGuardsTheCondition() {
    RewriteSet rewrites = new RewriteSet();
    Rewrite ternary = rewrites.addRewrite(rewriteOf(sample, Category.TERNARY, 0));
    Rewrite conditional = rewrites.addRewrite(rewriteOf(sample, Category.CONDITIONAL, 1));
    DesignRewriter rewriter = new DesignRewriter(sample);
    ternary.applyMux(rewriter);
    conditional.applyMux(rewriter);
    String text = rewriter.toDesign().text();
    assertThat(text).contains("  assign t = (pc_sel0 || (!pc_sel1 && (en))) ? a : b;\n");
    assertThat(text).contains("    if ((pc_sel2 || (!pc_sel3 && (op == 2'b11)))) z = t;\n");
  }

  @Test
  public void muxGuardsEachCaseLabel() {
    RewriteSet rewrites = RewriteSet.of(SiteLocator.locate(sample, Category.CASE_ITEM));
    DesignRewriter rewriter = new DesignRewriter(sample);
    for (Rewrite rewrite : rewrites) {
      rewrite.applyMux(rewriter);
    }
    String text = rewriter.toDesign().text();
    assertThat(text).contains("      ((pc_sel0) ? (op) : (pc_sel1) ? ~(op) : (2'b00)): y = a;\n");
    assertThat(text)
        .contains(
            "      ((pc_sel2) ? (op) : (pc_sel3) ? ~(op) : (2'b01)),"
                + " ((pc_sel2) ? (op) : (pc_sel3) ? ~(op) : (2'b10)): y = en ? b : a;\n");
  }

  @Test
  public void shrinkHasNoMux() {
    Rewrite rewrite = rewriteOf(sample, Category.BIT_SHRINK, 0);
    new RewriteSet().addRewrite(rewrite);
    assertThat(rewrite.muxMatches(rewrite.site().node())).isFalse();
    assertThrows(IllegalStateException.class, () -> rewrite.applyMux(new DesignRewriter(sample)));
  }

  @Test
  public void selectIndicesRequireRegistration() {
    Rewrite rewrite = rewriteOf(sample, Category.TERNARY, 0);
    assertThat(rewrite.isRegistered()).isFalse();
    assertThrows(IllegalStateException.class, rewrite::startIndex);
    RewriteSet rewrites = new RewriteSet();
    rewrites.addRewrite(rewriteOf(sample, Category.CONDITIONAL, 0));
    rewrites.addRewrite(rewrite);
    assertThat(rewrite.startIndex()).isEqualTo(2);
    assertThat(rewrite.selectionIndex(1)).isEqualTo(3);
    assertThat(Rewrite.selectName(rewrite.selectionIndex(1))).isEqualTo("pc_sel3");
    assertThrows(IndexOutOfBoundsException.class, () -> rewrite.selectionIndex(2));
  }

  @Test
  public void matchingIsByIdentity() {
    Rewrite rewrite = rewriteOf(sample, Category.TERNARY, 0);
    Design copy = Design.parse(Designs.SAMPLE, "copy.sv");
    Site sameText = SiteLocator.locate(copy, Category.TERNARY).get(0);
    assertThat(rewrite.matches(rewrite.site().node())).isTrue();
    assertThat(rewrite.matches(sameText.node())).isFalse();
    assertThrows(IllegalArgumentException.class, () -> rewrite.apply(copy, 0));
  }
}
