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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.papercut.hdl.Design;
import org.papercut.mutate.Category;
import org.papercut.mutate.Rewrite;
import org.papercut.mutate.RewriteSet;
import org.papercut.mutate.SiteLocator;
import org.papercut.mutate.Variant;
import org.papercut.mutate.VariantGenerator;

@RunWith(JUnit4.class)
public class ConsolidatorTest {

  private static final String SCENARIO =
      "module m (input logic b, input logic [3:0] c, input logic [3:0] d, output logic [3:0] a);\n"
          + "  assign a = b ? c : d;\n"
          + "endmodule\n";

  private final Design base = Design.parse(SCENARIO, "m_concretized.sv");
  private final RewriteSet rewrites = RewriteSet.of(SiteLocator.locate(base, Category.TERNARY));

  /** Returns a completed Run for each branch of the first Rewrite. */
  private ImmutableList<Run> runs(boolean firstPasses, boolean secondPasses) {
    Rewrite rewrite = rewrites.get(0);
    Run first = new Run(Variant.ofBranch(rewrite, 0));
    Run second = new Run(Variant.ofBranch(rewrite, 1));
    first.complete(firstPasses, "");
    second.complete(secondPasses, "");
    return ImmutableList.of(first, second);
  }

  @Test
  public void provenBranchIsApplied() {
    ConsolidatedDesign result =
        Consolidator.consolidate(base, rewrites, runs(true, false), "m_consolidated");
    assertThat(result.design().text())
        .isEqualTo(
            "module m_consolidated (input logic b, input logic [3:0] c, input logic [3:0] d,"
                + " output logic [3:0] a);\n"
                + "  assign a = c;\n"
                + "endmodule\n");
    assertThat(result.applied()).containsExactly(new Variant.Choice(rewrites.get(0), 0));
    assertThat(result.ambiguous()).isEmpty();
  }

  @Test
  public void consolidatingIsRepeatable() {
    List<Run> runs = runs(false, true);
    String first = Consolidator.consolidate(base, rewrites, runs, "m_consolidated").design().text();
    String second =
        Consolidator.consolidate(base, rewrites, runs, "m_consolidated").design().text();
    assertThat(second).isEqualTo(first);
    assertThat(first).contains("  assign a = d;\n");
    assertThat(base.text()).isEqualTo(SCENARIO);
  }

  @Test
  public void severalPassingBranchesAreAmbiguous() {
    ConsolidatedDesign result =
        Consolidator.consolidate(base, rewrites, runs(true, true), "m_consolidated");
    assertThat(result.design().text()).contains("  assign a = c;\n");
    assertThat(result.ambiguous()).containsExactly(rewrites.get(0));
  }

  @Test
  public void nothingPassed() {
    ConsolidatedDesign result =
        Consolidator.consolidate(base, rewrites, runs(false, false), "m_consolidated");
    assertThat(result.applied()).isEmpty();
    assertThat(result.design().text())
        .isEqualTo(SCENARIO.replace("module m ", "module m_consolidated "));
  }

  @Test
  public void runsWithoutASingleChoiceAreIgnored() {
    Run muxed = new Run(Variant.of(base, base.renameModule("m_muxed")));
    muxed.complete(true, "");
    ConsolidatedDesign result =
        Consolidator.consolidate(base, rewrites, ImmutableList.of(muxed), "m_consolidated");
    assertThat(result.applied()).isEmpty();
    assertThat(result.design().text()).contains("  assign a = b ? c : d;\n");
  }

  @Test
  public void applyAllComposesNestedSites() {
    Design nested =
        Design.parse(
            "module n (input logic a, b, c, output logic x, y);\n"
                + "  assign x = a ? (b ? c : a) : c;\n"
                + "  assign y = b ? a : c;\n"
                + "endmodule\n",
            "n.sv");
    RewriteSet all = RewriteSet.of(SiteLocator.locate(nested, Category.TERNARY));
    ConsolidatedDesign result = Consolidator.applyAll(nested, all, "n_unverified");
    assertThat(result.applied()).hasSize(3);
    assertThat(result.design().text())
        .isEqualTo(
            "module n_unverified (input logic a, b, c, output logic x, y);\n"
                + "  assign x = (c);\n"
                + "  assign y = a;\n"
                + "endmodule\n");
  }

  @Test
  public void overlappingChoicesAreSkipped() {
    RewriteSet twice = new RewriteSet();
    twice.addRewrite(Rewrite.of(rewrites.get(0).site()));
    twice.addRewrite(Rewrite.of(rewrites.get(0).site()));
    ConsolidatedDesign result = Consolidator.applyAll(base, twice, "m_unverified");
    assertThat(result.applied()).containsExactly(new Variant.Choice(twice.get(0), 0));
    assertThat(result.design().text()).contains("  assign a = c;\n");
  }

  @Test
  public void firstPassingVariant() {
    ImmutableList<Variant> variants =
        new VariantGenerator().generate(base, rewrites.rewrites());
    Run first = new Run(variants.get(0));
    Run second = new Run(variants.get(1));
    first.complete(false, "");
    second.complete(true, "");
    ConsolidatedDesign result =
        Consolidator.firstPassing(base, ImmutableList.of(first, second), "m_consolidated");
    assertThat(result.design().moduleName()).isEqualTo("m_consolidated");
    assertThat(result.design().text()).contains("  assign a = d;\n");
    assertThat(result.applied()).isEqualTo(variants.get(1).choices());

    second = new Run(variants.get(1));
    second.complete(false, "");
    result = Consolidator.firstPassing(base, ImmutableList.of(first, second), "m_consolidated");
    assertThat(result.applied()).isEmpty();
    assertThat(result.design().text()).contains("  assign a = b ? c : d;\n");
  }
}
