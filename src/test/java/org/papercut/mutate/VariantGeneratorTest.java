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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.papercut.hdl.Design;

@RunWith(JUnit4.class)
public class VariantGeneratorTest {

  private static final String THREE_TERNARIES =
      String.join(
          "\n",
          "module v (input logic a, b, c, output logic x, y, z);",
          "  logic [3:0] w;",
          "  assign x = a ? b : c;",
          "  assign y = b ? c : a;",
          "  assign z = c ? a : b;",
          "endmodule",
          "");

  private static ImmutableList<Rewrite> rewrites(Design design, Category... categories) {
    RewriteSet result = new RewriteSet();
    for (Category category : categories) {
      for (Site site : SiteLocator.locate(design, category)) {
        result.addRewrite(Rewrite.of(site));
      }
    }
    return result.rewrites();
  }

  @Test
  public void everyCombination() {
    Design design = Design.parse(THREE_TERNARIES, "v.sv");
    ImmutableList<Variant> variants =
        new VariantGenerator().generate(design, rewrites(design, Category.TERNARY));
    assertThat(variants).hasSize(8);
    Set<List<Integer>> branchVectors = new HashSet<>();
    for (int k = 0; k < variants.size(); k++) {
      Variant variant = variants.get(k);
      assertThat(variant.name()).isEqualTo("v_variant" + k);
      assertThat(variant.design().moduleName()).isEqualTo(variant.name());
      assertThat(variant.choices()).hasSize(3);
      branchVectors.add(
          variant.choices().stream().map(Variant.Choice::branch).collect(toImmutableList()));
    }
    assertThat(branchVectors).hasSize(8);
    assertThat(variants.get(0).text())
        .isEqualTo(
            String.join(
                "\n",
                "module v_variant0 (input logic a, b, c, output logic x, y, z);",
                "  logic [3:0] w;",
                "  assign x = b;",
                "  assign y = c;",
                "  assign z = a;",
                "endmodule",
                ""));
  }

  @Test
  public void variantIndexBitsChooseBranches() {
    Design design = Design.parse(THREE_TERNARIES, "v.sv");
    Variant variant =
        new VariantGenerator().generate(design, rewrites(design, Category.TERNARY)).get(5);
    assertThat(variant.choices().stream().map(Variant.Choice::branch))
        .containsExactly(1, 0, 1)
        .inOrder();
    assertThat(variant.text()).contains("assign x = c;\n  assign y = c;\n  assign z = b;");
  }

  @Test
  public void singleBranchRewritesAreLeftOut() {
    Design design = Design.parse(THREE_TERNARIES, "v.sv");
    ImmutableList<Rewrite> rewrites = rewrites(design, Category.TERNARY, Category.BIT_SHRINK);
    assertThat(rewrites).hasSize(4);
    ImmutableList<Variant> variants = new VariantGenerator().generate(design, rewrites);
    assertThat(variants).hasSize(8);
    for (Variant variant : variants) {
      assertThat(variant.text()).contains("  logic [3:0] w;\n");
    }
  }

  @Test
  public void nestedSitesAreLeftOut() {
    Design design =
        Design.parse(
            "module n (input logic a, b, c, output logic x);\n"
                + "  assign x = a ? (b ? c : a) : c;\n"
                + "endmodule\n",
            "n.sv");
    ImmutableList<Variant> variants =
        new VariantGenerator().generate(design, rewrites(design, Category.TERNARY));
    assertThat(variants).hasSize(2);
    assertThat(variants.get(0).text()).contains("assign x = (b ? c : a);");
    assertThat(variants.get(1).text()).contains("assign x = c;");
  }

  @Test
  public void sitesBeyondTheLimitAreLeftOut() {
    Design design = Design.parse(THREE_TERNARIES, "v.sv");
    ImmutableList<Variant> variants =
        new VariantGenerator(2).generate(design, rewrites(design, Category.TERNARY));
    assertThat(variants).hasSize(4);
    for (Variant variant : variants) {
      assertThat(variant.text()).contains("assign z = c ? a : b;");
    }
    assertThat(new VariantGenerator(0).generate(design, rewrites(design, Category.TERNARY)))
        .hasSize(1);
  }

  @Test
  public void limitIsBounded() {
    assertThrows(IllegalArgumentException.class, () -> new VariantGenerator(31));
    assertThrows(IllegalArgumentException.class, () -> new VariantGenerator(-1));
  }
}
