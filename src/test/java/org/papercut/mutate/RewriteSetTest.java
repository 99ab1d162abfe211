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

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.papercut.hdl.Design;
import org.papercut.hdl.DesignRewriter;
import org.papercut.testing.Designs;

@RunWith(JUnit4.class)
public class RewriteSetTest {

  private final Design sample = Design.parse(Designs.SAMPLE, "sel.sv");

  @Test
  public void indicesAreAllocatedInRegistrationOrder() {
    RewriteSet rewrites = new RewriteSet();
    for (Category category :
        ImmutableList.of(Category.TERNARY, Category.BIT_SHRINK, Category.CONDITIONAL)) {
      for (Site site : SiteLocator.locate(sample, category)) {
        rewrites.addRewrite(Rewrite.of(site));
      }
    }
    assertThat(rewrites.size()).isEqualTo(6);
    assertThat(rewrites.rewrites().stream().map(Rewrite::startIndex))
        .containsExactly(0, 2, 4, 5, 6, 8)
        .inOrder();
    assertThat(rewrites.totalSelections()).isEqualTo(10);
  }

  @Test
  public void emptySet() {
    RewriteSet rewrites = RewriteSet.of(ImmutableList.of());
    assertThat(rewrites.isEmpty()).isTrue();
    assertThat(rewrites.totalSelections()).isEqualTo(0);
    DesignRewriter rewriter = new DesignRewriter(sample);
    RewriteSet.MuxApplication application = rewrites.applyMuxes(rewriter);
    assertThat(application.applied()).isEmpty();
    assertThat(application.selectIndices()).isEmpty();
    assertThat(rewriter.toDesign().text()).isEqualTo(Designs.SAMPLE);
  }

  @Test
  public void aRewriteIsRegisteredOnce() {
    Rewrite rewrite = Rewrite.of(SiteLocator.locate(sample, Category.TERNARY).get(0));
    RewriteSet first = new RewriteSet();
    first.addRewrite(rewrite);
    assertThrows(IllegalStateException.class, () -> first.addRewrite(rewrite));
    assertThrows(IllegalStateException.class, () -> new RewriteSet().addRewrite(rewrite));
    assertThat(rewrite.startIndex()).isEqualTo(0);
    assertThat(first.totalSelections()).isEqualTo(2);
  }

  @Test
  public void rewritesMustShareADesign() {
    Design other = Design.parse(Designs.SAMPLE, "other.sv");
    RewriteSet rewrites = RewriteSet.of(SiteLocator.locate(sample, Category.TERNARY));
    Rewrite foreign = Rewrite.of(SiteLocator.locate(other, Category.TERNARY).get(0));
    assertThrows(IllegalArgumentException.class, () -> rewrites.addRewrite(foreign));
    assertThrows(
        IllegalArgumentException.class, () -> rewrites.applyMuxes(new DesignRewriter(other)));
  }

  @Test
  public void muxesSkipShrinks() {
    RewriteSet rewrites = new RewriteSet();
    rewrites.addRewrite(Rewrite.of(SiteLocator.locate(sample, Category.BIT_SHRINK).get(0)));
    Rewrite ternary =
        rewrites.addRewrite(Rewrite.of(SiteLocator.locate(sample, Category.TERNARY).get(0)));
    RewriteSet.MuxApplication application = rewrites.applyMuxes(new DesignRewriter(sample));
    assertThat(application.applied()).containsExactly(ternary);
    assertThat(application.selectIndices()).containsExactly(1, 2).inOrder();
  }

  @Test
  public void firstRegisteredRewriteWinsAConflict() {
    Site site = SiteLocator.locate(sample, Category.TERNARY).get(0);
    RewriteSet rewrites = new RewriteSet();
    Rewrite first = rewrites.addRewrite(Rewrite.of(site));
    Rewrite second = rewrites.addRewrite(Rewrite.of(site));
    DesignRewriter rewriter = new DesignRewriter(sample);
    RewriteSet.MuxApplication application = rewrites.applyMuxes(rewriter);
    assertThat(application.applied()).containsExactly(first);
    assertThat(application.conflicts()).containsExactly(new RewriteSet.Conflict(first, second));
    assertThat(application.selectIndices()).containsExactly(0, 1).inOrder();
    assertThat(rewriter.toDesign().text())
        .contains("assign t = (pc_sel0 || (!pc_sel1 && (en))) ? a : b;");
  }
}
