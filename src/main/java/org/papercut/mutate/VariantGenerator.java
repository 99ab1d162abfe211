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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;
import org.papercut.hdl.Design;
import org.papercut.hdl.DesignRewriter;
import org.papercut.hdl.SourceSpan;
import org.papercut.hdl.VerilogParser.ModuleDeclarationContext;

/**
 * Enumerates every combination of branch choices across a set of independent two-branch Rewrites:
 * for {@code n} Rewrites, {@code 2^n} Variants, where Variant {@code k} takes branch
 * {@code (k >> i) & 1} of Rewrite {@code i}.
 *
 * <p>Variants are produced by editing the base text directly. Each Rewrite's span and branch texts
 * are computed once from the unmodified source, and each combination applies its replacements in
 * descending offset order so that earlier offsets stay valid.
 */
public final class VariantGenerator {
  private static final Logger logger = Logger.getLogger(VariantGenerator.class.getName());

  /** The default limit on the number of Rewrites combined (and so 2^10 Variants). */
  public static final int DEFAULT_MAX_SITES = 10;

  private final int maxSites;

  public VariantGenerator() {
    this(DEFAULT_MAX_SITES);
  }

  public VariantGenerator(int maxSites) {
    checkArgument(maxSites >= 0 && maxSites <= 30, "maxSites must be in 0..30");
    this.maxSites = maxSites;
  }

  /** A replacement of {@code [start, end)} in the base text. */
  private record TextEdit(int start, int end, String text) {}

  /** One Rewrite's span and the replacement text for each of its branches. */
  private record Alternative(Rewrite rewrite, SourceSpan span, ImmutableList<String> branches) {}

  /**
   * Returns the Variants combining the given Rewrites, named {@code <module>_variant<k>}. Rewrites
   * without two branches, Rewrites nested inside an earlier one and Rewrites beyond the size limit
   * are left out.
   */
  public ImmutableList<Variant> generate(Design base, List<Rewrite> rewrites) {
    ImmutableList<Alternative> alternatives = independentAlternatives(base, rewrites);
    String moduleName = base.moduleName();
    ModuleDeclarationContext module = base.topModule();
    int n = alternatives.size();
    ImmutableList.Builder<Variant> result = ImmutableList.builder();
    for (int k = 0; k < (1 << n); k++) {
      String name = moduleName + "_variant" + k;
      List<TextEdit> edits = new ArrayList<>();
      edits.add(new TextEdit(base.startOffset(module.name), base.endOffset(module.name), name));
      if (module.endName != null) {
        edits.add(
            new TextEdit(base.startOffset(module.endName), base.endOffset(module.endName), name));
      }
      ImmutableList.Builder<Variant.Choice> choices = ImmutableList.builder();
      for (int i = 0; i < n; i++) {
        Alternative alternative = alternatives.get(i);
        int branch = (k >> i) & 1;
        choices.add(new Variant.Choice(alternative.rewrite(), branch));
        edits.add(
            new TextEdit(
                alternative.span().start(),
                alternative.span().end(),
                alternative.branches().get(branch)));
      }
      edits.sort(Comparator.comparingInt(TextEdit::start).reversed());
      StringBuilder text = new StringBuilder(base.text());
      for (TextEdit edit : edits) {
        text.replace(edit.start(), edit.end(), edit.text());
      }
      result.add(new Variant(name, base, choices.build(), text.toString()));
    }
    return result.build();
  }

  private ImmutableList<Alternative> independentAlternatives(
      Design base, List<Rewrite> rewrites) {
    List<Rewrite> sorted = new ArrayList<>();
    for (Rewrite rewrite : rewrites) {
      checkArgument(rewrite.design() == base, "%s does not belong to %s", rewrite, base);
      if (rewrite.numSelections() == 2) {
        sorted.add(rewrite);
      } else {
        logger.fine(String.format("Leaving %s out of exhaustive variants", rewrite));
      }
    }
    sorted.sort(Comparator.comparingInt(r -> r.site().span().start()));
    ImmutableList.Builder<Alternative> result = ImmutableList.builder();
    List<SourceSpan> kept = new ArrayList<>();
    for (Rewrite rewrite : sorted) {
      SourceSpan span = rewrite.site().span();
      if (kept.stream().anyMatch(span::overlaps)) {
        logger.warning(
            String.format("%s is nested in another site; leaving it out of variants", rewrite));
        continue;
      } else if (kept.size() == maxSites) {
        logger.warning(
            String.format(
                "More than %s independent sites; leaving %s out of variants", maxSites, rewrite));
        continue;
      }
      kept.add(span);
      ImmutableList.Builder<String> branches = ImmutableList.builder();
      for (int branch = 0; branch < 2; branch++) {
        DesignRewriter rewriter = new DesignRewriter(base);
        rewrite.applyBranch(rewriter, branch);
        branches.add(rewriter.render(rewrite.site().node()));
      }
      result.add(new Alternative(rewrite, span, branches.build()));
    }
    return result.build();
  }
}
