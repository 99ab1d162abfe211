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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.TreeSet;
import java.util.logging.Logger;
import org.papercut.hdl.Design;
import org.papercut.hdl.DesignRewriter;
import org.papercut.mutate.Rewrite;
import org.papercut.mutate.RewriteSet;
import org.papercut.mutate.Variant;

/** Folds the results of completed Runs back into the base design. */
public final class Consolidator {
  private static final Logger logger = Logger.getLogger(Consolidator.class.getName());

  // Statics only
  private Consolidator() {}

  /**
   * Replaces the site of each Rewrite by its proven branch, using the Runs whose candidate made a
   * single choice. A site with no passing Run is left unchanged; if several branches of one Rewrite
   * passed, the one with the lowest select index is used and the Rewrite is reported as ambiguous.
   * The result's module is named {@code moduleName}.
   */
  public static ConsolidatedDesign consolidate(
      Design base, RewriteSet rewrites, List<Run> runs, String moduleName) {
    ImmutableList.Builder<Variant.Choice> chosen = ImmutableList.builder();
    ImmutableList.Builder<Rewrite> ambiguous = ImmutableList.builder();
    for (Rewrite rewrite : rewrites) {
      TreeSet<Integer> passing = new TreeSet<>();
      for (Run run : runs) {
        List<Variant.Choice> choices = run.candidate().choices();
        if (run.passed() && choices.size() == 1 && choices.get(0).rewrite() == rewrite) {
          passing.add(choices.get(0).branch());
        }
      }
      if (passing.isEmpty()) {
        continue;
      } else if (passing.size() > 1) {
        logger.warning(
            String.format(
                "Branches %s of %s all passed; using branch %s",
                passing, rewrite, passing.first()));
        ambiguous.add(rewrite);
      }
      chosen.add(new Variant.Choice(rewrite, passing.first()));
    }
    return apply(base, chosen.build(), ambiguous.build(), moduleName);
  }

  /** Applies branch 0 of every Rewrite, without regard to any verification. */
  public static ConsolidatedDesign applyAll(Design base, RewriteSet rewrites, String moduleName) {
    ImmutableList<Variant.Choice> choices =
        rewrites.rewrites().stream()
            .map(r -> new Variant.Choice(r, 0))
            .collect(ImmutableList.toImmutableList());
    return apply(base, choices, ImmutableList.of(), moduleName);
  }

  /**
   * Returns the candidate of the first passing Run that made at least one choice, renamed to
   * {@code moduleName}, or the base design if there is none.
   */
  public static ConsolidatedDesign firstPassing(Design base, List<Run> runs, String moduleName) {
    for (Run run : runs) {
      Variant candidate = run.candidate();
      if (run.passed() && !candidate.choices().isEmpty()) {
        logger.info(String.format("Using %s", candidate.name()));
        return new ConsolidatedDesign(
            candidate.design().renameModule(moduleName), candidate.choices(), ImmutableList.of());
      }
    }
    return new ConsolidatedDesign(
        base.renameModule(moduleName), ImmutableList.of(), ImmutableList.of());
  }

  private static ConsolidatedDesign apply(
      Design base,
      List<Variant.Choice> choices,
      ImmutableList<Rewrite> ambiguous,
      String moduleName) {
    DesignRewriter rewriter = new DesignRewriter(base);
    ImmutableList.Builder<Variant.Choice> applied = ImmutableList.builder();
    for (Variant.Choice choice : choices) {
      Rewrite rewrite = choice.rewrite();
      if (rewrite.canApplyBranch(rewriter, choice.branch())) {
        rewrite.applyBranch(rewriter, choice.branch());
        applied.add(choice);
      } else {
        logger.warning(
            String.format("%s overlaps an earlier simplification; leaving it unchanged", rewrite));
      }
    }
    rewriter.renameModule(moduleName);
    return new ConsolidatedDesign(rewriter.toDesign(), applied.build(), ambiguous);
  }
}
