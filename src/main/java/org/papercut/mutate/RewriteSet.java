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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.papercut.hdl.Design;
import org.papercut.hdl.DesignRewriter;

/**
 * An ordered collection of Rewrites against one design, which allocates each Rewrite a contiguous
 * range of select indices. The ranges are assigned in registration order and together cover
 * {@code [0, totalSelections())} with no gaps or overlaps.
 */
public final class RewriteSet implements Iterable<Rewrite> {
  private static final Logger logger = Logger.getLogger(RewriteSet.class.getName());

  /** Two Rewrites that claim the same node; only {@code applied} was used. */
  public record Conflict(Rewrite applied, Rewrite skipped) {}

  /** The outcome of {@link #applyMuxes}. */
  public record MuxApplication(ImmutableList<Rewrite> applied, ImmutableList<Conflict> conflicts) {

    /** Returns the select indices owned by the applied Rewrites, in increasing order. */
    public ImmutableList<Integer> selectIndices() {
      return applied.stream()
          .flatMap(r -> IntStream.range(0, r.numSelections()).mapToObj(r::selectionIndex))
          .sorted()
          .collect(ImmutableList.toImmutableList());
    }
  }

  private final List<Rewrite> rewrites = new ArrayList<>();
  private int totalSelections;

  /** Returns a RewriteSet with a Rewrite for each of the given sites, in order. */
  public static RewriteSet of(Iterable<Site> sites) {
    RewriteSet result = new RewriteSet();
    for (Site site : sites) {
      result.addRewrite(Rewrite.of(site));
    }
    return result;
  }

  /**
   * Adds {@code rewrite}, assigning it the next {@code rewrite.numSelections()} select indices. A
   * Rewrite can belong to only one RewriteSet, and only once.
   */
  @CanIgnoreReturnValue
  public Rewrite addRewrite(Rewrite rewrite) {
    checkArgument(
        rewrites.isEmpty() || rewrites.get(0).design() == rewrite.design(),
        "%s belongs to a different design",
        rewrite);
    rewrite.assignStartIndex(totalSelections);
    totalSelections += rewrite.numSelections();
    rewrites.add(rewrite);
    return rewrite;
  }

  public int totalSelections() {
    return totalSelections;
  }

  public int size() {
    return rewrites.size();
  }

  public boolean isEmpty() {
    return rewrites.isEmpty();
  }

  public Rewrite get(int i) {
    return rewrites.get(i);
  }

  public ImmutableList<Rewrite> rewrites() {
    return ImmutableList.copyOf(rewrites);
  }

  @Override
  public Iterator<Rewrite> iterator() {
    return rewrites().iterator();
  }

  /**
   * Records the mux edits of every muxable Rewrite in a single walk of the design. If more than one
   * Rewrite matches a node the first one registered wins; the others are reported as conflicts and
   * not applied.
   */
  public MuxApplication applyMuxes(DesignRewriter rewriter) {
    Design design = rewriter.design();
    Map<ParseTree, List<Rewrite>> bySite = new IdentityHashMap<>();
    for (Rewrite rewrite : rewrites) {
      checkArgument(rewrite.design() == design, "%s does not belong to %s", rewrite, design);
      bySite.computeIfAbsent(rewrite.site().node(), k -> new ArrayList<>()).add(rewrite);
    }
    ImmutableList.Builder<Rewrite> applied = ImmutableList.builder();
    ImmutableList.Builder<Conflict> conflicts = ImmutableList.builder();
    walk(design.tree(), bySite, rewriter, applied, conflicts);
    return new MuxApplication(applied.build(), conflicts.build());
  }

  private static void walk(
      ParseTree node,
      Map<ParseTree, List<Rewrite>> bySite,
      DesignRewriter rewriter,
      ImmutableList.Builder<Rewrite> applied,
      ImmutableList.Builder<Conflict> conflicts) {
    List<Rewrite> candidates = bySite.get(node);
    if (candidates != null) {
      Rewrite winner = null;
      for (Rewrite rewrite : candidates) {
        if (!rewrite.muxMatches(node)) {
          continue;
        }
        if (winner == null) {
          winner = rewrite;
          rewrite.applyMux(rewriter);
          applied.add(rewrite);
        } else {
          logger.warning(
              String.format(
                  "Conflicting rewrites at %s: keeping %s (select %s), skipping %s (select %s)",
                  rewrite.site().span(),
                  winner,
                  winner.startIndex(),
                  rewrite,
                  rewrite.startIndex()));
          conflicts.add(new Conflict(winner, rewrite));
        }
      }
    }
    for (int i = 0; i < node.getChildCount(); i++) {
      walk(node.getChild(i), bySite, rewriter, applied, conflicts);
    }
  }
}
