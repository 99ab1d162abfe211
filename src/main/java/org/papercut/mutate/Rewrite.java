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
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.jspecify.annotations.Nullable;
import org.papercut.hdl.Design;
import org.papercut.hdl.DesignRewriter;
import org.papercut.hdl.VerilogParser.CaseStatementContext;
import org.papercut.hdl.VerilogParser.ConditionalExpressionContext;
import org.papercut.hdl.VerilogParser.ConditionalStatementContext;
import org.papercut.hdl.VerilogParser.DataDeclarationContext;
import org.papercut.hdl.VerilogParser.ExpressionContext;
import org.papercut.hdl.VerilogParser.StandardCaseItemContext;

/**
 * The mutations available at one {@link Site}.
 *
 * <p>A Rewrite can replace its site by any one of its branches, or (for muxable categories) guard
 * the site's condition so that select inputs choose the branch at runtime. Each branch owns one
 * select index; the first is assigned when the Rewrite is added to a {@link RewriteSet}, and
 * select {@code startIndex + b} forces branch {@code b}.
 */
public final class Rewrite {
  /** Select inputs are named by appending their index to this prefix. */
  public static final String SELECT_PREFIX = "pc_sel";

  private final Site site;
  private final @Nullable ShrinkTarget shrinkTarget;

  /** Assigned once by {@link RewriteSet#addRewrite}; -1 until then. */
  private int startIndex = -1;

  private Rewrite(Site site, @Nullable ShrinkTarget shrinkTarget) {
    this.site = site;
    this.shrinkTarget = shrinkTarget;
  }

  public static Rewrite of(Site site) {
    ShrinkTarget shrinkTarget = null;
    if (site.category() == Category.BIT_SHRINK) {
      shrinkTarget = ShrinkTarget.of(site.design(), (DataDeclarationContext) site.node());
      checkArgument(shrinkTarget != null, "%s cannot be shrunk", site);
    }
    return new Rewrite(site, shrinkTarget);
  }

  public Site site() {
    return site;
  }

  public Category category() {
    return site.category();
  }

  public Design design() {
    return site.design();
  }

  public int numSelections() {
    return site.numBranches();
  }

  public boolean isRegistered() {
    return startIndex >= 0;
  }

  public int startIndex() {
    checkState(startIndex >= 0, "%s has not been added to a RewriteSet", this);
    return startIndex;
  }

  void assignStartIndex(int start) {
    checkState(startIndex < 0, "%s was already added to a RewriteSet", this);
    checkArgument(start >= 0);
    startIndex = start;
  }

  /** Returns the select index that forces the given branch. */
  public int selectionIndex(int branch) {
    checkElementIndex(branch, numSelections());
    return startIndex() + branch;
  }

  public static String selectName(int index) {
    return SELECT_PREFIX + index;
  }

  /** True if {@code node} is this Rewrite's site. Matching is by identity, never by structure. */
  public boolean matches(ParseTree node) {
    return node == site.node();
  }

  /** True if {@code node} is this Rewrite's site and the site can be muxed. */
  public boolean muxMatches(ParseTree node) {
    return category().isMuxable() && matches(node);
  }

  /** Returns a copy of {@code design} with this site replaced by the given branch. */
  public Design apply(Design design, int branch) {
    checkArgument(design == site.design(), "%s does not belong to %s", this, design);
    DesignRewriter rewriter = new DesignRewriter(design);
    applyBranch(rewriter, branch);
    return rewriter.toDesign();
  }

  /** Records the replacement of this site by the given branch. */
  public void applyBranch(DesignRewriter rewriter, int branch) {
    checkElementIndex(branch, numSelections());
    ParserRuleContext node = site.node();
    switch (category()) {
      case TERNARY:
        {
          ConditionalExpressionContext ternary = (ConditionalExpressionContext) node;
          ExpressionContext chosen = (branch == 0) ? ternary.whenTrue : ternary.whenFalse;
          rewriter.replace(ternary, r -> r.render(chosen));
          break;
        }
      case CONDITIONAL:
        {
          ConditionalStatementContext statement = (ConditionalStatementContext) node;
          if (branch == 0) {
            rewriter.replace(statement, r -> r.render(statement.thenStatement));
          } else if (statement.elseStatement != null) {
            rewriter.replace(statement, r -> r.render(statement.elseStatement));
          } else {
            rewriter.replace(statement, ";");
          }
          break;
        }
      case CASE_ITEM:
        {
          StandardCaseItemContext item = (StandardCaseItemContext) node;
          if (branch == 0) {
            ExpressionContext caseExpr = caseExpression(item);
            for (ExpressionContext label : item.expression()) {
              rewriter.replace(label, r -> r.render(caseExpr));
            }
          } else {
            rewriter.replace(item, "");
          }
          break;
        }
      case BIT_SHRINK:
        rewriter.replace(
            shrinkTarget.largerBound(), Long.toString(shrinkTarget.largerValue() - 1));
        break;
    }
  }

  /**
   * True if none of the nodes that {@link #applyBranch} would edit has already been edited in
   * {@code rewriter}, e.g. by a Rewrite whose site encloses this one.
   */
  public boolean canApplyBranch(DesignRewriter rewriter, int branch) {
    checkElementIndex(branch, numSelections());
    ParserRuleContext node = site.node();
    switch (category()) {
      case CASE_ITEM:
        if (branch == 0) {
          StandardCaseItemContext item = (StandardCaseItemContext) node;
          return item.expression().stream().noneMatch(rewriter::hasEdit);
        }
        return !rewriter.hasEdit(node);
      case BIT_SHRINK:
        return !rewriter.hasEdit(shrinkTarget.largerBound());
      default:
        return !rewriter.hasEdit(node);
    }
  }

  /**
   * Records edits that let select inputs choose this site's branch at runtime: with both selects
   * low the design behaves as before, and select {@code startIndex() + b} forces branch {@code b}.
   */
  public void applyMux(DesignRewriter rewriter) {
    checkState(category().isMuxable(), "%s cannot be muxed", this);
    String forceFirst = selectName(selectionIndex(0));
    String forceSecond = selectName(selectionIndex(1));
    ParserRuleContext node = site.node();
    switch (category()) {
      case TERNARY:
        guardCondition(
            rewriter, ((ConditionalExpressionContext) node).cond, forceFirst, forceSecond);
        break;
      case CONDITIONAL:
        guardCondition(
            rewriter, ((ConditionalStatementContext) node).cond, forceFirst, forceSecond);
        break;
      case CASE_ITEM:
        {
          StandardCaseItemContext item = (StandardCaseItemContext) node;
          ExpressionContext caseExpr = caseExpression(item);
          for (ExpressionContext label : item.expression()) {
            rewriter.replace(
                label,
                r ->
                    String.format(
                        "((%s) ? (%s) : (%s) ? ~(%s) : (%s))",
                        forceFirst,
                        r.render(caseExpr),
                        forceSecond,
                        r.render(caseExpr),
                        r.renderUnedited(label)));
          }
          break;
        }
      default:
        throw new AssertionError(category());
    }
  }

  private static void guardCondition(
      DesignRewriter rewriter, ExpressionContext cond, String forceTrue, String forceFalse) {
    rewriter.replace(
        cond,
        r -> String.format("(%s || (!%s && (%s)))", forceTrue, forceFalse, r.renderUnedited(cond)));
  }

  private static ExpressionContext caseExpression(StandardCaseItemContext item) {
    return ((CaseStatementContext) item.getParent()).caseExpr;
  }

  /** Non-null for {@link Category#BIT_SHRINK} rewrites. */
  @Nullable ShrinkTarget shrinkTarget() {
    return shrinkTarget;
  }

  @Override
  public String toString() {
    return site.toString();
  }
}
