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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import java.util.logging.Logger;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.papercut.hdl.Design;
import org.papercut.hdl.VerilogParser.CaseStatementContext;
import org.papercut.hdl.VerilogParser.ConditionalExpressionContext;
import org.papercut.hdl.VerilogParser.ConditionalGenerateContext;
import org.papercut.hdl.VerilogParser.ConditionalStatementContext;
import org.papercut.hdl.VerilogParser.DataDeclarationContext;
import org.papercut.hdl.VerilogParser.ExpressionContext;
import org.papercut.hdl.VerilogParser.LoopGenerateContext;
import org.papercut.hdl.VerilogParser.ModuleDeclarationContext;
import org.papercut.hdl.VerilogParser.ModuleItemContext;
import org.papercut.hdl.VerilogParser.PackedDimensionContext;
import org.papercut.hdl.VerilogParser.ParameterDeclarationContext;
import org.papercut.hdl.VerilogParser.ParameterPortContext;
import org.papercut.hdl.VerilogParser.ParameterValueAssignmentContext;
import org.papercut.hdl.VerilogParser.StandardCaseItemContext;
import org.papercut.hdl.VerilogParser.UnpackedDimensionContext;

/**
 * Finds the sites of a given category in the top module of a design.
 *
 * <p>Sites are returned in source order, which is also the order of their handles. Locating never
 * changes the design.
 */
public final class SiteLocator {
  private static final Logger logger = Logger.getLogger(SiteLocator.class.getName());

  // Statics only
  private SiteLocator() {}

  public static ImmutableList<Site> locate(Design design, Category category) {
    ImmutableList.Builder<Site> sites = ImmutableList.builder();
    new Walker(design, category, sites).walk(design.topModule());
    return sites.build();
  }

  /** A pre-order walk that numbers every rule node, so that handles don't depend on category. */
  private static class Walker {
    final Design design;
    final Category category;
    final ImmutableList.Builder<Site> sites;
    int ordinal;

    Walker(Design design, Category category, ImmutableList.Builder<Site> sites) {
      this.design = design;
      this.category = category;
      this.sites = sites;
    }

    void walk(ParseTree node) {
      if (!(node instanceof ParserRuleContext ctx)) {
        return;
      }
      int handle = ordinal++;
      if (isSite(ctx)) {
        sites.add(new Site(category, design, ctx, handle));
      }
      for (int i = 0; i < ctx.getChildCount(); i++) {
        walk(ctx.getChild(i));
      }
    }

    boolean isSite(ParserRuleContext ctx) {
      switch (category) {
        case TERNARY:
          if (ctx instanceof ConditionalExpressionContext) {
            if (!isConstantContext(ctx)) {
              return true;
            }
            logger.fine(
                String.format(
                    "Skipping conditional expression at %s in a constant context",
                    design.span(ctx)));
          }
          return false;
        case CONDITIONAL:
          return ctx instanceof ConditionalStatementContext;
        case CASE_ITEM:
          return ctx instanceof StandardCaseItemContext item && !alwaysMatches(item);
        case BIT_SHRINK:
          return ctx instanceof DataDeclarationContext decl
              && isModuleLevel(decl)
              && ShrinkTarget.of(design, decl) != null;
      }
      throw new AssertionError(category);
    }

    /** True if every label of this item is the case expression itself. */
    boolean alwaysMatches(StandardCaseItemContext item) {
      String caseExpr = withoutWhitespace(((CaseStatementContext) item.getParent()).caseExpr);
      for (ExpressionContext label : item.expression()) {
        if (!withoutWhitespace(label).equals(caseExpr)) {
          return false;
        }
      }
      return true;
    }

    String withoutWhitespace(ParseTree node) {
      return CharMatcher.whitespace().removeFrom(design.textOf(node));
    }
  }

  private static boolean isModuleLevel(DataDeclarationContext decl) {
    return decl.getParent() instanceof ModuleItemContext item
        && item.getParent() instanceof ModuleDeclarationContext;
  }

  /**
   * True if the given expression must be a constant (a parameter value, a range bound or a
   * generate condition), so that it cannot be driven by a select input.
   */
  static boolean isConstantContext(ParserRuleContext node) {
    ParserRuleContext child = node;
    for (ParserRuleContext parent = node.getParent(); parent != null; parent = parent.getParent()) {
      if (parent instanceof ParameterDeclarationContext
          || parent instanceof ParameterPortContext
          || parent instanceof ParameterValueAssignmentContext
          || parent instanceof PackedDimensionContext
          || parent instanceof UnpackedDimensionContext) {
        return true;
      } else if (parent instanceof LoopGenerateContext loop) {
        return child != loop.generateBlock();
      } else if (parent instanceof ConditionalGenerateContext generate) {
        return child == generate.expression();
      }
      child = parent;
    }
    return false;
  }
}
