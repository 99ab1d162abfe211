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

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.logging.Logger;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.papercut.hdl.VerilogParser.BinaryExpressionContext;
import org.papercut.hdl.VerilogParser.ConcatenationExpressionContext;
import org.papercut.hdl.VerilogParser.ExpressionContext;
import org.papercut.hdl.VerilogParser.IdentifierExpressionContext;
import org.papercut.hdl.VerilogParser.LiteralExpressionContext;
import org.papercut.hdl.VerilogParser.ModuleDeclarationContext;
import org.papercut.hdl.VerilogParser.ModuleItemContext;
import org.papercut.hdl.VerilogParser.PackedDimensionContext;
import org.papercut.hdl.VerilogParser.ParamAssignmentContext;
import org.papercut.hdl.VerilogParser.ParameterPortContext;
import org.papercut.hdl.VerilogParser.ParenExpressionContext;
import org.papercut.hdl.VerilogParser.ReplicationExpressionContext;
import org.papercut.hdl.VerilogParser.SelectContext;
import org.papercut.hdl.VerilogParser.UnpackedDimensionContext;

/**
 * Replaces references to a module's parameters with their default values and then folds the
 * resulting constant arithmetic, so that later passes see literal widths ({@code [7:0]} rather
 * than {@code [WIDTH-1:0]}).
 *
 * <p>The parameter declarations themselves are kept, so the concretized module has the same
 * interface as the original.
 */
public final class ParameterConcretizer {
  private static final Logger logger = Logger.getLogger(ParameterConcretizer.class.getName());

  // Statics only
  private ParameterConcretizer() {}

  /** Returns a copy of {@code design} with parameter references substituted and folded. */
  public static Design concretize(Design design) {
    ImmutableMap<String, Long> values = resolveParameters(design.topModule());
    Design substituted = substitute(design, values);
    return fold(substituted);
  }

  /**
   * Evaluates the default value of each parameter and localparam of {@code module}, in declaration
   * order (so that a default may refer to earlier parameters). Parameters whose default is not a
   * constant integer expression are omitted.
   */
  public static ImmutableMap<String, Long> resolveParameters(ModuleDeclarationContext module) {
    List<ParamAssignmentContext> assignments = new ArrayList<>();
    if (module.parameterPortList() != null) {
      for (ParameterPortContext port : module.parameterPortList().parameterPort()) {
        assignments.add(port.paramAssignment());
      }
    }
    for (ModuleItemContext item : module.moduleItem()) {
      if (item.parameterDeclaration() != null) {
        assignments.addAll(item.parameterDeclaration().paramAssignment());
      }
    }
    Map<String, Long> values = new LinkedHashMap<>();
    ConstantEvaluator evaluator = new ConstantEvaluator(values);
    for (ParamAssignmentContext assignment : assignments) {
      String name = assignment.identifier().getText();
      OptionalLong value =
          assignment.unpackedDimension().isEmpty()
              ? evaluator.evaluate(assignment.expression())
              : OptionalLong.empty();
      if (value.isPresent()
          && value.getAsLong() >= Integer.MIN_VALUE
          && value.getAsLong() <= Integer.MAX_VALUE) {
        values.put(name, value.getAsLong());
      } else {
        logger.fine(
            String.format(
                "Parameter %s (line %s) is not a constant integer; leaving it symbolic",
                name, assignment.start.getLine()));
      }
    }
    return ImmutableMap.copyOf(values);
  }

  private static Design substitute(Design design, Map<String, Long> values) {
    if (values.isEmpty()) {
      return design;
    }
    DesignRewriter rewriter = new DesignRewriter(design);
    if (substituteIn(design.topModule(), values, rewriter) == 0) {
      return design;
    }
    return rewriter.toDesign();
  }

  /** Returns the number of references replaced within {@code node}. */
  private static int substituteIn(
      ParseTree node, Map<String, Long> values, DesignRewriter rewriter) {
    if (node instanceof IdentifierExpressionContext id && id.select().isEmpty()) {
      Long value = values.get(id.identifier().getText());
      if (value == null || !widthIsIrrelevant(id)) {
        return 0;
      }
      rewriter.replace(id, (value < 0) ? "(" + value + ")" : value.toString());
      return 1;
    }
    int count = 0;
    for (int i = 0; i < node.getChildCount(); i++) {
      count += substituteIn(node.getChild(i), values, rewriter);
    }
    return count;
  }

  /**
   * Unsized literals are not allowed in concatenations, so a parameter reference inside one is
   * left alone unless it is in a constant position (a select, dimension or replication count).
   */
  private static boolean widthIsIrrelevant(ParserRuleContext node) {
    ParserRuleContext child = node;
    for (ParserRuleContext parent = node.getParent(); parent != null; parent = parent.getParent()) {
      if (parent instanceof SelectContext
          || parent instanceof PackedDimensionContext
          || parent instanceof UnpackedDimensionContext) {
        return true;
      } else if (parent instanceof ReplicationExpressionContext replication) {
        return child == replication.expression(0);
      } else if (parent instanceof ConcatenationExpressionContext) {
        return false;
      }
      child = parent;
    }
    return true;
  }

  private static Design fold(Design design) {
    DesignRewriter rewriter = new DesignRewriter(design);
    if (foldIn(design.tree(), rewriter) == 0) {
      return design;
    }
    return rewriter.toDesign();
  }

  /**
   * Replaces each maximal foldable expression within {@code node} by its value, and returns the
   * number of replacements. Expressions with a negative or out-of-range intermediate value are left
   * unfolded.
   */
  private static int foldIn(ParseTree node, DesignRewriter rewriter) {
    if (node instanceof ExpressionContext expr
        && !(expr instanceof LiteralExpressionContext)
        && isFoldable(expr)) {
      OptionalLong value = ConstantEvaluator.forFolding().evaluate(expr);
      if (value.isPresent()) {
        rewriter.replace(expr, Long.toString(value.getAsLong()));
        return 1;
      }
    }
    int count = 0;
    for (int i = 0; i < node.getChildCount(); i++) {
      count += foldIn(node.getChild(i), rewriter);
    }
    return count;
  }

  /**
   * True if {@code expr} is built only from unsized decimal literals, parentheses and the
   * arithmetic or shift operators.
   */
  private static boolean isFoldable(ExpressionContext expr) {
    if (expr instanceof LiteralExpressionContext) {
      return ConstantEvaluator.isUnsizedDecimal(expr.getText());
    } else if (expr instanceof ParenExpressionContext paren) {
      return isFoldable(paren.expression());
    } else if (expr instanceof BinaryExpressionContext binary) {
      int op = binary.op.getType();
      boolean arithmetic =
          op == TokenType.PLUS
              || op == TokenType.MINUS
              || op == TokenType.STAR
              || op == TokenType.SLASH
              || op == TokenType.PERCENT
              || op == TokenType.POWER
              || op == TokenType.SHIFT_LEFT
              || op == TokenType.SHIFT_RIGHT;
      return arithmetic && isFoldable(binary.expression(0)) && isFoldable(binary.expression(1));
    }
    return false;
  }
}
