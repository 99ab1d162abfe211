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
import java.util.Map;
import java.util.OptionalLong;
import java.util.regex.Pattern;
import org.antlr.v4.runtime.tree.ParseTree;
import org.papercut.hdl.VerilogParser.BinaryExpressionContext;
import org.papercut.hdl.VerilogParser.ConditionalExpressionContext;
import org.papercut.hdl.VerilogParser.ExpressionContext;
import org.papercut.hdl.VerilogParser.IdentifierExpressionContext;
import org.papercut.hdl.VerilogParser.LiteralExpressionContext;
import org.papercut.hdl.VerilogParser.ParenExpressionContext;
import org.papercut.hdl.VerilogParser.SystemCallExpressionContext;
import org.papercut.hdl.VerilogParser.UnaryExpressionContext;

/**
 * Evaluates constant integer expressions: literals without x or z bits, references to already
 * resolved parameters, the usual arithmetic, shift, comparison and logical operators, the
 * conditional operator and {@code $clog2}.
 *
 * <p>Any node type without an explicit visit method is not constant; rather than returning a
 * default the visitor throws, which {@link #evaluate} turns into an empty result.
 *
 * <p>An evaluator created by {@link #forFolding} only accepts expressions whose every
 * subexpression, operands included, lies in {@code [0, 2^31)}. Within that range 64-bit
 * arithmetic agrees with the 32-bit arithmetic of unsized literals, and {@code >>} agrees with
 * its logical shift.
 */
final class ConstantEvaluator extends VerilogBaseVisitor<Long> {

  private static final Pattern UNSIZED_DECIMAL = Pattern.compile("[0-9][0-9_]*");

  /** Thrown (and caught by {@link #evaluate}) when an expression has no constant value. */
  private static final class NotConstantException extends RuntimeException {
    NotConstantException() {
      super(null, null, false, false);
    }
  }

  private final Map<String, Long> values;
  private final boolean nonNegativeInt;

  /**
   * Creates an evaluator that resolves identifiers using {@code values}; the map is read each time
   * an identifier is visited, so callers may add to it between evaluations.
   */
  ConstantEvaluator(Map<String, Long> values) {
    this(values, false);
  }

  private ConstantEvaluator(Map<String, Long> values, boolean nonNegativeInt) {
    this.values = values;
    this.nonNegativeInt = nonNegativeInt;
  }

  /** Returns an evaluator for literal-only expressions that may be replaced by their value. */
  static ConstantEvaluator forFolding() {
    return new ConstantEvaluator(ImmutableMap.of(), true);
  }

  /** Returns the value of {@code expr}, or empty if it is not a constant we can evaluate. */
  OptionalLong evaluate(ExpressionContext expr) {
    try {
      return OptionalLong.of(visit(expr));
    } catch (NotConstantException | ArithmeticException e) {
      return OptionalLong.empty();
    }
  }

  /** True if {@code text} is a decimal literal with neither size nor base. */
  static boolean isUnsizedDecimal(String text) {
    return UNSIZED_DECIMAL.matcher(text).matches();
  }

  /** Returns the value of an integer literal, or empty if it has x, z or fractional bits. */
  static OptionalLong parseLiteral(String text) {
    String digits = text.replace("_", "");
    int tick = digits.indexOf('\'');
    int radix = 10;
    if (tick >= 0) {
      int pos = tick + 1;
      if (pos < digits.length() && (digits.charAt(pos) == 's' || digits.charAt(pos) == 'S')) {
        pos++;
      }
      if (pos >= digits.length()) {
        return OptionalLong.empty();
      }
      switch (Character.toLowerCase(digits.charAt(pos))) {
        case 'b':
          radix = 2;
          break;
        case 'o':
          radix = 8;
          break;
        case 'd':
          radix = 10;
          break;
        case 'h':
          radix = 16;
          break;
        default:
          // An unbased unsized literal such as '0 or '1 has no fixed width.
          return OptionalLong.empty();
      }
      digits = digits.substring(pos + 1);
    }
    if (digits.isEmpty()) {
      return OptionalLong.empty();
    }
    for (int i = 0; i < digits.length(); i++) {
      if (Character.digit(digits.charAt(i), radix) < 0) {
        return OptionalLong.empty();
      }
    }
    try {
      return OptionalLong.of(Long.parseLong(digits, radix));
    } catch (NumberFormatException e) {
      // Too large for a long
      return OptionalLong.empty();
    }
  }

  @Override
  public Long visit(ParseTree tree) {
    Long value = super.visit(tree);
    if (nonNegativeInt && (value < 0 || value > Integer.MAX_VALUE)) {
      throw new NotConstantException();
    }
    return value;
  }

  @Override
  protected Long defaultResult() {
    throw new NotConstantException();
  }

  @Override
  public Long visitLiteralExpression(LiteralExpressionContext ctx) {
    OptionalLong value = parseLiteral(ctx.getText());
    if (value.isEmpty()) {
      throw new NotConstantException();
    }
    return value.getAsLong();
  }

  @Override
  public Long visitIdentifierExpression(IdentifierExpressionContext ctx) {
    Long value = ctx.select().isEmpty() ? values.get(ctx.identifier().getText()) : null;
    if (value == null) {
      throw new NotConstantException();
    }
    return value;
  }

  @Override
  public Long visitParenExpression(ParenExpressionContext ctx) {
    return visit(ctx.expression());
  }

  @Override
  public Long visitSystemCallExpression(SystemCallExpressionContext ctx) {
    if (!ctx.SYSTEM_IDENTIFIER().getText().equals("$clog2") || ctx.expression().size() != 1) {
      throw new NotConstantException();
    }
    long arg = visit(ctx.expression(0));
    return (arg <= 1) ? 0L : (long) (64 - Long.numberOfLeadingZeros(arg - 1));
  }

  @Override
  public Long visitUnaryExpression(UnaryExpressionContext ctx) {
    long arg = visit(ctx.expression());
    int op = ctx.op.getType();
    if (op == TokenType.PLUS) {
      return arg;
    } else if (op == TokenType.MINUS) {
      return Math.negateExact(arg);
    } else if (op == TokenType.BANG) {
      return (arg == 0) ? 1L : 0L;
    }
    throw new NotConstantException();
  }

  @Override
  public Long visitConditionalExpression(ConditionalExpressionContext ctx) {
    return (visit(ctx.cond) != 0) ? visit(ctx.whenTrue) : visit(ctx.whenFalse);
  }

  @Override
  public Long visitBinaryExpression(BinaryExpressionContext ctx) {
    long left = visit(ctx.expression(0));
    long right = visit(ctx.expression(1));
    int op = ctx.op.getType();
    if (op == TokenType.PLUS) {
      return Math.addExact(left, right);
    } else if (op == TokenType.MINUS) {
      return Math.subtractExact(left, right);
    } else if (op == TokenType.STAR) {
      return Math.multiplyExact(left, right);
    } else if (op == TokenType.SLASH || op == TokenType.PERCENT) {
      if (right == 0) {
        throw new NotConstantException();
      }
      return (op == TokenType.SLASH) ? left / right : left % right;
    } else if (op == TokenType.POWER) {
      return power(left, right);
    } else if (op == TokenType.SHIFT_LEFT || op == TokenType.ARITHMETIC_SHIFT_LEFT) {
      return shiftLeft(left, right);
    } else if (op == TokenType.SHIFT_RIGHT || op == TokenType.ARITHMETIC_SHIFT_RIGHT) {
      // A logical shift of a negative value depends on its width.
      if (right < 0 || right > 63 || (op == TokenType.SHIFT_RIGHT && left < 0)) {
        throw new NotConstantException();
      }
      return left >> right;
    } else if (op == TokenType.LESS_THAN) {
      return asBit(left < right);
    } else if (op == TokenType.LESS_THAN_OR_EQUALS) {
      return asBit(left <= right);
    } else if (op == TokenType.GREATER_THAN) {
      return asBit(left > right);
    } else if (op == TokenType.GREATER_THAN_OR_EQUALS) {
      return asBit(left >= right);
    } else if (op == TokenType.EQUALS_EQUALS) {
      return asBit(left == right);
    } else if (op == TokenType.NOT_EQUALS) {
      return asBit(left != right);
    } else if (op == TokenType.LOGICAL_AND) {
      return asBit(left != 0 && right != 0);
    } else if (op == TokenType.LOGICAL_OR) {
      return asBit(left != 0 || right != 0);
    }
    throw new NotConstantException();
  }

  private static long asBit(boolean b) {
    return b ? 1 : 0;
  }

  private static long power(long base, long exponent) {
    if (exponent < 0) {
      throw new NotConstantException();
    }
    if (base == 0 || base == 1) {
      return (exponent == 0) ? 1 : base;
    } else if (base == -1) {
      return (exponent % 2 == 0) ? 1 : -1;
    }
    // Any other base overflows within 63 multiplications.
    long result = 1;
    for (long i = 0; i < exponent; i++) {
      result = Math.multiplyExact(result, base);
    }
    return result;
  }

  private static long shiftLeft(long value, long amount) {
    if (amount < 0 || amount > 62) {
      throw new NotConstantException();
    }
    long result = value << amount;
    if ((result >> amount) != value) {
      throw new ArithmeticException("shift overflow");
    }
    return result;
  }
}
