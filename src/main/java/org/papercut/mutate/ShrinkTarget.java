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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.OptionalLong;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.papercut.hdl.Design;
import org.papercut.hdl.VerilogParser.DataDeclarationContext;
import org.papercut.hdl.VerilogParser.DataTypeContext;
import org.papercut.hdl.VerilogParser.DeclaratorContext;
import org.papercut.hdl.VerilogParser.ExpressionContext;
import org.papercut.hdl.VerilogParser.ImplicitTypeContext;
import org.papercut.hdl.VerilogParser.LiteralExpressionContext;
import org.papercut.hdl.VerilogParser.PackedDimensionContext;
import org.papercut.hdl.VerilogParser.SigningContext;
import org.papercut.hdl.VerilogParser.VectorTypeContext;

/**
 * The analysis of a declaration that {@link Category#BIT_SHRINK} can narrow: a vector declaration
 * with exactly one packed range {@code [msb:lsb]} whose bounds are integer literals.
 */
final class ShrinkTarget {
  private static final Logger logger = Logger.getLogger(ShrinkTarget.class.getName());

  private final DataDeclarationContext declaration;
  private final ExpressionContext largerBound;
  private final long largerValue;
  private final int width;
  private final @Nullable String signing;
  private final ImmutableList<String> names;

  private ShrinkTarget(
      DataDeclarationContext declaration,
      ExpressionContext largerBound,
      long largerValue,
      int width,
      @Nullable String signing,
      ImmutableList<String> names) {
    this.declaration = declaration;
    this.largerBound = largerBound;
    this.largerValue = largerValue;
    this.width = width;
    this.signing = signing;
    this.names = names;
  }

  /**
   * Returns the analysis of {@code decl}, or null if it is not a candidate for shrinking. Shapes we
   * cannot shrink (other than scalars and single-bit vectors) are logged.
   */
  static @Nullable ShrinkTarget of(Design design, DataDeclarationContext decl) {
    DataTypeContext dataType =
        (decl.dataType() != null) ? decl.dataType() : decl.dataTypeOrImplicit().dataType();
    List<PackedDimensionContext> dimensions;
    SigningContext signing;
    if (dataType == null) {
      ImplicitTypeContext implicit = decl.dataTypeOrImplicit().implicitType();
      dimensions = implicit.packedDimension();
      signing = implicit.signing();
    } else if (dataType instanceof VectorTypeContext vector) {
      dimensions = vector.packedDimension();
      signing = vector.signing();
    } else {
      unsupported(design, decl, "has a non-vector type");
      return null;
    }
    if (dimensions.isEmpty()) {
      return null;
    } else if (dimensions.size() > 1) {
      unsupported(design, decl, "has more than one packed dimension");
      return null;
    }
    PackedDimensionContext dimension = dimensions.get(0);
    OptionalLong msb = literalValue(dimension.msb);
    OptionalLong lsb = literalValue(dimension.lsb);
    if (msb.isEmpty() || lsb.isEmpty()) {
      unsupported(design, decl, "has a non-literal range");
      return null;
    }
    long high = Math.max(msb.getAsLong(), lsb.getAsLong());
    long width = high - Math.min(msb.getAsLong(), lsb.getAsLong()) + 1;
    if (width <= 1) {
      return null;
    } else if (width > Integer.MAX_VALUE) {
      unsupported(design, decl, "is too wide");
      return null;
    }
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (DeclaratorContext declarator : decl.declarator()) {
      if (!declarator.unpackedDimension().isEmpty()) {
        unsupported(design, decl, "declares an array");
        return null;
      }
      names.add(declarator.identifier().getText());
    }
    ExpressionContext largerBound =
        (msb.getAsLong() >= lsb.getAsLong()) ? dimension.msb : dimension.lsb;
    return new ShrinkTarget(
        decl,
        largerBound,
        high,
        (int) width,
        (signing == null) ? null : signing.getText(),
        names.build());
  }

  private static OptionalLong literalValue(ExpressionContext expr) {
    String text = expr.getText();
    if (expr instanceof LiteralExpressionContext && text.matches("[0-9][0-9_]*")) {
      try {
        return OptionalLong.of(Long.parseLong(text.replace("_", "")));
      } catch (NumberFormatException e) {
        // Too large to be a real bound
        return OptionalLong.empty();
      }
    }
    return OptionalLong.empty();
  }

  private static void unsupported(Design design, DataDeclarationContext decl, String reason) {
    logger.fine(
        String.format(
            "Not shrinking declaration at %s:%s, which %s",
            design.sourceName(), design.span(decl), reason));
  }

  DataDeclarationContext declaration() {
    return declaration;
  }

  /** The bound to decrement: the msb for a descending range, the lsb for an ascending one. */
  ExpressionContext largerBound() {
    return largerBound;
  }

  long largerValue() {
    return largerValue;
  }

  int width() {
    return width;
  }

  ImmutableList<String> names() {
    return names;
  }

  /** Returns a declaration of a shadow for each declared name, one bit narrower. */
  String shadowDeclaration(String suffix) {
    StringBuilder sb = new StringBuilder("logic ");
    if (signing != null) {
      sb.append(signing).append(' ');
    }
    sb.append('[').append(width - 2).append(":0] ");
    Joiner.on(", ").appendTo(sb, names.stream().map(n -> n + suffix).iterator());
    return sb.append(';').toString();
  }

  /** Returns a continuous assignment driving each shadow from its original. */
  String shadowAssignment(String suffix) {
    return "assign "
        + Joiner.on(", ").join(names.stream().map(n -> n + suffix + " = " + n).iterator())
        + ";";
  }
}
