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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.papercut.hdl.VerilogParser.AnsiPortContext;
import org.papercut.hdl.VerilogParser.AnsiPortListContext;
import org.papercut.hdl.VerilogParser.DataTypeContext;
import org.papercut.hdl.VerilogParser.DataTypeOrImplicitContext;
import org.papercut.hdl.VerilogParser.IdentifierContext;
import org.papercut.hdl.VerilogParser.ImplicitTypeContext;
import org.papercut.hdl.VerilogParser.ModuleDeclarationContext;
import org.papercut.hdl.VerilogParser.ModuleItemContext;
import org.papercut.hdl.VerilogParser.NonAnsiPortListContext;
import org.papercut.hdl.VerilogParser.PackedDimensionContext;
import org.papercut.hdl.VerilogParser.ParamAssignmentContext;
import org.papercut.hdl.VerilogParser.ParameterPortContext;
import org.papercut.hdl.VerilogParser.PortDeclarationContext;
import org.papercut.hdl.VerilogParser.PortDirectionContext;
import org.papercut.hdl.VerilogParser.SigningContext;
import org.papercut.hdl.VerilogParser.VectorTypeContext;

/**
 * The externally visible part of a module: its name, ports and overridable parameters, as needed
 * to instantiate it from another module.
 */
public record ModuleInterface(
    String name, ImmutableList<Port> ports, ImmutableList<Parameter> parameters) {

  public enum Direction {
    INPUT,
    OUTPUT,
    INOUT;

    static Direction of(PortDirectionContext ctx) {
      switch (ctx.getText()) {
        case "input":
          return INPUT;
        case "output":
          return OUTPUT;
        default:
          return INOUT;
      }
    }
  }

  /** A port; {@code type} is a declaration prefix such as {@code "logic signed [7:0]"}. */
  public record Port(String name, Direction direction, String type) {}

  /** A parameter and the source text of its default value. */
  public record Parameter(String name, String defaultValue) {}

  public ImmutableList<Port> inputs() {
    return ports.stream()
        .filter(p -> p.direction() != Direction.OUTPUT)
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Port> outputs() {
    return ports.stream()
        .filter(p -> p.direction() == Direction.OUTPUT)
        .collect(ImmutableList.toImmutableList());
  }

  /** Extracts the interface of {@code design}'s top module. */
  public static ModuleInterface of(Design design) {
    ModuleDeclarationContext module = design.topModule();
    return new ModuleInterface(
        module.name.getText(), ports(design, module), parameters(design, module));
  }

  private static ImmutableList<Parameter> parameters(
      Design design, ModuleDeclarationContext module) {
    ImmutableList.Builder<Parameter> result = ImmutableList.builder();
    if (module.parameterPortList() != null) {
      // A parameter port without a keyword continues the previous declaration; the first one is a
      // parameter.
      boolean local = false;
      for (ParameterPortContext port : module.parameterPortList().parameterPort()) {
        if (port.parameterKeyword() != null) {
          local = port.parameterKeyword().getText().equals("localparam");
        }
        if (!local) {
          result.add(parameter(design, port.paramAssignment()));
        }
      }
      return result.build();
    }
    // Without a parameter port list, body parameters can be overridden.
    for (ModuleItemContext item : module.moduleItem()) {
      if (item.parameterDeclaration() != null
          && item.parameterDeclaration().parameterKeyword().getText().equals("parameter")) {
        for (ParamAssignmentContext assignment : item.parameterDeclaration().paramAssignment()) {
          result.add(parameter(design, assignment));
        }
      }
    }
    return result.build();
  }

  private static Parameter parameter(Design design, ParamAssignmentContext assignment) {
    return new Parameter(
        assignment.identifier().getText(), design.textOf(assignment.expression()));
  }

  private static ImmutableList<Port> ports(Design design, ModuleDeclarationContext module) {
    ImmutableList.Builder<Port> result = ImmutableList.builder();
    if (module.portList() instanceof AnsiPortListContext ansi) {
      // Direction and type are inherited from the previous port when omitted.
      Direction direction = Direction.INOUT;
      String type = "logic";
      for (AnsiPortContext port : ansi.ansiPort()) {
        boolean hasType =
            port.netType() != null || !Design.isEmpty(port.dataTypeOrImplicit());
        if (port.portDirection() != null) {
          direction = Direction.of(port.portDirection());
          type = hasType ? typeOf(design, port.dataTypeOrImplicit()) : "logic";
        } else if (hasType) {
          type = typeOf(design, port.dataTypeOrImplicit());
        }
        result.add(new Port(port.identifier().getText(), direction, type));
      }
    } else if (module.portList() instanceof NonAnsiPortListContext nonAnsi) {
      Map<String, Port> declared = new LinkedHashMap<>();
      for (ModuleItemContext item : module.moduleItem()) {
        PortDeclarationContext decl = item.portDeclaration();
        if (decl != null) {
          Direction direction = Direction.of(decl.portDirection());
          String type = typeOf(design, decl.dataTypeOrImplicit());
          for (IdentifierContext id : decl.identifier()) {
            declared.put(id.getText(), new Port(id.getText(), direction, type));
          }
        }
      }
      for (IdentifierContext id : nonAnsi.identifier()) {
        Port port = declared.get(id.getText());
        result.add(port != null ? port : new Port(id.getText(), Direction.INOUT, "logic"));
      }
    }
    return result.build();
  }

  /**
   * Returns a declaration prefix for a port of the given type, normalizing vector and implicit
   * types to {@code logic} so that the result can be used for either a net or a variable.
   */
  private static String typeOf(Design design, DataTypeOrImplicitContext ctx) {
    DataTypeContext dataType = ctx.dataType();
    if (dataType == null) {
      ImplicitTypeContext implicit = ctx.implicitType();
      return vectorType(design, implicit.signing(), implicit.packedDimension());
    } else if (dataType instanceof VectorTypeContext vector) {
      return vectorType(design, vector.signing(), vector.packedDimension());
    }
    return design.textOf(dataType);
  }

  private static String vectorType(
      Design design,
      @Nullable SigningContext signing,
      Iterable<PackedDimensionContext> dimensions) {
    StringBuilder sb = new StringBuilder("logic");
    if (signing != null) {
      sb.append(' ').append(signing.getText());
    }
    for (PackedDimensionContext dimension : dimensions) {
      sb.append(' ').append(design.textOf(dimension));
    }
    return sb.toString();
  }
}
