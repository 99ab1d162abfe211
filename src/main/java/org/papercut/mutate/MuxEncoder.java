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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.stream.Collectors.joining;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import org.antlr.v4.runtime.tree.ParseTree;
import org.jspecify.annotations.Nullable;
import org.papercut.hdl.Design;
import org.papercut.hdl.DesignRewriter;
import org.papercut.hdl.TokenType;
import org.papercut.hdl.VerilogParser.AnsiPortContext;
import org.papercut.hdl.VerilogParser.AnsiPortListContext;
import org.papercut.hdl.VerilogParser.DataDeclarationContext;
import org.papercut.hdl.VerilogParser.EmptyPortListContext;
import org.papercut.hdl.VerilogParser.DeclaratorContext;
import org.papercut.hdl.VerilogParser.EventControlContext;
import org.papercut.hdl.VerilogParser.FunctionDeclarationContext;
import org.papercut.hdl.VerilogParser.FunctionItemContext;
import org.papercut.hdl.VerilogParser.GenerateBlockContext;
import org.papercut.hdl.VerilogParser.HierarchicalInstanceContext;
import org.papercut.hdl.VerilogParser.IdentifierContext;
import org.papercut.hdl.VerilogParser.IdentifierExpressionContext;
import org.papercut.hdl.VerilogParser.LvalueContext;
import org.papercut.hdl.VerilogParser.ModuleDeclarationContext;
import org.papercut.hdl.VerilogParser.ModuleItemContext;
import org.papercut.hdl.VerilogParser.NonAnsiPortListContext;
import org.papercut.hdl.VerilogParser.ParamAssignmentContext;
import org.papercut.hdl.VerilogParser.ParameterDeclarationContext;
import org.papercut.hdl.VerilogParser.PortDeclarationContext;
import org.papercut.hdl.VerilogParser.PortListContext;
import org.papercut.hdl.VerilogParser.SeqBlockContext;
import org.papercut.hdl.VerilogParser.TfPortContext;

/**
 * Produces a single design in which every simplification is available at once, controlled by new
 * select inputs.
 *
 * <p>Conditions of muxable sites are guarded as described in {@link Rewrite#applyMux}. Each
 * {@link Category#BIT_SHRINK} declaration gets a one-bit-narrower shadow ({@code <name>_papercut})
 * driven from the original, and plain reads of the original are redirected to the shadow;
 * assignment targets, sensitivity lists and instance connections are left as they were. The result
 * is named {@code <module>_muxed}.
 */
public final class MuxEncoder {
  private static final Logger logger = Logger.getLogger(MuxEncoder.class.getName());

  public static final String SHADOW_SUFFIX = "_papercut";
  public static final String MODULE_SUFFIX = "_muxed";

  // Statics only
  private MuxEncoder() {}

  /** The encoded design together with the select inputs it added. */
  public record Encoding(
      Design design,
      ImmutableList<String> selectInputs,
      ImmutableList<RewriteSet.Conflict> conflicts) {}

  public static Encoding encode(Design base, RewriteSet rewrites) {
    DesignRewriter rewriter = new DesignRewriter(base);
    RewriteSet.MuxApplication application = rewrites.applyMuxes(rewriter);
    ImmutableList<ShrinkTarget> shrinks =
        rewrites.rewrites().stream()
            .map(Rewrite::shrinkTarget)
            .filter(Objects::nonNull)
            .collect(toImmutableList());
    addShadows(base, rewriter, shrinks);
    Design muxed = rewriter.toDesign();

    ImmutableList<String> selects =
        application.selectIndices().stream().map(Rewrite::selectName).collect(toImmutableList());
    DesignRewriter header = new DesignRewriter(muxed);
    header.renameModule(base.moduleName() + MODULE_SUFFIX);
    addSelectInputs(muxed, header, selects);
    logger.info(
        String.format(
            "Encoded %s with %s select inputs and %s shrunk declarations",
            base.moduleName(), selects.size(), shrinks.size()));
    return new Encoding(header.toDesign(), selects, application.conflicts());
  }

  private static void addShadows(
      Design design, DesignRewriter rewriter, List<ShrinkTarget> shrinks) {
    if (shrinks.isEmpty()) {
      return;
    }
    // Maps each shrunk name to its shadow; local to this encoding.
    Map<String, String> shadows = new HashMap<>();
    for (ShrinkTarget shrink : shrinks) {
      for (String name : shrink.names()) {
        shadows.put(name, name + SHADOW_SUFFIX);
      }
      DataDeclarationContext declaration = shrink.declaration();
      String indent = design.indentationOf(declaration);
      rewriter.insertAfter(
          declaration,
          "\n"
              + indent
              + shrink.shadowDeclaration(SHADOW_SUFFIX)
              + "\n"
              + indent
              + shrink.shadowAssignment(SHADOW_SUFFIX));
    }
    redirectReads(design.topModule(), shadows, rewriter);
  }

  private static void redirectReads(
      ParseTree node, Map<String, String> shadows, DesignRewriter rewriter) {
    if (node instanceof LvalueContext
        || node instanceof EventControlContext
        || node instanceof HierarchicalInstanceContext
        || node instanceof DataDeclarationContext) {
      return;
    } else if (node instanceof FunctionDeclarationContext
        || node instanceof SeqBlockContext
        || node instanceof GenerateBlockContext) {
      // Names declared in this scope hide the module-level signals.
      List<String> locals = localNames(node);
      if (locals.stream().anyMatch(shadows::containsKey)) {
        Map<String, String> visible = new HashMap<>(shadows);
        visible.keySet().removeAll(locals);
        shadows = visible;
      }
    } else if (node instanceof IdentifierExpressionContext id && id.select().isEmpty()) {
      IdentifierContext identifier = id.identifier();
      String shadow = shadows.get(identifier.getText());
      if (shadow != null) {
        rewriter.replace(
            identifier,
            String.format("(%s !== 'z ? %s : %s)", shadow, shadow, identifier.getText()));
      }
      return;
    }
    for (int i = 0; i < node.getChildCount(); i++) {
      redirectReads(node.getChild(i), shadows, rewriter);
    }
  }

  /** Returns the names declared directly in a function, begin-end block or generate block. */
  private static List<String> localNames(ParseTree scope) {
    List<String> names = new ArrayList<>();
    if (scope instanceof FunctionDeclarationContext function) {
      names.add(function.name.getText());
      for (TfPortContext port : function.tfPort()) {
        names.add(port.identifier().getText());
      }
      for (FunctionItemContext item : function.functionItem()) {
        if (item.portDeclaration() != null) {
          addNames(item.portDeclaration(), names);
        } else {
          addNames(item.blockItem().dataDeclaration(), names);
          addNames(item.blockItem().parameterDeclaration(), names);
        }
      }
    } else if (scope instanceof SeqBlockContext block) {
      block.blockItem().forEach(item -> addNames(item.dataDeclaration(), names));
      block.blockItem().forEach(item -> addNames(item.parameterDeclaration(), names));
    } else if (scope instanceof GenerateBlockContext block) {
      for (ModuleItemContext item : block.moduleItem()) {
        addNames(item.dataDeclaration(), names);
        addNames(item.parameterDeclaration(), names);
      }
    }
    return names;
  }

  private static void addNames(@Nullable ParseTree declaration, List<String> names) {
    if (declaration instanceof DataDeclarationContext data) {
      for (DeclaratorContext declarator : data.declarator()) {
        names.add(declarator.identifier().getText());
      }
    } else if (declaration instanceof ParameterDeclarationContext parameter) {
      for (ParamAssignmentContext assignment : parameter.paramAssignment()) {
        names.add(assignment.identifier().getText());
      }
    } else if (declaration instanceof PortDeclarationContext port) {
      port.identifier().forEach(id -> names.add(id.getText()));
    }
  }

  /** Adds an {@code input logic} port for each select, keeping the existing ports unchanged. */
  private static void addSelectInputs(
      Design design, DesignRewriter rewriter, List<String> selects) {
    if (selects.isEmpty()) {
      return;
    }
    ModuleDeclarationContext module = design.topModule();
    PortListContext ports = module.portList();
    String declarations = selects.stream().map(s -> "input logic " + s).collect(joining(", "));
    if (ports == null) {
      ParseTree anchor =
          (module.parameterPortList() != null) ? module.parameterPortList() : module.name;
      rewriter.insertAfter(anchor, " (" + declarations + ")");
    } else if (ports instanceof EmptyPortListContext) {
      rewriter.replace(ports, "(" + declarations + ")");
    } else if (ports instanceof AnsiPortListContext ansi) {
      List<AnsiPortContext> ansiPorts = ansi.ansiPort();
      if (ansiPorts.get(0).portDirection() != null) {
        rewriter.insertBefore(ansiPorts.get(0), declarations + ", ");
      } else {
        // The first port's direction is implicit; a port in front of it would change it.
        rewriter.insertAfter(ansiPorts.get(ansiPorts.size() - 1), ", " + declarations);
      }
    } else if (ports instanceof NonAnsiPortListContext nonAnsi) {
      List<IdentifierContext> names = nonAnsi.identifier();
      rewriter.insertAfter(names.get(names.size() - 1), ", " + Joiner.on(", ").join(selects));
      String indent =
          module.moduleItem().isEmpty() ? "  " : design.indentationOf(module.moduleItem(0));
      StringBuilder body = new StringBuilder();
      for (String select : selects) {
        body.append('\n').append(indent).append("input logic ").append(select).append(';');
      }
      rewriter.insertAfter(module.getToken(TokenType.SEMICOLON, 0), body.toString());
    }
  }
}
