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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.IdentityHashMap;
import java.util.Map;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.papercut.hdl.VerilogParser.ModuleDeclarationContext;

/**
 * Collects edits against the nodes of one {@link Design} and renders the edited text.
 *
 * <p>Edits are keyed by node identity, never by node text, so two structurally identical nodes are
 * always distinguished. A replacement is rendered lazily and may itself render other nodes
 * (including its own descendants) through the rewriter, so edits nested inside a replaced subtree
 * are honored. Whitespace, comments and directives between tokens are copied through unchanged;
 * in particular the trivia in front of a replaced node stays in front of its replacement.
 *
 * <p>The underlying Design is never modified; {@link #toDesign} parses the rendered text into a new
 * one.
 */
public final class DesignRewriter {

  /** Produces the text that replaces an edited node. */
  @FunctionalInterface
  public interface Replacement {
    String render(DesignRewriter rewriter);
  }

  private final Design design;
  private final Map<ParseTree, Replacement> edits = new IdentityHashMap<>();
  private final Map<ParseTree, String> insertedBefore = new IdentityHashMap<>();
  private final Map<ParseTree, String> insertedAfter = new IdentityHashMap<>();

  public DesignRewriter(Design design) {
    this.design = design;
  }

  public Design design() {
    return design;
  }

  /** True if {@link #replace} has been called for this node. */
  public boolean hasEdit(ParseTree node) {
    return edits.containsKey(node);
  }

  /** Replaces the given node. A node may be replaced at most once. */
  @CanIgnoreReturnValue
  public DesignRewriter replace(ParseTree node, Replacement replacement) {
    if (edits.containsKey(node)) {
      throw new IllegalStateException(
          String.format(
              "Node '%s' at offset %s already has an edit",
              design.textOf(node), design.startOffset(node)));
    }
    edits.put(node, replacement);
    return this;
  }

  @CanIgnoreReturnValue
  public DesignRewriter replace(ParseTree node, String text) {
    return replace(node, rewriter -> text);
  }

  /** Adds text immediately before the given node (after any trivia that precedes it). */
  @CanIgnoreReturnValue
  public DesignRewriter insertBefore(ParseTree node, String text) {
    insertedBefore.merge(node, text, String::concat);
    return this;
  }

  /** Adds text immediately after the given node. */
  @CanIgnoreReturnValue
  public DesignRewriter insertAfter(ParseTree node, String text) {
    insertedAfter.merge(node, text, String::concat);
    return this;
  }

  /** Renames the design's top module, including its end label if it has one. */
  @CanIgnoreReturnValue
  public DesignRewriter renameModule(String newName) {
    ModuleDeclarationContext module = design.topModule();
    replace(module.name, newName);
    if (module.endName != null) {
      replace(module.endName, newName);
    }
    return this;
  }

  /** Returns the text of the given node with all applicable edits. */
  public String render(ParseTree node) {
    Replacement replacement = edits.get(node);
    String result = (replacement != null) ? replacement.render(this) : renderUnedited(node);
    String before = insertedBefore.get(node);
    String after = insertedAfter.get(node);
    if (before == null && after == null) {
      return result;
    }
    return (before == null ? "" : before) + result + (after == null ? "" : after);
  }

  /**
   * Returns the text of the given node, ignoring any replacement of the node itself but honoring
   * edits of its descendants. A replacement that wraps its own node uses this to render the
   * original.
   */
  public String renderUnedited(ParseTree node) {
    if (node instanceof TerminalNode terminal) {
      return terminal.getSymbol().getType() == Token.EOF ? "" : design.textOf(terminal);
    }
    ParserRuleContext ctx = (ParserRuleContext) node;
    if (Design.isEmpty(ctx)) {
      return "";
    }
    String text = design.text();
    StringBuilder sb = new StringBuilder();
    int pos = design.startOffset(ctx);
    for (int i = 0; i < ctx.getChildCount(); i++) {
      ParseTree child = ctx.getChild(i);
      if (child instanceof ParserRuleContext childCtx && Design.isEmpty(childCtx)) {
        sb.append(render(child));
        continue;
      }
      sb.append(text, pos, design.startOffset(child));
      sb.append(render(child));
      pos = design.endOffset(child);
    }
    return sb.toString();
  }

  /** Returns the complete text of the edited design. */
  public String renderDocument() {
    ParserRuleContext root = design.tree();
    String text = design.text();
    return text.substring(0, design.startOffset(root))
        + render(root)
        + text.substring(design.endOffset(root));
  }

  /** Parses the edited text into a new Design. */
  public Design toDesign() {
    return Design.parse(renderDocument(), design.sourceName());
  }
}
