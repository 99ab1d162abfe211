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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.papercut.hdl.VerilogParser.DescriptionContext;
import org.papercut.hdl.VerilogParser.ModuleDeclarationContext;
import org.papercut.hdl.VerilogParser.ModuleInstantiationContext;
import org.papercut.hdl.VerilogParser.SourceTextContext;

/**
 * An immutable parsed design: its source text together with the parse tree and token stream
 * produced from that text.
 *
 * <p>Parse tree nodes are only meaningful relative to the Design that produced them; code that
 * needs to identify a node (e.g. a mutation site) holds on to both. Every change to a design
 * produces a new Design, usually via {@link DesignRewriter#toDesign}.
 */
public final class Design {
  private final String text;
  private final String sourceName;
  private final CommonTokenStream tokens;
  private final SourceTextContext tree;

  /**
   * True if no character of {@link #text} is part of a surrogate pair, in which case the code point
   * indices stored in tokens can be used directly as String offsets.
   */
  private final boolean offsetsAreCodePoints;

  private final Supplier<ModuleDeclarationContext> topModule =
      Suppliers.memoize(this::findTopModule);

  private Design(String text, String sourceName, CommonTokenStream tokens, SourceTextContext tree) {
    this.text = text;
    this.sourceName = sourceName;
    this.tokens = tokens;
    this.tree = tree;
    this.offsetsAreCodePoints = text.length() == text.codePointCount(0, text.length());
  }

  /** Parses the given text; throws a {@link DesignError} if it is not syntactically valid. */
  public static Design parse(String text, String sourceName) {
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            throw new DesignError(msg, lineNum, charPositionInLine);
          }
        };
    VerilogLexer lexer = new VerilogLexer(CharStreams.fromString(text, sourceName));
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    VerilogParser parser = new VerilogParser(tokens);
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    SourceTextContext tree = parser.sourceText();
    return new Design(text, sourceName, tokens, tree);
  }

  /** Reads and parses the given file. */
  public static Design read(Path path) throws IOException {
    return parse(Files.readString(path), path.getFileName().toString());
  }

  public String text() {
    return text;
  }

  public String sourceName() {
    return sourceName;
  }

  public CommonTokenStream tokens() {
    return tokens;
  }

  public SourceTextContext tree() {
    return tree;
  }

  /** Returns every module declared in this design, in source order. */
  public ImmutableList<ModuleDeclarationContext> modules() {
    ImmutableList.Builder<ModuleDeclarationContext> result = ImmutableList.builder();
    for (DescriptionContext description : tree.description()) {
      if (description.moduleDeclaration() != null) {
        result.add(description.moduleDeclaration());
      }
    }
    return result.build();
  }

  /**
   * Returns the first module that no other module in this design instantiates (or the first module
   * if every one is instantiated); throws {@link StructureNotFoundException} if there is none.
   */
  public ModuleDeclarationContext topModule() {
    return topModule.get();
  }

  private ModuleDeclarationContext findTopModule() {
    ImmutableList<ModuleDeclarationContext> modules = modules();
    if (modules.isEmpty()) {
      throw new StructureNotFoundException("No module declaration in " + sourceName);
    }
    Set<String> instantiated = new HashSet<>();
    for (ModuleDeclarationContext module : modules) {
      collectInstantiations(module, module.name.getText(), instantiated);
    }
    for (ModuleDeclarationContext module : modules) {
      if (!instantiated.contains(module.name.getText())) {
        return module;
      }
    }
    return modules.get(0);
  }

  private static void collectInstantiations(ParseTree node, String parent, Set<String> names) {
    if (node instanceof ModuleInstantiationContext instance) {
      String name = instance.moduleName.getText();
      // A module instantiating itself does not make it a submodule.
      if (!name.equals(parent)) {
        names.add(name);
      }
      return;
    }
    for (int i = 0; i < node.getChildCount(); i++) {
      collectInstantiations(node.getChild(i), parent, names);
    }
  }

  /** Returns the name of {@link #topModule}. */
  public String moduleName() {
    return topModule().name.getText();
  }

  /** Returns a copy of this design with {@link #topModule} (and its end label) renamed. */
  public Design renameModule(String newName) {
    return new DesignRewriter(this).renameModule(newName).toDesign();
  }

  /** True if the given context matched no tokens (e.g. an omitted optional type). */
  public static boolean isEmpty(ParserRuleContext ctx) {
    return ctx.stop == null || ctx.stop.getTokenIndex() < ctx.start.getTokenIndex();
  }

  /** Returns the offset in {@link #text} of the first character of the given node. */
  public int startOffset(ParseTree node) {
    if (node instanceof TerminalNode terminal) {
      return charOffset(terminal.getSymbol().getStartIndex());
    }
    return charOffset(((ParserRuleContext) node).start.getStartIndex());
  }

  /** Returns the offset in {@link #text} just past the last character of the given node. */
  public int endOffset(ParseTree node) {
    if (node instanceof TerminalNode terminal) {
      return charOffset(terminal.getSymbol().getStopIndex() + 1);
    }
    ParserRuleContext ctx = (ParserRuleContext) node;
    return isEmpty(ctx) ? startOffset(ctx) : charOffset(ctx.stop.getStopIndex() + 1);
  }

  /** Returns the source text of the given node, exactly as it appears in this design. */
  public String textOf(ParseTree node) {
    return text.substring(startOffset(node), endOffset(node));
  }

  /** Returns the location of the given node. */
  public SourceSpan span(ParserRuleContext ctx) {
    return new SourceSpan(
        startOffset(ctx),
        endOffset(ctx),
        ctx.start.getLine(),
        ctx.start.getCharPositionInLine() + 1);
  }

  /** Returns the whitespace preceding the given node on its line. */
  public String indentationOf(ParseTree node) {
    int start = startOffset(node);
    int lineStart = text.lastIndexOf('\n', start - 1) + 1;
    int end = lineStart;
    while (end < start && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
      end++;
    }
    return text.substring(lineStart, end);
  }

  private int charOffset(int codePointIndex) {
    return offsetsAreCodePoints ? codePointIndex : text.offsetByCodePoints(0, codePointIndex);
  }

  @Override
  public String toString() {
    return sourceName;
  }
}
