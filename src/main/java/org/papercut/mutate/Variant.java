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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import org.papercut.hdl.Design;
import org.papercut.hdl.DesignRewriter;

/**
 * A candidate design derived from a base design by choosing one branch for each of some Rewrites.
 * The candidate's top module is renamed to the Variant's name so that it can be elaborated next to
 * the base module. Variants are immutable.
 */
public final class Variant {

  /** The branch chosen for one Rewrite. */
  public record Choice(Rewrite rewrite, int branch) {
    /** The select index that forces this choice. */
    public int selectionIndex() {
      return rewrite.selectionIndex(branch);
    }
  }

  private final String name;
  private final Design base;
  private final ImmutableList<Choice> choices;
  private final String text;
  private final Supplier<Design> design;

  Variant(String name, Design base, ImmutableList<Choice> choices, String text) {
    this.name = name;
    this.base = base;
    this.choices = choices;
    this.text = text;
    this.design = Suppliers.memoize(() -> Design.parse(text, fileName()));
  }

  /**
   * Returns the Variant that replaces {@code rewrite}'s site by the given branch, named
   * {@code <module>_<category><selection index>}.
   */
  public static Variant ofBranch(Rewrite rewrite, int branch) {
    Design base = rewrite.design();
    String name =
        base.moduleName() + "_" + rewrite.category().tag + rewrite.selectionIndex(branch);
    DesignRewriter rewriter = new DesignRewriter(base);
    rewrite.applyBranch(rewriter, branch);
    rewriter.renameModule(name);
    return new Variant(
        name, base, ImmutableList.of(new Choice(rewrite, branch)), rewriter.renderDocument());
  }

  /** Returns a Variant wrapping an already derived design, e.g. a mux-encoded one. */
  public static Variant of(Design base, Design derived) {
    return new Variant(derived.moduleName(), base, ImmutableList.of(), derived.text());
  }

  public String name() {
    return name;
  }

  public String fileName() {
    return name + ".sv";
  }

  public Design base() {
    return base;
  }

  public ImmutableList<Choice> choices() {
    return choices;
  }

  public String text() {
    return text;
  }

  /** Returns the parsed candidate design. */
  public Design design() {
    return design.get();
  }

  @Override
  public String toString() {
    return name;
  }
}
