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

import org.antlr.v4.runtime.ParserRuleContext;
import org.papercut.hdl.Design;
import org.papercut.hdl.SourceSpan;

/**
 * A location in a design that can be simplified. Sites are identified by their node (compared by
 * identity) and by a handle that is stable for a given design: the node's position in a pre-order
 * walk of the top module.
 */
public final class Site {
  private final Category category;
  private final Design design;
  private final ParserRuleContext node;
  private final int handle;

  Site(Category category, Design design, ParserRuleContext node, int handle) {
    this.category = category;
    this.design = design;
    this.node = node;
    this.handle = handle;
  }

  public Category category() {
    return category;
  }

  public Design design() {
    return design;
  }

  public ParserRuleContext node() {
    return node;
  }

  public int handle() {
    return handle;
  }

  public int numBranches() {
    return category.numBranches;
  }

  public SourceSpan span() {
    return design.span(node);
  }

  @Override
  public String toString() {
    return category.tag + "@" + span();
  }
}
