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

package org.papercut.verify;

import com.google.common.base.Joiner;
import java.util.List;

/**
 * The TCL script given to the prover: it reads the sources with {@code FORMAL} defined, elaborates
 * the wrapper with clock and reset disabled, and attempts an unbounded proof of every assertion.
 * The script exits 0 only if everything is proven; tool errors are caught and exit 1.
 */
public final class ProofScript {

  // Statics only
  private ProofScript() {}

  public static String generate(String wrapperName, List<String> sourceFiles) {
    return "# Equivalence proof for "
        + wrapperName
        + "\n"
        + "if {[catch {\n"
        + "    analyze -sv "
        + Joiner.on(' ').join(sourceFiles)
        + " +define+FORMAL\n"
        + "    elaborate -top "
        + wrapperName
        + " -bbox_mul 64 -bbox_div 64 -bbox_mod 64\n"
        + "    clock -none\n"
        + "    reset -none\n"
        + "\n"
        + "    set res [autoprove -all -silent]\n"
        + "\n"
        + "    if {$res eq \"proven\"} {\n"
        + "        exit 0\n"
        + "    } else {\n"
        + "        exit 1\n"
        + "    }\n"
        + "} err]} {\n"
        + "    puts \"Error during formal verification: $err\"\n"
        + "    exit 1\n"
        + "}\n";
  }
}
