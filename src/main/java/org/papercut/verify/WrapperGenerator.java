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

import static java.util.stream.Collectors.joining;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.papercut.hdl.ModuleInterface;
import org.papercut.hdl.ModuleInterface.Direction;
import org.papercut.hdl.ModuleInterface.Parameter;
import org.papercut.hdl.ModuleInterface.Port;

/**
 * Renders the module used to check a candidate against its base. Both are instantiated on shared
 * inputs, each instance's outputs are exposed as {@code <module>_<output>}, and the single output
 * {@code equiv} is the AND of the equality comparisons of same-named outputs ({@code 1'b1} when
 * there are none). When {@code FORMAL} is defined {@code equiv} is asserted.
 */
public final class WrapperGenerator {

  // Statics only
  private WrapperGenerator() {}

  public static String generate(
      ModuleInterface base, ModuleInterface candidate, String wrapperName) {
    // Inputs of the base first, then any that only the candidate has (e.g. select inputs).
    List<Port> inputs = new ArrayList<>(base.inputs());
    Set<String> inputNames = new HashSet<>();
    inputs.forEach(p -> inputNames.add(p.name()));
    for (Port port : candidate.inputs()) {
      if (inputNames.add(port.name())) {
        inputs.add(port);
      }
    }

    StringBuilder sb = new StringBuilder();
    sb.append("module ").append(wrapperName);
    if (!base.parameters().isEmpty()) {
      sb.append(" #(\n")
          .append(
              base.parameters().stream()
                  .map(p -> "    parameter " + p.name() + " = " + p.defaultValue())
                  .collect(joining(",\n")))
          .append("\n)");
    }
    List<String> ports = new ArrayList<>();
    for (Port input : inputs) {
      String direction = (input.direction() == Direction.INOUT) ? "inout" : "input";
      ports.add(String.format("    %s %s %s", direction, input.type(), input.name()));
    }
    for (ModuleInterface module : List.of(base, candidate)) {
      for (Port output : module.outputs()) {
        ports.add(
            String.format("    output %s %s_%s", output.type(), module.name(), output.name()));
      }
    }
    ports.add("    output logic equiv");
    sb.append(" (\n").append(Joiner.on(",\n").join(ports)).append("\n);\n");

    Set<String> wrapperParameters = new HashSet<>();
    base.parameters().forEach(p -> wrapperParameters.add(p.name()));
    appendInstance(sb, base, wrapperParameters);
    appendInstance(sb, candidate, wrapperParameters);

    List<String> checks = new ArrayList<>();
    for (Port output : base.outputs()) {
      boolean matched =
          candidate.outputs().stream().anyMatch(p -> p.name().equals(output.name()));
      if (matched) {
        checks.add(
            String.format(
                "(%s_%s == %s_%s)", base.name(), output.name(), candidate.name(), output.name()));
      }
    }
    sb.append("\nassign equiv = ")
        .append(checks.isEmpty() ? "1'b1" : Joiner.on(" & ").join(checks))
        .append(";\n");
    sb.append("\n`ifdef FORMAL\n")
        .append("  always @(*) begin\n")
        .append("    assert(equiv);\n")
        .append("  end\n")
        .append("`endif\n")
        .append("\nendmodule\n");
    return sb.toString();
  }

  private static void appendInstance(
      StringBuilder sb, ModuleInterface module, Set<String> wrapperParameters) {
    sb.append('\n').append(module.name());
    List<String> overrides = new ArrayList<>();
    for (Parameter parameter : module.parameters()) {
      if (wrapperParameters.contains(parameter.name())) {
        overrides.add(String.format("    .%s(%s)", parameter.name(), parameter.name()));
      }
    }
    if (!overrides.isEmpty()) {
      sb.append(" #(\n").append(Joiner.on(",\n").join(overrides)).append("\n)");
    }
    sb.append(' ').append(module.name()).append("_inst (\n");
    List<String> connections = new ArrayList<>();
    for (Port input : module.inputs()) {
      connections.add(String.format("    .%s(%s)", input.name(), input.name()));
    }
    for (Port output : module.outputs()) {
      connections.add(
          String.format("    .%s(%s_%s)", output.name(), module.name(), output.name()));
    }
    sb.append(Joiner.on(",\n").join(connections)).append("\n);\n");
  }
}
