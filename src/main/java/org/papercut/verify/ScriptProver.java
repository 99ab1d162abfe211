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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.CharStreams;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * A Prover that runs an external command through {@code sh -c}. The command is built from a
 * template in which {@code {script}} is replaced by the Run's script file and {@code {name}} by
 * the Run's name; it runs in the output directory with stderr merged into stdout, and only a zero
 * exit status counts as proven.
 */
public final class ScriptProver implements Prover {
  private static final Logger logger = Logger.getLogger(ScriptProver.class.getName());

  /** The system property that overrides {@link #DEFAULT_TEMPLATE}. */
  public static final String TEMPLATE_PROPERTY = "papercut.prover";

  public static final String DEFAULT_TEMPLATE = "jg -no_gui -tcl {script} -proj {name}_jgproject";

  private final String template;

  public ScriptProver(String template) {
    this.template = template;
  }

  /** Returns the command that would be run for {@code run}. */
  public String command(Run run) {
    return template.replace("{script}", run.scriptFileName()).replace("{name}", run.name());
  }

  @Override
  public Outcome prove(Run run, Path directory) throws IOException, InterruptedException {
    String command = command(run);
    logger.fine(String.format("Running '%s' in %s", command, directory));
    Process process =
        new ProcessBuilder("sh", "-c", command)
            .directory(directory.toFile())
            .redirectErrorStream(true)
            .start();
    String output;
    try (Reader reader = new InputStreamReader(process.getInputStream(), UTF_8)) {
      output = CharStreams.toString(reader);
    }
    int exitCode = process.waitFor();
    logger.fine(String.format("'%s' exited with %s", command, exitCode));
    return new Outcome(exitCode == 0, output);
  }
}
