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

import java.io.IOException;
import java.nio.file.Path;

/** Runs the proof script of a {@link Run} and reports whether equivalence was proven. */
public interface Prover {

  /** The verdict of one proof attempt and everything the prover printed. */
  record Outcome(boolean proven, String output) {}

  /**
   * Runs the proof for {@code run}, whose wrapper and script have already been written to
   * {@code directory}. Blocks until the proof completes.
   */
  Outcome prove(Run run, Path directory) throws IOException, InterruptedException;
}
