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

import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.papercut.mutate.Variant;

/**
 * One equivalence check of a candidate against its base design. A Run is created PENDING, moves to
 * RUNNING when a prover slot picks it up, and is completed exactly once with the prover's verdict
 * and captured output.
 */
public final class Run {
  private final Variant candidate;

  @GuardedBy("this")
  private RunStatus status = RunStatus.PENDING;

  @GuardedBy("this")
  private String output = "";

  public Run(Variant candidate) {
    this.candidate = candidate;
  }

  public String name() {
    return candidate.name();
  }

  public Variant candidate() {
    return candidate;
  }

  /** The name of the module that instantiates both the base and the candidate. */
  public String wrapperName() {
    return name() + "_wrapper";
  }

  public String scriptFileName() {
    return wrapperName() + ".tcl";
  }

  public String logFileName() {
    return wrapperName() + "_output.log";
  }

  public synchronized RunStatus status() {
    return status;
  }

  public synchronized String output() {
    return output;
  }

  public synchronized boolean passed() {
    return status == RunStatus.PASS;
  }

  synchronized void start() {
    checkState(status == RunStatus.PENDING, "%s is already %s", name(), status);
    status = RunStatus.RUNNING;
  }

  /** Records the outcome of this Run; throws if it has already been recorded. */
  public synchronized void complete(boolean proven, String output) {
    checkState(!status.isDone(), "%s already completed with %s", name(), status);
    this.status = proven ? RunStatus.PASS : RunStatus.FAIL;
    this.output = output;
  }

  @Override
  public synchronized String toString() {
    return name() + ": " + status;
  }
}
