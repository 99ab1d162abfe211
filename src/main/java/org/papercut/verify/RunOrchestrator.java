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

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.papercut.hdl.Design;
import org.papercut.hdl.DesignError;
import org.papercut.hdl.ModuleInterface;
import org.papercut.mutate.Variant;

/**
 * Checks candidates against their base design. For each candidate a wrapper and a proof script
 * are written to the output directory and a proof is queued on the {@link ProverPool}; once every
 * Run has completed, a summary listing each Run as {@code <name>: PASS} or {@code <name>: FAIL}
 * (in the order the candidates were given) is written to {@link #SUMMARY_FILE}.
 *
 * <p>A Run that cannot be prepared, or whose prover throws, fails; it never stops the other Runs.
 */
public final class RunOrchestrator {
  private static final Logger logger = Logger.getLogger(RunOrchestrator.class.getName());

  public static final String SUMMARY_FILE = "equivalence_results.txt";

  private final Prover prover;
  private final ProverPool pool;
  private final ArtifactWriter writer;

  public RunOrchestrator(Prover prover, ProverPool pool, ArtifactWriter writer) {
    this.prover = prover;
    this.pool = pool;
    this.writer = writer;
  }

  /**
   * Verifies each candidate against {@code base}, whose source has been written as
   * {@code baseFile}, and returns the completed Runs in submission order.
   */
  public ImmutableList<Run> verify(Design base, String baseFile, List<Variant> candidates)
      throws InterruptedException {
    ModuleInterface baseInterface = ModuleInterface.of(base);
    List<Run> runs = new ArrayList<>();
    List<Future<?>> pending = new ArrayList<>();
    for (Variant candidate : candidates) {
      Run run = new Run(candidate);
      runs.add(run);
      if (prepare(run, baseInterface, baseFile)) {
        pending.add(pool.submit(() -> execute(run)));
      } else {
        run.complete(false, "Unable to prepare verification files");
      }
    }
    logger.info(
        String.format(
            "Queued %s proofs (at most %s at a time)", pending.size(), pool.maxConcurrency()));
    for (Future<?> future : pending) {
      try {
        future.get();
      } catch (ExecutionException e) {
        // execute() records its own failures, so this is unexpected.
        logger.log(Level.SEVERE, "Proof task failed", e.getCause());
      }
    }
    writer.write(SUMMARY_FILE, summary(runs));
    return ImmutableList.copyOf(runs);
  }

  /** Returns one {@code <name>: PASS|FAIL} line per Run. */
  public static String summary(List<Run> runs) {
    StringBuilder sb = new StringBuilder();
    for (Run run : runs) {
      sb.append(run.name()).append(": ").append(run.passed() ? "PASS" : "FAIL").append('\n');
    }
    return sb.toString();
  }

  private boolean prepare(Run run, ModuleInterface baseInterface, String baseFile) {
    String wrapper;
    try {
      ModuleInterface candidate = ModuleInterface.of(run.candidate().design());
      wrapper = WrapperGenerator.generate(baseInterface, candidate, run.wrapperName());
    } catch (DesignError e) {
      logger.warning(String.format("Candidate %s is not a valid design: %s", run.name(), e));
      return false;
    }
    String wrapperFile = run.wrapperName() + ".sv";
    String script =
        ProofScript.generate(
            run.wrapperName(), List.of(baseFile, run.candidate().fileName(), wrapperFile));
    // Both files are attempted even if the first fails.
    boolean wroteWrapper = writer.write(wrapperFile, wrapper);
    boolean wroteScript = writer.write(run.scriptFileName(), script);
    return wroteWrapper && wroteScript;
  }

  private Void execute(Run run) {
    run.start();
    try {
      Prover.Outcome outcome = prover.prove(run, writer.directory());
      run.complete(outcome.proven(), outcome.output());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      run.complete(false, "Interrupted");
    } catch (IOException | RuntimeException e) {
      logger.log(Level.WARNING, "Prover failed for " + run.name(), e);
      run.complete(false, String.valueOf(e));
    }
    writer.write(run.logFileName(), run.output());
    logger.info(run.toString());
    return null;
  }
}
