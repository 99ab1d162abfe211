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

package org.papercut;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.papercut.hdl.Design;
import org.papercut.hdl.ParameterConcretizer;
import org.papercut.mutate.Category;
import org.papercut.mutate.MuxEncoder;
import org.papercut.mutate.Rewrite;
import org.papercut.mutate.RewriteSet;
import org.papercut.mutate.Site;
import org.papercut.mutate.SiteLocator;
import org.papercut.mutate.Variant;
import org.papercut.mutate.VariantGenerator;
import org.papercut.verify.ArtifactWriter;
import org.papercut.verify.ConsolidatedDesign;
import org.papercut.verify.Consolidator;
import org.papercut.verify.Prover;
import org.papercut.verify.ProverPool;
import org.papercut.verify.Run;
import org.papercut.verify.RunOrchestrator;

/**
 * Runs the whole simplification pipeline on one design file: concretizes its parameters, locates
 * the sites of the requested categories, writes a candidate for each branch (or each combination of
 * branches) and the mux-encoded design, and optionally proves the candidates and writes the
 * consolidated result.
 *
 * <p>All files are written to the output directory, which must already exist.
 */
public final class PapercutDriver {
  private static final Logger logger = Logger.getLogger(PapercutDriver.class.getName());

  /**
   * What to do with a design.
   *
   * @param categories the kinds of site to simplify; sites are registered in enum order
   * @param verify prove each candidate and write the consolidated design
   * @param exhaustive combine two-branch sites into {@code 2^n} variants instead of one candidate
   *     per branch
   * @param proveMux also prove the mux-encoded design
   * @param unverified write the design with the first branch of every site applied
   * @param maxSites the limit on sites combined in exhaustive mode
   * @param maxConcurrency the limit on provers running at once
   */
  public record Options(
      ImmutableSet<Category> categories,
      boolean verify,
      boolean exhaustive,
      boolean proveMux,
      boolean unverified,
      int maxSites,
      int maxConcurrency) {

    public static Options of(Iterable<Category> categories) {
      return new Options(
          ImmutableSet.copyOf(categories),
          false,
          false,
          false,
          false,
          VariantGenerator.DEFAULT_MAX_SITES,
          ProverPool.DEFAULT_MAX_CONCURRENCY);
    }
  }

  /** Everything the pipeline produced; fields for steps that were not requested are null. */
  public record Result(
      Design base,
      RewriteSet rewrites,
      ImmutableList<Variant> candidates,
      MuxEncoder.Encoding encoding,
      @Nullable ImmutableList<Run> runs,
      @Nullable ConsolidatedDesign consolidated,
      @Nullable ConsolidatedDesign unverified) {}

  private final Options options;
  private final Prover prover;
  private final ArtifactWriter writer;

  public PapercutDriver(Options options, Prover prover, Path outputDirectory) {
    this.options = options;
    this.prover = prover;
    this.writer = new ArtifactWriter(outputDirectory);
  }

  /**
   * Processes the design in {@code input}. Throws IOException if the input cannot be read, or
   * {@link org.papercut.hdl.DesignError} if it is not a valid design.
   */
  public Result run(Path input) throws IOException, InterruptedException {
    Design original = Design.read(input);
    String moduleName = original.moduleName();
    String baseFile = moduleName + "_concretized.sv";
    Design base = Design.parse(ParameterConcretizer.concretize(original).text(), baseFile);
    writer.write(baseFile, base.text());
    if (base.modules().size() > 1) {
      logger.warning(
          String.format(
              "%s declares %s modules; only %s is simplified, and every candidate file repeats"
                  + " the others",
              input, base.modules().size(), moduleName));
    }
    logger.info(String.format("Concretized %s into %s", input, baseFile));

    RewriteSet rewrites = new RewriteSet();
    for (Category category : Category.values()) {
      if (options.categories().contains(category)) {
        for (Site site : SiteLocator.locate(base, category)) {
          rewrites.addRewrite(Rewrite.of(site));
        }
      }
    }
    logger.info(
        String.format(
            "Found %s sites using %s select indices", rewrites.size(), rewrites.totalSelections()));

    ImmutableList<Variant> candidates = candidates(base, rewrites);
    for (Variant candidate : candidates) {
      writer.write(candidate.fileName(), candidate.text());
    }

    MuxEncoder.Encoding encoding = MuxEncoder.encode(base, rewrites);
    Variant muxed = Variant.of(base, encoding.design());
    writer.write(muxed.fileName(), muxed.text());

    ConsolidatedDesign unverified = null;
    if (options.unverified()) {
      unverified = Consolidator.applyAll(base, rewrites, moduleName + "_unverified");
      writer.write(moduleName + "_unverified.sv", unverified.design().text());
    }

    ImmutableList<Run> runs = null;
    ConsolidatedDesign consolidated = null;
    if (options.verify()) {
      List<Variant> toProve = new ArrayList<>(candidates);
      if (options.proveMux()) {
        toProve.add(muxed);
      }
      try (ProverPool pool = new ProverPool(options.maxConcurrency())) {
        runs = new RunOrchestrator(prover, pool, writer).verify(base, baseFile, toProve);
      }
      long passed = runs.stream().filter(Run::passed).count();
      logger.info(String.format("%s of %s proofs passed", passed, runs.size()));
      String consolidatedName = moduleName + "_consolidated";
      consolidated =
          options.exhaustive()
              ? Consolidator.firstPassing(base, runs, consolidatedName)
              : Consolidator.consolidate(base, rewrites, runs, consolidatedName);
      writer.write(consolidatedName + ".sv", consolidated.design().text());
    }
    return new Result(base, rewrites, candidates, encoding, runs, consolidated, unverified);
  }

  private ImmutableList<Variant> candidates(Design base, RewriteSet rewrites) {
    if (options.exhaustive()) {
      return new VariantGenerator(options.maxSites()).generate(base, rewrites.rewrites());
    }
    ImmutableList.Builder<Variant> result = ImmutableList.builder();
    for (Rewrite rewrite : rewrites) {
      for (int branch = 0; branch < rewrite.numSelections(); branch++) {
        result.add(Variant.ofBranch(rewrite, branch));
      }
    }
    return result.build();
  }
}
