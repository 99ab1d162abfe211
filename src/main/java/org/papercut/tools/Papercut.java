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

package org.papercut.tools;

import com.google.common.collect.Sets;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Set;
import java.util.logging.LogManager;
import org.papercut.PapercutDriver;
import org.papercut.hdl.DesignError;
import org.papercut.mutate.Category;
import org.papercut.mutate.VariantGenerator;
import org.papercut.verify.ProverPool;
import org.papercut.verify.ScriptProver;

/** A command-line tool for simplifying a single design. */
public class Papercut {
  private Papercut() {}

  private static final String USAGE =
      "Use: papercut [-s] [-c] [-i] [-t] [-a] [-u] [-e] [-x] [-m] [-o <dir>] [-j <n>] <file.sv>\n"
          + "  -s  shrink vector declarations by one bit\n"
          + "  -c  remove case items\n"
          + "  -i  remove if conditions\n"
          + "  -t  remove ternary conditions\n"
          + "  -a  all of the above\n"
          + "  -u  also write the design with every simplification applied, unverified\n"
          + "  -e  check each candidate for equivalence and consolidate the proven ones\n"
          + "  -x  combine sites exhaustively (up to papercut.maxSites, default 10)\n"
          + "  -m  also check the mux-encoded design\n"
          + "  -o  output directory (default outputs)\n"
          + "  -j  maximum number of concurrent provers (default 32)\n"
          + "System property papercut.maxSites must be an integer from 0 to 30.";

  static final String MAX_SITES_PROPERTY = "papercut.maxSites";

  /** True if {@code value} is a valid {@value #MAX_SITES_PROPERTY}: an integer from 0 to 30. */
  static boolean isMaxSites(String value) {
    return value.matches("[0-9]{1,2}") && Integer.parseInt(value) <= 30;
  }

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println(USAGE);
      System.exit(1);
    }
  }

  /** Installs {@code logging.properties} from the classpath unless logging was configured. */
  private static void configureLogging() throws IOException {
    if (System.getProperty("java.util.logging.config.file") != null) {
      return;
    }
    try (InputStream in = Papercut.class.getResourceAsStream("/logging.properties")) {
      if (in != null) {
        LogManager.getLogManager().readConfiguration(in);
      }
    }
  }

  public static void main(String[] args) throws IOException, InterruptedException {
    configureLogging();
    String proverTemplate =
        System.getProperty(ScriptProver.TEMPLATE_PROPERTY, ScriptProver.DEFAULT_TEMPLATE);
    String maxSitesProp =
        System.getProperty(
            MAX_SITES_PROPERTY, String.valueOf(VariantGenerator.DEFAULT_MAX_SITES));
    checkUsage(isMaxSites(maxSitesProp));
    int maxSites = Integer.parseInt(maxSitesProp);
    Set<Category> categories = EnumSet.noneOf(Category.class);
    boolean verify = false;
    boolean exhaustive = false;
    boolean proveMux = false;
    boolean unverified = false;
    Path outputDirectory = Path.of("outputs");
    int maxConcurrency = ProverPool.DEFAULT_MAX_CONCURRENCY;
    Path input = null;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      switch (arg) {
        case "-s":
          categories.add(Category.BIT_SHRINK);
          break;
        case "-c":
          categories.add(Category.CASE_ITEM);
          break;
        case "-i":
          categories.add(Category.CONDITIONAL);
          break;
        case "-t":
          categories.add(Category.TERNARY);
          break;
        case "-a":
          categories.addAll(EnumSet.allOf(Category.class));
          break;
        case "-u":
          unverified = true;
          break;
        case "-e":
          verify = true;
          break;
        case "-x":
          exhaustive = true;
          break;
        case "-m":
          proveMux = true;
          break;
        case "-o":
          checkUsage(i + 1 < args.length);
          outputDirectory = Path.of(args[++i]);
          break;
        case "-j":
          checkUsage(i + 1 < args.length && args[i + 1].matches("[1-9][0-9]*"));
          maxConcurrency = Integer.parseInt(args[++i]);
          break;
        default:
          checkUsage(!arg.startsWith("-") && input == null);
          input = Path.of(arg);
      }
    }
    checkUsage(input != null);
    // -u on its own applies every category
    if (categories.isEmpty() && unverified) {
      categories.addAll(EnumSet.allOf(Category.class));
    }
    checkUsage(!categories.isEmpty());
    if (!Files.isReadable(input)) {
      System.err.println("Cannot read " + input);
      System.exit(1);
    }

    // Every run starts with an empty output directory.
    if (Files.exists(outputDirectory)) {
      MoreFiles.deleteRecursively(outputDirectory, RecursiveDeleteOption.ALLOW_INSECURE);
    }
    Files.createDirectories(outputDirectory);

    PapercutDriver.Options options =
        new PapercutDriver.Options(
            Sets.immutableEnumSet(categories),
            verify,
            exhaustive,
            proveMux,
            unverified,
            maxSites,
            maxConcurrency);
    PapercutDriver driver =
        new PapercutDriver(
            options, new ScriptProver(proverTemplate), outputDirectory.toAbsolutePath());
    try {
      PapercutDriver.Result result = driver.run(input);
      System.out.printf(
          "%s: %s sites, %s candidates written to %s\n",
          result.base().moduleName(),
          result.rewrites().size(),
          result.candidates().size(),
          outputDirectory);
      if (result.consolidated() != null) {
        System.out.printf(
            "Consolidated %s simplifications into %s\n",
            result.consolidated().applied().size(),
            result.consolidated().design().moduleName());
      }
    } catch (DesignError e) {
      System.err.println(input + ": " + e.getMessage());
      System.exit(1);
    }
  }
}
