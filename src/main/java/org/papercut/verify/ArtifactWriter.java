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

import com.google.common.io.MoreFiles;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes output files into one directory. A file that cannot be written is logged and reported
 * through the return value; it never stops the files that follow.
 */
public final class ArtifactWriter {
  private static final Logger logger = Logger.getLogger(ArtifactWriter.class.getName());

  private final Path directory;

  public ArtifactWriter(Path directory) {
    this.directory = directory;
  }

  public Path directory() {
    return directory;
  }

  /** Writes {@code text} to {@code fileName}, replacing any previous contents. */
  @CanIgnoreReturnValue
  public boolean write(String fileName, String text) {
    Path path = directory.resolve(fileName);
    try {
      MoreFiles.asCharSink(path, UTF_8).write(text);
      return true;
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to write " + path, e);
      return false;
    }
  }
}
