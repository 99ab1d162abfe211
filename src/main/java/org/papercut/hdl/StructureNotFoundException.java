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

package org.papercut.hdl;

/** Thrown when a design has none of the structure papercut needs, e.g. no module declaration. */
public class StructureNotFoundException extends DesignError {
  public StructureNotFoundException(String msg) {
    super(msg, 0, 0);
  }

  @Override
  public String getMessage() {
    return msg;
  }
}
