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
import org.papercut.hdl.Design;
import org.papercut.mutate.Rewrite;
import org.papercut.mutate.Variant;

/**
 * The base design with every proven simplification applied.
 *
 * @param applied the branch substituted for each Rewrite that was changed, in registration order
 * @param ambiguous Rewrites for which more than one branch was proven
 */
public record ConsolidatedDesign(
    Design design, ImmutableList<Variant.Choice> applied, ImmutableList<Rewrite> ambiguous) {}
