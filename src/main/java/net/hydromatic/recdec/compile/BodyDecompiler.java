/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.recdec.compile;

import net.hydromatic.recdec.il.Il;
import net.hydromatic.recdec.type.Method;
import net.hydromatic.recdec.util.CancellationToken;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts the body of a compiled method into an instruction tree.
 *
 * <p>The tree is normalized just enough for pattern matching: trivial control
 * flow is collapsed into a single entry block, but locals are not renamed and
 * no source-level sugar is applied. The record analyzer requests each body at
 * most as often as it needs it, and never modifies or retains the result.
 */
public interface BodyDecompiler {
  /**
   * Returns the body of a method, or null if the method has no body (it is
   * abstract or extern, or has no metadata).
   *
   * <p>Implementations should call
   * {@link CancellationToken#throwIfCancellationRequested()} during lengthy
   * work.
   */
  Il.@Nullable Function decompile(Method method,
      CancellationToken cancellationToken);
}

// End BodyDecompiler.java
