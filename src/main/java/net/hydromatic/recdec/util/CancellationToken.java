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
package net.hydromatic.recdec.util;

import java.util.concurrent.CancellationException;

/**
 * Signal that an analysis should stop.
 *
 * <p>Cancellation is cooperative: long-running code calls
 * {@link #throwIfCancellationRequested()} at safe points, and the resulting
 * {@link CancellationException} unwinds the whole analysis.
 */
@FunctionalInterface
public interface CancellationToken {
  /** Token that is never cancelled. */
  CancellationToken NONE = () -> false;

  /** Returns whether cancellation has been requested. */
  boolean isCancellationRequested();

  /** Throws {@link CancellationException} if cancellation has been
   * requested. */
  default void throwIfCancellationRequested() {
    if (isCancellationRequested()) {
      throw new CancellationException("analysis cancelled");
    }
  }
}

// End CancellationToken.java
