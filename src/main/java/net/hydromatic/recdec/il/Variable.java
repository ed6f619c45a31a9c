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
package net.hydromatic.recdec.il;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import net.hydromatic.recdec.type.Type;

/**
 * Local variable or parameter of a decompiled function.
 *
 * <p>The implicit {@code this} parameter has index -1; declared parameters
 * are numbered from 0. Variables are compared by identity.
 */
public class Variable {
  public final Kind kind;
  public final int index;
  public final String name;
  public final Type type;

  Variable(Kind kind, int index, String name, Type type) {
    this.kind = requireNonNull(kind);
    this.index = index;
    this.name = requireNonNull(name);
    this.type = requireNonNull(type);
    checkArgument(index >= 0 || kind == Kind.PARAMETER && index == -1);
  }

  /** Whether this is the declared parameter with the given index. */
  public boolean isParameter(int index) {
    return kind == Kind.PARAMETER && this.index == index;
  }

  /** Whether this is the implicit {@code this} parameter. */
  public boolean isThis() {
    return isParameter(-1);
  }

  @Override
  public String toString() {
    return name;
  }

  /** Kind of variable. */
  public enum Kind {
    PARAMETER,
    LOCAL
  }
}

// End Variable.java
