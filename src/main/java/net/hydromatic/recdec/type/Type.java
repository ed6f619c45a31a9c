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
package net.hydromatic.recdec.type;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Type, as supplied by the type system.
 *
 * <p>There are three kinds: a {@link TypeDef} (a definition, whose type
 * arguments are its own type parameters), a {@link ParameterizedType} (a
 * definition applied to type arguments), and a {@link TypeParameter}.
 * Other implementations are treated as opaque definitions.
 */
public interface Type {
  /** Namespace, e.g. "System.Text"; empty for type parameters. */
  String namespace();

  /** Name without namespace or generic arity, e.g. "StringBuilder". */
  String name();

  TypeKind kind();

  /** Type arguments; empty if the type is not generic. */
  List<? extends Type> typeArguments();

  /** Returns the definition of this type, or null for a type parameter. */
  @Nullable TypeDef definition();

  /** Returns the {@code i}th type argument. */
  default Type arg(int i) {
    return typeArguments().get(i);
  }

  /** Returns the name qualified by namespace, e.g. "System.Text.StringBuilder".
   */
  default String fullName() {
    return namespace().isEmpty() ? name() : namespace() + "." + name();
  }
}

// End Type.java
