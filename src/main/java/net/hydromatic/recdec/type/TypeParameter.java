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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Type parameter of a generic type definition, such as "T" in
 * "{@code record Box<T>(T Value)}".
 *
 * <p>Type parameters are compared by identity; each {@link TypeDef} owns its
 * own. */
public class TypeParameter implements Type {
  public final String name;
  public final int ordinal;

  TypeParameter(String name, int ordinal) {
    this.name = requireNonNull(name);
    this.ordinal = ordinal;
  }

  @Override
  public String namespace() {
    return "";
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public TypeKind kind() {
    return TypeKind.TYPE_PARAMETER;
  }

  @Override
  public List<Type> typeArguments() {
    return ImmutableList.of();
  }

  @Override
  public @Nullable TypeDef definition() {
    return null;
  }

  @Override
  public String toString() {
    return name;
  }
}

// End TypeParameter.java
