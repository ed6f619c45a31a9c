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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Generic type definition applied to type arguments, for example
 * "{@code EqualityComparer<int>}".
 *
 * <p>Two parameterized types are equal if they have the same definition and
 * equal type arguments. */
public class ParameterizedType implements Type {
  public final TypeDef definition;
  public final ImmutableList<Type> typeArguments;

  public ParameterizedType(TypeDef definition, List<? extends Type> args) {
    this.definition = requireNonNull(definition);
    this.typeArguments = ImmutableList.copyOf(args);
    checkArgument(args.size() == definition.typeParameters.size(),
        "wrong number of type arguments for %s: %s", definition, args);
  }

  @Override
  public String namespace() {
    return definition.namespace;
  }

  @Override
  public String name() {
    return definition.name;
  }

  @Override
  public TypeKind kind() {
    return definition.kind;
  }

  @Override
  public List<Type> typeArguments() {
    return typeArguments;
  }

  @Override
  public TypeDef definition() {
    return definition;
  }

  @Override
  public int hashCode() {
    return Objects.hash(definition, typeArguments);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ParameterizedType
        && definition == ((ParameterizedType) o).definition
        && typeArguments.equals(((ParameterizedType) o).typeArguments);
  }

  @Override
  public String toString() {
    return typeArguments.stream()
        .map(Object::toString)
        .collect(Collectors.joining(", ", definition.fullName() + "<", ">"));
  }
}

// End ParameterizedType.java
