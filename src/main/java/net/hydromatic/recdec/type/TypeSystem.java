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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Answers the questions about types that record analysis needs.
 *
 * <p>Supplies a single definition for each {@link KnownType}, created on
 * first use; code that builds type definitions should obtain well-known types
 * via {@link #lookup(KnownType)} so that identity comparisons work.
 */
public class TypeSystem {
  private final Map<KnownType, TypeDef> knownTypes =
      new EnumMap<>(KnownType.class);

  /** Returns the definition of a well-known type. */
  public TypeDef lookup(KnownType knownType) {
    return knownTypes.computeIfAbsent(knownType, k -> {
      final List<String> typeParameterNames = new ArrayList<>();
      for (int i = 0; i < k.typeParameterCount; i++) {
        typeParameterNames.add("T" + (i == 0 ? "" : i));
      }
      return TypeDef.builder(
              new TypeDef(k.namespace, k.typeName, k.kind, typeParameterNames))
          .build();
    });
  }

  /** Applies a generic definition to type arguments,
   * e.g. {@code EqualityComparer<int>}. */
  public ParameterizedType parameterize(TypeDef typeDef, Type... args) {
    return new ParameterizedType(typeDef, Arrays.asList(args));
  }

  /** Creates a {@code System.Collections.Generic.EqualityComparer<T>}. */
  public ParameterizedType equalityComparer(Type type) {
    return parameterize(lookup(KnownType.EQUALITY_COMPARER), type);
  }

  /** Returns whether a type is a given well-known type. Matching is by name
   * and arity, so that it works whichever module defined the type. */
  public boolean isKnownType(Type type, KnownType knownType) {
    return type.kind() != TypeKind.TYPE_PARAMETER
        && type.name().equals(knownType.typeName)
        && type.namespace().equals(knownType.namespace)
        && type.typeArguments().size() == knownType.typeParameterCount;
  }

  /** Returns whether an attribute has a given well-known type. */
  public boolean isKnownAttribute(Attribute attribute, KnownType knownType) {
    return isKnownType(attribute.attributeType, knownType);
  }

  /**
   * Returns whether two types are the same after erasure.
   *
   * <p>Erasure replaces {@code dynamic} with {@code object}, recursively
   * through type arguments. Definitions are compared by identity, type
   * parameters by identity, and parameterized types structurally. Any other
   * implementation of {@link Type} is compared with its own
   * {@code equals}.
   */
  public boolean equivalentTypes(Type type1, Type type2) {
    return erase(type1).equals(erase(type2));
  }

  private Type erase(Type type) {
    if (isKnownType(type, KnownType.DYNAMIC)) {
      return lookup(KnownType.OBJECT);
    }
    if (type instanceof ParameterizedType) {
      final ParameterizedType p = (ParameterizedType) type;
      final ImmutableList.Builder<Type> args = ImmutableList.builder();
      p.typeArguments.forEach(t -> args.add(erase(t)));
      return new ParameterizedType(p.definition, args.build());
    }
    return type;
  }
}

// End TypeSystem.java
