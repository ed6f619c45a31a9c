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
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Member of a type: a {@link Field}, {@link Property} or {@link Method}.
 *
 * <p>Members are compared by identity. Use {@link #isSameDefinition(Member)}
 * to test whether two references, perhaps through different instantiations of
 * a generic declaring type, denote the same declaration.
 */
public abstract class Member {
  /** Declaring type; either the declaring {@link TypeDef} or an instantiation
   * of it. */
  public final Type declaringType;
  public final String name;
  public final Accessibility accessibility;
  public final ImmutableSet<Modifier> modifiers;
  public final ImmutableList<Attribute> attributes;

  Member(Type declaringType, String name, Accessibility accessibility,
      Collection<Modifier> modifiers, List<Attribute> attributes) {
    this.declaringType = requireNonNull(declaringType);
    this.name = requireNonNull(name);
    this.accessibility = requireNonNull(accessibility);
    this.modifiers = ImmutableSet.copyOf(modifiers);
    this.attributes = ImmutableList.copyOf(attributes);
  }

  public boolean isStatic() {
    return modifiers.contains(Modifier.STATIC);
  }

  public boolean isVirtual() {
    return modifiers.contains(Modifier.VIRTUAL);
  }

  public boolean isOverride() {
    return modifiers.contains(Modifier.OVERRIDE);
  }

  public boolean isSealed() {
    return modifiers.contains(Modifier.SEALED);
  }

  public boolean isAbstract() {
    return modifiers.contains(Modifier.ABSTRACT);
  }

  public boolean isExplicitInterfaceImplementation() {
    return modifiers.contains(Modifier.EXPLICIT_INTERFACE_IMPLEMENTATION);
  }

  /** Whether a derived type may override this member. */
  public boolean isOverridable() {
    return (isVirtual() || isOverride() || isAbstract()) && !isSealed();
  }

  /** Returns the definition of the declaring type. */
  public @Nullable TypeDef declaringTypeDef() {
    return declaringType.definition();
  }

  /** Whether this member and another denote the same declaration: same kind,
   * same declaring definition, same name. */
  public boolean isSameDefinition(Member other) {
    return other.getClass() == getClass()
        && declaringTypeDef() != null
        && declaringTypeDef() == other.declaringTypeDef()
        && name.equals(other.name);
  }

  @Override
  public String toString() {
    return declaringType + "." + name;
  }
}

// End Member.java
