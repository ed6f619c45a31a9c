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
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Type definition.
 *
 * <p>A definition is created with its name and type parameters, then its
 * base types and members are attached exactly once via {@link Builder}.
 * Members refer back to their declaring type, which is why the two steps are
 * separate. After {@link Builder#build()} the definition is immutable.
 *
 * <p>Definitions are compared by identity.
 */
public class TypeDef implements Type {
  public final String namespace;
  public final String name;
  public final TypeKind kind;
  public final ImmutableList<TypeParameter> typeParameters;

  private ImmutableList<Type> directBaseTypes = ImmutableList.of();
  private ImmutableList<Field> fields = ImmutableList.of();
  private ImmutableList<Property> properties = ImmutableList.of();
  private ImmutableList<Method> methods = ImmutableList.of();
  private boolean defined;

  public TypeDef(String namespace, String name, TypeKind kind,
      List<String> typeParameterNames) {
    this.namespace = requireNonNull(namespace);
    this.name = requireNonNull(name);
    this.kind = requireNonNull(kind);
    checkArgument(kind != TypeKind.TYPE_PARAMETER);
    final ImmutableList.Builder<TypeParameter> b = ImmutableList.builder();
    for (int i = 0; i < typeParameterNames.size(); i++) {
      b.add(new TypeParameter(typeParameterNames.get(i), i));
    }
    this.typeParameters = b.build();
  }

  /** Creates a builder that attaches base types and members to a
   * definition. */
  public static Builder builder(TypeDef typeDef) {
    return new Builder(typeDef);
  }

  @Override
  public String namespace() {
    return namespace;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public TypeKind kind() {
    return kind;
  }

  /** {@inheritDoc}
   *
   * <p>For a definition, returns its own type parameters. */
  @Override
  public List<TypeParameter> typeArguments() {
    return typeParameters;
  }

  @Override
  public TypeDef definition() {
    return this;
  }

  public List<Type> directBaseTypes() {
    return directBaseTypes;
  }

  /** Fields, in metadata order. */
  public List<Field> fields() {
    return fields;
  }

  /** Properties, in metadata order. */
  public List<Property> properties() {
    return properties;
  }

  /** Methods, in metadata order; does not include property accessors. */
  public List<Method> methods() {
    return methods;
  }

  /** Returns the {@code i}th type parameter. */
  public TypeParameter typeParameter(int i) {
    return typeParameters.get(i);
  }

  @Override
  public String toString() {
    return typeParameters.isEmpty()
        ? fullName()
        : fullName() + typeParameters.toString()
            .replace('[', '<').replace(']', '>');
  }

  /** Collects the base types and members of a {@link TypeDef}. */
  public static class Builder {
    private final TypeDef typeDef;
    private final List<Type> baseTypes = new ArrayList<>();
    private final List<Field> fields = new ArrayList<>();
    private final List<Property> properties = new ArrayList<>();
    private final List<Method> methods = new ArrayList<>();

    Builder(TypeDef typeDef) {
      this.typeDef = requireNonNull(typeDef);
      checkState(!typeDef.defined, "already defined: %s", typeDef);
    }

    public Builder baseType(Type type) {
      baseTypes.add(type);
      return this;
    }

    public Builder field(Field field) {
      checkDeclaredHere(field);
      checkUnique(fields, field);
      fields.add(field);
      return this;
    }

    /** Adds a property. Indexers may share a name; other properties may
     * not. */
    public Builder property(Property property) {
      checkDeclaredHere(property);
      if (property.parameters.isEmpty()) {
        checkUnique(properties, property);
      }
      properties.add(property);
      return this;
    }

    public Builder method(Method method) {
      checkDeclaredHere(method);
      methods.add(method);
      return this;
    }

    private void checkDeclaredHere(Member member) {
      checkArgument(member.declaringType.definition() == typeDef,
          "member %s is not declared by %s", member, typeDef);
    }

    private static void checkUnique(List<? extends Member> members,
        Member member) {
      for (Member m : members) {
        checkArgument(!m.name.equals(member.name), "duplicate member %s",
            member.name);
      }
    }

    /** Attaches the collected base types and members to the definition, and
     * returns it. */
    public TypeDef build() {
      checkState(!typeDef.defined, "already defined: %s", typeDef);
      typeDef.directBaseTypes = ImmutableList.copyOf(baseTypes);
      typeDef.fields = ImmutableList.copyOf(fields);
      typeDef.properties = ImmutableList.copyOf(properties);
      typeDef.methods = ImmutableList.copyOf(methods);
      typeDef.defined = true;
      return typeDef;
    }
  }
}

// End TypeDef.java
