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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** Method, constructor, operator or property accessor. */
public class Method extends Member {
  public final Type returnType;
  public final ImmutableList<Parameter> parameters;
  public final ImmutableList<Attribute> returnTypeAttributes;

  public Method(Type declaringType, String name, Type returnType,
      List<Parameter> parameters, Accessibility accessibility,
      Collection<Modifier> modifiers, List<Attribute> attributes,
      List<Attribute> returnTypeAttributes) {
    super(declaringType, name, accessibility, modifiers, attributes);
    this.returnType = requireNonNull(returnType);
    this.parameters = ImmutableList.copyOf(parameters);
    this.returnTypeAttributes = ImmutableList.copyOf(returnTypeAttributes);
  }

  /** Creates a builder of a public, non-virtual instance method with no
   * parameters and no attributes. */
  public static Builder builder(Type declaringType, String name,
      Type returnType) {
    return new Builder(declaringType, name, returnType);
  }

  /** Whether this is a user-defined operator, such as "op_Equality". */
  public boolean isOperator() {
    return isStatic() && name.startsWith("op_");
  }

  /** Whether this is a constructor. */
  public boolean isConstructor() {
    return name.equals(".ctor");
  }

  /** Returns the type of the {@code i}th parameter. */
  public Type parameterType(int i) {
    return parameters.get(i).type;
  }

  /** {@inheritDoc}
   *
   * <p>Methods must also have the same number of parameters. */
  @Override
  public boolean isSameDefinition(Member other) {
    return super.isSameDefinition(other)
        && parameters.size() == ((Method) other).parameters.size();
  }

  /** Builder of {@link Method}. */
  public static class Builder {
    private final Type declaringType;
    private final String name;
    private final Type returnType;
    private final List<Parameter> parameters = new ArrayList<>();
    private Accessibility accessibility = Accessibility.PUBLIC;
    private final Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
    private final List<Attribute> attributes = new ArrayList<>();
    private final List<Attribute> returnTypeAttributes = new ArrayList<>();

    Builder(Type declaringType, String name, Type returnType) {
      this.declaringType = requireNonNull(declaringType);
      this.name = requireNonNull(name);
      this.returnType = requireNonNull(returnType);
    }

    public Builder parameter(String name, Type type) {
      parameters.add(new Parameter(name, type));
      return this;
    }

    public Builder accessibility(Accessibility accessibility) {
      this.accessibility = requireNonNull(accessibility);
      return this;
    }

    public Builder modifiers(Modifier... modifiers) {
      this.modifiers.addAll(Arrays.asList(modifiers));
      return this;
    }

    public Builder attribute(Type attributeType) {
      attributes.add(new Attribute(attributeType));
      return this;
    }

    public Builder returnTypeAttribute(Type attributeType) {
      returnTypeAttributes.add(new Attribute(attributeType));
      return this;
    }

    public Method build() {
      return new Method(declaringType, name, returnType, parameters,
          accessibility, modifiers, attributes, returnTypeAttributes);
    }
  }
}

// End Method.java
