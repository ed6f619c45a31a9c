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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link TypeSystem} and the types and members it describes. */
class TypeSystemTest {
  private final TypeSystem ts = new TypeSystem();

  @Test
  void testLookup() {
    final TypeDef object = ts.lookup(KnownType.OBJECT);
    assertThat(ts.lookup(KnownType.OBJECT), sameInstance(object));
    assertThat(object, hasToString("System.Object"));
    assertThat(ts.lookup(KnownType.STRING_BUILDER).fullName(),
        is("System.Text.StringBuilder"));
    assertThat(ts.lookup(KnownType.DYNAMIC), hasToString("dynamic"));

    final TypeDef comparer = ts.lookup(KnownType.EQUALITY_COMPARER);
    assertThat(comparer,
        hasToString("System.Collections.Generic.EqualityComparer<T>"));
    assertThat(ts.equalityComparer(ts.lookup(KnownType.INT32)),
        hasToString("System.Collections.Generic.EqualityComparer"
            + "<System.Int32>"));
  }

  /** Known types are recognized by name, so a type from another assembly
   * with the same name is the same type. */
  @Test
  void testIsKnownType() {
    final TypeDef sb =
        new TypeDef("System.Text", "StringBuilder", TypeKind.CLASS,
            ImmutableList.of());
    assertThat(ts.isKnownType(sb, KnownType.STRING_BUILDER), is(true));
    assertThat(ts.isKnownType(sb, KnownType.STRING), is(false));

    final TypeDef myBuilder =
        new TypeDef("MyApp", "StringBuilder", TypeKind.CLASS,
            ImmutableList.of());
    assertThat(ts.isKnownType(myBuilder, KnownType.STRING_BUILDER),
        is(false));

    // The generic definition and its instantiations are EqualityComparer;
    // a non-generic type of that name is not
    final TypeDef comparer0 =
        new TypeDef("System.Collections.Generic", "EqualityComparer",
            TypeKind.CLASS, ImmutableList.of());
    assertThat(ts.isKnownType(comparer0, KnownType.EQUALITY_COMPARER),
        is(false));
    assertThat(
        ts.isKnownType(ts.equalityComparer(ts.lookup(KnownType.STRING)),
            KnownType.EQUALITY_COMPARER),
        is(true));

    final TypeDef box =
        new TypeDef("", "Box", TypeKind.CLASS, ImmutableList.of("Object"));
    assertThat(ts.isKnownType(box.typeParameter(0), KnownType.OBJECT),
        is(false));

    final Attribute attribute =
        new Attribute(ts.lookup(KnownType.COMPILER_GENERATED_ATTRIBUTE));
    assertThat(
        ts.isKnownAttribute(attribute, KnownType.COMPILER_GENERATED_ATTRIBUTE),
        is(true));
  }

  @Test
  void testEquivalentTypes() {
    final TypeDef object = ts.lookup(KnownType.OBJECT);
    final TypeDef dynamic = ts.lookup(KnownType.DYNAMIC);
    final TypeDef int32 = ts.lookup(KnownType.INT32);
    assertThat(ts.equivalentTypes(object, dynamic), is(true));
    assertThat(ts.equivalentTypes(object, int32), is(false));
    assertThat(
        ts.equivalentTypes(ts.equalityComparer(dynamic),
            ts.equalityComparer(object)),
        is(true));
    assertThat(
        ts.equivalentTypes(ts.equalityComparer(int32),
            ts.equalityComparer(object)),
        is(false));

    final TypeDef box =
        new TypeDef("", "Box", TypeKind.CLASS, ImmutableList.of("T"));
    final TypeDef box2 =
        new TypeDef("", "Box", TypeKind.CLASS, ImmutableList.of("T"));
    assertThat(ts.equivalentTypes(box.typeParameter(0), box.typeParameter(0)),
        is(true));
    assertThat(
        ts.equivalentTypes(box.typeParameter(0), box2.typeParameter(0)),
        is(false));
  }

  /** A type that is neither a definition, a parameterized type nor a type
   * parameter is compared by {@code equals}, not rejected. */
  @Test
  void testEquivalentForeignTypes() {
    final Type foreign = new Type() {
      @Override
      public String namespace() {
        return "Other";
      }

      @Override
      public String name() {
        return "Foreign";
      }

      @Override
      public TypeKind kind() {
        return TypeKind.CLASS;
      }

      @Override
      public List<? extends Type> typeArguments() {
        return ImmutableList.of();
      }

      @Override
      public @Nullable TypeDef definition() {
        return null;
      }
    };
    assertThat(ts.equivalentTypes(foreign, foreign), is(true));
    assertThat(ts.equivalentTypes(foreign, ts.lookup(KnownType.OBJECT)),
        is(false));
    assertThat(
        ts.equivalentTypes(ts.equalityComparer(foreign),
            ts.equalityComparer(foreign)),
        is(true));
  }

  @Test
  void testParameterizedType() {
    final TypeDef box =
        new TypeDef("Shapes", "Box", TypeKind.CLASS, ImmutableList.of("T"));
    final TypeDef int32 = ts.lookup(KnownType.INT32);
    final ParameterizedType boxOfInt = ts.parameterize(box, int32);
    assertThat(boxOfInt, is(ts.parameterize(box, int32)));
    assertThat(boxOfInt.hashCode(), is(ts.parameterize(box, int32).hashCode()));
    assertThat(boxOfInt.definition(), sameInstance(box));
    assertThat(boxOfInt.arg(0), sameInstance(int32));
    assertThat(boxOfInt, hasToString("Shapes.Box<System.Int32>"));
    assertThat(box, hasToString("Shapes.Box<T>"));
    assertThat(box.typeParameter(0).definition(), nullValue());
    assertThrows(IllegalArgumentException.class, () ->
        ts.parameterize(box, int32, int32));
  }

  /** Members referenced via an instantiation of their declaring type have
   * the same definition as the declared member. */
  @Test
  void testSameDefinition() {
    final TypeDef box =
        new TypeDef("Shapes", "Box", TypeKind.CLASS, ImmutableList.of("T"));
    final Type t = box.typeParameter(0);
    final Field field =
        new Field(box, "<Value>k__BackingField", t, Accessibility.PRIVATE,
            ImmutableList.of(), ImmutableList.of());
    final Field fieldRef =
        new Field(ts.parameterize(box, t), "<Value>k__BackingField", t,
            Accessibility.PRIVATE, ImmutableList.of(), ImmutableList.of());
    assertThat(fieldRef.isSameDefinition(field), is(true));
    assertThat(fieldRef.declaringTypeDef(), sameInstance(box));
    assertThat(fieldRef, hasToString("Shapes.Box<T>.<Value>k__BackingField"));

    final Method equals =
        Method.builder(box, "Equals", ts.lookup(KnownType.BOOLEAN))
            .parameter("other", box)
            .build();
    final Method equals0 =
        Method.builder(box, "Equals", ts.lookup(KnownType.BOOLEAN))
            .parameter("obj", ts.lookup(KnownType.OBJECT))
            .build();
    final Method equals2 =
        Method.builder(box, "Equals", ts.lookup(KnownType.BOOLEAN))
            .parameter("x", box)
            .parameter("y", box)
            .build();
    assertThat(equals.isSameDefinition(equals0), is(true));
    assertThat(equals.isSameDefinition(equals2), is(false));

    // A field and a method of the same name are different members
    final Method method =
        Method.builder(box, "<Value>k__BackingField", t).build();
    assertThat(method.isSameDefinition(field), is(false));
  }

  @Test
  void testModifiers() {
    final TypeDef point =
        new TypeDef("Shapes", "Point", TypeKind.CLASS, ImmutableList.of());
    final TypeDef bool = ts.lookup(KnownType.BOOLEAN);
    final Method opEquality =
        Method.builder(point, "op_Equality", bool)
            .parameter("left", point)
            .parameter("right", point)
            .modifiers(Modifier.STATIC)
            .build();
    assertThat(opEquality.isOperator(), is(true));
    assertThat(opEquality.isOverridable(), is(false));
    assertThat(opEquality.parameterType(1), sameInstance(point));

    final Method printMembers =
        Method.builder(point, "PrintMembers", bool)
            .accessibility(Accessibility.PROTECTED)
            .modifiers(Modifier.OVERRIDE)
            .build();
    assertThat(printMembers.isOperator(), is(false));
    assertThat(printMembers.isOverridable(), is(true));
    assertThat(printMembers.accessibility, is(Accessibility.PROTECTED));

    final Method sealed =
        Method.builder(point, "PrintMembers", bool)
            .modifiers(Modifier.OVERRIDE, Modifier.SEALED)
            .build();
    assertThat(sealed.isOverridable(), is(false));
    assertThat(Method.builder(point, ".ctor", ts.lookup(KnownType.VOID))
        .build().isConstructor(), is(true));
  }

  @Test
  void testTypeDefBuilder() {
    final TypeDef point =
        new TypeDef("Shapes", "Point", TypeKind.CLASS, ImmutableList.of());
    final TypeDef other =
        new TypeDef("Shapes", "Other", TypeKind.CLASS, ImmutableList.of());
    final TypeDef.Builder builder = TypeDef.builder(point);
    final Field foreign =
        new Field(other, "x", ts.lookup(KnownType.INT32),
            Accessibility.PUBLIC, ImmutableList.of(), ImmutableList.of());
    assertThrows(IllegalArgumentException.class, () -> builder.field(foreign));

    final Field x =
        new Field(point, "x", ts.lookup(KnownType.INT32),
            Accessibility.PUBLIC, ImmutableList.of(), ImmutableList.of());
    builder.baseType(ts.lookup(KnownType.OBJECT)).field(x).build();
    assertThat(point.fields(), is(ImmutableList.of(x)));
    assertThat(point.directBaseTypes(),
        is(ImmutableList.of(ts.lookup(KnownType.OBJECT))));

    // A definition is built only once
    assertThrows(IllegalStateException.class, builder::build);
    assertThrows(IllegalStateException.class, () -> TypeDef.builder(point));
  }

  /** Fields and properties have unique names, except that indexers may be
   * overloaded. */
  @Test
  void testDuplicateMembers() {
    final TypeDef point =
        new TypeDef("Shapes", "Point", TypeKind.CLASS, ImmutableList.of());
    final TypeDef int32 = ts.lookup(KnownType.INT32);
    final TypeDef.Builder builder = TypeDef.builder(point);
    final Field x =
        new Field(point, "x", int32, Accessibility.PRIVATE,
            ImmutableList.of(), ImmutableList.of());
    builder.field(x);
    assertThrows(IllegalArgumentException.class, () -> builder.field(x));

    final Property y =
        new Property(point, "Y", int32, null, null, ImmutableList.of(),
            Accessibility.PUBLIC, ImmutableList.of(), ImmutableList.of());
    builder.property(y);
    assertThrows(IllegalArgumentException.class, () -> builder.property(y));

    final Property item1 =
        new Property(point, "Item", int32, null, null,
            ImmutableList.of(new Parameter("i", int32)),
            Accessibility.PUBLIC, ImmutableList.of(), ImmutableList.of());
    final Property item2 =
        new Property(point, "Item", int32, null, null,
            ImmutableList.of(new Parameter("s", ts.lookup(KnownType.STRING))),
            Accessibility.PUBLIC, ImmutableList.of(), ImmutableList.of());
    builder.property(item1).property(item2).build();
    assertThat(point.fields(), is(ImmutableList.of(x)));
    assertThat(point.properties(), is(ImmutableList.of(y, item1, item2)));
  }
}

// End TypeSystemTest.java
