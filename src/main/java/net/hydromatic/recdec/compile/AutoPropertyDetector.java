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
package net.hydromatic.recdec.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableBiMap;
import net.hydromatic.recdec.il.Il;
import net.hydromatic.recdec.il.Op;
import net.hydromatic.recdec.il.Variable;
import net.hydromatic.recdec.type.Field;
import net.hydromatic.recdec.type.Method;
import net.hydromatic.recdec.type.Property;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the properties of a record whose accessors only read and write a
 * compiler-named backing field.
 *
 * <p>The getter of such a property is "{@code return ldfld f(ldloc this)}"
 * and its setter is "{@code stfld f(ldloc this, ldloc value); return}",
 * where {@code f} is a field of the record named
 * "{@code <Name>k__BackingField}". Static properties use {@code ldsfld} and
 * {@code stsfld}.
 */
class AutoPropertyDetector {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(AutoPropertyDetector.class);

  private final MatchContext cx;

  AutoPropertyDetector(MatchContext cx) {
    this.cx = requireNonNull(cx);
  }

  /** Returns the name the compiler gives to the field that backs an
   * automatic property. */
  static String backingFieldName(String propertyName) {
    return "<" + propertyName + ">k__BackingField";
  }

  /** Examines every property of the record and returns the automatic ones,
   * with their backing fields. */
  BackingFields detect() {
    final ImmutableBiMap.Builder<Property, Field> b = ImmutableBiMap.builder();
    for (Property property : cx.record.properties()) {
      cx.cancellationToken.throwIfCancellationRequested();
      final Field field = backingField(property);
      if (field != null) {
        LOGGER.debug("{} is an auto-property backed by {}", property,
            field.name);
        cx.tracer.onAutoProperty(property, field);
        b.put(property, field);
      }
    }
    return new BackingFields(b.build());
  }

  /** Returns the field declared by the record that backs a property, or
   * null if the property is not automatic. */
  private @Nullable Field backingField(Property property) {
    if (!property.parameters.isEmpty()) {
      return null; // indexers are never automatic
    }
    Field field = null;
    if (property.getter != null) {
      field = getterField(property.getter);
      if (field == null) {
        return null;
      }
    }
    if (property.setter != null) {
      final Field field2 = setterField(property.setter);
      if (field2 == null) {
        return null;
      }
      if (field == null) {
        field = field2;
      } else if (!field.isSameDefinition(field2)) {
        return null;
      }
    }
    if (field == null
        || !cx.isRecordType(field.declaringType)
        || !field.name.equals(backingFieldName(property.name))) {
      return null;
    }
    return declaredField(field);
  }

  /** Matches "{@code return ldfld f(ldloc this)}", or
   * "{@code return ldsfld f}" if the getter is static; returns f. */
  private @Nullable Field getterField(Method getter) {
    final Il.Function function = cx.decompile(getter);
    if (function == null || function.body.size() != 1) {
      return null;
    }
    final Il.Inst value = Patterns.matchReturn(function.body.at(0));
    if (value == null) {
      return null;
    }
    if (getter.isStatic()) {
      return value.op == Op.LDSFLD ? ((Il.LdFld) value).field : null;
    }
    if (value.op != Op.LDFLD) {
      return null;
    }
    final Il.LdFld ldFld = (Il.LdFld) value;
    return ldFld.target != null && ldFld.target.isLdThis()
        ? ldFld.field
        : null;
  }

  /** Matches "{@code stfld f(ldloc this, ldloc value); return}", or
   * "{@code stsfld f(ldloc value); return}" if the setter is static, where
   * {@code value} is the first parameter; returns f. */
  private @Nullable Field setterField(Method setter) {
    final Il.Function function = cx.decompile(setter);
    if (function == null || function.body.size() != 2) {
      return null;
    }
    final Il.Inst inst = function.body.instructions.get(0);
    if (inst.op != (setter.isStatic() ? Op.STSFLD : Op.STFLD)) {
      return null;
    }
    final Il.StFld stFld = (Il.StFld) inst;
    if (!setter.isStatic()
        && (stFld.target == null || !stFld.target.isLdThis())) {
      return null;
    }
    final Variable value = function.parameter(0);
    if (value == null || !stFld.value.isLdLoc(value)) {
      return null;
    }
    final Il.Inst returnValue =
        Patterns.matchReturn(function.body.instructions.get(1));
    return returnValue != null && returnValue.isNop() ? stFld.field : null;
  }

  /** Returns the record's own declaration of a field, which may have been
   * referenced via an instantiation of the record type. */
  private @Nullable Field declaredField(Field field) {
    for (Field f : cx.record.fields()) {
      if (f.isSameDefinition(field)) {
        return f;
      }
    }
    return null;
  }
}

// End AutoPropertyDetector.java
