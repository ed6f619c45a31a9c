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

import net.hydromatic.recdec.il.Il;
import net.hydromatic.recdec.type.Accessibility;
import net.hydromatic.recdec.type.KnownType;
import net.hydromatic.recdec.type.Method;
import net.hydromatic.recdec.type.Property;
import net.hydromatic.recdec.type.Type;

/**
 * Recognizes the generated {@code EqualityContract} property:
 *
 * <blockquote><pre>
 * protected virtual Type EqualityContract {
 *   [CompilerGenerated] get =&gt; typeof(R);
 * }</pre></blockquote>
 */
class EqualityContractMatcher {
  private final MatchContext cx;

  EqualityContractMatcher(MatchContext cx) {
    this.cx = requireNonNull(cx);
  }

  boolean matches(Property property) {
    assert property.name.equals(RecordAnalyzer.EQUALITY_CONTRACT);
    if (property.accessibility != Accessibility.PROTECTED) {
      return cx.mismatch(property, "accessibility is %s, expected protected",
          property.accessibility);
    }
    if (!(property.isVirtual() || property.isOverride())) {
      return cx.mismatch(property, "expected virtual or override");
    }
    if (property.isSealed()) {
      return cx.mismatch(property, "sealed");
    }
    final Method getter = property.getter;
    if (getter == null || property.canSet()) {
      return cx.mismatch(property, "expected a get-only property");
    }
    if (!property.attributes.isEmpty()
        || !getter.returnTypeAttributes.isEmpty()) {
      return cx.mismatch(property, "has attributes");
    }
    if (getter.attributes.size() != 1
        || !cx.typeSystem.isKnownAttribute(getter.attributes.get(0),
            KnownType.COMPILER_GENERATED_ATTRIBUTE)) {
      return cx.mismatch(property,
          "expected getter with a single [CompilerGenerated] attribute");
    }
    final Il.Function function = cx.decompile(getter);
    if (function == null) {
      return cx.mismatch(property, "getter has no body");
    }
    if (function.body.size() != 1) {
      return cx.mismatch(property, "expected 1 instruction, got %d",
          function.body.size());
    }
    // return call GetTypeFromHandle(ldtypetoken R)
    final Il.Inst value = Patterns.matchReturn(function.body.at(0));
    final Type type = value == null
        ? null
        : Patterns.matchGetTypeFromHandle(cx.typeSystem, value);
    if (type == null) {
      return cx.mismatch(property,
          "expected return call GetTypeFromHandle(ldtypetoken %s), got %s",
          cx.record, function.body.at(0));
    }
    if (!cx.isRecordType(type)) {
      return cx.mismatch(property, "contract is %s, expected %s", type,
          cx.record);
    }
    return true;
  }
}

// End EqualityContractMatcher.java
