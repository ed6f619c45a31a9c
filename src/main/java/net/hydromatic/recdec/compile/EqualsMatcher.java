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

import java.util.List;
import net.hydromatic.recdec.il.Il;
import net.hydromatic.recdec.il.Op;
import net.hydromatic.recdec.il.Variable;
import net.hydromatic.recdec.type.Field;
import net.hydromatic.recdec.type.KnownType;
import net.hydromatic.recdec.type.Member;
import net.hydromatic.recdec.type.Method;
import net.hydromatic.recdec.type.Property;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Recognizes the generated {@code Equals(R other)} method:
 *
 * <blockquote><pre>
 * virtual bool Equals(R? other) {
 *   return other != null
 *       &amp;&amp; EqualityContract == other.EqualityContract
 *       &amp;&amp; EqualityComparer&lt;int&gt;.Default.Equals(A, other.A)
 *       &amp;&amp; ...;
 * }</pre></blockquote>
 *
 * <p>Only fields and automatic properties take part in the comparison.
 *
 * <p>Records that derive from another record call the base {@code Equals}
 * instead of comparing the equality contract; that shape is not recognized,
 * and such methods are always classified as hand-written.
 */
class EqualsMatcher {
  private final MatchContext cx;
  private final @Nullable List<Member> memberOrder;
  private final BackingFields backingFields;

  EqualsMatcher(MatchContext cx, @Nullable List<Member> memberOrder,
      BackingFields backingFields) {
    this.cx = requireNonNull(cx);
    this.memberOrder = memberOrder;
    this.backingFields = requireNonNull(backingFields);
  }

  boolean matches(Method method) {
    assert method.name.equals("Equals") && method.parameters.size() == 1;
    if (method.parameters.size() != 1) {
      return cx.mismatch(method, "expected 1 parameter");
    }
    if (!method.isOverridable()) {
      return cx.mismatch(method, "not overridable");
    }
    if (!method.attributes.isEmpty()
        || !method.returnTypeAttributes.isEmpty()) {
      return cx.mismatch(method, "has attributes");
    }
    if (memberOrder == null) {
      return cx.mismatch(method, "member order is unknown");
    }
    if (cx.inheritedRecord) {
      // TODO: match "base.Equals(other) && ..." for derived records
      return cx.mismatch(method, "derived records are not supported");
    }
    final Il.Function function = cx.decompile(method);
    if (function == null) {
      return cx.mismatch(method, "no body");
    }
    final Il.Inst returnValue = Patterns.matchReturn(function.body.at(0));
    if (returnValue == null || function.body.size() != 1) {
      return cx.mismatch(method, "expected a single return, got %s",
          function.body);
    }
    final Variable other = function.parameter(0);
    if (other == null || !cx.isRecordType(other.type)) {
      return cx.mismatch(method, "parameter is not %s", cx.record);
    }
    final List<Il.Inst> conditions =
        Patterns.unpackLogicAndChain(returnValue);
    int pos = 0;

    // comp(ldloc other != ldnull)
    final Il.Inst nullChecked = Patterns.matchCompNotEqualsNull(
        conditions.get(pos));
    if (nullChecked == null || !nullChecked.isLdLoc(other)) {
      return cx.mismatch(method, "expected comp(ldloc %s != ldnull), got %s",
          other, conditions.get(pos));
    }
    pos++;

    // call op_Equality(callvirt get_EqualityContract(ldloc this),
    //     callvirt get_EqualityContract(ldloc other))
    if (pos >= conditions.size()
        || !isEqualityContractComparison(conditions.get(pos), other)) {
      return cx.mismatch(method,
          "expected comparison of equality contracts, got %s",
          pos < conditions.size() ? conditions.get(pos) : "end of chain");
    }
    pos++;

    for (Member member : memberOrder) {
      if (member.isStatic()) {
        continue;
      }
      if (member.name.equals(RecordAnalyzer.EQUALITY_CONTRACT)) {
        continue; // already compared
      }
      final Field field;
      if (member instanceof Field) {
        field = (Field) member;
      } else if (member instanceof Property) {
        field = backingFields.fieldOf((Property) member);
        if (field == null) {
          continue; // Equals ignores properties that are not automatic
        }
      } else {
        return cx.mismatch(method, "unexpected member %s", member);
      }
      // callvirt Equals(call get_Default(),
      //     ldfld <A>k__BackingField(ldloc this),
      //     ldfld <A>k__BackingField(ldloc other))
      if (pos >= conditions.size()
          || !isFieldComparison(conditions.get(pos), field, other)) {
        return cx.mismatch(method, "expected comparison of %s, got %s",
            field.name,
            pos < conditions.size() ? conditions.get(pos) : "end of chain");
      }
      pos++;
    }
    if (pos != conditions.size()) {
      return cx.mismatch(method, "expected %d conditions, got %d", pos,
          conditions.size());
    }
    return true;
  }

  /** Whether a condition is "{@code call op_Equality(callvirt
   * get_EqualityContract(ldloc this), callvirt get_EqualityContract(ldloc
   * other))}", where {@code op_Equality} is the operator of
   * {@code System.Type}. */
  private boolean isEqualityContractComparison(Il.Inst condition,
      Variable other) {
    final Il.Call call = Patterns.matchCall(condition, Op.CALL, "op_Equality");
    if (call == null
        || !call.method.isOperator()
        || !cx.typeSystem.isKnownType(call.method.declaringType,
            KnownType.TYPE)
        || call.arguments.size() != 2) {
      return false;
    }
    final Il.Inst target1 =
        Patterns.matchGetEqualityContract(call.arguments.get(0));
    final Il.Inst target2 =
        Patterns.matchGetEqualityContract(call.arguments.get(1));
    return target1 != null
        && target2 != null
        && target1.isLdThis()
        && target2.isLdLoc(other);
  }

  /** Whether a condition is "{@code callvirt Equals(call get_Default(),
   * ldfld f(ldloc this), ldfld f(ldloc other))}", where
   * {@code get_Default} belongs to the {@code EqualityComparer} of the
   * field's type. */
  private boolean isFieldComparison(Il.Inst condition, Field field,
      Variable other) {
    final Il.Call call = Patterns.matchCall(condition, Op.CALL_VIRT, "Equals");
    if (call == null
        || call.arguments.size() != 3
        || !Patterns.isEqualityComparerGetDefaultCall(cx.typeSystem,
            call.arguments.get(0), field.type)) {
      return false;
    }
    final Il.Inst target1 = Patterns.matchLdFld(call.arguments.get(1), field);
    final Il.Inst target2 = Patterns.matchLdFld(call.arguments.get(2), field);
    return target1 != null
        && target2 != null
        && target1.isLdThis()
        && target2.isLdLoc(other);
  }
}

// End EqualsMatcher.java
