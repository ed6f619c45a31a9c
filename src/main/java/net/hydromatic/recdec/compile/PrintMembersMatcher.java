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
import net.hydromatic.recdec.type.KnownType;
import net.hydromatic.recdec.type.Member;
import net.hydromatic.recdec.type.Method;
import net.hydromatic.recdec.type.Property;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Recognizes the generated {@code PrintMembers} method.
 *
 * <p>For "{@code record R(int A, string B)}" the compiler generates
 *
 * <blockquote><pre>
 * callvirt Append(ldloc builder, ldstr "A = ")
 * callvirt Append(ldloc builder,
 *   constrained[int].callvirt ToString(addressof int(call get_A(ldloc this))))
 * callvirt Append(ldloc builder, ldstr ", B = ")
 * callvirt Append(ldloc builder, call get_B(ldloc this))
 * return ldc.i4 1</pre></blockquote>
 *
 * <p>The text before a value may be split over several appends. A record
 * that derives from another record first calls the base method:
 *
 * <blockquote><pre>
 * if (call PrintMembers(ldloc this, ldloc builder))
 *   callvirt Append(ldloc builder, ldstr ", ")</pre></blockquote>
 */
class PrintMembersMatcher {
  private final MatchContext cx;
  private final @Nullable List<Member> memberOrder;

  PrintMembersMatcher(MatchContext cx, @Nullable List<Member> memberOrder) {
    this.cx = requireNonNull(cx);
    this.memberOrder = memberOrder;
  }

  boolean matches(Method method) {
    assert method.name.equals(RecordAnalyzer.PRINT_MEMBERS);
    if (method.parameters.size() != 1) {
      return cx.mismatch(method, "expected 1 parameter, got %d",
          method.parameters.size());
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
    final Il.Function function = cx.decompile(method);
    if (function == null) {
      return cx.mismatch(method, "no body");
    }
    final Variable builder = function.parameter(0);
    if (builder == null
        || !cx.typeSystem.isKnownType(builder.type,
            KnownType.STRING_BUILDER)) {
      return cx.mismatch(method, "parameter is not a StringBuilder");
    }
    final Il.Block body = function.body;
    int pos = 0;
    if (cx.inheritedRecord) {
      if (!matchBaseCall(body.at(pos), builder)) {
        return cx.mismatch(method,
            "expected if (call PrintMembers(ldloc this, ldloc %s)) "
                + "callvirt Append(ldloc %s, ldstr \", \"), got %s",
            builder, builder, body.at(pos));
      }
      pos++;
    }
    boolean needsComma = false;
    for (Member member : memberOrder) {
      if (member.isStatic()) {
        continue; // static fields and properties are not printed
      }
      if (member.name.equals(RecordAnalyzer.EQUALITY_CONTRACT)) {
        continue; // never printed
      }
      if (member.isExplicitInterfaceImplementation()) {
        continue; // not printed
      }
      cx.cancellationToken.throwIfCancellationRequested();

      // One or more "callvirt Append(ldloc builder, ldstr text)"
      final String expectedText =
          (needsComma ? ", " : "") + member.name + " = ";
      final StringBuilder text = new StringBuilder();
      int appendCount = 0;
      for (;;) {
        final String s =
            Patterns.matchStringBuilderAppendConstant(cx.typeSystem,
                body.at(pos), builder);
        if (s == null) {
          break;
        }
        text.append(s);
        ++appendCount;
        ++pos;
      }
      if (appendCount == 0 || !text.toString().equals(expectedText)) {
        return cx.mismatch(method, "expected text \"%s\", got \"%s\"",
            expectedText, text);
      }

      // "callvirt Append(ldloc builder, value)"
      final Il.Inst appended =
          Patterns.matchStringBuilderAppend(cx.typeSystem, body.at(pos),
              builder);
      if (appended == null) {
        return cx.mismatch(method, "expected value of %s, got %s",
            member.name, body.at(pos));
      }
      if (!(member instanceof Property)) {
        return cx.mismatch(method, "cannot match printed field %s",
            member.name);
      }
      if (!isGetterCall(unwrapToString(appended), (Property) member)) {
        return cx.mismatch(method, "expected value of %s, got %s",
            member.name, appended);
      }
      pos++;
      needsComma = true;
    }

    // "return ldc.i4 1" if anything was printed, else "return ldc.i4 0"
    final Il.Inst returnValue = Patterns.matchReturn(body.at(pos));
    if (returnValue == null || !returnValue.isLdcI4(needsComma ? 1 : 0)) {
      return cx.mismatch(method, "expected return ldc.i4 %d, got %s",
          needsComma ? 1 : 0, body.at(pos));
    }
    if (pos + 1 != body.size()) {
      return cx.mismatch(method, "unexpected instructions after return");
    }
    return true;
  }

  /** Matches "{@code if (call PrintMembers(ldloc this, ldloc builder))
   * callvirt Append(ldloc builder, ldstr ", ")}". */
  private boolean matchBaseCall(Il.@Nullable Inst inst, Variable builder) {
    final Il.If if_ = Patterns.matchIfThen(inst);
    if (if_ == null
        || !(if_.condition.op == Op.CALL || if_.condition.op == Op.CALL_VIRT)) {
      return false;
    }
    final Il.Call call = (Il.Call) if_.condition;
    return call.isCallTo(RecordAnalyzer.PRINT_MEMBERS)
        && call.arguments.size() == 2
        && call.arguments.get(0).isLdThis()
        && call.arguments.get(1).isLdLoc(builder)
        && Patterns.isStringBuilderAppend(cx.typeSystem,
            Patterns.unwrapBlock(if_.trueInst), builder, ", ");
  }

  /** If a value is "{@code ToString(v)}" or
   * "{@code ToString(addressof T(v))}", returns {@code v}; otherwise returns
   * the value. Returns null if the value is a call to {@code ToString} with
   * the wrong number of arguments. */
  private static Il.@Nullable Inst unwrapToString(Il.Inst value) {
    if (!(value.op == Op.CALL || value.op == Op.CALL_VIRT)) {
      return value;
    }
    final Il.Call call = (Il.Call) value;
    if (!call.isCallTo("ToString") || call.method.isStatic()) {
      return value;
    }
    if (call.arguments.size() != 1) {
      return null;
    }
    final Il.Inst arg = call.arguments.get(0);
    return arg.op == Op.ADDRESS_OF ? ((Il.AddressOf) arg).value : arg;
  }

  /** Whether a value is "{@code call get_P(ldloc this)}" for the getter of
   * a given property. */
  private static boolean isGetterCall(Il.@Nullable Inst value,
      Property property) {
    if (value == null
        || !(value.op == Op.CALL || value.op == Op.CALL_VIRT)
        || property.getter == null) {
      return false;
    }
    final Il.Call call = (Il.Call) value;
    return call.method.isSameDefinition(property.getter)
        && call.arguments.size() == 1
        && call.arguments.get(0).isLdThis();
  }
}

// End PrintMembersMatcher.java
