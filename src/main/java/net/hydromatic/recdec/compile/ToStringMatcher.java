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
import net.hydromatic.recdec.il.Op;
import net.hydromatic.recdec.il.Variable;
import net.hydromatic.recdec.type.KnownType;
import net.hydromatic.recdec.type.Method;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Recognizes the generated {@code ToString} method.
 *
 * <blockquote><pre>
 * stloc sb(newobj StringBuilder..ctor())
 * callvirt Append(ldloc sb, ldstr "R")
 * callvirt Append(ldloc sb, ldstr " { ")
 * if (callvirt PrintMembers(ldloc this, ldloc sb))
 *   callvirt Append(ldloc sb, ldstr " ")
 * callvirt Append(ldloc sb, ldstr "}")
 * return callvirt ToString(ldloc sb)</pre></blockquote>
 *
 * <p>The {@code if} is absent if there is nothing to print.
 */
class ToStringMatcher {
  private final MatchContext cx;

  ToStringMatcher(MatchContext cx) {
    this.cx = requireNonNull(cx);
  }

  boolean matches(Method method) {
    assert method.name.equals("ToString") && method.parameters.isEmpty();
    if (!method.isOverride()) {
      return cx.mismatch(method, "not an override");
    }
    if (method.isSealed()) {
      return cx.mismatch(method, "sealed");
    }
    if (!method.attributes.isEmpty()
        || !method.returnTypeAttributes.isEmpty()) {
      return cx.mismatch(method, "has attributes");
    }
    final Il.Function function = cx.decompile(method);
    if (function == null) {
      return cx.mismatch(method, "no body");
    }
    final Il.Block body = function.body;

    // stloc sb(newobj StringBuilder..ctor())
    final Variable sb = matchNewStringBuilder(body.at(0));
    if (sb == null) {
      return cx.mismatch(method,
          "expected stloc (newobj StringBuilder..ctor()), got %s", body.at(0));
    }
    int pos = 1;

    // callvirt Append(ldloc sb, ldstr "R")
    // callvirt Append(ldloc sb, ldstr " { ")
    for (String text : new String[] {cx.record.name, " { "}) {
      if (!Patterns.isStringBuilderAppend(cx.typeSystem, body.at(pos), sb,
          text)) {
        return expectedAppend(method, sb, text, body.at(pos));
      }
      pos++;
    }

    // if (callvirt PrintMembers(ldloc this, ldloc sb))
    //   callvirt Append(ldloc sb, ldstr " ")
    final Il.Inst inst = body.at(pos);
    if (inst != null && inst.op == Op.IF) {
      final Il.If if_ = Patterns.matchIfThen(inst);
      if (if_ == null || !isPrintMembersCall(if_.condition, sb)) {
        return cx.mismatch(method,
            "expected if (callvirt PrintMembers(ldloc this, ldloc %s)), "
                + "got %s", sb, inst);
      }
      final Il.Inst trueInst = Patterns.unwrapBlock(if_.trueInst);
      if (!Patterns.isStringBuilderAppend(cx.typeSystem, trueInst, sb, " ")) {
        return expectedAppend(method, sb, " ", trueInst);
      }
      pos++;
    }

    // callvirt Append(ldloc sb, ldstr "}")
    if (!Patterns.isStringBuilderAppend(cx.typeSystem, body.at(pos), sb,
        "}")) {
      return expectedAppend(method, sb, "}", body.at(pos));
    }
    pos++;

    // return callvirt ToString(ldloc sb)
    final Il.Call toStringCall =
        Patterns.matchCall(Patterns.matchReturn(body.at(pos)), Op.CALL_VIRT,
            "ToString");
    if (toStringCall == null
        || toStringCall.arguments.size() != 1
        || !toStringCall.arguments.get(0).isLdLoc(sb)) {
      return cx.mismatch(method,
          "expected return callvirt ToString(ldloc %s), got %s", sb,
          body.at(pos));
    }
    if (pos + 1 != body.size()) {
      return cx.mismatch(method, "unexpected instructions after return");
    }
    return true;
  }

  private boolean expectedAppend(Method method, Variable sb, String text,
      Il.@Nullable Inst actual) {
    return cx.mismatch(method,
        "expected callvirt Append(ldloc %s, ldstr \"%s\"), got %s", sb, text,
        actual);
  }

  /** Matches "{@code stloc sb(newobj StringBuilder..ctor())}"; returns
   * {@code sb}. */
  private @Nullable Variable matchNewStringBuilder(Il.@Nullable Inst inst) {
    if (inst == null || inst.op != Op.STLOC) {
      return null;
    }
    final Il.StLoc stLoc = (Il.StLoc) inst;
    if (stLoc.value.op != Op.NEW_OBJ) {
      return null;
    }
    final Il.Call newObj = (Il.Call) stLoc.value;
    return newObj.arguments.isEmpty()
        && cx.typeSystem.isKnownType(newObj.method.declaringType,
            KnownType.STRING_BUILDER)
        ? stLoc.variable
        : null;
  }

  /** Whether a condition is
   * "{@code callvirt PrintMembers(ldloc this, ldloc sb)}". */
  private static boolean isPrintMembersCall(Il.Inst condition, Variable sb) {
    final Il.Call call =
        Patterns.matchCall(condition, Op.CALL_VIRT,
            RecordAnalyzer.PRINT_MEMBERS);
    return call != null
        && call.arguments.size() == 2
        && call.arguments.get(0).isLdThis()
        && call.arguments.get(1).isLdLoc(sb);
  }
}

// End ToStringMatcher.java
