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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.recdec.il.Il;
import net.hydromatic.recdec.il.Op;
import net.hydromatic.recdec.il.Variable;
import net.hydromatic.recdec.type.Field;
import net.hydromatic.recdec.type.KnownType;
import net.hydromatic.recdec.type.Type;
import net.hydromatic.recdec.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Matching primitives shared by the record matchers.
 *
 * <p>Each {@code match} method returns the interesting operand of an
 * instruction if the instruction has the expected shape, or null if it does
 * not. None of them has side effects.
 */
class Patterns {
  private Patterns() {}

  /**
   * Flattens a left-associated chain of {@link Op#LOGIC_AND} into its
   * conditions, in left-to-right order.
   *
   * <p>For example, "{@code logic.and(logic.and(a, b), c)}" becomes
   * "{@code [a, b, c]}". An instruction that is not a {@code logic.and}
   * becomes a list of one element.
   */
  static List<Il.Inst> unpackLogicAndChain(Il.Inst rootOfChain) {
    final ImmutableList.Builder<Il.Inst> conditions = ImmutableList.builder();
    visitLogicAnd(rootOfChain, conditions);
    return conditions.build();
  }

  private static void visitLogicAnd(Il.Inst inst,
      ImmutableList.Builder<Il.Inst> conditions) {
    if (inst.op == Op.LOGIC_AND) {
      final Il.LogicAnd logicAnd = (Il.LogicAnd) inst;
      visitLogicAnd(logicAnd.left, conditions);
      visitLogicAnd(logicAnd.right, conditions);
    } else {
      conditions.add(inst);
    }
  }

  /** Matches "{@code return value}"; returns the value. */
  static Il.@Nullable Inst matchReturn(Il.@Nullable Inst inst) {
    if (inst == null || inst.op != Op.RETURN) {
      return null;
    }
    return ((Il.Return) inst).value;
  }

  /** Matches "{@code if (condition) trueInst}" with no else branch. */
  static Il.@Nullable If matchIfThen(Il.@Nullable Inst inst) {
    if (inst == null || inst.op != Op.IF) {
      return null;
    }
    final Il.If if_ = (Il.If) inst;
    return if_.falseInst.isNop() ? if_ : null;
  }

  /** If an instruction is a block of exactly one instruction, returns that
   * instruction; otherwise returns the instruction. */
  static Il.Inst unwrapBlock(Il.Inst inst) {
    return inst.op == Op.BLOCK ? ((Il.Block) inst).unwrap() : inst;
  }

  /** Matches a call with a given opcode and method name. */
  static Il.@Nullable Call matchCall(Il.@Nullable Inst inst, Op op,
      String methodName) {
    if (inst == null || inst.op != op) {
      return null;
    }
    final Il.Call call = (Il.Call) inst;
    return call.isCallTo(methodName) ? call : null;
  }

  /** Matches "{@code ldfld field(target)}" for a given field; returns the
   * target. */
  static Il.@Nullable Inst matchLdFld(Il.Inst inst, Field field) {
    if (inst.op != Op.LDFLD) {
      return null;
    }
    final Il.LdFld ldFld = (Il.LdFld) inst;
    return ldFld.field.isSameDefinition(field) ? ldFld.target : null;
  }

  /** Matches "{@code comp(value != ldnull)}"; returns the value. */
  static Il.@Nullable Inst matchCompNotEqualsNull(Il.Inst inst) {
    if (inst.op != Op.COMP) {
      return null;
    }
    final Il.Comp comp = (Il.Comp) inst;
    if (comp.kind != Il.ComparisonKind.INEQUALITY
        || comp.right.op != Op.LDNULL) {
      return null;
    }
    return comp.left;
  }

  /**
   * Matches "{@code callvirt Append(ldloc builder, value)}", where
   * {@code Append} is a method of {@code System.Text.StringBuilder}; returns
   * the value.
   */
  static Il.@Nullable Inst matchStringBuilderAppend(TypeSystem typeSystem,
      Il.@Nullable Inst inst, Variable builder) {
    final Il.Call call = matchCall(inst, Op.CALL_VIRT, "Append");
    if (call == null
        || !typeSystem.isKnownType(call.method.declaringType,
            KnownType.STRING_BUILDER)
        || call.arguments.size() != 2
        || !call.arguments.get(0).isLdLoc(builder)) {
      return null;
    }
    return call.arguments.get(1);
  }

  /** Matches "{@code callvirt Append(ldloc builder, ldstr text)}"; returns
   * the text. */
  static @Nullable String matchStringBuilderAppendConstant(
      TypeSystem typeSystem, Il.@Nullable Inst inst, Variable builder) {
    final Il.Inst value = matchStringBuilderAppend(typeSystem, inst, builder);
    if (value == null || value.op != Op.LDSTR) {
      return null;
    }
    return ((Il.LdStr) value).value;
  }

  /** Whether an instruction is
   * "{@code callvirt Append(ldloc builder, ldstr text)}" for a given text. */
  static boolean isStringBuilderAppend(TypeSystem typeSystem,
      Il.@Nullable Inst inst, Variable builder, String text) {
    final Il.Inst value = matchStringBuilderAppend(typeSystem, inst, builder);
    return value != null && value.isLdStr(text);
  }

  /** Matches "{@code callvirt get_EqualityContract(target)}"; returns the
   * target. */
  static Il.@Nullable Inst matchGetEqualityContract(Il.Inst inst) {
    final Il.Call call =
        matchCall(inst, Op.CALL_VIRT,
            "get_" + RecordAnalyzer.EQUALITY_CONTRACT);
    if (call == null || call.arguments.size() != 1) {
      return null;
    }
    return call.arguments.get(0);
  }

  /** Matches "{@code call GetTypeFromHandle(ldtypetoken T)}", where
   * {@code GetTypeFromHandle} is a static method of {@code System.Type};
   * returns {@code T}. */
  static @Nullable Type matchGetTypeFromHandle(TypeSystem typeSystem,
      Il.Inst inst) {
    final Il.Call call = matchCall(inst, Op.CALL, "GetTypeFromHandle");
    if (call == null
        || !call.method.isStatic()
        || !typeSystem.isKnownType(call.method.declaringType, KnownType.TYPE)
        || call.arguments.size() != 1
        || call.arguments.get(0).op != Op.LD_TYPE_TOKEN) {
      return null;
    }
    return ((Il.LdTypeToken) call.arguments.get(0)).type;
  }

  /**
   * Whether an instruction is "{@code call get_Default()}" on
   * {@code System.Collections.Generic.EqualityComparer<T>}, where {@code T}
   * is equivalent to a given type after erasure.
   */
  static boolean isEqualityComparerGetDefaultCall(TypeSystem typeSystem,
      Il.Inst inst, Type type) {
    final Il.Call call = matchCall(inst, Op.CALL, "get_Default");
    if (call == null || !call.method.isStatic()) {
      return false;
    }
    final Type declaringType = call.method.declaringType;
    return typeSystem.isKnownType(declaringType, KnownType.EQUALITY_COMPARER)
        && declaringType.typeArguments().size() == 1
        && typeSystem.equivalentTypes(declaringType.arg(0), type)
        && call.arguments.isEmpty();
  }
}

// End Patterns.java
