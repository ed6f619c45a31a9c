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
package net.hydromatic.recdec.il;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.recdec.type.Field;
import net.hydromatic.recdec.type.Method;
import net.hydromatic.recdec.type.Type;

/** Builds instruction trees. */
public enum IlBuilder {
  /** The singleton instance of the IL builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  il;

  private final Il.Leaf nop = new Il.Leaf(Op.NOP);

  private final Il.Leaf ldNull = new Il.Leaf(Op.LDNULL);

  /** Creates the implicit {@code this} parameter of a method declared by
   * {@code type}. */
  public Variable thisParameter(Type type) {
    return new Variable(Variable.Kind.PARAMETER, -1, "this", type);
  }

  /** Creates a declared parameter. */
  public Variable parameter(int index, String name, Type type) {
    checkArgument(index >= 0, "index must be non-negative");
    return new Variable(Variable.Kind.PARAMETER, index, name, type);
  }

  /** Creates a local variable. */
  public Variable local(int index, String name, Type type) {
    return new Variable(Variable.Kind.LOCAL, index, name, type);
  }

  /** Creates a decompiled function. */
  public Il.Function function(Method method, List<Variable> variables,
      Il.Block body) {
    return new Il.Function(method, ImmutableList.copyOf(variables), body);
  }

  public Il.Block block(Il.Inst... instructions) {
    return block(Arrays.asList(instructions));
  }

  public Il.Block block(List<? extends Il.Inst> instructions) {
    return new Il.Block(ImmutableList.copyOf(instructions));
  }

  /** Creates "return value". */
  public Il.Return ret(Il.Inst value) {
    return new Il.Return(value);
  }

  /** Creates "return" from a void function. */
  public Il.Return ret() {
    return new Il.Return(nop);
  }

  public Il.If ifThen(Il.Inst condition, Il.Inst trueInst) {
    return new Il.If(condition, trueInst, nop);
  }

  public Il.If ifThenElse(Il.Inst condition, Il.Inst trueInst,
      Il.Inst falseInst) {
    return new Il.If(condition, trueInst, falseInst);
  }

  /** Creates a static or non-virtual call. */
  public Il.Call call(Method method, Il.Inst... arguments) {
    return new Il.Call(Op.CALL, method, ImmutableList.copyOf(arguments), null);
  }

  /** Creates a virtual call; the first argument is the receiver. */
  public Il.Call callVirt(Method method, Il.Inst... arguments) {
    return new Il.Call(Op.CALL_VIRT, method, ImmutableList.copyOf(arguments),
        null);
  }

  /** Creates a virtual call on a value of type {@code type}, as used to
   * call {@code ToString} on a value type. */
  public Il.Call constrainedCallVirt(Type type, Method method,
      Il.Inst... arguments) {
    return new Il.Call(Op.CALL_VIRT, method, ImmutableList.copyOf(arguments),
        type);
  }

  /** Creates a call to a constructor. */
  public Il.Call newObj(Method constructor, Il.Inst... arguments) {
    checkArgument(constructor.isConstructor(), "not a constructor: %s",
        constructor);
    return new Il.Call(Op.NEW_OBJ, constructor,
        ImmutableList.copyOf(arguments), null);
  }

  /** Loads an instance field. */
  public Il.LdFld ldFld(Il.Inst target, Field field) {
    return new Il.LdFld(target, field);
  }

  /** Loads a static field. */
  public Il.LdFld ldsFld(Field field) {
    return new Il.LdFld(null, field);
  }

  /** Stores into an instance field. */
  public Il.StFld stFld(Il.Inst target, Field field, Il.Inst value) {
    return new Il.StFld(target, field, value);
  }

  /** Stores into a static field. */
  public Il.StFld stsFld(Field field, Il.Inst value) {
    return new Il.StFld(null, field, value);
  }

  public Il.LdLoc ldLoc(Variable variable) {
    return new Il.LdLoc(variable);
  }

  public Il.StLoc stLoc(Variable variable, Il.Inst value) {
    return new Il.StLoc(variable, value);
  }

  public Il.LogicAnd logicAnd(Il.Inst left, Il.Inst right) {
    return new Il.LogicAnd(left, right);
  }

  /** Combines a non-empty list of conditions into a left-associated chain;
   * "[a, b, c]" becomes "logic.and(logic.and(a, b), c)". */
  public Il.Inst logicAnd(List<? extends Il.Inst> conditions) {
    checkArgument(!conditions.isEmpty(), "empty list of conditions");
    Il.Inst result = conditions.get(0);
    for (int i = 1; i < conditions.size(); i++) {
      result = logicAnd(result, conditions.get(i));
    }
    return result;
  }

  public Il.Comp comp(Il.ComparisonKind kind, Il.Inst left, Il.Inst right) {
    return new Il.Comp(kind, left, right);
  }

  /** Creates "{@code value != null}". */
  public Il.Comp compNotEqualsNull(Il.Inst value) {
    return comp(Il.ComparisonKind.INEQUALITY, value, ldNull);
  }

  public Il.AddressOf addressOf(Il.Inst value, Type type) {
    return new Il.AddressOf(value, type);
  }

  public Il.LdStr ldStr(String value) {
    return new Il.LdStr(value);
  }

  public Il.LdcI4 ldcI4(int value) {
    return new Il.LdcI4(value);
  }

  /** Creates a boolean constant, which IL represents as an integer. */
  public Il.LdcI4 ldcBool(boolean value) {
    return ldcI4(value ? 1 : 0);
  }

  public Il.Inst ldNull() {
    return ldNull;
  }

  public Il.LdTypeToken ldTypeToken(Type type) {
    return new Il.LdTypeToken(type);
  }
}

// End IlBuilder.java
