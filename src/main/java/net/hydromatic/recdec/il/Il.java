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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.recdec.type.Field;
import net.hydromatic.recdec.type.Method;
import net.hydromatic.recdec.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Low-level instruction tree.
 *
 * <p>A decompiled method body is a {@link Function} whose body is a
 * {@link Block} of instructions. Every instruction is immutable, carries an
 * {@link Op} that identifies its class, and exposes its operands via
 * {@link Inst#children()} in a fixed order.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Use {@link IlBuilder#il} to create instructions.
 */
public class Il {
  private Il() {}

  /** Abstract base class of instructions. */
  public abstract static class Inst {
    public final Op op;

    Inst(Op op) {
      this.op = requireNonNull(op);
    }

    /** Returns the operands of this instruction, in order. */
    public abstract List<Inst> children();

    abstract StringBuilder unparse(StringBuilder b);

    /** Converts this instruction to textual IL, e.g.
     * "{@code callvirt Append(ldloc builder, ldstr ", ")}". */
    @Override
    public final String toString() {
      return unparse(new StringBuilder()).toString();
    }

    /** Whether this instruction loads the implicit {@code this}
     * parameter. */
    public boolean isLdThis() {
      return false;
    }

    /** Whether this instruction loads a given variable. */
    public boolean isLdLoc(Variable variable) {
      return false;
    }

    /** Whether this instruction is a string constant with a given value. */
    public boolean isLdStr(String value) {
      return false;
    }

    /** Whether this instruction is an integer constant with a given value. */
    public boolean isLdcI4(int value) {
      return false;
    }

    public boolean isNop() {
      return op == Op.NOP;
    }

    static StringBuilder unparseArgs(StringBuilder b, List<Inst> args) {
      b.append('(');
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        args.get(i).unparse(b);
      }
      return b.append(')');
    }
  }

  /** Decompiled method: the root of an instruction tree. Not itself an
   * instruction. */
  public static class Function {
    public final Method method;
    public final ImmutableList<Variable> variables;
    public final Block body;

    Function(Method method, ImmutableList<Variable> variables, Block body) {
      this.method = requireNonNull(method);
      this.variables = requireNonNull(variables);
      this.body = requireNonNull(body);
    }

    /** Returns the declared parameter with the given index, or null. */
    public @Nullable Variable parameter(int index) {
      for (Variable v : variables) {
        if (v.isParameter(index)) {
          return v;
        }
      }
      return null;
    }

    /** Returns the {@code this} parameter, or null if the method is
     * static. */
    public @Nullable Variable thisVariable() {
      return parameter(-1);
    }

    @Override
    public String toString() {
      return method.name + " " + body;
    }
  }

  /** Sequence of instructions. */
  public static class Block extends Inst {
    public final ImmutableList<Inst> instructions;

    Block(ImmutableList<Inst> instructions) {
      super(Op.BLOCK);
      this.instructions = requireNonNull(instructions);
    }

    @Override
    public List<Inst> children() {
      return instructions;
    }

    public int size() {
      return instructions.size();
    }

    /** Returns the {@code i}th instruction, or null if there is no such
     * instruction. */
    public @Nullable Inst at(int i) {
      return i >= 0 && i < instructions.size() ? instructions.get(i) : null;
    }

    /** If this block contains exactly one instruction, returns that
     * instruction; otherwise returns this block. */
    public Inst unwrap() {
      return instructions.size() == 1 ? instructions.get(0) : this;
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      b.append("Block {");
      for (int i = 0; i < instructions.size(); i++) {
        b.append(i == 0 ? " " : "; ");
        instructions.get(i).unparse(b);
      }
      return b.append(" }");
    }
  }

  /** Returns from the function, with a value; the value is a
   * {@link Op#NOP} if the function is void. */
  public static class Return extends Inst {
    public final Inst value;

    Return(Inst value) {
      super(Op.RETURN);
      this.value = requireNonNull(value);
    }

    @Override
    public List<Inst> children() {
      return ImmutableList.of(value);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      b.append(op.opName);
      if (!value.isNop()) {
        value.unparse(b.append(' '));
      }
      return b;
    }
  }

  /** Conditional; the false branch is a {@link Op#NOP} if absent. */
  public static class If extends Inst {
    public final Inst condition;
    public final Inst trueInst;
    public final Inst falseInst;

    If(Inst condition, Inst trueInst, Inst falseInst) {
      super(Op.IF);
      this.condition = requireNonNull(condition);
      this.trueInst = requireNonNull(trueInst);
      this.falseInst = requireNonNull(falseInst);
    }

    @Override
    public List<Inst> children() {
      return ImmutableList.of(condition, trueInst, falseInst);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      condition.unparse(b.append("if ("));
      trueInst.unparse(b.append(") "));
      if (!falseInst.isNop()) {
        falseInst.unparse(b.append(" else "));
      }
      return b;
    }
  }

  /** Call of a method: static or non-virtual ({@link Op#CALL}), virtual
   * ({@link Op#CALL_VIRT}), or constructor ({@link Op#NEW_OBJ}).
   *
   * <p>For an instance method, the first argument is the receiver. A call on
   * a value of generic type may be constrained, as in
   * "{@code constrained[int].callvirt ToString(addressof int(...))}". */
  public static class Call extends Inst {
    public final Method method;
    public final ImmutableList<Inst> arguments;
    public final @Nullable Type constrainedTo;

    Call(Op op, Method method, ImmutableList<Inst> arguments,
        @Nullable Type constrainedTo) {
      super(op);
      this.method = requireNonNull(method);
      this.arguments = requireNonNull(arguments);
      this.constrainedTo = constrainedTo;
      checkArgument(op.isCall());
      checkArgument(constrainedTo == null || op == Op.CALL_VIRT);
    }

    @Override
    public List<Inst> children() {
      return arguments;
    }

    /** Whether the called method has the given name. */
    public boolean isCallTo(String methodName) {
      return method.name.equals(methodName);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      if (constrainedTo != null) {
        b.append("constrained[").append(constrainedTo).append("].");
      }
      b.append(op.opName).append(' ');
      if (op == Op.NEW_OBJ) {
        b.append(method.declaringType.name()).append('.');
      }
      return unparseArgs(b.append(method.name), arguments);
    }
  }

  /** Loads an instance field ({@link Op#LDFLD}, with a target) or a static
   * field ({@link Op#LDSFLD}, target is null). */
  public static class LdFld extends Inst {
    public final @Nullable Inst target;
    public final Field field;

    LdFld(@Nullable Inst target, Field field) {
      super(target == null ? Op.LDSFLD : Op.LDFLD);
      this.target = target;
      this.field = requireNonNull(field);
    }

    @Override
    public List<Inst> children() {
      return target == null ? ImmutableList.of() : ImmutableList.of(target);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      b.append(op.opName).append(' ').append(field.name);
      return target == null ? b : unparseArgs(b, children());
    }
  }

  /** Stores into an instance field ({@link Op#STFLD}) or a static field
   * ({@link Op#STSFLD}, target is null). */
  public static class StFld extends Inst {
    public final @Nullable Inst target;
    public final Field field;
    public final Inst value;

    StFld(@Nullable Inst target, Field field, Inst value) {
      super(target == null ? Op.STSFLD : Op.STFLD);
      this.target = target;
      this.field = requireNonNull(field);
      this.value = requireNonNull(value);
    }

    @Override
    public List<Inst> children() {
      return target == null
          ? ImmutableList.of(value)
          : ImmutableList.of(target, value);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return unparseArgs(b.append(op.opName).append(' ').append(field.name),
          children());
    }
  }

  /** Loads a local variable or parameter. */
  public static class LdLoc extends Inst {
    public final Variable variable;

    LdLoc(Variable variable) {
      super(Op.LDLOC);
      this.variable = requireNonNull(variable);
    }

    @Override
    public List<Inst> children() {
      return ImmutableList.of();
    }

    @Override
    public boolean isLdThis() {
      return variable.isThis();
    }

    @Override
    public boolean isLdLoc(Variable variable) {
      return this.variable == variable;
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return b.append(op.opName).append(' ').append(variable.name);
    }
  }

  /** Stores into a local variable. */
  public static class StLoc extends Inst {
    public final Variable variable;
    public final Inst value;

    StLoc(Variable variable, Inst value) {
      super(Op.STLOC);
      this.variable = requireNonNull(variable);
      this.value = requireNonNull(value);
    }

    @Override
    public List<Inst> children() {
      return ImmutableList.of(value);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      b.append(op.opName).append(' ').append(variable.name);
      return unparseArgs(b, children());
    }
  }

  /** Short-circuit "and" of two conditions. */
  public static class LogicAnd extends Inst {
    public final Inst left;
    public final Inst right;

    LogicAnd(Inst left, Inst right) {
      super(Op.LOGIC_AND);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public List<Inst> children() {
      return ImmutableList.of(left, right);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return unparseArgs(b.append(op.opName), children());
    }
  }

  /** Comparison of two values. */
  public static class Comp extends Inst {
    public final ComparisonKind kind;
    public final Inst left;
    public final Inst right;

    Comp(ComparisonKind kind, Inst left, Inst right) {
      super(Op.COMP);
      this.kind = requireNonNull(kind);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public List<Inst> children() {
      return ImmutableList.of(left, right);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      left.unparse(b.append(op.opName).append('('));
      right.unparse(b.append(' ').append(kind.symbol).append(' '));
      return b.append(')');
    }
  }

  /** Kind of {@link Comp}. */
  public enum ComparisonKind {
    EQUALITY("=="),
    INEQUALITY("!=");

    public final String symbol;

    ComparisonKind(String symbol) {
      this.symbol = symbol;
    }
  }

  /** Takes the address of a value, so that a method can be called on it. */
  public static class AddressOf extends Inst {
    public final Inst value;
    public final Type type;

    AddressOf(Inst value, Type type) {
      super(Op.ADDRESS_OF);
      this.value = requireNonNull(value);
      this.type = requireNonNull(type);
    }

    @Override
    public List<Inst> children() {
      return ImmutableList.of(value);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      b.append(op.opName).append(' ').append(type);
      return unparseArgs(b, children());
    }
  }

  /** String constant. */
  public static class LdStr extends Inst {
    public final String value;

    LdStr(String value) {
      super(Op.LDSTR);
      this.value = requireNonNull(value);
    }

    @Override
    public List<Inst> children() {
      return ImmutableList.of();
    }

    @Override
    public boolean isLdStr(String value) {
      return this.value.equals(value);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return b.append(op.opName).append(" \"")
          .append(value.replace("\\", "\\\\").replace("\"", "\\\""))
          .append('"');
    }
  }

  /** 32-bit integer constant; also used for {@code bool} values. */
  public static class LdcI4 extends Inst {
    public final int value;

    LdcI4(int value) {
      super(Op.LDC_I4);
      this.value = value;
    }

    @Override
    public List<Inst> children() {
      return ImmutableList.of();
    }

    @Override
    public boolean isLdcI4(int value) {
      return this.value == value;
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return b.append(op.opName).append(' ').append(value);
    }
  }

  /** Token of a type, the argument to {@code Type.GetTypeFromHandle}. */
  public static class LdTypeToken extends Inst {
    public final Type type;

    LdTypeToken(Type type) {
      super(Op.LD_TYPE_TOKEN);
      this.type = requireNonNull(type);
    }

    @Override
    public List<Inst> children() {
      return ImmutableList.of();
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return b.append(op.opName).append(' ').append(type);
    }
  }

  /** Instruction without operands: {@link Op#LDNULL} or {@link Op#NOP}. */
  public static class Leaf extends Inst {
    Leaf(Op op) {
      super(op);
      checkArgument(op == Op.LDNULL || op == Op.NOP);
    }

    @Override
    public List<Inst> children() {
      return ImmutableList.of();
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return b.append(op.opName);
    }
  }
}

// End Il.java
