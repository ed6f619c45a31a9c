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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.recdec.util.Static.filterEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.recdec.type.KnownType;
import net.hydromatic.recdec.type.Member;
import net.hydromatic.recdec.type.Method;
import net.hydromatic.recdec.type.Property;
import net.hydromatic.recdec.type.Type;
import net.hydromatic.recdec.type.TypeDef;
import net.hydromatic.recdec.type.TypeSystem;
import net.hydromatic.recdec.util.CancellationToken;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which members of a record type were generated by the compiler.
 *
 * <p>Generated and hand-written members look the same in metadata, so the
 * analyzer decompiles each candidate and compares its body with the exact
 * shape that the compiler emits. Anything that differs, however slightly, is
 * classified as hand-written; the decompiler will then print it as source
 * rather than hide it.
 *
 * <p>The constructor detects automatic properties and the canonical member
 * order; after that, {@link #methodIsGenerated(Method)} and
 * {@link #propertyIsGenerated(Property)} may be called any number of times, in
 * any order. An analyzer is not thread-safe, but analyzers of different
 * records share no mutable state.
 *
 * <p>If the {@link CancellationToken} is cancelled, the constructor or query
 * in progress throws {@link java.util.concurrent.CancellationException}.
 */
public class RecordAnalyzer {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(RecordAnalyzer.class);

  /** Name of the property that prevents equality between sibling record
   * types. */
  public static final String EQUALITY_CONTRACT = "EqualityContract";

  /** Name of the method that appends the members to a builder. */
  public static final String PRINT_MEMBERS = "PrintMembers";

  /** Name of the clone method; it cannot be written in source code. */
  public static final String CLONE = "<Clone>$";

  private final MatchContext cx;
  private final boolean enabled;
  private final BackingFields backingFields;
  private final @Nullable ImmutableList<Member> memberOrder;

  private final EqualityContractMatcher equalityContractMatcher;
  private final PrintMembersMatcher printMembersMatcher;
  private final ToStringMatcher toStringMatcher;
  private final EqualsMatcher equalsMatcher;
  private final ComparisonOperatorMatcher comparisonOperatorMatcher;

  /** Creates an analyzer with default properties and no tracing. */
  public RecordAnalyzer(TypeSystem typeSystem, BodyDecompiler decompiler,
      TypeDef record, CancellationToken cancellationToken) {
    this(typeSystem, decompiler, record, cancellationToken, ImmutableMap.of(),
        Tracers.empty());
  }

  /** Creates an analyzer. */
  public RecordAnalyzer(TypeSystem typeSystem, BodyDecompiler decompiler,
      TypeDef record, CancellationToken cancellationToken,
      Map<Prop, Object> props, Tracer tracer) {
    this.cx =
        new MatchContext(typeSystem, decompiler, record, cancellationToken,
            tracer);
    this.enabled = Prop.RECORD_CLASSES.booleanValue(requireNonNull(props));
    this.backingFields = new AutoPropertyDetector(cx).detect();
    this.memberOrder = MemberOrder.resolve(record, backingFields);
    LOGGER.debug("{}: auto-properties {}, member order {}", record,
        backingFields, memberOrder);
    tracer.onMemberOrder(memberOrder);

    this.equalityContractMatcher = new EqualityContractMatcher(cx);
    this.printMembersMatcher = new PrintMembersMatcher(cx, memberOrder);
    this.toStringMatcher = new ToStringMatcher(cx);
    this.equalsMatcher = new EqualsMatcher(cx, memberOrder, backingFields);
    this.comparisonOperatorMatcher = new ComparisonOperatorMatcher(cx);
  }

  /** Returns the record type being analyzed. */
  public TypeDef record() {
    return cx.record;
  }

  /** Returns the automatic properties and their backing fields. */
  public BackingFields backingFields() {
    return backingFields;
  }

  /** Returns the order of fields and properties that generated members
   * agree on, or null if it could not be determined. */
  public @Nullable List<Member> memberOrder() {
    return memberOrder;
  }

  /** Whether the record derives from another record. */
  public boolean isInheritedRecord() {
    return cx.inheritedRecord;
  }

  /** Returns whether a method of the record was generated by the
   * compiler. */
  public boolean methodIsGenerated(Method method) {
    checkArgument(method.declaringTypeDef() == cx.record,
        "%s is not a member of %s", method, cx.record);
    cx.cancellationToken.throwIfCancellationRequested();
    final boolean generated = enabled && classify(method);
    cx.tracer.onVerdict(method, generated);
    return generated;
  }

  /** Returns whether a property of the record was generated by the
   * compiler. */
  public boolean propertyIsGenerated(Property property) {
    checkArgument(property.declaringTypeDef() == cx.record,
        "%s is not a member of %s", property, cx.record);
    cx.cancellationToken.throwIfCancellationRequested();
    final boolean generated = enabled && classify(property);
    cx.tracer.onVerdict(property, generated);
    return generated;
  }

  /** Returns the properties and methods of the record that were generated by
   * the compiler; properties first, then methods, each in declaration
   * order. */
  public List<Member> generatedMembers() {
    return ImmutableList.<Member>builder()
        .addAll(filterEager(cx.record.properties(), this::propertyIsGenerated))
        .addAll(filterEager(cx.record.methods(), this::methodIsGenerated))
        .build();
  }

  private boolean classify(Method method) {
    switch (method.name) {
    case "op_Equality":
    case "op_Inequality":
      // A user may declare other comparison operators, as long as they
      // have different parameter types.
      return comparisonOperatorMatcher.matches(method);

    case "Equals":
      if (method.parameters.size() != 1) {
        return false;
      }
      final Type paramType = method.parameterType(0);
      if (cx.typeSystem.isKnownType(paramType, KnownType.OBJECT)) {
        // "override bool Equals(object? obj)" is always generated
        return true;
      }
      if (cx.isRecordType(paramType)) {
        // "virtual bool Equals(R? other)" is generated unless the user
        // declared it
        return equalsMatcher.matches(method);
      }
      return false;

    case CLONE:
      // Always generated; the name cannot be expressed in source code
      return method.parameters.isEmpty();

    case PRINT_MEMBERS:
      return printMembersMatcher.matches(method);

    case "ToString":
      return method.parameters.isEmpty() && toStringMatcher.matches(method);

    default:
      return false;
    }
  }

  private boolean classify(Property property) {
    switch (property.name) {
    case EQUALITY_CONTRACT:
      return equalityContractMatcher.matches(property);

    default:
      return false;
    }
  }
}

// End RecordAnalyzer.java
