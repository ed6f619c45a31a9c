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
import static net.hydromatic.recdec.util.Static.anyMatch;

import net.hydromatic.recdec.il.Il;
import net.hydromatic.recdec.type.KnownType;
import net.hydromatic.recdec.type.Member;
import net.hydromatic.recdec.type.Method;
import net.hydromatic.recdec.type.Type;
import net.hydromatic.recdec.type.TypeDef;
import net.hydromatic.recdec.type.TypeKind;
import net.hydromatic.recdec.type.TypeSystem;
import net.hydromatic.recdec.util.CancellationToken;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** State shared by the detector and matchers that analyze one record
 * type. */
class MatchContext {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(MatchContext.class);

  final TypeSystem typeSystem;
  final BodyDecompiler decompiler;
  final TypeDef record;
  final CancellationToken cancellationToken;
  final Tracer tracer;
  /** Whether the record derives from another record, rather than directly
   * from {@code object}. */
  final boolean inheritedRecord;

  MatchContext(TypeSystem typeSystem, BodyDecompiler decompiler,
      TypeDef record, CancellationToken cancellationToken, Tracer tracer) {
    this.typeSystem = requireNonNull(typeSystem);
    this.decompiler = requireNonNull(decompiler);
    this.record = requireNonNull(record);
    this.cancellationToken = requireNonNull(cancellationToken);
    this.tracer = requireNonNull(tracer);
    this.inheritedRecord =
        anyMatch(record.directBaseTypes(),
            b -> b.kind() == TypeKind.CLASS
                && !typeSystem.isKnownType(b, KnownType.OBJECT));
  }

  /** Returns whether a type is the record type, including its type
   * arguments; "{@code R<T>}" is the record "{@code R<T>}" but
   * "{@code R<int>}" is not. */
  boolean isRecordType(Type type) {
    return type.definition() == record
        && type.typeArguments().equals(record.typeParameters);
  }

  /** Decompiles a method; returns null if the method is null or has no
   * body. */
  Il.@Nullable Function decompile(@Nullable Method method) {
    if (method == null) {
      return null;
    }
    return decompiler.decompile(method, cancellationToken);
  }

  /** Reports that a member does not have the generated shape, and returns
   * false. */
  boolean mismatch(Member member, String format, Object... args) {
    final String reason = String.format(format, args);
    LOGGER.debug("{} is not compiler-generated: {}", member, reason);
    tracer.onMismatch(member, reason);
    return false;
  }
}

// End MatchContext.java
