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
package net.hydromatic.recdec.type;

/**
 * Well-known types that the record analyzer needs to recognize.
 *
 * <p>Recognition is by namespace, name and number of type parameters; see
 * {@link TypeSystem#isKnownType(Type, KnownType)}.
 */
public enum KnownType {
  OBJECT("System", "Object", TypeKind.CLASS, 0),
  VOID("System", "Void", TypeKind.STRUCT, 0),
  BOOLEAN("System", "Boolean", TypeKind.STRUCT, 0),
  INT32("System", "Int32", TypeKind.STRUCT, 0),
  STRING("System", "String", TypeKind.CLASS, 0),
  /** The {@code dynamic} pseudo-type; erases to {@link #OBJECT}. */
  DYNAMIC("", "dynamic", TypeKind.CLASS, 0),
  /** {@code System.Type}, the type of the equality contract. */
  TYPE("System", "Type", TypeKind.CLASS, 0),
  RUNTIME_TYPE_HANDLE("System", "RuntimeTypeHandle", TypeKind.STRUCT, 0),
  STRING_BUILDER("System.Text", "StringBuilder", TypeKind.CLASS, 0),
  EQUALITY_COMPARER("System.Collections.Generic", "EqualityComparer",
      TypeKind.CLASS, 1),
  COMPILER_GENERATED_ATTRIBUTE("System.Runtime.CompilerServices",
      "CompilerGeneratedAttribute", TypeKind.CLASS, 0);

  public final String namespace;
  public final String typeName;
  public final TypeKind kind;
  public final int typeParameterCount;

  KnownType(String namespace, String typeName, TypeKind kind,
      int typeParameterCount) {
    this.namespace = namespace;
    this.typeName = typeName;
    this.kind = kind;
    this.typeParameterCount = typeParameterCount;
  }

  /** Returns the full name, e.g. "System.Text.StringBuilder". */
  public String fullName() {
    return namespace.isEmpty() ? typeName : namespace + "." + typeName;
  }
}

// End KnownType.java
