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

import static net.hydromatic.recdec.util.Static.allMatch;

import com.google.common.collect.ImmutableList;
import net.hydromatic.recdec.type.Member;
import net.hydromatic.recdec.type.TypeDef;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Determines the order of fields and properties that the generated members
 * of a record (equality, printing) agree on.
 *
 * <p>Metadata records the order of fields and the order of properties, but
 * not how they interleave. We only handle the common case where every field
 * backs an automatic property; then the order is the order of the
 * properties.
 */
class MemberOrder {
  private MemberOrder() {}

  /** Returns the canonical member order, or null if it cannot be
   * determined. */
  static @Nullable ImmutableList<Member> resolve(TypeDef record,
      BackingFields backingFields) {
    if (allMatch(record.fields(), backingFields::isBackingField)) {
      return ImmutableList.copyOf(record.properties());
    }
    return null;
  }
}

// End MemberOrder.java
