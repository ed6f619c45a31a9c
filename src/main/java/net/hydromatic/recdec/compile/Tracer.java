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

import java.util.List;
import net.hydromatic.recdec.type.Field;
import net.hydromatic.recdec.type.Member;
import net.hydromatic.recdec.type.Property;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during record analysis. */
public interface Tracer {
  /** Called when a property is recognized as automatic. */
  void onAutoProperty(Property property, Field backingField);

  /** Called with the canonical member order, or null if it is unknown. */
  void onMemberOrder(@Nullable List<Member> members);

  /** Called when a member's body or signature does not have the shape that
   * the compiler generates; {@code reason} describes the first
   * difference. */
  void onMismatch(Member member, String reason);

  /** Called with the verdict for a member. */
  void onVerdict(Member member, boolean generated);
}

// End Tracer.java
