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
import static net.hydromatic.recdec.util.Static.allMatch;

import net.hydromatic.recdec.type.Method;

/**
 * Recognizes the generated {@code op_Equality} and {@code op_Inequality}
 * operators.
 *
 * <p>The signature alone decides: the compiler reports a duplicate definition
 * if the user declares an operator whose parameters are both exactly the
 * record type. Operators with other parameter types are the user's.
 */
class ComparisonOperatorMatcher {
  private final MatchContext cx;

  ComparisonOperatorMatcher(MatchContext cx) {
    this.cx = requireNonNull(cx);
  }

  boolean matches(Method method) {
    assert method.name.equals("op_Equality")
        || method.name.equals("op_Inequality");
    if (method.parameters.size() != 2) {
      return cx.mismatch(method, "expected 2 parameters, got %d",
          method.parameters.size());
    }
    if (!allMatch(method.parameters, p -> cx.isRecordType(p.type))) {
      return cx.mismatch(method, "parameters are not both %s", cx.record);
    }
    return true;
  }
}

// End ComparisonOperatorMatcher.java
