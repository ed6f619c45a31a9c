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

/** Sub-types of {@link Il.Inst}. */
public enum Op {
  // containers and control flow
  BLOCK("Block"),
  RETURN("return"),
  IF("if"),

  // calls
  CALL("call"),
  CALL_VIRT("callvirt"),
  NEW_OBJ("newobj"),

  // fields
  LDFLD("ldfld"),
  LDSFLD("ldsfld"),
  STFLD("stfld"),
  STSFLD("stsfld"),

  // locals and parameters
  LDLOC("ldloc"),
  STLOC("stloc"),

  // operators
  LOGIC_AND("logic.and"),
  COMP("comp"),
  ADDRESS_OF("addressof"),

  // constants
  LDSTR("ldstr"),
  LDC_I4("ldc.i4"),
  LDNULL("ldnull"),
  LD_TYPE_TOKEN("ldtypetoken"),
  NOP("nop");

  /** Name of the opcode in textual IL, e.g. "callvirt". */
  public final String opName;

  Op(String opName) {
    this.opName = opName;
  }

  /** Whether this is one of the call opcodes. */
  public boolean isCall() {
    return this == CALL || this == CALL_VIRT || this == NEW_OBJ;
  }
}

// End Op.java
