/*
 * Copyright 2026 The ContractFold Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.contractfold.ast;

import static com.google.common.base.Preconditions.checkArgument;

/** Operators carried by operation, comparison and augmented assignment nodes. */
public enum Operator {
  // BINOP and AUG_ASSIGN
  ADD(Token.BINOP),
  SUB(Token.BINOP),
  MUL(Token.BINOP),
  DIV(Token.BINOP),
  MOD(Token.BINOP),
  POW(Token.BINOP),
  BITAND(Token.BINOP),
  BITOR(Token.BINOP),
  BITXOR(Token.BINOP),
  LSHIFT(Token.BINOP),
  RSHIFT(Token.BINOP),

  // UNARYOP
  USUB(Token.UNARYOP),
  NOT(Token.UNARYOP),
  INVERT(Token.UNARYOP),

  // BOOLOP
  AND(Token.BOOLOP),
  OR(Token.BOOLOP),

  // COMPARE
  EQ(Token.COMPARE),
  NE(Token.COMPARE),
  LT(Token.COMPARE),
  LE(Token.COMPARE),
  GT(Token.COMPARE),
  GE(Token.COMPARE),
  IN(Token.COMPARE),
  NOT_IN(Token.COMPARE);

  /** The operation token this operator belongs to. */
  private final Token kind;

  Operator(Token kind) {
    this.kind = kind;
  }

  /** Whether this operator may appear on a node with the given token. */
  boolean isValidFor(Token token) {
    return token == kind || (token == Token.AUG_ASSIGN && kind == Token.BINOP);
  }

  void checkValidFor(Token token) {
    checkArgument(isValidFor(token), "Operator %s cannot be used on %s", this, token);
  }
}
