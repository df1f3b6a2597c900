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

import com.google.common.collect.ImmutableSet;

/**
 * The kinds of node in a contract syntax tree.
 *
 * <p>Operator nodes ({@link #BINOP}, {@link #UNARYOP}, {@link #BOOLOP}, {@link #COMPARE} and
 * {@link #AUG_ASSIGN}) carry their {@link Operator} on the node itself.
 */
public enum Token {
  MODULE,
  FUNCTION_DEF,
  RETURN,
  EXPR,

  ANN_ASSIGN,
  ASSIGN,
  AUG_ASSIGN,

  NAME,
  ATTRIBUTE,

  INT,
  HEX,
  DECIMAL,
  BOOL,
  STR,
  BYTES,

  LIST,
  DICT,

  CALL,
  BINOP,
  UNARYOP,
  BOOLOP,
  COMPARE,
  SUBSCRIPT,
  INDEX;

  /** Tokens of nodes that directly hold a constant value. */
  public static final ImmutableSet<Token> LITERALS =
      ImmutableSet.of(INT, HEX, DECIMAL, BOOL, STR, BYTES);

  /** Tokens of nodes that assign to their first child. */
  public static final ImmutableSet<Token> ASSIGNMENTS =
      ImmutableSet.of(ANN_ASSIGN, ASSIGN, AUG_ASSIGN);

  public boolean isLiteral() {
    return LITERALS.contains(this);
  }

  public boolean isAssignment() {
    return ASSIGNMENTS.contains(this);
  }
}
