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
import static com.google.common.base.Preconditions.checkState;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;

/** An AST construction helper class. */
public class IR {

  private IR() {}

  public static Node module(Node... statements) {
    Node module = new Node(Token.MODULE);
    for (Node stmt : statements) {
      checkState(mayBeStatement(stmt), "Module cannot contain %s", stmt.getToken());
      module.addChildToBack(stmt);
    }
    return module;
  }

  public static Node function(String name, Node... body) {
    Node function = Node.newString(Token.FUNCTION_DEF, name);
    for (Node stmt : body) {
      checkState(mayBeStatement(stmt), "Function body cannot contain %s", stmt.getToken());
      function.addChildToBack(stmt);
    }
    return function;
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.RETURN, expr);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR, expr);
  }

  // ==========================================================================
  // Assignments

  public static Node assign(Node target, Node value) {
    checkState(isAssignmentTarget(target), target);
    checkState(mayBeExpression(value), value);
    return new Node(Token.ASSIGN, target, value);
  }

  public static Node augAssign(Operator op, Node target, Node value) {
    checkState(isAssignmentTarget(target), target);
    checkState(mayBeExpression(value), value);
    Node augAssign = Node.newOperation(Token.AUG_ASSIGN, op);
    augAssign.addChildToBack(target);
    augAssign.addChildToBack(value);
    return augAssign;
  }

  /** An annotated assignment with no value, {@code target: annotation}. */
  public static Node annAssign(Node target, Node annotation) {
    checkState(isAssignmentTarget(target), target);
    return new Node(Token.ANN_ASSIGN, target, annotation);
  }

  public static Node annAssign(Node target, Node annotation, Node value) {
    checkState(isAssignmentTarget(target), target);
    checkState(mayBeExpression(value), value);
    return new Node(Token.ANN_ASSIGN, target, annotation, value);
  }

  /** A module constant declaration, {@code NAME: constant(type) = value}. */
  public static Node constantDeclaration(String name, Node type, Node value) {
    return annAssign(name(name), call(name("constant"), type), value);
  }

  // ==========================================================================
  // Names

  public static Node name(String name) {
    checkArgument(!name.isEmpty(), "Empty name");
    return Node.newString(Token.NAME, name);
  }

  public static Node attribute(Node value, String attr) {
    checkState(mayBeExpression(value), value);
    Node attribute = Node.newString(Token.ATTRIBUTE, attr);
    attribute.addChildToBack(value);
    return attribute;
  }

  // ==========================================================================
  // Literals

  public static Node number(long value) {
    return Node.newInt(value);
  }

  public static Node number(BigInteger value) {
    return Node.newInt(value);
  }

  public static Node decimal(String value) {
    return Node.newDecimal(new BigDecimal(value));
  }

  public static Node decimal(BigDecimal value) {
    return Node.newDecimal(value);
  }

  public static Node trueNode() {
    return Node.newBoolean(true);
  }

  public static Node falseNode() {
    return Node.newBoolean(false);
  }

  public static Node bool(boolean value) {
    return Node.newBoolean(value);
  }

  public static Node string(String value) {
    return Node.newString(Token.STR, value);
  }

  /** A hex literal such as {@code 0x00ff}. */
  public static Node hex(String value) {
    checkArgument(
        value.length() > 2 && (value.startsWith("0x") || value.startsWith("0X")),
        "Not a hex literal: %s",
        value);
    return Node.newString(Token.HEX, value);
  }

  public static Node bytes(byte[] value) {
    return Node.newBytes(value);
  }

  public static Node bytes(String value) {
    return Node.newBytes(value.getBytes(StandardCharsets.UTF_8));
  }

  public static Node list(Node... elements) {
    Node list = new Node(Token.LIST);
    for (Node element : elements) {
      checkState(mayBeExpression(element), element);
      list.addChildToBack(element);
    }
    return list;
  }

  public static Node list(List<Node> elements) {
    return list(elements.toArray(new Node[0]));
  }

  /** A dict literal. Arguments alternate between keys and values. */
  public static Node dict(Node... keysAndValues) {
    checkArgument(keysAndValues.length % 2 == 0, "Dict needs a value for every key");
    Node dict = new Node(Token.DICT);
    for (Node n : keysAndValues) {
      checkState(mayBeExpression(n), n);
      dict.addChildToBack(n);
    }
    return dict;
  }

  // ==========================================================================
  // Operations

  public static Node call(Node callee, Node... args) {
    checkState(mayBeExpression(callee), callee);
    Node call = new Node(Token.CALL, callee);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node binaryOp(Operator op, Node left, Node right) {
    return operation(Token.BINOP, op, left, right);
  }

  public static Node add(Node left, Node right) {
    return binaryOp(Operator.ADD, left, right);
  }

  public static Node sub(Node left, Node right) {
    return binaryOp(Operator.SUB, left, right);
  }

  public static Node mul(Node left, Node right) {
    return binaryOp(Operator.MUL, left, right);
  }

  public static Node div(Node left, Node right) {
    return binaryOp(Operator.DIV, left, right);
  }

  public static Node pow(Node left, Node right) {
    return binaryOp(Operator.POW, left, right);
  }

  public static Node unaryOp(Operator op, Node operand) {
    return operation(Token.UNARYOP, op, operand);
  }

  public static Node neg(Node operand) {
    return unaryOp(Operator.USUB, operand);
  }

  public static Node not(Node operand) {
    return unaryOp(Operator.NOT, operand);
  }

  public static Node boolOp(Operator op, Node... values) {
    checkArgument(values.length >= 2, "Boolean operation needs at least two values");
    return operation(Token.BOOLOP, op, values);
  }

  public static Node and(Node... values) {
    return boolOp(Operator.AND, values);
  }

  public static Node or(Node... values) {
    return boolOp(Operator.OR, values);
  }

  public static Node compare(Operator op, Node left, Node right) {
    return operation(Token.COMPARE, op, left, right);
  }

  public static Node eq(Node left, Node right) {
    return compare(Operator.EQ, left, right);
  }

  public static Node lt(Node left, Node right) {
    return compare(Operator.LT, left, right);
  }

  /** {@code value[index]}. */
  public static Node subscript(Node value, Node index) {
    checkState(mayBeExpression(value), value);
    checkState(mayBeExpression(index), index);
    return new Node(Token.SUBSCRIPT, value, new Node(Token.INDEX, index));
  }

  private static Node operation(Token token, Operator op, Node... operands) {
    Node operation = Node.newOperation(token, op);
    for (Node operand : operands) {
      checkState(mayBeExpression(operand), operand);
      operation.addChildToBack(operand);
    }
    return operation;
  }

  // ==========================================================================

  private static boolean isAssignmentTarget(Node n) {
    switch (n.getToken()) {
      case NAME:
      case ATTRIBUTE:
      case SUBSCRIPT:
        return true;
      default:
        return false;
    }
  }

  /** Whether the node may appear in a module or function body. */
  public static boolean mayBeStatement(Node n) {
    switch (n.getToken()) {
      case FUNCTION_DEF:
      case RETURN:
      case EXPR:
      case ANN_ASSIGN:
      case ASSIGN:
      case AUG_ASSIGN:
        return true;
      default:
        return false;
    }
  }

  /**
   * It isn't possible to always determine if a detached node is a expression, so make a best
   * guess.
   */
  public static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case NAME:
      case ATTRIBUTE:
      case INT:
      case HEX:
      case DECIMAL:
      case BOOL:
      case STR:
      case BYTES:
      case LIST:
      case DICT:
      case CALL:
      case BINOP:
      case UNARYOP:
      case BOOLOP:
      case COMPARE:
      case SUBSCRIPT:
        return true;
      default:
        return false;
    }
  }
}
