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

package com.contractfold.fold;

import static com.google.common.base.Preconditions.checkState;

import com.contractfold.ast.Node;
import com.contractfold.ast.Operator;
import com.contractfold.ast.Token;
import com.contractfold.ast.types.TypeDescriptor;
import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;
import org.jspecify.nullness.Nullable;

/**
 * Folds arithmetic, boolean and comparison operations whose operands are literals, e.g.
 * {@code 2 ** 8 - 1} to {@code 255}.
 *
 * <p>Results follow the runtime semantics: integer division and modulo truncate toward zero,
 * decimal results are truncated to ten places. An operation whose result no type can hold, or
 * that fails at runtime (division by zero), is left for the type checker to report.
 */
class FoldLiteralOperations extends AbstractFoldingPass {

  /** Any larger exponent or shift overflows for every base other than -1, 0 and 1. */
  private static final int MAX_BIT_COUNT = 256;

  FoldLiteralOperations() {
    super(ImmutableSet.of(Token.BINOP, Token.UNARYOP, Token.BOOLOP, Token.COMPARE));
  }

  @Override
  @Nullable Node tryFold(Node n) {
    switch (n.getToken()) {
      case BINOP:
        return tryFoldBinaryOperation(n, n.getFirstChild(), n.getSecondChild());
      case UNARYOP:
        return tryFoldUnaryOperation(n, n.getOnlyChild());
      case BOOLOP:
        return tryFoldBooleanOperation(n);
      case COMPARE:
        return tryFoldComparison(n, n.getFirstChild(), n.getSecondChild());
      default:
        throw new IllegalStateException("Unexpected token " + n.getToken());
    }
  }

  private @Nullable Node tryFoldBinaryOperation(Node n, Node left, Node right) {
    if (left.getToken() != right.getToken()) {
      return null;
    }

    Node result;
    if (left.isInt()) {
      BigInteger value = evaluateIntOperation(n.getOperator(), left.getInt(), right.getInt());
      result = value == null ? null : Node.newInt(value);
    } else if (left.isDecimal()) {
      BigDecimal value =
          evaluateDecimalOperation(n.getOperator(), left.getDecimal(), right.getDecimal());
      result = value == null ? null : Node.newDecimal(value);
    } else {
      return null;
    }
    if (result == null) {
      return null;
    }

    TypeDescriptor type = left.getTypeDescriptor();
    if (Objects.equals(type, right.getTypeDescriptor())) {
      setTypeIfHeld(result, type);
    }
    return result.srcref(n);
  }

  /**
   * Types a folded numeric result with its operands' type, unless the value falls outside that
   * type. An out of range result overflows at runtime and stays untyped.
   */
  private static void setTypeIfHeld(Node result, @Nullable TypeDescriptor type) {
    if (type == null) {
      return;
    }
    boolean held =
        result.isInt() ? type.canHold(result.getInt()) : type.canHold(result.getDecimal());
    if (held) {
      result.setTypeDescriptor(type);
    }
  }

  private static @Nullable BigInteger evaluateIntOperation(
      Operator op, BigInteger left, BigInteger right) {
    BigInteger value;
    switch (op) {
      case ADD:
        value = left.add(right);
        break;
      case SUB:
        value = left.subtract(right);
        break;
      case MUL:
        value = left.multiply(right);
        break;
      case DIV:
        if (right.signum() == 0) {
          return null;
        }
        value = left.divide(right);
        break;
      case MOD:
        if (right.signum() == 0) {
          return null;
        }
        value = left.remainder(right);
        break;
      case POW:
        if (right.signum() < 0) {
          return null;
        }
        int exponent;
        if (right.compareTo(BigInteger.valueOf(MAX_BIT_COUNT)) <= 0) {
          exponent = right.intValue();
        } else if (left.abs().compareTo(BigInteger.ONE) <= 0) {
          // 0, 1 and -1 never overflow, only the parity of the exponent matters.
          exponent = right.testBit(0) ? 1 : 2;
        } else {
          return null;
        }
        value = left.pow(exponent);
        break;
      case BITAND:
        value = left.and(right);
        break;
      case BITOR:
        value = left.or(right);
        break;
      case BITXOR:
        value = left.xor(right);
        break;
      case LSHIFT:
        if (right.signum() < 0) {
          return null;
        }
        if (left.signum() == 0) {
          value = BigInteger.ZERO;
          break;
        }
        if (right.compareTo(BigInteger.valueOf(MAX_BIT_COUNT)) > 0) {
          return null;
        }
        value = left.shiftLeft(right.intValue());
        break;
      case RSHIFT:
        if (right.signum() < 0) {
          return null;
        }
        if (right.compareTo(BigInteger.valueOf(2 * MAX_BIT_COUNT)) > 0) {
          value = left.signum() < 0 ? BigInteger.ONE.negate() : BigInteger.ZERO;
          break;
        }
        value = left.shiftRight(right.intValue());
        break;
      default:
        return null;
    }
    return NumericBounds.isInBounds(value) ? value : null;
  }

  private static @Nullable BigDecimal evaluateDecimalOperation(
      Operator op, BigDecimal left, BigDecimal right) {
    BigDecimal value;
    switch (op) {
      case ADD:
        value = left.add(right);
        break;
      case SUB:
        value = left.subtract(right);
        break;
      case MUL:
        value = left.multiply(right).setScale(NumericBounds.DECIMAL_PLACES, RoundingMode.DOWN);
        break;
      case DIV:
        if (right.signum() == 0) {
          return null;
        }
        value = left.divide(right, NumericBounds.DECIMAL_PLACES, RoundingMode.DOWN);
        break;
      case MOD:
        if (right.signum() == 0) {
          return null;
        }
        value = left.remainder(right);
        break;
      default:
        // Exponentiation and bitwise operations are undefined on decimals.
        return null;
    }
    return NumericBounds.isInBounds(value) ? value : null;
  }

  private @Nullable Node tryFoldUnaryOperation(Node n, Node operand) {
    Node result;
    switch (n.getOperator()) {
      case USUB:
        if (operand.isInt()) {
          BigInteger value = operand.getInt().negate();
          result = NumericBounds.isInBounds(value) ? Node.newInt(value) : null;
        } else if (operand.isDecimal()) {
          BigDecimal value = operand.getDecimal().negate();
          result = NumericBounds.isInBounds(value) ? Node.newDecimal(value) : null;
        } else {
          result = null;
        }
        break;
      case NOT:
        result = operand.isBool() ? Node.newBoolean(!operand.getBoolean()) : null;
        break;
      case INVERT:
        // Only unsigned 256 bit integers support bitwise inversion.
        result =
            operand.isInt() && NumericBounds.isUint256(operand.getInt())
                ? Node.newInt(NumericBounds.MAX_UINT256.xor(operand.getInt()))
                : null;
        break;
      default:
        throw new IllegalStateException("Unexpected unary operator " + n.getOperator());
    }
    if (result == null) {
      return null;
    }
    if (result.isBool()) {
      result.copyTypeFrom(operand);
    } else {
      setTypeIfHeld(result, operand.getTypeDescriptor());
    }
    return result.srcref(n);
  }

  private @Nullable Node tryFoldBooleanOperation(Node n) {
    checkState(n.getChildCount() >= 2, "Boolean operation needs two values: %s", n);
    boolean isAnd = n.getOperator() == Operator.AND;
    boolean result = isAnd;
    for (Node value : n.children()) {
      if (!value.isBool()) {
        return null;
      }
      result = isAnd ? result && value.getBoolean() : result || value.getBoolean();
    }
    return Node.newBoolean(result).srcref(n);
  }

  private @Nullable Node tryFoldComparison(Node n, Node left, Node right) {
    if (!left.isLiteral()) {
      return null;
    }

    Operator op = n.getOperator();
    boolean result;
    switch (op) {
      case IN:
      case NOT_IN:
        if (!right.isList()) {
          return null;
        }
        boolean found = false;
        for (Node element : right.children()) {
          // Every element must be checked: a list with mixed kinds is never folded.
          if (element.getToken() != left.getToken()) {
            return null;
          }
          found = found || NodeUtil.literalEquals(left, element);
        }
        result = op == Operator.IN ? found : !found;
        break;
      case EQ:
      case NE:
        if (left.getToken() != right.getToken()) {
          return null;
        }
        result = NodeUtil.literalEquals(left, right) == (op == Operator.EQ);
        break;
      case LT:
      case LE:
      case GT:
      case GE:
        Integer comparison = compareNumbers(left, right);
        if (comparison == null) {
          return null;
        }
        result = isComparisonTrue(op, comparison);
        break;
      default:
        throw new IllegalStateException("Unexpected comparison " + op);
    }
    return Node.newBoolean(result).srcref(n);
  }

  /** Compares two numeric literals of the same kind, or returns null if they are not. */
  private static @Nullable Integer compareNumbers(Node left, Node right) {
    if (left.getToken() != right.getToken()) {
      return null;
    }
    if (left.isInt()) {
      return left.getInt().compareTo(right.getInt());
    }
    if (left.isDecimal()) {
      return left.getDecimal().compareTo(right.getDecimal());
    }
    return null;
  }

  private static boolean isComparisonTrue(Operator op, int comparison) {
    switch (op) {
      case LT:
        return comparison < 0;
      case LE:
        return comparison <= 0;
      case GT:
        return comparison > 0;
      case GE:
        return comparison >= 0;
      default:
        throw new IllegalStateException("Unexpected comparison " + op);
    }
  }
}
