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

package com.contractfold.fold.builtins;

import com.contractfold.ast.Node;
import com.contractfold.fold.NumericBounds;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.math.RoundingMode;
import org.jspecify.nullness.Nullable;

/** Numeric builtins: rounding, comparison and modular arithmetic. */
final class MathBuiltins {

  private MathBuiltins() {}

  static void addTo(BuiltinFunctionTable.Builder builder) {
    builder
        .add(new Round("floor", RoundingMode.FLOOR))
        .add(new Round("ceil", RoundingMode.CEILING))
        .add(new MinMax("min", false))
        .add(new MinMax("max", true))
        .add(new Abs())
        .add(new ModularArithmetic("uint256_addmod", false))
        .add(new ModularArithmetic("uint256_mulmod", true))
        .add(new PowMod256());
  }

  /** Rounds a decimal to an integer. */
  private static final class Round extends AbstractBuiltin {
    private final RoundingMode mode;

    Round(String name, RoundingMode mode) {
      super(name, 1);
      this.mode = mode;
    }

    @Override
    @Nullable Node evaluate(ImmutableList<Node> arguments) {
      Node value = arguments.get(0);
      if (!value.isDecimal()) {
        return null;
      }
      return Node.newInt(value.getDecimal().setScale(0, mode).toBigIntegerExact());
    }
  }

  private static final class MinMax extends AbstractBuiltin {
    private final boolean isMax;

    MinMax(String name, boolean isMax) {
      super(name, 2);
      this.isMax = isMax;
    }

    @Override
    @Nullable Node evaluate(ImmutableList<Node> arguments) {
      Node left = arguments.get(0);
      Node right = arguments.get(1);
      if (left.getToken() != right.getToken()) {
        return null;
      }
      if (left.isInt()) {
        BigInteger a = left.getInt();
        BigInteger b = right.getInt();
        return Node.newInt(isMax ? a.max(b) : a.min(b));
      }
      if (left.isDecimal()) {
        return Node.newDecimal(
            isMax
                ? left.getDecimal().max(right.getDecimal())
                : left.getDecimal().min(right.getDecimal()));
      }
      return null;
    }
  }

  /** Absolute value of a signed 256 bit integer. */
  private static final class Abs extends AbstractBuiltin {
    Abs() {
      super("abs", 1);
    }

    @Override
    @Nullable Node evaluate(ImmutableList<Node> arguments) {
      Node value = arguments.get(0);
      if (!value.isInt()) {
        return null;
      }
      BigInteger result = value.getInt().abs();
      // abs(-2**255) does not fit in an int256.
      if (result.compareTo(NumericBounds.MAX_INT256) > 0) {
        return null;
      }
      return Node.newInt(result);
    }
  }

  /** {@code (a + b) % c} or {@code (a * b) % c}, computed without intermediate overflow. */
  private static final class ModularArithmetic extends AbstractBuiltin {
    private final boolean isMultiplication;

    ModularArithmetic(String name, boolean isMultiplication) {
      super(name, 3);
      this.isMultiplication = isMultiplication;
    }

    @Override
    @Nullable Node evaluate(ImmutableList<Node> arguments) {
      BigInteger a = getUint256(arguments.get(0));
      BigInteger b = getUint256(arguments.get(1));
      BigInteger c = getUint256(arguments.get(2));
      if (a == null || b == null || c == null || c.signum() == 0) {
        return null;
      }
      BigInteger value = isMultiplication ? a.multiply(b) : a.add(b);
      return Node.newInt(value.mod(c));
    }
  }

  /** Exponentiation that wraps around at 2**256. */
  private static final class PowMod256 extends AbstractBuiltin {
    PowMod256() {
      super("pow_mod256", 2);
    }

    @Override
    @Nullable Node evaluate(ImmutableList<Node> arguments) {
      BigInteger base = getUint256(arguments.get(0));
      BigInteger exponent = getUint256(arguments.get(1));
      if (base == null || exponent == null) {
        return null;
      }
      return Node.newInt(base.modPow(exponent, NumericBounds.UINT256_MODULUS));
    }
  }
}
