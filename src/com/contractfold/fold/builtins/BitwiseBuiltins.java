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
import java.util.function.BinaryOperator;
import org.jspecify.nullness.Nullable;

/** Bitwise builtins over unsigned 256 bit integers. */
final class BitwiseBuiltins {

  private static final BigInteger WORD_BITS = BigInteger.valueOf(256);

  private BitwiseBuiltins() {}

  static void addTo(BuiltinFunctionTable.Builder builder) {
    builder
        .add(new BitwiseOperation("bitwise_and", BigInteger::and))
        .add(new BitwiseOperation("bitwise_or", BigInteger::or))
        .add(new BitwiseOperation("bitwise_xor", BigInteger::xor))
        .add(new BitwiseNot())
        .add(new Shift());
  }

  private static final class BitwiseOperation extends AbstractBuiltin {
    private final BinaryOperator<BigInteger> operation;

    BitwiseOperation(String name, BinaryOperator<BigInteger> operation) {
      super(name, 2);
      this.operation = operation;
    }

    @Override
    @Nullable Node evaluate(ImmutableList<Node> arguments) {
      BigInteger a = getUint256(arguments.get(0));
      BigInteger b = getUint256(arguments.get(1));
      if (a == null || b == null) {
        return null;
      }
      return Node.newInt(operation.apply(a, b));
    }
  }

  private static final class BitwiseNot extends AbstractBuiltin {
    BitwiseNot() {
      super("bitwise_not", 1);
    }

    @Override
    @Nullable Node evaluate(ImmutableList<Node> arguments) {
      BigInteger value = getUint256(arguments.get(0));
      if (value == null) {
        return null;
      }
      return Node.newInt(NumericBounds.MAX_UINT256.xor(value));
    }
  }

  /** Shifts left for a positive amount and right for a negative one, wrapping at 2**256. */
  private static final class Shift extends AbstractBuiltin {
    Shift() {
      super("shift", 2);
    }

    @Override
    @Nullable Node evaluate(ImmutableList<Node> arguments) {
      BigInteger value = getUint256(arguments.get(0));
      Node amount = arguments.get(1);
      if (value == null || !amount.isInt()) {
        return null;
      }
      BigInteger bits = amount.getInt();
      if (bits.abs().compareTo(WORD_BITS) >= 0) {
        return Node.newInt(0);
      }
      BigInteger result =
          bits.signum() >= 0
              ? value.shiftLeft(bits.intValue()).mod(NumericBounds.UINT256_MODULUS)
              : value.shiftRight(-bits.intValue());
      return Node.newInt(result);
    }
  }
}
