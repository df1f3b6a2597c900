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
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import org.jspecify.nullness.Nullable;

/**
 * Converts an amount in a named ether denomination to wei, e.g. {@code as_wei_value(1.5,
 * "gwei")} to {@code 1500000000}. Fractions of a wei are dropped.
 */
final class AsWeiValue extends AbstractBuiltin {

  static final ImmutableMap<String, BigInteger> DENOMINATIONS =
      ImmutableMap.<String, BigInteger>builder()
          .put("wei", BigInteger.ONE)
          .put("kwei", BigInteger.TEN.pow(3))
          .put("babbage", BigInteger.TEN.pow(3))
          .put("femtoether", BigInteger.TEN.pow(3))
          .put("mwei", BigInteger.TEN.pow(6))
          .put("lovelace", BigInteger.TEN.pow(6))
          .put("picoether", BigInteger.TEN.pow(6))
          .put("gwei", BigInteger.TEN.pow(9))
          .put("shannon", BigInteger.TEN.pow(9))
          .put("nanoether", BigInteger.TEN.pow(9))
          .put("szabo", BigInteger.TEN.pow(12))
          .put("microether", BigInteger.TEN.pow(12))
          .put("finney", BigInteger.TEN.pow(15))
          .put("milliether", BigInteger.TEN.pow(15))
          .put("ether", BigInteger.TEN.pow(18))
          .put("kether", BigInteger.TEN.pow(21))
          .put("grand", BigInteger.TEN.pow(21))
          .build();

  AsWeiValue() {
    super("as_wei_value", 2);
  }

  @Override
  @Nullable Node evaluate(ImmutableList<Node> arguments) {
    Node value = arguments.get(0);
    Node unit = arguments.get(1);
    if (!unit.isStr()) {
      return null;
    }
    BigInteger denomination = DENOMINATIONS.get(unit.getString());
    if (denomination == null) {
      return null;
    }

    BigInteger wei;
    if (value.isInt()) {
      if (value.getInt().signum() < 0) {
        return null;
      }
      wei = value.getInt().multiply(denomination);
    } else if (value.isDecimal()) {
      if (value.getDecimal().signum() < 0) {
        return null;
      }
      wei =
          value
              .getDecimal()
              .multiply(new BigDecimal(denomination))
              .setScale(0, RoundingMode.FLOOR)
              .toBigIntegerExact();
    } else {
      return null;
    }
    return NumericBounds.isUint256(wei) ? Node.newInt(wei) : null;
  }
}
