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

import java.math.BigDecimal;
import java.math.BigInteger;

/** The range of values any integer or decimal type of the language can hold. */
public final class NumericBounds {

  /** Decimals carry at most this many fractional digits. */
  public static final int DECIMAL_PLACES = 10;

  public static final BigInteger UINT256_MODULUS = BigInteger.ONE.shiftLeft(256);
  public static final BigInteger MAX_UINT256 = UINT256_MODULUS.subtract(BigInteger.ONE);

  /** The smallest value of the widest signed integer type. */
  public static final BigInteger MIN_INT = BigInteger.ONE.shiftLeft(255).negate();

  /** The largest value of the widest signed integer type. */
  public static final BigInteger MAX_INT256 =
      BigInteger.ONE.shiftLeft(255).subtract(BigInteger.ONE);

  /** The largest value of the widest unsigned integer type. */
  public static final BigInteger MAX_INT = MAX_UINT256;

  public static final BigInteger MIN_INT128 = BigInteger.ONE.shiftLeft(127).negate();
  public static final BigInteger MAX_INT128 =
      BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);

  public static final BigDecimal MIN_DECIMAL = new BigDecimal(MIN_INT128);
  public static final BigDecimal MAX_DECIMAL = new BigDecimal(MAX_INT128);

  private NumericBounds() {}

  public static boolean isInBounds(BigInteger value) {
    return value.compareTo(MIN_INT) >= 0 && value.compareTo(MAX_INT) <= 0;
  }

  public static boolean isInBounds(BigDecimal value) {
    return value.compareTo(MIN_DECIMAL) >= 0 && value.compareTo(MAX_DECIMAL) <= 0;
  }

  /** Whether the value fits an unsigned 256 bit integer. */
  public static boolean isUint256(BigInteger value) {
    return value.signum() >= 0 && value.compareTo(MAX_UINT256) <= 0;
  }
}
