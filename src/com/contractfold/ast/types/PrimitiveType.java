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

package com.contractfold.ast.types;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.Immutable;
import java.math.BigDecimal;
import java.math.BigInteger;
import org.jspecify.nullness.Nullable;

/**
 * A scalar value type such as {@code uint256}. Integer and decimal types know the range of values
 * they can hold.
 */
@Immutable
public final class PrimitiveType extends TypeDescriptor {

  public static final PrimitiveType BOOL = new PrimitiveType("bool", null, null, false);
  public static final PrimitiveType DECIMAL =
      new PrimitiveType(
          "decimal",
          new BigDecimal(BigInteger.ONE.shiftLeft(127).negate()),
          new BigDecimal(BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE)),
          true);
  public static final PrimitiveType ADDRESS = new PrimitiveType("address", null, null, false);
  public static final PrimitiveType BYTES32 = new PrimitiveType("bytes32", null, null, false);
  public static final PrimitiveType INT128 = integer("int128", true, 128);
  public static final PrimitiveType INT256 = integer("int256", true, 256);
  public static final PrimitiveType UINT8 = integer("uint8", false, 8);
  public static final PrimitiveType UINT256 = integer("uint256", false, 256);

  private static final ImmutableMap<String, PrimitiveType> BY_NAME =
      ImmutableMap.<String, PrimitiveType>builder()
          .put(BOOL.name, BOOL)
          .put(DECIMAL.name, DECIMAL)
          .put(ADDRESS.name, ADDRESS)
          .put(BYTES32.name, BYTES32)
          .put(INT128.name, INT128)
          .put(INT256.name, INT256)
          .put(UINT8.name, UINT8)
          .put(UINT256.name, UINT256)
          .buildOrThrow();

  private final String name;

  // Both null for types without a numeric range.
  private final @Nullable BigDecimal minValue;
  private final @Nullable BigDecimal maxValue;
  private final boolean isDecimal;

  private PrimitiveType(
      String name,
      @Nullable BigDecimal minValue,
      @Nullable BigDecimal maxValue,
      boolean isDecimal) {
    this.name = name;
    this.minValue = minValue;
    this.maxValue = maxValue;
    this.isDecimal = isDecimal;
  }

  private static PrimitiveType integer(String name, boolean signed, int bits) {
    BigInteger min = signed ? BigInteger.ONE.shiftLeft(bits - 1).negate() : BigInteger.ZERO;
    BigInteger max = BigInteger.ONE.shiftLeft(signed ? bits - 1 : bits).subtract(BigInteger.ONE);
    return new PrimitiveType(name, new BigDecimal(min), new BigDecimal(max), false);
  }

  /** Returns the primitive type with the given source name, or null if there is none. */
  public static @Nullable PrimitiveType forName(String name) {
    return BY_NAME.get(name);
  }

  @Override
  public boolean canHold(BigInteger value) {
    return !isDecimal && isInRange(new BigDecimal(value));
  }

  @Override
  public boolean canHold(BigDecimal value) {
    return isDecimal && isInRange(value);
  }

  private boolean isInRange(BigDecimal value) {
    return minValue != null
        && maxValue != null
        && value.compareTo(minValue) >= 0
        && value.compareTo(maxValue) <= 0;
  }

  @Override
  public String getDisplayName() {
    return name;
  }

  @Override
  public boolean equals(@Nullable Object other) {
    return other instanceof PrimitiveType && ((PrimitiveType) other).name.equals(name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }
}
