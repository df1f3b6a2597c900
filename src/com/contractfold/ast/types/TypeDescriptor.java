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

import com.google.errorprone.annotations.Immutable;
import java.math.BigDecimal;
import java.math.BigInteger;
import org.jspecify.nullness.Nullable;

/**
 * A resolved type, as attached to literal nodes by constant propagation and consumed by the type
 * checker. Only the parts of the type system that folding consults are modeled here.
 *
 * <p>Implementations are immutable and compare by value.
 */
@Immutable
public abstract class TypeDescriptor {

  TypeDescriptor() {}

  /** The name of the type as written in source, e.g. {@code int128[3]}. */
  public abstract String getDisplayName();

  /** Whether values of this type are fixed-size sequences. */
  public boolean isArrayType() {
    return false;
  }

  /** The element type of a sequence type, or null for scalar types. */
  public @Nullable TypeDescriptor getValueType() {
    return null;
  }

  /** Whether an integer literal with this value is a valid value of this type. */
  public boolean canHold(BigInteger value) {
    return false;
  }

  /** Whether a decimal literal with this value is a valid value of this type. */
  public boolean canHold(BigDecimal value) {
    return false;
  }

  @Override
  public abstract boolean equals(@Nullable Object other);

  @Override
  public abstract int hashCode();

  @Override
  public final String toString() {
    return getDisplayName();
  }
}
