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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.jspecify.nullness.Nullable;

/** A fixed-size array, {@code T[n]}. */
@Immutable
public final class ArrayType extends TypeDescriptor {

  private final TypeDescriptor valueType;
  private final int length;

  public ArrayType(TypeDescriptor valueType, int length) {
    checkArgument(length > 0, "Invalid array length %s", length);
    this.valueType = checkNotNull(valueType);
    this.length = length;
  }

  @Override
  public boolean isArrayType() {
    return true;
  }

  @Override
  public TypeDescriptor getValueType() {
    return valueType;
  }

  @Override
  public String getDisplayName() {
    return valueType.getDisplayName() + "[" + length + "]";
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (!(other instanceof ArrayType)) {
      return false;
    }
    ArrayType that = (ArrayType) other;
    return length == that.length && valueType.equals(that.valueType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(valueType, length);
  }
}
