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

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.jspecify.nullness.Nullable;

/** A dynamically sized string or byte array with a maximum length: {@code String[100]}. */
@Immutable
public final class BoundedType extends TypeDescriptor {

  /** The two base names that take a length bound. */
  public enum Kind {
    STRING("String"),
    BYTES("Bytes");

    private final String sourceName;

    Kind(String sourceName) {
      this.sourceName = sourceName;
    }

    public String getSourceName() {
      return sourceName;
    }
  }

  private final Kind kind;
  private final int maxLength;

  public BoundedType(Kind kind, int maxLength) {
    checkArgument(maxLength > 0, "Invalid length bound %s", maxLength);
    this.kind = kind;
    this.maxLength = maxLength;
  }

  @Override
  public String getDisplayName() {
    return kind.getSourceName() + "[" + maxLength + "]";
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (!(other instanceof BoundedType)) {
      return false;
    }
    BoundedType that = (BoundedType) other;
    return kind == that.kind && maxLength == that.maxLength;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, maxLength);
  }
}
