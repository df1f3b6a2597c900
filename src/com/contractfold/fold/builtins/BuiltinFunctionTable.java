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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.nullness.Nullable;

/** The builtin functions visible to a contract, by name. */
@Immutable
public final class BuiltinFunctionTable {

  @SuppressWarnings("Immutable") // Entries are stateless.
  private final ImmutableMap<String, BuiltinFunction> functions;

  private BuiltinFunctionTable(ImmutableMap<String, BuiltinFunction> functions) {
    this.functions = functions;
  }

  /** Returns the builtin called {@code name}, or null if there is none. */
  public @Nullable BuiltinFunction get(String name) {
    return functions.get(name);
  }

  public boolean contains(String name) {
    return functions.containsKey(name);
  }

  public ImmutableCollection<BuiltinFunction> getFunctions() {
    return functions.values();
  }

  /** The table with every builtin of the language. */
  public static BuiltinFunctionTable getDefault() {
    return DefaultHolder.INSTANCE;
  }

  public static Builder builder() {
    return new Builder();
  }

  private static final class DefaultHolder {
    static final BuiltinFunctionTable INSTANCE = createDefault();

    private static BuiltinFunctionTable createDefault() {
      Builder builder = builder();
      MathBuiltins.addTo(builder);
      BitwiseBuiltins.addTo(builder);
      BytesBuiltins.addTo(builder);
      builder.add(new AsWeiValue());
      for (String name :
          new String[] {
            "empty",
            "convert",
            "send",
            "raw_call",
            "slice",
            "concat",
            "extract32",
            "ecrecover"
          }) {
        builder.add(new OpaqueBuiltin(name));
      }
      return builder.build();
    }
  }

  /** Collects builtins; names must be unique. */
  public static final class Builder {
    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder add(BuiltinFunction function) {
      BuiltinFunction previous = functions.putIfAbsent(function.getName(), function);
      checkArgument(previous == null, "Duplicate builtin %s", function.getName());
      return this;
    }

    /** Adds every builtin of {@code table}. */
    @CanIgnoreReturnValue
    public Builder addAll(BuiltinFunctionTable table) {
      for (BuiltinFunction function : table.getFunctions()) {
        add(function);
      }
      return this;
    }

    public BuiltinFunctionTable build() {
      return new BuiltinFunctionTable(ImmutableMap.copyOf(functions));
    }
  }
}
