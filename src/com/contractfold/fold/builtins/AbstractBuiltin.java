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
import static com.google.common.base.Preconditions.checkNotNull;

import com.contractfold.ast.Node;
import com.contractfold.fold.NumericBounds;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import org.jspecify.nullness.Nullable;

/**
 * A builtin that takes a fixed number of positional arguments.
 *
 * <p>Subclasses see the arguments only; the arity is checked before they are called.
 */
abstract class AbstractBuiltin implements FoldableBuiltin {

  private final String name;
  private final int argumentCount;

  AbstractBuiltin(String name, int argumentCount) {
    this.name = checkNotNull(name);
    this.argumentCount = argumentCount;
  }

  @Override
  public final String getName() {
    return name;
  }

  @Override
  public final @Nullable Node evaluate(Node call) {
    checkArgument(
        call.isCall() && call.getFirstChild().matchesName(name),
        "Not a call to %s: %s",
        name,
        call);
    ImmutableList<Node> arguments = getArguments(call);
    if (arguments.size() != argumentCount) {
      return null;
    }
    return evaluate(arguments);
  }

  /** Evaluates the builtin on exactly as many arguments as it declares. */
  abstract @Nullable Node evaluate(ImmutableList<Node> arguments);

  @Override
  public String toString() {
    return name;
  }

  static ImmutableList<Node> getArguments(Node call) {
    ImmutableList.Builder<Node> arguments = ImmutableList.builder();
    for (Node arg = call.getSecondChild(); arg != null; arg = arg.getNext()) {
      arguments.add(arg);
    }
    return arguments.build();
  }

  /** Returns the value of an INT literal an unsigned 256 bit integer can hold, or null. */
  static @Nullable BigInteger getUint256(Node n) {
    if (!n.isInt() || !NumericBounds.isUint256(n.getInt())) {
      return null;
    }
    return n.getInt();
  }
}
