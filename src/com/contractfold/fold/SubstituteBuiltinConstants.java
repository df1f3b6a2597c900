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

import com.contractfold.ast.IR;
import com.contractfold.ast.Node;
import com.google.common.base.Strings;
import com.google.common.base.Supplier;
import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * Replaces references to the reserved constant names of the language with their values.
 *
 * <p>Builtin constants cannot be shadowed or assigned, so a single run is enough, and a
 * reference in a position that cannot hold a value is an internal error.
 */
final class SubstituteBuiltinConstants implements FoldingPass {

  static final ImmutableMap<String, Supplier<Node>> BUILTIN_CONSTANTS =
      ImmutableMap.<String, Supplier<Node>>builder()
          .put("EMPTY_BYTES32", () -> IR.hex("0x" + Strings.repeat("0", 64)))
          .put("ZERO_ADDRESS", () -> IR.hex("0x" + Strings.repeat("0", 40)))
          .put("MAX_INT128", () -> IR.number(NumericBounds.MAX_INT128))
          .put("MIN_INT128", () -> IR.number(NumericBounds.MIN_INT128))
          .put("MAX_DECIMAL", () -> IR.decimal(NumericBounds.MAX_DECIMAL))
          .put("MIN_DECIMAL", () -> IR.decimal(NumericBounds.MIN_DECIMAL))
          .put("MAX_UINT256", () -> IR.number(NumericBounds.MAX_UINT256))
          .buildOrThrow();

  @Override
  public int process(Node module) {
    int changedNodes = 0;
    for (Map.Entry<String, Supplier<Node>> constant : BUILTIN_CONSTANTS.entrySet()) {
      changedNodes +=
          ConstantSubstitution.replaceConstant(
              module, constant.getKey(), constant.getValue().get(), true, null);
    }
    return changedNodes;
  }
}
