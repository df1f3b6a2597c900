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

import static com.google.common.base.Preconditions.checkNotNull;

import com.contractfold.ast.Node;
import com.contractfold.ast.Token;
import com.contractfold.fold.builtins.BuiltinFunction;
import com.contractfold.fold.builtins.BuiltinFunctionTable;
import com.contractfold.fold.builtins.FoldableBuiltin;
import com.google.common.collect.ImmutableSet;
import org.jspecify.nullness.Nullable;

/** Replaces calls to pure builtins with literal arguments by their results. */
class FoldBuiltinCalls extends AbstractFoldingPass {

  private final BuiltinFunctionTable builtins;

  FoldBuiltinCalls(BuiltinFunctionTable builtins) {
    super(ImmutableSet.of(Token.CALL));
    this.builtins = checkNotNull(builtins);
  }

  @Override
  @Nullable Node tryFold(Node n) {
    Node callee = n.getFirstChild();
    if (!callee.isName()) {
      return null;
    }
    BuiltinFunction function = builtins.get(callee.getString());
    if (!(function instanceof FoldableBuiltin)) {
      return null;
    }
    Node result = ((FoldableBuiltin) function).evaluate(n);
    return result == null ? null : result.srcrefTree(n);
  }
}
