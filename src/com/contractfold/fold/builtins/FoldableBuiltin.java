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
import org.jspecify.nullness.Nullable;

/** A builtin function that can be evaluated at compile time when its arguments are literals. */
public interface FoldableBuiltin extends BuiltinFunction {

  /**
   * Evaluates a call to this builtin.
   *
   * @param call A CALL node whose callee names this builtin. It is not modified.
   * @return A new detached literal holding the result, or null if the arguments are not literals
   *     of the expected kinds or the call would fail at runtime
   */
  @Nullable Node evaluate(Node call);
}
