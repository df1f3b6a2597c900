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

import com.contractfold.ast.Node;
import com.contractfold.ast.Token;
import com.google.common.collect.ImmutableSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.nullness.Nullable;

/**
 * A folding pass that evaluates every node of some kinds and replaces the ones that evaluate to
 * a value.
 *
 * <p>Candidates are visited children first, so an operation whose operands fold in this pass sees
 * the folded operands by the time it is evaluated.
 */
abstract class AbstractFoldingPass implements FoldingPass {

  private static final Logger logger = Logger.getLogger(AbstractFoldingPass.class.getName());

  private final ImmutableSet<Token> candidateTokens;

  AbstractFoldingPass(ImmutableSet<Token> candidateTokens) {
    this.candidateTokens = candidateTokens;
  }

  /**
   * Evaluates a candidate node.
   *
   * @param n A node whose token is one of the candidate tokens
   * @return A new detached node holding the value of {@code n}, or null if {@code n} cannot be
   *     folded. Returning null is never an error: the type checker reports the cases that matter.
   */
  abstract @Nullable Node tryFold(Node n);

  @Override
  public final int process(Node module) {
    int changedNodes = 0;
    for (Node n : module.getDescendants(candidateTokens, true)) {
      Node folded = tryFold(n);
      if (folded == null) {
        if (logger.isLoggable(Level.FINEST)) {
          logger.finest(getClass().getSimpleName() + " skipped " + n);
        }
        continue;
      }
      NodeUtil.replaceInTree(module, n, folded);
      changedNodes++;
    }
    return changedNodes;
  }
}
