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
import com.contractfold.ast.types.TypeDescriptor;
import com.contractfold.ast.types.TypeResolver;
import java.util.logging.Logger;

/**
 * Finds module constants, {@code NAME: constant(type) = value}, and replaces references to them
 * with their values.
 *
 * <p>A constant whose value is not folded yet is skipped; the other passes fold the value in
 * place and a later sweep substitutes it. References the substitution must not touch are skipped
 * silently and left for the type checker.
 */
final class SubstituteUserConstants implements FoldingPass {

  private static final Logger logger = Logger.getLogger(SubstituteUserConstants.class.getName());

  private static final String CONSTANT_MARKER = "constant";

  private final TypeResolver typeResolver;

  SubstituteUserConstants(TypeResolver typeResolver) {
    this.typeResolver = typeResolver;
  }

  @Override
  public int process(Node module) {
    int changedNodes = 0;

    for (Node declaration : module.getChildren(Token.ANN_ASSIGN)) {
      Node target = declaration.getFirstChild();
      if (!target.isName()) {
        // left-hand side of the assignment is not a variable
        continue;
      }
      Node annotation = declaration.getSecondChild();
      if (!isConstantMarker(annotation)) {
        continue;
      }
      Node value = annotation.getNext();
      if (value == null) {
        logger.fine("Constant " + target.getString() + " has no value");
        continue;
      }

      // Resolve the declared type; `constant()` declares none.
      Node typeExpression = annotation.getSecondChild();
      TypeDescriptor type =
          typeExpression == null ? null : typeResolver.resolve(typeExpression);

      changedNodes +=
          ConstantSubstitution.replaceConstant(module, target.getString(), value, false, type);
    }

    return changedNodes;
  }

  private static boolean isConstantMarker(Node annotation) {
    return annotation.isCall() && annotation.getFirstChild().matchesName(CONSTANT_MARKER);
  }
}
