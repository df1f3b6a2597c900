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
import com.google.common.collect.ImmutableSet;
import java.math.BigInteger;
import org.jspecify.nullness.Nullable;

/** Folds constant indexes into literal lists, e.g. {@code [1, 2, 3][1]} to {@code 2}. */
class FoldSubscripts extends AbstractFoldingPass {

  FoldSubscripts() {
    super(ImmutableSet.of(Token.SUBSCRIPT));
  }

  @Override
  @Nullable Node tryFold(Node n) {
    if (NodeUtil.isInAssignmentTarget(n)) {
      return null;
    }

    Node list = n.getFirstChild();
    Node index = n.getLastChild().getOnlyChild();
    if (!list.isList() || !index.isInt()) {
      return null;
    }
    if (!NodeUtil.isLiteralValue(list) || !NodeUtil.hasUniformChildren(list)) {
      return null;
    }

    BigInteger position = index.getInt();
    if (position.signum() < 0
        || position.compareTo(BigInteger.valueOf(list.getChildCount())) >= 0) {
      // Out of range; left in place so the type checker can report it.
      return null;
    }

    Node element = list.getChildAtIndex(position.intValue());
    Node result = element.cloneTree().srcrefTree(n);
    TypeDescriptor listType = list.getTypeDescriptor();
    if (result.getTypeDescriptor() == null && listType != null && listType.isArrayType()) {
      result.setTypeDescriptor(listType.getValueType());
    }
    return result;
  }
}
