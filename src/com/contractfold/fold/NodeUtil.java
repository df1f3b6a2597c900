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

import static com.google.common.base.Preconditions.checkState;

import com.contractfold.ast.Node;
import com.contractfold.ast.Token;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  /**
   * Swaps {@code replacement} into the position of {@code old}.
   *
   * @throws IllegalStateException if {@code old} is no longer part of the tree under {@code
   *     root}, which means it was replaced or removed already
   */
  public static void replaceInTree(Node root, Node old, Node replacement) {
    checkState(
        old.hasParent() && old.isDescendantOf(root),
        "Node is not attached to the tree, it may have been replaced already: %s",
        old);
    old.replaceWith(replacement);
  }

  /** Whether {@code n} is the callee of its parent CALL, as {@code f} in {@code f(x)}. */
  public static boolean isCallTarget(Node n) {
    Node parent = n.getParent();
    return parent != null && parent.isCall() && parent.getFirstChild() == n;
  }

  /** Whether {@code n} is a key of its parent DICT. */
  public static boolean isDictKey(Node n) {
    Node parent = n.getParent();
    return parent != null && parent.isDict() && parent.getIndexOfChild(n) % 2 == 0;
  }

  /**
   * Whether {@code n} lies within the target of an assignment and is written to by it.
   *
   * <p>Nodes under an INDEX are read, not written: the {@code i} in {@code a[i] = 1} is an
   * ordinary value even though it sits inside the target.
   */
  public static boolean isInAssignmentTarget(Node n) {
    if (n.getEnclosing(Token.INDEX) != null) {
      return false;
    }
    Node assign = n.getEnclosing(Token.ASSIGNMENTS);
    return assign != null && n.isDescendantOf(assign.getFirstChild());
  }

  /** Whether {@code n} is a literal or a list whose elements are, recursively, literal values. */
  public static boolean isLiteralValue(Node n) {
    if (n.isLiteral()) {
      return true;
    }
    if (!n.isList()) {
      return false;
    }
    for (Node element : n.children()) {
      if (!isLiteralValue(element)) {
        return false;
      }
    }
    return true;
  }

  /** Whether all children of {@code n} have the same token. */
  public static boolean hasUniformChildren(Node n) {
    Node first = n.getFirstChild();
    for (Node c = first; c != null; c = c.getNext()) {
      if (c.getToken() != first.getToken()) {
        return false;
      }
    }
    return true;
  }

  /** Whether two literals of the same kind hold the same value. */
  static boolean literalEquals(Node a, Node b) {
    checkState(a.isLiteral() && a.getToken() == b.getToken(), "Cannot compare %s and %s", a, b);
    return a.isEquivalentTo(b);
  }
}
