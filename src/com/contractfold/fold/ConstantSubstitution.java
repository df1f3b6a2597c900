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
import com.contractfold.ast.types.TypeDescriptor;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.nullness.Nullable;

/**
 * Replaces references to a named constant with its literal value.
 *
 * <p>A reference is left alone when it is the callee of a call, a dict key, or written to by an
 * assignment. Substituting there would produce a tree that calls or assigns to a literal.
 */
final class ConstantSubstitution {

  private static final Logger logger = Logger.getLogger(ConstantSubstitution.class.getName());

  private ConstantSubstitution() {}

  /**
   * Replace references to a variable name with a literal value.
   *
   * @param module Module node to perform replacement in
   * @param name The name whose references are replaced
   * @param value The literal, or list of literals, to substitute. It is copied for every reference
   *     and never attached itself.
   * @param raiseOnError Whether a reference that cannot be replaced is an internal error. When
   *     false such references are skipped.
   * @param type Type to attach to the substituted literals, or null
   * @return Number of nodes that were replaced
   */
  static int replaceConstant(
      Node module,
      String name,
      Node value,
      boolean raiseOnError,
      @Nullable TypeDescriptor type) {
    int changedNodes = 0;

    ImmutableList<Node> references =
        module.getDescendants(ImmutableSet.of(Token.NAME), n -> n.matchesName(name), true, false);
    for (Node reference : references) {
      String exclusion = getExclusion(reference);
      if (exclusion != null) {
        checkState(
            !raiseOnError,
            "Cannot substitute %s used as %s at %s",
            name,
            exclusion,
            reference.getLocation());
        continue;
      }

      Node replacement = buildReplacement(reference, value, type);
      if (replacement == null) {
        checkState(!raiseOnError, "Value of %s is not a literal: %s", name, value);
        if (logger.isLoggable(Level.FINEST)) {
          logger.finest("Value of " + name + " is not folded yet at " + reference.getLocation());
        }
        continue;
      }

      NodeUtil.replaceInTree(module, reference, replacement);
      changedNodes++;
    }

    if (changedNodes > 0) {
      logger.fine("Substituted " + changedNodes + " reference(s) to " + name);
    }
    return changedNodes;
  }

  /** Returns why {@code reference} must not be substituted, or null if it may be. */
  private static @Nullable String getExclusion(Node reference) {
    if (NodeUtil.isCallTarget(reference)) {
      return "a call target";
    }
    if (NodeUtil.isDictKey(reference)) {
      return "a dict key";
    }
    if (NodeUtil.isInAssignmentTarget(reference)) {
      return "an assignment target";
    }
    return null;
  }

  /**
   * Copies {@code value} for substitution at {@code reference}.
   *
   * <p>The copy takes the position of the reference. A literal copy takes {@code type}; a list
   * copy takes {@code type} and its elements take the element type of {@code type}.
   *
   * @return The copy, or null if {@code value} is not made of literals
   */
  private static @Nullable Node buildReplacement(
      Node reference, Node value, @Nullable TypeDescriptor type) {
    if (value.isLiteral()) {
      Node literal = value.cloneTree().srcref(reference);
      if (type != null) {
        literal.setTypeDescriptor(type);
      }
      return literal;
    }

    if (value.isList()) {
      checkState(
          type == null || type.isArrayType(),
          "List value declared with non-sequence type %s at %s",
          type,
          value.getLocation());
      TypeDescriptor elementType = type == null ? null : type.getValueType();
      Node list = new Node(Token.LIST).srcref(reference);
      for (Node element : value.children()) {
        Node replacement = buildReplacement(reference, element, elementType);
        if (replacement == null) {
          return null;
        }
        list.addChildToBack(replacement);
      }
      if (type != null) {
        list.setTypeDescriptor(type);
      }
      return list;
    }

    return null;
  }
}
