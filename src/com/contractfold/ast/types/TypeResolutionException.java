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

package com.contractfold.ast.types;

import static com.google.common.base.Preconditions.checkNotNull;

import com.contractfold.ast.DiagnosticType;
import com.contractfold.ast.Node;

/** Thrown when a type annotation cannot be resolved. */
public class TypeResolutionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final DiagnosticType type;
  private final transient Node node;

  public TypeResolutionException(DiagnosticType type, Node node, Object... arguments) {
    super(node.getLocation() + ": " + type.format(arguments));
    this.type = checkNotNull(type);
    this.node = node;
  }

  public DiagnosticType getType() {
    return type;
  }

  /** The annotation node that failed to resolve. */
  public Node getNode() {
    return node;
  }
}
