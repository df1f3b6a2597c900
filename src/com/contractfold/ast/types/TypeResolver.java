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

import com.contractfold.ast.Node;

/** Turns a type annotation expression into a {@link TypeDescriptor}. */
public interface TypeResolver {

  /**
   * Resolves the type written by {@code annotation}.
   *
   * @param annotation the annotation expression, e.g. the {@code int128[3]} in {@code
   *     constant(int128[3])}
   * @throws TypeResolutionException if the annotation does not name a type
   */
  TypeDescriptor resolve(Node annotation);
}
