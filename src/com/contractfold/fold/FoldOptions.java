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

import static com.google.common.base.Preconditions.checkArgument;

/** Options for {@link ConstantFolder}. */
public class FoldOptions {

  public static final int DEFAULT_MAX_SWEEPS = 10000;

  private int maxSweeps = DEFAULT_MAX_SWEEPS;

  private boolean foldBuiltinConstants = true;

  private boolean foldBuiltinCalls = true;

  /**
   * Sets the number of sweeps after which the folder gives up. Every sweep but the last replaces
   * at least one node, so this is only reached when an evaluator keeps producing nodes it can
   * fold again.
   */
  public void setMaxSweeps(int maxSweeps) {
    checkArgument(maxSweeps > 0, "maxSweeps must be positive: %s", maxSweeps);
    this.maxSweeps = maxSweeps;
  }

  public int getMaxSweeps() {
    return maxSweeps;
  }

  /** Whether names such as {@code MAX_UINT256} are replaced by their values. */
  public void setFoldBuiltinConstants(boolean foldBuiltinConstants) {
    this.foldBuiltinConstants = foldBuiltinConstants;
  }

  public boolean shouldFoldBuiltinConstants() {
    return foldBuiltinConstants;
  }

  public void setFoldBuiltinCalls(boolean foldBuiltinCalls) {
    this.foldBuiltinCalls = foldBuiltinCalls;
  }

  public boolean shouldFoldBuiltinCalls() {
    return foldBuiltinCalls;
  }
}
