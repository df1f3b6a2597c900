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
import static com.google.common.base.Preconditions.checkNotNull;

import com.contractfold.ast.Node;
import com.contractfold.ast.types.AnnotationTypeResolver;
import com.contractfold.ast.types.TypeResolver;
import com.contractfold.fold.builtins.BuiltinFunctionTable;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.util.logging.Logger;

/**
 * Replaces every expression whose value is known at compile time by a literal holding that value.
 *
 * <p>Builtin constants are substituted first. The remaining passes then run in a fixed order,
 * sweep after sweep, until a sweep changes nothing. Because each pass replaces only what it can
 * evaluate, the result is the same however many sweeps it takes:
 *
 * <pre>
 * FOO: constant(uint256) = 2 ** 8
 * BAR: constant(uint256) = FOO - 1
 * x: uint256[BAR + 1]
 * </pre>
 *
 * becomes {@code x: uint256[256]}.
 *
 * <p>Expressions that cannot be evaluated are left alone; reporting them is the type checker's
 * job.
 */
public final class ConstantFolder implements CompilerPass {

  private static final Logger logger = Logger.getLogger(ConstantFolder.class.getName());

  private final FoldOptions options;
  private final FoldingPass builtinConstants;
  private final ImmutableList<FoldingPass> passes;

  private int lastSweepCount;
  private int lastChangeCount;

  public ConstantFolder() {
    this(new FoldOptions());
  }

  public ConstantFolder(FoldOptions options) {
    this(options, new AnnotationTypeResolver(), BuiltinFunctionTable.getDefault());
  }

  public ConstantFolder(
      FoldOptions options, TypeResolver typeResolver, BuiltinFunctionTable builtins) {
    this.options = checkNotNull(options);
    this.builtinConstants = new SubstituteBuiltinConstants();
    ImmutableList.Builder<FoldingPass> passes = ImmutableList.builder();
    passes.add(
        new SubstituteUserConstants(checkNotNull(typeResolver)),
        new FoldLiteralOperations(),
        new FoldSubscripts());
    if (options.shouldFoldBuiltinCalls()) {
      passes.add(new FoldBuiltinCalls(checkNotNull(builtins)));
    }
    this.passes = passes.build();
  }

  /** Folds {@code module} with the default options. */
  public static void fold(Node module) {
    new ConstantFolder().process(module);
  }

  @Override
  public void process(Node root) {
    checkArgument(root.isModule(), "Expected a module: %s", root);

    int changes = 0;
    if (options.shouldFoldBuiltinConstants()) {
      changes += builtinConstants.process(root);
    }

    int sweeps = 0;
    int changesInSweep;
    do {
      if (sweeps == options.getMaxSweeps()) {
        throw new IllegalStateException(
            "Constant folding did not finish after " + sweeps + " sweeps");
      }
      sweeps++;
      changesInSweep = 0;
      for (FoldingPass pass : passes) {
        changesInSweep += pass.process(root);
      }
      changes += changesInSweep;
    } while (changesInSweep > 0);

    lastSweepCount = sweeps;
    lastChangeCount = changes;
    logger.fine("Folded " + changes + " nodes in " + sweeps + " sweeps");
  }

  /** The number of sweeps the last run took, counting the final one that changed nothing. */
  @VisibleForTesting
  public int getLastSweepCount() {
    return lastSweepCount;
  }

  /** The number of nodes the last run replaced. */
  @VisibleForTesting
  public int getLastChangeCount() {
    return lastChangeCount;
  }
}
