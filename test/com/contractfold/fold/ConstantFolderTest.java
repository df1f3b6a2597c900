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

import static com.contractfold.ast.testing.NodeSubject.assertNode;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.contractfold.ast.IR;
import com.contractfold.ast.Node;
import com.contractfold.ast.Operator;
import com.contractfold.ast.Token;
import com.contractfold.ast.types.AnnotationTypeResolver;
import com.contractfold.ast.types.ArrayType;
import com.contractfold.ast.types.PrimitiveType;
import com.contractfold.ast.types.TypeResolutionException;
import com.contractfold.fold.builtins.BuiltinFunctionTable;
import java.math.BigInteger;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** End to end tests for {@link ConstantFolder}. */
@RunWith(JUnit4.class)
public final class ConstantFolderTest {

  private FoldOptions options;

  @Before
  public void setUp() {
    options = new FoldOptions();
  }

  private ConstantFolder process(Node module) {
    ConstantFolder folder = new ConstantFolder(options);
    folder.process(module);
    return folder;
  }

  private static Node uint256() {
    return IR.name("uint256");
  }

  @Test
  public void testConstantChain() {
    // FOO: constant(uint256) = 2 ** 8
    // BAR: constant(uint256) = FOO - 1
    // x: uint256[BAR + 1]
    Node module =
        IR.module(
            IR.constantDeclaration("FOO", uint256(), IR.pow(IR.number(2), IR.number(8))),
            IR.constantDeclaration("BAR", uint256(), IR.sub(IR.name("FOO"), IR.number(1))),
            IR.annAssign(
                IR.name("x"),
                IR.subscript(uint256(), IR.add(IR.name("BAR"), IR.number(1)))));

    process(module);

    assertNode(module.getFirstChild().getLastChild()).isInt(256);
    assertNode(module.getSecondChild().getLastChild()).isInt(255);
    Node annotation = module.getLastChild().getSecondChild();
    assertNode(annotation).isEqualTo(IR.subscript(uint256(), IR.number(256)));
  }

  @Test
  public void testStatistics() {
    // FOO: constant(uint256) = 1 + 2
    // x = FOO
    Node module =
        IR.module(
            IR.constantDeclaration("FOO", uint256(), IR.add(IR.number(1), IR.number(2))),
            IR.assign(IR.name("x"), IR.name("FOO")));

    ConstantFolder folder = process(module);

    assertThat(folder.getLastSweepCount()).isEqualTo(3);
    assertThat(folder.getLastChangeCount()).isEqualTo(2);
    assertNode(module.getSecondChild().getSecondChild()).isInt(3).hasType(PrimitiveType.UINT256);
  }

  @Test
  public void testOverflowingResultLosesDeclaredType() {
    // A: constant(uint256) = 5
    // B: constant(uint8) = 200
    // C: constant(uint8) = 100
    // x = -A
    // y = B + C
    Node module =
        IR.module(
            IR.constantDeclaration("A", uint256(), IR.number(5)),
            IR.constantDeclaration("B", IR.name("uint8"), IR.number(200)),
            IR.constantDeclaration("C", IR.name("uint8"), IR.number(100)),
            IR.assign(IR.name("x"), IR.neg(IR.name("A"))),
            IR.assign(IR.name("y"), IR.add(IR.name("B"), IR.name("C"))));

    process(module);

    assertNode(module.getChildAtIndex(3).getSecondChild()).isInt(-5).hasType(null);
    assertNode(module.getLastChild().getSecondChild()).isInt(300).hasType(null);
  }

  @Test
  public void testDeepExpressionFoldsInOneSweep() {
    Node sum = IR.number(1);
    for (int i = 0; i < 50; i++) {
      sum = IR.add(sum, IR.number(1));
    }
    Node module = IR.module(IR.exprResult(sum));

    ConstantFolder folder = process(module);

    assertNode(module.getFirstChild().getOnlyChild()).isInt(51);
    assertThat(folder.getLastSweepCount()).isEqualTo(2);
    assertThat(folder.getLastChangeCount()).isEqualTo(50);
  }

  @Test
  public void testFoldingIsIdempotent() {
    Node module =
        IR.module(
            IR.constantDeclaration("A", uint256(), IR.mul(IR.number(3), IR.number(4))),
            IR.constantDeclaration(
                "ARR",
                IR.subscript(uint256(), IR.number(2)),
                IR.list(IR.name("A"), IR.add(IR.name("A"), IR.number(1)))),
            IR.assign(IR.name("x"), IR.subscript(IR.name("ARR"), IR.number(1))),
            IR.assign(IR.name("y"), IR.call(IR.name("min"), IR.name("A"), IR.name("MAX_INT128"))));

    process(module);
    Node once = module.cloneTree();
    ConstantFolder folder = process(module);

    assertThat(folder.getLastChangeCount()).isEqualTo(0);
    assertThat(folder.getLastSweepCount()).isEqualTo(1);
    assertNode(module).isEqualToTyped(once);
    assertNode(module.getChildAtIndex(2).getSecondChild()).isInt(13);
    assertNode(module.getChildAtIndex(3).getSecondChild()).isInt(12);
  }

  @Test
  public void testMaxInt128Expression() {
    Node module =
        IR.module(
            IR.exprResult(IR.sub(IR.pow(IR.number(2), IR.number(127)), IR.number(1))));

    process(module);

    assertNode(module.getFirstChild().getOnlyChild()).isInt(NumericBounds.MAX_INT128);
  }

  @Test
  public void testArrayConstantIndex() {
    // ARR: constant(int128[3]) = [1, 2, 3]
    // x = ARR[1]
    Node module =
        IR.module(
            IR.constantDeclaration(
                "ARR",
                IR.subscript(IR.name("int128"), IR.number(3)),
                IR.list(IR.number(1), IR.number(2), IR.number(3))),
            IR.assign(IR.name("x"), IR.subscript(IR.name("ARR"), IR.number(1))));

    process(module);

    assertNode(module.getSecondChild().getSecondChild()).isInt(2).hasType(PrimitiveType.INT128);
  }

  @Test
  public void testArrayConstantWithConstantLength() {
    // N: constant(uint256) = 2
    // ARR: constant(uint8[N]) = [1, 2]
    // y = ARR
    Node module =
        IR.module(
            IR.constantDeclaration("N", uint256(), IR.number(2)),
            IR.constantDeclaration(
                "ARR",
                IR.subscript(IR.name("uint8"), IR.name("N")),
                IR.list(IR.number(1), IR.number(2))),
            IR.assign(IR.name("y"), IR.name("ARR")));

    process(module);

    assertNode(module.getLastChild().getSecondChild())
        .hasType(new ArrayType(PrimitiveType.UINT8, 2));
  }

  @Test
  public void testForwardReferenceInTypeFails() {
    Node module =
        IR.module(
            IR.constantDeclaration(
                "ARR", IR.subscript(IR.name("uint8"), IR.name("N")), IR.list(IR.number(1))),
            IR.constantDeclaration("N", uint256(), IR.number(1)));

    assertThrows(TypeResolutionException.class, () -> process(module));
  }

  @Test
  public void testForwardReferenceInValueFolds() {
    // B: constant(uint256) = A + 1
    // A: constant(uint256) = 1
    Node module =
        IR.module(
            IR.constantDeclaration("B", uint256(), IR.add(IR.name("A"), IR.number(1))),
            IR.constantDeclaration("A", uint256(), IR.number(1)),
            IR.exprResult(IR.name("B")));

    process(module);

    assertNode(module.getLastChild().getOnlyChild()).isInt(2);
  }

  @Test
  public void testExcludedReferencesSurvive() {
    Node module =
        IR.module(
            IR.constantDeclaration("FOO", uint256(), IR.number(1)),
            IR.exprResult(IR.call(IR.name("FOO"), IR.name("FOO"))),
            IR.exprResult(IR.dict(IR.name("FOO"), IR.name("FOO"))),
            IR.assign(IR.name("FOO"), IR.name("FOO")));

    process(module);

    assertNode(module.getChildAtIndex(1).getOnlyChild())
        .isEqualTo(IR.call(IR.name("FOO"), IR.number(1)));
    assertNode(module.getChildAtIndex(2).getOnlyChild())
        .isEqualTo(IR.dict(IR.name("FOO"), IR.number(1)));
    assertNode(module.getChildAtIndex(3)).isEqualTo(IR.assign(IR.name("FOO"), IR.number(1)));
    assertThat(module.getDescendants(Token.NAME)).hasSize(6);
  }

  @Test
  public void testExclusionsAndValueUse() {
    // x: constant(int128) = 5
    // x(7)
    // {x: 1}
    // x[0] = 2
    // y = x + 1
    Node module =
        IR.module(
            IR.constantDeclaration("x", IR.name("int128"), IR.number(5)),
            IR.exprResult(IR.call(IR.name("x"), IR.number(7))),
            IR.exprResult(IR.dict(IR.name("x"), IR.number(1))),
            IR.assign(IR.subscript(IR.name("x"), IR.number(0)), IR.number(2)),
            IR.assign(IR.name("y"), IR.add(IR.name("x"), IR.number(1))));

    process(module);

    assertNode(module.getChildAtIndex(1).getOnlyChild())
        .isEqualTo(IR.call(IR.name("x"), IR.number(7)));
    assertNode(module.getChildAtIndex(2).getOnlyChild())
        .isEqualTo(IR.dict(IR.name("x"), IR.number(1)));
    assertNode(module.getChildAtIndex(3).getFirstChild())
        .isEqualTo(IR.subscript(IR.name("x"), IR.number(0)));
    assertNode(module.getChildAtIndex(4).getSecondChild()).isInt(6);
  }

  @Test
  public void testBuiltinConstants() {
    Node module = IR.module(IR.exprResult(IR.sub(IR.name("MAX_UINT256"), IR.number(1))));

    ConstantFolder folder = process(module);

    assertNode(module.getFirstChild().getOnlyChild())
        .isInt(BigInteger.ONE.shiftLeft(256).subtract(BigInteger.valueOf(2)));
    assertThat(folder.getLastChangeCount()).isEqualTo(2);
  }

  @Test
  public void testBuiltinConstantsDisabled() {
    options.setFoldBuiltinConstants(false);
    Node module = IR.module(IR.exprResult(IR.name("MAX_UINT256")));

    process(module);

    assertNode(module.getFirstChild().getOnlyChild()).isEqualTo(IR.name("MAX_UINT256"));
  }

  @Test
  public void testBuiltinCalls() {
    // x = as_wei_value(FOO, "gwei") where FOO = 1.5
    Node module =
        IR.module(
            IR.constantDeclaration("FOO", IR.name("decimal"), IR.decimal("1.5")),
            IR.assign(
                IR.name("x"), IR.call(IR.name("as_wei_value"), IR.name("FOO"), IR.string("gwei"))));

    process(module);

    assertNode(module.getSecondChild().getSecondChild()).isInt(1500000000);
  }

  @Test
  public void testBuiltinCallsDisabled() {
    options.setFoldBuiltinCalls(false);
    Node call = IR.call(IR.name("floor"), IR.decimal("1.5"));
    Node module = IR.module(IR.exprResult(call));

    process(module);

    assertThat(module.getFirstChild().getOnlyChild()).isSameInstanceAs(call);
  }

  @Test
  public void testOpaqueBuiltinLeftAlone() {
    Node call = IR.call(IR.name("raw_call"), IR.string("abc"));
    Node module = IR.module(IR.exprResult(call));

    process(module);

    assertThat(module.getFirstChild().getOnlyChild()).isSameInstanceAs(call);
  }

  @Test
  public void testBuiltinResultFeedsOperations() {
    Node module =
        IR.module(
            IR.exprResult(
                IR.compare(
                    Operator.GT,
                    IR.call(IR.name("len"), IR.string("hello")),
                    IR.number(3))));

    process(module);

    assertNode(module.getFirstChild().getOnlyChild()).isBool(true);
  }

  @Test
  public void testSweepLimit() {
    options.setMaxSweeps(1);
    Node module =
        IR.module(
            IR.constantDeclaration("FOO", uint256(), IR.add(IR.number(1), IR.number(2))),
            IR.exprResult(IR.name("FOO")));

    assertThrows(IllegalStateException.class, () -> process(module));
  }

  @Test
  public void testRootMustBeModule() {
    assertThrows(
        IllegalArgumentException.class, () -> process(IR.exprResult(IR.name("MAX_UINT256"))));
  }

  @Test
  public void testStaticFold() {
    Node module = IR.module(IR.exprResult(IR.not(IR.falseNode())));

    ConstantFolder.fold(module);

    assertNode(module.getFirstChild().getOnlyChild()).isBool(true);
  }

  @Test
  public void testCustomBuiltinTable() {
    ConstantFolder folder =
        new ConstantFolder(
            options, new AnnotationTypeResolver(), BuiltinFunctionTable.builder().build());
    Node call = IR.call(IR.name("floor"), IR.decimal("1.5"));
    Node module = IR.module(IR.exprResult(call));

    folder.process(module);

    assertThat(module.getFirstChild().getOnlyChild()).isSameInstanceAs(call);
  }
}
