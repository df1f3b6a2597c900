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

import com.contractfold.ast.IR;
import com.contractfold.ast.Node;
import com.contractfold.ast.Token;
import com.contractfold.ast.types.ArrayType;
import com.contractfold.ast.types.PrimitiveType;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link FoldSubscripts}. */
@RunWith(JUnit4.class)
public final class FoldSubscriptsTest {

  private static Node fold(Node expression) {
    Node module = IR.module(IR.exprResult(expression));
    new FoldSubscripts().process(module);
    return module.getFirstChild().getOnlyChild();
  }

  private static Node ints(long... values) {
    Node list = new Node(Token.LIST);
    for (long value : values) {
      list.addChildToBack(IR.number(value));
    }
    return list;
  }

  private static void assertNotFolded(Node expression) {
    Node expected = expression.cloneTree();
    assertNode(fold(expression)).isEqualTo(expected);
  }

  @Test
  public void testFoldIndex() {
    assertNode(fold(IR.subscript(ints(1, 2, 3), IR.number(0)))).isInt(1);
    assertNode(fold(IR.subscript(ints(1, 2, 3), IR.number(2)))).isInt(3);
  }

  @Test
  public void testFoldNestedLists() {
    Node nested = IR.list(ints(1, 2), ints(3, 4));

    assertNode(fold(IR.subscript(nested.cloneTree(), IR.number(1)))).isEqualTo(ints(3, 4));
    assertNode(fold(IR.subscript(IR.subscript(nested, IR.number(1)), IR.number(0)))).isInt(3);
  }

  @Test
  public void testIndexOutOfRangeNotFolded() {
    assertNotFolded(IR.subscript(ints(1, 2, 3), IR.number(3)));
    assertNotFolded(IR.subscript(ints(1, 2, 3), IR.number(-1)));
    assertNotFolded(IR.subscript(IR.list(), IR.number(0)));
  }

  @Test
  public void testNonLiteralIndexOrListNotFolded() {
    assertNotFolded(IR.subscript(ints(1, 2, 3), IR.name("i")));
    assertNotFolded(IR.subscript(ints(1, 2, 3), IR.decimal("1.0")));
    assertNotFolded(IR.subscript(IR.name("xs"), IR.number(0)));
    assertNotFolded(IR.subscript(IR.list(IR.number(1), IR.name("x")), IR.number(0)));
    assertNotFolded(IR.subscript(IR.list(IR.number(1), IR.decimal("1.0")), IR.number(0)));
  }

  @Test
  public void testSubscriptInAssignmentTargetNotFolded() {
    Node target = IR.subscript(ints(1, 2, 3), IR.number(0));
    Node module = IR.module(IR.assign(target, IR.number(5)));

    assertThat(new FoldSubscripts().process(module)).isEqualTo(0);
    assertThat(module.getFirstChild().getFirstChild()).isSameInstanceAs(target);
  }

  @Test
  public void testSubscriptInAssignmentValueFolded() {
    Node module =
        IR.module(IR.assign(IR.name("x"), IR.subscript(ints(1, 2, 3), IR.number(1))));

    assertThat(new FoldSubscripts().process(module)).isEqualTo(1);
    assertNode(module.getFirstChild().getSecondChild()).isInt(2);
  }

  @Test
  public void testSubscriptInsideTargetIndexFolded() {
    // xs[[1, 2][0]] = 5
    Node index = IR.subscript(ints(1, 2), IR.number(0));
    Node module = IR.module(IR.assign(IR.subscript(IR.name("xs"), index), IR.number(5)));

    assertThat(new FoldSubscripts().process(module)).isEqualTo(1);
    assertNode(module.getFirstChild().getFirstChild())
        .isEqualTo(IR.subscript(IR.name("xs"), IR.number(1)));
  }

  @Test
  public void testElementTakesListValueType() {
    Node list = ints(1, 2, 3).setTypeDescriptor(new ArrayType(PrimitiveType.INT128, 3));

    assertNode(fold(IR.subscript(list, IR.number(1)))).isInt(2).hasType(PrimitiveType.INT128);
  }

  @Test
  public void testElementKeepsOwnType() {
    Node list = ints(1, 2, 3).setTypeDescriptor(new ArrayType(PrimitiveType.INT128, 3));
    list.getSecondChild().setTypeDescriptor(PrimitiveType.UINT8);

    assertNode(fold(IR.subscript(list, IR.number(1)))).hasType(PrimitiveType.UINT8);
  }

  @Test
  public void testResultTakesPositionOfSubscript() {
    Node list = IR.list(ints(1, 2));
    list.srcrefTree(IR.name("p").setSourcePosition("a.vy", 1, 1));
    Node subscript = IR.subscript(list, IR.number(0));
    subscript.setSourcePosition("a.vy", 9, 3);

    Node folded = fold(subscript);

    assertNode(folded).isEqualTo(ints(1, 2));
    assertNode(folded).hasLineno(9).hasCharno(3);
    assertNode(folded.getFirstChild()).hasLineno(9).hasCharno(3);
  }
}
