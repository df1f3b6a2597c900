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

package com.contractfold.fold.builtins;

import static com.contractfold.ast.testing.NodeSubject.assertNode;
import static com.google.common.truth.Truth.assertThat;

import com.contractfold.ast.IR;
import com.contractfold.ast.Node;
import com.contractfold.ast.Token;
import org.jspecify.nullness.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BytesBuiltinsTest {

  private static final String SHA256_ABC =
      "0xba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

  private static final String KECCAK256_ABC =
      "0x4e03657aea45a94fc7d47ba826c8d667c0d1e6e33a64a036ec44f58fa12d6c45";

  private static @Nullable Node evaluate(String name, Node... arguments) {
    FoldableBuiltin builtin = (FoldableBuiltin) BuiltinFunctionTable.getDefault().get(name);
    return builtin.evaluate(IR.call(IR.name(name), arguments));
  }

  @Test
  public void testLen() {
    assertNode(evaluate("len", IR.string("hello"))).isInt(5);
    assertNode(evaluate("len", IR.string(""))).isInt(0);
    assertNode(evaluate("len", IR.bytes(new byte[] {1, 2, 3}))).isInt(3);
    assertNode(evaluate("len", IR.hex("0x00ff00ff"))).isInt(4);
    assertThat(evaluate("len", IR.number(5))).isNull();
    assertThat(evaluate("len", IR.list(IR.number(1)))).isNull();
  }

  @Test
  public void testSha256OfString() {
    assertNode(evaluate("sha256", IR.string("abc"))).hasToken(Token.HEX).hasStringValue(SHA256_ABC);
  }

  @Test
  public void testSha256OfBytesAndHexAgree() {
    assertNode(evaluate("sha256", IR.bytes("abc"))).hasStringValue(SHA256_ABC);
    assertNode(evaluate("sha256", IR.hex("0x616263"))).hasStringValue(SHA256_ABC);
    assertNode(evaluate("sha256", IR.hex("0x616263")))
        .isEqualTo(IR.hex("0x" + SHA256_ABC.substring(2).toUpperCase()));
  }

  @Test
  public void testSha256OfEmptyBytes() {
    assertNode(evaluate("sha256", IR.bytes(new byte[0])))
        .hasStringValue("0xe3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
  }

  @Test
  public void testSha256NotFolded() {
    assertThat(evaluate("sha256", IR.hex("0x123"))).isNull();
    assertThat(evaluate("sha256", IR.hex("0xzz"))).isNull();
    assertThat(evaluate("sha256", IR.hex("0x12g4"))).isNull();
    assertThat(evaluate("sha256", IR.number(1))).isNull();
  }

  @Test
  public void testKeccak256() {
    assertNode(evaluate("keccak256", IR.string("abc")))
        .hasToken(Token.HEX)
        .hasStringValue(KECCAK256_ABC);
    assertNode(evaluate("keccak256", IR.bytes("abc"))).hasStringValue(KECCAK256_ABC);
    assertNode(evaluate("keccak256", IR.hex("0x616263"))).hasStringValue(KECCAK256_ABC);
    assertNode(evaluate("keccak256", IR.string("")))
        .hasStringValue("0xc5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470");
  }

  @Test
  public void testKeccak256NotFolded() {
    assertThat(evaluate("keccak256", IR.hex("0xzz"))).isNull();
    assertThat(evaluate("keccak256", IR.number(1))).isNull();
    assertThat(evaluate("keccak256", IR.string("a"), IR.string("b"))).isNull();
  }
}
