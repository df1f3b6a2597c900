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
import java.math.BigInteger;
import org.jspecify.nullness.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class AsWeiValueTest {

  private static @Nullable Node asWeiValue(Node value, String unit) {
    return new AsWeiValue()
        .evaluate(IR.call(IR.name("as_wei_value"), value, IR.string(unit)));
  }

  @Test
  public void testIntegerAmounts() {
    assertNode(asWeiValue(IR.number(5), "wei")).isInt(5);
    assertNode(asWeiValue(IR.number(1), "ether")).isInt(BigInteger.TEN.pow(18));
    assertNode(asWeiValue(IR.number(2), "nanoether")).isInt(2000000000L);
    assertNode(asWeiValue(IR.number(3), "gwei")).isInt(3000000000L);
    assertNode(asWeiValue(IR.number(2), "grand")).isInt(BigInteger.TEN.pow(21).shiftLeft(1));
  }

  @Test
  public void testAliasesAgree() {
    for (String[] aliases :
        new String[][] {
          {"kwei", "babbage"},
          {"kwei", "femtoether"},
          {"mwei", "lovelace"},
          {"mwei", "picoether"},
          {"gwei", "shannon"},
          {"gwei", "nanoether"},
          {"szabo", "microether"},
          {"finney", "milliether"},
          {"kether", "grand"}
        }) {
      assertThat(AsWeiValue.DENOMINATIONS.get(aliases[0]))
          .isEqualTo(AsWeiValue.DENOMINATIONS.get(aliases[1]));
    }
  }

  @Test
  public void testDecimalAmountsAreFloored() {
    assertNode(asWeiValue(IR.decimal("1.5"), "gwei")).isInt(1500000000L);
    assertNode(asWeiValue(IR.decimal("0.5"), "wei")).isInt(0);
    assertNode(asWeiValue(IR.decimal("2.9999"), "kwei")).isInt(2999);
  }

  @Test
  public void testNotFolded() {
    assertThat(asWeiValue(IR.number(-1), "ether")).isNull();
    assertThat(asWeiValue(IR.decimal("-0.5"), "ether")).isNull();
    assertThat(asWeiValue(IR.number(1), "lightyear")).isNull();
    assertThat(asWeiValue(IR.name("x"), "ether")).isNull();
    assertThat(asWeiValue(IR.number(BigInteger.TEN.pow(70)), "ether")).isNull();
    assertThat(
            new AsWeiValue()
                .evaluate(IR.call(IR.name("as_wei_value"), IR.number(1), IR.name("ether"))))
        .isNull();
  }
}
