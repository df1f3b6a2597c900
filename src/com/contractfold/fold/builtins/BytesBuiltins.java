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

import com.contractfold.ast.Node;
import com.contractfold.ast.Token;
import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.digests.KeccakDigest;
import org.jspecify.nullness.Nullable;

/** Builtins over strings, byte arrays and hex literals. */
final class BytesBuiltins {

  private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

  private BytesBuiltins() {}

  static void addTo(BuiltinFunctionTable.Builder builder) {
    builder.add(new Len()).add(new Sha256()).add(new Keccak256());
  }

  /**
   * Returns the bytes a STR, BYTES or HEX literal holds, or null for any other node. Strings are
   * encoded as UTF-8.
   */
  static byte @Nullable [] getByteValue(Node n) {
    switch (n.getToken()) {
      case BYTES:
        return n.getBytes();
      case STR:
        return n.getString().getBytes(StandardCharsets.UTF_8);
      case HEX:
        String digits = Ascii.toLowerCase(n.getString().substring(2));
        return HEX.canDecode(digits) ? HEX.decode(digits) : null;
      default:
        return null;
    }
  }

  private static final class Len extends AbstractBuiltin {
    Len() {
      super("len", 1);
    }

    @Override
    @Nullable Node evaluate(ImmutableList<Node> arguments) {
      Node value = arguments.get(0);
      switch (value.getToken()) {
        case STR:
          String str = value.getString();
          return Node.newInt(str.codePointCount(0, str.length()));
        case BYTES:
          return Node.newInt(value.getBytes().length);
        case HEX:
          return Node.newInt((value.getString().length() - 2) / 2);
        default:
          return null;
      }
    }
  }

  /** The SHA-256 digest of a literal, as a 32 byte hex literal. */
  private static final class Sha256 extends AbstractBuiltin {
    Sha256() {
      super("sha256", 1);
    }

    @Override
    @Nullable Node evaluate(ImmutableList<Node> arguments) {
      byte[] value = getByteValue(arguments.get(0));
      if (value == null) {
        return null;
      }
      return newDigest(Hashing.sha256().hashBytes(value).asBytes());
    }
  }

  /** The original Keccak-256 digest (not FIPS SHA3-256) of a literal, as a 32 byte hex literal. */
  private static final class Keccak256 extends AbstractBuiltin {
    private static final int BIT_LENGTH = 256;

    Keccak256() {
      super("keccak256", 1);
    }

    @Override
    @Nullable Node evaluate(ImmutableList<Node> arguments) {
      byte[] value = getByteValue(arguments.get(0));
      if (value == null) {
        return null;
      }
      KeccakDigest digest = new KeccakDigest(BIT_LENGTH);
      digest.update(value, 0, value.length);
      byte[] hash = new byte[digest.getDigestSize()];
      digest.doFinal(hash, 0);
      return newDigest(hash);
    }
  }

  private static Node newDigest(byte[] hash) {
    return Node.newString(Token.HEX, "0x" + HEX.encode(hash));
  }
}
