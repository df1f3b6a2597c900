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

import com.contractfold.ast.DiagnosticType;
import com.contractfold.ast.Node;
import java.math.BigInteger;

/**
 * Resolves the annotation forms needed for constant declarations: primitive type names, bounded
 * {@code String[n]} and {@code Bytes[n]}, and fixed-size arrays {@code T[n]} of any of these.
 */
public final class AnnotationTypeResolver implements TypeResolver {

  static final DiagnosticType UNKNOWN_TYPE =
      DiagnosticType.error("CF_UNKNOWN_TYPE", "Unknown type: {0}");

  static final DiagnosticType INVALID_TYPE_EXPRESSION =
      DiagnosticType.error("CF_INVALID_TYPE_EXPRESSION", "Invalid type expression: {0}");

  static final DiagnosticType INVALID_LENGTH =
      DiagnosticType.error(
          "CF_INVALID_LENGTH", "Type length must be a positive integer literal, found: {0}");

  private static final BigInteger MAX_LENGTH = BigInteger.valueOf(Integer.MAX_VALUE);

  @Override
  public TypeDescriptor resolve(Node annotation) {
    switch (annotation.getToken()) {
      case NAME:
        return resolveName(annotation);
      case SUBSCRIPT:
        return resolveSubscript(annotation);
      default:
        throw new TypeResolutionException(INVALID_TYPE_EXPRESSION, annotation, annotation);
    }
  }

  private static TypeDescriptor resolveName(Node name) {
    PrimitiveType type = PrimitiveType.forName(name.getString());
    if (type == null) {
      throw new TypeResolutionException(UNKNOWN_TYPE, name, name.getString());
    }
    return type;
  }

  private TypeDescriptor resolveSubscript(Node subscript) {
    Node base = subscript.getFirstChild();
    int length = resolveLength(subscript.getSecondChild().getOnlyChild());

    if (base.isName()) {
      for (BoundedType.Kind kind : BoundedType.Kind.values()) {
        if (base.getString().equals(kind.getSourceName())) {
          return new BoundedType(kind, length);
        }
      }
    }
    return new ArrayType(resolve(base), length);
  }

  private static int resolveLength(Node length) {
    if (!length.isInt()
        || length.getInt().signum() <= 0
        || length.getInt().compareTo(MAX_LENGTH) > 0) {
      throw new TypeResolutionException(INVALID_LENGTH, length, length);
    }
    return length.getInt().intValue();
  }
}
