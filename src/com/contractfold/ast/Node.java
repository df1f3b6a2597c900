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

package com.contractfold.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.contractfold.ast.types.TypeDescriptor;
import com.google.common.base.Predicate;
import com.google.common.base.Predicates;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.BaseEncoding;
import com.google.errorprone.annotations.CheckReturnValue;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import org.jspecify.nullness.Nullable;

/**
 * A node of a contract syntax tree.
 *
 * <p>A node owns its children through a sibling linked list and keeps a non-owning link to its
 * parent. The first child's {@code previous} link points at the last child so that appending is
 * constant time. Nodes are mutated only through the structural operations on this class, which
 * guard against attaching a node twice or detaching a node that has no parent.
 */
public class Node {

  private static final class IntNode extends Node {

    private final BigInteger value;

    IntNode(BigInteger value) {
      super(Token.INT);
      this.value = checkNotNull(value);
    }

    @Override
    boolean isValueEquivalentTo(Node node) {
      return value.equals(((IntNode) node).value);
    }

    @Override
    IntNode cloneNode() {
      IntNode clone = new IntNode(value);
      copyBaseNodeFields(this, clone);
      return clone;
    }
  }

  private static final class DecimalNode extends Node {

    private final BigDecimal value;

    DecimalNode(BigDecimal value) {
      super(Token.DECIMAL);
      this.value = checkNotNull(value);
    }

    @Override
    boolean isValueEquivalentTo(Node node) {
      // 1.5 and 1.50 denote the same decimal.
      return value.compareTo(((DecimalNode) node).value) == 0;
    }

    @Override
    DecimalNode cloneNode() {
      DecimalNode clone = new DecimalNode(value);
      copyBaseNodeFields(this, clone);
      return clone;
    }
  }

  private static final class BooleanNode extends Node {

    private final boolean value;

    BooleanNode(boolean value) {
      super(Token.BOOL);
      this.value = value;
    }

    @Override
    boolean isValueEquivalentTo(Node node) {
      return value == ((BooleanNode) node).value;
    }

    @Override
    BooleanNode cloneNode() {
      BooleanNode clone = new BooleanNode(value);
      copyBaseNodeFields(this, clone);
      return clone;
    }
  }

  /** NAME, ATTRIBUTE, FUNCTION_DEF, STR and HEX nodes. */
  private static final class StringNode extends Node {

    private final String str;

    StringNode(Token token, String str) {
      super(token);
      this.str = checkNotNull(str);
    }

    @Override
    boolean isValueEquivalentTo(Node node) {
      String other = ((StringNode) node).str;
      return isHex() ? str.equalsIgnoreCase(other) : str.equals(other);
    }

    @Override
    StringNode cloneNode() {
      StringNode clone = new StringNode(getToken(), str);
      copyBaseNodeFields(this, clone);
      return clone;
    }
  }

  private static final class BytesNode extends Node {

    private final byte[] value;

    BytesNode(byte[] value) {
      super(Token.BYTES);
      this.value = value.clone();
    }

    @Override
    boolean isValueEquivalentTo(Node node) {
      return Arrays.equals(value, ((BytesNode) node).value);
    }

    @Override
    BytesNode cloneNode() {
      BytesNode clone = new BytesNode(value);
      copyBaseNodeFields(this, clone);
      return clone;
    }
  }

  /** BINOP, UNARYOP, BOOLOP, COMPARE and AUG_ASSIGN nodes. */
  private static final class OperatorNode extends Node {

    private final Operator operator;

    OperatorNode(Token token, Operator operator) {
      super(token);
      operator.checkValidFor(token);
      this.operator = operator;
    }

    @Override
    boolean isValueEquivalentTo(Node node) {
      return operator == ((OperatorNode) node).operator;
    }

    @Override
    OperatorNode cloneNode() {
      OperatorNode clone = new OperatorNode(getToken(), operator);
      copyBaseNodeFields(this, clone);
      return clone;
    }
  }

  private final Token token;
  private @Nullable Node parent;
  private @Nullable Node first; // first child; first.previous is the last child
  private @Nullable Node next; // next sibling, null for the last child
  private @Nullable Node previous; // previous sibling, wraps around to the last child

  private @Nullable String sourceFileName;
  private int lineno = -1;
  private int charno = -1;

  private @Nullable TypeDescriptor typeDescriptor;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public static Node newInt(BigInteger value) {
    return new IntNode(value);
  }

  public static Node newInt(long value) {
    return new IntNode(BigInteger.valueOf(value));
  }

  public static Node newDecimal(BigDecimal value) {
    return new DecimalNode(value);
  }

  public static Node newBoolean(boolean value) {
    return new BooleanNode(value);
  }

  public static Node newBytes(byte[] value) {
    return new BytesNode(value);
  }

  /** Creates a NAME, ATTRIBUTE, FUNCTION_DEF, STR or HEX node. */
  public static Node newString(Token token, String str) {
    checkArgument(
        token == Token.NAME
            || token == Token.ATTRIBUTE
            || token == Token.FUNCTION_DEF
            || token == Token.STR
            || token == Token.HEX,
        "%s does not carry a string",
        token);
    return new StringNode(token, str);
  }

  /** Creates a BINOP, UNARYOP, BOOLOP, COMPARE or AUG_ASSIGN node with no children. */
  public static Node newOperation(Token token, Operator operator) {
    return new OperatorNode(token, operator);
  }

  public final Token getToken() {
    return token;
  }

  // ==========================================================================
  // Values

  public final BigInteger getInt() {
    checkState(token == Token.INT, "Not an integer literal: %s", this);
    return ((IntNode) this).value;
  }

  public final BigDecimal getDecimal() {
    checkState(token == Token.DECIMAL, "Not a decimal literal: %s", this);
    return ((DecimalNode) this).value;
  }

  public final boolean getBoolean() {
    checkState(token == Token.BOOL, "Not a boolean literal: %s", this);
    return ((BooleanNode) this).value;
  }

  public final String getString() {
    checkState(this instanceof StringNode, "Node does not carry a string: %s", this);
    return ((StringNode) this).str;
  }

  public final byte[] getBytes() {
    checkState(isBytes(), "Not a bytes literal: %s", this);
    return ((BytesNode) this).value.clone();
  }

  public final Operator getOperator() {
    checkState(this instanceof OperatorNode, "Node does not carry an operator: %s", this);
    return ((OperatorNode) this).operator;
  }

  /** Whether the nodes hold equal values. Both nodes are known to be of the same class. */
  boolean isValueEquivalentTo(Node node) {
    return true;
  }

  // ==========================================================================
  // Children

  public final boolean hasChildren() {
    return first != null;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild(), "Expected exactly one child: %s", this);
    return first;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @param i The index
   * @return The ith child
   */
  public final Node getChildAtIndex(int i) {
    checkArgument(i >= 0, i);
    Node n = first;
    while (i > 0 && n != null) {
      n = n.next;
      i--;
    }
    checkArgument(n != null, "No child at index in %s", this);
    return n;
  }

  /**
   * Gets the index of a child, note that this is O(N) where N is the number of children.
   *
   * @return The index of the child, or -1 if it is not a child of this node
   */
  public final int getIndexOfChild(Node child) {
    Node n = first;
    int i = 0;
    while (n != null) {
      if (child == n) {
        return i;
      }
      n = n.next;
      i++;
    }
    return -1;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  /** Iterates the direct children. Do not restructure the children while iterating. */
  public final Iterable<Node> children() {
    if (first == null) {
      return Collections.emptySet();
    }
    Node start = first;
    return () -> new SiblingNodeIterator(start);
  }

  private static final class SiblingNodeIterator implements Iterator<Node> {
    private @Nullable Node current;

    SiblingNodeIterator(Node start) {
      this.current = start;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node n = current;
      current = current.getNext();
      return n;
    }
  }

  /** Returns the direct children with the given token, in order. */
  public final ImmutableList<Node> getChildren(Token childToken) {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (Node n = first; n != null; n = n.next) {
      if (n.token == childToken) {
        builder.add(n);
      }
    }
    return builder.build();
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);

    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      // NOTE: child.next remains null
      child.previous = last;
      first.previous = child;
    }

    child.parent = this;
  }

  public final void addChildToFront(Node child) {
    checkArgument(child.parent == null);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);
    child.parent = this;
    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
    } else {
      Node last = first.previous;
      // NOTE: last.next remains null
      child.previous = last;
      child.next = first;
      first.previous = child;
    }
    first = child;
  }

  /**
   * Swaps {@code replacement} and its subtree into the position of {@code this}. The replacement
   * takes this node's source position if it has none of its own.
   */
  public final void replaceWith(Node replacement) {
    this.checkAttached();
    replacement.checkDetached();
    checkArgument(replacement != this, "Cannot replace a node with itself: %s", this);

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    replacement.srcrefIfMissing(this);

    // The sequence below also has to work when `this` is an only child, which can cause many of
    // the variables to point to the same object.

    this.parent = null;
    replacement.parent = existingParent;

    this.previous = null;
    replacement.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = replacement;
      // existingPrevious.next remains null
    } else {
      // existingParent.first is unchanged;
      existingPrevious.next = replacement;
    }

    if (existingNext == null) {
      // this.next remains null;
      existingParent.first.previous = replacement;
      // replacement.next remains null
    } else {
      this.next = null;
      existingNext.previous = replacement;
      replacement.next = existingNext;
    }
  }

  /** Removes this node from its parent, but retains its subtree. */
  public final Node detach() {
    this.checkAttached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    this.parent = null;

    if (existingNext == null) {
      // this.next remains null;
      existingParent.first.previous = existingPrevious;
    } else {
      this.next = null;
      existingNext.previous = existingPrevious;
    }

    this.previous = null;
    if (existingPrevious.next == null) {
      existingParent.first = existingNext;
      // existingPrevious.next remains null
    } else {
      // existingParent.first is unchanged;
      existingPrevious.next = existingNext;
    }

    return this;
  }

  private void checkAttached() {
    checkState(this.parent != null, "Has no parent: %s", this);
  }

  private void checkDetached() {
    checkState(this.parent == null, "Has parent: %s", this);
    checkState(this.next == null, "Has next: %s", this);
    checkState(this.previous == null, "Has previous: %s", this);
  }

  // ==========================================================================
  // Ancestors and descendants

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasParent() {
    return parent != null;
  }

  /** Is this Node the same as {@code node} or a descendant of {@code node}? */
  public final boolean isDescendantOf(Node node) {
    for (Node n = this; n != null; n = n.parent) {
      if (n == node) {
        return true;
      }
    }
    return false;
  }

  /** Returns the nearest proper ancestor whose token is one of {@code tokens}, if any. */
  public final @Nullable Node getEnclosing(Set<Token> tokens) {
    for (Node n = parent; n != null; n = n.parent) {
      if (tokens.contains(n.token)) {
        return n;
      }
    }
    return null;
  }

  public final @Nullable Node getEnclosing(Token ancestorToken) {
    return getEnclosing(ImmutableSet.of(ancestorToken));
  }

  /**
   * Returns a snapshot of the descendants of this node whose token is one of {@code tokens} and
   * which match {@code filter}.
   *
   * <p>Nodes are listed in document order, parents before their children. When {@code reverse}
   * is set the order is inverted, so every node comes before its ancestors and its left siblings.
   * Passes that replace nodes while walking the snapshot rely on this: replacing a node never
   * detaches an entry that has yet to be visited.
   *
   * @param includeSelf whether this node is a candidate too
   */
  public final ImmutableList<Node> getDescendants(
      Set<Token> tokens, Predicate<Node> filter, boolean reverse, boolean includeSelf) {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    if (includeSelf) {
      collectDescendants(this, tokens, filter, builder);
    } else {
      for (Node c = first; c != null; c = c.next) {
        collectDescendants(c, tokens, filter, builder);
      }
    }
    ImmutableList<Node> descendants = builder.build();
    return reverse ? descendants.reverse() : descendants;
  }

  public final ImmutableList<Node> getDescendants(Set<Token> tokens, boolean reverse) {
    return getDescendants(tokens, Predicates.alwaysTrue(), reverse, false);
  }

  public final ImmutableList<Node> getDescendants(Token descendantToken) {
    return getDescendants(ImmutableSet.of(descendantToken), false);
  }

  private static void collectDescendants(
      Node n, Set<Token> tokens, Predicate<Node> filter, ImmutableList.Builder<Node> builder) {
    if (tokens.contains(n.token) && filter.apply(n)) {
      builder.add(n);
    }
    for (Node c = n.first; c != null; c = c.next) {
      collectDescendants(c, tokens, filter, builder);
    }
  }

  // ==========================================================================
  // Cloning and source information

  /** Returns a detached clone of the Node, specifically excluding its children. */
  @CheckReturnValue
  Node cloneNode() {
    Node clone = new Node(token);
    copyBaseNodeFields(this, clone);
    return clone;
  }

  private static void copyBaseNodeFields(Node source, Node dest) {
    dest.sourceFileName = source.sourceFileName;
    dest.lineno = source.lineno;
    dest.charno = source.charno;
    dest.typeDescriptor = source.typeDescriptor;
  }

  /** Returns a detached clone of the Node and all its children. */
  @CheckReturnValue
  public final Node cloneTree() {
    Node result = cloneNode();
    for (Node c = first; c != null; c = c.next) {
      result.addChildToBack(c.cloneTree());
    }
    return result;
  }

  /** Copy the source info from `other` onto `this`. */
  public final Node srcref(Node other) {
    this.sourceFileName = other.sourceFileName;
    this.lineno = other.lineno;
    this.charno = other.charno;
    return this;
  }

  /** For all Nodes in the subtree of `this`, copy the source info from `other`. */
  public final Node srcrefTree(Node other) {
    this.srcref(other);
    for (Node child = first; child != null; child = child.next) {
      child.srcrefTree(other);
    }
    return this;
  }

  /** Iff source info is not set on `this`, copy the source info from `other`. */
  public final Node srcrefIfMissing(Node other) {
    if (lineno == -1 && sourceFileName == null) {
      srcref(other);
    }
    return this;
  }

  public final Node setSourcePosition(@Nullable String sourceFileName, int lineno, int charno) {
    checkArgument(lineno >= -1 && charno >= -1, "Invalid position %s:%s", lineno, charno);
    this.sourceFileName = sourceFileName;
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  public final @Nullable String getSourceFileName() {
    return sourceFileName;
  }

  public final int getLineno() {
    return lineno;
  }

  public final int getCharno() {
    return charno;
  }

  /** Returns "file:line:column" for diagnostics. */
  public final String getLocation() {
    return (sourceFileName == null ? "<unknown>" : sourceFileName) + ":" + lineno + ":" + charno;
  }

  // ==========================================================================
  // Type annotation

  /** Returns the type attached by the type system or by constant propagation, if any. */
  public final @Nullable TypeDescriptor getTypeDescriptor() {
    return typeDescriptor;
  }

  public final Node setTypeDescriptor(@Nullable TypeDescriptor typeDescriptor) {
    this.typeDescriptor = typeDescriptor;
    return this;
  }

  /** Copies a node's type descriptor, if present. */
  public final Node copyTypeFrom(Node other) {
    this.typeDescriptor = other.typeDescriptor;
    return this;
  }

  // ==========================================================================
  // Equivalence and printing

  /**
   * Returns true if this node and its subtree are structurally equal to {@code node}. Source
   * positions and type descriptors are not compared.
   */
  public final boolean isEquivalentTo(Node node) {
    return isEquivalentTo(node, false);
  }

  /** Like {@link #isEquivalentTo(Node)} but also requires equal type descriptors. */
  public final boolean isEquivalentToTyped(Node node) {
    return isEquivalentTo(node, true);
  }

  private boolean isEquivalentTo(Node node, boolean compareType) {
    if (token != node.token
        || getClass() != node.getClass()
        || getChildCount() != node.getChildCount()
        || !isValueEquivalentTo(node)) {
      return false;
    }
    if (compareType && !Objects.equals(typeDescriptor, node.typeDescriptor)) {
      return false;
    }
    for (Node n = first, n2 = node.first; n != null; n = n.next, n2 = n2.next) {
      if (!n.isEquivalentTo(n2, compareType)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    switch (token) {
      case INT:
        sb.append(' ').append(getInt());
        break;
      case DECIMAL:
        sb.append(' ').append(getDecimal().toPlainString());
        break;
      case BOOL:
        sb.append(' ').append(getBoolean());
        break;
      case BYTES:
        sb.append(" b\"").append(BaseEncoding.base16().lowerCase().encode(getBytes())).append('"');
        break;
      case STR:
        sb.append(" \"").append(getString()).append('"');
        break;
      case NAME:
      case ATTRIBUTE:
      case FUNCTION_DEF:
      case HEX:
        sb.append(' ').append(getString());
        break;
      case BINOP:
      case UNARYOP:
      case BOOLOP:
      case COMPARE:
      case AUG_ASSIGN:
        sb.append(' ').append(getOperator());
        break;
      default:
        break;
    }
    if (lineno != -1) {
      sb.append(' ').append(lineno).append(':').append(charno);
    }
    if (typeDescriptor != null) {
      sb.append(" : ").append(typeDescriptor);
    }
    return sb.toString();
  }

  @CheckReturnValue
  public final String toStringTree() {
    try {
      StringBuilder s = new StringBuilder();
      appendStringTree(s);
      return s.toString();
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
  }

  public final void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(Node n, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Node cursor = n.first; cursor != null; cursor = cursor.next) {
      toStringTreeHelper(cursor, level + 1, sb);
    }
  }

  // ==========================================================================
  // Token predicates

  public final boolean isLiteral() {
    return token.isLiteral();
  }

  public final boolean isModule() {
    return token == Token.MODULE;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isInt() {
    return token == Token.INT;
  }

  public final boolean isDecimal() {
    return token == Token.DECIMAL;
  }

  public final boolean isBool() {
    return token == Token.BOOL;
  }

  public final boolean isStr() {
    return token == Token.STR;
  }

  public final boolean isHex() {
    return token == Token.HEX;
  }

  public final boolean isBytes() {
    return token == Token.BYTES;
  }

  public final boolean isList() {
    return token == Token.LIST;
  }

  public final boolean isDict() {
    return token == Token.DICT;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  /** Whether this is a NAME node referring to {@code name}. */
  public final boolean matchesName(String name) {
    return token == Token.NAME && getString().equals(name);
  }
}
