/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.controlflow.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A node of the abstract syntax tree handed to the control flow builder.
 *
 * <p>Children are kept in a doubly linked sibling list. The first child's {@code previous} points
 * at the last child so that {@link #getLastChild()} is constant time.
 *
 * <p>Nodes are compared by identity. Once a tree has been handed to the control flow builder it
 * must not be modified.
 */
public class Node {

  private final Token token;

  private @Nullable String string;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  private boolean conditionalAccess;
  private boolean nonReturning;
  private boolean qualified;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node... children) {
    this(token);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  public static Node newString(Token token, String str) {
    Node n = new Node(token);
    n.string = checkNotNull(str);
    return n;
  }

  public final Token getToken() {
    return token;
  }

  /**
   * Returns the name, label, type name, literal text, member name or operator carried by this
   * node, or null if it carries none.
   */
  public final @Nullable String getString() {
    return string;
  }

  public final Node setString(String str) {
    this.string = checkNotNull(str);
    return this;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasParent() {
    return parent != null;
  }

  public final boolean hasChildren() {
    return first != null;
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
    checkArgument(i >= 0, "negative child index %s", i);
    Node n = first;
    while (i > 0) {
      checkState(n != null, "child index out of range");
      n = n.next;
      i--;
    }
    return checkNotNull(n, "child index out of range");
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

  public final ImmutableList<Node> children() {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (Node n = first; n != null; n = n.next) {
      builder.add(n);
    }
    return builder.build();
  }

  public final void addChildToBack(Node child) {
    checkArgument(child.parent == null, "Node %s is already attached", child);
    checkArgument(child.next == null && child.previous == null);
    child.parent = this;
    if (first == null) {
      first = child;
      child.previous = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
  }

  /** Returns true if this node is {@code ancestor} or one of its descendants. */
  public final boolean isDescendantOf(Node ancestor) {
    for (Node n = this; n != null; n = n.parent) {
      if (n == ancestor) {
        return true;
      }
    }
    return false;
  }

  /** Returns the ancestors of this node, innermost first, excluding the node itself. */
  public final List<Node> getAncestors() {
    List<Node> ancestors = new ArrayList<>();
    for (Node n = parent; n != null; n = n.parent) {
      ancestors.add(n);
    }
    return ancestors;
  }

  /**
   * Returns the receiver of a member access, element access or qualified call. The qualifier is
   * stored as the first child so that it is evaluated before any argument or index.
   */
  public final @Nullable Node getQualifier() {
    return switch (token) {
      case GETPROP, GETELEM -> first;
      case CALL -> qualified ? first : null;
      default -> null;
    };
  }

  /** Whether this is a {@code ?.} access or call. */
  public final boolean isConditionalAccess() {
    return conditionalAccess;
  }

  public final Node setConditionalAccess(boolean conditionalAccess) {
    checkState(token == Token.GETPROP || token == Token.GETELEM || token == Token.CALL, this);
    this.conditionalAccess = conditionalAccess;
    return this;
  }

  /** Whether this call never returns to its caller, for example a process exit. */
  public final boolean isNonReturning() {
    return nonReturning;
  }

  public final Node setNonReturning(boolean nonReturning) {
    checkState(token == Token.CALL, this);
    this.nonReturning = nonReturning;
    return this;
  }

  /** Whether this call has a receiver as its first child. */
  public final boolean isQualified() {
    return qualified;
  }

  public final Node setQualified(boolean qualified) {
    checkState(token == Token.CALL, this);
    this.qualified = qualified;
    return this;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isTry() {
    return token == Token.TRY;
  }

  public final boolean isCatch() {
    return token == Token.CATCH;
  }

  public final boolean isCase() {
    return token == Token.CASE;
  }

  public final boolean isDefaultCase() {
    return token == Token.DEFAULT_CASE;
  }

  public final boolean isLabel() {
    return token == Token.LABEL;
  }

  public final boolean isIf() {
    return token == Token.IF;
  }

  public final boolean isTrue() {
    return token == Token.TRUE;
  }

  public final boolean isFalse() {
    return token == Token.FALSE;
  }

  public final boolean isTypeRef() {
    return token == Token.TYPE_REF;
  }

  public final boolean isLambda() {
    return token == Token.LAMBDA;
  }

  /** Whether this node is the root of a callable body: a method, constructor or lambda. */
  public final boolean isCallable() {
    return token == Token.METHOD || token == Token.CONSTRUCTOR || token == Token.LAMBDA;
  }

  @Override
  public String toString() {
    return string == null ? token.toString() : token + " " + string;
  }
}
