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

package com.google.controlflow;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.controlflow.ast.Node;
import com.google.controlflow.ast.Token;
import com.google.controlflow.ast.TypeHierarchy;
import org.jspecify.annotations.Nullable;

/** Structural queries about the AST shared by the completion model and the graph builder. */
final class ElementUtil {

  /** How the value of an expression is consumed by its parent. */
  enum EvaluationContext {
    PLAIN,
    /** The expression is tested for truth. */
    BOOLEAN,
    /** The expression is tested for null. */
    NULLNESS
  }

  private ElementUtil() {}

  static EvaluationContext getContext(Node n) {
    Node parent = n.getParent();
    if (parent == null) {
      return EvaluationContext.PLAIN;
    }
    switch (parent.getToken()) {
      case IF, WHILE -> {
        if (n == parent.getFirstChild()) {
          return EvaluationContext.BOOLEAN;
        }
      }
      case DO -> {
        if (n == parent.getLastChild()) {
          return EvaluationContext.BOOLEAN;
        }
      }
      case FOR, CASE, SWITCH_ARM -> {
        if (n == parent.getSecondChild()) {
          return EvaluationContext.BOOLEAN;
        }
      }
      case CATCH -> {
        if (n == getCatchFilter(parent)) {
          return EvaluationContext.BOOLEAN;
        }
      }
      case AND, OR, HOOK -> {
        return n == parent.getFirstChild() ? EvaluationContext.BOOLEAN : getContext(parent);
      }
      case COALESCE -> {
        return n == parent.getFirstChild() ? EvaluationContext.NULLNESS : getContext(parent);
      }
      case ASSIGN_COALESCE -> {
        if (n == parent.getFirstChild()) {
          return EvaluationContext.NULLNESS;
        }
      }
      case NOT -> {
        return getContext(parent);
      }
      case GETPROP, GETELEM, CALL -> {
        if (parent.isConditionalAccess() && n == parent.getQualifier()) {
          return EvaluationContext.NULLNESS;
        }
      }
      default -> {}
    }
    return EvaluationContext.PLAIN;
  }

  /**
   * Whether the node has no control flow node of its own: control passes through its operands
   * only.
   */
  static boolean isTransparent(Node n) {
    return switch (n.getToken()) {
      case AND, OR, COALESCE, HOOK -> true;
      case NOT -> getContext(n) == EvaluationContext.BOOLEAN;
      default -> false;
    };
  }

  /** Whether the node is executed before its children, as an entry marker. */
  static boolean isPreOrder(Node n) {
    return switch (n.getToken()) {
      case BLOCK,
          EXPR_RESULT,
          VAR,
          EMPTY,
          IF,
          WHILE,
          DO,
          FOR,
          SWITCH,
          TRY,
          LABEL,
          DEFAULT_CASE -> true;
      case NEW_ARRAY -> !hasArrayLengths(n);
      default -> false;
    };
  }

  /** Whether the node tests a pattern or an exception and completes with a matching outcome. */
  static boolean isMatchingTest(Node n) {
    return switch (n.getToken()) {
      case CASE, SWITCH_ARM, CATCH -> true;
      default -> false;
    };
  }

  /** Whether the node can ever be evaluated. Type references, labels and patterns are not. */
  static boolean isEvaluated(Node n) {
    return switch (n.getToken()) {
      case TYPE_REF, LABEL_NAME, PARAM_LIST, TYPE_PATTERN, VAR_PATTERN, DISCARD -> false;
      case EMPTY -> isEmptyStatement(n);
      case METHOD, CONSTRUCTOR -> false;
      default -> !isMatchedOnly(n);
    };
  }

  /** Whether the node is a constant pattern, a goto case constant or a catch variable. */
  private static boolean isMatchedOnly(Node n) {
    Node parent = n.getParent();
    if (parent == null) {
      return false;
    }
    return switch (parent.getToken()) {
      case CASE, SWITCH_ARM -> n == parent.getFirstChild();
      case IS, CATCH -> n == parent.getSecondChild();
      case GOTO_CASE -> true;
      default -> false;
    };
  }

  /** Whether an EMPTY node is a statement rather than a placeholder for an absent part. */
  private static boolean isEmptyStatement(Node n) {
    Node parent = n.getParent();
    if (parent == null) {
      return false;
    }
    return switch (parent.getToken()) {
      case BLOCK, LABEL, IF, WHILE, DO -> true;
      case FOR -> n == parent.getLastChild();
      case FOREACH -> n == parent.getLastChild();
      default -> false;
    };
  }

  /** Returns the children of a post-order node in evaluation order. */
  static ImmutableList<Node> getEvaluatedChildren(Node n) {
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    switch (n.getToken()) {
      case LAMBDA, GOTO_CASE -> {}
      case CAST -> children.add(n.getSecondChild());
      case IS, AS -> children.add(n.getFirstChild());
      default -> {
        for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
          if (isEvaluated(c)) {
            children.add(c);
          }
        }
      }
    }
    return children.build();
  }

  static boolean hasArrayLengths(Node newArray) {
    checkArgument(newArray.getToken() == Token.NEW_ARRAY, newArray);
    Node afterType = newArray.getSecondChild();
    return afterType != null && afterType.getToken() != Token.ARRAY_LIT;
  }

  /** Whether the node is a NAME declaring a variable of a VAR statement. */
  static boolean isDeclarator(Node n) {
    return n.isName() && n.getParent() != null && n.getParent().getToken() == Token.VAR;
  }

  static boolean isLoop(Node n) {
    return switch (n.getToken()) {
      case WHILE, DO, FOR, FOREACH -> true;
      default -> false;
    };
  }

  static Node getCallableBody(Node callable) {
    checkArgument(callable.isCallable(), callable);
    return callable.getLastChild();
  }

  static @Nullable Node getConstructorInitializer(Node callable) {
    if (callable.getToken() != Token.CONSTRUCTOR) {
      return null;
    }
    Node initializer = callable.getChildAtIndex(2);
    return initializer.isEmpty() ? null : initializer;
  }

  static boolean hasFinally(Node tryNode) {
    return getFinallyBlock(tryNode) != null;
  }

  static @Nullable Node getFinallyBlock(Node tryNode) {
    checkArgument(tryNode.isTry(), tryNode);
    Node last = tryNode.getLastChild();
    return last != tryNode.getFirstChild() && last.isBlock() ? last : null;
  }

  static @Nullable Node getFirstCatch(Node tryNode) {
    Node second = tryNode.getSecondChild();
    return second != null && second.isCatch() ? second : null;
  }

  static @Nullable Node getNextCatch(Node catchNode) {
    Node next = catchNode.getNext();
    return next != null && next.isCatch() ? next : null;
  }

  static @Nullable Node getCatchFilter(Node catchNode) {
    Node filter = catchNode.getChildAtIndex(2);
    return filter.isEmpty() ? null : filter;
  }

  static Node getCatchBody(Node catchNode) {
    return catchNode.getLastChild();
  }

  /** Returns the caught type, or null for a clause that catches every exception. */
  static @Nullable String getCaughtType(Node catchNode) {
    Node type = catchNode.getFirstChild();
    return type.isEmpty() ? null : type.getString();
  }

  /**
   * Returns the type thrown by a throw statement or expression: the created type for {@code throw
   * new T(...)}, otherwise the type caught by the enclosing catch clause.
   */
  static String getThrownType(Node throwNode) {
    Node thrown = throwNode.getFirstChild();
    if (thrown != null && thrown.getToken() == Token.NEW) {
      return thrown.getFirstChild().getString();
    }
    for (Node child = throwNode, parent = throwNode.getParent();
        parent != null && !parent.isCallable();
        child = parent, parent = parent.getParent()) {
      if (parent.isCatch() && child == getCatchBody(parent)) {
        String caught = getCaughtType(parent);
        return caught == null ? TypeHierarchy.ROOT_EXCEPTION : caught;
      }
    }
    return TypeHierarchy.ROOT_EXCEPTION;
  }

  /**
   * Whether an exception raised by the node may be handled within the callable: the node is
   * inside a try block, or inside a catch clause of a try statement with a finally block.
   */
  static boolean isTried(Node n) {
    for (Node child = n, parent = n.getParent();
        parent != null && !child.isCallable();
        child = parent, parent = parent.getParent()) {
      if (parent.isTry()
          && (child == parent.getFirstChild() || (child.isCatch() && hasFinally(parent)))) {
        return true;
      }
    }
    return false;
  }

  static @Nullable String getJumpLabel(Node jump) {
    Node label = jump.getFirstChild();
    return label == null ? null : label.getString();
  }

  /**
   * Check if label is actually referencing the target control structure. If label is null, it
   * always returns true.
   */
  static boolean matchLabel(Node target, @Nullable String label) {
    if (label == null) {
      return true;
    }
    for (Node n = target.getParent(); n != null && n.isLabel(); n = n.getParent()) {
      if (label.equals(n.getFirstChild().getString())) {
        return true;
      }
    }
    return false;
  }

  /** Returns the statement labeled {@code label} among the children of a block, if any. */
  static @Nullable Node findLabel(Node block, String label) {
    for (Node c = block.getFirstChild(); c != null; c = c.getNext()) {
      if (c.isLabel() && label.equals(c.getFirstChild().getString())) {
        return c;
      }
    }
    return null;
  }

  /** Returns the first section of a switch statement that is a case, if any. */
  static @Nullable Node getNextCase(@Nullable Node section) {
    for (Node c = section; c != null; c = c.getNext()) {
      if (c.isCase()) {
        return c;
      }
    }
    return null;
  }

  static @Nullable Node getDefaultCase(Node switchNode) {
    for (Node c = switchNode.getSecondChild(); c != null; c = c.getNext()) {
      if (c.isDefaultCase()) {
        return c;
      }
    }
    return null;
  }

  /**
   * Returns a key identifying a constant by kind and value, so that {@code 1} and {@code "1"}
   * differ. Returns null for anything that is not a constant.
   */
  static @Nullable String getConstantKey(Node n) {
    return switch (n.getToken()) {
      case NUMBER, STRING -> n.getToken() + " " + n.getString();
      case TRUE, FALSE, NULL -> n.getToken().toString();
      default -> null;
    };
  }

  /** Returns the case whose constant pattern has the given constant key, if any. */
  static @Nullable Node findCase(Node switchNode, String constantKey) {
    for (Node c = switchNode.getSecondChild(); c != null; c = c.getNext()) {
      if (c.isCase() && constantKey.equals(getConstantKey(c.getFirstChild()))) {
        return c;
      }
    }
    return null;
  }

  /** Returns the block executed when the given switch section is selected. */
  static Node getSectionBody(Node section) {
    return section.getLastChild();
  }

  /** Returns the guard of a case or switch arm, if any. */
  static @Nullable Node getGuard(Node test) {
    Node guard = test.getSecondChild();
    return guard.isEmpty() ? null : guard;
  }

  /** Whether a case or switch arm pattern matches every value. */
  static boolean isIrrefutable(Node pattern) {
    return pattern.getToken() == Token.DISCARD || pattern.getToken() == Token.VAR_PATTERN;
  }

  /** Whether the expression can only evaluate to a non-null value. */
  static boolean isNeverNull(Node n) {
    return switch (n.getToken()) {
      case NEW, NEW_ARRAY, ARRAY_LIT, THIS, NUMBER, STRING, TRUE, FALSE, LAMBDA -> true;
      default -> false;
    };
  }

  /** Whether the node is an access or call in a chain starting at a conditional access. */
  static boolean isAccess(Node n) {
    return switch (n.getToken()) {
      case GETPROP, GETELEM, CALL -> true;
      default -> false;
    };
  }

  /**
   * Returns the outermost node skipped when the qualifier of the conditional access {@code
   * access} is null: the maximal chain of accesses and calls built on top of it, including an
   * assignment to the chain.
   */
  static Node getConditionalChainRoot(Node access) {
    Node root = access;
    for (Node parent = root.getParent();
        parent != null && isAccess(parent) && parent.getQualifier() == root;
        parent = root.getParent()) {
      root = parent;
    }
    Node parent = root.getParent();
    if (parent != null
        && (parent.getToken() == Token.ASSIGN || parent.getToken() == Token.ASSIGN_OP)
        && parent.getFirstChild() == root) {
      return parent;
    }
    return root;
  }
}
