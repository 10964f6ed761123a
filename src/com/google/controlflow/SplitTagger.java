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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.HashBiMap;
import com.google.common.collect.ImmutableBiMap;
import com.google.controlflow.Split.BooleanSplit;
import com.google.controlflow.Split.ExceptionHandlerSplit;
import com.google.controlflow.Split.FinallySplit;
import com.google.controlflow.ast.Node;
import com.google.controlflow.ast.Token;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Computes the splits carried by control flow nodes.
 *
 * <p>Splits are attached at the transitions that create them and kept on every successor that
 * stays inside the split's region:
 *
 * <ul>
 *   <li>a {@link FinallySplit} lives on the nodes of the finally block entered with an abrupt
 *       completion;
 *   <li>an {@link ExceptionHandlerSplit} lives on the catch clause tests and filters of the try
 *       statement searching for a handler;
 *   <li>a {@link BooleanSplit} lives on the nodes between two tests of the same variable, up to
 *       and including the second test.
 * </ul>
 */
final class SplitTagger {

  /** Pre-order positions of the nodes of the callable. */
  private final Map<Node, Integer> astPosition = new IdentityHashMap<>();

  /** Maps a condition to a later condition testing the same variable. */
  private final ImmutableBiMap<Node, Node> booleanPartners;

  private final Comparator<Split> canonicalOrder =
      Comparator.comparing(Split::getKind).thenComparingInt(split -> position(split.getAnchor()));

  SplitTagger(Node callable, boolean booleanSplitting) {
    HashBiMap<Node, Node> partners = HashBiMap.create();
    Deque<Node> stack = new ArrayDeque<>();
    stack.push(callable);
    int counter = 0;
    while (!stack.isEmpty()) {
      Node n = stack.pop();
      astPosition.put(n, counter++);
      if (n.isLambda() && n != callable) {
        continue;
      }
      if (booleanSplitting && n.isBlock()) {
        findBooleanPartners(n, partners);
      }
      List<Node> children = n.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    this.booleanPartners = ImmutableBiMap.copyOf(partners);
  }

  Comparator<Split> getCanonicalOrder() {
    return canonicalOrder;
  }

  /** Returns the pre-order position of a node of the callable. */
  int position(Node n) {
    return checkNotNull(astPosition.get(n), "%s is not part of the callable", n);
  }

  /** Returns the condition whose value is recorded for {@code condition}, if any. */
  @Nullable Node getBooleanSplitSource(Node condition) {
    return booleanPartners.inverse().get(condition);
  }

  /** Whether the outcome of {@code condition} is recorded for a later test. */
  boolean isBooleanSplitSource(Node condition) {
    return booleanPartners.containsKey(condition);
  }

  /**
   * Returns the splits of a successor: the splits of the predecessor that are still in scope at
   * {@code target}, plus the splits created by the transition. A null target is the exit of the
   * callable, which carries no split.
   */
  SplitSet getSuccessorSplits(SplitSet current, @Nullable Node target, List<Split> added) {
    if (target == null || (current.isEmpty() && added.isEmpty())) {
      return SplitSet.empty();
    }
    List<Split> result = new ArrayList<>();
    for (Split split : current.getSplits()) {
      if (isInRegion(split, target) && !isReplaced(split, added)) {
        result.add(split);
      }
    }
    for (Split split : added) {
      if (isInRegion(split, target)) {
        result.add(split);
      }
    }
    return SplitSet.of(result, canonicalOrder);
  }

  private static boolean isReplaced(Split split, List<Split> added) {
    for (Split other : added) {
      if (other.getKind() == split.getKind() && other.getAnchor() == split.getAnchor()) {
        return true;
      }
    }
    return false;
  }

  /** Whether a node for {@code element} may carry {@code split}. */
  boolean isInRegion(Split split, Node element) {
    if (split instanceof FinallySplit finallySplit) {
      Node finallyBlock = ElementUtil.getFinallyBlock(finallySplit.getTryStatement());
      return finallyBlock != null && element.isDescendantOf(finallyBlock);
    } else if (split instanceof ExceptionHandlerSplit handlerSplit) {
      for (Node catchNode = ElementUtil.getFirstCatch(handlerSplit.getTryStatement());
          catchNode != null;
          catchNode = ElementUtil.getNextCatch(catchNode)) {
        Node filter = ElementUtil.getCatchFilter(catchNode);
        if (element == catchNode || (filter != null && element.isDescendantOf(filter))) {
          return true;
        }
      }
      return false;
    } else if (split instanceof BooleanSplit booleanSplit) {
      return isInBooleanRegion(booleanSplit.getCondition(), element);
    }
    throw new IllegalArgumentException("Unknown split " + split);
  }

  /**
   * The region of a boolean split starts after the first test and spans the statements of the
   * block up to the second if statement and its condition.
   */
  private boolean isInBooleanRegion(Node firstCondition, Node element) {
    Node secondCondition = booleanPartners.get(firstCondition);
    if (secondCondition == null) {
      return false;
    }
    Node firstIf = firstCondition.getParent();
    Node secondIf = secondCondition.getParent();
    if (element == secondIf || element.isDescendantOf(secondCondition)) {
      return true;
    }
    for (Node stmt = firstIf; stmt != null && stmt != secondIf; stmt = stmt.getNext()) {
      if (element.isDescendantOf(stmt)) {
        return element != firstCondition;
      }
    }
    return false;
  }

  /**
   * Pairs each {@code if (b)} statement of the block with the next {@code if (b)} statement when
   * nothing in between may change {@code b} or transfer control into the statements between them.
   */
  private static void findBooleanPartners(Node block, Map<Node, Node> partners) {
    for (Node first = block.getFirstChild(); first != null; first = first.getNext()) {
      String name = getTestedVariable(first);
      if (name == null) {
        continue;
      }
      for (Node stmt = first; stmt != null; stmt = stmt.getNext()) {
        if (stmt != first && name.equals(getTestedVariable(stmt))) {
          partners.put(first.getFirstChild(), stmt.getFirstChild());
          break;
        }
        if (mayInterfere(stmt, name)) {
          break;
        }
      }
    }
  }

  private static @Nullable String getTestedVariable(Node stmt) {
    if (!stmt.isIf() || !stmt.getFirstChild().isName()) {
      return null;
    }
    return stmt.getFirstChild().getString();
  }

  /**
   * Whether the subtree may write the variable, declare a variable of the same name, or contains a
   * jump target or deferred code.
   */
  private static boolean mayInterfere(Node n, String name) {
    switch (n.getToken()) {
      case LABEL, LAMBDA -> {
        return true;
      }
      case ASSIGN, ASSIGN_OP, ASSIGN_COALESCE, INC, DEC -> {
        if (isName(n.getFirstChild(), name)) {
          return true;
        }
      }
      case VAR, FOREACH, CATCH -> {
        for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
          if (isName(c, name)) {
            return true;
          }
        }
      }
      case TYPE_PATTERN, VAR_PATTERN -> {
        if (isName(n.getLastChild(), name)) {
          return true;
        }
      }
      default -> {}
    }
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      if (mayInterfere(c, name)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isName(@Nullable Node n, String name) {
    return n != null && n.getToken() == Token.NAME && name.equals(n.getString());
  }
}
