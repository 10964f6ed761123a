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

package com.google.controlflow.graph;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.controlflow.graph.DiGraph.DiGraphEdge;
import com.google.controlflow.graph.DiGraph.DiGraphNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The dominator tree of a directed graph, rooted at a given node.
 *
 * <p>A backward tree is computed over the reversed graph and therefore describes post-dominance
 * when rooted at an exit node. Nodes that cannot be reached from the root in the direction of the
 * tree are not part of it: such a node is dominated only by itself.
 *
 * <p>Uses the iterative algorithm of Cooper, Harvey and Kennedy, "A Simple, Fast Dominance
 * Algorithm" (2001), for both the dominators and the dominance frontiers.
 *
 * @param <N> Value type of the graph nodes.
 */
public final class DominatorTree<N> {

  private final N root;

  /** Immediate dominators. The root maps to null. */
  private final Map<N, @Nullable N> idom;

  /** Position of each node in reverse postorder; the root is 0. */
  private final Map<N, Integer> order;

  private final ImmutableSetMultimap<N, N> frontier;

  private DominatorTree(
      N root,
      Map<N, @Nullable N> idom,
      Map<N, Integer> order,
      ImmutableSetMultimap<N, N> frontier) {
    this.root = root;
    this.idom = idom;
    this.order = order;
    this.frontier = frontier;
  }

  /** Computes the dominators of {@code graph} along its edges, starting at {@code root}. */
  public static <N, E> DominatorTree<N> forward(DiGraph<N, E> graph, N root) {
    return compute(graph, root, /* forward= */ true);
  }

  /** Computes the post-dominators of {@code graph}, walking edges backward from {@code root}. */
  public static <N, E> DominatorTree<N> backward(DiGraph<N, E> graph, N root) {
    return compute(graph, root, /* forward= */ false);
  }

  private static <N, E> DominatorTree<N> compute(DiGraph<N, E> graph, N root, boolean forward) {
    checkArgument(graph.hasNode(root), "%s is not in the graph", root);
    ImmutableList<N> rpo = reversePostOrder(graph, root, forward);
    Map<N, Integer> order = new HashMap<>();
    for (int i = 0; i < rpo.size(); i++) {
      order.put(rpo.get(i), i);
    }

    Map<N, @Nullable N> idom = new HashMap<>();
    idom.put(root, root);
    boolean changed = true;
    while (changed) {
      changed = false;
      for (N b : rpo.subList(1, rpo.size())) {
        N newIdom = null;
        for (N p : predecessors(graph, b, forward)) {
          if (!idom.containsKey(p)) {
            // Not processed yet, or not reachable from the root.
            continue;
          }
          newIdom = newIdom == null ? p : intersect(p, newIdom, idom, order);
        }
        if (newIdom != null && !newIdom.equals(idom.get(b))) {
          idom.put(b, newIdom);
          changed = true;
        }
      }
    }
    idom.put(root, null);

    ImmutableSetMultimap.Builder<N, N> frontier = ImmutableSetMultimap.builder();
    for (N b : rpo) {
      List<N> preds = new ArrayList<>();
      for (N p : predecessors(graph, b, forward)) {
        if (order.containsKey(p)) {
          preds.add(p);
        }
      }
      if (preds.size() < 2) {
        continue;
      }
      N bIdom = idom.get(b);
      for (N p : preds) {
        for (N runner = p; runner != null && !runner.equals(bIdom); runner = idom.get(runner)) {
          frontier.put(runner, b);
        }
      }
    }
    return new DominatorTree<>(root, idom, order, frontier.build());
  }

  private static <N> N intersect(
      N b1, N b2, Map<N, @Nullable N> idom, Map<N, Integer> order) {
    N finger1 = b1;
    N finger2 = b2;
    while (!finger1.equals(finger2)) {
      while (order.get(finger1) > order.get(finger2)) {
        finger1 = idom.get(finger1);
      }
      while (order.get(finger2) > order.get(finger1)) {
        finger2 = idom.get(finger2);
      }
    }
    return finger1;
  }

  private static <N, E> ImmutableList<N> reversePostOrder(
      DiGraph<N, E> graph, N root, boolean forward) {
    List<N> postOrder = new ArrayList<>();
    Set<N> visited = new HashSet<>();
    Deque<Iterator<N>> stack = new ArrayDeque<>();
    Deque<N> path = new ArrayDeque<>();
    visited.add(root);
    stack.push(successors(graph, root, forward).iterator());
    path.push(root);
    while (!stack.isEmpty()) {
      Iterator<N> it = stack.peek();
      if (it.hasNext()) {
        N next = it.next();
        if (visited.add(next)) {
          stack.push(successors(graph, next, forward).iterator());
          path.push(next);
        }
      } else {
        stack.pop();
        postOrder.add(path.pop());
      }
    }
    return ImmutableList.copyOf(postOrder).reverse();
  }

  private static <N, E> List<N> successors(DiGraph<N, E> graph, N n, boolean forward) {
    return forward ? neighbors(graph.getOutEdges(n), true) : neighbors(graph.getInEdges(n), false);
  }

  private static <N, E> List<N> predecessors(DiGraph<N, E> graph, N n, boolean forward) {
    return forward ? neighbors(graph.getInEdges(n), false) : neighbors(graph.getOutEdges(n), true);
  }

  private static <N, E> List<N> neighbors(
      List<? extends DiGraphEdge<N, E>> edges, boolean destinations) {
    List<N> result = new ArrayList<>(edges.size());
    for (DiGraphEdge<N, E> edge : edges) {
      DiGraphNode<N, E> neighbor = destinations ? edge.getDestination() : edge.getSource();
      result.add(neighbor.getValue());
    }
    return result;
  }

  public N getRoot() {
    return root;
  }

  /** Whether {@code n} is reachable from the root in the direction of this tree. */
  public boolean contains(N n) {
    return order.containsKey(n);
  }

  /** Returns the immediate dominator of {@code n}, or null for the root and for absent nodes. */
  public @Nullable N getImmediateDominator(N n) {
    return idom.get(n);
  }

  /** Whether every path from the root to {@code b} passes through {@code a}. Reflexive. */
  public boolean dominates(N a, N b) {
    if (a.equals(b)) {
      return true;
    }
    if (!contains(a) || !contains(b)) {
      return false;
    }
    int aOrder = order.get(a);
    for (N runner = idom.get(b); runner != null; runner = idom.get(runner)) {
      if (runner.equals(a)) {
        return true;
      }
      if (order.get(runner) < aOrder) {
        // Dominators precede the nodes they dominate in reverse postorder.
        return false;
      }
    }
    return false;
  }

  public boolean strictlyDominates(N a, N b) {
    return !a.equals(b) && dominates(a, b);
  }

  /**
   * Returns the dominance frontier of {@code n}: the nodes where the region dominated by {@code n}
   * ends.
   */
  public ImmutableSet<N> getDominanceFrontier(N n) {
    return frontier.get(n);
  }
}
