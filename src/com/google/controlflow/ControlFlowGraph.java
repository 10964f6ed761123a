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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.controlflow.ast.Node;
import com.google.controlflow.graph.LinkedDirectedGraph;

/**
 * Control flow graph of a single callable.
 *
 * <p>The graph holds exactly the nodes reachable from the entry node. The exit node is part of the
 * graph only if some path reaches it.
 */
public final class ControlFlowGraph extends LinkedDirectedGraph<ControlFlowNode, SuccessorType> {

  private final Node callable;

  private final ControlFlowNode entry;

  private final ControlFlowNode exit;

  private final ListMultimap<Node, ControlFlowNode> elementNodes = LinkedListMultimap.create();

  private final Supplier<BasicBlockGraph> basicBlocks =
      Suppliers.memoize(() -> BasicBlockGraph.create(this));

  ControlFlowGraph(Node callable) {
    this.callable = callable;
    this.entry = ControlFlowNode.entry(callable);
    this.exit = ControlFlowNode.exit(callable);
    createNode(entry);
  }

  @Override
  public LinkedDirectedGraphNode<ControlFlowNode, SuccessorType> createNode(ControlFlowNode node) {
    if (node.isElement() && !hasNode(node)) {
      elementNodes.put(node.getElement(), node);
    }
    return super.createNode(node);
  }

  public Node getCallable() {
    return callable;
  }

  /** Gets the entry point of the control flow graph. */
  public ControlFlowNode getEntry() {
    return entry;
  }

  /** Gets the exit node, where normal and exceptional paths leave the callable. */
  public ControlFlowNode getExit() {
    return exit;
  }

  /** Whether the node was reached from the entry. */
  public boolean isReachable(ControlFlowNode node) {
    return hasNode(node);
  }

  /** Whether some node for the element was reached from the entry. */
  public boolean isReachable(Node element) {
    return elementNodes.containsKey(element);
  }

  /** Returns the nodes of an element, one for each split context it was reached in. */
  public ImmutableList<ControlFlowNode> getNodes(Node element) {
    return ImmutableList.copyOf(elementNodes.get(element));
  }

  public ImmutableList<ControlFlowNode> getSuccessors(ControlFlowNode node) {
    if (!hasNode(node)) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<ControlFlowNode> successors = ImmutableList.builder();
    for (LinkedDirectedGraphEdge<ControlFlowNode, SuccessorType> edge : getOutEdges(node)) {
      successors.add(edge.getDestination().getValue());
    }
    return successors.build();
  }

  /** Returns the successors reached through edges of the given branch kind. */
  public ImmutableList<ControlFlowNode> getSuccessors(ControlFlowNode node, Branch branch) {
    if (!hasNode(node)) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<ControlFlowNode> successors = ImmutableList.builder();
    for (LinkedDirectedGraphEdge<ControlFlowNode, SuccessorType> edge : getOutEdges(node)) {
      if (edge.getValue().getBranch() == branch) {
        successors.add(edge.getDestination().getValue());
      }
    }
    return successors.build();
  }

  public ImmutableList<ControlFlowNode> getPredecessors(ControlFlowNode node) {
    if (!hasNode(node)) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<ControlFlowNode> predecessors = ImmutableList.builder();
    for (LinkedDirectedGraphEdge<ControlFlowNode, SuccessorType> edge : getInEdges(node)) {
      predecessors.add(edge.getSource().getValue());
    }
    return predecessors.build();
  }

  /** Returns the predecessors whose edge into {@code node} is of the given branch kind. */
  public ImmutableList<ControlFlowNode> getPredecessors(ControlFlowNode node, Branch branch) {
    if (!hasNode(node)) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<ControlFlowNode> predecessors = ImmutableList.builder();
    for (LinkedDirectedGraphEdge<ControlFlowNode, SuccessorType> edge : getInEdges(node)) {
      if (edge.getValue().getBranch() == branch) {
        predecessors.add(edge.getSource().getValue());
      }
    }
    return predecessors.build();
  }

  public SplitSet getSplits(ControlFlowNode node) {
    return node.getSplits();
  }

  /** Returns the basic blocks of this graph, computing them on first use. */
  public BasicBlockGraph getBasicBlockGraph() {
    return basicBlocks.get();
  }

  public BasicBlock getBasicBlock(ControlFlowNode node) {
    return getBasicBlockGraph().getBasicBlock(node);
  }

  /** Whether every path from the entry to {@code b} passes through {@code a}. */
  public boolean dominates(ControlFlowNode a, ControlFlowNode b) {
    return getBasicBlockGraph().dominates(a, b);
  }

  public boolean strictlyDominates(ControlFlowNode a, ControlFlowNode b) {
    return getBasicBlockGraph().strictlyDominates(a, b);
  }

  /** Whether every path from {@code b} to the exit passes through {@code a}. */
  public boolean postDominates(ControlFlowNode a, ControlFlowNode b) {
    return getBasicBlockGraph().postDominates(a, b);
  }

  public boolean strictlyPostDominates(ControlFlowNode a, ControlFlowNode b) {
    return getBasicBlockGraph().strictlyPostDominates(a, b);
  }

  /** The edge object for the control flow graph. */
  public static enum Branch {
    /** Unconditional branch. */
    NORMAL,
    /** Edge is taken if the condition is true. */
    TRUE,
    /** Edge is taken if the condition is false. */
    FALSE,
    NULL,
    NON_NULL,
    /** Edge is taken if the pattern, case or catch clause matches. */
    MATCH,
    NO_MATCH,
    /** Edge is taken if the collection of a foreach loop is exhausted. */
    EMPTY,
    NON_EMPTY,
    RETURN,
    BREAK,
    CONTINUE,
    GOTO_LABEL,
    GOTO_CASE,
    GOTO_DEFAULT,
    /** Exception-handling code paths. */
    EXCEPTION,
    /** A call that never returns. */
    EXIT;

    public boolean isConditional() {
      return switch (this) {
        case TRUE, FALSE, NULL, NON_NULL, MATCH, NO_MATCH, EMPTY, NON_EMPTY -> true;
        default -> false;
      };
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("CFG:\n");
    for (LinkedDirectedGraphNode<ControlFlowNode, SuccessorType> node : getNodes()) {
      for (LinkedDirectedGraphEdge<ControlFlowNode, SuccessorType> edge : node.getOutEdges()) {
        sb.append(edge).append('\n');
      }
    }
    return sb.toString();
  }
}
