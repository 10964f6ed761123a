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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.controlflow.graph.DominatorTree;
import com.google.controlflow.graph.LinkedDirectedGraph;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The basic blocks of a {@link ControlFlowGraph}, with an edge for every control flow edge that
 * leaves a block, and the dominance relations over them.
 *
 * <p>Node level dominance reduces to the order of nodes inside a block and to block dominance
 * across blocks.
 */
public final class BasicBlockGraph extends LinkedDirectedGraph<BasicBlock, SuccessorType> {

  private final ControlFlowGraph cfg;

  private final ImmutableList<BasicBlock> blocks;

  private final Map<ControlFlowNode, BasicBlock> blockOf;

  private final Map<ControlFlowNode, Integer> indexInBlock;

  private final Supplier<DominatorTree<BasicBlock>> dominators =
      Suppliers.memoize(() -> DominatorTree.forward(this, getEntryBlock()));

  private final Supplier<@Nullable DominatorTree<BasicBlock>> postDominators =
      Suppliers.memoize(
          () -> {
            BasicBlock exitBlock = getExitBlock();
            return exitBlock == null ? null : DominatorTree.backward(this, exitBlock);
          });

  private BasicBlockGraph(
      ControlFlowGraph cfg,
      ImmutableList<BasicBlock> blocks,
      Map<ControlFlowNode, BasicBlock> blockOf,
      Map<ControlFlowNode, Integer> indexInBlock) {
    this.cfg = cfg;
    this.blocks = blocks;
    this.blockOf = blockOf;
    this.indexInBlock = indexInBlock;
  }

  /** Splits the nodes of {@code cfg} into basic blocks, in discovery order. */
  static BasicBlockGraph create(ControlFlowGraph cfg) {
    ImmutableList.Builder<BasicBlock> blocks = ImmutableList.builder();
    Map<ControlFlowNode, BasicBlock> blockOf = new HashMap<>();
    Map<ControlFlowNode, Integer> indexInBlock = new HashMap<>();
    int id = 0;
    for (LinkedDirectedGraphNode<ControlFlowNode, SuccessorType> graphNode : cfg.getNodes()) {
      ControlFlowNode leader = graphNode.getValue();
      if (!isLeader(cfg, leader)) {
        continue;
      }
      ImmutableList.Builder<ControlFlowNode> chain = ImmutableList.builder();
      ControlFlowNode current = leader;
      chain.add(current);
      while (true) {
        List<LinkedDirectedGraphEdge<ControlFlowNode, SuccessorType>> outEdges =
            cfg.getOutEdges(current);
        if (outEdges.size() != 1) {
          break;
        }
        ControlFlowNode next = outEdges.get(0).getDestination().getValue();
        if (isLeader(cfg, next)) {
          break;
        }
        chain.add(next);
        current = next;
      }
      BasicBlock block = new BasicBlock(id++, chain.build());
      blocks.add(block);
      for (int i = 0; i < block.size(); i++) {
        blockOf.put(block.getNodes().get(i), block);
        indexInBlock.put(block.getNodes().get(i), i);
      }
    }

    BasicBlockGraph graph = new BasicBlockGraph(cfg, blocks.build(), blockOf, indexInBlock);
    for (BasicBlock block : graph.blocks) {
      graph.createNode(block);
    }
    for (BasicBlock block : graph.blocks) {
      for (LinkedDirectedGraphEdge<ControlFlowNode, SuccessorType> edge :
          cfg.getOutEdges(block.getLastNode())) {
        BasicBlock target = blockOf.get(edge.getDestination().getValue());
        graph.connect(block, edge.getValue(), target);
      }
    }
    return graph;
  }

  /**
   * Whether a node starts a basic block: the entry and the exit, nodes that do not have exactly
   * one predecessor, and nodes whose predecessor branches.
   */
  private static boolean isLeader(ControlFlowGraph cfg, ControlFlowNode node) {
    if (node.isEntry() || node.isExit()) {
      return true;
    }
    List<LinkedDirectedGraphEdge<ControlFlowNode, SuccessorType>> inEdges = cfg.getInEdges(node);
    if (inEdges.size() != 1) {
      return true;
    }
    ControlFlowNode pred = inEdges.get(0).getSource().getValue();
    return cfg.getOutEdges(pred).size() > 1;
  }

  public ControlFlowGraph getControlFlowGraph() {
    return cfg;
  }

  /** Returns the blocks in discovery order. */
  public ImmutableList<BasicBlock> getBasicBlocks() {
    return blocks;
  }

  public BasicBlock getBasicBlock(ControlFlowNode node) {
    BasicBlock block = blockOf.get(node);
    checkArgument(block != null, "%s is not reachable", node);
    return block;
  }

  /** Returns the position of {@code node} within its basic block. */
  public int getIndexInBlock(ControlFlowNode node) {
    getBasicBlock(node);
    return indexInBlock.get(node);
  }

  public BasicBlock getEntryBlock() {
    return getBasicBlock(cfg.getEntry());
  }

  /** Returns the block of the exit node, or null if no path reaches the exit. */
  public @Nullable BasicBlock getExitBlock() {
    return blockOf.get(cfg.getExit());
  }

  public ImmutableList<BasicBlock> getSuccessors(BasicBlock block) {
    ImmutableList.Builder<BasicBlock> successors = ImmutableList.builder();
    for (LinkedDirectedGraphEdge<BasicBlock, SuccessorType> edge : getOutEdges(block)) {
      successors.add(edge.getDestination().getValue());
    }
    return successors.build();
  }

  public ImmutableList<BasicBlock> getPredecessors(BasicBlock block) {
    ImmutableList.Builder<BasicBlock> predecessors = ImmutableList.builder();
    for (LinkedDirectedGraphEdge<BasicBlock, SuccessorType> edge : getInEdges(block)) {
      predecessors.add(edge.getSource().getValue());
    }
    return predecessors.build();
  }

  /** Whether control reaches the block from more than one predecessor. */
  public boolean isJoinBlock(BasicBlock block) {
    return getInEdges(block).size() > 1;
  }

  /** Whether the block ends in a branch with more than one kind of outgoing edge. */
  public boolean isConditionBlock(BasicBlock block) {
    Set<SuccessorType> types = new HashSet<>();
    for (LinkedDirectedGraphEdge<BasicBlock, SuccessorType> edge : getOutEdges(block)) {
      types.add(edge.getValue());
    }
    return types.size() > 1;
  }

  /**
   * Whether taking the {@code type} edge from the condition block {@code condition} to {@code
   * successor} is the only way to reach {@code successor}: the edge is the only one between the
   * two blocks and {@code successor} dominates all of its other predecessors.
   */
  public boolean immediatelyControls(
      BasicBlock condition, BasicBlock successor, SuccessorType type) {
    if (!isConditionBlock(condition)) {
      return false;
    }
    int edgesToSuccessor = 0;
    boolean hasTypedEdge = false;
    for (LinkedDirectedGraphEdge<BasicBlock, SuccessorType> edge : getOutEdges(condition)) {
      if (edge.getDestination().getValue() == successor) {
        edgesToSuccessor++;
        hasTypedEdge |= edge.getValue().equals(type);
      }
    }
    if (edgesToSuccessor != 1 || !hasTypedEdge) {
      return false;
    }
    for (BasicBlock pred : getPredecessors(successor)) {
      if (pred != condition && !dominates(successor, pred)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Whether {@code controlled} only executes when the condition block {@code condition} takes its
   * {@code type} edge.
   */
  public boolean controls(BasicBlock condition, BasicBlock controlled, SuccessorType type) {
    for (BasicBlock successor : ImmutableSet.copyOf(getSuccessors(condition))) {
      if (immediatelyControls(condition, successor, type) && dominates(successor, controlled)) {
        return true;
      }
    }
    return false;
  }

  /** Whether every path from the entry to {@code b} passes through {@code a}. */
  public boolean dominates(BasicBlock a, BasicBlock b) {
    return dominators.get().dominates(a, b);
  }

  public boolean strictlyDominates(BasicBlock a, BasicBlock b) {
    return a != b && dominates(a, b);
  }

  /**
   * Whether every path from {@code b} to the exit passes through {@code a}. A block from which the
   * exit cannot be reached is post-dominated only by itself.
   */
  public boolean postDominates(BasicBlock a, BasicBlock b) {
    DominatorTree<BasicBlock> tree = postDominators.get();
    return tree == null ? a == b : tree.dominates(a, b);
  }

  public boolean strictlyPostDominates(BasicBlock a, BasicBlock b) {
    return a != b && postDominates(a, b);
  }

  /** Returns the immediate dominator of {@code block}, or null for the entry block. */
  public @Nullable BasicBlock getImmediateDominator(BasicBlock block) {
    return dominators.get().getImmediateDominator(block);
  }

  /**
   * Returns the immediate post-dominator of {@code block}, or null for the exit block and for
   * blocks that cannot reach the exit.
   */
  public @Nullable BasicBlock getImmediatePostDominator(BasicBlock block) {
    DominatorTree<BasicBlock> tree = postDominators.get();
    return tree == null ? null : tree.getImmediateDominator(block);
  }

  public ImmutableSet<BasicBlock> getDominanceFrontier(BasicBlock block) {
    return dominators.get().getDominanceFrontier(block);
  }

  public boolean dominates(ControlFlowNode a, ControlFlowNode b) {
    BasicBlock blockA = getBasicBlock(a);
    BasicBlock blockB = getBasicBlock(b);
    if (blockA == blockB) {
      return indexInBlock.get(a) <= indexInBlock.get(b);
    }
    return dominates(blockA, blockB);
  }

  public boolean strictlyDominates(ControlFlowNode a, ControlFlowNode b) {
    return !a.equals(b) && dominates(a, b);
  }

  public boolean postDominates(ControlFlowNode a, ControlFlowNode b) {
    BasicBlock blockA = getBasicBlock(a);
    BasicBlock blockB = getBasicBlock(b);
    if (blockA == blockB) {
      return indexInBlock.get(a) >= indexInBlock.get(b);
    }
    return postDominates(blockA, blockB);
  }

  public boolean strictlyPostDominates(ControlFlowNode a, ControlFlowNode b) {
    return !a.equals(b) && postDominates(a, b);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Basic blocks:\n");
    for (BasicBlock block : blocks) {
      sb.append(block).append(" -> ").append(getSuccessors(block)).append('\n');
    }
    return sb.toString();
  }
}
