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

import com.google.common.collect.ImmutableList;

/**
 * Represents a section of code that is uninterrupted by control structures: a maximal chain of
 * control flow nodes in which every node but the first has a single predecessor and every node
 * but the last has a single successor.
 */
public final class BasicBlock {

  private final int id;

  private final ImmutableList<ControlFlowNode> nodes;

  BasicBlock(int id, ImmutableList<ControlFlowNode> nodes) {
    this.id = id;
    this.nodes = nodes;
  }

  /** Position of the block in discovery order. The entry block is 0. */
  public int getId() {
    return id;
  }

  public ImmutableList<ControlFlowNode> getNodes() {
    return nodes;
  }

  public ControlFlowNode getFirstNode() {
    return nodes.get(0);
  }

  public ControlFlowNode getLastNode() {
    return nodes.get(nodes.size() - 1);
  }

  public int size() {
    return nodes.size();
  }

  public boolean contains(ControlFlowNode node) {
    return nodes.contains(node);
  }

  @Override
  public String toString() {
    return "BB" + id + nodes;
  }
}
