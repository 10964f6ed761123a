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
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A directed graph using linked list within nodes to store edge information.
 *
 * <p>Nodes are kept in insertion order, so iterating over a graph built by a deterministic
 * procedure is itself deterministic.
 *
 * @param <N> Value type that the graph node stores.
 * @param <E> Value type that the graph edge stores.
 */
public class LinkedDirectedGraph<N, E> extends DiGraph<N, E> {

  private final Map<N, LinkedDirectedGraphNode<N, E>> nodes = new LinkedHashMap<>();

  public static <N, E> LinkedDirectedGraph<N, E> create() {
    return new LinkedDirectedGraph<>();
  }

  protected LinkedDirectedGraph() {}

  @Override
  public Collection<LinkedDirectedGraphNode<N, E>> getNodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  @Override
  public @Nullable LinkedDirectedGraphNode<N, E> getNode(N nodeValue) {
    return nodes.get(nodeValue);
  }

  @Override
  public LinkedDirectedGraphNode<N, E> createNode(N nodeValue) {
    return nodes.computeIfAbsent(checkNotNull(nodeValue), LinkedDirectedGraphNode::new);
  }

  @Override
  public void connect(N srcValue, E edgeValue, N destValue) {
    LinkedDirectedGraphNode<N, E> src = getNodeOrFail(srcValue);
    LinkedDirectedGraphNode<N, E> dest = getNodeOrFail(destValue);
    LinkedDirectedGraphEdge<N, E> edge = new LinkedDirectedGraphEdge<>(src, edgeValue, dest);
    src.outEdges.add(edge);
    dest.inEdges.add(edge);
  }

  @Override
  public boolean connectIfNotFound(N srcValue, E edgeValue, N destValue) {
    if (isConnectedInDirection(srcValue, edgeValue, destValue)) {
      return false;
    }
    connect(srcValue, edgeValue, destValue);
    return true;
  }

  @Override
  public List<LinkedDirectedGraphEdge<N, E>> getOutEdges(N nodeValue) {
    return Collections.unmodifiableList(getNodeOrFail(nodeValue).outEdges);
  }

  @Override
  public List<LinkedDirectedGraphEdge<N, E>> getInEdges(N nodeValue) {
    return Collections.unmodifiableList(getNodeOrFail(nodeValue).inEdges);
  }

  @Override
  public List<LinkedDirectedGraphNode<N, E>> getDirectedPredNodes(DiGraphNode<N, E> n) {
    LinkedDirectedGraphNode<N, E> node = getNodeOrFail(n.getValue());
    List<LinkedDirectedGraphNode<N, E>> result = new ArrayList<>(node.inEdges.size());
    for (LinkedDirectedGraphEdge<N, E> edge : node.inEdges) {
      result.add(edge.source);
    }
    return result;
  }

  @Override
  public List<LinkedDirectedGraphNode<N, E>> getDirectedSuccNodes(DiGraphNode<N, E> n) {
    LinkedDirectedGraphNode<N, E> node = getNodeOrFail(n.getValue());
    List<LinkedDirectedGraphNode<N, E>> result = new ArrayList<>(node.outEdges.size());
    for (LinkedDirectedGraphEdge<N, E> edge : node.outEdges) {
      result.add(edge.destination);
    }
    return result;
  }

  @Override
  public boolean isConnectedInDirection(N n1, E edgeValue, N n2) {
    LinkedDirectedGraphNode<N, E> src = nodes.get(n1);
    LinkedDirectedGraphNode<N, E> dest = nodes.get(n2);
    if (src == null || dest == null) {
      return false;
    }
    for (LinkedDirectedGraphEdge<N, E> edge : src.outEdges) {
      if (edge.destination == dest && edge.value.equals(edgeValue)) {
        return true;
      }
    }
    return false;
  }

  private LinkedDirectedGraphNode<N, E> getNodeOrFail(N nodeValue) {
    LinkedDirectedGraphNode<N, E> node = nodes.get(nodeValue);
    checkArgument(node != null, "%s does not exist in graph", nodeValue);
    return node;
  }

  /**
   * A directed graph node that stores outgoing edges and incoming edges as lists within the node.
   */
  public static final class LinkedDirectedGraphNode<N, E> implements DiGraphNode<N, E> {

    private final List<LinkedDirectedGraphEdge<N, E>> inEdges = new ArrayList<>();
    private final List<LinkedDirectedGraphEdge<N, E>> outEdges = new ArrayList<>();

    private final N value;

    private LinkedDirectedGraphNode(N nodeValue) {
      this.value = nodeValue;
    }

    @Override
    public N getValue() {
      return value;
    }

    @Override
    public List<LinkedDirectedGraphEdge<N, E>> getOutEdges() {
      return Collections.unmodifiableList(outEdges);
    }

    @Override
    public List<LinkedDirectedGraphEdge<N, E>> getInEdges() {
      return Collections.unmodifiableList(inEdges);
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  /** A directed graph edge that stores the source and destination nodes at each edge. */
  public static final class LinkedDirectedGraphEdge<N, E> implements DiGraphEdge<N, E> {

    private final LinkedDirectedGraphNode<N, E> source;
    private final LinkedDirectedGraphNode<N, E> destination;
    private final E value;

    private LinkedDirectedGraphEdge(
        LinkedDirectedGraphNode<N, E> source, E edgeValue, LinkedDirectedGraphNode<N, E> dest) {
      this.source = source;
      this.destination = dest;
      this.value = checkNotNull(edgeValue);
    }

    @Override
    public LinkedDirectedGraphNode<N, E> getSource() {
      return source;
    }

    @Override
    public LinkedDirectedGraphNode<N, E> getDestination() {
      return destination;
    }

    @Override
    public E getValue() {
      return value;
    }

    @Override
    public String toString() {
      return source + " -> " + destination + " [" + value + "]";
    }
  }
}
