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

import java.util.Collection;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A directed graph.
 *
 * @param <N> Value type that the graph node stores.
 * @param <E> Value type that the graph edge stores.
 */
public abstract class DiGraph<N, E> {

  /** Gets all the nodes of the graph, in insertion order. */
  public abstract Collection<? extends DiGraphNode<N, E>> getNodes();

  /** Gets the node holding the given value, or null if there is none. */
  public abstract @Nullable DiGraphNode<N, E> getNode(N nodeValue);

  /** Gets the node holding the given value, creating it if necessary. */
  public abstract DiGraphNode<N, E> createNode(N nodeValue);

  /** Connects two existing nodes with an edge holding the given value. */
  public abstract void connect(N srcValue, E edgeValue, N destValue);

  /**
   * Connects two nodes unless an edge with an equal value already connects them in this direction.
   *
   * @return Whether a new edge was added.
   */
  public abstract boolean connectIfNotFound(N srcValue, E edgeValue, N destValue);

  public abstract List<? extends DiGraphEdge<N, E>> getOutEdges(N nodeValue);

  public abstract List<? extends DiGraphEdge<N, E>> getInEdges(N nodeValue);

  public abstract List<? extends DiGraphNode<N, E>> getDirectedPredNodes(DiGraphNode<N, E> n);

  public abstract List<? extends DiGraphNode<N, E>> getDirectedSuccNodes(DiGraphNode<N, E> n);

  public abstract boolean isConnectedInDirection(N n1, E edgeValue, N n2);

  public int getNodeCount() {
    return getNodes().size();
  }

  public boolean hasNode(N nodeValue) {
    return getNode(nodeValue) != null;
  }

  /**
   * A generic directed graph node.
   *
   * @param <N> Value type that the graph node stores.
   * @param <E> Value type that the graph edge stores.
   */
  public interface DiGraphNode<N, E> {

    N getValue();

    List<? extends DiGraphEdge<N, E>> getOutEdges();

    List<? extends DiGraphEdge<N, E>> getInEdges();
  }

  /**
   * A generic directed graph edge.
   *
   * @param <N> Value type that the graph node stores.
   * @param <E> Value type that the graph edge stores.
   */
  public interface DiGraphEdge<N, E> {

    DiGraphNode<N, E> getSource();

    DiGraphNode<N, E> getDestination();

    E getValue();
  }
}
