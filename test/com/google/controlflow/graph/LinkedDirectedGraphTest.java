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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.controlflow.graph.LinkedDirectedGraph.LinkedDirectedGraphEdge;
import com.google.controlflow.graph.LinkedDirectedGraph.LinkedDirectedGraphNode;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link LinkedDirectedGraph}. */
@RunWith(JUnit4.class)
public final class LinkedDirectedGraphTest {

  @Test
  public void testNodesKeepCreationOrder() {
    LinkedDirectedGraph<String, String> graph = LinkedDirectedGraph.create();
    graph.createNode("c");
    graph.createNode("a");
    graph.createNode("b");
    LinkedDirectedGraphNode<String, String> again = graph.createNode("a");

    List<String> values = new ArrayList<>();
    for (LinkedDirectedGraphNode<String, String> node : graph.getNodes()) {
      values.add(node.getValue());
    }
    assertThat(values).containsExactly("c", "a", "b").inOrder();
    assertThat(again).isSameInstanceAs(graph.getNode("a"));
    assertThat(graph.getNodeCount()).isEqualTo(3);
    assertThat(graph.hasNode("b")).isTrue();
    assertThat(graph.hasNode("z")).isFalse();
  }

  @Test
  public void testConnect() {
    LinkedDirectedGraph<String, String> graph = LinkedDirectedGraph.create();
    graph.createNode("a");
    graph.createNode("b");
    graph.connect("a", "x", "b");

    List<LinkedDirectedGraphEdge<String, String>> out = graph.getOutEdges("a");
    assertThat(out).hasSize(1);
    assertThat(out.get(0).getSource().getValue()).isEqualTo("a");
    assertThat(out.get(0).getDestination().getValue()).isEqualTo("b");
    assertThat(out.get(0).getValue()).isEqualTo("x");
    assertThat(graph.getInEdges("b")).containsExactlyElementsIn(out);
    assertThat(graph.getInEdges("a")).isEmpty();
    assertThat(graph.isConnectedInDirection("a", "x", "b")).isTrue();
    assertThat(graph.isConnectedInDirection("a", "y", "b")).isFalse();
    assertThat(graph.isConnectedInDirection("b", "x", "a")).isFalse();
    assertThat(out.get(0).toString()).isEqualTo("a -> b [x]");
  }

  @Test
  public void testConnectIfNotFound() {
    LinkedDirectedGraph<String, String> graph = LinkedDirectedGraph.create();
    graph.createNode("a");
    graph.createNode("b");

    assertThat(graph.connectIfNotFound("a", "x", "b")).isTrue();
    assertThat(graph.connectIfNotFound("a", "x", "b")).isFalse();
    assertThat(graph.connectIfNotFound("a", "y", "b")).isTrue();
    assertThat(graph.getOutEdges("a")).hasSize(2);
  }

  @Test
  public void testDirectedNeighbors() {
    LinkedDirectedGraph<String, String> graph = LinkedDirectedGraph.create();
    LinkedDirectedGraphNode<String, String> a = graph.createNode("a");
    LinkedDirectedGraphNode<String, String> b = graph.createNode("b");
    LinkedDirectedGraphNode<String, String> c = graph.createNode("c");
    graph.connect("a", "-", "b");
    graph.connect("a", "-", "c");
    graph.connect("c", "-", "b");

    assertThat(graph.getDirectedSuccNodes(a)).containsExactly(b, c).inOrder();
    assertThat(graph.getDirectedPredNodes(b)).containsExactly(a, c).inOrder();
    assertThat(graph.getDirectedPredNodes(a)).isEmpty();
  }

  @Test
  public void testMissingNode() {
    LinkedDirectedGraph<String, String> graph = LinkedDirectedGraph.create();
    graph.createNode("a");

    assertThrows(IllegalArgumentException.class, () -> graph.connect("a", "x", "b"));
    assertThrows(IllegalArgumentException.class, () -> graph.getOutEdges("b"));
    assertThat(graph.getNode("b")).isNull();
    assertThat(graph.isConnectedInDirection("a", "x", "b")).isFalse();
  }
}
