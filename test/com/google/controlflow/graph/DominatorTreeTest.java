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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link DominatorTree}. */
@RunWith(JUnit4.class)
public final class DominatorTreeTest {

  private static LinkedDirectedGraph<String, String> createGraph(String... edges) {
    LinkedDirectedGraph<String, String> graph = LinkedDirectedGraph.create();
    for (String edge : edges) {
      String[] ends = edge.split("->");
      graph.createNode(ends[0]);
      graph.createNode(ends[1]);
      graph.connect(ends[0], "-", ends[1]);
    }
    return graph;
  }

  @Test
  public void testDiamond() {
    DominatorTree<String> tree =
        DominatorTree.forward(createGraph("A->B", "A->C", "B->D", "C->D"), "A");

    assertThat(tree.getRoot()).isEqualTo("A");
    assertThat(tree.getImmediateDominator("A")).isNull();
    assertThat(tree.getImmediateDominator("B")).isEqualTo("A");
    assertThat(tree.getImmediateDominator("C")).isEqualTo("A");
    assertThat(tree.getImmediateDominator("D")).isEqualTo("A");
    assertThat(tree.dominates("A", "D")).isTrue();
    assertThat(tree.dominates("B", "D")).isFalse();
    assertThat(tree.dominates("D", "D")).isTrue();
    assertThat(tree.strictlyDominates("D", "D")).isFalse();
    assertThat(tree.getDominanceFrontier("B")).containsExactly("D");
    assertThat(tree.getDominanceFrontier("C")).containsExactly("D");
    assertThat(tree.getDominanceFrontier("A")).isEmpty();
  }

  @Test
  public void testChain() {
    DominatorTree<String> tree = DominatorTree.forward(createGraph("A->B", "B->C"), "A");

    assertThat(tree.getImmediateDominator("C")).isEqualTo("B");
    assertThat(tree.dominates("A", "C")).isTrue();
    assertThat(tree.dominates("C", "A")).isFalse();
  }

  @Test
  public void testLoop() {
    DominatorTree<String> tree =
        DominatorTree.forward(createGraph("A->B", "B->C", "C->B", "C->D"), "A");

    assertThat(tree.getImmediateDominator("B")).isEqualTo("A");
    assertThat(tree.getImmediateDominator("C")).isEqualTo("B");
    assertThat(tree.getImmediateDominator("D")).isEqualTo("C");
    assertThat(tree.getDominanceFrontier("C")).containsExactly("B");
    assertThat(tree.getDominanceFrontier("B")).containsExactly("B");
    assertThat(tree.getDominanceFrontier("D")).isEmpty();
  }

  @Test
  public void testUnreachableNode() {
    LinkedDirectedGraph<String, String> graph = createGraph("A->B", "E->B");
    DominatorTree<String> tree = DominatorTree.forward(graph, "A");

    assertThat(tree.contains("E")).isFalse();
    assertThat(tree.getImmediateDominator("B")).isEqualTo("A");
    assertThat(tree.dominates("E", "E")).isTrue();
    assertThat(tree.dominates("A", "E")).isFalse();
    assertThat(tree.getDominanceFrontier("E")).isEmpty();
  }

  @Test
  public void testBackward() {
    DominatorTree<String> tree =
        DominatorTree.backward(createGraph("A->B", "A->C", "B->D", "C->D", "D->X"), "X");

    assertThat(tree.getRoot()).isEqualTo("X");
    assertThat(tree.getImmediateDominator("D")).isEqualTo("X");
    assertThat(tree.getImmediateDominator("A")).isEqualTo("D");
    assertThat(tree.getImmediateDominator("B")).isEqualTo("D");
    assertThat(tree.dominates("D", "A")).isTrue();
    assertThat(tree.dominates("B", "A")).isFalse();
    assertThat(tree.getDominanceFrontier("B")).containsExactly("A");
  }

  @Test
  public void testBackwardIgnoresNodesThatCannotReachRoot() {
    DominatorTree<String> tree =
        DominatorTree.backward(createGraph("A->B", "A->L", "L->L", "B->X"), "X");

    assertThat(tree.contains("L")).isFalse();
    assertThat(tree.getImmediateDominator("A")).isEqualTo("B");
  }

  @Test
  public void testRootMustBeInGraph() {
    LinkedDirectedGraph<String, String> graph = createGraph("A->B");
    assertThrows(IllegalArgumentException.class, () -> DominatorTree.forward(graph, "Z"));
  }
}
