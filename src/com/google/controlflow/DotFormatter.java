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

import com.google.controlflow.graph.LinkedDirectedGraph.LinkedDirectedGraphEdge;
import com.google.controlflow.graph.LinkedDirectedGraph.LinkedDirectedGraphNode;
import java.io.IOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * DotFormatter prints out a dot file of a {@link ControlFlowGraph}. For a detailed description of
 * the dot format and visualization tool refer to <a href="http://www.graphviz.org">Graphviz</a>.
 *
 * <p>Typical usage of this class
 *
 * <pre>{@code System.out.println(DotFormatter.toDot(cfg));}</pre>
 */
public final class DotFormatter {
  private static final String INDENT = "  ";
  private static final String ARROW = " -> ";

  // stores the current assignment of node to keys
  private final Map<ControlFlowNode, Integer> assignments = new HashMap<>();

  // key count in order to assign a unique key to each node
  private int keyCount = 0;

  // the builder used to generate the dot diagram
  private final Appendable builder;

  private final ControlFlowGraph cfg;

  private DotFormatter(ControlFlowGraph cfg, Appendable builder) throws IOException {
    this.cfg = cfg;
    this.builder = builder;

    formatPreamble();
    traverseNodes();
    formatConclusion();
  }

  /**
   * Converts a control flow graph to dot representation.
   *
   * @param cfg the graph described in the dot formatted string
   * @return the dot representation of the graph
   */
  public static String toDot(ControlFlowGraph cfg) throws IOException {
    StringBuilder builder = new StringBuilder();
    appendDot(cfg, builder);
    return builder.toString();
  }

  /**
   * Converts a control flow graph to dot representation and appends it to the given buffer.
   *
   * @param cfg the graph described in the dot formatted string
   * @param builder A place to dump the graph.
   */
  public static void appendDot(ControlFlowGraph cfg, Appendable builder) throws IOException {
    new DotFormatter(cfg, builder);
  }

  private void traverseNodes() throws IOException {
    // Keys follow discovery order so that the output is stable.
    for (LinkedDirectedGraphNode<ControlFlowNode, SuccessorType> node : cfg.getNodes()) {
      key(node.getValue());
    }

    for (LinkedDirectedGraphNode<ControlFlowNode, SuccessorType> node : cfg.getNodes()) {
      List<LinkedDirectedGraphEdge<ControlFlowNode, SuccessorType>> outEdges =
          node.getOutEdges();
      String[] edgeList = new String[outEdges.size()];
      for (int i = 0; i < edgeList.length; i++) {
        LinkedDirectedGraphEdge<ControlFlowNode, SuccessorType> edge = outEdges.get(i);
        edgeList[i] =
            formatNodeName(key(node.getValue()))
                + ARROW
                + formatNodeName(key(edge.getDestination().getValue()))
                + " [label=\""
                + escape(edge.getValue().toString())
                + "\""
                + (edge.getValue().isConditional() ? ", fontcolor=\"red\", color=\"red\"" : "")
                + "];\n";
      }

      Arrays.sort(edgeList);

      for (String edge : edgeList) {
        builder.append(INDENT);
        builder.append(edge);
      }
    }
  }

  int key(ControlFlowNode n) throws IOException {
    Integer key = assignments.get(n);
    if (key == null) {
      key = keyCount++;
      assignments.put(n, key);
      builder.append(INDENT);
      builder.append(formatNodeName(key));
      builder.append(" [label=\"");
      builder.append(escape(n.toString()));
      builder.append("\"");
      if (!n.isElement()) {
        builder.append(" shape=box");
      }
      builder.append("];\n");
    }
    return key;
  }

  private static String escape(String label) {
    return label.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  private static String formatNodeName(Integer key) {
    return "node" + key;
  }

  private void formatPreamble() throws IOException {
    builder.append("digraph CFG {\n");
    builder.append(INDENT);
    builder.append("node [color=lightblue2, style=filled];\n");
  }

  private void formatConclusion() throws IOException {
    builder.append("}\n");
  }
}
