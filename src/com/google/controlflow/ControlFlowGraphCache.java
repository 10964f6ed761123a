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

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.controlflow.ast.Node;
import com.google.controlflow.ast.TypeHierarchy;
import java.util.logging.Logger;

/**
 * Memoizes control flow graphs per callable.
 *
 * <p>This allows several analyses to query the graph of a callable without recomputing it. Graphs
 * are memoized stupidly: if the tree of a callable changes, its graph must be invalidated.
 * Callables are held weakly and compared by identity.
 */
public final class ControlFlowGraphCache {

  private static final Logger logger = Logger.getLogger(ControlFlowGraphCache.class.getName());

  private final LoadingCache<Node, ControlFlowGraph> graphs;

  private ControlFlowGraphCache(
      TypeHierarchy typeHierarchy, boolean booleanSplitting, boolean continueAfterErrors) {
    this.graphs =
        CacheBuilder.newBuilder()
            .weakKeys()
            .build(
                new CacheLoader<Node, ControlFlowGraph>() {
                  @Override
                  public ControlFlowGraph load(Node callable) {
                    logger.fine("Computing Control Flow Graph");
                    return ControlFlowAnalysis.builder()
                        .setCfgRoot(callable)
                        .setTypeHierarchy(typeHierarchy)
                        .setBooleanSplitting(booleanSplitting)
                        .setContinueAfterErrors(continueAfterErrors)
                        .computeCfg();
                  }
                });
  }

  public static ControlFlowGraphCache create() {
    return create(TypeHierarchy.standard(), true);
  }

  public static ControlFlowGraphCache create(
      TypeHierarchy typeHierarchy, boolean booleanSplitting) {
    return create(typeHierarchy, booleanSplitting, false);
  }

  /**
   * @param continueAfterErrors whether internal routing errors are logged and their edges skipped
   *     instead of failing the computation of a graph
   */
  public static ControlFlowGraphCache create(
      TypeHierarchy typeHierarchy, boolean booleanSplitting, boolean continueAfterErrors) {
    return new ControlFlowGraphCache(typeHierarchy, booleanSplitting, continueAfterErrors);
  }

  /** Returns the graph of {@code callable}, computing it on first use. */
  public ControlFlowGraph get(Node callable) {
    checkArgument(callable.isCallable(), "Unexpected control flow graph root %s", callable);
    return graphs.getUnchecked(callable);
  }

  /** Whether the graph of {@code callable} is currently memoized. */
  public boolean contains(Node callable) {
    return graphs.getIfPresent(callable) != null;
  }

  /** Forgets the graph of {@code callable}, after its tree has changed. */
  public void invalidate(Node callable) {
    graphs.invalidate(callable);
  }

  public void invalidateAll() {
    graphs.invalidateAll();
  }
}
