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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.util.concurrent.UncheckedExecutionException;
import com.google.controlflow.ast.IR;
import com.google.controlflow.ast.Node;
import com.google.controlflow.ast.TypeHierarchy;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link ControlFlowGraphCache}. */
@RunWith(JUnit4.class)
public final class ControlFlowGraphCacheTest {

  private static Node createMethod() {
    return IR.method("m", IR.block(IR.exprResult(IR.call("f"))));
  }

  @Test
  public void testGraphIsComputedOnce() {
    ControlFlowGraphCache cache = ControlFlowGraphCache.create();
    Node m = createMethod();

    assertThat(cache.contains(m)).isFalse();
    ControlFlowGraph cfg = cache.get(m);
    assertThat(cfg.getCallable()).isSameInstanceAs(m);
    assertThat(cache.contains(m)).isTrue();
    assertThat(cache.get(m)).isSameInstanceAs(cfg);
  }

  @Test
  public void testCallablesAreComparedByIdentity() {
    ControlFlowGraphCache cache = ControlFlowGraphCache.create();
    Node m1 = createMethod();
    Node m2 = createMethod();

    assertThat(cache.get(m1)).isNotSameInstanceAs(cache.get(m2));
  }

  @Test
  public void testInvalidate() {
    ControlFlowGraphCache cache = ControlFlowGraphCache.create();
    Node m = createMethod();
    ControlFlowGraph before = cache.get(m);

    cache.invalidate(m);
    assertThat(cache.contains(m)).isFalse();
    assertThat(cache.get(m)).isNotSameInstanceAs(before);

    cache.invalidateAll();
    assertThat(cache.contains(m)).isFalse();
  }

  @Test
  public void testOptionsAreApplied() {
    Node second = IR.name("b");
    Node m =
        IR.method(
            "m",
            IR.block(
                IR.ifStmt(IR.name("b"), IR.exprResult(IR.call("x"))),
                IR.ifStmt(second, IR.exprResult(IR.call("y")))));

    assertThat(ControlFlowGraphCache.create().get(m).getNodes(second)).hasSize(2);
    assertThat(
            ControlFlowGraphCache.create(TypeHierarchy.standard(), false).get(m).getNodes(second))
        .hasSize(1);
  }

  @Test
  public void testContinueAfterErrors() {
    Node m = IR.method("m", IR.block(IR.breakStmt()));

    ControlFlowGraphCache strict = ControlFlowGraphCache.create();
    UncheckedExecutionException e =
        assertThrows(UncheckedExecutionException.class, () -> strict.get(m));
    assertThat(e).hasCauseThat().isInstanceOf(IllegalStateException.class);

    ControlFlowGraphCache lenient =
        ControlFlowGraphCache.create(
            TypeHierarchy.standard(),
            /* booleanSplitting= */ true,
            /* continueAfterErrors= */ true);
    ControlFlowGraph cfg = lenient.get(m);
    assertThat(cfg.isReachable(cfg.getExit())).isFalse();
  }

  @Test
  public void testRootMustBeCallable() {
    ControlFlowGraphCache cache = ControlFlowGraphCache.create();
    assertThrows(IllegalArgumentException.class, () -> cache.get(IR.block()));
  }
}
