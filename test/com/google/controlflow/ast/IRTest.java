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

package com.google.controlflow.ast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link IR} and the tree structure of {@link Node}. */
@RunWith(JUnit4.class)
public final class IRTest {

  @Test
  public void testMethodLayout() {
    Node body = IR.block();
    Node m = IR.method("m", body, "a", "b");

    assertThat(m.getToken()).isEqualTo(Token.METHOD);
    assertThat(m.isCallable()).isTrue();
    assertThat(m.getFirstChild().getString()).isEqualTo("m");
    assertThat(m.getSecondChild().getChildCount()).isEqualTo(2);
    assertThat(m.getLastChild()).isSameInstanceAs(body);
    assertThat(body.getParent()).isSameInstanceAs(m);
  }

  @Test
  public void testConstructorWithoutInitializer() {
    Node ctor = IR.constructor("C", null, IR.block());

    assertThat(ctor.getChildCount()).isEqualTo(4);
    assertThat(ctor.getChildAtIndex(2).isEmpty()).isTrue();
  }

  @Test
  public void testForLoopFillsAbsentParts() {
    Node body = IR.block();
    Node forNode = IR.forLoop(null, IR.name("c"), null, body);

    assertThat(forNode.getChildCount()).isEqualTo(4);
    assertThat(forNode.getFirstChild().isEmpty()).isTrue();
    assertThat(forNode.getSecondChild().isName()).isTrue();
    assertThat(forNode.getChildAtIndex(2).isEmpty()).isTrue();
    assertThat(forNode.getLastChild()).isSameInstanceAs(body);
  }

  @Test
  public void testCatchLayout() {
    Node filter = IR.name("f");
    Node catchNode = IR.catchClause("System.Exception", "e", filter, IR.block());

    assertThat(catchNode.getFirstChild().isTypeRef()).isTrue();
    assertThat(catchNode.getSecondChild().getString()).isEqualTo("e");
    assertThat(catchNode.getChildAtIndex(2)).isSameInstanceAs(filter);
    assertThat(IR.generalCatch(IR.block()).getFirstChild().isEmpty()).isTrue();
  }

  @Test
  public void testQualifiers() {
    Node receiver = IR.name("o");
    Node call = IR.callOn(receiver, "f", IR.number(1));
    Node unqualified = IR.call("g");
    Node access = IR.conditionalGetprop(IR.name("p"), "x");

    assertThat(call.getQualifier()).isSameInstanceAs(receiver);
    assertThat(call.getString()).isEqualTo("f");
    assertThat(unqualified.getQualifier()).isNull();
    assertThat(access.isConditionalAccess()).isTrue();
    assertThat(IR.nonReturningCall(IR.typeRef("Environment"), "Exit").isNonReturning()).isTrue();
  }

  @Test
  public void testSiblings() {
    Node a = IR.exprResult(IR.call("a"));
    Node b = IR.exprResult(IR.call("b"));
    Node c = IR.exprResult(IR.call("c"));
    Node block = IR.block(ImmutableList.of(a, b, c));

    assertThat(block.children()).containsExactly(a, b, c).inOrder();
    assertThat(a.getNext()).isSameInstanceAs(b);
    assertThat(c.getNext()).isNull();
    assertThat(b.getPrevious()).isSameInstanceAs(a);
    assertThat(block.getIndexOfChild(c)).isEqualTo(2);
    assertThat(c.isDescendantOf(block)).isTrue();
    assertThat(c.getFirstChild().getAncestors()).containsExactly(c, block).inOrder();
  }

  @Test
  public void testStructuralChecks() {
    assertThrows(IllegalStateException.class, () -> IR.method("m", IR.name("x")));
    assertThrows(IllegalStateException.class, () -> IR.ifStmt(IR.block(), IR.block()));
    assertThrows(IllegalStateException.class, () -> IR.exprResult(IR.returnStmt()));
    assertThrows(IllegalArgumentException.class, () -> IR.tryStatement(IR.block(), null));
    assertThrows(
        IllegalStateException.class,
        () -> IR.switchStmt(IR.name("x"), IR.defaultCase(IR.block()), IR.defaultCase(IR.block())));
  }

  @Test
  public void testToString() {
    assertThat(IR.name("x").toString()).isEqualTo("NAME x");
    assertThat(IR.block().toString()).isEqualTo("BLOCK");
    assertThat(IR.number(42).toString()).isEqualTo("NUMBER 42");
  }
}
