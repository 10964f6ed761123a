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

import com.google.common.collect.ImmutableList;
import com.google.controlflow.ast.IR;
import com.google.controlflow.ast.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link SplitTagger}. */
@RunWith(JUnit4.class)
public final class SplitTaggerTest {

  @Test
  public void testBooleanPartners() {
    Node first = IR.name("b");
    Node second = IR.name("b");
    Node other = IR.name("c");
    Node m =
        IR.method(
            "m",
            IR.block(
                IR.ifStmt(first, IR.block()),
                IR.ifStmt(other, IR.block()),
                IR.exprResult(IR.call("f")),
                IR.ifStmt(second, IR.block())));
    SplitTagger tagger = new SplitTagger(m, true);

    assertThat(tagger.isBooleanSplitSource(first)).isTrue();
    assertThat(tagger.isBooleanSplitSource(second)).isFalse();
    assertThat(tagger.isBooleanSplitSource(other)).isFalse();
    assertThat(tagger.getBooleanSplitSource(second)).isSameInstanceAs(first);
    assertThat(tagger.getBooleanSplitSource(first)).isNull();
  }

  @Test
  public void testBooleanSplittingDisabled() {
    Node first = IR.name("b");
    Node m =
        IR.method(
            "m", IR.block(IR.ifStmt(first, IR.block()), IR.ifStmt(IR.name("b"), IR.block())));

    assertThat(new SplitTagger(m, false).isBooleanSplitSource(first)).isFalse();
  }

  @Test
  public void testWritesAndLabelsBreakPartnership() {
    Node afterWrite = IR.name("b");
    Node afterLabel = IR.name("c");
    Node m =
        IR.method(
            "m",
            IR.block(
                IR.ifStmt(IR.name("b"), IR.block()),
                IR.exprResult(IR.inc(IR.name("b"))),
                IR.ifStmt(afterWrite, IR.block()),
                IR.ifStmt(IR.name("c"), IR.block()),
                IR.label("L", IR.exprResult(IR.call("f"))),
                IR.ifStmt(afterLabel, IR.block())));
    SplitTagger tagger = new SplitTagger(m, true);

    assertThat(tagger.getBooleanSplitSource(afterWrite)).isNull();
    assertThat(tagger.getBooleanSplitSource(afterLabel)).isNull();
  }

  @Test
  public void testBooleanRegion() {
    Node first = IR.name("b");
    Node firstThen = IR.block();
    Node middle = IR.exprResult(IR.call("f"));
    Node second = IR.name("b");
    Node secondIf = IR.ifStmt(second, IR.block());
    Node after = IR.exprResult(IR.call("g"));
    Node m = IR.method("m", IR.block(IR.ifStmt(first, firstThen), middle, secondIf, after));
    SplitTagger tagger = new SplitTagger(m, true);
    Split split = Split.booleanSplit(first, true);

    assertThat(tagger.isInRegion(split, first)).isFalse();
    assertThat(tagger.isInRegion(split, firstThen)).isTrue();
    assertThat(tagger.isInRegion(split, middle)).isTrue();
    assertThat(tagger.isInRegion(split, secondIf)).isTrue();
    assertThat(tagger.isInRegion(split, second)).isTrue();
    assertThat(tagger.isInRegion(split, secondIf.getSecondChild())).isFalse();
    assertThat(tagger.isInRegion(split, after)).isFalse();
  }

  @Test
  public void testFinallyAndHandlerRegions() {
    Node filter = IR.name("c");
    Node catchBody = IR.block();
    Node catchNode = IR.catchClause("System.Exception", "e", filter, catchBody);
    Node finallyBlock = IR.block(IR.exprResult(IR.call("f")));
    Node tryBody = IR.block();
    Node tryNode = IR.tryStatement(tryBody, finallyBlock, catchNode);
    Node m = IR.method("m", IR.block(tryNode));
    SplitTagger tagger = new SplitTagger(m, true);

    Split finallySplit = Split.finallySplit(tryNode, Completion.returnCompletion());
    assertThat(tagger.isInRegion(finallySplit, finallyBlock)).isTrue();
    assertThat(tagger.isInRegion(finallySplit, finallyBlock.getFirstChild())).isTrue();
    assertThat(tagger.isInRegion(finallySplit, tryBody)).isFalse();

    Split handlerSplit = Split.exceptionHandlerSplit(tryNode, "System.Exception");
    assertThat(tagger.isInRegion(handlerSplit, catchNode)).isTrue();
    assertThat(tagger.isInRegion(handlerSplit, filter)).isTrue();
    assertThat(tagger.isInRegion(handlerSplit, catchBody)).isFalse();
    assertThat(tagger.isInRegion(handlerSplit, finallyBlock)).isFalse();
  }

  @Test
  public void testSuccessorSplits() {
    Node innerFinally = IR.block(IR.exprResult(IR.call("g")));
    Node innerTry = IR.tryFinally(IR.block(), innerFinally);
    Node outerFinally = IR.block(innerTry);
    Node outerTry = IR.tryFinally(IR.block(), outerFinally);
    Node m = IR.method("m", IR.block(outerTry));
    SplitTagger tagger = new SplitTagger(m, true);

    Split outerSplit = Split.finallySplit(outerTry, Completion.returnCompletion());
    Split innerSplit = Split.finallySplit(innerTry, Completion.throwCompletion("E"));
    SplitSet current =
        tagger.getSuccessorSplits(SplitSet.empty(), innerTry, ImmutableList.of(outerSplit));
    assertThat(current.getSplits()).containsExactly(outerSplit);

    // Splits are kept in a canonical order regardless of creation order.
    SplitSet nested =
        tagger.getSuccessorSplits(current, innerFinally, ImmutableList.of(innerSplit));
    assertThat(nested.getSplits()).containsExactly(outerSplit, innerSplit).inOrder();

    // A new split for the same anchor replaces the old one.
    Split replacement = Split.finallySplit(outerTry, Completion.breakCompletion(null));
    SplitSet replaced =
        tagger.getSuccessorSplits(current, innerTry, ImmutableList.of(replacement));
    assertThat(replaced.getSplits()).containsExactly(replacement);

    // Leaving a region drops its split, and the exit carries none.
    assertThat(tagger.getSuccessorSplits(nested, outerTry, ImmutableList.of()).isEmpty())
        .isTrue();
    assertThat(tagger.getSuccessorSplits(nested, null, ImmutableList.of()).isEmpty()).isTrue();
  }

  @Test
  public void testPositionsFollowPreOrder() {
    Node first = IR.exprResult(IR.call("f"));
    Node second = IR.exprResult(IR.call("g"));
    Node body = IR.block(first, second);
    Node m = IR.method("m", body);
    SplitTagger tagger = new SplitTagger(m, true);

    assertThat(tagger.position(m)).isEqualTo(0);
    assertThat(tagger.position(body)).isLessThan(tagger.position(first));
    assertThat(tagger.position(first.getFirstChild())).isLessThan(tagger.position(second));
  }
}
