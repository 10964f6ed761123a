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
import com.google.controlflow.ast.TypeHierarchy;
import java.util.Comparator;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link CompletionModel}. */
@RunWith(JUnit4.class)
public final class CompletionModelTest {

  private final CompletionModel model = CompletionModel.create(TypeHierarchy.standard());

  private ImmutableList<Completion> completionsOf(Node element) {
    return model.getCompletions(element, SplitSet.empty());
  }

  private static SplitSet thrown(Node tryNode, String type) {
    return SplitSet.of(
        ImmutableList.of(Split.exceptionHandlerSplit(tryNode, type)),
        Comparator.comparing(Split::getKind));
  }

  @Test
  public void testPlainExpression() {
    Node value = IR.name("y");
    IR.method("m", IR.block(IR.exprResult(IR.assign(IR.name("x"), value))));

    assertThat(completionsOf(value)).containsExactly(Completion.normal());
  }

  @Test
  public void testCondition() {
    Node cond = IR.name("c");
    IR.method("m", IR.block(IR.ifStmt(cond, IR.block())));

    assertThat(completionsOf(cond))
        .containsExactly(Completion.ofBoolean(true), Completion.ofBoolean(false))
        .inOrder();
  }

  @Test
  public void testConstantCondition() {
    Node cond = IR.falseNode();
    IR.method("m", IR.block(IR.whileLoop(cond, IR.block())));

    assertThat(completionsOf(cond)).containsExactly(Completion.ofBoolean(false));
  }

  @Test
  public void testNullness() {
    Node nullable = IR.name("a");
    Node nullLiteral = IR.nullNode();
    Node created = IR.newObject("T");
    IR.method(
        "m",
        IR.block(
            IR.exprResult(IR.assign(IR.name("x"), IR.coalesce(nullable, IR.name("b")))),
            IR.exprResult(IR.assign(IR.name("y"), IR.coalesce(nullLiteral, IR.name("b")))),
            IR.exprResult(IR.assign(IR.name("z"), IR.coalesce(created, IR.name("b"))))));

    assertThat(completionsOf(nullable))
        .containsExactly(Completion.nullness(true), Completion.nullness(false));
    assertThat(completionsOf(nullLiteral)).containsExactly(Completion.nullness(true));
    assertThat(completionsOf(created)).containsExactly(Completion.nullness(false));
  }

  @Test
  public void testTransparentAndUnevaluatedNodes() {
    Node and = IR.and(IR.name("a"), IR.name("b"));
    Node typeRef = IR.typeRef("T");
    IR.method("m", IR.block(IR.ifStmt(and, IR.block())));

    assertThat(completionsOf(and)).isEmpty();
    assertThat(completionsOf(typeRef)).isEmpty();
  }

  @Test
  public void testPreOrderStatement() {
    Node block = IR.block();
    IR.method("m", IR.block(block));

    assertThat(completionsOf(block)).containsExactly(Completion.normal());
  }

  @Test
  public void testCaseTests() {
    Node constantCase = IR.caseClause(IR.number(1), IR.block());
    Node discardCase = IR.caseClause(IR.discard(), IR.block());
    IR.method("m", IR.block(IR.switchStmt(IR.name("x"), constantCase, discardCase)));

    assertThat(completionsOf(constantCase))
        .containsExactly(Completion.matching(true), Completion.matching(false));
    assertThat(completionsOf(discardCase)).containsExactly(Completion.matching(true));
  }

  @Test
  public void testForEach() {
    Node forEach = IR.forEach("v", IR.name("xs"), IR.block());
    IR.method("m", IR.block(forEach));

    assertThat(completionsOf(forEach))
        .containsExactly(Completion.emptiness(true), Completion.emptiness(false));
  }

  @Test
  public void testJumps() {
    Node returnNode = IR.returnStmt();
    Node breakNode = IR.breakStmt("L");
    Node continueNode = IR.continueStmt();
    Node gotoCase = IR.gotoCase(IR.number(2));
    Node gotoLabel = IR.gotoLabel("L");
    IR.method(
        "m",
        IR.block(
            IR.label(
                "L",
                IR.whileLoop(IR.name("c"), IR.block(breakNode, continueNode, gotoLabel))),
            IR.switchStmt(IR.name("x"), IR.caseClause(IR.number(2), IR.block(gotoCase))),
            returnNode));

    assertThat(completionsOf(returnNode)).containsExactly(Completion.returnCompletion());
    assertThat(completionsOf(breakNode)).containsExactly(Completion.breakCompletion("L"));
    assertThat(completionsOf(continueNode)).containsExactly(Completion.continueCompletion(null));
    assertThat(completionsOf(gotoCase)).containsExactly(Completion.gotoCase("NUMBER 2"));
    assertThat(completionsOf(gotoLabel)).containsExactly(Completion.gotoLabel("L"));
  }

  @Test
  public void testThrow() {
    Node throwNew = IR.throwStmt(IR.newObject("System.ArgumentException"));
    Node throwVariable = IR.throwStmt(IR.name("e"));
    IR.method("m", IR.block(throwNew, throwVariable));

    assertThat(completionsOf(throwNew))
        .containsExactly(Completion.throwCompletion("System.ArgumentException"));
    assertThat(completionsOf(throwVariable))
        .containsExactly(Completion.throwCompletion(TypeHierarchy.ROOT_EXCEPTION));
  }

  @Test
  public void testRethrowUsesCaughtType() {
    Node rethrow = IR.rethrow();
    IR.method(
        "m",
        IR.block(
            IR.tryCatch(
                IR.block(), IR.catchClause("System.IO.IOException", IR.block(rethrow)))));

    assertThat(completionsOf(rethrow))
        .containsExactly(Completion.throwCompletion("System.IO.IOException"));
  }

  @Test
  public void testImplicitThrowsOnlyWhenTried() {
    Node outside = IR.div(IR.name("a"), IR.name("b"));
    Node inside = IR.div(IR.name("c"), IR.name("d"));
    Node insideCall = IR.call("f");
    IR.method(
        "m",
        IR.block(
            IR.exprResult(IR.assign(IR.name("x"), outside)),
            IR.tryFinally(
                IR.block(
                    IR.exprResult(IR.assign(IR.name("y"), inside)), IR.exprResult(insideCall)),
                IR.block())));

    assertThat(completionsOf(outside)).containsExactly(Completion.normal());
    assertThat(completionsOf(inside))
        .containsExactly(
            Completion.normal(), Completion.throwCompletion("System.DivideByZeroException"))
        .inOrder();
    assertThat(completionsOf(insideCall))
        .containsExactly(
            Completion.normal(), Completion.throwCompletion(TypeHierarchy.ROOT_EXCEPTION));
  }

  @Test
  public void testImplicitThrowTypes() {
    assertThat(CompletionModel.getImplicitThrow(IR.cast("int", IR.name("o"))))
        .isEqualTo("System.InvalidCastException");
    assertThat(CompletionModel.getImplicitThrow(IR.getelem(IR.name("a"), IR.number(0))))
        .isEqualTo("System.IndexOutOfRangeException");
    assertThat(CompletionModel.getImplicitThrow(IR.getprop(IR.name("a"), "f")))
        .isEqualTo("System.NullReferenceException");
    assertThat(CompletionModel.getImplicitThrow(IR.getprop(IR.thisNode(), "f"))).isNull();
    assertThat(CompletionModel.getImplicitThrow(IR.conditionalGetprop(IR.name("a"), "f")))
        .isNull();
    assertThat(CompletionModel.getImplicitThrow(IR.assignOp("/=", IR.name("a"), IR.name("b"))))
        .isEqualTo("System.DivideByZeroException");
    assertThat(CompletionModel.getImplicitThrow(IR.assignOp("+=", IR.name("a"), IR.name("b"))))
        .isNull();
    assertThat(CompletionModel.getImplicitThrow(IR.name("a"))).isNull();
  }

  @Test
  public void testNonReturningCall() {
    Node exit = IR.nonReturningCall(IR.typeRef("Environment"), "Exit", IR.number(0));
    IR.method("m", IR.block(IR.tryFinally(IR.block(IR.exprResult(exit)), IR.block())));

    assertThat(completionsOf(exit)).containsExactly(Completion.exit());
  }

  @Test
  public void testCatchWithoutKnownException() {
    Node typed = IR.catchClause("System.ArgumentException", IR.block());
    Node general = IR.generalCatch(IR.block());
    IR.method("m", IR.block(IR.tryCatch(IR.block(), typed, general)));

    assertThat(completionsOf(typed))
        .containsExactly(Completion.matching(true), Completion.matching(false));
    assertThat(completionsOf(general)).containsExactly(Completion.matching(true));
  }

  @Test
  public void testCatchWithKnownException() {
    Node catchNode = IR.catchClause("System.ArgumentException", IR.block());
    Node tryNode = IR.tryCatch(IR.block(), catchNode);
    IR.method("m", IR.block(tryNode));

    assertThat(model.getCompletions(catchNode, thrown(tryNode, "System.ArgumentNullException")))
        .containsExactly(Completion.matching(true));
    assertThat(model.getCompletions(catchNode, thrown(tryNode, "System.DivideByZeroException")))
        .containsExactly(Completion.matching(false));
    assertThat(model.getCompletions(catchNode, thrown(tryNode, TypeHierarchy.ROOT_EXCEPTION)))
        .containsExactly(Completion.matching(true), Completion.matching(false));
  }

  @Test
  public void testIsValidFor() {
    Node cond = IR.name("c");
    Node returnNode = IR.returnStmt();
    IR.method("m", IR.block(IR.ifStmt(cond, returnNode)));

    assertThat(model.isValidFor(Completion.ofBoolean(true), cond)).isTrue();
    assertThat(model.isValidFor(Completion.normal(), cond)).isFalse();
    assertThat(model.isValidFor(Completion.returnCompletion(), returnNode)).isTrue();
    assertThat(model.isValidFor(Completion.normal(), returnNode)).isFalse();
  }
}
